/*
 * Copyright 2010 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package constraintsystem;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;

/**
 * Locates the conclusion with a given index of a node.
 */
public final class NodeConc implements Comparable<NodeConc> {
  private final NodeId node;
  private final int index;

  private NodeConc(NodeId node, int index) {
    this.node = Preconditions.checkNotNull(node);
    this.index = index;
  }

  public static NodeConc create(NodeId node, int index) {
    return new NodeConc(node, index);
  }

  public NodeId node() {
    return node;
  }

  public int index() {
    return index;
  }

  @Override
  public int compareTo(NodeConc other) {
    return ComparisonChain.start()
        .compare(node, other.node)
        .compare(index, other.index)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NodeConc)) {
      return false;
    }
    NodeConc other = (NodeConc) obj;
    return index == other.index && node.equals(other.node);
  }

  @Override
  public int hashCode() {
    return node.hashCode() * 31 + index;
  }

  @Override
  public String toString() {
    return "(" + node + ", " + index + ")";
  }
}
