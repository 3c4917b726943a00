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
 * An edge of a dependency graph: the fact produced by a conclusion is
 * consumed by a premise.
 */
public final class Edge implements Comparable<Edge> {
  private final NodeConc source;
  private final NodePrem target;

  private Edge(NodeConc source, NodePrem target) {
    this.source = Preconditions.checkNotNull(source);
    this.target = Preconditions.checkNotNull(target);
  }

  public static Edge create(NodeConc source, NodePrem target) {
    return new Edge(source, target);
  }

  public NodeConc source() {
    return source;
  }

  public NodePrem target() {
    return target;
  }

  @Override
  public int compareTo(Edge other) {
    return ComparisonChain.start()
        .compare(source, other.source)
        .compare(target, other.target)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Edge)) {
      return false;
    }
    Edge other = (Edge) obj;
    return source.equals(other.source) && target.equals(other.target);
  }

  @Override
  public int hashCode() {
    return source.hashCode() * 31 + target.hashCode();
  }

  @Override
  public String toString() {
    return source + " >-> " + target;
  }
}
