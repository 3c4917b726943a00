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
 * The constraint that node {@code smaller} occurs before node {@code larger}
 * in every trace.
 */
public final class LessAtom implements Comparable<LessAtom> {
  private final NodeId smaller;
  private final NodeId larger;

  private LessAtom(NodeId smaller, NodeId larger) {
    this.smaller = Preconditions.checkNotNull(smaller);
    this.larger = Preconditions.checkNotNull(larger);
  }

  public static LessAtom create(NodeId smaller, NodeId larger) {
    return new LessAtom(smaller, larger);
  }

  public NodeId smaller() {
    return smaller;
  }

  public NodeId larger() {
    return larger;
  }

  @Override
  public int compareTo(LessAtom other) {
    return ComparisonChain.start()
        .compare(smaller, other.smaller)
        .compare(larger, other.larger)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LessAtom)) {
      return false;
    }
    LessAtom other = (LessAtom) obj;
    return smaller.equals(other.smaller) && larger.equals(other.larger);
  }

  @Override
  public int hashCode() {
    return smaller.hashCode() * 31 + larger.hashCode();
  }

  @Override
  public String toString() {
    return smaller + " < " + larger;
  }
}
