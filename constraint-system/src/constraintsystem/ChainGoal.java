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

import java.util.Set;

/**
 * The goal of finding a chain of destruction steps from the conclusion
 * {@code source} to the premise {@code target}. Until it is solved, the chain
 * orders its endpoints just like an edge does.
 */
public final class ChainGoal extends Goal {
  private final NodeConc source;
  private final NodePrem target;

  private ChainGoal(NodeConc source, NodePrem target) {
    this.source = Preconditions.checkNotNull(source);
    this.target = Preconditions.checkNotNull(target);
  }

  public static ChainGoal create(NodeConc source, NodePrem target) {
    return new ChainGoal(source, target);
  }

  public NodeConc source() {
    return source;
  }

  public NodePrem target() {
    return target;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitChain(this);
  }

  @Override
  void collectVariables(Set<LVar> vars) {
    vars.add(source.node().asVar());
    vars.add(target.node().asVar());
  }

  @Override
  public Goal apply(Substitution subst) {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ChainGoal)) {
      return false;
    }
    ChainGoal other = (ChainGoal) obj;
    return source.equals(other.source) && target.equals(other.target);
  }

  @Override
  public int hashCode() {
    return source.hashCode() * 31 + target.hashCode();
  }

  @Override
  public String toString() {
    return source + " ~~> " + target;
  }
}
