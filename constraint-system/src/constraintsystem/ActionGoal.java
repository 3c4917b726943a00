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
 * The goal that the action {@code fact} happens at node {@code node}.
 */
public final class ActionGoal extends Goal {
  private final NodeId node;
  private final Fact fact;

  private ActionGoal(NodeId node, Fact fact) {
    this.node = Preconditions.checkNotNull(node);
    this.fact = Preconditions.checkNotNull(fact);
  }

  public static ActionGoal create(NodeId node, Fact fact) {
    return new ActionGoal(node, fact);
  }

  public NodeId node() {
    return node;
  }

  public Fact fact() {
    return fact;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitAction(this);
  }

  @Override
  void collectVariables(Set<LVar> vars) {
    vars.add(node.asVar());
    fact.collectVariables(vars);
  }

  @Override
  public Goal apply(Substitution subst) {
    return new ActionGoal(node, fact.apply(subst));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ActionGoal)) {
      return false;
    }
    ActionGoal other = (ActionGoal) obj;
    return node.equals(other.node) && fact.equals(other.fact);
  }

  @Override
  public int hashCode() {
    return node.hashCode() * 31 + fact.hashCode();
  }

  @Override
  public String toString() {
    return fact + " @ " + node;
  }
}
