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
 * The goal of finding a source for the premise {@code premise}, which requires
 * the fact {@code fact}.
 */
public final class PremiseGoal extends Goal {
  private final NodePrem premise;
  private final Fact fact;

  private PremiseGoal(NodePrem premise, Fact fact) {
    this.premise = Preconditions.checkNotNull(premise);
    this.fact = Preconditions.checkNotNull(fact);
  }

  public static PremiseGoal create(NodePrem premise, Fact fact) {
    return new PremiseGoal(premise, fact);
  }

  public NodePrem premise() {
    return premise;
  }

  public Fact fact() {
    return fact;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitPremise(this);
  }

  @Override
  void collectVariables(Set<LVar> vars) {
    vars.add(premise.node().asVar());
    fact.collectVariables(vars);
  }

  @Override
  public Goal apply(Substitution subst) {
    return new PremiseGoal(premise, fact.apply(subst));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof PremiseGoal)) {
      return false;
    }
    PremiseGoal other = (PremiseGoal) obj;
    return premise.equals(other.premise) && fact.equals(other.fact);
  }

  @Override
  public int hashCode() {
    return premise.hashCode() * 31 + fact.hashCode();
  }

  @Override
  public String toString() {
    return fact + " >" + premise.index() + " " + premise.node();
  }
}
