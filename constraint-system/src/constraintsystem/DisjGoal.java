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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Set;

/**
 * The goal of choosing one of several disjuncts.
 */
public final class DisjGoal extends Goal {
  private final ImmutableList<Guarded> disjuncts;

  private DisjGoal(ImmutableList<Guarded> disjuncts) {
    this.disjuncts = Preconditions.checkNotNull(disjuncts);
  }

  public static DisjGoal create(List<Guarded> disjuncts) {
    return new DisjGoal(ImmutableList.copyOf(disjuncts));
  }

  public ImmutableList<Guarded> disjuncts() {
    return disjuncts;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitDisj(this);
  }

  @Override
  void collectVariables(Set<LVar> vars) {
    for (Guarded disjunct : disjuncts) {
      disjunct.collectVariables(vars);
    }
  }

  @Override
  public Goal apply(Substitution subst) {
    ImmutableList.Builder<Guarded> result = ImmutableList.builder();
    for (Guarded disjunct : disjuncts) {
      result.add(disjunct.apply(subst));
    }
    return new DisjGoal(result.build());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof DisjGoal
        && disjuncts.equals(((DisjGoal) obj).disjuncts);
  }

  @Override
  public int hashCode() {
    return disjuncts.hashCode();
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(") | (").join(disjuncts) + ")";
  }
}
