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

import java.util.Set;

/**
 * An open or solved proof obligation of a constraint system. There are
 * exactly five kinds of goals; code that needs to treat them differently
 * dispatches through a {@link Visitor}.
 */
public abstract class Goal {
  Goal() {}

  /** Exhaustive dispatch on the kind of goal. */
  public interface Visitor<R> {
    R visitPremise(PremiseGoal goal);
    R visitAction(ActionGoal goal);
    R visitChain(ChainGoal goal);
    R visitSplit(SplitGoal goal);
    R visitDisj(DisjGoal goal);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /** Adds the variables occurring in this goal to {@code vars}. */
  abstract void collectVariables(Set<LVar> vars);

  /** Returns the goal obtained by applying {@code subst}. */
  public abstract Goal apply(Substitution subst);
}
