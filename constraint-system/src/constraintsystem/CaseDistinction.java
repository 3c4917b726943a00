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

/**
 * A precomputed big-step case distinction: all the ways a goal can be solved,
 * each given as the path of proof steps taken and the resulting constraint
 * system. Case distinctions are computed once per proof context and reused in
 * every branch that introduces the same goal.
 */
public final class CaseDistinction {
  private final Goal goal;
  private final ImmutableList<Case> cases;

  private CaseDistinction(Goal goal, ImmutableList<Case> cases) {
    this.goal = Preconditions.checkNotNull(goal);
    this.cases = cases;
  }

  public static CaseDistinction create(Goal goal, List<Case> cases) {
    return new CaseDistinction(goal, ImmutableList.copyOf(cases));
  }

  /** The goal this case distinction starts from. */
  public Goal goal() {
    return goal;
  }

  /** The disjunction of cases. */
  public ImmutableList<Case> cases() {
    return cases;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof CaseDistinction)) {
      return false;
    }
    CaseDistinction other = (CaseDistinction) obj;
    return goal.equals(other.goal) && cases.equals(other.cases);
  }

  @Override
  public int hashCode() {
    return goal.hashCode() * 31 + cases.hashCode();
  }

  @Override
  public String toString() {
    return "case distinction for " + goal + "\n" + Joiner.on("\n").join(cases);
  }

  /** One named case of a case distinction. */
  public static final class Case {
    private final ImmutableList<String> path;
    private final ConstraintSystem system;

    private Case(ImmutableList<String> path, ConstraintSystem system) {
      this.path = path;
      this.system = Preconditions.checkNotNull(system);
    }

    public static Case create(List<String> path, ConstraintSystem system) {
      return new Case(ImmutableList.copyOf(path), system);
    }

    /** The names of the proof steps leading to this case. */
    public ImmutableList<String> path() {
      return path;
    }

    public ConstraintSystem system() {
      return system;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Case)) {
        return false;
      }
      Case other = (Case) obj;
      return path.equals(other.path) && system.equals(other.system);
    }

    @Override
    public int hashCode() {
      return path.hashCode() * 31 + system.hashCode();
    }

    @Override
    public String toString() {
      return "case " + Joiner.on("_").join(path) + "\n" + system;
    }
  }
}
