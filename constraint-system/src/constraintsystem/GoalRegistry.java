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

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies and enumerates the goals of a constraint system. Which goal to
 * solve next is decided by the search driver, not here.
 */
public final class GoalRegistry {
  private GoalRegistry() {}

  /** The unsolved premise goals. */
  public static ImmutableList<PremiseGoal> unsolvedPremises(
      ConstraintSystem sys) {
    ImmutableList.Builder<PremiseGoal> result = ImmutableList.builder();
    for (Map.Entry<Goal, GoalStatus> entry : sys.goals().entrySet()) {
      if (entry.getKey() instanceof PremiseGoal
          && !entry.getValue().isSolved()) {
        result.add((PremiseGoal) entry.getKey());
      }
    }
    return result.build();
  }

  /** The unsolved action goals. */
  public static ImmutableList<ActionGoal> unsolvedActionAtoms(
      ConstraintSystem sys) {
    ImmutableList.Builder<ActionGoal> result = ImmutableList.builder();
    for (Map.Entry<Goal, GoalStatus> entry : sys.goals().entrySet()) {
      if (entry.getKey() instanceof ActionGoal
          && !entry.getValue().isSolved()) {
        result.add((ActionGoal) entry.getKey());
      }
    }
    return result.build();
  }

  /** The unsolved destruction chains. */
  public static ImmutableList<ChainGoal> unsolvedChains(ConstraintSystem sys) {
    ImmutableList.Builder<ChainGoal> result = ImmutableList.builder();
    for (Map.Entry<Goal, GoalStatus> entry : sys.goals().entrySet()) {
      if (entry.getKey() instanceof ChainGoal
          && !entry.getValue().isSolved()) {
        result.add((ChainGoal) entry.getKey());
      }
    }
    return result.build();
  }

  /** The unsolved action goals whose fact is not a KU fact. */
  public static ImmutableList<ActionGoal> standardActionAtoms(
      ConstraintSystem sys) {
    ImmutableList.Builder<ActionGoal> result = ImmutableList.builder();
    for (ActionGoal goal : unsolvedActionAtoms(sys)) {
      if (!goal.fact().isKU()) {
        result.add(goal);
      }
    }
    return result.build();
  }

  /** The unsolved action goals whose fact is a KU fact. */
  public static ImmutableList<ActionGoal> kuActionAtoms(ConstraintSystem sys) {
    ImmutableList.Builder<ActionGoal> result = ImmutableList.builder();
    for (ActionGoal goal : unsolvedActionAtoms(sys)) {
      if (goal.fact().isKU()) {
        result.add(goal);
      }
    }
    return result.build();
  }

  /**
   * All actions that hold in the system: the unsolved action goals followed
   * by the actions of the graph nodes.
   */
  public static ImmutableList<Atom.Action> allActions(ConstraintSystem sys) {
    ImmutableList.Builder<Atom.Action> result = ImmutableList.builder();
    for (ActionGoal goal : unsolvedActionAtoms(sys)) {
      result.add(Atom.action(goal.node(), goal.fact()));
    }
    for (Map.Entry<NodeId, Rule> entry : sys.nodes().entrySet()) {
      for (Fact action : entry.getValue().actions()) {
        result.add(Atom.action(entry.getKey(), action));
      }
    }
    return result.build();
  }

  /** The KU facts among {@link #allActions}. */
  public static ImmutableList<Atom.Action> allKUActions(ConstraintSystem sys) {
    ImmutableList.Builder<Atom.Action> result = ImmutableList.builder();
    for (Atom.Action action : allActions(sys)) {
      if (action.fact().isKU()) {
        result.add(action);
      }
    }
    return result.build();
  }

  /** The conclusions of graph nodes that are KD facts. */
  public static ImmutableList<NodeConc> allKDConclusions(ConstraintSystem sys) {
    ImmutableList.Builder<NodeConc> result = ImmutableList.builder();
    for (Map.Entry<NodeId, Rule> entry : sys.nodes().entrySet()) {
      List<Fact> conclusions = entry.getValue().conclusions();
      for (int i = 0; i < conclusions.size(); i++) {
        if (conclusions.get(i).isKD()) {
          result.add(NodeConc.create(entry.getKey(), i));
        }
      }
    }
    return result.build();
  }

  /**
   * The unsolved goals whose fact is trivial: premise goals, and action
   * goals with a KU fact. These are the candidates for closing a branch
   * early; see {@link IndependenceChecker}.
   */
  public static ImmutableList<Goal> unsolvedTrivialGoals(ConstraintSystem sys) {
    ImmutableList.Builder<Goal> result = ImmutableList.builder();
    for (Map.Entry<Goal, GoalStatus> entry : sys.goals().entrySet()) {
      if (!entry.getValue().isSolved() && isTrivialFactGoal(entry.getKey())) {
        result.add(entry.getKey());
      }
    }
    return result.build();
  }

  /**
   * Whether every goal is solved or a simple fact: a trivial premise, or a
   * trivial KU action. Chain, split and disjunction goals must be solved.
   */
  public static boolean allOpenGoalsAreSimpleFacts(ConstraintSystem sys) {
    for (Map.Entry<Goal, GoalStatus> entry : sys.goals().entrySet()) {
      if (!entry.getValue().isSolved() && !isTrivialFactGoal(entry.getKey())) {
        return false;
      }
    }
    return true;
  }

  /** Whether no two goals share a variable of their facts. */
  public static boolean noCommonVarsInGoals(List<Goal> goals) {
    Set<LVar> seen = Sets.newHashSet();
    for (Goal goal : goals) {
      Optional<Fact> fact = factOf(goal);
      if (!fact.isPresent()) {
        continue;
      }
      for (LVar var : fact.get().variables()) {
        if (!seen.add(var)) {
          return false;
        }
      }
    }
    return true;
  }

  public static boolean allFormulasAreSolved(ConstraintSystem sys) {
    return sys.formulas().isEmpty();
  }

  public static boolean dgIsNotEmpty(ConstraintSystem sys) {
    return !sys.nodes().isEmpty();
  }

  private static boolean isTrivialFactGoal(Goal candidate) {
    return candidate.accept(new Goal.Visitor<Boolean>() {
      @Override
      public Boolean visitPremise(PremiseGoal goal) {
        return goal.fact().isTrivial();
      }

      @Override
      public Boolean visitAction(ActionGoal goal) {
        return goal.fact().isTrivial() && goal.fact().isKU();
      }

      @Override
      public Boolean visitChain(ChainGoal goal) {
        return false;
      }

      @Override
      public Boolean visitSplit(SplitGoal goal) {
        return false;
      }

      @Override
      public Boolean visitDisj(DisjGoal goal) {
        return false;
      }
    });
  }

  private static final Goal.Visitor<Optional<Fact>> FACT_OF =
      new Goal.Visitor<Optional<Fact>>() {
        @Override
        public Optional<Fact> visitPremise(PremiseGoal goal) {
          return Optional.of(goal.fact());
        }

        @Override
        public Optional<Fact> visitAction(ActionGoal goal) {
          return Optional.of(goal.fact());
        }

        @Override
        public Optional<Fact> visitChain(ChainGoal goal) {
          return Optional.absent();
        }

        @Override
        public Optional<Fact> visitSplit(SplitGoal goal) {
          return Optional.absent();
        }

        @Override
        public Optional<Fact> visitDisj(DisjGoal goal) {
          return Optional.absent();
        }
      };

  /** The fact of a premise or action goal, absent for other goals. */
  static Optional<Fact> factOf(Goal goal) {
    return goal.accept(FACT_OF);
  }
}
