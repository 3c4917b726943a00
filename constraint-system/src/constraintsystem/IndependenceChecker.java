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
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Decides whether the open trivial goals of a system are independent of each
 * other and of the rest of the dependency graph. If they are, the remaining
 * obligations are public knowledge that can always be supplied without
 * further constraining the graph, and the search driver may close the
 * branch.
 */
public final class IndependenceChecker {
  private static final Logger LOGGER =
      Logger.getLogger(IndependenceChecker.class.getName());

  private IndependenceChecker() {}

  /**
   * Whether the unsolved trivial goals share no fact variables, and each of
   * them is independent of the graph; see {@link #checkIndependence}. Only
   * meaningful if {@link GoalRegistry#allOpenGoalsAreSimpleFacts} holds.
   */
  public static boolean allOpenFactGoalsAreIndependent(ConstraintSystem sys) {
    ImmutableList<Goal> goals = GoalRegistry.unsolvedTrivialGoals(sys);
    if (!GoalRegistry.noCommonVarsInGoals(goals)) {
      LOGGER.fine("open goals share variables: " + goals);
      return false;
    }
    for (Goal goal : goals) {
      if (!checkIndependence(sys, goal)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Whether the trivial premise or KU action goal {@code goal} is independent
   * of the graph. The nodes that depend on the goal are removed: for a
   * premise goal its node, for an action goal the nodes ordered after it
   * with a premise equal to its fact, and transitively every node reached
   * from those over the edges saturated with the less relation. No fact of
   * the remaining nodes may mention a variable of the goal.
   *
   * @throws IllegalArgumentException if the goal's fact is not trivial
   */
  public static boolean checkIndependence(ConstraintSystem sys, Goal goal) {
    Optional<Fact> fact = GoalRegistry.factOf(goal);
    Optional<ImmutableList<LVar>> variables = fact.isPresent()
        ? fact.get().trivialVariables()
        : Optional.<ImmutableList<LVar>>absent();
    if (!variables.isPresent()) {
      throw new IllegalArgumentException("checkIndependence: the goal "
          + goal + " should be trivial! System:\n" + sys);
    }
    List<NodePrem> startPremises = goal.accept(
        new StartPremises(sys, fact.get()));

    Map<NodeId, Rule> remaining = Maps.newTreeMap(sys.nodes());
    removeDependentNodes(remaining, startPremises,
        TemporalOrder.saturateEdgesWithLessRelation(sys));

    for (Map.Entry<NodeId, Rule> entry : remaining.entrySet()) {
      Rule rule = entry.getValue();
      for (Fact other
          : Iterables.concat(rule.premises(), rule.conclusions())) {
        if (!Collections.disjoint(other.variables(), variables.get())) {
          LOGGER.fine(goal + " depends on node " + entry.getKey());
          return false;
        }
      }
    }
    return true;
  }

  private static void removeDependentNodes(Map<NodeId, Rule> nodes,
      List<NodePrem> startPremises, Set<Edge> edges) {
    Set<NodeId> visited = Sets.newHashSet();
    Deque<NodeId> worklist = Lists.newLinkedList();
    for (NodePrem premise : startPremises) {
      worklist.add(premise.node());
    }
    while (!worklist.isEmpty()) {
      NodeId node = worklist.removeFirst();
      if (!visited.add(node)) {
        continue;
      }
      nodes.remove(node);
      for (Edge edge : edges) {
        if (edge.source().node().equals(node)) {
          worklist.add(edge.target().node());
        }
      }
    }
  }

  /**
   * The premises a trivial goal feeds directly: the goal's own premise, or
   * the premises equal to an action's fact on the nodes ordered after it.
   */
  private static final class StartPremises
      implements Goal.Visitor<List<NodePrem>> {
    private final ConstraintSystem sys;
    private final Fact fact;

    StartPremises(ConstraintSystem sys, Fact fact) {
      this.sys = sys;
      this.fact = fact;
    }

    @Override
    public List<NodePrem> visitPremise(PremiseGoal goal) {
      return ImmutableList.of(goal.premise());
    }

    @Override
    public List<NodePrem> visitAction(ActionGoal goal) {
      return TemporalOrder.matchingPremises(sys, fact,
          TemporalOrder.lessSuccessors(sys, goal.node()));
    }

    @Override
    public List<NodePrem> visitChain(ChainGoal goal) {
      throw notTrivial(goal);
    }

    @Override
    public List<NodePrem> visitSplit(SplitGoal goal) {
      throw notTrivial(goal);
    }

    @Override
    public List<NodePrem> visitDisj(DisjGoal goal) {
      throw notTrivial(goal);
    }

    private IllegalArgumentException notTrivial(Goal goal) {
      return new IllegalArgumentException("checkIndependence: the goal "
          + goal + " should be trivial! System:\n" + sys);
    }
  }
}
