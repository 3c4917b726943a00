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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import com.google.common.graph.Traverser;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Queries about the temporal order of the nodes of a constraint system.
 * <p>
 * An instance caches the graph induced by {@link #rawLessRel} of one system,
 * so that repeated {@link #alwaysBefore} queries do not rebuild it. The
 * static methods work directly on a system.
 */
public final class TemporalOrder {
  private final ConstraintSystem sys;
  private final ImmutableGraph<NodeId> lessGraph;

  private TemporalOrder(ConstraintSystem sys) {
    this.sys = sys;
    MutableGraph<NodeId> graph =
        GraphBuilder.directed().allowsSelfLoops(true).build();
    for (LessAtom pair : rawLessRel(sys)) {
      graph.putEdge(pair.smaller(), pair.larger());
    }
    this.lessGraph = ImmutableGraph.copyOf(graph);
  }

  public static TemporalOrder create(ConstraintSystem sys) {
    return new TemporalOrder(sys);
  }

  public ConstraintSystem system() {
    return sys;
  }

  /**
   * Whether {@code i} happens before {@code j} in every trace satisfying the
   * system: either {@code i < j} is a less atom, or {@code j} is reachable
   * from {@code i} by a non-empty path of the raw less relation. Assuming
   * the relation is acyclic, this is a strict partial order.
   */
  public boolean alwaysBefore(NodeId i, NodeId j) {
    return sys.lessAtoms().contains(LessAtom.create(i, j))
        || nodesAfter(i).contains(j);
  }

  /** The nodes reachable from {@code i} by a non-empty path. */
  public ImmutableSet<NodeId> nodesAfter(NodeId i) {
    if (!lessGraph.nodes().contains(i)) {
      return ImmutableSet.of();
    }
    return ImmutableSet.copyOf(
        Traverser.forGraph(lessGraph).breadthFirst(lessGraph.successors(i)));
  }

  /** One-off version of {@link #alwaysBefore(NodeId, NodeId)}. */
  public static boolean alwaysBefore(ConstraintSystem sys, NodeId i,
      NodeId j) {
    return create(sys).alwaysBefore(i, j);
  }

  /**
   * The pairs of nodes that are connected by an edge or by an unsolved
   * chain goal. Unsolved chains count as edges: their endpoints are fixed
   * even though the deduction in between is not.
   */
  public static ImmutableList<LessAtom> rawEdgeRel(ConstraintSystem sys) {
    ImmutableList.Builder<LessAtom> result = ImmutableList.builder();
    for (Edge edge : sys.edges()) {
      result.add(LessAtom.create(edge.source().node(), edge.target().node()));
    }
    for (ChainGoal chain : GoalRegistry.unsolvedChains(sys)) {
      result.add(LessAtom.create(chain.source().node(),
          chain.target().node()));
    }
    return result.build();
  }

  /** The less atoms together with {@link #rawEdgeRel}. */
  public static ImmutableList<LessAtom> rawLessRel(ConstraintSystem sys) {
    return ImmutableList.<LessAtom>builder()
        .addAll(sys.lessAtoms())
        .addAll(rawEdgeRel(sys))
        .build();
  }

  /** Whether {@code i} is the designated last node. */
  public static boolean isLast(ConstraintSystem sys, NodeId i) {
    return sys.lastNode().isPresent() && sys.lastNode().get().equals(i);
  }

  /**
   * Whether {@code i} certainly denotes a position of the trace: it is a node
   * of the graph, the last node, or carries an unsolved action goal.
   */
  public static boolean isInTrace(ConstraintSystem sys, NodeId i) {
    if (sys.nodes().containsKey(i) || isLast(sys, i)) {
      return true;
    }
    for (ActionGoal goal : GoalRegistry.unsolvedActionAtoms(sys)) {
      if (goal.node().equals(i)) {
        return true;
      }
    }
    return false;
  }

  /** The nodes {@code j} with a less atom {@code j < i}. */
  public static ImmutableList<NodeId> lessPredecessors(ConstraintSystem sys,
      NodeId i) {
    ImmutableList.Builder<NodeId> result = ImmutableList.builder();
    for (LessAtom atom : sys.lessAtoms()) {
      if (atom.larger().equals(i)) {
        result.add(atom.smaller());
      }
    }
    return result.build();
  }

  /** The nodes {@code j} with a less atom {@code i < j}. */
  public static ImmutableList<NodeId> lessSuccessors(ConstraintSystem sys,
      NodeId i) {
    ImmutableList.Builder<NodeId> result = ImmutableList.builder();
    for (LessAtom atom : sys.lessAtoms()) {
      if (atom.smaller().equals(i)) {
        result.add(atom.larger());
      }
    }
    return result.build();
  }

  /** The premises of graph nodes without an incoming edge. */
  public static ImmutableList<NodePrem> openPremises(ConstraintSystem sys) {
    Set<NodePrem> connected = Sets.newHashSet();
    for (Edge edge : sys.edges()) {
      connected.add(edge.target());
    }
    ImmutableList.Builder<NodePrem> result = ImmutableList.builder();
    for (Map.Entry<NodeId, Rule> entry : sys.nodes().entrySet()) {
      for (int i = 0; i < entry.getValue().premises().size(); i++) {
        NodePrem premise = NodePrem.create(entry.getKey(), i);
        if (!connected.contains(premise)) {
          result.add(premise);
        }
      }
    }
    return result.build();
  }

  /**
   * The edges implied by the less relation: an open premise can be supplied
   * by any conclusion with the same fact on a node that is a less
   * predecessor of the premise's node.
   */
  public static ImmutableSortedSet<Edge> edgesFromLessRelation(
      ConstraintSystem sys) {
    Set<Edge> result = Sets.newTreeSet();
    for (NodePrem premise : openPremises(sys)) {
      Fact fact = sys.premiseFact(premise);
      for (NodeId pred : lessPredecessors(sys, premise.node())) {
        for (NodeConc conclusion : matchingConclusions(sys, fact,
            ImmutableList.of(pred))) {
          result.add(Edge.create(conclusion, premise));
        }
      }
    }
    return ImmutableSortedSet.copyOf(result);
  }

  /** The explicit edges together with {@link #edgesFromLessRelation}. */
  public static ImmutableSortedSet<Edge> saturateEdgesWithLessRelation(
      ConstraintSystem sys) {
    return ImmutableSortedSet.<Edge>naturalOrder()
        .addAll(sys.edges())
        .addAll(edgesFromLessRelation(sys))
        .build();
  }

  /**
   * The premises of the given nodes whose fact equals {@code fact}. Nodes
   * that are not part of the graph are skipped.
   */
  public static ImmutableList<NodePrem> matchingPremises(ConstraintSystem sys,
      Fact fact, List<NodeId> nodes) {
    ImmutableList.Builder<NodePrem> result = ImmutableList.builder();
    for (NodeId node : nodes) {
      Rule rule = sys.nodes().get(node);
      if (rule == null) {
        continue;
      }
      for (int i = 0; i < rule.premises().size(); i++) {
        if (rule.premise(i).equals(fact)) {
          result.add(NodePrem.create(node, i));
        }
      }
    }
    return result.build();
  }

  /** Like {@link #matchingPremises} for conclusions. */
  public static ImmutableList<NodeConc> matchingConclusions(
      ConstraintSystem sys, Fact fact, List<NodeId> nodes) {
    ImmutableList.Builder<NodeConc> result = ImmutableList.builder();
    for (NodeId node : nodes) {
      Rule rule = sys.nodes().get(node);
      if (rule == null) {
        continue;
      }
      for (int i = 0; i < rule.conclusions().size(); i++) {
        if (rule.conclusion(i).equals(fact)) {
          result.add(NodeConc.create(node, i));
        }
      }
    }
    return result.build();
  }
}
