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

import java.util.Map;
import java.util.logging.Logger;

/**
 * Checks the structural well-formedness of the dependency graph of a
 * constraint system.
 */
public final class DependencyGraphValidator {
  private static final Logger LOGGER =
      Logger.getLogger(DependencyGraphValidator.class.getName());

  private DependencyGraphValidator() {}

  /**
   * Whether the graph is correct: every premise of every node has exactly one
   * incoming edge, and the fact of the edge's source conclusion equals the
   * premise fact under the system's substitution.
   * <p>
   * Open goals, axioms and the consistency of the temporal order are not
   * checked, so a graph can be correct while goals remain open.
   */
  public static boolean isCorrectDG(ConstraintSystem sys) {
    Substitution subst = sys.substitution();
    for (Map.Entry<NodeId, Rule> entry : sys.nodes().entrySet()) {
      ImmutableList<Fact> premises = entry.getValue().premises();
      for (int i = 0; i < premises.size(); i++) {
        NodePrem premise = NodePrem.create(entry.getKey(), i);
        ImmutableList<Edge> incoming = incomingEdges(sys, premise);
        if (incoming.size() != 1) {
          LOGGER.fine(premise + " has " + incoming.size() + " incoming edges");
          return false;
        }
        Optional<Fact> source =
            sys.resolveConclusionFact(incoming.get(0).source());
        if (!source.isPresent() || !source.get().apply(subst)
            .equals(premises.get(i).apply(subst))) {
          LOGGER.fine("edge " + incoming.get(0) + " connects different facts");
          return false;
        }
      }
    }
    return true;
  }

  /** The edges ending in {@code premise}. */
  public static ImmutableList<Edge> incomingEdges(ConstraintSystem sys,
      NodePrem premise) {
    ImmutableList.Builder<Edge> result = ImmutableList.builder();
    for (Edge edge : sys.edges()) {
      if (edge.target().equals(premise)) {
        result.add(edge);
      }
    }
    return result.build();
  }
}
