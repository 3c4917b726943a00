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

import static constraintsystem.TestSystems.I;
import static constraintsystem.TestSystems.J;
import static constraintsystem.TestSystems.K;
import static constraintsystem.TestSystems.L;
import static constraintsystem.TestSystems.M;
import static constraintsystem.TestSystems.X;
import static constraintsystem.TestSystems.chain;
import static constraintsystem.TestSystems.edge;
import static constraintsystem.TestSystems.initRule;
import static constraintsystem.TestSystems.respRule;
import static constraintsystem.TestSystems.var;

import junit.framework.TestCase;

public class DependencyGraphValidatorTest extends TestCase {
  public void testChainIsCorrect() {
    assertTrue(DependencyGraphValidator.isCorrectDG(chain()));
  }

  public void testEmptyGraphIsCorrect() {
    assertTrue(DependencyGraphValidator.isCorrectDG(TestSystems.empty()));
  }

  public void testMissingEdge() {
    ConstraintSystem sys = chain().withoutEdge(edge(J, 0, L, 0));
    assertFalse(DependencyGraphValidator.isCorrectDG(sys));
  }

  /** A premise must have exactly one incoming edge. */
  public void testTwoIncomingEdges() {
    ConstraintSystem sys = chain()
        .withNode(M, initRule(var(K)))
        .withEdge(edge(M, 0, L, 0));
    assertEquals(2, DependencyGraphValidator.incomingEdges(sys,
        NodePrem.create(L, 0)).size());
    assertFalse(DependencyGraphValidator.isCorrectDG(sys));
  }

  public void testEdgeBetweenDifferentFacts() {
    ConstraintSystem sys = chain()
        .withoutEdge(edge(J, 0, L, 0))
        .withEdge(edge(J, 1, L, 0));
    assertFalse(DependencyGraphValidator.isCorrectDG(sys));
  }

  public void testEdgeFromMissingConclusion() {
    ConstraintSystem sys = chain()
        .withoutEdge(edge(J, 0, L, 0))
        .withEdge(edge(J, 5, L, 0));
    assertFalse(DependencyGraphValidator.isCorrectDG(sys));
  }

  public void testFactsAreComparedUnderSubstitution() {
    ConstraintSystem sys = chain().withNode(L, respRule(var(X)));
    assertFalse(DependencyGraphValidator.isCorrectDG(sys));

    EquationStore store = sys.equationStore()
        .withSubstitution(Substitution.of(X, var(K)));
    assertTrue(DependencyGraphValidator.isCorrectDG(
        sys.withEquationStore(store)));
  }

  public void testFreshNodeHasNoPremises() {
    ConstraintSystem sys = TestSystems.empty()
        .withNode(I, TestSystems.freshRule(var(K)));
    assertTrue(DependencyGraphValidator.isCorrectDG(sys));
  }
}
