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

import static constraintsystem.TestSystems.K;
import static constraintsystem.TestSystems.L;
import static constraintsystem.TestSystems.X;
import static constraintsystem.TestSystems.Y;
import static constraintsystem.TestSystems.initRule;
import static constraintsystem.TestSystems.respRule;
import static constraintsystem.TestSystems.var;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import junit.framework.TestCase;

import java.util.List;

public class EquationsTest extends TestCase {
  private static final Term A = Term.pubName("a");
  private static final Term B = Term.pubName("b");

  private final ProofContext ctxt = TestSystems.context();

  /** An oracle for which every set of equations has the unifiers x=a, x=b. */
  private static class TwoUnifiersOracle implements EquationalOracle {
    private final SyntacticOracle delegate = SyntacticOracle.create();

    @Override
    public boolean unifiable(Term left, Term right) {
      return delegate.unifiable(left, right);
    }

    @Override
    public boolean unifiable(Fact left, Fact right) {
      return delegate.unifiable(left, right);
    }

    @Override
    public ImmutableList<Substitution> variantsOf(Rule rule) {
      return delegate.variantsOf(rule);
    }

    @Override
    public Optional<Substitution> match(Term term, Term pattern) {
      return delegate.match(term, pattern);
    }

    @Override
    public ImmutableList<Substitution> unify(List<Equal<Fact>> equations) {
      return ImmutableList.of(Substitution.of(X, A), Substitution.of(X, B));
    }
  }

  private static ConstraintSystem waiting() {
    return TestSystems.empty().withNode(L, respRule(var(X)));
  }

  private static List<Equal<Term>> equation(Term left, Term right) {
    return ImmutableList.of(Equal.create(left, right));
  }

  public void testSingleUnifierIsApplied() {
    Optional<ConstraintSystem> result =
        Equations.addTermEquations(ctxt, waiting(), equation(var(X), A));
    assertTrue(result.isPresent());
    assertEquals(respRule(A), result.get().nodeRule(L));
    assertEquals(A, result.get().substitution().get(X));
    assertTrue(result.get().equationStore().disjunctions().isEmpty());
  }

  public void testContradictoryEquations() {
    assertFalse(Equations.addTermEquations(ctxt, waiting(), equation(A, B))
        .isPresent());
  }

  public void testVariablesAreIdentified() {
    ConstraintSystem sys = waiting().withNode(TestSystems.M,
        respRule(var(Y)));
    Optional<ConstraintSystem> result =
        Equations.addTermEquations(ctxt, sys, equation(var(X), var(Y)));
    assertTrue(result.isPresent());
    Substitution subst = result.get().substitution();
    assertEquals(subst.get(X), subst.get(Y));
    assertEquals(result.get().nodeRule(L).premise(0),
        result.get().nodeRule(TestSystems.M).premise(0));
    LVar fresh = ((VarTerm) subst.get(X)).var();
    assertFalse(sys.variables().contains(fresh));
  }

  public void testSubstitutionsAccumulate() {
    ConstraintSystem sys = waiting().withNode(TestSystems.M,
        respRule(var(Y)));
    ConstraintSystem first =
        Equations.addTermEquations(ctxt, sys, equation(var(X), A)).get();
    ConstraintSystem second =
        Equations.addTermEquations(ctxt, first, equation(var(Y), B)).get();
    assertEquals(A, second.substitution().get(X));
    assertEquals(B, second.substitution().get(Y));
  }

  public void testSeveralUnifiersBecomeCaseSplit() {
    ProofContext splitting =
        ProofContext.builder(new TwoUnifiersOracle()).build();
    Optional<ConstraintSystem> result = Equations.addFactEquations(
        splitting, waiting(), ImmutableList.<Equal<Fact>>of());
    assertTrue(result.isPresent());
    ConstraintSystem sys = result.get();
    SplitId id = SplitId.create(0);
    assertEquals(ImmutableList.of(Substitution.of(X, A), Substitution.of(X, B)),
        sys.equationStore().casesAt(id).get());
    assertEquals(SplitId.create(1), sys.equationStore().peekSplitId());
    assertFalse(sys.goals().get(SplitGoal.create(id)).isSolved());
    // The graph is unchanged until the split is resolved.
    assertEquals(respRule(var(X)), sys.nodeRule(L));

    ImmutableList<ConstraintSystem> cases = Equations.splitCases(sys, id);
    assertEquals(2, cases.size());
    assertEquals(respRule(A), cases.get(0).nodeRule(L));
    assertEquals(respRule(B), cases.get(1).nodeRule(L));
    for (ConstraintSystem c : cases) {
      assertFalse(c.equationStore().casesAt(id).isPresent());
      assertTrue(c.goals().get(SplitGoal.create(id)).isSolved());
    }
  }

  public void testSplitCasesOfUnknownSplit() {
    try {
      Equations.splitCases(waiting(), SplitId.create(3));
      fail("Should have thrown an exception");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("no case split"));
    }
  }

  public void testUnifiableRules() {
    SyntacticOracle oracle = SyntacticOracle.create();
    assertTrue(Equations.unifiableRules(oracle, initRule(var(K)),
        initRule(var(X))));
    assertTrue(Equations.unifiableRules(oracle, respRule(A),
        respRule(var(X))));
    assertFalse(Equations.unifiableRules(oracle, respRule(A), respRule(B)));
    assertFalse(Equations.unifiableRules(oracle, initRule(var(K)),
        respRule(var(K))));
  }
}
