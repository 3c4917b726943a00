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
import static constraintsystem.TestSystems.ORACLE;
import static constraintsystem.TestSystems.X;
import static constraintsystem.TestSystems.chain;
import static constraintsystem.TestSystems.initRule;
import static constraintsystem.TestSystems.respRule;
import static constraintsystem.TestSystems.var;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;

import junit.framework.TestCase;

import java.util.List;

public class AxiomEvaluatorTest extends TestCase {
  private static final LVar NODE = LVar.node("t");
  private static final LVar MSG = LVar.msg("m");
  private static final LVar OTHER = LVar.msg("n");
  private static final Term FIVE = Term.pubName("5");

  private final ProofContext ctxt = TestSystems.context();

  /** {@code --[A(t)]->} */
  private static Rule emitRule(Term t) {
    return Rule.create(RuleName.protocol("Emit"), ImmutableList.<Fact>of(),
        ImmutableList.<Fact>of(), ImmutableList.of(Fact.proto("A", t)));
  }

  private static Atom.Action actionA(Term node, Term m) {
    return Atom.action(node, Fact.proto("A", m));
  }

  private static Guarded actionB(Term node, Term m) {
    return Guarded.atom(Atom.action(node, Fact.proto("B", m)));
  }

  private Valuation valuate(ConstraintSystem sys, Atom atom) {
    return AxiomEvaluator.partialAtomValuation(ctxt, sys, atom);
  }

  public void testActionValuation() {
    ConstraintSystem sys = chain();
    assertEquals(Valuation.TRUE,
        valuate(sys, Atom.action(J, Fact.proto("Start", var(K)))));
    assertEquals(Valuation.UNKNOWN,
        valuate(sys, Atom.action(J, Fact.proto("Start", var(X)))));
    assertEquals(Valuation.FALSE,
        valuate(sys, Atom.action(J, Fact.proto("Done", var(K)))));
    assertEquals(Valuation.UNKNOWN,
        valuate(sys, Atom.action(M, Fact.proto("Start", var(K)))));
  }

  public void testLessValuation() {
    ConstraintSystem sys = chain();
    assertEquals(Valuation.TRUE, valuate(sys, Atom.less(I, L)));
    assertEquals(Valuation.FALSE, valuate(sys, Atom.less(L, I)));
    assertEquals(Valuation.FALSE, valuate(sys, Atom.less(J, J)));
    assertEquals(Valuation.UNKNOWN, valuate(sys, Atom.less(I, M)));
    assertEquals(Valuation.UNKNOWN,
        valuate(sys, Atom.less(var(X), L.asTerm())));
  }

  public void testLessValuationWithLastNode() {
    ConstraintSystem sys = chain().withLastNode(M);
    // Nothing happens after the last node.
    assertEquals(Valuation.FALSE, valuate(sys, Atom.less(M, J)));
    // M may still be another name for J.
    assertEquals(Valuation.UNKNOWN, valuate(sys, Atom.less(J, M)));

    ConstraintSystem distinct = sys.withNode(M, respRule(var(X)));
    assertEquals(Valuation.TRUE, valuate(distinct, Atom.less(J, M)));
    ConstraintSystem same = sys.withNode(M, initRule(var(K)));
    assertEquals(Valuation.UNKNOWN, valuate(same, Atom.less(J, M)));
  }

  public void testEqValuation() {
    ConstraintSystem sys = chain();
    assertEquals(Valuation.TRUE, valuate(sys, Atom.eq(var(K), var(K))));
    assertEquals(Valuation.FALSE,
        valuate(sys, Atom.eq(Term.pubName("a"), Term.pubName("b"))));
    assertEquals(Valuation.UNKNOWN, valuate(sys, Atom.eq(var(X), FIVE)));
    // Ordered nodes are different.
    assertEquals(Valuation.FALSE,
        valuate(sys, Atom.eq(I.asTerm(), L.asTerm())));

    ConstraintSystem twoInits = sys.withNode(M, initRule(var(K)));
    assertEquals(Valuation.UNKNOWN,
        valuate(twoInits, Atom.eq(J.asTerm(), M.asTerm())));
    ConstraintSystem initAndResp = sys.withNode(M, respRule(var(K)));
    assertEquals(Valuation.FALSE,
        valuate(initAndResp, Atom.eq(J.asTerm(), M.asTerm())));
  }

  public void testLastValuation() {
    assertEquals(Valuation.TRUE,
        valuate(chain().withLastNode(L), Atom.last(L)));
    // J is followed by L, which is in the trace.
    assertEquals(Valuation.FALSE, valuate(chain(), Atom.last(I)));
    assertEquals(Valuation.UNKNOWN, valuate(chain(), Atom.last(L)));
    assertEquals(Valuation.UNKNOWN, valuate(chain(), Atom.last(var(X))));

    ConstraintSystem lastInit = chain().withNode(M, initRule(var(X)))
        .withLastNode(M);
    assertEquals(Valuation.FALSE, valuate(lastInit, Atom.last(L)));
    ConstraintSystem lastResp = chain().withNode(M, respRule(var(X)))
        .withLastNode(M);
    assertEquals(Valuation.UNKNOWN, valuate(lastResp, Atom.last(L)));
  }

  /** {@code All t m. A(m) @ t ==> B(m) @ t} with {@code A('5') @ j}. */
  public void testImpliedFormulaInstance() {
    ConstraintSystem sys = TestSystems.empty().withNode(J, emitRule(FIVE));
    Guarded formula = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG))),
        actionB(var(NODE), var(MSG)));
    assertEquals(ImmutableList.of(actionB(J.asTerm(), FIVE)),
        AxiomEvaluator.impliedFormulas(ORACLE, sys, formula));
  }

  public void testImpliedFormulasForEveryMatch() {
    Term six = Term.pubName("6");
    ConstraintSystem sys = TestSystems.empty()
        .withNode(J, emitRule(FIVE))
        .withNode(L, emitRule(six))
        .withNode(M, initRule(var(K)));
    Guarded formula = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG))),
        actionB(var(NODE), var(MSG)));
    assertEquals(
        ImmutableList.of(actionB(J.asTerm(), FIVE), actionB(L.asTerm(), six)),
        AxiomEvaluator.impliedFormulas(ORACLE, sys, formula));
  }

  public void testActionGoalsCount() {
    ConstraintSystem sys = TestSystems.empty()
        .insertGoal(ActionGoal.create(M, Fact.proto("A", FIVE)), false);
    Guarded formula = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG))),
        actionB(var(NODE), var(MSG)));
    assertEquals(ImmutableList.of(actionB(M.asTerm(), FIVE)),
        AxiomEvaluator.impliedFormulas(ORACLE, sys, formula));
  }

  public void testFreeVariablesAreNotInstantiated() {
    ConstraintSystem sys = TestSystems.empty().withNode(J, emitRule(FIVE));
    Guarded formula = Guarded.all(ImmutableList.of(NODE),
        ImmutableList.of(actionA(var(NODE), var(X))),
        actionB(var(NODE), var(X)));
    assertTrue(AxiomEvaluator.impliedFormulas(ORACLE, sys, formula)
        .isEmpty());
  }

  public void testEquationGuards() {
    ConstraintSystem sys = TestSystems.empty().withNode(J, emitRule(FIVE));
    Guarded formula = Guarded.all(ImmutableList.of(NODE, MSG, OTHER),
        ImmutableList.of(actionA(var(NODE), var(MSG)),
            Atom.eq(var(OTHER), var(MSG))),
        actionB(var(NODE), var(OTHER)));
    assertEquals(ImmutableList.of(actionB(J.asTerm(), FIVE)),
        AxiomEvaluator.impliedFormulas(ORACLE, sys, formula));

    Guarded contradictory = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG)),
            Atom.eq(var(MSG), Term.pubName("6"))),
        actionB(var(NODE), var(MSG)));
    assertTrue(AxiomEvaluator.impliedFormulas(ORACLE, sys, contradictory)
        .isEmpty());
  }

  public void testUnguardedEquation() {
    ConstraintSystem sys = TestSystems.empty().withNode(J, emitRule(FIVE));
    LVar a = LVar.msg("a");
    LVar b = LVar.msg("b");
    Guarded formula = Guarded.all(ImmutableList.of(NODE, MSG, a, b),
        ImmutableList.of(actionA(var(NODE), var(MSG)),
            Atom.eq(var(a), var(b))),
        actionB(var(NODE), var(a)));
    try {
      AxiomEvaluator.impliedFormulas(ORACLE, sys, formula);
      fail("Should have thrown an exception");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("bound variables on both sides"));
    }
  }

  public void testOtherGuardsStayGuards() {
    ConstraintSystem sys = TestSystems.empty().withNode(J, emitRule(FIVE));
    Guarded formula = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG)),
            Atom.less(var(NODE), L.asTerm())),
        actionB(var(NODE), var(MSG)));
    Guarded expected = Guarded.all(ImmutableList.<LVar>of(),
        ImmutableList.of(Atom.less(J, L)), actionB(J.asTerm(), FIVE));
    assertEquals(ImmutableList.of(expected),
        AxiomEvaluator.impliedFormulas(ORACLE, sys, formula));
  }

  public void testDuplicatesAreRemoved() {
    ConstraintSystem sys = TestSystems.empty()
        .withNode(J, emitRule(FIVE))
        .withNode(L, emitRule(FIVE));
    Guarded formula = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG))),
        Guarded.atom(Atom.eq(var(MSG), FIVE)));
    assertEquals(2, Iterators.size(
        AxiomEvaluator.impliedFormulasIterator(ORACLE, sys, formula)));
    assertEquals(ImmutableList.of(Guarded.atom(Atom.eq(FIVE, FIVE))),
        AxiomEvaluator.impliedFormulas(ORACLE, sys, formula));
  }

  public void testOnlyUniversalFormulasImplyInstances() {
    ConstraintSystem sys = TestSystems.empty().withNode(J, emitRule(FIVE));
    Guarded formula = Guarded.ex(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG))),
        actionB(var(NODE), var(MSG)));
    assertTrue(AxiomEvaluator.impliedFormulas(ORACLE, sys, formula)
        .isEmpty());
    assertTrue(AxiomEvaluator.impliedFormulas(ORACLE, sys,
        Guarded.atom(Atom.last(J))).isEmpty());
  }

  public void testFilterAxioms() {
    Guarded aboutStart = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(Atom.action(var(NODE),
            Fact.proto("Start", var(MSG)))),
        Guarded.FALSE);
    Guarded aboutOther = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG))), Guarded.FALSE);
    Guarded inBody = Guarded.not(Guarded.atom(
        Atom.action(L, Fact.proto("Done", var(X)))));
    List<Guarded> axioms = ImmutableList.of(aboutStart, aboutOther, inBody);
    assertEquals(ImmutableList.of(aboutStart, inBody),
        AxiomEvaluator.filterAxioms(ctxt, chain(), axioms));
    assertTrue(AxiomEvaluator.filterAxioms(ctxt, TestSystems.empty(), axioms)
        .isEmpty());
  }

  public void testAxiomsHold() {
    Guarded startImpliesStart = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(Atom.action(var(NODE),
            Fact.proto("Start", var(MSG)))),
        Guarded.atom(Atom.action(var(NODE), Fact.proto("Start", var(MSG)))));
    assertEquals(Valuation.TRUE, AxiomEvaluator.doAxiomsHold(ctxt, chain(),
        ImmutableList.of(startImpliesStart), false));
    assertEquals(Valuation.TRUE, AxiomEvaluator.doAxiomsHold(ctxt, chain(),
        ImmutableList.<Guarded>of(), false));
  }

  public void testAxiomViolated() {
    Guarded startImpliesDone = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(Atom.action(var(NODE),
            Fact.proto("Start", var(MSG)))),
        Guarded.atom(Atom.action(var(NODE), Fact.proto("Done", var(MSG)))));
    assertEquals(Valuation.FALSE, AxiomEvaluator.doAxiomsHold(ctxt, chain(),
        ImmutableList.of(startImpliesDone), false));
  }

  public void testUnmatchedAxiomHoldsOnlyInSolvedSystems() {
    Guarded aboutA = Guarded.all(ImmutableList.of(NODE, MSG),
        ImmutableList.of(actionA(var(NODE), var(MSG))), Guarded.FALSE);
    List<Guarded> axioms = ImmutableList.of(aboutA);
    assertEquals(Valuation.UNKNOWN,
        AxiomEvaluator.doAxiomsHold(ctxt, chain(), axioms, false));
    assertEquals(Valuation.TRUE,
        AxiomEvaluator.doAxiomsHold(ctxt, chain(), axioms, true));
  }

  /** {@code All a b m. Start(m)@a & Done(m)@b & order ==> body} */
  private static Guarded startThenDone(Atom order, Guarded body) {
    LVar a = LVar.node("a");
    LVar b = LVar.node("b");
    return Guarded.all(ImmutableList.of(a, b, MSG),
        ImmutableList.of(
            Atom.action(var(a), Fact.proto("Start", var(MSG))),
            Atom.action(var(b), Fact.proto("Done", var(MSG))),
            order),
        body);
  }

  public void testOrderGuardLeftInInstance() {
    Term a = var(LVar.node("a"));
    Term b = var(LVar.node("b"));
    List<Guarded> startFirst = ImmutableList.of(
        startThenDone(Atom.less(a, b), Guarded.FALSE));
    assertEquals(Valuation.FALSE,
        AxiomEvaluator.doAxiomsHold(ctxt, chain(), startFirst, false));
    List<Guarded> doneFirst = ImmutableList.of(
        startThenDone(Atom.less(b, a), Guarded.FALSE));
    assertEquals(Valuation.TRUE,
        AxiomEvaluator.doAxiomsHold(ctxt, chain(), doneFirst, false));
  }

  public void testUndecidedOrderGuardTerminates() {
    LVar c = LVar.node("c");
    Term a = var(LVar.node("a"));
    Term b = var(LVar.node("b"));
    Guarded otherLater = Guarded.ex(ImmutableList.of(c),
        ImmutableList.of(Atom.action(var(c), Fact.proto("Other", var(MSG)))),
        Guarded.TRUE);
    List<Guarded> axioms = ImmutableList.of(
        startThenDone(Atom.less(b, a), otherLater));
    ConstraintSystem unordered = TestSystems.empty()
        .withNode(J, initRule(var(K)))
        .withNode(L, respRule(var(K)));
    assertEquals(Valuation.UNKNOWN,
        AxiomEvaluator.doAxiomsHold(ctxt, unordered, axioms, false));
    assertEquals(Valuation.UNKNOWN,
        AxiomEvaluator.doAxiomsHold(ctxt, unordered, axioms, true));
  }

  /** {@code All a m. Start(m)@a ==> All b. Done(m)@b ==> body(a, b)} */
  private static Guarded everyDoneAfterStart(boolean startFirst) {
    LVar a = LVar.node("a");
    LVar b = LVar.node("b");
    Atom order = startFirst
        ? Atom.less(var(a), var(b)) : Atom.less(var(b), var(a));
    Guarded inner = Guarded.all(ImmutableList.of(b),
        ImmutableList.of(Atom.action(var(b), Fact.proto("Done", var(MSG)))),
        Guarded.atom(order));
    return Guarded.all(ImmutableList.of(a, MSG),
        ImmutableList.of(Atom.action(var(a), Fact.proto("Start", var(MSG)))),
        inner);
  }

  public void testNestedQuantifierInBody() {
    assertEquals(Valuation.TRUE, AxiomEvaluator.doAxiomsHold(ctxt, chain(),
        ImmutableList.of(everyDoneAfterStart(true)), false));
    assertEquals(Valuation.FALSE, AxiomEvaluator.doAxiomsHold(ctxt, chain(),
        ImmutableList.of(everyDoneAfterStart(false)), false));
  }
}
