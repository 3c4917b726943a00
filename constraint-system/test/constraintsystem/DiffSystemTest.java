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
import static constraintsystem.TestSystems.ORACLE;
import static constraintsystem.TestSystems.X;
import static constraintsystem.TestSystems.chain;
import static constraintsystem.TestSystems.context;
import static constraintsystem.TestSystems.freshRule;
import static constraintsystem.TestSystems.initRule;
import static constraintsystem.TestSystems.protocolRules;
import static constraintsystem.TestSystems.pubRule;
import static constraintsystem.TestSystems.var;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import junit.framework.TestCase;

public class DiffSystemTest extends TestCase {
  public void testDefaultProofContext() {
    ProofContext ctxt = ProofContext.builder(ORACLE).build();
    assertSame(ORACLE, ctxt.oracle());
    assertEquals(ClassifiedRules.empty(), ctxt.rules());
    assertEquals(CaseDistKind.UNTYPED, ctxt.caseDistKind());
    assertEquals(InductionHint.AVOID_INDUCTION, ctxt.inductionHint());
    assertEquals(TraceQuantifier.EXISTS_NO_TRACE, ctxt.traceQuantifier());
    assertFalse(ctxt.isDiff());
    assertTrue(ctxt.caseDistinctions().isEmpty());
    assertEquals(ctxt, ctxt.toBuilder().build());
    assertFalse(ctxt.equals(ctxt.toBuilder().diff(true).build()));
  }

  public void testContextPerSide() {
    ProofContext left = context();
    ProofContext right = context().toBuilder()
        .rules(ClassifiedRules.create(ImmutableList.of(initRule(var(K))),
            ImmutableList.<Rule>of(),
            ImmutableList.of(pubRule(var(LVar.pub("p"))))))
        .build();
    Guarded axiom = Guarded.atom(Atom.last(var(LVar.node("t"))));
    DiffProofContext diff = DiffProofContext.create(left, right,
        ImmutableList.of(initRule(var(K))), ImmutableList.<Rule>of(),
        ImmutableList.<Rule>of(),
        ImmutableMap.of(Side.RHS, ImmutableList.of(axiom)));

    assertSame(left, diff.context(Side.LHS));
    assertSame(right, diff.context(Side.RHS));
    assertSame(ORACLE, diff.oracle(Side.RHS));
    assertEquals(protocolRules().all(), diff.rulesOnSide(Side.LHS));
    assertEquals(right.rules().all(), diff.rulesOnOtherSide(Side.LHS));
    assertEquals(2, diff.rulesOnOtherSide(Side.LHS).size());
    assertEquals(ImmutableList.of(axiom), diff.axioms(Side.RHS));
    assertTrue(diff.axioms(Side.LHS).isEmpty());
    assertEquals(ImmutableList.of(initRule(var(K))), diff.protocolRules());
  }

  public void testSideOpposite() {
    assertEquals(Side.RHS, Side.LHS.opposite());
    assertEquals(Side.LHS, Side.RHS.opposite());
  }

  public void testEmptyDiffSystem() {
    DiffSystem empty = DiffSystem.empty();
    assertFalse(empty.proofType().isPresent());
    assertFalse(empty.side().isPresent());
    assertFalse(empty.proofContext().isPresent());
    assertFalse(empty.system().isPresent());
    assertFalse(empty.currentRule().isPresent());
    assertTrue(empty.protocolRules().isEmpty());
  }

  public void testDiffSystemUpdates() {
    DiffSystem diff = DiffSystem.empty()
        .withProofType(DiffProofType.RULE_EQUIVALENCE)
        .withRules(ImmutableList.of(initRule(var(K))),
            ImmutableList.of(pubRule(var(X))),
            ImmutableList.<Rule>of())
        .withCurrentRule("Init")
        .withSide(Side.LHS, context(), chain());
    assertEquals(DiffProofType.RULE_EQUIVALENCE, diff.proofType().get());
    assertEquals(Side.LHS, diff.side().get());
    assertEquals(context(), diff.proofContext().get());
    assertEquals(chain(), diff.system().get());
    assertEquals("Init", diff.currentRule().get());
    assertEquals(ImmutableSet.of(pubRule(var(X))), diff.constructionRules());

    ConstraintSystem single = TestSystems.empty()
        .withNode(TestSystems.I, freshRule(var(K)));
    DiffSystem replaced = diff.withSystem(single);
    assertEquals(single, replaced.system().get());
    assertEquals(chain(), diff.system().get());
    assertEquals(Side.LHS, replaced.side().get());
    assertFalse(replaced.equals(diff));
    assertEquals(replaced, diff.withSystem(single));
    assertFalse(DiffSystem.empty().equals(diff));
  }
}
