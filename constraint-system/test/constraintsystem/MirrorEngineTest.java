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
import static constraintsystem.TestSystems.ORACLE;
import static constraintsystem.TestSystems.X;
import static constraintsystem.TestSystems.Y;
import static constraintsystem.TestSystems.chain;
import static constraintsystem.TestSystems.freshRule;
import static constraintsystem.TestSystems.initRule;
import static constraintsystem.TestSystems.respRule;
import static constraintsystem.TestSystems.var;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;

import junit.framework.TestCase;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

public class MirrorEngineTest extends TestCase {
  private static final LVar P = LVar.pub("p");

  /** Like Init, but sends a hash of the key. */
  private static Rule hashingInitRule(Term t) {
    return Rule.create(RuleName.protocol("Init"),
        ImmutableList.of(Fact.fresh(t)),
        ImmutableList.of(Fact.proto("St", t),
            Fact.out(Term.fun("h", t))),
        ImmutableList.of(Fact.proto("Start", t)));
  }

  /** Like Resp, but expects a pair. */
  private static Rule pairRespRule() {
    return Rule.create(RuleName.protocol("Resp"),
        ImmutableList.of(Fact.proto("St", Term.fun("pair", var(X), var(Y)))),
        ImmutableList.<Fact>of(),
        ImmutableList.of(Fact.proto("Done", var(X))));
  }

  /** {@code --> Ann(p)}, introducing the public variable p. */
  private static Rule announceRule(Term p) {
    return Rule.create(RuleName.protocol("Announce"),
        ImmutableList.<Fact>of(), ImmutableList.of(Fact.proto("Ann", p)),
        ImmutableList.<Fact>of());
  }

  private static ProofContext sideContext(List<Rule> rules) {
    return ProofContext.builder(ORACLE)
        .rules(ClassifiedRules.create(rules, ImmutableList.<Rule>of(),
            ImmutableList.<Rule>of()))
        .diff(true)
        .build();
  }

  private static DiffProofContext diffContext(List<Rule> left,
      List<Rule> right) {
    return DiffProofContext.create(sideContext(left), sideContext(right),
        left, ImmutableList.<Rule>of(), ImmutableList.<Rule>of(),
        ImmutableMap.<Side, List<Guarded>>of());
  }

  private static DiffProofContext standardContext() {
    return diffContext(
        ImmutableList.of(initRule(var(K)), respRule(var(X))),
        ImmutableList.of(hashingInitRule(var(K)), respRule(var(X))));
  }

  public void testFreshNodeIsKept() {
    ConstraintSystem sys = TestSystems.empty()
        .withNode(I, freshRule(var(K)));
    assertEquals(Optional.of(sys),
        MirrorEngine.getMirrorDG(standardContext(), Side.LHS, sys));
  }

  public void testEmptySystemMirrorsItself() {
    ConstraintSystem sys = TestSystems.empty();
    assertEquals(Optional.of(sys),
        MirrorEngine.getMirrorDG(standardContext(), Side.RHS, sys));
  }

  public void testMirrorIsCorrectGraphWithSameRuleNames() {
    ConstraintSystem sys = chain();
    Optional<ConstraintSystem> mirror =
        MirrorEngine.getMirrorDG(standardContext(), Side.LHS, sys);
    assertTrue(mirror.isPresent());
    assertTrue(DependencyGraphValidator.isCorrectDG(mirror.get()));
    assertEquals(sys.nodes().keySet(), mirror.get().nodes().keySet());
    for (Map.Entry<NodeId, Rule> entry : sys.nodes().entrySet()) {
      assertEquals(entry.getValue().name(),
          mirror.get().nodeRule(entry.getKey()).name());
    }
    assertEquals(sys.edges(), mirror.get().edges());

    // J uses the right-hand Init rule.
    Term sent = mirror.get().nodeRule(J).conclusion(1).terms().get(0);
    assertTrue(sent instanceof FunTerm);
    assertEquals("h", ((FunTerm) sent).symbol());
  }

  public void testNoMirror() {
    DiffProofContext ctxt = diffContext(
        ImmutableList.of(initRule(var(K)), respRule(var(X))),
        ImmutableList.of(initRule(var(K)), pairRespRule()));
    assertFalse(MirrorEngine.getMirrorDG(ctxt, Side.LHS, chain())
        .isPresent());
  }

  public void testLessAtomFeedsOpenPremise() {
    ConstraintSystem unordered = TestSystems.empty()
        .withNode(J, initRule(var(K)))
        .withNode(L, respRule(var(K)));
    ConstraintSystem ordered =
        unordered.withLessAtom(TestSystems.less(J, L));
    DiffProofContext mismatching = diffContext(
        ImmutableList.of(initRule(var(K)), respRule(var(X))),
        ImmutableList.of(initRule(var(K)), pairRespRule()));

    // St(~k) of J can only reach L's premise through J < L.
    assertTrue(MirrorEngine.getMirrorDG(mismatching, Side.LHS, unordered)
        .isPresent());
    assertFalse(MirrorEngine.getMirrorDG(mismatching, Side.LHS, ordered)
        .isPresent());

    Optional<ConstraintSystem> mirror =
        MirrorEngine.getMirrorDG(standardContext(), Side.LHS, ordered);
    assertTrue(mirror.isPresent());
    assertEquals(mirror.get().nodeRule(J).conclusion(0),
        mirror.get().nodeRule(L).premise(0));
  }

  public void testMissingRuleOnOtherSide() {
    DiffProofContext ctxt = diffContext(
        ImmutableList.of(initRule(var(K)), respRule(var(X))),
        ImmutableList.of(initRule(var(K))));
    try {
      MirrorEngine.getMirrorDG(ctxt, Side.LHS, chain());
      fail("Should have thrown an exception");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("No other rule found"));
    }
  }

  public void testInstanceNeedsUniqueOriginal() {
    DiffProofContext ctxt = diffContext(
        ImmutableList.of(respRule(var(X))),
        ImmutableList.of(initRule(var(K)), respRule(var(X))));
    try {
      MirrorEngine.originalRule(ctxt, Side.LHS, initRule(var(K)));
      fail("Should have thrown an exception");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().startsWith("0 rules found"));
    }
  }

  public void testNewVariablesBecomeConstants() {
    DiffProofContext ctxt = diffContext(
        ImmutableList.of(announceRule(var(P))),
        ImmutableList.of(announceRule(var(P))));
    ConstraintSystem sys = TestSystems.empty()
        .withNode(J, announceRule(var(P)));
    assertEquals(ImmutableMap.of(P, var(P)),
        MirrorEngine.newVariablesFixing(ctxt, Side.LHS, sys.nodeRule(J)));

    Optional<ConstraintSystem> mirror =
        MirrorEngine.getMirrorDG(ctxt, Side.LHS, sys);
    assertTrue(mirror.isPresent());
    assertEquals(announceRule(MirrorEngine.constant(P)),
        mirror.get().nodeRule(J));
  }

  public void testTrivialGoalsBecomeConstants() {
    ConstraintSystem sys = TestSystems.empty()
        .withNode(L, respRule(var(X)))
        .insertGoal(PremiseGoal.create(NodePrem.create(L, 0),
            Fact.proto("St", var(X))), false);
    Optional<ConstraintSystem> mirror =
        MirrorEngine.getMirrorDG(standardContext(), Side.LHS, sys);
    assertTrue(mirror.isPresent());
    Term received = mirror.get().nodeRule(L).premise(0).terms().get(0);
    assertTrue(received instanceof NameTerm);
    assertTrue(((NameTerm) received).id()
        .startsWith(MirrorEngine.CONSTANT_PREFIX));
  }

  public void testConstants() {
    assertEquals(NameTerm.create(NameTerm.Kind.FRESH, "constVarfk0"),
        MirrorEngine.constant(K));
    assertEquals(NameTerm.create(NameTerm.Kind.PUB, "constVarmx3"),
        MirrorEngine.constant(X.withIndex(3)));
    assertEquals(NameTerm.create(NameTerm.Kind.PUB, "constVarpp0"),
        MirrorEngine.constant(P));
  }

  public void testACConstructionsUseCanonicalInstances() {
    Rule mult = IntruderRules.multRuleInstance(3);
    ImmutableList<Rule> opposite =
        MirrorEngine.oppositeRules(standardContext(), Side.LHS, mult);
    assertEquals(ImmutableList.of(IntruderRules.multRuleInstance(3)),
        opposite);
    assertEquals(3, opposite.get(0).premises().size());
  }

  public void testCandidatesVaryLastNodeFastest() {
    Rule a = respRule(Term.pubName("a"));
    Rule b = respRule(Term.pubName("b"));
    Rule c = respRule(Term.pubName("c"));
    Rule d = respRule(Term.pubName("d"));
    Map<NodeId, Rule> fixed = ImmutableMap.of(I, freshRule(var(K)));
    Iterator<ImmutableSortedMap<NodeId, Rule>> candidates =
        MirrorEngine.candidates(fixed, ImmutableList.of(J, L),
            ImmutableList.of(ImmutableList.of(a, b), ImmutableList.of(c, d)));
    List<ImmutableSortedMap<NodeId, Rule>> all =
        Lists.newArrayList(candidates);
    assertEquals(4, all.size());
    assertEquals(ImmutableSortedMap.of(I, freshRule(var(K)), J, a, L, c),
        all.get(0));
    assertEquals(ImmutableSortedMap.of(I, freshRule(var(K)), J, a, L, d),
        all.get(1));
    assertEquals(ImmutableSortedMap.of(I, freshRule(var(K)), J, b, L, c),
        all.get(2));
    assertEquals(ImmutableSortedMap.of(I, freshRule(var(K)), J, b, L, d),
        all.get(3));
  }

  public void testNoCandidatesIfANodeHasNoAlternative() {
    Iterator<ImmutableSortedMap<NodeId, Rule>> candidates =
        MirrorEngine.candidates(ImmutableMap.<NodeId, Rule>of(),
            ImmutableList.of(J, L), ImmutableList.of(
                ImmutableList.of(respRule(var(X))),
                ImmutableList.<Rule>of()));
    assertFalse(candidates.hasNext());
  }

  public void testOnlyFixedNodes() {
    Map<NodeId, Rule> fixed = ImmutableMap.of(I, freshRule(var(K)));
    Iterator<ImmutableSortedMap<NodeId, Rule>> candidates =
        MirrorEngine.candidates(fixed, ImmutableList.<NodeId>of(),
            ImmutableList.<List<Rule>>of());
    assertEquals(ImmutableSortedMap.copyOf(fixed), candidates.next());
    assertFalse(candidates.hasNext());
  }
}
