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
import static constraintsystem.TestSystems.X;
import static constraintsystem.TestSystems.Y;
import static constraintsystem.TestSystems.var;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import junit.framework.TestCase;

public class SyntacticOracleTest extends TestCase {
  private final SyntacticOracle oracle = SyntacticOracle.create();
  private final Term a = Term.pubName("a");
  private final Term b = Term.pubName("b");

  private static Equal<Fact> eq(Fact left, Fact right) {
    return Equal.create(left, right);
  }

  public void testUnifiableTerms() {
    assertTrue(oracle.unifiable(var(X), a));
    assertTrue(oracle.unifiable(Term.fun("pair", var(X), b),
        Term.fun("pair", a, var(Y))));
    assertFalse(oracle.unifiable(a, b));
    assertFalse(oracle.unifiable(Term.fun("f", a), Term.fun("g", a)));
    assertFalse(oracle.unifiable(Term.fun("pair", var(X), var(X)),
        Term.fun("pair", a, b)));
  }

  public void testOccursCheck() {
    assertFalse(oracle.unifiable(var(X), Term.fun("h", var(X))));
  }

  public void testSorts() {
    // A fresh variable only stands for fresh values.
    assertFalse(oracle.unifiable(var(K), a));
    assertFalse(oracle.unifiable(var(K), Term.fun("h", a)));
    assertTrue(oracle.unifiable(var(K), Term.freshName("n")));
    assertTrue(oracle.unifiable(var(X), var(K)));
  }

  public void testUnifiableFactsNeedSameTag() {
    assertTrue(oracle.unifiable(Fact.proto("St", var(X)),
        Fact.proto("St", a)));
    assertFalse(oracle.unifiable(Fact.proto("St", a), Fact.out(a)));
  }

  public void testUnifyReturnsFreshUnifier() {
    ImmutableList<Substitution> unifiers = oracle.unify(ImmutableList.of(
        eq(Fact.proto("St", var(X)), Fact.proto("St", var(Y)))));
    assertEquals(1, unifiers.size());
    Substitution unifier = unifiers.get(0);
    assertEquals(unifier.get(X), unifier.get(Y));
    assertTrue(unifier.get(X) instanceof VarTerm);
    LVar fresh = ((VarTerm) unifier.get(X)).var();
    assertFalse(fresh.equals(X) || fresh.equals(Y));
  }

  public void testUnifyBindsToValues() {
    ImmutableList<Substitution> unifiers = oracle.unify(ImmutableList.of(
        eq(Fact.proto("St", var(X)), Fact.proto("St", a)),
        eq(Fact.proto("Key", var(Y)), Fact.proto("Key", Term.fun("h",
            var(X))))));
    assertEquals(1, unifiers.size());
    assertEquals(a, unifiers.get(0).get(X));
    assertEquals(Term.fun("h", a), unifiers.get(0).get(Y));
  }

  public void testUnifyFailure() {
    assertTrue(oracle.unify(ImmutableList.of(
        eq(Fact.proto("St", a), Fact.proto("St", b)))).isEmpty());
    assertTrue(oracle.unify(ImmutableList.of(
        eq(Fact.proto("St", a), Fact.proto("Other", a)))).isEmpty());
  }

  public void testUnifyNothing() {
    assertEquals(ImmutableList.of(Substitution.empty()),
        oracle.unify(ImmutableList.<Equal<Fact>>of()));
  }

  public void testMatchIsOneWay() {
    Optional<Substitution> match =
        oracle.match(Term.fun("pair", a, var(Y)), Term.fun("pair", var(X),
            var(X)));
    assertFalse(match.isPresent());

    match = oracle.match(Term.fun("pair", a, var(Y)),
        Term.fun("pair", var(X), var(K)));
    assertFalse("~k cannot stand for y", match.isPresent());

    match = oracle.match(Term.fun("pair", a, a),
        Term.fun("pair", var(X), var(X)));
    assertEquals(Optional.of(Substitution.of(X, a)), match);

    assertFalse(oracle.match(var(X), a).isPresent());
  }

  public void testSingleVariant() {
    assertEquals(ImmutableList.of(Substitution.empty()),
        oracle.variantsOf(TestSystems.initRule(var(K))));
  }
}
