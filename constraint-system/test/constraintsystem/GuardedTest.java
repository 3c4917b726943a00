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

import static constraintsystem.TestSystems.X;
import static constraintsystem.TestSystems.var;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import junit.framework.TestCase;

public class GuardedTest extends TestCase {
  private static final LVar T = LVar.node("t");
  private static final LVar M = LVar.msg("m");

  private final Guarded a = Guarded.atom(Atom.last(var(T)));
  private final Guarded b = Guarded.atom(Atom.eq(var(X), var(M)));
  private final Guarded c = Guarded.atom(Atom.less(var(T), var(T)));

  /** {@code All t m. Start(m) @ t ==> body} */
  private static Guarded everyStart(Guarded body) {
    return Guarded.all(ImmutableList.of(T, M),
        ImmutableList.of(Atom.action(var(T), Fact.proto("Start", var(M)))),
        body);
  }

  /** Valuates every atom to {@code value}. */
  private static AtomValuation constant(final Valuation value) {
    return new AtomValuation() {
      @Override
      public Valuation valuate(Atom atom) {
        return value;
      }
    };
  }

  public void testConjunctionIsFlattened() {
    assertEquals(Guarded.conj(a, b, c), Guarded.conj(a, Guarded.conj(b, c)));
    assertEquals(3,
        ((Guarded.Conj) Guarded.conj(a, Guarded.conj(b, c))).formulas().size());
    assertEquals(a, Guarded.conj(a));
    assertEquals(a, Guarded.conj(a, Guarded.TRUE));
    assertEquals(Guarded.FALSE, Guarded.conj(a, Guarded.FALSE, b));
    assertEquals(Guarded.TRUE, Guarded.conj(ImmutableList.<Guarded>of()));
  }

  public void testDisjunctionIsFlattened() {
    assertEquals(3,
        ((Guarded.Disj) Guarded.disj(Guarded.disj(a, b), c)).formulas().size());
    assertEquals(a, Guarded.disj(a, Guarded.FALSE));
    assertEquals(Guarded.TRUE, Guarded.disj(a, Guarded.TRUE));
    assertEquals(Guarded.FALSE, Guarded.disj(ImmutableList.<Guarded>of()));
  }

  public void testNegation() {
    assertEquals(a, Guarded.not(Guarded.not(a)));
    assertEquals(Guarded.disj(Guarded.not(a), Guarded.not(b)),
        Guarded.not(Guarded.conj(a, b)));
    assertEquals(Guarded.conj(Guarded.not(a), Guarded.not(b)),
        Guarded.not(Guarded.disj(a, b)));
    assertEquals(Guarded.FALSE, Guarded.not(Guarded.TRUE));
    assertEquals(Guarded.TRUE, Guarded.not(Guarded.FALSE));

    Guarded negated = Guarded.not(everyStart(a));
    assertTrue(negated instanceof Guarded.Quantified);
    Guarded.Quantified ex = (Guarded.Quantified) negated;
    assertEquals(Guarded.Quantifier.EX, ex.quantifier());
    assertEquals(Guarded.not(a), ex.body());
    assertEquals(everyStart(a), Guarded.not(negated));
  }

  public void testVariables() {
    Guarded formula = everyStart(Guarded.conj(a, b));
    assertEquals(ImmutableSet.of(X), formula.freeVariables());
    assertEquals(ImmutableSet.of(T, M, X), formula.variables());
  }

  public void testSafety() {
    assertTrue(everyStart(a).isSafety());
    assertFalse("free variable x", everyStart(b).isSafety());
    assertFalse(Guarded.not(everyStart(a)).isSafety());
    assertFalse(everyStart(Guarded.not(everyStart(a))).isSafety());
    assertTrue(everyStart(Guarded.not(a)).isSafety());
  }

  public void testApplyLeavesBoundVariables() {
    Term five = Term.pubName("5");
    Guarded formula = everyStart(b);
    assertEquals(formula, formula.apply(Substitution.of(M, five)));
    assertEquals(Guarded.atom(Atom.eq(five, var(M))),
        b.apply(Substitution.of(X, five)));
  }

  public void testRenameBoundVariables() {
    Guarded formula = everyStart(b);
    Guarded.Quantified renamed = (Guarded.Quantified)
        formula.renameBoundVariables(FreshSupply.avoiding(formula.variables()));
    assertEquals(2, renamed.vars().size());
    assertFalse(renamed.vars().contains(T));
    assertFalse(renamed.vars().contains(M));
    assertEquals(formula.freeVariables(), renamed.freeVariables());
  }

  public void testSimplify() {
    assertEquals(Guarded.TRUE,
        Guarded.conj(a, b).simplify(constant(Valuation.TRUE)));
    assertEquals(Guarded.FALSE,
        Guarded.conj(a, b).simplify(constant(Valuation.FALSE)));
    assertEquals(Guarded.conj(a, b),
        Guarded.conj(a, b).simplify(constant(Valuation.UNKNOWN)));
    assertEquals(Guarded.TRUE,
        Guarded.not(a).simplify(constant(Valuation.FALSE)));
  }

  public void testSimplifyOnlyEvaluatesFreeAtoms() {
    // The guard and body mention bound variables and are left alone.
    Guarded formula = everyStart(a);
    assertEquals(formula, formula.simplify(constant(Valuation.FALSE)));

    Guarded free = Guarded.atom(Atom.eq(var(X), var(X)));
    Guarded mixed = everyStart(Guarded.conj(a, free));
    assertEquals(everyStart(a), mixed.simplify(constant(Valuation.TRUE)));
    assertEquals(everyStart(Guarded.FALSE),
        mixed.simplify(constant(Valuation.FALSE)));
  }

  public void testFalseGuardMakesQuantificationTrivial() {
    Guarded all = Guarded.all(ImmutableList.<LVar>of(),
        ImmutableList.of(Atom.less(var(X), var(X))), b);
    assertEquals(Guarded.TRUE, all.simplify(new AtomValuation() {
      @Override
      public Valuation valuate(Atom atom) {
        return atom instanceof Atom.Less ? Valuation.FALSE
            : Valuation.UNKNOWN;
      }
    }));
    Guarded ex = Guarded.ex(ImmutableList.<LVar>of(),
        ImmutableList.of(Atom.less(var(X), var(X))), b);
    assertEquals(Guarded.FALSE, ex.simplify(constant(Valuation.FALSE)));
    // True guards vanish, leaving the body.
    assertEquals(b, all.simplify(new AtomValuation() {
      @Override
      public Valuation valuate(Atom atom) {
        return atom instanceof Atom.Less ? Valuation.TRUE
            : Valuation.UNKNOWN;
      }
    }));
  }

  public void testToString() {
    assertEquals("T", Guarded.TRUE.toString());
    assertEquals("F", Guarded.FALSE.toString());
    assertEquals("(All #t m. (Start(m) @ #t) ==> last(#t))",
        everyStart(a).toString());
  }
}
