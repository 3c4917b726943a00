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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A guarded trace formula. Quantifiers are always guarded by a list of atoms:
 * <ul>
 * <li>{@code All vs. guards ==> body}
 * <li>{@code Ex vs. guards & body}
 * </ul>
 * Negation is normally pushed down to the atoms; see {@link #not}.
 * The empty conjunction is {@link #TRUE}, the empty disjunction
 * {@link #FALSE}.
 * <p>
 * Bound variables are ordinary {@link LVar}s. Substitutions never replace a
 * bound variable, but they can capture one; callers that substitute terms
 * containing foreign variables first call {@link #renameBoundApart}.
 */
public abstract class Guarded {
  public static final Guarded TRUE = new Conj(ImmutableList.<Guarded>of());
  public static final Guarded FALSE = new Disj(ImmutableList.<Guarded>of());

  /** The two quantifiers. */
  public enum Quantifier {
    ALL, EX;

    public Quantifier dual() {
      return this == ALL ? EX : ALL;
    }
  }

  private Guarded() {}

  /** Exhaustive dispatch on the kind of formula. */
  public interface Visitor<R> {
    R visitAtom(AtomFormula formula);
    R visitNot(Not formula);
    R visitConj(Conj formula);
    R visitDisj(Disj formula);
    R visitQuantified(Quantified formula);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /** Applies {@code subst} to the free variables of this formula. */
  public abstract Guarded apply(Substitution subst);

  /** Adds all variables, free or bound, to {@code vars}. */
  abstract void collectVariables(Set<LVar> vars);

  abstract void collectFreeVariables(Set<LVar> bound, Set<LVar> free);

  abstract Guarded renameBoundApart(FreshSupply supply);

  abstract boolean noExistential();

  abstract Guarded simplify(AtomValuation valuation, Set<LVar> bound);

  public ImmutableSet<LVar> variables() {
    Set<LVar> vars = Sets.newLinkedHashSet();
    collectVariables(vars);
    return ImmutableSet.copyOf(vars);
  }

  public ImmutableSet<LVar> freeVariables() {
    Set<LVar> free = Sets.newLinkedHashSet();
    collectFreeVariables(Collections.<LVar>emptySet(), free);
    return ImmutableSet.copyOf(free);
  }

  /**
   * Whether this formula is a safety formula: closed and without existential
   * quantification. Safety axioms are prefix closed and can be kept as
   * lemmas.
   */
  public boolean isSafety() {
    return freeVariables().isEmpty() && noExistential();
  }

  /**
   * Replaces every atom whose variables are all free by its valuation, if
   * known, and simplifies the result.
   */
  public Guarded simplify(AtomValuation valuation) {
    return simplify(valuation, Collections.<LVar>emptySet());
  }

  /** Renames all bound variables to variables drawn from {@code supply}. */
  public Guarded renameBoundVariables(FreshSupply supply) {
    return renameBoundApart(supply);
  }

  public static Guarded atom(Atom atom) {
    return new AtomFormula(atom);
  }

  /** Negates {@code formula}, pushing the negation down to the atoms. */
  public static Guarded not(Guarded formula) {
    return formula.accept(new Visitor<Guarded>() {
      @Override
      public Guarded visitAtom(AtomFormula f) {
        return new Not(f);
      }

      @Override
      public Guarded visitNot(Not f) {
        return f.formula();
      }

      @Override
      public Guarded visitConj(Conj f) {
        List<Guarded> negated = Lists.newArrayList();
        for (Guarded conjunct : f.formulas()) {
          negated.add(not(conjunct));
        }
        return disj(negated);
      }

      @Override
      public Guarded visitDisj(Disj f) {
        List<Guarded> negated = Lists.newArrayList();
        for (Guarded disjunct : f.formulas()) {
          negated.add(not(disjunct));
        }
        return conj(negated);
      }

      @Override
      public Guarded visitQuantified(Quantified f) {
        return new Quantified(f.quantifier().dual(), f.vars(), f.guards(),
            not(f.body()));
      }
    });
  }

  /** A flattened conjunction; FALSE absorbs, TRUE vanishes. */
  public static Guarded conj(List<Guarded> formulas) {
    ImmutableList.Builder<Guarded> result = ImmutableList.builder();
    for (Guarded formula : formulas) {
      if (formula.equals(FALSE)) {
        return FALSE;
      } else if (formula instanceof Conj) {
        result.addAll(((Conj) formula).formulas());
      } else {
        result.add(formula);
      }
    }
    ImmutableList<Guarded> conjuncts = result.build();
    return conjuncts.size() == 1 ? conjuncts.get(0) : new Conj(conjuncts);
  }

  public static Guarded conj(Guarded... formulas) {
    return conj(ImmutableList.copyOf(formulas));
  }

  /** A flattened disjunction; TRUE absorbs, FALSE vanishes. */
  public static Guarded disj(List<Guarded> formulas) {
    ImmutableList.Builder<Guarded> result = ImmutableList.builder();
    for (Guarded formula : formulas) {
      if (formula.equals(TRUE)) {
        return TRUE;
      } else if (formula instanceof Disj) {
        result.addAll(((Disj) formula).formulas());
      } else {
        result.add(formula);
      }
    }
    ImmutableList<Guarded> disjuncts = result.build();
    return disjuncts.size() == 1 ? disjuncts.get(0) : new Disj(disjuncts);
  }

  public static Guarded disj(Guarded... formulas) {
    return disj(ImmutableList.copyOf(formulas));
  }

  /** {@code All vars. guards ==> body} */
  public static Guarded all(List<LVar> vars, List<? extends Atom> guards,
      Guarded body) {
    return new Quantified(Quantifier.ALL, ImmutableList.copyOf(vars),
        ImmutableList.<Atom>copyOf(guards), body);
  }

  /** {@code Ex vars. guards & body} */
  public static Guarded ex(List<LVar> vars, List<? extends Atom> guards,
      Guarded body) {
    return new Quantified(Quantifier.EX, ImmutableList.copyOf(vars),
        ImmutableList.<Atom>copyOf(guards), body);
  }

  private static Valuation valuateFree(Atom atom, AtomValuation valuation,
      Set<LVar> bound) {
    if (!Collections.disjoint(atom.variables(), bound)) {
      return Valuation.UNKNOWN;
    }
    return valuation.valuate(atom);
  }

  /** An atom used as a formula. */
  public static final class AtomFormula extends Guarded {
    private final Atom atom;

    AtomFormula(Atom atom) {
      this.atom = Preconditions.checkNotNull(atom);
    }

    public Atom atom() {
      return atom;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAtom(this);
    }

    @Override
    public Guarded apply(Substitution subst) {
      return new AtomFormula(atom.apply(subst));
    }

    @Override
    void collectVariables(Set<LVar> vars) {
      atom.collectVariables(vars);
    }

    @Override
    void collectFreeVariables(Set<LVar> bound, Set<LVar> free) {
      for (LVar var : atom.variables()) {
        if (!bound.contains(var)) {
          free.add(var);
        }
      }
    }

    @Override
    Guarded renameBoundApart(FreshSupply supply) {
      return this;
    }

    @Override
    boolean noExistential() {
      return true;
    }

    @Override
    Guarded simplify(AtomValuation valuation, Set<LVar> bound) {
      switch (valuateFree(atom, valuation, bound)) {
        case TRUE:
          return TRUE;
        case FALSE:
          return FALSE;
        default:
          return this;
      }
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof AtomFormula
          && atom.equals(((AtomFormula) obj).atom);
    }

    @Override
    public int hashCode() {
      return atom.hashCode();
    }

    @Override
    public String toString() {
      return atom.toString();
    }
  }

  /** A negated formula. */
  public static final class Not extends Guarded {
    private final Guarded formula;

    Not(Guarded formula) {
      this.formula = Preconditions.checkNotNull(formula);
    }

    public Guarded formula() {
      return formula;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNot(this);
    }

    @Override
    public Guarded apply(Substitution subst) {
      return new Not(formula.apply(subst));
    }

    @Override
    void collectVariables(Set<LVar> vars) {
      formula.collectVariables(vars);
    }

    @Override
    void collectFreeVariables(Set<LVar> bound, Set<LVar> free) {
      formula.collectFreeVariables(bound, free);
    }

    @Override
    Guarded renameBoundApart(FreshSupply supply) {
      return new Not(formula.renameBoundApart(supply));
    }

    @Override
    boolean noExistential() {
      return formula instanceof AtomFormula || not(formula).noExistential();
    }

    @Override
    Guarded simplify(AtomValuation valuation, Set<LVar> bound) {
      Guarded simplified = formula.simplify(valuation, bound);
      if (simplified.equals(TRUE)) {
        return FALSE;
      } else if (simplified.equals(FALSE)) {
        return TRUE;
      }
      return new Not(simplified);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Not && formula.equals(((Not) obj).formula);
    }

    @Override
    public int hashCode() {
      return ~formula.hashCode();
    }

    @Override
    public String toString() {
      return "not(" + formula + ")";
    }
  }

  /** A conjunction. */
  public static final class Conj extends Guarded {
    private final ImmutableList<Guarded> formulas;

    Conj(ImmutableList<Guarded> formulas) {
      this.formulas = formulas;
    }

    public ImmutableList<Guarded> formulas() {
      return formulas;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitConj(this);
    }

    @Override
    public Guarded apply(Substitution subst) {
      return new Conj(applyAll(formulas, subst));
    }

    @Override
    void collectVariables(Set<LVar> vars) {
      for (Guarded formula : formulas) {
        formula.collectVariables(vars);
      }
    }

    @Override
    void collectFreeVariables(Set<LVar> bound, Set<LVar> free) {
      for (Guarded formula : formulas) {
        formula.collectFreeVariables(bound, free);
      }
    }

    @Override
    Guarded renameBoundApart(FreshSupply supply) {
      return new Conj(renameAll(formulas, supply));
    }

    @Override
    boolean noExistential() {
      for (Guarded formula : formulas) {
        if (!formula.noExistential()) {
          return false;
        }
      }
      return true;
    }

    @Override
    Guarded simplify(AtomValuation valuation, Set<LVar> bound) {
      List<Guarded> simplified = Lists.newArrayList();
      for (Guarded formula : formulas) {
        simplified.add(formula.simplify(valuation, bound));
      }
      return conj(simplified);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Conj && formulas.equals(((Conj) obj).formulas);
    }

    @Override
    public int hashCode() {
      return formulas.hashCode();
    }

    @Override
    public String toString() {
      return formulas.isEmpty() ? "T"
          : "(" + Joiner.on(" & ").join(formulas) + ")";
    }
  }

  /** A disjunction. */
  public static final class Disj extends Guarded {
    private final ImmutableList<Guarded> formulas;

    Disj(ImmutableList<Guarded> formulas) {
      this.formulas = formulas;
    }

    public ImmutableList<Guarded> formulas() {
      return formulas;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDisj(this);
    }

    @Override
    public Guarded apply(Substitution subst) {
      return new Disj(applyAll(formulas, subst));
    }

    @Override
    void collectVariables(Set<LVar> vars) {
      for (Guarded formula : formulas) {
        formula.collectVariables(vars);
      }
    }

    @Override
    void collectFreeVariables(Set<LVar> bound, Set<LVar> free) {
      for (Guarded formula : formulas) {
        formula.collectFreeVariables(bound, free);
      }
    }

    @Override
    Guarded renameBoundApart(FreshSupply supply) {
      return new Disj(renameAll(formulas, supply));
    }

    @Override
    boolean noExistential() {
      for (Guarded formula : formulas) {
        if (!formula.noExistential()) {
          return false;
        }
      }
      return true;
    }

    @Override
    Guarded simplify(AtomValuation valuation, Set<LVar> bound) {
      List<Guarded> simplified = Lists.newArrayList();
      for (Guarded formula : formulas) {
        simplified.add(formula.simplify(valuation, bound));
      }
      return disj(simplified);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Disj && formulas.equals(((Disj) obj).formulas);
    }

    @Override
    public int hashCode() {
      return ~formulas.hashCode();
    }

    @Override
    public String toString() {
      return formulas.isEmpty() ? "F"
          : "(" + Joiner.on(" | ").join(formulas) + ")";
    }
  }

  /** A guarded quantification. */
  public static final class Quantified extends Guarded {
    private final Quantifier quantifier;
    private final ImmutableList<LVar> vars;
    private final ImmutableList<Atom> guards;
    private final Guarded body;

    Quantified(Quantifier quantifier, ImmutableList<LVar> vars,
        ImmutableList<Atom> guards, Guarded body) {
      this.quantifier = Preconditions.checkNotNull(quantifier);
      this.vars = vars;
      this.guards = guards;
      this.body = Preconditions.checkNotNull(body);
    }

    public Quantifier quantifier() {
      return quantifier;
    }

    public ImmutableList<LVar> vars() {
      return vars;
    }

    public ImmutableList<Atom> guards() {
      return guards;
    }

    public Guarded body() {
      return body;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitQuantified(this);
    }

    @Override
    public Guarded apply(Substitution subst) {
      Substitution inner = subst.without(ImmutableSet.copyOf(vars));
      ImmutableList.Builder<Atom> newGuards = ImmutableList.builder();
      for (Atom guard : guards) {
        newGuards.add(guard.apply(inner));
      }
      return new Quantified(quantifier, vars, newGuards.build(),
          body.apply(inner));
    }

    @Override
    void collectVariables(Set<LVar> all) {
      all.addAll(vars);
      for (Atom guard : guards) {
        guard.collectVariables(all);
      }
      body.collectVariables(all);
    }

    @Override
    void collectFreeVariables(Set<LVar> bound, Set<LVar> free) {
      Set<LVar> innerBound = Sets.union(bound, ImmutableSet.copyOf(vars));
      for (Atom guard : guards) {
        for (LVar var : guard.variables()) {
          if (!innerBound.contains(var)) {
            free.add(var);
          }
        }
      }
      body.collectFreeVariables(innerBound, free);
    }

    @Override
    Guarded renameBoundApart(FreshSupply supply) {
      Map<LVar, Term> renaming = Maps.newLinkedHashMap();
      ImmutableList.Builder<LVar> newVars = ImmutableList.builder();
      for (LVar var : vars) {
        LVar fresh = supply.fresh(var);
        renaming.put(var, Term.var(fresh));
        newVars.add(fresh);
      }
      Substitution rename = Substitution.create(renaming);
      ImmutableList.Builder<Atom> newGuards = ImmutableList.builder();
      for (Atom guard : guards) {
        newGuards.add(guard.apply(rename));
      }
      return new Quantified(quantifier, newVars.build(), newGuards.build(),
          body.apply(rename).renameBoundApart(supply));
    }

    @Override
    boolean noExistential() {
      return quantifier == Quantifier.ALL && body.noExistential();
    }

    @Override
    Guarded simplify(AtomValuation valuation, Set<LVar> bound) {
      Set<LVar> innerBound =
          Sets.union(bound, ImmutableSet.copyOf(vars)).immutableCopy();
      ImmutableList.Builder<Atom> remaining = ImmutableList.builder();
      for (Atom guard : guards) {
        switch (valuateFree(guard, valuation, innerBound)) {
          case FALSE:
            return quantifier == Quantifier.ALL ? TRUE : FALSE;
          case TRUE:
            break;
          default:
            remaining.add(guard);
        }
      }
      ImmutableList<Atom> newGuards = remaining.build();
      Guarded newBody = body.simplify(valuation, innerBound);
      if (quantifier == Quantifier.ALL && newBody.equals(TRUE)) {
        return TRUE;
      } else if (quantifier == Quantifier.EX && newBody.equals(FALSE)) {
        return FALSE;
      } else if (vars.isEmpty() && newGuards.isEmpty()) {
        return newBody;
      }
      return new Quantified(quantifier, vars, newGuards, newBody);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Quantified)) {
        return false;
      }
      Quantified other = (Quantified) obj;
      return quantifier == other.quantifier && vars.equals(other.vars)
          && guards.equals(other.guards) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
      return ((quantifier.hashCode() * 31 + vars.hashCode()) * 31
          + guards.hashCode()) * 31 + body.hashCode();
    }

    @Override
    public String toString() {
      String prefix = quantifier == Quantifier.ALL ? "All " : "Ex ";
      String connective = quantifier == Quantifier.ALL ? " ==> " : " & ";
      return "(" + prefix + Joiner.on(" ").join(vars) + ". ("
          + Joiner.on(" & ").join(guards) + ")" + connective + body + ")";
    }
  }

  private static ImmutableList<Guarded> applyAll(List<Guarded> formulas,
      Substitution subst) {
    ImmutableList.Builder<Guarded> result = ImmutableList.builder();
    for (Guarded formula : formulas) {
      result.add(formula.apply(subst));
    }
    return result.build();
  }

  private static ImmutableList<Guarded> renameAll(List<Guarded> formulas,
      FreshSupply supply) {
    ImmutableList.Builder<Guarded> result = ImmutableList.builder();
    for (Guarded formula : formulas) {
      result.add(formula.renameBoundApart(supply));
    }
    return result.build();
  }
}
