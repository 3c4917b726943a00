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
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An oracle for the free term algebra: two terms are equal iff they are
 * syntactically equal. AC symbols are treated like any other symbol, so this
 * oracle is only complete for theories without equations. It is
 * deterministic and stateless, hence safe to share between threads.
 * <p>
 * Sorts are respected: a fresh (public) variable only unifies with fresh
 * (public) names and variables, a message variable with any message, and
 * temporal variables only with temporal variables.
 */
public final class SyntacticOracle implements EquationalOracle {
  private static final SyntacticOracle INSTANCE = new SyntacticOracle();

  private SyntacticOracle() {}

  public static SyntacticOracle create() {
    return INSTANCE;
  }

  @Override
  public boolean unifiable(Term left, Term right) {
    return unifyInto(left, right, Maps.<LVar, Term>newHashMap());
  }

  @Override
  public boolean unifiable(Fact left, Fact right) {
    return left.tag().equals(right.tag())
        && unifiable(left.asTerm(), right.asTerm());
  }

  @Override
  public ImmutableList<Substitution> variantsOf(Rule rule) {
    return ImmutableList.of(Substitution.empty());
  }

  @Override
  public Optional<Substitution> match(Term term, Term pattern) {
    Map<LVar, Term> bindings = Maps.newLinkedHashMap();
    if (!matchInto(term, pattern, bindings)) {
      return Optional.absent();
    }
    return Optional.of(Substitution.create(bindings));
  }

  @Override
  public ImmutableList<Substitution> unify(List<Equal<Fact>> equations) {
    Map<LVar, Term> bindings = Maps.newHashMap();
    Set<LVar> problemVars = Sets.newTreeSet();
    for (Equal<Fact> equation : equations) {
      if (!equation.left().tag().equals(equation.right().tag())) {
        return ImmutableList.of();
      }
      equation.left().collectVariables(problemVars);
      equation.right().collectVariables(problemVars);
      if (!unifyInto(equation.left().asTerm(), equation.right().asTerm(),
          bindings)) {
        return ImmutableList.of();
      }
    }
    // Express the most general unifier over fresh variables.
    FreshSupply supply = FreshSupply.avoiding(problemVars);
    Map<LVar, Term> renaming = Maps.newHashMap();
    for (LVar var : problemVars) {
      renaming.put(var, Term.var(supply.fresh(var)));
    }
    Substitution rename = Substitution.create(renaming);
    Map<LVar, Term> unifier = Maps.newLinkedHashMap();
    for (LVar var : problemVars) {
      unifier.put(var, resolve(Term.var(var), bindings).apply(rename));
    }
    return ImmutableList.of(Substitution.create(unifier));
  }

  private static Term walk(Term term, Map<LVar, Term> bindings) {
    while (term instanceof VarTerm) {
      Term bound = bindings.get(((VarTerm) term).var());
      if (bound == null) {
        return term;
      }
      term = bound;
    }
    return term;
  }

  private static Term resolve(Term term, Map<LVar, Term> bindings) {
    term = walk(term, bindings);
    if (term instanceof FunTerm) {
      FunTerm fun = (FunTerm) term;
      ImmutableList.Builder<Term> args = ImmutableList.builder();
      for (Term arg : fun.args()) {
        args.add(resolve(arg, bindings));
      }
      return FunTerm.create(fun.symbol(), fun.isAC(), args.build());
    }
    return term;
  }

  private static Sort sortOf(Term term) {
    if (term instanceof VarTerm) {
      return ((VarTerm) term).var().sort();
    } else if (term instanceof NameTerm) {
      return ((NameTerm) term).kind() == NameTerm.Kind.FRESH
          ? Sort.FRESH : Sort.PUB;
    }
    return Sort.MSG;
  }

  /** Whether a term of sort {@code sub} may replace a {@code sup} variable. */
  private static boolean isSubsort(Sort sub, Sort sup) {
    return sub == sup
        || (sup == Sort.MSG && (sub == Sort.FRESH || sub == Sort.PUB));
  }

  private static boolean unifyInto(Term left, Term right,
      Map<LVar, Term> bindings) {
    Term a = walk(left, bindings);
    Term b = walk(right, bindings);
    if (a.equals(b)) {
      return true;
    }
    if (a instanceof VarTerm && b instanceof VarTerm) {
      LVar x = ((VarTerm) a).var();
      LVar y = ((VarTerm) b).var();
      if (isSubsort(y.sort(), x.sort())) {
        bindings.put(x, b);
        return true;
      } else if (isSubsort(x.sort(), y.sort())) {
        bindings.put(y, a);
        return true;
      }
      return false;
    }
    if (a instanceof VarTerm) {
      return bind(((VarTerm) a).var(), b, bindings);
    }
    if (b instanceof VarTerm) {
      return bind(((VarTerm) b).var(), a, bindings);
    }
    if (a instanceof FunTerm && b instanceof FunTerm) {
      FunTerm f = (FunTerm) a;
      FunTerm g = (FunTerm) b;
      if (!f.symbol().equals(g.symbol()) || f.isAC() != g.isAC()
          || f.args().size() != g.args().size()) {
        return false;
      }
      for (int i = 0; i < f.args().size(); i++) {
        if (!unifyInto(f.args().get(i), g.args().get(i), bindings)) {
          return false;
        }
      }
      return true;
    }
    // Two distinct names, or a name and an application.
    return false;
  }

  private static boolean bind(LVar var, Term term, Map<LVar, Term> bindings) {
    if (!isSubsort(sortOf(term), var.sort())
        || occurs(var, term, bindings)) {
      return false;
    }
    bindings.put(var, term);
    return true;
  }

  private static boolean occurs(LVar var, Term term,
      Map<LVar, Term> bindings) {
    term = walk(term, bindings);
    if (term instanceof VarTerm) {
      return ((VarTerm) term).var().equals(var);
    } else if (term instanceof FunTerm) {
      for (Term arg : ((FunTerm) term).args()) {
        if (occurs(var, arg, bindings)) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean matchInto(Term term, Term pattern,
      Map<LVar, Term> bindings) {
    if (pattern instanceof VarTerm) {
      LVar var = ((VarTerm) pattern).var();
      if (!isSubsort(sortOf(term), var.sort())) {
        return false;
      }
      Term bound = bindings.get(var);
      if (bound == null) {
        bindings.put(var, term);
        return true;
      }
      return bound.equals(term);
    } else if (pattern instanceof NameTerm) {
      return pattern.equals(term);
    }
    if (!(term instanceof FunTerm)) {
      return false;
    }
    FunTerm f = (FunTerm) term;
    FunTerm p = (FunTerm) pattern;
    if (!f.symbol().equals(p.symbol()) || f.isAC() != p.isAC()
        || f.args().size() != p.args().size()) {
      return false;
    }
    for (int i = 0; i < f.args().size(); i++) {
      if (!matchInto(f.args().get(i), p.args().get(i), bindings)) {
        return false;
      }
    }
    return true;
  }
}
