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

import com.google.common.base.Function;
import com.google.common.base.Optional;
import com.google.common.base.Predicates;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Evaluates atoms, lemmas and axioms against a constraint system.
 * <p>
 * The valuation of atoms is three-valued and safe: {@link Valuation#TRUE}
 * ({@link Valuation#FALSE}) means the atom holds (fails) in every model of
 * the system, not just under its current substitution.
 */
public final class AxiomEvaluator {
  private static final Logger LOGGER =
      Logger.getLogger(AxiomEvaluator.class.getName());

  private AxiomEvaluator() {}

  /**
   * Returns the partial valuation of atoms in {@code sys}. The returned
   * valuation caches the temporal order of the system.
   */
  public static AtomValuation partialAtomValuation(final ProofContext ctxt,
      final ConstraintSystem sys) {
    final TemporalOrder order = TemporalOrder.create(sys);
    return new AtomValuation() {
      @Override
      public Valuation valuate(Atom atom) {
        return atom.accept(new AtomValuator(ctxt.oracle(), sys, order));
      }
    };
  }

  /** Valuates a single atom in {@code sys}. */
  public static Valuation partialAtomValuation(ProofContext ctxt,
      ConstraintSystem sys, Atom atom) {
    return partialAtomValuation(ctxt, sys).valuate(atom);
  }

  private static final class AtomValuator implements Atom.Visitor<Valuation> {
    private final EquationalOracle oracle;
    private final ConstraintSystem sys;
    private final TemporalOrder order;

    AtomValuator(EquationalOracle oracle, ConstraintSystem sys,
        TemporalOrder order) {
      this.oracle = oracle;
      this.sys = sys;
      this.order = order;
    }

    @Override
    public Valuation visitAction(Atom.Action atom) {
      Optional<NodeId> i = NodeId.fromTerm(atom.node());
      if (!i.isPresent() || !sys.nodes().containsKey(i.get())) {
        return Valuation.UNKNOWN;
      }
      ImmutableList<Fact> actions = sys.nodeRule(i.get()).actions();
      if (actions.contains(atom.fact())) {
        return Valuation.TRUE;
      }
      for (Fact action : actions) {
        if (oracle.unifiable(atom.fact(), action)) {
          return Valuation.UNKNOWN;
        }
      }
      return Valuation.FALSE;
    }

    @Override
    public Valuation visitLess(Atom.Less atom) {
      Optional<NodeId> i = NodeId.fromTerm(atom.smaller());
      Optional<NodeId> j = NodeId.fromTerm(atom.larger());
      if (!i.isPresent() || !j.isPresent()) {
        return Valuation.UNKNOWN;
      }
      if (i.get().equals(j.get()) || order.alwaysBefore(j.get(), i.get())) {
        return Valuation.FALSE;
      } else if (order.alwaysBefore(i.get(), j.get())) {
        return Valuation.TRUE;
      } else if (TemporalOrder.isLast(sys, i.get())
          && TemporalOrder.isInTrace(sys, j.get())) {
        return Valuation.FALSE;
      } else if (TemporalOrder.isLast(sys, j.get())
          && TemporalOrder.isInTrace(sys, i.get())
          && nonUnifiableNodes(i.get(), j.get())) {
        return Valuation.TRUE;
      }
      return Valuation.UNKNOWN;
    }

    @Override
    public Valuation visitEq(Atom.Eq atom) {
      if (atom.left().equals(atom.right())) {
        return Valuation.TRUE;
      } else if (!oracle.unifiable(atom.left(), atom.right())) {
        return Valuation.FALSE;
      }
      Optional<NodeId> i = NodeId.fromTerm(atom.left());
      Optional<NodeId> j = NodeId.fromTerm(atom.right());
      if (i.isPresent() && j.isPresent()) {
        if (order.alwaysBefore(i.get(), j.get())
            || order.alwaysBefore(j.get(), i.get())
            || nonUnifiableNodes(i.get(), j.get())) {
          return Valuation.FALSE;
        }
      }
      return Valuation.UNKNOWN;
    }

    @Override
    public Valuation visitLast(Atom.Last atom) {
      Optional<NodeId> i = NodeId.fromTerm(atom.node());
      if (!i.isPresent()) {
        return Valuation.UNKNOWN;
      }
      if (TemporalOrder.isLast(sys, i.get())) {
        return Valuation.TRUE;
      }
      for (NodeId after : order.nodesAfter(i.get())) {
        if (!after.equals(i.get()) && TemporalOrder.isInTrace(sys, after)) {
          return Valuation.FALSE;
        }
      }
      if (sys.lastNode().isPresent()
          && nonUnifiableNodes(i.get(), sys.lastNode().get())) {
        return Valuation.FALSE;
      }
      return Valuation.UNKNOWN;
    }

    /**
     * Whether both nodes are in the graph and their rule instances cannot be
     * unified, so that the two nodes denote different trace positions.
     */
    private boolean nonUnifiableNodes(NodeId i, NodeId j) {
      Rule left = sys.nodes().get(i);
      Rule right = sys.nodes().get(j);
      return left != null && right != null
          && !Equations.unifiableRules(oracle, left, right);
    }
  }

  /**
   * Returns the instances of the succedent of the universally guarded
   * formula {@code formula} implied by the actions of {@code sys}: one for
   * every way of matching the action and equation guards against the system.
   * Guards of other kinds stay in the instance as guards of an empty
   * quantification. Duplicates are removed. The result is empty for
   * formulas that are not universally guarded.
   *
   * @throws IllegalStateException if an equation guard has bound variables
   *         on both sides after matching the guards before it
   * @throws OracleException if the oracle fails
   */
  public static ImmutableList<Guarded> impliedFormulas(EquationalOracle oracle,
      ConstraintSystem sys, Guarded formula) {
    return ImmutableList.copyOf(
        ImmutableSet.copyOf(impliedFormulasIterator(oracle, sys, formula)));
  }

  /**
   * A lazy version of {@link #impliedFormulas}: instances are computed one at
   * a time, so callers that need only the first one stop the search early.
   * Duplicates are not removed.
   */
  public static Iterator<Guarded> impliedFormulasIterator(
      EquationalOracle oracle, ConstraintSystem sys, Guarded formula) {
    Optional<Guarded.Quantified> universal = asUniversal(formula);
    if (!universal.isPresent()) {
      return ImmutableList.<Guarded>of().iterator();
    }
    FreshSupply supply = FreshSupply.avoiding(
        Sets.union(sys.variables(), formula.variables()));
    Guarded.Quantified renamed =
        (Guarded.Quantified) universal.get().renameBoundVariables(supply);

    List<Atom> matched = Lists.newArrayList();
    List<Atom> equations = Lists.newArrayList();
    List<Atom> others = Lists.newArrayList();
    for (Atom guard : renamed.guards()) {
      switch (guard.accept(GUARD_KIND)) {
        case ACTION:
          matched.add(guard);
          break;
        case EQUATION:
          equations.add(guard);
          break;
        default:
          others.add(guard);
      }
    }
    matched.addAll(equations);
    final Guarded succedent = others.isEmpty() ? renamed.body()
        : Guarded.all(ImmutableList.<LVar>of(), others, renamed.body());

    Matcher matcher = new Matcher(oracle, GoalRegistry.allActions(sys),
        ImmutableSet.copyOf(renamed.vars()));
    return matcher.candidateSubstitutions(Substitution.empty(),
        ImmutableList.copyOf(matched))
        .transform(new Function<Substitution, Guarded>() {
          @Override
          public Guarded apply(Substitution subst) {
            return succedent.apply(subst);
          }
        })
        .iterator();
  }

  /** How a guard is used when deriving instances. */
  private enum GuardKind {
    ACTION, EQUATION, OTHER
  }

  private static final Atom.Visitor<GuardKind> GUARD_KIND =
      new Atom.Visitor<GuardKind>() {
        @Override
        public GuardKind visitAction(Atom.Action atom) {
          return GuardKind.ACTION;
        }

        @Override
        public GuardKind visitLess(Atom.Less atom) {
          return GuardKind.OTHER;
        }

        @Override
        public GuardKind visitEq(Atom.Eq atom) {
          return GuardKind.EQUATION;
        }

        @Override
        public GuardKind visitLast(Atom.Last atom) {
          return GuardKind.OTHER;
        }
      };

  private static final Atom.Visitor<Optional<Fact>> ACTION_FACT =
      new Atom.Visitor<Optional<Fact>>() {
        @Override
        public Optional<Fact> visitAction(Atom.Action atom) {
          return Optional.of(atom.fact());
        }

        @Override
        public Optional<Fact> visitLess(Atom.Less atom) {
          return Optional.absent();
        }

        @Override
        public Optional<Fact> visitEq(Atom.Eq atom) {
          return Optional.absent();
        }

        @Override
        public Optional<Fact> visitLast(Atom.Last atom) {
          return Optional.absent();
        }
      };

  /** Returns {@code formula} if it is universally quantified. */
  private static Optional<Guarded.Quantified> asUniversal(Guarded formula) {
    return formula.accept(new Guarded.Visitor<Optional<Guarded.Quantified>>() {
      @Override
      public Optional<Guarded.Quantified> visitAtom(Guarded.AtomFormula f) {
        return Optional.absent();
      }

      @Override
      public Optional<Guarded.Quantified> visitNot(Guarded.Not f) {
        return Optional.absent();
      }

      @Override
      public Optional<Guarded.Quantified> visitConj(Guarded.Conj f) {
        return Optional.absent();
      }

      @Override
      public Optional<Guarded.Quantified> visitDisj(Guarded.Disj f) {
        return Optional.absent();
      }

      @Override
      public Optional<Guarded.Quantified> visitQuantified(
          Guarded.Quantified f) {
        return f.quantifier() == Guarded.Quantifier.ALL
            ? Optional.of(f) : Optional.<Guarded.Quantified>absent();
      }
    });
  }

  /** Matches guards against system actions, binding only bound variables. */
  private static final class Matcher {
    private final EquationalOracle oracle;
    private final ImmutableList<Atom.Action> systemActions;
    private final ImmutableSet<LVar> boundVars;

    Matcher(EquationalOracle oracle, ImmutableList<Atom.Action> systemActions,
        ImmutableSet<LVar> boundVars) {
      this.oracle = oracle;
      this.systemActions = systemActions;
      this.boundVars = boundVars;
    }

    FluentIterable<Substitution> candidateSubstitutions(
        final Substitution subst, final ImmutableList<Atom> guards) {
      if (guards.isEmpty()) {
        return FluentIterable.from(ImmutableList.of(subst));
      }
      final ImmutableList<Atom> rest = guards.subList(1, guards.size());
      return guards.get(0).apply(subst).accept(
          new Atom.Visitor<FluentIterable<Substitution>>() {
            @Override
            public FluentIterable<Substitution> visitAction(
                Atom.Action guard) {
              final Term pattern = actionTerm(guard);
              return FluentIterable.from(systemActions).transformAndConcat(
                  new Function<Atom.Action, Iterable<Substitution>>() {
                    @Override
                    public Iterable<Substitution> apply(Atom.Action action) {
                      return extend(subst, actionTerm(action), pattern, rest);
                    }
                  });
            }

            @Override
            public FluentIterable<Substitution> visitEq(Atom.Eq eq) {
              if (!containsBound(eq.left())) {
                return extend(subst, eq.left(), eq.right(), rest);
              } else if (!containsBound(eq.right())) {
                return extend(subst, eq.right(), eq.left(), rest);
              }
              throw new IllegalStateException("impliedFormulas: equation "
                  + eq + " has bound variables on both sides; it is not"
                  + " guarded");
            }

            @Override
            public FluentIterable<Substitution> visitLess(Atom.Less guard) {
              throw notMatchable(guard);
            }

            @Override
            public FluentIterable<Substitution> visitLast(Atom.Last guard) {
              throw notMatchable(guard);
            }
          });
    }

    private IllegalStateException notMatchable(Atom guard) {
      return new IllegalStateException("cannot match guard " + guard);
    }

    private FluentIterable<Substitution> extend(Substitution subst, Term term,
        Term pattern, ImmutableList<Atom> rest) {
      Optional<Substitution> match = oracle.match(term, pattern);
      // Free variables of the formula must not be instantiated.
      if (!match.isPresent()
          || !boundVars.containsAll(match.get().domain())) {
        return FluentIterable.from(ImmutableList.<Substitution>of());
      }
      return candidateSubstitutions(match.get().compose(subst), rest);
    }

    private boolean containsBound(Term term) {
      for (LVar var : term.variables()) {
        if (boundVars.contains(var)) {
          return true;
        }
      }
      return false;
    }

    private static Term actionTerm(Atom.Action action) {
      return FunTerm.create("action", false,
          ImmutableList.of(action.node(), action.fact().asTerm()));
    }
  }

  /**
   * Keeps the axioms that mention an action unifiable with some action of a
   * node of {@code sys}; the others cannot be affected by the system.
   */
  public static ImmutableList<Guarded> filterAxioms(ProofContext ctxt,
      ConstraintSystem sys, List<Guarded> axioms) {
    List<Fact> nodeActions = Lists.newArrayList();
    for (Rule rule : sys.nodes().values()) {
      nodeActions.addAll(rule.actions());
    }
    ImmutableList.Builder<Guarded> result = ImmutableList.builder();
    for (Guarded axiom : axioms) {
      if (isRelevant(ctxt.oracle(), nodeActions, axiom)) {
        result.add(axiom);
      } else {
        LOGGER.fine("axiom not relevant: " + axiom);
      }
    }
    return result.build();
  }

  private static boolean isRelevant(final EquationalOracle oracle,
      final List<Fact> nodeActions, Guarded formula) {
    return formula.accept(new Guarded.Visitor<Boolean>() {
      @Override
      public Boolean visitAtom(Guarded.AtomFormula f) {
        return unifiableAtoms(ImmutableList.of(f.atom()));
      }

      @Override
      public Boolean visitNot(Guarded.Not f) {
        return f.formula().accept(this);
      }

      @Override
      public Boolean visitConj(Guarded.Conj f) {
        return anyRelevant(f.formulas());
      }

      @Override
      public Boolean visitDisj(Guarded.Disj f) {
        return anyRelevant(f.formulas());
      }

      @Override
      public Boolean visitQuantified(Guarded.Quantified f) {
        return f.body().accept(this) || unifiableAtoms(f.guards());
      }

      private boolean anyRelevant(List<Guarded> formulas) {
        for (Guarded formula : formulas) {
          if (formula.accept(this)) {
            return true;
          }
        }
        return false;
      }

      private boolean unifiableAtoms(List<Atom> atoms) {
        for (Atom atom : atoms) {
          Optional<Fact> fact = atom.accept(ACTION_FACT);
          if (!fact.isPresent()) {
            continue;
          }
          for (Fact action : nodeActions) {
            if (oracle.unifiable(fact.get(), action)) {
              return true;
            }
          }
        }
        return false;
      }
    });
  }

  /**
   * Decides whether the axioms hold in {@code sys}. Universally guarded axioms
   * are repeatedly replaced by their implied instances, if there are any or
   * the system is solved, and everything is simplified with the partial
   * atom valuation until nothing changes.
   *
   * @return TRUE if all axioms simplify to true, FALSE if one simplifies to
   *         false, UNKNOWN otherwise
   */
  public static Valuation doAxiomsHold(ProofContext ctxt,
      ConstraintSystem sys, List<Guarded> axioms, boolean isSolved) {
    AtomValuation valuation = partialAtomValuation(ctxt, sys);
    List<Guarded> current = ImmutableList.copyOf(axioms);
    while (true) {
      List<Guarded> next = Lists.newArrayList();
      for (Guarded axiom : current) {
        for (Guarded formula
            : impliedOrInitial(ctxt.oracle(), sys, axiom, isSolved)) {
          next.add(formula.simplify(valuation));
        }
      }
      if (next.equals(current)) {
        break;
      }
      current = next;
    }
    if (Iterables.all(current, Predicates.equalTo(Guarded.TRUE))) {
      return Valuation.TRUE;
    } else if (current.contains(Guarded.FALSE)) {
      LOGGER.fine("axioms violated: " + axioms);
      return Valuation.FALSE;
    }
    return Valuation.UNKNOWN;
  }

  private static List<Guarded> impliedOrInitial(EquationalOracle oracle,
      ConstraintSystem sys, Guarded formula, boolean isSolved) {
    Optional<Guarded.Quantified> universal = asUniversal(formula);
    if (universal.isPresent() && !isResidual(universal.get())) {
      ImmutableList<Guarded> implied = impliedFormulas(oracle, sys, formula);
      if (isSolved || !implied.isEmpty()) {
        return implied;
      }
    }
    return ImmutableList.of(formula);
  }

  /**
   * Whether {@code formula} binds no variables and has no guard to match.
   * Its only instance is the formula itself with its bound variables
   * renamed, so deriving it again would never reach a fixpoint.
   */
  private static boolean isResidual(Guarded.Quantified formula) {
    if (!formula.vars().isEmpty()) {
      return false;
    }
    for (Atom guard : formula.guards()) {
      if (guard.accept(GUARD_KIND) != GuardKind.OTHER) {
        return false;
      }
    }
    return true;
  }
}
