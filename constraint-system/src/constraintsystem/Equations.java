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
import com.google.common.collect.Lists;

import java.util.List;
import java.util.logging.Logger;

/**
 * Turns the answers of an {@link EquationalOracle} into changes of a
 * constraint system: a single unifier is applied and recorded in the free
 * substitution, several unifiers become a case split.
 */
public final class Equations {
  private static final Logger LOGGER =
      Logger.getLogger(Equations.class.getName());

  /** The oracle unifies facts only; term equations are wrapped in this tag. */
  private static final FactTag TERM_EQUATION =
      FactTag.proto("TermEquation", 1, false);

  private Equations() {}

  /**
   * Adds the equations {@code equations} to {@code sys}.
   *
   * @return the new system, or absent if the equations are contradictory
   * @throws OracleException if the oracle fails
   */
  public static Optional<ConstraintSystem> addTermEquations(
      ProofContext ctxt, ConstraintSystem sys, List<Equal<Term>> equations) {
    List<Equal<Fact>> factEquations = Lists.newArrayList();
    for (Equal<Term> equation : equations) {
      factEquations.add(Equal.create(
          Fact.create(TERM_EQUATION, equation.left()),
          Fact.create(TERM_EQUATION, equation.right())));
    }
    return addFactEquations(ctxt, sys, factEquations);
  }

  /**
   * Adds the equations {@code equations} between facts to {@code sys}.
   *
   * @return the new system, or absent if the equations are contradictory
   * @throws OracleException if the oracle fails
   */
  public static Optional<ConstraintSystem> addFactEquations(
      ProofContext ctxt, ConstraintSystem sys, List<Equal<Fact>> equations) {
    ImmutableList<Substitution> unifiers = ctxt.oracle().unify(equations);
    if (unifiers.isEmpty()) {
      LOGGER.fine("contradictory equations: " + equations);
      return Optional.absent();
    } else if (unifiers.size() == 1) {
      return Optional.of(applyUnifier(sys, unifiers.get(0)));
    }
    EquationStore store = sys.equationStore();
    SplitId id = store.peekSplitId();
    LOGGER.fine(unifiers.size() + " unifiers, new case split " + id);
    return Optional.of(sys.withEquationStore(store.withDisjunction(unifiers))
        .insertGoal(SplitGoal.create(id), false));
  }

  /**
   * Returns one system per disjunct of the case split {@code id}, in the
   * order of the disjuncts. The split goal, if present, is solved in each.
   *
   * @throws IllegalArgumentException if there is no such case split
   */
  public static ImmutableList<ConstraintSystem> splitCases(
      ConstraintSystem sys, SplitId id) {
    Optional<ImmutableList<Substitution>> cases =
        sys.equationStore().casesAt(id);
    if (!cases.isPresent()) {
      throw new IllegalArgumentException("no case split " + id
          + " in constraint system\n" + sys);
    }
    ConstraintSystem base = sys.withEquationStore(
        sys.equationStore().withoutDisjunction(id));
    Goal goal = SplitGoal.create(id);
    if (base.goals().containsKey(goal)) {
      base = base.markGoalSolved(goal);
    }
    ImmutableList.Builder<ConstraintSystem> result = ImmutableList.builder();
    for (Substitution subst : cases.get()) {
      result.add(applyUnifier(base, subst));
    }
    return result.build();
  }

  /**
   * Whether two rule instances are unifiable: they must have the same name
   * and the same number of facts, and all their facts must be unifiable
   * simultaneously.
   */
  public static boolean unifiableRules(EquationalOracle oracle, Rule left,
      Rule right) {
    if (!left.name().equals(right.name())
        || left.premises().size() != right.premises().size()
        || left.conclusions().size() != right.conclusions().size()
        || left.actions().size() != right.actions().size()) {
      return false;
    }
    List<Equal<Fact>> equations = Lists.newArrayList();
    ImmutableList<Fact> leftFacts = left.facts();
    ImmutableList<Fact> rightFacts = right.facts();
    for (int i = 0; i < leftFacts.size(); i++) {
      equations.add(Equal.create(leftFacts.get(i), rightFacts.get(i)));
    }
    return !oracle.unify(equations).isEmpty();
  }

  /** Applies a fresh-variable unifier and records it in the substitution. */
  private static ConstraintSystem applyUnifier(ConstraintSystem sys,
      Substitution unifier) {
    Substitution free = unifier.freshToFree(
        FreshSupply.avoiding(sys.variables()));
    EquationStore store = sys.equationStore();
    return sys.apply(free).withEquationStore(
        store.withSubstitution(free.compose(store.substitution())));
  }
}
