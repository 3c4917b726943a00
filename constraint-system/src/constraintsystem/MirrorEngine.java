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
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds the mirror of a dependency graph: the graph on the opposite side of
 * a diff proof that uses, for every node, a rule with the same name. If a
 * graph has no mirror, the two sides may be distinguishable.
 * <p>
 * Nodes of the fresh rule and of public constructions are kept as they are.
 * Every other node may be replaced by any variant of any opposite rule with
 * its name; the combinations are enumerated lazily and the first one whose
 * equality obligations are unifiable is returned.
 */
public final class MirrorEngine {
  private static final Logger LOGGER =
      Logger.getLogger(MirrorEngine.class.getName());

  static final String CONSTANT_PREFIX = "constVar";

  private MirrorEngine() {}

  /**
   * Returns the mirror of the graph of {@code sys}, which was built on
   * {@code side}, or absent if there is none.
   *
   * @throws IllegalStateException if a node's rule has no counterpart on the
   *         opposite side, or a protocol rule instance does not have exactly
   *         one original rule on {@code side}
   * @throws OracleException if an oracle fails
   */
  public static Optional<ConstraintSystem> getMirrorDG(DiffProofContext ctxt,
      Side side, ConstraintSystem sys) {
    Map<NodeId, Rule> fixed = Maps.newTreeMap();
    List<NodeId> ids = Lists.newArrayList();
    List<List<Rule>> alternatives = Lists.newArrayList();
    FreshSupply supply = FreshSupply.avoiding(sys.variables());
    for (Map.Entry<NodeId, Rule> entry : sys.nodes().entrySet()) {
      RuleName name = entry.getValue().name();
      if (name.isFreshRule() || name.isPubConstrRule()) {
        fixed.put(entry.getKey(), entry.getValue());
      } else {
        ids.add(entry.getKey());
        alternatives.add(
            oppositeInstances(ctxt, side, entry.getValue(), supply));
      }
    }
    LOGGER.fine("mirroring " + ids.size() + " nodes, keeping "
        + fixed.size());

    Iterator<ImmutableSortedMap<NodeId, Rule>> candidates =
        candidates(fixed, ids, alternatives);
    int tried = 0;
    while (candidates.hasNext()) {
      ImmutableSortedMap<NodeId, Rule> nodes = candidates.next();
      tried++;
      Optional<List<Equal<Fact>>> equalities =
          equalities(sys, nodes, fixed.keySet());
      if (!equalities.isPresent()) {
        continue;
      }
      ImmutableList<Substitution> unifiers = equalities.get().isEmpty()
          ? ImmutableList.of(Substitution.empty())
          : ctxt.oracle(side).unify(equalities.get());
      if (unifiers.isEmpty()) {
        continue;
      }
      LOGGER.fine("found mirror after " + tried + " candidates");
      return Optional.of(sys.withNodes(applyUnifier(nodes, unifiers.get(0))));
    }
    LOGGER.fine("no mirror among " + tried + " candidates");
    return Optional.absent();
  }

  /**
   * Lazily enumerates the node maps made of {@code fixed} plus one choice
   * from {@code alternatives.get(k)} for node {@code ids.get(k)}, for every
   * {@code k}. The first node varies slowest. Nothing is enumerated if some
   * node has no alternatives.
   */
  public static Iterator<ImmutableSortedMap<NodeId, Rule>> candidates(
      final Map<NodeId, Rule> fixed, final List<NodeId> ids,
      final List<? extends List<Rule>> alternatives) {
    return new AbstractIterator<ImmutableSortedMap<NodeId, Rule>>() {
      private int[] choice;

      @Override
      protected ImmutableSortedMap<NodeId, Rule> computeNext() {
        if (choice == null) {
          for (List<Rule> rules : alternatives) {
            if (rules.isEmpty()) {
              return endOfData();
            }
          }
          choice = new int[ids.size()];
        } else if (!advance()) {
          return endOfData();
        }
        ImmutableSortedMap.Builder<NodeId, Rule> result =
            ImmutableSortedMap.naturalOrder();
        result.putAll(fixed);
        for (int k = 0; k < ids.size(); k++) {
          result.put(ids.get(k), alternatives.get(k).get(choice[k]));
        }
        return result.build();
      }

      private boolean advance() {
        for (int k = ids.size() - 1; k >= 0; k--) {
          choice[k]++;
          if (choice[k] < alternatives.get(k).size()) {
            return true;
          }
          choice[k] = 0;
        }
        return false;
      }
    };
  }

  /**
   * The rules on the opposite side with the name of {@code rule}: protocol
   * rules by name, canonical instances for the AC constructions, and other
   * intruder rules by identity.
   */
  static ImmutableList<Rule> oppositeRules(DiffProofContext ctxt, Side side,
      Rule rule) {
    RuleName name = rule.name();
    if (IntruderRules.isACConstruction(name)) {
      int arity = rule.premises().size();
      return ImmutableList.of(IntruderRules.MULT.equals(name.name())
          ? IntruderRules.multRuleInstance(arity)
          : IntruderRules.unionRuleInstance(arity));
    }
    ImmutableList<Rule> result = rulesWithName(
        ctxt.rulesOnOtherSide(side), name);
    if (result.isEmpty()) {
      throw new IllegalStateException("No other rule found for "
          + (name.isProtocolRule() ? "protocol" : "intruder") + " rule "
          + name + " " + ctxt.rulesOnOtherSide(side));
    }
    return result;
  }

  /** The unique rule on {@code side} that {@code instance} instantiates. */
  static Rule originalRule(DiffProofContext ctxt, Side side, Rule instance) {
    Preconditions.checkArgument(instance.name().isProtocolRule(),
        "not a protocol rule: %s", instance);
    ImmutableList<Rule> rules =
        rulesWithName(ctxt.rulesOnSide(side), instance.name());
    if (rules.size() != 1) {
      throw new IllegalStateException(rules.size() + " rules found for "
          + "protocol rule " + instance.name() + " " + ctxt.rulesOnSide(side));
    }
    return rules.get(0);
  }

  private static ImmutableList<Rule> rulesWithName(List<Rule> rules,
      RuleName name) {
    ImmutableList.Builder<Rule> result = ImmutableList.builder();
    for (Rule rule : rules) {
      if (rule.name().equals(name)) {
        result.add(rule);
      }
    }
    return result.build();
  }

  /**
   * The new variables of the original rule of {@code instance}, mapped to
   * their value in {@code instance}.
   */
  static ImmutableMap<LVar, Term> newVariablesFixing(DiffProofContext ctxt,
      Side side, Rule instance) {
    Rule original = originalRule(ctxt, side, instance);
    Optional<Substitution> match =
        ctxt.oracle(side).match(instance.asTerm(), original.asTerm());
    if (!match.isPresent()) {
      throw new IllegalStateException(instance + " is not an instance of "
          + original);
    }
    ImmutableMap.Builder<LVar, Term> result = ImmutableMap.builder();
    for (LVar var : original.newVariables()) {
      Term value = match.get().get(var);
      result.put(var, value == null ? Term.var(var) : value);
    }
    return result.build();
  }

  /** All variants of all opposite rules instantiated for {@code rule}. */
  private static ImmutableList<Rule> oppositeInstances(DiffProofContext ctxt,
      Side side, Rule rule, FreshSupply supply) {
    EquationalOracle oracle = ctxt.oracle(side.opposite());
    Map<LVar, Term> fixing = rule.name().isProtocolRule()
        ? newVariablesFixing(ctxt, side, rule)
        : ImmutableMap.<LVar, Term>of();
    ImmutableList.Builder<Rule> result = ImmutableList.builder();
    for (Rule opposite : oppositeRules(ctxt, side, rule)) {
      Rule instance = opposite.instantiateFixing(fixing, supply);
      for (Substitution variant : oracle.variantsOf(instance)) {
        result.add(instance.apply(variant.freshToFree(supply)));
      }
    }
    return result.build();
  }

  /**
   * The equality obligations of a candidate node map: the facts connected by
   * edges and by edges implied by the less relation must be equal, trivial
   * open goals are instantiated with constants, and so are the new variables
   * of the replaced nodes. Absent if a trivial goal's premise is no longer
   * trivial in the candidate.
   */
  static Optional<List<Equal<Fact>>> equalities(ConstraintSystem sys,
      Map<NodeId, Rule> nodes, Set<NodeId> fixed) {
    List<Equal<Fact>> result = Lists.newArrayList();
    for (Edge edge : sys.edges()) {
      result.add(edgeEquality(sys, nodes, edge));
    }
    for (Edge edge : TemporalOrder.edgesFromLessRelation(sys)) {
      result.add(edgeEquality(sys, nodes, edge));
    }
    if (!addTrivialGoalEqualities(sys, nodes, result)) {
      return Optional.absent();
    }
    for (Map.Entry<NodeId, Rule> entry : nodes.entrySet()) {
      if (!fixed.contains(entry.getKey())) {
        addNewVariableEqualities(entry.getValue(), result);
      }
    }
    return Optional.of(result);
  }

  private static Equal<Fact> edgeEquality(ConstraintSystem sys,
      Map<NodeId, Rule> nodes, Edge edge) {
    return Equal.create(
        ruleAt(sys, nodes, edge.target().node())
            .premise(edge.target().index()),
        ruleAt(sys, nodes, edge.source().node())
            .conclusion(edge.source().index()));
  }

  private static Rule ruleAt(ConstraintSystem sys, Map<NodeId, Rule> nodes,
      NodeId node) {
    Rule rule = nodes.get(node);
    if (rule == null) {
      throw new IllegalStateException("node '" + node
          + "' does not exist in mirror of\n" + sys);
    }
    return rule;
  }

  /**
   * Adds, for each unsolved trivial goal, equations instantiating the
   * variables of the premises it stands for with constants.
   */
  private static boolean addTrivialGoalEqualities(ConstraintSystem sys,
      Map<NodeId, Rule> nodes, List<Equal<Fact>> result) {
    Set<LVar> nodeVars = Sets.newHashSet();
    for (Rule rule : nodes.values()) {
      rule.collectVariables(nodeVars);
    }
    TrivialGoalEqualities equalities =
        new TrivialGoalEqualities(sys, nodes, nodeVars, result);
    for (Goal goal : GoalRegistry.unsolvedTrivialGoals(sys)) {
      if (!goal.accept(equalities)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Adds the constant equations of one trivial goal, answering false when a
   * premise it stands for is not trivial.
   */
  private static final class TrivialGoalEqualities
      implements Goal.Visitor<Boolean> {
    private final ConstraintSystem sys;
    private final Map<NodeId, Rule> nodes;
    private final Set<LVar> nodeVars;
    private final List<Equal<Fact>> result;

    TrivialGoalEqualities(ConstraintSystem sys, Map<NodeId, Rule> nodes,
        Set<LVar> nodeVars, List<Equal<Fact>> result) {
      this.sys = sys;
      this.nodes = nodes;
      this.nodeVars = nodeVars;
      this.result = result;
    }

    @Override
    public Boolean visitPremise(PremiseGoal goal) {
      NodePrem premise = goal.premise();
      Fact fact = ruleAt(sys, nodes, premise.node()).premise(premise.index());
      Optional<ImmutableList<LVar>> vars = fact.trivialVariables();
      if (!vars.isPresent()) {
        return false;
      }
      for (LVar var : vars.get()) {
        result.add(constantEquality(fact, var, var));
      }
      return true;
    }

    @Override
    public Boolean visitAction(ActionGoal goal) {
      Fact renamed = renamedAvoiding(goal.fact(), nodeVars);
      ImmutableList<LVar> goalVars = renamed.trivialVariables().get();
      for (NodePrem premise : TemporalOrder.matchingPremises(sys,
          goal.fact(), TemporalOrder.lessSuccessors(sys, goal.node()))) {
        Fact fact = ruleAt(sys, nodes, premise.node())
            .premise(premise.index());
        Optional<ImmutableList<LVar>> vars = fact.trivialVariables();
        if (!vars.isPresent()) {
          return false;
        }
        int n = Math.min(vars.get().size(), goalVars.size());
        for (int i = 0; i < n; i++) {
          result.add(constantEquality(fact, vars.get().get(i),
              goalVars.get(i)));
        }
      }
      return true;
    }

    @Override
    public Boolean visitChain(ChainGoal goal) {
      throw notTrivial(goal);
    }

    @Override
    public Boolean visitSplit(SplitGoal goal) {
      throw notTrivial(goal);
    }

    @Override
    public Boolean visitDisj(DisjGoal goal) {
      throw notTrivial(goal);
    }

    private static IllegalStateException notTrivial(Goal goal) {
      return new IllegalStateException("not a trivial goal: " + goal);
    }
  }

  private static Fact renamedAvoiding(Fact fact, Set<LVar> avoid) {
    FreshSupply supply = FreshSupply.avoiding(avoid);
    Map<LVar, Term> renaming = Maps.newLinkedHashMap();
    for (LVar var : fact.variables()) {
      renaming.put(var, Term.var(supply.fresh(var)));
    }
    return fact.apply(Substitution.create(renaming));
  }

  private static void addNewVariableEqualities(Rule rule,
      List<Equal<Fact>> result) {
    for (LVar var : rule.newVariables()) {
      for (Fact fact
          : Iterables.concat(rule.conclusions(), rule.actions())) {
        if (fact.variables().contains(var)) {
          result.add(constantEquality(fact, var, var));
          break;
        }
      }
    }
  }

  /** {@code fact = fact[var := c]}, with {@code c} named after {@code name}. */
  private static Equal<Fact> constantEquality(Fact fact, LVar var,
      LVar name) {
    return Equal.create(fact,
        fact.apply(Substitution.of(var, constant(name))));
  }

  /**
   * The constant standing for variable {@code var}: a fresh name for fresh
   * variables, a public name otherwise, named after sort, name and index of
   * the variable. Two replaced nodes get distinct constants for their new
   * variables only because {@link Rule#instantiateFixing} draws every
   * instance's variables from the one supply shared across the candidate,
   * so no variable occurs in two instances.
   */
  static NameTerm constant(LVar var) {
    NameTerm.Kind kind = var.sort() == Sort.FRESH
        ? NameTerm.Kind.FRESH : NameTerm.Kind.PUB;
    return NameTerm.create(kind,
        CONSTANT_PREFIX + var.sort().code() + var.name() + var.index());
  }

  private static ImmutableSortedMap<NodeId, Rule> applyUnifier(
      ImmutableSortedMap<NodeId, Rule> nodes, Substitution unifier) {
    Set<LVar> vars = Sets.newHashSet();
    for (Rule rule : nodes.values()) {
      rule.collectVariables(vars);
    }
    Substitution free = unifier.freshToFree(FreshSupply.avoiding(vars));
    ImmutableSortedMap.Builder<NodeId, Rule> result =
        ImmutableSortedMap.naturalOrder();
    for (Map.Entry<NodeId, Rule> entry : nodes.entrySet()) {
      result.put(entry.getKey(), entry.getValue().apply(free));
    }
    return result.build();
  }
}
