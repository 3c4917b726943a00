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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A constraint system: one proof state of the backtracking search. It
 * consists of a partial dependency graph (nodes labelled with rule instances,
 * edges from conclusions to premises), a temporal order, an optional last
 * node, the equation store, the guarded formulas still to be solved, solved
 * formulas and lemmas, and the goals with their status.
 * <p>
 * Constraint systems are immutable. Every operation that changes a system
 * returns a new one, so proof branches never share mutable state.
 */
public final class ConstraintSystem {
  private final ImmutableSortedMap<NodeId, Rule> nodes;
  private final ImmutableSortedSet<Edge> edges;
  private final ImmutableSortedSet<LessAtom> lessAtoms;
  private final Optional<NodeId> lastNode;
  private final EquationStore equationStore;
  private final ImmutableSet<Guarded> formulas;
  private final ImmutableSet<Guarded> solvedFormulas;
  private final ImmutableSet<Guarded> lemmas;
  private final ImmutableMap<Goal, GoalStatus> goals;
  private final long nextGoalNr;
  private final CaseDistKind caseDistKind;
  private final boolean isDiff;

  private ConstraintSystem(Builder builder) {
    this.nodes = ImmutableSortedMap.copyOf(builder.nodes);
    this.edges = ImmutableSortedSet.copyOf(builder.edges);
    this.lessAtoms = ImmutableSortedSet.copyOf(builder.lessAtoms);
    this.lastNode = builder.lastNode;
    this.equationStore = builder.equationStore;
    this.formulas = ImmutableSet.copyOf(builder.formulas);
    this.solvedFormulas = ImmutableSet.copyOf(builder.solvedFormulas);
    this.lemmas = ImmutableSet.copyOf(builder.lemmas);
    this.goals = ImmutableMap.copyOf(builder.goals);
    this.nextGoalNr = builder.nextGoalNr;
    this.caseDistKind = builder.caseDistKind;
    this.isDiff = builder.isDiff;
    Preconditions.checkArgument(Sets.intersection(formulas, solvedFormulas)
        .isEmpty(), "formulas both solved and unsolved: %s",
        Sets.intersection(formulas, solvedFormulas));
    for (Map.Entry<Goal, GoalStatus> entry : goals.entrySet()) {
      Preconditions.checkArgument(entry.getValue().nr() < nextGoalNr,
          "goal %s has number %s, but the next number is %s",
          entry.getKey(), entry.getValue().nr(), nextGoalNr);
    }
  }

  /** The empty constraint system, which is logically equivalent to true. */
  public static ConstraintSystem empty(CaseDistKind kind, boolean isDiff) {
    return new Builder(kind, isDiff).build();
  }

  /**
   * Returns the constraint system that must be solved to decide
   * {@code formula}. Safety axioms become lemmas. All other axioms are
   * conjoined to the formula, as they make the set of traces non-prefix
   * closed. For {@link TraceQuantifier#EXISTS_NO_TRACE} the formula is
   * negated first.
   */
  public static ConstraintSystem formulaToSystem(List<Guarded> axioms,
      CaseDistKind kind, TraceQuantifier quantifier, boolean isDiff,
      Guarded formula) {
    List<Guarded> safetyAxioms = Lists.newArrayList();
    List<Guarded> conjuncts = Lists.newArrayList();
    conjuncts.add(quantifier == TraceQuantifier.EXISTS_SOME_TRACE
        ? formula : Guarded.not(formula));
    for (Guarded axiom : axioms) {
      if (axiom.isSafety()) {
        safetyAxioms.add(axiom);
      } else {
        conjuncts.add(axiom);
      }
    }
    return empty(kind, isDiff).toBuilder()
        .formulas(ImmutableSet.of(Guarded.conj(conjuncts)))
        .build()
        .insertLemmas(safetyAxioms);
  }

  public static Builder builder(CaseDistKind kind, boolean isDiff) {
    return new Builder(kind, isDiff);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public ImmutableSortedMap<NodeId, Rule> nodes() {
    return nodes;
  }

  public ImmutableSortedSet<Edge> edges() {
    return edges;
  }

  public ImmutableSortedSet<LessAtom> lessAtoms() {
    return lessAtoms;
  }

  public Optional<NodeId> lastNode() {
    return lastNode;
  }

  public EquationStore equationStore() {
    return equationStore;
  }

  /** The free substitution of the equation store. */
  public Substitution substitution() {
    return equationStore.substitution();
  }

  /** The formulas that still have to be solved. */
  public ImmutableSet<Guarded> formulas() {
    return formulas;
  }

  public ImmutableSet<Guarded> solvedFormulas() {
    return solvedFormulas;
  }

  public ImmutableSet<Guarded> lemmas() {
    return lemmas;
  }

  public ImmutableMap<Goal, GoalStatus> goals() {
    return goals;
  }

  public long nextGoalNr() {
    return nextGoalNr;
  }

  public CaseDistKind caseDistKind() {
    return caseDistKind;
  }

  public boolean isDiff() {
    return isDiff;
  }

  /**
   * Returns the rule instance labelling {@code node}.
   *
   * @throws IllegalStateException if there is no such node
   */
  public Rule nodeRule(NodeId node) {
    Rule rule = nodes.get(node);
    if (rule == null) {
      throw new IllegalStateException("nodeRule: node '" + node
          + "' does not exist in constraint system\n" + this);
    }
    return rule;
  }

  public Optional<Rule> nodeRuleSafe(NodeId node) {
    return Optional.fromNullable(nodes.get(node));
  }

  /** The fact of a premise that is known to exist. */
  public Fact premiseFact(NodePrem premise) {
    return nodeRule(premise.node()).premise(premise.index());
  }

  /** The fact of a conclusion that is known to exist. */
  public Fact conclusionFact(NodeConc conclusion) {
    return nodeRule(conclusion.node()).conclusion(conclusion.index());
  }

  public Optional<Fact> resolvePremiseFact(NodePrem premise) {
    Rule rule = nodes.get(premise.node());
    if (rule == null || premise.index() >= rule.premises().size()) {
      return Optional.absent();
    }
    return Optional.of(rule.premise(premise.index()));
  }

  public Optional<Fact> resolveConclusionFact(NodeConc conclusion) {
    Rule rule = nodes.get(conclusion.node());
    if (rule == null || conclusion.index() >= rule.conclusions().size()) {
      return Optional.absent();
    }
    return Optional.of(rule.conclusion(conclusion.index()));
  }

  public ConstraintSystem withNode(NodeId node, Rule rule) {
    Builder builder = toBuilder();
    builder.nodes.put(node, rule);
    return builder.build();
  }

  public ConstraintSystem withNodes(Map<NodeId, Rule> newNodes) {
    return toBuilder().nodes(newNodes).build();
  }

  public ConstraintSystem withEdge(Edge edge) {
    Builder builder = toBuilder();
    builder.edges.add(edge);
    return builder.build();
  }

  public ConstraintSystem withoutEdge(Edge edge) {
    Builder builder = toBuilder();
    builder.edges.remove(edge);
    return builder.build();
  }

  public ConstraintSystem withLessAtom(LessAtom atom) {
    Builder builder = toBuilder();
    builder.lessAtoms.add(atom);
    return builder.build();
  }

  public ConstraintSystem withLastNode(NodeId node) {
    Preconditions.checkState(
        !lastNode.isPresent() || lastNode.get().equals(node),
        "%s is already the last node, cannot make %s last", lastNode, node);
    return toBuilder().lastNode(Optional.of(node)).build();
  }

  public ConstraintSystem withEquationStore(EquationStore store) {
    return toBuilder().equationStore(store).build();
  }

  /** Adds an unsolved formula. Formulas solved already are not added again. */
  public ConstraintSystem withFormula(Guarded formula) {
    if (solvedFormulas.contains(formula)) {
      return this;
    }
    Builder builder = toBuilder();
    builder.formulas.add(formula);
    return builder.build();
  }

  /** Moves {@code formula} from the unsolved to the solved formulas. */
  public ConstraintSystem markFormulaSolved(Guarded formula) {
    Preconditions.checkArgument(formulas.contains(formula),
        "not an unsolved formula: %s", formula);
    Builder builder = toBuilder();
    builder.formulas.remove(formula);
    builder.solvedFormulas.add(formula);
    return builder.build();
  }

  /** Adds a lemma; conjunctions are split into their conjuncts. */
  public ConstraintSystem insertLemma(Guarded lemma) {
    Builder builder = toBuilder();
    addLemma(lemma, builder.lemmas);
    return builder.build();
  }

  public ConstraintSystem insertLemmas(Collection<Guarded> newLemmas) {
    Builder builder = toBuilder();
    for (Guarded lemma : newLemmas) {
      addLemma(lemma, builder.lemmas);
    }
    return builder.build();
  }

  private static void addLemma(final Guarded lemma,
      final Set<Guarded> lemmas) {
    lemma.accept(new Guarded.Visitor<Void>() {
      @Override
      public Void visitAtom(Guarded.AtomFormula formula) {
        lemmas.add(lemma);
        return null;
      }

      @Override
      public Void visitNot(Guarded.Not formula) {
        lemmas.add(lemma);
        return null;
      }

      @Override
      public Void visitConj(Guarded.Conj formula) {
        for (Guarded conjunct : formula.formulas()) {
          addLemma(conjunct, lemmas);
        }
        return null;
      }

      @Override
      public Void visitDisj(Guarded.Disj formula) {
        lemmas.add(lemma);
        return null;
      }

      @Override
      public Void visitQuantified(Guarded.Quantified formula) {
        lemmas.add(lemma);
        return null;
      }
    });
  }


  /**
   * Adds {@code goal} as an open goal with the next creation number. If the
   * goal is present already, the loop-breaker flags are combined and the
   * original number is kept.
   */
  public ConstraintSystem insertGoal(Goal goal, boolean loopBreaker) {
    Builder builder = toBuilder();
    GoalStatus status = GoalStatus.create(false, nextGoalNr, loopBreaker);
    GoalStatus old = builder.goals.get(goal);
    builder.goals.put(goal, old == null ? status : old.combine(status));
    builder.nextGoalNr = nextGoalNr + 1;
    return builder.build();
  }

  /** Marks {@code goal} as solved; it stays in the goal map. */
  public ConstraintSystem markGoalSolved(Goal goal) {
    GoalStatus status = goals.get(goal);
    Preconditions.checkArgument(status != null, "unknown goal: %s", goal);
    Builder builder = toBuilder();
    builder.goals.put(goal, status.markSolved());
    return builder.build();
  }

  /**
   * Applies {@code subst} to the rule instances, goals and formulas. Goals
   * that become equal are merged with {@link GoalStatus#combine}. Node ids
   * are not renamed.
   */
  public ConstraintSystem apply(Substitution subst) {
    Builder builder = toBuilder();
    builder.nodes.clear();
    for (Map.Entry<NodeId, Rule> entry : nodes.entrySet()) {
      builder.nodes.put(entry.getKey(), entry.getValue().apply(subst));
    }
    builder.goals.clear();
    for (Map.Entry<Goal, GoalStatus> entry : goals.entrySet()) {
      Goal goal = entry.getKey().apply(subst);
      GoalStatus old = builder.goals.get(goal);
      builder.goals.put(goal,
          old == null ? entry.getValue() : old.combine(entry.getValue()));
    }
    builder.formulas = applyAll(formulas, subst);
    builder.solvedFormulas = applyAll(solvedFormulas, subst);
    builder.lemmas = applyAll(lemmas, subst);
    builder.formulas.removeAll(builder.solvedFormulas);
    return builder.build();
  }

  private static Set<Guarded> applyAll(Set<Guarded> formulas,
      Substitution subst) {
    Set<Guarded> result = Sets.newLinkedHashSet();
    for (Guarded formula : formulas) {
      result.add(formula.apply(subst));
    }
    return result;
  }

  /** All variables occurring anywhere in this system. */
  public ImmutableSet<LVar> variables() {
    Set<LVar> vars = Sets.newLinkedHashSet();
    for (Map.Entry<NodeId, Rule> entry : nodes.entrySet()) {
      vars.add(entry.getKey().asVar());
      entry.getValue().collectVariables(vars);
    }
    for (LessAtom atom : lessAtoms) {
      vars.add(atom.smaller().asVar());
      vars.add(atom.larger().asVar());
    }
    if (lastNode.isPresent()) {
      vars.add(lastNode.get().asVar());
    }
    for (Goal goal : goals.keySet()) {
      goal.collectVariables(vars);
    }
    for (Guarded formula
        : Sets.union(Sets.union(formulas, solvedFormulas), lemmas)) {
      formula.collectVariables(vars);
    }
    vars.addAll(substitution().domain());
    vars.addAll(substitution().rangeVariables());
    for (ImmutableList<Substitution> disjunction
        : equationStore.disjunctions().values()) {
      for (Substitution subst : disjunction) {
        vars.addAll(subst.domain());
      }
    }
    return ImmutableSet.copyOf(vars);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ConstraintSystem)) {
      return false;
    }
    ConstraintSystem other = (ConstraintSystem) obj;
    return nodes.equals(other.nodes)
        && edges.equals(other.edges)
        && lessAtoms.equals(other.lessAtoms)
        && lastNode.equals(other.lastNode)
        && equationStore.equals(other.equationStore)
        && formulas.equals(other.formulas)
        && solvedFormulas.equals(other.solvedFormulas)
        && lemmas.equals(other.lemmas)
        && goals.equals(other.goals)
        && nextGoalNr == other.nextGoalNr
        && caseDistKind == other.caseDistKind
        && isDiff == other.isDiff;
  }

  @Override
  public int hashCode() {
    int result = nodes.hashCode();
    result = result * 31 + edges.hashCode();
    result = result * 31 + lessAtoms.hashCode();
    result = result * 31 + goals.hashCode();
    result = result * 31 + formulas.hashCode();
    return result * 31 + (int) nextGoalNr;
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder();
    for (Map.Entry<NodeId, Rule> entry : nodes.entrySet()) {
      result.append("  ").append(entry.getKey()).append(" : ")
          .append(entry.getValue()).append('\n');
    }
    for (Edge edge : edges) {
      result.append("  ").append(edge).append('\n');
    }
    for (LessAtom atom : lessAtoms) {
      result.append("  ").append(atom).append('\n');
    }
    if (lastNode.isPresent()) {
      result.append("  last(").append(lastNode.get()).append(")\n");
    }
    result.append("  ").append(equationStore.toString().replace("\n", "\n  "))
        .append('\n');
    for (Guarded formula : formulas) {
      result.append("  formula: ").append(formula).append('\n');
    }
    for (Guarded formula : solvedFormulas) {
      result.append("  solved: ").append(formula).append('\n');
    }
    for (Guarded lemma : lemmas) {
      result.append("  lemma: ").append(lemma).append('\n');
    }
    for (Map.Entry<Goal, GoalStatus> entry : goals.entrySet()) {
      result.append("  goal: ").append(entry.getKey()).append(" -- ")
          .append(entry.getValue()).append('\n');
    }
    result.append("  case distinctions: ").append(caseDistKind)
        .append(isDiff ? ", diff" : "");
    return result.toString();
  }

  /**
   * Assembles a constraint system field by field. Used for bulk changes and
   * when decoding persisted systems.
   */
  public static final class Builder {
    private Map<NodeId, Rule> nodes;
    private Set<Edge> edges;
    private Set<LessAtom> lessAtoms;
    private Optional<NodeId> lastNode;
    private EquationStore equationStore;
    private Set<Guarded> formulas;
    private Set<Guarded> solvedFormulas;
    private Set<Guarded> lemmas;
    private Map<Goal, GoalStatus> goals;
    private long nextGoalNr;
    private final CaseDistKind caseDistKind;
    private final boolean isDiff;

    private Builder(CaseDistKind caseDistKind, boolean isDiff) {
      this.nodes = Maps.newTreeMap();
      this.edges = Sets.newTreeSet();
      this.lessAtoms = Sets.newTreeSet();
      this.lastNode = Optional.absent();
      this.equationStore = EquationStore.empty();
      this.formulas = Sets.newLinkedHashSet();
      this.solvedFormulas = Sets.newLinkedHashSet();
      this.lemmas = Sets.newLinkedHashSet();
      this.goals = Maps.newLinkedHashMap();
      this.nextGoalNr = 0;
      this.caseDistKind = Preconditions.checkNotNull(caseDistKind);
      this.isDiff = isDiff;
    }

    private Builder(ConstraintSystem sys) {
      this.nodes = Maps.newTreeMap(sys.nodes);
      this.edges = Sets.newTreeSet(sys.edges);
      this.lessAtoms = Sets.newTreeSet(sys.lessAtoms);
      this.lastNode = sys.lastNode;
      this.equationStore = sys.equationStore;
      this.formulas = Sets.newLinkedHashSet(sys.formulas);
      this.solvedFormulas = Sets.newLinkedHashSet(sys.solvedFormulas);
      this.lemmas = Sets.newLinkedHashSet(sys.lemmas);
      this.goals = Maps.newLinkedHashMap(sys.goals);
      this.nextGoalNr = sys.nextGoalNr;
      this.caseDistKind = sys.caseDistKind;
      this.isDiff = sys.isDiff;
    }

    public Builder nodes(Map<NodeId, Rule> newNodes) {
      this.nodes = Maps.newTreeMap();
      this.nodes.putAll(newNodes);
      return this;
    }

    public Builder edges(Collection<Edge> newEdges) {
      this.edges = Sets.newTreeSet(newEdges);
      return this;
    }

    public Builder lessAtoms(Collection<LessAtom> newLessAtoms) {
      this.lessAtoms = Sets.newTreeSet(newLessAtoms);
      return this;
    }

    public Builder lastNode(Optional<NodeId> newLastNode) {
      this.lastNode = Preconditions.checkNotNull(newLastNode);
      return this;
    }

    public Builder equationStore(EquationStore store) {
      this.equationStore = Preconditions.checkNotNull(store);
      return this;
    }

    public Builder formulas(Collection<Guarded> newFormulas) {
      this.formulas = Sets.newLinkedHashSet(newFormulas);
      return this;
    }

    public Builder solvedFormulas(Collection<Guarded> newSolvedFormulas) {
      this.solvedFormulas = Sets.newLinkedHashSet(newSolvedFormulas);
      return this;
    }

    public Builder lemmas(Collection<Guarded> newLemmas) {
      this.lemmas = Sets.newLinkedHashSet(newLemmas);
      return this;
    }

    public Builder goals(Map<Goal, GoalStatus> newGoals) {
      this.goals = Maps.newLinkedHashMap(newGoals);
      return this;
    }

    public Builder nextGoalNr(long nr) {
      this.nextGoalNr = nr;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a formula is both solved and
     *         unsolved, or a goal number is not below the next goal number
     */
    public ConstraintSystem build() {
      return new ConstraintSystem(this);
    }
  }
}
