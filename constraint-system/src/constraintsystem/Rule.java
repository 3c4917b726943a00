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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A multiset rewriting rule {@code [premises] --[actions]-> [conclusions]}.
 * The same class represents rules of a theory and their instances labelling
 * the nodes of a dependency graph.
 */
public final class Rule {
  private final RuleName name;
  private final ImmutableList<Fact> premises;
  private final ImmutableList<Fact> conclusions;
  private final ImmutableList<Fact> actions;

  private Rule(RuleName name, ImmutableList<Fact> premises,
      ImmutableList<Fact> conclusions, ImmutableList<Fact> actions) {
    this.name = Preconditions.checkNotNull(name);
    this.premises = premises;
    this.conclusions = conclusions;
    this.actions = actions;
  }

  public static Rule create(RuleName name, List<Fact> premises,
      List<Fact> conclusions, List<Fact> actions) {
    return new Rule(name, ImmutableList.copyOf(premises),
        ImmutableList.copyOf(conclusions), ImmutableList.copyOf(actions));
  }

  public RuleName name() {
    return name;
  }

  public ImmutableList<Fact> premises() {
    return premises;
  }

  public ImmutableList<Fact> conclusions() {
    return conclusions;
  }

  public ImmutableList<Fact> actions() {
    return actions;
  }

  /**
   * Returns the premise with the given index.
   * @throws IllegalArgumentException if there is no such premise
   */
  public Fact premise(int index) {
    Preconditions.checkArgument(index >= 0 && index < premises.size(),
        "rule %s has no premise %s", name, index);
    return premises.get(index);
  }

  /**
   * Returns the conclusion with the given index.
   * @throws IllegalArgumentException if there is no such conclusion
   */
  public Fact conclusion(int index) {
    Preconditions.checkArgument(index >= 0 && index < conclusions.size(),
        "rule %s has no conclusion %s", name, index);
    return conclusions.get(index);
  }

  /** Premises, conclusions and actions, in this order. */
  public ImmutableList<Fact> facts() {
    return ImmutableList.<Fact>builder()
        .addAll(premises).addAll(conclusions).addAll(actions).build();
  }

  public Rule apply(Substitution subst) {
    if (subst.isEmpty()) {
      return this;
    }
    return new Rule(name, applyAll(premises, subst),
        applyAll(conclusions, subst), applyAll(actions, subst));
  }

  private static ImmutableList<Fact> applyAll(List<Fact> facts,
      Substitution subst) {
    ImmutableList.Builder<Fact> result = ImmutableList.builder();
    for (Fact fact : facts) {
      result.add(fact.apply(subst));
    }
    return result.build();
  }

  void collectVariables(Set<LVar> vars) {
    for (Fact fact : facts()) {
      fact.collectVariables(vars);
    }
  }

  public ImmutableSet<LVar> variables() {
    Set<LVar> vars = Sets.newLinkedHashSet();
    collectVariables(vars);
    return ImmutableSet.copyOf(vars);
  }

  /**
   * The variables introduced by this rule: those occurring in a conclusion or
   * an action but in no premise.
   */
  public ImmutableSortedSet<LVar> newVariables() {
    Set<LVar> premiseVars = Sets.newHashSet();
    for (Fact premise : premises) {
      premise.collectVariables(premiseVars);
    }
    Set<LVar> introduced = Sets.newTreeSet();
    for (Fact fact : Iterables.concat(conclusions, actions)) {
      for (LVar var : fact.variables()) {
        if (!premiseVars.contains(var)) {
          introduced.add(var);
        }
      }
    }
    return ImmutableSortedSet.copyOf(introduced);
  }

  /** Whether {@link #newVariables()} is non-empty. */
  public boolean containsNewVariables() {
    return !newVariables().isEmpty();
  }

  /** Renames all variables of this rule apart, using {@code supply}. */
  public Rule renamedApart(FreshSupply supply) {
    return instantiateFixing(ImmutableMap.<LVar, Term>of(), supply);
  }

  /**
   * Instantiates this rule: variables in the key set of {@code fixed} are
   * replaced by their image, all other variables are renamed apart.
   */
  public Rule instantiateFixing(Map<LVar, ? extends Term> fixed,
      FreshSupply supply) {
    Map<LVar, Term> mapping = Maps.newLinkedHashMap(fixed);
    for (LVar var : variables()) {
      if (!mapping.containsKey(var)) {
        mapping.put(var, Term.var(supply.fresh(var)));
      }
    }
    return apply(Substitution.create(mapping));
  }

  /**
   * Encodes all facts of this rule as one term, so that an oracle can match
   * a rule against an instance of it.
   */
  public Term asTerm() {
    List<Term> factTerms = Lists.newArrayList();
    for (Fact fact : premises) {
      factTerms.add(fact.asTerm());
    }
    Term prems = FunTerm.create("premises", false,
        ImmutableList.copyOf(factTerms));
    factTerms.clear();
    for (Fact fact : conclusions) {
      factTerms.add(fact.asTerm());
    }
    Term concs = FunTerm.create("conclusions", false,
        ImmutableList.copyOf(factTerms));
    factTerms.clear();
    for (Fact fact : actions) {
      factTerms.add(fact.asTerm());
    }
    Term acts = FunTerm.create("actions", false,
        ImmutableList.copyOf(factTerms));
    return Term.fun("rule:" + name, prems, concs, acts);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Rule)) {
      return false;
    }
    Rule other = (Rule) obj;
    return name.equals(other.name) && premises.equals(other.premises)
        && conclusions.equals(other.conclusions)
        && actions.equals(other.actions);
  }

  @Override
  public int hashCode() {
    return ((name.hashCode() * 31 + premises.hashCode()) * 31
        + conclusions.hashCode()) * 31 + actions.hashCode();
  }

  @Override
  public String toString() {
    return String.format("rule (%s): [%s] --[%s]-> [%s]", name,
        Joiner.on(", ").join(premises), Joiner.on(", ").join(actions),
        Joiner.on(", ").join(conclusions));
  }
}
