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
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Map;
import java.util.Set;

/**
 * A finite map from variables to terms.
 * <p>
 * Substitutions returned by an {@link EquationalOracle} are
 * <em>fresh-variable</em> substitutions: the variables in their range are
 * unrelated to the variables of the constraint system and must be renamed
 * apart with {@link #freshToFree} before the substitution is applied.
 */
public final class Substitution {
  private static final Substitution EMPTY =
      new Substitution(ImmutableMap.<LVar, Term>of());

  private final ImmutableMap<LVar, Term> mappings;

  private Substitution(ImmutableMap<LVar, Term> mappings) {
    this.mappings = mappings;
  }

  public static Substitution empty() {
    return EMPTY;
  }

  public static Substitution of(LVar var, Term term) {
    return create(ImmutableMap.of(var, term));
  }

  /** Creates a substitution, dropping trivial mappings {@code x -> x}. */
  public static Substitution create(Map<LVar, ? extends Term> mappings) {
    ImmutableMap.Builder<LVar, Term> builder = ImmutableMap.builder();
    for (Map.Entry<LVar, ? extends Term> entry : mappings.entrySet()) {
      if (!entry.getValue().equals(Term.var(entry.getKey()))) {
        builder.put(entry.getKey(), entry.getValue());
      }
    }
    return new Substitution(builder.build());
  }

  /** Returns the image of {@code var}, or null if it is not in the domain. */
  public Term get(LVar var) {
    return mappings.get(var);
  }

  public boolean isEmpty() {
    return mappings.isEmpty();
  }

  public ImmutableSet<LVar> domain() {
    return mappings.keySet();
  }

  public ImmutableMap<LVar, Term> asMap() {
    return mappings;
  }

  /** Returns the variables occurring in the range of this substitution. */
  public ImmutableSet<LVar> rangeVariables() {
    Set<LVar> vars = Sets.newLinkedHashSet();
    for (Term term : mappings.values()) {
      term.collectVariables(vars);
    }
    return ImmutableSet.copyOf(vars);
  }

  /**
   * Returns the substitution that first applies {@code first} and then this
   * substitution.
   */
  public Substitution compose(Substitution first) {
    Map<LVar, Term> composed = Maps.newLinkedHashMap();
    for (Map.Entry<LVar, Term> entry : first.mappings.entrySet()) {
      composed.put(entry.getKey(), entry.getValue().apply(this));
    }
    for (Map.Entry<LVar, Term> entry : mappings.entrySet()) {
      if (!composed.containsKey(entry.getKey())) {
        composed.put(entry.getKey(), entry.getValue());
      }
    }
    return create(composed);
  }

  /** Restricts the domain of this substitution to {@code vars}. */
  public Substitution restrict(Set<LVar> vars) {
    return create(Maps.filterKeys(mappings, Predicates.in(vars)));
  }

  /** Removes {@code vars} from the domain of this substitution. */
  public Substitution without(Set<LVar> vars) {
    return create(
        Maps.filterKeys(mappings, Predicates.not(Predicates.in(vars))));
  }

  /**
   * Renames the range variables of this fresh-variable substitution to
   * variables drawn from {@code supply}, so that they cannot clash with the
   * variables the supply was created to avoid.
   */
  public Substitution freshToFree(FreshSupply supply) {
    Map<LVar, Term> renaming = Maps.newLinkedHashMap();
    for (LVar var : rangeVariables()) {
      renaming.put(var, Term.var(supply.fresh(var)));
    }
    Substitution rename = create(renaming);
    Map<LVar, Term> renamed = Maps.newLinkedHashMap();
    for (Map.Entry<LVar, Term> entry : mappings.entrySet()) {
      renamed.put(entry.getKey(), entry.getValue().apply(rename));
    }
    return create(renamed);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Substitution
        && mappings.equals(((Substitution) obj).mappings);
  }

  @Override
  public int hashCode() {
    return mappings.hashCode();
  }

  @Override
  public String toString() {
    return "{" + Joiner.on(", ").withKeyValueSeparator(" <~ ").join(mappings)
        + "}";
  }
}
