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
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * A fact: a {@link FactTag} applied to a tuple of terms, e.g. {@code KU(x)} or
 * {@code !Ltk($A, ~k)}.
 */
public final class Fact {
  private final FactTag tag;
  private final ImmutableList<Term> terms;

  private Fact(FactTag tag, ImmutableList<Term> terms) {
    this.tag = Preconditions.checkNotNull(tag);
    this.terms = terms;
  }

  public static Fact create(FactTag tag, ImmutableList<Term> terms) {
    return new Fact(tag, terms);
  }

  public static Fact create(FactTag tag, Term... terms) {
    return new Fact(tag, ImmutableList.copyOf(terms));
  }

  /** A linear protocol fact. */
  public static Fact proto(String name, Term... terms) {
    return create(FactTag.proto(name, terms.length, false), terms);
  }

  /** A persistent protocol fact. */
  public static Fact persistent(String name, Term... terms) {
    return create(FactTag.proto(name, terms.length, true), terms);
  }

  public static Fact ku(Term term) {
    return create(FactTag.KU, term);
  }

  public static Fact kd(Term term) {
    return create(FactTag.KD, term);
  }

  public static Fact fresh(Term term) {
    return create(FactTag.FRESH, term);
  }

  public static Fact in(Term term) {
    return create(FactTag.IN, term);
  }

  public static Fact out(Term term) {
    return create(FactTag.OUT, term);
  }

  public FactTag tag() {
    return tag;
  }

  public ImmutableList<Term> terms() {
    return terms;
  }

  /** Whether this is a public-knowledge fact, i.e. {@code KU(m)}. */
  public boolean isKU() {
    return tag.kind() == FactTag.Kind.KU;
  }

  public boolean isKD() {
    return tag.kind() == FactTag.Kind.KD;
  }

  public Fact apply(Substitution subst) {
    if (subst.isEmpty()) {
      return this;
    }
    ImmutableList.Builder<Term> newTerms = ImmutableList.builder();
    for (Term term : terms) {
      newTerms.add(term.apply(subst));
    }
    return new Fact(tag, newTerms.build());
  }

  void collectVariables(Set<LVar> vars) {
    for (Term term : terms) {
      term.collectVariables(vars);
    }
  }

  public ImmutableSet<LVar> variables() {
    Set<LVar> vars = Sets.newLinkedHashSet();
    collectVariables(vars);
    return ImmutableSet.copyOf(vars);
  }

  /**
   * If every argument of this fact is a message variable and no variable
   * occurs twice, returns these variables. Such a fact is <em>trivial</em>:
   * it says nothing about the shape of its arguments, so it can always be
   * satisfied by public values without constraining the rest of a graph.
   */
  public Optional<ImmutableList<LVar>> trivialVariables() {
    ImmutableList.Builder<LVar> vars = ImmutableList.builder();
    Set<LVar> seen = Sets.newHashSet();
    for (Term term : terms) {
      if (!(term instanceof VarTerm)) {
        return Optional.absent();
      }
      LVar var = ((VarTerm) term).var();
      if (var.sort() != Sort.MSG || !seen.add(var)) {
        return Optional.absent();
      }
      vars.add(var);
    }
    return Optional.of(vars.build());
  }

  public boolean isTrivial() {
    return trivialVariables().isPresent();
  }

  /**
   * Encodes this fact as a term, so that facts can be handed to an oracle that
   * only matches terms.
   */
  public Term asTerm() {
    return FunTerm.create("fact:" + tag.kind() + ":" + tag.name(), false,
        terms);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Fact)) {
      return false;
    }
    Fact other = (Fact) obj;
    return tag.equals(other.tag) && terms.equals(other.terms);
  }

  @Override
  public int hashCode() {
    return tag.hashCode() * 31 + terms.hashCode();
  }

  @Override
  public String toString() {
    return tag + "(" + Joiner.on(", ").join(terms) + ")";
  }
}
