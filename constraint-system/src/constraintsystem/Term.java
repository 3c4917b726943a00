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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * A message term: a variable, a name constant, or the application of a
 * function symbol to argument terms. Terms are immutable; applying a
 * {@link Substitution} yields a new term.
 * <p>
 * The constraint-system core never decides equality modulo an equational
 * theory itself. Structural equality ({@link #equals}) is syntactic; anything
 * else is asked of an {@link EquationalOracle}.
 */
public abstract class Term {
  Term() {}

  /** Dispatch on the kind of term. */
  public interface Visitor<R> {
    R visitVar(VarTerm var);
    R visitName(NameTerm name);
    R visitFun(FunTerm fun);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /** Adds all variables occurring in this term to {@code vars}. */
  abstract void collectVariables(Set<LVar> vars);

  /** Returns the result of applying {@code subst} to this term. */
  public abstract Term apply(Substitution subst);

  /** Returns the variables occurring in this term. */
  public ImmutableSet<LVar> variables() {
    Set<LVar> vars = Sets.newLinkedHashSet();
    collectVariables(vars);
    return ImmutableSet.copyOf(vars);
  }

  /** True iff this term contains no variables. */
  public boolean isGround() {
    return variables().isEmpty();
  }

  public static VarTerm var(LVar var) {
    return VarTerm.create(var);
  }

  public static NameTerm freshName(String id) {
    return NameTerm.create(NameTerm.Kind.FRESH, id);
  }

  public static NameTerm pubName(String id) {
    return NameTerm.create(NameTerm.Kind.PUB, id);
  }

  public static FunTerm fun(String symbol, Term... args) {
    return FunTerm.create(symbol, false, ImmutableList.copyOf(args));
  }

  public static FunTerm acFun(String symbol, Term... args) {
    return FunTerm.create(symbol, true, ImmutableList.copyOf(args));
  }
}
