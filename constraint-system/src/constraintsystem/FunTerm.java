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

import java.util.Set;

/**
 * The application of a function symbol to a list of arguments, such as
 * {@code pair(x, y)} or the associative-commutative {@code mult(a, b, c)}.
 * <p>
 * The AC flag is only carried along so that an oracle can tell which symbols
 * it has to treat modulo AC; the core itself compares arguments positionally.
 */
public final class FunTerm extends Term {
  private final String symbol;
  private final boolean ac;
  private final ImmutableList<Term> args;

  private FunTerm(String symbol, boolean ac, ImmutableList<Term> args) {
    this.symbol = Preconditions.checkNotNull(symbol);
    this.ac = ac;
    this.args = args;
  }

  public static FunTerm create(String symbol, boolean ac,
      ImmutableList<Term> args) {
    return new FunTerm(symbol, ac, args);
  }

  public String symbol() {
    return symbol;
  }

  /** Whether the symbol is associative and commutative. */
  public boolean isAC() {
    return ac;
  }

  public ImmutableList<Term> args() {
    return args;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitFun(this);
  }

  @Override
  void collectVariables(Set<LVar> vars) {
    for (Term arg : args) {
      arg.collectVariables(vars);
    }
  }

  @Override
  public Term apply(Substitution subst) {
    if (subst.isEmpty()) {
      return this;
    }
    ImmutableList.Builder<Term> newArgs = ImmutableList.builder();
    for (Term arg : args) {
      newArgs.add(arg.apply(subst));
    }
    return new FunTerm(symbol, ac, newArgs.build());
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FunTerm)) {
      return false;
    }
    FunTerm other = (FunTerm) obj;
    return ac == other.ac && symbol.equals(other.symbol)
        && args.equals(other.args);
  }

  @Override
  public int hashCode() {
    return symbol.hashCode() * 31 + args.hashCode();
  }

  @Override
  public String toString() {
    return symbol + "(" + Joiner.on(", ").join(args) + ")";
  }
}
