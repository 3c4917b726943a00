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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Canonical instances of the intruder rules for the built-in AC operators.
 * <p>
 * A theory contains a single construction rule for {@code mult} and
 * {@code union}, but a node in a graph may construct a product of any number
 * of factors; the instance with the right number of premises is built here.
 */
final class IntruderRules {
  static final String MULT = "mult";
  static final String UNION = "union";

  private IntruderRules() {}

  /** Whether {@code name} is the construction rule of a built-in AC symbol. */
  static boolean isACConstruction(RuleName name) {
    return name.kind() == RuleName.Kind.CONSTRUCTION
        && (MULT.equals(name.name()) || UNION.equals(name.name()));
  }

  /** The instance {@code KU(x1), ..., KU(xn) --> KU(mult(x1, ..., xn))}. */
  static Rule multRuleInstance(int arity) {
    return acRuleInstance(MULT, arity);
  }

  /** The instance {@code KU(x1), ..., KU(xn) --> KU(union(x1, ..., xn))}. */
  static Rule unionRuleInstance(int arity) {
    return acRuleInstance(UNION, arity);
  }

  private static Rule acRuleInstance(String symbol, int arity) {
    Preconditions.checkArgument(arity >= 2,
        "%s needs at least two arguments, got %s", symbol, arity);
    ImmutableList.Builder<Fact> premises = ImmutableList.builder();
    ImmutableList.Builder<Term> args = ImmutableList.builder();
    for (int i = 1; i <= arity; i++) {
      Term x = Term.var(LVar.msg("x" + i));
      premises.add(Fact.ku(x));
      args.add(x);
    }
    Fact result = Fact.ku(FunTerm.create(symbol, true, args.build()));
    return Rule.create(RuleName.construction(symbol), premises.build(),
        ImmutableList.of(result), ImmutableList.of(result));
  }
}
