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

import java.util.List;

/**
 * The interface to an external unification engine, e.g. one that unifies
 * modulo associativity and commutativity. All operations are side-effect
 * free from the point of view of the caller and may be expensive.
 * <p>
 * Unifiers are <em>fresh-variable</em> substitutions; see
 * {@link Substitution#freshToFree}. Failures of the engine are reported as
 * {@link OracleException}s.
 */
public interface EquationalOracle {
  /** Whether the two terms have a common instance. */
  boolean unifiable(Term left, Term right);

  /** Whether the two facts have a common instance. */
  boolean unifiable(Fact left, Fact right);

  /**
   * Returns the variants of a rule instance: one substitution per way the
   * instance can be normalized. A rule without equational symbols has exactly
   * one, empty, variant.
   */
  ImmutableList<Substitution> variantsOf(Rule rule);

  /**
   * Matches {@code term} against {@code pattern}: returns a substitution for
   * the variables of the pattern that makes it equal to the term, if any.
   * The variables of {@code term} are treated as constants.
   */
  Optional<Substitution> match(Term term, Term pattern);

  /**
   * Returns a complete set of unifiers of the given equations. The list is
   * empty if the equations cannot be solved simultaneously; it contains the
   * empty substitution if they hold already.
   */
  ImmutableList<Substitution> unify(List<Equal<Fact>> equations);
}
