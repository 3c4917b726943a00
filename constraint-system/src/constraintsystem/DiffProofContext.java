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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * The context of a diff proof: a proof context per side, the rules shared by
 * both sides, and the axioms of each side.
 */
public final class DiffProofContext {
  private final ProofContext left;
  private final ProofContext right;
  private final ImmutableList<Rule> protocolRules;
  private final ImmutableList<Rule> constructionRules;
  private final ImmutableList<Rule> destructionRules;
  private final ImmutableMap<Side, ImmutableList<Guarded>> axioms;

  private DiffProofContext(ProofContext left, ProofContext right,
      ImmutableList<Rule> protocolRules, ImmutableList<Rule> constructionRules,
      ImmutableList<Rule> destructionRules,
      ImmutableMap<Side, ImmutableList<Guarded>> axioms) {
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
    this.protocolRules = protocolRules;
    this.constructionRules = constructionRules;
    this.destructionRules = destructionRules;
    this.axioms = axioms;
  }

  public static DiffProofContext create(ProofContext left, ProofContext right,
      List<Rule> protocolRules, List<Rule> constructionRules,
      List<Rule> destructionRules, Map<Side, ? extends List<Guarded>> axioms) {
    Map<Side, ImmutableList<Guarded>> axiomsCopy = Maps.newEnumMap(Side.class);
    for (Map.Entry<Side, ? extends List<Guarded>> entry : axioms.entrySet()) {
      axiomsCopy.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    return new DiffProofContext(left, right,
        ImmutableList.copyOf(protocolRules),
        ImmutableList.copyOf(constructionRules),
        ImmutableList.copyOf(destructionRules),
        ImmutableMap.copyOf(axiomsCopy));
  }

  public ProofContext left() {
    return left;
  }

  public ProofContext right() {
    return right;
  }

  /** The proof context of {@code side}. */
  public ProofContext context(Side side) {
    return side == Side.LHS ? left : right;
  }

  /** The oracle handle of {@code side}. */
  public EquationalOracle oracle(Side side) {
    return context(side).oracle();
  }

  /** All rules of {@code side}. */
  public ImmutableList<Rule> rulesOnSide(Side side) {
    return context(side).rules().all();
  }

  public ImmutableList<Rule> rulesOnOtherSide(Side side) {
    return rulesOnSide(side.opposite());
  }

  public ImmutableList<Rule> protocolRules() {
    return protocolRules;
  }

  public ImmutableList<Rule> constructionRules() {
    return constructionRules;
  }

  public ImmutableList<Rule> destructionRules() {
    return destructionRules;
  }

  /** The axioms of {@code side}; empty if there are none. */
  public ImmutableList<Guarded> axioms(Side side) {
    ImmutableList<Guarded> result = axioms.get(side);
    return result == null ? ImmutableList.<Guarded>of() : result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DiffProofContext)) {
      return false;
    }
    DiffProofContext other = (DiffProofContext) obj;
    return left.equals(other.left) && right.equals(other.right)
        && protocolRules.equals(other.protocolRules)
        && constructionRules.equals(other.constructionRules)
        && destructionRules.equals(other.destructionRules)
        && axioms.equals(other.axioms);
  }

  @Override
  public int hashCode() {
    return (left.hashCode() * 31 + right.hashCode()) * 31
        + protocolRules.hashCode();
  }

  @Override
  public String toString() {
    return "LHS:\n" + left + "\nRHS:\n" + right + "\naxioms: " + axioms;
  }
}
