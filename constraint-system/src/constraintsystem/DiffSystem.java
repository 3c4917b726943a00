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
import com.google.common.collect.ImmutableSet;

import java.util.Collection;

/**
 * The state of a diff proof: the technique used, the side searched
 * backwards, its proof context and constraint system, the rules of the
 * theory and the name of the rule under consideration. All parts but the
 * rule sets are absent until the proof has chosen them.
 */
public final class DiffSystem {
  private static final DiffSystem EMPTY = new DiffSystem(
      Optional.<DiffProofType>absent(), Optional.<Side>absent(),
      Optional.<ProofContext>absent(), Optional.<ConstraintSystem>absent(),
      ImmutableSet.<Rule>of(), ImmutableSet.<Rule>of(), ImmutableSet.<Rule>of(),
      Optional.<String>absent());

  private final Optional<DiffProofType> proofType;
  private final Optional<Side> side;
  private final Optional<ProofContext> proofContext;
  private final Optional<ConstraintSystem> system;
  private final ImmutableSet<Rule> protocolRules;
  private final ImmutableSet<Rule> constructionRules;
  private final ImmutableSet<Rule> destructionRules;
  private final Optional<String> currentRule;

  private DiffSystem(Optional<DiffProofType> proofType, Optional<Side> side,
      Optional<ProofContext> proofContext, Optional<ConstraintSystem> system,
      ImmutableSet<Rule> protocolRules, ImmutableSet<Rule> constructionRules,
      ImmutableSet<Rule> destructionRules, Optional<String> currentRule) {
    this.proofType = proofType;
    this.side = side;
    this.proofContext = proofContext;
    this.system = system;
    this.protocolRules = protocolRules;
    this.constructionRules = constructionRules;
    this.destructionRules = destructionRules;
    this.currentRule = currentRule;
  }

  public static DiffSystem empty() {
    return EMPTY;
  }

  public Optional<DiffProofType> proofType() {
    return proofType;
  }

  public Optional<Side> side() {
    return side;
  }

  public Optional<ProofContext> proofContext() {
    return proofContext;
  }

  public Optional<ConstraintSystem> system() {
    return system;
  }

  public ImmutableSet<Rule> protocolRules() {
    return protocolRules;
  }

  public ImmutableSet<Rule> constructionRules() {
    return constructionRules;
  }

  public ImmutableSet<Rule> destructionRules() {
    return destructionRules;
  }

  public Optional<String> currentRule() {
    return currentRule;
  }

  public DiffSystem withProofType(DiffProofType type) {
    return new DiffSystem(Optional.of(type), side, proofContext, system,
        protocolRules, constructionRules, destructionRules, currentRule);
  }

  /** Starts the backward search on {@code newSide} with its context. */
  public DiffSystem withSide(Side newSide, ProofContext context,
      ConstraintSystem newSystem) {
    return new DiffSystem(proofType, Optional.of(newSide),
        Optional.of(context), Optional.of(newSystem), protocolRules,
        constructionRules, destructionRules, currentRule);
  }

  public DiffSystem withSystem(ConstraintSystem newSystem) {
    return new DiffSystem(proofType, side, proofContext,
        Optional.of(newSystem), protocolRules, constructionRules,
        destructionRules, currentRule);
  }

  public DiffSystem withRules(Collection<Rule> protocol,
      Collection<Rule> construction, Collection<Rule> destruction) {
    return new DiffSystem(proofType, side, proofContext, system,
        ImmutableSet.copyOf(protocol), ImmutableSet.copyOf(construction),
        ImmutableSet.copyOf(destruction), currentRule);
  }

  public DiffSystem withCurrentRule(String ruleName) {
    return new DiffSystem(proofType, side, proofContext, system,
        protocolRules, constructionRules, destructionRules,
        Optional.of(ruleName));
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DiffSystem)) {
      return false;
    }
    DiffSystem other = (DiffSystem) obj;
    return proofType.equals(other.proofType) && side.equals(other.side)
        && proofContext.equals(other.proofContext)
        && system.equals(other.system)
        && protocolRules.equals(other.protocolRules)
        && constructionRules.equals(other.constructionRules)
        && destructionRules.equals(other.destructionRules)
        && currentRule.equals(other.currentRule);
  }

  @Override
  public int hashCode() {
    return (system.hashCode() * 31 + side.hashCode()) * 31
        + currentRule.hashCode();
  }

  @Override
  public String toString() {
    return "proof type: " + proofType.orNull() + "\nside: " + side.orNull()
        + "\ncurrent rule: " + currentRule.orNull()
        + (system.isPresent() ? "\n" + system.get() : "");
  }
}
