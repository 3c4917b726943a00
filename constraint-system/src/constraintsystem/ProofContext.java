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
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.List;

/**
 * The read-only configuration of a proof: the oracle handle, the classified
 * rules of the theory, the fact tags known to be injective, the case
 * distinction kind and the precomputed case distinctions, the induction hint,
 * the trace quantifier and whether the proof is a diff proof.
 * <p>
 * A proof context is passed explicitly to every query that needs it.
 */
public final class ProofContext {
  private final EquationalOracle oracle;
  private final ClassifiedRules rules;
  private final ImmutableSet<FactTag> injectiveFactTags;
  private final CaseDistKind caseDistKind;
  private final ImmutableList<CaseDistinction> caseDistinctions;
  private final InductionHint inductionHint;
  private final TraceQuantifier traceQuantifier;
  private final boolean isDiff;

  private ProofContext(Builder builder) {
    this.oracle = Preconditions.checkNotNull(builder.oracle, "oracle");
    this.rules = builder.rules;
    this.injectiveFactTags = builder.injectiveFactTags;
    this.caseDistKind = builder.caseDistKind;
    this.caseDistinctions = builder.caseDistinctions;
    this.inductionHint = builder.inductionHint;
    this.traceQuantifier = builder.traceQuantifier;
    this.isDiff = builder.isDiff;
  }

  public static Builder builder(EquationalOracle oracle) {
    return new Builder(oracle);
  }

  public Builder toBuilder() {
    return new Builder(oracle)
        .rules(rules)
        .injectiveFactTags(injectiveFactTags)
        .caseDistKind(caseDistKind)
        .caseDistinctions(caseDistinctions)
        .inductionHint(inductionHint)
        .traceQuantifier(traceQuantifier)
        .diff(isDiff);
  }

  public EquationalOracle oracle() {
    return oracle;
  }

  public ClassifiedRules rules() {
    return rules;
  }

  public ImmutableSet<FactTag> injectiveFactTags() {
    return injectiveFactTags;
  }

  public CaseDistKind caseDistKind() {
    return caseDistKind;
  }

  public ImmutableList<CaseDistinction> caseDistinctions() {
    return caseDistinctions;
  }

  public InductionHint inductionHint() {
    return inductionHint;
  }

  public TraceQuantifier traceQuantifier() {
    return traceQuantifier;
  }

  public boolean isDiff() {
    return isDiff;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ProofContext)) {
      return false;
    }
    ProofContext other = (ProofContext) obj;
    return oracle.equals(other.oracle)
        && rules.equals(other.rules)
        && injectiveFactTags.equals(other.injectiveFactTags)
        && caseDistKind == other.caseDistKind
        && caseDistinctions.equals(other.caseDistinctions)
        && inductionHint == other.inductionHint
        && traceQuantifier == other.traceQuantifier
        && isDiff == other.isDiff;
  }

  @Override
  public int hashCode() {
    return (rules.hashCode() * 31 + caseDistinctions.hashCode()) * 31
        + traceQuantifier.hashCode();
  }

  @Override
  public String toString() {
    return String.format("rules:\n%s\ninjective: %s\ncase distinctions: %s"
        + " (%d precomputed)\n%s, %s%s", rules, injectiveFactTags,
        caseDistKind, caseDistinctions.size(), inductionHint, traceQuantifier,
        isDiff ? ", diff" : "");
  }

  /** Collects the parts of a {@link ProofContext}. */
  public static final class Builder {
    private final EquationalOracle oracle;
    private ClassifiedRules rules = ClassifiedRules.empty();
    private ImmutableSet<FactTag> injectiveFactTags = ImmutableSet.of();
    private CaseDistKind caseDistKind = CaseDistKind.UNTYPED;
    private ImmutableList<CaseDistinction> caseDistinctions =
        ImmutableList.of();
    private InductionHint inductionHint = InductionHint.AVOID_INDUCTION;
    private TraceQuantifier traceQuantifier = TraceQuantifier.EXISTS_NO_TRACE;
    private boolean isDiff = false;

    private Builder(EquationalOracle oracle) {
      this.oracle = oracle;
    }

    public Builder rules(ClassifiedRules newRules) {
      this.rules = Preconditions.checkNotNull(newRules);
      return this;
    }

    public Builder injectiveFactTags(Collection<FactTag> tags) {
      this.injectiveFactTags = ImmutableSet.copyOf(tags);
      return this;
    }

    public Builder caseDistKind(CaseDistKind kind) {
      this.caseDistKind = Preconditions.checkNotNull(kind);
      return this;
    }

    public Builder caseDistinctions(List<CaseDistinction> distinctions) {
      this.caseDistinctions = ImmutableList.copyOf(distinctions);
      return this;
    }

    public Builder inductionHint(InductionHint hint) {
      this.inductionHint = Preconditions.checkNotNull(hint);
      return this;
    }

    public Builder traceQuantifier(TraceQuantifier quantifier) {
      this.traceQuantifier = Preconditions.checkNotNull(quantifier);
      return this;
    }

    public Builder diff(boolean diff) {
      this.isDiff = diff;
      return this;
    }

    public ProofContext build() {
      return new ProofContext(this);
    }
  }
}
