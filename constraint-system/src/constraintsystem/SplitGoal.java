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

import java.util.Set;

/**
 * The goal of resolving the equational case split {@code splitId} of the
 * equation store.
 */
public final class SplitGoal extends Goal {
  private final SplitId splitId;

  private SplitGoal(SplitId splitId) {
    this.splitId = Preconditions.checkNotNull(splitId);
  }

  public static SplitGoal create(SplitId splitId) {
    return new SplitGoal(splitId);
  }

  public SplitId splitId() {
    return splitId;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitSplit(this);
  }

  @Override
  void collectVariables(Set<LVar> vars) {}

  @Override
  public Goal apply(Substitution subst) {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof SplitGoal
        && splitId.equals(((SplitGoal) obj).splitId);
  }

  @Override
  public int hashCode() {
    return splitId.hashCode();
  }

  @Override
  public String toString() {
    return "splitEqs(" + splitId + ")";
  }
}
