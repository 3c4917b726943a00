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
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * The equations of a constraint system: a free substitution that has already
 * been applied to the system, and a conjunction of disjunctions of
 * fresh-variable substitutions, one disjunction per pending equational case
 * split.
 */
public final class EquationStore {
  private static final EquationStore EMPTY = new EquationStore(
      Substitution.empty(),
      ImmutableSortedMap.<SplitId, ImmutableList<Substitution>>of(), 0);

  private final Substitution substitution;
  private final ImmutableSortedMap<SplitId, ImmutableList<Substitution>>
      disjunctions;
  private final int nextSplitId;

  private EquationStore(Substitution substitution,
      ImmutableSortedMap<SplitId, ImmutableList<Substitution>> disjunctions,
      int nextSplitId) {
    this.substitution = Preconditions.checkNotNull(substitution);
    this.disjunctions = disjunctions;
    this.nextSplitId = nextSplitId;
  }

  public static EquationStore empty() {
    return EMPTY;
  }

  /** Used when decoding; {@code nextSplitId} must exceed all used ids. */
  static EquationStore create(Substitution substitution,
      Map<SplitId, ? extends List<Substitution>> disjunctions,
      int nextSplitId) {
    SortedMap<SplitId, ImmutableList<Substitution>> copy = Maps.newTreeMap();
    for (Map.Entry<SplitId, ? extends List<Substitution>> entry
        : disjunctions.entrySet()) {
      Preconditions.checkArgument(entry.getKey().id() < nextSplitId,
          "split id %s is not below %s", entry.getKey(), nextSplitId);
      copy.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    return new EquationStore(substitution,
        ImmutableSortedMap.copyOfSorted(copy), nextSplitId);
  }

  /** The free substitution. */
  public Substitution substitution() {
    return substitution;
  }

  public ImmutableSortedMap<SplitId, ImmutableList<Substitution>>
      disjunctions() {
    return disjunctions;
  }

  public ImmutableSortedSet<SplitId> splitIds() {
    return disjunctions.keySet();
  }

  int nextSplitId() {
    return nextSplitId;
  }

  /** The disjuncts of the case split {@code id}, if it is still pending. */
  public Optional<ImmutableList<Substitution>> casesAt(SplitId id) {
    return Optional.fromNullable(disjunctions.get(id));
  }

  public EquationStore withSubstitution(Substitution newSubstitution) {
    return new EquationStore(newSubstitution, disjunctions, nextSplitId);
  }

  /** The id the next call of {@link #withDisjunction} will use. */
  public SplitId peekSplitId() {
    return SplitId.create(nextSplitId);
  }

  /** Adds a new case split, identified by {@link #peekSplitId()}. */
  public EquationStore withDisjunction(List<Substitution> disjuncts) {
    Preconditions.checkArgument(!disjuncts.isEmpty(),
        "an empty disjunction is a contradiction, not a case split");
    SortedMap<SplitId, ImmutableList<Substitution>> copy =
        Maps.newTreeMap(disjunctions);
    copy.put(SplitId.create(nextSplitId), ImmutableList.copyOf(disjuncts));
    return new EquationStore(substitution,
        ImmutableSortedMap.copyOfSorted(copy), nextSplitId + 1);
  }

  /** Removes the case split {@code id} once it has been resolved. */
  public EquationStore withoutDisjunction(SplitId id) {
    SortedMap<SplitId, ImmutableList<Substitution>> copy =
        Maps.newTreeMap(disjunctions);
    copy.remove(id);
    return new EquationStore(substitution,
        ImmutableSortedMap.copyOfSorted(copy), nextSplitId);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof EquationStore)) {
      return false;
    }
    EquationStore other = (EquationStore) obj;
    return substitution.equals(other.substitution)
        && disjunctions.equals(other.disjunctions)
        && nextSplitId == other.nextSplitId;
  }

  @Override
  public int hashCode() {
    return (substitution.hashCode() * 31 + disjunctions.hashCode()) * 31
        + nextSplitId;
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder("free: " + substitution);
    for (Map.Entry<SplitId, ImmutableList<Substitution>> entry
        : disjunctions.entrySet()) {
      result.append("\n").append(entry.getKey()).append(": ")
          .append(Joiner.on(" | ").join(entry.getValue()));
    }
    return result.toString();
  }
}
