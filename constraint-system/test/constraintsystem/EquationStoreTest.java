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

import static constraintsystem.TestSystems.X;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import junit.framework.TestCase;

public class EquationStoreTest extends TestCase {
  private final Substitution toA = Substitution.of(X, Term.pubName("a"));
  private final Substitution toB = Substitution.of(X, Term.pubName("b"));

  public void testSplitIdsAreNeverReused() {
    EquationStore store = EquationStore.empty();
    assertEquals(SplitId.create(0), store.peekSplitId());
    store = store.withDisjunction(ImmutableList.of(toA, toB));
    assertEquals(SplitId.create(1), store.peekSplitId());
    store = store.withoutDisjunction(SplitId.create(0));
    assertTrue(store.splitIds().isEmpty());
    assertEquals(SplitId.create(1), store.peekSplitId());
  }

  public void testCasesAt() {
    EquationStore store = EquationStore.empty()
        .withDisjunction(ImmutableList.of(toA, toB))
        .withDisjunction(ImmutableList.of(toB));
    assertEquals(ImmutableSet.of(SplitId.create(0), SplitId.create(1)),
        store.splitIds());
    assertEquals(ImmutableList.of(toB),
        store.casesAt(SplitId.create(1)).get());
    assertFalse(store.casesAt(SplitId.create(2)).isPresent());
  }

  public void testEmptyDisjunctionIsRejected() {
    try {
      EquationStore.empty().withDisjunction(ImmutableList.<Substitution>of());
      fail("Should have thrown an exception");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testSubstitutionIsKeptWithSplits() {
    EquationStore store = EquationStore.empty().withSubstitution(toA)
        .withDisjunction(ImmutableList.of(toB));
    assertEquals(toA, store.substitution());
    assertEquals(toA, store.withoutDisjunction(SplitId.create(0))
        .substitution());
  }
}
