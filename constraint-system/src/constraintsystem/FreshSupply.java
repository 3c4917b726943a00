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

/**
 * A supply of variables that are guaranteed not to clash with a given set of
 * variables. New variables keep the name and sort of the variable they are
 * derived from and get an index larger than any index seen so far.
 * <p>
 * A supply is mutable and is meant to be local to one computation; it is
 * never shared between proof branches.
 */
public final class FreshSupply {
  private long nextIndex;

  private FreshSupply(long nextIndex) {
    this.nextIndex = nextIndex;
  }

  /** Creates a supply avoiding all of {@code vars}. */
  public static FreshSupply avoiding(Iterable<LVar> vars) {
    long max = 0;
    for (LVar var : vars) {
      max = Math.max(max, var.index());
    }
    return new FreshSupply(max + 1);
  }

  /** Additionally avoids {@code vars} from now on. */
  public void avoid(Iterable<LVar> vars) {
    for (LVar var : vars) {
      if (var.index() >= nextIndex) {
        nextIndex = var.index() + 1;
      }
    }
  }

  /** Returns a new variable with the name and sort of {@code like}. */
  public LVar fresh(LVar like) {
    return like.withIndex(nextIndex++);
  }
}
