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
 * Identifies one disjunction of unifiers in an {@link EquationStore}.
 */
public final class SplitId implements Comparable<SplitId> {
  private final int id;

  private SplitId(int id) {
    this.id = id;
  }

  public static SplitId create(int id) {
    return new SplitId(id);
  }

  public int id() {
    return id;
  }

  @Override
  public int compareTo(SplitId other) {
    return id < other.id ? -1 : (id == other.id ? 0 : 1);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof SplitId && id == ((SplitId) obj).id;
  }

  @Override
  public int hashCode() {
    return id;
  }

  @Override
  public String toString() {
    return "split" + id;
  }
}
