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
import com.google.common.collect.ComparisonChain;

/**
 * A logical variable: a name, a sort and an index. Two variables with the same
 * name but different indices are different variables; indices are how
 * {@link FreshSupply} renames variables apart.
 */
public final class LVar implements Comparable<LVar> {
  private final String name;
  private final Sort sort;
  private final long index;

  private LVar(String name, Sort sort, long index) {
    this.name = Preconditions.checkNotNull(name);
    this.sort = Preconditions.checkNotNull(sort);
    this.index = index;
  }

  public static LVar create(String name, Sort sort, long index) {
    return new LVar(name, sort, index);
  }

  public static LVar msg(String name) {
    return new LVar(name, Sort.MSG, 0);
  }

  public static LVar fresh(String name) {
    return new LVar(name, Sort.FRESH, 0);
  }

  public static LVar pub(String name) {
    return new LVar(name, Sort.PUB, 0);
  }

  public static LVar node(String name) {
    return new LVar(name, Sort.NODE, 0);
  }

  public String name() {
    return name;
  }

  public Sort sort() {
    return sort;
  }

  public long index() {
    return index;
  }

  /** Returns a copy of this variable with a different index. */
  public LVar withIndex(long newIndex) {
    return new LVar(name, sort, newIndex);
  }

  @Override
  public int compareTo(LVar other) {
    return ComparisonChain.start()
        .compare(sort, other.sort)
        .compare(name, other.name)
        .compare(index, other.index)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LVar)) {
      return false;
    }
    LVar other = (LVar) obj;
    return index == other.index && sort == other.sort
        && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return (name.hashCode() * 31 + sort.hashCode()) * 31 + (int) index;
  }

  @Override
  public String toString() {
    return sort.prefix() + name + (index == 0 ? "" : "." + index);
  }
}
