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
 * The tag of a {@link Fact}: its kind, its name, its arity and whether it is
 * persistent (may be consumed any number of times) or linear.
 */
public final class FactTag implements Comparable<FactTag> {
  /** The built-in fact kinds and the user-defined protocol facts. */
  public enum Kind {
    PROTO, FRESH, IN, OUT, KU, KD, DED
  }

  public static final FactTag FRESH = new FactTag(Kind.FRESH, "Fr", 1, false);
  public static final FactTag IN = new FactTag(Kind.IN, "In", 1, false);
  public static final FactTag OUT = new FactTag(Kind.OUT, "Out", 1, false);
  /** Knowledge derived in the "up" direction, i.e. by construction */
  public static final FactTag KU = new FactTag(Kind.KU, "KU", 1, true);
  /** Knowledge derived in the "down" direction, i.e. by destruction */
  public static final FactTag KD = new FactTag(Kind.KD, "KD", 1, true);
  public static final FactTag DED = new FactTag(Kind.DED, "Ded", 0, false);

  private final Kind kind;
  private final String name;
  private final int arity;
  private final boolean persistent;

  private FactTag(Kind kind, String name, int arity, boolean persistent) {
    this.kind = Preconditions.checkNotNull(kind);
    this.name = Preconditions.checkNotNull(name);
    this.arity = arity;
    this.persistent = persistent;
  }

  /** Creates the tag of a user-defined protocol fact. */
  public static FactTag proto(String name, int arity, boolean persistent) {
    return new FactTag(Kind.PROTO, name, arity, persistent);
  }

  /** Recreates any tag; used when decoding. */
  static FactTag create(Kind kind, String name, int arity,
      boolean persistent) {
    switch (kind) {
      case FRESH:
        return FRESH;
      case IN:
        return IN;
      case OUT:
        return OUT;
      case KU:
        return KU;
      case KD:
        return KD;
      case DED:
        return DED;
      default:
        return new FactTag(kind, name, arity, persistent);
    }
  }

  public Kind kind() {
    return kind;
  }

  public String name() {
    return name;
  }

  public int arity() {
    return arity;
  }

  public boolean isPersistent() {
    return persistent;
  }

  @Override
  public int compareTo(FactTag other) {
    return ComparisonChain.start()
        .compare(kind, other.kind)
        .compare(name, other.name)
        .compare(arity, other.arity)
        .compareFalseFirst(persistent, other.persistent)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FactTag)) {
      return false;
    }
    FactTag other = (FactTag) obj;
    return kind == other.kind && name.equals(other.name)
        && arity == other.arity && persistent == other.persistent;
  }

  @Override
  public int hashCode() {
    return (kind.hashCode() * 31 + name.hashCode()) * 31 + arity;
  }

  @Override
  public String toString() {
    return (persistent && kind == Kind.PROTO ? "!" : "") + name;
  }
}
