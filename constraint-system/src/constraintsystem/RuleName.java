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
 * The logical name of a rule: either a protocol rule or one of the fixed
 * kinds of intruder rules. Two rule names are equal iff their kinds and names
 * are equal; for intruder rules this is their identity.
 */
public final class RuleName implements Comparable<RuleName> {
  /** The kinds of rules. */
  public enum Kind {
    /** A rule of the protocol under analysis */
    PROTOCOL,
    /** The built-in rule generating fresh values */
    FRESH,
    /** Intruder construction rule for a function symbol */
    CONSTRUCTION,
    /** Intruder destruction rule */
    DESTRUCTION,
    /** Coercion from down-knowledge to up-knowledge */
    COERCE,
    /** The intruder receiving a message */
    IRECV,
    /** The intruder sending a message */
    ISEND,
    /** The intruder knowing a public value */
    PUB_CONSTR,
    /** The intruder generating a fresh value */
    FRESH_CONSTR
  }

  public static final RuleName FRESH = new RuleName(Kind.FRESH, "Fresh");
  public static final RuleName COERCE = new RuleName(Kind.COERCE, "coerce");
  public static final RuleName IRECV = new RuleName(Kind.IRECV, "irecv");
  public static final RuleName ISEND = new RuleName(Kind.ISEND, "isend");
  public static final RuleName PUB_CONSTR =
      new RuleName(Kind.PUB_CONSTR, "pub");
  public static final RuleName FRESH_CONSTR =
      new RuleName(Kind.FRESH_CONSTR, "fresh");

  private final Kind kind;
  private final String name;

  private RuleName(Kind kind, String name) {
    this.kind = Preconditions.checkNotNull(kind);
    this.name = Preconditions.checkNotNull(name);
  }

  public static RuleName create(Kind kind, String name) {
    return new RuleName(kind, name);
  }

  public static RuleName protocol(String name) {
    return new RuleName(Kind.PROTOCOL, name);
  }

  public static RuleName construction(String symbol) {
    return new RuleName(Kind.CONSTRUCTION, symbol);
  }

  public static RuleName destruction(String symbol) {
    return new RuleName(Kind.DESTRUCTION, symbol);
  }

  public Kind kind() {
    return kind;
  }

  public String name() {
    return name;
  }

  /** Protocol rules include the built-in fresh rule. */
  public boolean isProtocolRule() {
    return kind == Kind.PROTOCOL || kind == Kind.FRESH;
  }

  public boolean isIntruderRule() {
    return !isProtocolRule();
  }

  public boolean isFreshRule() {
    return kind == Kind.FRESH;
  }

  public boolean isPubConstrRule() {
    return kind == Kind.PUB_CONSTR;
  }

  @Override
  public int compareTo(RuleName other) {
    return ComparisonChain.start()
        .compare(kind, other.kind)
        .compare(name, other.name)
        .result();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RuleName)) {
      return false;
    }
    RuleName other = (RuleName) obj;
    return kind == other.kind && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + name.hashCode();
  }

  @Override
  public String toString() {
    return isProtocolRule() ? name : kind.name().toLowerCase() + ":" + name;
  }
}
