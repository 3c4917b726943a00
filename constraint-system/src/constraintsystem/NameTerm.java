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
 * A name constant: either a fresh name ({@code ~'n'}) or a public name
 * ({@code 'n'}).
 */
public final class NameTerm extends Term {
  /** The two kinds of names. */
  public enum Kind {
    FRESH, PUB
  }

  private final Kind kind;
  private final String id;

  private NameTerm(Kind kind, String id) {
    this.kind = Preconditions.checkNotNull(kind);
    this.id = Preconditions.checkNotNull(id);
  }

  public static NameTerm create(Kind kind, String id) {
    return new NameTerm(kind, id);
  }

  public Kind kind() {
    return kind;
  }

  public String id() {
    return id;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitName(this);
  }

  @Override
  void collectVariables(Set<LVar> vars) {
    // names are ground
  }

  @Override
  public Term apply(Substitution subst) {
    return this;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NameTerm)) {
      return false;
    }
    NameTerm other = (NameTerm) obj;
    return kind == other.kind && id.equals(other.id);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + id.hashCode();
  }

  @Override
  public String toString() {
    return (kind == Kind.FRESH ? "~'" : "'") + id + "'";
  }
}
