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
 * A {@link Term} consisting of a single logical variable.
 */
public final class VarTerm extends Term {
  private final LVar var;

  private VarTerm(LVar var) {
    this.var = Preconditions.checkNotNull(var);
  }

  public static VarTerm create(LVar var) {
    return new VarTerm(var);
  }

  public LVar var() {
    return var;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitVar(this);
  }

  @Override
  void collectVariables(Set<LVar> vars) {
    vars.add(var);
  }

  @Override
  public Term apply(Substitution subst) {
    Term image = subst.get(var);
    return image == null ? this : image;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof VarTerm && var.equals(((VarTerm) obj).var);
  }

  @Override
  public int hashCode() {
    return var.hashCode();
  }

  @Override
  public String toString() {
    return var.toString();
  }
}
