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

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

/**
 * Identifies a position in a (possibly partial) trace. Inside formulas a node
 * is referred to by a temporal variable, see {@link #asTerm()}.
 */
public final class NodeId implements Comparable<NodeId> {
  private final LVar var;

  private NodeId(LVar var) {
    Preconditions.checkArgument(var.sort() == Sort.NODE,
        "not a temporal variable: %s", var);
    this.var = var;
  }

  public static NodeId create(String name, long index) {
    return new NodeId(LVar.create(name, Sort.NODE, index));
  }

  public static NodeId of(LVar var) {
    return new NodeId(var);
  }

  /** Returns the node a term refers to, if the term is a temporal variable. */
  public static Optional<NodeId> fromTerm(Term term) {
    if (term instanceof VarTerm && ((VarTerm) term).var().sort() == Sort.NODE) {
      return Optional.of(new NodeId(((VarTerm) term).var()));
    }
    return Optional.absent();
  }

  public LVar asVar() {
    return var;
  }

  public Term asTerm() {
    return Term.var(var);
  }

  @Override
  public int compareTo(NodeId other) {
    return var.compareTo(other.var);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof NodeId && var.equals(((NodeId) obj).var);
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
