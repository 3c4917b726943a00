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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * An atom of a trace formula: an action at a node, the temporal order of two
 * nodes, the equality of two terms, or a node being the last one of the
 * trace. Nodes are referred to by terms, usually temporal variables.
 */
public abstract class Atom {
  private Atom() {}

  /** Exhaustive dispatch on the kind of atom. */
  public interface Visitor<R> {
    R visitAction(Action atom);
    R visitLess(Less atom);
    R visitEq(Eq atom);
    R visitLast(Last atom);
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public abstract Atom apply(Substitution subst);

  abstract void collectVariables(Set<LVar> vars);

  public ImmutableSet<LVar> variables() {
    Set<LVar> vars = Sets.newLinkedHashSet();
    collectVariables(vars);
    return ImmutableSet.copyOf(vars);
  }

  public static Action action(Term node, Fact fact) {
    return new Action(node, fact);
  }

  public static Action action(NodeId node, Fact fact) {
    return new Action(node.asTerm(), fact);
  }

  public static Less less(Term smaller, Term larger) {
    return new Less(smaller, larger);
  }

  public static Less less(NodeId smaller, NodeId larger) {
    return new Less(smaller.asTerm(), larger.asTerm());
  }

  public static Eq eq(Term left, Term right) {
    return new Eq(left, right);
  }

  public static Last last(Term node) {
    return new Last(node);
  }

  public static Last last(NodeId node) {
    return new Last(node.asTerm());
  }

  /** {@code fact @ node} */
  public static final class Action extends Atom {
    private final Term node;
    private final Fact fact;

    private Action(Term node, Fact fact) {
      this.node = Preconditions.checkNotNull(node);
      this.fact = Preconditions.checkNotNull(fact);
    }

    public Term node() {
      return node;
    }

    public Fact fact() {
      return fact;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAction(this);
    }

    @Override
    public Atom apply(Substitution subst) {
      return new Action(node.apply(subst), fact.apply(subst));
    }

    @Override
    void collectVariables(Set<LVar> vars) {
      node.collectVariables(vars);
      fact.collectVariables(vars);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Action)) {
        return false;
      }
      Action other = (Action) obj;
      return node.equals(other.node) && fact.equals(other.fact);
    }

    @Override
    public int hashCode() {
      return node.hashCode() * 31 + fact.hashCode();
    }

    @Override
    public String toString() {
      return fact + " @ " + node;
    }
  }

  /** {@code smaller < larger} */
  public static final class Less extends Atom {
    private final Term smaller;
    private final Term larger;

    private Less(Term smaller, Term larger) {
      this.smaller = Preconditions.checkNotNull(smaller);
      this.larger = Preconditions.checkNotNull(larger);
    }

    public Term smaller() {
      return smaller;
    }

    public Term larger() {
      return larger;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLess(this);
    }

    @Override
    public Atom apply(Substitution subst) {
      return new Less(smaller.apply(subst), larger.apply(subst));
    }

    @Override
    void collectVariables(Set<LVar> vars) {
      smaller.collectVariables(vars);
      larger.collectVariables(vars);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Less)) {
        return false;
      }
      Less other = (Less) obj;
      return smaller.equals(other.smaller) && larger.equals(other.larger);
    }

    @Override
    public int hashCode() {
      return 17 + smaller.hashCode() * 31 + larger.hashCode();
    }

    @Override
    public String toString() {
      return smaller + " < " + larger;
    }
  }

  /** {@code left = right} */
  public static final class Eq extends Atom {
    private final Term left;
    private final Term right;

    private Eq(Term left, Term right) {
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    public Term left() {
      return left;
    }

    public Term right() {
      return right;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEq(this);
    }

    @Override
    public Atom apply(Substitution subst) {
      return new Eq(left.apply(subst), right.apply(subst));
    }

    @Override
    void collectVariables(Set<LVar> vars) {
      left.collectVariables(vars);
      right.collectVariables(vars);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Eq)) {
        return false;
      }
      Eq other = (Eq) obj;
      return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return 37 + left.hashCode() * 31 + right.hashCode();
    }

    @Override
    public String toString() {
      return left + " = " + right;
    }
  }

  /** {@code last(node)} */
  public static final class Last extends Atom {
    private final Term node;

    private Last(Term node) {
      this.node = Preconditions.checkNotNull(node);
    }

    public Term node() {
      return node;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLast(this);
    }

    @Override
    public Atom apply(Substitution subst) {
      return new Last(node.apply(subst));
    }

    @Override
    void collectVariables(Set<LVar> vars) {
      node.collectVariables(vars);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Last && node.equals(((Last) obj).node);
    }

    @Override
    public int hashCode() {
      return 53 + node.hashCode();
    }

    @Override
    public String toString() {
      return "last(" + node + ")";
    }
  }
}
