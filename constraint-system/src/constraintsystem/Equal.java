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

/**
 * An equation between two values, e.g. two facts that must be unified.
 *
 * @param <T> the type of the two sides
 */
public final class Equal<T> {
  private final T left;
  private final T right;

  private Equal(T left, T right) {
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
  }

  public static <T> Equal<T> create(T left, T right) {
    return new Equal<T>(left, right);
  }

  public T left() {
    return left;
  }

  public T right() {
    return right;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Equal)) {
      return false;
    }
    Equal<?> other = (Equal<?>) obj;
    return left.equals(other.left) && right.equals(other.right);
  }

  @Override
  public int hashCode() {
    return left.hashCode() * 31 + right.hashCode();
  }

  @Override
  public String toString() {
    return left + " = " + right;
  }
}
