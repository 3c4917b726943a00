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
 * The kind of precomputed case distinctions. The declaration order is the
 * subkinding order: untyped case distinctions are also valid where typed ones
 * are expected, so {@code UNTYPED < TYPED}.
 */
public enum CaseDistKind {
  UNTYPED("untyped"), TYPED("typed");

  private final String label;

  private CaseDistKind(String label) {
    this.label = label;
  }

  /** Parses the label printed by {@link #toString()}. */
  public static CaseDistKind fromLabel(String label) {
    for (CaseDistKind kind : values()) {
      if (kind.label.equals(label)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown case distinction kind: "
        + label);
  }

  @Override
  public String toString() {
    return label;
  }
}
