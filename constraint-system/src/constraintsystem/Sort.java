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
 * The sort of a logical variable.
 */
public enum Sort {
  /** Arbitrary messages */
  MSG("", 'm'),
  /** Fresh values, written ~x */
  FRESH("~", 'f'),
  /** Public values, written $x */
  PUB("$", 'p'),
  /** Temporal variables, i.e. trace positions, written #x */
  NODE("#", 'n');

  private final String prefix;
  private final char code;

  private Sort(String prefix, char code) {
    this.prefix = prefix;
    this.code = code;
  }

  /** The prefix used when printing variables of this sort. */
  public String prefix() {
    return prefix;
  }

  /** A one-character code, used in the names of mirror constants. */
  char code() {
    return code;
  }
}
