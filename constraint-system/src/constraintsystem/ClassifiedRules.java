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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The rules of a theory, classified into protocol, construction and
 * destruction rules.
 */
public final class ClassifiedRules {
  private static final ClassifiedRules EMPTY = new ClassifiedRules(
      ImmutableList.<Rule>of(), ImmutableList.<Rule>of(),
      ImmutableList.<Rule>of());

  private final ImmutableList<Rule> protocol;
  private final ImmutableList<Rule> destruction;
  private final ImmutableList<Rule> construction;

  private ClassifiedRules(ImmutableList<Rule> protocol,
      ImmutableList<Rule> destruction, ImmutableList<Rule> construction) {
    this.protocol = protocol;
    this.destruction = destruction;
    this.construction = construction;
  }

  public static ClassifiedRules create(List<Rule> protocol,
      List<Rule> destruction, List<Rule> construction) {
    return new ClassifiedRules(ImmutableList.copyOf(protocol),
        ImmutableList.copyOf(destruction), ImmutableList.copyOf(construction));
  }

  public static ClassifiedRules empty() {
    return EMPTY;
  }

  public ImmutableList<Rule> protocol() {
    return protocol;
  }

  public ImmutableList<Rule> destruction() {
    return destruction;
  }

  public ImmutableList<Rule> construction() {
    return construction;
  }

  /** All rules: protocol, then destruction, then construction rules. */
  public ImmutableList<Rule> all() {
    return ImmutableList.<Rule>builder()
        .addAll(protocol).addAll(destruction).addAll(construction).build();
  }

  /** All rules that have at least one action. */
  public ImmutableList<Rule> nonSilent() {
    ImmutableList.Builder<Rule> result = ImmutableList.builder();
    for (Rule rule : all()) {
      if (!rule.actions().isEmpty()) {
        result.add(rule);
      }
    }
    return result.build();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ClassifiedRules)) {
      return false;
    }
    ClassifiedRules other = (ClassifiedRules) obj;
    return protocol.equals(other.protocol)
        && destruction.equals(other.destruction)
        && construction.equals(other.construction);
  }

  @Override
  public int hashCode() {
    return (protocol.hashCode() * 31 + destruction.hashCode()) * 31
        + construction.hashCode();
  }

  @Override
  public String toString() {
    return String.format("protocol: %s\ndestruction: %s\nconstruction: %s",
        protocol, destruction, construction);
  }
}
