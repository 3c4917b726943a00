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
 * The bookkeeping data of a goal: whether it is solved, its creation number,
 * and whether the search driver flagged it as a loop breaker.
 */
public final class GoalStatus {
  private final boolean solved;
  private final long nr;
  private final boolean loopBreaker;

  private GoalStatus(boolean solved, long nr, boolean loopBreaker) {
    this.solved = solved;
    this.nr = nr;
    this.loopBreaker = loopBreaker;
  }

  public static GoalStatus create(boolean solved, long nr,
      boolean loopBreaker) {
    return new GoalStatus(solved, nr, loopBreaker);
  }

  public boolean isSolved() {
    return solved;
  }

  /** The creation number; goals created later have larger numbers. */
  public long nr() {
    return nr;
  }

  /** True if solving this goal early may lead to non-termination. */
  public boolean isLoopBreaker() {
    return loopBreaker;
  }

  public GoalStatus markSolved() {
    return new GoalStatus(true, nr, loopBreaker);
  }

  /**
   * Combines the status of two goals that collapsed into one: solved if
   * either was, the older creation number, loop breaker if either was.
   */
  public GoalStatus combine(GoalStatus other) {
    return new GoalStatus(solved || other.solved, Math.min(nr, other.nr),
        loopBreaker || other.loopBreaker);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof GoalStatus)) {
      return false;
    }
    GoalStatus other = (GoalStatus) obj;
    return solved == other.solved && nr == other.nr
        && loopBreaker == other.loopBreaker;
  }

  @Override
  public int hashCode() {
    return (int) nr * 4 + (solved ? 2 : 0) + (loopBreaker ? 1 : 0);
  }

  @Override
  public String toString() {
    return "nr: " + nr + (solved ? " (solved)" : "")
        + (loopBreaker ? " (loop breaker)" : "");
  }
}
