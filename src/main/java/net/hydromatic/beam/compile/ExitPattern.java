/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.beam.compile;

import static net.hydromatic.beam.ast.SourceBuilder.source;

import net.hydromatic.beam.ast.Source;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The early exit that dominates a loop body.
 *
 * <p>A loop is classified by the first early exit that is reachable in a
 * pre-order walk of its body. The {@link #condition} is the conjunction of
 * the tests of the conditionals that enclose the exit, outermost first; a
 * test is negated if the exit is in the else branch. If the exit is
 * unconditional, the condition is null.
 *
 * @see LoopExitAnalyzer
 */
public abstract sealed class ExitPattern {
  /** Pattern of a loop that has no early exit. */
  public static final ExitPattern NONE = new None();

  public final Kind kind;
  public final Source.@Nullable Exp condition;

  private ExitPattern(Kind kind, Source.@Nullable Exp condition) {
    this.kind = kind;
    this.condition = condition;
  }

  /** Creates a pattern for a "break" statement. */
  public static ExitPattern breakOf(Source.@Nullable Exp condition) {
    return new Jump(Kind.BREAK, condition);
  }

  /** Creates a pattern for a "continue" statement. */
  public static ExitPattern continueOf(Source.@Nullable Exp condition) {
    return new Jump(Kind.CONTINUE, condition);
  }

  /** Creates a pattern for a "return" statement. */
  public static ExitPattern returnOf(
      Source.@Nullable Exp condition, Source.@Nullable Exp value) {
    return new Return(condition, value);
  }

  /** Returns whether the loop has an early exit. */
  public boolean isExit() {
    return kind != Kind.NONE;
  }

  /**
   * Returns a copy of this pattern that is reached only if {@code test} is
   * true. If this pattern already has a condition, the result's condition is
   * "test && condition".
   */
  public ExitPattern guardedBy(Source.Exp test) {
    return withCondition(
        condition == null ? test : source.andAlso(test, condition));
  }

  abstract ExitPattern withCondition(Source.Exp condition);

  @Override
  public String toString() {
    return condition == null ? kind.toString() : kind + " when " + condition;
  }

  /** Kind of early exit. */
  public enum Kind {
    BREAK,
    CONTINUE,
    RETURN,
    NONE
  }

  /** Pattern of a loop that leaves via "break" or "continue". */
  static final class Jump extends ExitPattern {
    Jump(Kind kind, Source.@Nullable Exp condition) {
      super(kind, condition);
    }

    @Override
    ExitPattern withCondition(Source.Exp condition) {
      return new Jump(kind, condition);
    }
  }

  /** Pattern of a loop that leaves via "return". */
  public static final class Return extends ExitPattern {
    /** The returned value; null if the statement is a bare "return". */
    public final Source.@Nullable Exp value;

    Return(Source.@Nullable Exp condition, Source.@Nullable Exp value) {
      super(Kind.RETURN, condition);
      this.value = value;
    }

    @Override
    ExitPattern withCondition(Source.Exp condition) {
      return new Return(condition, value);
    }

    @Override
    public String toString() {
      return value == null
          ? super.toString()
          : super.toString() + " -> " + value;
    }
  }

  /** Pattern of a loop that has no early exit. */
  static final class None extends ExitPattern {
    None() {
      super(Kind.NONE, null);
    }

    @Override
    ExitPattern withCondition(Source.Exp condition) {
      throw new IllegalStateException("cannot guard a loop with no exit");
    }
  }
}

// End ExitPattern.java
