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
 * Finds the early exit that dominates a loop body.
 *
 * <p>The walk is pre-order and depth-first, and stops at the first "break",
 * "continue" or "return" it finds. It descends only through the branches of
 * conditionals (then before else), the statements of blocks, and the bodies
 * of switch arms (in order, then the default). It does not descend into
 * nested loops or function literals, whose exits belong to them, nor into
 * any other expression.
 */
public abstract class LoopExitAnalyzer {
  private LoopExitAnalyzer() {}

  /** Returns the exit pattern of a loop body; never null. */
  public static ExitPattern analyze(Source.Exp body) {
    final ExitPattern exitPattern = find(body);
    return exitPattern == null ? ExitPattern.NONE : exitPattern;
  }

  private static @Nullable ExitPattern find(Source.Exp exp) {
    switch (exp.op) {
      case BREAK:
        return ExitPattern.breakOf(null);

      case CONTINUE:
        return ExitPattern.continueOf(null);

      case RETURN:
        return ExitPattern.returnOf(null, ((Source.Return) exp).exp);

      case BLOCK:
        for (Source.Exp e : ((Source.Block) exp).exps) {
          final ExitPattern exitPattern = find(e);
          if (exitPattern != null) {
            return exitPattern;
          }
        }
        return null;

      case IF:
        final Source.If anIf = (Source.If) exp;
        final ExitPattern ifTrue = find(anIf.ifTrue);
        if (ifTrue != null) {
          return ifTrue.guardedBy(anIf.condition);
        }
        if (anIf.ifFalse != null) {
          final ExitPattern ifFalse = find(anIf.ifFalse);
          if (ifFalse != null) {
            return ifFalse.guardedBy(source.not(anIf.condition));
          }
        }
        return null;

      case SWITCH:
        final Source.Switch aSwitch = (Source.Switch) exp;
        for (Source.Arm arm : aSwitch.arms) {
          if (arm.body != null) {
            final ExitPattern exitPattern = find(arm.body);
            if (exitPattern != null) {
              return exitPattern;
            }
          }
        }
        return aSwitch.defaultBody == null ? null : find(aSwitch.defaultBody);

      case WHILE:
      case FOR:
      case FUNCTION:
        // exits in a nested loop or function do not leave this loop
        return null;

      case CONSTANT:
      case LOCAL:
      case STATIC:
      case VAR_DECL:
      case ASSIGN:
      case OBJECT_DECL:
      case ARRAY_DECL:
      case FIELD:
      case CALL:
      case CON_CALL:
      case NEGATE:
      case NOT:
      case TIMES:
      case DIVIDE:
      case PLUS:
      case MINUS:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case ANDALSO:
      case ORELSE:
        return null;

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }
}

// End LoopExitAnalyzer.java
