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

import static net.hydromatic.beam.ast.TargetBuilder.target;

import com.google.common.collect.ImmutableList;
import java.util.Set;
import net.hydromatic.beam.ast.Op;
import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Target;

/** Implementations of {@link LoopLowering}. */
public abstract class LoopLowerings {
  private LoopLowerings() {}

  /**
   * Returns a strategy that lowers each loop to plain iteration, ignoring its
   * exit pattern.
   *
   * <p>"for (x in c) body" becomes
   * "Enum.each(c, fn x -> body end)";
   * "while (cond) body" becomes a {@code Enum.reduce_while} over an infinite
   * stream that halts when the condition is false.
   */
  public static LoopLowering plain() {
    return PlainLoopLowering.INSTANCE;
  }

  /** Lowers loops to plain iteration. */
  private enum PlainLoopLowering implements LoopLowering {
    INSTANCE;

    @Override
    public Target.Exp lower(
        Source.Loop loop,
        ExitPattern exitPattern,
        ExpressionCompiler compiler) {
      switch (loop.op) {
        case FOR:
          final Source.ForIn forIn = (Source.ForIn) loop;
          final Target.Fn fn =
              target.fn(
                  ImmutableList.of(
                      target.clause(
                          ImmutableList.of(
                              target.varPat(
                                  NameNormalizer.normalize(forIn.var.name))),
                          null,
                          compiler.compile(forIn.body))));
          return target.apply(
              target.alias("Enum"),
              "each",
              ImmutableList.of(compiler.compile(forIn.collection), fn));

        case WHILE:
          final Source.While aWhile = (Source.While) loop;
          // The accumulator must not hide a variable of the loop.
          final String accName =
              freshName(
                  "acc",
                  VarFinder.names(
                      VarFinder.vars(aWhile.condition, aWhile.body)));
          final Target.Exp acc = target.var(accName);
          final Target.Exp step =
              target.ifThenElse(
                  compiler.compile(aWhile.condition),
                  target.block(
                      ImmutableList.of(
                          compiler.compile(aWhile.body),
                          target.tuple(target.atom("cont"), acc))),
                  target.tuple(target.atom("halt"), acc));
          return target.apply(
              target.alias("Enum"),
              "reduce_while",
              ImmutableList.of(
                  naturals(),
                  target.atom("ok"),
                  target.fn(
                      ImmutableList.of(
                          target.clause(
                              ImmutableList.of(
                                  target.wildcardPat(), target.varPat(accName)),
                              null,
                              step)))));

        default:
          throw new AssertionError("unknown loop " + loop.op);
      }
    }

    /**
     * Returns {@code base} if it is not in {@code names}, otherwise the first
     * of "base_2", "base_3" and so on that is not.
     */
    private static String freshName(String base, Set<String> names) {
      String name = base;
      for (int i = 2; names.contains(name); i++) {
        name = base + "_" + i;
      }
      return name;
    }

    /** Returns "Stream.iterate(0, fn n -> n + 1 end)". */
    private static Target.Exp naturals() {
      final Target.Exp n = target.var("n");
      return target.apply(
          target.alias("Stream"),
          "iterate",
          ImmutableList.of(
              target.literal(0),
              target.fn(
                  ImmutableList.of(
                      target.clause(
                          ImmutableList.of(target.varPat("n")),
                          null,
                          target.binary(Op.PLUS, n, target.literal(1)))))));
    }
  }
}

// End LoopLowerings.java
