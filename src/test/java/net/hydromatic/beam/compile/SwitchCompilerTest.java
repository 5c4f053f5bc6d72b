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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import net.hydromatic.beam.ast.Op;
import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Target;
import org.junit.jupiter.api.Test;

/** Tests {@link SwitchCompiler}. */
public class SwitchCompilerTest {
  @Test
  void testConstants() {
    final Fixture f = new Fixture();
    // switch (x) { case 1: "one"; case 2, 3: "few"; default: "many" }
    final Source.Exp e =
        source.switchOf(
            f.local(f.x),
            ImmutableList.of(
                source.arm(f.constant(1), f.constant("one")),
                source.arm(
                    ImmutableList.of(f.constant(2), f.constant(3)),
                    null,
                    f.constant("few"))),
            f.constant("many"));
    final Target.Exp t = f.lower(e);
    assertThat(t,
        hasToString("case x do 1 -> \"one\"; 2, 3 -> \"few\"; "
            + "_ -> \"many\" end"));
    final Target.Case aCase = (Target.Case) t;
    assertThat(aCase.clauses.size(), is(3));
    assertThat(aCase.clauses.get(1).pats.size(), is(2));
    assertThat(f.fallbacks, empty());
  }

  /**
   * Bound variables are matched with captures in order of first use in
   * the body, not in argument order.
   */
  @Test
  void testCapturesFollowFirstUse() {
    final Fixture f = new Fixture();
    // switch (p) { case Pair(x, y): y * 2 + x }
    final Source.Exp e =
        source.switchOf(
            f.local(f.p),
            ImmutableList.of(
                source.arm(
                    source.conCall("Pair", "Pair", f.local(f.x), f.local(f.y)),
                    source.plus(
                        source.binary(Op.TIMES, f.local(f.y), f.constant(2)),
                        f.local(f.x)))),
            null);
    assertThat(f.lower(e),
        hasToString("case p do {:pair, first, second} -> first * 2 + second "
            + "end"));
  }

  @Test
  void testMultiWordParameterNames() {
    final Fixture f = new Fixture();
    // switch (msg) { case StatusUpdate(id, status): status }
    final Source.Exp e =
        source.switchOf(
            f.local(f.msg),
            ImmutableList.of(
                source.arm(
                    source.conCall(
                        "Message",
                        "StatusUpdate",
                        f.local(f.id),
                        f.local(f.status)),
                    f.local(f.status))),
            null);
    assertThat(f.lower(e),
        hasToString("case msg do {:status_update, worker_id, _new_status} "
            + "-> worker_id end"));
  }

  @Test
  void testUnusedCapture() {
    final Fixture f = new Fixture();
    // switch (s) { case Rect(w, h): w }
    final Source.Exp e =
        source.switchOf(
            f.local(f.s),
            ImmutableList.of(
                source.arm(
                    source.conCall("Shape", "Rect", f.local(f.w), f.local(f.h)),
                    f.local(f.w))),
            null);
    assertThat(f.lower(e),
        hasToString("case s do {:rect, width, _height} -> width end"));

    final LoweringContext context =
        f.contextBuilder().set(Prop.UNUSED_CAPTURE_PREFIX, "unused_").build();
    assertThat(Lowering.lowerBody(context, e),
        hasToString("case s do {:rect, width, unused_height} -> width end"));
  }

  @Test
  void testGuard() {
    final Fixture f = new Fixture();
    // switch (o) { case Some(v) if v > 0: v; case None: 0 }
    final Source.Exp e =
        source.switchOf(
            f.local(f.o),
            ImmutableList.of(
                source.arm(
                    ImmutableList.of(
                        source.conCall("Option", "Some", f.local(f.v))),
                    source.gt(f.local(f.v), f.constant(0)),
                    f.local(f.v)),
                source.arm(source.conCall("Option", "None"), f.constant(0))),
            null);
    assertThat(f.lower(e),
        hasToString("case o do {:some, value} when value > 0 -> value; "
            + "{:none} -> 0 end"));
  }

  /** A variable used only by the guard is still bound. */
  @Test
  void testGuardOnlyVariable() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.switchOf(
            f.local(f.o),
            ImmutableList.of(
                source.arm(
                    ImmutableList.of(
                        source.conCall("Option", "Some", f.local(f.v))),
                    source.gt(f.local(f.v), f.constant(0)),
                    f.constant("positive"))),
            f.constant("other"));
    assertThat(f.lower(e),
        hasToString("case o do {:some, value} when value > 0 -> \"positive\"; "
            + "_ -> \"other\" end"));
  }

  /**
   * A constant argument stays a literal, so the clause does not match
   * more values than the arm.
   */
  @Test
  void testConstantArgument() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.switchOf(
            f.local(f.o),
            ImmutableList.of(
                source.arm(
                    source.conCall("Option", "Some", f.constant(0)),
                    f.constant("zero")),
                source.arm(
                    source.conCall("Option", "Some", f.local(f.n)),
                    f.local(f.n))),
            null);
    assertThat(f.lower(e),
        hasToString("case o do {:some, 0} -> \"zero\"; "
            + "{:some, value} -> value end"));
  }

  @Test
  void testListAndVariablePatterns() {
    final Fixture f = new Fixture();
    // switch (x) { case [a, 1]: a; case y: y + 1 }
    final Source.Exp e =
        source.switchOf(
            f.local(f.x),
            ImmutableList.of(
                source.arm(
                    source.array(f.local(f.a), f.constant(1)), f.local(f.a)),
                source.arm(
                    f.local(f.y), source.plus(f.local(f.y), f.constant(1)))),
            null);
    assertThat(f.lower(e),
        hasToString("case x do [a, 1] -> a; y -> y + 1 end"));
  }

  @Test
  void testUnknownConstructor() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.switchOf(
            f.local(f.c),
            ImmutableList.of(
                source.arm(source.conCall("Color", "Red"), f.constant(1))),
            null);
    assertThat(f.lower(e), hasToString("case c do _ -> 1 end"));
    assertThat(f.fallbackKinds(), hasToString("[UNKNOWN_CONSTRUCTOR]"));
    assertThat(f.fallbacks.get(0).detail,
        is("constructor Color.Red not found"));
  }

  @Test
  void testUnrecognizedPattern() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.switchOf(
            f.local(f.x),
            ImmutableList.of(
                source.arm(
                    source.call(source.staticRef("f"), f.local(f.a)),
                    f.constant(0))),
            null);
    assertThat(f.lower(e), hasToString("case x do _ -> 0 end"));
    assertThat(f.fallbackKinds(), hasToString("[UNRECOGNIZED_PATTERN]"));
  }

  @Test
  void testEmptyArmIsDropped() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.switchOf(
            f.local(f.x),
            ImmutableList.of(
                source.arm(ImmutableList.of(), null, f.constant(1)),
                source.arm(f.constant(2), f.constant("two"))),
            null);
    assertThat(f.lower(e), hasToString("case x do 2 -> \"two\" end"));
    assertThat(f.fallbackKinds(), hasToString("[EMPTY_ARM]"));
  }

  @Test
  void testMissingBody() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.switchOf(
            f.local(f.x),
            ImmutableList.of(
                source.arm(ImmutableList.of(f.constant(1)), null, null)),
            null);
    assertThat(f.lower(e), hasToString("case x do 1 -> nil end"));
  }

  /**
   * A bound variable beyond the constructor's arity is bound to nil
   * before the body.
   */
  @Test
  void testUnboundCapture() {
    final Fixture f = new Fixture();
    // switch (o) { case Some(a, b): a + b }
    final Source.Exp e =
        source.switchOf(
            f.local(f.o),
            ImmutableList.of(
                source.arm(
                    source.conCall(
                        "Option", "Some", f.local(f.a), f.local(f.b)),
                    source.plus(f.local(f.a), f.local(f.b)))),
            null);
    assertThat(f.lower(e),
        hasToString("case o do {:some, value} -> b = nil; value + b end"));
    assertThat(f.fallbackKinds(), hasToString("[UNBOUND_CAPTURE]"));
  }

  /**
   * A nested switch uses its own frame; its captures do not clash with,
   * or outlive, those of the enclosing clause.
   */
  @Test
  void testNestedSwitch() {
    final Fixture f = new Fixture();
    // switch (o) {
    //   case Some(v):
    //     switch (v) { case Some(w): w + v; default: v };
    //     v
    // }
    final Source.Exp inner =
        source.switchOf(
            f.local(f.v),
            ImmutableList.of(
                source.arm(
                    source.conCall("Option", "Some", f.local(f.w)),
                    source.plus(f.local(f.w), f.local(f.v)))),
            f.local(f.v));
    final Source.Exp e =
        source.switchOf(
            f.local(f.o),
            ImmutableList.of(
                source.arm(
                    source.conCall("Option", "Some", f.local(f.v)),
                    source.block(inner, f.local(f.v)))),
            null);
    assertThat(f.lower(e),
        hasToString("case o do {:some, value} -> "
            + "case value do {:some, value_2} -> value_2 + value; "
            + "_ -> value end; value end"));
  }

  /**
   * A capture does not take the name of a variable that the arm uses but
   * does not bind.
   */
  @Test
  void testCaptureDoesNotHideOuterVariable() {
    final Fixture f = new Fixture();
    // var value = 10; switch (o) { case Some(v): v + value }
    final Source.Exp e =
        source.block(
            source.varDecl(f.value, f.constant(10)),
            source.switchOf(
                f.local(f.o),
                ImmutableList.of(
                    source.arm(
                        source.conCall("Option", "Some", f.local(f.v)),
                        source.plus(f.local(f.v), f.local(f.value)))),
                null));
    assertThat(f.lower(e),
        hasToString("(value = 10; case o do {:some, value_2} -> "
            + "value_2 + value end)"));
    assertThat(f.fallbacks, empty());
  }

  /**
   * A capture does not take the name of a loop variable declared in the
   * arm, even if the loop body never uses that variable.
   */
  @Test
  void testCaptureDoesNotClashWithLoopVariable() {
    final Fixture f = new Fixture();
    // switch (o) { case Some(v): for (value in items) IO.puts(v) }
    final Source.Exp e =
        source.switchOf(
            f.local(f.o),
            ImmutableList.of(
                source.arm(
                    source.conCall("Option", "Some", f.local(f.v)),
                    source.forIn(
                        f.value,
                        f.local(f.items),
                        source.call(
                            source.field(source.staticRef("IO"), "puts"),
                            f.local(f.v))))),
            null);
    assertThat(f.lower(e),
        hasToString("case o do {:some, value_2} -> "
            + "Enum.each(items, fn value -> IO.puts(value_2) end) end"));
  }

  /** Lowering the same switch twice gives equal results. */
  @Test
  void testDeterministic() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.switchOf(
            f.local(f.p),
            ImmutableList.of(
                source.arm(
                    source.conCall("Pair", "Pair", f.local(f.x), f.local(f.y)),
                    source.plus(f.local(f.y), f.local(f.x))),
                source.arm(
                    source.conCall("Shape", "Circle", f.local(f.x)),
                    f.local(f.x))),
            source.nullConstant());
    final Target.Exp t1 = f.lower(e);
    final Target.Exp t2 = f.lower(e);
    assertThat(t2, is(t1));
    assertThat(t2, hasToString(t1.toString()));
    assertThat(t1.hashCode(), is(t2.hashCode()));
  }
}

// End SwitchCompilerTest.java
