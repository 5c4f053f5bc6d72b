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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.beam.ast.Source;
import org.junit.jupiter.api.Test;

/** Tests {@link LiteralShapeClassifier}. */
public class LiteralShapeClassifierTest {
  private static LiteralShape shapeOf(String... names) {
    final ImmutableList.Builder<Map.Entry<String, Source.Exp>> b =
        ImmutableList.builder();
    for (String name : names) {
      b.add(source.entry(name, source.constant(0)));
    }
    return LiteralShapeClassifier.shapeOf(b.build());
  }

  @Test
  void testShapeOf() {
    assertThat(shapeOf("_1", "_2"), is(LiteralShape.TUPLE));
    assertThat(shapeOf("_2", "_10", "_1"), is(LiteralShape.TUPLE));
    assertThat(shapeOf("_0"), is(LiteralShape.PLAIN_RECORD));
    assertThat(shapeOf("_1", "x"), is(LiteralShape.PLAIN_RECORD));
    assertThat(shapeOf("_01"), is(LiteralShape.PLAIN_RECORD));
    assertThat(shapeOf(), is(LiteralShape.PLAIN_RECORD));
    assertThat(shapeOf("strategy", "maxRestarts"),
        is(LiteralShape.OPTION_LIST));
    assertThat(shapeOf("strategy", "max_seconds"),
        is(LiteralShape.OPTION_LIST));
    assertThat(shapeOf("strategy"), is(LiteralShape.PLAIN_RECORD));
    assertThat(shapeOf("maxRestarts", "maxSeconds"),
        is(LiteralShape.PLAIN_RECORD));
    assertThat(shapeOf("id", "start"), is(LiteralShape.PROCESS_SPEC));
    assertThat(shapeOf("id"), is(LiteralShape.PLAIN_RECORD));
    // option list takes priority over process descriptor
    assertThat(shapeOf("id", "start", "strategy", "maxRestarts"),
        is(LiteralShape.OPTION_LIST));
  }

  @Test
  void testTuple() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.object(
            source.entry("_2", f.constant("b")),
            source.entry("_10", f.constant(10)),
            source.entry("_1", f.constant("a")));
    assertThat(f.lower(e), hasToString("{\"a\", \"b\", 10}"));
  }

  @Test
  void testOptionList() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.object(
            source.entry("strategy", f.constant("oneForOne")),
            source.entry("maxRestarts", f.constant(3)),
            source.entry("maxSeconds", f.local(f.n)));
    assertThat(f.lower(e),
        hasToString("[strategy: :one_for_one, max_restarts: 3, "
            + "max_seconds: n]"));
  }

  @Test
  void testProcessSpec() {
    final Fixture f = new Fixture();
    final Source.Exp start =
        source.object(
            source.entry("module", f.constant("Worker")),
            source.entry("func", f.constant("startLink")),
            source.entry("args", source.array(f.local(f.id))));
    final Source.Exp e =
        source.object(
            source.entry("id", f.local(f.id)),
            source.entry("start", start),
            source.entry("restart", f.constant("permanent")),
            source.entry("shutdown", f.constant(5000)),
            source.entry("type", f.constant("worker")));
    assertThat(f.lower(e),
        hasToString("%{:id => id, :start => {Worker, :start_link, [id]}, "
            + ":restart => :permanent, :shutdown => 5000, "
            + ":type => :worker}"));
    assertThat(f.fallbacks, empty());
  }

  /** A start literal that lacks a field is compiled as a plain record. */
  @Test
  void testMalformedStart() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.object(
            source.entry("id", f.constant("w1")),
            source.entry("start",
                source.object(
                    source.entry("module", f.constant("Worker")),
                    source.entry("func", f.constant("startLink")))));
    assertThat(f.lower(e),
        hasToString("%{:id => \"w1\", :start => "
            + "%{:module => \"Worker\", :func => \"startLink\"}}"));
    assertThat(f.fallbackKinds(), hasToString("[MALFORMED_START]"));
    assertThat(f.fallbacks.get(0).detail,
        is("start literal {module: \"Worker\", func: \"startLink\"} "
            + "lacks [args]"));
  }

  /** A start value that is not a literal is compiled as usual, silently. */
  @Test
  void testStartNotLiteral() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.object(
            source.entry("id", f.constant("w1")),
            source.entry("start", f.local(f.s)));
    assertThat(f.lower(e), hasToString("%{:id => \"w1\", :start => s}"));
    assertThat(f.fallbacks, empty());
  }

  @Test
  void testPlainRecord() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.object(
            source.entry("userName", f.constant("ann")),
            source.entry("retryCount", f.local(f.retryCount)),
            source.entry("tags", source.array()));
    assertThat(f.lower(e),
        hasToString("%{:user_name => \"ann\", :retry_count => retry_count, "
            + ":tags => []}"));
  }

  /** A variable value uses the name from the rename table, if present. */
  @Test
  void testRenameTable() {
    final Fixture f = new Fixture();
    final Source.Exp e =
        source.object(
            source.entry("count", f.local(f.n)),
            source.entry("total", f.local(f.x)));
    final LoweringContext context =
        f.contextBuilder()
            .renames(RenameTable.of(ImmutableMap.of(f.n, "n_renamed")))
            .build();
    assertThat(Lowering.lowerBody(context, e),
        hasToString("%{:count => n_renamed, :total => x}"));
  }

  /**
   * A variable captured by an enclosing clause keeps its capture name, even
   * if the rename table has an entry for it.
   */
  @Test
  void testCaptureBeatsRenameTable() {
    final Fixture f = new Fixture();
    // switch (o) { case Some(v): {user: v, count: n} }
    final Source.Exp e =
        source.switchOf(
            f.local(f.o),
            ImmutableList.of(
                source.arm(
                    source.conCall("Option", "Some", f.local(f.v)),
                    source.object(
                        source.entry("user", f.local(f.v)),
                        source.entry("count", f.local(f.n))))),
            null);
    final LoweringContext context =
        f.contextBuilder()
            .renames(
                RenameTable.of(
                    ImmutableMap.of(f.v, "v_renamed", f.n, "n_renamed")))
            .build();
    assertThat(Lowering.lowerBody(context, e),
        hasToString("case o do {:some, value} -> "
            + "%{:user => value, :count => n_renamed} end"));
  }

  private static Source.Exp coalesce(Fixture f, boolean nullFirst) {
    // { var tmp = user.name; tmp != null ? tmp : "anonymous" }
    final Source.Exp tmpRef = f.local(f.tmp);
    final Source.Exp test =
        nullFirst
            ? source.ne(source.nullConstant(), tmpRef)
            : source.ne(tmpRef, source.nullConstant());
    return source.block(
        source.varDecl(f.tmp, source.field(f.local(f.user), "name")),
        source.ifThenElse(test, f.local(f.tmp), f.constant("anonymous")));
  }

  @Test
  void testNullCoalescing() {
    final Fixture f = new Fixture();
    final String expected = "%{:name => if (tmp = user.name) != nil, "
        + "do: tmp, else: \"anonymous\"}";
    assertThat(f.lower(source.object(source.entry("name", coalesce(f, false)))),
        hasToString(expected));
    assertThat(f.lower(source.object(source.entry("name", coalesce(f, true)))),
        hasToString(expected));
  }

  @Test
  void testNullCoalescingDisabled() {
    final Fixture f = new Fixture();
    final LoweringContext context =
        f.contextBuilder().set(Prop.INLINE_NULL_COALESCING, false).build();
    final Source.Exp e =
        source.object(source.entry("name", coalesce(f, false)));
    assertThat(Lowering.lowerBody(context, e),
        hasToString("%{:name => (tmp = user.name; "
            + "if tmp != nil do tmp else \"anonymous\" end)}"));
  }

  /** A two-statement block that is not the idiom is compiled unchanged. */
  @Test
  void testOtherBlock() {
    final Fixture f = new Fixture();
    final Source.Exp block =
        source.block(
            source.varDecl(f.tmp, f.constant(1)),
            source.ifThenElse(
                source.ne(f.local(f.tmp), source.nullConstant()),
                f.local(f.x),
                f.constant(0)));
    final List<Map.Entry<String, Source.Exp>> fields =
        ImmutableList.of(source.entry("v", block));
    final LiteralShapeClassifier.Result result =
        new LiteralShapeClassifier(f.context(), f::lower, new ClauseScopes())
            .classify(fields);
    assertThat(result.shape, is(LiteralShape.PLAIN_RECORD));
    assertThat(result.exp,
        hasToString("%{:v => (tmp = 1; if tmp != nil do x else 0 end)}"));
  }
}

// End LiteralShapeClassifierTest.java
