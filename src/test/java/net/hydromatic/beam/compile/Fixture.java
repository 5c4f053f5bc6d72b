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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Target;

/**
 * Variables, constructors and a recording tracer, shared by the tests in
 * this package.
 */
class Fixture {
  final List<Fallback> fallbacks = new ArrayList<>();
  final List<String> loops = new ArrayList<>();

  final Tracer tracer =
      Tracers.withOnLoop(
          Tracers.withOnFallback(Tracers.empty(), fallbacks::add),
          (loop, exitPattern) -> loops.add(loop.op + ": " + exitPattern));

  final TypeLookup typeLookup =
      TypeLookup.of(
          ImmutableList.of(
              new TypeLookup.Constructor(
                  "Option", "Some", ImmutableList.of("value")),
              new TypeLookup.Constructor("Option", "None", ImmutableList.of()),
              new TypeLookup.Constructor(
                  "Shape", "Rect", ImmutableList.of("width", "height")),
              new TypeLookup.Constructor(
                  "Shape", "Circle", ImmutableList.of("radius")),
              new TypeLookup.Constructor(
                  "Pair", "Pair", ImmutableList.of("first", "second")),
              new TypeLookup.Constructor(
                  "Message",
                  "StatusUpdate",
                  ImmutableList.of("workerId", "newStatus"))));

  final Source.Var a = source.var(1, "a");
  final Source.Var b = source.var(2, "b");
  final Source.Var c = source.var(3, "c");
  final Source.Var h = source.var(4, "h");
  final Source.Var i = source.var(5, "i");
  final Source.Var n = source.var(6, "n");
  final Source.Var o = source.var(7, "o");
  final Source.Var p = source.var(8, "p");
  final Source.Var s = source.var(9, "s");
  final Source.Var v = source.var(10, "v");
  final Source.Var w = source.var(11, "w");
  final Source.Var x = source.var(12, "x");
  final Source.Var y = source.var(13, "y");
  final Source.Var tmp = source.var(14, "tmp");
  final Source.Var user = source.var(15, "user");
  final Source.Var item = source.var(16, "item");
  final Source.Var items = source.var(17, "items");
  final Source.Var retryCount = source.var(18, "retryCount");
  final Source.Var msg = source.var(19, "msg");
  final Source.Var id = source.var(20, "id");
  final Source.Var status = source.var(21, "status");
  final Source.Var value = source.var(22, "value");
  final Source.Var acc = source.var(23, "acc");

  LoweringContext.Builder contextBuilder() {
    return LoweringContext.builder().typeLookup(typeLookup).tracer(tracer);
  }

  LoweringContext context() {
    return contextBuilder().build();
  }

  /** Lowers an expression with the default context. */
  Target.Exp lower(Source.Exp exp) {
    return Lowering.lowerBody(context(), exp);
  }

  /** Returns the kinds of the fallbacks reported so far. */
  List<Fallback.Kind> fallbackKinds() {
    final List<Fallback.Kind> kinds = new ArrayList<>();
    fallbacks.forEach(fallback -> kinds.add(fallback.kind));
    return kinds;
  }

  Source.Local local(Source.Var var) {
    return source.local(var);
  }

  Source.Constant constant(Object value) {
    return source.constant(value);
  }
}

// End Fixture.java
