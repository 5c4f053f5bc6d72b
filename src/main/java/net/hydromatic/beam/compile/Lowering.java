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

import static com.google.common.base.Preconditions.checkState;

import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Target;

/**
 * Entry points for lowering.
 *
 * <p>Each call creates a fresh {@link Lowerer}, so no state survives from
 * one function to the next, and lowering the same input twice gives equal
 * output.
 */
public abstract class Lowering {
  private Lowering() {}

  /** Lowers a function literal. */
  public static Target.Fn lowerFunction(
      LoweringContext context, Source.Function function) {
    final Lowerer lowerer = new Lowerer(context);
    final Target.Fn fn = lowerer.function(function);
    checkState(lowerer.isIdle(), "clause scopes not empty");
    return fn;
  }

  /** Lowers a function body, or any other expression. */
  public static Target.Exp lowerBody(
      LoweringContext context, Source.Exp body) {
    final Lowerer lowerer = new Lowerer(context);
    final Target.Exp exp = lowerer.compile(body);
    checkState(lowerer.isIdle(), "clause scopes not empty");
    return exp;
  }
}

// End Lowering.java
