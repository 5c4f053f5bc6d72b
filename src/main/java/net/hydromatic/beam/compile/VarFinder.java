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

import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds the variables that an expression references or declares, including
 * loop variables and function parameters.
 */
class VarFinder extends Visitor {
  final Consumer<Source.Var> consumer;

  VarFinder(Consumer<Source.Var> consumer) {
    this.consumer = consumer;
  }

  /** Finds the variables in some expressions, in order of appearance. */
  static ImmutableSet<Source.Var> vars(Source.@Nullable Exp... exps) {
    return vars(Arrays.asList(exps));
  }

  /** Finds the variables in some expressions, in order of appearance. */
  static ImmutableSet<Source.Var> vars(
      List<? extends Source.@Nullable Exp> exps) {
    final ImmutableSet.Builder<Source.Var> set = ImmutableSet.builder();
    final VarFinder finder = new VarFinder(set::add);
    for (Source.@Nullable Exp exp : exps) {
      if (exp != null) {
        exp.accept(finder);
      }
    }
    return set.build();
  }

  /** Returns the normalized names of some variables. */
  static ImmutableSet<String> names(Iterable<Source.Var> vars) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    vars.forEach(v -> names.add(NameNormalizer.normalize(v.name)));
    return names.build();
  }

  @Override
  protected void visit(Source.Local local) {
    consumer.accept(local.var);
  }

  @Override
  protected void visit(Source.VarDecl varDecl) {
    consumer.accept(varDecl.var);
    super.visit(varDecl);
  }

  @Override
  protected void visit(Source.Assign assign) {
    consumer.accept(assign.var);
    super.visit(assign);
  }

  @Override
  protected void visit(Source.ForIn forIn) {
    consumer.accept(forIn.var);
    super.visit(forIn);
  }

  @Override
  protected void visit(Source.Function function) {
    function.params.forEach(consumer);
    super.visit(function);
  }
}

// End VarFinder.java
