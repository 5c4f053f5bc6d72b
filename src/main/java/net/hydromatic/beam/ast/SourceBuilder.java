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
package net.hydromatic.beam.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds source tree nodes. */
public enum SourceBuilder {
  /**
   * The singleton instance of the source builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  source;

  private final Source.Jump breakJump = new Source.Jump(Op.BREAK);

  private final Source.Jump continueJump = new Source.Jump(Op.CONTINUE);

  /** Creates a variable identity. */
  public Source.Var var(int id, String name) {
    return new Source.Var(id, name);
  }

  /** Creates a constant; the value may be null. */
  public Source.Constant constant(@Nullable Object value) {
    return new Source.Constant(value);
  }

  /** Creates the "null" constant. */
  public Source.Constant nullConstant() {
    return new Source.Constant(null);
  }

  /** Creates a reference to a local variable. */
  public Source.Local local(Source.Var var) {
    return new Source.Local(var);
  }

  /** Creates a reference to a module or class. */
  public Source.StaticRef staticRef(String name) {
    return new Source.StaticRef(name);
  }

  /** Creates a variable declaration; the initializer may be null. */
  public Source.VarDecl varDecl(Source.Var var, Source.@Nullable Exp init) {
    return new Source.VarDecl(var, init);
  }

  /** Creates an assignment. */
  public Source.Assign assign(Source.Var var, Source.Exp exp) {
    return new Source.Assign(var, exp);
  }

  /** Creates a conditional with no else branch. */
  public Source.If ifThen(Source.Exp condition, Source.Exp ifTrue) {
    return new Source.If(condition, ifTrue, null);
  }

  /** Creates a conditional with an else branch. */
  public Source.If ifThenElse(
      Source.Exp condition, Source.Exp ifTrue, Source.Exp ifFalse) {
    return new Source.If(condition, ifTrue, ifFalse);
  }

  /** Creates a block. */
  public Source.Block block(Source.Exp... exps) {
    return new Source.Block(ImmutableList.copyOf(exps));
  }

  /** Creates a block. */
  public Source.Block block(List<? extends Source.Exp> exps) {
    return new Source.Block(ImmutableList.copyOf(exps));
  }

  /** Creates a switch; the default body may be null. */
  public Source.Switch switchOf(
      Source.Exp exp,
      List<Source.Arm> arms,
      Source.@Nullable Exp defaultBody) {
    return new Source.Switch(exp, ImmutableList.copyOf(arms), defaultBody);
  }

  /** Creates an arm of a switch; the guard and body may be null. */
  public Source.Arm arm(
      List<? extends Source.Exp> values,
      Source.@Nullable Exp guard,
      Source.@Nullable Exp body) {
    return new Source.Arm(ImmutableList.copyOf(values), guard, body);
  }

  /** Creates an arm of a switch with one value and no guard. */
  public Source.Arm arm(Source.Exp value, Source.Exp body) {
    return new Source.Arm(ImmutableList.of(value), null, body);
  }

  /** Creates a "while" loop. */
  public Source.While whileLoop(Source.Exp condition, Source.Exp body) {
    return new Source.While(condition, body);
  }

  /** Creates a "for (x in c)" loop. */
  public Source.ForIn forIn(
      Source.Var var, Source.Exp collection, Source.Exp body) {
    return new Source.ForIn(var, collection, body);
  }

  /** Returns the "break" statement. */
  public Source.Jump breakLoop() {
    return breakJump;
  }

  /** Returns the "continue" statement. */
  public Source.Jump continueLoop() {
    return continueJump;
  }

  /** Creates a "return" statement; the value may be null. */
  public Source.Return returnOf(Source.@Nullable Exp exp) {
    return new Source.Return(exp);
  }

  /** Creates a field of a structural literal. */
  public Map.Entry<String, Source.Exp> entry(String name, Source.Exp value) {
    return Maps.immutableEntry(name, value);
  }

  /** Creates a structural literal. Field names must be unique. */
  public Source.ObjectDecl object(List<Map.Entry<String, Source.Exp>> fields) {
    final Set<String> names = new HashSet<>();
    for (Map.Entry<String, Source.Exp> field : fields) {
      checkArgument(
          names.add(field.getKey()), "duplicate field %s", field.getKey());
    }
    return new Source.ObjectDecl(ImmutableList.copyOf(fields));
  }

  /** Creates a structural literal. Field names must be unique. */
  @SafeVarargs
  public final Source.ObjectDecl object(
      Map.Entry<String, Source.Exp>... fields) {
    return object(ImmutableList.copyOf(fields));
  }

  /** Creates an array literal. */
  public Source.ArrayDecl array(Source.Exp... args) {
    return new Source.ArrayDecl(ImmutableList.copyOf(args));
  }

  /** Creates an array literal. */
  public Source.ArrayDecl array(List<? extends Source.Exp> args) {
    return new Source.ArrayDecl(ImmutableList.copyOf(args));
  }

  /** Creates a field access. */
  public Source.Field field(Source.Exp exp, String name) {
    return new Source.Field(exp, name);
  }

  /** Creates a call. */
  public Source.Call call(Source.Exp fn, Source.Exp... args) {
    return new Source.Call(fn, ImmutableList.copyOf(args));
  }

  /** Creates a call. */
  public Source.Call call(Source.Exp fn, List<? extends Source.Exp> args) {
    return new Source.Call(fn, ImmutableList.copyOf(args));
  }

  /** Creates a call to a variant constructor. */
  public Source.ConCall conCall(
      String enumName, String tag, Source.Exp... args) {
    return new Source.ConCall(enumName, tag, ImmutableList.copyOf(args));
  }

  /** Creates a function literal. */
  public Source.Function function(List<Source.Var> params, Source.Exp body) {
    return new Source.Function(ImmutableList.copyOf(params), body);
  }

  /** Creates a unary minus. */
  public Source.Unary negate(Source.Exp arg) {
    return new Source.Unary(Op.NEGATE, arg);
  }

  /** Creates a logical negation. */
  public Source.Unary not(Source.Exp arg) {
    return new Source.Unary(Op.NOT, arg);
  }

  /** Creates a call to a binary operator. */
  public Source.Binary binary(Op op, Source.Exp a0, Source.Exp a1) {
    return new Source.Binary(op, a0, a1);
  }

  /** Creates a logical conjunction, "a && b". */
  public Source.Binary andAlso(Source.Exp a0, Source.Exp a1) {
    return binary(Op.ANDALSO, a0, a1);
  }

  /** Creates an equality test, "a == b". */
  public Source.Binary eq(Source.Exp a0, Source.Exp a1) {
    return binary(Op.EQ, a0, a1);
  }

  /** Creates an inequality test, "a != b". */
  public Source.Binary ne(Source.Exp a0, Source.Exp a1) {
    return binary(Op.NE, a0, a1);
  }

  /** Creates a comparison, "a > b". */
  public Source.Binary gt(Source.Exp a0, Source.Exp a1) {
    return binary(Op.GT, a0, a1);
  }

  /** Creates a comparison, "a < b". */
  public Source.Binary lt(Source.Exp a0, Source.Exp a1) {
    return binary(Op.LT, a0, a1);
  }

  /** Creates an addition, "a + b". */
  public Source.Binary plus(Source.Exp a0, Source.Exp a1) {
    return binary(Op.PLUS, a0, a1);
  }
}

// End SourceBuilder.java
