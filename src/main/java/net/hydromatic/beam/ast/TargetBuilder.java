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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds target tree nodes. */
public enum TargetBuilder {
  /**
   * The singleton instance of the target builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  target;

  private final Target.Literal nilLiteral = new Target.Literal(null);

  private final Target.Literal trueLiteral = new Target.Literal(true);

  private final Target.Literal falseLiteral = new Target.Literal(false);

  private final Target.WildcardPat wildcardPat = new Target.WildcardPat();

  /** Creates a symbolic atom, ":name". */
  public Target.Atom atom(String name) {
    return new Target.Atom(name, false);
  }

  /** Creates a module alias, "Name". */
  public Target.Atom alias(String name) {
    return new Target.Atom(name, true);
  }

  /** Returns the nil literal. */
  public Target.Literal nil() {
    return nilLiteral;
  }

  /** Creates a literal; null becomes nil. */
  public Target.Literal literal(@Nullable Object value) {
    if (value == null) {
      return nilLiteral;
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? trueLiteral : falseLiteral;
    }
    return new Target.Literal(value);
  }

  /** Creates a reference to a variable. */
  public Target.Var var(String name) {
    return new Target.Var(name);
  }

  /** Creates a binding, "pat = exp". */
  public Target.Match match(Target.Pat pat, Target.Exp exp) {
    return new Target.Match(pat, exp);
  }

  /** Creates a binding of a variable, "name = exp". */
  public Target.Match bind(String name, Target.Exp exp) {
    return new Target.Match(varPat(name), exp);
  }

  /** Creates a tuple. */
  public Target.Tuple tuple(Target.Exp... args) {
    return new Target.Tuple(ImmutableList.copyOf(args));
  }

  /** Creates a tuple. */
  public Target.Tuple tuple(List<? extends Target.Exp> args) {
    return new Target.Tuple(ImmutableList.copyOf(args));
  }

  /** Creates a list. */
  public Target.ListExp list(List<? extends Target.Exp> args) {
    return new Target.ListExp(ImmutableList.copyOf(args));
  }

  /** Creates a map. */
  public Target.MapExp map(
      List<? extends Map.Entry<? extends Target.Exp, Target.Exp>> entries) {
    final ImmutableList.Builder<Map.Entry<Target.Exp, Target.Exp>> b =
        ImmutableList.builder();
    entries.forEach(e -> b.add(Maps.immutableEntry(e.getKey(), e.getValue())));
    return new Target.MapExp(b.build());
  }

  /** Creates a keyword list. */
  public Target.KeywordList keywordList(
      List<Map.Entry<String, Target.Exp>> entries) {
    return new Target.KeywordList(ImmutableList.copyOf(entries));
  }

  /** Creates an entry of a map or keyword list. */
  public <K> Map.Entry<K, Target.Exp> entry(K key, Target.Exp value) {
    return Maps.immutableEntry(key, value);
  }

  /** Creates a conditional that is rendered on several lines. */
  public Target.If ifThenElse(
      Target.Exp condition, Target.Exp ifTrue, Target.Exp ifFalse) {
    return new Target.If(condition, ifTrue, ifFalse, false);
  }

  /** Creates a conditional that is rendered on one line. */
  public Target.If inlineIf(
      Target.Exp condition, Target.Exp ifTrue, Target.Exp ifFalse) {
    return new Target.If(condition, ifTrue, ifFalse, true);
  }

  /**
   * Creates a sequence of expressions.
   *
   * <p>Nested sequences are flattened; a sequence of one expression is that
   * expression, and an empty sequence is nil.
   */
  public Target.Exp block(List<? extends Target.Exp> exps) {
    final ImmutableList.Builder<Target.Exp> b = ImmutableList.builder();
    for (Target.Exp exp : exps) {
      if (exp instanceof Target.Block) {
        b.addAll(((Target.Block) exp).exps);
      } else {
        b.add(exp);
      }
    }
    final ImmutableList<Target.Exp> list = b.build();
    switch (list.size()) {
      case 0:
        return nilLiteral;
      case 1:
        return list.get(0);
      default:
        return new Target.Block(list);
    }
  }

  /** Creates a call to a named function; the receiver may be null. */
  public Target.Apply apply(
      Target.@Nullable Exp receiver,
      String name,
      List<? extends Target.Exp> args) {
    return new Target.Apply(receiver, name, ImmutableList.copyOf(args));
  }

  /** Creates a call to an anonymous function value. */
  public Target.FnApply fnApply(
      Target.Exp fn, List<? extends Target.Exp> args) {
    return new Target.FnApply(fn, ImmutableList.copyOf(args));
  }

  /** Creates a field access. */
  public Target.Field field(Target.Exp exp, String name) {
    return new Target.Field(exp, name);
  }

  /** Creates a call to a macro. */
  public Target.MacroCall macroCall(
      String name, List<? extends Target.Exp> args) {
    return new Target.MacroCall(name, ImmutableList.copyOf(args));
  }

  /** Creates an anonymous function. */
  public Target.Fn fn(List<Target.Clause> clauses) {
    return new Target.Fn(ImmutableList.copyOf(clauses));
  }

  /** Creates a case expression. */
  public Target.Case caseOf(Target.Exp exp, List<Target.Clause> clauses) {
    return new Target.Case(exp, ImmutableList.copyOf(clauses));
  }

  /** Creates a clause; the guard may be null. */
  public Target.Clause clause(
      List<? extends Target.Pat> pats,
      Target.@Nullable Exp guard,
      Target.Exp body) {
    return new Target.Clause(ImmutableList.copyOf(pats), guard, body);
  }

  /** Creates a call to a unary operator. */
  public Target.Unary unary(Op op, Target.Exp arg) {
    return new Target.Unary(op, arg);
  }

  /** Creates a logical negation. */
  public Target.Unary not(Target.Exp arg) {
    return new Target.Unary(Op.NOT, arg);
  }

  /** Creates a call to a binary operator. */
  public Target.Binary binary(Op op, Target.Exp a0, Target.Exp a1) {
    return new Target.Binary(op, a0, a1);
  }

  /** Creates an inert placeholder. */
  public Target.Placeholder placeholder(String reason) {
    return new Target.Placeholder(reason);
  }

  /** Creates a literal pattern. */
  public Target.LiteralPat literalPat(Target.Exp value) {
    return new Target.LiteralPat(value);
  }

  /** Creates a variable pattern. */
  public Target.VarPat varPat(String name) {
    return new Target.VarPat(name);
  }

  /** Creates a tuple pattern. */
  public Target.TuplePat tuplePat(List<? extends Target.Pat> args) {
    return new Target.TuplePat(ImmutableList.copyOf(args));
  }

  /** Creates a list pattern. */
  public Target.ListPat listPat(List<? extends Target.Pat> args) {
    return new Target.ListPat(ImmutableList.copyOf(args));
  }

  /** Returns the wildcard pattern. */
  public Target.WildcardPat wildcardPat() {
    return wildcardPat;
  }
}

// End TargetBuilder.java
