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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // source: leaves
  CONSTANT(true),
  LOCAL(true),
  STATIC(true),

  // source: statements and structure
  VAR_DECL,
  ASSIGN,
  BLOCK,
  SWITCH,
  WHILE,
  FOR,
  BREAK(true),
  CONTINUE(true),
  RETURN,
  OBJECT_DECL(true),
  ARRAY_DECL(true),
  CALL(true),
  CON_CALL(true),
  FUNCTION,

  // shared by source and target
  IF,
  FIELD(true),
  NEGATE("-", 9, false),
  NOT("not ", 9, false),
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  EQ(" == ", 4),
  NE(" != ", 4),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  ANDALSO(" and ", 2),
  ORELSE(" or ", 1),

  // target expressions
  ATOM(true),
  LITERAL(true),
  VAR(true),
  MATCH(" = ", 0, false),
  TUPLE(true),
  LIST(true),
  MAP(true),
  KEYWORD_LIST(true),
  TARGET_BLOCK(true),
  APPLY(true),
  FN_APPLY(true),
  MACRO_CALL,
  FN(true),
  CASE(true),
  CLAUSE,
  PLACEHOLDER(true),

  // target patterns
  LITERAL_PAT(true),
  VAR_PAT(true),
  TUPLE_PAT(true),
  LIST_PAT(true),
  WILDCARD_PAT(true);

  /** Padded name, e.g. " == ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }
}

// End Op.java
