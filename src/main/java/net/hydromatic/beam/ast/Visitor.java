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

import java.util.Map;

/**
 * Visits source trees.
 *
 * <p>The default implementation of each method visits the children of the
 * node, left to right; that is, a pre-order, depth-first traversal. Override
 * a method to stop descending or to act on a node.
 */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends Source.Exp> void accept(E e) {
    e.accept(this);
  }

  // leaves

  protected void visit(Source.Constant constant) {}

  protected void visit(Source.Local local) {}

  protected void visit(Source.StaticRef staticRef) {}

  protected void visit(Source.Jump jump) {}

  // statements

  protected void visit(Source.VarDecl varDecl) {
    if (varDecl.init != null) {
      varDecl.init.accept(this);
    }
  }

  protected void visit(Source.Assign assign) {
    assign.exp.accept(this);
  }

  protected void visit(Source.Return aReturn) {
    if (aReturn.exp != null) {
      aReturn.exp.accept(this);
    }
  }

  protected void visit(Source.Block block) {
    block.exps.forEach(this::accept);
  }

  // control flow

  protected void visit(Source.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    if (anIf.ifFalse != null) {
      anIf.ifFalse.accept(this);
    }
  }

  protected void visit(Source.Switch aSwitch) {
    aSwitch.exp.accept(this);
    for (Source.Arm arm : aSwitch.arms) {
      arm.values.forEach(this::accept);
      if (arm.guard != null) {
        arm.guard.accept(this);
      }
      if (arm.body != null) {
        arm.body.accept(this);
      }
    }
    if (aSwitch.defaultBody != null) {
      aSwitch.defaultBody.accept(this);
    }
  }

  protected void visit(Source.While aWhile) {
    aWhile.condition.accept(this);
    aWhile.body.accept(this);
  }

  protected void visit(Source.ForIn forIn) {
    forIn.collection.accept(this);
    forIn.body.accept(this);
  }

  // value constructors

  protected void visit(Source.ObjectDecl objectDecl) {
    for (Map.Entry<String, Source.Exp> field : objectDecl.fields) {
      field.getValue().accept(this);
    }
  }

  protected void visit(Source.ArrayDecl arrayDecl) {
    arrayDecl.args.forEach(this::accept);
  }

  protected void visit(Source.ConCall conCall) {
    conCall.args.forEach(this::accept);
  }

  protected void visit(Source.Function function) {
    function.body.accept(this);
  }

  // calls and operators

  protected void visit(Source.Field field) {
    field.exp.accept(this);
  }

  protected void visit(Source.Call call) {
    call.fn.accept(this);
    call.args.forEach(this::accept);
  }

  protected void visit(Source.Unary unary) {
    unary.arg.accept(this);
  }

  protected void visit(Source.Binary binary) {
    binary.a0.accept(this);
    binary.a1.accept(this);
  }
}

// End Visitor.java
