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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Source expressions.
 *
 * <p>A source tree is the type-checked representation of an imperative,
 * object-oriented program. It is read-only: lowering never modifies it.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Use {@link SourceBuilder#source} to create nodes.
 */
public class Source {
  private Source() {}

  /**
   * Identity of a source variable.
   *
   * <p>Two variables are the same if they have the same {@link #id}; the type
   * checker guarantees that ids are unique within a compilation unit. The
   * {@link #name} is as written in the source, usually lower camel case.
   */
  public static final class Var {
    public final int id;
    public final String name;

    Var(int id, String name) {
      this.id = id;
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return id;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var
              && ((Var) o).id == id
              && ((Var) o).name.equals(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Base class of source expressions. Statements are expressions too. */
  public abstract static sealed class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }

    /** Accepts a visitor. */
    public abstract void accept(Visitor visitor);
  }

  /** Constant: integer, real, string, boolean, or null. */
  public static final class Constant extends Exp {
    public final @Nullable Object value;

    Constant(@Nullable Object value) {
      super(Op.CONSTANT);
      this.value = value;
      checkArgument(
          value == null
              || value instanceof Number
              || value instanceof String
              || value instanceof Boolean,
          "invalid constant %s",
          value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (value == null) {
        return w.append("null");
      }
      if (value instanceof String) {
        return w.appendQuoted((String) value);
      }
      return w.append(value.toString());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a local variable. */
  public static final class Local extends Exp {
    public final Var var;

    Local(Var var) {
      super(Op.LOCAL);
      this.var = requireNonNull(var);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(var.name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a module or class by name, e.g. "Supervisor". */
  public static final class StaticRef extends Exp {
    public final String name;

    StaticRef(String name) {
      super(Op.STATIC);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Declaration of a local variable, with an optional initializer. */
  public static final class VarDecl extends Exp {
    public final Var var;
    public final @Nullable Exp init;

    VarDecl(Var var, @Nullable Exp init) {
      super(Op.VAR_DECL);
      this.var = requireNonNull(var);
      this.init = init;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("var ").append(var.name);
      if (init != null) {
        w.append(" = ").append(init, 0, 0);
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assignment to a local variable. */
  public static final class Assign extends Exp {
    public final Var var;
    public final Exp exp;

    Assign(Var var, Exp exp) {
      super(Op.ASSIGN);
      this.var = requireNonNull(var);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(var.name).append(" = ").append(exp, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Conditional, "if (c) a else b".
   *
   * <p>Serves both as a statement and as a selection expression ("c ? a :
   * b"). If {@link #ifFalse} is null, there is no else branch.
   */
  public static final class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final @Nullable Exp ifFalse;

    If(Exp condition, Exp ifTrue, @Nullable Exp ifFalse) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = ifFalse;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if (").append(condition, 0, 0).append(") ");
      w.append(ifTrue, 0, 0);
      if (ifFalse != null) {
        w.append(" else ").append(ifFalse, 0, 0);
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Sequence of statements; its value is the value of the last. */
  public static final class Block extends Exp {
    public final List<Exp> exps;

    Block(ImmutableList<Exp> exps) {
      super(Op.BLOCK);
      this.exps = requireNonNull(exps);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("{").appendAll(exps, "; ").append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Branch-on-value construct, "switch (e) { case v1, v2 if g: body; default:
   * body }".
   */
  public static final class Switch extends Exp {
    public final Exp exp;
    public final List<Arm> arms;
    /** Body of the default arm; null if there is no default arm. */
    public final @Nullable Exp defaultBody;

    Switch(Exp exp, ImmutableList<Arm> arms, @Nullable Exp defaultBody) {
      super(Op.SWITCH);
      this.exp = requireNonNull(exp);
      this.arms = requireNonNull(arms);
      this.defaultBody = defaultBody;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("switch (").append(exp, 0, 0).append(") {");
      for (int i = 0; i < arms.size(); i++) {
        w.append(i == 0 ? "" : "; ");
        arms.get(i).unparse(w);
      }
      if (defaultBody != null) {
        w.append(arms.isEmpty() ? "" : "; ")
            .append("default: ")
            .append(defaultBody, 0, 0);
      }
      return w.append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Arm of a {@link Switch}. Not a node in its own right. */
  public static final class Arm {
    public final List<Exp> values;
    public final @Nullable Exp guard;
    public final @Nullable Exp body;

    Arm(ImmutableList<Exp> values, @Nullable Exp guard, @Nullable Exp body) {
      this.values = requireNonNull(values);
      this.guard = guard;
      this.body = body;
    }

    void unparse(AstWriter w) {
      w.append("case ").appendAll(values, ", ");
      if (guard != null) {
        w.append(" if ").append(guard, 0, 0);
      }
      w.append(":");
      if (body != null) {
        w.append(" ").append(body, 0, 0);
      }
    }
  }

  /** Base class for loops. */
  public abstract static sealed class Loop extends Exp {
    public final Exp body;

    Loop(Op op, Exp body) {
      super(op);
      this.body = requireNonNull(body);
    }
  }

  /** Loop that runs while a condition holds, "while (c) body". */
  public static final class While extends Loop {
    public final Exp condition;

    While(Exp condition, Exp body) {
      super(Op.WHILE, body);
      this.condition = requireNonNull(condition);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("while (")
          .append(condition, 0, 0)
          .append(") ")
          .append(body, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Loop over the elements of a collection, "for (x in c) body". */
  public static final class ForIn extends Loop {
    public final Var var;
    public final Exp collection;

    ForIn(Var var, Exp collection, Exp body) {
      super(Op.FOR, body);
      this.var = requireNonNull(var);
      this.collection = requireNonNull(collection);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("for (")
          .append(var.name)
          .append(" in ")
          .append(collection, 0, 0)
          .append(") ")
          .append(body, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "break" or "continue". */
  public static final class Jump extends Exp {
    Jump(Op op) {
      super(op);
      checkArgument(op == Op.BREAK || op == Op.CONTINUE);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op == Op.BREAK ? "break" : "continue");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "return" statement, with an optional value. */
  public static final class Return extends Exp {
    public final @Nullable Exp exp;

    Return(@Nullable Exp exp) {
      super(Op.RETURN);
      this.exp = exp;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("return");
      return exp == null ? w : w.append(" ").append(exp, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Anonymous structural literal, "{name: value, ...}".
   *
   * <p>Fields are in declaration order, and names are unique.
   */
  public static final class ObjectDecl extends Exp {
    public final List<Map.Entry<String, Exp>> fields;

    ObjectDecl(ImmutableList<Map.Entry<String, Exp>> fields) {
      super(Op.OBJECT_DECL);
      this.fields = requireNonNull(fields);
    }

    /** Returns the value of the field with a given name, or null. */
    public @Nullable Exp get(String name) {
      for (Map.Entry<String, Exp> field : fields) {
        if (field.getKey().equals(name)) {
          return field.getValue();
        }
      }
      return null;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      for (int i = 0; i < fields.size(); i++) {
        final Map.Entry<String, Exp> field = fields.get(i);
        w.append(i == 0 ? "" : ", ")
            .append(field.getKey())
            .append(": ")
            .append(field.getValue(), 0, 0);
      }
      return w.append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Array literal, "[a, b, c]". */
  public static final class ArrayDecl extends Exp {
    public final List<Exp> args;

    ArrayDecl(ImmutableList<Exp> args) {
      super(Op.ARRAY_DECL);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(args, ", ").append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Field access, "e.name". */
  public static final class Field extends Exp {
    public final Exp exp;
    public final String name;

    Field(Exp exp, String name) {
      super(Op.FIELD);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.left).append(".").append(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call of a function or method, "f(a, b)". */
  public static final class Call extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    Call(Exp fn, ImmutableList<Exp> args) {
      super(Op.CALL);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(fn, left, op.left)
          .append("(")
          .appendAll(args, ", ")
          .append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Call to a variant constructor, "Some(x)".
   *
   * <p>{@link #enumName} is the name of the algebraic data type that declares
   * the constructor, and {@link #tag} is the constructor's name.
   */
  public static final class ConCall extends Exp {
    public final String enumName;
    public final String tag;
    public final List<Exp> args;

    ConCall(String enumName, String tag, ImmutableList<Exp> args) {
      super(Op.CON_CALL);
      this.enumName = requireNonNull(enumName);
      this.tag = requireNonNull(tag);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(tag);
      return args.isEmpty()
          ? w
          : w.append("(").appendAll(args, ", ").append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function literal, "function (a, b) body". */
  public static final class Function extends Exp {
    public final List<Var> params;
    public final Exp body;

    Function(ImmutableList<Var> params, Exp body) {
      super(Op.FUNCTION);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("function (");
      for (int i = 0; i < params.size(); i++) {
        w.append(i == 0 ? "" : ", ").append(params.get(i).name);
      }
      return w.append(") ").append(body, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a unary operator, "-e" or "!e". */
  public static final class Unary extends Exp {
    public final Exp arg;

    Unary(Op op, Exp arg) {
      super(op);
      this.arg = requireNonNull(arg);
      checkArgument(op == Op.NEGATE || op == Op.NOT, "not unary: %s", op);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, arg, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a binary operator, "a + b". */
  public static final class Binary extends Exp {
    public final Exp a0;
    public final Exp a1;

    Binary(Op op, Exp a0, Exp a1) {
      super(op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.ordinal() >= Op.TIMES.ordinal()
          && op.ordinal() <= Op.ORELSE.ordinal(), "not binary: %s", op);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Source.java
