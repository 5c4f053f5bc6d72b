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

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Target expressions and patterns.
 *
 * <p>The target is a functional, pattern-matching runtime: values are atoms,
 * tuples, lists, immutable maps and keyword lists; control flow is
 * conditionals and guarded clause sets.
 *
 * <p>Nodes are immutable and have structural equality, so that two lowerings
 * of the same source tree can be compared. {@link #toString()} gives a
 * compact rendering in target syntax, for debugging and tests.
 *
 * <p>This class functions as a namespace. Use {@link TargetBuilder#target}
 * to create nodes.
 */
public class Target {
  private Target() {}

  /** Base class of target expressions. */
  public abstract static sealed class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }
  }

  /**
   * Symbolic atom, such as ":ok".
   *
   * <p>If {@link #alias} is true, the atom names a module and is written
   * without a colon, such as "MyWorker".
   */
  public static final class Atom extends Exp {
    public final String name;
    public final boolean alias;

    Atom(String name, boolean alias) {
      super(Op.ATOM);
      this.name = requireNonNull(name);
      this.alias = alias;
      checkArgument(!name.isEmpty(), "empty atom");
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + (alias ? 1 : 0);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Atom
              && name.equals(((Atom) o).name)
              && alias == ((Atom) o).alias;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return alias ? w.append(name) : w.append(":").append(name);
    }
  }

  /** Literal: number, string, boolean, or nil (represented by null). */
  public static final class Literal extends Exp {
    public final @Nullable Object value;

    Literal(@Nullable Object value) {
      super(Op.LITERAL);
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal && Objects.equals(value, ((Literal) o).value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (value == null) {
        return w.append("nil");
      }
      if (value instanceof String) {
        return w.appendQuoted((String) value);
      }
      return w.append(value.toString());
    }
  }

  /** Reference to a variable. */
  public static final class Var extends Exp {
    public final String name;

    Var(String name) {
      super(Op.VAR);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && name.equals(((Var) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Binding of a pattern to a value, "pat = exp". */
  public static final class Match extends Exp {
    public final Pat pat;
    public final Exp exp;

    Match(Pat pat, Exp exp) {
      super(Op.MATCH);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pat, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Match
              && pat.equals(((Match) o).pat)
              && exp.equals(((Match) o).exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, pat, op, exp, right);
    }
  }

  /** Tuple, "{a, b}". */
  public static final class Tuple extends Exp {
    public final List<Exp> args;

    Tuple(List<Exp> args) {
      super(Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Tuple && args.equals(((Tuple) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("{").appendAll(args, ", ").append("}");
    }
  }

  /** List, "[a, b]". */
  public static final class ListExp extends Exp {
    public final List<Exp> args;

    ListExp(List<Exp> args) {
      super(Op.LIST);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp && args.equals(((ListExp) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(args, ", ").append("]");
    }
  }

  /** Immutable map, "%{:a => 1}". Entries are in insertion order. */
  public static final class MapExp extends Exp {
    public final List<Map.Entry<Exp, Exp>> entries;

    MapExp(List<Map.Entry<Exp, Exp>> entries) {
      super(Op.MAP);
      this.entries = requireNonNull(entries);
    }

    @Override
    public int hashCode() {
      return entries.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MapExp && entries.equals(((MapExp) o).entries);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("%{");
      for (int i = 0; i < entries.size(); i++) {
        final Map.Entry<Exp, Exp> entry = entries.get(i);
        w.append(i == 0 ? "" : ", ")
            .append(entry.getKey(), 0, 0)
            .append(" => ")
            .append(entry.getValue(), 0, 0);
      }
      return w.append("}");
    }
  }

  /** Keyword-style pair list, "[strategy: :one_for_one, max_restarts: 5]". */
  public static final class KeywordList extends Exp {
    public final List<Map.Entry<String, Exp>> entries;

    KeywordList(List<Map.Entry<String, Exp>> entries) {
      super(Op.KEYWORD_LIST);
      this.entries = requireNonNull(entries);
    }

    @Override
    public int hashCode() {
      return entries.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof KeywordList
              && entries.equals(((KeywordList) o).entries);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[");
      for (int i = 0; i < entries.size(); i++) {
        final Map.Entry<String, Exp> entry = entries.get(i);
        w.append(i == 0 ? "" : ", ")
            .append(entry.getKey())
            .append(": ")
            .append(entry.getValue(), 0, 0);
      }
      return w.append("]");
    }
  }

  /**
   * Conditional expression.
   *
   * <p>If {@link #inline} is true, the conditional is rendered on one line,
   * "if c, do: a, else: b". The flag is a hint to the printer and does not
   * change the meaning.
   */
  public static final class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;
    public final boolean inline;

    If(Exp condition, Exp ifTrue, Exp ifFalse, boolean inline) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
      this.inline = inline;
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse, inline);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof If
              && condition.equals(((If) o).condition)
              && ifTrue.equals(((If) o).ifTrue)
              && ifFalse.equals(((If) o).ifFalse)
              && inline == ((If) o).inline;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("if ").append(condition, 0, 0);
      if (inline) {
        return w.append(", do: ")
            .append(ifTrue, 0, 0)
            .append(", else: ")
            .append(ifFalse, 0, 0);
      }
      w.append(" do ");
      body(w, ifTrue);
      w.append(" else ");
      body(w, ifFalse);
      return w.append(" end");
    }
  }

  /** Sequence of expressions; its value is the value of the last. */
  public static final class Block extends Exp {
    public final List<Exp> exps;

    Block(List<Exp> exps) {
      super(Op.TARGET_BLOCK);
      this.exps = requireNonNull(exps);
      checkArgument(exps.size() >= 2, "block must have 2 or more elements");
    }

    @Override
    public int hashCode() {
      return exps.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Block && exps.equals(((Block) o).exps);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").appendAll(exps, "; ").append(")");
    }
  }

  /**
   * Call to a named function, "Module.fun(args)", "recv.fun(args)" or
   * "fun(args)".
   */
  public static final class Apply extends Exp {
    public final @Nullable Exp receiver;
    public final String name;
    public final List<Exp> args;

    Apply(@Nullable Exp receiver, String name, List<Exp> args) {
      super(Op.APPLY);
      this.receiver = receiver;
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(receiver, name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && Objects.equals(receiver, ((Apply) o).receiver)
              && name.equals(((Apply) o).name)
              && args.equals(((Apply) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (receiver != null) {
        w.append(receiver, left, op.left).append(".");
      }
      return w.append(name).append("(").appendAll(args, ", ").append(")");
    }
  }

  /** Call to an anonymous function value, "f.(args)". */
  public static final class FnApply extends Exp {
    public final Exp fn;
    public final List<Exp> args;

    FnApply(Exp fn, List<Exp> args) {
      super(Op.FN_APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FnApply
              && fn.equals(((FnApply) o).fn)
              && args.equals(((FnApply) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(fn, left, op.left)
          .append(".(")
          .appendAll(args, ", ")
          .append(")");
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
    public int hashCode() {
      return Objects.hash(exp, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Field
              && exp.equals(((Field) o).exp)
              && name.equals(((Field) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.left).append(".").append(name);
    }
  }

  /** Call to a macro, written without parentheses, "assert x == 1". */
  public static final class MacroCall extends Exp {
    public final String name;
    public final List<Exp> args;

    MacroCall(String name, List<Exp> args) {
      super(Op.MACRO_CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MacroCall
              && name.equals(((MacroCall) o).name)
              && args.equals(((MacroCall) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append(name);
      return args.isEmpty() ? w : w.append(" ").appendAll(args, ", ");
    }
  }

  /** Anonymous function, "fn x -> body end". */
  public static final class Fn extends Exp {
    public final List<Clause> clauses;

    Fn(List<Clause> clauses) {
      super(Op.FN);
      this.clauses = requireNonNull(clauses);
      checkArgument(!clauses.isEmpty(), "fn must have at least one clause");
    }

    @Override
    public int hashCode() {
      return clauses.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Fn && clauses.equals(((Fn) o).clauses);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("fn ").appendAll(clauses, "; ").append(" end");
    }
  }

  /** Set of guarded clauses matched against a value, "case e do ... end". */
  public static final class Case extends Exp {
    public final Exp exp;
    public final List<Clause> clauses;

    Case(Exp exp, List<Clause> clauses) {
      super(Op.CASE);
      this.exp = requireNonNull(exp);
      this.clauses = requireNonNull(clauses);
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, clauses);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Case
              && exp.equals(((Case) o).exp)
              && clauses.equals(((Case) o).clauses);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("case ")
          .append(exp, 0, 0)
          .append(" do ")
          .appendAll(clauses, "; ")
          .append(" end");
    }
  }

  /** Call to a unary operator, "-e" or "not e". */
  public static final class Unary extends Exp {
    public final Exp arg;

    Unary(Op op, Exp arg) {
      super(op);
      this.arg = requireNonNull(arg);
      checkArgument(op == Op.NEGATE || op == Op.NOT, "not unary: %s", op);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Unary
              && op == ((Unary) o).op
              && arg.equals(((Unary) o).arg);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, arg, right);
    }
  }

  /** Call to a binary operator, "a != b". */
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
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && op == ((Binary) o).op
              && a0.equals(((Binary) o).a0)
              && a1.equals(((Binary) o).a1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /**
   * Inert placeholder for a construct that could not be lowered.
   *
   * <p>Evaluates to nil. The {@link #reason} is for diagnostics only.
   */
  public static final class Placeholder extends Exp {
    public final String reason;

    Placeholder(String reason) {
      super(Op.PLACEHOLDER);
      this.reason = requireNonNull(reason);
    }

    @Override
    public int hashCode() {
      return reason.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Placeholder
              && reason.equals(((Placeholder) o).reason);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("nil");
    }
  }

  /**
   * Guarded pattern clause, "p1, p2 when guard -> body".
   *
   * <p>Used in {@link Case} (one pattern per clause, or several alternative
   * patterns) and in {@link Fn} (one pattern per parameter).
   */
  public static final class Clause extends AstNode {
    public final List<Pat> pats;
    public final @Nullable Exp guard;
    public final Exp body;

    Clause(List<Pat> pats, @Nullable Exp guard, Exp body) {
      super(Op.CLAUSE);
      this.pats = requireNonNull(pats);
      this.guard = guard;
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pats, guard, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Clause
              && pats.equals(((Clause) o).pats)
              && Objects.equals(guard, ((Clause) o).guard)
              && body.equals(((Clause) o).body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.appendAll(pats, ", ");
      if (guard != null) {
        w.append(pats.isEmpty() ? "when " : " when ").append(guard, 0, 0);
      }
      w.append(pats.isEmpty() && guard == null ? "-> " : " -> ");
      return body(w, body);
    }
  }

  /** Base class of patterns. */
  public abstract static sealed class Pat extends AstNode {
    Pat(Op op) {
      super(op);
    }
  }

  /** Literal pattern; the value is a {@link Literal} or {@link Atom}. */
  public static final class LiteralPat extends Pat {
    public final Exp value;

    LiteralPat(Exp value) {
      super(Op.LITERAL_PAT);
      this.value = requireNonNull(value);
      checkArgument(value.op == Op.LITERAL || value.op == Op.ATOM,
          "not a literal: %s", value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof LiteralPat && value.equals(((LiteralPat) o).value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(value, left, right);
    }
  }

  /** Variable pattern; binds the matched value to a name. */
  public static final class VarPat extends Pat {
    public final String name;

    VarPat(String name) {
      super(Op.VAR_PAT);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof VarPat && name.equals(((VarPat) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Tuple pattern, "{:some, value}". */
  public static final class TuplePat extends Pat {
    public final List<Pat> args;

    TuplePat(List<Pat> args) {
      super(Op.TUPLE_PAT);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TuplePat && args.equals(((TuplePat) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("{").appendAll(args, ", ").append("}");
    }
  }

  /** List pattern, "[a, b]". */
  public static final class ListPat extends Pat {
    public final List<Pat> args;

    ListPat(List<Pat> args) {
      super(Op.LIST_PAT);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return args.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListPat && args.equals(((ListPat) o).args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(args, ", ").append("]");
    }
  }

  /** Wildcard pattern, "_". */
  public static final class WildcardPat extends Pat {
    WildcardPat() {
      super(Op.WILDCARD_PAT);
    }

    @Override
    public int hashCode() {
      return "_".hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof WildcardPat;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /** Writes the body of a clause or branch; a block's parentheses are
   * omitted. */
  static AstWriter body(AstWriter w, Exp body) {
    if (body instanceof Block) {
      return w.appendAll(((Block) body).exps, "; ");
    }
    return w.append(body, 0, 0);
  }
}

// End Target.java
