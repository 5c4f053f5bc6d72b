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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.beam.ast.TargetBuilder.target;
import static net.hydromatic.beam.util.Static.allMatch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import net.hydromatic.beam.ast.Op;
import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Target;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lowers an anonymous structural literal, choosing its target shape from the
 * names of its fields.
 *
 * <p>The rules are tried in order, and the first that matches wins:
 *
 * <ol>
 *   <li>{@link LiteralShape#TUPLE}: every field is named "_1", "_2", etc.;
 *   <li>{@link LiteralShape#OPTION_LIST}: there is a "strategy" field and a
 *       "max_restarts" or "max_seconds" field;
 *   <li>{@link LiteralShape#PROCESS_SPEC}: there are "id" and "start"
 *       fields;
 *   <li>{@link LiteralShape#PLAIN_RECORD}: otherwise.
 * </ol>
 *
 * <p>Field names are compared after {@link NameNormalizer normalization},
 * so "maxRestarts" and "max_restarts" are equivalent.
 */
public class LiteralShapeClassifier {
  private static final Pattern TUPLE_FIELD = Pattern.compile("_[1-9][0-9]*");

  private static final Set<String> ATOM_VALUED_FIELDS =
      ImmutableSet.of("type", "restart", "shutdown");

  /** Orders "_2" before "_10". */
  private static final Comparator<String> TUPLE_FIELD_ORDER =
      Comparator.comparingInt(String::length)
          .thenComparing(Comparator.naturalOrder());

  private final LoweringContext context;
  private final ExpressionCompiler compiler;
  private final ClauseScopes scopes;

  public LiteralShapeClassifier(
      LoweringContext context,
      ExpressionCompiler compiler,
      ClauseScopes scopes) {
    this.context = requireNonNull(context);
    this.compiler = requireNonNull(compiler);
    this.scopes = requireNonNull(scopes);
  }

  /** Returns the shape of a literal with the given fields. */
  public static LiteralShape shapeOf(
      List<Map.Entry<String, Source.Exp>> fields) {
    if (!fields.isEmpty()
        && allMatch(fields, f -> isTupleField(f.getKey()))) {
      return LiteralShape.TUPLE;
    }
    final Set<String> names = new HashSet<>();
    fields.forEach(f -> names.add(NameNormalizer.normalize(f.getKey())));
    if (names.contains("strategy")
        && (names.contains("max_restarts") || names.contains("max_seconds"))) {
      return LiteralShape.OPTION_LIST;
    }
    if (names.contains("id") && names.contains("start")) {
      return LiteralShape.PROCESS_SPEC;
    }
    return LiteralShape.PLAIN_RECORD;
  }

  private static boolean isTupleField(String name) {
    return TUPLE_FIELD.matcher(name).matches();
  }

  /** Classifies and lowers a structural literal. */
  public Result classify(List<Map.Entry<String, Source.Exp>> fields) {
    final LiteralShape shape = shapeOf(fields);
    switch (shape) {
      case TUPLE:
        return new Result(shape, tuple(fields));
      case OPTION_LIST:
        return new Result(shape, optionList(fields));
      case PROCESS_SPEC:
        return new Result(shape, processSpec(fields));
      case PLAIN_RECORD:
        return new Result(shape, plainRecord(fields));
      default:
        throw new AssertionError("unknown shape " + shape);
    }
  }

  private Target.Exp tuple(List<Map.Entry<String, Source.Exp>> fields) {
    final List<Map.Entry<String, Source.Exp>> sorted = new ArrayList<>(fields);
    sorted.sort(Map.Entry.comparingByKey(TUPLE_FIELD_ORDER));
    final ImmutableList.Builder<Target.Exp> b = ImmutableList.builder();
    sorted.forEach(f -> b.add(compiler.compile(f.getValue())));
    return target.tuple(b.build());
  }

  private Target.Exp optionList(List<Map.Entry<String, Source.Exp>> fields) {
    final ImmutableList.Builder<Map.Entry<String, Target.Exp>> b =
        ImmutableList.builder();
    for (Map.Entry<String, Source.Exp> field : fields) {
      final String name = NameNormalizer.normalize(field.getKey());
      final Target.Exp value =
          name.equals("strategy")
              ? atomOrCompile(field.getValue())
              : compiler.compile(field.getValue());
      b.add(target.entry(name, value));
    }
    return target.keywordList(b.build());
  }

  private Target.Exp processSpec(List<Map.Entry<String, Source.Exp>> fields) {
    final ImmutableList.Builder<Map.Entry<Target.Exp, Target.Exp>> b =
        ImmutableList.builder();
    for (Map.Entry<String, Source.Exp> field : fields) {
      final String name = NameNormalizer.normalize(field.getKey());
      final Target.Exp value;
      if (name.equals("start")) {
        value = start(field.getValue());
      } else if (ATOM_VALUED_FIELDS.contains(name)) {
        value = atomOrCompile(field.getValue());
      } else {
        value = compiler.compile(field.getValue());
      }
      b.add(target.entry(target.atom(name), value));
    }
    return target.map(b.build());
  }

  /**
   * Lowers the "start" field of a process descriptor. A literal
   * "{module: "Worker", func: "startLink", args: [...]}" becomes the tuple
   * "{Worker, :start_link, [...]}".
   */
  private Target.Exp start(Source.Exp exp) {
    if (exp.op == Op.OBJECT_DECL) {
      final Source.ObjectDecl objectDecl = (Source.ObjectDecl) exp;
      final Source.@Nullable Exp module = objectDecl.get("module");
      final Source.@Nullable Exp func = objectDecl.get("func");
      final Source.@Nullable Exp args = objectDecl.get("args");
      if (module != null && func != null && args != null) {
        final String moduleName = stringValue(module);
        final String funcName = stringValue(func);
        return target.tuple(
            moduleName != null
                ? target.alias(moduleName)
                : compiler.compile(module),
            funcName != null
                ? target.atom(NameNormalizer.normalize(funcName))
                : compiler.compile(func),
            compiler.compile(args));
      }
      final List<String> missing = new ArrayList<>();
      if (module == null) {
        missing.add("module");
      }
      if (func == null) {
        missing.add("func");
      }
      if (args == null) {
        missing.add("args");
      }
      context.fallback(
          Fallback.Kind.MALFORMED_START,
          "start literal " + exp + " lacks " + missing);
    }
    return compiler.compile(exp);
  }

  private Target.Exp plainRecord(List<Map.Entry<String, Source.Exp>> fields) {
    final ImmutableList.Builder<Map.Entry<Target.Exp, Target.Exp>> b =
        ImmutableList.builder();
    for (Map.Entry<String, Source.Exp> field : fields) {
      final String name = NameNormalizer.normalize(field.getKey());
      b.add(target.entry(target.atom(name), recordValue(field.getValue())));
    }
    return target.map(b.build());
  }

  private Target.Exp recordValue(Source.Exp exp) {
    switch (exp.op) {
      case LOCAL:
        // A capture of an enclosing clause takes precedence over a rename.
        final Source.Var var = ((Source.Local) exp).var;
        if (scopes.resolve(var) == null) {
          final String name = context.renames.getOpt(var);
          if (name != null) {
            return target.var(name);
          }
        }
        break;

      case BLOCK:
        if (context.booleanValue(Prop.INLINE_NULL_COALESCING)) {
          final Target.Exp coalesce = nullCoalescing((Source.Block) exp);
          if (coalesce != null) {
            return coalesce;
          }
        }
        break;

      default:
        break;
    }
    return compiler.compile(exp);
  }

  /**
   * Recognizes "{var tmp = init; tmp != null ? tmp : default}" and lowers it
   * to "if (tmp = init) != nil, do: tmp, else: default"; returns null if the
   * block has any other form.
   */
  private Target.@Nullable Exp nullCoalescing(Source.Block block) {
    if (block.exps.size() != 2
        || block.exps.get(0).op != Op.VAR_DECL
        || block.exps.get(1).op != Op.IF) {
      return null;
    }
    final Source.VarDecl varDecl = (Source.VarDecl) block.exps.get(0);
    final Source.If anIf = (Source.If) block.exps.get(1);
    if (varDecl.init == null
        || anIf.ifFalse == null
        || !isNotNull(anIf.condition, varDecl.var)
        || !isLocal(anIf.ifTrue, varDecl.var)) {
      return null;
    }
    final String name = NameNormalizer.normalize(varDecl.var.name);
    return target.inlineIf(
        target.binary(
            Op.NE,
            target.match(target.varPat(name), compiler.compile(varDecl.init)),
            target.nil()),
        target.var(name),
        compiler.compile(anIf.ifFalse));
  }

  /** Returns whether an expression is "var != null" or "null != var". */
  private static boolean isNotNull(Source.Exp exp, Source.Var var) {
    if (exp.op != Op.NE) {
      return false;
    }
    final Source.Binary binary = (Source.Binary) exp;
    return isLocal(binary.a0, var) && isNull(binary.a1)
        || isNull(binary.a0) && isLocal(binary.a1, var);
  }

  private static boolean isLocal(Source.Exp exp, Source.Var var) {
    return exp.op == Op.LOCAL && ((Source.Local) exp).var.equals(var);
  }

  private static boolean isNull(Source.Exp exp) {
    return exp.op == Op.CONSTANT && ((Source.Constant) exp).value == null;
  }

  /** Returns the value of a string constant, or null. */
  private static @Nullable String stringValue(Source.Exp exp) {
    if (exp.op == Op.CONSTANT
        && ((Source.Constant) exp).value instanceof String) {
      return (String) ((Source.Constant) exp).value;
    }
    return null;
  }

  /** Lowers a string constant to an atom, and anything else as usual. */
  private Target.Exp atomOrCompile(Source.Exp exp) {
    final String s = stringValue(exp);
    return s != null
        ? target.atom(NameNormalizer.normalize(s))
        : compiler.compile(exp);
  }

  /** Result of classifying a structural literal. */
  public static class Result {
    public final LiteralShape shape;
    public final Target.Exp exp;

    Result(LiteralShape shape, Target.Exp exp) {
      this.shape = requireNonNull(shape);
      this.exp = requireNonNull(exp);
    }

    @Override
    public String toString() {
      return shape + " " + exp;
    }
  }
}

// End LiteralShapeClassifier.java
