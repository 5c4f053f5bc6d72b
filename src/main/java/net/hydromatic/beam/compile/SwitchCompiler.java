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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Target;
import net.hydromatic.beam.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a switch into a case expression whose clauses are guarded
 * patterns.
 *
 * <p>Each value of an arm becomes one pattern:
 *
 * <ul>
 *   <li>a constant becomes a literal pattern;
 *   <li>a call to a variant constructor, "Some(x)", becomes a tagged tuple
 *       pattern, "{:some, value}", with one capture per constructor
 *       parameter, named after the parameter;
 *   <li>an array literal becomes a list pattern;
 *   <li>a variable becomes a variable pattern;
 *   <li>anything else becomes a wildcard, and a fallback is reported.
 * </ul>
 *
 * <p>The variables that a constructor pattern binds are the variables that
 * appear as its arguments. They are matched with captures in the order that
 * the arm body first uses them, not in argument order. A capture that no
 * variable is matched with gets the {@link Prop#UNUSED_CAPTURE_PREFIX}.
 *
 * <p>Each clause is compiled in its own frame of the {@link ClauseScopes},
 * so that the body and guard see the clause's captures, and a nested switch
 * does not disturb them.
 */
public class SwitchCompiler {
  private final LoweringContext context;
  private final ExpressionCompiler compiler;
  private final ClauseScopes scopes;

  public SwitchCompiler(
      LoweringContext context,
      ExpressionCompiler compiler,
      ClauseScopes scopes) {
    this.context = requireNonNull(context);
    this.compiler = requireNonNull(compiler);
    this.scopes = requireNonNull(scopes);
  }

  /** Compiles a {@link Source.Switch}. */
  public Target.Exp compile(Source.Switch aSwitch) {
    return compile(aSwitch.exp, aSwitch.arms, aSwitch.defaultBody);
  }

  /**
   * Compiles a switch.
   *
   * @param matched Value being switched on
   * @param arms Arms, in order
   * @param defaultBody Body of the default arm, or null if there is none
   * @return Case expression
   */
  public Target.Exp compile(
      Source.Exp matched,
      List<Source.Arm> arms,
      Source.@Nullable Exp defaultBody) {
    final Target.Exp exp = compiler.compile(matched);
    final ImmutableList.Builder<Target.Clause> clauses =
        ImmutableList.builder();
    for (Source.Arm arm : arms) {
      if (arm.values.isEmpty()) {
        context.fallback(Fallback.Kind.EMPTY_ARM, "arm has no values");
        continue;
      }
      clauses.add(clause(arm));
    }
    if (defaultBody != null) {
      try (ClauseScopes.Frame frame = scopes.push()) {
        final Target.Exp body = compiler.compile(defaultBody);
        clauses.add(
            target.clause(
                ImmutableList.of(target.wildcardPat()),
                null,
                frame.context.wrapBody(body)));
      }
    }
    return target.caseOf(exp, clauses.build());
  }

  private Target.Clause clause(Source.Arm arm) {
    try (ClauseScopes.Frame frame = scopes.push()) {
      final ArmState state =
          new ArmState(
              scopes, frame.context, firstUses(arm), outsideNames(arm));
      final ImmutableList.Builder<Target.Pat> pats = ImmutableList.builder();
      arm.values.forEach(value -> pats.add(pattern(value, state)));

      final Target.@Nullable Exp guard =
          arm.guard == null ? null : compiler.compile(arm.guard);
      final Target.Exp body =
          arm.body == null ? target.nil() : compiler.compile(arm.body);
      return target.clause(pats.build(), guard, frame.context.wrapBody(body));
    }
  }

  /**
   * Returns the variables used by an arm, in order of first use: first the
   * body, pre-order, then the guard.
   */
  private static List<Source.Var> firstUses(Source.Arm arm) {
    final Set<Source.Var> vars = new LinkedHashSet<>();
    final Visitor visitor =
        new Visitor() {
          @Override
          protected void visit(Source.Local local) {
            vars.add(local.var);
          }
        };
    if (arm.body != null) {
      arm.body.accept(visitor);
    }
    if (arm.guard != null) {
      arm.guard.accept(visitor);
    }
    return ImmutableList.copyOf(vars);
  }

  /**
   * Returns the names of variables that an arm's body and guard reference
   * or declare but that its patterns do not bind. A capture must not take
   * one of these names, or it would hide the variable.
   */
  private Set<String> outsideNames(Source.Arm arm) {
    final Set<Source.Var> patternVars = VarFinder.vars(arm.values);
    final List<Source.Var> outsideVars = new ArrayList<>();
    for (Source.Var var : VarFinder.vars(arm.body, arm.guard)) {
      if (!patternVars.contains(var)) {
        outsideVars.add(var);
      }
    }
    final Set<String> names = new HashSet<>(VarFinder.names(outsideVars));
    for (Source.Var var : outsideVars) {
      final String renamed = context.renames.getOpt(var);
      if (renamed != null) {
        names.add(renamed);
      }
    }
    return names;
  }

  private Target.Pat pattern(Source.Exp value, ArmState state) {
    switch (value.op) {
      case CONSTANT:
        return target.literalPat(
            target.literal(((Source.Constant) value).value));

      case CON_CALL:
        return constructorPattern((Source.ConCall) value, state);

      case ARRAY_DECL:
        final ImmutableList.Builder<Target.Pat> b = ImmutableList.builder();
        ((Source.ArrayDecl) value).args.forEach(arg ->
            b.add(pattern(arg, state)));
        return target.listPat(b.build());

      case LOCAL:
        final Source.Var var = ((Source.Local) value).var;
        final String bound = state.context.resolve(var);
        if (bound != null) {
          return target.varPat(bound);
        }
        final String name =
            state.uniqueName(NameNormalizer.normalize(var.name));
        state.context.bind(var, name);
        return target.varPat(name);

      default:
        context.fallback(
            Fallback.Kind.UNRECOGNIZED_PATTERN,
            "cannot match " + value.op + " " + value);
        return target.wildcardPat();
    }
  }

  /**
   * Converts a call to a variant constructor into a tagged tuple pattern.
   * For example, if the body uses {@code y} before {@code x},
   * "Pair(x, y)" becomes "{:pair, first, second}" with {@code y} bound to
   * "first" and {@code x} to "second".
   */
  private Target.Pat constructorPattern(
      Source.ConCall conCall, ArmState state) {
    final TypeLookup.Constructor constructor =
        context.typeLookup.getConstructor(conCall.enumName, conCall.tag);
    if (constructor == null) {
      context.fallback(
          Fallback.Kind.UNKNOWN_CONSTRUCTOR,
          "constructor " + conCall.enumName + "." + conCall.tag
              + " not found");
      return target.wildcardPat();
    }

    // Variables bound by this pattern, in order of first use in the arm.
    // Variables that the arm never uses need no name.
    final Set<Source.Var> argVars = new HashSet<>();
    for (Source.Exp arg : conCall.args) {
      if (arg instanceof Source.Local) {
        argVars.add(((Source.Local) arg).var);
      }
    }
    final List<Source.Var> boundVars = new ArrayList<>();
    for (Source.Var var : state.firstUses) {
      if (argVars.contains(var)) {
        boundVars.add(var);
      }
    }

    final String unusedPrefix = context.stringValue(Prop.UNUSED_CAPTURE_PREFIX);
    final ImmutableList.Builder<Target.Pat> slots = ImmutableList.builder();
    slots.add(
        target.literalPat(
            target.atom(NameNormalizer.normalize(conCall.tag))));
    int captureCount = 0;
    for (int i = 0; i < constructor.params.size(); i++) {
      final Source.@Nullable Exp arg =
          i < conCall.args.size() ? conCall.args.get(i) : null;
      if (arg instanceof Source.Constant) {
        slots.add(
            target.literalPat(target.literal(((Source.Constant) arg).value)));
        continue;
      }
      final String param = NameNormalizer.normalize(constructor.params.get(i));
      final String name;
      if (captureCount < boundVars.size()) {
        final Source.Var var = boundVars.get(captureCount);
        final String bound = state.context.resolve(var);
        if (bound != null) {
          name = bound;
        } else {
          name = state.uniqueName(param);
          state.context.bind(var, name);
        }
      } else {
        name = state.uniqueName(unusedPrefix + param);
      }
      slots.add(target.varPat(name));
      ++captureCount;
    }

    for (int i = captureCount; i < boundVars.size(); i++) {
      final Source.Var var = boundVars.get(i);
      if (state.context.isBound(var)) {
        continue;
      }
      final String name = state.uniqueName(NameNormalizer.normalize(var.name));
      state.context.bind(var, name);
      state.context.preBind(name, target.nil());
      context.fallback(
          Fallback.Kind.UNBOUND_CAPTURE,
          "variable " + var + " has no capture in " + conCall.tag
              + " (arity " + constructor.params.size() + ")");
    }
    return target.tuplePat(slots.build());
  }

  /** State of the arm that is being compiled. */
  private static class ArmState {
    final ClauseScopes scopes;
    final ClauseContext context;
    final List<Source.Var> firstUses;
    /** Names of variables that the clause uses but does not bind. */
    final Set<String> reserved;
    /** Names bound by the patterns of this clause. */
    final Set<String> names = new HashSet<>();

    ArmState(
        ClauseScopes scopes,
        ClauseContext context,
        List<Source.Var> firstUses,
        Set<String> reserved) {
      this.scopes = scopes;
      this.context = context;
      this.firstUses = firstUses;
      this.reserved = reserved;
    }

    /**
     * Returns a name, based on {@code base}, that is not yet used in this
     * clause, is not the name of a variable that the clause uses but does not
     * bind, and is not bound by an enclosing clause.
     */
    String uniqueName(String base) {
      String name = base;
      for (int i = 2; isUsed(name); i++) {
        name = base + "_" + i;
      }
      names.add(name);
      return name;
    }

    private boolean isUsed(String name) {
      return names.contains(name)
          || reserved.contains(name)
          || scopes.isNameBound(name);
    }
  }
}

// End SwitchCompiler.java
