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
import static net.hydromatic.beam.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.beam.ast.Op;
import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Target;

/**
 * Compiles source expressions to target expressions.
 *
 * <p>Switches, loops and structural literals are delegated to
 * {@link SwitchCompiler}, {@link LoopExitAnalyzer} and the context's
 * {@link LoopLowering}, and {@link LiteralShapeClassifier}, which call back
 * into this compiler for their sub-expressions.
 *
 * <p>A lowerer holds the clause scopes of one function. Create a new
 * lowerer, via {@link Lowering}, for each function.
 */
public class Lowerer implements ExpressionCompiler {
  private final LoweringContext context;
  private final ClauseScopes scopes = new ClauseScopes();
  private final SwitchCompiler switchCompiler;
  private final LiteralShapeClassifier classifier;

  Lowerer(LoweringContext context) {
    this.context = requireNonNull(context);
    this.switchCompiler = new SwitchCompiler(context, this, scopes);
    this.classifier = new LiteralShapeClassifier(context, this, scopes);
  }

  @Override
  public Target.Exp compile(Source.Exp exp) {
    switch (exp.op) {
      case CONSTANT:
        return target.literal(((Source.Constant) exp).value);

      case LOCAL:
        return target.var(name(((Source.Local) exp).var));

      case STATIC:
        return target.alias(((Source.StaticRef) exp).name);

      case VAR_DECL:
        final Source.VarDecl varDecl = (Source.VarDecl) exp;
        return target.bind(
            name(varDecl.var),
            varDecl.init == null ? target.nil() : compile(varDecl.init));

      case ASSIGN:
        final Source.Assign assign = (Source.Assign) exp;
        return target.bind(name(assign.var), compile(assign.exp));

      case IF:
        final Source.If anIf = (Source.If) exp;
        return target.ifThenElse(
            compile(anIf.condition),
            compile(anIf.ifTrue),
            anIf.ifFalse == null ? target.nil() : compile(anIf.ifFalse));

      case BLOCK:
        return target.block(compileAll(((Source.Block) exp).exps));

      case SWITCH:
        return switchCompiler.compile((Source.Switch) exp);

      case WHILE:
      case FOR:
        final Source.Loop loop = (Source.Loop) exp;
        final ExitPattern exitPattern = LoopExitAnalyzer.analyze(loop.body);
        context.tracer.onLoop(loop, exitPattern);
        return context.loopLowering.lower(loop, exitPattern, this);

      case OBJECT_DECL:
        return classifier.classify(((Source.ObjectDecl) exp).fields).exp;

      case ARRAY_DECL:
        return target.list(compileAll(((Source.ArrayDecl) exp).args));

      case FIELD:
        final Source.Field field = (Source.Field) exp;
        return target.field(
            compile(field.exp), NameNormalizer.normalize(field.name));

      case CALL:
        return call((Source.Call) exp);

      case CON_CALL:
        final Source.ConCall conCall = (Source.ConCall) exp;
        return target.tuple(
            ImmutableList.<Target.Exp>builder()
                .add(target.atom(NameNormalizer.normalize(conCall.tag)))
                .addAll(compileAll(conCall.args))
                .build());

      case FUNCTION:
        return function((Source.Function) exp);

      case NEGATE:
      case NOT:
        return target.unary(exp.op, compile(((Source.Unary) exp).arg));

      case TIMES:
      case DIVIDE:
      case PLUS:
      case MINUS:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case ANDALSO:
      case ORELSE:
        final Source.Binary binary = (Source.Binary) exp;
        return target.binary(
            exp.op, compile(binary.a0), compile(binary.a1));

      case RETURN:
        final Source.Return aReturn = (Source.Return) exp;
        return aReturn.exp == null ? target.nil() : compile(aReturn.exp);

      case BREAK:
      case CONTINUE:
        final String jump = exp.op == Op.BREAK ? "break" : "continue";
        context.fallback(
            Fallback.Kind.DETACHED_JUMP,
            "'" + jump + "' outside structured loop lowering");
        return target.placeholder(jump);

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }

  /** Compiles a function literal to an anonymous function. */
  public Target.Fn function(Source.Function function) {
    final List<Target.Pat> pats =
        transformEager(function.params, param -> target.varPat(name(param)));
    return target.fn(
        ImmutableList.of(target.clause(pats, null, compile(function.body))));
  }

  /** Returns whether no clause is being compiled. */
  boolean isIdle() {
    return scopes.depth() == 0;
  }

  private List<Target.Exp> compileAll(List<Source.Exp> exps) {
    return transformEager(exps, this::compile);
  }

  /**
   * Returns the target name of a variable: the name bound by an enclosing
   * clause, if any, otherwise the variable's normalized name.
   */
  private String name(Source.Var var) {
    final String name = scopes.resolve(var);
    return name != null ? name : NameNormalizer.normalize(var.name);
  }

  private Target.Exp call(Source.Call call) {
    final List<Target.Exp> args = compileAll(call.args);
    switch (call.fn.op) {
      case FIELD:
        final Source.Field field = (Source.Field) call.fn;
        final String method = NameNormalizer.normalize(field.name);
        if (field.exp.op == Op.STATIC) {
          final String owner = ((Source.StaticRef) field.exp).name;
          if (owner.equals(AssertionTable.OWNER)) {
            return assertion(field.name, args);
          }
          return target.apply(target.alias(owner), method, args);
        }
        return target.apply(compile(field.exp), method, args);

      case STATIC:
        final String name = ((Source.StaticRef) call.fn).name;
        return target.apply(null, NameNormalizer.normalize(name), args);

      default:
        return target.fnApply(compile(call.fn), args);
    }
  }

  private Target.Exp assertion(String method, List<Target.Exp> args) {
    final Target.Exp exp = AssertionTable.lower(method, args);
    if (exp != null) {
      return exp;
    }
    context.fallback(
        Fallback.Kind.UNKNOWN_ASSERTION,
        AssertionTable.isKnown(method)
            ? "assertion " + method + " takes a different number of arguments"
            : "unknown assertion " + method);
    return target.placeholder(AssertionTable.OWNER + "." + method);
  }
}

// End Lowerer.java
