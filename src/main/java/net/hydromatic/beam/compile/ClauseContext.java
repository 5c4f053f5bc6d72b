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

import static com.google.common.base.Preconditions.checkState;
import static net.hydromatic.beam.ast.TargetBuilder.target;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.beam.ast.Source;
import net.hydromatic.beam.ast.Target;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Names of the source variables that are bound by one pattern clause.
 *
 * <p>A context is created when a clause starts and discarded when it ends.
 * Within a clause, each source variable is bound at most once.
 *
 * <p>A context also accumulates synthetic bindings ("name = value") that
 * must be evaluated before the clause body; {@link #wrapBody} prepends them.
 */
public class ClauseContext {
  private final Map<Source.Var, String> names = new LinkedHashMap<>();
  private final List<Target.Exp> preBindings = new ArrayList<>();

  ClauseContext() {}

  /**
   * Binds a source variable to a target name.
   *
   * @throws IllegalStateException if the variable is already bound in this
   *     clause
   */
  public void bind(Source.Var var, String name) {
    checkState(
        !names.containsKey(var), "variable %s is already bound", var);
    names.put(var, name);
  }

  /** Returns whether a variable is bound in this clause. */
  public boolean isBound(Source.Var var) {
    return names.containsKey(var);
  }

  /** Returns the name that a variable is bound to, or null. */
  public @Nullable String resolve(Source.Var var) {
    return names.get(var);
  }

  /** Returns whether some variable is bound to a given name. */
  public boolean bindsName(String name) {
    return names.containsValue(name);
  }

  /** Adds a binding that will be evaluated before the clause body. */
  public void preBind(String name, Target.Exp value) {
    preBindings.add(target.bind(name, value));
  }

  /** Returns the body, preceded by the synthetic bindings, if any. */
  public Target.Exp wrapBody(Target.Exp body) {
    if (preBindings.isEmpty()) {
      return body;
    }
    return target.block(
        ImmutableList.<Target.Exp>builder()
            .addAll(preBindings)
            .add(body)
            .build());
  }

  @Override
  public String toString() {
    return names.toString();
  }
}

// End ClauseContext.java
