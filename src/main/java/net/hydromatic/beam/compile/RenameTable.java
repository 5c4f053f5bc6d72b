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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.beam.ast.Source;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Names that earlier passes chose for source variables.
 *
 * <p>A record field whose value is a bare variable reference uses the name
 * from this table, if there is one.
 */
public interface RenameTable {
  /** Returns the target name of a variable, or null. */
  @Nullable String getOpt(Source.Var var);

  /** Returns a table with no entries. */
  static RenameTable empty() {
    return v -> null;
  }

  /** Returns a table backed by a copy of a map. */
  static RenameTable of(Map<Source.Var, String> map) {
    final ImmutableMap<Source.Var, String> copy = ImmutableMap.copyOf(map);
    return copy::get;
  }
}

// End RenameTable.java
