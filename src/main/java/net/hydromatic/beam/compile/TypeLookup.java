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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Provides the declarations of variant constructors.
 *
 * <p>Lowering never guesses a constructor's parameters; if the lookup does
 * not know a constructor, patterns that use it degrade to a wildcard.
 */
public interface TypeLookup {
  /**
   * Returns the constructor with a given tag in a given algebraic data type,
   * or null if not known.
   */
  @Nullable Constructor getConstructor(String enumName, String tag);

  /** Returns a lookup that knows no constructors. */
  static TypeLookup empty() {
    return of(ImmutableList.of());
  }

  /** Returns a lookup that knows the given constructors. */
  static TypeLookup of(Iterable<Constructor> constructors) {
    final ImmutableMap.Builder<String, Constructor> b = ImmutableMap.builder();
    for (Constructor constructor : constructors) {
      b.put(constructor.enumName + "." + constructor.tag, constructor);
    }
    final Map<String, Constructor> map = b.build();
    return (enumName, tag) -> map.get(enumName + "." + tag);
  }

  /** Declaration of a variant constructor. */
  final class Constructor {
    public final String enumName;
    public final String tag;
    /** Parameter names, in declaration order. */
    public final List<String> params;

    public Constructor(String enumName, String tag, List<String> params) {
      this.enumName = requireNonNull(enumName);
      this.tag = requireNonNull(tag);
      this.params = ImmutableList.copyOf(params);
    }

    @Override
    public String toString() {
      return enumName + "." + tag + params;
    }
  }
}

// End TypeLookup.java
