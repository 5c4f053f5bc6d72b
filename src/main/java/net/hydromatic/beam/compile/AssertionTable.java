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

import static net.hydromatic.beam.ast.TargetBuilder.target;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.beam.ast.Op;
import net.hydromatic.beam.ast.Target;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Maps calls to methods of the source's {@code Assert} class to the target's
 * assertion macros.
 *
 * <p>For example, "Assert.equals(expected, actual)" becomes
 * "assert actual == expected".
 */
public abstract class AssertionTable {
  private AssertionTable() {}

  /** Name of the class whose static methods are assertions. */
  public static final String OWNER = "Assert";

  /**
   * Lowers a call to an assertion method whose arguments have already been
   * compiled. Returns null if the method is not known, or is called with the
   * wrong number of arguments.
   */
  public static Target.@Nullable Exp lower(
      String method, List<Target.Exp> args) {
    final Entry entry = Entry.BY_METHOD.get(method);
    if (entry == null || entry.arity != args.size()) {
      return null;
    }
    return entry.lower(args);
  }

  /** Returns whether there is an assertion with a given method name. */
  public static boolean isKnown(String method) {
    return Entry.BY_METHOD.containsKey(method);
  }

  private static Target.Exp macro(String name, Target.Exp arg) {
    return target.macroCall(name, ImmutableList.of(arg));
  }

  /** Assertion method and its translation. */
  private enum Entry {
    IS_TRUE("isTrue", 1) {
      @Override
      Target.Exp lower(List<Target.Exp> args) {
        return macro("assert", args.get(0));
      }
    },
    IS_FALSE("isFalse", 1) {
      @Override
      Target.Exp lower(List<Target.Exp> args) {
        return macro("refute", args.get(0));
      }
    },
    EQUALS("equals", 2) {
      @Override
      Target.Exp lower(List<Target.Exp> args) {
        // "equals(expected, actual)" puts the actual value first
        return macro(
            "assert", target.binary(Op.EQ, args.get(1), args.get(0)));
      }
    },
    NOT_EQUALS("notEquals", 2) {
      @Override
      Target.Exp lower(List<Target.Exp> args) {
        return macro(
            "assert", target.binary(Op.NE, args.get(1), args.get(0)));
      }
    },
    IS_NULL("isNull", 1) {
      @Override
      Target.Exp lower(List<Target.Exp> args) {
        return macro("assert", target.binary(Op.EQ, args.get(0), target.nil()));
      }
    },
    NOT_NULL("notNull", 1) {
      @Override
      Target.Exp lower(List<Target.Exp> args) {
        return macro("assert", target.binary(Op.NE, args.get(0), target.nil()));
      }
    },
    FAIL("fail", 1) {
      @Override
      Target.Exp lower(List<Target.Exp> args) {
        return macro("flunk", args.get(0));
      }
    },
    RAISES("raises", 1) {
      @Override
      Target.Exp lower(List<Target.Exp> args) {
        return macro("assert_raise", args.get(0));
      }
    };

    static final ImmutableMap<String, Entry> BY_METHOD;

    static {
      final ImmutableMap.Builder<String, Entry> b = ImmutableMap.builder();
      for (Entry entry : values()) {
        b.put(entry.method, entry);
      }
      BY_METHOD = b.build();
    }

    final String method;
    final int arity;

    Entry(String method, int arity) {
      this.method = method;
      this.arity = arity;
    }

    abstract Target.Exp lower(List<Target.Exp> args);
  }
}

// End AssertionTable.java
