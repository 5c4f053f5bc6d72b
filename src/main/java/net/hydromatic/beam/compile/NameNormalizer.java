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

import com.google.common.base.Ascii;
import com.google.common.base.CaseFormat;

/**
 * Converts identifiers from the source's naming convention to the target's.
 *
 * <p>Source identifiers are camel case ("maxRestarts", "OneForOne"); target
 * identifiers and atoms are lower case with underscores ("max_restarts",
 * "one_for_one"). Leading underscores are preserved.
 *
 * <p>Normalization is idempotent: a normalized name contains no upper case
 * letters, and is therefore returned unchanged.
 */
public abstract class NameNormalizer {
  private NameNormalizer() {}

  /** Converts a camel-case identifier to lower case with underscores. */
  public static String normalize(String name) {
    int i = 0;
    while (i < name.length() && name.charAt(i) == '_') {
      ++i;
    }
    if (i == name.length()) {
      return name;
    }
    final String prefix = name.substring(0, i);
    final String rest = name.substring(i);
    final CaseFormat format =
        Ascii.isUpperCase(rest.charAt(0))
            ? CaseFormat.UPPER_CAMEL
            : CaseFormat.LOWER_CAMEL;
    return prefix + format.to(CaseFormat.LOWER_UNDERSCORE, rest);
  }

  /** Returns whether a name is already in the target's convention. */
  public static boolean isNormalized(String name) {
    return normalize(name).equals(name);
  }
}

// End NameNormalizer.java
