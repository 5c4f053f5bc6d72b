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

import java.util.Objects;

/**
 * Record of a construct that was lowered in a degraded, best-effort way.
 *
 * <p>Lowering never fails because of one unrecognized shape; instead it
 * produces the most general correct output and reports a fallback to the
 * {@link Tracer}.
 */
public final class Fallback {
  public final Kind kind;
  public final String detail;

  Fallback(Kind kind, String detail) {
    this.kind = requireNonNull(kind);
    this.detail = requireNonNull(detail);
  }

  /** Creates a fallback. */
  public static Fallback of(Kind kind, String detail) {
    return new Fallback(kind, detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, detail);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Fallback
            && kind == ((Fallback) o).kind
            && detail.equals(((Fallback) o).detail);
  }

  @Override
  public String toString() {
    return kind + ": " + detail;
  }

  /** Kinds of fallback. */
  public enum Kind {
    /** A switch value has no pattern shape; it became a wildcard. */
    UNRECOGNIZED_PATTERN,
    /** A variant constructor is not known to the type lookup; it became a
     * wildcard. */
    UNKNOWN_CONSTRUCTOR,
    /** A switch arm had no values, and was dropped. */
    EMPTY_ARM,
    /** A variable bound by a constructor pattern has no capture; it was
     * bound to nil. */
    UNBOUND_CAPTURE,
    /** The "start" field of a process descriptor lacks module, function or
     * arguments; it was compiled as a plain value. */
    MALFORMED_START,
    /** An assertion method is not in the table; it became a placeholder. */
    UNKNOWN_ASSERTION,
    /** A "break" or "continue" was compiled outside a loop lowering; it
     * became a placeholder. */
    DETACHED_JUMP
  }
}

// End Fallback.java
