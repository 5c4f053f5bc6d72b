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

import java.util.ArrayDeque;
import java.util.Deque;
import net.hydromatic.beam.ast.Source;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Stack of {@link ClauseContext}s that are live while one function is being
 * lowered.
 *
 * <p>A context is pushed when a clause starts and popped when its body has
 * been compiled. Frames are strictly nested; use try-with-resources:
 *
 * <blockquote><pre>
 * try (ClauseScopes.Frame frame = scopes.push()) {
 *   frame.context.bind(var, "x");
 *   ...
 * }
 * </pre></blockquote>
 *
 * <p>A variable resolves in the innermost frame that binds it, so a nested
 * switch sees the captures of the clause that encloses it.
 */
public class ClauseScopes {
  private final Deque<Frame> frames = new ArrayDeque<>();

  /** Pushes a new, empty context. */
  public Frame push() {
    final Frame frame = new Frame(new ClauseContext());
    frames.push(frame);
    return frame;
  }

  /** Returns the number of live frames. */
  public int depth() {
    return frames.size();
  }

  /**
   * Returns the name that a variable is bound to in the innermost frame that
   * binds it, or null.
   */
  public @Nullable String resolve(Source.Var var) {
    for (Frame frame : frames) {
      final String name = frame.context.resolve(var);
      if (name != null) {
        return name;
      }
    }
    return null;
  }

  /** Returns whether any live frame binds a variable to a given name. */
  public boolean isNameBound(String name) {
    for (Frame frame : frames) {
      if (frame.context.bindsName(name)) {
        return true;
      }
    }
    return false;
  }

  /** Live context, popped when closed. */
  public class Frame implements AutoCloseable {
    public final ClauseContext context;
    private boolean closed;

    Frame(ClauseContext context) {
      this.context = context;
    }

    @Override
    public void close() {
      checkState(!closed, "frame is already closed");
      checkState(frames.peek() == this, "frame closed out of order");
      frames.pop();
      closed = true;
    }
  }
}

// End ClauseScopes.java
