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

import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.beam.ast.Source;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each analyzed loop,
   * then calls the underlying tracer.
   */
  public static Tracer withOnLoop(
      Tracer tracer, BiConsumer<Source.Loop, ExitPattern> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLoop(Source.Loop loop, ExitPattern exitPattern) {
        consumer.accept(loop, exitPattern);
        super.onLoop(loop, exitPattern);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each fallback, then
   * calls the underlying tracer.
   */
  public static Tracer withOnFallback(
      Tracer tracer, Consumer<Fallback> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFallback(Fallback fallback) {
        consumer.accept(fallback);
        super.onFallback(fallback);
      }
    };
  }

  /**
   * Returns a tracer that prints each event to a writer, then calls the
   * underlying tracer.
   */
  public static Tracer printing(Tracer tracer, PrintWriter pw) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLoop(Source.Loop loop, ExitPattern exitPattern) {
        pw.println("loop " + loop.op + ": " + exitPattern);
        pw.flush();
        super.onLoop(loop, exitPattern);
      }

      @Override
      public void onFallback(Fallback fallback) {
        pw.println("fallback " + fallback);
        pw.flush();
        super.onFallback(fallback);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onLoop(Source.Loop loop, ExitPattern exitPattern) {}

    @Override
    public void onFallback(Fallback fallback) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onLoop(Source.Loop loop, ExitPattern exitPattern) {
      tracer.onLoop(loop, exitPattern);
    }

    @Override
    public void onFallback(Fallback fallback) {
      tracer.onFallback(fallback);
    }
  }
}

// End Tracers.java
