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

import com.google.common.collect.ImmutableMap;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything that lowering needs from its environment: constructor
 * declarations, earlier renames, a tracer, a loop strategy, and property
 * values.
 *
 * <p>A context is immutable, and may be shared by the lowering of many
 * functions. Create one using {@link #builder()}.
 */
public class LoweringContext {
  public final TypeLookup typeLookup;
  public final RenameTable renames;
  public final Tracer tracer;
  public final LoopLowering loopLowering;
  public final ImmutableMap<Prop, Object> propMap;

  private LoweringContext(
      TypeLookup typeLookup,
      RenameTable renames,
      Tracer tracer,
      LoopLowering loopLowering,
      ImmutableMap<Prop, Object> propMap) {
    this.typeLookup = requireNonNull(typeLookup);
    this.renames = requireNonNull(renames);
    this.tracer = requireNonNull(tracer);
    this.loopLowering = requireNonNull(loopLowering);
    this.propMap = requireNonNull(propMap);
  }

  /** Creates a builder with default values. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Prop prop) {
    return prop.booleanValue(propMap);
  }

  /** Returns the value of a string property. */
  public String stringValue(Prop prop) {
    return prop.stringValue(propMap);
  }

  /** Reports a fallback to the tracer. */
  void fallback(Fallback.Kind kind, String detail) {
    tracer.onFallback(Fallback.of(kind, detail));
  }

  /** Builder for {@link LoweringContext}. */
  public static class Builder {
    private TypeLookup typeLookup = TypeLookup.empty();
    private RenameTable renames = RenameTable.empty();
    private Tracer tracer = Tracers.empty();
    private LoopLowering loopLowering = LoopLowerings.plain();
    private @Nullable PrintWriter writer;
    private final Map<Prop, Object> propMap = new LinkedHashMap<>();

    private Builder() {}

    /** Sets the source of constructor declarations. */
    public Builder typeLookup(TypeLookup typeLookup) {
      this.typeLookup = requireNonNull(typeLookup);
      return this;
    }

    /** Sets the table of names chosen by earlier passes. */
    public Builder renames(RenameTable renames) {
      this.renames = requireNonNull(renames);
      return this;
    }

    /** Sets the tracer. */
    public Builder tracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
      return this;
    }

    /** Sets the strategy for lowering loops. */
    public Builder loopLowering(LoopLowering loopLowering) {
      this.loopLowering = requireNonNull(loopLowering);
      return this;
    }

    /**
     * Sets the writer to which diagnostics are printed if {@link
     * Prop#VERBOSE} is true. If not set, uses standard output.
     */
    public Builder writer(PrintWriter writer) {
      this.writer = requireNonNull(writer);
      return this;
    }

    /** Sets a property. Throws if the value has the wrong type. */
    public Builder set(Prop prop, @Nullable Object value) {
      prop.set(propMap, value);
      return this;
    }

    /** Sets properties from a map keyed by property name. */
    public Builder setAll(Map<String, ?> map) {
      map.forEach((name, value) -> set(Prop.lookup(name), value));
      return this;
    }

    /** Creates a context. */
    public LoweringContext build() {
      Tracer tracer = this.tracer;
      if (Prop.VERBOSE.booleanValue(propMap)) {
        final PrintWriter pw =
            writer != null
                ? writer
                : new PrintWriter(
                    new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        tracer = Tracers.printing(tracer, pw);
      }
      return new LoweringContext(
          typeLookup,
          renames,
          tracer,
          loopLowering,
          ImmutableMap.copyOf(propMap));
    }
  }
}

// End LoweringContext.java
