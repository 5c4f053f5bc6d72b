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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that configures lowering.
 *
 * @see LoweringContext#propMap
 */
public enum Prop {
  /**
   * Boolean property "inlineNullCoalescing" controls whether a record field
   * whose value is the two-statement null-coalescing idiom ("var tmp = e; tmp
   * != null ? tmp : default") is lowered to one inline conditional. If false,
   * the block is lowered statement by statement. Default is true.
   */
  INLINE_NULL_COALESCING("inlineNullCoalescing", Boolean.class, true),

  /**
   * String property "unusedCapturePrefix" is the prefix given to a capture
   * variable of a constructor pattern that the clause body never uses. The
   * default is "_", which suppresses unused-variable warnings in the target.
   */
  UNUSED_CAPTURE_PREFIX("unusedCapturePrefix", String.class, "_"),

  /**
   * Boolean property "verbose" controls whether diagnostics (loop
   * classifications and fallbacks) are printed to the context's writer, in
   * addition to being sent to its tracer. Default is false.
   */
  VERBOSE("verbose", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return (String) get(map);
  }

  /**
   * Sets the value of a property. Checks that the value is not null and that
   * its type is valid.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      throw new IllegalArgumentException(
          "property " + camelName + " is required");
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException(
          "value for property " + camelName + " must have type " + type);
    }
    map.put(this, value);
  }
}

// End Prop.java
