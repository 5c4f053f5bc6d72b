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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

/** Tests {@link LoweringContext}, {@link Prop} and {@link TypeLookup}. */
public class LoweringContextTest {
  @Test
  void testDefaults() {
    final LoweringContext context = LoweringContext.builder().build();
    assertThat(context.booleanValue(Prop.VERBOSE), is(false));
    assertThat(context.booleanValue(Prop.INLINE_NULL_COALESCING), is(true));
    assertThat(context.stringValue(Prop.UNUSED_CAPTURE_PREFIX), is("_"));
    assertThat(context.propMap.isEmpty(), is(true));
    assertThat(context.typeLookup.getConstructor("Option", "Some"),
        nullValue());
  }

  @Test
  void testSet() {
    final LoweringContext context =
        LoweringContext.builder()
            .set(Prop.INLINE_NULL_COALESCING, false)
            .setAll(ImmutableMap.of("unusedCapturePrefix", "ignored_"))
            .build();
    assertThat(context.booleanValue(Prop.INLINE_NULL_COALESCING), is(false));
    assertThat(context.stringValue(Prop.UNUSED_CAPTURE_PREFIX),
        is("ignored_"));
  }

  @Test
  void testInvalidValues() {
    final LoweringContext.Builder builder = LoweringContext.builder();
    assertThrows(IllegalArgumentException.class,
        () -> builder.set(Prop.VERBOSE, "yes"));
    assertThrows(IllegalArgumentException.class,
        () -> builder.set(Prop.VERBOSE, null));
    assertThrows(IllegalArgumentException.class,
        () -> builder.setAll(ImmutableMap.of("noSuchProperty", true)));
    final LoweringContext context = builder.build();
    assertThrows(IllegalArgumentException.class,
        () -> context.stringValue(Prop.VERBOSE));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("verbose"), is(Prop.VERBOSE));
    assertThat(Prop.lookup("VERBOSE"), is(Prop.VERBOSE));
    assertThat(Prop.lookup("inlineNullCoalescing"),
        is(Prop.INLINE_NULL_COALESCING));
    assertThat(Prop.BY_NAME.get("UNUSED_CAPTURE_PREFIX"),
        is(Prop.UNUSED_CAPTURE_PREFIX));
    assertThat(Prop.BY_NAME.size(), is(6));
  }

  @Test
  void testTypeLookup() {
    final TypeLookup typeLookup =
        TypeLookup.of(
            ImmutableList.of(
                new TypeLookup.Constructor(
                    "Option", "Some", ImmutableList.of("value"))));
    final TypeLookup.Constructor some =
        typeLookup.getConstructor("Option", "Some");
    assertThat(some, hasToString("Option.Some[value]"));
    assertThat(typeLookup.getConstructor("Maybe", "Some"), nullValue());
    assertThat(typeLookup.getConstructor("Option", "None"), nullValue());
  }
}

// End LoweringContextTest.java
