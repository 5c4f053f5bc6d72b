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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.beam.ast.Target;
import org.junit.jupiter.api.Test;

/** Tests {@link ClauseScopes} and {@link ClauseContext}. */
public class ClauseScopesTest {
  @Test
  void testResolveInnermostFirst() {
    final Fixture f = new Fixture();
    final ClauseScopes scopes = new ClauseScopes();
    assertThat(scopes.depth(), is(0));
    try (ClauseScopes.Frame outer = scopes.push()) {
      outer.context.bind(f.x, "value");
      outer.context.bind(f.y, "other");
      try (ClauseScopes.Frame inner = scopes.push()) {
        inner.context.bind(f.x, "value_2");
        assertThat(scopes.depth(), is(2));
        assertThat(scopes.resolve(f.x), is("value_2"));
        assertThat(scopes.resolve(f.y), is("other"));
        assertThat(scopes.isNameBound("value"), is(true));
      }
      assertThat(scopes.depth(), is(1));
      assertThat(scopes.resolve(f.x), is("value"));
      assertThat(scopes.isNameBound("value_2"), is(false));
    }
    assertThat(scopes.depth(), is(0));
    assertThat(scopes.resolve(f.x), nullValue());
  }

  @Test
  void testDuplicateBindingThrows() {
    final Fixture f = new Fixture();
    final ClauseScopes scopes = new ClauseScopes();
    try (ClauseScopes.Frame frame = scopes.push()) {
      frame.context.bind(f.x, "value");
      assertThat(frame.context.isBound(f.x), is(true));
      assertThat(frame.context.isBound(f.y), is(false));
      assertThrows(IllegalStateException.class,
          () -> frame.context.bind(f.x, "value_2"));
    }
  }

  @Test
  void testCloseOutOfOrderThrows() {
    final ClauseScopes scopes = new ClauseScopes();
    final ClauseScopes.Frame outer = scopes.push();
    final ClauseScopes.Frame inner = scopes.push();
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, outer::close);
    assertThat(e.getMessage(), is("frame closed out of order"));
    inner.close();
    outer.close();
    assertThat(scopes.depth(), is(0));
    assertThrows(IllegalStateException.class, outer::close);
  }

  @Test
  void testWrapBody() {
    final ClauseScopes scopes = new ClauseScopes();
    try (ClauseScopes.Frame frame = scopes.push()) {
      final Target.Exp body = target.var("x");
      assertThat(frame.context.wrapBody(body), sameInstance(body));
      frame.context.preBind("a", target.nil());
      frame.context.preBind("b", target.literal(1));
      assertThat(frame.context.wrapBody(body),
          hasToString("(a = nil; b = 1; x)"));
    }
  }
}

// End ClauseScopesTest.java
