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
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.jupiter.api.Test;

/** Tests {@link NameNormalizer}. */
public class NameNormalizerTest {
  private static void check(String name, String expected) {
    assertThat(NameNormalizer.normalize(name), is(expected));
    // normalizing twice gives the same result
    assertThat(NameNormalizer.normalize(expected), is(expected));
    assertThat(NameNormalizer.isNormalized(expected), is(true));
  }

  @Test
  void testNormalize() {
    check("x", "x");
    check("maxRestarts", "max_restarts");
    check("max_restarts", "max_restarts");
    check("OneForOne", "one_for_one");
    check("StatusUpdate", "status_update");
    check("startLink", "start_link");
    check("workerId2", "worker_id2");
    check("_height", "_height");
    check("_unusedValue", "_unused_value");
    check("_1", "_1");
    check("__", "__");
    check("", "");
  }

  @Test
  void testIsNormalized() {
    assertThat(NameNormalizer.isNormalized("retry_count"), is(true));
    assertThat(NameNormalizer.isNormalized("retryCount"), is(false));
    assertThat(NameNormalizer.isNormalized("Worker"), is(false));
  }
}

// End NameNormalizerTest.java
