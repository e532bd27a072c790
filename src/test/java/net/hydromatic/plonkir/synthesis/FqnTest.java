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
package net.hydromatic.plonkir.synthesis;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests {@link Fqn}. */
class FqnTest {
  @Test void testClean() {
    assertThat(Fqn.clean("a b-c"), is("a_b_c"));
    assertThat(Fqn.clean("x_1"), is("x_1"));
    assertThat(Fqn.clean("é"), is("_"));
  }

  @Test void testToString() {
    final Fqn fqn =
        new Fqn("range check", 3, ImmutableList.of("outer", "in.ner"),
            "lhs[0]");
    assertThat(fqn, hasToString("range_check_3__outer__in_ner__lhs_0_"));
    assertThat(new Fqn("r", 0, ImmutableList.of(), "a"),
        hasToString("r_0__a"));
  }
}

// End FqnTest.java
