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
package net.hydromatic.plonkir.compile;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.plonkir.RecordingBackend;
import net.hydromatic.plonkir.TestCircuits;
import net.hydromatic.plonkir.gate.GateCallbacks;
import net.hydromatic.plonkir.lookup.LookupCallbacks;
import org.junit.jupiter.api.Test;

/** Tests {@link Tracers}. */
class TracersTest {
  /** Tracers can be stacked, and each sees the events of one kind. */
  @Test void testChain() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnRegion(tracer, r -> events.add("region " + r.name));
    tracer = Tracers.withOnFreeCells(tracer, (groupId, name, cells) ->
        events.add("free " + name + " " + cells.size()));
    tracer = Tracers.withOnGroupBody(tracer, b -> events.add("body " + b.name));
    tracer = Tracers.withOnLeader(tracer, name -> events.add("leader " + name));
    Compiler.compile(new TestCircuits.Nested(), new RecordingBackend(),
        ImmutableMap.of(), tracer, GateCallbacks.DEFAULT,
        LookupCallbacks.DEFAULT);
    assertThat(events,
        is(
            ImmutableList.of("region r1", "region r2",
                "free A 1", "free B 1", "free Main 1",
                "body A", "body B", "body Main",
                "leader A", "leader B", "leader Main")));
  }

  /** A stacked tracer still passes events to the tracer beneath it. */
  @Test void testDelegation() {
    final List<String> outer = new ArrayList<>();
    final List<String> inner = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnWarning(
            Tracers.withOnWarning(Tracers.empty(), inner::add),
            outer::add);
    tracer.onWarning("careful");
    assertThat(outer, is(ImmutableList.of("careful")));
    assertThat(inner, is(ImmutableList.of("careful")));
  }
}

// End TracersTest.java
