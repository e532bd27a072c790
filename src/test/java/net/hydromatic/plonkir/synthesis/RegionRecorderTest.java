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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Random;
import java.util.TreeSet;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Felt;
import org.junit.jupiter.api.Test;

/** Tests {@link RegionRecorder}. */
class RegionRecorderTest {
  private static RegionData push(RegionRecorder recorder, String name) {
    return recorder.push(name, null, 0, ImmutableList.of());
  }

  @Test void testSequentialIndices() {
    final RegionRecorder recorder = new RegionRecorder();
    assertThat(recorder.latest(), nullValue());
    assertThat(push(recorder, "a").index, is(0));
    recorder.commit();
    assertThat(push(recorder, "b").index, is(1));
    assertThat(recorder.current().name, is("b"));
    recorder.commit();
    assertThat(recorder.latest().name, is("b"));
    assertThat(recorder.usedIndices(), is(ImmutableSortedSet.of(0, 1)));
  }

  /** Demoting a region to a table gives its index to the next region. */
  @Test void testDemoteReusesIndex() {
    final RegionRecorder recorder = new RegionRecorder();
    push(recorder, "a");
    recorder.commit();
    push(recorder, "table");
    recorder.commit();
    final RegionData table = recorder.demoteLatest();
    assertThat(table.index, is(1));
    assertThat(recorder.tables(), is(ImmutableList.of(table)));
    assertThat(push(recorder, "b").index, is(1));
    recorder.commit();
    assertThat(push(recorder, "c").index, is(2));
  }

  /** After two demotions in a row, both indices are reused, lowest first,
   * and the indices stay contiguous. */
  @Test void testDemoteTwice() {
    final RegionRecorder recorder = new RegionRecorder();
    for (String name : ImmutableList.of("a", "b", "c")) {
      push(recorder, name);
      recorder.commit();
    }
    assertThat(recorder.demoteLatest().index, is(2));
    assertThat(recorder.demoteLatest().index, is(1));
    assertThat(recorder.usedIndices(), is(ImmutableSortedSet.of(0)));
    assertThat(push(recorder, "d").index, is(1));
    recorder.commit();
    assertThat(push(recorder, "e").index, is(2));
    recorder.commit();
    assertThat(push(recorder, "f").index, is(3));
    recorder.commit();
    assertThat(recorder.usedIndices(),
        is(ImmutableSortedSet.of(0, 1, 2, 3)));
    assertThat(recorder.tables(), hasSize(2));
  }

  /** A recovered index that an explicit index has taken is not handed
   * out again. */
  @Test void testRecoveredIndexTakenExplicitly() {
    final RegionRecorder recorder = new RegionRecorder();
    push(recorder, "a");
    recorder.commit();
    push(recorder, "table");
    recorder.commit();
    recorder.demoteLatest();
    assertThat(recorder.push("b", 1, 0, ImmutableList.of()).index, is(1));
    recorder.commit();
    assertThat(push(recorder, "c").index, is(2));
  }

  /** A committed region's fixed data can be read but not written. */
  @Test void testCommittedFixedDataIsReadOnly() {
    final RegionRecorder recorder = new RegionRecorder();
    final Column f = Column.fixed(0);
    final RegionData region = push(recorder, "a");
    region.fixedData().assign(Cell.of(f, 0), Felt.of(7));
    assertThat(region.fixedData().isFrozen(), is(false));
    recorder.commit();
    assertThat(region.fixedData().isFrozen(), is(true));
    assertThat(region.fixedData().resolve(Cell.of(f, 0)), is(Felt.of(7)));
    final SynthesisException e =
        assertThrows(SynthesisException.class, () ->
            region.fixedData().assign(Cell.of(f, 1), Felt.of(8)));
    assertThat(e.getMessage(), is("Fixed data is read-only"));
    assertThrows(SynthesisException.class, () ->
        region.fixedData().fill(f, 0, Felt.ZERO));
    assertThat(region.fixedData().directValues().size(), is(1));
  }

  @Test void testExplicitIndex() {
    final RegionRecorder recorder = new RegionRecorder();
    assertThat(recorder.push("a", 1, 0, ImmutableList.of()).index, is(1));
    recorder.commit();
    assertThat(push(recorder, "b").index, is(0));
    recorder.commit();
    // Index 1 is taken, so the counter skips it.
    assertThat(push(recorder, "c").index, is(2));
    recorder.commit();
    final SynthesisException e =
        assertThrows(SynthesisException.class, () ->
            recorder.push("d", 2, 0, ImmutableList.of()));
    assertThat(e.getMessage(), is("Region index 2 is already in use"));
  }

  @Test void testErrors() {
    final RegionRecorder recorder = new RegionRecorder();
    assertThrows(SynthesisException.class, recorder::current);
    assertThrows(SynthesisException.class, recorder::commit);
    final SynthesisException e =
        assertThrows(SynthesisException.class, recorder::demoteLatest);
    assertThat(e.getMessage(), is("There is no region to demote"));
    push(recorder, "a");
    final SynthesisException e2 =
        assertThrows(SynthesisException.class, () -> push(recorder, "b"));
    assertThat(e2.getMessage(),
        is("Cannot enter region 'b' while region 0 'a' rows [0, 0) is open"));
    assertThrows(SynthesisException.class, recorder::demoteLatest);
  }

  /** Runs random sequences of operations, and checks that committed regions
   * always have distinct indices, and that the used indices are exactly
   * those of the committed and open regions. */
  @Test void testRandom() {
    final Random random = new Random(1234);
    for (int run = 0; run < 50; run++) {
      final RegionRecorder recorder = new RegionRecorder();
      for (int step = 0; step < 40; step++) {
        final int action = random.nextInt(4);
        if (recorder.currentOrNull() != null) {
          recorder.current().touch(Column.advice(0), random.nextInt(3));
          recorder.commit();
        } else if (action == 0 && recorder.latest() != null) {
          recorder.demoteLatest();
        } else if (action == 1) {
          final int explicit = random.nextInt(60);
          if (!recorder.usedIndices().contains(explicit)) {
            recorder.push("r" + step, explicit, 0, ImmutableList.of());
          }
        } else {
          push(recorder, "r" + step);
        }
        final TreeSet<Integer> indices = new TreeSet<>();
        for (RegionData region : recorder.committed()) {
          indices.add(region.index);
        }
        assertThat(indices, hasSize(recorder.committed().size()));
        final RegionData open = recorder.currentOrNull();
        if (open != null) {
          assertThat(indices.add(open.index), is(true));
        }
        assertThat(recorder.usedIndices(),
            is(ImmutableSortedSet.copyOf(indices)));
      }
    }
  }
}

// End RegionRecorderTest.java
