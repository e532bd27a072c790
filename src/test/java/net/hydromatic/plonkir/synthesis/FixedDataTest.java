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
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Felt;
import org.junit.jupiter.api.Test;

/** Tests {@link FixedData}. */
class FixedDataTest {
  private final Column f = Column.fixed(0);

  /** A direct write wins over a blanket fill; a fill covers the rows from
   * its start onwards. */
  @Test void testDirectWinsOverFill() {
    final FixedData data = new FixedData();
    assertThat(data.isEmpty(), is(true));
    data.fill(f, 5, Felt.of(7));
    data.assign(Cell.of(f, 5), Felt.of(3));
    assertThat(data.resolve(Cell.of(f, 5)), is(Felt.of(3)));
    assertThat(data.resolve(Cell.of(f, 6)), is(Felt.of(7)));
    assertThat(data.resolve(Cell.of(f, 4)), is(Felt.ZERO));
    assertThat(data.lookup(Cell.of(f, 4)), is(Optional.empty()));
    assertThat(data.resolve(Cell.of(Column.fixed(1), 9)), is(Felt.ZERO));
  }

  /** The most recent fill wins. */
  @Test void testLaterFill() {
    final FixedData data = new FixedData();
    data.fill(f, 0, Felt.of(1));
    data.fill(f, 10, Felt.of(2));
    assertThat(data.resolve(Cell.of(f, 3)), is(Felt.of(1)));
    assertThat(data.resolve(Cell.of(f, 12)), is(Felt.of(2)));
    assertThat(data.directValues().isEmpty(), is(true));
  }

  @Test void testNotFixed() {
    final FixedData data = new FixedData();
    final SynthesisException e =
        assertThrows(SynthesisException.class, () ->
            data.assign(Cell.of(Column.advice(0), 0), Felt.ONE));
    assertThat(e.getMessage(), is("Cell advice[0]@0 is not fixed"));
    assertThrows(SynthesisException.class, () ->
        data.fill(Column.instance(0), 0, Felt.ONE));
  }
}

// End FixedDataTest.java
