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
package net.hydromatic.plonkir.group;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import java.util.List;
import net.hydromatic.plonkir.TestCircuits;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.compile.Tracers;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;
import net.hydromatic.plonkir.synthesis.EqConstraint;
import net.hydromatic.plonkir.synthesis.Synthesizer;
import org.junit.jupiter.api.Test;

/** Tests {@link FreeCellLifter}, {@link GroupBounds} and
 * {@link Groups}. */
class FreeCellLifterTest {
  private final CircuitSynthesis synthesis =
      Synthesizer.synthesize(new TestCircuits.Nested(), Tracers.empty());
  private final Column a = Column.advice(0);

  /** Group A reaches out to B's cell at row 2; B, which calls A, must
   * therefore receive that cell too, and in turn reaches out to A's cell at
   * row 1, which the top level must supply. */
  @Test void testLift() {
    final FreeCellLifter lifter =
        new FreeCellLifter(synthesis.groups, synthesis.eqGraph);
    final List<FreeCells> result = lifter.lift();
    assertThat(result, hasSize(3));
    assertThat(result.get(0).inputs, hasToString("[advice[0]@2]"));
    assertThat(result.get(1).inputs, hasToString("[advice[0]@1]"));
    assertThat(result.get(1).callsites, hasToString("[[advice[0]@2]]"));
    assertThat(result.get(2).inputs, hasToString("[advice[0]@1]"));
    assertThat(result.get(2).callsites, hasToString("[[advice[0]@1]]"));

    // Lifting again from the result changes nothing.
    assertThat(lifter.lift(result), is(result));
  }

  @Test void testRegionStarts() {
    final Groups groups = synthesis.groups;
    assertThat(groups.regionStarts(), hasToString("{0=0, 1=2}"));
    assertThat(groups.regionStarts(), sameInstance(groups.regionStarts()));
  }

  @Test void testBounds() {
    final Groups groups = synthesis.groups;
    final EqConstraint edge = synthesis.eqGraph.edges().get(0);

    final GroupBounds boundsA = new GroupBounds(groups.get(0), groups);
    assertThat(boundsA.check(edge), hasToString("(WITHIN, OUTSIDE)"));
    assertThat(boundsA.withinBounds(Cell.of(a, 0)), is(true));
    assertThat(boundsA.withinBounds(Cell.of(Column.advice(1), 0)),
        is(false));

    final List<FreeCells> freeCells =
        new FreeCellLifter(groups, synthesis.eqGraph).lift();
    final GroupBounds boundsB =
        new GroupBounds(groups.get(1), groups, freeCells.get(1).inputs);
    assertThat(boundsB.check(edge), hasToString("(FOREIGN_IO, WITHIN)"));
    assertThat(boundsB.check(Cell.of(a, 0)), is(GroupBounds.Bound.OUTSIDE));
  }
}

// End FreeCellLifterTest.java
