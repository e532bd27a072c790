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
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.plonkir.TestCircuits;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Circuit;
import net.hydromatic.plonkir.circuit.CircuitIO;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.ColumnType;
import net.hydromatic.plonkir.circuit.ConstraintSystem;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.compile.Tracers;
import net.hydromatic.plonkir.group.Group;
import net.hydromatic.plonkir.group.GroupKey;
import net.hydromatic.plonkir.group.Groups;
import net.hydromatic.plonkir.ir.Stmt;
import org.junit.jupiter.api.Test;

/** Tests {@link Synthesizer} and {@link SimpleFloorPlanner}. */
class SynthesizerTest {
  private final ConstraintSystem cs = new ConstraintSystem();
  private final Column a = cs.adviceColumn();
  private final Column b = cs.adviceColumn();
  private final Column f = cs.fixedColumn();
  private final Synthesizer synthesizer =
      new Synthesizer(cs, Tracers.empty());

  private CircuitSynthesis finish() {
    return synthesizer.finish(CircuitIO.empty(ColumnType.ADVICE),
        CircuitIO.empty(ColumnType.INSTANCE));
  }

  @Test void testAdviceNames() {
    final CircuitSynthesis synthesis =
        Synthesizer.synthesize(new TestCircuits.Adder(), Tracers.empty());
    assertThat(synthesis.regions, hasSize(1));
    assertThat(synthesis.adviceNames.get(Cell.of(Column.advice(0), 0)),
        hasToString("add_0__a"));
    assertThat(synthesis.adviceIo.inputCount(), is(2));
    final Groups groups = synthesis.groups;
    assertThat(groups.size(), is(1));
    assertThat(groups.topLevel().name, is(Group.TOP_LEVEL_NAME));
    assertThat(groups.topLevel().regions, is(ImmutableList.of(0)));
    assertThat(groups.topLevel().inputs, hasSize(2));
  }

  /** Only the namespaces opened inside a region are part of the names of its
   * cells; the region remembers the ones that were open outside it. */
  @Test void testNamespaces() {
    synthesizer.pushNamespace("outer");
    synthesizer.enterRegion("r", null, 0);
    synthesizer.pushNamespace("in");
    synthesizer.assignAdvice("x", a, 0);
    synthesizer.popNamespace();
    synthesizer.exitRegion();
    synthesizer.popNamespace();
    final CircuitSynthesis synthesis = finish();
    assertThat(synthesis.adviceNames.get(Cell.of(a, 0)),
        hasToString("r_0__in__x"));
    assertThat(synthesis.regions.get(0).namespaces,
        is(ImmutableList.of("outer")));
  }

  @Test void testUnbalancedNamespaces() {
    synthesizer.enterRegion("r", null, 0);
    synthesizer.pushNamespace("x");
    final SynthesisException e =
        assertThrows(SynthesisException.class, synthesizer::exitRegion);
    assertThat(e.getMessage(),
        is("Unbalanced namespaces in region 0 'r' rows [0, 0)"));
  }

  /** Inside a region, a namespace opened outside it cannot be popped. */
  @Test void testPopOutsideRegionNamespace() {
    synthesizer.pushNamespace("outer");
    synthesizer.enterRegion("r", null, 0);
    final SynthesisException e =
        assertThrows(SynthesisException.class, synthesizer::popNamespace);
    assertThat(e.getMessage(), is("No namespace to pop"));
  }

  @Test void testCopyRequiresEquality() {
    synthesizer.enterRegion("r", null, 0);
    final SynthesisException e =
        assertThrows(SynthesisException.class, () ->
            synthesizer.copy(Cell.of(a, 0), Cell.of(b, 0)));
    assertThat(e.getMessage(),
        is("Column advice[0] is not enabled for equality constraints"));

    cs.enableEquality(a);
    cs.enableEquality(b);
    synthesizer.copy(Cell.of(a, 0), Cell.of(b, 0));
    synthesizer.copy(Cell.of(b, 0), Cell.of(a, 0));
    synthesizer.exitRegion();
    assertThat(finish().eqGraph.edges(), hasSize(1));
  }

  @Test void testAssignOutsideRegion() {
    final SynthesisException e =
        assertThrows(SynthesisException.class, () ->
            synthesizer.assignAdvice("x", a, 0));
    assertThat(e.getMessage(),
        is("Cannot assign advice[0] outside of a region"));
  }

  @Test void testFinishWhileOpen() {
    synthesizer.enterRegion("r", null, 0);
    final SynthesisException e =
        assertThrows(SynthesisException.class, this::finish);
    assertThat(e.getMessage(),
        is("Synthesis finished while region 0 'r' rows [0, 0) is open"));
  }

  @Test void testUnbalancedGroups() {
    synthesizer.enterGroup("g", GroupKey.of("g"));
    final SynthesisException e =
        assertThrows(SynthesisException.class, this::finish);
    assertThat(e.getMessage(),
        is("Unbalanced group stack: 1 group(s) not exited"));

    synthesizer.enterRegion("r", null, 0);
    final SynthesisException e2 =
        assertThrows(SynthesisException.class, () ->
            synthesizer.enterGroup("h", GroupKey.of("h")));
    assertThat(e2.getMessage(),
        is("Cannot enter group 'h' while region 0 'r' rows [0, 0) is open"));
  }

  @Test void testFillOutsideTable() {
    final SynthesisException e =
        assertThrows(SynthesisException.class, () ->
            synthesizer.fillFromRow(f, 3, Felt.ONE));
    assertThat(e.getMessage(),
        is("Cannot fill fixed[0]: it does not belong to a table"));
  }

  @Test void testInjectIr() {
    synthesizer.enterRegion("r", null, 4);
    synthesizer.assignAdvice("x", a, 4);
    synthesizer.injectIr(4, Stmt.eq(a.cur(), Expression.constant(1)));
    synthesizer.exitRegion();
    final CircuitSynthesis synthesis = finish();
    assertThat(synthesis.injected(0), hasSize(1));
    assertThat(synthesis.injected(0).get(0).row, is(4));
    assertThat(synthesis.injected(1), hasSize(0));
  }

  /** Committed regions must have indices 0, 1, ...; an explicit index
   * that leaves a gap is detected when synthesis finishes. */
  @Test void testRegionIndexGap() {
    synthesizer.enterRegion("r", null, 0);
    synthesizer.assignAdvice("x", a, 0);
    synthesizer.exitRegion();
    synthesizer.enterRegion("s", 2, 1);
    synthesizer.assignAdvice("y", a, 1);
    synthesizer.exitRegion();
    final SynthesisException e =
        assertThrows(SynthesisException.class, this::finish);
    assertThat(e.getMessage(), is("Region indices [0, 2] are not contiguous"));
  }

  /** A region whose fixed columns are filled after it is committed becomes
   * a table, and the next region reuses its index. */
  @Test void testTable() {
    final List<String> tables = new ArrayList<>();
    final CircuitSynthesis synthesis =
        Synthesizer.synthesize(new TestCircuits.RangeCheck(2),
            Tracers.withOnTable(Tracers.empty(), r -> tables.add(r.name)));
    assertThat(tables, is(ImmutableList.of("range table")));
    assertThat(synthesis.tables, hasSize(1));
    assertThat(synthesis.regions, hasSize(1));
    final RegionData values = synthesis.regions.get(0);
    assertThat(values.name, is("values"));
    assertThat(values.index, is(0));
    assertThat(values.height(), is(2));

    final Column t = Column.fixed(0);
    assertThat(synthesis.tableData.rows(ImmutableList.of(t)), hasSize(4));
    assertThat(synthesis.fixedData.resolve(Cell.of(t, 3)), is(Felt.of(3)));
    // The fill after the table's last row uses the value in its first row.
    assertThat(synthesis.fixedData.resolve(Cell.of(t, 10)), is(Felt.ZERO));
    assertThat(
        synthesis.tablesForLookup(synthesis.cs.lookups().get(0)),
        hasSize(1));
    assertThat(synthesis.groups.topLevel().regions,
        is(ImmutableList.of(0)));
  }

  @Test void testGroups() {
    final CircuitSynthesis synthesis =
        Synthesizer.synthesize(new TestCircuits.Nested(), Tracers.empty());
    final Groups groups = synthesis.groups;
    assertThat(groups.size(), is(3));
    final Group groupA = groups.get(0);
    final Group groupB = groups.get(1);
    assertThat(groupA.name, is("A"));
    assertThat(groupA.regions, is(ImmutableList.of(0)));
    assertThat(groupB.children, is(ImmutableList.of(0)));
    assertThat(groupB.regions, is(ImmutableList.of(1)));
    assertThat(groups.topLevel().children, is(ImmutableList.of(1)));
    assertThat(groups.owner(1), is(1));
    assertThat(groups.baseRow(groupB), is(0));
    assertThat(groups.regionStarts().get(1), is(2));
    assertThat(synthesis.eqGraph.edges(),
        hasToString("[advice[0]@1 == advice[0]@2]"));
  }

  /** Constants are placed in a region after all the others, and each
   * becomes an equality constraint and a fixed-to-constant constraint. */
  @Test void testConstants() {
    final CircuitSynthesis synthesis =
        Synthesizer.synthesize(new TestCircuits.Constant(), Tracers.empty());
    assertThat(synthesis.regions, hasSize(2));
    final RegionData constants = synthesis.regions.get(1);
    assertThat(constants.name, is("constants"));
    assertThat(constants.start, is(1));
    assertThat(synthesis.eqGraph.edges(),
        hasToString("[fixed[0]@1 == advice[0]@0, fixed[0]@1 == 5]"));
  }

  @Test void testConstantsWithoutColumn() {
    final SynthesisException e =
        assertThrows(SynthesisException.class, () ->
            Synthesizer.synthesize(new NoConstantColumn(), Tracers.empty()));
    assertThat(e.getMessage(),
        is("Circuit uses constants but no fixed column was enabled for "
            + "constants"));
  }

  /** Circuit that assigns a constant without a column to hold it. */
  private static class NoConstantColumn implements Circuit<Column> {
    @Override public Column configure(ConstraintSystem cs) {
      final Column a = cs.adviceColumn();
      cs.enableEquality(a);
      return a;
    }

    @Override public void synthesize(Column a, Layouter layouter) {
      layouter.assignRegion("r", region ->
          region.assignAdviceFromConstant("a", a, 0, Felt.of(5)));
    }
  }
}

// End SynthesizerTest.java
