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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Circuit;
import net.hydromatic.plonkir.circuit.CircuitIO;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.ConstraintSystem;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.compile.Tracer;
import net.hydromatic.plonkir.group.Group;
import net.hydromatic.plonkir.group.GroupBuilder;
import net.hydromatic.plonkir.group.GroupCell;
import net.hydromatic.plonkir.group.GroupKey;
import net.hydromatic.plonkir.group.Groups;
import net.hydromatic.plonkir.ir.Stmt;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Records everything a circuit does while it is configured and
 * synthesized.
 *
 * <p>A synthesizer is used for one run. If the circuit breaks a structural
 * rule, the run fails with {@link SynthesisException} and nothing that was
 * recorded is kept.
 */
public class Synthesizer implements Assignment {
  private final ConstraintSystem cs;
  private final Tracer tracer;
  private final RegionRecorder recorder = new RegionRecorder();
  private final FixedData fixedData = new FixedData();
  private final TableData tableData = new TableData();
  private final EqConstraintGraph eqGraph = new EqConstraintGraph();
  private final GroupBuilder groupBuilder = new GroupBuilder();
  private final Map<Cell, Fqn> adviceNames = new LinkedHashMap<>();
  private final ListMultimap<Integer, InjectedIr> injected =
      ArrayListMultimap.create();
  private final List<String> namespaces = new ArrayList<>();
  private @Nullable RegionData lastTable;
  private int regionNamespaceDepth;

  public Synthesizer(ConstraintSystem cs, Tracer tracer) {
    this.cs = requireNonNull(cs);
    this.tracer = requireNonNull(tracer);
  }

  /** Configures and synthesizes a circuit. */
  public static <C> CircuitSynthesis synthesize(Circuit<C> circuit,
      Tracer tracer) {
    final ConstraintSystem cs = new ConstraintSystem();
    final C config = circuit.configure(cs);
    final Synthesizer synthesizer = new Synthesizer(cs, tracer);
    final SimpleFloorPlanner planner = new SimpleFloorPlanner(synthesizer, cs);
    circuit.synthesize(config, planner);
    planner.finish();
    return synthesizer.finish(circuit.adviceIo(config),
        circuit.instanceIo(config));
  }

  /** Completes the run, making the circuit's inputs and outputs those of the
   * top level group. */
  public CircuitSynthesis finish(CircuitIO adviceIo, CircuitIO instanceIo) {
    final RegionData open = recorder.currentOrNull();
    if (open != null) {
      throw new SynthesisException("Synthesis finished while " + open
          + " is open");
    }
    final List<GroupCell> inputs = new ArrayList<>();
    final List<GroupCell> outputs = new ArrayList<>();
    instanceIo.inputs().forEach(c -> inputs.add(GroupCell.instance(c)));
    adviceIo.inputs().forEach(c -> inputs.add(GroupCell.advice(c)));
    instanceIo.outputs().forEach(c -> outputs.add(GroupCell.instance(c)));
    adviceIo.outputs().forEach(c -> outputs.add(GroupCell.advice(c)));
    final List<Group> groupList = groupBuilder.finish(inputs, outputs);
    eqGraph.addFixedToConst(fixedData);
    final Groups groups = new Groups(groupList, recorder.committed());
    return new CircuitSynthesis(cs, recorder.committed(), recorder.tables(),
        fixedData, tableData, eqGraph, groups, adviceNames, adviceIo,
        instanceIo, injected);
  }

  /** Returns the indices of the regions that are committed or open. */
  public List<Integer> usedRegionIndices() {
    return recorder.usedIndices().asList();
  }

  @Override public int enterRegion(String name,
      @Nullable Integer explicitIndex, int start) {
    final RegionData region =
        recorder.push(name, explicitIndex, start, namespaces);
    regionNamespaceDepth = namespaces.size();
    return region.index;
  }

  @Override public void exitRegion() {
    final RegionData region = recorder.current();
    if (namespaces.size() != regionNamespaceDepth) {
      throw new SynthesisException("Unbalanced namespaces in " + region);
    }
    recorder.commit();
    groupBuilder.addRegion(region.index);
    tracer.onRegion(region);
  }

  private RegionData currentRegion(String action) {
    final RegionData region = recorder.currentOrNull();
    if (region == null) {
      throw new SynthesisException("Cannot " + action
          + " outside of a region");
    }
    return region;
  }

  @Override public void enableSelector(String annotation, Selector selector,
      int row) {
    currentRegion("enable selector " + selector)
        .enableSelector(selector, row);
  }

  @Override public void assignAdvice(String annotation, Column column,
      int row) {
    final RegionData region = currentRegion("assign " + column);
    region.touch(column, row);
    final List<String> local =
        namespaces.subList(regionNamespaceDepth, namespaces.size());
    adviceNames.put(Cell.of(column, row),
        new Fqn(region.name, region.index, local, annotation));
  }

  @Override public void assignFixed(String annotation, Column column, int row,
      Felt value) {
    final RegionData region = currentRegion("assign " + column);
    region.touch(column, row);
    final Cell cell = Cell.of(column, row);
    region.fixedData().assign(cell, value);
    fixedData.assign(cell, value);
  }

  @Override public void copy(Cell left, Cell right) {
    checkEquality(left);
    checkEquality(right);
    eqGraph.add(left, right);
  }

  private void checkEquality(Cell cell) {
    if (!cs.equalityColumns().contains(cell.column)) {
      throw new SynthesisException("Column " + cell.column
          + " is not enabled for equality constraints");
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Inside a region, records a blanket fill in the region and globally.
   * Outside a region, the column belongs to a table that has just been
   * assigned; the first such call demotes that region to a table.
   */
  @Override public void fillFromRow(Column column, int fromRow, Felt value) {
    final RegionData open = recorder.currentOrNull();
    if (open != null) {
      open.fixedData().fill(column, fromRow, value);
      fixedData.fill(column, fromRow, value);
      return;
    }
    if (lastTable == null || !lastTable.columns().contains(column)) {
      final RegionData latest = recorder.latest();
      if (latest == null || !latest.columns().contains(column)) {
        throw new SynthesisException("Cannot fill " + column
            + ": it does not belong to a table");
      }
      final RegionData table = recorder.demoteLatest();
      groupBuilder.removeRegion(table.index);
      tableData.add(table);
      lastTable = table;
      tracer.onTable(table);
    }
    fixedData.fill(column, fromRow, value);
  }

  @Override public void pushNamespace(String name) {
    namespaces.add(requireNonNull(name));
  }

  @Override public void popNamespace() {
    final int floor =
        recorder.currentOrNull() == null ? 0 : regionNamespaceDepth;
    if (namespaces.size() <= floor) {
      throw new SynthesisException("No namespace to pop");
    }
    namespaces.remove(namespaces.size() - 1);
  }

  @Override public void enterGroup(String name, GroupKey key) {
    final RegionData open = recorder.currentOrNull();
    if (open != null) {
      throw new SynthesisException("Cannot enter group '" + name
          + "' while " + open + " is open");
    }
    groupBuilder.enter(name, key);
  }

  @Override public void exitGroup(List<GroupCell> inputs,
      List<GroupCell> outputs) {
    final List<Integer> committed = new ArrayList<>();
    recorder.committed().forEach(r -> committed.add(r.index));
    for (GroupCell cell
        : ImmutableList.<GroupCell>builder().addAll(inputs).addAll(outputs)
            .build()) {
      final Integer regionIndex = cell.regionIndex();
      if (regionIndex != null && !committed.contains(regionIndex)) {
        throw SynthesisException.inconsistentRegionIndex(cell);
      }
    }
    groupBuilder.exit(inputs, outputs);
  }

  @Override public void injectIr(int row, Stmt<Expression> stmt) {
    final RegionData region = currentRegion("inject IR");
    injected.put(region.index, new InjectedIr(region.index, row, stmt));
  }
}

// End Synthesizer.java
