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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import net.hydromatic.plonkir.circuit.AssignedCell;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.ConstraintSystem;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.group.GroupCell;
import net.hydromatic.plonkir.group.GroupKey;
import net.hydromatic.plonkir.ir.Stmt;

/**
 * Floor planner that places regions one after another.
 *
 * <p>Each region starts at the row after the last row of the previous
 * region. Tables are placed at row 0 of their own columns, and each of
 * their columns is then filled from the row after the table's last row,
 * which files the region as a table. Constants are placed, after all
 * regions, in the first column that was enabled for constants.
 */
public class SimpleFloorPlanner implements Layouter {
  private final Assignment assignment;
  private final ImmutableList<Column> constantColumns;
  private final Map<Integer, Integer> regionStarts = new HashMap<>();
  private final List<Constant> constants = new ArrayList<>();
  private final Deque<GroupIo> groupIo = new ArrayDeque<>();
  private int cursor;

  public SimpleFloorPlanner(Assignment assignment, ConstraintSystem cs) {
    this.assignment = requireNonNull(assignment);
    this.constantColumns = cs.constantColumns().asList();
  }

  /** Returns the row after the last row that has been laid out. */
  public int cursor() {
    return cursor;
  }

  @Override public <T> T assignRegion(String name, Function<Region, T> fn) {
    final int start = cursor;
    final int index = assignment.enterRegion(name, null, start);
    regionStarts.put(index, start);
    final RegionImpl region = new RegionImpl(index, start);
    final T result = fn.apply(region);
    assignment.exitRegion();
    cursor = start + region.height;
    return result;
  }

  @Override public void assignTable(String name, Consumer<Table> fn) {
    assignment.enterRegion(name, null, 0);
    final TableImpl table = new TableImpl();
    fn.accept(table);
    assignment.exitRegion();
    table.defaults.forEach((column, value) ->
        assignment.fillFromRow(column, table.heights.get(column), value));
  }

  @Override public void constrainInstance(AssignedCell cell,
      Column instanceColumn, int row) {
    checkArgument(instanceColumn.isInstance(), "not an instance column: %s",
        instanceColumn);
    assignment.copy(absolute(cell), Cell.of(instanceColumn, row));
  }

  @Override public <T> T namespace(String name, Supplier<T> fn) {
    assignment.pushNamespace(name);
    try {
      return fn.get();
    } finally {
      assignment.popNamespace();
    }
  }

  @Override public <T> T group(String name, GroupKey key,
      Function<Layouter, T> fn) {
    assignment.enterGroup(name, key);
    groupIo.push(new GroupIo());
    final T result = fn.apply(this);
    final GroupIo io = groupIo.pop();
    assignment.exitGroup(io.inputs, io.outputs);
    return result;
  }

  @Override public void annotateInput(GroupCell cell) {
    currentGroup().inputs.add(checkKnown(cell));
  }

  @Override public void annotateOutput(GroupCell cell) {
    currentGroup().outputs.add(checkKnown(cell));
  }

  private GroupIo currentGroup() {
    final GroupIo io = groupIo.peek();
    if (io == null) {
      throw new SynthesisException("Cannot annotate a cell outside of a "
          + "group");
    }
    return io;
  }

  private GroupCell checkKnown(GroupCell cell) {
    final Integer regionIndex = cell.regionIndex();
    if (regionIndex != null && !regionStarts.containsKey(regionIndex)) {
      throw SynthesisException.inconsistentRegionIndex(cell);
    }
    return cell;
  }

  /** Converts a region-relative cell to an absolute cell. */
  private Cell absolute(AssignedCell cell) {
    final Integer start = regionStarts.get(cell.regionIndex);
    if (start == null) {
      throw SynthesisException.inconsistentRegionIndex(cell);
    }
    return Cell.of(cell.column, start + cell.rowOffset);
  }

  /** Places the constants collected by
   * {@link Region#constrainConstant}. Call once, after the circuit has been
   * synthesized. */
  public void finish() {
    if (constants.isEmpty()) {
      return;
    }
    if (constantColumns.isEmpty()) {
      throw new SynthesisException("Circuit uses constants but no fixed "
          + "column was enabled for constants");
    }
    final Column column = constantColumns.get(0);
    final int start = cursor;
    assignment.enterRegion("constants", null, start);
    int row = start;
    for (Constant constant : constants) {
      assignment.assignFixed("constant", column, row, constant.value);
      assignment.copy(constant.cell, Cell.of(column, row));
      ++row;
    }
    assignment.exitRegion();
    cursor = row;
    constants.clear();
  }

  /** Constant to be placed after all regions. */
  private static class Constant {
    final Cell cell;
    final Felt value;

    Constant(Cell cell, Felt value) {
      this.cell = cell;
      this.value = value;
    }
  }

  /** Inputs and outputs declared for an open group. */
  private static class GroupIo {
    final List<GroupCell> inputs = new ArrayList<>();
    final List<GroupCell> outputs = new ArrayList<>();
  }

  /** Implementation of {@link Region} that offsets rows by the region's
   * start. */
  private class RegionImpl implements Region {
    final int index;
    final int start;
    int height;

    RegionImpl(int index, int start) {
      this.index = index;
      this.start = start;
    }

    private int row(int offset) {
      checkArgument(offset >= 0, "negative offset %s", offset);
      height = Math.max(height, offset + 1);
      return start + offset;
    }

    @Override public int index() {
      return index;
    }

    @Override public AssignedCell assignAdvice(String annotation,
        Column column, int offset) {
      checkArgument(column.isAdvice(), "not an advice column: %s", column);
      assignment.assignAdvice(annotation, column, row(offset));
      return AssignedCell.of(index, offset, column);
    }

    @Override public AssignedCell assignFixed(String annotation,
        Column column, int offset, Felt value) {
      checkArgument(column.isFixed(), "not a fixed column: %s", column);
      assignment.assignFixed(annotation, column, row(offset), value);
      return AssignedCell.of(index, offset, column);
    }

    @Override public void enableSelector(String annotation,
        Selector selector, int offset) {
      assignment.enableSelector(annotation, selector, row(offset));
    }

    @Override public void constrainEqual(AssignedCell left,
        AssignedCell right) {
      assignment.copy(absolute(left), absolute(right));
    }

    @Override public void constrainConstant(AssignedCell cell, Felt value) {
      constants.add(new Constant(absolute(cell), value));
    }

    @Override public AssignedCell assignAdviceFromConstant(String annotation,
        Column column, int offset, Felt value) {
      final AssignedCell cell = assignAdvice(annotation, column, offset);
      constrainConstant(cell, value);
      return cell;
    }

    @Override public AssignedCell assignAdviceFromInstance(String annotation,
        Column instanceColumn, int instanceRow, Column adviceColumn,
        int offset) {
      checkArgument(instanceColumn.isInstance(), "not an instance column: %s",
          instanceColumn);
      final AssignedCell cell = assignAdvice(annotation, adviceColumn, offset);
      assignment.copy(Cell.of(instanceColumn, instanceRow), absolute(cell));
      return cell;
    }

    @Override public void injectIr(int offset, Stmt<Expression> stmt) {
      assignment.injectIr(start + offset, stmt);
    }

    @Override public void pushNamespace(String name) {
      assignment.pushNamespace(name);
    }

    @Override public void popNamespace() {
      assignment.popNamespace();
    }
  }

  /** Implementation of {@link Table}. Records, for each column, its height
   * and the value in its first row, which pads the rest of the column. */
  private class TableImpl implements Table {
    final Map<Column, Integer> heights = new LinkedHashMap<>();
    final Map<Column, Felt> defaults = new LinkedHashMap<>();

    @Override public void assignCell(String annotation, Column column,
        int offset, Felt value) {
      checkArgument(column.isFixed(), "not a fixed column: %s", column);
      checkArgument(offset >= 0, "negative offset %s", offset);
      assignment.assignFixed(annotation, column, offset, value);
      heights.merge(column, offset + 1, Math::max);
      if (offset == 0) {
        defaults.put(column, value);
      } else {
        defaults.putIfAbsent(column, Felt.ZERO);
      }
    }
  }
}

// End SimpleFloorPlanner.java
