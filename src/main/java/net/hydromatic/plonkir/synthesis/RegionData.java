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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Selector;

/**
 * A region: a named, contiguous range of rows whose cells are assigned
 * together.
 *
 * <p>A region is created open by {@link RegionRecorder#push}, grows as cells
 * are assigned and selectors enabled, and is frozen by
 * {@link RegionRecorder#commit}. A committed region may later be demoted to
 * a lookup table.
 */
public class RegionData {
  public final String name;
  public final int index;
  /** First row of the region. */
  public final int start;
  /** Namespaces that were open when the region was entered. */
  public final ImmutableList<String> namespaces;

  private int height;
  private final Set<Column> columns = new LinkedHashSet<>();
  private final TreeMap<Integer, Set<Selector>> enabledSelectors =
      new TreeMap<>();
  private final FixedData fixedData = new FixedData();

  RegionData(String name, int index, int start, List<String> namespaces) {
    this.name = requireNonNull(name);
    this.index = index;
    this.start = start;
    this.namespaces = ImmutableList.copyOf(namespaces);
  }

  @Override public String toString() {
    return "region " + index + " '" + name + "' rows [" + start + ", "
        + end() + ")";
  }

  /** Records that a cell has been used, extending the region if
   * necessary. */
  void touch(Column column, int row) {
    if (row < start) {
      throw new SynthesisException("Row " + row + " is before the start of "
          + this);
    }
    columns.add(column);
    height = Math.max(height, row - start + 1);
  }

  void enableSelector(Selector selector, int row) {
    if (row < start) {
      throw new SynthesisException("Row " + row + " is before the start of "
          + this);
    }
    enabledSelectors.computeIfAbsent(row, r -> new LinkedHashSet<>())
        .add(selector);
    height = Math.max(height, row - start + 1);
  }

  /** Returns the number of rows. */
  public int height() {
    return height;
  }

  /** Returns the row after the last row of the region. */
  public int end() {
    return start + height;
  }

  public boolean containsRow(int row) {
    return row >= start && row < end();
  }

  /** Returns whether a cell lies in one of this region's columns and within
   * its rows. */
  public boolean contains(Cell cell) {
    return columns.contains(cell.column) && containsRow(cell.row);
  }

  public ImmutableSet<Column> columns() {
    return ImmutableSet.copyOf(columns);
  }

  /** Returns the fixed columns used by this region. */
  public ImmutableSet<Column> fixedColumns() {
    final ImmutableSet.Builder<Column> b = ImmutableSet.builder();
    columns.forEach(c -> {
      if (c.isFixed()) {
        b.add(c);
      }
    });
    return b.build();
  }

  /** Returns the selectors enabled at an absolute row. */
  public ImmutableSet<Selector> enabledSelectors(int row) {
    final Set<Selector> set = enabledSelectors.get(row);
    return set == null ? ImmutableSet.of() : ImmutableSet.copyOf(set);
  }

  /** Returns whether a selector is enabled at an absolute row. */
  public boolean isEnabled(Selector selector, int row) {
    final Set<Selector> set = enabledSelectors.get(row);
    return set != null && set.contains(selector);
  }

  /** Freezes the region's fixed data; called when the region is
   * committed. */
  void freeze() {
    fixedData.freeze();
  }

  /** Values written to fixed cells while this region was open. Read-only
   * once the region is committed. */
  public FixedData fixedData() {
    return fixedData;
  }
}

// End RegionData.java
