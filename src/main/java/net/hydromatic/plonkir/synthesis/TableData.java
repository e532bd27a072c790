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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Felt;

/** Contents of the fixed columns of the regions that were demoted to
 * lookup tables. */
public class TableData {
  private final Map<Column, TreeMap<Integer, Felt>> columns =
      new LinkedHashMap<>();

  /** Adds the fixed cells of a demoted region. */
  void add(RegionData region) {
    region.fixedData().directValues().forEach((Cell cell, Felt value) ->
        columns.computeIfAbsent(cell.column, c -> new TreeMap<>())
            .put(cell.row, value));
  }

  public boolean contains(Column column) {
    return columns.containsKey(column);
  }

  /**
   * Returns the rows of the table formed by the given columns. Row {@code i}
   * of the result holds the value of each column at row {@code i}.
   *
   * @throws SynthesisException if a column is unknown, has a gap, or has a
   * different length than the others
   */
  public ImmutableList<ImmutableList<Felt>> rows(List<Column> columns) {
    int height = -1;
    for (Column column : columns) {
      final TreeMap<Integer, Felt> values = this.columns.get(column);
      if (values == null) {
        throw new SynthesisException("Column " + column
            + " is not part of any table");
      }
      int expected = 0;
      for (int row : values.keySet()) {
        if (row != expected) {
          throw new SynthesisException("Table column " + column
              + " has a gap at row " + expected);
        }
        ++expected;
      }
      if (height >= 0 && height != values.size()) {
        throw new SynthesisException("Table column " + column + " has "
            + values.size() + " rows; expected " + height);
      }
      height = values.size();
    }
    final ImmutableList.Builder<ImmutableList<Felt>> rows =
        ImmutableList.builder();
    for (int i = 0; i < Math.max(height, 0); i++) {
      final ImmutableList.Builder<Felt> row = ImmutableList.builder();
      for (Column column : columns) {
        row.add(this.columns.get(column).get(i));
      }
      rows.add(row.build());
    }
    return rows.build();
  }
}

// End TableData.java
