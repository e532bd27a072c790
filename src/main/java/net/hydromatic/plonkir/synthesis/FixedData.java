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

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Felt;

/**
 * Values written to fixed columns.
 *
 * <p>A value is either written directly to one cell, or is a blanket fill
 * that covers a column from a given row onwards. When resolving a cell,
 * a direct write wins; otherwise the most recent blanket fill that covers
 * the cell; otherwise the cell is zero.
 *
 * <p>Once frozen, the data is read-only.
 */
public class FixedData {
  private final Map<Cell, Felt> values = new LinkedHashMap<>();
  private final List<Fill> fills = new ArrayList<>();
  private boolean frozen;

  /** Makes this data read-only. */
  void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkWritable() {
    if (frozen) {
      throw new SynthesisException("Fixed data is read-only");
    }
  }

  /** Records a direct write. */
  public void assign(Cell cell, Felt value) {
    requireNonNull(value);
    checkWritable();
    if (!cell.column.isFixed()) {
      throw new SynthesisException("Cell " + cell + " is not fixed");
    }
    values.put(cell, value);
  }

  /** Records a blanket fill of {@code column} from {@code fromRow}
   * onwards. */
  public void fill(Column column, int fromRow, Felt value) {
    checkWritable();
    if (!column.isFixed()) {
      throw new SynthesisException("Column " + column + " is not fixed");
    }
    fills.add(new Fill(column, fromRow, requireNonNull(value)));
  }

  /** Returns the value of a fixed cell, or empty if nothing has been written
   * to it. */
  public Optional<Felt> lookup(Cell cell) {
    final Felt value = values.get(cell);
    if (value != null) {
      return Optional.of(value);
    }
    for (int i = fills.size() - 1; i >= 0; i--) {
      final Fill fill = fills.get(i);
      if (fill.covers(cell)) {
        return Optional.of(fill.value);
      }
    }
    return Optional.empty();
  }

  /** Returns the value of a fixed cell; zero if nothing has been written to
   * it. */
  public Felt resolve(Cell cell) {
    return lookup(cell).orElse(Felt.ZERO);
  }

  /** Returns the cells that have been written directly, and their
   * values. */
  public ImmutableMap<Cell, Felt> directValues() {
    return ImmutableMap.copyOf(values);
  }

  public boolean isEmpty() {
    return values.isEmpty() && fills.isEmpty();
  }

  /** Blanket fill of a column. */
  private static class Fill {
    final Column column;
    final int fromRow;
    final Felt value;

    Fill(Column column, int fromRow, Felt value) {
      this.column = column;
      this.fromRow = fromRow;
      this.value = value;
    }

    boolean covers(Cell cell) {
      return cell.column.equals(column) && cell.row >= fromRow;
    }
  }
}

// End FixedData.java
