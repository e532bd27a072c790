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

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.Objects;
import net.hydromatic.plonkir.circuit.AssignedCell;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.ColumnType;
import net.hydromatic.plonkir.synthesis.SynthesisException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Cell that is an input or output of a group. */
public abstract class GroupCell {
  public final Kind kind;

  GroupCell(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Creates a cell that was assigned in a region. */
  public static GroupCell assigned(AssignedCell cell) {
    return new Assigned(cell);
  }

  /** Creates a cell of an instance column at an absolute row. */
  public static GroupCell instance(Cell cell) {
    checkType(cell, ColumnType.INSTANCE);
    return new Absolute(Kind.INSTANCE_IO, cell);
  }

  /** Creates a cell of an advice column at an absolute row. */
  public static GroupCell advice(Cell cell) {
    checkType(cell, ColumnType.ADVICE);
    return new Absolute(Kind.ADVICE_IO, cell);
  }

  /** Creates an absolute cell of the appropriate kind for its column. */
  public static GroupCell of(Cell cell) {
    switch (cell.column.type) {
    case INSTANCE:
      return instance(cell);
    case ADVICE:
      return advice(cell);
    default:
      throw new IllegalArgumentException("Fixed cell " + cell
          + " cannot be an input or output");
    }
  }

  private static void checkType(Cell cell, ColumnType type) {
    if (cell.column.type != type) {
      throw new IllegalArgumentException("Cell " + cell + " is not of type "
          + type);
    }
  }

  public abstract Column column();

  /** Returns the region the cell was assigned in, or null if the cell is
   * absolute. */
  public abstract @Nullable Integer regionIndex();

  /** Converts this cell to an absolute cell, given the first row of each
   * region. */
  public abstract Cell toCell(Map<Integer, Integer> regionStarts);

  /** Kind of group cell. */
  public enum Kind {
    ASSIGNED, INSTANCE_IO, ADVICE_IO
  }

  /** Cell assigned in a region, at a row relative to the region's
   * start. */
  public static final class Assigned extends GroupCell {
    public final AssignedCell cell;

    Assigned(AssignedCell cell) {
      super(Kind.ASSIGNED);
      this.cell = requireNonNull(cell);
    }

    @Override public Column column() {
      return cell.column;
    }

    @Override public Integer regionIndex() {
      return cell.regionIndex;
    }

    @Override public Cell toCell(Map<Integer, Integer> regionStarts) {
      final Integer start = regionStarts.get(cell.regionIndex);
      if (start == null) {
        throw new SynthesisException("Region " + cell.regionIndex
            + " is not a known region");
      }
      return Cell.of(cell.column, start + cell.rowOffset);
    }

    @Override public int hashCode() {
      return cell.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assigned
          && cell.equals(((Assigned) o).cell);
    }

    @Override public String toString() {
      return cell.toString();
    }
  }

  /** Cell at an absolute row. */
  public static final class Absolute extends GroupCell {
    public final Cell cell;

    Absolute(Kind kind, Cell cell) {
      super(kind);
      this.cell = requireNonNull(cell);
    }

    @Override public Column column() {
      return cell.column;
    }

    @Override public @Nullable Integer regionIndex() {
      return null;
    }

    @Override public Cell toCell(Map<Integer, Integer> regionStarts) {
      return cell;
    }

    @Override public int hashCode() {
      return Objects.hash(kind, cell);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Absolute
          && kind == ((Absolute) o).kind
          && cell.equals(((Absolute) o).cell);
    }

    @Override public String toString() {
      return cell.toString();
    }
  }
}

// End GroupCell.java
