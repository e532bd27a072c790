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
package net.hydromatic.plonkir.circuit;

import static java.util.Objects.requireNonNull;

import java.util.Comparator;
import java.util.Objects;

/** A column and an absolute row. */
public final class Cell implements Comparable<Cell> {
  private static final Comparator<Cell> COMPARATOR =
      Comparator.comparing((Cell c) -> c.column).thenComparingInt(c -> c.row);

  public final Column column;
  public final int row;

  private Cell(Column column, int row) {
    this.column = requireNonNull(column);
    this.row = row;
  }

  public static Cell of(Column column, int row) {
    return new Cell(column, row);
  }

  @Override public int compareTo(Cell o) {
    return COMPARATOR.compare(this, o);
  }

  @Override public int hashCode() {
    return Objects.hash(column, row);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Cell
        && column.equals(((Cell) o).column)
        && row == ((Cell) o).row;
  }

  @Override public String toString() {
    return column + "@" + row;
  }
}

// End Cell.java
