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

import java.util.Objects;

/**
 * A cell that was assigned inside a region; its row is relative to the
 * start of that region.
 */
public final class AssignedCell {
  public final int regionIndex;
  public final int rowOffset;
  public final Column column;

  private AssignedCell(int regionIndex, int rowOffset, Column column) {
    this.regionIndex = regionIndex;
    this.rowOffset = rowOffset;
    this.column = requireNonNull(column);
  }

  public static AssignedCell of(int regionIndex, int rowOffset,
      Column column) {
    return new AssignedCell(regionIndex, rowOffset, column);
  }

  @Override public int hashCode() {
    return Objects.hash(regionIndex, rowOffset, column);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof AssignedCell
        && regionIndex == ((AssignedCell) o).regionIndex
        && rowOffset == ((AssignedCell) o).rowOffset
        && column.equals(((AssignedCell) o).column);
  }

  @Override public String toString() {
    return column + "@r" + regionIndex + "+" + rowOffset;
  }
}

// End AssignedCell.java
