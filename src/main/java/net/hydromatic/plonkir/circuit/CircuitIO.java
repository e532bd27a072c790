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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ordered lists of the input and output cells of one column type.
 *
 * <p>The order is significant: the n-th input becomes argument n and the
 * n-th output becomes output field n of the function generated for the
 * scope that owns this IO.
 */
public final class CircuitIO {
  public final ColumnType type;
  private final List<Cell> inputs;
  private final List<Cell> outputs;

  private CircuitIO(ColumnType type, List<Cell> inputs, List<Cell> outputs) {
    this.type = requireNonNull(type);
    this.inputs = new ArrayList<>(inputs);
    this.outputs = new ArrayList<>(outputs);
    for (Cell cell : this.inputs) {
      checkType(cell);
    }
    for (Cell cell : this.outputs) {
      checkType(cell);
    }
  }

  private void checkType(Cell cell) {
    checkArgument(cell.column.type == type,
        "cell %s is not of type %s", cell, type);
  }

  /** Creates an IO with no cells. */
  public static CircuitIO empty(ColumnType type) {
    return new CircuitIO(type, ImmutableList.of(), ImmutableList.of());
  }

  /** Creates an IO, checking that no cell is both input and output. */
  public static CircuitIO of(ColumnType type, List<Cell> inputs,
      List<Cell> outputs) {
    final Set<Cell> both =
        Sets.intersection(Sets.newHashSet(inputs), Sets.newHashSet(outputs));
    if (!both.isEmpty()) {
      throw new IllegalArgumentException("Sets are not disjoint: " + both);
    }
    return new CircuitIO(type, inputs, outputs);
  }

  /** Creates an IO without the disjointness check; cells may be both
   * inputs and outputs of a group. */
  public static CircuitIO ofUnchecked(ColumnType type, List<Cell> inputs,
      List<Cell> outputs) {
    return new CircuitIO(type, inputs, outputs);
  }

  /** Creates an IO from a column and its input and output rows. */
  public static CircuitIO of(Column column, int[] inputRows,
      int[] outputRows) {
    final List<Cell> inputs = new ArrayList<>();
    for (int row : inputRows) {
      inputs.add(Cell.of(column, row));
    }
    final List<Cell> outputs = new ArrayList<>();
    for (int row : outputRows) {
      outputs.add(Cell.of(column, row));
    }
    return of(column.type, inputs, outputs);
  }

  public List<Cell> inputs() {
    return ImmutableList.copyOf(inputs);
  }

  public List<Cell> outputs() {
    return ImmutableList.copyOf(outputs);
  }

  public int inputCount() {
    return inputs.size();
  }

  public int outputCount() {
    return outputs.size();
  }

  /** Returns the position of a cell among the inputs, or -1. */
  public int inputIndex(Cell cell) {
    return inputs.indexOf(cell);
  }

  /** Returns the position of a cell among the outputs, or -1. */
  public int outputIndex(Cell cell) {
    return outputs.indexOf(cell);
  }

  /** Appends an input cell. */
  public void addInput(Cell cell) {
    checkType(cell);
    inputs.add(cell);
  }

  @Override public String toString() {
    return type.name().toLowerCase(Locale.ROOT)
        + " io {inputs: " + inputs + ", outputs: " + outputs + "}";
  }
}

// End CircuitIO.java
