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

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import net.hydromatic.plonkir.circuit.AssignedCell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.group.GroupCell;
import net.hydromatic.plonkir.group.GroupKey;

/** Lays out the regions and tables of a circuit. */
public interface Layouter {
  /** Assigns a region. The region is committed when {@code fn} returns. */
  <T> T assignRegion(String name, Function<Region, T> fn);

  /** Assigns a lookup table. */
  void assignTable(String name, Consumer<Table> fn);

  /** Constrains a cell to equal a cell of an instance column. */
  void constrainInstance(AssignedCell cell, Column instanceColumn, int row);

  /** Runs {@code fn} inside a namespace. */
  <T> T namespace(String name, Supplier<T> fn);

  /**
   * Runs {@code fn} inside a group. Regions assigned by {@code fn} belong to
   * the group; inputs and outputs declared by {@link #annotateInput} and
   * {@link #annotateOutput} within {@code fn} are the group's.
   */
  <T> T group(String name, GroupKey key, Function<Layouter, T> fn);

  /** Declares an input of the innermost group. */
  void annotateInput(GroupCell cell);

  /** Declares an output of the innermost group. */
  void annotateOutput(GroupCell cell);

  default void annotateInput(AssignedCell cell) {
    annotateInput(GroupCell.assigned(cell));
  }

  default void annotateOutput(AssignedCell cell) {
    annotateOutput(GroupCell.assigned(cell));
  }
}

// End Layouter.java
