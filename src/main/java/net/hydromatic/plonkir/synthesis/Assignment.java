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

import java.util.List;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.group.GroupCell;
import net.hydromatic.plonkir.group.GroupKey;
import net.hydromatic.plonkir.ir.Stmt;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Receives the assignments of a circuit at absolute rows.
 *
 * <p>A floor planner translates the region-relative calls of a
 * {@link Layouter} into calls to this interface.
 */
public interface Assignment {
  /** Opens a region that starts at row {@code start}, and returns its
   * index. */
  int enterRegion(String name, @Nullable Integer explicitIndex, int start);

  void exitRegion();

  void enableSelector(String annotation, Selector selector, int row);

  void assignAdvice(String annotation, Column column, int row);

  void assignFixed(String annotation, Column column, int row, Felt value);

  /** Constrains two cells to be equal. */
  void copy(Cell left, Cell right);

  /** Fills a fixed column from {@code fromRow} onwards. */
  void fillFromRow(Column column, int fromRow, Felt value);

  void pushNamespace(String name);

  void popNamespace();

  void enterGroup(String name, GroupKey key);

  void exitGroup(List<GroupCell> inputs, List<GroupCell> outputs);

  /** Attaches a statement to the open region, to be evaluated at
   * {@code row}. */
  void injectIr(int row, Stmt<Expression> stmt);
}

// End Assignment.java
