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

import net.hydromatic.plonkir.circuit.AssignedCell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.ir.Stmt;

/** Region being assigned. Offsets are relative to the start of the
 * region. */
public interface Region {
  /** Returns the index of this region. */
  int index();

  AssignedCell assignAdvice(String annotation, Column column, int offset);

  AssignedCell assignFixed(String annotation, Column column, int offset,
      Felt value);

  void enableSelector(String annotation, Selector selector, int offset);

  /** Constrains two cells, possibly of different regions, to be equal. */
  void constrainEqual(AssignedCell left, AssignedCell right);

  /** Constrains a cell to equal a constant. The constant is placed in a
   * fixed column that was enabled for constants. */
  void constrainConstant(AssignedCell cell, Felt value);

  /** Assigns an advice cell and constrains it to equal a constant. */
  AssignedCell assignAdviceFromConstant(String annotation, Column column,
      int offset, Felt value);

  /** Assigns an advice cell and constrains it to equal a cell of an
   * instance column. */
  AssignedCell assignAdviceFromInstance(String annotation,
      Column instanceColumn, int instanceRow, Column adviceColumn,
      int offset);

  /** Attaches a statement to this region, to be evaluated at
   * {@code offset}. */
  void injectIr(int offset, Stmt<Expression> stmt);

  void pushNamespace(String name);

  void popNamespace();
}

// End Region.java
