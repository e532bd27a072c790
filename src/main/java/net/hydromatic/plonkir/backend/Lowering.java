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
package net.hydromatic.plonkir.backend;

import java.util.List;
import net.hydromatic.plonkir.ir.CmpOp;
import net.hydromatic.plonkir.ir.FuncIO;

/**
 * Emits statements into one scope of a backend, such as the body of a
 * function.
 *
 * @param <E> Type of expression in the backend
 */
public interface Lowering<E> extends ExprLowering<E> {
  void generateConstraint(CmpOp op, E left, E right);

  /** Returns the number of constraints generated so far in this scope. */
  int numConstraints();

  /** Generates a constraint, and checks that the backend counted it.
   *
   * @throws LoweringException if the number of constraints did not
   * increase */
  default void checkedGenerateConstraint(CmpOp op, E left, E right) {
    final int before = numConstraints();
    generateConstraint(op, left, right);
    if (numConstraints() <= before) {
      throw LoweringException.lastConstraintNotGenerated();
    }
  }

  void generateComment(String text);

  /** Calls a function; {@code outputs} become variables of this scope. */
  void generateCall(String name, List<E> inputs, List<FuncIO> outputs);

  void generateAssumeDeterministic(FuncIO io);

  void generateAssert(E condition);
}

// End Lowering.java
