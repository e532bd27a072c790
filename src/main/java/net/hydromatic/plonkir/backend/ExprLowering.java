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

import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.ir.CmpOp;
import net.hydromatic.plonkir.ir.FuncIO;

/**
 * Builds a backend's expressions.
 *
 * @param <E> Type of expression in the backend
 */
public interface ExprLowering<E> {
  E lowerSum(E left, E right);

  E lowerProduct(E left, E right);

  E lowerNeg(E e);

  E lowerConstant(Felt value);

  /** Returns the expression for a variable of the current scope. */
  E lowerFuncIO(FuncIO io);

  E lowerCmp(CmpOp op, E left, E right);

  E lowerAnd(E left, E right);

  E lowerOr(E left, E right);

  E lowerNot(E e);

  E lowerTrue();

  E lowerFalse();
}

// End ExprLowering.java
