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
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.ir.FuncIO;

/**
 * Target of compilation.
 *
 * <p>A codegen strategy opens a scope with one of the {@code define}
 * methods, emits the scope's statements through the returned
 * {@link Lowering}, then closes it with {@link #onScopeEnd}.
 *
 * @param <E> Type of expression in the backend
 */
public interface Backend<E> {
  /** Opens a function with the given inputs and outputs. */
  Lowering<E> defineFunction(String name, List<FuncIO> inputs,
      List<FuncIO> outputs);

  /** Opens a function that evaluates a gate; its arguments are the gate's
   * selectors followed by its queries. */
  Lowering<E> defineGateFunction(String name, List<Selector> selectors,
      List<Expression.Query> queries, List<FuncIO> outputs);

  /** Opens the entry point of the circuit. */
  Lowering<E> defineMainFunction(int inputCount, int outputCount);

  void onScopeEnd(Lowering<E> scope);
}

// End Backend.java
