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

import net.hydromatic.plonkir.synthesis.Layouter;

/**
 * Circuit that can be compiled.
 *
 * <p>{@link #configure} is called once to declare columns, gates and
 * lookups; then {@link #synthesize} is called once with the resulting
 * configuration to lay out regions and copy constraints.
 *
 * <p>{@link #adviceIo} and {@link #instanceIo} declare the circuit-level
 * inputs and outputs; their order determines argument numbering and must be
 * the same on every run.
 *
 * @param <C> configuration type
 */
public interface Circuit<C> {
  C configure(ConstraintSystem cs);

  void synthesize(C config, Layouter layouter);

  /** Returns the advice cells that are inputs and outputs of the circuit.
   * The default has none. */
  default CircuitIO adviceIo(C config) {
    return CircuitIO.empty(ColumnType.ADVICE);
  }

  /** Returns the instance cells that are inputs and outputs of the
   * circuit. The default has none. */
  default CircuitIO instanceIo(C config) {
    return CircuitIO.empty(ColumnType.INSTANCE);
  }
}

// End Circuit.java
