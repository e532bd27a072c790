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
package net.hydromatic.plonkir.codegen;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.plonkir.backend.Backend;
import net.hydromatic.plonkir.backend.Lowerer;
import net.hydromatic.plonkir.backend.Lowering;
import net.hydromatic.plonkir.ir.FuncIO;
import net.hydromatic.plonkir.ir.GroupBody;

/**
 * Decides how a circuit is laid out into functions of a backend.
 *
 * <p>A strategy defines functions callee-first, and the main function
 * last.
 */
public interface CodegenStrategy {
  <E> void codegen(CodegenContext context, Backend<E> backend);

  /** Defines a function whose body is a group body. The function takes
   * {@code Arg(0) .. Arg(inputCount - 1)} and returns
   * {@code Field(0) .. Field(outputCount - 1)}. */
  static <E> void defineFunction(Backend<E> backend, String name,
      GroupBody body) {
    final List<FuncIO> inputs = new ArrayList<>();
    for (int i = 0; i < body.inputCount; i++) {
      inputs.add(FuncIO.arg(i));
    }
    final List<FuncIO> outputs = new ArrayList<>();
    for (int i = 0; i < body.outputCount; i++) {
      outputs.add(FuncIO.field(i));
    }
    final Lowering<E> scope = backend.defineFunction(name, inputs, outputs);
    Lowerer.lower(body.toStmt(), scope);
    backend.onScopeEnd(scope);
  }

  /** Defines the main function, whose body is a group body. */
  static <E> void defineMain(Backend<E> backend, GroupBody body) {
    final Lowering<E> scope =
        backend.defineMainFunction(body.inputCount, body.outputCount);
    Lowerer.lower(body.toStmt(), scope);
    backend.onScopeEnd(scope);
  }
}

// End CodegenStrategy.java
