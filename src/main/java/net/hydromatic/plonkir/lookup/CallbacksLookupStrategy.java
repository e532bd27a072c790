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
package net.hydromatic.plonkir.lookup;

import static java.util.Objects.requireNonNull;

import net.hydromatic.plonkir.backend.Backend;
import net.hydromatic.plonkir.circuit.Lookup;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.Stmt;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;

/** Lowers each lookup to the statements that a {@link LookupCallbacks}
 * returns. */
public class CallbacksLookupStrategy implements LookupStrategy {
  private final LookupCallbacks callbacks;

  public CallbacksLookupStrategy(LookupCallbacks callbacks) {
    this.callbacks = requireNonNull(callbacks);
  }

  @Override public <E> void defineModules(Backend<E> backend,
      CircuitSynthesis synthesis) {
  }

  @Override public Stmt<AExpr> lower(Lookup lookup, LookupScope scope) {
    return scope.lower(callbacks.onLookup(lookup, scope.table));
  }
}

// End CallbacksLookupStrategy.java
