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

import net.hydromatic.plonkir.backend.LoweringException;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Lookup;
import net.hydromatic.plonkir.ir.Stmt;

/** Lets a client decide what statements a lookup becomes. */
public interface LookupCallbacks {
  /** Callbacks for circuits without lookups. */
  LookupCallbacks DEFAULT = new LookupCallbacks() {
  };

  /**
   * Returns the statements for a lookup at one row of a region. The
   * expressions in the result are evaluated at that row.
   *
   * @param lookup Lookup
   * @param table Rows of the table that the lookup reads, computed on
   *              demand
   */
  default Stmt<Expression> onLookup(Lookup lookup,
      LookupTableGenerator table) {
    throw new LoweringException(
        "Target circuit has lookups but their behaviour was not specified");
  }
}

// End LookupCallbacks.java
