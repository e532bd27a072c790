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

import static java.util.Objects.requireNonNull;

import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.ir.Stmt;

/** Statement that the author of a circuit attached to a region. */
public final class InjectedIr {
  public final int regionIndex;
  /** Absolute row at which the statement's queries are evaluated. */
  public final int row;
  public final Stmt<Expression> stmt;

  InjectedIr(int regionIndex, int row, Stmt<Expression> stmt) {
    this.regionIndex = regionIndex;
    this.row = row;
    this.stmt = requireNonNull(stmt);
  }

  @Override public String toString() {
    return "region " + regionIndex + " row " + row + ": " + stmt;
  }
}

// End InjectedIr.java
