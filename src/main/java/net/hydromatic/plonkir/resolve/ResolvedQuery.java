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
package net.hydromatic.plonkir.resolve;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.FuncIO;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of resolving a query: either a literal value or a variable. */
public final class ResolvedQuery {
  public final @Nullable Felt value;
  public final @Nullable FuncIO var;

  private ResolvedQuery(@Nullable Felt value, @Nullable FuncIO var) {
    this.value = value;
    this.var = var;
  }

  public static ResolvedQuery lit(Felt value) {
    return new ResolvedQuery(requireNonNull(value), null);
  }

  public static ResolvedQuery io(FuncIO var) {
    return new ResolvedQuery(null, requireNonNull(var));
  }

  public boolean isLiteral() {
    return value != null;
  }

  public AExpr toExpr() {
    return value != null
        ? AExpr.constant(value)
        : AExpr.io(requireNonNull(var));
  }

  @Override public int hashCode() {
    return value != null ? value.hashCode() : requireNonNull(var).hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof ResolvedQuery
        && Objects.equals(value, ((ResolvedQuery) o).value)
        && Objects.equals(var, ((ResolvedQuery) o).var);
  }

  @Override public String toString() {
    return value != null ? "lit(" + value + ")" : "io(" + var + ")";
  }
}

// End ResolvedQuery.java
