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

import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.FuncIO;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of resolving a selector: either whether it is enabled, or a
 * variable that holds whether it is enabled. */
public final class ResolvedSelector {
  private static final ResolvedSelector TRUE = new ResolvedSelector(true, null);
  private static final ResolvedSelector FALSE =
      new ResolvedSelector(false, null);

  private final boolean enabled;
  public final @Nullable FuncIO var;

  private ResolvedSelector(boolean enabled, @Nullable FuncIO var) {
    this.enabled = enabled;
    this.var = var;
  }

  public static ResolvedSelector lit(boolean enabled) {
    return enabled ? TRUE : FALSE;
  }

  public static ResolvedSelector io(FuncIO var) {
    return new ResolvedSelector(false, requireNonNull(var));
  }

  public boolean isLiteral() {
    return var == null;
  }

  /** Returns whether the selector is enabled; throws if it is not a
   * literal. */
  public boolean enabled() {
    if (var != null) {
      throw new IllegalStateException("selector is not a literal: " + var);
    }
    return enabled;
  }

  public AExpr toExpr() {
    return var != null
        ? AExpr.io(var)
        : AExpr.constant(enabled ? Felt.ONE : Felt.ZERO);
  }

  @Override public String toString() {
    return var != null ? "io(" + var + ")" : "lit(" + enabled + ")";
  }
}

// End ResolvedSelector.java
