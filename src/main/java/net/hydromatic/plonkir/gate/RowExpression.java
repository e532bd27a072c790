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
package net.hydromatic.plonkir.gate;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.plonkir.circuit.Expression;

/** An expression to be evaluated at an absolute row of a region. Queries
 * in the expression are rotated relative to that row. */
public final class RowExpression {
  public final int row;
  public final Expression expression;

  private RowExpression(int row, Expression expression) {
    this.row = row;
    this.expression = requireNonNull(expression);
  }

  public static RowExpression of(int row, Expression expression) {
    return new RowExpression(row, expression);
  }

  @Override public int hashCode() {
    return Objects.hash(row, expression);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof RowExpression
        && row == ((RowExpression) o).row
        && expression.equals(((RowExpression) o).expression);
  }

  @Override public String toString() {
    return expression + " @ " + row;
  }
}

// End RowExpression.java
