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

import java.util.Objects;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Felt;

/** Edge in the graph of equality (copy) constraints. */
public abstract class EqConstraint {
  public final Kind kind;

  EqConstraint(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Creates an equality between two cells. The order of the cells is
   * not significant. */
  public static AnyToAny anyToAny(Cell a, Cell b) {
    return a.compareTo(b) <= 0 ? new AnyToAny(a, b) : new AnyToAny(b, a);
  }

  public static FixedToConst fixedToConst(Cell cell, Felt value) {
    return new FixedToConst(cell, value);
  }

  /** Kind of edge. */
  public enum Kind {
    ANY_TO_ANY, FIXED_TO_CONST
  }

  /** Equality between two cells; {@link #left} is never greater than
   * {@link #right}. */
  public static final class AnyToAny extends EqConstraint {
    public final Cell left;
    public final Cell right;

    private AnyToAny(Cell left, Cell right) {
      super(Kind.ANY_TO_ANY);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public int hashCode() {
      return Objects.hash(left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof AnyToAny
          && left.equals(((AnyToAny) o).left)
          && right.equals(((AnyToAny) o).right);
    }

    @Override public String toString() {
      return left + " == " + right;
    }
  }

  /** Equality between a fixed cell and the value assigned to it. */
  public static final class FixedToConst extends EqConstraint {
    public final Cell cell;
    public final Felt value;

    private FixedToConst(Cell cell, Felt value) {
      super(Kind.FIXED_TO_CONST);
      this.cell = requireNonNull(cell);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return Objects.hash(cell, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof FixedToConst
          && cell.equals(((FixedToConst) o).cell)
          && value.equals(((FixedToConst) o).value);
    }

    @Override public String toString() {
      return cell + " == " + value;
    }
  }
}

// End EqConstraint.java
