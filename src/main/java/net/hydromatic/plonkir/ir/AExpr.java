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
package net.hydromatic.plonkir.ir;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.plonkir.circuit.Felt;

/** Arithmetic expression of the IR. */
public abstract class AExpr {
  public final Op op;

  AExpr(Op op) {
    this.op = requireNonNull(op);
  }

  public static Constant constant(Felt value) {
    return new Constant(value);
  }

  public static Constant constant(long value) {
    return new Constant(Felt.of(value));
  }

  public static IO io(FuncIO var) {
    return new IO(var);
  }

  public static AExpr negated(AExpr arg) {
    return new Negated(arg);
  }

  public static AExpr sum(AExpr left, AExpr right) {
    return new Sum(left, right);
  }

  public static AExpr product(AExpr left, AExpr right) {
    return new Product(left, right);
  }

  /** Returns whether this is a constant with the given value. */
  public boolean isConstant(Felt value) {
    return op == Op.CONSTANT && ((Constant) this).value.equals(value);
  }

  @Override public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf);

  /** Kind of arithmetic expression. */
  public enum Op {
    CONSTANT, IO, NEGATED, SUM, PRODUCT
  }

  /** Literal. */
  public static final class Constant extends AExpr {
    public final Felt value;

    Constant(Felt value) {
      super(Op.CONSTANT);
      this.value = requireNonNull(value);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(value);
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Constant
          && value.equals(((Constant) o).value);
    }
  }

  /** Reference to a variable. */
  public static final class IO extends AExpr {
    public final FuncIO var;

    IO(FuncIO var) {
      super(Op.IO);
      this.var = requireNonNull(var);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(var);
    }

    @Override public int hashCode() {
      return var.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IO
          && var.equals(((IO) o).var);
    }
  }

  /** Negation. */
  public static final class Negated extends AExpr {
    public final AExpr arg;

    Negated(AExpr arg) {
      super(Op.NEGATED);
      this.arg = requireNonNull(arg);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return arg.unparse(buf.append('-'));
    }

    @Override public int hashCode() {
      return Objects.hash(op, arg);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Negated
          && arg.equals(((Negated) o).arg);
    }
  }

  /** Expression with two operands. */
  public abstract static class Binary extends AExpr {
    public final AExpr left;
    public final AExpr right;

    Binary(Op op, AExpr left, AExpr right) {
      super(op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      left.unparse(buf).append(op == Op.SUM ? " + " : " * ");
      return right.unparse(buf).append(')');
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
          && op == ((Binary) o).op
          && left.equals(((Binary) o).left)
          && right.equals(((Binary) o).right);
    }
  }

  /** Addition. */
  public static final class Sum extends Binary {
    Sum(AExpr left, AExpr right) {
      super(Op.SUM, left, right);
    }
  }

  /** Multiplication. */
  public static final class Product extends Binary {
    Product(AExpr left, AExpr right) {
      super(Op.PRODUCT, left, right);
    }
  }
}

// End AExpr.java
