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

import net.hydromatic.plonkir.circuit.Felt;

/**
 * Folds constants in arithmetic expressions, bottom-up.
 *
 * <p>Applies {@code c1 op c2 => c}, {@code 0 + x => x},
 * {@code x + 0 => x}, {@code x + -x => 0}, {@code 1 * x => x},
 * {@code x * 1 => x}, {@code 0 * x => 0}, {@code x * 0 => 0},
 * {@code -1 * x => -x}, {@code --x => x}. Folding is idempotent.
 */
public abstract class ConstantFolding {
  private ConstantFolding() {}

  public static AExpr fold(AExpr e) {
    switch (e.op) {
    case CONSTANT:
    case IO:
      return e;
    case NEGATED:
      return negate(fold(((AExpr.Negated) e).arg));
    case SUM:
      final AExpr.Sum sum = (AExpr.Sum) e;
      return add(fold(sum.left), fold(sum.right));
    case PRODUCT:
      final AExpr.Product product = (AExpr.Product) e;
      return multiply(fold(product.left), fold(product.right));
    default:
      throw new AssertionError(e.op);
    }
  }

  /** Negates an expression that has already been folded. */
  static AExpr negate(AExpr e) {
    switch (e.op) {
    case CONSTANT:
      return AExpr.constant(((AExpr.Constant) e).value.negate());
    case NEGATED:
      return ((AExpr.Negated) e).arg;
    default:
      return AExpr.negated(e);
    }
  }

  private static AExpr add(AExpr left, AExpr right) {
    if (left.op == AExpr.Op.CONSTANT && right.op == AExpr.Op.CONSTANT) {
      return AExpr.constant(
          ((AExpr.Constant) left).value.add(((AExpr.Constant) right).value));
    }
    if (left.isConstant(Felt.ZERO)) {
      return right;
    }
    if (right.isConstant(Felt.ZERO)) {
      return left;
    }
    if (right.op == AExpr.Op.NEGATED
        && ((AExpr.Negated) right).arg.equals(left)
        || left.op == AExpr.Op.NEGATED
        && ((AExpr.Negated) left).arg.equals(right)) {
      return AExpr.constant(Felt.ZERO);
    }
    return AExpr.sum(left, right);
  }

  private static AExpr multiply(AExpr left, AExpr right) {
    if (left.op == AExpr.Op.CONSTANT && right.op == AExpr.Op.CONSTANT) {
      return AExpr.constant(
          ((AExpr.Constant) left).value
              .multiply(((AExpr.Constant) right).value));
    }
    if (left.isConstant(Felt.ZERO) || right.isConstant(Felt.ZERO)) {
      return AExpr.constant(Felt.ZERO);
    }
    if (left.isConstant(Felt.ONE)) {
      return right;
    }
    if (right.isConstant(Felt.ONE)) {
      return left;
    }
    if (left.isConstant(Felt.MINUS_ONE)) {
      return negate(right);
    }
    if (right.isConstant(Felt.MINUS_ONE)) {
      return negate(left);
    }
    return AExpr.product(left, right);
  }

  /** Folds the operands of a boolean expression. */
  public static BExpr<AExpr> fold(BExpr<AExpr> e) {
    return e.map(ConstantFolding::fold);
  }

  /** Folds the expressions in a statement. */
  public static Stmt<AExpr> fold(Stmt<AExpr> stmt) {
    return stmt.map(ConstantFolding::fold);
  }
}

// End ConstantFolding.java
