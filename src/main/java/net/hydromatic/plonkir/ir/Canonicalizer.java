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

import com.google.common.collect.ImmutableList;
import net.hydromatic.plonkir.circuit.Felt;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites equality constraints into a canonical form.
 *
 * <p>{@code (a + -b) == 0} and {@code 1 * (a + -b) == 0}, with the zero on
 * either side, become {@code a == b}. The rewrite applies to constraints
 * and to comparisons inside assertions. Expressions are folded first, so
 * the result is a fixed point.
 */
public abstract class Canonicalizer {
  private Canonicalizer() {}

  public static Stmt<AExpr> canonicalize(Stmt<AExpr> stmt) {
    switch (stmt.kind) {
    case CONSTRAINT:
      final Stmt.Constraint<AExpr> c = (Stmt.Constraint<AExpr>) stmt;
      final AExpr left = ConstantFolding.fold(c.left);
      final AExpr right = ConstantFolding.fold(c.right);
      if (c.op == CmpOp.EQ) {
        final AExpr[] pair = difference(left, right);
        if (pair != null) {
          return Stmt.eq(pair[0], pair[1]);
        }
      }
      return Stmt.constraint(c.op, left, right);
    case ASSERT:
      return Stmt.assertion(
          canonicalize(((Stmt.Assert<AExpr>) stmt).condition));
    case SEQ:
      final ImmutableList.Builder<Stmt<AExpr>> b = ImmutableList.builder();
      ((Stmt.Seq<AExpr>) stmt).stmts.forEach(s -> b.add(canonicalize(s)));
      return Stmt.seq(b.build());
    default:
      return ConstantFolding.fold(stmt);
    }
  }

  public static BExpr<AExpr> canonicalize(BExpr<AExpr> e) {
    switch (e.op) {
    case CMP:
      final BExpr.Cmp<AExpr> cmp = (BExpr.Cmp<AExpr>) e;
      final AExpr left = ConstantFolding.fold(cmp.left);
      final AExpr right = ConstantFolding.fold(cmp.right);
      if (cmp.cmpOp == CmpOp.EQ) {
        final AExpr[] pair = difference(left, right);
        if (pair != null) {
          return BExpr.eq(pair[0], pair[1]);
        }
      }
      return BExpr.cmp(cmp.cmpOp, left, right);
    case AND:
      return BExpr.and(canonicalizeArgs((BExpr.Nary<AExpr>) e));
    case OR:
      return BExpr.or(canonicalizeArgs((BExpr.Nary<AExpr>) e));
    case NOT:
      return BExpr.not(canonicalize(((BExpr.Not<AExpr>) e).arg));
    default:
      return e;
    }
  }

  private static ImmutableList<BExpr<AExpr>> canonicalizeArgs(
      BExpr.Nary<AExpr> e) {
    final ImmutableList.Builder<BExpr<AExpr>> b = ImmutableList.builder();
    e.args.forEach(arg -> b.add(canonicalize(arg)));
    return b.build();
  }

  /** If one side is zero and the other is {@code a + -b}, possibly
   * multiplied by one, returns {@code [a, b]}; otherwise null. */
  private static AExpr @Nullable [] difference(AExpr left, AExpr right) {
    final AExpr e;
    if (right.isConstant(Felt.ZERO)) {
      e = stripOne(left);
    } else if (left.isConstant(Felt.ZERO)) {
      e = stripOne(right);
    } else {
      return null;
    }
    if (e.op != AExpr.Op.SUM) {
      return null;
    }
    final AExpr.Sum sum = (AExpr.Sum) e;
    if (sum.right.op == AExpr.Op.NEGATED) {
      return new AExpr[] {sum.left, ((AExpr.Negated) sum.right).arg};
    }
    if (sum.left.op == AExpr.Op.NEGATED) {
      return new AExpr[] {sum.right, ((AExpr.Negated) sum.left).arg};
    }
    return null;
  }

  private static AExpr stripOne(AExpr e) {
    if (e.op == AExpr.Op.PRODUCT) {
      final AExpr.Product p = (AExpr.Product) e;
      if (p.left.isConstant(Felt.ONE)) {
        return p.right;
      }
      if (p.right.isConstant(Felt.ONE)) {
        return p.left;
      }
    }
    return e;
  }
}

// End Canonicalizer.java
