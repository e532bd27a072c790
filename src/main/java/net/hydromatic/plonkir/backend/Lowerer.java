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
package net.hydromatic.plonkir.backend;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.BExpr;
import net.hydromatic.plonkir.ir.Stmt;

/** Lowers IR statements and expressions onto a {@link Lowering}. */
public abstract class Lowerer {
  private Lowerer() {}

  /** Emits a statement. Constraints are checked, so a backend that
   * silently drops one causes a {@link LoweringException}. */
  public static <E> void lower(Stmt<AExpr> stmt, Lowering<E> l) {
    switch (stmt.kind) {
    case CALL:
      final Stmt.Call<AExpr> call = (Stmt.Call<AExpr>) stmt;
      l.generateCall(call.name, lowerAll(call.inputs, l), call.outputs);
      break;
    case CONSTRAINT:
      final Stmt.Constraint<AExpr> c = (Stmt.Constraint<AExpr>) stmt;
      l.checkedGenerateConstraint(c.op, lower(c.left, l), lower(c.right, l));
      break;
    case ASSERT:
      l.generateAssert(lower(((Stmt.Assert<AExpr>) stmt).condition, l));
      break;
    case COMMENT:
      l.generateComment(((Stmt.Comment<AExpr>) stmt).text);
      break;
    case ASSUME_DETERMINISTIC:
      l.generateAssumeDeterministic(
          ((Stmt.AssumeDeterministic<AExpr>) stmt).var);
      break;
    case SEQ:
      for (Stmt<AExpr> s : ((Stmt.Seq<AExpr>) stmt).stmts) {
        lower(s, l);
      }
      break;
    default:
      throw new AssertionError(stmt.kind);
    }
  }

  public static <E> E lower(BExpr<AExpr> e, ExprLowering<E> l) {
    switch (e.op) {
    case TRUE:
      return l.lowerTrue();
    case FALSE:
      return l.lowerFalse();
    case CMP:
      final BExpr.Cmp<AExpr> cmp = (BExpr.Cmp<AExpr>) e;
      return l.lowerCmp(cmp.cmpOp, lower(cmp.left, l), lower(cmp.right, l));
    case AND:
    case OR:
      final List<BExpr<AExpr>> args = ((BExpr.Nary<AExpr>) e).args;
      if (args.isEmpty()) {
        return e.op == BExpr.Op.AND ? l.lowerTrue() : l.lowerFalse();
      }
      E result = lower(args.get(0), l);
      for (BExpr<AExpr> arg : args.subList(1, args.size())) {
        result = e.op == BExpr.Op.AND
            ? l.lowerAnd(result, lower(arg, l))
            : l.lowerOr(result, lower(arg, l));
      }
      return result;
    case NOT:
      return l.lowerNot(lower(((BExpr.Not<AExpr>) e).arg, l));
    default:
      throw new AssertionError(e.op);
    }
  }

  public static <E> E lower(AExpr e, ExprLowering<E> l) {
    switch (e.op) {
    case CONSTANT:
      return l.lowerConstant(((AExpr.Constant) e).value);
    case IO:
      return l.lowerFuncIO(((AExpr.IO) e).var);
    case NEGATED:
      return l.lowerNeg(lower(((AExpr.Negated) e).arg, l));
    case SUM:
      final AExpr.Binary sum = (AExpr.Binary) e;
      return l.lowerSum(lower(sum.left, l), lower(sum.right, l));
    case PRODUCT:
      final AExpr.Binary product = (AExpr.Binary) e;
      return l.lowerProduct(lower(product.left, l), lower(product.right, l));
    default:
      throw new AssertionError(e.op);
    }
  }

  public static <E> List<E> lowerAll(List<AExpr> exprs, ExprLowering<E> l) {
    final ImmutableList.Builder<E> b = ImmutableList.builder();
    exprs.forEach(e -> b.add(lower(e, l)));
    return b.build();
  }
}

// End Lowerer.java
