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

import java.util.ArrayList;
import java.util.List;

/**
 * Structural equivalence of IR, used to decide whether two groups can share
 * a function.
 *
 * <p>Comments are ignored. Local advice cells are compared by column and
 * offset, not by absolute row; table lookup outputs are compared by lookup,
 * column and position, not by row or region.
 */
public abstract class SymbolicEquivalence {
  private SymbolicEquivalence() {}

  public static boolean equivalent(Stmt<AExpr> a, Stmt<AExpr> b) {
    final List<Stmt<AExpr>> as = withoutComments(a);
    final List<Stmt<AExpr>> bs = withoutComments(b);
    if (as.size() != bs.size()) {
      return false;
    }
    for (int i = 0; i < as.size(); i++) {
      if (!equivalentLeaf(as.get(i), bs.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static List<Stmt<AExpr>> withoutComments(Stmt<AExpr> stmt) {
    final List<Stmt<AExpr>> list = new ArrayList<>();
    for (Stmt<AExpr> s : stmt.flatten()) {
      if (s.kind != Stmt.Kind.COMMENT) {
        list.add(s);
      }
    }
    return list;
  }

  private static boolean equivalentLeaf(Stmt<AExpr> a, Stmt<AExpr> b) {
    if (a.kind != b.kind) {
      return false;
    }
    switch (a.kind) {
    case CALL:
      final Stmt.Call<AExpr> ca = (Stmt.Call<AExpr>) a;
      final Stmt.Call<AExpr> cb = (Stmt.Call<AExpr>) b;
      return ca.name.equals(cb.name)
          && equivalentExprs(ca.inputs, cb.inputs)
          && equivalentVars(ca.outputs, cb.outputs);
    case CONSTRAINT:
      final Stmt.Constraint<AExpr> ka = (Stmt.Constraint<AExpr>) a;
      final Stmt.Constraint<AExpr> kb = (Stmt.Constraint<AExpr>) b;
      return ka.op == kb.op
          && equivalent(ka.left, kb.left)
          && equivalent(ka.right, kb.right);
    case ASSERT:
      return equivalent(((Stmt.Assert<AExpr>) a).condition,
          ((Stmt.Assert<AExpr>) b).condition);
    case ASSUME_DETERMINISTIC:
      return equivalent(((Stmt.AssumeDeterministic<AExpr>) a).var,
          ((Stmt.AssumeDeterministic<AExpr>) b).var);
    default:
      throw new AssertionError(a.kind);
    }
  }

  public static boolean equivalent(BExpr<AExpr> a, BExpr<AExpr> b) {
    if (a.op != b.op) {
      return false;
    }
    switch (a.op) {
    case TRUE:
    case FALSE:
      return true;
    case CMP:
      final BExpr.Cmp<AExpr> ca = (BExpr.Cmp<AExpr>) a;
      final BExpr.Cmp<AExpr> cb = (BExpr.Cmp<AExpr>) b;
      return ca.cmpOp == cb.cmpOp
          && equivalent(ca.left, cb.left)
          && equivalent(ca.right, cb.right);
    case AND:
    case OR:
      final List<BExpr<AExpr>> as = ((BExpr.Nary<AExpr>) a).args;
      final List<BExpr<AExpr>> bs = ((BExpr.Nary<AExpr>) b).args;
      if (as.size() != bs.size()) {
        return false;
      }
      for (int i = 0; i < as.size(); i++) {
        if (!equivalent(as.get(i), bs.get(i))) {
          return false;
        }
      }
      return true;
    case NOT:
      return equivalent(((BExpr.Not<AExpr>) a).arg,
          ((BExpr.Not<AExpr>) b).arg);
    default:
      throw new AssertionError(a.op);
    }
  }

  public static boolean equivalent(AExpr a, AExpr b) {
    if (a.op != b.op) {
      return false;
    }
    switch (a.op) {
    case CONSTANT:
      return a.equals(b);
    case IO:
      return equivalent(((AExpr.IO) a).var, ((AExpr.IO) b).var);
    case NEGATED:
      return equivalent(((AExpr.Negated) a).arg, ((AExpr.Negated) b).arg);
    case SUM:
    case PRODUCT:
      final AExpr.Binary ba = (AExpr.Binary) a;
      final AExpr.Binary bb = (AExpr.Binary) b;
      return equivalent(ba.left, bb.left)
          && equivalent(ba.right, bb.right);
    default:
      throw new AssertionError(a.op);
    }
  }

  public static boolean equivalent(FuncIO a, FuncIO b) {
    if (a.kind != b.kind) {
      return false;
    }
    switch (a.kind) {
    case ADVICE:
      final FuncIO.Advice aa = (FuncIO.Advice) a;
      final FuncIO.Advice ab = (FuncIO.Advice) b;
      return aa.column.equals(ab.column) && aa.offset == ab.offset;
    case TABLE_LOOKUP:
      final FuncIO.TableLookup ta = (FuncIO.TableLookup) a;
      final FuncIO.TableLookup tb = (FuncIO.TableLookup) b;
      return ta.id == tb.id && ta.column == tb.column && ta.idx == tb.idx;
    default:
      return a.equals(b);
    }
  }

  public static boolean equivalentExprs(List<AExpr> as, List<AExpr> bs) {
    if (as.size() != bs.size()) {
      return false;
    }
    for (int i = 0; i < as.size(); i++) {
      if (!equivalent(as.get(i), bs.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean equivalentVars(List<FuncIO> as, List<FuncIO> bs) {
    if (as.size() != bs.size()) {
      return false;
    }
    for (int i = 0; i < as.size(); i++) {
      if (!equivalent(as.get(i), bs.get(i))) {
        return false;
      }
    }
    return true;
  }
}

// End SymbolicEquivalence.java
