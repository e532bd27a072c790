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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Boolean expression of the IR, over operands of type {@code E}.
 *
 * @param <E> operand type
 */
public abstract class BExpr<E> {
  public final Op op;

  BExpr(Op op) {
    this.op = requireNonNull(op);
  }

  @SuppressWarnings("unchecked")
  public static <E> BExpr<E> trueExpr() {
    return (BExpr<E>) True.INSTANCE;
  }

  @SuppressWarnings("unchecked")
  public static <E> BExpr<E> falseExpr() {
    return (BExpr<E>) False.INSTANCE;
  }

  public static <E> Cmp<E> cmp(CmpOp op, E left, E right) {
    return new Cmp<>(op, left, right);
  }

  public static <E> Cmp<E> eq(E left, E right) {
    return new Cmp<>(CmpOp.EQ, left, right);
  }

  public static <E> BExpr<E> and(List<BExpr<E>> args) {
    return new And<>(args);
  }

  public static <E> BExpr<E> or(List<BExpr<E>> args) {
    return new Or<>(args);
  }

  public static <E> BExpr<E> not(BExpr<E> arg) {
    return new Not<>(arg);
  }

  /** Transforms the operands. */
  public abstract <F> BExpr<F> map(Function<? super E, ? extends F> f);

  /** Kind of boolean expression. */
  public enum Op {
    TRUE, FALSE, CMP, AND, OR, NOT
  }

  /** Literal true. */
  public static final class True<E> extends BExpr<E> {
    static final True<Object> INSTANCE = new True<>();

    private True() {
      super(Op.TRUE);
    }

    @Override public <F> BExpr<F> map(Function<? super E, ? extends F> f) {
      return trueExpr();
    }

    @Override public String toString() {
      return "true";
    }
  }

  /** Literal false. */
  public static final class False<E> extends BExpr<E> {
    static final False<Object> INSTANCE = new False<>();

    private False() {
      super(Op.FALSE);
    }

    @Override public <F> BExpr<F> map(Function<? super E, ? extends F> f) {
      return falseExpr();
    }

    @Override public String toString() {
      return "false";
    }
  }

  /** Comparison of two operands. */
  public static final class Cmp<E> extends BExpr<E> {
    public final CmpOp cmpOp;
    public final E left;
    public final E right;

    Cmp(CmpOp cmpOp, E left, E right) {
      super(Op.CMP);
      this.cmpOp = requireNonNull(cmpOp);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public <F> BExpr<F> map(Function<? super E, ? extends F> f) {
      return new Cmp<>(cmpOp, f.apply(left), f.apply(right));
    }

    @Override public int hashCode() {
      return Objects.hash(cmpOp, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Cmp
          && cmpOp == ((Cmp<?>) o).cmpOp
          && left.equals(((Cmp<?>) o).left)
          && right.equals(((Cmp<?>) o).right);
    }

    @Override public String toString() {
      return left + " " + cmpOp.symbol + " " + right;
    }
  }

  /** Expression whose operands are boolean expressions. */
  public abstract static class Nary<E> extends BExpr<E> {
    public final ImmutableList<BExpr<E>> args;

    Nary(Op op, List<BExpr<E>> args) {
      super(op);
      this.args = ImmutableList.copyOf(args);
    }

    <F> ImmutableList<BExpr<F>> mapArgs(
        Function<? super E, ? extends F> f) {
      final ImmutableList.Builder<BExpr<F>> b = ImmutableList.builder();
      args.forEach(arg -> b.add(arg.map(f)));
      return b.build();
    }

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Nary
          && op == ((Nary<?>) o).op
          && args.equals(((Nary<?>) o).args);
    }

    @Override public String toString() {
      final StringBuilder b = new StringBuilder("(");
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          b.append(op == Op.AND ? " && " : " || ");
        }
        b.append(args.get(i));
      }
      return b.append(')').toString();
    }
  }

  /** Conjunction. */
  public static final class And<E> extends Nary<E> {
    And(List<BExpr<E>> args) {
      super(Op.AND, args);
    }

    @Override public <F> BExpr<F> map(Function<? super E, ? extends F> f) {
      return new And<>(mapArgs(f));
    }
  }

  /** Disjunction. */
  public static final class Or<E> extends Nary<E> {
    Or(List<BExpr<E>> args) {
      super(Op.OR, args);
    }

    @Override public <F> BExpr<F> map(Function<? super E, ? extends F> f) {
      return new Or<>(mapArgs(f));
    }
  }

  /** Negation. */
  public static final class Not<E> extends BExpr<E> {
    public final BExpr<E> arg;

    Not(BExpr<E> arg) {
      super(Op.NOT);
      this.arg = requireNonNull(arg);
    }

    @Override public <F> BExpr<F> map(Function<? super E, ? extends F> f) {
      return new Not<>(arg.map(f));
    }

    @Override public int hashCode() {
      return Objects.hash(op, arg);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Not
          && arg.equals(((Not<?>) o).arg);
    }

    @Override public String toString() {
      return "!" + arg;
    }
  }
}

// End BExpr.java
