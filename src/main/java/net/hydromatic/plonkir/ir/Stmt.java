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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Statement of the IR, over expressions of type {@code E}.
 *
 * @param <E> expression type
 */
public abstract class Stmt<E> {
  public final Kind kind;

  Stmt(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  public static <E> Call<E> call(String name, List<E> inputs,
      List<FuncIO> outputs) {
    return new Call<>(name, inputs, outputs);
  }

  public static <E> Constraint<E> constraint(CmpOp op, E left, E right) {
    return new Constraint<>(op, left, right);
  }

  /** Creates a constraint that two expressions are equal. */
  public static <E> Constraint<E> eq(E left, E right) {
    return new Constraint<>(CmpOp.EQ, left, right);
  }

  public static <E> Assert<E> assertion(BExpr<E> condition) {
    return new Assert<>(condition);
  }

  public static <E> Comment<E> comment(String text) {
    return new Comment<>(text);
  }

  public static <E> AssumeDeterministic<E> assumeDeterministic(FuncIO var) {
    return new AssumeDeterministic<>(var);
  }

  public static <E> Seq<E> seq(List<? extends Stmt<E>> stmts) {
    return new Seq<>(stmts);
  }

  @SafeVarargs
  public static <E> Seq<E> seq(Stmt<E>... stmts) {
    return new Seq<>(Arrays.asList(stmts));
  }

  public static <E> Seq<E> empty() {
    return new Seq<>(ImmutableList.of());
  }

  /** Transforms the expressions in this statement. */
  public abstract <F> Stmt<F> map(Function<? super E, ? extends F> f);

  /** Returns the statements that are not sequences, in order, expanding
   * nested sequences. */
  public ImmutableList<Stmt<E>> flatten() {
    final ImmutableList.Builder<Stmt<E>> b = ImmutableList.builder();
    flattenTo(b);
    return b.build();
  }

  void flattenTo(ImmutableList.Builder<Stmt<E>> b) {
    b.add(this);
  }

  /** Returns whether this statement does nothing; that is, it is a
   * sequence with no statements other than empty sequences. */
  public boolean isEmpty() {
    return false;
  }

  /** Kind of statement. */
  public enum Kind {
    CALL, CONSTRAINT, ASSERT, COMMENT, ASSUME_DETERMINISTIC, SEQ
  }

  /** Call to a function. The outputs of the call become variables. */
  public static final class Call<E> extends Stmt<E> {
    public final String name;
    public final ImmutableList<E> inputs;
    public final ImmutableList<FuncIO> outputs;

    Call(String name, List<E> inputs, List<FuncIO> outputs) {
      super(Kind.CALL);
      this.name = requireNonNull(name);
      this.inputs = ImmutableList.copyOf(inputs);
      this.outputs = ImmutableList.copyOf(outputs);
    }

    @Override public <F> Stmt<F> map(Function<? super E, ? extends F> f) {
      final ImmutableList.Builder<F> b = ImmutableList.builder();
      inputs.forEach(e -> b.add(f.apply(e)));
      return new Call<>(name, b.build(), outputs);
    }

    @Override public int hashCode() {
      return Objects.hash(name, inputs, outputs);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Call
          && name.equals(((Call<?>) o).name)
          && inputs.equals(((Call<?>) o).inputs)
          && outputs.equals(((Call<?>) o).outputs);
    }

    @Override public String toString() {
      return outputs + " = call " + name + inputs;
    }
  }

  /** Constraint that two expressions are related by a comparison. */
  public static final class Constraint<E> extends Stmt<E> {
    public final CmpOp op;
    public final E left;
    public final E right;

    Constraint(CmpOp op, E left, E right) {
      super(Kind.CONSTRAINT);
      this.op = requireNonNull(op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override public <F> Stmt<F> map(Function<? super E, ? extends F> f) {
      return new Constraint<>(op, f.apply(left), f.apply(right));
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Constraint
          && op == ((Constraint<?>) o).op
          && left.equals(((Constraint<?>) o).left)
          && right.equals(((Constraint<?>) o).right);
    }

    @Override public String toString() {
      return "constrain " + left + " " + op.symbol + " " + right;
    }
  }

  /** Assertion that a boolean expression holds. */
  public static final class Assert<E> extends Stmt<E> {
    public final BExpr<E> condition;

    Assert(BExpr<E> condition) {
      super(Kind.ASSERT);
      this.condition = requireNonNull(condition);
    }

    @Override public <F> Stmt<F> map(Function<? super E, ? extends F> f) {
      return new Assert<>(condition.map(f));
    }

    @Override public int hashCode() {
      return condition.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assert
          && condition.equals(((Assert<?>) o).condition);
    }

    @Override public String toString() {
      return "assert " + condition;
    }
  }

  /** Comment; has no effect. */
  public static final class Comment<E> extends Stmt<E> {
    public final String text;

    Comment(String text) {
      super(Kind.COMMENT);
      this.text = requireNonNull(text);
    }

    @Override public <F> Stmt<F> map(Function<? super E, ? extends F> f) {
      return new Comment<>(text);
    }

    @Override public int hashCode() {
      return text.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Comment
          && text.equals(((Comment<?>) o).text);
    }

    @Override public String toString() {
      return "// " + text;
    }
  }

  /** Declares that a variable is determined by the other variables. */
  public static final class AssumeDeterministic<E> extends Stmt<E> {
    public final FuncIO var;

    AssumeDeterministic(FuncIO var) {
      super(Kind.ASSUME_DETERMINISTIC);
      this.var = requireNonNull(var);
    }

    @Override public <F> Stmt<F> map(Function<? super E, ? extends F> f) {
      return new AssumeDeterministic<>(var);
    }

    @Override public int hashCode() {
      return var.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof AssumeDeterministic
          && var.equals(((AssumeDeterministic<?>) o).var);
    }

    @Override public String toString() {
      return "assume deterministic " + var;
    }
  }

  /** Sequence of statements. */
  public static final class Seq<E> extends Stmt<E> {
    public final ImmutableList<Stmt<E>> stmts;

    Seq(List<? extends Stmt<E>> stmts) {
      super(Kind.SEQ);
      this.stmts = ImmutableList.copyOf(stmts);
    }

    @Override public <F> Stmt<F> map(Function<? super E, ? extends F> f) {
      final ImmutableList.Builder<Stmt<F>> b = ImmutableList.builder();
      stmts.forEach(s -> b.add(s.map(f)));
      return new Seq<>(b.build());
    }

    @Override void flattenTo(ImmutableList.Builder<Stmt<E>> b) {
      stmts.forEach(s -> s.flattenTo(b));
    }

    @Override public boolean isEmpty() {
      return stmts.stream().allMatch(Stmt::isEmpty);
    }

    @Override public int hashCode() {
      return stmts.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Seq
          && stmts.equals(((Seq<?>) o).stmts);
    }

    @Override public String toString() {
      final StringBuilder b = new StringBuilder("{");
      stmts.forEach(s -> b.append(s).append("; "));
      return b.append('}').toString();
    }
  }
}

// End Stmt.java
