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
package net.hydromatic.plonkir.circuit;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Polynomial expression over the columns of a circuit.
 *
 * <p>Expressions are immutable trees. Every node has an {@link Op}; the
 * concrete sub-classes are nested in this class. To compute something from
 * an expression, implement {@link Evaluator} and call
 * {@link #evaluate(Evaluator)}, which visits the tree bottom-up.
 */
public abstract class Expression {
  public final Op op;

  Expression(Op op) {
    this.op = requireNonNull(op);
  }

  /** Folds this expression bottom-up. */
  public abstract <R> R evaluate(Evaluator<R> evaluator);

  // Factory methods

  public static Expression constant(Felt value) {
    return new Constant(value);
  }

  public static Expression constant(long value) {
    return new Constant(Felt.of(value));
  }

  public static Expression selector(Selector selector) {
    return new SelectorRef(selector);
  }

  public static Expression query(Column column, int rotation) {
    return new Query(column, rotation);
  }

  public static Expression challenge(Challenge challenge) {
    return new ChallengeRef(challenge);
  }

  public static Expression negated(Expression e) {
    return new Negated(e);
  }

  public static Expression sum(Expression left, Expression right) {
    return new Sum(left, right);
  }

  public static Expression product(Expression left, Expression right) {
    return new Product(left, right);
  }

  public static Expression scaled(Expression e, Felt factor) {
    return new Scaled(e, factor);
  }

  public Expression plus(Expression e) {
    return sum(this, e);
  }

  /** Returns {@code this + (-e)}. */
  public Expression minus(Expression e) {
    return sum(this, negated(e));
  }

  public Expression times(Expression e) {
    return product(this, e);
  }

  public Expression negate() {
    return negated(this);
  }

  public Expression scale(Felt factor) {
    return scaled(this, factor);
  }

  /** Returns the distinct queries in this expression, in order of first
   * appearance. */
  public ImmutableList<Query> queries() {
    final Set<Query> queries = new LinkedHashSet<>();
    collect(this, queries, null);
    return ImmutableList.copyOf(queries);
  }

  /** Returns the distinct selectors in this expression, in order of first
   * appearance. */
  public ImmutableList<Selector> selectors() {
    final Set<Selector> selectors = new LinkedHashSet<>();
    collect(this, null, selectors);
    return ImmutableList.copyOf(selectors);
  }

  /** Returns whether this expression queries a fixed column. */
  public boolean containsFixed() {
    return queries().stream().anyMatch(q -> q.column.isFixed());
  }

  private static void collect(Expression e, @Nullable Set<Query> queries,
      @Nullable Set<Selector> selectors) {
    switch (e.op) {
    case SELECTOR:
      if (selectors != null) {
        selectors.add(((SelectorRef) e).selector);
      }
      break;
    case FIXED:
    case ADVICE:
    case INSTANCE:
      if (queries != null) {
        queries.add((Query) e);
      }
      break;
    case NEGATED:
      collect(((Negated) e).arg, queries, selectors);
      break;
    case SCALED:
      collect(((Scaled) e).arg, queries, selectors);
      break;
    case SUM:
    case PRODUCT:
      final Binary b = (Binary) e;
      collect(b.left, queries, selectors);
      collect(b.right, queries, selectors);
      break;
    default:
      break;
    }
  }

  @Override public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf);

  /** Kind of expression node. */
  public enum Op {
    CONSTANT, SELECTOR, FIXED, ADVICE, INSTANCE, CHALLENGE,
    NEGATED, SUM, PRODUCT, SCALED
  }

  /** Callback for {@link #evaluate(Evaluator)}.
   *
   * @param <R> result type */
  public interface Evaluator<R> {
    R constant(Felt value);

    R selector(Selector selector);

    R fixed(Query query);

    R advice(Query query);

    R instance(Query query);

    R challenge(Challenge challenge);

    R negated(R arg);

    R sum(R left, R right);

    R product(R left, R right);

    R scaled(R arg, Felt factor);
  }

  /** Literal field value. */
  public static final class Constant extends Expression {
    public final Felt value;

    Constant(Felt value) {
      super(Op.CONSTANT);
      this.value = requireNonNull(value);
    }

    @Override public <R> R evaluate(Evaluator<R> evaluator) {
      return evaluator.constant(value);
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

  /** Reference to a selector. */
  public static final class SelectorRef extends Expression {
    public final Selector selector;

    SelectorRef(Selector selector) {
      super(Op.SELECTOR);
      this.selector = requireNonNull(selector);
    }

    @Override public <R> R evaluate(Evaluator<R> evaluator) {
      return evaluator.selector(selector);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(selector);
    }

    @Override public int hashCode() {
      return selector.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof SelectorRef
          && selector.equals(((SelectorRef) o).selector);
    }
  }

  /** Query of a fixed, advice or instance column at a rotation relative to
   * the current row. */
  public static final class Query extends Expression {
    public final Column column;
    public final int rotation;

    Query(Column column, int rotation) {
      super(opFor(column.type));
      this.column = column;
      this.rotation = rotation;
    }

    private static Op opFor(ColumnType type) {
      switch (type) {
      case FIXED:
        return Op.FIXED;
      case ADVICE:
        return Op.ADVICE;
      case INSTANCE:
        return Op.INSTANCE;
      default:
        throw new AssertionError(type);
      }
    }

    @Override public <R> R evaluate(Evaluator<R> evaluator) {
      switch (op) {
      case FIXED:
        return evaluator.fixed(this);
      case ADVICE:
        return evaluator.advice(this);
      default:
        return evaluator.instance(this);
      }
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append(column);
      if (rotation == 0) {
        return buf.append("@cur");
      }
      return buf.append(rotation > 0 ? "@+" : "@").append(rotation);
    }

    @Override public int hashCode() {
      return Objects.hash(column, rotation);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Query
          && column.equals(((Query) o).column)
          && rotation == ((Query) o).rotation;
    }
  }

  /** Reference to a challenge. */
  public static final class ChallengeRef extends Expression {
    public final Challenge challenge;

    ChallengeRef(Challenge challenge) {
      super(Op.CHALLENGE);
      this.challenge = requireNonNull(challenge);
    }

    @Override public <R> R evaluate(Evaluator<R> evaluator) {
      return evaluator.challenge(challenge);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return buf.append(challenge);
    }

    @Override public int hashCode() {
      return challenge.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ChallengeRef
          && challenge.equals(((ChallengeRef) o).challenge);
    }
  }

  /** Negation. */
  public static final class Negated extends Expression {
    public final Expression arg;

    Negated(Expression arg) {
      super(Op.NEGATED);
      this.arg = requireNonNull(arg);
    }

    @Override public <R> R evaluate(Evaluator<R> evaluator) {
      return evaluator.negated(arg.evaluate(evaluator));
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      return arg.unparse(buf.append("-"));
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

  /** Base class for sum and product. */
  public abstract static class Binary extends Expression {
    public final Expression left;
    public final Expression right;

    Binary(Op op, Expression left, Expression right) {
      super(op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      left.unparse(buf);
      buf.append(op == Op.SUM ? " + " : " * ");
      right.unparse(buf);
      return buf.append(')');
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

  /** Sum of two expressions. */
  public static final class Sum extends Binary {
    Sum(Expression left, Expression right) {
      super(Op.SUM, left, right);
    }

    @Override public <R> R evaluate(Evaluator<R> evaluator) {
      return evaluator.sum(left.evaluate(evaluator),
          right.evaluate(evaluator));
    }
  }

  /** Product of two expressions. */
  public static final class Product extends Binary {
    Product(Expression left, Expression right) {
      super(Op.PRODUCT, left, right);
    }

    @Override public <R> R evaluate(Evaluator<R> evaluator) {
      return evaluator.product(left.evaluate(evaluator),
          right.evaluate(evaluator));
    }
  }

  /** Expression multiplied by a constant factor. */
  public static final class Scaled extends Expression {
    public final Expression arg;
    public final Felt factor;

    Scaled(Expression arg, Felt factor) {
      super(Op.SCALED);
      this.arg = requireNonNull(arg);
      this.factor = requireNonNull(factor);
    }

    @Override public <R> R evaluate(Evaluator<R> evaluator) {
      return evaluator.scaled(arg.evaluate(evaluator), factor);
    }

    @Override StringBuilder unparse(StringBuilder buf) {
      buf.append('(');
      arg.unparse(buf);
      return buf.append(" * ").append(factor).append(')');
    }

    @Override public int hashCode() {
      return Objects.hash(op, arg, factor);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Scaled
          && arg.equals(((Scaled) o).arg)
          && factor.equals(((Scaled) o).factor);
    }
  }
}

// End Expression.java
