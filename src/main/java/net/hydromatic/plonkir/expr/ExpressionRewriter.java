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
package net.hydromatic.plonkir.expr;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.compile.Tracer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites expressions using a list of rules.
 *
 * <p>At each node, the rules are tried in order and the first that returns
 * a non-null expression wins. {@link #rewrite} makes one top-down pass and
 * does not revisit what a rule produced; {@link #rewriteRecursive} repeats
 * passes until nothing changes, up to a limit.
 */
public class ExpressionRewriter {
  private final ImmutableList<Rule> rules;

  private ExpressionRewriter(List<Rule> rules) {
    this.rules = ImmutableList.copyOf(rules);
  }

  public static ExpressionRewriter of(Rule... rules) {
    return new ExpressionRewriter(ImmutableList.copyOf(rules));
  }

  public static ExpressionRewriter of(List<Rule> rules) {
    return new ExpressionRewriter(rules);
  }

  /** Rewrites an expression in one pass. */
  public Expression rewrite(Expression e) {
    final Expression r = apply(e);
    if (r != null) {
      return r;
    }
    switch (e.op) {
    case NEGATED:
      final Expression.Negated negated = (Expression.Negated) e;
      final Expression arg = rewrite(negated.arg);
      return arg == negated.arg ? e : Expression.negated(arg);
    case SCALED:
      final Expression.Scaled scaled = (Expression.Scaled) e;
      final Expression scaledArg = rewrite(scaled.arg);
      return scaledArg == scaled.arg
          ? e
          : Expression.scaled(scaledArg, scaled.factor);
    case SUM:
    case PRODUCT:
      final Expression.Binary b = (Expression.Binary) e;
      final Expression left = rewrite(b.left);
      final Expression right = rewrite(b.right);
      if (left == b.left && right == b.right) {
        return e;
      }
      return e.op == Expression.Op.SUM
          ? Expression.sum(left, right)
          : Expression.product(left, right);
    default:
      return e;
    }
  }

  /**
   * Rewrites an expression repeatedly until it stops changing.
   *
   * @throws NonConvergenceException if it is still changing after
   * {@code maxIterations} passes
   */
  public Expression rewriteRecursive(Expression e, int maxIterations) {
    Expression current = e;
    for (int i = 0; i < maxIterations; i++) {
      final Expression next = rewrite(current);
      if (next.equals(current)) {
        return current;
      }
      current = next;
    }
    throw new NonConvergenceException(maxIterations, current);
  }

  /**
   * Rewrites an expression repeatedly until it stops changing. If
   * {@code strict} is false and the limit is reached, the tracer receives a
   * warning and the last expression is returned.
   */
  public Expression rewriteRecursive(Expression e, int maxIterations,
      boolean strict, Tracer tracer) {
    try {
      return rewriteRecursive(e, maxIterations);
    } catch (NonConvergenceException ex) {
      if (strict) {
        throw ex;
      }
      tracer.onWarning(ex.getMessage());
      return ex.last;
    }
  }

  private @Nullable Expression apply(Expression e) {
    for (Rule rule : rules) {
      final Expression r = rule.apply(e);
      if (r != null) {
        return r;
      }
    }
    return null;
  }

  /** Rewrite rule. Each method handles one kind of node, and returns null
   * if the rule does not apply. */
  public interface Rule {
    default @Nullable Expression constant(Expression.Constant e) {
      return null;
    }

    default @Nullable Expression selector(Expression.SelectorRef e) {
      return null;
    }

    default @Nullable Expression query(Expression.Query e) {
      return null;
    }

    default @Nullable Expression challenge(Expression.ChallengeRef e) {
      return null;
    }

    default @Nullable Expression negated(Expression.Negated e) {
      return null;
    }

    default @Nullable Expression sum(Expression.Sum e) {
      return null;
    }

    default @Nullable Expression product(Expression.Product e) {
      return null;
    }

    default @Nullable Expression scaled(Expression.Scaled e) {
      return null;
    }

    /** Dispatches to the method for the kind of node. */
    default @Nullable Expression apply(Expression e) {
      switch (e.op) {
      case CONSTANT:
        return constant((Expression.Constant) e);
      case SELECTOR:
        return selector((Expression.SelectorRef) e);
      case FIXED:
      case ADVICE:
      case INSTANCE:
        return query((Expression.Query) e);
      case CHALLENGE:
        return challenge((Expression.ChallengeRef) e);
      case NEGATED:
        return negated((Expression.Negated) e);
      case SUM:
        return sum((Expression.Sum) e);
      case PRODUCT:
        return product((Expression.Product) e);
      case SCALED:
        return scaled((Expression.Scaled) e);
      default:
        throw new AssertionError(e.op);
      }
    }
  }
}

// End ExpressionRewriter.java
