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

import static java.util.Objects.requireNonNull;

import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.Stmt;
import net.hydromatic.plonkir.resolve.QueryResolver;
import net.hydromatic.plonkir.resolve.SelectorResolver;

/** An expression paired with the scope in which it is to be lowered. */
public final class ScopedExpression {
  public final Expression expression;
  private final QueryResolver queries;
  private final SelectorResolver selectors;

  public ScopedExpression(Expression expression, QueryResolver queries,
      SelectorResolver selectors) {
    this.expression = requireNonNull(expression);
    this.queries = requireNonNull(queries);
    this.selectors = requireNonNull(selectors);
  }

  /** Creates a ScopedExpression whose resolver resolves both queries and
   * selectors. */
  public static <R extends QueryResolver & SelectorResolver> ScopedExpression
      of(Expression expression, R resolver) {
    return new ScopedExpression(expression, resolver, resolver);
  }

  public AExpr lower() {
    return ExpressionLowering.lower(expression, queries, selectors);
  }

  /** Lowers every expression in a statement within one scope. */
  public static <R extends QueryResolver & SelectorResolver> Stmt<AExpr>
      lower(Stmt<Expression> stmt, R resolver) {
    return stmt.map(e -> of(e, resolver)).map(ScopedExpression::lower);
  }

  @Override public String toString() {
    return expression.toString();
  }
}

// End ScopedExpression.java
