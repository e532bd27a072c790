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

import net.hydromatic.plonkir.circuit.Challenge;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.ConstantFolding;
import net.hydromatic.plonkir.resolve.QueryResolver;
import net.hydromatic.plonkir.resolve.SelectorResolver;

/** Lowers a polynomial {@link Expression} to an IR {@link AExpr}, resolving
 * its queries and selectors and folding constants. */
public abstract class ExpressionLowering {
  private ExpressionLowering() {}

  public static AExpr lower(Expression e, QueryResolver queries,
      SelectorResolver selectors) {
    return ConstantFolding.fold(e.evaluate(new ToAExpr(queries, selectors)));
  }

  /** Converts each node, bottom-up. */
  private static class ToAExpr implements Expression.Evaluator<AExpr> {
    private final QueryResolver queries;
    private final SelectorResolver selectors;

    ToAExpr(QueryResolver queries, SelectorResolver selectors) {
      this.queries = queries;
      this.selectors = selectors;
    }

    @Override public AExpr constant(Felt value) {
      return AExpr.constant(value);
    }

    @Override public AExpr selector(Selector selector) {
      return selectors.resolveSelector(selector).toExpr();
    }

    @Override public AExpr fixed(Expression.Query query) {
      return queries.resolveQuery(query).toExpr();
    }

    @Override public AExpr advice(Expression.Query query) {
      return queries.resolveQuery(query).toExpr();
    }

    @Override public AExpr instance(Expression.Query query) {
      return queries.resolveQuery(query).toExpr();
    }

    @Override public AExpr challenge(Challenge challenge) {
      return AExpr.io(queries.resolveChallenge(challenge));
    }

    @Override public AExpr negated(AExpr arg) {
      return AExpr.negated(arg);
    }

    @Override public AExpr sum(AExpr left, AExpr right) {
      return AExpr.sum(left, right);
    }

    @Override public AExpr product(AExpr left, AExpr right) {
      return AExpr.product(left, right);
    }

    @Override public AExpr scaled(AExpr arg, Felt factor) {
      return AExpr.product(arg, AExpr.constant(factor));
    }
  }
}

// End ExpressionLowering.java
