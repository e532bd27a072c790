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
package net.hydromatic.plonkir.gate;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.ir.CmpOp;
import net.hydromatic.plonkir.ir.Stmt;

/**
 * Pattern that matches every gate, and constrains each polynomial to equal
 * zero at each row of the region.
 *
 * <p>If {@code ignoreDisabled}, a polynomial is omitted at a row where none
 * of its selectors is enabled. A polynomial with no selectors counts as
 * disabled.
 */
public class FallbackGateRewriter implements GateRewritePattern {
  private final boolean ignoreDisabled;

  public FallbackGateRewriter(boolean ignoreDisabled) {
    this.ignoreDisabled = ignoreDisabled;
  }

  @Override public boolean match(GateScope scope) {
    return true;
  }

  @Override public Stmt<RowExpression> rewrite(GateScope scope) {
    final List<Stmt<RowExpression>> stmts = new ArrayList<>();
    for (int row : scope.rows()) {
      for (Expression polynomial : scope.polynomials()) {
        if (ignoreDisabled
            && scope.regionRow(row)
                .gateIsDisabled(polynomial.selectors())) {
          continue;
        }
        stmts.add(
            Stmt.constraint(CmpOp.EQ, RowExpression.of(row, polynomial),
                RowExpression.of(row, Expression.constant(0))));
      }
    }
    return Stmt.seq(ImmutableList.copyOf(stmts));
  }
}

// End FallbackGateRewriter.java
