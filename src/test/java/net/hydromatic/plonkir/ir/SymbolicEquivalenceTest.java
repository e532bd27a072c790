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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import net.hydromatic.plonkir.circuit.Column;
import org.junit.jupiter.api.Test;

/** Tests {@link SymbolicEquivalence}. */
class SymbolicEquivalenceTest {
  private final Column a = Column.advice(0);
  private final Column b = Column.advice(1);

  @Test void testAdvice() {
    assertThat(
        SymbolicEquivalence.equivalent(FuncIO.advice(a, 5, 1),
            FuncIO.advice(a, 9, 1)),
        is(true));
    assertThat(
        SymbolicEquivalence.equivalent(FuncIO.advice(a, 5, 1),
            FuncIO.advice(a, 5, 2)),
        is(false));
    assertThat(
        SymbolicEquivalence.equivalent(FuncIO.advice(a, 5, 1),
            FuncIO.advice(b, 5, 1)),
        is(false));
  }

  @Test void testTableLookup() {
    assertThat(
        SymbolicEquivalence.equivalent(FuncIO.tableLookup(0, 1, 3, 0, 2),
            FuncIO.tableLookup(0, 1, 7, 0, 5)),
        is(true));
    assertThat(
        SymbolicEquivalence.equivalent(FuncIO.tableLookup(0, 1, 3, 0, 2),
            FuncIO.tableLookup(0, 1, 3, 1, 2)),
        is(false));
  }

  /** Other variables must be equal. */
  @Test void testOtherVariables() {
    assertThat(SymbolicEquivalence.equivalent(FuncIO.arg(1), FuncIO.arg(1)),
        is(true));
    assertThat(SymbolicEquivalence.equivalent(FuncIO.arg(1), FuncIO.field(1)),
        is(false));
    assertThat(
        SymbolicEquivalence.equivalent(FuncIO.fixed(a, 3),
            FuncIO.fixed(a, 4)),
        is(false));
  }

  @Test void testStatements() {
    final Stmt<AExpr> s1 =
        Stmt.seq(Stmt.comment("row 3"),
            Stmt.eq(AExpr.io(FuncIO.advice(a, 3, 0)),
                AExpr.io(FuncIO.arg(0))));
    final Stmt<AExpr> s2 =
        Stmt.eq(AExpr.io(FuncIO.advice(a, 8, 0)), AExpr.io(FuncIO.arg(0)));
    final Stmt<AExpr> s3 =
        Stmt.constraint(CmpOp.NE, AExpr.io(FuncIO.advice(a, 8, 0)),
            AExpr.io(FuncIO.arg(0)));
    final Stmt<AExpr> s4 =
        Stmt.eq(AExpr.io(FuncIO.advice(a, 8, 0)), AExpr.constant(2));
    assertThat(SymbolicEquivalence.equivalent(s1, s2), is(true));
    assertThat(SymbolicEquivalence.equivalent(s2, s3), is(false));
    assertThat(SymbolicEquivalence.equivalent(s2, s4), is(false));
    assertThat(SymbolicEquivalence.equivalent(s1, Stmt.seq(s2, s2)),
        is(false));
  }

  @Test void testBooleanExpressions() {
    final BExpr<AExpr> e1 =
        BExpr.not(
            BExpr.eq(AExpr.io(FuncIO.advice(a, 1, 1)), AExpr.constant(0)));
    final BExpr<AExpr> e2 =
        BExpr.not(
            BExpr.eq(AExpr.io(FuncIO.advice(a, 2, 1)), AExpr.constant(0)));
    assertThat(SymbolicEquivalence.equivalent(e1, e2), is(true));
    assertThat(SymbolicEquivalence.equivalent(e1, BExpr.trueExpr()),
        is(false));
  }
}

// End SymbolicEquivalenceTest.java
