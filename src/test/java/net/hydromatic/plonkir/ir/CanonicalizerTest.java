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
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests {@link Canonicalizer} and {@link ConstantFolding}. */
class CanonicalizerTest {
  private final AExpr a = AExpr.io(FuncIO.arg(0));
  private final AExpr b = AExpr.io(FuncIO.field(0));
  private final AExpr zero = AExpr.constant(0);

  private static AExpr minus(AExpr x, AExpr y) {
    return AExpr.sum(x, AExpr.negated(y));
  }

  @Test void testDifference() {
    assertThat(Canonicalizer.canonicalize(Stmt.eq(minus(a, b), zero)),
        hasToString("constrain arg0 == field0"));
  }

  /** The zero may be on the left, the negated term may come first, and the
   * difference may be multiplied by one. */
  @Test void testDifferenceVariants() {
    final Stmt<AExpr> stmt =
        Stmt.eq(zero,
            AExpr.product(AExpr.constant(1),
                AExpr.sum(AExpr.negated(b), a)));
    assertThat(Canonicalizer.canonicalize(stmt),
        hasToString("constrain arg0 == field0"));
  }

  @Test void testOnlyEquality() {
    final Stmt<AExpr> stmt = Stmt.constraint(CmpOp.LT, minus(a, b), zero);
    assertThat(Canonicalizer.canonicalize(stmt),
        hasToString("constrain (arg0 + -field0) < 0"));
  }

  @Test void testFolding() {
    final Stmt<AExpr> stmt =
        Stmt.eq(AExpr.product(a, zero), AExpr.sum(b, zero));
    assertThat(Canonicalizer.canonicalize(stmt),
        hasToString("constrain 0 == field0"));
    assertThat(ConstantFolding.fold(minus(a, a)), hasToString("0"));
    assertThat(
        ConstantFolding.fold(
            AExpr.product(AExpr.constant(-1), AExpr.negated(b))),
        hasToString("field0"));
    assertThat(
        ConstantFolding.fold(AExpr.sum(AExpr.constant(2), AExpr.constant(3))),
        hasToString("5"));
  }

  @Test void testAssertion() {
    final Stmt<AExpr> stmt =
        Stmt.assertion(
            BExpr.and(
                ImmutableList.of(BExpr.eq(minus(a, b), zero),
                    BExpr.not(BExpr.eq(a, AExpr.product(b, zero))))));
    assertThat(Canonicalizer.canonicalize(stmt),
        hasToString("assert (arg0 == field0 && !arg0 == 0)"));
  }

  @Test void testFixedPoint() {
    final Stmt<AExpr> stmt =
        Stmt.seq(Stmt.comment("c"),
            Stmt.eq(minus(a, b), zero),
            Stmt.eq(AExpr.product(a, AExpr.constant(1)), b));
    final Stmt<AExpr> once = Canonicalizer.canonicalize(stmt);
    assertThat(once,
        hasToString("{// c; constrain arg0 == field0; "
            + "constrain arg0 == field0; }"));
    assertThat(Canonicalizer.canonicalize(once), is(once));
  }
}

// End CanonicalizerTest.java
