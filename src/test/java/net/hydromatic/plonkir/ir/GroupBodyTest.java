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
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.group.GroupKey;
import org.junit.jupiter.api.Test;

/** Tests {@link GroupBody} and {@link CallSite}. */
class GroupBodyTest {
  private final GroupKey keyA = GroupKey.of("A");
  private final Column a = Column.advice(0);

  private GroupBody callee(int row, GroupKey key) {
    return new GroupBody("A", 0, key, 1, 1, ImmutableList.of(),
        Stmt.eq(AExpr.io(FuncIO.advice(a, row, 0)), AExpr.io(FuncIO.arg(0))),
        Stmt.empty(), Stmt.empty(), Stmt.empty(), false);
  }

  private GroupBody caller(CallSite callsite, boolean debugComments) {
    return new GroupBody("Main", 1, null, 0, 0, ImmutableList.of(callsite),
        Stmt.empty(), Stmt.empty(), Stmt.empty(), Stmt.empty(),
        debugComments);
  }

  @Test void testValidate() {
    final CallSite good =
        CallSite.of("A", keyA, 0, 0,
            ImmutableList.of(AExpr.io(FuncIO.arg(0))),
            ImmutableList.of(AExpr.io(FuncIO.field(0))));
    final GroupBody body = caller(good, false);
    final List<GroupBody> bodies = ImmutableList.of(callee(3, keyA), body);
    body.validate(bodies);

    final CallSite bad =
        CallSite.of("A", keyA, 0, 0,
            ImmutableList.of(AExpr.io(FuncIO.arg(0)),
                AExpr.io(FuncIO.arg(1))),
            ImmutableList.of());
    final ValidationException e =
        assertThrows(ValidationException.class, () ->
            caller(bad, false).validate(bodies));
    assertThat(e.errors,
        is(
            ImmutableList.of(
                "Main: call to 'A' passes 2 inputs but the callee takes 1",
                "Main: call to 'A' expects 0 outputs but the callee "
                    + "returns 1")));
  }

  @Test void testValidateUnknownCallee() {
    final CallSite callsite =
        CallSite.of("A", keyA, 5, 0, ImmutableList.of(), ImmutableList.of());
    final ValidationException e =
        assertThrows(ValidationException.class, () ->
            caller(callsite, false).validate(ImmutableList.of()));
    assertThat(e.getMessage(),
        is("IR validation failed:\nMain: call to unknown group 5"));
  }

  /** Bodies that differ only in the absolute rows of their local cells are
   * equivalent; bodies with different keys are not. */
  @Test void testEquivalent() {
    assertThat(callee(3, keyA).equivalent(callee(7, keyA)), is(true));
    assertThat(callee(3, keyA).equivalent(callee(3, GroupKey.of("B"))),
        is(false));
    assertThat(callee(3, keyA).isTopLevel(), is(false));
  }

  @Test void testToStmt() {
    final CallSite callsite =
        CallSite.of("A", keyA, 0, 0,
            ImmutableList.of(AExpr.io(FuncIO.arg(0))),
            ImmutableList.of(AExpr.io(FuncIO.field(0))));
    assertThat(caller(callsite, false).toStmt().flatten(),
        hasToString("[[call0_out0] = call A[arg0], "
            + "constrain field0 == call0_out0]"));
    assertThat(caller(callsite, true).toStmt().flatten(),
        hasToString("[// Calls to subgroups, [call0_out0] = call A[arg0], "
            + "constrain field0 == call0_out0]"));
    assertThat(caller(callsite, false).withName("Renamed").name,
        is("Renamed"));
    assertThat(
        caller(callsite, false)
            .withCallsites(c -> c.withName("A_1"))
            .callsites.get(0).name,
        is("A_1"));
  }
}

// End GroupBodyTest.java
