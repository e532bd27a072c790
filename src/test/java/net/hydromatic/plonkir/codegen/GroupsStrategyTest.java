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
package net.hydromatic.plonkir.codegen;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.group.GroupKey;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.CallSite;
import net.hydromatic.plonkir.ir.FuncIO;
import net.hydromatic.plonkir.ir.GroupBody;
import net.hydromatic.plonkir.ir.Stmt;
import org.junit.jupiter.api.Test;

/** Tests the choice of leaders in {@link GroupsStrategy}. */
class GroupsStrategyTest {
  private final GroupKey key = GroupKey.of("double");

  /** Creates the body of a group whose gate constrains a local cell to
   * equal its argument. */
  private static GroupBody body(String name, int id, GroupKey key,
      Column column, int row) {
    return new GroupBody(name, id, key, 1, 0, ImmutableList.of(),
        Stmt.eq(AExpr.io(FuncIO.advice(column, row, 0)),
            AExpr.io(FuncIO.arg(0))),
        Stmt.empty(), Stmt.empty(), Stmt.empty(), false);
  }

  private static GroupBody main(int id, List<GroupBody> callees) {
    final List<CallSite> callsites = new ArrayList<>();
    for (GroupBody callee : callees) {
      callsites.add(
          CallSite.of(callee.name, callee.key, callee.id, callsites.size(),
              ImmutableList.of(AExpr.constant(callee.id)),
              ImmutableList.of()));
    }
    return new GroupBody("Main", id, null, 0, 0, callsites, Stmt.empty(),
        Stmt.empty(), Stmt.empty(), Stmt.empty(), false);
  }

  @Test void testLeaders() {
    final Column a = Column.advice(0);
    final Column b = Column.advice(1);
    final List<GroupBody> groups =
        ImmutableList.of(body("double", 0, key, a, 0),
            body("double", 1, key, a, 3),
            body("double", 2, key, b, 5),
            body("double", 3, GroupKey.of("other"), a, 0));
    final List<GroupBody> bodies = new ArrayList<>(groups);
    bodies.add(main(4, groups));
    final GroupsStrategy.Leaders leaders = GroupsStrategy.Leaders.of(bodies);

    assertThat(leaders.leaderIds, is(ImmutableList.of(0, 2, 3, 4)));
    assertThat(leaders.name(1), is("double"));
    assertThat(leaders.name(2), is("double1"));
    assertThat(leaders.name(3), is("double2"));
    assertThat(leaders.name(4), is("Main"));
    assertThat(leaders.classes.same(0, 1), is(true));
    assertThat(leaders.classes.same(0, 2), is(false));

    final GroupBody main = leaders.renamed.get(4);
    assertThat(main.callsites.get(1).name, is("double"));
    assertThat(main.callsites.get(2).name, is("double1"));
    assertThat(main.callsites.get(3).name, is("double2"));
    for (GroupBody leader : leaders.bodies()) {
      leader.validate(leaders.renamed);
    }
  }

  /** A group cannot take the name of the main function. */
  @Test void testMainNameReserved() {
    final GroupBody group = body("Main", 0, key, Column.advice(0), 0);
    final GroupsStrategy.Leaders leaders =
        GroupsStrategy.Leaders.of(
            ImmutableList.of(group, main(1, ImmutableList.of(group))));
    assertThat(leaders.name(0), is("Main1"));
    assertThat(leaders.name(1), is("Main"));
    assertThat(leaders.renamed.get(1).callsites.get(0).name, is("Main1"));
  }
}

// End GroupsStrategyTest.java
