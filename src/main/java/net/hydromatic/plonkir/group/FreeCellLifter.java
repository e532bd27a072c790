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
package net.hydromatic.plonkir.group;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.compile.Tracer;
import net.hydromatic.plonkir.synthesis.EqConstraint;
import net.hydromatic.plonkir.synthesis.EqConstraintGraph;

/**
 * Lifts cells that are referenced by a group's equality constraints, but
 * lie outside the group, into extra inputs of the group.
 *
 * <p>First, each group is seeded with the cells at the far end of the
 * edges that connect a cell within the group to a cell outside it. Then a
 * worklist propagates free cells from callees to callers: every callsite of
 * a group passes the group's free cells as trailing arguments, and any of
 * those cells that is outside the caller becomes a free cell of the caller.
 *
 * <p>Free cell sets only grow, and each is bounded by the number of cells,
 * so the process terminates.
 */
public class FreeCellLifter {
  private final Groups groups;
  private final EqConstraintGraph graph;

  public FreeCellLifter(Groups groups, EqConstraintGraph graph) {
    this.groups = groups;
    this.graph = graph;
  }

  /** Computes the free cells of every group, indexed by group id. */
  public List<FreeCells> lift() {
    return lift(ImmutableList.of());
  }

  /** Computes the free cells of every group, starting from a previous
   * result. Lifting is idempotent: re-running on its own output yields the
   * same output. */
  public List<FreeCells> lift(List<FreeCells> previous) {
    final List<List<GroupCell>> inputs = new ArrayList<>();
    final List<List<List<GroupCell>>> callsites = new ArrayList<>();
    for (Group group : groups.list()) {
      final List<GroupCell> free = new ArrayList<>();
      if (group.id < previous.size()) {
        free.addAll(previous.get(group.id).inputs);
      }
      for (GroupCell cell : seed(group)) {
        if (!free.contains(cell)) {
          free.add(cell);
        }
      }
      inputs.add(free);
      final List<List<GroupCell>> calls = new ArrayList<>();
      group.children.forEach(c -> calls.add(new ArrayList<>()));
      callsites.add(calls);
    }

    final Deque<Integer> worklist = new ArrayDeque<>();
    for (Group group : groups.list()) {
      if (!inputs.get(group.id).isEmpty()) {
        worklist.add(group.id);
      }
    }
    while (!worklist.isEmpty()) {
      final int calleeId = worklist.poll();
      final List<GroupCell> calleeInputs =
          ImmutableList.copyOf(inputs.get(calleeId));
      for (Group caller : groups.list()) {
        final int position = caller.childPosition(calleeId);
        if (position < 0) {
          continue;
        }
        callsites.get(caller.id).set(position, calleeInputs);
        final List<GroupCell> callerInputs = inputs.get(caller.id);
        final GroupBounds bounds =
            new GroupBounds(caller, groups, callerInputs);
        boolean changed = false;
        for (GroupCell cell : calleeInputs) {
          if (!bounds.withinBounds(cell.toCell(groups.regionStarts()))
              && !callerInputs.contains(cell)) {
            callerInputs.add(cell);
            changed = true;
          }
        }
        if (changed && !worklist.contains(caller.id)) {
          worklist.add(caller.id);
        }
      }
    }

    final ImmutableList.Builder<FreeCells> b = ImmutableList.builder();
    for (Group group : groups.list()) {
      b.add(new FreeCells(inputs.get(group.id), callsites.get(group.id)));
    }
    return b.build();
  }

  /** Calls the tracer for every group that has free cells. */
  public static void trace(Groups groups, List<FreeCells> freeCells,
      Tracer tracer) {
    for (Group group : groups.list()) {
      final FreeCells cells = freeCells.get(group.id);
      if (!cells.inputs.isEmpty()) {
        tracer.onFreeCells(group.id, group.name, cells.inputs);
      }
    }
  }

  /** Returns the advice and instance cells at the far end of edges that
   * connect a cell within the group to a cell outside it. */
  private List<GroupCell> seed(Group group) {
    final GroupBounds bounds = new GroupBounds(group, groups);
    final List<GroupCell> free = new ArrayList<>();
    for (EqConstraint edge : graph.edges()) {
      if (edge.kind != EqConstraint.Kind.ANY_TO_ANY) {
        continue;
      }
      final EqConstraint.AnyToAny anyToAny = (EqConstraint.AnyToAny) edge;
      final GroupBounds.Check check = bounds.check(edge);
      if (check.left == GroupBounds.Bound.WITHIN
          && check.right == GroupBounds.Bound.OUTSIDE) {
        addFree(free, anyToAny.right);
      } else if (check.left == GroupBounds.Bound.OUTSIDE
          && check.right == GroupBounds.Bound.WITHIN) {
        addFree(free, anyToAny.left);
      }
    }
    return free;
  }

  private static void addFree(List<GroupCell> free, Cell cell) {
    if (cell.column.isFixed()) {
      return;
    }
    final GroupCell groupCell = GroupCell.of(cell);
    if (!free.contains(groupCell)) {
      free.add(groupCell);
    }
  }
}

// End FreeCellLifter.java
