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
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.synthesis.EqConstraint;
import net.hydromatic.plonkir.synthesis.RegionData;

/**
 * Decides whether a cell is within the bounds of a group.
 *
 * <p>A cell is {@link Bound#WITHIN} if it lies in one of the regions that
 * the group owns directly; {@link Bound#IO} if it is also one of the group's
 * inputs or outputs; {@link Bound#FOREIGN_IO} if it is an input or output
 * (or an extra input) that lies outside the group's regions; otherwise
 * {@link Bound#OUTSIDE}.
 */
public class GroupBounds {
  private final ImmutableList<RegionData> regions;
  private final ImmutableSet<Cell> io;
  private final ImmutableSet<Cell> foreignIo;

  public GroupBounds(Group group, Groups groups) {
    this(group, groups, ImmutableList.of());
  }

  public GroupBounds(Group group, Groups groups,
      List<GroupCell> extraInputs) {
    this.regions = ImmutableList.copyOf(groups.regionsOf(group));
    final Map<Integer, Integer> starts = groups.regionStarts();
    final Set<Cell> io = new LinkedHashSet<>();
    final Set<Cell> foreignIo = new LinkedHashSet<>();
    final List<GroupCell> cells =
        ImmutableList.<GroupCell>builder()
            .addAll(group.inputs)
            .addAll(group.outputs)
            .addAll(extraInputs)
            .build();
    for (GroupCell cell : cells) {
      final Integer regionIndex = cell.regionIndex();
      if (regionIndex != null && group.regions.contains(regionIndex)) {
        io.add(cell.toCell(starts));
      } else {
        foreignIo.add(cell.toCell(starts));
      }
    }
    this.io = ImmutableSet.copyOf(io);
    this.foreignIo = ImmutableSet.copyOf(foreignIo);
  }

  /** Returns whether a cell is in the group's regions or is a foreign
   * input or output. */
  public boolean withinBounds(Cell cell) {
    return inRegions(cell) || foreignIo.contains(cell);
  }

  private boolean inRegions(Cell cell) {
    for (RegionData region : regions) {
      if (region.contains(cell)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether a fixed column is used by any of the group's
   * regions, at any row. */
  public boolean fixedWithinRegions(Column column) {
    for (RegionData region : regions) {
      if (region.columns().contains(column)) {
        return true;
      }
    }
    return false;
  }

  /** Classifies a cell. */
  public Bound check(Cell cell) {
    if (!withinBounds(cell)) {
      return Bound.OUTSIDE;
    }
    if (foreignIo.contains(cell)) {
      return Bound.FOREIGN_IO;
    }
    if (io.contains(cell)) {
      return Bound.IO;
    }
    return Bound.WITHIN;
  }

  /** Classifies the endpoints of an equality constraint. For a
   * {@link EqConstraint.FixedToConst} both bounds are the same, and are
   * either {@link Bound#WITHIN} or {@link Bound#OUTSIDE}. */
  public Check check(EqConstraint constraint) {
    switch (constraint.kind) {
    case ANY_TO_ANY:
      final EqConstraint.AnyToAny anyToAny = (EqConstraint.AnyToAny) constraint;
      return new Check(check(anyToAny.left), check(anyToAny.right));
    case FIXED_TO_CONST:
      final EqConstraint.FixedToConst fixed =
          (EqConstraint.FixedToConst) constraint;
      final Bound bound =
          fixedWithinRegions(fixed.cell.column) ? Bound.WITHIN : Bound.OUTSIDE;
      return new Check(bound, bound);
    default:
      throw new AssertionError(constraint.kind);
    }
  }

  /** Where a cell lies relative to a group. */
  public enum Bound {
    WITHIN, IO, FOREIGN_IO, OUTSIDE
  }

  /** Bounds of the endpoints of an equality constraint. */
  public static final class Check {
    public final Bound left;
    public final Bound right;

    Check(Bound left, Bound right) {
      this.left = left;
      this.right = right;
    }

    @Override public String toString() {
      return "(" + left + ", " + right + ")";
    }
  }
}

// End GroupBounds.java
