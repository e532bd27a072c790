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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.CircuitIO;
import net.hydromatic.plonkir.circuit.ColumnType;
import net.hydromatic.plonkir.group.FreeCells;
import net.hydromatic.plonkir.group.Group;
import net.hydromatic.plonkir.group.GroupCell;
import net.hydromatic.plonkir.group.Groups;

/**
 * Inputs and outputs of each group, as seen by the function generated for
 * it.
 *
 * <p>A group's formal inputs are its instance inputs followed by its advice
 * inputs; a group other than the top level also takes its free cells, each
 * appended to the inputs of its column type. Outputs are ordered the same
 * way. Fixed cells are never inputs or outputs.
 */
public class IrContext {
  public final Groups groups;
  private final ImmutableList<FreeCells> freeCells;
  private final ImmutableList<GroupIo> io;

  public IrContext(Groups groups, List<FreeCells> freeCells) {
    this.groups = groups;
    this.freeCells = ImmutableList.copyOf(freeCells);
    final ImmutableList.Builder<GroupIo> b = ImmutableList.builder();
    for (Group group : groups.list()) {
      b.add(new GroupIo(group, groups.regionStarts(),
          group.isTopLevel()
              ? ImmutableList.of()
              : freeCells.get(group.id).inputs));
    }
    this.io = b.build();
  }

  public FreeCells freeCells(Group group) {
    return freeCells.get(group.id);
  }

  public CircuitIO adviceIo(Group group) {
    return io.get(group.id).adviceIo;
  }

  public CircuitIO instanceIo(Group group) {
    return io.get(group.id).instanceIo;
  }

  /** Returns the formal inputs of a group, in argument order. */
  public ImmutableList<GroupCell> inputs(Group group) {
    return io.get(group.id).inputs;
  }

  /** Returns the formal outputs of a group, in field order. */
  public ImmutableList<GroupCell> outputs(Group group) {
    return io.get(group.id).outputs;
  }

  /** Inputs and outputs of one group. */
  private static class GroupIo {
    final ImmutableList<GroupCell> inputs;
    final ImmutableList<GroupCell> outputs;
    final CircuitIO adviceIo;
    final CircuitIO instanceIo;

    GroupIo(Group group, Map<Integer, Integer> regionStarts,
        List<GroupCell> free) {
      final List<GroupCell> allInputs = new ArrayList<>(group.inputs);
      allInputs.addAll(free);
      this.inputs = ordered(allInputs);
      this.outputs = ordered(group.outputs);
      this.adviceIo =
          CircuitIO.ofUnchecked(ColumnType.ADVICE,
              cells(inputs, ColumnType.ADVICE, regionStarts),
              cells(outputs, ColumnType.ADVICE, regionStarts));
      this.instanceIo =
          CircuitIO.ofUnchecked(ColumnType.INSTANCE,
              cells(inputs, ColumnType.INSTANCE, regionStarts),
              cells(outputs, ColumnType.INSTANCE, regionStarts));
    }

    /** Puts instance cells before advice cells, dropping fixed cells. */
    private static ImmutableList<GroupCell> ordered(List<GroupCell> cells) {
      final ImmutableList.Builder<GroupCell> b = ImmutableList.builder();
      for (ColumnType type
          : ImmutableList.of(ColumnType.INSTANCE, ColumnType.ADVICE)) {
        for (GroupCell cell : cells) {
          if (cell.column().type == type) {
            b.add(cell);
          }
        }
      }
      return b.build();
    }

    private static List<Cell> cells(List<GroupCell> cells, ColumnType type,
        Map<Integer, Integer> regionStarts) {
      final List<Cell> list = new ArrayList<>();
      for (GroupCell cell : cells) {
        if (cell.column().type == type) {
          list.add(cell.toCell(regionStarts));
        }
      }
      return list;
    }
  }
}

// End IrContext.java
