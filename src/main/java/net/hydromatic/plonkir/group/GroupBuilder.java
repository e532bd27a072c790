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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import net.hydromatic.plonkir.synthesis.SynthesisException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds the list of groups while a circuit is being synthesized.
 *
 * <p>Groups form a stack. A group receives its id when it is closed, so
 * the resulting list is in post-order: every group comes after the groups
 * it calls, and the top level comes last.
 */
public class GroupBuilder {
  private final Deque<Frame> stack = new ArrayDeque<>();
  private final List<Group> groups = new ArrayList<>();

  public GroupBuilder() {
    stack.push(new Frame(Group.TOP_LEVEL_NAME, null));
  }

  /** Opens a group. */
  public void enter(String name, GroupKey key) {
    stack.push(new Frame(name.isEmpty() ? Group.UNNAMED : name,
        requireNonNull(key, "key")));
  }

  /** Closes the innermost group, giving it inputs and outputs. Fixed cells
   * among them are ignored. */
  public Group exit(List<GroupCell> inputs, List<GroupCell> outputs) {
    if (stack.size() <= 1) {
      throw new SynthesisException("Unbalanced group stack: no group to exit");
    }
    final Frame frame = stack.pop();
    final Group group =
        new Group(groups.size(), frame.name, frame.key, frame.regions,
            frame.children, withoutFixed(inputs), withoutFixed(outputs));
    groups.add(group);
    requireNonNull(stack.peek()).children.add(group.id);
    return group;
  }

  private static List<GroupCell> withoutFixed(List<GroupCell> cells) {
    final ImmutableList.Builder<GroupCell> b = ImmutableList.builder();
    cells.forEach(c -> {
      if (!c.column().isFixed()) {
        b.add(c);
      }
    });
    return b.build();
  }

  /** Assigns a region to the innermost group. */
  public void addRegion(int regionIndex) {
    requireNonNull(stack.peek()).regions.add(regionIndex);
  }

  /** Removes a region from the innermost group; called when the region is
   * demoted to a table. */
  public void removeRegion(int regionIndex) {
    if (!requireNonNull(stack.peek()).regions
        .remove(Integer.valueOf(regionIndex))) {
      throw new SynthesisException("Region " + regionIndex
          + " does not belong to the current group");
    }
  }

  /** Returns the number of open groups, including the top level. */
  public int depth() {
    return stack.size();
  }

  /** Closes the top level and returns all groups, top level last.
   * Inputs and outputs of the top level must be absolute cells. */
  public List<Group> finish(List<GroupCell> inputs, List<GroupCell> outputs) {
    if (stack.size() != 1) {
      throw new SynthesisException("Unbalanced group stack: "
          + (stack.size() - 1) + " group(s) not exited");
    }
    for (GroupCell cell : ImmutableList.<GroupCell>builder().addAll(inputs)
        .addAll(outputs).build()) {
      if (cell.kind == GroupCell.Kind.ASSIGNED) {
        throw new SynthesisException("Top level IO cannot be an assigned "
            + "cell: " + cell);
      }
    }
    final Frame frame = stack.pop();
    groups.add(
        new Group(groups.size(), frame.name, null, frame.regions,
            frame.children, withoutFixed(inputs), withoutFixed(outputs)));
    return ImmutableList.copyOf(groups);
  }

  /** Group that is still open. */
  private static class Frame {
    final String name;
    final @Nullable GroupKey key;
    final List<Integer> regions = new ArrayList<>();
    final List<Integer> children = new ArrayList<>();

    Frame(String name, @Nullable GroupKey key) {
      this.name = name;
      this.key = key;
    }
  }
}

// End GroupBuilder.java
