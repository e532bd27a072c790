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
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A callable unit of a circuit: the regions it owns directly, the groups it
 * calls, and the cells that are its inputs and outputs.
 *
 * <p>Exactly one group, the top level, has no key; it is named
 * {@value #TOP_LEVEL_NAME}.
 */
public final class Group {
  public static final String TOP_LEVEL_NAME = "Main";
  static final String UNNAMED = "unnamed_group";

  public final int id;
  public final String name;
  public final @Nullable GroupKey key;
  /** Indices of the regions owned directly by this group. */
  public final ImmutableList<Integer> regions;
  /** Ids of the groups called by this group, in call order. */
  public final ImmutableList<Integer> children;
  public final ImmutableList<GroupCell> inputs;
  public final ImmutableList<GroupCell> outputs;

  Group(int id, String name, @Nullable GroupKey key, List<Integer> regions,
      List<Integer> children, List<GroupCell> inputs,
      List<GroupCell> outputs) {
    this.id = id;
    this.name = requireNonNull(name);
    this.key = key;
    this.regions = ImmutableList.copyOf(regions);
    this.children = ImmutableList.copyOf(children);
    this.inputs = ImmutableList.copyOf(inputs);
    this.outputs = ImmutableList.copyOf(outputs);
  }

  public boolean isTopLevel() {
    return key == null;
  }

  /** Returns the position of {@code groupId} among the children of this
   * group, or -1 if this group does not call it. */
  public int childPosition(int groupId) {
    return children.indexOf(groupId);
  }

  /** Returns the key; throws if this is the top level. */
  public GroupKey key() {
    if (key == null) {
      throw new IllegalStateException("Top level group has no key");
    }
    return key;
  }

  @Override public String toString() {
    return "group " + id + " '" + name + "'";
  }
}

// End Group.java
