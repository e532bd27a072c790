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
import java.util.List;
import java.util.Objects;

/**
 * Cells that a group needs as extra inputs because its equality
 * constraints reach outside its bounds, and the extra arguments that each
 * of its callsites must pass.
 */
public final class FreeCells {
  /** Extra inputs of the group, appended after its declared inputs. */
  public final ImmutableList<GroupCell> inputs;
  /** Extra arguments for each callsite, indexed by child position. */
  public final ImmutableList<ImmutableList<GroupCell>> callsites;

  FreeCells(List<GroupCell> inputs,
      List<? extends List<GroupCell>> callsites) {
    this.inputs = ImmutableList.copyOf(inputs);
    final ImmutableList.Builder<ImmutableList<GroupCell>> b =
        ImmutableList.builder();
    callsites.forEach(c -> b.add(ImmutableList.copyOf(c)));
    this.callsites = b.build();
  }

  @Override public int hashCode() {
    return Objects.hash(inputs, callsites);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FreeCells
        && inputs.equals(((FreeCells) o).inputs)
        && callsites.equals(((FreeCells) o).callsites);
  }

  @Override public String toString() {
    return "{inputs: " + inputs + ", callsites: " + callsites + "}";
  }
}

// End FreeCells.java
