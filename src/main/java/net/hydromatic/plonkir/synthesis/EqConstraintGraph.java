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
package net.hydromatic.plonkir.synthesis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import net.hydromatic.plonkir.circuit.Cell;

/**
 * Undirected graph of equality constraints between cells.
 *
 * <p>Edges are de-duplicated regardless of the order of their endpoints,
 * and an edge from a cell to itself is discarded.
 */
public class EqConstraintGraph {
  private final Set<EqConstraint> edges = new LinkedHashSet<>();
  private final Set<Cell> vertices = new LinkedHashSet<>();

  /** Adds an edge; returns whether the graph changed. */
  public boolean add(Cell a, Cell b) {
    if (a.equals(b)) {
      return false;
    }
    vertices.add(a);
    vertices.add(b);
    return edges.add(EqConstraint.anyToAny(a, b));
  }

  /** Adds, for every vertex in a fixed column, an edge to its value. */
  void addFixedToConst(FixedData fixedData) {
    for (Cell cell : ImmutableList.copyOf(vertices)) {
      if (cell.column.isFixed()) {
        edges.add(EqConstraint.fixedToConst(cell, fixedData.resolve(cell)));
      }
    }
  }

  public ImmutableList<EqConstraint> edges() {
    return ImmutableList.copyOf(edges);
  }

  public ImmutableSet<Cell> vertices() {
    return ImmutableSet.copyOf(vertices);
  }
}

// End EqConstraintGraph.java
