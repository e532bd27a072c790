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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import java.util.List;
import java.util.Map;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.CircuitIO;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.ConstraintSystem;
import net.hydromatic.plonkir.circuit.Lookup;
import net.hydromatic.plonkir.group.Groups;

/**
 * Immutable record of one run of a circuit: its constraint system,
 * committed regions, tables, fixed values, equality constraints and
 * groups.
 */
public class CircuitSynthesis {
  public final ConstraintSystem cs;
  /** Committed regions, in the order they were committed. */
  public final ImmutableList<RegionData> regions;
  /** Regions that were demoted to tables. */
  public final ImmutableList<RegionData> tables;
  public final FixedData fixedData;
  public final TableData tableData;
  public final EqConstraintGraph eqGraph;
  public final Groups groups;
  public final ImmutableMap<Cell, Fqn> adviceNames;
  public final CircuitIO adviceIo;
  public final CircuitIO instanceIo;
  public final ImmutableListMultimap<Integer, InjectedIr> injected;

  CircuitSynthesis(ConstraintSystem cs, List<RegionData> regions,
      List<RegionData> tables, FixedData fixedData, TableData tableData,
      EqConstraintGraph eqGraph, Groups groups, Map<Cell, Fqn> adviceNames,
      CircuitIO adviceIo, CircuitIO instanceIo,
      ListMultimap<Integer, InjectedIr> injected) {
    this.cs = cs;
    this.regions = ImmutableList.copyOf(regions);
    this.tables = ImmutableList.copyOf(tables);
    this.fixedData = fixedData;
    this.tableData = tableData;
    this.eqGraph = eqGraph;
    this.groups = groups;
    this.adviceNames = ImmutableMap.copyOf(adviceNames);
    this.adviceIo = adviceIo;
    this.instanceIo = instanceIo;
    this.injected = ImmutableListMultimap.copyOf(injected);
  }

  /** Returns the tables that hold any of the columns of a lookup. */
  public ImmutableList<RegionData> tablesForLookup(Lookup lookup) {
    final ImmutableList.Builder<RegionData> b = ImmutableList.builder();
    for (RegionData table : tables) {
      for (Column column : lookup.tableColumns()) {
        if (table.columns().contains(column)) {
          b.add(table);
          break;
        }
      }
    }
    return b.build();
  }

  /** Returns the statements injected into a region. */
  public ImmutableList<InjectedIr> injected(int regionIndex) {
    return injected.get(regionIndex);
  }
}

// End CircuitSynthesis.java
