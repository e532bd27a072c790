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
package net.hydromatic.plonkir.lookup;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Lookup;

/**
 * Class of lookups that read the same table columns and split their inputs
 * the same way.
 *
 * <p>An input that queries a fixed column is passed to the lookup's
 * function as an argument; every other input is an output of the function.
 * All lookups of a kind can therefore call one function.
 */
public final class LookupKind {
  /** Number of the kind, in order of first appearance. */
  public final int id;
  /** Name of the first lookup of this kind. */
  public final String name;
  public final ImmutableList<Column> columns;
  /** For each input, whether it contains a fixed query. */
  public final ImmutableList<Boolean> fixedInputs;

  private LookupKind(int id, String name, List<Column> columns,
      List<Boolean> fixedInputs) {
    this.id = id;
    this.name = requireNonNull(name);
    this.columns = ImmutableList.copyOf(columns);
    this.fixedInputs = ImmutableList.copyOf(fixedInputs);
  }

  /** Assigns a kind to each lookup; returns a map keyed by
   * {@link Lookup#index}. */
  public static ImmutableMap<Integer, LookupKind> assign(
      List<Lookup> lookups) {
    final Map<List<Object>, LookupKind> kinds = new HashMap<>();
    final ImmutableMap.Builder<Integer, LookupKind> b = ImmutableMap.builder();
    for (Lookup lookup : lookups) {
      final ImmutableList<Boolean> mask = fixedMask(lookup);
      final List<Object> key =
          ImmutableList.of(lookup.tableColumns(), mask);
      final LookupKind kind =
          kinds.computeIfAbsent(key, k ->
              new LookupKind(kinds.size(), lookup.name,
                  lookup.tableColumns(), mask));
      b.put(lookup.index, kind);
    }
    return b.build();
  }

  private static ImmutableList<Boolean> fixedMask(Lookup lookup) {
    final ImmutableList.Builder<Boolean> b = ImmutableList.builder();
    lookup.inputs.forEach(e -> b.add(e.containsFixed()));
    return b.build();
  }

  /** Returns the name of the function that evaluates lookups of this
   * kind. */
  public String moduleName() {
    return "lookup" + id + "_" + name;
  }

  public int inputCount() {
    return (int) fixedInputs.stream().filter(b -> b).count();
  }

  public int outputCount() {
    return fixedInputs.size() - inputCount();
  }

  /** Returns the inputs of a lookup that are arguments of the function. */
  public ImmutableList<Expression> arguments(Lookup lookup) {
    return select(lookup, true);
  }

  /** Returns the inputs of a lookup that are outputs of the function. */
  public ImmutableList<Expression> results(Lookup lookup) {
    return select(lookup, false);
  }

  private ImmutableList<Expression> select(Lookup lookup, boolean fixed) {
    final ImmutableList.Builder<Expression> b = ImmutableList.builder();
    for (int i = 0; i < lookup.inputs.size(); i++) {
      if (fixedInputs.get(i) == fixed) {
        b.add(lookup.inputs.get(i));
      }
    }
    return b.build();
  }

  @Override public String toString() {
    return moduleName();
  }
}

// End LookupKind.java
