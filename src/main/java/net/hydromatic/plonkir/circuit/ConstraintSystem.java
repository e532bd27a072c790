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
package net.hydromatic.plonkir.circuit;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Records the columns, selectors, gates and lookups that a circuit declares
 * while it is being configured.
 */
public class ConstraintSystem {
  private int fixedCount;
  private int adviceCount;
  private int instanceCount;
  private final List<Selector> selectors = new ArrayList<>();
  private final List<Challenge> challenges = new ArrayList<>();
  private final List<Gate> gates = new ArrayList<>();
  private final List<Lookup> lookups = new ArrayList<>();
  private final Set<Column> equalityColumns = new LinkedHashSet<>();
  private final Set<Column> constantColumns = new LinkedHashSet<>();

  public Column fixedColumn() {
    return Column.fixed(fixedCount++);
  }

  public Column adviceColumn() {
    return Column.advice(adviceCount++);
  }

  public Column instanceColumn() {
    return Column.instance(instanceCount++);
  }

  /** Allocates a simple selector. */
  public Selector selector() {
    return addSelector(true);
  }

  /** Allocates a selector that may appear anywhere in a polynomial. */
  public Selector complexSelector() {
    return addSelector(false);
  }

  private Selector addSelector(boolean simple) {
    final Selector selector = Selector.of(selectors.size(), simple);
    selectors.add(selector);
    return selector;
  }

  /** Allocates a challenge that is usable after the given phase. */
  public Challenge challengeUsableAfter(int phase) {
    final Challenge challenge = Challenge.of(challenges.size(), phase);
    challenges.add(challenge);
    return challenge;
  }

  /** Allows a column to take part in equality constraints. */
  public void enableEquality(Column column) {
    equalityColumns.add(column);
  }

  /** Allows a fixed column to hold constants for
   * {@code constrainConstant}. */
  public void enableConstant(Column column) {
    checkArgument(column.isFixed(), "not a fixed column: %s", column);
    constantColumns.add(column);
    equalityColumns.add(column);
  }

  public Gate createGate(String name, List<Expression> polynomials) {
    checkArgument(!polynomials.isEmpty(), "gate '%s' has no polynomials",
        name);
    final Gate gate = new Gate(name, polynomials);
    gates.add(gate);
    return gate;
  }

  public Gate createGate(String name, Expression... polynomials) {
    return createGate(name, Arrays.asList(polynomials));
  }

  public Lookup lookup(String name, List<Expression> inputs,
      List<Expression> tables) {
    final Lookup lookup = new Lookup(lookups.size(), name, inputs, tables);
    lookups.add(lookup);
    return lookup;
  }

  public int fixedCount() {
    return fixedCount;
  }

  public int adviceCount() {
    return adviceCount;
  }

  public int instanceCount() {
    return instanceCount;
  }

  public ImmutableList<Selector> selectors() {
    return ImmutableList.copyOf(selectors);
  }

  public ImmutableList<Challenge> challenges() {
    return ImmutableList.copyOf(challenges);
  }

  public ImmutableList<Gate> gates() {
    return ImmutableList.copyOf(gates);
  }

  public ImmutableList<Lookup> lookups() {
    return ImmutableList.copyOf(lookups);
  }

  public ImmutableSet<Column> equalityColumns() {
    return ImmutableSet.copyOf(equalityColumns);
  }

  public ImmutableSet<Column> constantColumns() {
    return ImmutableSet.copyOf(constantColumns);
  }
}

// End ConstraintSystem.java
