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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Named list of polynomials that must evaluate to zero on every row. */
public final class Gate {
  public final String name;
  public final ImmutableList<Expression> polynomials;

  public Gate(String name, List<Expression> polynomials) {
    this.name = requireNonNull(name);
    this.polynomials = ImmutableList.copyOf(polynomials);
  }

  /** Returns the distinct selectors used by the polynomials. */
  public ImmutableList<Selector> selectors() {
    final Set<Selector> set = new LinkedHashSet<>();
    polynomials.forEach(p -> set.addAll(p.selectors()));
    return ImmutableList.copyOf(set);
  }

  /** Returns the distinct queries used by the polynomials. */
  public ImmutableList<Expression.Query> queries() {
    final Set<Expression.Query> set = new LinkedHashSet<>();
    polynomials.forEach(p -> set.addAll(p.queries()));
    return ImmutableList.copyOf(set);
  }

  @Override public String toString() {
    return "gate '" + name + "' " + polynomials;
  }
}

// End Gate.java
