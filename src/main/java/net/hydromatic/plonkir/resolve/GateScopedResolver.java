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
package net.hydromatic.plonkir.resolve;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plonkir.circuit.Challenge;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Gate;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.ir.FuncIO;

/**
 * Resolves queries inside a function that implements one gate.
 *
 * <p>The function's arguments are the gate's selectors, then its queries.
 * Challenges are not declared arguments; they resolve to a
 * {@link FuncIO.Challenge} whose position follows the declared
 * arguments, the same numbering the main function uses.
 */
public class GateScopedResolver implements QueryResolver, SelectorResolver {
  private final ImmutableList<Selector> selectors;
  private final ImmutableList<Expression.Query> queries;

  public GateScopedResolver(List<Selector> selectors,
      List<Expression.Query> queries) {
    this.selectors = ImmutableList.copyOf(selectors);
    this.queries = ImmutableList.copyOf(queries);
  }

  public static GateScopedResolver of(Gate gate) {
    return new GateScopedResolver(gate.selectors(), gate.queries());
  }

  /** Returns the number of arguments, not counting challenges. */
  public int argCount() {
    return selectors.size() + queries.size();
  }

  @Override public ResolvedSelector resolveSelector(Selector selector) {
    final int i = selectors.indexOf(selector);
    if (i < 0) {
      throw new ResolutionException("Selector " + selector
          + " is not an argument of the gate");
    }
    return ResolvedSelector.io(FuncIO.arg(i));
  }

  @Override public ResolvedQuery resolveQuery(Expression.Query query) {
    final int i = queries.indexOf(query);
    if (i < 0) {
      throw new ResolutionException("Query " + query
          + " is not an argument of the gate");
    }
    return ResolvedQuery.io(FuncIO.arg(selectors.size() + i));
  }

  @Override public FuncIO resolveChallenge(Challenge challenge) {
    return FuncIO.challenge(challenge.index, challenge.phase,
        FuncIO.arg(argCount() + challenge.index));
  }
}

// End GateScopedResolver.java
