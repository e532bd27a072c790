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

import static java.util.Objects.requireNonNull;

import java.util.Collection;
import java.util.Optional;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Challenge;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.ir.FuncIO;
import net.hydromatic.plonkir.synthesis.RegionData;

/**
 * Resolves queries at a row of a region.
 *
 * <p>Fixed cells are looked up in the values the region wrote before the
 * circuit-wide values. Selectors resolve to whether the region enabled
 * them at the row. Everything else is resolved as by {@link RowResolver}.
 */
public class RegionRowResolver implements QueryResolver, SelectorResolver {
  public final RegionData region;
  public final RowResolver row;

  public RegionRowResolver(RegionData region, RowResolver row) {
    this.region = requireNonNull(region);
    this.row = requireNonNull(row);
  }

  @Override public ResolvedQuery resolveQuery(Expression.Query query) {
    if (query.column.isFixed()) {
      final Cell cell =
          Cell.of(query.column, row.resolveRotation(query.rotation));
      final Optional<Felt> value = region.fixedData().lookup(cell);
      if (value.isPresent()) {
        return ResolvedQuery.lit(value.get());
      }
    }
    return row.resolveQuery(query);
  }

  @Override public FuncIO resolveChallenge(Challenge challenge) {
    return row.resolveChallenge(challenge);
  }

  @Override public ResolvedSelector resolveSelector(Selector selector) {
    return ResolvedSelector.lit(region.isEnabled(selector, row.row));
  }

  /** Returns whether none of the given selectors is enabled at this row;
   * true if {@code selectors} is empty. */
  public boolean gateIsDisabled(Collection<Selector> selectors) {
    for (Selector selector : selectors) {
      if (region.isEnabled(selector, row.row)) {
        return false;
      }
    }
    return true;
  }
}

// End RegionRowResolver.java
