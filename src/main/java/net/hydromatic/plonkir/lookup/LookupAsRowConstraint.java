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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.plonkir.backend.Backend;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Lookup;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.BExpr;
import net.hydromatic.plonkir.ir.CmpOp;
import net.hydromatic.plonkir.ir.Stmt;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;

/** Lowers each lookup to an assertion that some row of the table equals the
 * lookup's inputs. */
public class LookupAsRowConstraint implements LookupStrategy {
  @Override public <E> void defineModules(Backend<E> backend,
      CircuitSynthesis synthesis) {
  }

  @Override public Stmt<AExpr> lower(Lookup lookup, LookupScope scope) {
    final List<AExpr> inputs = new ArrayList<>();
    lookup.inputs.forEach(e -> inputs.add(scope.lower(e)));
    final ImmutableList.Builder<BExpr<AExpr>> rows = ImmutableList.builder();
    for (List<Felt> row : scope.table.table()) {
      final ImmutableList.Builder<BExpr<AExpr>> cells =
          ImmutableList.builder();
      for (int i = 0; i < row.size(); i++) {
        cells.add(
            BExpr.cmp(CmpOp.EQ, AExpr.constant(row.get(i)), inputs.get(i)));
      }
      rows.add(BExpr.and(cells.build()));
    }
    return Stmt.assertion(BExpr.or(rows.build()));
  }
}

// End LookupAsRowConstraint.java
