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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.plonkir.backend.Backend;
import net.hydromatic.plonkir.backend.Lowerer;
import net.hydromatic.plonkir.backend.Lowering;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Lookup;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.BExpr;
import net.hydromatic.plonkir.ir.CmpOp;
import net.hydromatic.plonkir.ir.FuncIO;
import net.hydromatic.plonkir.ir.Stmt;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;

/**
 * Lowers lookups to calls to one function per {@link LookupKind}.
 *
 * <p>The function takes the inputs that contain fixed queries as arguments
 * and returns the others. Its body assumes the outputs deterministic and
 * asserts that arguments and outputs together equal some row of the table.
 * At each call, the outputs become {@link FuncIO.TableLookup} variables that
 * are unique to the lookup, row and region, and are constrained to equal
 * the lookup's inputs.
 */
public class InvokeLookupAsModule implements LookupStrategy {
  private final ImmutableMap<Integer, LookupKind> kinds;

  public InvokeLookupAsModule(List<Lookup> lookups) {
    this.kinds = LookupKind.assign(lookups);
  }

  /** Returns the kinds, in order of their ids. */
  public ImmutableList<LookupKind> kinds() {
    final Set<LookupKind> set = new LinkedHashSet<>(kinds.values());
    return ImmutableList.copyOf(set);
  }

  public LookupKind kind(Lookup lookup) {
    final LookupKind kind = kinds.get(lookup.index);
    if (kind == null) {
      throw new IllegalArgumentException("Unknown " + lookup);
    }
    return kind;
  }

  @Override public <E> void defineModules(Backend<E> backend,
      CircuitSynthesis synthesis) {
    for (LookupKind kind : kinds()) {
      final List<FuncIO> inputs = new ArrayList<>();
      for (int i = 0; i < kind.inputCount(); i++) {
        inputs.add(FuncIO.arg(i));
      }
      final List<FuncIO> outputs = new ArrayList<>();
      for (int i = 0; i < kind.outputCount(); i++) {
        outputs.add(FuncIO.field(i));
      }
      final Lowering<E> scope =
          backend.defineFunction(kind.moduleName(), inputs, outputs);
      final LookupTableGenerator table =
          new LookupTableGenerator(synthesis.tableData, kind.columns);
      Lowerer.lower(body(kind, table, outputs), scope);
      backend.onScopeEnd(scope);
    }
  }

  /** Returns the body of the function for a kind of lookup. */
  static Stmt<AExpr> body(LookupKind kind, LookupTableGenerator table,
      List<FuncIO> outputs) {
    final List<Stmt<AExpr>> stmts = new ArrayList<>();
    outputs.forEach(o -> stmts.add(Stmt.assumeDeterministic(o)));

    // The variable that each column is matched against.
    final List<AExpr> vars = new ArrayList<>();
    int arg = 0;
    int field = 0;
    for (boolean fixed : kind.fixedInputs) {
      vars.add(AExpr.io(fixed ? FuncIO.arg(arg++) : FuncIO.field(field++)));
    }
    final ImmutableList.Builder<BExpr<AExpr>> rows = ImmutableList.builder();
    for (List<Felt> row : table.table()) {
      final ImmutableList.Builder<BExpr<AExpr>> cells =
          ImmutableList.builder();
      for (int i = 0; i < row.size(); i++) {
        cells.add(BExpr.cmp(CmpOp.EQ, AExpr.constant(row.get(i)),
            vars.get(i)));
      }
      rows.add(BExpr.and(cells.build()));
    }
    stmts.add(Stmt.assertion(BExpr.or(rows.build())));
    return Stmt.seq(stmts);
  }

  @Override public Stmt<AExpr> lower(Lookup lookup, LookupScope scope) {
    final LookupKind kind = kind(lookup);
    final List<AExpr> inputs = new ArrayList<>();
    kind.arguments(lookup).forEach(e -> inputs.add(scope.lower(e)));

    final List<FuncIO> vars = new ArrayList<>();
    final List<Stmt<AExpr>> constraints = new ArrayList<>();
    for (int i = 0; i < lookup.inputs.size(); i++) {
      if (kind.fixedInputs.get(i)) {
        continue;
      }
      final Column column = lookup.tableColumns().get(i);
      final FuncIO var =
          FuncIO.tableLookup(kind.id, column.index, scope.row(),
              lookup.index, scope.region().index);
      final Expression input = lookup.inputs.get(i);
      vars.add(var);
      constraints.add(
          Stmt.constraint(CmpOp.EQ, AExpr.io(var), scope.lower(input)));
    }
    return Stmt.seq(
        ImmutableList.<Stmt<AExpr>>builder()
            .add(Stmt.call(kind.moduleName(), inputs, vars))
            .addAll(constraints)
            .build());
  }
}

// End InvokeLookupAsModule.java
