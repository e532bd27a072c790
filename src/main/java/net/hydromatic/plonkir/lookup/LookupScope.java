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

import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.expr.ExpressionLowering;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.Stmt;
import net.hydromatic.plonkir.resolve.RegionRowResolver;
import net.hydromatic.plonkir.synthesis.RegionData;

/** A row of a region at which a lookup is evaluated, and the table the
 * lookup reads. */
public class LookupScope {
  public final RegionRowResolver resolver;
  public final LookupTableGenerator table;

  public LookupScope(RegionRowResolver resolver, LookupTableGenerator table) {
    this.resolver = requireNonNull(resolver);
    this.table = requireNonNull(table);
  }

  public RegionData region() {
    return resolver.region;
  }

  public int row() {
    return resolver.row.row;
  }

  /** Lowers an expression at this row. */
  public AExpr lower(Expression e) {
    return ExpressionLowering.lower(e, resolver, resolver);
  }

  /** Lowers every expression in a statement at this row. */
  public Stmt<AExpr> lower(Stmt<Expression> stmt) {
    return stmt.map(this::lower);
  }

  @Override public String toString() {
    return "region " + region().index + " '" + region().name + "' @ row "
        + row();
  }
}

// End LookupScope.java
