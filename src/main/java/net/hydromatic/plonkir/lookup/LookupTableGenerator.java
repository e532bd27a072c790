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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Lookup;
import net.hydromatic.plonkir.synthesis.TableData;

/**
 * Produces the rows of the table that a lookup reads.
 *
 * <p>The table is computed on first use and then remembered for the rest
 * of the compilation. Each row holds one value per column, in the order of
 * {@link #columns()}.
 */
public class LookupTableGenerator {
  private final ImmutableList<Column> columns;
  private final Supplier<ImmutableList<ImmutableList<Felt>>> table;

  public LookupTableGenerator(TableData tableData, Lookup lookup) {
    this(tableData, lookup.tableColumns());
  }

  public LookupTableGenerator(TableData tableData, List<Column> columns) {
    requireNonNull(tableData);
    this.columns = ImmutableList.copyOf(columns);
    this.table = Suppliers.memoize(() -> tableData.rows(this.columns));
  }

  public ImmutableList<Column> columns() {
    return columns;
  }

  /** Returns the rows of the table. */
  public ImmutableList<ImmutableList<Felt>> table() {
    return table.get();
  }

  /** Returns the value of a column in a row of the table. */
  public Felt value(int row, Column column) {
    final int i = columns.indexOf(column);
    if (i < 0) {
      throw new IllegalArgumentException("Column " + column
          + " is not part of the table");
    }
    return table().get(row).get(i);
  }
}

// End LookupTableGenerator.java
