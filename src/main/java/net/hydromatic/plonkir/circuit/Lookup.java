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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Constraint that the tuple of {@link #inputs}, evaluated at a row, equals
 * some row of the table formed by the fixed columns queried in
 * {@link #tables}.
 */
public final class Lookup {
  /** Position in the constraint system's list of lookups. */
  public final int index;
  public final String name;
  public final ImmutableList<Expression> inputs;
  public final ImmutableList<Expression> tables;

  public Lookup(int index, String name, List<Expression> inputs,
      List<Expression> tables) {
    this.index = index;
    this.name = requireNonNull(name);
    this.inputs = ImmutableList.copyOf(inputs);
    this.tables = ImmutableList.copyOf(tables);
    checkArgument(this.inputs.size() == this.tables.size(),
        "lookup '%s' has %s inputs but %s table expressions", name,
        this.inputs.size(), this.tables.size());
    for (Expression table : this.tables) {
      checkArgument(table.op == Expression.Op.FIXED,
          "Table row expressions can only be fixed cell queries: %s", table);
    }
  }

  /** Returns the table side of each pair as a fixed-column query. */
  public ImmutableList<Expression.Query> tableQueries() {
    final ImmutableList.Builder<Expression.Query> b = ImmutableList.builder();
    tables.forEach(e -> b.add((Expression.Query) e));
    return b.build();
  }

  /** Returns the fixed columns that make up the table. */
  public ImmutableList<Column> tableColumns() {
    final ImmutableList.Builder<Column> b = ImmutableList.builder();
    tables.forEach(e -> b.add(((Expression.Query) e).column));
    return b.build();
  }

  /** Returns the input expression that is matched against a table column. */
  public Expression inputForColumn(Column column) {
    for (int i = 0; i < tables.size(); i++) {
      if (((Expression.Query) tables.get(i)).column.equals(column)) {
        return inputs.get(i);
      }
    }
    throw new IllegalArgumentException("Column " + column + " not found");
  }

  @Override public String toString() {
    return "Lookup " + index + " '" + name + "'";
  }
}

// End Lookup.java
