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

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifies a storage column of the circuit.
 *
 * <p>A column of any kind plays the role of {@code Column<Any>}; methods that
 * need a particular kind check {@link #type}.
 */
public final class Column implements Comparable<Column> {
  private static final Comparator<Column> COMPARATOR =
      Comparator.comparing((Column c) -> c.type)
          .thenComparingInt(c -> c.index);

  public final ColumnType type;
  public final int index;

  private Column(ColumnType type, int index) {
    this.type = requireNonNull(type);
    this.index = index;
  }

  public static Column of(ColumnType type, int index) {
    return new Column(type, index);
  }

  public static Column fixed(int index) {
    return new Column(ColumnType.FIXED, index);
  }

  public static Column advice(int index) {
    return new Column(ColumnType.ADVICE, index);
  }

  public static Column instance(int index) {
    return new Column(ColumnType.INSTANCE, index);
  }

  public boolean isFixed() {
    return type == ColumnType.FIXED;
  }

  public boolean isAdvice() {
    return type == ColumnType.ADVICE;
  }

  public boolean isInstance() {
    return type == ColumnType.INSTANCE;
  }

  /** Returns an expression that queries this column at a given rotation. */
  public Expression query(int rotation) {
    return Expression.query(this, rotation);
  }

  /** Returns an expression that queries this column at the current row. */
  public Expression cur() {
    return query(0);
  }

  @Override public int compareTo(Column o) {
    return COMPARATOR.compare(this, o);
  }

  @Override public int hashCode() {
    return Objects.hash(type, index);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Column
        && type == ((Column) o).type
        && index == ((Column) o).index;
  }

  @Override public String toString() {
    return type.name().toLowerCase(Locale.ROOT) + "[" + index + "]";
  }
}

// End Column.java
