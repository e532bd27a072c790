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
package net.hydromatic.plonkir.ir;

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.plonkir.circuit.Column;

/**
 * Identity of a variable in a generated function.
 *
 * <p>A variable is an argument, an output field, a cell of the circuit that
 * is local to the function, a temporary, an output of a call, the output of
 * a table lookup, or a challenge.
 */
public abstract class FuncIO {
  public final Kind kind;

  FuncIO(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  public static Arg arg(int n) {
    return new Arg(n);
  }

  public static Field field(int n) {
    return new Field(n);
  }

  public static Fixed fixed(Column column, int row) {
    return new Fixed(column, row);
  }

  public static Advice advice(Column column, int row, int offset) {
    return new Advice(column, row, offset);
  }

  public static Temp temp(int id) {
    return new Temp(id);
  }

  public static CallOutput callOutput(int callNo, int n) {
    return new CallOutput(callNo, n);
  }

  public static TableLookup tableLookup(int id, int column, int row, int idx,
      int region) {
    return new TableLookup(id, column, row, idx, region);
  }

  public static Challenge challenge(int index, int phase, Arg arg) {
    return new Challenge(index, phase, arg);
  }

  /** Kind of variable. */
  public enum Kind {
    ARG, FIELD, FIXED, ADVICE, TEMP, CALL_OUTPUT, TABLE_LOOKUP, CHALLENGE
  }

  /** The n-th argument of the function. */
  public static final class Arg extends FuncIO {
    public final int n;

    Arg(int n) {
      super(Kind.ARG);
      this.n = n;
    }

    @Override public int hashCode() {
      return n;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Arg
          && n == ((Arg) o).n;
    }

    @Override public String toString() {
      return "arg" + n;
    }
  }

  /** The n-th output field of the function. */
  public static final class Field extends FuncIO {
    public final int n;

    Field(int n) {
      super(Kind.FIELD);
      this.n = n;
    }

    @Override public int hashCode() {
      return 31 + n;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Field
          && n == ((Field) o).n;
    }

    @Override public String toString() {
      return "field" + n;
    }
  }

  /** Cell of a fixed column whose value is not known statically. */
  public static final class Fixed extends FuncIO {
    public final Column column;
    public final int row;

    Fixed(Column column, int row) {
      super(Kind.FIXED);
      this.column = requireNonNull(column);
      this.row = row;
    }

    @Override public int hashCode() {
      return Objects.hash(column, row);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Fixed
          && column.equals(((Fixed) o).column)
          && row == ((Fixed) o).row;
    }

    @Override public String toString() {
      return "fix" + column.index + "_" + row;
    }
  }

  /**
   * Cell of an advice column that is local to the function.
   *
   * <p>{@link #row} is absolute; {@link #offset} is relative to the first
   * row of the enclosing group, and is what symbolic equivalence
   * compares.
   */
  public static final class Advice extends FuncIO {
    public final Column column;
    public final int row;
    public final int offset;

    Advice(Column column, int row, int offset) {
      super(Kind.ADVICE);
      this.column = requireNonNull(column);
      this.row = row;
      this.offset = offset;
    }

    @Override public int hashCode() {
      return Objects.hash(column, row, offset);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Advice
          && column.equals(((Advice) o).column)
          && row == ((Advice) o).row
          && offset == ((Advice) o).offset;
    }

    @Override public String toString() {
      return "adv" + column.index + "_" + row;
    }
  }

  /** Temporary variable. */
  public static final class Temp extends FuncIO {
    public final int id;

    Temp(int id) {
      super(Kind.TEMP);
      this.id = id;
    }

    @Override public int hashCode() {
      return 63 + id;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Temp
          && id == ((Temp) o).id;
    }

    @Override public String toString() {
      return "t" + id;
    }
  }

  /** The n-th output of the call numbered {@code callNo}. */
  public static final class CallOutput extends FuncIO {
    public final int callNo;
    public final int n;

    CallOutput(int callNo, int n) {
      super(Kind.CALL_OUTPUT);
      this.callNo = callNo;
      this.n = n;
    }

    @Override public int hashCode() {
      return Objects.hash(callNo, n);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof CallOutput
          && callNo == ((CallOutput) o).callNo
          && n == ((CallOutput) o).n;
    }

    @Override public String toString() {
      return "call" + callNo + "_out" + n;
    }
  }

  /**
   * Value produced by a table lookup.
   *
   * <p>{@link #id} identifies the lookup, {@link #column} the table column,
   * {@link #idx} the position of the value among the lookup's outputs;
   * {@link #row} and {@link #region} locate the evaluation.
   */
  public static final class TableLookup extends FuncIO {
    public final int id;
    public final int column;
    public final int row;
    public final int idx;
    public final int region;

    TableLookup(int id, int column, int row, int idx, int region) {
      super(Kind.TABLE_LOOKUP);
      this.id = id;
      this.column = column;
      this.row = row;
      this.idx = idx;
      this.region = region;
    }

    @Override public int hashCode() {
      return Objects.hash(id, column, row, idx, region);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TableLookup
          && id == ((TableLookup) o).id
          && column == ((TableLookup) o).column
          && row == ((TableLookup) o).row
          && idx == ((TableLookup) o).idx
          && region == ((TableLookup) o).region;
    }

    @Override public String toString() {
      return "lookup" + id + "_" + column + "_" + row + "_" + idx;
    }
  }

  /** Challenge, passed to the function as an argument. */
  public static final class Challenge extends FuncIO {
    public final int index;
    public final int phase;
    public final Arg arg;

    Challenge(int index, int phase, Arg arg) {
      super(Kind.CHALLENGE);
      this.index = index;
      this.phase = phase;
      this.arg = requireNonNull(arg);
    }

    @Override public int hashCode() {
      return Objects.hash(index, phase, arg);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Challenge
          && index == ((Challenge) o).index
          && phase == ((Challenge) o).phase
          && arg.equals(((Challenge) o).arg);
    }

    @Override public String toString() {
      return "challenge" + index;
    }
  }
}

// End FuncIO.java
