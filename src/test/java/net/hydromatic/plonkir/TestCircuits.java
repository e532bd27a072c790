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
package net.hydromatic.plonkir;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plonkir.circuit.AssignedCell;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Challenge;
import net.hydromatic.plonkir.circuit.Circuit;
import net.hydromatic.plonkir.circuit.CircuitIO;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.ColumnType;
import net.hydromatic.plonkir.circuit.ConstraintSystem;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.group.GroupKey;
import net.hydromatic.plonkir.synthesis.Layouter;

/** Small circuits used by the tests. */
public abstract class TestCircuits {
  private TestCircuits() {}

  /** Configuration with advice columns {@code a}, {@code b}, {@code c} and
   * a selector {@code s}. */
  public static class AbcConfig {
    public final Column a;
    public final Column b;
    public final Column c;
    public final Selector s;

    AbcConfig(ConstraintSystem cs) {
      a = cs.adviceColumn();
      b = cs.adviceColumn();
      c = cs.adviceColumn();
      s = cs.selector();
    }
  }

  /** Circuit with gate {@code s * (a + b - c)}, one region of one row,
   * inputs {@code a} and {@code b} and output {@code c}. */
  public static class Adder implements Circuit<AbcConfig> {
    @Override public AbcConfig configure(ConstraintSystem cs) {
      final AbcConfig config = new AbcConfig(cs);
      cs.createGate("add",
          config.s.expr()
              .times(config.a.cur().plus(config.b.cur())
                  .minus(config.c.cur())));
      return config;
    }

    @Override public void synthesize(AbcConfig config, Layouter layouter) {
      layouter.assignRegion("add", region -> {
        region.assignAdvice("a", config.a, 0);
        region.assignAdvice("b", config.b, 0);
        region.assignAdvice("c", config.c, 0);
        region.enableSelector("s", config.s, 0);
        return null;
      });
    }

    @Override public CircuitIO adviceIo(AbcConfig config) {
      return CircuitIO.of(ColumnType.ADVICE,
          ImmutableList.of(Cell.of(config.a, 0), Cell.of(config.b, 0)),
          ImmutableList.of(Cell.of(config.c, 0)));
    }
  }

  /** Circuit with gate {@code s * (a - b)} over a region of
   * {@code height} rows, in which the selector is enabled only at the first
   * row. */
  public static class SparseSelector implements Circuit<AbcConfig> {
    private final int height;

    public SparseSelector(int height) {
      this.height = height;
    }

    @Override public AbcConfig configure(ConstraintSystem cs) {
      final AbcConfig config = new AbcConfig(cs);
      cs.createGate("eq",
          config.s.expr().times(config.a.cur().minus(config.b.cur())));
      return config;
    }

    @Override public void synthesize(AbcConfig config, Layouter layouter) {
      layouter.assignRegion("rows", region -> {
        for (int i = 0; i < height; i++) {
          region.assignAdvice("a", config.a, i);
          region.assignAdvice("b", config.b, i);
        }
        region.enableSelector("s", config.s, 0);
        return null;
      });
    }
  }

  /** Circuit that calls the same group twice. The group has gate
   * {@code s * (a + a - b)}, input {@code a} and output {@code b}.
   *
   * <p>If {@code distinctKeys}, the two groups have different keys, and
   * so cannot share a function. */
  public static class TwoDoublers implements Circuit<AbcConfig> {
    private final boolean distinctKeys;

    public TwoDoublers(boolean distinctKeys) {
      this.distinctKeys = distinctKeys;
    }

    @Override public AbcConfig configure(ConstraintSystem cs) {
      final AbcConfig config = new AbcConfig(cs);
      cs.createGate("double",
          config.s.expr()
              .times(config.a.cur().plus(config.a.cur())
                  .minus(config.b.cur())));
      return config;
    }

    @Override public void synthesize(AbcConfig config, Layouter layouter) {
      for (int i = 0; i < 2; i++) {
        final GroupKey key =
            GroupKey.of(distinctKeys ? "double" + i : "double");
        layouter.group("double", key, l -> {
          final List<AssignedCell> cells =
              l.assignRegion("double", region -> {
                final AssignedCell a = region.assignAdvice("a", config.a, 0);
                final AssignedCell b = region.assignAdvice("b", config.b, 0);
                region.enableSelector("s", config.s, 0);
                return ImmutableList.of(a, b);
              });
          l.annotateInput(cells.get(0));
          l.annotateOutput(cells.get(1));
          return null;
        });
      }
    }
  }

  /**
   * Circuit in which group "B" calls group "A", and an equality constraint
   * connects a cell of A's region to a cell of B's region.
   *
   * <p>A owns region 0 (rows 0 and 1); B owns region 1 (rows 2 and 3). The
   * constraint is between {@code a} at rows 1 and 2.
   */
  public static class Nested implements Circuit<AbcConfig> {
    @Override public AbcConfig configure(ConstraintSystem cs) {
      final AbcConfig config = new AbcConfig(cs);
      cs.enableEquality(config.a);
      return config;
    }

    @Override public void synthesize(AbcConfig config, Layouter layouter) {
      layouter.group("B", GroupKey.of("B"), outer -> {
        final AssignedCell inner =
            outer.group("A", GroupKey.of("A"), l ->
                l.assignRegion("r1", region -> {
                  region.assignAdvice("a0", config.a, 0);
                  return region.assignAdvice("a1", config.a, 1);
                }));
        outer.assignRegion("r2", region -> {
          final AssignedCell a2 = region.assignAdvice("a2", config.a, 0);
          region.assignAdvice("a3", config.a, 1);
          region.constrainEqual(inner, a2);
          return null;
        });
        return null;
      });
    }
  }

  /** Configuration with an advice column and a fixed column that holds a
   * table. */
  public static class TableConfig {
    public final Column a;
    public final Column t;

    TableConfig(ConstraintSystem cs) {
      a = cs.adviceColumn();
      t = cs.fixedColumn();
    }
  }

  /** Circuit with a lookup of {@code a} in a table of the values 0 to 3.
   * The region has {@code height} rows. */
  public static class RangeCheck implements Circuit<TableConfig> {
    private final int height;

    public RangeCheck(int height) {
      this.height = height;
    }

    @Override public TableConfig configure(ConstraintSystem cs) {
      final TableConfig config = new TableConfig(cs);
      cs.lookup("range", ImmutableList.of(config.a.cur()),
          ImmutableList.of(config.t.cur()));
      return config;
    }

    @Override public void synthesize(TableConfig config, Layouter layouter) {
      layouter.assignTable("range table", table -> {
        for (int i = 0; i < 4; i++) {
          table.assignCell("t", config.t, i, Felt.of(i));
        }
      });
      layouter.assignRegion("values", region -> {
        for (int i = 0; i < height; i++) {
          region.assignAdvice("a", config.a, i);
        }
        return null;
      });
    }
  }

  /** Circuit with two lookups into the same table, {@code a} and
   * {@code a + a}, over two regions of one row each. Both lookups are of
   * the same kind. */
  public static class TwoRangeChecks implements Circuit<TableConfig> {
    @Override public TableConfig configure(ConstraintSystem cs) {
      final TableConfig config = new TableConfig(cs);
      cs.lookup("small", ImmutableList.of(config.a.cur()),
          ImmutableList.of(config.t.cur()));
      cs.lookup("twice", ImmutableList.of(config.a.cur().plus(config.a.cur())),
          ImmutableList.of(config.t.cur()));
      return config;
    }

    @Override public void synthesize(TableConfig config, Layouter layouter) {
      layouter.assignTable("range table", table -> {
        for (int i = 0; i < 4; i++) {
          table.assignCell("t", config.t, i, Felt.of(i));
        }
      });
      for (String name : ImmutableList.of("lo", "hi")) {
        layouter.assignRegion(name, region ->
            region.assignAdvice("a", config.a, 0));
      }
    }
  }

  /** Circuit with gate {@code s * (a - r)}, where {@code r} is a challenge,
   * and one region of one row. */
  public static class RandomCheck implements Circuit<AbcConfig> {
    @Override public AbcConfig configure(ConstraintSystem cs) {
      final AbcConfig config = new AbcConfig(cs);
      final Challenge r = cs.challengeUsableAfter(0);
      cs.createGate("random",
          config.s.expr()
              .times(config.a.cur().minus(Expression.challenge(r))));
      return config;
    }

    @Override public void synthesize(AbcConfig config, Layouter layouter) {
      layouter.assignRegion("random", region -> {
        region.assignAdvice("a", config.a, 0);
        region.enableSelector("s", config.s, 0);
        return null;
      });
    }
  }

  /** Circuit that constrains an advice cell to equal the constant 5. */
  public static class Constant implements Circuit<TableConfig> {
    @Override public TableConfig configure(ConstraintSystem cs) {
      final TableConfig config = new TableConfig(cs);
      cs.enableEquality(config.a);
      cs.enableConstant(config.t);
      return config;
    }

    @Override public void synthesize(TableConfig config, Layouter layouter) {
      layouter.assignRegion("r", region ->
          region.assignAdviceFromConstant("a", config.a, 0, Felt.of(5)));
    }
  }
}

// End TestCircuits.java
