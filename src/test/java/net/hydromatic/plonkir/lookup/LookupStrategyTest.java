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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.plonkir.RecordingBackend;
import net.hydromatic.plonkir.TestCircuits;
import net.hydromatic.plonkir.backend.LoweringException;
import net.hydromatic.plonkir.circuit.CircuitIO;
import net.hydromatic.plonkir.circuit.Column;
import net.hydromatic.plonkir.circuit.ColumnType;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Lookup;
import net.hydromatic.plonkir.compile.Tracers;
import net.hydromatic.plonkir.ir.Stmt;
import net.hydromatic.plonkir.resolve.RegionRowResolver;
import net.hydromatic.plonkir.resolve.RowResolver;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;
import net.hydromatic.plonkir.synthesis.Synthesizer;
import org.junit.jupiter.api.Test;

/** Tests the implementations of {@link LookupStrategy}, and
 * {@link LookupKind}. */
class LookupStrategyTest {
  /** Lookup of advice column {@code a} in a table of the values 0 to 3. */
  private final CircuitSynthesis synthesis =
      Synthesizer.synthesize(new TestCircuits.RangeCheck(2), Tracers.empty());
  private final Lookup lookup = synthesis.cs.lookups().get(0);

  /** Returns the scope of the lookup at row 1 of the "values" region. */
  private LookupScope scope() {
    final RowResolver row =
        new RowResolver(1, CircuitIO.empty(ColumnType.ADVICE),
            CircuitIO.empty(ColumnType.INSTANCE), cell -> Optional.empty(),
            0);
    return new LookupScope(
        new RegionRowResolver(synthesis.regions.get(0), row),
        new LookupTableGenerator(synthesis.tableData, lookup));
  }

  @Test void testTableGenerator() {
    final LookupTableGenerator table = scope().table;
    assertThat(table.columns(), is(ImmutableList.of(Column.fixed(0))));
    assertThat(table.table(), hasSize(4));
    assertThat(table.table(), sameInstance(table.table()));
    assertThat(table.value(3, Column.fixed(0)), is(Felt.of(3)));
    assertThrows(IllegalArgumentException.class, () ->
        table.value(0, Column.fixed(1)));
  }

  @Test void testRowConstraint() {
    final LookupScope scope = scope();
    assertThat(scope, hasToString("region 0 'values' @ row 1"));
    assertThat(new LookupAsRowConstraint().lower(lookup, scope),
        hasToString("assert ((0 == adv0_1) || (1 == adv0_1) || (2 == adv0_1)"
            + " || (3 == adv0_1))"));
  }

  /** Each lookup at each row gets its own output variable, which is
   * constrained to equal the lookup's input. */
  @Test void testModule() {
    final InvokeLookupAsModule strategy =
        new InvokeLookupAsModule(synthesis.cs.lookups());
    assertThat(strategy.kinds(), hasToString("[lookup0_range]"));
    assertThat(strategy.lower(lookup, scope()).flatten(),
        hasToString("[[lookup0_0_1_0] = call lookup0_range[], "
            + "constrain lookup0_0_1_0 == adv0_1]"));

    final RecordingBackend backend = new RecordingBackend();
    strategy.defineModules(backend, synthesis);
    assertThat(backend.names(), is(ImmutableList.of("lookup0_range")));
    assertThat(backend.header("lookup0_range"),
        is("function lookup0_range[] -> [field0]"));
    assertThat(backend.body("lookup0_range"),
        is(
            ImmutableList.of("assume_deterministic field0",
                "assert (((0 == field0 || 1 == field0) || 2 == field0)"
                    + " || 3 == field0)")));
  }

  @Test void testCallbacks() {
    final LoweringException e =
        assertThrows(LoweringException.class, () ->
            new CallbacksLookupStrategy(LookupCallbacks.DEFAULT)
                .lower(lookup, scope()));
    assertThat(e.getMessage(),
        is("Target circuit has lookups but their behaviour was not "
            + "specified"));

    final LookupCallbacks callbacks = new LookupCallbacks() {
      @Override public Stmt<Expression> onLookup(Lookup lookup,
          LookupTableGenerator table) {
        final Column t = table.columns().get(0);
        return Stmt.eq(lookup.inputForColumn(t),
            Expression.constant(table.value(2, t)));
      }
    };
    assertThat(new CallbacksLookupStrategy(callbacks).lower(lookup, scope()),
        hasToString("constrain adv0_1 == 2"));
  }

  /** Lookups share a kind if they read the same columns and have fixed
   * queries in the same inputs. */
  @Test void testKinds() {
    final Column a = Column.advice(0);
    final Column f = Column.fixed(1);
    final Column t = Column.fixed(0);
    final Column u = Column.fixed(2);
    final ImmutableList<Expression> tu = ImmutableList.of(t.cur(), u.cur());
    final Lookup l0 = new Lookup(0, "x", ImmutableList.of(a.cur(), f.cur()),
        tu);
    final Lookup l1 = new Lookup(1, "y",
        ImmutableList.of(a.query(1), f.cur().plus(a.cur())), tu);
    final Lookup l2 = new Lookup(2, "z", ImmutableList.of(a.cur(), a.cur()),
        tu);
    final Map<Integer, LookupKind> kinds =
        LookupKind.assign(ImmutableList.of(l0, l1, l2));
    assertThat(kinds.get(1), sameInstance(kinds.get(0)));
    assertThat(kinds.get(2).id, is(1));
    assertThat(kinds.get(2).moduleName(), is("lookup1_z"));

    final LookupKind kind = kinds.get(0);
    assertThat(kind.inputCount(), is(1));
    assertThat(kind.outputCount(), is(1));
    assertThat(kind.arguments(l1), hasToString("[(fixed[1]@cur + "
        + "advice[0]@cur)]"));
    assertThat(kind.results(l1), hasToString("[advice[0]@+1]"));
    assertThrows(IllegalArgumentException.class, () ->
        new Lookup(3, "bad", ImmutableList.of(a.cur()),
            ImmutableList.of(a.cur())));
  }
}

// End LookupStrategyTest.java
