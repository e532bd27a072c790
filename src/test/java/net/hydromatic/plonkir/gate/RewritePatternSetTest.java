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
package net.hydromatic.plonkir.gate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.plonkir.TestCircuits;
import net.hydromatic.plonkir.circuit.CircuitIO;
import net.hydromatic.plonkir.circuit.ColumnType;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.compile.Prop;
import net.hydromatic.plonkir.compile.Tracer;
import net.hydromatic.plonkir.compile.Tracers;
import net.hydromatic.plonkir.expr.ExpressionRewriter;
import net.hydromatic.plonkir.expr.RewriteException;
import net.hydromatic.plonkir.ir.Stmt;
import net.hydromatic.plonkir.resolve.ResolutionException;
import net.hydromatic.plonkir.resolve.RowResolver;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;
import net.hydromatic.plonkir.synthesis.Synthesizer;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests {@link RewritePatternSet}, {@link FallbackGateRewriter} and
 * {@link GateScope}. */
class RewritePatternSetTest {
  private static final String SCOPE =
      "gate 'eq' @ region 0 'rows' @ rows 0..=2";

  private final Map<Prop, Object> props = new EnumMap<>(Prop.class);

  /** Creates a scope for the gate {@code s * (a - b)} in a region of three
   * rows where {@code s} is enabled only at row 0. */
  private GateScope scope(Tracer tracer) {
    final CircuitSynthesis synthesis =
        Synthesizer.synthesize(new TestCircuits.SparseSelector(3),
            Tracers.empty());
    final RowResolver resolver =
        new RowResolver(0, CircuitIO.empty(ColumnType.ADVICE),
            CircuitIO.empty(ColumnType.INSTANCE), cell -> Optional.empty(),
            0);
    return new GateScope(synthesis.cs.gates().get(0),
        synthesis.regions.get(0), resolver, props, tracer);
  }

  private GateScope scope() {
    return scope(Tracers.empty());
  }

  /** Pattern that fails with an error. */
  private static GateRewritePattern failing(String message) {
    return new GateRewritePattern() {
      @Override public Optional<Stmt<RowExpression>> matchAndRewrite(
          GateScope scope) {
        throw RewriteException.error(scope.gateName(),
            ImmutableList.of(message));
      }
    };
  }

  @Test void testScope() {
    final GateScope scope = scope();
    assertThat(scope, hasToString(SCOPE));
    assertThat(scope.rows(), hasToString("[0..2]"));
    assertThat(scope.lower(scope.polynomials().get(0), 0),
        hasToString("(adv0_0 + -adv1_0)"));
    assertThat(scope.lower(scope.polynomials().get(0), 1), hasToString("0"));
    final ResolutionException e =
        assertThrows(ResolutionException.class, () -> scope.regionRow(5));
    assertThat(e.getMessage(),
        is("Row 5 is not within the rows of the scope [0, 2]"));
  }

  @Test void testFallback() {
    final Stmt<RowExpression> all =
        new FallbackGateRewriter(false).rewrite(scope());
    assertThat(all.flatten(), hasSize(3));
    assertThat(all.flatten().get(2),
        hasToString("constrain (s0 * (advice[0]@cur + -advice[1]@cur)) @ 2 "
            + "== 0 @ 2"));
    final Stmt<RowExpression> enabled =
        new FallbackGateRewriter(true).rewrite(scope());
    assertThat(enabled.flatten(), hasSize(1));
    assertThat(((Stmt.Constraint<RowExpression>) enabled.flatten().get(0))
        .left.row, is(0));
  }

  /** The first pattern that matches wins. */
  @Test void testFirstMatchWins() {
    final GateRewritePattern custom = new GateRewritePattern() {
      @Override public boolean match(GateScope scope) {
        return scope.gateName().equals("eq");
      }

      @Override public Stmt<RowExpression> rewrite(GateScope scope) {
        return Stmt.comment("custom " + scope.regionName());
      }
    };
    final GateCallbacks callbacks = new GateCallbacks() {
      @Override public List<GateRewritePattern> patterns() {
        return ImmutableList.of(custom);
      }
    };
    final RewritePatternSet set = RewritePatternSet.load(callbacks, true);
    assertThat(set.patterns(), hasSize(2));
    assertThat(set.patterns().get(1), instanceOf(FallbackGateRewriter.class));
    assertThat(set.rewrite(scope()), hasToString("// custom rows"));
  }

  /** A failure is not reported if a later pattern matches. */
  @Test void testFailureThenMatch() {
    final RewritePatternSet set =
        new RewritePatternSet(
            ImmutableList.of(failing("boom"), new FallbackGateRewriter(true)));
    assertThat(set.rewrite(scope()).flatten(), hasSize(1));
  }

  @Test void testFailures() {
    final RewritePatternSet set =
        new RewritePatternSet(
            ImmutableList.of(failing("boom"), failing("bang")));
    final RewriteException e =
        assertThrows(RewriteException.class, () -> set.rewrite(scope()));
    assertThat(e.kind, is(RewriteException.Kind.ERROR));
    assertThat(e.errors, hasSize(2));
    assertThat(e.getMessage(),
        is("Failed to rewrite " + SCOPE + ": Failed to rewrite eq: boom; "
            + "Failed to rewrite eq: bang"));
  }

  /** A pattern that throws "no match" is skipped silently. */
  @Test void testNoMatch() {
    final GateRewritePattern noMatch = new GateRewritePattern() {
      @Override public Optional<Stmt<RowExpression>> matchAndRewrite(
          GateScope scope) {
        throw RewriteException.noMatch(scope.toString());
      }
    };
    final RewritePatternSet set =
        new RewritePatternSet(ImmutableList.of(noMatch));
    assertThat(set.matchAndRewrite(scope()).isPresent(), is(false));
    final RewriteException e =
        assertThrows(RewriteException.class, () -> set.rewrite(scope()));
    assertThat(e.kind, is(RewriteException.Kind.NO_MATCH));
    assertThat(e.getMessage(), is("No pattern matched " + SCOPE));
  }

  @Test void testIncompletePattern() {
    final GateRewritePattern incomplete = new GateRewritePattern() {
    };
    assertThrows(UnsupportedOperationException.class, () ->
        incomplete.matchAndRewrite(scope()));
  }

  /** The rewriting limits come from the compiler properties. */
  @Test void testRewriteRecursive() {
    final ExpressionRewriter negateQueries =
        ExpressionRewriter.of(new ExpressionRewriter.Rule() {
          @Override public @Nullable Expression query(Expression.Query e) {
            return Expression.negated(e);
          }
        });
    final List<String> warnings = new ArrayList<>();
    final GateScope scope =
        scope(Tracers.withOnWarning(Tracers.empty(), warnings::add));
    final Expression e = scope.polynomials().get(0);
    assertThrows(RewriteException.class, () ->
        scope.rewriteRecursive(negateQueries, e));

    Prop.MAX_REWRITE_ITERATIONS.set(props, 1);
    Prop.STRICT_REWRITE.set(props, false);
    assertThat(scope.rewriteRecursive(negateQueries, e),
        hasToString("(s0 * (-advice[0]@cur + --advice[1]@cur))"));
    assertThat(warnings, hasSize(1));
  }
}

// End RewritePatternSetTest.java
