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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.Map;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Gate;
import net.hydromatic.plonkir.compile.Prop;
import net.hydromatic.plonkir.compile.Tracer;
import net.hydromatic.plonkir.expr.ExpressionLowering;
import net.hydromatic.plonkir.expr.ExpressionRewriter;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.resolve.RegionRowResolver;
import net.hydromatic.plonkir.resolve.ResolutionException;
import net.hydromatic.plonkir.resolve.RowResolver;
import net.hydromatic.plonkir.synthesis.RegionData;

/**
 * A gate, and a region in which it is to be lowered.
 *
 * <p>Rewrite patterns receive a GateScope and may inspect the region's rows,
 * resolve queries at a row, and rewrite the gate's polynomials.
 */
public class GateScope {
  public final Gate gate;
  public final RegionData region;
  private final RowResolver resolver;
  private final Map<Prop, Object> props;
  private final Tracer tracer;

  /**
   * Creates a GateScope.
   *
   * @param gate Gate
   * @param region Region in which the gate is lowered
   * @param resolver Resolver of the group that owns the region, at any row
   * @param props Compiler properties
   * @param tracer Tracer
   */
  public GateScope(Gate gate, RegionData region, RowResolver resolver,
      Map<Prop, Object> props, Tracer tracer) {
    this.gate = requireNonNull(gate);
    this.region = requireNonNull(region);
    this.resolver = requireNonNull(resolver);
    this.props = requireNonNull(props);
    this.tracer = requireNonNull(tracer);
  }

  public String gateName() {
    return gate.name;
  }

  public String regionName() {
    return region.name;
  }

  public int regionIndex() {
    return region.index;
  }

  public ImmutableList<Expression> polynomials() {
    return gate.polynomials;
  }

  /** Returns the first row of the region. */
  public int startRow() {
    return region.start;
  }

  /** Returns the last row of the region, or the first row if the region is
   * empty. */
  public int endRow() {
    return region.height() == 0 ? region.start : region.end() - 1;
  }

  /** Returns the rows of the region. */
  public ContiguousSet<Integer> rows() {
    return ContiguousSet.create(Range.closedOpen(region.start, region.end()),
        DiscreteDomain.integers());
  }

  /** Returns a resolver for a row of the region.
   *
   * @throws ResolutionException if the row is not in the region */
  public RegionRowResolver regionRow(int row) {
    if (!region.containsRow(row)) {
      throw new ResolutionException("Row " + row
          + " is not within the rows of the scope [" + startRow() + ", "
          + endRow() + "]");
    }
    return new RegionRowResolver(region, resolver.atRow(row));
  }

  /** Lowers and folds an expression at a row of the region. */
  public AExpr lower(Expression e, int row) {
    final RegionRowResolver r = regionRow(row);
    return ExpressionLowering.lower(e, r, r);
  }

  /** Rewrites an expression until it stops changing, observing the
   * {@link Prop#MAX_REWRITE_ITERATIONS} and {@link Prop#STRICT_REWRITE}
   * properties. */
  public Expression rewriteRecursive(ExpressionRewriter rewriter,
      Expression e) {
    return rewriter.rewriteRecursive(e,
        Prop.MAX_REWRITE_ITERATIONS.intValue(props),
        Prop.STRICT_REWRITE.booleanValue(props), tracer);
  }

  @Override public String toString() {
    return "gate '" + gate.name + "' @ region " + region.index + " '"
        + region.name + "' @ rows " + startRow() + "..=" + endRow();
  }
}

// End GateScope.java
