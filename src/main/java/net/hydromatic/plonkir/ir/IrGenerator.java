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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Gate;
import net.hydromatic.plonkir.circuit.Lookup;
import net.hydromatic.plonkir.compile.CompileException;
import net.hydromatic.plonkir.compile.Prop;
import net.hydromatic.plonkir.compile.Tracer;
import net.hydromatic.plonkir.expr.ExpressionLowering;
import net.hydromatic.plonkir.expr.ScopedExpression;
import net.hydromatic.plonkir.gate.GateScope;
import net.hydromatic.plonkir.gate.RewritePatternSet;
import net.hydromatic.plonkir.gate.RowExpression;
import net.hydromatic.plonkir.group.Group;
import net.hydromatic.plonkir.group.GroupBounds;
import net.hydromatic.plonkir.group.GroupCell;
import net.hydromatic.plonkir.group.GroupKey;
import net.hydromatic.plonkir.group.Groups;
import net.hydromatic.plonkir.lookup.LookupScope;
import net.hydromatic.plonkir.lookup.LookupStrategy;
import net.hydromatic.plonkir.lookup.LookupTableGenerator;
import net.hydromatic.plonkir.resolve.FixedQueryResolver;
import net.hydromatic.plonkir.resolve.RegionRowResolver;
import net.hydromatic.plonkir.resolve.RowResolver;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;
import net.hydromatic.plonkir.synthesis.EqConstraint;
import net.hydromatic.plonkir.synthesis.InjectedIr;
import net.hydromatic.plonkir.synthesis.RegionData;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates the IR of each group.
 *
 * <p>A group's body consists of calls to the groups it contains, the
 * constraints of the gates in its regions, the equality constraints that
 * concern it, its lookups, and the statements injected into its regions.
 * Every part is folded and canonicalized.
 */
public class IrGenerator {
  protected final CircuitSynthesis synthesis;
  private final IrContext ctx;
  private final RewritePatternSet patterns;
  private final LookupStrategy lookupStrategy;
  private final Map<Prop, Object> props;
  private final Tracer tracer;
  private final boolean debugComments;
  private final FixedQueryResolver fixed;
  private final ImmutableMap<Integer, Integer> regionStarts;
  private final ImmutableMap<Integer, LookupTableGenerator> tables;

  public IrGenerator(CircuitSynthesis synthesis, IrContext ctx,
      RewritePatternSet patterns, LookupStrategy lookupStrategy,
      Map<Prop, Object> props, Tracer tracer) {
    this.synthesis = requireNonNull(synthesis);
    this.ctx = requireNonNull(ctx);
    this.patterns = requireNonNull(patterns);
    this.lookupStrategy = requireNonNull(lookupStrategy);
    this.props = requireNonNull(props);
    this.tracer = requireNonNull(tracer);
    this.debugComments = Prop.GENERATE_DEBUG_COMMENTS.booleanValue(props);
    this.fixed = cell -> Optional.of(synthesis.fixedData.resolve(cell));
    this.regionStarts = synthesis.groups.regionStarts();
    final ImmutableMap.Builder<Integer, LookupTableGenerator> b =
        ImmutableMap.builder();
    for (Lookup lookup : synthesis.cs.lookups()) {
      b.put(lookup.index,
          new LookupTableGenerator(synthesis.tableData, lookup));
    }
    this.tables = b.build();
  }

  private Groups groups() {
    return synthesis.groups;
  }

  /** Generates the bodies of all groups, indexed by group id. */
  public ImmutableList<GroupBody> generate() {
    final ImmutableList.Builder<GroupBody> b = ImmutableList.builder();
    for (Group group : groups().list()) {
      b.add(generate(group));
    }
    return b.build();
  }

  /** Generates the body of one group. */
  public GroupBody generate(Group group) {
    final RowResolver resolver = resolver(group);
    final List<CallSite> callsites = new ArrayList<>();
    for (int callNo = 0; callNo < group.children.size(); callNo++) {
      callsites.add(callsite(group, resolver, callNo));
    }
    final List<RegionData> regions = groups().regionsOf(group);
    final GroupBounds bounds =
        new GroupBounds(group, groups(), ctx.freeCells(group).inputs);
    final List<Stmt<AExpr>> eqs =
        eqConstraints(regions, resolver,
            edge -> select(group, edge, bounds.check(edge)));
    eqs.addAll(doubleAnnotated(group, resolver));
    return body(group.name, group.id, group.key, ctx.inputs(group).size(),
        ctx.outputs(group).size(), callsites, regions, resolver, eqs);
  }

  /** Generates a single body for the whole circuit, ignoring groups. Every
   * equality constraint is emitted. */
  public GroupBody generateInline() {
    final RowResolver resolver =
        new RowResolver(0, synthesis.adviceIo, synthesis.instanceIo, fixed,
            0);
    final List<Stmt<AExpr>> eqs =
        eqConstraints(synthesis.regions, resolver, edge -> true);
    return body(Group.TOP_LEVEL_NAME, groups().topLevel().id, null,
        synthesis.instanceIo.inputCount() + synthesis.adviceIo.inputCount(),
        synthesis.instanceIo.outputCount()
            + synthesis.adviceIo.outputCount(),
        ImmutableList.of(), synthesis.regions, resolver, eqs);
  }

  private GroupBody body(String name, int id, @Nullable GroupKey key,
      int inputCount, int outputCount, List<CallSite> callsites,
      List<RegionData> regions, RowResolver resolver,
      List<Stmt<AExpr>> eqs) {
    final List<Stmt<AExpr>> gates = new ArrayList<>();
    final List<Stmt<AExpr>> lookups = new ArrayList<>();
    final List<Stmt<AExpr>> injected = new ArrayList<>();
    for (RegionData region : regions) {
      for (Gate gate : synthesis.cs.gates()) {
        gates.add(lowerGate(gate, region, resolver));
      }
      for (InjectedIr ir : synthesis.injected(region.index)) {
        injected.add(
            ScopedExpression.lower(ir.stmt, regionRow(region, resolver,
                ir.row)));
      }
    }
    for (Lookup lookup : synthesis.cs.lookups()) {
      for (RegionData region : regions) {
        for (int row = region.start; row < region.end(); row++) {
          lookups.add(lowerLookup(lookup, region, resolver, row));
        }
      }
    }
    final GroupBody body =
        new GroupBody(name, id, key, inputCount, outputCount, callsites,
            Canonicalizer.canonicalize(Stmt.seq(gates)),
            Canonicalizer.canonicalize(Stmt.seq(eqs)),
            Canonicalizer.canonicalize(Stmt.seq(lookups)),
            Canonicalizer.canonicalize(Stmt.seq(injected)),
            debugComments);
    tracer.onGroupBody(body);
    return body;
  }

  /** Returns a resolver for the scope of a group. */
  public RowResolver resolver(Group group) {
    return new RowResolver(0, ctx.adviceIo(group), ctx.instanceIo(group),
        fixed, groups().baseRow(group));
  }

  protected static RegionRowResolver regionRow(RegionData region,
      RowResolver resolver, int row) {
    return new RegionRowResolver(region, resolver.atRow(row));
  }

  private CallSite callsite(Group caller, RowResolver resolver,
      int callNo) {
    final Group callee = groups().get(caller.children.get(callNo));
    final List<AExpr> inputs = new ArrayList<>();
    for (GroupCell cell : ctx.inputs(callee)) {
      inputs.add(lowerCell(resolver, cell));
    }
    final List<AExpr> outputs = new ArrayList<>();
    for (GroupCell cell : ctx.outputs(callee)) {
      outputs.add(lowerCell(resolver, cell));
    }
    return CallSite.of(callee.name, callee.key(), callee.id, callNo, inputs,
        outputs);
  }

  /** Lowers a query of a group cell, in the region that the cell belongs
   * to if it has one. */
  private AExpr lowerCell(RowResolver resolver, GroupCell cell) {
    final Cell c = cell.toCell(regionStarts);
    final Expression query = Expression.query(c.column, 0);
    final RowResolver r = resolver.atRow(c.row);
    final Integer regionIndex = cell.regionIndex();
    if (regionIndex != null) {
      final RegionRowResolver rr =
          new RegionRowResolver(groups().region(regionIndex), r);
      return ExpressionLowering.lower(query, rr, rr);
    }
    return ExpressionLowering.lower(query, r, r);
  }

  /** Lowers a query of a cell, in whichever of the given regions contains
   * it. */
  private static AExpr lowerCell(List<RegionData> regions,
      RowResolver resolver, Cell cell) {
    final Expression query = Expression.query(cell.column, 0);
    final RowResolver r = resolver.atRow(cell.row);
    final @Nullable RegionData region = containing(regions, cell);
    if (region != null) {
      final RegionRowResolver rr = new RegionRowResolver(region, r);
      return ExpressionLowering.lower(query, rr, rr);
    }
    return ExpressionLowering.lower(query, r, r);
  }

  private static @Nullable RegionData containing(List<RegionData> regions,
      Cell cell) {
    for (RegionData region : regions) {
      if (region.contains(cell)) {
        return region;
      }
    }
    return null;
  }

  /** Lowers a gate in a region. */
  protected Stmt<AExpr> lowerGate(Gate gate, RegionData region,
      RowResolver resolver) {
    final GateScope scope =
        new GateScope(gate, region, resolver, props, tracer);
    final Stmt<RowExpression> rewritten = patterns.rewrite(scope);
    final Stmt<AExpr> stmt =
        rewritten.map(e -> scope.lower(e.expression, e.row));
    return withComment(stmt, scope.toString());
  }

  private Stmt<AExpr> lowerLookup(Lookup lookup, RegionData region,
      RowResolver resolver, int row) {
    final LookupScope scope =
        new LookupScope(regionRow(region, resolver, row),
            requireNonNull(tables.get(lookup.index)));
    return withComment(lookupStrategy.lower(lookup, scope),
        lookup + " @ " + scope);
  }

  protected Stmt<AExpr> withComment(Stmt<AExpr> stmt, String comment) {
    if (stmt.isEmpty() || !debugComments) {
      return stmt;
    }
    return Stmt.seq(Stmt.comment(comment), stmt);
  }

  /** Returns the selected equality constraints, and every fixed-to-constant
   * constraint. */
  private List<Stmt<AExpr>> eqConstraints(List<RegionData> regions,
      RowResolver resolver, Predicate<EqConstraint.AnyToAny> selector) {
    final List<Stmt<AExpr>> list = new ArrayList<>();
    for (EqConstraint edge : synthesis.eqGraph.edges()) {
      switch (edge.kind) {
      case ANY_TO_ANY:
        final EqConstraint.AnyToAny anyToAny = (EqConstraint.AnyToAny) edge;
        if (selector.test(anyToAny)) {
          list.add(
              Stmt.eq(lowerCell(regions, resolver, anyToAny.left),
                  lowerCell(regions, resolver, anyToAny.right)));
        }
        break;
      case FIXED_TO_CONST:
        final EqConstraint.FixedToConst fixedToConst =
            (EqConstraint.FixedToConst) edge;
        list.add(
            Stmt.eq(lowerCell(regions, resolver, fixedToConst.cell),
                AExpr.constant(fixedToConst.value)));
        break;
      default:
        throw new AssertionError(edge.kind);
      }
    }
    return list;
  }

  /** Decides whether a group emits an equality constraint between two
   * cells, given where each cell lies relative to the group.
   *
   * <p>A constraint between two foreign cells belongs to another group. A
   * constraint from a cell within the group to a cell outside it is only
   * possible if the outside cell is fixed; otherwise free-cell lifting
   * would have made it an input. */
  static boolean select(Group group, EqConstraint.AnyToAny edge,
      GroupBounds.Check check) {
    final GroupBounds.Bound l = check.left;
    final GroupBounds.Bound r = check.right;
    if (l == GroupBounds.Bound.OUTSIDE || r == GroupBounds.Bound.OUTSIDE) {
      final Cell outside;
      if (l == GroupBounds.Bound.WITHIN) {
        outside = edge.right;
      } else if (r == GroupBounds.Bound.WITHIN) {
        outside = edge.left;
      } else {
        return false;
      }
      if (!outside.column.isFixed()) {
        throw new CompileException("Equality constraint " + edge
            + " connects " + group + " to cell " + outside
            + ", which is outside its bounds and not an input");
      }
      return true;
    }
    return l != GroupBounds.Bound.FOREIGN_IO
        || r != GroupBounds.Bound.FOREIGN_IO;
  }

  /** Connects the input and the output variables of cells that are both
   * inputs and outputs of a group. */
  private List<Stmt<AExpr>> doubleAnnotated(Group group,
      RowResolver resolver) {
    final List<Stmt<AExpr>> list = new ArrayList<>();
    for (GroupCell input : group.inputs) {
      for (GroupCell output : group.outputs) {
        if (input.equals(output)) {
          list.add(
              Stmt.eq(
                  lowerCell(resolver.withPriority(RowResolver.Priority.INPUT),
                      input),
                  lowerCell(resolver.withPriority(RowResolver.Priority.OUTPUT),
                      output)));
        }
      }
    }
    return list;
  }
}

// End IrGenerator.java
