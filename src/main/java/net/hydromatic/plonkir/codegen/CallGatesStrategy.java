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
package net.hydromatic.plonkir.codegen;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.plonkir.backend.Backend;
import net.hydromatic.plonkir.backend.Lowerer;
import net.hydromatic.plonkir.backend.Lowering;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Gate;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.expr.ExpressionLowering;
import net.hydromatic.plonkir.ir.AExpr;
import net.hydromatic.plonkir.ir.Canonicalizer;
import net.hydromatic.plonkir.ir.CmpOp;
import net.hydromatic.plonkir.ir.IrGenerator;
import net.hydromatic.plonkir.ir.Stmt;
import net.hydromatic.plonkir.resolve.GateScopedResolver;
import net.hydromatic.plonkir.resolve.RegionRowResolver;
import net.hydromatic.plonkir.resolve.RowResolver;
import net.hydromatic.plonkir.synthesis.RegionData;

/**
 * Strategy that defines one function per gate, and calls it from the main
 * function at each row of each region.
 *
 * <p>A gate function takes the gate's selectors, then its queries. Each
 * call passes exactly those, so its arity matches the gate's header.
 * Challenges are not passed; the body refers to them as
 * {@link net.hydromatic.plonkir.ir.FuncIO.Challenge} values, which name
 * the challenge by index. Rows at which none of the gate's selectors is
 * enabled are skipped if gates are set to ignore disabled rows.
 */
public class CallGatesStrategy implements CodegenStrategy {
  @Override public <E> void codegen(CodegenContext context,
      Backend<E> backend) {
    context.lookupStrategy.defineModules(backend, context.synthesis);

    final NameGenerator names = new NameGenerator();
    final Map<Gate, String> gateNames = new IdentityHashMap<>();
    for (Gate gate : context.synthesis.cs.gates()) {
      final String name = names.fresh(gate.name);
      gateNames.put(gate, name);
      defineGate(backend, name, gate);
    }

    final IrGenerator generator = new CallingGenerator(context, gateNames);
    CodegenStrategy.defineMain(backend, generator.generateInline());
  }

  private static <E> void defineGate(Backend<E> backend, String name,
      Gate gate) {
    final GateScopedResolver resolver = GateScopedResolver.of(gate);
    final Lowering<E> scope =
        backend.defineGateFunction(name, gate.selectors(), gate.queries(),
            ImmutableList.of());
    for (Expression polynomial : gate.polynomials) {
      final Stmt<AExpr> constraint =
          Stmt.constraint(CmpOp.EQ,
              ExpressionLowering.lower(polynomial, resolver, resolver),
              AExpr.constant(0));
      Lowerer.lower(Canonicalizer.canonicalize(constraint), scope);
    }
    backend.onScopeEnd(scope);
  }

  /** Generator that lowers each gate to calls to its function. */
  private static class CallingGenerator extends IrGenerator {
    private final Map<Gate, String> gateNames;
    private final boolean ignoreDisabled;

    CallingGenerator(CodegenContext context, Map<Gate, String> gateNames) {
      super(context.synthesis, context.irContext(), context.patterns,
          context.lookupStrategy, context.props, context.tracer);
      this.gateNames = gateNames;
      this.ignoreDisabled = context.ignoreDisabled;
    }

    @Override protected Stmt<AExpr> lowerGate(Gate gate, RegionData region,
        RowResolver resolver) {
      final List<Stmt<AExpr>> calls = new ArrayList<>();
      for (int row = region.start; row < region.end(); row++) {
        final RegionRowResolver r = regionRow(region, resolver, row);
        if (ignoreDisabled && r.gateIsDisabled(gate.selectors())) {
          continue;
        }
        final List<AExpr> inputs = new ArrayList<>();
        for (Selector selector : gate.selectors()) {
          inputs.add(r.resolveSelector(selector).toExpr());
        }
        for (Expression.Query query : gate.queries()) {
          inputs.add(ExpressionLowering.lower(query, r, r));
        }
        calls.add(
            Stmt.call(gateNames.get(gate), inputs, ImmutableList.of()));
      }
      return withComment(Stmt.seq(calls), "gate '" + gate.name
          + "' @ region " + region.index + " '" + region.name + "'");
    }
  }
}

// End CallGatesStrategy.java
