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
package net.hydromatic.plonkir.compile;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.plonkir.backend.Backend;
import net.hydromatic.plonkir.circuit.Circuit;
import net.hydromatic.plonkir.codegen.CallGatesStrategy;
import net.hydromatic.plonkir.codegen.CodegenContext;
import net.hydromatic.plonkir.codegen.CodegenStrategy;
import net.hydromatic.plonkir.codegen.GroupsStrategy;
import net.hydromatic.plonkir.codegen.InlineStrategy;
import net.hydromatic.plonkir.gate.GateCallbacks;
import net.hydromatic.plonkir.gate.RewritePatternSet;
import net.hydromatic.plonkir.lookup.CallbacksLookupStrategy;
import net.hydromatic.plonkir.lookup.InvokeLookupAsModule;
import net.hydromatic.plonkir.lookup.LookupAsRowConstraint;
import net.hydromatic.plonkir.lookup.LookupCallbacks;
import net.hydromatic.plonkir.lookup.LookupStrategy;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;
import net.hydromatic.plonkir.synthesis.Synthesizer;

/**
 * Compiles a circuit onto a backend.
 *
 * <p>Compilation synthesizes the circuit once, generates IR according to
 * the {@link Prop properties}, and lowers it onto the backend. It either
 * completes or throws a {@link CompileException}; a backend that has
 * received some functions when an exception is thrown must discard them.
 */
public abstract class Compiler {
  private Compiler() {}

  /** Compiles a circuit with default properties and callbacks. */
  public static <C, E> void compile(Circuit<C> circuit, Backend<E> backend) {
    compile(circuit, backend, ImmutableMap.of(), Tracers.empty(),
        GateCallbacks.DEFAULT, LookupCallbacks.DEFAULT);
  }

  /** Compiles a circuit. */
  public static <C, E> void compile(Circuit<C> circuit, Backend<E> backend,
      Map<Prop, Object> props, Tracer tracer, GateCallbacks gateCallbacks,
      LookupCallbacks lookupCallbacks) {
    final CircuitSynthesis synthesis =
        Synthesizer.synthesize(circuit, tracer);
    compile(synthesis, backend, props, tracer, gateCallbacks,
        lookupCallbacks);
  }

  /** Compiles a circuit that has already been synthesized. */
  public static <E> void compile(CircuitSynthesis synthesis,
      Backend<E> backend, Map<Prop, Object> props, Tracer tracer,
      GateCallbacks gateCallbacks, LookupCallbacks lookupCallbacks) {
    final Boolean ignore = gateCallbacks.ignoreDisabledGates();
    final boolean ignoreDisabled = ignore != null
        ? ignore
        : Prop.IGNORE_DISABLED_GATES.booleanValue(props);
    final CodegenContext context =
        new CodegenContext(synthesis, props, tracer,
            RewritePatternSet.load(gateCallbacks, ignoreDisabled),
            lookupStrategy(
                Prop.LOOKUP_STRATEGY.enumValue(props, Prop.LookupMode.class),
                synthesis, lookupCallbacks),
            ignoreDisabled);
    codegenStrategy(
        Prop.CODEGEN_STRATEGY.enumValue(props, Prop.Strategy.class))
        .codegen(context, backend);
  }

  /** Creates the lookup strategy for a mode. */
  public static LookupStrategy lookupStrategy(Prop.LookupMode mode,
      CircuitSynthesis synthesis, LookupCallbacks callbacks) {
    switch (mode) {
    case CALLBACKS:
      return new CallbacksLookupStrategy(callbacks);
    case MODULE:
      return new InvokeLookupAsModule(synthesis.cs.lookups());
    case ROW_CONSTRAINT:
      return new LookupAsRowConstraint();
    default:
      throw new AssertionError(mode);
    }
  }

  /** Creates the codegen strategy for a value of
   * {@link Prop#CODEGEN_STRATEGY}. */
  public static CodegenStrategy codegenStrategy(Prop.Strategy strategy) {
    switch (strategy) {
    case INLINE:
      return new InlineStrategy();
    case CALL_GATES:
      return new CallGatesStrategy();
    case GROUPS:
      return new GroupsStrategy();
    default:
      throw new AssertionError(strategy);
    }
  }
}

// End Compiler.java
