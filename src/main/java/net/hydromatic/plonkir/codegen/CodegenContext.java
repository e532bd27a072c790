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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.plonkir.compile.Tracer;
import net.hydromatic.plonkir.compile.Prop;
import net.hydromatic.plonkir.gate.RewritePatternSet;
import net.hydromatic.plonkir.group.FreeCellLifter;
import net.hydromatic.plonkir.group.FreeCells;
import net.hydromatic.plonkir.ir.IrContext;
import net.hydromatic.plonkir.ir.IrGenerator;
import net.hydromatic.plonkir.lookup.LookupStrategy;
import net.hydromatic.plonkir.synthesis.CircuitSynthesis;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Everything a {@link CodegenStrategy} needs to compile one circuit. */
public class CodegenContext {
  public final CircuitSynthesis synthesis;
  public final ImmutableMap<Prop, Object> props;
  public final Tracer tracer;
  public final RewritePatternSet patterns;
  public final LookupStrategy lookupStrategy;
  /** Whether rows where a gate's selectors are all disabled are
   * skipped. */
  public final boolean ignoreDisabled;
  private @Nullable IrContext irContext;

  public CodegenContext(CircuitSynthesis synthesis, Map<Prop, Object> props,
      Tracer tracer, RewritePatternSet patterns,
      LookupStrategy lookupStrategy, boolean ignoreDisabled) {
    this.synthesis = requireNonNull(synthesis);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    this.patterns = requireNonNull(patterns);
    this.lookupStrategy = requireNonNull(lookupStrategy);
    this.ignoreDisabled = ignoreDisabled;
  }

  /** Returns the inputs and outputs of each group, lifting free cells the
   * first time it is called. */
  public IrContext irContext() {
    if (irContext == null) {
      final List<FreeCells> freeCells =
          new FreeCellLifter(synthesis.groups, synthesis.eqGraph).lift();
      FreeCellLifter.trace(synthesis.groups, freeCells, tracer);
      irContext = new IrContext(synthesis.groups, freeCells);
    }
    return irContext;
  }

  public IrGenerator generator() {
    return new IrGenerator(synthesis, irContext(), patterns, lookupStrategy,
        props, tracer);
  }
}

// End CodegenContext.java
