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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.plonkir.group.GroupKey;

/**
 * Call from one group to another.
 *
 * <p>The call passes {@link #inputs} and binds the callee's outputs to
 * {@link #outputVars}; each output variable is then constrained to equal
 * the caller's view of the corresponding output cell.
 */
public final class CallSite {
  /** Name of the function to call. */
  public final String name;
  public final GroupKey callee;
  public final int calleeId;
  public final ImmutableList<AExpr> inputs;
  public final ImmutableList<FuncIO> outputVars;
  public final ImmutableList<AExpr> outputs;

  public CallSite(String name, GroupKey callee, int calleeId,
      List<AExpr> inputs, List<FuncIO> outputVars, List<AExpr> outputs) {
    this.name = requireNonNull(name);
    this.callee = requireNonNull(callee);
    this.calleeId = calleeId;
    this.inputs = ImmutableList.copyOf(inputs);
    this.outputVars = ImmutableList.copyOf(outputVars);
    this.outputs = ImmutableList.copyOf(outputs);
  }

  /** Creates a call site whose output variables are
   * {@code CallOutput(callNo, 0)}, {@code CallOutput(callNo, 1)}, ... */
  public static CallSite of(String name, GroupKey callee, int calleeId,
      int callNo, List<AExpr> inputs, List<AExpr> outputs) {
    final List<FuncIO> vars = new ArrayList<>();
    for (int i = 0; i < outputs.size(); i++) {
      vars.add(FuncIO.callOutput(callNo, i));
    }
    return new CallSite(name, callee, calleeId, inputs, vars, outputs);
  }

  /** Returns a copy that calls a function with a different name. */
  public CallSite withName(String name) {
    return name.equals(this.name)
        ? this
        : new CallSite(name, callee, calleeId, inputs, outputVars, outputs);
  }

  public Stmt<AExpr> toStmt() {
    final List<Stmt<AExpr>> stmts = new ArrayList<>();
    stmts.add(Stmt.call(name, inputs, outputVars));
    for (int i = 0; i < outputs.size(); i++) {
      stmts.add(Stmt.eq(outputs.get(i), AExpr.io(outputVars.get(i))));
    }
    return Stmt.seq(stmts);
  }

  /** Returns whether two call sites call the same kind of group with
   * equivalent arguments. */
  public boolean equivalent(CallSite o) {
    return name.equals(o.name)
        && callee.equals(o.callee)
        && SymbolicEquivalence.equivalentExprs(inputs, o.inputs)
        && SymbolicEquivalence.equivalentExprs(outputs, o.outputs);
  }

  @Override public String toString() {
    return toStmt().toString();
  }
}

// End CallSite.java
