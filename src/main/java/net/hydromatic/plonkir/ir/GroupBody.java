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
import java.util.Objects;
import java.util.function.Function;
import net.hydromatic.plonkir.group.GroupKey;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * IR of one group: calls to the groups it contains, then the constraints of
 * its own regions.
 */
public final class GroupBody {
  public final String name;
  public final int id;
  public final @Nullable GroupKey key;
  public final int inputCount;
  public final int outputCount;
  public final ImmutableList<CallSite> callsites;
  public final Stmt<AExpr> gates;
  public final Stmt<AExpr> eqConstraints;
  public final Stmt<AExpr> lookups;
  public final Stmt<AExpr> injected;
  private final boolean debugComments;

  public GroupBody(String name, int id, @Nullable GroupKey key,
      int inputCount, int outputCount, List<CallSite> callsites,
      Stmt<AExpr> gates, Stmt<AExpr> eqConstraints, Stmt<AExpr> lookups,
      Stmt<AExpr> injected, boolean debugComments) {
    this.name = requireNonNull(name);
    this.id = id;
    this.key = key;
    this.inputCount = inputCount;
    this.outputCount = outputCount;
    this.callsites = ImmutableList.copyOf(callsites);
    this.gates = requireNonNull(gates);
    this.eqConstraints = requireNonNull(eqConstraints);
    this.lookups = requireNonNull(lookups);
    this.injected = requireNonNull(injected);
    this.debugComments = debugComments;
  }

  public boolean isTopLevel() {
    return key == null;
  }

  /** Returns a copy with a different name. */
  public GroupBody withName(String name) {
    return new GroupBody(name, id, key, inputCount, outputCount, callsites,
        gates, eqConstraints, lookups, injected, debugComments);
  }

  /** Returns a copy in which each call site has been transformed. */
  public GroupBody withCallsites(Function<CallSite, CallSite> fn) {
    final List<CallSite> list = new ArrayList<>();
    callsites.forEach(c -> list.add(fn.apply(c)));
    return new GroupBody(name, id, key, inputCount, outputCount, list,
        gates, eqConstraints, lookups, injected, debugComments);
  }

  /** Returns the body as one statement. */
  public Stmt<AExpr> toStmt() {
    final List<Stmt<AExpr>> stmts = new ArrayList<>();
    final List<Stmt<AExpr>> calls = new ArrayList<>();
    callsites.forEach(c -> calls.add(c.toStmt()));
    section(stmts, "Calls to subgroups", Stmt.seq(calls));
    section(stmts, "Gate constraints", gates);
    section(stmts, "Equality constraints", eqConstraints);
    section(stmts, "Lookups", lookups);
    section(stmts, "Injected", injected);
    return Stmt.seq(stmts);
  }

  private void section(List<Stmt<AExpr>> stmts, String title,
      Stmt<AExpr> stmt) {
    if (stmt.isEmpty()) {
      return;
    }
    if (debugComments) {
      stmts.add(Stmt.comment(title));
    }
    stmts.add(stmt);
  }

  /** Returns whether this body and another can be compiled to the same
   * function. */
  public boolean equivalent(GroupBody o) {
    if (!Objects.equals(key, o.key)
        || inputCount != o.inputCount
        || outputCount != o.outputCount
        || callsites.size() != o.callsites.size()) {
      return false;
    }
    for (int i = 0; i < callsites.size(); i++) {
      if (!callsites.get(i).equivalent(o.callsites.get(i))) {
        return false;
      }
    }
    return SymbolicEquivalence.equivalent(gates, o.gates)
        && SymbolicEquivalence.equivalent(eqConstraints, o.eqConstraints)
        && SymbolicEquivalence.equivalent(lookups, o.lookups)
        && SymbolicEquivalence.equivalent(injected, o.injected);
  }

  /**
   * Checks that each call site passes as many arguments as its callee
   * takes, and expects as many outputs as it returns.
   *
   * @param bodies Bodies of all groups, indexed by id
   * @throws ValidationException if any call site is inconsistent
   */
  public void validate(List<GroupBody> bodies) {
    final List<String> errors = new ArrayList<>();
    for (CallSite callsite : callsites) {
      if (callsite.calleeId < 0 || callsite.calleeId >= bodies.size()) {
        errors.add(name + ": call to unknown group " + callsite.calleeId);
        continue;
      }
      final GroupBody callee = bodies.get(callsite.calleeId);
      if (callsite.inputs.size() != callee.inputCount) {
        errors.add(name + ": call to '" + callsite.name + "' passes "
            + callsite.inputs.size() + " inputs but the callee takes "
            + callee.inputCount);
      }
      if (callsite.outputs.size() != callee.outputCount) {
        errors.add(name + ": call to '" + callsite.name + "' expects "
            + callsite.outputs.size() + " outputs but the callee returns "
            + callee.outputCount);
      }
    }
    if (!errors.isEmpty()) {
      throw new ValidationException(errors);
    }
  }

  @Override public String toString() {
    return "group body " + id + " '" + name + "'";
  }
}

// End GroupBody.java
