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

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.plonkir.backend.Backend;
import net.hydromatic.plonkir.backend.Lowering;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Felt;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.ir.CmpOp;
import net.hydromatic.plonkir.ir.FuncIO;

/**
 * Backend whose expressions are strings, and which records the body of
 * each function it is given.
 *
 * <p>Functions are recorded in the order their scopes end. The printed form
 * of a function is a header line followed by one line per statement.
 */
public class RecordingBackend implements Backend<String> {
  private final Map<String, Scope> functions = new LinkedHashMap<>();
  private final List<Scope> open = new ArrayList<>();
  /** If set, the scopes drop every constraint, which a correct compiler
   * must detect. */
  private final boolean dropConstraints;

  public RecordingBackend() {
    this(false);
  }

  public RecordingBackend(boolean dropConstraints) {
    this.dropConstraints = dropConstraints;
  }

  @Override public Lowering<String> defineFunction(String name,
      List<FuncIO> inputs, List<FuncIO> outputs) {
    return open(name, "function " + name + inputs + " -> " + outputs);
  }

  @Override public Lowering<String> defineGateFunction(String name,
      List<Selector> selectors, List<Expression.Query> queries,
      List<FuncIO> outputs) {
    return open(name, "gate " + name + selectors + queries);
  }

  @Override public Lowering<String> defineMainFunction(int inputCount,
      int outputCount) {
    return open("Main", "main(" + inputCount + ") -> " + outputCount);
  }

  private Scope open(String name, String header) {
    checkState(!functions.containsKey(name), "duplicate function %s", name);
    final Scope scope = new Scope(name, header);
    open.add(scope);
    return scope;
  }

  @Override public void onScopeEnd(Lowering<String> scope) {
    checkState(open.remove(scope), "scope is not open");
    final Scope s = (Scope) scope;
    functions.put(s.name, s);
  }

  /** Returns the names of the functions, in the order they were
   * completed. */
  public List<String> names() {
    return new ArrayList<>(functions.keySet());
  }

  /** Returns the statements of a function. */
  public List<String> body(String name) {
    final Scope scope = functions.get(name);
    if (scope == null) {
      throw new IllegalArgumentException("no function " + name);
    }
    return scope.lines;
  }

  /** Returns the header of a function. */
  public String header(String name) {
    return functions.get(name).header;
  }

  @Override public String toString() {
    return functions.values().stream()
        .map(Scope::toString)
        .collect(Collectors.joining());
  }

  /** Body of one function. */
  private class Scope implements Lowering<String> {
    final String name;
    final String header;
    final List<String> lines = new ArrayList<>();
    int constraints;

    Scope(String name, String header) {
      this.name = name;
      this.header = header;
    }

    @Override public String toString() {
      final StringBuilder b = new StringBuilder(header).append(" {\n");
      lines.forEach(line -> b.append("  ").append(line).append('\n'));
      return b.append("}\n").toString();
    }

    @Override public void generateConstraint(CmpOp op, String left,
        String right) {
      if (dropConstraints) {
        return;
      }
      lines.add(left + " " + op.symbol + " " + right);
      ++constraints;
    }

    @Override public int numConstraints() {
      return constraints;
    }

    @Override public void generateComment(String text) {
      lines.add("// " + text);
    }

    @Override public void generateCall(String name, List<String> inputs,
        List<FuncIO> outputs) {
      lines.add(outputs + " = " + name + "(" + String.join(", ", inputs)
          + ")");
    }

    @Override public void generateAssumeDeterministic(FuncIO io) {
      lines.add("assume_deterministic " + io);
    }

    @Override public void generateAssert(String condition) {
      lines.add("assert " + condition);
    }

    @Override public String lowerSum(String left, String right) {
      return "(" + left + " + " + right + ")";
    }

    @Override public String lowerProduct(String left, String right) {
      return "(" + left + " * " + right + ")";
    }

    @Override public String lowerNeg(String e) {
      return "-" + e;
    }

    @Override public String lowerConstant(Felt value) {
      return value.toString();
    }

    @Override public String lowerFuncIO(FuncIO io) {
      return io.toString();
    }

    @Override public String lowerCmp(CmpOp op, String left, String right) {
      return left + " " + op.symbol + " " + right;
    }

    @Override public String lowerAnd(String left, String right) {
      return "(" + left + " && " + right + ")";
    }

    @Override public String lowerOr(String left, String right) {
      return "(" + left + " || " + right + ")";
    }

    @Override public String lowerNot(String e) {
      return "!" + e;
    }

    @Override public String lowerTrue() {
      return "true";
    }

    @Override public String lowerFalse() {
      return "false";
    }
  }
}

// End RecordingBackend.java
