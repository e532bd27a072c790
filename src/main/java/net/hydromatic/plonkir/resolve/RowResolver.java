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
package net.hydromatic.plonkir.resolve;

import static java.util.Objects.requireNonNull;

import net.hydromatic.plonkir.circuit.Cell;
import net.hydromatic.plonkir.circuit.Challenge;
import net.hydromatic.plonkir.circuit.CircuitIO;
import net.hydromatic.plonkir.circuit.Expression;
import net.hydromatic.plonkir.circuit.Selector;
import net.hydromatic.plonkir.ir.FuncIO;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves queries at a row, outside of any region.
 *
 * <p>Cells that are inputs of the scope become arguments, and outputs
 * become output fields. Instance cells are numbered before advice cells:
 * advice input {@code i} is argument {@code instanceInputs + i}. An advice
 * cell that is neither input nor output is a local variable. Challenges
 * follow the inputs.
 */
public class RowResolver implements QueryResolver, SelectorResolver {
  public final int row;
  final CircuitIO adviceIo;
  final CircuitIO instanceIo;
  final FixedQueryResolver fixed;
  private final Priority priority;
  private final int baseRow;

  /**
   * Creates a RowResolver.
   *
   * @param row Row at which queries are evaluated
   * @param adviceIo Advice inputs and outputs of the scope
   * @param instanceIo Instance inputs and outputs of the scope
   * @param fixed Values of fixed cells
   * @param baseRow First row of the scope; local advice cells carry their
   *                offset from it
   */
  public RowResolver(int row, CircuitIO adviceIo, CircuitIO instanceIo,
      FixedQueryResolver fixed, int baseRow) {
    this(row, adviceIo, instanceIo, fixed, baseRow, Priority.OUTPUT);
  }

  private RowResolver(int row, CircuitIO adviceIo, CircuitIO instanceIo,
      FixedQueryResolver fixed, int baseRow, Priority priority) {
    this.row = row;
    this.adviceIo = requireNonNull(adviceIo);
    this.instanceIo = requireNonNull(instanceIo);
    this.fixed = requireNonNull(fixed);
    this.baseRow = baseRow;
    this.priority = requireNonNull(priority);
  }

  /** Returns a resolver that resolves cells that are both inputs and
   * outputs as the given role. */
  public RowResolver withPriority(Priority priority) {
    return priority == this.priority
        ? this
        : new RowResolver(row, adviceIo, instanceIo, fixed, baseRow,
            priority);
  }

  /** Returns a resolver for another row of the same scope. */
  public RowResolver atRow(int row) {
    return row == this.row
        ? this
        : new RowResolver(row, adviceIo, instanceIo, fixed, baseRow,
            priority);
  }

  /** Applies a rotation to this resolver's row. */
  public int resolveRotation(int rotation) {
    final int r = row + rotation;
    if (r < 0) {
      throw ResolutionException.rowUnderflow(row, rotation);
    }
    return r;
  }

  @Override public ResolvedQuery resolveQuery(Expression.Query query) {
    final Cell cell = Cell.of(query.column, resolveRotation(query.rotation));
    switch (query.column.type) {
    case FIXED:
      return fixed.resolve(cell)
          .map(ResolvedQuery::lit)
          .orElseGet(() -> ResolvedQuery.io(FuncIO.fixed(cell.column,
              cell.row)));
    case ADVICE:
      final FuncIO advice = resolveIo(adviceIo, cell);
      if (advice == null) {
        return ResolvedQuery.io(
            FuncIO.advice(cell.column, cell.row, cell.row - baseRow));
      }
      return ResolvedQuery.io(stepAdvice(advice));
    case INSTANCE:
      final FuncIO instance = resolveIo(instanceIo, cell);
      if (instance == null) {
        throw new ResolutionException("Instance cell " + cell
            + " is neither an input nor an output");
      }
      return ResolvedQuery.io(instance);
    default:
      throw new AssertionError(query.column.type);
    }
  }

  private @Nullable FuncIO resolveIo(CircuitIO io, Cell cell) {
    final int input = io.inputIndex(cell);
    final int output = io.outputIndex(cell);
    if (input >= 0 && output >= 0) {
      return priority == Priority.INPUT
          ? FuncIO.arg(input)
          : FuncIO.field(output);
    }
    if (input >= 0) {
      return FuncIO.arg(input);
    }
    if (output >= 0) {
      return FuncIO.field(output);
    }
    return null;
  }

  /** Advice cells come after the instance cells of the same role. */
  private FuncIO stepAdvice(FuncIO io) {
    switch (io.kind) {
    case ARG:
      return FuncIO.arg(((FuncIO.Arg) io).n + instanceIo.inputCount());
    case FIELD:
      return FuncIO.field(((FuncIO.Field) io).n + instanceIo.outputCount());
    default:
      throw new AssertionError(io);
    }
  }

  @Override public FuncIO resolveChallenge(Challenge challenge) {
    return FuncIO.challenge(challenge.index, challenge.phase,
        FuncIO.arg(adviceIo.inputCount() + instanceIo.inputCount()
            + challenge.index));
  }

  @Override public ResolvedSelector resolveSelector(Selector selector) {
    throw new ResolutionException("Selector " + selector
        + " cannot be resolved outside of a region");
  }

  /** Which role wins when a cell is both an input and an output. */
  public enum Priority {
    INPUT, OUTPUT
  }
}

// End RowResolver.java
