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

import java.util.Optional;
import net.hydromatic.plonkir.expr.RewriteException;
import net.hydromatic.plonkir.ir.Stmt;

/**
 * Decides how the polynomials of a gate become statements in one region.
 *
 * <p>Implement either {@link #match} and {@link #rewrite}, or
 * {@link #matchAndRewrite}. Rewrites must preserve the semantics of the
 * gate.
 */
public interface GateRewritePattern {
  /** Returns whether this pattern applies to a gate in a region. */
  default boolean match(GateScope scope) {
    throw new UnsupportedOperationException(
        "Implement match and rewrite, or matchAndRewrite");
  }

  /** Rewrites a gate that {@link #match} accepted.
   *
   * @throws RewriteException if the gate cannot be rewritten */
  default Stmt<RowExpression> rewrite(GateScope scope) {
    throw new UnsupportedOperationException(
        "Implement match and rewrite, or matchAndRewrite");
  }

  /** Returns the statements for a gate in a region, or empty if this pattern
   * does not apply. */
  default Optional<Stmt<RowExpression>> matchAndRewrite(GateScope scope) {
    if (!match(scope)) {
      return Optional.empty();
    }
    return Optional.of(rewrite(scope));
  }
}

// End GateRewritePattern.java
