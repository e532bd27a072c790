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
package net.hydromatic.plonkir.expr;

import com.google.common.collect.ImmutableList;
import net.hydromatic.plonkir.circuit.Expression;

/** Recursive rewriting of an expression was still producing new
 * expressions when it reached its iteration limit. */
public class NonConvergenceException extends RewriteException {
  public final int iterations;
  public final Expression last;

  public NonConvergenceException(int iterations, Expression last) {
    super(Kind.ERROR, "Expression rewriting did not converge after "
        + iterations + " iterations; last expression was " + last,
        ImmutableList.of());
    this.iterations = iterations;
    this.last = last;
  }
}

// End NonConvergenceException.java
