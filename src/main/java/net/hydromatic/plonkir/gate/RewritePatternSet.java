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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.hydromatic.plonkir.compile.CompileException;
import net.hydromatic.plonkir.expr.RewriteException;
import net.hydromatic.plonkir.ir.Stmt;

/**
 * Ordered list of patterns. The first pattern that matches decides how a
 * gate is lowered.
 *
 * <p>A pattern that fails does not stop the search; if no later pattern
 * matches, the failures are reported together.
 */
public class RewritePatternSet implements GateRewritePattern {
  private final ImmutableList<GateRewritePattern> patterns;

  public RewritePatternSet(List<? extends GateRewritePattern> patterns) {
    this.patterns = ImmutableList.copyOf(patterns);
  }

  /** Creates the patterns for a compilation: the client's patterns, then
   * a {@link FallbackGateRewriter}. */
  public static RewritePatternSet load(GateCallbacks callbacks,
      boolean ignoreDisabled) {
    return new RewritePatternSet(
        ImmutableList.<GateRewritePattern>builder()
            .addAll(callbacks.patterns())
            .add(new FallbackGateRewriter(ignoreDisabled))
            .build());
  }

  public ImmutableList<GateRewritePattern> patterns() {
    return patterns;
  }

  @Override public Optional<Stmt<RowExpression>> matchAndRewrite(
      GateScope scope) {
    final List<String> errors = new ArrayList<>();
    for (GateRewritePattern pattern : patterns) {
      try {
        final Optional<Stmt<RowExpression>> result =
            pattern.matchAndRewrite(scope);
        if (result.isPresent()) {
          return result;
        }
      } catch (RewriteException e) {
        if (e.kind != RewriteException.Kind.NO_MATCH) {
          errors.add(e.getMessage());
        }
      } catch (CompileException e) {
        errors.add(e.getMessage());
      }
    }
    if (!errors.isEmpty()) {
      throw RewriteException.error(scope.toString(), errors);
    }
    return Optional.empty();
  }

  /** Rewrites a gate, failing if no pattern matches. */
  public Stmt<RowExpression> rewrite(GateScope scope) {
    return matchAndRewrite(scope)
        .orElseThrow(() -> RewriteException.noMatch(scope.toString()));
  }
}

// End RewritePatternSet.java
