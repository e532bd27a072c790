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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plonkir.compile.CompileException;

/** Rewriting a gate or an expression failed. */
public class RewriteException extends CompileException {
  public final Kind kind;
  /** Messages of the rules that failed, if {@link #kind} is
   * {@link Kind#ERROR}. */
  public final ImmutableList<String> errors;

  protected RewriteException(Kind kind, String message, List<String> errors) {
    super(message);
    this.kind = requireNonNull(kind);
    this.errors = ImmutableList.copyOf(errors);
  }

  /** Creates an exception for a gate that no pattern matched. */
  public static RewriteException noMatch(String what) {
    return new RewriteException(Kind.NO_MATCH, "No pattern matched " + what,
        ImmutableList.of());
  }

  /** Creates an exception that aggregates the errors of the patterns that
   * failed. */
  public static RewriteException error(String what, List<String> errors) {
    return new RewriteException(Kind.ERROR,
        "Failed to rewrite " + what + ": " + String.join("; ", errors),
        errors);
  }

  /** Why rewriting failed. */
  public enum Kind {
    NO_MATCH, ERROR
  }
}

// End RewriteException.java
