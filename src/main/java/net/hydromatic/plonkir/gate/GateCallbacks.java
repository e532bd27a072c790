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
import java.util.List;
import net.hydromatic.plonkir.compile.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Lets a client control how gates are lowered. */
public interface GateCallbacks {
  /** The default callbacks: no extra patterns. */
  GateCallbacks DEFAULT = new GateCallbacks() {
  };

  /** Returns patterns to try before the fallback, in order. */
  default List<GateRewritePattern> patterns() {
    return ImmutableList.of();
  }

  /** Returns whether polynomials whose selectors are all disabled at a row
   * are omitted at that row. If null, the {@link Prop#IGNORE_DISABLED_GATES}
   * property decides. */
  default @Nullable Boolean ignoreDisabledGates() {
    return null;
  }
}

// End GateCallbacks.java
