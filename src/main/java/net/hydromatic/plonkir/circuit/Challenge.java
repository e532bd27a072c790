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
package net.hydromatic.plonkir.circuit;

import java.util.Objects;

/** Verifier challenge that becomes available after a given phase. */
public final class Challenge {
  public final int index;
  public final int phase;

  private Challenge(int index, int phase) {
    this.index = index;
    this.phase = phase;
  }

  public static Challenge of(int index, int phase) {
    return new Challenge(index, phase);
  }

  @Override public int hashCode() {
    return Objects.hash(index, phase);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Challenge
        && index == ((Challenge) o).index
        && phase == ((Challenge) o).phase;
  }

  @Override public String toString() {
    return "challenge" + index + "@phase" + phase;
  }
}

// End Challenge.java
