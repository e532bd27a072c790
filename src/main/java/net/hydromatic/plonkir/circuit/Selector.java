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

/** Per-row boolean that activates gates. */
public final class Selector implements Comparable<Selector> {
  public final int index;
  /** Whether the selector may only appear multiplied with a polynomial. */
  public final boolean simple;

  private Selector(int index, boolean simple) {
    this.index = index;
    this.simple = simple;
  }

  public static Selector of(int index, boolean simple) {
    return new Selector(index, simple);
  }

  /** Returns an expression that evaluates to this selector. */
  public Expression expr() {
    return Expression.selector(this);
  }

  @Override public int compareTo(Selector o) {
    return Integer.compare(index, o.index);
  }

  @Override public int hashCode() {
    return Objects.hash(index, simple);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Selector
        && index == ((Selector) o).index
        && simple == ((Selector) o).simple;
  }

  @Override public String toString() {
    return "s" + index;
  }
}

// End Selector.java
