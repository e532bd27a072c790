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
package net.hydromatic.plonkir.synthesis;

import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Fully-qualified name of an advice cell, used in diagnostics and by
 * backends that name their signals.
 *
 * <p>The printed form is {@code region_idx__ns1__ns2__name}, where every
 * character of a component that is not a letter, digit or underscore has
 * been replaced by an underscore.
 */
public final class Fqn {
  public final String region;
  public final int regionIndex;
  public final ImmutableList<String> namespaces;
  public final String name;

  public Fqn(String region, int regionIndex, List<String> namespaces,
      String name) {
    this.region = requireNonNull(region);
    this.regionIndex = regionIndex;
    this.namespaces = ImmutableList.copyOf(namespaces);
    this.name = requireNonNull(name);
  }

  private static final CharMatcher INVALID =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'))
          .negate()
          .precomputed();

  /** Replaces characters that are not valid in an identifier. */
  static String clean(String s) {
    return INVALID.replaceFrom(s, '_');
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append(clean(region)).append('_').append(regionIndex);
    for (String namespace : namespaces) {
      b.append("__").append(clean(namespace));
    }
    return b.append("__").append(clean(name)).toString();
  }

  @Override public int hashCode() {
    return Objects.hash(region, regionIndex, namespaces, name);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Fqn
        && region.equals(((Fqn) o).region)
        && regionIndex == ((Fqn) o).regionIndex
        && namespaces.equals(((Fqn) o).namespaces)
        && name.equals(((Fqn) o).name);
  }
}

// End Fqn.java
