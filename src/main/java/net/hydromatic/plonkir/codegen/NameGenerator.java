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
package net.hydromatic.plonkir.codegen;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique function names.
 *
 * <p>The first request for a name returns the name itself; later requests
 * append an ordinal: "foo", "foo1", "foo2". A name is never returned twice.
 */
public class NameGenerator {
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();
  private final Set<String> used = new HashSet<>();

  /** Marks a name as taken, so that {@link #fresh} never returns it. */
  public void reserve(String name) {
    used.add(name);
  }

  /** Returns a name based on {@code name} that has not been returned
   * before. */
  public String fresh(String name) {
    for (;;) {
      final int n = inc(name);
      final String candidate = n == 0 ? name : name + n;
      if (used.add(candidate)) {
        return candidate;
      }
    }
  }

  /** Returns the number of times that "name" has been requested. */
  private int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .getAndIncrement();
  }
}

// End NameGenerator.java
