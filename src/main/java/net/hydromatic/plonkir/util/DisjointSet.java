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
package net.hydromatic.plonkir.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

/**
 * Partition of the integers {@code 0 .. n - 1} into disjoint classes.
 *
 * <p>Uses union by size and path compression. The representative of a
 * class is one of its members; after {@link #union} it is the
 * representative of the larger class, or of the first argument's class if
 * the sizes are equal.
 */
public class DisjointSet {
  private final int[] parent;
  private final int[] size;

  public DisjointSet(int n) {
    parent = new int[n];
    size = new int[n];
    for (int i = 0; i < n; i++) {
      parent[i] = i;
      size[i] = 1;
    }
  }

  public int size() {
    return parent.length;
  }

  /** Returns the representative of the class that contains {@code i}. */
  public int find(int i) {
    int root = i;
    while (parent[root] != root) {
      root = parent[root];
    }
    while (parent[i] != root) {
      final int next = parent[i];
      parent[i] = root;
      i = next;
    }
    return root;
  }

  /** Merges the classes of {@code a} and {@code b}; returns the
   * representative of the merged class. */
  public int union(int a, int b) {
    int ra = find(a);
    int rb = find(b);
    if (ra == rb) {
      return ra;
    }
    if (size[ra] < size[rb]) {
      final int t = ra;
      ra = rb;
      rb = t;
    }
    parent[rb] = ra;
    size[ra] += size[rb];
    return ra;
  }

  public boolean same(int a, int b) {
    return find(a) == find(b);
  }

  /** Returns the members of each class, keyed by representative, in
   * ascending order. */
  public ImmutableListMultimap<Integer, Integer> classes() {
    final ImmutableListMultimap.Builder<Integer, Integer> b =
        ImmutableListMultimap.builder();
    for (int i = 0; i < parent.length; i++) {
      b.put(find(i), i);
    }
    return b.build();
  }

  /** Returns the members of the class of {@code i}, in ascending order. */
  public ImmutableList<Integer> members(int i) {
    return classes().get(find(i));
  }
}

// End DisjointSet.java
