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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Records the lifecycle of regions.
 *
 * <p>A region is pushed (opened), then committed; at most one region is
 * open at a time. The most recently committed region can be demoted to a
 * table, which gives its index back so that a later region can reuse
 * it. Recovered indices are reused lowest first.
 */
public class RegionRecorder {
  private final List<RegionData> committed = new ArrayList<>();
  private final List<RegionData> tables = new ArrayList<>();
  private final SortedSet<Integer> used = new TreeSet<>();
  private @Nullable RegionData open;
  /** Indices given back by demoted regions, not yet reused. */
  private final SortedSet<Integer> recovered = new TreeSet<>();
  private int next;

  /**
   * Opens a region and reserves its index.
   *
   * <p>The index is {@code explicitIndex} if given; otherwise the lowest
   * index recovered from a demoted table that is still free; otherwise the
   * lowest integer that has not been handed out, skipping indices that are
   * in use.
   */
  public RegionData push(String name, @Nullable Integer explicitIndex,
      int start, List<String> namespaces) {
    if (open != null) {
      throw new SynthesisException("Cannot enter region '" + name
          + "' while " + open + " is open");
    }
    final int index;
    if (explicitIndex != null) {
      if (used.contains(explicitIndex)) {
        throw new SynthesisException("Region index " + explicitIndex
            + " is already in use");
      }
      index = explicitIndex;
    } else {
      recovered.removeAll(used);
      if (!recovered.isEmpty()) {
        index = recovered.first();
      } else {
        while (used.contains(next)) {
          ++next;
        }
        index = next++;
      }
    }
    recovered.remove(index);
    used.add(index);
    open = new RegionData(name, index, start, namespaces);
    return open;
  }

  /** Returns the open region; throws if there is none. */
  public RegionData current() {
    if (open == null) {
      throw new SynthesisException("No region is open");
    }
    return open;
  }

  public @Nullable RegionData currentOrNull() {
    return open;
  }

  /** Commits the open region. */
  public RegionData commit() {
    final RegionData region = current();
    region.freeze();
    committed.add(region);
    open = null;
    return region;
  }

  /** Returns the most recently committed region, or null. */
  public @Nullable RegionData latest() {
    return committed.isEmpty() ? null : committed.get(committed.size() - 1);
  }

  /**
   * Removes the most recently committed region, files it as a table, and
   * makes its index available for the next region.
   */
  public RegionData demoteLatest() {
    if (open != null) {
      throw new SynthesisException("Cannot demote a region while " + open
          + " is open");
    }
    if (committed.isEmpty()) {
      throw new SynthesisException("There is no region to demote");
    }
    final RegionData region = committed.remove(committed.size() - 1);
    tables.add(region);
    used.remove(region.index);
    recovered.add(region.index);
    return region;
  }

  /** Returns the indices of the committed regions and of the open region,
   * if any. */
  public ImmutableSortedSet<Integer> usedIndices() {
    return ImmutableSortedSet.copyOf(used);
  }

  /** Returns the committed regions, in the order they were committed. */
  public ImmutableList<RegionData> committed() {
    return ImmutableList.copyOf(committed);
  }

  /** Returns the regions that were demoted to tables. */
  public ImmutableList<RegionData> tables() {
    return ImmutableList.copyOf(tables);
  }
}

// End RegionRecorder.java
