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
package net.hydromatic.plonkir.group;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.plonkir.synthesis.RegionData;
import net.hydromatic.plonkir.synthesis.SynthesisException;

/**
 * The groups of a circuit, in post-order, with the committed regions they
 * own.
 */
public class Groups {
  private final ImmutableList<Group> groups;
  private final ImmutableMap<Integer, RegionData> regionsByIndex;
  private final ImmutableMap<Integer, Integer> ownerByRegion;
  private final ImmutableMap<Integer, Integer> regionStarts;

  /** Creates a Groups.
   *
   * @throws SynthesisException if the regions owned by groups are not the
   * same as the committed regions, a region has more than one owner, or
   * the indices of the committed regions are not 0, 1, ... */
  public Groups(List<Group> groups, List<RegionData> committedRegions) {
    this.groups = ImmutableList.copyOf(groups);
    if (this.groups.isEmpty()
        || !this.groups.get(this.groups.size() - 1).isTopLevel()) {
      throw new SynthesisException("Top level group must be last");
    }
    final Map<Integer, RegionData> regions = new LinkedHashMap<>();
    committedRegions.forEach(r -> regions.put(r.index, r));
    this.regionsByIndex = ImmutableMap.copyOf(regions);
    final ImmutableSortedSet<Integer> indices =
        ImmutableSortedSet.copyOf(regions.keySet());
    if (!indices.isEmpty()
        && (indices.first() != 0 || indices.last() != indices.size() - 1)) {
      throw new SynthesisException("Region indices " + indices
          + " are not contiguous");
    }
    final ImmutableMap.Builder<Integer, Integer> starts =
        ImmutableMap.builder();
    regions.forEach((index, region) -> starts.put(index, region.start));
    this.regionStarts = starts.build();

    final Map<Integer, Integer> owners = new LinkedHashMap<>();
    for (Group group : this.groups) {
      for (int region : group.regions) {
        if (!regions.containsKey(region)) {
          throw new SynthesisException(group + " owns region " + region
              + ", which was not committed");
        }
        final Integer previous = owners.put(region, group.id);
        if (previous != null) {
          throw new SynthesisException("Region " + region
              + " is owned by groups " + previous + " and " + group.id);
        }
      }
    }
    for (int region : regions.keySet()) {
      if (!owners.containsKey(region)) {
        throw new SynthesisException("Region " + region
            + " is not owned by any group");
      }
    }
    this.ownerByRegion = ImmutableMap.copyOf(owners);
  }

  public ImmutableList<Group> list() {
    return groups;
  }

  public Group get(int id) {
    return groups.get(id);
  }

  public int size() {
    return groups.size();
  }

  public Group topLevel() {
    return groups.get(groups.size() - 1);
  }

  /** Returns the committed regions, keyed by index. */
  public ImmutableMap<Integer, RegionData> regionsByIndex() {
    return regionsByIndex;
  }

  public RegionData region(int index) {
    final RegionData region = regionsByIndex.get(index);
    if (region == null) {
      throw new SynthesisException("Region with index " + index
          + " is not a known region");
    }
    return region;
  }

  /** Returns the id of the group that owns a region. */
  public int owner(int regionIndex) {
    final Integer owner = ownerByRegion.get(regionIndex);
    if (owner == null) {
      throw new SynthesisException("Region with index " + regionIndex
          + " is not a known region");
    }
    return owner;
  }

  /** Returns the first row of each committed region, keyed by index. */
  public ImmutableMap<Integer, Integer> regionStarts() {
    return regionStarts;
  }

  /** Returns the regions owned directly by a group. */
  public List<RegionData> regionsOf(Group group) {
    final List<RegionData> list = new ArrayList<>();
    group.regions.forEach(index -> list.add(region(index)));
    return list;
  }

  /** Returns the first row of the regions owned by a group and its
   * descendants, or 0 if there are none. */
  public int baseRow(Group group) {
    final int base = minRow(group);
    return base == Integer.MAX_VALUE ? 0 : base;
  }

  private int minRow(Group group) {
    int base = Integer.MAX_VALUE;
    for (RegionData region : regionsOf(group)) {
      base = Math.min(base, region.start);
    }
    for (int child : group.children) {
      base = Math.min(base, minRow(get(child)));
    }
    return base;
  }
}

// End Groups.java
