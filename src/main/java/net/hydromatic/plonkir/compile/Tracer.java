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
package net.hydromatic.plonkir.compile;

import java.util.List;
import net.hydromatic.plonkir.group.GroupCell;
import net.hydromatic.plonkir.ir.GroupBody;
import net.hydromatic.plonkir.synthesis.RegionData;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when a region is committed. */
  void onRegion(RegionData region);

  /** Called when a region is demoted to a lookup table. */
  void onTable(RegionData region);

  /** Called after free-cell lifting, for each group that has free cells. */
  void onFreeCells(int groupId, String name, List<GroupCell> cells);

  /** Called when the IR of a group has been generated, folded and
   * canonicalized. */
  void onGroupBody(GroupBody body);

  /**
   * Called when a group is chosen to represent a class of equivalent
   * groups.
   *
   * @param name Name of the function that will be generated
   * @param groupId Id of the leader
   * @param members Ids of all groups in the class, including the leader
   */
  void onLeader(String name, int groupId, List<Integer> members);

  /** Called with a condition that does not stop compilation. */
  void onWarning(String message);
}

// End Tracer.java
