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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.plonkir.backend.Backend;
import net.hydromatic.plonkir.group.Group;
import net.hydromatic.plonkir.group.GroupKey;
import net.hydromatic.plonkir.ir.GroupBody;
import net.hydromatic.plonkir.util.DisjointSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Strategy that defines one function per class of equivalent groups.
 *
 * <p>Groups are visited callee-first. Each group's call sites are renamed
 * to the functions chosen for their callees; then the group joins the
 * class of the first earlier group with the same key whose body is
 * equivalent, or becomes the leader of a new class with a fresh name. Only
 * leaders are defined. The top level group becomes the main function.
 */
public class GroupsStrategy implements CodegenStrategy {
  @Override public <E> void codegen(CodegenContext context,
      Backend<E> backend) {
    context.lookupStrategy.defineModules(backend, context.synthesis);
    final List<GroupBody> bodies = context.generator().generate();
    final Leaders leaders = Leaders.of(bodies);
    leaders.trace(context);

    for (GroupBody leader : leaders.bodies()) {
      leader.validate(leaders.renamed);
    }
    for (GroupBody leader : leaders.bodies()) {
      if (leader.isTopLevel()) {
        CodegenStrategy.defineMain(backend, leader);
      } else {
        CodegenStrategy.defineFunction(backend, leader.name, leader);
      }
    }
  }

  /** Assignment of each group to the leader of its class. */
  static class Leaders {
    /** Bodies, indexed by group id, with call sites and names changed to
     * those of the leaders. */
    final ImmutableList<GroupBody> renamed;
    final DisjointSet classes;
    /** Ids of leaders, in the order they were chosen. */
    final ImmutableList<Integer> leaderIds;

    private Leaders(List<GroupBody> renamed, DisjointSet classes,
        List<Integer> leaderIds) {
      this.renamed = ImmutableList.copyOf(renamed);
      this.classes = classes;
      this.leaderIds = ImmutableList.copyOf(leaderIds);
    }

    static Leaders of(List<GroupBody> bodies) {
      final NameGenerator names = new NameGenerator();
      names.reserve(Group.TOP_LEVEL_NAME);
      final DisjointSet classes = new DisjointSet(bodies.size());
      final List<GroupBody> renamed = new ArrayList<>();
      final List<Integer> leaderIds = new ArrayList<>();
      final Map<GroupKey, List<Integer>> leadersByKey = new LinkedHashMap<>();
      for (GroupBody body : bodies) {
        final GroupBody b =
            body.withCallsites(c ->
                c.withName(renamed.get(c.calleeId).name));
        if (b.isTopLevel()) {
          renamed.add(b);
          leaderIds.add(b.id);
          continue;
        }
        final List<Integer> candidates =
            leadersByKey.computeIfAbsent(requireNonNull(b.key),
                k -> new ArrayList<>());
        @Nullable GroupBody leader = null;
        for (int candidate : candidates) {
          if (renamed.get(candidate).equivalent(b)) {
            leader = renamed.get(candidate);
            break;
          }
        }
        if (leader != null) {
          classes.union(leader.id, b.id);
          renamed.add(b.withName(leader.name));
        } else {
          candidates.add(b.id);
          leaderIds.add(b.id);
          renamed.add(b.withName(names.fresh(b.name)));
        }
      }
      return new Leaders(renamed, classes, leaderIds);
    }

    /** Returns the bodies of the leaders, callee-first. */
    ImmutableList<GroupBody> bodies() {
      final ImmutableList.Builder<GroupBody> b = ImmutableList.builder();
      leaderIds.forEach(id -> b.add(renamed.get(id)));
      return b.build();
    }

    /** Returns the name of the function that implements a group. */
    String name(int groupId) {
      return renamed.get(groupId).name;
    }

    void trace(CodegenContext context) {
      for (int id : leaderIds) {
        final List<Integer> members = new ArrayList<>();
        for (int i = 0; i < renamed.size(); i++) {
          if (classes.same(i, id)) {
            members.add(i);
          }
        }
        context.tracer.onLeader(renamed.get(id).name, id, members);
      }
    }
  }
}

// End GroupsStrategy.java
