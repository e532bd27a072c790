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
import java.util.function.Consumer;
import net.hydromatic.plonkir.group.GroupCell;
import net.hydromatic.plonkir.ir.GroupBody;
import net.hydromatic.plonkir.synthesis.RegionData;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each committed
   * region, then calls the underlying tracer. */
  public static Tracer withOnRegion(Tracer tracer,
      Consumer<RegionData> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRegion(RegionData region) {
        consumer.accept(region);
        super.onRegion(region);
      }
    };
  }

  /** Returns a tracer that performs the given action on each region that is
   * demoted to a table, then calls the underlying tracer. */
  public static Tracer withOnTable(Tracer tracer,
      Consumer<RegionData> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onTable(RegionData region) {
        consumer.accept(region);
        super.onTable(region);
      }
    };
  }

  public static Tracer withOnFreeCells(Tracer tracer,
      FreeCellsConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onFreeCells(int groupId, String name,
          List<GroupCell> cells) {
        consumer.accept(groupId, name, cells);
        super.onFreeCells(groupId, name, cells);
      }
    };
  }

  public static Tracer withOnGroupBody(Tracer tracer,
      Consumer<GroupBody> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onGroupBody(GroupBody body) {
        consumer.accept(body);
        super.onGroupBody(body);
      }
    };
  }

  public static Tracer withOnLeader(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onLeader(String name, int groupId,
          List<Integer> members) {
        consumer.accept(name);
        super.onLeader(name, groupId, members);
      }
    };
  }

  public static Tracer withOnWarning(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onWarning(String message) {
        consumer.accept(message);
        super.onWarning(message);
      }
    };
  }

  /** Receives the free cells of a group. */
  @FunctionalInterface
  public interface FreeCellsConsumer {
    void accept(int groupId, String name, List<GroupCell> cells);
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRegion(RegionData region) {
    }

    @Override public void onTable(RegionData region) {
    }

    @Override public void onFreeCells(int groupId, String name,
        List<GroupCell> cells) {
    }

    @Override public void onGroupBody(GroupBody body) {
    }

    @Override public void onLeader(String name, int groupId,
        List<Integer> members) {
    }

    @Override public void onWarning(String message) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onRegion(RegionData region) {
      tracer.onRegion(region);
    }

    @Override public void onTable(RegionData region) {
      tracer.onTable(region);
    }

    @Override public void onFreeCells(int groupId, String name,
        List<GroupCell> cells) {
      tracer.onFreeCells(groupId, name, cells);
    }

    @Override public void onGroupBody(GroupBody body) {
      tracer.onGroupBody(body);
    }

    @Override public void onLeader(String name, int groupId,
        List<Integer> members) {
      tracer.onLeader(name, groupId, members);
    }

    @Override public void onWarning(String message) {
      tracer.onWarning(message);
    }
  }
}

// End Tracers.java
