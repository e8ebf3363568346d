/*
 * Copyright 2025 The Wirelint Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wirelint.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders the modules of a design so that every module comes after all the modules it instantiates.
 *
 * <p>Modules are also grouped into levels: a module that instantiates nothing is at level 0, and
 * any other module is one level above the highest of its submodules. No module instantiates
 * another module at the same level.
 *
 * <p>Instances of modules that aren't in the design don't affect the order. Modules that
 * instantiate themselves, directly or indirectly, are reported by {@link #cyclic} and left out.
 */
public final class DependencyOrder {
  private final ImmutableList<String> order;
  private final ImmutableList<ImmutableList<String>> levels;
  private final ImmutableSet<String> cyclic;
  private final ImmutableSet<String> topLevel;

  private DependencyOrder(
      ImmutableList<String> order,
      ImmutableList<ImmutableList<String>> levels,
      ImmutableSet<String> cyclic,
      ImmutableSet<String> topLevel) {
    this.order = order;
    this.levels = levels;
    this.cyclic = cyclic;
    this.topLevel = topLevel;
  }

  public static DependencyOrder compute(Design design) {
    // The submodules of each module, restricted to those actually in the design.
    Map<String, Set<String>> deps = new LinkedHashMap<>();
    Set<String> instantiated = new HashSet<>();
    for (Module module : design.modules) {
      Set<String> subs = new LinkedHashSet<>();
      for (ModuleInstance inst : module.instances) {
        if (design.module(inst.moduleName) != null) {
          subs.add(inst.moduleName);
          instantiated.add(inst.moduleName);
        }
      }
      deps.put(module.name, subs);
    }
    ImmutableSet.Builder<String> cyclic = ImmutableSet.builder();
    for (String name : deps.keySet()) {
      if (reaches(deps, name, name)) {
        cyclic.add(name);
      }
    }
    ImmutableSet<String> cyclicSet = cyclic.build();
    Map<String, Integer> heights = new HashMap<>();
    List<String> names = new ArrayList<>();
    for (String name : deps.keySet()) {
      if (!cyclicSet.contains(name)) {
        height(name, deps, cyclicSet, heights);
        names.add(name);
      }
    }
    // A stable sort, so modules at the same level stay in declaration order.
    names.sort(Comparator.comparing(heights::get));
    List<ImmutableList.Builder<String>> levels = new ArrayList<>();
    for (String name : names) {
      int h = heights.get(name);
      while (levels.size() <= h) {
        levels.add(ImmutableList.builder());
      }
      levels.get(h).add(name);
    }
    ImmutableSet<String> topLevel =
        names.stream()
            .filter(n -> !instantiated.contains(n))
            .collect(ImmutableSet.toImmutableSet());
    return new DependencyOrder(
        ImmutableList.copyOf(names),
        levels.stream().map(ImmutableList.Builder::build).collect(ImmutableList.toImmutableList()),
        cyclicSet,
        topLevel);
  }

  /** Returns true if {@code target} can be reached from {@code start} by one or more steps. */
  private static boolean reaches(Map<String, Set<String>> deps, String start, String target) {
    Set<String> seen = new HashSet<>();
    Deque<String> pending = new ArrayDeque<>(deps.get(start));
    while (!pending.isEmpty()) {
      String next = pending.pop();
      if (next.equals(target)) {
        return true;
      } else if (seen.add(next)) {
        pending.addAll(deps.get(next));
      }
    }
    return false;
  }

  private static int height(
      String name,
      Map<String, Set<String>> deps,
      Set<String> cyclic,
      Map<String, Integer> heights) {
    Integer known = heights.get(name);
    if (known != null) {
      return known;
    }
    int result = 0;
    for (String sub : deps.get(name)) {
      // Cyclic modules get no analysis, so they impose no ordering constraint.
      if (!cyclic.contains(sub)) {
        result = Math.max(result, height(sub, deps, cyclic, heights) + 1);
      }
    }
    heights.put(name, result);
    return result;
  }

  /** Every non-cyclic module, each after all of its submodules. */
  public ImmutableList<String> order() {
    return order;
  }

  /** The modules at each level, starting from level 0. */
  public ImmutableList<ImmutableList<String>> levels() {
    return levels;
  }

  /** The modules that (directly or indirectly) instantiate themselves. */
  public ImmutableSet<String> cyclic() {
    return cyclic;
  }

  /** The non-cyclic modules that no module in the design instantiates. */
  public ImmutableSet<String> topLevel() {
    return topLevel;
  }

  public boolean isTopLevel(String module) {
    return topLevel.contains(module);
  }

  @Override
  public String toString() {
    return order.toString();
  }
}
