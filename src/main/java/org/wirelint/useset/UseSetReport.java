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

package org.wirelint.useset;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.wirelint.ir.BitId;

/** The classification of every reported bit of one module. */
public final class UseSetReport {
  public final String module;
  private final ImmutableMap<BitId, BitClass> classes;
  private final ImmutableListMultimap<BitClass, BitId> byClass;

  /** The wires that were left out because they are ignored or hierarchical. */
  public final ImmutableSet<String> skippedWires;

  UseSetReport(String module, Map<BitId, BitClass> classes, ImmutableSet<String> skippedWires) {
    this.module = module;
    this.classes = ImmutableMap.copyOf(classes);
    ImmutableListMultimap.Builder<BitClass, BitId> builder = ImmutableListMultimap.builder();
    classes.forEach((bit, c) -> builder.put(c, bit));
    this.byClass = builder.orderKeysBy(Comparator.naturalOrder()).build();
    this.skippedWires = skippedWires;
  }

  /** Returns the class of {@code bit}, or null if it wasn't classified. */
  public @Nullable BitClass classOf(BitId bit) {
    return classes.get(bit);
  }

  /** Returns the bits in the given class, in database order. */
  public List<BitId> bits(BitClass bitClass) {
    return byClass.get(bitClass);
  }

  /** Returns true if every classified bit is FINE. */
  public boolean allFine() {
    return byClass.keySet().stream().allMatch(c -> c == BitClass.FINE);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(module).append(":");
    for (BitClass c : byClass.keySet()) {
      List<BitId> bits = byClass.get(c);
      sb.append(' ').append(bits.size()).append(' ').append(c.name().toLowerCase(Locale.ROOT));
      if (c != BitClass.FINE) {
        sb.append(' ').append(bits);
      }
      sb.append(';');
    }
    return sb.toString();
  }
}
