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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.wirelint.warn.WarningType;
import org.wirelint.warn.Warnings;

/**
 * Maps each wire declared in a module to its ordered (msb-first) list of bits.
 *
 * <p>Port declarations and net declarations both declare wires; the same name may appear in both
 * (e.g. {@code output [3:0] q; reg [3:0] q;}) as long as the ranges agree.
 */
public final class WireAlist {

  /** One declared wire and its bits. */
  public static final class Wire {
    public final String name;
    public final @Nullable Range range;
    public final ImmutableList<BitId> bits;

    Wire(String name, @Nullable Range range) {
      this.name = name;
      this.range = range;
      this.bits = bitsOf(name, range);
    }

    /** Returns the bit with the given index, or null if the index is out of range. */
    public @Nullable BitId bitAt(int index) {
      if (range == null) {
        return null;
      }
      int position = range.position(index);
      return (position < 0) ? null : bits.get(position);
    }

    public int width() {
      return bits.size();
    }

    @Override
    public String toString() {
      return (range == null) ? name : name + range;
    }
  }

  private final ImmutableMap<String, Wire> wires;

  private WireAlist(ImmutableMap<String, Wire> wires) {
    this.wires = wires;
  }

  /**
   * Returns the wire alist of the given module, or null (after adding a fatal warning) if the
   * module declares the same wire with different ranges.
   */
  public static @Nullable WireAlist forModule(Module module, Warnings warnings) {
    Map<String, Wire> wires = new LinkedHashMap<>();
    boolean ok = true;
    for (PortDecl decl : module.portDecls) {
      ok &= addWire(wires, decl.name, decl.range, decl, warnings);
    }
    for (NetDecl decl : module.netDecls) {
      ok &= addWire(wires, decl.name, decl.range, decl, warnings);
    }
    return ok ? new WireAlist(ImmutableMap.copyOf(wires)) : null;
  }

  private static boolean addWire(
      Map<String, Wire> wires,
      String name,
      @Nullable Range range,
      Object decl,
      Warnings warnings) {
    Wire prev = wires.get(name);
    if (prev == null) {
      wires.put(name, new Wire(name, range));
      return true;
    } else if (Objects.equals(prev.range, range)) {
      return true;
    }
    warnings.fatal(
        WarningType.USESET_BAD_DECLARATION,
        decl,
        "'%s' is declared as both %s and %s",
        name,
        prev,
        new Wire(name, range));
    return false;
  }

  /** Returns the bits of a wire with the given declared range, msb first. */
  public static ImmutableList<BitId> bitsOf(String name, @Nullable Range range) {
    if (range == null) {
      return ImmutableList.of(BitId.scalar(name));
    }
    ImmutableList.Builder<BitId> builder = ImmutableList.builderWithExpectedSize(range.width());
    for (int i = 0; i < range.width(); i++) {
      builder.add(BitId.of(name, range.indexAt(i)));
    }
    return builder.build();
  }

  /** Returns the wire with the given name, or null if it was not declared. */
  public @Nullable Wire wire(String name) {
    return wires.get(name);
  }

  /** Returns the bits of the named wire, or an empty list if it was not declared. */
  public ImmutableList<BitId> bits(String name) {
    Wire wire = wires.get(name);
    return (wire == null) ? ImmutableList.of() : wire.bits;
  }

  /** Returns all the declared wires, in declaration order. */
  public ImmutableList<Wire> wires() {
    return wires.values().asList();
  }

  /** Returns every declared bit. */
  public ImmutableSet<BitId> allBits() {
    ImmutableSet.Builder<BitId> builder = ImmutableSet.builder();
    wires.values().forEach(w -> builder.addAll(w.bits));
    return builder.build();
  }

  @Override
  public String toString() {
    return wires.values().toString();
  }
}
