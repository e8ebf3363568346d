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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.wirelint.warn.Warning;

/**
 * An immutable Verilog module, as produced by the parser and any earlier transforms.
 *
 * <p>Modules are created with a {@link Builder}. A Module carries the warnings that earlier stages
 * attached to it; {@link #withWarnings} returns a copy with more.
 */
public final class Module {
  public final String name;
  public final ImmutableList<Port> ports;
  public final ImmutableList<PortDecl> portDecls;
  public final ImmutableList<NetDecl> netDecls;
  public final ImmutableList<Assign> assigns;
  public final ImmutableList<GateInstance> gates;
  public final ImmutableList<ModuleInstance> instances;
  public final ImmutableList<ProceduralBlock> blocks;

  /** Wires that the user has asked not to be reported on. */
  public final ImmutableSet<String> ignoredWires;

  public final ImmutableList<Warning> warnings;

  private Module(Builder builder, ImmutableList<Warning> warnings) {
    this.name = builder.name;
    this.ports = builder.ports.build();
    this.portDecls = builder.portDecls.build();
    this.netDecls = builder.netDecls.build();
    this.assigns = builder.assigns.build();
    this.gates = builder.gates.build();
    this.instances = builder.instances.build();
    this.blocks = builder.blocks.build();
    this.ignoredWires = builder.ignoredWires.build();
    this.warnings = warnings;
  }

  private Module(Module base, ImmutableList<Warning> warnings) {
    this.name = base.name;
    this.ports = base.ports;
    this.portDecls = base.portDecls;
    this.netDecls = base.netDecls;
    this.assigns = base.assigns;
    this.gates = base.gates;
    this.instances = base.instances;
    this.blocks = base.blocks;
    this.ignoredWires = base.ignoredWires;
    this.warnings = warnings;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Returns the port declaration for the given name, or null if there is none. */
  public @Nullable PortDecl portDecl(String wire) {
    for (PortDecl decl : portDecls) {
      if (decl.name.equals(wire)) {
        return decl;
      }
    }
    return null;
  }

  /** Returns a copy of this module with the given warnings appended to its own. */
  public Module withWarnings(List<Warning> more) {
    if (more.isEmpty()) {
      return this;
    }
    return new Module(
        this, ImmutableList.<Warning>builder().addAll(warnings).addAll(more).build());
  }

  @Override
  public String toString() {
    return "module " + name;
  }

  /** Accumulates the parts of a Module. */
  public static final class Builder {
    private final String name;
    private final ImmutableList.Builder<Port> ports = ImmutableList.builder();
    private final ImmutableList.Builder<PortDecl> portDecls = ImmutableList.builder();
    private final ImmutableList.Builder<NetDecl> netDecls = ImmutableList.builder();
    private final ImmutableList.Builder<Assign> assigns = ImmutableList.builder();
    private final ImmutableList.Builder<GateInstance> gates = ImmutableList.builder();
    private final ImmutableList.Builder<ModuleInstance> instances = ImmutableList.builder();
    private final ImmutableList.Builder<ProceduralBlock> blocks = ImmutableList.builder();
    private final ImmutableSet.Builder<String> ignoredWires = ImmutableSet.builder();

    private Builder(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    /** Adds an entry to the port list (without declaring it). */
    @CanIgnoreReturnValue
    public Builder port(Port port) {
      ports.add(port);
      return this;
    }

    /** Adds a port list entry with the given name and declares it. */
    @CanIgnoreReturnValue
    public Builder port(String name, Direction direction, @Nullable Range range) {
      ports.add(Port.named(name));
      portDecls.add(new PortDecl(name, direction, range));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder input(String name) {
      return port(name, Direction.INPUT, null);
    }

    @CanIgnoreReturnValue
    public Builder input(String name, int msb, int lsb) {
      return port(name, Direction.INPUT, new Range(msb, lsb));
    }

    @CanIgnoreReturnValue
    public Builder output(String name) {
      return port(name, Direction.OUTPUT, null);
    }

    @CanIgnoreReturnValue
    public Builder output(String name, int msb, int lsb) {
      return port(name, Direction.OUTPUT, new Range(msb, lsb));
    }

    @CanIgnoreReturnValue
    public Builder inout(String name) {
      return port(name, Direction.INOUT, null);
    }

    @CanIgnoreReturnValue
    public Builder portDecl(PortDecl decl) {
      portDecls.add(decl);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder net(NetDecl decl) {
      netDecls.add(decl);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder wire(String name) {
      return net(new NetDecl(name, NetType.WIRE, null));
    }

    @CanIgnoreReturnValue
    public Builder wire(String name, int msb, int lsb) {
      return net(new NetDecl(name, NetType.WIRE, new Range(msb, lsb)));
    }

    @CanIgnoreReturnValue
    public Builder reg(String name) {
      return net(new NetDecl(name, NetType.REG, null));
    }

    @CanIgnoreReturnValue
    public Builder reg(String name, int msb, int lsb) {
      return net(new NetDecl(name, NetType.REG, new Range(msb, lsb)));
    }

    @CanIgnoreReturnValue
    public Builder assign(Expr lhs, Expr rhs) {
      assigns.add(new Assign(lhs, rhs));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder gate(GateInstance gate) {
      gates.add(gate);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder instance(ModuleInstance instance) {
      instances.add(instance);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder always(Statement body) {
      blocks.add(ProceduralBlock.always(body));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder initial(Statement body) {
      blocks.add(ProceduralBlock.initial(body));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder ignore(String... wires) {
      ignoredWires.add(wires);
      return this;
    }

    public Module build() {
      return new Module(this, ImmutableList.of());
    }
  }
}
