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

import static org.wirelint.useset.UseSetFlag.SET_ABOVE;
import static org.wirelint.useset.UseSetFlag.USED_ABOVE;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.wirelint.ir.Assign;
import org.wirelint.ir.BitId;
import org.wirelint.ir.ExprBits;
import org.wirelint.ir.GateInstance;
import org.wirelint.ir.Module;
import org.wirelint.ir.ModuleInstance;
import org.wirelint.ir.NetDecl;
import org.wirelint.ir.Port;
import org.wirelint.ir.PortDecl;
import org.wirelint.ir.ProceduralBlock;
import org.wirelint.ir.WireAlist;
import org.wirelint.warn.WarningType;
import org.wirelint.warn.Warnings;

/**
 * The state of the use/set analysis for one module: its wire alist, port pattern and bit database,
 * the notes it left for pass 2, and its warnings.
 *
 * <p>A ModuleAnalysis is created and filled in by {@link #passOne} on a single thread. After that
 * only its database changes, when instantiating modules apply their notes during pass 2.
 */
final class ModuleAnalysis {
  final Module module;
  final Warnings warnings;

  private final @Nullable WireAlist alist;
  private final @Nullable BitDatabase db;
  private final @Nullable ImmutableList<ImmutableList<BitId>> portPattern;

  /** Only modified during this module's pass 1. */
  private final List<Note> notes = new ArrayList<>();

  private ModuleAnalysis(
      Module module,
      Warnings warnings,
      @Nullable WireAlist alist,
      @Nullable BitDatabase db,
      @Nullable ImmutableList<ImmutableList<BitId>> portPattern) {
    this.module = module;
    this.warnings = warnings;
    this.alist = alist;
    this.db = db;
    this.portPattern = portPattern;
  }

  /** Returns a ModuleAnalysis with no database, for a module that can't be analyzed. */
  static ModuleAnalysis failed(Module module, Warnings warnings) {
    return new ModuleAnalysis(module, warnings, null, null, null);
  }

  /**
   * Runs pass 1 on {@code module}: builds its database, marks everything the module's own
   * constructs read and drive, resolves its instances against their (already completed)
   * submodules, and finally marks its false inouts.
   *
   * @param topLevel true if nothing instantiates this module
   * @param lookup returns the completed pass-1 analysis of a submodule, or null if there is none
   */
  static ModuleAnalysis passOne(
      Module module, boolean topLevel, Function<String, @Nullable ModuleAnalysis> lookup) {
    Warnings warnings = new Warnings(module.name);
    WireAlist alist = WireAlist.forModule(module, warnings);
    if (alist == null) {
      // forModule() has already explained why.
      return failed(module, warnings);
    }
    BitDatabase db = BitDatabase.initialize(module.name, alist);
    ExprBits exprBits = new ExprBits(alist);
    ModuleAnalysis result =
        new ModuleAnalysis(module, warnings, alist, db, portPattern(module, alist, warnings));
    Marker marker = new Marker(module, alist, db, warnings);
    if (topLevel) {
      marker.markTopLevelPorts();
    }
    for (NetDecl decl : module.netDecls) {
      marker.markNetDecl(decl);
    }
    for (Assign assign : module.assigns) {
      marker.markAssign(assign);
    }
    for (GateInstance gate : module.gates) {
      marker.markGate(gate);
    }
    for (ProceduralBlock block : module.blocks) {
      marker.markBlock(block);
    }
    InstanceResolver resolver = new InstanceResolver(result, db, exprBits, lookup);
    for (ModuleInstance inst : module.instances) {
      resolver.resolve(inst);
    }
    marker.markFalseInouts();
    return result;
  }

  /**
   * Returns the bits of each entry in the module's port list, or null (after adding a fatal
   * warning) if some port expression isn't an lvalue or the port list doesn't cover exactly the
   * declared ports.
   */
  static @Nullable ImmutableList<ImmutableList<BitId>> portPattern(
      Module module, WireAlist alist, Warnings warnings) {
    ExprBits exprBits = new ExprBits(alist);
    ImmutableList.Builder<ImmutableList<BitId>> pattern = ImmutableList.builder();
    ImmutableSet.Builder<BitId> patternBits = ImmutableSet.builder();
    for (Port port : module.ports) {
      if (port.expr == null) {
        pattern.add(ImmutableList.of());
        continue;
      }
      ImmutableList<BitId> bits = exprBits.lvalueBits(port.expr);
      if (bits == null) {
        warnings.fatal(
            WarningType.USESET_BAD_PORT_PATTERN,
            port,
            "Can't determine the bits of port %s",
            port.name);
        return null;
      }
      pattern.add(bits);
      patternBits.addAll(bits);
    }
    ImmutableSet.Builder<BitId> declBits = ImmutableSet.builder();
    for (PortDecl decl : module.portDecls) {
      declBits.addAll(alist.bits(decl.name));
    }
    ImmutableSet<BitId> fromPorts = patternBits.build();
    ImmutableSet<BitId> fromDecls = declBits.build();
    if (!fromPorts.equals(fromDecls)) {
      warnings.fatal(
          WarningType.USESET_BAD_PORT_PATTERN,
          null,
          "Port list doesn't match the port declarations (undeclared: %s, not in port list: %s)",
          Sets.difference(fromPorts, fromDecls),
          Sets.difference(fromDecls, fromPorts));
      return null;
    }
    return pattern.build();
  }

  /**
   * Runs pass 2 for this module: tells each submodule that it has left notes for how the bits
   * connected to its ports are used and set up here. This module's own database must already
   * include everything its instantiators have told it.
   */
  void passTwo(Function<String, @Nullable ModuleAnalysis> lookup) {
    if (notes.isEmpty()) {
      return;
    }
    BitDatabase own = Preconditions.checkNotNull(db);
    for (Note note : notes) {
      ModuleAnalysis sub = lookup.apply(note.submodule);
      // Notes are only recorded against submodules that had a database during pass 1.
      Preconditions.checkState(sub != null && sub.db != null, "Lost database for %s", note);
      FlagSet actual = own.union(note.actuals);
      FlagSet above = FlagSet.EMPTY;
      if (actual.trulySet() || actual.setAbove()) {
        above = above.with(SET_ABOVE);
      }
      if (actual.trulyUsed() || actual.usedAbove()) {
        above = above.with(USED_ABOVE);
      }
      if (!above.isEmpty()) {
        sub.db.mergeAbove(note.formals, above);
      }
    }
  }

  void addNote(Note note) {
    notes.add(note);
  }

  ImmutableList<Note> notes() {
    return ImmutableList.copyOf(notes);
  }

  /** Drops the notes once pass 2 no longer needs them. */
  void clearNotes() {
    notes.clear();
  }

  @Nullable WireAlist alist() {
    return alist;
  }

  @Nullable BitDatabase db() {
    return db;
  }

  @Nullable ImmutableList<ImmutableList<BitId>> portPattern() {
    return portPattern;
  }

  @Override
  public String toString() {
    return "analysis of " + module.name;
  }
}
