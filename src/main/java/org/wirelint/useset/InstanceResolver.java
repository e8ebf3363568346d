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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.wirelint.ir.BitId;
import org.wirelint.ir.Expr;
import org.wirelint.ir.ExprBits;
import org.wirelint.ir.ModuleInstance;
import org.wirelint.warn.WarningType;
import org.wirelint.warn.Warnings;

/**
 * Transfers what is known about a submodule's port bits to the bits connected to them in an
 * instantiating module, and leaves {@link Note}s so that pass 2 can do the reverse.
 *
 * <p>The submodule must already have finished pass 1, which the dependency order guarantees.
 * Anything unexpected (missing submodule data, unsupported instance forms, mismatched widths) costs
 * a warning and the connection is ignored.
 */
class InstanceResolver {
  private final ModuleAnalysis analysis;
  private final Function<String, @Nullable ModuleAnalysis> lookup;
  private final BitDatabase db;
  private final ExprBits exprBits;
  private final Warnings warnings;

  /**
   * @param analysis the instantiating module, whose pass 1 is in progress
   * @param lookup returns the completed pass-1 analysis of a submodule, or null if there is none
   */
  InstanceResolver(
      ModuleAnalysis analysis,
      BitDatabase db,
      ExprBits exprBits,
      Function<String, @Nullable ModuleAnalysis> lookup) {
    this.analysis = analysis;
    this.db = db;
    this.exprBits = exprBits;
    this.lookup = lookup;
    this.warnings = analysis.warnings;
  }

  void resolve(ModuleInstance inst) {
    if (inst.range != null) {
      warnings.fudging(inst, "Instance arrays are not supported; ignoring %s", inst.instanceName);
      return;
    } else if (!inst.paramArgs.isEmpty()) {
      warnings.fudging(
          inst, "Parameterized instances are not supported; ignoring %s", inst.instanceName);
      return;
    } else if (!inst.argsResolved) {
      warnings.fudging(inst, "Arguments of %s have not been resolved", inst.instanceName);
      return;
    }
    ModuleAnalysis sub = lookup.apply(inst.moduleName);
    if (sub == null) {
      warnings.fudging(inst, "No use/set information for module %s", inst.moduleName);
      return;
    }
    BitDatabase subDb = sub.db();
    if (subDb == null || sub.alist() == null) {
      warnings.fudging(inst, "No use/set database for module %s", inst.moduleName);
      return;
    }
    ImmutableList<ImmutableList<BitId>> pattern = sub.portPattern();
    if (pattern == null) {
      warnings.fudging(inst, "No port pattern for module %s", inst.moduleName);
      return;
    }
    if (inst.args.size() != pattern.size()) {
      warnings.fatal(
          WarningType.USESET_ARITY_MISMATCH,
          inst,
          "%s has %s arguments but module %s has %s ports",
          inst.instanceName,
          inst.args.size(),
          inst.moduleName,
          pattern.size());
      return;
    }
    for (int i = 0; i < pattern.size(); i++) {
      Expr actual = inst.args.get(i).expr;
      if (actual != null) {
        resolveArg(inst, subDb, pattern.get(i), actual);
      }
    }
  }

  private void resolveArg(
      ModuleInstance inst, BitDatabase subDb, ImmutableList<BitId> formals, Expr actual) {
    ImmutableList<BitId> actualBits = exprBits.lvalueBits(actual);
    int width = (actualBits != null) ? actualBits.size() : exprBits.width(actual);
    if (width != formals.size()) {
      warnings.fatal(
          WarningType.USESET_WIDTH_MISMATCH,
          inst,
          "Argument %s of %s has width %s but the port has width %s",
          actual,
          inst.instanceName,
          (width < 0) ? "unknown" : width,
          formals.size());
      return;
    }
    if (actualBits != null) {
      for (int j = 0; j < formals.size(); j++) {
        BitId formal = formals.get(j);
        BitId bit = actualBits.get(j);
        FlagSet mask = subDb.query(formal).minus(FlagSet.ABOVE);
        db.mark(ImmutableList.of(bit), mask, warnings, inst);
        analysis.addNote(new Note(inst.moduleName, ImmutableList.of(formal), ImmutableList.of(bit)));
      }
    } else {
      FlagSet mask = subDb.union(formals).minus(FlagSet.ABOVE);
      if (mask.trulySet()) {
        warnings.warn(
            WarningType.USESET_TRAINWRECK,
            inst,
            "Port of %s connected to the non-lvalue %s is driven by %s; not treating the wires"
                + " of %s as set",
            inst.instanceName,
            actual,
            inst.moduleName,
            actual);
      }
      if (mask.falselySet()) {
        warnings.warn(
            WarningType.USESET_FUTURE_TRAINWRECK,
            inst,
            "Port of %s connected to the non-lvalue %s is declared as an output of %s; it will be"
                + " driven from both sides if %s ever drives it",
            inst.instanceName,
            actual,
            inst.moduleName,
            inst.moduleName);
      }
      ImmutableSet<BitId> referenced = exprBits.referencedBits(actual);
      db.mark(referenced, mask.minus(FlagSet.SETS), warnings, inst);
      analysis.addNote(new Note(inst.moduleName, formals, referenced.asList()));
    }
  }
}
