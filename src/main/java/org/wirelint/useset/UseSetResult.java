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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;
import org.wirelint.ir.BitId;
import org.wirelint.ir.Design;
import org.wirelint.warn.Warning;

/** Everything a use/set analysis run produced. */
public final class UseSetResult {
  public final Design design;
  private final ImmutableMap<String, ImmutableMap<BitId, FlagSet>> databases;
  private final ImmutableMap<String, UseSetReport> reports;
  private final ImmutableListMultimap<String, Warning> warnings;

  UseSetResult(
      Design design,
      ImmutableMap<String, ImmutableMap<BitId, FlagSet>> databases,
      ImmutableMap<String, UseSetReport> reports,
      ImmutableListMultimap<String, Warning> warnings) {
    this.design = design;
    this.databases = databases;
    this.reports = reports;
    this.warnings = warnings;
  }

  /** The final flags of every bit, for each module that could be analyzed. */
  public ImmutableMap<String, ImmutableMap<BitId, FlagSet>> databases() {
    return databases;
  }

  /** Returns the final database of the given module, or null if it couldn't be analyzed. */
  public @Nullable ImmutableMap<BitId, FlagSet> database(String module) {
    return databases.get(module);
  }

  /** Returns the final flags of a bit, or EMPTY if the module or bit is unknown. */
  public FlagSet flags(String module, BitId bit) {
    ImmutableMap<BitId, FlagSet> db = databases.get(module);
    return (db == null) ? FlagSet.EMPTY : db.getOrDefault(bit, FlagSet.EMPTY);
  }

  /** True if the bit is read in its module or by whatever is connected to it above. */
  public boolean isUsed(String module, BitId bit) {
    FlagSet flags = flags(module, bit);
    return flags.trulyUsed() || flags.usedAbove();
  }

  /** True if the bit is driven in its module or by whatever is connected to it above. */
  public boolean isSet(String module, BitId bit) {
    FlagSet flags = flags(module, bit);
    return flags.trulySet() || flags.setAbove();
  }

  /** Returns the classification of the given module, or null if it couldn't be analyzed. */
  public @Nullable UseSetReport report(String module) {
    return reports.get(module);
  }

  /** Returns the use/set warnings for the given module. */
  public ImmutableList<Warning> warnings(String module) {
    return warnings.get(module);
  }

  /** Returns all the use/set warnings, grouped by module in design order. */
  public ImmutableList<Warning> allWarnings() {
    return ImmutableList.copyOf(warnings.values());
  }

  /** Returns the design with each module's use/set warnings added to the module. */
  public Design annotatedDesign() {
    return new Design(
        design.modules.stream()
            .map(m -> m.withWarnings(warnings.get(m.name)))
            .collect(ImmutableList.toImmutableList()));
  }

  @Override
  public String toString() {
    return reports.values().toString();
  }
}
