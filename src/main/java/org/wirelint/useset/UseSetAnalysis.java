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
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountedCompleter;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.wirelint.ir.BitId;
import org.wirelint.ir.DependencyOrder;
import org.wirelint.ir.Design;
import org.wirelint.ir.Module;
import org.wirelint.warn.Warning;
import org.wirelint.warn.WarningType;
import org.wirelint.warn.Warnings;

/**
 * Determines, for every bit of every wire in a design, whether it is used and whether it is set,
 * and warns about the bits that look wrong.
 *
 * <p>The analysis has three steps:
 *
 * <ol>
 *   <li>Pass 1 visits modules leaves first. Each module's own constructs are marked, and what is
 *       already known about each submodule's ports is copied to the wires connected to them. Each
 *       connection also leaves a {@link Note}.
 *   <li>Pass 2 visits modules in the opposite order. Each module uses its notes to tell its
 *       submodules whether the wires connected to their ports are used or set up here; by the time
 *       a module is visited, all of its instantiators have already done this for it.
 *   <li>Each module's final database is classified and reported on.
 * </ol>
 *
 * <p>Problems with individual modules or instances only produce warnings; the analysis of the rest
 * of the design always completes.
 *
 * <p>With {@link UseSetOptions#parallel}, the modules of each dependency level are processed
 * concurrently; no module instantiates another at the same level, so a barrier between levels is
 * all the ordering either pass needs.
 */
public final class UseSetAnalysis {
  private final Design design;
  private final UseSetOptions options;
  private final DependencyOrder order;

  /** Written by pass 1 (possibly concurrently), then only read. */
  private final Map<String, ModuleAnalysis> analyses = new ConcurrentHashMap<>();

  private UseSetAnalysis(Design design, UseSetOptions options) {
    this.design = design;
    this.options = options;
    this.order = DependencyOrder.compute(design);
  }

  /** Analyzes {@code design} with the default options. */
  public static UseSetResult run(Design design) {
    return run(design, UseSetOptions.DEFAULT);
  }

  /** Analyzes {@code design}. */
  public static UseSetResult run(Design design, UseSetOptions options) {
    UseSetAnalysis analysis = new UseSetAnalysis(design, options);
    analysis.passOne();
    analysis.passTwo();
    return analysis.classify();
  }

  /** Runs pass 1 only; for tests that want to look at the intermediate state. */
  static UseSetAnalysis passOneOnly(Design design, UseSetOptions options) {
    UseSetAnalysis analysis = new UseSetAnalysis(design, options);
    analysis.passOne();
    return analysis;
  }

  private @Nullable ModuleAnalysis lookup(String module) {
    return analyses.get(module);
  }

  /** Returns the analysis of the named module, or null if it has none (yet). */
  @Nullable ModuleAnalysis analysis(String module) {
    return lookup(module);
  }

  void passOne() {
    for (String name : order.cyclic()) {
      Module module = design.module(name);
      Warnings warnings = new Warnings(name);
      warnings.fatal(
          WarningType.USESET_CYCLE, null, "%s instantiates itself; it will not be analyzed", name);
      analyses.put(name, ModuleAnalysis.failed(module, warnings));
    }
    Consumer<String> step =
        name ->
            analyses.put(
                name,
                ModuleAnalysis.passOne(design.module(name), order.isTopLevel(name), this::lookup));
    if (options.parallel) {
      order.levels().forEach(level -> forEachConcurrently(level, step));
    } else {
      order.order().forEach(step);
    }
  }

  void passTwo() {
    Consumer<String> step = name -> analyses.get(name).passTwo(this::lookup);
    if (options.parallel) {
      order.levels().reverse().forEach(level -> forEachConcurrently(level, step));
    } else {
      order.order().reverse().forEach(step);
    }
    analyses.values().forEach(ModuleAnalysis::clearNotes);
  }

  private UseSetResult classify() {
    UseSetClassifier classifier = new UseSetClassifier(options);
    ImmutableMap.Builder<String, ImmutableMap<BitId, FlagSet>> databases = ImmutableMap.builder();
    ImmutableMap.Builder<String, UseSetReport> reports = ImmutableMap.builder();
    ImmutableListMultimap.Builder<String, Warning> warnings = ImmutableListMultimap.builder();
    for (Module module : design.modules) {
      ModuleAnalysis analysis = analyses.get(module.name);
      BitDatabase db = analysis.db();
      if (db != null) {
        ImmutableMap<BitId, FlagSet> flags = db.shrink();
        databases.put(module.name, flags);
        reports.put(
            module.name, classifier.classify(module, analysis.alist(), flags, analysis.warnings));
      }
      warnings.putAll(module.name, analysis.warnings.toList());
    }
    return new UseSetResult(design, databases.build(), reports.build(), warnings.build());
  }

  /**
   * Calls {@code action} on each of {@code names} in the common ForkJoinPool, and returns when all
   * of the calls have completed.
   */
  private static void forEachConcurrently(List<String> names, Consumer<String> action) {
    // The base task doesn't do anything itself; it just waits for all its children to complete.
    CountedCompleter<Void> baseTask =
        new CountedCompleter<Void>() {
          @Override
          public void compute() {
            tryComplete();
          }
        };
    for (String name : names) {
      baseTask.addToPendingCount(1);
      new CountedCompleter<Void>(baseTask) {
        @Override
        public void compute() {
          action.accept(name);
          tryComplete();
        }
      }.fork();
    }
    baseTask.invoke();
  }

  /** The order in which pass 1 visits modules. */
  ImmutableList<String> passOneOrder() {
    return order.order();
  }
}
