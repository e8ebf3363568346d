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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Locale;

/** Settings for a use/set analysis run. */
public final class UseSetOptions {

  /** Wires whose names start with one of these (ignoring case) are never reported. */
  public static final ImmutableList<String> BUILTIN_IGNORED_PREFIXES =
      ImmutableList.of("unused", "spare");

  public static final UseSetOptions DEFAULT = builder().build();

  /** If true, modules at the same dependency level are analyzed concurrently. */
  public final boolean parallel;

  /** Wire names that are not reported in any module. */
  public final ImmutableSet<String> globalIgnoredWires;

  /** If false, {@link #BUILTIN_IGNORED_PREFIXES} are not applied. */
  public final boolean builtinIgnores;

  private UseSetOptions(Builder builder) {
    this.parallel = builder.parallel;
    this.globalIgnoredWires = builder.globalIgnoredWires.build();
    this.builtinIgnores = builder.builtinIgnores;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options from the system properties {@code wirelint.parallel} (default false), {@code
   * wirelint.ignore} (a comma-separated list of wire names, default empty) and {@code
   * wirelint.builtinIgnores} (default true).
   */
  public static UseSetOptions fromSystemProperties() {
    Builder builder = builder();
    builder.parallel(Boolean.parseBoolean(System.getProperty("wirelint.parallel", "false")));
    builder.builtinIgnores(
        Boolean.parseBoolean(System.getProperty("wirelint.builtinIgnores", "true")));
    String ignore = System.getProperty("wirelint.ignore", "");
    Splitter.on(',').trimResults().omitEmptyStrings().split(ignore).forEach(builder::ignore);
    return builder.build();
  }

  /** Returns true if wires with this name are never reported in {@code moduleIgnores}' module. */
  boolean isIgnored(String wire, ImmutableSet<String> moduleIgnores) {
    if (moduleIgnores.contains(wire) || globalIgnoredWires.contains(wire)) {
      return true;
    } else if (builtinIgnores) {
      String lower = wire.toLowerCase(Locale.ROOT);
      return BUILTIN_IGNORED_PREFIXES.stream().anyMatch(lower::startsWith);
    }
    return false;
  }

  @Override
  public String toString() {
    return String.format(
        "UseSetOptions(parallel=%s, ignore=%s, builtinIgnores=%s)",
        parallel, globalIgnoredWires, builtinIgnores);
  }

  /** Builds a UseSetOptions. */
  public static final class Builder {
    private boolean parallel;
    private final ImmutableSet.Builder<String> globalIgnoredWires = ImmutableSet.builder();
    private boolean builtinIgnores = true;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder ignore(String wire) {
      globalIgnoredWires.add(wire);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder builtinIgnores(boolean builtinIgnores) {
      this.builtinIgnores = builtinIgnores;
      return this;
    }

    public UseSetOptions build() {
      return new UseSetOptions(this);
    }
  }
}
