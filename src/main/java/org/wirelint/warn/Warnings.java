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

package org.wirelint.warn;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Collects the warnings for one module. A Warnings is owned by whichever thread is currently
 * analyzing its module and is not synchronized.
 */
public final class Warnings {
  public final String module;
  private final List<Warning> warnings = new ArrayList<>();

  public Warnings(String module) {
    this.module = module;
  }

  public void add(Warning warning) {
    assert warning.module.equals(module);
    warnings.add(warning);
  }

  /** Adds a non-fatal warning. */
  @FormatMethod
  public void warn(WarningType type, @Nullable Object context, String fmt, Object... args) {
    add(new Warning(type, String.format(fmt, args), module, contextString(context), false));
  }

  /** Adds a fatal warning; the caller is expected to abandon the construct it describes. */
  @FormatMethod
  public void fatal(WarningType type, @Nullable Object context, String fmt, Object... args) {
    add(new Warning(type, String.format(fmt, args), module, contextString(context), true));
  }

  /** Adds a non-fatal {@link WarningType#USESET_FUDGING} warning. */
  @FormatMethod
  public void fudging(@Nullable Object context, String fmt, Object... args) {
    warn(WarningType.USESET_FUDGING, context, fmt, args);
  }

  public boolean isEmpty() {
    return warnings.isEmpty();
  }

  public int size() {
    return warnings.size();
  }

  /** Returns the warnings added so far, in order. */
  public ImmutableList<Warning> toList() {
    return ImmutableList.copyOf(warnings);
  }

  private static @Nullable String contextString(@Nullable Object context) {
    return (context == null) ? null : context.toString();
  }

  @Override
  public String toString() {
    return warnings.toString();
  }
}
