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
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A set of modules with distinct names, in the order they were read. */
public final class Design {
  public final ImmutableList<Module> modules;
  private final ImmutableMap<String, Module> byName;

  public Design(List<Module> modules) {
    Map<String, Module> map = new LinkedHashMap<>();
    for (Module module : modules) {
      Module prev = map.put(module.name, module);
      Preconditions.checkArgument(prev == null, "Duplicate module '%s'", module.name);
    }
    this.modules = ImmutableList.copyOf(modules);
    this.byName = ImmutableMap.copyOf(map);
  }

  public static Design of(Module... modules) {
    return new Design(ImmutableList.copyOf(modules));
  }

  /** Returns the module with the given name, or null if there is none. */
  public @Nullable Module module(String name) {
    return byName.get(name);
  }

  @Override
  public String toString() {
    return byName.keySet().toString();
  }
}
