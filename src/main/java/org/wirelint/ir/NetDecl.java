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
import org.jspecify.annotations.Nullable;

/** A net or variable declaration, e.g. {@code wire [7:0] data;} or {@code supply1 vdd;}. */
public final class NetDecl {
  public final String name;
  public final NetType type;
  public final @Nullable Range range;

  public NetDecl(String name, NetType type, @Nullable Range range) {
    this.name = Preconditions.checkNotNull(name);
    this.type = Preconditions.checkNotNull(type);
    this.range = range;
  }

  @Override
  public String toString() {
    return type + ((range == null) ? " " : " " + range + " ") + name + ";";
  }
}
