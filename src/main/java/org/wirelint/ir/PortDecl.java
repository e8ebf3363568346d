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

/** A port declaration, e.g. {@code output [3:0] q;}. */
public final class PortDecl {
  public final String name;
  public final Direction direction;
  public final @Nullable Range range;

  public PortDecl(String name, Direction direction, @Nullable Range range) {
    this.name = Preconditions.checkNotNull(name);
    this.direction = Preconditions.checkNotNull(direction);
    this.range = range;
  }

  @Override
  public String toString() {
    return direction + ((range == null) ? " " : " " + range + " ") + name + ";";
  }
}
