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

/** An {@code always} or {@code initial} block. */
public final class ProceduralBlock {
  public final boolean isInitial;
  public final Statement body;

  public ProceduralBlock(boolean isInitial, Statement body) {
    this.isInitial = isInitial;
    this.body = Preconditions.checkNotNull(body);
  }

  public static ProceduralBlock always(Statement body) {
    return new ProceduralBlock(false, body);
  }

  public static ProceduralBlock initial(Statement body) {
    return new ProceduralBlock(true, body);
  }

  @Override
  public String toString() {
    return (isInitial ? "initial " : "always ") + body;
  }
}
