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

/** A continuous assignment, {@code assign lhs = rhs;}. */
public final class Assign {
  public final Expr lhs;
  public final Expr rhs;

  public Assign(Expr lhs, Expr rhs) {
    this.lhs = Preconditions.checkNotNull(lhs);
    this.rhs = Preconditions.checkNotNull(rhs);
  }

  @Override
  public String toString() {
    return "assign " + lhs + " = " + rhs + ";";
  }
}
