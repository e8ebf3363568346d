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

/**
 * An entry in a module's port list. Usually the expression is just an identifier naming a declared
 * port, but Verilog also allows e.g. {@code .p({a, b[3:2]})}, and blank ports have no expression.
 */
public final class Port {
  public final String name;
  public final @Nullable Expr expr;

  public Port(String name, @Nullable Expr expr) {
    this.name = Preconditions.checkNotNull(name);
    this.expr = expr;
  }

  /** Returns the common case, a port whose expression is the identifier of the same name. */
  public static Port named(String name) {
    return new Port(name, Expr.id(name));
  }

  @Override
  public String toString() {
    return (expr == null) ? "." + name + "()" : "." + name + "(" + expr + ")";
  }
}
