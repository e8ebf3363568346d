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
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An instance of a submodule, e.g. {@code adder #(8) u1 (.a(x), .b(y), .s(z));}.
 *
 * <p>If {@link #argsResolved} is true, {@link #args} are positional: the i-th argument connects to
 * the i-th entry of the submodule's port list. Otherwise they are still named connections that
 * nobody has matched up with the submodule's ports.
 */
public final class ModuleInstance {

  /** A connection; {@code expr} is null for a blank connection such as {@code .p()}. */
  public static final class PortArg {
    public final @Nullable String name;
    public final @Nullable Expr expr;

    public PortArg(@Nullable String name, @Nullable Expr expr) {
      this.name = name;
      this.expr = expr;
    }

    public static PortArg positional(@Nullable Expr expr) {
      return new PortArg(null, expr);
    }

    @Override
    public String toString() {
      String value = (expr == null) ? "" : expr.toString();
      return (name == null) ? value : "." + name + "(" + value + ")";
    }
  }

  public final String instanceName;
  public final String moduleName;

  /** The range of an instance array ({@code foo u[3:0] (...)}), or null. */
  public final @Nullable Range range;

  public final ImmutableList<Expr> paramArgs;
  public final ImmutableList<PortArg> args;
  public final boolean argsResolved;

  public ModuleInstance(
      String instanceName,
      String moduleName,
      @Nullable Range range,
      List<Expr> paramArgs,
      List<PortArg> args,
      boolean argsResolved) {
    this.instanceName = Preconditions.checkNotNull(instanceName);
    this.moduleName = Preconditions.checkNotNull(moduleName);
    this.range = range;
    this.paramArgs = ImmutableList.copyOf(paramArgs);
    this.args = ImmutableList.copyOf(args);
    this.argsResolved = argsResolved;
  }

  /** Returns an unparameterized, non-array instance with resolved positional arguments. */
  public static ModuleInstance of(String instanceName, String moduleName, Expr... args) {
    ImmutableList.Builder<PortArg> portArgs = ImmutableList.builder();
    for (Expr arg : args) {
      portArgs.add(PortArg.positional(arg));
    }
    return new ModuleInstance(
        instanceName, moduleName, null, ImmutableList.of(), portArgs.build(), true);
  }

  @Override
  public String toString() {
    String argList = args.stream().map(PortArg::toString).collect(Collectors.joining(", "));
    return moduleName + " " + instanceName + ((range == null) ? "" : range.toString())
        + " (" + argList + ");";
  }
}
