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
 * A primitive gate instance such as {@code and g1 (o, a, b);}. The parser resolves the direction of
 * each argument from the gate type where it can.
 */
public final class GateInstance {

  /** One argument to a gate; {@code direction} is null if it could not be resolved. */
  public static final class GateArg {
    public final @Nullable Direction direction;
    public final Expr expr;

    public GateArg(@Nullable Direction direction, Expr expr) {
      this.direction = direction;
      this.expr = Preconditions.checkNotNull(expr);
    }

    public static GateArg input(Expr expr) {
      return new GateArg(Direction.INPUT, expr);
    }

    public static GateArg output(Expr expr) {
      return new GateArg(Direction.OUTPUT, expr);
    }

    @Override
    public String toString() {
      return expr.toString();
    }
  }

  /** The gate type keyword, e.g. "and", "bufif1". */
  public final String type;

  /** The instance name; may be null, since gate instances need not be named. */
  public final @Nullable String name;

  public final ImmutableList<GateArg> args;

  public GateInstance(String type, @Nullable String name, List<GateArg> args) {
    this.type = Preconditions.checkNotNull(type);
    this.name = name;
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public String toString() {
    String argList = args.stream().map(GateArg::toString).collect(Collectors.joining(", "));
    return type + ((name == null) ? "" : " " + name) + " (" + argList + ");";
  }
}
