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
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * An Expr is an immutable Verilog expression as produced by the parser. Only the handful of forms
 * that matter to bit-level dataflow are distinguished; everything else is an {@link Operation}.
 *
 * <p>The subclasses are nested here, and there are no others.
 */
public abstract class Expr {

  private Expr() {}

  /** Returns an identifier expression. */
  public static Id id(String name) {
    return new Id(name);
  }

  /** Returns a sized constant with a known value. */
  public static Const constant(int width, long value) {
    return new Const(width, value);
  }

  /** Returns an unsized integer constant (self-determined width 32). */
  public static Const integer(long value) {
    return new Const(32, value);
  }

  /** Returns a {@code name[index]} expression with a constant index. */
  public static BitSelect select(String name, int index) {
    return new BitSelect(name, integer(index));
  }

  /** Returns a {@code name[index]} expression. */
  public static BitSelect select(String name, Expr index) {
    return new BitSelect(name, index);
  }

  /** Returns a {@code name[msb:lsb]} expression. */
  public static PartSelect part(String name, int msb, int lsb) {
    return new PartSelect(name, msb, lsb);
  }

  /** Returns a concatenation of the given expressions. */
  public static Concat concat(Expr... parts) {
    return new Concat(Arrays.asList(parts));
  }

  /** Returns an operator application, e.g. {@code op("+", a, b)}. */
  public static Operation op(String operator, Expr... args) {
    return new Operation(operator, Arrays.asList(args));
  }

  /** A constant. {@code value} is null if the constant contains X or Z bits. */
  public static final class Const extends Expr {
    public final int width;
    public final @Nullable Long value;

    public Const(int width, @Nullable Long value) {
      Preconditions.checkArgument(width > 0);
      this.width = width;
      this.value = value;
    }

    @Override
    public String toString() {
      return width + "'" + ((value == null) ? "bx" : "d" + value);
    }
  }

  /** A reference to a wire (net, variable or port) of the enclosing module. */
  public static final class Id extends Expr {
    public final String name;

    public Id(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** {@code name[index]}; the index may be any expression. */
  public static final class BitSelect extends Expr {
    public final String name;
    public final Expr index;

    public BitSelect(String name, Expr index) {
      this.name = Preconditions.checkNotNull(name);
      this.index = Preconditions.checkNotNull(index);
    }

    /** Returns the selected index if it is a known constant, otherwise null. */
    public @Nullable Integer constantIndex() {
      if (index instanceof Const c && c.value != null) {
        return c.value.intValue();
      }
      return null;
    }

    @Override
    public String toString() {
      return name + "[" + index + "]";
    }
  }

  /** {@code name[msb:lsb]} with constant bounds. */
  public static final class PartSelect extends Expr {
    public final String name;
    public final Range range;

    public PartSelect(String name, int msb, int lsb) {
      this.name = Preconditions.checkNotNull(name);
      this.range = new Range(msb, lsb);
    }

    @Override
    public String toString() {
      return name + range;
    }
  }

  /** {@code {a, b, ...}}. */
  public static final class Concat extends Expr {
    public final ImmutableList<Expr> parts;

    public Concat(List<Expr> parts) {
      Preconditions.checkArgument(!parts.isEmpty());
      this.parts = ImmutableList.copyOf(parts);
    }

    @Override
    public String toString() {
      return parts.stream().map(Expr::toString).collect(Collectors.joining(", ", "{", "}"));
    }
  }

  /** {@code {count{inner}}}. */
  public static final class Replicate extends Expr {
    public final Expr count;
    public final Expr inner;

    public Replicate(Expr count, Expr inner) {
      this.count = Preconditions.checkNotNull(count);
      this.inner = Preconditions.checkNotNull(inner);
    }

    @Override
    public String toString() {
      return "{" + count + "{" + inner + "}}";
    }
  }

  /**
   * A unary, binary or ternary operator application. The operator is the Verilog token (e.g.
   * {@code "+"}, {@code "~&"}, {@code "?:"}); unary operators have one argument.
   */
  public static final class Operation extends Expr {
    public final String operator;
    public final ImmutableList<Expr> args;

    public Operation(String operator, List<Expr> args) {
      Preconditions.checkArgument(args.size() >= 1 && args.size() <= 3);
      this.operator = Preconditions.checkNotNull(operator);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public String toString() {
      switch (args.size()) {
        case 1:
          return operator + args.get(0);
        case 2:
          return "(" + args.get(0) + " " + operator + " " + args.get(1) + ")";
        default:
          return "(" + args.get(0) + " ? " + args.get(1) + " : " + args.get(2) + ")";
      }
    }
  }

  /**
   * A hierarchical reference such as {@code top.sub.w}. These are never resolved and contribute no
   * bits to the analysis.
   */
  public static final class HierRef extends Expr {
    public final String path;

    public HierRef(String path) {
      this.path = Preconditions.checkNotNull(path);
    }

    @Override
    public String toString() {
      return path;
    }
  }
}
