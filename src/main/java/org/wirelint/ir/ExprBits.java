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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;
import org.wirelint.ir.Expr.BitSelect;
import org.wirelint.ir.Expr.Concat;
import org.wirelint.ir.Expr.Const;
import org.wirelint.ir.Expr.HierRef;
import org.wirelint.ir.Expr.Id;
import org.wirelint.ir.Expr.Operation;
import org.wirelint.ir.Expr.PartSelect;
import org.wirelint.ir.Expr.Replicate;

/**
 * Translates expressions into the bits of a module's wires.
 *
 * <p>Names that the wire alist doesn't know about (implicit nets, or selects outside the declared
 * range) still produce BitIds; it's up to whoever marks them to complain.
 */
public final class ExprBits {

  private static final ImmutableSet<String> ONE_BIT_UNARY =
      ImmutableSet.of("!", "&", "~&", "|", "~|", "^", "~^", "^~");

  private static final ImmutableSet<String> SAME_WIDTH_UNARY = ImmutableSet.of("~", "-", "+");

  private static final ImmutableSet<String> ONE_BIT_BINARY =
      ImmutableSet.of("==", "!=", "===", "!==", "<", "<=", ">", ">=", "&&", "||");

  private static final ImmutableSet<String> MAX_WIDTH_BINARY =
      ImmutableSet.of("+", "-", "*", "/", "%", "&", "|", "^", "~^", "^~");

  private static final ImmutableSet<String> LEFT_WIDTH_BINARY =
      ImmutableSet.of("<<", ">>", "<<<", ">>>", "**");

  private final WireAlist alist;

  public ExprBits(WireAlist alist) {
    this.alist = alist;
  }

  /**
   * If {@code expr} is an lvalue whose bits can be determined (an identifier, a bit-select with a
   * constant index, a part-select, or a concatenation of these), returns its bits msb-first;
   * otherwise returns null.
   */
  public @Nullable ImmutableList<BitId> lvalueBits(Expr expr) {
    if (expr instanceof Id id) {
      return wireBits(id.name);
    } else if (expr instanceof BitSelect select) {
      Integer index = select.constantIndex();
      return (index == null) ? null : ImmutableList.of(bitAt(select.name, index));
    } else if (expr instanceof PartSelect part) {
      ImmutableList.Builder<BitId> builder = ImmutableList.builder();
      for (int i = 0; i < part.range.width(); i++) {
        builder.add(bitAt(part.name, part.range.indexAt(i)));
      }
      return builder.build();
    } else if (expr instanceof Concat concat) {
      ImmutableList.Builder<BitId> builder = ImmutableList.builder();
      for (Expr part : concat.parts) {
        ImmutableList<BitId> bits = lvalueBits(part);
        if (bits == null) {
          return null;
        }
        builder.addAll(bits);
      }
      return builder.build();
    }
    return null;
  }

  /** Returns every bit whose value {@code expr} reads. */
  public ImmutableSet<BitId> referencedBits(Expr expr) {
    ImmutableSet.Builder<BitId> builder = ImmutableSet.builder();
    addReferenced(expr, builder);
    return builder.build();
  }

  private void addReferenced(Expr expr, ImmutableSet.Builder<BitId> builder) {
    if (expr instanceof Const || expr instanceof HierRef) {
      return;
    } else if (expr instanceof Id || expr instanceof PartSelect) {
      builder.addAll(lvalueBits(expr));
    } else if (expr instanceof BitSelect select) {
      Integer index = select.constantIndex();
      if (index != null) {
        builder.add(bitAt(select.name, index));
      } else {
        builder.addAll(wireBits(select.name));
        addReferenced(select.index, builder);
      }
    } else if (expr instanceof Concat concat) {
      concat.parts.forEach(p -> addReferenced(p, builder));
    } else if (expr instanceof Replicate replicate) {
      addReferenced(replicate.count, builder);
      addReferenced(replicate.inner, builder);
    } else if (expr instanceof Operation operation) {
      operation.args.forEach(a -> addReferenced(a, builder));
    } else {
      throw new AssertionError("Unexpected expression " + expr.getClass().getSimpleName());
    }
  }

  /**
   * Returns the bits driven when {@code expr} is the target of an assignment. A bit-select with a
   * variable index may drive any bit of its wire, so all of them are returned.
   */
  public ImmutableSet<BitId> lhsBits(Expr expr) {
    ImmutableList<BitId> bits = lvalueBits(expr);
    if (bits != null) {
      return ImmutableSet.copyOf(bits);
    } else if (expr instanceof BitSelect select) {
      return ImmutableSet.copyOf(wireBits(select.name));
    } else if (expr instanceof Concat concat) {
      ImmutableSet.Builder<BitId> builder = ImmutableSet.builder();
      concat.parts.forEach(p -> builder.addAll(lhsBits(p)));
      return builder.build();
    }
    // Not a legal lvalue; the best we can do is assume everything in it is driven.
    return referencedBits(expr);
  }

  /** Returns the bits read by the index expressions of an assignment target. */
  public ImmutableSet<BitId> lhsIndexBits(Expr expr) {
    if (expr instanceof BitSelect select && select.constantIndex() == null) {
      return referencedBits(select.index);
    } else if (expr instanceof Concat concat) {
      ImmutableSet.Builder<BitId> builder = ImmutableSet.builder();
      concat.parts.forEach(p -> builder.addAll(lhsIndexBits(p)));
      return builder.build();
    }
    return ImmutableSet.of();
  }

  /** Returns the self-determined width of {@code expr}, or -1 if it can't be determined. */
  public int width(Expr expr) {
    if (expr instanceof Const c) {
      return c.width;
    } else if (expr instanceof Id id) {
      return wireBits(id.name).size();
    } else if (expr instanceof BitSelect) {
      return 1;
    } else if (expr instanceof PartSelect part) {
      return part.range.width();
    } else if (expr instanceof Concat concat) {
      int sum = 0;
      for (Expr part : concat.parts) {
        int w = width(part);
        if (w < 0) {
          return -1;
        }
        sum += w;
      }
      return sum;
    } else if (expr instanceof Replicate replicate) {
      int inner = width(replicate.inner);
      if (replicate.count instanceof Const c && c.value != null && c.value > 0 && inner >= 0) {
        long total = c.value * inner;
        // The product of a positive count and a width that fits in an int can't overflow a long.
        if (c.value <= Integer.MAX_VALUE && total <= Integer.MAX_VALUE) {
          return (int) total;
        }
      }
      return -1;
    } else if (expr instanceof Operation operation) {
      return operationWidth(operation);
    } else if (expr instanceof HierRef) {
      return -1;
    }
    throw new AssertionError("Unexpected expression " + expr.getClass().getSimpleName());
  }

  private int operationWidth(Operation operation) {
    String op = operation.operator;
    ImmutableList<Expr> args = operation.args;
    switch (args.size()) {
      case 1:
        if (ONE_BIT_UNARY.contains(op)) {
          return 1;
        } else if (SAME_WIDTH_UNARY.contains(op)) {
          return width(args.get(0));
        }
        return -1;
      case 2:
        if (ONE_BIT_BINARY.contains(op)) {
          return 1;
        } else if (MAX_WIDTH_BINARY.contains(op)) {
          return maxWidth(args.get(0), args.get(1));
        } else if (LEFT_WIDTH_BINARY.contains(op)) {
          return width(args.get(0));
        }
        return -1;
      default:
        return op.equals("?:") ? maxWidth(args.get(1), args.get(2)) : -1;
    }
  }

  private int maxWidth(Expr x, Expr y) {
    int wx = width(x);
    int wy = width(y);
    return (wx < 0 || wy < 0) ? -1 : Math.max(wx, wy);
  }

  /** All bits of the named wire; an undeclared name is treated as an implicit scalar net. */
  private ImmutableList<BitId> wireBits(String name) {
    WireAlist.Wire wire = alist.wire(name);
    return (wire == null) ? ImmutableList.of(BitId.scalar(name)) : wire.bits;
  }

  private BitId bitAt(String name, int index) {
    WireAlist.Wire wire = alist.wire(name);
    BitId bit = (wire == null) ? null : wire.bitAt(index);
    return (bit == null) ? BitId.of(name, index) : bit;
  }
}
