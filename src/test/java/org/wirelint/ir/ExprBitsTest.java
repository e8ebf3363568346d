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

import static com.google.common.truth.Truth.assertThat;
import static org.wirelint.ir.Expr.concat;
import static org.wirelint.ir.Expr.constant;
import static org.wirelint.ir.Expr.id;
import static org.wirelint.ir.Expr.integer;
import static org.wirelint.ir.Expr.op;
import static org.wirelint.ir.Expr.part;
import static org.wirelint.ir.Expr.select;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirelint.warn.Warnings;

@RunWith(JUnit4.class)
public class ExprBitsTest {

  // wire [3:0] a; wire b; reg [0:2] c;
  private static final Module MODULE =
      Module.builder("m").wire("a", 3, 0).wire("b").reg("c", 0, 2).build();

  private final ExprBits exprBits =
      new ExprBits(WireAlist.forModule(MODULE, new Warnings(MODULE.name)));

  private static BitId a(int i) {
    return BitId.of("a", i);
  }

  private static BitId c(int i) {
    return BitId.of("c", i);
  }

  private static final BitId B = BitId.scalar("b");

  @Test
  public void lvalueBitsAreMsbFirst() {
    assertThat(exprBits.lvalueBits(id("a"))).containsExactly(a(3), a(2), a(1), a(0)).inOrder();
    assertThat(exprBits.lvalueBits(id("c"))).containsExactly(c(0), c(1), c(2)).inOrder();
    assertThat(exprBits.lvalueBits(part("a", 2, 1))).containsExactly(a(2), a(1)).inOrder();
    assertThat(exprBits.lvalueBits(part("c", 1, 2))).containsExactly(c(1), c(2)).inOrder();
    assertThat(exprBits.lvalueBits(select("a", 2))).containsExactly(a(2));
    assertThat(exprBits.lvalueBits(id("b"))).containsExactly(B);
  }

  @Test
  public void concatenationsAreLvalues() {
    assertThat(exprBits.lvalueBits(concat(id("b"), part("a", 1, 0))))
        .containsExactly(B, a(1), a(0))
        .inOrder();
  }

  @Test
  public void notLvalues() {
    assertThat(exprBits.lvalueBits(op("&", id("a"), id("b")))).isNull();
    assertThat(exprBits.lvalueBits(select("a", id("b")))).isNull();
    assertThat(exprBits.lvalueBits(constant(4, 3))).isNull();
    assertThat(exprBits.lvalueBits(concat(id("b"), op("~", id("b"))))).isNull();
  }

  @Test
  public void undeclaredNames() {
    // Implicit nets are scalars; out-of-range selects still name a bit.
    assertThat(exprBits.lvalueBits(id("x"))).containsExactly(BitId.scalar("x"));
    assertThat(exprBits.lvalueBits(select("a", 7))).containsExactly(a(7));
  }

  @Test
  public void referencedBits() {
    assertThat(exprBits.referencedBits(op("+", select("a", id("b")), constant(4, 1))))
        .containsExactly(a(3), a(2), a(1), a(0), B);
    assertThat(exprBits.referencedBits(constant(1, 0))).isEmpty();
    assertThat(exprBits.referencedBits(new Expr.HierRef("u.v"))).isEmpty();
    assertThat(exprBits.referencedBits(new Expr.Replicate(integer(2), select("c", 1))))
        .containsExactly(c(1));
  }

  @Test
  public void variableIndexDrivesWholeWire() {
    Expr lhs = select("a", id("b"));
    assertThat(exprBits.lhsBits(lhs)).containsExactly(a(3), a(2), a(1), a(0));
    assertThat(exprBits.lhsIndexBits(lhs)).containsExactly(B);
    assertThat(exprBits.lhsIndexBits(select("a", 1))).isEmpty();
  }

  @Test
  public void lhsOfConcatWithVariableIndex() {
    Expr lhs = concat(select("c", id("b")), select("a", 0));
    assertThat(exprBits.lhsBits(lhs)).containsExactly(c(0), c(1), c(2), a(0));
    assertThat(exprBits.lhsIndexBits(lhs)).containsExactly(B);
  }

  @Test
  public void widths() {
    assertThat(exprBits.width(id("a"))).isEqualTo(4);
    assertThat(exprBits.width(op("==", id("a"), id("b")))).isEqualTo(1);
    assertThat(exprBits.width(op("+", id("a"), id("b")))).isEqualTo(4);
    assertThat(exprBits.width(op("<<", id("c"), id("a")))).isEqualTo(3);
    assertThat(exprBits.width(op("?:", id("b"), id("a"), id("c")))).isEqualTo(4);
    assertThat(exprBits.width(op("&", id("a")))).isEqualTo(1);
    assertThat(exprBits.width(op("~", id("c")))).isEqualTo(3);
    assertThat(exprBits.width(concat(id("a"), id("b")))).isEqualTo(5);
    assertThat(exprBits.width(new Expr.Replicate(integer(3), id("c")))).isEqualTo(9);
    assertThat(exprBits.width(constant(8, 255))).isEqualTo(8);
  }

  @Test
  public void unknownWidths() {
    assertThat(exprBits.width(new Expr.HierRef("u.v"))).isEqualTo(-1);
    assertThat(exprBits.width(new Expr.Replicate(id("b"), id("c")))).isEqualTo(-1);
    assertThat(exprBits.width(op("+", id("a"), new Expr.HierRef("u.v")))).isEqualTo(-1);
  }

  @Test
  public void replicationCountOutOfRange() {
    assertThat(exprBits.width(new Expr.Replicate(integer(0), id("c")))).isEqualTo(-1);
    assertThat(exprBits.width(new Expr.Replicate(integer(-2), id("c")))).isEqualTo(-1);
    // 2^32 + 1 copies of a 1-bit wire; truncating to an int would give 1.
    assertThat(exprBits.width(new Expr.Replicate(integer(4294967297L), id("b")))).isEqualTo(-1);
    assertThat(exprBits.width(new Expr.Replicate(integer(1L << 30), id("a")))).isEqualTo(-1);
    assertThat(exprBits.width(new Expr.Replicate(integer(Integer.MAX_VALUE), id("b"))))
        .isEqualTo(Integer.MAX_VALUE);
  }
}
