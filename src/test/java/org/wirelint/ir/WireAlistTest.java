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

import com.google.common.collect.Iterables;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirelint.warn.Warning;
import org.wirelint.warn.WarningType;
import org.wirelint.warn.Warnings;

@RunWith(JUnit4.class)
public class WireAlistTest {

  @Test
  public void portsAndNets() {
    Module module =
        Module.builder("m").input("clk").output("q", 3, 0).reg("q", 3, 0).wire("w", 0, 1).build();
    Warnings warnings = new Warnings("m");
    WireAlist alist = WireAlist.forModule(module, warnings);
    assertThat(warnings.isEmpty()).isTrue();
    assertThat(alist.wires()).hasSize(3);
    assertThat(alist.bits("clk")).containsExactly(BitId.scalar("clk"));
    assertThat(alist.bits("q"))
        .containsExactly(BitId.of("q", 3), BitId.of("q", 2), BitId.of("q", 1), BitId.of("q", 0))
        .inOrder();
    assertThat(alist.bits("w")).containsExactly(BitId.of("w", 0), BitId.of("w", 1)).inOrder();
    assertThat(alist.allBits()).hasSize(7);
    assertThat(alist.bits("nope")).isEmpty();
    assertThat(alist.wire("nope")).isNull();
  }

  @Test
  public void bitAt() {
    Module module = Module.builder("m").wire("v", 7, 4).wire("s").build();
    WireAlist alist = WireAlist.forModule(module, new Warnings("m"));
    WireAlist.Wire v = alist.wire("v");
    assertThat(v.width()).isEqualTo(4);
    assertThat(v.bitAt(5)).isSameInstanceAs(BitId.of("v", 5));
    assertThat(v.bitAt(3)).isNull();
    assertThat(alist.wire("s").bitAt(0)).isNull();
    assertThat(v.toString()).isEqualTo("v[7:4]");
  }

  @Test
  public void conflictingRanges() {
    Module module = Module.builder("m").output("q", 3, 0).reg("q", 7, 0).build();
    Warnings warnings = new Warnings("m");
    assertThat(WireAlist.forModule(module, warnings)).isNull();
    Warning warning = Iterables.getOnlyElement(warnings.toList());
    assertThat(warning.type).isEqualTo(WarningType.USESET_BAD_DECLARATION);
    assertThat(warning.fatal).isTrue();
    assertThat(warning.message).contains("q[3:0]");
    assertThat(warning.message).contains("q[7:0]");
  }

  @Test
  public void bitIdsAreInterned() {
    assertThat(BitId.of("x", 3)).isSameInstanceAs(BitId.of("x", 3));
    assertThat(BitId.scalar("x")).isSameInstanceAs(BitId.scalar("x"));
    assertThat(BitId.scalar("x")).isNotEqualTo(BitId.of("x", 0));
    assertThat(BitId.scalar("x").isScalar()).isTrue();
    assertThat(BitId.of("x", 0).isScalar()).isFalse();
  }

  @Test
  public void bitIdOrdering() {
    assertThat(BitId.of("a", 3)).isLessThan(BitId.of("a", 2));
    assertThat(BitId.of("a", 0)).isLessThan(BitId.scalar("b"));
    assertThat(BitId.scalar("a")).isLessThan(BitId.of("a", 7));
    assertThat(BitId.scalar("a").toString()).isEqualTo("a");
    assertThat(BitId.of("a", 3).toString()).isEqualTo("a[3]");
  }
}
