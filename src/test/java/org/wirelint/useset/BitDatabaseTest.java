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

package org.wirelint.useset;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.wirelint.useset.UseSetFlag.FALSELY_SET;
import static org.wirelint.useset.UseSetFlag.SET_ABOVE;
import static org.wirelint.useset.UseSetFlag.TRULY_SET;
import static org.wirelint.useset.UseSetFlag.TRULY_USED;
import static org.wirelint.useset.UseSetFlag.USED_ABOVE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.wirelint.ir.BitId;
import org.wirelint.ir.Module;
import org.wirelint.ir.WireAlist;
import org.wirelint.warn.Warning;
import org.wirelint.warn.WarningType;
import org.wirelint.warn.Warnings;

@RunWith(JUnit4.class)
public class BitDatabaseTest {

  private static final Module MODULE = Module.builder("m").input("i").wire("w", 1, 0).build();
  private static final BitId I = BitId.scalar("i");
  private static final BitId W1 = BitId.of("w", 1);
  private static final BitId W0 = BitId.of("w", 0);

  private final Warnings warnings = new Warnings("m");

  private BitDatabase newDatabase() {
    return BitDatabase.initialize("m", WireAlist.forModule(MODULE, warnings));
  }

  @Test
  public void initiallyEmpty() {
    BitDatabase db = newDatabase();
    assertThat(db.size()).isEqualTo(3);
    assertThat(db.shrink())
        .containsExactly(I, FlagSet.EMPTY, W1, FlagSet.EMPTY, W0, FlagSet.EMPTY);
    assertThat(db.isDeclared(W0)).isTrue();
    assertThat(db.query(BitId.scalar("nope"))).isSameInstanceAs(FlagSet.EMPTY);
    assertThat(db.contains(BitId.scalar("nope"))).isFalse();
  }

  @Test
  public void marksAccumulate() {
    BitDatabase db = newDatabase();
    db.mark(ImmutableList.of(W1), Marker.USED, warnings, null);
    db.mark(ImmutableList.of(W1, W0), Marker.SET, warnings, null);
    db.mark(ImmutableList.of(W1), FlagSet.EMPTY, warnings, null);
    assertThat(db.query(W1)).isSameInstanceAs(FlagSet.of(TRULY_USED, TRULY_SET));
    assertThat(db.query(W0)).isSameInstanceAs(FlagSet.of(TRULY_SET));
    assertThat(db.query(I)).isSameInstanceAs(FlagSet.EMPTY);
    assertThat(db.union(ImmutableList.of(W0, I))).isSameInstanceAs(FlagSet.of(TRULY_SET));
    assertThat(db.union(ImmutableList.of())).isSameInstanceAs(FlagSet.EMPTY);
    assertThat(warnings.isEmpty()).isTrue();
  }

  @Test
  public void markingOrderDoesNotMatter() {
    FlagSet[] masks = {
      Marker.USED, FlagSet.of(FALSELY_SET), Marker.SET, Marker.USED, FlagSet.of(SET_ABOVE)
    };
    BitDatabase forward = newDatabase();
    BitDatabase backward = newDatabase();
    for (int i = 0; i < masks.length; i++) {
      forward.mark(ImmutableList.of(W0), masks[i], warnings, null);
      backward.mark(ImmutableList.of(W0), masks[masks.length - 1 - i], warnings, null);
    }
    assertThat(forward.shrink()).isEqualTo(backward.shrink());
  }

  @Test
  public void undeclaredBitsAreAddedWithAWarning() {
    BitDatabase db = newDatabase();
    BitId stray = BitId.of("w", 5);
    db.mark(ImmutableList.of(stray), Marker.USED, warnings, "assign x = w[5]");
    db.mark(ImmutableList.of(stray), Marker.SET, warnings, "assign w[5] = 1");
    assertThat(db.query(stray)).isSameInstanceAs(FlagSet.of(TRULY_USED, TRULY_SET));
    assertThat(db.isDeclared(stray)).isFalse();
    assertThat(db.size()).isEqualTo(4);
    // Only the first mark creates the binding, so only it warns.
    Warning warning = Iterables.getOnlyElement(warnings.toList());
    assertThat(warning.type).isEqualTo(WarningType.USESET_UNDECLARED);
    assertThat(warning.fatal).isFalse();
    assertThat(warning.context).isEqualTo("assign x = w[5]");
  }

  @Test
  public void mergeAbove() {
    BitDatabase db = newDatabase();
    db.mark(ImmutableList.of(I), Marker.USED, warnings, null);
    db.mergeAbove(ImmutableList.of(I), FlagSet.of(SET_ABOVE));
    db.mergeAbove(ImmutableList.of(I), FlagSet.of(USED_ABOVE));
    assertThat(db.query(I)).isSameInstanceAs(FlagSet.of(TRULY_USED, USED_ABOVE, SET_ABOVE));
  }

  @Test
  public void mergeAboveRejectsLocalFlags() {
    BitDatabase db = newDatabase();
    assertThrows(
        IllegalArgumentException.class,
        () -> db.mergeAbove(ImmutableList.of(I), FlagSet.of(USED_ABOVE, TRULY_SET)));
    assertThat(db.query(I)).isSameInstanceAs(FlagSet.EMPTY);
  }

  @Test
  public void shrinkIsASnapshot() {
    BitDatabase db = newDatabase();
    ImmutableMap<BitId, FlagSet> before = db.shrink();
    db.mark(ImmutableList.of(I), Marker.USED, warnings, null);
    assertThat(before.get(I)).isSameInstanceAs(FlagSet.EMPTY);
    assertThat(db.shrink().get(I)).isSameInstanceAs(Marker.USED);
  }
}
