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
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Identifies one bit of one wire: {@code w} for a scalar wire, or {@code w[3]} for a bit of a
 * vector. BitIds are interned, so equal BitIds are usually identical, but equals() and hashCode()
 * don't depend on that.
 *
 * <p>A BitId doesn't name its module; it is only meaningful together with the module whose wires
 * it was made from.
 */
public final class BitId implements Comparable<BitId> {
  private static final Interner<BitId> INTERNER = Interners.newWeakInterner();

  public final String wire;

  /** The bit index, or null for a scalar wire. */
  public final @Nullable Integer index;

  private final int hash;

  private BitId(String wire, @Nullable Integer index) {
    this.wire = Preconditions.checkNotNull(wire);
    this.index = index;
    this.hash = wire.hashCode() * 31 + Objects.hashCode(index);
  }

  /** Returns the BitId of a scalar wire. */
  public static BitId scalar(String wire) {
    return INTERNER.intern(new BitId(wire, null));
  }

  /** Returns the BitId for bit {@code index} of a vector wire. */
  public static BitId of(String wire, int index) {
    return INTERNER.intern(new BitId(wire, index));
  }

  /** True if this is the only bit of a wire declared without a range. */
  public boolean isScalar() {
    return index == null;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof BitId b
        && hash == b.hash
        && wire.equals(b.wire)
        && Objects.equals(index, b.index);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  /** Orders by wire name, then by descending index (so bits of a vector appear msb-first). */
  @Override
  public int compareTo(BitId other) {
    int cmp = wire.compareTo(other.wire);
    if (cmp != 0) {
      return cmp;
    } else if (isScalar() || other.isScalar()) {
      return isScalar() ? (other.isScalar() ? 0 : -1) : 1;
    }
    return Integer.compare(other.index, index);
  }

  @Override
  public String toString() {
    return isScalar() ? wire : wire + "[" + index + "]";
  }
}
