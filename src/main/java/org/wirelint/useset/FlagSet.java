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

import static org.wirelint.useset.UseSetFlag.FALSELY_SET;
import static org.wirelint.useset.UseSetFlag.FALSELY_USED;
import static org.wirelint.useset.UseSetFlag.SET_ABOVE;
import static org.wirelint.useset.UseSetFlag.TRULY_SET;
import static org.wirelint.useset.UseSetFlag.TRULY_USED;
import static org.wirelint.useset.UseSetFlag.USED_ABOVE;

import com.google.common.base.Preconditions;
import java.util.StringJoiner;

/**
 * An immutable set of {@link UseSetFlag}s.
 *
 * <p>There are only 64 possible FlagSets and they are all preallocated, so FlagSets can be compared
 * with {@code ==} and creating one never allocates.
 */
public final class FlagSet {
  private static final int ALL_BITS = (1 << UseSetFlag.values().length) - 1;

  private static final FlagSet[] CANONICAL = new FlagSet[ALL_BITS + 1];

  static {
    for (int i = 0; i <= ALL_BITS; i++) {
      CANONICAL[i] = new FlagSet(i);
    }
  }

  public static final FlagSet EMPTY = CANONICAL[0];

  /** {@code used-above} and {@code set-above}; the only flags that pass 2 may add. */
  public static final FlagSet ABOVE = of(USED_ABOVE, SET_ABOVE);

  /** The flags that a module's own contents determine. */
  public static final FlagSet LOCAL = of(TRULY_USED, TRULY_SET, FALSELY_USED, FALSELY_SET);

  /** The flags that say a bit is driven, truly or not. */
  public static final FlagSet SETS = of(TRULY_SET, FALSELY_SET);

  private final int bits;

  private FlagSet(int bits) {
    this.bits = bits;
  }

  /** Returns the FlagSet containing exactly the given flags. */
  public static FlagSet of(UseSetFlag... flags) {
    int bits = 0;
    for (UseSetFlag flag : flags) {
      bits |= flag.mask();
    }
    return CANONICAL[bits];
  }

  /** Returns the FlagSet whose {@link #toInt} is {@code bits}. */
  public static FlagSet fromInt(int bits) {
    Preconditions.checkArgument((bits & ~ALL_BITS) == 0, "Bad flags: %s", bits);
    return CANONICAL[bits];
  }

  /** Returns the flags as an int, with bit {@code i} set for the flag with ordinal {@code i}. */
  public int toInt() {
    return bits;
  }

  @SuppressWarnings("ReferenceEquality")
  public boolean isEmpty() {
    return this == EMPTY;
  }

  public boolean contains(UseSetFlag flag) {
    return (bits & flag.mask()) != 0;
  }

  /** Returns true if every flag in {@code other} is also in this. */
  public boolean containsAll(FlagSet other) {
    return (other.bits & ~bits) == 0;
  }

  public FlagSet with(UseSetFlag flag) {
    return CANONICAL[bits | flag.mask()];
  }

  public FlagSet union(FlagSet other) {
    return CANONICAL[bits | other.bits];
  }

  public FlagSet intersection(FlagSet other) {
    return CANONICAL[bits & other.bits];
  }

  /** Returns the flags in this that are not in {@code other}. */
  public FlagSet minus(FlagSet other) {
    return CANONICAL[bits & ~other.bits];
  }

  /** True if the bit is read in its own module. */
  public boolean trulyUsed() {
    return contains(TRULY_USED);
  }

  /** True if the bit is driven in its own module. */
  public boolean trulySet() {
    return contains(TRULY_SET);
  }

  public boolean falselyUsed() {
    return contains(FALSELY_USED);
  }

  public boolean falselySet() {
    return contains(FALSELY_SET);
  }

  public boolean usedAbove() {
    return contains(USED_ABOVE);
  }

  public boolean setAbove() {
    return contains(SET_ABOVE);
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    for (UseSetFlag flag : UseSetFlag.values()) {
      if (contains(flag)) {
        joiner.add(flag.label);
      }
    }
    return joiner.toString();
  }
}
