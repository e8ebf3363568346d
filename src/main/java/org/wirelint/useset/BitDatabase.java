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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.wirelint.ir.BitId;
import org.wirelint.ir.WireAlist;
import org.wirelint.warn.WarningType;
import org.wirelint.warn.Warnings;

/**
 * Maps each bit of one module to the flags recorded for it so far.
 *
 * <p>Flags only accumulate: every update is a union, so nothing recorded is ever lost and the
 * order of updates doesn't matter. Updates are synchronized, since during pass 2 several
 * instantiating modules may merge flags into the same submodule's database at once.
 */
public final class BitDatabase {
  public final String module;

  /** The bits of the wire alist the database was created from. */
  private final ImmutableSet<BitId> declared;

  @GuardedBy("this")
  private final Map<BitId, FlagSet> flags = new LinkedHashMap<>();

  private BitDatabase(String module, ImmutableSet<BitId> declared) {
    this.module = module;
    this.declared = declared;
  }

  /** Returns a database binding every bit of {@code alist} to the empty set. */
  public static BitDatabase initialize(String module, WireAlist alist) {
    BitDatabase result = new BitDatabase(module, alist.allBits());
    synchronized (result) {
      result.declared.forEach(b -> result.flags.put(b, FlagSet.EMPTY));
    }
    return result;
  }

  /**
   * Adds {@code mask} to the flags of each of {@code bits}. A bit that wasn't declared gets a new
   * entry, and a warning.
   */
  public synchronized void mark(
      Iterable<BitId> bits, FlagSet mask, Warnings warnings, @Nullable Object context) {
    for (BitId bit : bits) {
      FlagSet prev = flags.get(bit);
      if (prev == null) {
        assert !declared.contains(bit);
        warnings.warn(
            WarningType.USESET_UNDECLARED, context, "'%s' is not declared in %s", bit, module);
        prev = FlagSet.EMPTY;
      }
      flags.put(bit, prev.union(mask));
    }
  }

  /**
   * Adds {@code mask}, which may only contain {@code used-above} and {@code set-above}, to the
   * flags of each of {@code bits}.
   */
  synchronized void mergeAbove(Iterable<BitId> bits, FlagSet mask) {
    Preconditions.checkArgument(FlagSet.ABOVE.containsAll(mask), "Not an above mask: %s", mask);
    for (BitId bit : bits) {
      flags.merge(bit, mask, FlagSet::union);
    }
  }

  /** Returns the flags recorded for {@code bit}, or EMPTY if it has none. */
  public synchronized FlagSet query(BitId bit) {
    return flags.getOrDefault(bit, FlagSet.EMPTY);
  }

  /** Returns true if {@code bit} has an entry (declared, or marked since). */
  public synchronized boolean contains(BitId bit) {
    return flags.containsKey(bit);
  }

  /** Returns the union of the flags of all of {@code bits}. */
  public synchronized FlagSet union(Iterable<BitId> bits) {
    FlagSet result = FlagSet.EMPTY;
    for (BitId bit : bits) {
      result = result.union(flags.getOrDefault(bit, FlagSet.EMPTY));
    }
    return result;
  }

  /** Returns true if {@code bit} was in the wire alist this database was initialized from. */
  public boolean isDeclared(BitId bit) {
    return declared.contains(bit);
  }

  public synchronized int size() {
    return flags.size();
  }

  /**
   * Returns an immutable copy of the current bindings, one per bit. Later updates to this database
   * are not reflected in the result.
   */
  public synchronized ImmutableMap<BitId, FlagSet> shrink() {
    return ImmutableMap.copyOf(flags);
  }

  @Override
  public synchronized String toString() {
    return module + flags;
  }
}
