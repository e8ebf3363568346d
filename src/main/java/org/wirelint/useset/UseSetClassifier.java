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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.wirelint.ir.BitId;
import org.wirelint.ir.Direction;
import org.wirelint.ir.Module;
import org.wirelint.ir.PortDecl;
import org.wirelint.ir.WireAlist;
import org.wirelint.warn.Warnings;

/**
 * Turns a module's final bit database into a {@link UseSetReport} and a warning for each group of
 * suspicious bits.
 *
 * <p>Non-port bits are judged only on what their own module does with them:
 *
 * <pre>
 *   used  set   class
 *    0     0    spurious
 *    0     1    unused
 *    1     0    unset
 *    1     1    fine
 * </pre>
 *
 * <p>Port bits also take their direction and the above flags into account; see {@link
 * #classifyPort}.
 */
final class UseSetClassifier {
  private final UseSetOptions options;

  UseSetClassifier(UseSetOptions options) {
    this.options = options;
  }

  /** Classifies a bit that isn't part of a port. */
  static BitClass classifyInternal(FlagSet flags) {
    boolean used = flags.trulyUsed() || flags.falselyUsed();
    boolean set = flags.trulySet() || flags.falselySet();
    if (used) {
      return set ? BitClass.FINE : BitClass.UNSET;
    } else {
      return set ? BitClass.UNUSED : BitClass.SPURIOUS;
    }
  }

  /**
   * Classifies a port bit.
   *
   * <pre>
   *   dir     U S = 0 0                  0 1                  1 0                  1 1
   *   input   UA ? fine : unnecessary    SA ? trainwreck      fine                 SA ? trainwreck
   *                                        : UA ? fine                               : fine
   *                                        : unnecessary
   *   output  SA ? fine                  fine                 SA ? fine            fine
   *             : UA ? unset port                               : unset port
   *             : unnecessary
   *   inout   UA|SA ? fine : unnecessary fine                 fine                 fine
   * </pre>
   *
   * U and S are {@code truly-used} and {@code truly-set}; UA and SA are {@code used-above} and
   * {@code set-above}.
   *
   * <p>An output that its module drives always ends up with SA as well, since pass 1 copies its
   * {@code truly-set} to the wire connected above; so SA says nothing about a driven output, and
   * only an input can be seen to be driven from both sides here. Outputs connected to something
   * that isn't an lvalue are checked by {@link InstanceResolver} instead.
   */
  static BitClass classifyPort(Direction direction, FlagSet flags) {
    boolean used = flags.trulyUsed();
    boolean set = flags.trulySet();
    boolean usedAbove = flags.usedAbove();
    boolean setAbove = flags.setAbove();
    switch (direction) {
      case INPUT:
        if (set && setAbove) {
          return BitClass.TRAINWRECK;
        } else if (used || usedAbove) {
          return BitClass.FINE;
        }
        return BitClass.UNNECESSARY_PORT;
      case OUTPUT:
        if (set || setAbove) {
          return BitClass.FINE;
        } else if (used || usedAbove) {
          return BitClass.UNSET_PORT;
        }
        return BitClass.UNNECESSARY_PORT;
      case INOUT:
        if (used || set || usedAbove || setAbove) {
          return BitClass.FINE;
        }
        return BitClass.UNNECESSARY_PORT;
    }
    throw new AssertionError(direction);
  }

  /**
   * Returns the annotation for a bit that isn't used or set locally but is from above, or null if
   * there's nothing to say.
   */
  static @Nullable String looksAnnotation(FlagSet flags) {
    boolean looksUsed = !flags.trulyUsed() && flags.usedAbove();
    boolean looksSet = !flags.trulySet() && flags.setAbove();
    if (looksUsed && looksSet) {
      return "It looks used and set from above.";
    } else if (looksUsed) {
      return "It looks used from above.";
    } else if (looksSet) {
      return "It looks set from above.";
    }
    return null;
  }

  /** Returns true if bits of this wire should never be reported. */
  boolean isSkipped(Module module, String wire) {
    // Flattened hierarchical names can't be analyzed.
    return wire.indexOf('.') >= 0 || options.isIgnored(wire, module.ignoredWires);
  }

  /**
   * Classifies every bit of {@code flags} that isn't skipped, and adds a warning to {@code
   * warnings} for each group of bits of one wire that share a non-FINE class.
   */
  UseSetReport classify(
      Module module, WireAlist alist, ImmutableMap<BitId, FlagSet> flags, Warnings warnings) {
    Map<BitId, BitClass> classes = new LinkedHashMap<>();
    ImmutableSet.Builder<String> skipped = ImmutableSet.builder();
    Map<GroupKey, List<BitId>> groups = new LinkedHashMap<>();
    for (Map.Entry<BitId, FlagSet> entry : flags.entrySet()) {
      BitId bit = entry.getKey();
      if (isSkipped(module, bit.wire)) {
        skipped.add(bit.wire);
        continue;
      }
      FlagSet bitFlags = entry.getValue();
      PortDecl decl = module.portDecl(bit.wire);
      BitClass bitClass;
      String annotation = null;
      if (decl != null) {
        bitClass = classifyPort(decl.direction, bitFlags);
      } else {
        bitClass = classifyInternal(bitFlags);
      }
      if (bitClass != BitClass.FINE) {
        annotation = looksAnnotation(bitFlags);
      }
      classes.put(bit, bitClass);
      if (bitClass.warningType != null) {
        WireAlist.Wire wire = alist.wire(bit.wire);
        boolean declared = wire != null && wire.bits.contains(bit);
        GroupKey key = new GroupKey(bit.wire, declared, bitClass, annotation);
        groups.computeIfAbsent(key, k -> new ArrayList<>()).add(bit);
      }
    }
    groups.forEach((key, bits) -> report(module, alist, key, bits, warnings));
    return new UseSetReport(module.name, classes, skipped.build());
  }

  private static void report(
      Module module, WireAlist alist, GroupKey key, List<BitId> bits, Warnings warnings) {
    PortDecl decl = module.portDecl(key.wire);
    Direction direction = (decl == null) ? null : decl.direction;
    WireAlist.Wire wire = alist.wire(key.wire);
    String what = key.bitClass.describe(direction);
    String message;
    // A group of declared bits is all of its wire exactly when it has the wire's width.
    boolean wholeWire = key.declared && (wire.range == null || bits.size() == wire.width());
    if (wholeWire || bits.stream().allMatch(BitId::isScalar)) {
      message = String.format("Wire %s is %s.", wholeWire ? wire : key.wire, what);
    } else {
      ImmutableList<Object> indices =
          bits.stream()
              .<Object>map(b -> b.isScalar() ? b.wire : b.index)
              .collect(ImmutableList.toImmutableList());
      message =
          String.format(
              "Wire %s: %s%s %s %s %s.",
              (wire == null) ? key.wire : wire,
              key.declared ? "" : "undeclared ",
              (bits.size() == 1) ? "bit" : "bits",
              Joiner.on(", ").join(indices),
              (bits.size() == 1) ? "is" : "are",
              what);
    }
    if (key.annotation != null) {
      message += " " + key.annotation;
    }
    warnings.warn(key.bitClass.warningType, decl, "%s", message);
  }

  /**
   * Bits of the same wire with the same class and annotation are reported together; bits the wire
   * doesn't declare are reported apart from the declared ones.
   */
  private static final class GroupKey {
    final String wire;
    final boolean declared;
    final BitClass bitClass;
    final @Nullable String annotation;

    GroupKey(String wire, boolean declared, BitClass bitClass, @Nullable String annotation) {
      this.wire = wire;
      this.declared = declared;
      this.bitClass = bitClass;
      this.annotation = annotation;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof GroupKey k
          && wire.equals(k.wire)
          && declared == k.declared
          && bitClass == k.bitClass
          && Objects.equals(annotation, k.annotation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(wire, declared, bitClass, annotation);
    }
  }
}
