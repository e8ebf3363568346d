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

import org.jspecify.annotations.Nullable;
import org.wirelint.ir.Direction;
import org.wirelint.warn.WarningType;

/** The verdict for one bit after both passes. */
public enum BitClass {
  /** Nothing to report. */
  FINE(null),
  /** A non-port bit that is neither used nor set. */
  SPURIOUS(WarningType.USESET_SPURIOUS),
  /** A non-port bit that is set but never used. */
  UNUSED(WarningType.USESET_UNUSED),
  /** A non-port bit that is used but never set. */
  UNSET(WarningType.USESET_UNSET),
  /** A port bit that neither its module nor any instantiator needs. */
  UNNECESSARY_PORT(WarningType.USESET_UNNECESSARY_PORT),
  /** An output port bit that is used but that nothing drives. */
  UNSET_PORT(WarningType.USESET_UNSET_PORT),
  /** A port bit driven both by its module and by an instantiator. */
  TRAINWRECK(WarningType.USESET_PORT_TRAINWRECK);

  /** The type of warning to report for bits in this class, or null if they aren't reported. */
  public final @Nullable WarningType warningType;

  BitClass(@Nullable WarningType warningType) {
    this.warningType = warningType;
  }

  /**
   * Completes a sentence such as "Wire foo is ..."; {@code direction} is null for bits that aren't
   * ports.
   */
  String describe(@Nullable Direction direction) {
    return switch (this) {
      case FINE -> "fine";
      case SPURIOUS -> "spurious (never used or set)";
      case UNUSED -> "never used";
      case UNSET -> "never set";
      case UNNECESSARY_PORT -> "an unnecessary " + direction;
      case UNSET_PORT -> "an unset " + direction;
      case TRAINWRECK -> "an " + direction + " driven from both sides (trainwreck)";
    };
  }
}
