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

/** The six independent facts recorded for each bit. */
public enum UseSetFlag {
  /** Read by some construct in the bit's own module. */
  TRULY_USED("truly-used"),
  /** Driven by some construct in the bit's own module. */
  TRULY_SET("truly-set"),
  /** Declared input or inout, but never actually read in its module. */
  FALSELY_USED("falsely-used"),
  /** Declared output or inout, but never actually driven in its module. */
  FALSELY_SET("falsely-set"),
  /** The connection to this port bit is read by some instantiating module. */
  USED_ABOVE("used-above"),
  /** The connection to this port bit is driven by some instantiating module. */
  SET_ABOVE("set-above");

  final String label;

  UseSetFlag(String label) {
    this.label = label;
  }

  /** The bit representing this flag in a {@link FlagSet}. */
  int mask() {
    return 1 << ordinal();
  }

  @Override
  public String toString() {
    return label;
  }
}
