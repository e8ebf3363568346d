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

/**
 * A constant {@code [msb:lsb]} range. Either bound may be the larger; the msb is always the
 * left-hand index as written.
 */
public final class Range {
  public final int msb;
  public final int lsb;

  public Range(int msb, int lsb) {
    this.msb = msb;
    this.lsb = lsb;
  }

  /** The number of bits spanned by this range. */
  public int width() {
    return Math.abs(msb - lsb) + 1;
  }

  /** Returns true if {@code index} lies between the two bounds (inclusive). */
  public boolean contains(int index) {
    return index >= Math.min(msb, lsb) && index <= Math.max(msb, lsb);
  }

  /**
   * Returns the position of {@code index} in the msb-first ordering of this range's bits, or -1 if
   * it is out of range.
   */
  public int position(int index) {
    if (!contains(index)) {
      return -1;
    }
    return (msb >= lsb) ? msb - index : index - msb;
  }

  /** Returns the index at the given position of the msb-first ordering. */
  public int indexAt(int position) {
    assert position >= 0 && position < width();
    return (msb >= lsb) ? msb - position : msb + position;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Range r && r.msb == msb && r.lsb == lsb;
  }

  @Override
  public int hashCode() {
    return msb * 31 + lsb;
  }

  @Override
  public String toString() {
    return "[" + msb + ":" + lsb + "]";
  }
}
