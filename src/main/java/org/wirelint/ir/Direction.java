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

/** The declared direction of a port, or of a gate argument whose direction has been resolved. */
public enum Direction {
  INPUT("input"),
  OUTPUT("output"),
  INOUT("inout");

  private final String keyword;

  Direction(String keyword) {
    this.keyword = keyword;
  }

  /** True for inputs and inouts, i.e. directions that imply the port is read locally. */
  public boolean impliesUse() {
    return this != OUTPUT;
  }

  /** True for outputs and inouts, i.e. directions that imply the port is driven locally. */
  public boolean impliesSet() {
    return this != INPUT;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
