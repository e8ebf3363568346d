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

/** The kinds of net and variable declarations that may appear in a module. */
public enum NetType {
  WIRE("wire"),
  TRI("tri"),
  WAND("wand"),
  WOR("wor"),
  REG("reg"),
  INTEGER("integer"),
  SUPPLY0("supply0"),
  SUPPLY1("supply1");

  private final String keyword;

  NetType(String keyword) {
    this.keyword = keyword;
  }

  /** Supply nets are constantly driven, so every bit of one is considered set. */
  public boolean isSupply() {
    return this == SUPPLY0 || this == SUPPLY1;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
