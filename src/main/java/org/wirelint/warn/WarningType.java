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

package org.wirelint.warn;

/** The kinds of diagnostic produced by the use/set analysis. */
public enum WarningType {
  /** Something the analysis can't handle; a conservative default was used instead. */
  USESET_FUDGING,
  /** A bit was marked that no declaration produced. */
  USESET_UNDECLARED,
  /** A port is driven both by its module and by an instantiating module. */
  USESET_TRAINWRECK,
  /** A port would be driven from both sides as soon as its module starts driving it. */
  USESET_FUTURE_TRAINWRECK,
  /** The number of instance arguments differs from the number of submodule ports. */
  USESET_ARITY_MISMATCH,
  /** An instance argument and its port have different widths. */
  USESET_WIDTH_MISMATCH,
  /** Conflicting declarations of one wire; the module's wires can't be determined. */
  USESET_BAD_DECLARATION,
  /** A module's port list could not be turned into a pattern of port bits. */
  USESET_BAD_PORT_PATTERN,
  /** A module instantiates itself, directly or indirectly. */
  USESET_CYCLE,
  USESET_SPURIOUS,
  USESET_UNUSED,
  USESET_UNSET,
  USESET_UNNECESSARY_PORT,
  USESET_UNSET_PORT,
  USESET_PORT_TRAINWRECK
}
