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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/** A delay ({@code #expr}) or event control ({@code @(...)} or {@code @*}). */
public final class TimingControl {

  /** The kinds of timing control. */
  public enum Kind {
    DELAY,
    EVENT,
    STAR
  }

  public final Kind kind;

  /** The delay amount for DELAY; the event expressions for EVENT; empty for STAR. */
  public final ImmutableList<Expr> exprs;

  private TimingControl(Kind kind, List<Expr> exprs) {
    this.kind = kind;
    this.exprs = ImmutableList.copyOf(exprs);
  }

  /** {@code #amount}. */
  public static TimingControl delay(Expr amount) {
    return new TimingControl(Kind.DELAY, ImmutableList.of(amount));
  }

  /** {@code @(e1 or e2 ...)}; edge keywords are not represented. */
  public static TimingControl event(Expr... events) {
    return new TimingControl(Kind.EVENT, ImmutableList.copyOf(events));
  }

  /** {@code @*}. */
  public static TimingControl star() {
    return new TimingControl(Kind.STAR, ImmutableList.of());
  }

  @Override
  public String toString() {
    switch (kind) {
      case DELAY:
        return "#" + exprs.get(0);
      case EVENT:
        return exprs.stream().map(Expr::toString).collect(Collectors.joining(" or ", "@(", ")"));
      default:
        return "@*";
    }
  }
}
