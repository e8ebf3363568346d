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
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.wirelint.ir.BitId;

/**
 * Records that some bits of an instantiating module are connected to some port bits of a
 * submodule. Pass 2 uses these to tell the submodule how its ports are used from above.
 *
 * <p>When the connection is an lvalue, each note pairs one port bit with one actual bit. Otherwise
 * the note has a whole port's bits and every bit the connected expression reads.
 */
public final class Note {
  public final String submodule;
  public final ImmutableList<BitId> formals;
  public final ImmutableList<BitId> actuals;

  public Note(String submodule, List<BitId> formals, List<BitId> actuals) {
    this.submodule = Preconditions.checkNotNull(submodule);
    this.formals = ImmutableList.copyOf(formals);
    this.actuals = ImmutableList.copyOf(actuals);
  }

  @Override
  public String toString() {
    return submodule + ":" + formals + "<-" + actuals;
  }
}
