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

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic attached to one module and, where there is one, to the construct that caused it.
 *
 * <p>A fatal warning means the analysis gave up on some part of the module (an instance, the port
 * list, or the whole module); it never stops the analysis of anything else.
 */
public final class Warning {
  public final WarningType type;
  public final String message;
  public final String module;
  public final @Nullable String context;
  public final boolean fatal;

  public Warning(
      WarningType type, String message, String module, @Nullable String context, boolean fatal) {
    this.type = Preconditions.checkNotNull(type);
    this.message = Preconditions.checkNotNull(message);
    this.module = Preconditions.checkNotNull(module);
    this.context = context;
    this.fatal = fatal;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Warning w
        && type == w.type
        && fatal == w.fatal
        && message.equals(w.message)
        && module.equals(w.module)
        && Objects.equals(context, w.context);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, message, module, context, fatal);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(fatal ? "FATAL " : "").append(type).append(" in ").append(module);
    if (context != null) {
      sb.append(" at ").append(context);
    }
    return sb.append(": ").append(message).toString();
  }
}
