/*
 * Copyright 2026 The C2Rust Refactor Authors.
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

package org.c2rust.refactor.transform;

import static java.util.Objects.requireNonNull;

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic raised while refactoring one function-like item.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param itemName Name of the function-like item being processed, if any.
 * @param nodeId Identity of the offending node, or {@link #NO_NODE}.
 * @param defaultLevel The level of the diagnostic type.
 */
public record RefactorError(
    DiagnosticType type,
    String description,
    @Nullable String itemName,
    int nodeId,
    CheckLevel defaultLevel)
    implements Serializable {
  public static final int NO_NODE = -1;

  public RefactorError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates an error attached to a node of an item.
   *
   * @param type The DiagnosticType
   * @param itemName The item being processed
   * @param nodeId The offending node
   * @param arguments Arguments to be incorporated into the message
   */
  public static RefactorError make(
      DiagnosticType type, @Nullable String itemName, int nodeId, Object... arguments) {
    return new RefactorError(type, type.format(arguments), itemName, nodeId, type.level);
  }

  public String format(CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (itemName != null) {
      b.append(itemName);
      if (nodeId != NO_NODE) {
        b.append(" @ node ").append(nodeId);
      }
      b.append(": ");
    }
    b.append(level.name()).append(" - [").append(type.key).append("] ").append(description);
    return b.toString();
  }

  @Override
  public String toString() {
    return format(defaultLevel);
  }
}
