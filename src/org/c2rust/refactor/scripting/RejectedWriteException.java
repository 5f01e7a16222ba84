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

package org.c2rust.refactor.scripting;

import com.google.common.base.Strings;
import com.google.errorprone.annotations.FormatMethod;

/** Thrown when a pass asks the bridge for a write it does not allow. Nothing is written. */
public final class RejectedWriteException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final int nodeId;

  @FormatMethod
  RejectedWriteException(int nodeId, String format, Object... args) {
    super(Strings.lenientFormat(format, args));
    this.nodeId = nodeId;
  }

  /** The identity of the node the pass tried to write. */
  public int getNodeId() {
    return nodeId;
  }
}
