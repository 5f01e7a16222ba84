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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.Serializable;

/** Options shared by the driver and the passes it runs. */
public class RefactorOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Identifiers starting with this character are unused by convention. */
  private char unusedMarker = '_';

  /** Whether unused bindings get the unused marker prepended. */
  private boolean renameUnusedBindings = true;

  /** The level at which items left untouched because of unsupported syntax are reported. */
  private CheckLevel unsupportedNodeKindLevel = CheckLevel.ERROR;

  /** Logs every node a traversal visits. Very verbose. */
  private boolean traceTraversal = false;

  public RefactorOptions() {}

  public char getUnusedMarker() {
    return unusedMarker;
  }

  public void setUnusedMarker(char unusedMarker) {
    checkArgument(
        Character.isJavaIdentifierStart(unusedMarker), "Not an identifier start: %s", unusedMarker);
    this.unusedMarker = unusedMarker;
  }

  public boolean getRenameUnusedBindings() {
    return renameUnusedBindings;
  }

  public void setRenameUnusedBindings(boolean renameUnusedBindings) {
    this.renameUnusedBindings = renameUnusedBindings;
  }

  public CheckLevel getUnsupportedNodeKindLevel() {
    return unsupportedNodeKindLevel;
  }

  public void setUnsupportedNodeKindLevel(CheckLevel level) {
    this.unsupportedNodeKindLevel = checkNotNull(level);
  }

  public boolean isTraceTraversal() {
    return traceTraversal;
  }

  public void setTraceTraversal(boolean traceTraversal) {
    this.traceTraversal = traceTraversal;
  }
}
