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

/**
 * A simple listener for code change events.
 */
public interface CodeChangeHandler {

  /** Report a change to the field of a node. */
  void reportChange(int nodeId);

  /**
   * A trivial change handler that just records whether the code
   * has changed since the last reset.
   */
  final class RecentChange implements CodeChangeHandler {
    private boolean hasChanged = false;

    @Override
    public void reportChange(int nodeId) {
      hasChanged = true;
    }

    public boolean hasCodeChanged() {
      return hasChanged;
    }

    public void reset() {
      hasChanged = false;
    }
  }

  /**
   * A change handler that throws an exception if any changes are made.
   */
  final class ForbiddenChange implements CodeChangeHandler {
    @Override
    public void reportChange(int nodeId) {
      throw new IllegalStateException("Code changes forbidden, node " + nodeId);
    }
  }
}
