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

package org.c2rust.refactor.refactoring;

import com.google.common.collect.ImmutableList;
import org.c2rust.refactor.transform.RefactorError;

/**
 * The outcome of one driver run.
 *
 * @param errors Diagnostics reported during the run, in the order they were raised.
 * @param changedItems Identities of the function-like items whose fields were rewritten.
 * @param skippedItems Identities of the bodiless items that were left alone.
 */
public record RefactoringResult(
    ImmutableList<RefactorError> errors,
    ImmutableList<Integer> changedItems,
    ImmutableList<Integer> skippedItems) {

  /** Whether every item was processed without a diagnostic. */
  public boolean success() {
    return errors.isEmpty();
  }
}
