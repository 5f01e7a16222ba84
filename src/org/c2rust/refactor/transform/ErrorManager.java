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

import com.google.common.collect.ImmutableList;

/**
 * The error manager is in charge of storing, organizing and displaying errors and warnings
 * raised while a driver runs its passes.
 */
public interface ErrorManager {

  /**
   * Reports an error. The level is the one the caller decided on, which may differ from the
   * error's default level.
   */
  void report(CheckLevel level, RefactorError error);

  /** Writes a report of all errors and warnings gathered so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<RefactorError> getErrors();

  ImmutableList<RefactorError> getWarnings();
}
