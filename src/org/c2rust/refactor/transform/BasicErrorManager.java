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
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An error manager that collects diagnostics in memory, drops duplicates and generates a sorted
 * report when {@link #generateReport()} is called. Subclasses decide where the report goes.
 */
public abstract class BasicErrorManager implements ErrorManager {
  private final SortedSet<ErrorWithLevel> messages =
      new TreeSet<>(new LeveledRefactorErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, RefactorError error) {
    if (!level.isOn()) {
      return;
    }
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public void generateReport() {
    // Copy so that println may report further diagnostics.
    for (ErrorWithLevel message : new ArrayList<>(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the
   * {@link #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, RefactorError error);

  /**
   * Print the summary of the run - number of errors and warnings.
   */
  protected abstract void printSummary();

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<RefactorError> getErrors() {
    return toArray(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<RefactorError> getWarnings() {
    return toArray(CheckLevel.WARNING);
  }

  private ImmutableList<RefactorError> toArray(CheckLevel level) {
    List<RefactorError> errors = new ArrayList<>(messages.size());
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return ImmutableList.copyOf(errors);
  }

  /** A diagnostic paired with the level it was reported at. */
  static final class ErrorWithLevel {
    final RefactorError error;
    final CheckLevel level;

    ErrorWithLevel(RefactorError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }
  }

  /**
   * Orders diagnostics by level (errors first), then item name, node identity, type and
   * description. Two diagnostics comparing equal are duplicates.
   */
  static final class LeveledRefactorErrorComparator
      implements Comparator<ErrorWithLevel>, Serializable {
    private static final long serialVersionUID = 1L;

    private static final Comparator<String> NULLS_FIRST =
        Comparator.nullsFirst(Comparator.<String>naturalOrder());

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // null is the smallest value
      if (p2 == null) {
        return p1 == null ? 0 : 1;
      }
      if (p1 == null) {
        return -1;
      }

      // check level
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level) < 0 ? -1 : 1;
      }

      RefactorError e1 = p1.error;
      RefactorError e2 = p2.error;
      int result = NULLS_FIRST.compare(e1.itemName(), e2.itemName());
      if (result != 0) {
        return result;
      }
      result = Integer.compare(e1.nodeId(), e2.nodeId());
      if (result != 0) {
        return result;
      }
      result = e1.type().compareTo(e2.type());
      if (result != 0) {
        return result;
      }
      return e1.description().compareTo(e2.description());
    }
  }
}
