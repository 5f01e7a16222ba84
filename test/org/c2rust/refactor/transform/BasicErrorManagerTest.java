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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests {@link BasicErrorManager}.
 */
@RunWith(JUnit4.class)
public final class BasicErrorManagerTest {
  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo {0}");
  private static final DiagnosticType JOO_TYPE = DiagnosticType.warning("TEST_JOO", "Joo");

  private static final class CollectingErrorManager extends BasicErrorManager {
    final List<String> printed = new ArrayList<>();
    int summaries = 0;

    @Override
    public void println(CheckLevel level, RefactorError error) {
      printed.add(level + " " + error.description());
    }

    @Override
    protected void printSummary() {
      summaries++;
    }
  }

  @Test
  public void testDeduplicatedErrors() {
    CollectingErrorManager manager = new CollectingErrorManager();
    manager.report(CheckLevel.ERROR, RefactorError.make(FOO_TYPE, "f", 3, "x"));
    manager.report(CheckLevel.ERROR, RefactorError.make(FOO_TYPE, "f", 3, "x"));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getErrors()).hasSize(1);
  }

  @Test
  public void testLevelOverridesDefault() {
    CollectingErrorManager manager = new CollectingErrorManager();
    manager.report(CheckLevel.WARNING, RefactorError.make(FOO_TYPE, "f", 3, "x"));
    manager.report(CheckLevel.OFF, RefactorError.make(JOO_TYPE, "g", 4));

    assertThat(manager.getErrorCount()).isEqualTo(0);
    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.getWarnings().get(0).description()).isEqualTo("Foo x");
  }

  @Test
  public void testReportIsSortedErrorsFirst() {
    CollectingErrorManager manager = new CollectingErrorManager();
    manager.report(CheckLevel.WARNING, RefactorError.make(JOO_TYPE, "a", 1));
    manager.report(CheckLevel.ERROR, RefactorError.make(FOO_TYPE, "b", 7, "late"));
    manager.report(CheckLevel.ERROR, RefactorError.make(FOO_TYPE, "b", 2, "early"));

    manager.generateReport();

    assertThat(manager.printed)
        .containsExactly("ERROR Foo early", "ERROR Foo late", "WARNING Joo")
        .inOrder();
    assertThat(manager.summaries).isEqualTo(1);
  }

  @Test
  public void testFormat() {
    RefactorError error = RefactorError.make(FOO_TYPE, "entry", 12, "bar");

    assertThat(error.format(CheckLevel.ERROR))
        .isEqualTo("entry @ node 12: ERROR - [TEST_FOO] Foo bar");
    assertThat(RefactorError.make(JOO_TYPE, null, RefactorError.NO_NODE).toString())
        .isEqualTo("WARNING - [TEST_JOO] Joo");
  }
}
