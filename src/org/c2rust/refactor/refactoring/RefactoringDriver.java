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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.c2rust.refactor.ast.NodeArena;
import org.c2rust.refactor.scripting.CodeChangeHandler.RecentChange;
import org.c2rust.refactor.scripting.FnLikeHandle;
import org.c2rust.refactor.scripting.FnLikePass;
import org.c2rust.refactor.scripting.PassFactory;
import org.c2rust.refactor.scripting.RejectedWriteException;
import org.c2rust.refactor.scripting.TransformContext;
import org.c2rust.refactor.transform.CheckLevel;
import org.c2rust.refactor.transform.CleanupPasses;
import org.c2rust.refactor.transform.DiagnosticType;
import org.c2rust.refactor.transform.ErrorManager;
import org.c2rust.refactor.transform.LoggerErrorManager;
import org.c2rust.refactor.transform.RefactorError;
import org.c2rust.refactor.transform.RefactorOptions;
import org.c2rust.refactor.transform.UnsupportedNodeKindException;
import org.jspecify.annotations.Nullable;

/**
 * Primary driver of a refactoring. Runs the registered passes, in registration order, over every
 * function-like item of a crate, in declaration order.
 *
 * <p>Bodiless items are skipped. An item on which a pass throws {@link
 * UnsupportedNodeKindException} or {@link RejectedWriteException} is reported and no further pass
 * runs on it, but the remaining items are still processed. Mutations a pass made before it threw
 * are not rolled back.
 */
public final class RefactoringDriver {
  private static final Logger logger = Logger.getLogger(RefactoringDriver.class.getName());

  static final DiagnosticType UNSUPPORTED_NODE_KIND =
      DiagnosticType.error(
          "C2RUST_UNSUPPORTED_NODE_KIND",
          "Pass {0} does not support {1} (node {2}); {3} left unmodified");

  static final DiagnosticType REJECTED_WRITE =
      DiagnosticType.error(
          "C2RUST_REJECTED_WRITE", "Pass {0} made a write that is not allowed: {1}; {2} skipped");

  private final RefactorOptions options;
  private final ImmutableList<PassFactory> passes;
  private final @Nullable ErrorManager sharedErrorManager;
  private ErrorManager errorManager;

  private RefactoringDriver(
      RefactorOptions options,
      ImmutableList<PassFactory> passes,
      @Nullable ErrorManager sharedErrorManager) {
    this.options = options;
    this.passes = passes;
    this.sharedErrorManager = sharedErrorManager;
    this.errorManager = newErrorManager();
  }

  private ErrorManager newErrorManager() {
    return sharedErrorManager != null ? sharedErrorManager : new LoggerErrorManager(logger);
  }

  /**
   * Runs the passes over the crate rooted at {@code crateId}, rewriting the arena in place. A
   * pass that meets unsupported syntax or makes a write the bridge rejects gives up on its item
   * alone; the remaining items are still processed.
   */
  public RefactoringResult drive(NodeArena arena, int crateId) {
    errorManager = newErrorManager();
    TransformContext context = new TransformContext(arena);
    ImmutableList<NamedPass> instances = createPasses();

    RecentChange changes = new RecentChange();
    context.addChangeHandler(changes);
    ImmutableList.Builder<RefactorError> errors = ImmutableList.builder();
    ImmutableList.Builder<Integer> changedItems = ImmutableList.builder();
    ImmutableList.Builder<Integer> skippedItems = ImmutableList.builder();

    for (FnLikeHandle fnLike : context.getFnLikes(crateId)) {
      if (fnLike.isBodiless()) {
        logger.fine("Skipping bodiless " + fnLike);
        skippedItems.add(fnLike.getId());
        continue;
      }
      changes.reset();
      for (NamedPass pass : instances) {
        try {
          pass.pass.transform(fnLike);
        } catch (UnsupportedNodeKindException e) {
          report(
              errors,
              options.getUnsupportedNodeKindLevel(),
              RefactorError.make(
                  UNSUPPORTED_NODE_KIND,
                  fnLike.getName(),
                  e.getNodeId(),
                  pass.name,
                  e.getToken(),
                  String.valueOf(e.getNodeId()),
                  fnLike.getName()));
          break;
        } catch (RejectedWriteException e) {
          // Writes made before the rejected one stay in place.
          report(
              errors,
              REJECTED_WRITE.level,
              RefactorError.make(
                  REJECTED_WRITE,
                  fnLike.getName(),
                  e.getNodeId(),
                  pass.name,
                  e.getMessage(),
                  fnLike.getName()));
          break;
        }
      }
      if (changes.hasCodeChanged()) {
        changedItems.add(fnLike.getId());
      }
    }
    context.removeChangeHandler(changes);

    RefactoringResult result =
        new RefactoringResult(errors.build(), changedItems.build(), skippedItems.build());
    if (logger.isLoggable(Level.INFO)) {
      logger.info(
          String.format(
              "Refactored %d item(s), skipped %d bodiless item(s), %d diagnostic(s)",
              result.changedItems().size(),
              result.skippedItems().size(),
              result.errors().size()));
    }
    errorManager.generateReport();
    return result;
  }

  private void report(
      ImmutableList.Builder<RefactorError> errors, CheckLevel level, RefactorError error) {
    errorManager.report(level, error);
    if (level != CheckLevel.OFF) {
      errors.add(error);
    }
  }

  private ImmutableList<NamedPass> createPasses() {
    ImmutableList.Builder<NamedPass> instances = ImmutableList.builder();
    for (PassFactory factory : passes) {
      if (factory.getCondition().apply(options)) {
        instances.add(new NamedPass(factory.getName(), factory.create(options)));
      }
    }
    return instances.build();
  }

  /**
   * The manager the latest run reported to. Unless one was supplied to the builder, every run
   * gets a fresh {@link LoggerErrorManager}, so its report covers that run alone.
   */
  public ErrorManager getErrorManager() {
    return errorManager;
  }

  private static final class NamedPass {
    final String name;
    final FnLikePass pass;

    NamedPass(String name, FnLikePass pass) {
      this.name = name;
      this.pass = pass;
    }
  }

  /** Builds a driver. Without explicit passes, {@link CleanupPasses#getPasses()} are run. */
  public static class Builder {
    private RefactorOptions options = new RefactorOptions();
    private final ImmutableList.Builder<PassFactory> passes = ImmutableList.builder();
    private boolean hasPasses = false;
    private @Nullable ErrorManager errorManager = null;

    public Builder() {}

    public Builder withOptions(RefactorOptions options) {
      this.options = checkNotNull(options);
      return this;
    }

    public Builder addPass(PassFactory pass) {
      passes.add(checkNotNull(pass));
      hasPasses = true;
      return this;
    }

    /**
     * Reports every run to {@code errorManager}. The manager belongs to the caller and keeps
     * accumulating, so a report generated after a later run also includes earlier diagnostics.
     */
    public Builder withErrorManager(ErrorManager errorManager) {
      this.errorManager = checkNotNull(errorManager);
      return this;
    }

    public RefactoringDriver build() {
      return new RefactoringDriver(
          options, hasPasses ? passes.build() : CleanupPasses.getPasses(), errorManager);
    }
  }
}
