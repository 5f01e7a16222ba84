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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;
import java.util.function.Function;
import org.c2rust.refactor.transform.RefactorOptions;

/**
 * A named recipe for a {@link FnLikePass}. Registering factories rather than pass instances lets
 * each driver run start from fresh pass state.
 */
@AutoValue
public abstract class PassFactory {

  /** The name of the pass as it will appear in logs and diagnostics. */
  public abstract String getName();

  /** Whether the pass runs at all under the given options. */
  public abstract Function<RefactorOptions, Boolean> getCondition();

  abstract Function<RefactorOptions, ? extends FnLikePass> getInternalFactory();

  public abstract Builder toBuilder();

  PassFactory() {
    // Subclasses in this package only.
  }

  /** A builder for a {@link PassFactory}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String x);

    public abstract Builder setCondition(Function<RefactorOptions, Boolean> cond);

    public abstract Builder setInternalFactory(
        Function<RefactorOptions, ? extends FnLikePass> x);

    @ForOverride
    abstract PassFactory autoBuild();

    public final PassFactory build() {
      PassFactory result = autoBuild();
      checkState(!result.getName().isEmpty());
      return result;
    }
  }

  public static Builder builder() {
    return new AutoValue_PassFactory.Builder().setCondition((o) -> true);
  }

  /** Wraps a stateless pass, for passes written as lambdas. */
  public static PassFactory of(String name, FnLikePass pass) {
    return builder().setName(name).setInternalFactory((o) -> pass).build();
  }

  /** Creates a new pass to be run. */
  public final FnLikePass create(RefactorOptions options) {
    return getInternalFactory().apply(options);
  }
}
