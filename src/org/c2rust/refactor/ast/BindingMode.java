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

package org.c2rust.refactor.ast;

/**
 * How a name introduced by a pattern is bound. Only the by-value pair is ever inferred; the
 * by-reference pair records an explicit decision made by the translator and is carried through
 * untouched.
 */
public enum BindingMode {
  BY_VALUE_IMMUTABLE,
  BY_VALUE_MUTABLE,
  BY_REF_IMMUTABLE,
  BY_REF_MUTABLE;

  public boolean isByValue() {
    return this == BY_VALUE_IMMUTABLE || this == BY_VALUE_MUTABLE;
  }

  public boolean isMutable() {
    return this == BY_VALUE_MUTABLE || this == BY_REF_MUTABLE;
  }
}
