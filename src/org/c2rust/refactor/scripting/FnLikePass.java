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
 * A refactoring authored against the scripting bridge. It is handed one function-like item at a
 * time and may rewrite binding fields of that item through the handle.
 *
 * <p>Implementations may throw {@link org.c2rust.refactor.transform.UnsupportedNodeKindException}
 * to give up on an item; the driver then moves on to the next one.
 */
@FunctionalInterface
public interface FnLikePass {
  void transform(FnLikeHandle fnLike);
}
