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

import com.google.common.collect.ImmutableList;

/** Read-only access to the nodes of an arena. */
public interface AstView {

  /**
   * Returns the node with the given identity.
   *
   * @throws IllegalStateException if no such node was ever allocated
   */
  Node get(int id);

  /** Returns the children of a node, in source order. */
  ImmutableList<Integer> childrenOf(int id);
}
