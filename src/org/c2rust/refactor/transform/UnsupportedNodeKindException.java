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

import org.c2rust.refactor.ast.Node;
import org.c2rust.refactor.ast.Token;

/**
 * Thrown when a traversal reaches a node outside the grammar it understands. The analysis of the
 * enclosing item is abandoned rather than continued with a partial view of the body.
 */
public final class UnsupportedNodeKindException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int nodeId;
  private final Token token;

  public UnsupportedNodeKindException(Node node) {
    super("Unsupported node kind " + node.getToken() + " (node " + node.getId() + ")");
    this.nodeId = node.getId();
    this.token = node.getToken();
  }

  /** The identity of the offending node. */
  public int getNodeId() {
    return nodeId;
  }

  public Token getToken() {
    return token;
  }
}
