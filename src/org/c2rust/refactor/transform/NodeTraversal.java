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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.c2rust.refactor.ast.AstView;
import org.c2rust.refactor.ast.Node;
import org.c2rust.refactor.ast.Prop;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal walks the body of a function-like item depth first, left to right, and calls back
 * into a {@link Callback} before descending into each node's children. Visiting (collecting
 * facts about a node) is kept apart from recursing (the structural walk), and the structural
 * rules live here alone.
 *
 * <p>Only a small grammar is understood:
 *
 * <ul>
 *   <li>BLOCK: every statement in order.
 *   <li>LOCAL: the initializer, if any. The pattern is not walked.
 *   <li>ITEM_STMT: nothing; nested items are processed on their own.
 *   <li>SEMI, EXPR_STMT: the expression.
 *   <li>BOX: the boxed expression.
 *   <li>ARRAY: every element in order.
 *   <li>BINARY, ASSIGN, ASSIGN_OP: left operand, then right operand.
 *   <li>PATH, LIT: nothing.
 * </ul>
 *
 * Any other node aborts the traversal with an {@link UnsupportedNodeKindException}. A pass that
 * skipped over code it does not understand would draw wrong conclusions from what it did see.
 */
public final class NodeTraversal {
  private static final Logger logger = Logger.getLogger(NodeTraversal.class.getName());

  private final AstView ast;
  private final Callback callback;
  private final boolean trace;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** Callback for tree-based traversals. Each hook fires in preorder. */
  public interface Callback {
    void visitBlock(NodeTraversal t, Node block);

    void visitStatement(NodeTraversal t, Node stmt);

    void visitExpression(NodeTraversal t, Node expr);
  }

  /** Callback with no-op hooks, for visitors interested in a single family. */
  public abstract static class AbstractCallback implements Callback {
    @Override
    public void visitBlock(NodeTraversal t, Node block) {}

    @Override
    public void visitStatement(NodeTraversal t, Node stmt) {}

    @Override
    public void visitExpression(NodeTraversal t, Node expr) {}
  }

  public NodeTraversal(AstView ast, Callback cb) {
    this(ast, cb, false);
  }

  /**
   * @param trace whether to log every visited node at {@link Level#FINEST}
   */
  public NodeTraversal(AstView ast, Callback cb, boolean trace) {
    this.ast = checkNotNull(ast);
    this.callback = checkNotNull(cb);
    this.trace = trace;
  }

  /** Traverses a parse tree recursively. */
  public static void traverse(AstView ast, int root, Callback cb) {
    new NodeTraversal(ast, cb).traverse(root);
  }

  /**
   * Traverses the subtree rooted at {@code root}.
   *
   * @throws UnsupportedNodeKindException on the first node outside the supported grammar
   */
  public void traverse(int root) {
    try {
      traverseBranch(ast.get(root));
    } finally {
      currentNode = null;
    }
  }

  private void traverseBranch(Node n) {
    currentNode = n;
    if (trace && logger.isLoggable(Level.FINEST)) {
      logger.finest("Visiting " + n);
    }
    switch (n.getToken()) {
      case BLOCK:
        callback.visitBlock(this, n);
        traverseList(n, Prop.STMTS);
        break;

      case LOCAL:
        callback.visitStatement(this, n);
        traverseOptional(n, Prop.INIT);
        break;
      case ITEM_STMT:
        callback.visitStatement(this, n);
        break;
      case SEMI:
      case EXPR_STMT:
        callback.visitStatement(this, n);
        traverseChild(n, Prop.EXPR);
        break;

      case BOX:
        callback.visitExpression(this, n);
        traverseChild(n, Prop.EXPR);
        break;
      case ARRAY:
        callback.visitExpression(this, n);
        traverseList(n, Prop.ELEMENTS);
        break;
      case BINARY:
      case ASSIGN:
      case ASSIGN_OP:
        callback.visitExpression(this, n);
        traverseChild(n, Prop.LHS);
        traverseChild(n, Prop.RHS);
        break;
      case PATH:
      case LIT:
        callback.visitExpression(this, n);
        break;

      default:
        throw new UnsupportedNodeKindException(n);
    }
  }

  private void traverseChild(Node n, Prop prop) {
    traverseBranch(ast.get(n.getChild(prop)));
  }

  private void traverseOptional(Node n, Prop prop) {
    if (n.hasChild(prop)) {
      traverseChild(n, prop);
    }
  }

  private void traverseList(Node n, Prop prop) {
    for (int child : n.getChildren(prop)) {
      traverseBranch(ast.get(child));
    }
  }

  /** Resolves an identity against the tree being traversed. */
  public Node getNode(int id) {
    return ast.get(id);
  }

  /** Gets the current node, or null outside of a traversal. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }
}
