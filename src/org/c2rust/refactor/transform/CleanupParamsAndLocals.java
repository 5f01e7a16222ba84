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

import java.util.logging.Level;
import java.util.logging.Logger;
import org.c2rust.refactor.ast.BindingMode;
import org.c2rust.refactor.ast.Node;
import org.c2rust.refactor.ast.Prop;
import org.c2rust.refactor.ast.Token;
import org.c2rust.refactor.scripting.FnLikeHandle;
import org.c2rust.refactor.scripting.FnLikePass;
import org.c2rust.refactor.scripting.PatternHandle;

/**
 * Decides, for every argument and local of a function-like item, whether it needs a mutable
 * binding and whether it is used at all.
 *
 * <p>A binding is used when a single-segment path with its name appears anywhere in the body, and
 * mutable when such a path is the target of an assignment or compound assignment. Afterwards:
 *
 * <ul>
 *   <li>Unused bindings become immutable and get the unused marker prepended to their name,
 *       unless it is already there, e.g. {@code count} becomes {@code _count}.
 *   <li>Used bindings get the inferred mode, so a {@code mut} the translator added on every
 *       local is dropped where nothing assigns to it.
 * </ul>
 *
 * By-reference bindings keep their mode. Destructuring and wildcard patterns are skipped
 * entirely. The body is fully traversed before anything is written, so an item that fails with
 * {@link UnsupportedNodeKindException} is left as it was. Running the pass twice gives the same
 * result as running it once.
 */
public final class CleanupParamsAndLocals implements FnLikePass {
  private static final Logger logger = Logger.getLogger(CleanupParamsAndLocals.class.getName());

  static final String NAME = "cleanupParamsAndLocals";

  private final RefactorOptions options;

  public CleanupParamsAndLocals(RefactorOptions options) {
    this.options = options;
  }

  @Override
  public void transform(FnLikeHandle fnLike) {
    // Foreign functions have no body to look at.
    if (fnLike.isBodiless()) {
      return;
    }
    logger.fine("FnLike name: " + fnLike.getName());

    SymbolTable symbols = new SymbolTable();
    for (PatternHandle arg : fnLike.getArgs()) {
      if (arg.isIdent()) {
        symbols.declare(arg.getPatternId(), false, arg.getIdent());
      }
    }

    new NodeTraversal(fnLike.getContext(), new UsageCollector(symbols), options.isTraceTraversal())
        .traverse(fnLike.getBodyId());

    for (PatternHandle arg : fnLike.getArgs()) {
      rewrite(arg, symbols);
    }
    for (PatternHandle local : fnLike.getLocals()) {
      rewrite(local, symbols);
    }
  }

  private void rewrite(PatternHandle binding, SymbolTable symbols) {
    if (!binding.isIdent()) {
      return;
    }
    Var var = symbols.get(binding.getPatternId());
    if (var == null) {
      return;
    }
    boolean byValue = binding.getBindingMode().isByValue();
    if (!var.isUsed()) {
      if (byValue) {
        binding.setBindingMode(BindingMode.BY_VALUE_IMMUTABLE);
      }
      char marker = options.getUnusedMarker();
      if (options.getRenameUnusedBindings() && binding.getIdent().charAt(0) != marker) {
        binding.setIdent(marker + binding.getIdent());
      }
    } else if (byValue) {
      binding.setBindingMode(var.getBindingMode());
    }
  }

  /** Records declarations, reads and writes of bindings while the body is walked. */
  private static final class UsageCollector extends NodeTraversal.AbstractCallback {
    private final SymbolTable symbols;

    UsageCollector(SymbolTable symbols) {
      this.symbols = symbols;
    }

    @Override
    public void visitStatement(NodeTraversal t, Node stmt) {
      if (!stmt.isLocal()) {
        return;
      }
      Node pat = t.getNode(stmt.getChild(Prop.PAT));
      if (pat.isIdentPattern()) {
        // Marks earlier bindings of the same name as shadowed.
        symbols.declare(pat.getId(), true, pat.getIdent());
      } else if (logger.isLoggable(Level.FINE)) {
        logger.fine("Skipping unsupported local pattern " + pat);
      }
    }

    @Override
    public void visitExpression(NodeTraversal t, Node expr) {
      if (expr.isSimplePath()) {
        symbols.markUsed(expr.getSegments().get(0));
      } else if (expr.getToken() == Token.ASSIGN || expr.getToken() == Token.ASSIGN_OP) {
        Node lhs = t.getNode(expr.getChild(Prop.LHS));
        if (lhs.isSimplePath()) {
          symbols.markMutated(lhs.getSegments().get(0));
        }
      }
    }
  }
}
