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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.c2rust.refactor.ast.AstView;
import org.c2rust.refactor.ast.BindingMode;
import org.c2rust.refactor.ast.Node;
import org.c2rust.refactor.ast.NodeArena;
import org.c2rust.refactor.ast.Prop;
import org.c2rust.refactor.ast.Token;

/**
 * The only view of an arena handed to passes. Everything can be read; the only writes are the
 * binding fields: the identifier and binding mode of identifier patterns, and the pattern of an
 * argument or local. Nothing can be allocated, so a pass cannot change the shape of the tree.
 *
 * <p>Writes are applied to the arena before the call returns and reported to every registered
 * {@link CodeChangeHandler}. Writing a field's current value is not a change. A write the
 * bridge does not allow throws {@link RejectedWriteException} and leaves the arena as it was.
 */
public final class TransformContext implements AstView {
  private static final int NO_OWNER = 0;

  private final NodeArena arena;
  private final List<CodeChangeHandler> changeHandlers = new ArrayList<>();

  public TransformContext(NodeArena arena) {
    this.arena = checkNotNull(arena);
  }

  @Override
  public Node get(int id) {
    return arena.get(id);
  }

  @Override
  public ImmutableList<Integer> childrenOf(int id) {
    return arena.childrenOf(id);
  }

  public void addChangeHandler(CodeChangeHandler handler) {
    changeHandlers.add(checkNotNull(handler));
  }

  public void removeChangeHandler(CodeChangeHandler handler) {
    changeHandlers.remove(handler);
  }

  /**
   * Returns the function-like items of a crate in declaration order. An item nested in the body
   * of another follows its enclosing item.
   */
  public ImmutableList<FnLikeHandle> getFnLikes(int crateId) {
    Node crate = get(crateId);
    checkArgument(crate.getToken() == Token.CRATE, "Not a crate: %s", crate);
    ImmutableList.Builder<FnLikeHandle> fnLikes = ImmutableList.builder();
    for (int item : crate.getChildren(Prop.ITEMS)) {
      collectFnLikes(get(item), fnLikes);
    }
    return fnLikes.build();
  }

  private void collectFnLikes(Node item, ImmutableList.Builder<FnLikeHandle> fnLikes) {
    if (!item.isFnLike()) {
      return;
    }
    FnLikeHandle fnLike = new FnLikeHandle(this, item.getId());
    fnLikes.add(fnLike);
    if (fnLike.isBodiless()) {
      return;
    }
    collectNestedFnLikes(fnLike.getBodyId(), fnLikes);
  }

  /** Finds items declared anywhere under {@code id}, however deeply nested in the body. */
  private void collectNestedFnLikes(int id, ImmutableList.Builder<FnLikeHandle> fnLikes) {
    Node n = get(id);
    if (n.getToken() == Token.ITEM_STMT) {
      collectFnLikes(get(n.getChild(Prop.ITEM)), fnLikes);
      return;
    }
    for (int child : n.children()) {
      collectNestedFnLikes(child, fnLikes);
    }
  }

  /**
   * Invokes {@code pass} once for every function-like item of the crate, in declaration order.
   * Exceptions thrown by the pass propagate to the caller.
   */
  public void visitFnLike(int crateId, FnLikePass pass) {
    for (FnLikeHandle fnLike : getFnLikes(crateId)) {
      pass.transform(fnLike);
    }
  }

  /**
   * Renames the binding introduced by an identifier pattern.
   *
   * @throws RejectedWriteException if {@code ident} is empty or the node is not an identifier
   *     pattern
   */
  public void setIdent(int patternId, String ident) {
    checkWrite(!ident.isEmpty(), patternId, "Empty identifier");
    checkIdentPattern(patternId);
    setField(patternId, Prop.IDENT, ident);
  }

  public void setBindingMode(int patternId, BindingMode mode) {
    checkIdentPattern(patternId);
    setField(patternId, Prop.BINDING, checkNotNull(mode));
  }

  /**
   * Replaces the pattern of an argument or local with another existing pattern node. The new
   * pattern must be detached, e.g. one a previous call replaced, so that no two nodes share it.
   *
   * @throws RejectedWriteException if the owner is not an ARG or LOCAL, or the pattern is not
   *     detached
   */
  public void setPattern(int ownerId, int patternId) {
    Node owner = get(ownerId);
    checkWrite(
        owner.getToken() == Token.ARG || owner.isLocal(), ownerId, "%s has no pattern", owner);
    Node pattern = get(patternId);
    checkWrite(
        pattern.getToken().getFamily() == Token.Family.PATTERN,
        ownerId,
        "Not a pattern: %s",
        pattern);
    int current = findOwner(patternId);
    checkWrite(
        current == NO_OWNER || current == ownerId,
        ownerId,
        "%s already belongs to node %s",
        pattern,
        current);
    setField(ownerId, Prop.PAT, patternId);
  }

  /** Returns the node holding {@code id} as a child, or {@link #NO_OWNER} if it is detached. */
  private int findOwner(int id) {
    for (int candidate = 1; candidate <= arena.size(); candidate++) {
      if (arena.childrenOf(candidate).contains(id)) {
        return candidate;
      }
    }
    return NO_OWNER;
  }

  private void checkIdentPattern(int patternId) {
    Node pattern = get(patternId);
    checkWrite(pattern.isIdentPattern(), patternId, "Not an identifier pattern: %s", pattern);
  }

  private static void checkWrite(boolean allowed, int nodeId, String format, Object... args) {
    if (!allowed) {
      throw new RejectedWriteException(nodeId, format, args);
    }
  }

  private void setField(int id, Prop prop, Object value) {
    if (Objects.equals(get(id).getProp(prop), value)) {
      return;
    }
    arena.setField(id, prop, value);
    for (CodeChangeHandler handler : changeHandlers) {
      handler.reportChange(id);
    }
  }
}
