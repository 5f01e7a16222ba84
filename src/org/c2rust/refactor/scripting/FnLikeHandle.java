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

import com.google.common.collect.ImmutableList;
import org.c2rust.refactor.ast.FnKind;
import org.c2rust.refactor.ast.Node;
import org.c2rust.refactor.ast.Prop;

/** A function-like item as seen by a pass. */
public final class FnLikeHandle {
  private final TransformContext context;
  private final int id;

  FnLikeHandle(TransformContext context, int id) {
    this.context = context;
    this.id = id;
  }

  public TransformContext getContext() {
    return context;
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return node().getIdent();
  }

  public FnKind getKind() {
    return node().getFnKind();
  }

  /** Whether the item is a foreign declaration or otherwise has no body to transform. */
  public boolean isBodiless() {
    return node().isBodiless();
  }

  public int getBodyId() {
    checkState(!isBodiless(), "%s has no body", getName());
    return node().getChild(Prop.BODY);
  }

  /** The pattern of every argument, in declaration order. */
  public ImmutableList<PatternHandle> getArgs() {
    ImmutableList.Builder<PatternHandle> args = ImmutableList.builder();
    for (int arg : node().getChildren(Prop.ARGS)) {
      args.add(new PatternHandle(context, arg));
    }
    return args.build();
  }

  /** The pattern of every local declared directly in the body, in declaration order. */
  public ImmutableList<PatternHandle> getLocals() {
    ImmutableList.Builder<PatternHandle> locals = ImmutableList.builder();
    for (int stmt : context.get(getBodyId()).getChildren(Prop.STMTS)) {
      if (context.get(stmt).isLocal()) {
        locals.add(new PatternHandle(context, stmt));
      }
    }
    return locals.build();
  }

  private Node node() {
    return context.get(id);
  }

  @Override
  public String toString() {
    return "FnLike " + getName() + " @ " + id;
  }
}
