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

import org.c2rust.refactor.ast.BindingMode;
import org.c2rust.refactor.ast.Node;
import org.c2rust.refactor.ast.Prop;

/**
 * The pattern field of an argument or a local. The handle follows the owner, so it keeps
 * pointing at the right pattern after {@link #replacePattern}.
 */
public final class PatternHandle {
  private final TransformContext context;
  private final int ownerId;

  PatternHandle(TransformContext context, int ownerId) {
    this.context = context;
    this.ownerId = ownerId;
  }

  /** The ARG or LOCAL node holding the pattern. */
  public int getOwnerId() {
    return ownerId;
  }

  public int getPatternId() {
    return context.get(ownerId).getChild(Prop.PAT);
  }

  /** Whether the pattern binds a single name. Other patterns have no identifier or mode. */
  public boolean isIdent() {
    return pattern().isIdentPattern();
  }

  public String getIdent() {
    return pattern().getIdent();
  }

  public void setIdent(String ident) {
    context.setIdent(getPatternId(), ident);
  }

  public BindingMode getBindingMode() {
    return pattern().getBindingMode();
  }

  public void setBindingMode(BindingMode mode) {
    context.setBindingMode(getPatternId(), mode);
  }

  public void replacePattern(int patternId) {
    context.setPattern(ownerId, patternId);
  }

  private Node pattern() {
    return context.get(getPatternId());
  }

  @Override
  public String toString() {
    return "Pattern " + pattern() + " of " + ownerId;
  }
}
