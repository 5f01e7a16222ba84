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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;

/**
 * A field of a {@link Node}. Child fields hold node identities, never nodes, so that a field
 * can be rewritten without invalidating the identities held by anybody else.
 */
public enum Prop {
  // Ordered children
  ITEMS(Kind.CHILD_LIST),
  ARGS(Kind.CHILD_LIST),
  STMTS(Kind.CHILD_LIST),
  ELEMENTS(Kind.CHILD_LIST),
  SUBPATS(Kind.CHILD_LIST),

  // Single children
  PAT(Kind.CHILD),
  INIT(Kind.CHILD),
  ITEM(Kind.CHILD),
  EXPR(Kind.CHILD),
  LHS(Kind.CHILD),
  RHS(Kind.CHILD),
  COND(Kind.CHILD),
  BODY(Kind.CHILD),
  ELSE(Kind.CHILD),

  // Attributes
  IDENT(String.class),
  // Type text as printed by the translator, opaque to every pass.
  TY(String.class),
  OP(String.class),
  LITERAL(String.class),
  SEGMENTS(ImmutableList.class),
  BINDING(BindingMode.class),
  FN_KIND(FnKind.class);

  /** What kind of value a prop holds. */
  public enum Kind {
    CHILD,
    CHILD_LIST,
    VALUE
  }

  private final Kind kind;
  private final Class<?> valueType;

  Prop(Kind kind) {
    this.kind = kind;
    this.valueType = kind == Kind.CHILD ? Integer.class : ImmutableList.class;
  }

  Prop(Class<?> valueType) {
    this.kind = Kind.VALUE;
    this.valueType = valueType;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isChild() {
    return kind != Kind.VALUE;
  }

  Class<?> getValueType() {
    return valueType;
  }

  /** The key used for this prop in the JSON interchange format. */
  public String getJsonName() {
    return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }
}
