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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A node of a translated syntax tree. The token is fixed at creation; fields may only be
 * rewritten through {@link NodeArena#setField}, which keeps this class read-only to everybody
 * outside the arena.
 */
public final class Node {
  private final int id;
  private final Token token;
  private final EnumMap<Prop, Object> props = new EnumMap<>(Prop.class);

  Node(int id, Token token, Map<Prop, Object> props) {
    this.id = id;
    this.token = token;
    this.props.putAll(props);
  }

  public int getId() {
    return id;
  }

  public Token getToken() {
    return token;
  }

  public boolean hasProp(Prop prop) {
    return props.containsKey(prop);
  }

  public @Nullable Object getProp(Prop prop) {
    return props.get(prop);
  }

  void putProp(Prop prop, Object value) {
    props.put(prop, value);
  }

  public String getString(Prop prop) {
    Object value = props.get(prop);
    checkState(value instanceof String, "%s has no %s", this, prop);
    return (String) value;
  }

  public boolean hasChild(Prop prop) {
    return prop.getKind() == Prop.Kind.CHILD && props.containsKey(prop);
  }

  /** Returns the identity held by a single-child prop, which must be present. */
  public int getChild(Prop prop) {
    Object value = props.get(prop);
    checkState(value instanceof Integer, "%s has no %s", this, prop);
    return (Integer) value;
  }

  /** Returns the identities held by a child-list prop; an absent list is empty. */
  @SuppressWarnings("unchecked") // Validated by NodeArena
  public ImmutableList<Integer> getChildren(Prop prop) {
    checkState(prop.getKind() == Prop.Kind.CHILD_LIST, "%s is not a child list", prop);
    Object value = props.get(prop);
    return value == null ? ImmutableList.of() : (ImmutableList<Integer>) value;
  }

  public String getIdent() {
    return getString(Prop.IDENT);
  }

  public BindingMode getBindingMode() {
    Object value = props.get(Prop.BINDING);
    checkState(value != null, "%s has no binding mode", this);
    return (BindingMode) value;
  }

  public FnKind getFnKind() {
    Object value = props.get(Prop.FN_KIND);
    return value == null ? FnKind.NORMAL : (FnKind) value;
  }

  @SuppressWarnings("unchecked") // Validated by NodeArena
  public ImmutableList<String> getSegments() {
    Object value = props.get(Prop.SEGMENTS);
    return value == null ? ImmutableList.of() : (ImmutableList<String>) value;
  }

  /** Whether this is a path made of exactly one segment, i.e. a plain variable reference. */
  public boolean isSimplePath() {
    return token == Token.PATH && getSegments().size() == 1;
  }

  public boolean isIdentPattern() {
    return token == Token.PAT_IDENT;
  }

  public boolean isLocal() {
    return token == Token.LOCAL;
  }

  public boolean isFnLike() {
    return token == Token.FN_LIKE;
  }

  /** Whether this function-like item has nothing for a pass to look at. */
  public boolean isBodiless() {
    return token == Token.FN_LIKE && (getFnKind() == FnKind.FOREIGN || !hasChild(Prop.BODY));
  }

  /** The children of this node in the order its token declares them. */
  public ImmutableList<Integer> children() {
    ImmutableList.Builder<Integer> builder = ImmutableList.builder();
    for (Prop prop : token.getProps()) {
      if (prop.getKind() == Prop.Kind.CHILD && props.containsKey(prop)) {
        builder.add(getChild(prop));
      } else if (prop.getKind() == Prop.Kind.CHILD_LIST) {
        builder.addAll(getChildren(prop));
      }
    }
    return builder.build();
  }

  @Override
  public String toString() {
    if (props.containsKey(Prop.IDENT)) {
      return token + "#" + id + " " + props.get(Prop.IDENT);
    }
    return token + "#" + id;
  }
}
