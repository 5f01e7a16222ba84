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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Owns every node of one translation unit. Nodes are addressed by an integer identity handed out
 * by {@link #allocate}; identities start at 1, are never reused and stay valid across any number
 * of {@link #setField} calls, so passes and symbol tables can hold them instead of node
 * references.
 *
 * <p>An arena is not thread safe. One traversal owns it at a time.
 */
public final class NodeArena implements AstView {
  // nodes.get(i) has identity i + 1
  private final List<Node> nodes = new ArrayList<>();

  /**
   * Creates a node and returns its identity.
   *
   * @throws IllegalArgumentException if the token does not accept one of the props, a value has
   *     the wrong type, a required prop is missing or a child identity is unknown
   */
  public int allocate(Token token, Map<Prop, ?> fields) {
    checkNotNull(token);
    int id = nodes.size() + 1;
    EnumMap<Prop, Object> validated = new EnumMap<>(Prop.class);
    for (Map.Entry<Prop, ?> field : fields.entrySet()) {
      validated.put(field.getKey(), validate(id, token, field.getKey(), field.getValue()));
    }
    for (Prop prop : token.getProps()) {
      checkArgument(
          token.isOptional(prop) || validated.containsKey(prop), "%s requires %s", token, prop);
    }
    nodes.add(new Node(id, token, validated));
    return id;
  }

  @Override
  public Node get(int id) {
    checkState(contains(id), "ArenaIdentityNotFound: no node with identity %s", id);
    return nodes.get(id - 1);
  }

  public boolean contains(int id) {
    return id > 0 && id <= nodes.size();
  }

  /** The number of nodes ever allocated. */
  public int size() {
    return nodes.size();
  }

  /**
   * Rewrites one field of an existing node. The change is visible immediately to every holder of
   * the identity.
   */
  public void setField(int id, Prop prop, Object value) {
    Node node = get(id);
    node.putProp(prop, validate(id, node.getToken(), prop, value));
  }

  @Override
  public ImmutableList<Integer> childrenOf(int id) {
    return get(id).children();
  }

  private Object validate(int owner, Token token, Prop prop, Object value) {
    checkArgument(token.accepts(prop), "%s does not accept %s", token, prop);
    checkNotNull(value, "null value for %s", prop);
    switch (prop.getKind()) {
      case CHILD:
        checkArgument(value instanceof Integer, "%s must hold a node identity", prop);
        checkChild(owner, (Integer) value);
        return value;
      case CHILD_LIST:
        checkArgument(value instanceof List, "%s must hold a list of node identities", prop);
        ImmutableList.Builder<Integer> children = ImmutableList.builder();
        for (Object child : (List<?>) value) {
          checkArgument(child instanceof Integer, "%s must hold node identities", prop);
          checkChild(owner, (Integer) child);
          children.add((Integer) child);
        }
        return children.build();
      case VALUE:
        if (prop == Prop.SEGMENTS) {
          checkArgument(value instanceof List, "SEGMENTS must be a list of strings");
          ImmutableList.Builder<String> segments = ImmutableList.builder();
          for (Object segment : (List<?>) value) {
            checkArgument(segment instanceof String, "SEGMENTS must be a list of strings");
            segments.add((String) segment);
          }
          return segments.build();
        }
        checkArgument(
            prop.getValueType().isInstance(value),
            "%s expects %s, got %s",
            prop,
            prop.getValueType().getSimpleName(),
            value.getClass().getSimpleName());
        return value;
    }
    throw new AssertionError(prop.getKind());
  }

  private void checkChild(int owner, int child) {
    checkArgument(child != owner, "node %s cannot be its own child", owner);
    checkArgument(contains(child), "unknown child identity %s", child);
  }
}
