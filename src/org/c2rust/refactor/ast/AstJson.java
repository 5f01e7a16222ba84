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
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Converts between arenas and the nested JSON form exchanged with the translator and the source
 * printer. Every node is one object: {@code "type"} names its {@link Token}, every other key is
 * the {@link Prop#getJsonName() JSON name} of a prop, and children are nested inline. Written
 * trees additionally carry each node's {@code "id"}, which is ignored on input.
 *
 * <pre>
 * {"type": "PAT_IDENT", "ident": "count", "binding": "BY_VALUE_IMMUTABLE"}
 * </pre>
 */
public final class AstJson {
  private static final String TYPE_KEY = "type";
  private static final String ID_KEY = "id";

  /** Reads a tree into the arena and returns the identity of its root. */
  public static int read(String contents, NodeArena arena) throws AstJsonException {
    JsonObject root;
    try {
      root = new Gson().fromJson(contents, JsonObject.class);
    } catch (JsonParseException ex) {
      throw new AstJsonException("JSON parse exception: " + ex.getMessage(), ex);
    }
    if (root == null) {
      throw new AstJsonException("Empty tree");
    }
    return readNode(root, arena);
  }

  private static int readNode(JsonObject object, NodeArena arena) throws AstJsonException {
    if (!object.has(TYPE_KEY)) {
      throw new AstJsonException("Node without a type: " + object);
    }
    Token token = parseEnum(Token.class, object.get(TYPE_KEY).getAsString());
    Map<Prop, Object> fields = new EnumMap<>(Prop.class);
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      String key = entry.getKey();
      if (key.equals(TYPE_KEY) || key.equals(ID_KEY)) {
        continue;
      }
      Prop prop = propForJsonName(key);
      if (!token.accepts(prop)) {
        throw new AstJsonException(token + " does not accept " + key);
      }
      fields.put(prop, readValue(prop, entry.getValue(), arena));
    }
    try {
      return arena.allocate(token, fields);
    } catch (IllegalArgumentException ex) {
      throw new AstJsonException("Invalid " + token + ": " + ex.getMessage(), ex);
    }
  }

  private static Object readValue(Prop prop, JsonElement value, NodeArena arena)
      throws AstJsonException {
    try {
      switch (prop.getKind()) {
        case CHILD:
          return readNode(value.getAsJsonObject(), arena);
        case CHILD_LIST:
          ImmutableList.Builder<Integer> children = ImmutableList.builder();
          for (JsonElement child : value.getAsJsonArray()) {
            children.add(readNode(child.getAsJsonObject(), arena));
          }
          return children.build();
        case VALUE:
          if (prop == Prop.SEGMENTS) {
            ImmutableList.Builder<String> segments = ImmutableList.builder();
            for (JsonElement segment : value.getAsJsonArray()) {
              segments.add(segment.getAsString());
            }
            return segments.build();
          } else if (prop == Prop.BINDING) {
            return parseEnum(BindingMode.class, value.getAsString());
          } else if (prop == Prop.FN_KIND) {
            return parseEnum(FnKind.class, value.getAsString());
          }
          return value.getAsString();
      }
    } catch (IllegalStateException | UnsupportedOperationException ex) {
      // Thrown by the Gson accessors when an element has the wrong shape.
      throw new AstJsonException("Malformed " + prop.getJsonName() + ": " + value, ex);
    }
    throw new AssertionError(prop.getKind());
  }

  private static Prop propForJsonName(String name) throws AstJsonException {
    for (Prop prop : Prop.values()) {
      if (prop.getJsonName().equals(name)) {
        return prop;
      }
    }
    throw new AstJsonException("Unknown field " + name);
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String name)
      throws AstJsonException {
    try {
      return Enum.valueOf(type, name);
    } catch (IllegalArgumentException ex) {
      throw new AstJsonException("Unknown " + type.getSimpleName() + " " + name, ex);
    }
  }

  /** Writes the subtree rooted at {@code root} as nested JSON. */
  public static String write(AstView ast, int root) {
    StringWriter out = new StringWriter();
    try (JsonWriter jsonWriter = new JsonWriter(out)) {
      writeNode(ast, ast.get(root), jsonWriter);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  private static void writeNode(AstView ast, Node node, JsonWriter jsonWriter)
      throws IOException {
    jsonWriter.beginObject();
    jsonWriter.name(TYPE_KEY).value(node.getToken().name());
    jsonWriter.name(ID_KEY).value(node.getId());
    for (Prop prop : node.getToken().getProps()) {
      if (!node.hasProp(prop)) {
        continue;
      }
      jsonWriter.name(prop.getJsonName());
      switch (prop.getKind()) {
        case CHILD:
          writeNode(ast, ast.get(node.getChild(prop)), jsonWriter);
          break;
        case CHILD_LIST:
          jsonWriter.beginArray();
          for (int child : node.getChildren(prop)) {
            writeNode(ast, ast.get(child), jsonWriter);
          }
          jsonWriter.endArray();
          break;
        case VALUE:
          if (prop == Prop.SEGMENTS) {
            jsonWriter.beginArray();
            for (String segment : node.getSegments()) {
              jsonWriter.value(segment);
            }
            jsonWriter.endArray();
          } else {
            jsonWriter.value(node.getProp(prop).toString());
          }
          break;
      }
    }
    jsonWriter.endObject();
  }

  private AstJson() {}
}
