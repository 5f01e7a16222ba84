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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;
import java.util.EnumMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Creates well-formed nodes in an arena and returns their identities. Mostly used by the
 * external translator bridge and by tests; passes never allocate.
 */
public final class AstFactory {
  private final NodeArena arena;

  public AstFactory(NodeArena arena) {
    this.arena = arena;
  }

  public NodeArena getArena() {
    return arena;
  }

  public int crate(int... items) {
    return arena.allocate(Token.CRATE, ImmutableMap.of(Prop.ITEMS, Ints.asList(items)));
  }

  public int fn(String name, ImmutableList<Integer> args, int body) {
    return fnLike(name, FnKind.NORMAL, args, body);
  }

  public int method(String name, ImmutableList<Integer> args, int body) {
    return fnLike(name, FnKind.IMPL_METHOD, args, body);
  }

  /** A trait method without a default body. */
  public int traitMethod(String name, ImmutableList<Integer> args) {
    return fnLike(name, FnKind.TRAIT_METHOD, args, null);
  }

  public int foreignFn(String name, ImmutableList<Integer> args) {
    return fnLike(name, FnKind.FOREIGN, args, null);
  }

  public int fnLike(String name, FnKind kind, ImmutableList<Integer> args, @Nullable Integer body) {
    Map<Prop, Object> fields = new EnumMap<>(Prop.class);
    fields.put(Prop.IDENT, name);
    fields.put(Prop.FN_KIND, kind);
    fields.put(Prop.ARGS, args);
    if (body != null) {
      fields.put(Prop.BODY, body);
    }
    return arena.allocate(Token.FN_LIKE, fields);
  }

  public int arg(int pat) {
    return arena.allocate(Token.ARG, ImmutableMap.of(Prop.PAT, pat));
  }

  public int arg(int pat, String type) {
    return arena.allocate(Token.ARG, ImmutableMap.of(Prop.PAT, pat, Prop.TY, type));
  }

  /** An argument {@code name} bound by immutable value. */
  public int arg(String name) {
    return arg(patIdent(name));
  }

  public int patIdent(String name) {
    return patIdent(name, BindingMode.BY_VALUE_IMMUTABLE);
  }

  public int patIdent(String name, BindingMode mode) {
    checkArgument(!name.isEmpty());
    return arena.allocate(Token.PAT_IDENT, ImmutableMap.of(Prop.IDENT, name, Prop.BINDING, mode));
  }

  public int patTuple(int... subpats) {
    return arena.allocate(Token.PAT_TUPLE, ImmutableMap.of(Prop.SUBPATS, Ints.asList(subpats)));
  }

  public int patWild() {
    return arena.allocate(Token.PAT_WILD, ImmutableMap.of());
  }

  public int block(int... stmts) {
    return arena.allocate(Token.BLOCK, ImmutableMap.of(Prop.STMTS, Ints.asList(stmts)));
  }

  public int local(int pat, @Nullable Integer init) {
    if (init == null) {
      return arena.allocate(Token.LOCAL, ImmutableMap.of(Prop.PAT, pat));
    }
    return arena.allocate(Token.LOCAL, ImmutableMap.of(Prop.PAT, pat, Prop.INIT, init));
  }

  /** {@code let name = init;} with an immutable by-value binding. */
  public int local(String name, @Nullable Integer init) {
    return local(patIdent(name), init);
  }

  public int itemStmt(int item) {
    return arena.allocate(Token.ITEM_STMT, ImmutableMap.of(Prop.ITEM, item));
  }

  public int semi(int expr) {
    return arena.allocate(Token.SEMI, ImmutableMap.of(Prop.EXPR, expr));
  }

  public int exprStmt(int expr) {
    return arena.allocate(Token.EXPR_STMT, ImmutableMap.of(Prop.EXPR, expr));
  }

  public int box(int expr) {
    return arena.allocate(Token.BOX, ImmutableMap.of(Prop.EXPR, expr));
  }

  public int array(int... elements) {
    return arena.allocate(Token.ARRAY, ImmutableMap.of(Prop.ELEMENTS, Ints.asList(elements)));
  }

  public int binary(String op, int lhs, int rhs) {
    return arena.allocate(
        Token.BINARY, ImmutableMap.of(Prop.OP, op, Prop.LHS, lhs, Prop.RHS, rhs));
  }

  public int assign(int lhs, int rhs) {
    return arena.allocate(Token.ASSIGN, ImmutableMap.of(Prop.LHS, lhs, Prop.RHS, rhs));
  }

  public int assignOp(String op, int lhs, int rhs) {
    return arena.allocate(
        Token.ASSIGN_OP, ImmutableMap.of(Prop.OP, op, Prop.LHS, lhs, Prop.RHS, rhs));
  }

  public int path(String... segments) {
    checkArgument(segments.length > 0);
    return arena.allocate(
        Token.PATH, ImmutableMap.of(Prop.SEGMENTS, ImmutableList.copyOf(segments)));
  }

  public int lit(String text) {
    return arena.allocate(Token.LIT, ImmutableMap.of(Prop.LITERAL, text));
  }

  public int call(int callee, int... args) {
    return arena.allocate(
        Token.CALL, ImmutableMap.of(Prop.EXPR, callee, Prop.ELEMENTS, Ints.asList(args)));
  }

  public int unary(String op, int expr) {
    return arena.allocate(Token.UNARY, ImmutableMap.of(Prop.OP, op, Prop.EXPR, expr));
  }

  public int index(int base, int index) {
    return arena.allocate(Token.INDEX, ImmutableMap.of(Prop.LHS, base, Prop.RHS, index));
  }

  public int whileLoop(int cond, int body) {
    return arena.allocate(Token.WHILE, ImmutableMap.of(Prop.COND, cond, Prop.BODY, body));
  }

  public int loop(int body) {
    return arena.allocate(Token.LOOP, ImmutableMap.of(Prop.BODY, body));
  }

  public int returnExpr(int expr) {
    return arena.allocate(Token.RETURN, ImmutableMap.of(Prop.EXPR, expr));
  }

  public static ImmutableList<Integer> args(int... args) {
    return ImmutableList.copyOf(Ints.asList(args));
  }
}
