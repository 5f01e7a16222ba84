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

import static org.c2rust.refactor.ast.Prop.ARGS;
import static org.c2rust.refactor.ast.Prop.BINDING;
import static org.c2rust.refactor.ast.Prop.BODY;
import static org.c2rust.refactor.ast.Prop.COND;
import static org.c2rust.refactor.ast.Prop.ELEMENTS;
import static org.c2rust.refactor.ast.Prop.ELSE;
import static org.c2rust.refactor.ast.Prop.EXPR;
import static org.c2rust.refactor.ast.Prop.FN_KIND;
import static org.c2rust.refactor.ast.Prop.IDENT;
import static org.c2rust.refactor.ast.Prop.INIT;
import static org.c2rust.refactor.ast.Prop.ITEM;
import static org.c2rust.refactor.ast.Prop.ITEMS;
import static org.c2rust.refactor.ast.Prop.LHS;
import static org.c2rust.refactor.ast.Prop.LITERAL;
import static org.c2rust.refactor.ast.Prop.OP;
import static org.c2rust.refactor.ast.Prop.PAT;
import static org.c2rust.refactor.ast.Prop.RHS;
import static org.c2rust.refactor.ast.Prop.SEGMENTS;
import static org.c2rust.refactor.ast.Prop.STMTS;
import static org.c2rust.refactor.ast.Prop.SUBPATS;
import static org.c2rust.refactor.ast.Prop.TY;

import com.google.common.collect.ImmutableList;

/**
 * The closed set of node kinds a translated tree may contain. Each token lists the props it
 * accepts; the order of its child props is the order in which {@link NodeArena#childrenOf}
 * reports children. Every accepted prop is required unless {@link #isOptional} says otherwise.
 */
public enum Token {
  CRATE(Family.ROOT, ITEMS),
  FN_LIKE(Family.ITEM, IDENT, FN_KIND, ARGS, BODY),
  ARG(Family.PARAM, PAT, TY),

  BLOCK(Family.BLOCK, STMTS),

  LOCAL(Family.STATEMENT, PAT, TY, INIT),
  ITEM_STMT(Family.STATEMENT, ITEM),
  // Expression statement terminated by a semicolon
  SEMI(Family.STATEMENT, EXPR),
  // Trailing expression statement, no semicolon
  EXPR_STMT(Family.STATEMENT, EXPR),

  BOX(Family.EXPRESSION, EXPR),
  ARRAY(Family.EXPRESSION, ELEMENTS),
  BINARY(Family.EXPRESSION, OP, LHS, RHS),
  ASSIGN(Family.EXPRESSION, LHS, RHS),
  ASSIGN_OP(Family.EXPRESSION, OP, LHS, RHS),
  PATH(Family.EXPRESSION, SEGMENTS),
  LIT(Family.EXPRESSION, LITERAL),
  CALL(Family.EXPRESSION, EXPR, ELEMENTS),
  UNARY(Family.EXPRESSION, OP, EXPR),
  INDEX(Family.EXPRESSION, LHS, RHS),
  IF(Family.EXPRESSION, COND, BODY, ELSE),
  WHILE(Family.EXPRESSION, COND, BODY),
  LOOP(Family.EXPRESSION, BODY),
  RETURN(Family.EXPRESSION, EXPR),

  PAT_IDENT(Family.PATTERN, BINDING, IDENT),
  PAT_TUPLE(Family.PATTERN, SUBPATS),
  PAT_WILD(Family.PATTERN);

  /** Groups tokens the way visitors see them. */
  public enum Family {
    ROOT,
    ITEM,
    PARAM,
    BLOCK,
    STATEMENT,
    EXPRESSION,
    PATTERN
  }

  private final Family family;
  private final ImmutableList<Prop> props;

  Token(Family family, Prop... props) {
    this.family = family;
    this.props = ImmutableList.copyOf(props);
  }

  public Family getFamily() {
    return family;
  }

  public ImmutableList<Prop> getProps() {
    return props;
  }

  public boolean accepts(Prop prop) {
    return props.contains(prop);
  }

  /** Whether a node of this kind may omit {@code prop}. An absent child list reads as empty. */
  public boolean isOptional(Prop prop) {
    if (prop.getKind() == Prop.Kind.CHILD_LIST) {
      return true;
    }
    switch (this) {
      case FN_LIKE:
        return prop == FN_KIND || prop == BODY;
      case ARG:
        return prop == TY;
      case LOCAL:
        return prop == TY || prop == INIT;
      case IF:
        return prop == ELSE;
      case RETURN:
        return prop == EXPR;
      default:
        return false;
    }
  }
}
