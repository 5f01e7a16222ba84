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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.c2rust.refactor.ast.AstFactory;
import org.c2rust.refactor.ast.BindingMode;
import org.c2rust.refactor.ast.FnKind;
import org.c2rust.refactor.ast.NodeArena;
import org.c2rust.refactor.scripting.CodeChangeHandler.ForbiddenChange;
import org.c2rust.refactor.scripting.CodeChangeHandler.RecentChange;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TransformContextTest {
  private NodeArena arena;
  private AstFactory factory;
  private TransformContext context;

  @Before
  public void setUp() {
    arena = new NodeArena();
    factory = new AstFactory(arena);
    context = new TransformContext(arena);
  }

  @Test
  public void testFnLikesInDeclarationOrder() {
    int inner = factory.fn("inner", AstFactory.args(), factory.block());
    int outer =
        factory.fn("outer", AstFactory.args(), factory.block(factory.itemStmt(inner)));
    int ext = factory.foreignFn("ext", AstFactory.args());
    int method = factory.method("get", AstFactory.args(), factory.block());
    int crate = factory.crate(outer, ext, method);

    List<String> names = new ArrayList<>();
    context.visitFnLike(crate, fnLike -> names.add(fnLike.getName()));

    assertThat(names).containsExactly("outer", "inner", "ext", "get").inOrder();
    assertThat(context.getFnLikes(crate).get(2).isBodiless()).isTrue();
    assertThat(context.getFnLikes(crate).get(3).getKind()).isEqualTo(FnKind.IMPL_METHOD);
  }

  @Test
  public void testFnLikesNestedInLoopBodiesAreListed() {
    int deepest = factory.fn("deepest", AstFactory.args(), factory.block());
    int inWhile =
        factory.fn("inWhile", AstFactory.args(), factory.block(factory.itemStmt(deepest)));
    int inLoop = factory.fn("inLoop", AstFactory.args(), factory.block());
    int body =
        factory.block(
            factory.semi(
                factory.whileLoop(factory.path("c"), factory.block(factory.itemStmt(inWhile)))),
            factory.exprStmt(factory.loop(factory.block(factory.itemStmt(inLoop)))));
    int outer = factory.fn("outer", AstFactory.args(), body);

    List<String> names = new ArrayList<>();
    for (FnLikeHandle fnLike : context.getFnLikes(factory.crate(outer))) {
      names.add(fnLike.getName());
    }

    assertThat(names).containsExactly("outer", "inWhile", "deepest", "inLoop").inOrder();
  }

  @Test
  public void testVisitFnLikeRequiresCrate() {
    int fn = factory.fn("f", AstFactory.args(), factory.block());

    assertThrows(IllegalArgumentException.class, () -> context.visitFnLike(fn, fnLike -> {}));
  }

  @Test
  public void testHandlesExposeArgsAndLocals() {
    int a = factory.patIdent("a");
    int local = factory.local("x", factory.lit("1"));
    int body = factory.block(local, factory.semi(factory.path("x")));
    int fn = factory.fn("f", AstFactory.args(factory.arg(a, "i32")), body);
    FnLikeHandle fnLike = context.getFnLikes(factory.crate(fn)).get(0);

    assertThat(fnLike.getBodyId()).isEqualTo(body);
    assertThat(fnLike.getArgs()).hasSize(1);
    assertThat(fnLike.getArgs().get(0).getPatternId()).isEqualTo(a);
    assertThat(fnLike.getLocals()).hasSize(1);
    assertThat(fnLike.getLocals().get(0).getOwnerId()).isEqualTo(local);
    assertThat(fnLike.getLocals().get(0).getIdent()).isEqualTo("x");
  }

  @Test
  public void testBodilessItemHasNoBody() {
    int ext = factory.foreignFn("ext", AstFactory.args());
    FnLikeHandle fnLike = context.getFnLikes(factory.crate(ext)).get(0);

    assertThrows(IllegalStateException.class, fnLike::getBodyId);
  }

  @Test
  public void testWritesAreAppliedAndReported() {
    int a = factory.patIdent("a");
    RecentChange changes = new RecentChange();
    context.addChangeHandler(changes);

    context.setIdent(a, "_a");
    assertThat(arena.get(a).getIdent()).isEqualTo("_a");
    assertThat(changes.hasCodeChanged()).isTrue();

    changes.reset();
    context.setBindingMode(a, BindingMode.BY_VALUE_IMMUTABLE);
    assertThat(changes.hasCodeChanged()).isFalse();

    context.setBindingMode(a, BindingMode.BY_VALUE_MUTABLE);
    assertThat(arena.get(a).getBindingMode()).isEqualTo(BindingMode.BY_VALUE_MUTABLE);
    assertThat(changes.hasCodeChanged()).isTrue();
  }

  @Test
  public void testForbiddenChange() {
    int a = factory.patIdent("a");
    context.addChangeHandler(new ForbiddenChange());

    // Writing the current value is not a change.
    context.setIdent(a, "a");
    assertThrows(IllegalStateException.class, () -> context.setIdent(a, "b"));
  }

  @Test
  public void testOnlyBindingFieldsAreWritable() {
    int tuple = factory.patTuple(factory.patWild());
    int lit = factory.lit("1");
    int block = factory.block();

    assertThrows(IllegalArgumentException.class, () -> context.setIdent(tuple, "x"));
    assertThrows(
        IllegalArgumentException.class,
        () -> context.setBindingMode(lit, BindingMode.BY_VALUE_MUTABLE));
    assertThrows(IllegalArgumentException.class, () -> context.setPattern(block, tuple));
    assertThrows(IllegalArgumentException.class, () -> context.setIdent(factory.patIdent("a"), ""));
  }

  @Test
  public void testReplacePattern() {
    int original = factory.patTuple(factory.patIdent("a"), factory.patIdent("b"));
    int local = factory.local(original, factory.lit("t"));
    int fn = factory.fn("f", AstFactory.args(), factory.block(local));
    PatternHandle pattern = context.getFnLikes(factory.crate(fn)).get(0).getLocals().get(0);
    int replacement = factory.patIdent("pair");

    assertThat(pattern.isIdent()).isFalse();
    pattern.replacePattern(replacement);

    assertThat(pattern.isIdent()).isTrue();
    assertThat(pattern.getIdent()).isEqualTo("pair");
    assertThrows(IllegalArgumentException.class, () -> pattern.replacePattern(local));
  }

  @Test
  public void testReplacePatternRejectsPatternOfAnotherArg() {
    int a = factory.patIdent("a");
    int b = factory.patIdent("b");
    int argB = factory.arg(b);
    int fn = factory.fn("f", AstFactory.args(factory.arg(a), argB), factory.block());
    List<PatternHandle> args = context.getFnLikes(factory.crate(fn)).get(0).getArgs();
    RecentChange changes = new RecentChange();
    context.addChangeHandler(changes);

    RejectedWriteException e =
        assertThrows(
            RejectedWriteException.class,
            () -> args.get(1).replacePattern(args.get(0).getPatternId()));

    assertThat(e.getNodeId()).isEqualTo(argB);
    assertThat(args.get(1).getPatternId()).isEqualTo(b);
    assertThat(changes.hasCodeChanged()).isFalse();
  }

  @Test
  public void testReplacedPatternCanBeReused() {
    int first = factory.patIdent("first");
    int tuple = factory.patTuple(first, factory.patIdent("second"));
    int moved = factory.local(tuple, factory.lit("t"));
    int target = factory.local(factory.patWild(), factory.lit("u"));
    int fn = factory.fn("f", AstFactory.args(), factory.block(moved, target));
    List<PatternHandle> locals = context.getFnLikes(factory.crate(fn)).get(0).getLocals();

    // Still owned by the first local.
    assertThrows(RejectedWriteException.class, () -> locals.get(1).replacePattern(tuple));
    // Owned by the tuple.
    assertThrows(RejectedWriteException.class, () -> locals.get(1).replacePattern(first));

    locals.get(0).replacePattern(factory.patIdent("pair"));
    locals.get(1).replacePattern(tuple);

    assertThat(locals.get(1).getPatternId()).isEqualTo(tuple);
    // Replacing a pattern with itself is allowed and is not a change.
    locals.get(1).replacePattern(tuple);
  }

  @Test
  public void testUnknownIdentityIsFatal() {
    assertThrows(IllegalStateException.class, () -> context.setIdent(99, "x"));
  }
}
