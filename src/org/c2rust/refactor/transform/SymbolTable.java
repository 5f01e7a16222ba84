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

package org.c2rust.refactor.transform;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.c2rust.refactor.ast.BindingMode;
import org.jspecify.annotations.Nullable;

/**
 * The variables of one function-like item, in declaration order.
 *
 * <p>There is a single flat table rather than a chain of nested scopes. Names resolve against
 * every declaration carrying that name, including shadowed ones, so a use after a shadowing
 * declaration counts for both bindings. Records are never removed.
 */
public final class SymbolTable {
  private final Map<Integer, Var> vars = new LinkedHashMap<>();

  /**
   * Declares the binding introduced by pattern {@code id}, marking every earlier binding of the
   * same name as shadowed.
   */
  public Var declare(int id, boolean local, String name) {
    checkArgument(!name.isEmpty());
    // Make sure that it's declared only once
    checkState(!vars.containsKey(id), "%s already declared", id);
    for (Var var : findByName(name)) {
      var.markShadowed();
    }
    Var var = new Var(id, local, name);
    vars.put(id, var);
    return var;
  }

  public @Nullable Var get(int id) {
    return vars.get(id);
  }

  /** All records declared with this name, oldest first. */
  public ImmutableList<Var> findByName(String name) {
    ImmutableList.Builder<Var> result = ImmutableList.builder();
    for (Var var : vars.values()) {
      if (var.getName().equals(name)) {
        result.add(var);
      }
    }
    return result.build();
  }

  public void markUsed(int id) {
    getOrFail(id).markUsed();
  }

  public void markMutated(int id) {
    getOrFail(id).setBindingMode(BindingMode.BY_VALUE_MUTABLE);
  }

  /** Marks every binding called {@code name} as used. */
  public void markUsed(String name) {
    for (Var var : findByName(name)) {
      var.markUsed();
    }
  }

  /** Marks every binding called {@code name} as needing a mutable binding. */
  public void markMutated(String name) {
    for (Var var : findByName(name)) {
      var.setBindingMode(BindingMode.BY_VALUE_MUTABLE);
    }
  }

  public ImmutableList<Var> getVars() {
    return ImmutableList.copyOf(vars.values());
  }

  private Var getOrFail(int id) {
    Var var = vars.get(id);
    checkState(var != null, "No variable declared for %s", id);
    return var;
  }
}
