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

import org.c2rust.refactor.ast.BindingMode;

/**
 * What one pass run knows about a binding introduced by an argument or a local. Keyed by the
 * identity of the binding's pattern node and discarded once the item has been processed.
 */
public final class Var {
  private final int id;
  private final boolean local;
  // Snapshot taken at declaration; later renames do not change resolution.
  private final String name;
  private BindingMode bindingMode = BindingMode.BY_VALUE_IMMUTABLE;
  private boolean used = false;
  private boolean shadowed = false;

  Var(int id, boolean local, String name) {
    this.id = id;
    this.local = local;
    this.name = name;
  }

  public int getId() {
    return id;
  }

  /** False for arguments. */
  public boolean isLocal() {
    return local;
  }

  public String getName() {
    return name;
  }

  /** The inferred binding mode. */
  public BindingMode getBindingMode() {
    return bindingMode;
  }

  void setBindingMode(BindingMode bindingMode) {
    this.bindingMode = bindingMode;
  }

  public boolean isUsed() {
    return used;
  }

  void markUsed() {
    used = true;
  }

  public boolean isShadowed() {
    return shadowed;
  }

  void markShadowed() {
    shadowed = true;
  }

  @Override
  public String toString() {
    return "Var " + name + " @ " + id;
  }
}
