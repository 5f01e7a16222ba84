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

import org.c2rust.refactor.transform.RefactorOptions;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PassFactoryTest {

  @Test
  public void testCreateCallsFactoryEachTime() {
    int[] created = {0};
    PassFactory factory =
        PassFactory.builder()
            .setName("counting")
            .setInternalFactory(
                (options) -> {
                  created[0]++;
                  return fnLike -> {};
                })
            .build();

    factory.create(new RefactorOptions());
    factory.create(new RefactorOptions());

    assertThat(created[0]).isEqualTo(2);
    assertThat(factory.getCondition().apply(new RefactorOptions())).isTrue();
  }

  @Test
  public void testOfWrapsPass() {
    FnLikePass pass = fnLike -> {};

    assertThat(PassFactory.of("noop", pass).create(new RefactorOptions())).isSameInstanceAs(pass);
  }

  @Test
  public void testNameIsRequired() {
    assertThrows(IllegalStateException.class, () -> PassFactory.of("", fnLike -> {}));
  }
}
