/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.python.analysis.values;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.python.interpreter.PythonMemberType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NamespaceSetTest {
  private final Namespace a = new NamedNamespace("a");
  private final Namespace b = new NamedNamespace("b");
  private final Namespace c = new NamedNamespace("c");

  @Test
  public void testEmpty() {
    assertThat(NamespaceSet.EMPTY.isEmpty()).isTrue();
    assertThat(NamespaceSet.EMPTY.isAny()).isFalse();
    assertThat(NamespaceSet.EMPTY.size()).isEqualTo(0);
    assertThat(NamespaceSet.copyOf(ImmutableList.of())).isEqualTo(NamespaceSet.EMPTY);
  }

  @Test
  public void testAnyIsNotEmpty() {
    assertThat(NamespaceSet.ANY.isEmpty()).isFalse();
    assertThat(NamespaceSet.ANY.isAny()).isTrue();
    assertThat(NamespaceSet.ANY).isNotEqualTo(NamespaceSet.EMPTY);
  }

  @Test
  public void testUnionRemovesDuplicates() {
    NamespaceSet union = NamespaceSet.of(a, b).union(NamespaceSet.of(b, c));
    assertThat(union.asSet()).containsExactly(a, b, c).inOrder();
    assertThat(union.size()).isEqualTo(3);
  }

  @Test
  public void testUnionWithSubsetIsEqual() {
    NamespaceSet ab = NamespaceSet.of(a, b);
    assertThat(ab.union(NamespaceSet.of(a))).isEqualTo(ab);
    assertThat(ab.union(NamespaceSet.EMPTY)).isEqualTo(ab);
  }

  @Test
  public void testUnionOverLimitBecomesAny() {
    NamespaceSet ab = NamespaceSet.of(a, b);
    assertThat(ab.union(NamespaceSet.of(c), 3).isAny()).isFalse();
    assertThat(ab.union(NamespaceSet.of(c), 2).isAny()).isTrue();
    assertThat(ab.union(NamespaceSet.of(c), NamespaceSet.UNLIMITED).size()).isEqualTo(3);
  }

  @Test
  public void testUnionIsCommutativeAssociativeAndIdempotent() {
    Namespace d = new NamedNamespace("d");
    ImmutableList<NamespaceSet> sets =
        ImmutableList.of(
            NamespaceSet.EMPTY,
            NamespaceSet.of(a),
            NamespaceSet.of(a, b),
            NamespaceSet.of(c, b),
            NamespaceSet.of(d, c),
            NamespaceSet.ANY);
    for (int limit : new int[] {NamespaceSet.UNLIMITED, 2, 3}) {
      for (NamespaceSet x : sets) {
        assertWithMessage("%s with limit %s", x, limit)
            .that(x.union(x, limit))
            .isEqualTo(x.union(NamespaceSet.EMPTY, limit));
        for (NamespaceSet y : sets) {
          assertWithMessage("%s, %s with limit %s", x, y, limit)
              .that(x.union(y, limit))
              .isEqualTo(y.union(x, limit));
          for (NamespaceSet z : sets) {
            assertWithMessage("%s, %s, %s with limit %s", x, y, z, limit)
                .that(x.union(y, limit).union(z, limit))
                .isEqualTo(x.union(y.union(z, limit), limit));
          }
        }
      }
    }
  }

  @Test
  public void testUnionAllIgnoresOrder() {
    NamespaceSet ab = NamespaceSet.of(a, b);
    NamespaceSet bc = NamespaceSet.of(b, c);
    NamespaceSet ca = NamespaceSet.of(c, a);
    assertThat(NamespaceSet.unionAll(ImmutableList.of(ab, bc, ca), 3))
        .isEqualTo(NamespaceSet.unionAll(ImmutableList.of(ca, ab, bc), 3));
    assertThat(NamespaceSet.unionAll(ImmutableList.of(ab, bc), 2))
        .isEqualTo(NamespaceSet.unionAll(ImmutableList.of(bc, ab), 2));
  }

  @Test
  public void testAnyAbsorbs() {
    assertThat(NamespaceSet.ANY.union(NamespaceSet.of(a))).isEqualTo(NamespaceSet.ANY);
    assertThat(NamespaceSet.of(a).union(NamespaceSet.ANY)).isEqualTo(NamespaceSet.ANY);
    assertThat(NamespaceSet.ANY.add(b).isAny()).isTrue();
  }

  @Test
  public void testUnionAll() {
    NamespaceSet all =
        NamespaceSet.unionAll(
            ImmutableList.of(NamespaceSet.of(a), NamespaceSet.EMPTY, NamespaceSet.of(c, a)));
    assertThat(all.asSet()).containsExactly(a, c);
    assertThat(
            NamespaceSet.unionAll(
                    ImmutableList.of(NamespaceSet.of(a), NamespaceSet.of(b), NamespaceSet.of(c)),
                    2)
                .isAny())
        .isTrue();
  }

  @Test
  public void testSelfSetIsCached() {
    assertThat(a.getSelfSet()).isSameInstanceAs(a.getSelfSet());
    assertThat(a.getSelfSet().contains(a)).isTrue();
    assertThat(a.getSelfSet().contains(b)).isFalse();
  }

  @Test
  public void testEqualityIgnoresOrder() {
    assertThat(NamespaceSet.of(a, b)).isEqualTo(NamespaceSet.of(b, a));
    assertThat(NamespaceSet.of(a, b).hashCode()).isEqualTo(NamespaceSet.of(b, a).hashCode());
  }

  private static final class NamedNamespace extends Namespace {
    private final String name;

    NamedNamespace(String name) {
      this.name = name;
    }

    @Override
    public PythonMemberType getMemberType() {
      return PythonMemberType.UNKNOWN;
    }

    @Override
    public String getName() {
      return name;
    }
  }
}
