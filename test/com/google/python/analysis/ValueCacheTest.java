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

package com.google.python.analysis;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.util.concurrent.Uninterruptibles;
import com.google.python.analysis.values.Namespace;
import com.google.python.interpreter.PythonMemberType;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ValueCacheTest {
  private final ValueCache cache = new ValueCache();

  @Test
  public void testMakesOnce() {
    AtomicInteger made = new AtomicInteger();
    Namespace first = cache.getCached("key", () -> new Value("v" + made.incrementAndGet()));
    Namespace second = cache.getCached("key", () -> new Value("v" + made.incrementAndGet()));
    assertThat(second).isSameInstanceAs(first);
    assertThat(made.get()).isEqualTo(1);
    assertThat(cache.size()).isEqualTo(1);
  }

  @Test
  public void testNullKey() {
    Namespace none = cache.getCached(null, () -> new Value("None"));
    assertThat(cache.contains(null)).isTrue();
    assertThat(cache.getCached(null, () -> new Value("other"))).isSameInstanceAs(none);
  }

  @Test
  public void testReentrantLookupSeesPlaceholder() {
    Namespace[] inner = new Namespace[1];
    Namespace outer =
        cache.getCached(
            "key",
            () -> {
              inner[0] = cache.getCached("key", () -> new Value("inner"));
              return new Value("outer");
            });
    assertThat(inner[0]).isNull();
    assertThat(cache.getCached("key", () -> new Value("again"))).isSameInstanceAs(outer);
  }

  @Test
  public void testMakerRunsWithoutHoldingTheCache() {
    Namespace[] fromOtherThread = new Namespace[1];
    cache.getCached(
        "outer",
        () -> {
          Thread other =
              new Thread(
                  () -> fromOtherThread[0] = cache.getCached("inner", () -> new Value("inner")));
          other.start();
          Uninterruptibles.joinUninterruptibly(other, 10, TimeUnit.SECONDS);
          return new Value("outer");
        });
    assertThat(fromOtherThread[0]).isNotNull();
    assertThat(cache.contains("inner")).isTrue();
  }

  @Test
  public void testKeyInProgressOnAnotherThreadIsMadeOnce() {
    Namespace[] fromOtherThread = new Namespace[1];
    Namespace outer =
        cache.getCached(
            "key",
            () -> {
              assertThat(cache.isInProgress("key")).isTrue();
              Thread other =
                  new Thread(
                      () -> fromOtherThread[0] = cache.getCached("key", () -> new Value("other")));
              other.start();
              Uninterruptibles.joinUninterruptibly(other, 10, TimeUnit.SECONDS);
              return new Value("outer");
            });
    assertThat(fromOtherThread[0].getName()).isEqualTo("other");
    assertThat(outer).isSameInstanceAs(fromOtherThread[0]);
    assertThat(cache.isInProgress("key")).isFalse();
  }

  @Test
  public void testFailedMakerLeavesNoEntry() {
    assertThrows(
        IllegalStateException.class,
        () ->
            cache.getCached(
                "key",
                () -> {
                  throw new IllegalStateException("boom");
                }));
    assertThat(cache.contains("key")).isFalse();
    assertThat(cache.getCached("key", () -> new Value("retried")).getName()).isEqualTo("retried");
  }

  @Test
  public void testClear() {
    Namespace first = cache.getCached("key", () -> new Value("first"));
    cache.clear();
    assertThat(cache.size()).isEqualTo(0);
    assertThat(cache.getCached("key", () -> new Value("second"))).isNotSameInstanceAs(first);
  }

  private static final class Value extends Namespace {
    private final String name;

    Value(String name) {
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
