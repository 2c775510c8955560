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

import com.google.python.analysis.values.Namespace;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Memoizes the namespaces created for interpreter objects and constants so that each gets
 * exactly one.
 *
 * <p>While a thread makes the namespace for a key, a request for the same key from inside that
 * factory gets null instead of recursing. Factories run without the cache's lock, so they may call
 * into the interpreter and the module registry freely; when two threads make the same key at
 * once, the first namespace published is kept.
 */
final class ValueCache {
  private static final Object NULL_KEY = new Object();

  private final Map<Object, Namespace> cache = new HashMap<>();
  private final ThreadLocal<Set<Object>> making = ThreadLocal.withInitial(HashSet::new);

  @Nullable Namespace getCached(@Nullable Object key, Supplier<? extends Namespace> maker) {
    Object k = key == null ? NULL_KEY : key;
    synchronized (this) {
      Namespace existing = cache.get(k);
      if (existing != null) {
        return existing;
      }
    }
    Set<Object> inProgress = making.get();
    if (!inProgress.add(k)) {
      return null;
    }
    Namespace result;
    try {
      result = maker.get();
    } finally {
      inProgress.remove(k);
    }
    synchronized (this) {
      Namespace published = cache.putIfAbsent(k, result);
      return published != null ? published : result;
    }
  }

  synchronized boolean contains(@Nullable Object key) {
    return cache.containsKey(key == null ? NULL_KEY : key);
  }

  /** True while the calling thread is making the namespace for {@code key}. */
  boolean isInProgress(@Nullable Object key) {
    return making.get().contains(key == null ? NULL_KEY : key);
  }

  synchronized int size() {
    return cache.size();
  }

  synchronized void clear() {
    cache.clear();
  }
}
