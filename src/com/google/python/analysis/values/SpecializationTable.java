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

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The call overrides installed on one module, keyed by function name ({@code "f"} or {@code
 * "Class.f"}).
 *
 * <p>Overrides are applied when a member is read: each value found under a specialized name is
 * replaced by a {@link SpecializedCallable}. Wrappers are cached per original value, so repeated
 * reads see the same namespace.
 */
public final class SpecializationTable {
  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /** Installs an override; returns false if the same override was already installed. */
  @CanIgnoreReturnValue
  public synchronized boolean put(String name, CallDelegate delegate, boolean analyze) {
    Entry existing = entries.get(name);
    if (existing != null && existing.delegate == delegate && existing.analyze == analyze) {
      return false;
    }
    entries.put(name, new Entry(delegate, analyze));
    return true;
  }

  public synchronized boolean contains(String name) {
    return entries.containsKey(name);
  }

  public synchronized ImmutableSet<String> getNames() {
    return ImmutableSet.copyOf(entries.keySet());
  }

  public synchronized int size() {
    return entries.size();
  }

  /** Replaces the values read from member {@code name} with their specialized versions. */
  public NamespaceSet apply(String name, NamespaceSet values) {
    Entry entry;
    synchronized (this) {
      entry = entries.get(name);
    }
    if (entry == null || values.isEmpty() || values.isAny()) {
      return values;
    }
    NamespaceSet result = NamespaceSet.EMPTY;
    for (Namespace ns : values) {
      result = result.add(entry.wrap(ns));
    }
    return result;
  }

  private static final class Entry {
    final CallDelegate delegate;
    final boolean analyze;
    final Map<Namespace, SpecializedCallable> wrapped = new IdentityHashMap<>();

    Entry(CallDelegate delegate, boolean analyze) {
      this.delegate = delegate;
      this.analyze = analyze;
    }

    synchronized Namespace wrap(Namespace original) {
      if (original instanceof SpecializedCallable
          && ((SpecializedCallable) original).getDelegate() == delegate) {
        return original;
      }
      SpecializedCallable result = wrapped.get(original);
      if (result == null) {
        result = new SpecializedCallable(original, delegate, analyze);
        wrapped.put(original, result);
      }
      return result;
    }

    @Override
    public String toString() {
      return "Entry(analyze=" + analyze + ")";
    }
  }

  @Override
  public synchronized String toString() {
    return "SpecializationTable" + entries.keySet();
  }
}
