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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** A deque of units to analyze that holds each unit at most once. */
final class AnalysisQueue {
  private final Deque<AnalysisUnit> workQueue = new ArrayDeque<>();
  private final Set<AnalysisUnit> seenSet = new HashSet<>();

  /** Queues {@code unit} at the back; returns false if it is already queued. */
  synchronized boolean addLast(AnalysisUnit unit) {
    if (seenSet.add(unit)) {
      workQueue.addLast(unit);
      return true;
    }
    return false;
  }

  /** Queues {@code unit} at the front; returns false if it is already queued. */
  synchronized boolean addFirst(AnalysisUnit unit) {
    if (seenSet.add(unit)) {
      workQueue.addFirst(unit);
      return true;
    }
    return false;
  }

  synchronized @Nullable AnalysisUnit pollFirst() {
    AnalysisUnit unit = workQueue.pollFirst();
    if (unit != null) {
      seenSet.remove(unit);
    }
    return unit;
  }

  synchronized boolean contains(AnalysisUnit unit) {
    return seenSet.contains(unit);
  }

  synchronized int size() {
    return workQueue.size();
  }

  synchronized boolean isEmpty() {
    return workQueue.isEmpty();
  }

  synchronized void clear() {
    workQueue.clear();
    seenSet.clear();
  }
}
