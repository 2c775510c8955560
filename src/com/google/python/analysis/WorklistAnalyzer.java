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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Runs queued units until the queue drains. Analyzing a unit may queue further units; every
 * value set only grows and is capped, so the loop reaches a fixed point.
 *
 * <p>As a guard against divergence, a unit analyzed more than {@link
 * AnalysisLimits#getMaxVisitsPerUnit()} times in one run is dropped with a warning. A unit that
 * throws is logged and skipped, so one broken module does not stop the analysis of the others.
 */
final class WorklistAnalyzer {
  private static final Logger logger = Logger.getLogger(WorklistAnalyzer.class.getName());

  private final AnalysisQueue queue;
  private final AnalysisLimits limits;
  private final @Nullable IntConsumer reportQueueSize;
  private final int reportQueueInterval;

  WorklistAnalyzer(
      AnalysisQueue queue,
      AnalysisLimits limits,
      @Nullable IntConsumer reportQueueSize,
      int reportQueueInterval) {
    this.queue = checkNotNull(queue);
    this.limits = checkNotNull(limits);
    this.reportQueueSize = reportQueueSize;
    this.reportQueueInterval = Math.max(1, reportQueueInterval);
  }

  /** Analyzes until the queue is empty or {@code cancel} fires; returns the units analyzed. */
  int analyze(CancellationToken cancel) {
    Multiset<AnalysisUnit> visits = HashMultiset.create();
    int maxVisits = limits.getMaxVisitsPerUnit();
    int processed = 0;
    while (true) {
      if (cancel.isCancellationRequested()) {
        int dropped = queue.size();
        queue.clear();
        logger.warning("Analysis cancelled with " + dropped + " units still queued");
        break;
      }
      AnalysisUnit unit = queue.pollFirst();
      if (unit == null) {
        break;
      }
      if (maxVisits >= 0 && visits.add(unit, 1) >= maxVisits) {
        logger.warning("Dropping " + unit + " after " + maxVisits + " visits");
        continue;
      }
      try {
        unit.analyze(cancel);
      } catch (RuntimeException e) {
        // Whatever the unit assigned before failing stays; the other units still run.
        logger.log(Level.WARNING, "Analysis of " + unit + " failed", e);
      }
      processed++;
      if (reportQueueSize != null && processed % reportQueueInterval == 0) {
        reportQueueSize.accept(queue.size());
      }
    }
    if (reportQueueSize != null) {
      reportQueueSize.accept(queue.size());
    }
    logger.fine("Analyzed " + processed + " units");
    return processed;
  }
}
