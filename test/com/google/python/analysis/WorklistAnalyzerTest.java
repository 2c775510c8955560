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

import com.google.python.interpreter.FakeInterpreter;
import com.google.python.parsing.IR;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class WorklistAnalyzerTest {
  private final AnalysisQueue queue = new AnalysisQueue();
  private final AnalysisLimits limits = new AnalysisLimits();
  private final List<Integer> reports = new ArrayList<>();
  private ModuleEntry entry;

  @Before
  public void setUp() {
    PythonAnalyzer analyzer = new PythonAnalyzer(new FakeInterpreter());
    entry = analyzer.addModule("mod", "/proj/mod.py");
  }

  private AnalysisUnit newUnit() {
    return new AnalysisUnit(IR.module(), entry.getModuleInfo().getScope());
  }

  @Test
  public void testQueueIgnoresDuplicates() {
    AnalysisUnit unit = newUnit();
    assertThat(queue.addLast(unit)).isTrue();
    assertThat(queue.addFirst(unit)).isFalse();
    assertThat(queue.size()).isEqualTo(1);
    assertThat(queue.pollFirst()).isSameInstanceAs(unit);
    assertThat(queue.addLast(unit)).isTrue();
  }

  @Test
  public void testDrainsQueue() {
    queue.addLast(newUnit());
    queue.addLast(newUnit());
    queue.addLast(newUnit());

    int processed = new WorklistAnalyzer(queue, limits, reports::add, 2).analyze(() -> false);

    assertThat(processed).isEqualTo(3);
    assertThat(queue.isEmpty()).isTrue();
    assertThat(reports).containsExactly(1, 0).inOrder();
  }

  @Test
  public void testCancellation() {
    queue.addLast(newUnit());
    queue.addLast(newUnit());

    int processed = new WorklistAnalyzer(queue, limits, reports::add, 1).analyze(() -> true);

    assertThat(processed).isEqualTo(0);
    assertThat(queue.isEmpty()).isTrue();
    assertThat(reports).containsExactly(0);
  }

  @Test
  public void testVisitLimit() {
    limits.setMaxVisitsPerUnit(0);
    queue.addLast(newUnit());

    int processed = new WorklistAnalyzer(queue, limits, null, 1).analyze(CancellationToken.NONE);

    assertThat(processed).isEqualTo(0);
    assertThat(queue.isEmpty()).isTrue();
  }

  @Test
  public void testNoLimit() {
    limits.setMaxVisitsPerUnit(-1);
    queue.addLast(newUnit());

    assertThat(new WorklistAnalyzer(queue, limits, null, 1).analyze(CancellationToken.NONE))
        .isEqualTo(1);
  }
}
