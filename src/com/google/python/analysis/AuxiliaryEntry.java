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

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A non-Python file of the project, such as markup that code loads at runtime. Modules that use
 * it are registered as dependencies and analyzed again when its content changes.
 */
public class AuxiliaryEntry implements RemovableProjectEntry {
  private final PythonAnalyzer projectState;
  private final String filePath;
  private volatile @Nullable AnalysisCookie cookie;
  private final Set<ModuleEntry> dependencies = new LinkedHashSet<>();
  private int analysisVersion;

  AuxiliaryEntry(PythonAnalyzer projectState, String filePath, @Nullable AnalysisCookie cookie) {
    this.projectState = checkNotNull(projectState);
    this.filePath = checkNotNull(filePath);
    this.cookie = cookie;
  }

  @Override
  public String getFilePath() {
    return filePath;
  }

  @Override
  public @Nullable AnalysisCookie getCookie() {
    return cookie;
  }

  @Override
  public synchronized int getAnalysisVersion() {
    return analysisVersion;
  }

  @Override
  public synchronized boolean isAnalyzed() {
    return analysisVersion > 0;
  }

  public synchronized void addDependency(ModuleEntry module) {
    dependencies.add(checkNotNull(module));
  }

  public synchronized void removeDependency(ModuleEntry module) {
    dependencies.remove(module);
  }

  public synchronized ImmutableSet<ModuleEntry> getDependencies() {
    return ImmutableSet.copyOf(dependencies);
  }

  /** Records new content and queues the body of every dependent module. */
  public void updateContent(@Nullable AnalysisCookie cookie) {
    ImmutableSet<ModuleEntry> dependents;
    synchronized (this) {
      this.cookie = cookie;
      analysisVersion++;
      dependents = ImmutableSet.copyOf(dependencies);
    }
    for (ModuleEntry dependent : dependents) {
      AnalysisUnit unit = dependent.getAnalysisUnit();
      if (unit != null) {
        projectState.enqueue(unit);
      }
    }
  }

  @Override
  public synchronized void removedFromProject() {
    dependencies.clear();
  }

  @Override
  public String toString() {
    return "AuxiliaryEntry(" + filePath + ")";
  }
}
