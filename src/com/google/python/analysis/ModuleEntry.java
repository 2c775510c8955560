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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.python.analysis.values.ModuleInfo;
import com.google.python.interpreter.ModuleContext;
import com.google.python.parsing.Node;
import com.google.python.parsing.Token;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A Python source file of the project and the module it defines.
 *
 * <p>A host parses the file, hands the tree over with {@link #updateTree} and calls {@link
 * #analyze}. Analyzing again after an edit only throws away what was learned about this module;
 * units in other modules that read from it are analyzed again.
 */
public class ModuleEntry implements RemovableProjectEntry {
  private static final Logger logger = Logger.getLogger(ModuleEntry.class.getName());

  private final PythonAnalyzer projectState;
  private final @Nullable String moduleName;
  private final @Nullable String filePath;
  private final ModuleInfo moduleInfo;
  private volatile @Nullable AnalysisCookie cookie;
  private @Nullable Node tree;
  private @Nullable AnalysisUnit analysisUnit;
  private int analysisVersion;
  private boolean removed;

  ModuleEntry(
      PythonAnalyzer projectState,
      @Nullable String moduleName,
      @Nullable String filePath,
      @Nullable AnalysisCookie cookie,
      ModuleContext moduleContext) {
    this.projectState = checkNotNull(projectState);
    this.moduleName = moduleName;
    this.filePath = filePath;
    this.cookie = cookie;
    this.moduleInfo = new ModuleInfo(moduleName == null ? "" : moduleName, this, moduleContext);
  }

  public PythonAnalyzer getProjectState() {
    return projectState;
  }

  public @Nullable String getModuleName() {
    return moduleName;
  }

  @Override
  public @Nullable String getFilePath() {
    return filePath;
  }

  @Override
  public @Nullable AnalysisCookie getCookie() {
    return cookie;
  }

  public ModuleInfo getModuleInfo() {
    return moduleInfo;
  }

  public synchronized @Nullable Node getTree() {
    return tree;
  }

  /** The unit for the module body of the last analysis, or null before the first one. */
  public synchronized @Nullable AnalysisUnit getAnalysisUnit() {
    return analysisUnit;
  }

  @Override
  public synchronized int getAnalysisVersion() {
    return analysisVersion;
  }

  @Override
  public synchronized boolean isAnalyzed() {
    return analysisVersion > 0;
  }

  public synchronized boolean isRemoved() {
    return removed;
  }

  /** Replaces the parsed tree of the file. Takes effect at the next {@link #analyze}. */
  public synchronized void updateTree(Node tree, @Nullable AnalysisCookie cookie) {
    checkArgument(tree.getToken() == Token.MODULE, "Expected a module, got %s", tree);
    this.tree = tree;
    this.cookie = cookie;
  }

  /** Analyzes the current tree and everything that depends on it. */
  public void analyze(CancellationToken cancel) {
    prepareForAnalysis();
    projectState.analyzeQueuedEntries(cancel);
  }

  public void analyze() {
    analyze(CancellationToken.NONE);
  }

  /**
   * Clears the module and queues its body, together with the units of other modules that read
   * from it. Does nothing if no tree was given yet.
   */
  public synchronized void prepareForAnalysis() {
    Node ast = tree;
    if (ast == null) {
      logger.fine("No tree to analyze for " + this);
      return;
    }
    ModuleScope oldScope = moduleInfo.getScope();
    ImmutableSet<AnalysisUnit> dependents = moduleInfo.getDependentUnits();
    moduleInfo.clear();
    analysisUnit = new AnalysisUnit(ast, moduleInfo.getScope());
    analysisVersion++;
    projectState.enqueueFirst(analysisUnit);
    for (AnalysisUnit dependent : dependents) {
      if (dependent.getScope().getGlobalScope() != oldScope) {
        projectState.enqueue(dependent);
      }
    }
  }

  @Override
  public synchronized void removedFromProject() {
    if (removed) {
      return;
    }
    removed = true;
    ModuleScope oldScope = moduleInfo.getScope();
    ImmutableSet<AnalysisUnit> dependents = moduleInfo.getDependentUnits();
    moduleInfo.clear();
    analysisUnit = null;
    for (AnalysisUnit dependent : dependents) {
      if (dependent.getScope().getGlobalScope() != oldScope) {
        projectState.enqueue(dependent);
      }
    }
  }

  @Override
  public String toString() {
    return "ModuleEntry(" + moduleName + ", " + filePath + ")";
  }
}
