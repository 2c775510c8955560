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

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.python.analysis.values.NamespaceSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The values a variable, attribute, parameter or return slot has been seen to hold.
 *
 * <p>Units that read the slot are recorded as dependents; when new values are added, every
 * dependent is queued to be analyzed again.
 */
public class VariableDef {
  private NamespaceSet types = NamespaceSet.EMPTY;
  private final Set<AnalysisUnit> dependentUnits = new LinkedHashSet<>();
  private final Set<SourceLocation> assignments = new LinkedHashSet<>();
  private final Set<SourceLocation> references = new LinkedHashSet<>();

  /** Returns the values without recording a dependency. */
  public NamespaceSet getTypes() {
    return types;
  }

  /** Returns the values and records {@code unit} as depending on them. */
  public NamespaceSet getTypes(AnalysisUnit unit) {
    addDependency(unit);
    return types;
  }

  public void addDependency(AnalysisUnit unit) {
    if (!unit.isForEval()) {
      dependentUnits.add(unit);
    }
  }

  /**
   * Adds {@code newTypes}, capped at {@code limit}. Returns true, after queuing the dependents, if
   * the values grew.
   */
  @CanIgnoreReturnValue
  public boolean addTypes(AnalysisUnit unit, NamespaceSet newTypes, int limit) {
    NamespaceSet merged = types.union(newTypes, limit);
    if (merged.equals(types)) {
      return false;
    }
    types = merged;
    PythonAnalyzer projectState = unit.getProjectState();
    for (AnalysisUnit dependent : ImmutableSet.copyOf(dependentUnits)) {
      projectState.enqueue(dependent);
    }
    return true;
  }

  public ImmutableSet<AnalysisUnit> getDependentUnits() {
    return ImmutableSet.copyOf(dependentUnits);
  }

  public void addAssignment(SourceLocation location) {
    assignments.add(location);
  }

  public void addReference(SourceLocation location) {
    references.add(location);
  }

  public ImmutableSet<SourceLocation> getAssignments() {
    return ImmutableSet.copyOf(assignments);
  }

  public ImmutableSet<SourceLocation> getReferences() {
    return ImmutableSet.copyOf(references);
  }

  /** True if nothing was ever assigned; such defs only exist to record readers. */
  public boolean isEmpty() {
    return types.isEmpty() && assignments.isEmpty();
  }

  @Override
  public String toString() {
    return "VariableDef" + types;
  }
}
