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
import com.google.python.analysis.values.Namespace;
import com.google.python.interpreter.PythonMemberType;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A slot in the module registry. The slot outlives the module in it, so units that imported a
 * name are still known when a module for the name is added, replaced or removed.
 *
 * <p>A slot is in one of three states: not loaded yet, loaded (with a module, or known to have
 * none), or unresolved. Only unresolved slots are invalid.
 */
public final class ModuleReference {
  private @Nullable Namespace module;
  private boolean loadAttempted;
  private boolean valid = true;
  private final Set<AnalysisUnit> references = new LinkedHashSet<>();

  ModuleReference() {}

  ModuleReference(Namespace module) {
    setModule(module);
  }

  public synchronized @Nullable Namespace getModule() {
    return module;
  }

  /** True if a module is bound; a loaded slot may still have none. */
  public synchronized boolean hasModule() {
    return module != null;
  }

  /** False once loading the name has failed. */
  public synchronized boolean isValid() {
    return valid;
  }

  synchronized boolean isLoadAttempted() {
    return loadAttempted;
  }

  /** Binds {@code module}; null marks the name as known to have no module. */
  synchronized void setModule(@Nullable Namespace module) {
    this.module = module;
    this.loadAttempted = true;
    this.valid = true;
  }

  /**
   * Records the outcome of loading the name, unless the slot was loaded in the meantime. A null
   * {@code module} marks the slot unresolved. Returns true if the outcome was recorded.
   */
  @CanIgnoreReturnValue
  synchronized boolean completeLoad(@Nullable Namespace module) {
    if (loadAttempted) {
      return false;
    }
    if (module == null) {
      markUnresolved();
    } else {
      setModule(module);
    }
    return true;
  }

  /** Returns the slot to the not loaded state if {@code expected} is what it is bound to. */
  synchronized boolean resetIfBoundTo(Namespace expected) {
    if (module != expected) {
      return false;
    }
    reset();
    return true;
  }

  synchronized void markUnresolved() {
    this.module = null;
    this.loadAttempted = true;
    this.valid = false;
  }

  /** Returns the slot to the not loaded state. */
  synchronized void reset() {
    this.module = null;
    this.loadAttempted = false;
    this.valid = true;
  }

  /** Records that {@code unit} imports this name. */
  synchronized void addReference(AnalysisUnit unit) {
    if (!unit.isForEval()) {
      references.add(unit);
    }
  }

  synchronized void removeReference(AnalysisUnit unit) {
    references.remove(unit);
  }

  public synchronized ImmutableSet<AnalysisUnit> getReferences() {
    return ImmutableSet.copyOf(references);
  }

  public synchronized PythonMemberType getMemberType() {
    return module == null ? PythonMemberType.UNKNOWN : module.getMemberType();
  }

  @Override
  public synchronized String toString() {
    return "ModuleReference(" + (valid ? module : "unresolved") + ")";
  }
}
