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

import com.google.common.collect.ImmutableSortedMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.python.analysis.values.BuiltinModule;
import com.google.python.analysis.values.ModuleInfo;
import com.google.python.analysis.values.Namespace;
import com.google.python.interpreter.PythonInterpreter;
import com.google.python.interpreter.PythonModule;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The registry of importable modules by dotted name: project modules and interpreter modules.
 * Interpreter modules are imported the first time they are asked for.
 */
public final class ModuleTable {
  private static final Logger logger = Logger.getLogger(ModuleTable.class.getName());

  private final PythonAnalyzer projectState;
  private final PythonInterpreter interpreter;
  private final ConcurrentMap<String, ModuleReference> modules = new ConcurrentHashMap<>();

  ModuleTable(PythonAnalyzer projectState, PythonInterpreter interpreter) {
    this.projectState = checkNotNull(projectState);
    this.interpreter = checkNotNull(interpreter);
  }

  public @Nullable ModuleReference getReference(String name) {
    return modules.get(name);
  }

  ModuleReference getOrCreateReference(String name) {
    return modules.computeIfAbsent(name, n -> new ModuleReference());
  }

  public boolean contains(String name) {
    return modules.containsKey(name);
  }

  /**
   * Returns the module bound to {@code name}, importing it from the interpreter if nothing was
   * tried yet. Returns null if there is none.
   */
  public @Nullable Namespace getModule(String name) {
    ModuleReference ref = getOrCreateReference(name);
    if (!ref.isLoadAttempted()) {
      load(name, ref);
    }
    return ref.getModule();
  }

  /**
   * Imports {@code name} without holding the slot's lock. Two threads may both import; the first
   * result is kept, and a module bound in the meantime wins over either.
   */
  private void load(String name, ModuleReference ref) {
    Object module = projectState.importBuiltinModule(name, true);
    if (module instanceof Namespace) {
      ref.completeLoad((Namespace) module);
    } else if (ref.completeLoad(null)) {
      logger.fine("Unable to resolve module " + name);
    }
  }

  /**
   * Returns the one namespace for an interpreter module. The module's name is not bound here:
   * alternatives of an aggregate share a name, which only {@link #getModule} may bind.
   */
  BuiltinModule getBuiltinModule(PythonModule module) {
    return (BuiltinModule)
        checkNotNull(projectState.getCached(module, () -> new BuiltinModule(module, projectState)));
  }

  /** Binds {@code module} to {@code name}, replacing whatever was bound. */
  ModuleReference setModule(String name, Namespace module) {
    ModuleReference ref = getOrCreateReference(name);
    ref.setModule(module);
    return ref;
  }

  /**
   * Unbinds {@code name} if {@code module} is what it is bound to. The name may then resolve to an
   * interpreter module again.
   */
  @CanIgnoreReturnValue
  boolean remove(String name, Namespace module) {
    ModuleReference ref = modules.get(name);
    if (ref == null || !ref.resetIfBoundTo(module)) {
      return false;
    }
    load(name, ref);
    return true;
  }

  /** A snapshot of every slot, sorted by name. */
  public ImmutableSortedMap<String, ModuleReference> getReferences() {
    return ImmutableSortedMap.copyOf(modules);
  }

  /**
   * Forgets every interpreter module and registers the interpreter's module names again. Project
   * modules stay bound.
   */
  void reInit() {
    for (Map.Entry<String, ModuleReference> entry : modules.entrySet()) {
      ModuleReference ref = entry.getValue();
      synchronized (ref) {
        if (ref.getModule() instanceof ModuleInfo) {
          continue;
        }
        if (ref.getReferences().isEmpty()) {
          modules.remove(entry.getKey(), ref);
        } else {
          ref.reset();
        }
      }
    }
    for (String name : interpreter.getModuleNames()) {
      modules.putIfAbsent(name, new ModuleReference());
    }
    for (Map.Entry<String, ModuleReference> entry : modules.entrySet()) {
      ModuleReference ref = entry.getValue();
      if (!ref.isLoadAttempted() && !ref.getReferences().isEmpty()) {
        load(entry.getKey(), ref);
      }
    }
  }
}
