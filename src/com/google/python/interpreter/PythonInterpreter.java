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
package com.google.python.interpreter;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * The type system of the interpreter being analyzed against. Supplies builtin types, the names of
 * every importable module, and the module objects themselves.
 *
 * <p>All queries are expected to be answered from memory; the analyzer calls them while it holds
 * no locks, but from the analysis thread only.
 */
public interface PythonInterpreter {

  /** Returns the interpreter's object for the given builtin type. */
  PythonType getBuiltinType(BuiltinTypeId id);

  /** Returns the names of every module the interpreter knows how to import. */
  ImmutableList<String> getModuleNames();

  /** Imports the named top-level module, or returns null if it does not exist. */
  @Nullable PythonModule importModule(String name);

  ModuleContext createModuleContext();
}
