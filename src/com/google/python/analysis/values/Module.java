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

import com.google.common.collect.ImmutableMap;
import com.google.python.interpreter.ModuleContext;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A namespace that can be imported: a project module, a builtin module, or an aggregate. */
public interface Module {

  /** The submodule {@code name} of this package, or null. */
  @Nullable Module getChildPackage(ModuleContext context, String name);

  ImmutableMap<String, Namespace> getChildrenPackages(ModuleContext context);

  /**
   * Installs a call override for the function {@code name}, which may be qualified by a class
   * name ({@code "Class.method"}). Installing the same override twice has no further effect.
   */
  void specializeFunction(String name, CallDelegate delegate, boolean analyze);

  /** Applies the overrides installed under {@code name} to {@code values}. */
  NamespaceSet applySpecializations(String name, NamespaceSet values);

  boolean containsMember(ModuleContext context, String name);

  Map<String, NamespaceSet> getAllMembers(ModuleContext context);
}
