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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.ModuleEntry;
import com.google.python.analysis.ModuleScope;
import com.google.python.analysis.SourceLocation;
import com.google.python.analysis.VariableDef;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A module of the project being analyzed. Its members are the variables of its module scope;
 * names without a binding fall back to submodules of the same package.
 */
public class ModuleInfo extends Namespace implements Module {
  private final String name;
  private final ModuleEntry projectEntry;
  private final ModuleContext moduleContext;
  private final SpecializationTable specializations = new SpecializationTable();
  private ModuleScope scope;

  public ModuleInfo(String name, ModuleEntry projectEntry, ModuleContext moduleContext) {
    this.name = checkNotNull(name);
    this.projectEntry = checkNotNull(projectEntry);
    this.moduleContext = checkNotNull(moduleContext);
    this.scope = new ModuleScope(this);
  }

  public ModuleScope getScope() {
    return scope;
  }

  public ModuleEntry getProjectEntry() {
    return projectEntry;
  }

  public ModuleContext getModuleContext() {
    return moduleContext;
  }

  public SpecializationTable getSpecializations() {
    return specializations;
  }

  /** Units that read any of this module's variables. */
  public ImmutableSet<AnalysisUnit> getDependentUnits() {
    return scope.getDependentUnits();
  }

  /** Drops everything learned about the module; its next analysis starts from scratch. */
  public void clear() {
    scope = new ModuleScope(this);
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    VariableDef def = scope.getVariable(name);
    if (def == null && !unit.isForEval()) {
      def = scope.createVariable(name);
    }
    NamespaceSet result = def == null ? NamespaceSet.EMPTY : def.getTypes(unit);
    if (result.isEmpty()) {
      Module child = getChildPackage(unit.getModuleContext(), name);
      if (child instanceof Namespace) {
        result = ((Namespace) child).getSelfSet();
      }
    }
    return specializations.apply(name, result);
  }

  @Override
  public void setMember(Node node, AnalysisUnit unit, String name, NamespaceSet value) {
    scope.assignVariable(name, node, unit, value);
  }

  @Override
  public @Nullable Module getChildPackage(ModuleContext context, String name) {
    Namespace child = projectEntry.getProjectState().getRegisteredModule(this.name + "." + name);
    return child instanceof Module ? (Module) child : null;
  }

  @Override
  public ImmutableMap<String, Namespace> getChildrenPackages(ModuleContext context) {
    return projectEntry.getProjectState().getChildModules(name);
  }

  @Override
  public void specializeFunction(String name, CallDelegate delegate, boolean analyze) {
    specializations.put(name, delegate, analyze);
  }

  @Override
  public NamespaceSet applySpecializations(String name, NamespaceSet values) {
    return specializations.apply(name, values);
  }

  @Override
  public boolean containsMember(ModuleContext context, String name) {
    VariableDef def = scope.getVariable(name);
    return def != null && !def.isEmpty();
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    Map<String, NamespaceSet> result = new LinkedHashMap<>();
    scope
        .getVariables()
        .forEach(
            (name, def) -> {
              if (!def.isEmpty()) {
                result.put(name, def.getTypes());
              }
            });
    return result;
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.MODULE;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getDescription() {
    return "Python module " + name;
  }

  @Override
  public ImmutableList<SourceLocation> getLocations() {
    return ImmutableList.of(SourceLocation.create(projectEntry.getFilePath(), 1, 1));
  }
}
