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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.ClassScope;
import com.google.python.analysis.InterpreterScope;
import com.google.python.analysis.ModuleEntry;
import com.google.python.analysis.SourceLocation;
import com.google.python.analysis.VariableDef;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A class defined in project code. Members are looked up in the class body first, then in each
 * base in declaration order. Calling the class runs {@code __init__} on its instance.
 */
public class ClassInfo extends Namespace {
  private final Node classDef;
  private final ModuleEntry projectEntry;
  private final ClassScope scope;
  private final AnalysisUnit analysisUnit;
  private final InstanceInfo instance;
  private final List<VariableDef> bases = new ArrayList<>();
  private boolean lookingUp;

  public ClassInfo(Node classDef, InterpreterScope declaringScope, ModuleEntry projectEntry) {
    checkArgument(classDef.isClass(), classDef);
    this.classDef = classDef;
    this.projectEntry = checkNotNull(projectEntry);
    this.scope = new ClassScope(this, declaringScope);
    this.analysisUnit = new AnalysisUnit(classDef, scope);
    this.instance = new InstanceInfo(this);
  }

  public Node getClassDefinition() {
    return classDef;
  }

  public ClassScope getScope() {
    return scope;
  }

  public AnalysisUnit getAnalysisUnit() {
    return analysisUnit;
  }

  public InstanceInfo getInstance() {
    return instance;
  }

  /** The values each base expression evaluated to, without recording dependencies. */
  public ImmutableList<NamespaceSet> getBases() {
    ImmutableList.Builder<NamespaceSet> result = ImmutableList.builder();
    for (VariableDef base : bases) {
      result.add(base.getTypes());
    }
    return result.build();
  }

  /** Adds to the values of the base at {@code index}; returns true if they grew. */
  @CanIgnoreReturnValue
  public boolean addBase(AnalysisUnit unit, int index, NamespaceSet values) {
    while (bases.size() <= index) {
      bases.add(new VariableDef());
    }
    return bases.get(index).addTypes(unit, values, NamespaceSet.UNLIMITED);
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    instance.getMember(node, unit, "__init__").call(node, unit, args, argNames);
    return instance.getSelfSet();
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    // A class reachable from its own bases.
    if (lookingUp) {
      return NamespaceSet.EMPTY;
    }
    NamespaceSet result;
    lookingUp = true;
    try {
      result = lookupMember(node, unit, name);
    } finally {
      lookingUp = false;
    }
    return projectEntry.getModuleInfo().applySpecializations(getName() + "." + name, result);
  }

  private NamespaceSet lookupMember(Node node, AnalysisUnit unit, String name) {
    VariableDef def = scope.getVariable(name);
    if (def == null && !unit.isForEval()) {
      def = scope.createVariable(name);
    }
    if (def != null) {
      NamespaceSet own = def.getTypes(unit);
      if (!own.isEmpty()) {
        return own;
      }
    }
    NamespaceSet result = NamespaceSet.EMPTY;
    for (VariableDef base : bases) {
      result = result.union(base.getTypes(unit).getMember(node, unit, name));
    }
    return result;
  }

  @Override
  public void setMember(Node node, AnalysisUnit unit, String name, NamespaceSet value) {
    scope.assignVariable(name, node, unit, value);
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    Map<String, NamespaceSet> result = new LinkedHashMap<>();
    for (VariableDef base : bases) {
      for (Namespace ns : base.getTypes()) {
        result.putAll(ns.getAllMembers(moduleContext));
      }
    }
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
    return PythonMemberType.CLASS;
  }

  @Override
  public String getName() {
    return classDef.getString();
  }

  @Override
  public String getDescription() {
    return "class " + getName();
  }

  @Override
  public ImmutableList<SourceLocation> getLocations() {
    return ImmutableList.of(SourceLocation.of(projectEntry.getFilePath(), classDef));
  }
}
