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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.ClassScope;
import com.google.python.analysis.FunctionScope;
import com.google.python.analysis.InterpreterScope;
import com.google.python.analysis.ModuleEntry;
import com.google.python.analysis.SourceLocation;
import com.google.python.analysis.VariableDef;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A function defined in project code.
 *
 * <p>Calls add the argument values to the parameters and return the values of every {@code
 * return} seen so far. The caller depends on the return values, so it is analyzed again when the
 * body learns new ones.
 */
public class FunctionInfo extends Namespace {
  private final Node functionDef;
  private final ModuleEntry projectEntry;
  private final InterpreterScope declaringScope;
  private final FunctionScope scope;
  private final AnalysisUnit analysisUnit;
  private final ImmutableList<String> parameterNames;
  private final Map<String, VariableDef> functionAttributes = new LinkedHashMap<>();

  public FunctionInfo(Node functionDef, InterpreterScope declaringScope, ModuleEntry projectEntry) {
    checkArgument(functionDef.isFunction(), functionDef);
    this.functionDef = functionDef;
    this.projectEntry = checkNotNull(projectEntry);
    this.declaringScope = checkNotNull(declaringScope);
    ImmutableList.Builder<String> names = ImmutableList.builder();
    Node params = functionDef.getFirstChild();
    if (params != null) {
      for (Node param : params.children()) {
        if (param.hasString()) {
          names.add(param.getString());
        }
      }
    }
    this.parameterNames = names.build();
    this.scope = new FunctionScope(this, declaringScope);
    for (String name : parameterNames) {
      scope.createVariable(name);
    }
    this.analysisUnit = new AnalysisUnit(functionDef, scope);
  }

  public Node getFunctionDefinition() {
    return functionDef;
  }

  public FunctionScope getScope() {
    return scope;
  }

  public AnalysisUnit getAnalysisUnit() {
    return analysisUnit;
  }

  public ImmutableList<String> getParameterNames() {
    return parameterNames;
  }

  /** The class whose body defines this function, or null. */
  public @Nullable ClassInfo getDeclaringClass() {
    return declaringScope instanceof ClassScope
        ? ((ClassScope) declaringScope).getClassInfo()
        : null;
  }

  /** Values returned so far, without recording a dependency. */
  public NamespaceSet getReturnTypes() {
    return scope.getReturnValue().getTypes();
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    int limit = unit.getProjectState().getLimits().getAssignedTypes();
    int positional = args.length - argNames.length;
    for (int i = 0; i < positional && i < parameterNames.size(); i++) {
      scope.createVariable(parameterNames.get(i)).addTypes(unit, args[i], limit);
    }
    for (int i = 0; i < argNames.length; i++) {
      if (parameterNames.contains(argNames[i])) {
        scope.createVariable(argNames[i]).addTypes(unit, args[positional + i], limit);
      }
    }
    return scope.getReturnValue().getTypes(unit);
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    VariableDef def = functionAttributes.get(name);
    if (def != null) {
      NamespaceSet result = def.getTypes(unit);
      if (!result.isEmpty()) {
        return result;
      }
    }
    return unit.getProjectState()
        .getClassInfo(BuiltinTypeId.FUNCTION)
        .getInstance()
        .getMember(node, unit, name);
  }

  @Override
  public void setMember(Node node, AnalysisUnit unit, String name, NamespaceSet value) {
    VariableDef def = functionAttributes.computeIfAbsent(name, n -> new VariableDef());
    def.addAssignment(SourceLocation.of(unit, node));
    def.addTypes(unit, value, unit.getProjectState().getLimits().getAssignedTypes());
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.FUNCTION;
  }

  @Override
  public String getName() {
    return functionDef.getString();
  }

  @Override
  public String getDescription() {
    return "def " + getName() + "(" + Joiner.on(", ").join(parameterNames) + ")";
  }

  @Override
  public ImmutableList<SourceLocation> getLocations() {
    return ImmutableList.of(SourceLocation.of(projectEntry.getFilePath(), functionDef));
  }
}
