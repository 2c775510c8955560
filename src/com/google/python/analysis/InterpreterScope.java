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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.python.analysis.values.Namespace;
import com.google.python.analysis.values.NamespaceSet;
import com.google.python.parsing.Node;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * The variables of a module, class or function body, and the values allocated at nodes inside it.
 */
public abstract class InterpreterScope {
  private final @Nullable InterpreterScope outerScope;
  private final Map<String, VariableDef> variables = new LinkedHashMap<>();
  private final Map<Node, NamespaceSet> nodeValues = new IdentityHashMap<>();

  protected InterpreterScope(@Nullable InterpreterScope outerScope) {
    this.outerScope = outerScope;
  }

  public final @Nullable InterpreterScope getOuterScope() {
    return outerScope;
  }

  /** The value this scope belongs to. */
  public abstract Namespace getNamespace();

  /** Whether names bound here can be seen from nested scopes. */
  public boolean isVisibleToChildren() {
    return true;
  }

  public ImmutableMap<String, VariableDef> getVariables() {
    return ImmutableMap.copyOf(variables);
  }

  public @Nullable VariableDef getVariable(String name) {
    return variables.get(name);
  }

  public VariableDef createVariable(String name) {
    return variables.computeIfAbsent(name, n -> new VariableDef());
  }

  /** Adds {@code values} to variable {@code name}; returns true if its values grew. */
  @CanIgnoreReturnValue
  public boolean assignVariable(
      String name, Node location, AnalysisUnit unit, NamespaceSet values) {
    VariableDef def = createVariable(name);
    def.addAssignment(SourceLocation.of(unit, location));
    return def.addTypes(unit, values, unit.getProjectState().getLimits().getAssignedTypes());
  }

  /**
   * Returns the value allocated at {@code node}, creating it the first time. Later evaluations of
   * the node in this scope get the same value.
   */
  public NamespaceSet getOrMakeNodeValue(Node node, Function<Node, NamespaceSet> maker) {
    NamespaceSet result = nodeValues.get(node);
    if (result == null) {
      result = maker.apply(node);
      nodeValues.put(node, result);
    }
    return result;
  }

  /** This scope followed by each enclosing scope, ending with the module scope. */
  public ImmutableList<InterpreterScope> enumerateTowardsGlobal() {
    ImmutableList.Builder<InterpreterScope> result = ImmutableList.builder();
    for (InterpreterScope s = this; s != null; s = s.outerScope) {
      result.add(s);
    }
    return result.build();
  }

  public ModuleScope getGlobalScope() {
    InterpreterScope s = this;
    while (s.outerScope != null) {
      s = s.outerScope;
    }
    checkState(s instanceof ModuleScope, "Outermost scope is not a module: %s", s);
    return (ModuleScope) s;
  }

  /** Units that read any variable of this scope. */
  public ImmutableSet<AnalysisUnit> getDependentUnits() {
    ImmutableSet.Builder<AnalysisUnit> result = ImmutableSet.builder();
    for (VariableDef def : variables.values()) {
      result.addAll(def.getDependentUnits());
    }
    return result.build();
  }

  public String getName() {
    return getNamespace().getName();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + getName() + ")";
  }
}
