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
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.SourceLocation;
import com.google.python.analysis.VariableDef;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The instance of a project class. Attributes assigned through any instance are shared by all of
 * them; functions found on the class are returned bound to this instance.
 */
public class InstanceInfo extends Namespace {
  private final ClassInfo classInfo;
  private final Map<String, VariableDef> instanceAttributes = new LinkedHashMap<>();
  private final Map<Namespace, BoundMethodInfo> boundMethods = new IdentityHashMap<>();

  InstanceInfo(ClassInfo classInfo) {
    this.classInfo = classInfo;
  }

  public ClassInfo getClassInfo() {
    return classInfo;
  }

  public ImmutableMap<String, VariableDef> getInstanceAttributes() {
    return ImmutableMap.copyOf(instanceAttributes);
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    VariableDef def = instanceAttributes.get(name);
    if (def == null && !unit.isForEval()) {
      def = new VariableDef();
      instanceAttributes.put(name, def);
    }
    NamespaceSet result = def == null ? NamespaceSet.EMPTY : def.getTypes(unit);
    NamespaceSet classMembers = classInfo.getMember(node, unit, name);
    if (classMembers.isAny()) {
      return NamespaceSet.ANY;
    }
    for (Namespace member : classMembers) {
      result = result.add(BoundMethodInfo.isBindable(member) ? bind(member) : member);
    }
    return result;
  }

  /** Returns {@code function} bound to this instance. */
  public BoundMethodInfo bind(Namespace function) {
    return boundMethods.computeIfAbsent(function, f -> new BoundMethodInfo(f, this));
  }

  @Override
  public void setMember(Node node, AnalysisUnit unit, String name, NamespaceSet value) {
    VariableDef def = instanceAttributes.computeIfAbsent(name, n -> new VariableDef());
    def.addAssignment(SourceLocation.of(unit, node));
    def.addTypes(unit, value, unit.getProjectState().getLimits().getInstanceMembers());
  }

  @Override
  public NamespaceSet getIndex(Node node, AnalysisUnit unit, NamespaceSet index) {
    return getMember(node, unit, "__getitem__")
        .call(node, unit, new NamespaceSet[] {index}, NO_NAMES);
  }

  @Override
  public NamespaceSet getIterator(Node node, AnalysisUnit unit) {
    return getMember(node, unit, "__iter__").call(node, unit, NO_ARGS, NO_NAMES);
  }

  @Override
  public NamespaceSet getEnumeratorTypes(Node node, AnalysisUnit unit) {
    String next = unit.getProjectState().getLanguageVersion().getNextMethodName();
    return getIterator(node, unit).getMember(node, unit, next).call(node, unit, NO_ARGS, NO_NAMES);
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    Map<String, NamespaceSet> result = new LinkedHashMap<>(classInfo.getAllMembers(moduleContext));
    instanceAttributes.forEach(
        (name, def) -> {
          if (!def.isEmpty()) {
            result.merge(name, def.getTypes(), NamespaceSet::union);
          }
        });
    return result;
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.INSTANCE;
  }

  @Override
  public String getName() {
    return classInfo.getName();
  }

  @Override
  public String getDescription() {
    return getName() + " instance";
  }
}
