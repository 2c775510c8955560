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

import com.google.python.analysis.AnalysisUnit;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.Map;

/** The instance shared by every value of a builtin class. */
public class BuiltinInstanceInfo extends Namespace {
  private final BuiltinClassInfo classInfo;

  BuiltinInstanceInfo(BuiltinClassInfo classInfo) {
    this.classInfo = classInfo;
  }

  public BuiltinClassInfo getClassInfo() {
    return classInfo;
  }

  public BuiltinTypeId getTypeId() {
    return classInfo.getTypeId();
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    NamespaceSet members = classInfo.getMember(node, unit, name);
    NamespaceSet result = NamespaceSet.EMPTY;
    for (Namespace member : members) {
      if (member instanceof BuiltinPropertyInfo) {
        result = result.union(((BuiltinPropertyInfo) member).getInstanceValue());
      } else {
        result = result.add(member);
      }
    }
    return members.isAny() ? NamespaceSet.ANY : result;
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
    String next = classInfo.getProjectState().getLanguageVersion().getNextMethodName();
    return getIterator(node, unit).getMember(node, unit, next).call(node, unit, NO_ARGS, NO_NAMES);
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    return classInfo.getAllMembers(moduleContext);
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
