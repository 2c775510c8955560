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
import com.google.python.analysis.PythonAnalyzer;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.interpreter.PythonType;
import com.google.python.parsing.Node;
import org.jspecify.annotations.Nullable;

/** A class provided by the interpreter. Calling it produces its single shared instance. */
public class BuiltinClassInfo extends BuiltinNamespace<PythonType> {
  private @Nullable BuiltinInstanceInfo instance;

  public BuiltinClassInfo(PythonType type, PythonAnalyzer projectState) {
    super(type, projectState);
  }

  public PythonType getPythonType() {
    return container;
  }

  public BuiltinTypeId getTypeId() {
    return container.getTypeId();
  }

  public BuiltinInstanceInfo getInstance() {
    if (instance == null) {
      instance = new BuiltinInstanceInfo(this);
    }
    return instance;
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return getInstance().getSelfSet();
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    return projectState.applySpecializations(
        container.getDeclaringModuleName(),
        getName() + "." + name,
        super.getMember(node, unit, name));
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.CLASS;
  }

  @Override
  public String getName() {
    return container.getName();
  }

  @Override
  public String getDescription() {
    return "type " + getName();
  }
}
