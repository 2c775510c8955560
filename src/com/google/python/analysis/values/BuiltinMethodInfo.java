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

import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.PythonAnalyzer;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.interpreter.PythonMethodDescriptor;
import com.google.python.parsing.Node;

/** A method of a builtin class. */
public class BuiltinMethodInfo extends Namespace {
  private final PythonMethodDescriptor method;
  private final PythonAnalyzer projectState;

  public BuiltinMethodInfo(PythonMethodDescriptor method, PythonAnalyzer projectState) {
    this.method = checkNotNull(method);
    this.projectState = checkNotNull(projectState);
  }

  public PythonMethodDescriptor getMethodDescriptor() {
    return method;
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return projectState.getInstances(method.getFunction().getReturnTypes());
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.METHOD;
  }

  @Override
  public String getName() {
    return method.getFunction().getName();
  }

  @Override
  public String getDescription() {
    return "method " + getName();
  }
}
