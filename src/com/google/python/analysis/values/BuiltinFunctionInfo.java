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
import com.google.python.interpreter.PythonFunction;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;

/** A function provided by the interpreter; calls return instances of its declared return types. */
public class BuiltinFunctionInfo extends Namespace {
  private final PythonFunction function;
  private final PythonAnalyzer projectState;

  public BuiltinFunctionInfo(PythonFunction function, PythonAnalyzer projectState) {
    this.function = checkNotNull(function);
    this.projectState = checkNotNull(projectState);
  }

  public PythonFunction getFunction() {
    return function;
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return projectState.getInstances(function.getReturnTypes());
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.FUNCTION;
  }

  @Override
  public String getName() {
    return function.getName();
  }

  @Override
  public String getDescription() {
    return "built-in function " + getName();
  }
}
