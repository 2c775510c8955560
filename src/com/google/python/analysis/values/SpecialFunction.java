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
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;

/** A synthetic function whose calls are answered entirely by a {@link CallDelegate}. */
public class SpecialFunction extends Namespace {
  private final String name;
  private final CallDelegate delegate;

  public SpecialFunction(String name, CallDelegate delegate) {
    this.name = checkNotNull(name);
    this.delegate = checkNotNull(delegate);
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    NamespaceSet result = delegate.call(node, unit, args, argNames);
    return result == null ? NamespaceSet.EMPTY : result;
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.FUNCTION;
  }

  @Override
  public String getName() {
    return name;
  }
}
