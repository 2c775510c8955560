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

import com.google.python.analysis.PythonAnalyzer;
import com.google.python.interpreter.MemberContainer;
import com.google.python.interpreter.PythonMemberType;

/** An interpreter object that only exposes members. */
public class ReflectedNamespace extends BuiltinNamespace<MemberContainer> {

  public ReflectedNamespace(MemberContainer container, PythonAnalyzer projectState) {
    super(container, projectState);
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.NAMESPACE;
  }

  @Override
  public String getName() {
    return "namespace";
  }
}
