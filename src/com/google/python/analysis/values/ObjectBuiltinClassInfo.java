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
import com.google.python.interpreter.PythonType;
import com.google.python.parsing.Node;

/** {@code object}, whose {@code __new__} returns an instance of the class passed to it. */
public class ObjectBuiltinClassInfo extends BuiltinClassInfo {
  private final SpecialFunction newFunction;

  public ObjectBuiltinClassInfo(PythonType type, PythonAnalyzer projectState) {
    super(type, projectState);
    this.newFunction = new SpecialFunction("__new__", ObjectBuiltinClassInfo::objectNew);
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    if (name.equals("__new__")) {
      return newFunction.getSelfSet();
    }
    return super.getMember(node, unit, name);
  }

  private static NamespaceSet objectNew(
      Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    if (args.length == 0) {
      return NamespaceSet.EMPTY;
    }
    NamespaceSet result = NamespaceSet.EMPTY;
    for (Namespace type : args[0]) {
      if (type instanceof ClassInfo) {
        result = result.add(((ClassInfo) type).getInstance());
      } else if (type instanceof BuiltinClassInfo) {
        result = result.add(((BuiltinClassInfo) type).getInstance());
      }
    }
    return result;
  }
}
