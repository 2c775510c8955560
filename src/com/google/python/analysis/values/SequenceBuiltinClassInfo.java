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

/**
 * {@code list} and {@code tuple}. Each call site allocates its own {@link SequenceInfo}, which
 * collects the elements of the argument.
 */
public class SequenceBuiltinClassInfo extends BuiltinClassInfo {

  public SequenceBuiltinClassInfo(PythonType type, PythonAnalyzer projectState) {
    super(type, projectState);
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    NamespaceSet result = makeSequence(node, unit);
    if (args.length > 0) {
      NamespaceSet elements = args[0].getEnumeratorTypes(node, unit);
      for (Namespace ns : result) {
        if (ns instanceof SequenceInfo) {
          ((SequenceInfo) ns).addTypes(unit, elements);
        }
      }
    }
    return result;
  }

  /** Returns the sequence allocated at {@code node} in the unit's scope. */
  public NamespaceSet makeSequence(Node node, AnalysisUnit unit) {
    return unit.getScope().getOrMakeNodeValue(node, n -> new SequenceInfo(this, n).getSelfSet());
  }
}
