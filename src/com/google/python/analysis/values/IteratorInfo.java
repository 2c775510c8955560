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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.VariableDef;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import org.jspecify.annotations.Nullable;

/** An iterator over a sequence, yielding the sequence's element types. */
public class IteratorInfo extends Namespace {
  private final VariableDef elementTypes;
  private final BuiltinClassInfo iteratorType;
  private @Nullable SpecialFunction next;
  private @Nullable SpecialFunction iter;

  public IteratorInfo(VariableDef elementTypes, BuiltinClassInfo iteratorType) {
    this.elementTypes = checkNotNull(elementTypes);
    this.iteratorType = checkNotNull(iteratorType);
  }

  /** Adds types the iterator yields; returns true if they grew. */
  @CanIgnoreReturnValue
  public boolean addTypes(AnalysisUnit unit, NamespaceSet types) {
    return elementTypes.addTypes(unit, types, unit.getProjectState().getLimits().getIndexTypes());
  }

  @Override
  public NamespaceSet getEnumeratorTypes(Node node, AnalysisUnit unit) {
    return elementTypes.getTypes(unit);
  }

  @Override
  public NamespaceSet getIterator(Node node, AnalysisUnit unit) {
    return getSelfSet();
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    if (name.equals(unit.getProjectState().getLanguageVersion().getNextMethodName())) {
      if (next == null) {
        next = new SpecialFunction(name, (n, u, args, argNames) -> elementTypes.getTypes(u));
      }
      return next.getSelfSet();
    } else if (name.equals("__iter__")) {
      if (iter == null) {
        iter = new SpecialFunction(name, (n, u, args, argNames) -> getSelfSet());
      }
      return iter.getSelfSet();
    }
    return iteratorType.getInstance().getMember(node, unit, name);
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.INSTANCE;
  }

  @Override
  public String getName() {
    return iteratorType.getName();
  }
}
