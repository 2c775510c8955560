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
import com.google.python.interpreter.Member;
import com.google.python.interpreter.MemberContainer;
import com.google.python.interpreter.ModuleContext;
import com.google.python.parsing.Node;
import java.util.Map;

/** A namespace backed by an interpreter object whose members are read through the host. */
public abstract class BuiltinNamespace<T extends MemberContainer> extends Namespace {
  protected final T container;
  protected final PythonAnalyzer projectState;

  protected BuiltinNamespace(T container, PythonAnalyzer projectState) {
    this.container = checkNotNull(container);
    this.projectState = checkNotNull(projectState);
  }

  public final T getContainedValue() {
    return container;
  }

  public final PythonAnalyzer getProjectState() {
    return projectState;
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    Member member = container.getMember(unit.getModuleContext(), name);
    if (member == null) {
      return NamespaceSet.EMPTY;
    }
    return projectState.getNamespaceFromObjects(member).getSelfSet();
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    return projectState.getAllMembers(container, moduleContext);
  }
}
