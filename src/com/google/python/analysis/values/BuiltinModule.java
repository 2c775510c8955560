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

import com.google.common.collect.ImmutableMap;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.PythonAnalyzer;
import com.google.python.interpreter.Member;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.interpreter.PythonModule;
import com.google.python.parsing.Node;
import org.jspecify.annotations.Nullable;

/** A module provided by the interpreter. */
public class BuiltinModule extends BuiltinNamespace<PythonModule> implements Module {
  private final SpecializationTable specializations = new SpecializationTable();

  public BuiltinModule(PythonModule module, PythonAnalyzer projectState) {
    super(module, projectState);
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    return specializations.apply(name, super.getMember(node, unit, name));
  }

  @Override
  public @Nullable Module getChildPackage(ModuleContext context, String name) {
    Member member = container.getMember(context, name);
    if (member instanceof PythonModule) {
      Namespace ns = projectState.getNamespaceFromObjects(member);
      return ns instanceof Module ? (Module) ns : null;
    }
    return null;
  }

  @Override
  public ImmutableMap<String, Namespace> getChildrenPackages(ModuleContext context) {
    ImmutableMap.Builder<String, Namespace> result = ImmutableMap.builder();
    for (String name : container.getMemberNames(context)) {
      Member member = container.getMember(context, name);
      if (member instanceof PythonModule) {
        result.put(name, projectState.getNamespaceFromObjects(member));
      }
    }
    return result.buildKeepingLast();
  }

  @Override
  public void specializeFunction(String name, CallDelegate delegate, boolean analyze) {
    specializations.put(name, delegate, analyze);
  }

  @Override
  public NamespaceSet applySpecializations(String name, NamespaceSet values) {
    return specializations.apply(name, values);
  }

  public SpecializationTable getSpecializations() {
    return specializations;
  }

  @Override
  public boolean containsMember(ModuleContext context, String name) {
    return container.getMember(context, name) != null;
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.MODULE;
  }

  @Override
  public String getName() {
    return container.getName();
  }

  @Override
  public String getDescription() {
    return "built-in module " + getName();
  }
}
