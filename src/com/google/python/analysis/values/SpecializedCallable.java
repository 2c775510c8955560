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

import com.google.common.collect.ImmutableList;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.SourceLocation;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.Map;

/**
 * A callable whose call result comes from a {@link CallDelegate}. When the override is analyzed,
 * the original callable is also called so its body keeps seeing the arguments; its result is used
 * only if the delegate returns null.
 */
public final class SpecializedCallable extends Namespace {
  private final Namespace original;
  private final CallDelegate delegate;
  private final boolean analyze;

  SpecializedCallable(Namespace original, CallDelegate delegate, boolean analyze) {
    this.original = original;
    this.delegate = delegate;
    this.analyze = analyze;
  }

  public Namespace getOriginal() {
    return original;
  }

  CallDelegate getDelegate() {
    return delegate;
  }

  public boolean isAnalyzed() {
    return analyze;
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    NamespaceSet specialized = delegate.call(node, unit, args, argNames);
    if (analyze) {
      NamespaceSet generic = original.call(node, unit, args, argNames);
      return specialized != null ? specialized : generic;
    }
    return specialized != null ? specialized : NamespaceSet.EMPTY;
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    return original.getMember(node, unit, name);
  }

  @Override
  public void setMember(Node node, AnalysisUnit unit, String name, NamespaceSet value) {
    original.setMember(node, unit, name, value);
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    return original.getAllMembers(moduleContext);
  }

  @Override
  public PythonMemberType getMemberType() {
    return original.getMemberType();
  }

  @Override
  public String getName() {
    return original.getName();
  }

  @Override
  public String getDescription() {
    return original.getDescription();
  }

  @Override
  public ImmutableList<SourceLocation> getLocations() {
    return original.getLocations();
  }
}
