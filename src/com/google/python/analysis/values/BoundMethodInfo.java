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

import com.google.common.collect.ImmutableList;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.SourceLocation;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;

/** A project function read through an instance; calls pass the instance as the first argument. */
public class BoundMethodInfo extends Namespace {
  private final Namespace function;
  private final Namespace instance;

  BoundMethodInfo(Namespace function, Namespace instance) {
    this.function = checkNotNull(function);
    this.instance = checkNotNull(instance);
  }

  /** True for functions that are bound when read through an instance. */
  static boolean isBindable(Namespace ns) {
    return ns instanceof FunctionInfo
        || (ns instanceof SpecializedCallable
            && ((SpecializedCallable) ns).getOriginal() instanceof FunctionInfo);
  }

  public Namespace getFunction() {
    return function;
  }

  public Namespace getInstance() {
    return instance;
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    NamespaceSet[] withSelf = new NamespaceSet[args.length + 1];
    withSelf[0] = instance.getSelfSet();
    System.arraycopy(args, 0, withSelf, 1, args.length);
    return function.call(node, unit, withSelf, argNames);
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    return function.getMember(node, unit, name);
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.METHOD;
  }

  @Override
  public String getName() {
    return function.getName();
  }

  @Override
  public String getDescription() {
    return "bound method " + function.getDescription();
  }

  @Override
  public ImmutableList<SourceLocation> getLocations() {
    return function.getLocations();
  }
}
