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
import com.google.python.analysis.PythonAnalyzer;
import com.google.python.interpreter.BuiltinProperty;
import com.google.python.interpreter.PythonMemberType;

/** A property of a builtin class. Reading it through an instance yields its type's instance. */
public class BuiltinPropertyInfo extends Namespace {
  private final BuiltinProperty property;
  private final PythonAnalyzer projectState;

  public BuiltinPropertyInfo(BuiltinProperty property, PythonAnalyzer projectState) {
    this.property = checkNotNull(property);
    this.projectState = checkNotNull(projectState);
  }

  public NamespaceSet getInstanceValue() {
    return projectState.getInstances(ImmutableList.of(property.getType()));
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.PROPERTY;
  }

  @Override
  public String getName() {
    return property.getType().getName();
  }

  @Override
  public String getDescription() {
    return "property of type " + getName();
  }
}
