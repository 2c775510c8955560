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
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonConstant;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A literal value, {@code None}, or a constant exported by the interpreter. Member access and
 * iteration behave like the instance of the constant's class.
 */
public class ConstantInfo extends Namespace {
  private final @Nullable Object value;
  private final BuiltinClassInfo type;

  public ConstantInfo(@Nullable Object value, BuiltinClassInfo type) {
    this.value = value;
    this.type = checkNotNull(type);
  }

  public BuiltinClassInfo getClassInfo() {
    return type;
  }

  @Override
  public @Nullable Object getConstantValue() {
    return value instanceof PythonConstant ? null : value;
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    return type.getInstance().getMember(node, unit, name);
  }

  @Override
  public NamespaceSet getIndex(Node node, AnalysisUnit unit, NamespaceSet index) {
    return type.getInstance().getIndex(node, unit, index);
  }

  @Override
  public NamespaceSet getIterator(Node node, AnalysisUnit unit) {
    return type.getInstance().getIterator(node, unit);
  }

  @Override
  public NamespaceSet getEnumeratorTypes(Node node, AnalysisUnit unit) {
    return type.getInstance().getEnumeratorTypes(node, unit);
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    return type.getAllMembers(moduleContext);
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.CONSTANT;
  }

  @Override
  public String getName() {
    return type.getName();
  }

  @Override
  public String getDescription() {
    if (value == null) {
      return "None";
    } else if (value instanceof String) {
      return "'" + value + "'";
    }
    return value instanceof PythonConstant ? type.getName() : String.valueOf(value);
  }
}
