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
package com.google.python.analysis;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.python.analysis.values.ClassInfo;

/** The body of a class. Its names are not visible to the methods defined inside it. */
public final class ClassScope extends InterpreterScope {
  private final ClassInfo classInfo;

  public ClassScope(ClassInfo classInfo, InterpreterScope outerScope) {
    super(checkNotNull(outerScope));
    this.classInfo = checkNotNull(classInfo);
  }

  public ClassInfo getClassInfo() {
    return classInfo;
  }

  @Override
  public ClassInfo getNamespace() {
    return classInfo;
  }

  @Override
  public boolean isVisibleToChildren() {
    return false;
  }
}
