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

/** The Python language level the analyzed code targets. */
public enum LanguageVersion {
  V2("__builtin__", "next"),
  V3("builtins", "__next__");

  private final String builtinModuleName;
  private final String nextMethodName;

  LanguageVersion(String builtinModuleName, String nextMethodName) {
    this.builtinModuleName = builtinModuleName;
    this.nextMethodName = nextMethodName;
  }

  public boolean is3x() {
    return this == V3;
  }

  /** The module holding the builtin names. */
  public String getBuiltinModuleName() {
    return builtinModuleName;
  }

  /** The iterator protocol method that produces the next element. */
  public String getNextMethodName() {
    return nextMethodName;
  }
}
