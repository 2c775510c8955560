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

import com.google.auto.value.AutoValue;

/** A fully qualified name that may be imported, and whether it certainly exists. */
@AutoValue
public abstract class ExportedMemberInfo {

  public static ExportedMemberInfo create(String name, boolean isDefinitelyExported) {
    return new AutoValue_ExportedMemberInfo(name, isDefinitelyExported);
  }

  public abstract String name();

  /** False for guesses: the module exists but is not known to define the member. */
  public abstract boolean isDefinitelyExported();
}
