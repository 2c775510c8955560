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
import com.google.python.analysis.values.CallDelegate;

/** A registered call override, kept so it can be installed again. */
@AutoValue
abstract class SpecializationInfo {

  static SpecializationInfo create(
      String moduleName, String name, CallDelegate delegate, boolean analyze) {
    return new AutoValue_SpecializationInfo(moduleName, name, delegate, analyze);
  }

  abstract String moduleName();

  abstract String name();

  abstract CallDelegate delegate();

  abstract boolean analyze();
}
