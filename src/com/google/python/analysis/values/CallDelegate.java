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

import com.google.python.analysis.AnalysisUnit;
import com.google.python.parsing.Node;
import org.jspecify.annotations.Nullable;

/** A hand-written replacement for the inferred call behavior of a function. */
@FunctionalInterface
public interface CallDelegate {

  /**
   * Returns the values the call produces, or null to fall back to the function's generic
   * behavior (or to nothing, if the function is not analyzed).
   */
  @Nullable NamespaceSet call(
      Node callNode, AnalysisUnit unit, NamespaceSet[] args, String[] argNames);
}
