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

import com.google.python.analysis.values.Namespace;
import com.google.python.parsing.Node;
import org.jspecify.annotations.Nullable;

/** A call override that sees the call node and its arguments. */
@FunctionalInterface
public interface CallInfoDelegate {

  /** Returns the values the call produces, or null to use the function's own result. */
  @Nullable Iterable<? extends Namespace> call(Node callNode, CallInfo callInfo);
}
