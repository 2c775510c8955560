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
import com.google.common.collect.ImmutableList;
import com.google.python.analysis.values.NamespaceSet;

/** The argument values of one call, as seen by a {@link CallInfoDelegate}. */
@AutoValue
public abstract class CallInfo {

  static CallInfo create(NamespaceSet[] args, String[] argNames) {
    return new AutoValue_CallInfo(ImmutableList.copyOf(args), ImmutableList.copyOf(argNames));
  }

  /** Positional argument values followed by keyword argument values. */
  public abstract ImmutableList<NamespaceSet> args();

  /** Names of the trailing keyword arguments. */
  public abstract ImmutableList<String> argNames();

  /** The number of positional arguments. */
  public final int positionalCount() {
    return args().size() - argNames().size();
  }
}
