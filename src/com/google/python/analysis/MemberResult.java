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

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.python.analysis.values.Namespace;
import com.google.python.interpreter.PythonMemberType;

/**
 * A named completion result. The values behind the name are computed the first time they are
 * asked for.
 */
public final class MemberResult {
  private final String name;
  private final Supplier<ImmutableList<Namespace>> values;
  private final Supplier<PythonMemberType> memberType;

  MemberResult(String name, Iterable<? extends Namespace> values) {
    this(name, Suppliers.ofInstance(ImmutableList.copyOf(values)));
  }

  MemberResult(String name, Supplier<ImmutableList<Namespace>> values) {
    this.name = checkNotNull(name);
    this.values = Suppliers.memoize(values);
    this.memberType = Suppliers.memoize(() -> commonMemberType(this.values.get()));
  }

  public String getName() {
    return name;
  }

  /** The text to insert when the result is chosen. */
  public String getCompletion() {
    return name;
  }

  public ImmutableList<Namespace> getNamespaces() {
    return values.get();
  }

  /** The kind shared by every value, {@code MULTIPLE} if they differ, {@code UNKNOWN} if none. */
  public PythonMemberType getMemberType() {
    return memberType.get();
  }

  static PythonMemberType commonMemberType(Iterable<Namespace> namespaces) {
    PythonMemberType result = null;
    for (Namespace ns : namespaces) {
      PythonMemberType type = ns.getMemberType();
      if (result == null) {
        result = type;
      } else if (result != type) {
        return PythonMemberType.MULTIPLE;
      }
    }
    return result == null ? PythonMemberType.UNKNOWN : result;
  }

  @Override
  public String toString() {
    return "MemberResult(" + name + ")";
  }
}
