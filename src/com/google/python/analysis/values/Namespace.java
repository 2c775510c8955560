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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.SourceLocation;
import com.google.python.interpreter.AsciiString;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * One possible runtime value of an expression: a class, an instance, a function, a module, a
 * constant, or an aggregate of those.
 *
 * <p>Namespaces compare by identity. Every namespace is created once for the thing it models
 * (a host object, a definition node, an allocation site) and reused after that, so a {@link
 * NamespaceSet} of namespaces only grows when new things are discovered.
 *
 * <p>The abstract operations ({@link #getMember}, {@link #call}, ...) default to "nothing is
 * known", which is also what an unsupported operation on the runtime value would produce for the
 * analysis.
 */
public abstract class Namespace {
  /** Argument list of a call without arguments. */
  public static final NamespaceSet[] NO_ARGS = new NamespaceSet[0];

  /** Keyword names of a call without keyword arguments. */
  public static final String[] NO_NAMES = new String[0];

  private @Nullable NamespaceSet selfSet;

  /** Returns the singleton set containing this namespace. */
  public final NamespaceSet getSelfSet() {
    NamespaceSet result = selfSet;
    if (result == null) {
      result = selfSet = NamespaceSet.of(this);
    }
    return result;
  }

  /** Values of the attribute {@code name} read at {@code node}. */
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    return NamespaceSet.EMPTY;
  }

  /** Records an assignment of {@code value} to the attribute {@code name}. */
  public void setMember(Node node, AnalysisUnit unit, String name, NamespaceSet value) {}

  /**
   * Values produced by calling this namespace.
   *
   * @param args positional argument values followed by keyword argument values
   * @param argNames names of the trailing keyword arguments, in order
   */
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return NamespaceSet.EMPTY;
  }

  /** Values produced by subscripting this namespace with {@code index}. */
  public NamespaceSet getIndex(Node node, AnalysisUnit unit, NamespaceSet index) {
    return NamespaceSet.EMPTY;
  }

  /** Iterator objects produced by {@code iter(value)}. */
  public NamespaceSet getIterator(Node node, AnalysisUnit unit) {
    return NamespaceSet.EMPTY;
  }

  /** Values produced by iterating over this namespace in a {@code for} loop. */
  public NamespaceSet getEnumeratorTypes(Node node, AnalysisUnit unit) {
    return NamespaceSet.EMPTY;
  }

  /** Returns every member this namespace is known to have, without recording dependencies. */
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    return ImmutableMap.of();
  }

  /** The value of a constant, or null if this is not a constant (or is {@code None}). */
  public @Nullable Object getConstantValue() {
    return null;
  }

  /** The value of a string or byte string constant, or null. */
  public final @Nullable String getConstantValueAsString() {
    Object value = getConstantValue();
    if (value instanceof String) {
      return (String) value;
    } else if (value instanceof AsciiString) {
      return ((AsciiString) value).getString();
    }
    return null;
  }

  public abstract PythonMemberType getMemberType();

  public abstract String getName();

  public String getDescription() {
    return getName();
  }

  /** Locations where this namespace is defined, for go-to-definition. */
  public ImmutableList<SourceLocation> getLocations() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + getDescription() + ")";
  }
}
