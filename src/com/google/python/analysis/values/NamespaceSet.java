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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.parsing.Node;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * An immutable set of {@link Namespace}s: every value an expression or variable is known to have
 * had so far.
 *
 * <p>Union is idempotent, commutative and associative. A union may be given a limit; when the
 * result would have more than {@code limit} members, the union is {@link #ANY} instead. {@code ANY}
 * absorbs every further union, so a capped set stays capped.
 */
public final class NamespaceSet implements Iterable<Namespace> {
  /** Passed as a limit to mean no cap applies. */
  public static final int UNLIMITED = -1;

  public static final NamespaceSet EMPTY = new NamespaceSet(ImmutableSet.of(), false);

  /** The set of every value. Operations on it produce {@code ANY} again. */
  public static final NamespaceSet ANY = new NamespaceSet(ImmutableSet.of(), true);

  private final ImmutableSet<Namespace> members;
  private final boolean any;

  private NamespaceSet(ImmutableSet<Namespace> members, boolean any) {
    this.members = members;
    this.any = any;
  }

  public static NamespaceSet of(Namespace ns) {
    return new NamespaceSet(ImmutableSet.of(ns), false);
  }

  public static NamespaceSet of(Namespace... namespaces) {
    return copyOf(Arrays.asList(namespaces));
  }

  public static NamespaceSet copyOf(Iterable<? extends Namespace> namespaces) {
    ImmutableSet<Namespace> members = ImmutableSet.copyOf(namespaces);
    return members.isEmpty() ? EMPTY : new NamespaceSet(members, false);
  }

  public static NamespaceSet unionAll(Iterable<NamespaceSet> sets) {
    return unionAll(sets, UNLIMITED);
  }

  /** Unions the given sets, giving up with {@link #ANY} as soon as {@code limit} is passed. */
  public static NamespaceSet unionAll(Iterable<NamespaceSet> sets, int limit) {
    Set<Namespace> result = new LinkedHashSet<>();
    for (NamespaceSet set : sets) {
      if (set.any) {
        return ANY;
      }
      result.addAll(set.members);
      if (exceeds(result.size(), limit)) {
        return ANY;
      }
    }
    return copyOf(result);
  }

  public NamespaceSet union(NamespaceSet other) {
    return union(other, UNLIMITED);
  }

  public NamespaceSet union(NamespaceSet other, int limit) {
    if (any || other.any) {
      return ANY;
    }
    if (other.members.isEmpty() || members.containsAll(other.members)) {
      return exceeds(members.size(), limit) ? ANY : this;
    }
    if (members.isEmpty() || other.members.containsAll(members)) {
      return exceeds(other.members.size(), limit) ? ANY : other;
    }
    ImmutableSet<Namespace> merged =
        ImmutableSet.<Namespace>builder().addAll(members).addAll(other.members).build();
    return exceeds(merged.size(), limit) ? ANY : new NamespaceSet(merged, false);
  }

  public NamespaceSet add(Namespace ns) {
    return union(ns.getSelfSet());
  }

  private static boolean exceeds(int size, int limit) {
    return limit >= 0 && size > limit;
  }

  /** True for {@link #ANY}. */
  public boolean isAny() {
    return any;
  }

  /** True if no value is known. {@link #ANY} is not empty. */
  public boolean isEmpty() {
    return !any && members.isEmpty();
  }

  /** The number of distinct namespaces; 0 for {@link #ANY}. */
  public int size() {
    return members.size();
  }

  public boolean contains(Namespace ns) {
    return members.contains(ns);
  }

  public ImmutableSet<Namespace> asSet() {
    return members;
  }

  @Override
  public Iterator<Namespace> iterator() {
    return Iterators.unmodifiableIterator(members.iterator());
  }

  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    return flatMap(ns -> ns.getMember(node, unit, name));
  }

  public void setMember(Node node, AnalysisUnit unit, String name, NamespaceSet value) {
    for (Namespace ns : members) {
      ns.setMember(node, unit, name, value);
    }
  }

  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return flatMap(ns -> ns.call(node, unit, args, argNames));
  }

  public NamespaceSet getIndex(Node node, AnalysisUnit unit, NamespaceSet index) {
    return flatMap(ns -> ns.getIndex(node, unit, index));
  }

  public NamespaceSet getIterator(Node node, AnalysisUnit unit) {
    return flatMap(ns -> ns.getIterator(node, unit));
  }

  public NamespaceSet getEnumeratorTypes(Node node, AnalysisUnit unit) {
    return flatMap(ns -> ns.getEnumeratorTypes(node, unit));
  }

  private NamespaceSet flatMap(Function<Namespace, NamespaceSet> operation) {
    if (any) {
      return ANY;
    }
    NamespaceSet result = EMPTY;
    for (Namespace ns : members) {
      result = result.union(operation.apply(ns));
    }
    return result;
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof NamespaceSet)) {
      return false;
    }
    NamespaceSet that = (NamespaceSet) o;
    return any == that.any && members.equals(that.members);
  }

  @Override
  public int hashCode() {
    return any ? -1 : members.hashCode();
  }

  @Override
  public String toString() {
    return any ? "{*}" : "{" + Joiner.on(", ").join(members) + "}";
  }
}
