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
import com.google.common.collect.ImmutableSet;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A name bound to several alternative values at once, such as a module member that differs
 * between platforms. Every operation is applied to each alternative and the results unioned.
 *
 * <p>Two aggregates over the same alternatives are equal.
 */
public class MultipleMemberInfo extends Namespace implements Module {
  private final ImmutableList<Namespace> members;
  private final ImmutableSet<Namespace> memberSet;

  public MultipleMemberInfo(Iterable<? extends Namespace> members) {
    this.members = ImmutableList.copyOf(members);
    this.memberSet = ImmutableSet.copyOf(members);
  }

  public ImmutableList<Namespace> getMembers() {
    return members;
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    NamespaceSet result = NamespaceSet.EMPTY;
    for (Namespace member : members) {
      result = result.union(member.getMember(node, unit, name));
    }
    return result;
  }

  @Override
  public void setMember(Node node, AnalysisUnit unit, String name, NamespaceSet value) {
    for (Namespace member : members) {
      member.setMember(node, unit, name, value);
    }
  }

  @Override
  public NamespaceSet call(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    NamespaceSet result = NamespaceSet.EMPTY;
    for (Namespace member : members) {
      result = result.union(member.call(node, unit, args, argNames));
    }
    return result;
  }

  @Override
  public NamespaceSet getIndex(Node node, AnalysisUnit unit, NamespaceSet index) {
    NamespaceSet result = NamespaceSet.EMPTY;
    for (Namespace member : members) {
      result = result.union(member.getIndex(node, unit, index));
    }
    return result;
  }

  @Override
  public NamespaceSet getIterator(Node node, AnalysisUnit unit) {
    NamespaceSet result = NamespaceSet.EMPTY;
    for (Namespace member : members) {
      result = result.union(member.getIterator(node, unit));
    }
    return result;
  }

  @Override
  public NamespaceSet getEnumeratorTypes(Node node, AnalysisUnit unit) {
    NamespaceSet result = NamespaceSet.EMPTY;
    for (Namespace member : members) {
      result = result.union(member.getEnumeratorTypes(node, unit));
    }
    return result;
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    Map<String, NamespaceSet> result = new LinkedHashMap<>();
    for (Namespace member : members) {
      member
          .getAllMembers(moduleContext)
          .forEach((name, values) -> result.merge(name, values, NamespaceSet::union));
    }
    return result;
  }

  @Override
  public @Nullable Module getChildPackage(ModuleContext context, String name) {
    List<Namespace> children = new ArrayList<>();
    for (Namespace member : members) {
      if (member instanceof Module) {
        Module child = ((Module) member).getChildPackage(context, name);
        if (child instanceof Namespace) {
          children.add((Namespace) child);
        }
      }
    }
    if (children.isEmpty()) {
      return null;
    } else if (children.size() == 1 && children.get(0) instanceof Module) {
      return (Module) children.get(0);
    }
    return new MultipleMemberInfo(children);
  }

  @Override
  public ImmutableMap<String, Namespace> getChildrenPackages(ModuleContext context) {
    Map<String, Namespace> result = new LinkedHashMap<>();
    for (Namespace member : members) {
      if (member instanceof Module) {
        result.putAll(((Module) member).getChildrenPackages(context));
      }
    }
    return ImmutableMap.copyOf(result);
  }

  @Override
  public void specializeFunction(String name, CallDelegate delegate, boolean analyze) {
    for (Namespace member : members) {
      if (member instanceof Module) {
        ((Module) member).specializeFunction(name, delegate, analyze);
      }
    }
  }

  /** Overrides are installed on each alternative and applied when reading through it. */
  @Override
  public NamespaceSet applySpecializations(String name, NamespaceSet values) {
    return values;
  }

  @Override
  public boolean containsMember(ModuleContext context, String name) {
    for (Namespace member : members) {
      if (member instanceof Module && ((Module) member).containsMember(context, name)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.MULTIPLE;
  }

  @Override
  public String getName() {
    return members.isEmpty() ? "<unknown>" : members.get(0).getName();
  }

  @Override
  public String getDescription() {
    return "one of " + members.size() + " values";
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof MultipleMemberInfo && memberSet.equals(((MultipleMemberInfo) o).memberSet);
  }

  @Override
  public int hashCode() {
    return memberSet.hashCode();
  }
}
