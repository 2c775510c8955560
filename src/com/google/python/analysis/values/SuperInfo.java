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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.python.analysis.AnalysisUnit;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;

/** The result of {@code super()}: member lookups skip the class itself and start at its bases. */
public class SuperInfo extends Namespace {
  private final ClassInfo classInfo;
  private final NamespaceSet instances;

  public SuperInfo(ClassInfo classInfo, NamespaceSet instances) {
    this.classInfo = checkNotNull(classInfo);
    this.instances = checkNotNull(instances);
  }

  public ClassInfo getClassInfo() {
    return classInfo;
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    NamespaceSet result = NamespaceSet.EMPTY;
    for (NamespaceSet base : classInfo.getBases()) {
      for (Namespace member : base.getMember(node, unit, name)) {
        if (!BoundMethodInfo.isBindable(member) || instances.isEmpty()) {
          result = result.add(member);
          continue;
        }
        for (Namespace instance : instances) {
          Namespace bound =
              instance instanceof InstanceInfo ? ((InstanceInfo) instance).bind(member) : member;
          result = result.add(bound);
        }
      }
    }
    return result;
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.INSTANCE;
  }

  @Override
  public String getName() {
    return "super";
  }

  @Override
  public String getDescription() {
    return "super(" + classInfo.getName() + ")";
  }
}
