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

import com.google.common.base.Splitter;
import com.google.python.analysis.values.Module;
import com.google.python.analysis.values.MultipleMemberInfo;
import com.google.python.analysis.values.Namespace;
import com.google.python.interpreter.Member;
import com.google.python.interpreter.PythonInterpreter;
import com.google.python.interpreter.PythonModule;
import com.google.python.interpreter.PythonMultipleMembers;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Resolves dotted module names, walking from the top-level module through its members.
 *
 * <p>A member bound to several alternatives resolves through each of them; the alternatives that
 * resolve are combined into one {@link MultipleMemberInfo}.
 */
final class ImportResolver {
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final PythonAnalyzer projectState;
  private final PythonInterpreter interpreter;

  ImportResolver(PythonAnalyzer projectState, PythonInterpreter interpreter) {
    this.projectState = checkNotNull(projectState);
    this.interpreter = checkNotNull(interpreter);
  }

  /**
   * Imports {@code modName} from the interpreter. With {@code bottom}, returns the module named by
   * the whole path; otherwise returns the top-level module once the whole path resolves. Relative
   * names (with a leading dot) are not resolved here.
   */
  @Nullable Module importBuiltinModule(String modName, boolean bottom) {
    List<String> names = DOT_SPLITTER.splitToList(modName);
    if (names.get(0).isEmpty()) {
      return null;
    }
    PythonModule top = interpreter.importModule(names.get(0));
    if (top == null) {
      return null;
    }
    Namespace topNamespace = projectState.getNamespaceFromObjects(top);
    Module topModule = topNamespace instanceof Module ? (Module) topNamespace : null;
    if (names.size() == 1 || topModule == null) {
      return topModule;
    }
    Module bottomModule = importFromPythonModule(top, names, 1);
    if (bottomModule == null) {
      return null;
    }
    return bottom ? bottomModule : topModule;
  }

  /** Resolves {@code names[index..]} starting from the interpreter object {@code member}. */
  @Nullable Module importFromMember(@Nullable Member member, List<String> names, int index) {
    if (member == null) {
      return null;
    }
    if (index >= names.size()) {
      Namespace ns = projectState.getNamespaceFromObjects(member);
      return ns instanceof Module ? (Module) ns : null;
    }
    if (member instanceof PythonModule) {
      return importFromPythonModule((PythonModule) member, names, index);
    } else if (member instanceof PythonMultipleMembers) {
      return importFromMultipleMembers((PythonMultipleMembers) member, names, index);
    }
    return null;
  }

  private @Nullable Module importFromPythonModule(
      PythonModule module, List<String> names, int index) {
    Member member = module.getMember(projectState.getDefaultContext(), names.get(index));
    return importFromMember(member, names, index + 1);
  }

  private @Nullable Module importFromMultipleMembers(
      PythonMultipleMembers members, List<String> names, int index) {
    List<Namespace> resolved = new ArrayList<>();
    for (Member alternative : members.getMembers()) {
      Module module = importFromMember(alternative, names, index);
      if (module instanceof Namespace) {
        resolved.add((Namespace) module);
      }
    }
    if (resolved.isEmpty()) {
      return null;
    } else if (resolved.size() == 1) {
      return (Module) resolved.get(0);
    }
    return new MultipleMemberInfo(resolved);
  }

  /** Walks the submodules of an already resolved module. */
  @Nullable Module importFromModule(Module module, List<String> names, int index) {
    Module current = module;
    for (int i = index; i < names.size() && current != null; i++) {
      current = current.getChildPackage(projectState.getDefaultContext(), names.get(i));
    }
    return current;
  }

  /**
   * Resolves an absolute module name against the registry, falling back to walking submodules
   * from the top-level module.
   */
  @Nullable Namespace resolveModule(String name) {
    List<String> names = DOT_SPLITTER.splitToList(name);
    if (names.get(0).isEmpty()) {
      return null;
    }
    Namespace direct = projectState.getModules().getModule(name);
    if (direct != null || names.size() == 1) {
      return direct;
    }
    Namespace top = projectState.getModules().getModule(names.get(0));
    if (top instanceof Module) {
      Module module = importFromModule((Module) top, names, 1);
      if (module instanceof Namespace) {
        return (Namespace) module;
      }
    }
    return null;
  }
}
