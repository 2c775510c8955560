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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.python.analysis.values.ClassInfo;
import com.google.python.analysis.values.FunctionInfo;
import com.google.python.analysis.values.Namespace;
import com.google.python.analysis.values.NamespaceSet;
import com.google.python.parsing.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Walks the statements of one unit, binding names and queuing the bodies of the functions and
 * classes it defines. Statements the analysis does not model, and broken parts of a tree, are
 * skipped.
 */
final class StatementEvaluator {
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private final AnalysisUnit unit;
  private final ExpressionEvaluator evaluator;

  StatementEvaluator(AnalysisUnit unit) {
    this.unit = checkNotNull(unit);
    this.evaluator = new ExpressionEvaluator(unit);
  }

  void walk(Iterable<Node> statements) {
    for (Node statement : statements) {
      visit(statement);
    }
  }

  void visit(Node n) {
    switch (n.getToken()) {
      case EXPR_RESULT:
        evaluator.evaluate(n.getFirstChild());
        break;
      case ASSIGN:
        visitAssign(n);
        break;
      case RETURN:
        visitReturn(n);
        break;
      case FUNCTION:
        visitFunction(n);
        break;
      case CLASS:
        visitClass(n);
        break;
      case IF:
        evaluator.evaluate(n.getFirstChild());
        for (int i = 1; i < n.getChildCount(); i++) {
          walk(n.getChildAtIndex(i).children());
        }
        break;
      case FOR:
        visitFor(n);
        break;
      case IMPORT:
        for (Node importName : n.children()) {
          visitImport(importName);
        }
        break;
      case IMPORT_FROM:
        visitImportFrom(n);
        break;
      case SUITE:
        walk(n.children());
        break;
      default:
        break;
    }
  }

  private void visitAssign(Node n) {
    Node target = n.getFirstChild();
    Node value = n.getSecondChild();
    if (target == null || value == null) {
      return;
    }
    assign(target, evaluator.evaluate(value));
  }

  private void assign(Node target, NamespaceSet values) {
    switch (target.getToken()) {
      case NAME:
        if (target.hasString()) {
          unit.getScope().assignVariable(target.getString(), target, unit, values);
        }
        break;
      case GETATTR:
        if (!target.hasString() || !target.hasChildren()) {
          break;
        }
        evaluator
            .evaluate(target.getFirstChild())
            .setMember(target, unit, target.getString(), values);
        break;
      case TUPLE:
        NamespaceSet elements = values.getEnumeratorTypes(target, unit);
        for (Node child : target.children()) {
          assign(child, elements);
        }
        break;
      default:
        break;
    }
  }

  private void visitReturn(Node n) {
    InterpreterScope scope = unit.getScope();
    if (!(scope instanceof FunctionScope)) {
      return;
    }
    NamespaceSet values =
        n.hasChildren()
            ? evaluator.evaluate(n.getFirstChild())
            : unit.getProjectState().getNoneInstance().getSelfSet();
    ((FunctionScope) scope)
        .getReturnValue()
        .addTypes(unit, values, unit.getProjectState().getLimits().getReturnTypes());
  }

  private void visitFunction(Node n) {
    if (!n.hasString() || n.getChildCount() < 2) {
      return;
    }
    InterpreterScope scope = unit.getScope();
    PythonAnalyzer state = unit.getProjectState();
    NamespaceSet function =
        scope.getOrMakeNodeValue(
            n,
            def -> {
              FunctionInfo info = new FunctionInfo(def, scope, unit.getProjectEntry());
              state.enqueue(info.getAnalysisUnit());
              return info.getSelfSet();
            });
    scope.assignVariable(n.getString(), n, unit, function);
  }

  private void visitClass(Node n) {
    if (!n.hasString()) {
      return;
    }
    InterpreterScope scope = unit.getScope();
    PythonAnalyzer state = unit.getProjectState();
    NamespaceSet classes =
        scope.getOrMakeNodeValue(
            n,
            def -> {
              ClassInfo info = new ClassInfo(def, scope, unit.getProjectEntry());
              state.enqueueFirst(info.getAnalysisUnit());
              return info.getSelfSet();
            });
    Node bases = n.getFirstChild();
    if (bases != null) {
      for (int i = 0; i < bases.getChildCount(); i++) {
        NamespaceSet baseValues = evaluator.evaluate(bases.getChildAtIndex(i));
        for (Namespace ns : classes) {
          if (ns instanceof ClassInfo) {
            ((ClassInfo) ns).addBase(unit, i, baseValues);
          }
        }
      }
    }
    scope.assignVariable(n.getString(), n, unit, classes);
  }

  private void visitFor(Node n) {
    Node target = n.getFirstChild();
    Node iterable = n.getSecondChild();
    if (target == null || iterable == null) {
      return;
    }
    assign(target, evaluator.evaluate(iterable).getEnumeratorTypes(n, unit));
    if (n.getChildCount() > 2) {
      walk(n.getChildAtIndex(2).children());
    }
  }

  /** {@code import a.b.c} binds {@code a}; {@code import a.b.c as d} binds the submodule. */
  private void visitImport(Node importName) {
    if (!importName.hasString()) {
      return;
    }
    PythonAnalyzer state = unit.getProjectState();
    String dotted = importName.getString();
    Node alias = importName.getFirstChild();
    state.addImportReference(dotted, unit);
    Namespace module = state.resolveModule(dotted);
    if (alias != null) {
      if (module != null && alias.hasString()) {
        unit.getScope().assignVariable(alias.getString(), alias, unit, module.getSelfSet());
      }
      return;
    }
    String top = DOT_SPLITTER.splitToList(dotted).get(0);
    if (!top.equals(dotted)) {
      state.addImportReference(top, unit);
      module = state.resolveModule(top);
    }
    if (module != null) {
      unit.getScope().assignVariable(top, importName, unit, module.getSelfSet());
    }
  }

  private void visitImportFrom(Node n) {
    if (!n.hasString()) {
      return;
    }
    String moduleName = toAbsoluteName(n.getString());
    if (moduleName == null) {
      return;
    }
    PythonAnalyzer state = unit.getProjectState();
    state.addImportReference(moduleName, unit);
    Namespace module = state.resolveModule(moduleName);
    for (Node importName : n.children()) {
      if (!importName.hasString()) {
        continue;
      }
      String member = importName.getString();
      if (member.equals("*")) {
        if (module != null) {
          for (Map.Entry<String, NamespaceSet> entry :
              module.getAllMembers(unit.getModuleContext()).entrySet()) {
            unit.getScope().assignVariable(entry.getKey(), importName, unit, entry.getValue());
          }
        }
        continue;
      }
      NamespaceSet values =
          module == null ? NamespaceSet.EMPTY : module.getMember(importName, unit, member);
      if (values.isEmpty()) {
        String submoduleName = moduleName + "." + member;
        state.addImportReference(submoduleName, unit);
        Namespace submodule = state.resolveModule(submoduleName);
        if (submodule != null) {
          values = submodule.getSelfSet();
        }
      }
      Node alias = importName.getFirstChild();
      String boundName = alias != null && alias.hasString() ? alias.getString() : member;
      if (!values.isEmpty()) {
        unit.getScope().assignVariable(boundName, importName, unit, values);
      }
    }
  }

  /** Resolves a relative module name against the importing module; null if it cannot be. */
  private @Nullable String toAbsoluteName(String name) {
    int dots = 0;
    while (dots < name.length() && name.charAt(dots) == '.') {
      dots++;
    }
    if (dots == 0) {
      return name;
    }
    ModuleEntry entry = unit.getProjectEntry();
    String current = entry.getModuleName();
    if (current == null || current.isEmpty()) {
      return null;
    }
    List<String> parts = new ArrayList<>(DOT_SPLITTER.splitToList(current));
    String path = entry.getFilePath();
    boolean isPackage = path != null && path.endsWith("__init__.py");
    int drop = isPackage ? dots - 1 : dots;
    if (drop > parts.size()) {
      return null;
    }
    List<String> base = new ArrayList<>(parts.subList(0, parts.size() - drop));
    String rest = name.substring(dots);
    if (!rest.isEmpty()) {
      base.add(rest);
    }
    return base.isEmpty() ? null : Joiner.on('.').join(base);
  }
}
