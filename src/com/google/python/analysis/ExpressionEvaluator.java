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

import com.google.python.analysis.values.Namespace;
import com.google.python.analysis.values.NamespaceSet;
import com.google.python.analysis.values.SequenceInfo;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.parsing.Node;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Evaluates expressions of one unit to the set of values they may produce. */
final class ExpressionEvaluator {
  private final AnalysisUnit unit;

  ExpressionEvaluator(AnalysisUnit unit) {
    this.unit = checkNotNull(unit);
  }

  NamespaceSet evaluate(@Nullable Node node) {
    if (node == null) {
      return NamespaceSet.EMPTY;
    }
    switch (node.getToken()) {
      case NAME:
        return node.hasString() ? lookupName(node) : NamespaceSet.EMPTY;
      case CONST:
        return unit.getProjectState().getConstant(node.getConstantValue());
      case GETATTR:
        if (!node.hasString() || !node.hasChildren()) {
          return NamespaceSet.EMPTY;
        }
        return evaluate(node.getFirstChild()).getMember(node, unit, node.getString());
      case GETITEM:
        return evaluate(node.getFirstChild())
            .getIndex(node, unit, evaluate(node.getSecondChild()));
      case CALL:
        return evaluateCall(node);
      case LIST:
        return evaluateSequence(node, BuiltinTypeId.LIST);
      case TUPLE:
        return evaluateSequence(node, BuiltinTypeId.TUPLE);
      default:
        return NamespaceSet.EMPTY;
    }
  }

  /**
   * Looks a name up in the enclosing scopes, skipping class bodies other than the current one, then
   * in the builtins. A name found nowhere gets an empty module level variable so that this unit is
   * analyzed again once something assigns it.
   */
  NamespaceSet lookupName(Node node) {
    String name = node.getString();
    InterpreterScope current = unit.getScope();
    for (InterpreterScope scope : current.enumerateTowardsGlobal()) {
      if (scope != current && !scope.isVisibleToChildren()) {
        continue;
      }
      VariableDef def = scope.getVariable(name);
      if (def == null) {
        continue;
      }
      // Read even when empty so that this unit runs again once the variable gets values.
      NamespaceSet types = def.getTypes(unit);
      if (!def.isEmpty()) {
        def.addReference(SourceLocation.of(unit, node));
        return types;
      }
    }
    NamespaceSet builtin = unit.getProjectState().getBuiltinModule().getMember(node, unit, name);
    if (!builtin.isEmpty()) {
      return builtin;
    }
    if (unit.isForEval()) {
      return NamespaceSet.EMPTY;
    }
    VariableDef placeholder = current.getGlobalScope().createVariable(name);
    placeholder.addReference(SourceLocation.of(unit, node));
    return placeholder.getTypes(unit);
  }

  private NamespaceSet evaluateCall(Node call) {
    NamespaceSet callee = evaluate(call.getFirstChild());
    List<NamespaceSet> positional = new ArrayList<>();
    List<NamespaceSet> keywordValues = new ArrayList<>();
    List<String> keywordNames = new ArrayList<>();
    for (int i = 1; i < call.getChildCount(); i++) {
      Node arg = call.getChildAtIndex(i);
      if (arg.isKeyword()) {
        if (!arg.hasString()) {
          continue;
        }
        keywordNames.add(arg.getString());
        keywordValues.add(evaluate(arg.getFirstChild()));
      } else {
        positional.add(evaluate(arg));
      }
    }
    positional.addAll(keywordValues);
    return callee.call(
        call,
        unit,
        positional.toArray(new NamespaceSet[0]),
        keywordNames.toArray(new String[0]));
  }

  private NamespaceSet evaluateSequence(Node node, BuiltinTypeId typeId) {
    PythonAnalyzer state = unit.getProjectState();
    NamespaceSet result =
        unit.getScope()
            .getOrMakeNodeValue(
                node, n -> new SequenceInfo(state.getClassInfo(typeId), n).getSelfSet());
    NamespaceSet elements = NamespaceSet.EMPTY;
    for (Node child : node.children()) {
      elements = elements.union(evaluate(child));
    }
    for (Namespace ns : result) {
      if (ns instanceof SequenceInfo) {
        ((SequenceInfo) ns).addTypes(unit, elements);
      }
    }
    return result;
  }
}
