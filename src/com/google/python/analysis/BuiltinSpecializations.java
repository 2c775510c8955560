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

import com.google.python.analysis.values.ClassInfo;
import com.google.python.analysis.values.IteratorInfo;
import com.google.python.analysis.values.Namespace;
import com.google.python.analysis.values.NamespaceSet;
import com.google.python.analysis.values.SequenceBuiltinClassInfo;
import com.google.python.analysis.values.SequenceInfo;
import com.google.python.analysis.values.SuperInfo;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.parsing.Node;
import java.util.Arrays;

/** Hand-written call results for builtins whose behavior cannot be inferred from the host. */
final class BuiltinSpecializations {

  private BuiltinSpecializations() {}

  static void install(PythonAnalyzer analyzer) {
    String builtins = analyzer.getLanguageVersion().getBuiltinModuleName();
    analyzer.specializeFunction(builtins, "range", BuiltinSpecializations::range, false);
    analyzer.specializeFunction(builtins, "min", BuiltinSpecializations::unionOfInputs, true);
    analyzer.specializeFunction(builtins, "max", BuiltinSpecializations::unionOfInputs, true);
    analyzer.specializeFunction(builtins, "getattr", BuiltinSpecializations::getattr, false);
    analyzer.specializeFunction(builtins, "next", BuiltinSpecializations::next, false);
    analyzer.specializeFunction(builtins, "iter", BuiltinSpecializations::iter, false);
    analyzer.specializeFunction(builtins, "super", BuiltinSpecializations::superCall, false);

    analyzer.specializeFunction("copy", "deepcopy", BuiltinSpecializations::firstArg, false);
    analyzer.specializeFunction("copy", "copy", BuiltinSpecializations::firstArg, false);
    analyzer.specializeFunction("pickle", "dumps", BuiltinSpecializations::bytes, false);
    analyzer.specializeFunction("pprint", "pprint", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction("pprint", "pformat", BuiltinSpecializations::string, false);
    analyzer.specializeFunction("pprint", "saferepr", BuiltinSpecializations::string, false);
    analyzer.specializeFunction("pprint", "_safe_repr", BuiltinSpecializations::string, false);
    analyzer.specializeFunction("pprint", "_format", BuiltinSpecializations::string, false);
    analyzer.specializeFunction(
        "pprint.PrettyPrinter", "_format", BuiltinSpecializations::string, false);
    analyzer.specializeFunction(
        "UserDict.UserDict", "update", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction(
        "decimal.Decimal", "__new__", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction(
        "StringIO.StringIO", "write", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction(
        "Tkinter.Toplevel", "__init__", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction(
        "weakref.WeakValueDictionary", "update", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction(
        "idlelib.EditorWindow.EditorWindow", "__init__", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction(
        "threading.Thread", "__init__", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction(
        "subprocess.Popen", "__init__", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction("os._Environ", "get", BuiltinSpecializations::string, false);
    analyzer.specializeFunction("os._Environ", "update", BuiltinSpecializations::nothing, false);
    analyzer.specializeFunction("ntpath", "expandvars", BuiltinSpecializations::string, false);
  }

  /** {@code range(...)}: a list of ints allocated at the call. */
  static NamespaceSet range(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    PythonAnalyzer state = unit.getProjectState();
    SequenceBuiltinClassInfo list =
        (SequenceBuiltinClassInfo) state.getClassInfo(BuiltinTypeId.LIST);
    NamespaceSet result = list.makeSequence(node, unit);
    NamespaceSet ints = state.getClassInfo(BuiltinTypeId.INT).getInstance().getSelfSet();
    for (Namespace ns : result) {
      if (ns instanceof SequenceInfo) {
        ((SequenceInfo) ns).addTypes(unit, ints);
      }
    }
    return result;
  }

  static NamespaceSet unionOfInputs(
      Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return NamespaceSet.unionAll(Arrays.asList(args));
  }

  /** {@code getattr(obj, name[, default])} with constant names resolved to the member. */
  static NamespaceSet getattr(
      Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    NamespaceSet result = NamespaceSet.EMPTY;
    if (args.length < 2) {
      return result;
    }
    if (args.length >= 3) {
      result = args[2];
    }
    for (Namespace value : args[0]) {
      for (Namespace name : args[1]) {
        String attribute = name.getConstantValueAsString();
        if (attribute != null) {
          result = result.union(value.getMember(node, unit, attribute));
        }
      }
    }
    return result;
  }

  /** {@code next(it[, default])}. */
  static NamespaceSet next(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    if (args.length == 0) {
      return NamespaceSet.EMPTY;
    }
    String nextName = unit.getProjectState().getLanguageVersion().getNextMethodName();
    NamespaceSet result =
        args[0]
            .getMember(node, unit, nextName)
            .call(node, unit, Namespace.NO_ARGS, Namespace.NO_NAMES);
    return args.length > 1 ? result.union(args[1]) : result;
  }

  /**
   * {@code iter(iterable)}, or {@code iter(callable, sentinel)} which yields what the callable
   * returns.
   */
  static NamespaceSet iter(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    if (args.length == 1) {
      return args[0].getIterator(node, unit);
    } else if (args.length != 2) {
      return NamespaceSet.EMPTY;
    }
    PythonAnalyzer state = unit.getProjectState();
    NamespaceSet iterator =
        unit.getScope()
            .getOrMakeNodeValue(
                node,
                n ->
                    new IteratorInfo(
                            new VariableDef(), state.getClassInfo(BuiltinTypeId.CALLABLE_ITERATOR))
                        .getSelfSet());
    NamespaceSet produced = args[0].call(node, unit, Namespace.NO_ARGS, Namespace.NO_NAMES);
    for (Namespace ns : iterator) {
      if (ns instanceof IteratorInfo) {
        ((IteratorInfo) ns).addTypes(unit, produced);
      }
    }
    return iterator;
  }

  /**
   * {@code super(cls[, obj])}, and in Python 3 the argument-less form inside a method, which uses
   * the enclosing class and its instance.
   */
  static NamespaceSet superCall(
      Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    if (args.length > 2) {
      return NamespaceSet.EMPTY;
    }
    NamespaceSet classes = NamespaceSet.EMPTY;
    NamespaceSet instances = NamespaceSet.EMPTY;
    if (args.length == 0) {
      if (!unit.getProjectState().getLanguageVersion().is3x()) {
        return NamespaceSet.EMPTY;
      }
      for (InterpreterScope scope : unit.getScope().enumerateTowardsGlobal()) {
        if (scope instanceof FunctionScope && scope.getOuterScope() instanceof ClassScope) {
          ClassInfo classInfo = ((ClassScope) scope.getOuterScope()).getClassInfo();
          classes = classInfo.getSelfSet();
          if (!((FunctionScope) scope).getFunction().getParameterNames().isEmpty()) {
            instances = classInfo.getInstance().getSelfSet();
          }
          break;
        }
      }
    } else {
      classes = args[0];
      if (args.length > 1) {
        instances = args[1];
      }
    }
    NamespaceSet superClasses = classes;
    NamespaceSet superInstances = instances;
    return unit.getScope()
        .getOrMakeNodeValue(
            node,
            n -> {
              NamespaceSet result = NamespaceSet.EMPTY;
              for (Namespace ns : superClasses) {
                if (ns instanceof ClassInfo) {
                  result = result.add(new SuperInfo((ClassInfo) ns, superInstances));
                }
              }
              return result;
            });
  }

  static NamespaceSet firstArg(
      Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return args.length > 0 ? args[0] : NamespaceSet.EMPTY;
  }

  static NamespaceSet bytes(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return unit.getProjectState().getClassInfo(BuiltinTypeId.BYTES).getInstance().getSelfSet();
  }

  static NamespaceSet string(Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return unit.getProjectState().getClassInfo(BuiltinTypeId.STR).getInstance().getSelfSet();
  }

  static NamespaceSet nothing(
      Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    return NamespaceSet.EMPTY;
  }
}
