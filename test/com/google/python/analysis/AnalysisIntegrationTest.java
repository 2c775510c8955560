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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static com.google.python.parsing.IR.assign;
import static com.google.python.parsing.IR.bases;
import static com.google.python.parsing.IR.call;
import static com.google.python.parsing.IR.classDef;
import static com.google.python.parsing.IR.forNode;
import static com.google.python.parsing.IR.function;
import static com.google.python.parsing.IR.getattr;
import static com.google.python.parsing.IR.getitem;
import static com.google.python.parsing.IR.ifNode;
import static com.google.python.parsing.IR.importFrom;
import static com.google.python.parsing.IR.importName;
import static com.google.python.parsing.IR.importNode;
import static com.google.python.parsing.IR.keyword;
import static com.google.python.parsing.IR.list;
import static com.google.python.parsing.IR.module;
import static com.google.python.parsing.IR.name;
import static com.google.python.parsing.IR.number;
import static com.google.python.parsing.IR.paramList;
import static com.google.python.parsing.IR.returnNode;
import static com.google.python.parsing.IR.string;
import static com.google.python.parsing.IR.suite;
import static com.google.python.parsing.IR.tuple;

import com.google.python.analysis.values.BuiltinModule;
import com.google.python.analysis.values.ClassInfo;
import com.google.python.analysis.values.FunctionInfo;
import com.google.python.analysis.values.InstanceInfo;
import com.google.python.analysis.values.MultipleMemberInfo;
import com.google.python.analysis.values.Namespace;
import com.google.python.analysis.values.NamespaceSet;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.FakeInterpreter;
import com.google.python.parsing.Node;
import com.google.python.parsing.Token;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AnalysisIntegrationTest {
  private FakeInterpreter interpreter;
  private PythonAnalyzer analyzer;

  @Before
  public void setUp() {
    interpreter = new FakeInterpreter();
    analyzer = new PythonAnalyzer(interpreter);
  }

  @Test
  public void testFunctionReturnsArgument() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                function("f", paramList("x"), suite(returnNode(name("x")))),
                assign(name("y"), call(name("f"), number(1)))));

    assertThat(typesOf(entry, "y")).isEqualTo(analyzer.getConstant(1));
  }

  @Test
  public void testKeywordArgument() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                function("g", paramList("a", "b"), suite(returnNode(name("b")))),
                assign(name("y"), call(name("g"), number(1), keyword("b", string("s"))))));

    assertThat(typesOf(entry, "y")).isEqualTo(analyzer.getConstant("s"));
  }

  @Test
  public void testFunctionWithoutReturnValue() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                function("f", paramList(), suite(returnNode())),
                assign(name("y"), call(name("f")))));

    assertThat(typesOf(entry, "y")).isEqualTo(analyzer.getNoneInstance().getSelfSet());
  }

  @Test
  public void testInstanceAttributeSetInConstructor() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                classDef(
                    "C",
                    bases(),
                    suite(
                        function(
                            "__init__",
                            paramList("self", "v"),
                            suite(assign(getattr(name("self"), "v"), name("v")))))),
                assign(name("c"), call(name("C"), number(1))),
                assign(name("z"), getattr(name("c"), "v"))));

    assertThat(typesOf(entry, "z")).isEqualTo(analyzer.getConstant(1));
    Namespace instance = typesOf(entry, "c").iterator().next();
    assertThat(instance).isInstanceOf(InstanceInfo.class);
    assertThat(instance.getName()).isEqualTo("C");
  }

  @Test
  public void testMethodFromBaseClass() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                classDef("A", bases(), suite(method("m", returnNode(number(1))))),
                classDef("B", bases(name("A")), suite()),
                assign(name("r"), call(getattr(call(name("B")), "m")))));

    assertThat(typesOf(entry, "r")).isEqualTo(analyzer.getConstant(1));
  }

  @Test
  public void testSuperWithoutArguments() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                classDef("A", bases(), suite(method("m", returnNode(number(1))))),
                classDef(
                    "B",
                    bases(name("A")),
                    suite(method("m", returnNode(call(getattr(call(name("super")), "m")))))),
                assign(name("r"), call(getattr(call(name("B")), "m")))));

    assertThat(typesOf(entry, "r")).isEqualTo(analyzer.getConstant(1));
  }

  @Test
  public void testBothBranchesOfIf() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                ifNode(
                    name("cond"),
                    suite(assign(name("y"), number(1))),
                    suite(assign(name("y"), string("s"))))));

    assertThat(typesOf(entry, "y"))
        .isEqualTo(analyzer.getConstant(1).union(analyzer.getConstant("s")));
  }

  @Test
  public void testListElements() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                assign(name("l"), list(number(1), string("s"))),
                forNode(name("e"), name("l"), suite(assign(name("k"), name("e")))),
                assign(name("i"), getitem(name("l"), number(0)))));

    NamespaceSet elements = analyzer.getConstant(1).union(analyzer.getConstant("s"));
    assertThat(typesOf(entry, "k")).isEqualTo(elements);
    assertThat(typesOf(entry, "i")).isEqualTo(elements);
  }

  @Test
  public void testTupleUnpacking() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(assign(tuple(name("a"), name("b")), tuple(number(1), string("s")))));

    NamespaceSet elements = analyzer.getConstant(1).union(analyzer.getConstant("s"));
    assertThat(typesOf(entry, "a")).isEqualTo(elements);
    assertThat(typesOf(entry, "b")).isEqualTo(elements);
  }

  @Test
  public void testBuiltinFunctionReturnType() {
    ModuleEntry entry =
        analyze("mod", module(assign(name("n"), call(name("len"), string("abc")))));

    assertThat(typesOf(entry, "n"))
        .isEqualTo(analyzer.getClassInfo(BuiltinTypeId.INT).getInstance().getSelfSet());
  }

  @Test
  public void testRangeIsListOfInt() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                assign(name("r"), call(name("range"), number(3))),
                forNode(name("i"), name("r"), suite(assign(name("n"), name("i"))))));

    assertThat(typesOf(entry, "n"))
        .isEqualTo(analyzer.getClassInfo(BuiltinTypeId.INT).getInstance().getSelfSet());
  }

  @Test
  public void testMinIsUnionOfArguments() {
    ModuleEntry entry =
        analyze("mod", module(assign(name("m"), call(name("min"), number(1), string("s")))));

    assertThat(typesOf(entry, "m"))
        .isEqualTo(analyzer.getConstant(1).union(analyzer.getConstant("s")));
  }

  @Test
  public void testGetattrWithConstantName() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                importNode(importName("os")),
                assign(name("j"), call(name("getattr"), name("os"), string("getcwd"))),
                assign(name("s"), call(name("j")))));

    assertThat(typesOf(entry, "s"))
        .isEqualTo(analyzer.getClassInfo(BuiltinTypeId.STR).getInstance().getSelfSet());
  }

  @Test
  public void testDeepcopyReturnsArgument() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                importNode(importName("copy")),
                assign(name("l"), list(number(1))),
                assign(name("d"), call(getattr(name("copy"), "deepcopy"), name("l")))));

    assertThat(typesOf(entry, "d")).isEqualTo(typesOf(entry, "l"));
  }

  @Test
  public void testImportDottedNameBindsTopLevel() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                importNode(importName("os.path")),
                assign(
                    name("j"),
                    call(getattr(getattr(name("os"), "path"), "join"), string("a")))));

    assertThat(typesOf(entry, "os").iterator().next().getName()).isEqualTo("os");
    assertThat(typesOf(entry, "j"))
        .isEqualTo(analyzer.getClassInfo(BuiltinTypeId.STR).getInstance().getSelfSet());
  }

  @Test
  public void testImportAsBindsSubmodule() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(importNode(importName("os.path", "p")), importFrom("os", importName("path"))));

    Namespace p = typesOf(entry, "p").iterator().next();
    assertThat(p).isInstanceOf(BuiltinModule.class);
    assertThat(p.getName()).isEqualTo("os.path");
    assertThat(typesOf(entry, "path")).isEqualTo(typesOf(entry, "p"));
  }

  @Test
  public void testImportOfAlternativeModules() {
    ModuleEntry entry = analyze("mod", module(importNode(importName("plat.impl", "impl"))));

    Namespace impl = typesOf(entry, "impl").iterator().next();
    assertThat(impl).isInstanceOf(MultipleMemberInfo.class);
    assertThat(((MultipleMemberInfo) impl).getMembers()).hasSize(2);
  }

  @Test
  public void testImportBetweenProjectModules() {
    ModuleEntry b =
        addModule(
            "b", module(importFrom("a", importName("x")), assign(name("y"), name("x"))));
    ModuleEntry a = addModule("a", module(assign(name("x"), number(1))));

    b.analyze();
    a.analyze();

    assertThat(typesOf(b, "y")).isEqualTo(analyzer.getConstant(1));
  }

  @Test
  public void testUpdatedModuleReanalyzesImporters() {
    ModuleEntry a = addModule("a", module(assign(name("x"), number(1))));
    ModuleEntry b =
        addModule(
            "b",
            module(importNode(importName("a")), assign(name("y"), getattr(name("a"), "x"))));
    a.analyze();
    b.analyze();
    assertThat(typesOf(b, "y")).isEqualTo(analyzer.getConstant(1));
    int version = a.getAnalysisVersion();

    a.updateTree(module(assign(name("x"), string("s"))), null);
    a.analyze();

    assertThat(a.getAnalysisVersion()).isEqualTo(version + 1);
    assertThat(typesOf(a, "x")).isEqualTo(analyzer.getConstant("s"));
    assertThat(typesOf(b, "y").asSet())
        .containsAtLeastElementsIn(analyzer.getConstant("s").asSet());
  }

  @Test
  public void testAddingModuleReanalyzesEarlierImporters() {
    ModuleEntry user =
        addModule(
            "user",
            module(
                importNode(importName("later")),
                assign(name("v"), getattr(name("later"), "x"))));
    user.analyze();
    assertThat(typesOf(user, "later").isEmpty()).isTrue();

    ModuleEntry later = addModule("later", module(assign(name("x"), number(1))));
    later.analyze();

    assertThat(typesOf(user, "v")).isEqualTo(analyzer.getConstant(1));
  }

  @Test
  public void testRelativeImportInPackage() {
    ModuleEntry pkg = analyzer.addModule("pkg", "/proj/pkg/__init__.py");
    pkg.updateTree(module(importFrom(".sub", importName("x"))), null);
    ModuleEntry sub = analyzer.addModule("pkg.sub", "/proj/pkg/sub.py");
    sub.updateTree(module(assign(name("x"), number(1))), null);
    ModuleEntry sibling = analyzer.addModule("pkg.sibling", "/proj/pkg/sibling.py");
    sibling.updateTree(module(importFrom(".sub", importName("x", "y"))), null);

    sub.analyze();
    pkg.analyze();
    sibling.analyze();

    assertThat(typesOf(pkg, "x")).isEqualTo(analyzer.getConstant(1));
    assertThat(typesOf(sibling, "y")).isEqualTo(analyzer.getConstant(1));
  }

  @Test
  public void testRemovedModuleReanalyzesImporters() {
    ModuleEntry a = addModule("a", module(assign(name("x"), number(1))));
    ModuleEntry b =
        addModule("b", module(importFrom("a", importName("x")), assign(name("y"), name("x"))));
    a.analyze();
    b.analyze();

    analyzer.removeModule(a);

    assertThat(analyzer.getQueueSize()).isGreaterThan(0);
    analyzer.analyzeQueuedEntries(CancellationToken.NONE);
    assertThat(analyzer.getQueueSize()).isEqualTo(0);
  }

  @Test
  public void testRecursionTerminates() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                function(
                    "f",
                    paramList("n"),
                    suite(returnNode(list(call(name("f"), list(name("n"))))))),
                assign(name("y"), call(name("f"), number(0)))));

    assertThat(typesOf(entry, "y")).isNotEmpty();
  }

  @Test
  public void testCancelledAnalysisDropsQueue() {
    ModuleEntry entry = addModule("mod", module(assign(name("y"), number(1))));
    entry.prepareForAnalysis();

    int processed = analyzer.analyzeQueuedEntries(() -> true);

    assertThat(processed).isEqualTo(0);
    assertThat(analyzer.getQueueSize()).isEqualTo(0);
    assertThat(entry.getModuleInfo().getScope().getVariable("y")).isNull();
  }

  @Test
  public void testQueueReporting() {
    List<Integer> reports = new ArrayList<>();
    analyzer.setQueueReporting(reports::add, 1);

    analyze(
        "mod",
        module(
            function("f", paramList(), suite(returnNode(number(1)))),
            assign(name("y"), call(name("f")))));

    assertThat(reports).isNotEmpty();
    assertThat(reports.get(reports.size() - 1)).isEqualTo(0);
  }

  @Test
  public void testEvalUnitDoesNotCreateVariables() {
    ModuleEntry entry = analyze("mod", module(assign(name("x"), number(1))));
    AnalysisUnit unit = entry.getAnalysisUnit().copyForEval();

    NamespaceSet x = new ExpressionEvaluator(unit).evaluate(name("x"));
    NamespaceSet missing = new ExpressionEvaluator(unit).evaluate(name("missing"));

    assertThat(x).isEqualTo(analyzer.getConstant(1));
    assertThat(missing).isEqualTo(NamespaceSet.EMPTY);
    assertThat(entry.getModuleInfo().getScope().getVariable("missing")).isNull();
    assertThat(typesOf(entry, "x").iterator().next().getConstantValue()).isEqualTo(1);
  }

  @Test
  public void testRecordsAssignmentAndReferenceLocations() {
    Node target = name("x").setLineno(1).setCharno(0);
    Node read = name("x").setLineno(2).setCharno(4);
    ModuleEntry entry =
        analyze("mod", module(assign(target, number(1)), assign(name("y"), read)));

    VariableDef x = entry.getModuleInfo().getScope().getVariable("x");
    assertThat(x.getAssignments())
        .containsExactly(SourceLocation.create("/proj/mod.py", 1, 0));
    assertThat(x.getReferences()).containsExactly(SourceLocation.create("/proj/mod.py", 2, 4));

    entry.analyze();
    x = entry.getModuleInfo().getScope().getVariable("x");
    assertThat(x.getReferences()).hasSize(1);
  }

  @Test
  public void testBrokenStatementsAreSkipped() {
    ModuleEntry good = addModule("good", module(assign(name("z"), number(2))));
    ModuleEntry bad =
        addModule(
            "bad",
            module(
                new Node(Token.FOR, name("x"), list(number(1))),
                assign(name("a"), new Node(Token.GETATTR, name("x"))),
                new Node(Token.FUNCTION, paramList(), suite()),
                new Node(Token.CLASS, bases(), suite()),
                new Node(Token.IMPORT, new Node(Token.IMPORT_NAME)),
                new Node(Token.IMPORT_FROM, importName("os")),
                new Node(Token.ERROR),
                assign(name("y"), number(1))));
    good.prepareForAnalysis();
    bad.prepareForAnalysis();

    analyzer.analyzeQueuedEntries(CancellationToken.NONE);

    assertThat(typesOf(bad, "x")).isEqualTo(analyzer.getConstant(1));
    assertThat(typesOf(bad, "y")).isEqualTo(analyzer.getConstant(1));
    assertThat(typesOf(good, "z")).isEqualTo(analyzer.getConstant(2));
    assertThat(analyzer.getQueueSize()).isEqualTo(0);
  }

  @Test
  public void testFailingUnitDoesNotStopOtherModules() {
    analyzer.specializeFunction(
        "os",
        "getcwd",
        (node, unit, args, argNames) -> {
          throw new IllegalStateException("broken override");
        },
        false);
    ModuleEntry good = addModule("good", module(assign(name("z"), number(2))));
    ModuleEntry bad =
        addModule(
            "bad",
            module(
                importNode(importName("os")),
                assign(name("w"), number(1)),
                assign(name("y"), call(getattr(name("os"), "getcwd")))));
    good.prepareForAnalysis();
    bad.prepareForAnalysis();

    analyzer.analyzeQueuedEntries(CancellationToken.NONE);

    assertThat(typesOf(bad, "w")).isEqualTo(analyzer.getConstant(1));
    assertThat(bad.getModuleInfo().getScope().getVariable("y")).isNull();
    assertThat(typesOf(good, "z")).isEqualTo(analyzer.getConstant(2));
  }

  @Test
  public void testReanalysisAtFixedPointChangesNothing() {
    ModuleEntry entry =
        analyze(
            "mod",
            module(
                function("f", paramList("x"), suite(returnNode(name("x")))),
                classDef(
                    "C", bases(), suite(method("m", returnNode(call(name("f"), name("self")))))),
                assign(name("a"), call(name("f"), number(1))),
                assign(name("b"), call(getattr(call(name("C")), "m"))),
                forNode(
                    name("i"),
                    list(name("a"), string("s")),
                    suite(assign(name("last"), name("i"))))));
    Map<String, NamespaceSet> before = new LinkedHashMap<>();
    Set<AnalysisUnit> units = new LinkedHashSet<>();
    units.add(entry.getAnalysisUnit());
    collectValues(entry.getModuleInfo().getScope(), before, units);
    assertThat(units).hasSize(4);

    for (AnalysisUnit unit : units) {
      analyzer.enqueue(unit);
    }
    int processed = analyzer.analyzeQueuedEntries(CancellationToken.NONE);

    Map<String, NamespaceSet> after = new LinkedHashMap<>();
    collectValues(entry.getModuleInfo().getScope(), after, new LinkedHashSet<>());
    assertThat(processed).isAtLeast(units.size());
    assertThat(after).isEqualTo(before);
  }

  /** Records the values of every variable reachable from {@code scope}, and the units seen. */
  private static void collectValues(
      InterpreterScope scope, Map<String, NamespaceSet> values, Set<AnalysisUnit> units) {
    for (Map.Entry<String, VariableDef> variable : scope.getVariables().entrySet()) {
      NamespaceSet types = variable.getValue().getTypes();
      values.put(scope.getName() + "." + variable.getKey(), types);
      for (Namespace ns : types) {
        if (ns instanceof FunctionInfo) {
          FunctionInfo function = (FunctionInfo) ns;
          if (units.add(function.getAnalysisUnit())) {
            collectValues(function.getScope(), values, units);
          }
        } else if (ns instanceof ClassInfo) {
          ClassInfo classInfo = (ClassInfo) ns;
          if (units.add(classInfo.getAnalysisUnit())) {
            collectValues(classInfo.getScope(), values, units);
          }
        }
      }
    }
  }

  private static Node method(String name, Node... body) {
    return function(name, paramList("self"), suite(body));
  }

  private ModuleEntry addModule(String moduleName, Node tree) {
    ModuleEntry entry =
        analyzer.addModule(moduleName, "/proj/" + moduleName.replace('.', '/') + ".py");
    entry.updateTree(tree, null);
    return entry;
  }

  private ModuleEntry analyze(String moduleName, Node tree) {
    ModuleEntry entry = addModule(moduleName, tree);
    entry.analyze();
    return entry;
  }

  private static NamespaceSet typesOf(ModuleEntry entry, String variable) {
    VariableDef def = entry.getModuleInfo().getScope().getVariable(variable);
    assertWithMessage("variable %s", variable).that(def).isNotNull();
    return def.getTypes();
  }
}
