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
import static com.google.python.parsing.IR.assign;
import static com.google.python.parsing.IR.call;
import static com.google.python.parsing.IR.function;
import static com.google.python.parsing.IR.getattr;
import static com.google.python.parsing.IR.importFrom;
import static com.google.python.parsing.IR.importName;
import static com.google.python.parsing.IR.importNode;
import static com.google.python.parsing.IR.module;
import static com.google.python.parsing.IR.name;
import static com.google.python.parsing.IR.number;
import static com.google.python.parsing.IR.paramList;
import static com.google.python.parsing.IR.returnNode;
import static com.google.python.parsing.IR.string;
import static com.google.python.parsing.IR.suite;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.python.analysis.values.BuiltinModule;
import com.google.python.analysis.values.CallDelegate;
import com.google.python.analysis.values.NamespaceSet;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.FakeInterpreter;
import com.google.python.parsing.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SpecializationRegistryTest {
  private PythonAnalyzer analyzer;

  @Before
  public void setUp() {
    analyzer = new PythonAnalyzer(new FakeInterpreter());
  }

  @Test
  public void testRegisteredBeforeModuleIsAdded() {
    AtomicInteger calls = new AtomicInteger();
    CallDelegate delegate =
        (node, unit, args, argNames) -> {
          calls.incrementAndGet();
          return unit.getProjectState().getConstant("special");
        };
    analyzer.specializeFunction("later", "f", delegate, false);

    ModuleEntry later = analyzer.addModule("later", "/proj/later.py");
    later.updateTree(module(function("f", paramList(), suite(returnNode(number(1))))), null);
    ModuleEntry user = analyzer.addModule("user", "/proj/user.py");
    user.updateTree(
        module(importFrom("later", importName("f")), assign(name("y"), call(name("f")))), null);
    later.analyze();
    user.analyze();

    assertThat(later.getModuleInfo().getSpecializations().getNames()).containsExactly("f");
    assertThat(typesOf(user, "y")).isEqualTo(analyzer.getConstant("special"));
    assertThat(calls.get()).isGreaterThan(0);

    analyzer.reloadModules();
    analyzer.addModule("other", "/proj/other.py");

    assertThat(later.getModuleInfo().getSpecializations().size()).isEqualTo(1);
  }

  @Test
  public void testMethodOfInterpreterClass() {
    analyzer.specializeFunction(
        "collections.OrderedDict",
        "keys",
        (node, unit, args, argNames) -> unit.getProjectState().getConstant("keys"),
        false);

    BuiltinModule collections = (BuiltinModule) analyzer.tryGetModule("collections");
    assertThat(collections.getSpecializations().getNames()).contains("OrderedDict.keys");

    ModuleEntry user =
        analyze(
            module(
                importNode(importName("collections")),
                assign(name("d"), call(getattr(name("collections"), "OrderedDict"))),
                assign(name("k"), call(getattr(name("d"), "keys")))));

    assertThat(typesOf(user, "k")).isEqualTo(analyzer.getConstant("keys"));
  }

  @Test
  public void testReturnTypeByName() {
    analyzer.specializeFunction("os", "getcwd", "collections.OrderedDict");

    ModuleEntry user =
        analyze(
            module(
                importNode(importName("os")),
                assign(name("d"), call(getattr(name("os"), "getcwd")))));

    NamespaceSet d = typesOf(user, "d");
    assertThat(d.size()).isEqualTo(1);
    assertThat(d.iterator().next().getName()).isEqualTo("OrderedDict");
  }

  @Test
  public void testReturnTypeWithoutModule() {
    assertThrows(
        IllegalArgumentException.class,
        () -> analyzer.specializeFunction("os", "getcwd", "OrderedDict"));
  }

  @Test
  public void testCallInfoDelegate() {
    List<Integer> positionalCounts = new ArrayList<>();
    analyzer.specializeFunction(
        "os",
        "getcwd",
        (Node node, CallInfo info) -> {
          positionalCounts.add(info.positionalCount());
          return ImmutableList.copyOf(info.args().get(0));
        });

    ModuleEntry user =
        analyze(
            module(
                importNode(importName("os")),
                assign(name("d"), call(getattr(name("os"), "getcwd"), number(7)))));

    assertThat(typesOf(user, "d")).isEqualTo(analyzer.getConstant(7));
    assertThat(positionalCounts).contains(1);
  }

  @Test
  public void testCallbackKeepsGenericResult() {
    List<Node> seen = new ArrayList<>();
    analyzer.specializeFunction("os", "getcwd", (Node node) -> seen.add(node));
    Node callNode = call(getattr(name("os"), "getcwd"));

    ModuleEntry user =
        analyze(module(importNode(importName("os")), assign(name("d"), callNode)));

    assertThat(seen).contains(callNode);
    assertThat(typesOf(user, "d"))
        .isEqualTo(analyzer.getClassInfo(BuiltinTypeId.STR).getInstance().getSelfSet());
  }

  @Test
  public void testBuiltinOverridesSurviveReload() {
    analyzer.reloadModules();
    ModuleEntry user =
        analyze(module(assign(name("m"), call(name("max"), number(1), string("s")))));

    assertThat(typesOf(user, "m"))
        .isEqualTo(analyzer.getConstant(1).union(analyzer.getConstant("s")));
  }

  private ModuleEntry analyze(Node tree) {
    ModuleEntry entry = analyzer.addModule("user", "/proj/user.py");
    entry.updateTree(tree, null);
    entry.analyze();
    return entry;
  }

  private static NamespaceSet typesOf(ModuleEntry entry, String variable) {
    VariableDef def = entry.getModuleInfo().getScope().getVariable(variable);
    assertThat(def).isNotNull();
    return def.getTypes();
  }
}
