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
import static com.google.python.parsing.IR.importFrom;
import static com.google.python.parsing.IR.importName;
import static com.google.python.parsing.IR.importNode;
import static com.google.python.parsing.IR.module;

import com.google.common.util.concurrent.Uninterruptibles;
import com.google.python.analysis.values.BuiltinModule;
import com.google.python.analysis.values.Module;
import com.google.python.analysis.values.MultipleMemberInfo;
import com.google.python.analysis.values.Namespace;
import com.google.python.interpreter.FakeInterpreter;
import com.google.python.interpreter.Member;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ImportResolverTest {
  private FakeInterpreter interpreter;
  private PythonAnalyzer analyzer;

  @Before
  public void setUp() {
    interpreter = new FakeInterpreter();
    analyzer = new PythonAnalyzer(interpreter);
  }

  @Test
  public void testBottomModule() {
    Module path = analyzer.importBuiltinModule("os.path", true);
    assertThat(path).isInstanceOf(BuiltinModule.class);
    assertThat(((Namespace) path).getName()).isEqualTo("os.path");
  }

  @Test
  public void testTopModule() {
    Module os = analyzer.importBuiltinModule("os.path", false);
    assertThat(((Namespace) os).getName()).isEqualTo("os");
    assertThat(analyzer.importBuiltinModule("os", true)).isSameInstanceAs(os);
  }

  @Test
  public void testUnresolvedPath() {
    assertThat(analyzer.importBuiltinModule("os.missing", true)).isNull();
    assertThat(analyzer.importBuiltinModule("os.missing", false)).isNull();
    assertThat(analyzer.importBuiltinModule("os.getcwd", true)).isNull();
    assertThat(analyzer.importBuiltinModule("missing", true)).isNull();
  }

  @Test
  public void testRelativeNamesAreNotResolved() {
    assertThat(analyzer.importBuiltinModule(".os", true)).isNull();
    assertThat(analyzer.resolveModule(".os")).isNull();
  }

  @Test
  public void testAlternativeModules() {
    Module impl = analyzer.importBuiltinModule("plat.impl", true);
    assertThat(impl).isInstanceOf(MultipleMemberInfo.class);
    assertThat(((MultipleMemberInfo) impl).getMembers()).hasSize(2);
    assertThat(analyzer.resolveModule("plat.impl")).isInstanceOf(MultipleMemberInfo.class);
  }

  @Test
  public void testMemberLookupKeepsAlternativesCombined() {
    ModuleEntry user = analyzer.addModule("user", "/proj/user.py");
    user.updateTree(
        module(
            importFrom("plat", importName("impl")),
            importNode(importName("plat.impl", "q"))),
        null);
    user.analyze();

    Namespace impl = onlyValue(user, "impl");
    Namespace q = onlyValue(user, "q");
    assertThat(impl).isInstanceOf(MultipleMemberInfo.class);
    assertThat(q).isInstanceOf(MultipleMemberInfo.class);
    assertThat(((MultipleMemberInfo) q).getMembers()).hasSize(2);
    assertThat(q).isEqualTo(impl);
  }

  @Test
  public void testAlternativeReachedThroughMemberIsNotBound() {
    Namespace plat = analyzer.resolveModule("plat");
    Member implMember =
        interpreter.getFakeModule("plat").getMember(analyzer.getDefaultContext(), "impl");
    Namespace impl = analyzer.getNamespaceFromObjects(implMember);
    assertThat(plat).isInstanceOf(BuiltinModule.class);
    assertThat(impl).isInstanceOf(MultipleMemberInfo.class);

    for (Namespace alternative : ((MultipleMemberInfo) impl).getMembers()) {
      assertThat(alternative.getName()).isEqualTo("plat.impl");
    }
    assertThat(analyzer.resolveModule("plat.impl")).isEqualTo(impl);
  }

  @Test
  public void testSlotIsReadableWhileItsModuleIsImported() {
    List<Boolean> readWhileImporting = new ArrayList<>();
    interpreter.setImportHook(
        name -> {
          if (!name.equals("collections")) {
            return;
          }
          ModuleReference ref = analyzer.getModules().getReference("collections");
          Thread reader = new Thread(() -> readWhileImporting.add(ref.hasModule()));
          reader.start();
          Uninterruptibles.joinUninterruptibly(reader, 10, TimeUnit.SECONDS);
        });

    assertThat(analyzer.tryGetModule("collections")).isInstanceOf(BuiltinModule.class);
    assertThat(readWhileImporting).containsExactly(false);
  }

  @Test
  public void testResolveBindsName() {
    Namespace path = analyzer.resolveModule("os.path");
    assertThat(path).isSameInstanceAs(analyzer.importBuiltinModule("os.path", true));
    assertThat(analyzer.getModules().getReference("os.path").getModule())
        .isSameInstanceAs(path);
  }

  @Test
  public void testResolveWalksProjectPackages() {
    ModuleEntry pkg = analyzer.addModule("pkg", "/proj/pkg/__init__.py");
    ModuleEntry sub = analyzer.addModule("pkg.sub", "/proj/pkg/sub.py");

    assertThat(analyzer.resolveModule("pkg")).isSameInstanceAs(pkg.getModuleInfo());
    assertThat(analyzer.resolveModule("pkg.sub")).isSameInstanceAs(sub.getModuleInfo());
    assertThat(analyzer.resolveModule("pkg.other")).isNull();
  }

  private static Namespace onlyValue(ModuleEntry entry, String variable) {
    VariableDef def = entry.getModuleInfo().getScope().getVariable(variable);
    assertThat(def).isNotNull();
    assertThat(def.getTypes().size()).isEqualTo(1);
    return def.getTypes().iterator().next();
  }
}
