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

package com.google.python.parsing;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testFunction() {
    Node function = IR.function("f", IR.paramList("a", "b"), IR.suite(IR.returnNode()));
    assertThat(function.isFunction()).isTrue();
    assertThat(function.getString()).isEqualTo("f");
    assertThat(function.getFirstChild().getChildCount()).isEqualTo(2);
    assertThat(function.getFirstChild().getFirstChild().getString()).isEqualTo("a");
    assertThat(function.getLastChild().getToken()).isEqualTo(Token.SUITE);
  }

  @Test
  public void testImportNames() {
    Node plain = IR.importName("a.b");
    Node aliased = IR.importName("a.b", "c");
    assertThat(plain.hasChildren()).isFalse();
    assertThat(aliased.getFirstChild().getString()).isEqualTo("c");

    Node importFrom = IR.importFrom("..pkg", IR.importName("x"));
    assertThat(importFrom.getString()).isEqualTo("..pkg");
    assertThat(importFrom.getFirstChild().getParent()).isSameInstanceAs(importFrom);
  }

  @Test
  public void testCallWithKeyword() {
    Node call = IR.call(IR.name("f"), IR.number(1), IR.keyword("k", IR.string("v")));
    assertThat(call.getChildCount()).isEqualTo(3);
    Node keyword = call.getChildAtIndex(2);
    assertThat(keyword.isKeyword()).isTrue();
    assertThat(keyword.getString()).isEqualTo("k");
    assertThat(keyword.getFirstChild().getConstantValue()).isEqualTo("v");
  }

  @Test
  public void testConstants() {
    assertThat(IR.none().getConstantValue()).isNull();
    assertThat(IR.number(3).getConstantValue()).isEqualTo(3);
    assertThrows(IllegalStateException.class, () -> IR.name("x").getConstantValue());
    assertThrows(IllegalStateException.class, () -> IR.list().getString());
  }

  @Test
  public void testRejectsMalformedTrees() {
    assertThrows(
        IllegalStateException.class, () -> IR.assign(IR.call(IR.name("f")), IR.number(1)));
    assertThrows(
        IllegalStateException.class, () -> IR.function("f", IR.suite(), IR.suite()));
    assertThrows(IllegalStateException.class, () -> IR.importNode(IR.name("os")));
    assertThrows(IllegalStateException.class, () -> IR.returnNode(IR.pass()));
  }

  @Test
  public void testNodeCanOnlyHaveOneParent() {
    Node name = IR.name("x");
    IR.exprResult(name);
    assertThrows(IllegalArgumentException.class, () -> IR.exprResult(name));
  }

  @Test
  public void testPositions() {
    Node name = IR.name("x").setLineno(3).setCharno(4);
    assertThat(name.getLineno()).isEqualTo(3);
    assertThat(name.getCharno()).isEqualTo(4);
    assertThat(IR.name("y").getLineno()).isEqualTo(-1);
  }
}
