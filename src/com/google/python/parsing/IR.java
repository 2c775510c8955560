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

import static com.google.common.base.Preconditions.checkState;

import org.jspecify.annotations.Nullable;

/** A tree construction helper class. */
public class IR {

  private IR() {}

  public static Node module(Node... statements) {
    return new Node(Token.MODULE, statements);
  }

  public static Node suite(Node... statements) {
    return new Node(Token.SUITE, statements);
  }

  public static Node function(String name, Node params, Node body) {
    checkState(params.getToken() == Token.PARAM_LIST);
    checkState(body.getToken() == Token.SUITE);
    Node function = Node.newString(Token.FUNCTION, name);
    function.addChildToBack(params);
    function.addChildToBack(body);
    return function;
  }

  public static Node paramList(String... names) {
    Node params = new Node(Token.PARAM_LIST);
    for (String name : names) {
      params.addChildToBack(name(name));
    }
    return params;
  }

  public static Node classDef(String name, Node bases, Node body) {
    checkState(bases.getToken() == Token.BASES);
    checkState(body.getToken() == Token.SUITE);
    Node classDef = Node.newString(Token.CLASS, name);
    classDef.addChildToBack(bases);
    classDef.addChildToBack(body);
    return classDef;
  }

  public static Node bases(Node... bases) {
    for (Node base : bases) {
      checkState(mayBeExpression(base), base);
    }
    return new Node(Token.BASES, bases);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node assign(Node target, Node value) {
    checkState(target.isName() || target.isGetAttr() || target.isTuple(), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.ASSIGN, target, value);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(then.getToken() == Token.SUITE);
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(then.getToken() == Token.SUITE);
    checkState(elseNode.getToken() == Token.SUITE);
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node forNode(Node target, Node iterable, Node body) {
    checkState(target.isName() || target.isTuple(), target);
    checkState(body.getToken() == Token.SUITE);
    return new Node(Token.FOR, target, iterable, body);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  /** {@code import a.b, c as d}, built from {@link #importName} nodes. */
  public static Node importNode(Node... names) {
    for (Node name : names) {
      checkState(name.getToken() == Token.IMPORT_NAME, name);
    }
    return new Node(Token.IMPORT, names);
  }

  /** {@code from module import a, b as c}; a leading dot in the module marks a relative import. */
  public static Node importFrom(String module, Node... names) {
    Node importFrom = Node.newString(Token.IMPORT_FROM, module);
    for (Node name : names) {
      checkState(name.getToken() == Token.IMPORT_NAME, name);
      importFrom.addChildToBack(name);
    }
    return importFrom;
  }

  public static Node importName(String dottedName) {
    return Node.newString(Token.IMPORT_NAME, dottedName);
  }

  public static Node importName(String dottedName, @Nullable String alias) {
    Node importName = importName(dottedName);
    if (alias != null) {
      importName.addChildToBack(name(alias));
    }
    return importName;
  }

  public static Node call(Node callee, Node... args) {
    checkState(mayBeExpression(callee), callee);
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.isKeyword(), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node keyword(String name, Node value) {
    checkState(mayBeExpression(value), value);
    Node keyword = Node.newString(Token.KEYWORD, name);
    keyword.addChildToBack(value);
    return keyword;
  }

  public static Node getattr(Node target, String attribute) {
    checkState(mayBeExpression(target), target);
    Node getattr = Node.newString(Token.GETATTR, attribute);
    getattr.addChildToBack(target);
    return getattr;
  }

  public static Node getitem(Node target, Node index) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(index), index);
    return new Node(Token.GETITEM, target, index);
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node constant(@Nullable Object value) {
    return Node.newConstant(value);
  }

  public static Node none() {
    return Node.newConstant(null);
  }

  public static Node string(String value) {
    return Node.newConstant(value);
  }

  public static Node number(int value) {
    return Node.newConstant(value);
  }

  public static Node list(Node... elements) {
    return new Node(Token.LIST, elements);
  }

  public static Node tuple(Node... elements) {
    return new Node(Token.TUPLE, elements);
  }

  public static Node error() {
    return new Node(Token.ERROR);
  }

  private static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case NAME:
      case CONST:
      case GETATTR:
      case GETITEM:
      case CALL:
      case LIST:
      case TUPLE:
      case ERROR:
        return true;
      default:
        return false;
    }
  }
}
