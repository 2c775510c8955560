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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A node of the source tree. Nodes are owned by the parser; the analysis only reads them and uses
 * their identity as a key for per-node state.
 *
 * <p>Names (of variables, attributes, functions, classes, imported modules and keyword
 * arguments) are stored as the node's string. Constants carry their value: a {@link String},
 * {@link Boolean}, {@link Integer}, {@link Long}, {@link java.math.BigInteger}, {@link Double},
 * {@link com.google.python.interpreter.Complex}, {@link
 * com.google.python.interpreter.AsciiString}, {@link com.google.python.interpreter.Ellipsis}, or
 * null for {@code None}.
 */
public class Node {
  private final Token token;
  private final List<Node> children = new ArrayList<>();
  private @Nullable Node parent;
  private @Nullable String string;
  private @Nullable Object constantValue;
  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public static Node newConstant(@Nullable Object value) {
    Node n = new Node(Token.CONST);
    n.constantValue = value;
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final String getString() {
    checkState(string != null, "%s has no string", token);
    return string;
  }

  public final boolean hasString() {
    return string != null;
  }

  /** Returns the value of a {@link Token#CONST} node. */
  public final @Nullable Object getConstantValue() {
    checkState(token == Token.CONST, "not a constant: %s", token);
    return constantValue;
  }

  public final boolean hasChildren() {
    return !children.isEmpty();
  }

  public final int getChildCount() {
    return children.size();
  }

  public final @Nullable Node getFirstChild() {
    return children.isEmpty() ? null : children.get(0);
  }

  public final @Nullable Node getSecondChild() {
    return children.size() < 2 ? null : children.get(1);
  }

  public final @Nullable Node getLastChild() {
    return children.isEmpty() ? null : children.get(children.size() - 1);
  }

  public final Node getChildAtIndex(int i) {
    return children.get(i);
  }

  public final ImmutableList<Node> children() {
    return ImmutableList.copyOf(children);
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final void addChildToBack(Node child) {
    checkArgument(child.parent == null, "%s is already attached", child);
    child.parent = this;
    children.add(child);
  }

  public final Node setLineno(int lineno) {
    this.lineno = lineno;
    return this;
  }

  public final Node setCharno(int charno) {
    this.charno = charno;
    return this;
  }

  /** Line of the node, 1-based, or -1 if unknown. */
  public final int getLineno() {
    return lineno;
  }

  /** Column of the node, 0-based, or -1 if unknown. */
  public final int getCharno() {
    return charno;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isGetAttr() {
    return token == Token.GETATTR;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isClass() {
    return token == Token.CLASS;
  }

  public final boolean isTuple() {
    return token == Token.TUPLE;
  }

  public final boolean isKeyword() {
    return token == Token.KEYWORD;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(token.toString());
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (token == Token.CONST) {
      sb.append(' ').append(constantValue);
    }
    if (lineno != -1) {
      sb.append(" [").append(lineno).append(':').append(charno).append(']');
    }
    return sb.toString();
  }
}
