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

import com.google.python.analysis.values.ModuleInfo;
import com.google.python.interpreter.ModuleContext;
import com.google.python.parsing.Node;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The smallest piece of code analyzed at once: the statements of a module, class or function body
 * evaluated in one scope.
 *
 * <p>Two units are equal if they cover the same node in the same scope. A unit created for
 * evaluation only (see {@link #copyForEval}) reads values without becoming a dependent of them.
 */
public class AnalysisUnit {
  private final Node ast;
  private final InterpreterScope scope;
  private final boolean forEval;

  public AnalysisUnit(Node ast, InterpreterScope scope) {
    this(ast, scope, false);
  }

  AnalysisUnit(Node ast, InterpreterScope scope, boolean forEval) {
    this.ast = checkNotNull(ast);
    this.scope = checkNotNull(scope);
    this.forEval = forEval;
  }

  public Node getAst() {
    return ast;
  }

  public InterpreterScope getScope() {
    return scope;
  }

  public boolean isForEval() {
    return forEval;
  }

  /** A unit over the same code that does not record dependencies. */
  public AnalysisUnit copyForEval() {
    return new AnalysisUnit(ast, scope, true);
  }

  public ModuleInfo getDeclaringModule() {
    return scope.getGlobalScope().getModule();
  }

  public ModuleEntry getProjectEntry() {
    return getDeclaringModule().getProjectEntry();
  }

  public PythonAnalyzer getProjectState() {
    return getProjectEntry().getProjectState();
  }

  public ModuleContext getModuleContext() {
    return getDeclaringModule().getModuleContext();
  }

  /** Evaluates the body once in this unit's scope. */
  public void analyze(CancellationToken cancel) {
    if (cancel.isCancellationRequested()) {
      return;
    }
    StatementEvaluator evaluator = new StatementEvaluator(this);
    switch (ast.getToken()) {
      case MODULE:
        evaluator.walk(ast.children());
        break;
      case FUNCTION:
      case CLASS:
        // The body follows the parameters or bases; a definition without one has nothing to run.
        if (ast.getChildCount() > 1) {
          evaluator.walk(ast.getLastChild().children());
        }
        break;
      default:
        evaluator.visit(ast);
        break;
    }
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (!(o instanceof AnalysisUnit)) {
      return false;
    }
    AnalysisUnit that = (AnalysisUnit) o;
    return ast == that.ast && scope == that.scope && forEval == that.forEval;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(ast), System.identityHashCode(scope), forEval);
  }

  @Override
  public String toString() {
    return "AnalysisUnit(" + ast.getToken() + " in " + scope + ")";
  }
}
