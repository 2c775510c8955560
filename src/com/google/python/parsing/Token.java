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

/** Node kinds of the source tree. */
public enum Token {
  MODULE,
  SUITE,

  // Statements
  EXPR_RESULT,
  ASSIGN,
  RETURN,
  FUNCTION,
  PARAM_LIST,
  CLASS,
  BASES,
  IF,
  FOR,
  PASS,
  IMPORT,
  IMPORT_FROM,
  IMPORT_NAME,

  // Expressions
  NAME,
  CONST,
  GETATTR,
  GETITEM,
  CALL,
  KEYWORD,
  LIST,
  TUPLE,

  // Placeholder left by the parser where the source could not be parsed.
  ERROR,
}
