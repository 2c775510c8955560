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

import com.google.python.interpreter.AsciiString;
import com.google.python.interpreter.BuiltinProperty;
import com.google.python.interpreter.Complex;
import com.google.python.interpreter.Ellipsis;
import com.google.python.interpreter.MemberContainer;
import com.google.python.interpreter.PythonConstant;
import com.google.python.interpreter.PythonFunction;
import com.google.python.interpreter.PythonMethodDescriptor;
import com.google.python.interpreter.PythonModule;
import com.google.python.interpreter.PythonMultipleMembers;
import com.google.python.interpreter.PythonType;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/**
 * The kinds of object an interpreter can hand to the analysis. {@link #classify} probes them in
 * declaration order, so an object implementing several interfaces gets the first kind that fits.
 */
enum HostObjectKind {
  TYPE,
  FUNCTION,
  METHOD_DESCRIPTOR,
  PROPERTY,
  MODULE,
  CONSTANT,
  PRIMITIVE,
  MEMBER_CONTAINER,
  MULTIPLE_MEMBERS,
  UNKNOWN;

  static HostObjectKind classify(@Nullable Object obj) {
    if (obj instanceof PythonType) {
      return TYPE;
    } else if (obj instanceof PythonFunction) {
      return FUNCTION;
    } else if (obj instanceof PythonMethodDescriptor) {
      return METHOD_DESCRIPTOR;
    } else if (obj instanceof BuiltinProperty) {
      return PROPERTY;
    } else if (obj instanceof PythonModule) {
      return MODULE;
    } else if (obj instanceof PythonConstant) {
      return CONSTANT;
    } else if (isPrimitive(obj)) {
      return PRIMITIVE;
    } else if (obj instanceof MemberContainer) {
      return MEMBER_CONTAINER;
    } else if (obj instanceof PythonMultipleMembers) {
      return MULTIPLE_MEMBERS;
    }
    return UNKNOWN;
  }

  /** Values that literals in source code evaluate to, and {@code None}. */
  static boolean isPrimitive(@Nullable Object obj) {
    return obj == null
        || obj instanceof Boolean
        || obj instanceof Integer
        || obj instanceof Long
        || obj instanceof BigInteger
        || obj instanceof Double
        || obj instanceof String
        || obj instanceof Complex
        || obj instanceof AsciiString
        || obj instanceof Ellipsis;
  }
}
