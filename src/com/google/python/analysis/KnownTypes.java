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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Maps;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.PythonInterpreter;
import com.google.python.interpreter.PythonType;
import java.util.EnumMap;

/** The interpreter's builtin types, fetched once per load. */
final class KnownTypes {
  private final EnumMap<BuiltinTypeId, PythonType> types = Maps.newEnumMap(BuiltinTypeId.class);

  KnownTypes(PythonInterpreter interpreter) {
    for (BuiltinTypeId id : BuiltinTypeId.values()) {
      if (id != BuiltinTypeId.UNKNOWN) {
        types.put(id, checkNotNull(interpreter.getBuiltinType(id), "No builtin type for %s", id));
      }
    }
  }

  PythonType get(BuiltinTypeId id) {
    PythonType type = types.get(id);
    checkState(type != null, "No builtin type for %s", id);
    return type;
  }
}
