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
package com.google.python.interpreter;

import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/** A host object whose members can be enumerated and looked up by name. */
public interface MemberContainer {

  /** Returns the named member, or null if the container does not define it. */
  @Nullable Member getMember(ModuleContext context, String name);

  ImmutableSet<String> getMemberNames(ModuleContext moduleContext);
}
