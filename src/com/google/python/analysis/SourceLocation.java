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

import com.google.auto.value.AutoValue;
import com.google.python.parsing.Node;
import org.jspecify.annotations.Nullable;

/** A position in a project file. Lines and columns are -1 when unknown. */
@AutoValue
public abstract class SourceLocation {

  public static SourceLocation create(@Nullable String filePath, int line, int column) {
    return new AutoValue_SourceLocation(filePath, line, column);
  }

  public static SourceLocation of(@Nullable String filePath, Node node) {
    return create(filePath, node.getLineno(), node.getCharno());
  }

  /** The location of {@code node} in the file the unit belongs to. */
  public static SourceLocation of(AnalysisUnit unit, Node node) {
    return of(unit.getProjectEntry().getFilePath(), node);
  }

  public abstract @Nullable String filePath();

  public abstract int line();

  public abstract int column();
}
