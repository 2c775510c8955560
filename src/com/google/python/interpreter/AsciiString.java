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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/** Value carrier for byte string constants. */
@Immutable
public final class AsciiString {
  @SuppressWarnings("Immutable") // never mutated after construction
  private final byte[] bytes;

  private final String string;

  public AsciiString(byte[] bytes) {
    this.bytes = bytes.clone();
    this.string = new String(bytes, StandardCharsets.ISO_8859_1);
  }

  public static AsciiString of(String value) {
    checkNotNull(value);
    return new AsciiString(value.getBytes(StandardCharsets.ISO_8859_1));
  }

  public byte[] getBytes() {
    return bytes.clone();
  }

  /** The bytes decoded one char per byte. */
  public String getString() {
    return string;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AsciiString && Arrays.equals(bytes, ((AsciiString) o).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "b'" + string + "'";
  }
}
