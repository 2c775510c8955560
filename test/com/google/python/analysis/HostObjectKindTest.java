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

import static com.google.common.truth.Truth.assertThat;

import com.google.python.interpreter.AsciiString;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.Complex;
import com.google.python.interpreter.Ellipsis;
import com.google.python.interpreter.FakeInterpreter;
import com.google.python.interpreter.FakeInterpreter.FakeConstant;
import com.google.python.interpreter.FakeInterpreter.FakeFunction;
import com.google.python.interpreter.FakeInterpreter.FakeMethod;
import com.google.python.interpreter.FakeInterpreter.FakeModule;
import com.google.python.interpreter.FakeInterpreter.FakeMultipleMembers;
import com.google.python.interpreter.FakeInterpreter.FakeProperty;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class HostObjectKindTest {
  private final FakeInterpreter interpreter = new FakeInterpreter();

  @Test
  public void testInterpreterObjects() {
    FakeFunction function = new FakeFunction("f");
    assertThat(HostObjectKind.classify(interpreter.type(BuiltinTypeId.INT)))
        .isEqualTo(HostObjectKind.TYPE);
    assertThat(HostObjectKind.classify(function)).isEqualTo(HostObjectKind.FUNCTION);
    assertThat(HostObjectKind.classify(new FakeMethod(function)))
        .isEqualTo(HostObjectKind.METHOD_DESCRIPTOR);
    assertThat(HostObjectKind.classify(new FakeProperty(interpreter.type(BuiltinTypeId.INT))))
        .isEqualTo(HostObjectKind.PROPERTY);
    assertThat(HostObjectKind.classify(new FakeModule("m"))).isEqualTo(HostObjectKind.MODULE);
    assertThat(HostObjectKind.classify(new FakeConstant(interpreter.type(BuiltinTypeId.STR))))
        .isEqualTo(HostObjectKind.CONSTANT);
    assertThat(HostObjectKind.classify(new FakeMultipleMembers(function)))
        .isEqualTo(HostObjectKind.MULTIPLE_MEMBERS);
  }

  @Test
  public void testPrimitives() {
    for (Object value :
        new Object[] {
          true, 1, 2L, BigInteger.TEN, 1.5, "s", Complex.of(1, 2), AsciiString.of("b"),
          Ellipsis.INSTANCE
        }) {
      assertThat(HostObjectKind.classify(value)).isEqualTo(HostObjectKind.PRIMITIVE);
    }
    assertThat(HostObjectKind.classify(null)).isEqualTo(HostObjectKind.PRIMITIVE);
  }

  @Test
  public void testUnknown() {
    assertThat(HostObjectKind.classify(new Object())).isEqualTo(HostObjectKind.UNKNOWN);
    assertThat(HostObjectKind.classify('c')).isEqualTo(HostObjectKind.UNKNOWN);
  }
}
