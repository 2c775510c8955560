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
import static org.junit.Assert.assertThrows;

import com.google.common.io.Resources;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class AnalysisLimitsTest {

  @Test
  public void testDefaultsMatchBundledResource() {
    AnalysisLimits limits = AnalysisLimits.getDefault();
    assertThat(limits.getAssignedTypes()).isEqualTo(100);
    assertThat(limits.getReturnTypes()).isEqualTo(20);
    assertThat(limits.getInstanceMembers()).isEqualTo(50);
    assertThat(limits.getIndexTypes()).isEqualTo(30);
    assertThat(limits.getMaxVisitsPerUnit()).isEqualTo(10000);
  }

  @Test
  public void testStandardLibraryLimitsAreTighter() {
    AnalysisLimits limits = AnalysisLimits.getStandardLibraryLimits();
    assertThat(limits.getReturnTypes()).isEqualTo(10);
    assertThat(limits.getInstanceMembers()).isEqualTo(5);
    assertThat(limits.getIndexTypes()).isEqualTo(5);
    assertThat(limits.getAssignedTypes()).isEqualTo(50);
  }

  @Test
  public void testLoadOverridesOnlyGivenKeys() throws IOException {
    Properties properties = new Properties();
    try (InputStream in =
        Resources.getResource(AnalysisLimitsTest.class, "testdata/tight-limits.properties")
            .openStream()) {
      properties.load(in);
    }
    AnalysisLimits limits = new AnalysisLimits().loadFromProperties(properties);
    assertThat(limits.getAssignedTypes()).isEqualTo(2);
    assertThat(limits.getReturnTypes()).isEqualTo(2);
    assertThat(limits.getIndexTypes()).isEqualTo(1);
    assertThat(limits.getInstanceMembers()).isEqualTo(50);
  }

  @Test
  public void testInvalidValue() {
    Properties properties = new Properties();
    properties.setProperty("returnTypes", "many");
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> new AnalysisLimits().loadFromProperties(properties));
    assertThat(e).hasMessageThat().contains("returnTypes");
  }

  @Test
  public void testToString() {
    assertThat(new AnalysisLimits().toString()).contains("indexTypes=30");
  }
}
