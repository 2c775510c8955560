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

import com.google.common.base.MoreObjects;
import com.google.common.io.Resources;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Properties;

/**
 * Bounds on how much the analysis tracks. A value set that grows past its limit is replaced by the
 * set of every value. A negative limit means unlimited.
 *
 * <p>Defaults are read from {@code analysis-limits.properties} next to this class.
 */
public class AnalysisLimits {
  static final String DEFAULTS_RESOURCE = "analysis-limits.properties";

  private int assignedTypes = 100;
  private int returnTypes = 20;
  private int instanceMembers = 50;
  private int indexTypes = 30;
  private int maxVisitsPerUnit = 10000;

  /** Limits with the values from the bundled defaults resource. */
  public static AnalysisLimits getDefault() {
    URL url = Resources.getResource(AnalysisLimits.class, DEFAULTS_RESOURCE);
    Properties properties = new Properties();
    try (InputStream in = Resources.asByteSource(url).openStream()) {
      properties.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read " + url, e);
    }
    return new AnalysisLimits().loadFromProperties(properties);
  }

  /** Tighter limits for the large standard library, where precision matters less. */
  public static AnalysisLimits getStandardLibraryLimits() {
    AnalysisLimits limits = getDefault();
    limits.returnTypes = 10;
    limits.instanceMembers = 5;
    limits.indexTypes = 5;
    limits.assignedTypes = 50;
    return limits;
  }

  /** Overrides every limit named in {@code properties}; other limits keep their value. */
  @CanIgnoreReturnValue
  public AnalysisLimits loadFromProperties(Properties properties) {
    assignedTypes = read(properties, "assignedTypes", assignedTypes);
    returnTypes = read(properties, "returnTypes", returnTypes);
    instanceMembers = read(properties, "instanceMembers", instanceMembers);
    indexTypes = read(properties, "indexTypes", indexTypes);
    maxVisitsPerUnit = read(properties, "maxVisitsPerUnit", maxVisitsPerUnit);
    return this;
  }

  private static int read(Properties properties, String key, int defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
    }
  }

  /** Maximum number of values tracked for one variable. */
  public int getAssignedTypes() {
    return assignedTypes;
  }

  public void setAssignedTypes(int assignedTypes) {
    this.assignedTypes = assignedTypes;
  }

  /** Maximum number of values a function is tracked to return. */
  public int getReturnTypes() {
    return returnTypes;
  }

  public void setReturnTypes(int returnTypes) {
    this.returnTypes = returnTypes;
  }

  /** Maximum number of values tracked for one instance attribute. */
  public int getInstanceMembers() {
    return instanceMembers;
  }

  public void setInstanceMembers(int instanceMembers) {
    this.instanceMembers = instanceMembers;
  }

  /** Maximum number of element types tracked for one sequence. */
  public int getIndexTypes() {
    return indexTypes;
  }

  public void setIndexTypes(int indexTypes) {
    this.indexTypes = indexTypes;
  }

  /** How often a single unit may be analyzed in one run before it is dropped. */
  public int getMaxVisitsPerUnit() {
    return maxVisitsPerUnit;
  }

  public void setMaxVisitsPerUnit(int maxVisitsPerUnit) {
    this.maxVisitsPerUnit = maxVisitsPerUnit;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("assignedTypes", assignedTypes)
        .add("returnTypes", returnTypes)
        .add("instanceMembers", instanceMembers)
        .add("indexTypes", indexTypes)
        .add("maxVisitsPerUnit", maxVisitsPerUnit)
        .toString();
  }
}
