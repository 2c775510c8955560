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

import com.google.common.base.MoreObjects;

/** Settings of an analysis session. */
public class AnalyzerOptions {
  private LanguageVersion languageVersion = LanguageVersion.V3;
  private AnalysisLimits limits = AnalysisLimits.getDefault();
  private boolean strictHostContract = false;

  public LanguageVersion getLanguageVersion() {
    return languageVersion;
  }

  public void setLanguageVersion(LanguageVersion languageVersion) {
    this.languageVersion = checkNotNull(languageVersion);
  }

  public AnalysisLimits getLimits() {
    return limits;
  }

  public void setLimits(AnalysisLimits limits) {
    this.limits = checkNotNull(limits);
  }

  /**
   * If true, an interpreter object that cannot be classified is an error. Otherwise it is logged
   * and treated as an unknown {@code object}.
   */
  public boolean isStrictHostContract() {
    return strictHostContract;
  }

  public void setStrictHostContract(boolean strictHostContract) {
    this.strictHostContract = strictHostContract;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("languageVersion", languageVersion)
        .add("limits", limits)
        .add("strictHostContract", strictHostContract)
        .toString();
  }
}
