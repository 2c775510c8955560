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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.python.analysis.values.CallDelegate;
import com.google.python.analysis.values.Module;
import com.google.python.analysis.values.Namespace;
import java.util.logging.Logger;

/**
 * Remembers every call override so it can be installed on modules that do not exist yet or are
 * created again.
 *
 * <p>An override for {@code "pkg.Cls"} that names no module is installed on {@code pkg} as
 * {@code "Cls.name"}; it is remembered under both names so adding either module installs it.
 */
final class SpecializationRegistry {
  private static final Logger logger = Logger.getLogger(SpecializationRegistry.class.getName());

  private final ModuleTable modules;
  private final ListMultimap<String, SpecializationInfo> registered = ArrayListMultimap.create();

  SpecializationRegistry(ModuleTable modules) {
    this.modules = checkNotNull(modules);
  }

  void register(String moduleName, String name, CallDelegate delegate, boolean analyze) {
    SpecializationInfo info = SpecializationInfo.create(moduleName, name, delegate, analyze);
    boolean applied = apply(info);
    int lastDot = moduleName.lastIndexOf('.');
    boolean nested = lastDot != -1 && !(modules.getModule(moduleName) instanceof Module);
    synchronized (this) {
      registered.put(moduleName, info);
      if (nested) {
        registered.put(moduleName.substring(0, lastDot), info);
      }
    }
    if (!applied) {
      logger.fine("Deferred specialization of " + moduleName + "." + name);
    }
  }

  /** Installs the overrides remembered for {@code moduleName}. */
  void onModuleAdded(String moduleName) {
    ImmutableList<SpecializationInfo> infos;
    synchronized (this) {
      infos = ImmutableList.copyOf(registered.get(moduleName));
    }
    for (SpecializationInfo info : infos) {
      apply(info);
    }
  }

  /** Installs every remembered override again, after the modules were reloaded. */
  void replayAll() {
    ImmutableSet<SpecializationInfo> infos;
    synchronized (this) {
      infos = ImmutableSet.copyOf(registered.values());
    }
    for (SpecializationInfo info : infos) {
      apply(info);
    }
  }

  private boolean apply(SpecializationInfo info) {
    String moduleName = info.moduleName();
    Namespace module = modules.getModule(moduleName);
    if (module instanceof Module) {
      ((Module) module).specializeFunction(info.name(), info.delegate(), info.analyze());
      return true;
    }
    int lastDot = moduleName.lastIndexOf('.');
    if (lastDot != -1) {
      Namespace outer = modules.getModule(moduleName.substring(0, lastDot));
      if (outer instanceof Module) {
        String qualifiedName = moduleName.substring(lastDot + 1) + "." + info.name();
        ((Module) outer).specializeFunction(qualifiedName, info.delegate(), info.analyze());
        return true;
      }
    }
    return false;
  }
}
