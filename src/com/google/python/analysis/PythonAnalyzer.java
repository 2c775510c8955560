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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.python.analysis.values.BuiltinClassInfo;
import com.google.python.analysis.values.BuiltinFunctionInfo;
import com.google.python.analysis.values.BuiltinInstanceInfo;
import com.google.python.analysis.values.BuiltinMethodInfo;
import com.google.python.analysis.values.BuiltinModule;
import com.google.python.analysis.values.BuiltinPropertyInfo;
import com.google.python.analysis.values.CallDelegate;
import com.google.python.analysis.values.ClassInfo;
import com.google.python.analysis.values.ConstantInfo;
import com.google.python.analysis.values.Module;
import com.google.python.analysis.values.ModuleInfo;
import com.google.python.analysis.values.MultipleMemberInfo;
import com.google.python.analysis.values.Namespace;
import com.google.python.analysis.values.NamespaceSet;
import com.google.python.analysis.values.ObjectBuiltinClassInfo;
import com.google.python.analysis.values.ReflectedNamespace;
import com.google.python.analysis.values.SequenceBuiltinClassInfo;
import com.google.python.interpreter.AdvancedPythonType;
import com.google.python.interpreter.AsciiString;
import com.google.python.interpreter.BuiltinProperty;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.Complex;
import com.google.python.interpreter.Ellipsis;
import com.google.python.interpreter.Member;
import com.google.python.interpreter.MemberContainer;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonConstant;
import com.google.python.interpreter.PythonFunction;
import com.google.python.interpreter.PythonInterpreter;
import com.google.python.interpreter.PythonMethodDescriptor;
import com.google.python.interpreter.PythonModule;
import com.google.python.interpreter.PythonMultipleMembers;
import com.google.python.interpreter.PythonType;
import com.google.python.parsing.IR;
import com.google.python.parsing.Node;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The analysis state of one Python project.
 *
 * <p>A host adds a {@link ModuleEntry} per source file, hands it a parsed tree and analyzes it.
 * Modules that are not part of the project are looked up in the {@link PythonInterpreter}, whose
 * objects are turned into namespaces on demand and cached for the life of the analyzer (or until
 * {@link #reloadModules}).
 *
 * <p>Entries may be added, updated and removed from several threads; analysis itself runs on one
 * thread at a time per call to {@link #analyzeQueuedEntries}.
 */
public class PythonAnalyzer {
  private static final Logger logger = Logger.getLogger(PythonAnalyzer.class.getName());

  private static final String GLOBAL_MODULE_NAME = "$global";
  private static final String PACKAGE_MARKER = "__init__.py";
  private static final Joiner DOT_JOINER = Joiner.on('.');

  private final PythonInterpreter interpreter;
  private final AnalyzerOptions options;
  private final ModuleTable modules;
  private final ImportResolver importResolver;
  private final SpecializationRegistry specializations;
  private final ValueCache itemCache = new ValueCache();
  private final Map<MemberContainer, Map<String, NamespaceSet>> allMembersCache =
      new IdentityHashMap<>();
  private final AnalysisQueue queue = new AnalysisQueue();
  private final ConcurrentMap<String, ProjectEntry> entriesByPath = new ConcurrentHashMap<>();
  private final Set<String> analysisDirectories = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
  private final List<AnalysisDirectoriesListener> directoryListeners =
      new CopyOnWriteArrayList<>();
  private final ModuleContext defaultContext;
  private final AnalysisUnit evalUnit;

  private volatile @Nullable IntConsumer reportQueueSize;
  private volatile int reportQueueInterval = 1;

  private KnownTypes types;
  private BuiltinModule builtinModule;
  private ConstantInfo noneInstance;

  public PythonAnalyzer(PythonInterpreter interpreter) {
    this(interpreter, new AnalyzerOptions());
  }

  public PythonAnalyzer(PythonInterpreter interpreter, AnalyzerOptions options) {
    this.interpreter = checkNotNull(interpreter);
    this.options = checkNotNull(options);
    this.modules = new ModuleTable(this, interpreter);
    this.importResolver = new ImportResolver(this, interpreter);
    this.specializations = new SpecializationRegistry(modules);
    this.defaultContext = interpreter.createModuleContext();

    modules.reInit();
    loadKnownTypes();

    ModuleEntry global =
        new ModuleEntry(this, GLOBAL_MODULE_NAME, null, null, interpreter.createModuleContext());
    this.evalUnit = new AnalysisUnit(IR.module(), global.getModuleInfo().getScope(), true);

    BuiltinSpecializations.install(this);
  }

  private void loadKnownTypes() {
    types = new KnownTypes(interpreter);
    Namespace builtins = modules.getModule(options.getLanguageVersion().getBuiltinModuleName());
    checkState(
        builtins instanceof BuiltinModule,
        "Interpreter has no %s module",
        options.getLanguageVersion().getBuiltinModuleName());
    builtinModule = (BuiltinModule) builtins;
    noneInstance =
        (ConstantInfo)
            checkNotNull(
                itemCache.getCached(
                    null, () -> new ConstantInfo(null, getClassInfo(BuiltinTypeId.NONE_TYPE))));
  }

  // Project entries.

  /** Adds a module of the project. A null name is allowed for files outside any package. */
  public ModuleEntry addModule(@Nullable String moduleName, @Nullable String filePath) {
    return addModule(moduleName, filePath, null);
  }

  public ModuleEntry addModule(
      @Nullable String moduleName, @Nullable String filePath, @Nullable AnalysisCookie cookie) {
    ModuleEntry entry =
        new ModuleEntry(this, moduleName, filePath, cookie, interpreter.createModuleContext());
    if (moduleName != null) {
      ModuleReference ref = modules.setModule(moduleName, entry.getModuleInfo());
      // Units that failed to import this name earlier.
      for (AnalysisUnit importer : ref.getReferences()) {
        enqueue(importer);
      }
      specializations.onModuleAdded(moduleName);
    }
    if (filePath != null) {
      entriesByPath.put(filePath, entry);
    }
    logger.fine("Added module " + moduleName + " from " + filePath);
    return entry;
  }

  public AuxiliaryEntry addAuxiliaryFile(String filePath, @Nullable AnalysisCookie cookie) {
    AuxiliaryEntry entry = new AuxiliaryEntry(this, filePath, cookie);
    entriesByPath.put(filePath, entry);
    return entry;
  }

  /**
   * Removes an entry from the project. Units in other modules that depend on it are analyzed again
   * the next time the queue is drained. Removing an entry twice has no further effect.
   */
  public void removeModule(ProjectEntry entry) {
    checkNotNull(entry, "entry");
    if (entry instanceof ModuleEntry) {
      ModuleEntry module = (ModuleEntry) entry;
      String moduleName = module.getModuleName();
      if (moduleName != null) {
        modules.remove(moduleName, module.getModuleInfo());
      }
      for (ProjectEntry other : entriesByPath.values()) {
        if (other instanceof AuxiliaryEntry) {
          ((AuxiliaryEntry) other).removeDependency(module);
        }
      }
    }
    String filePath = entry.getFilePath();
    if (filePath != null) {
      entriesByPath.remove(filePath, entry);
    }
    if (entry instanceof RemovableProjectEntry) {
      ((RemovableProjectEntry) entry).removedFromProject();
    }
  }

  public void removeAuxiliaryFile(AuxiliaryEntry entry) {
    removeModule(entry);
  }

  public @Nullable ProjectEntry getEntryByPath(String filePath) {
    return entriesByPath.get(filePath);
  }

  /** Every module entry of the project, in no particular order. */
  public ImmutableList<ModuleEntry> getModuleEntries() {
    ImmutableSet.Builder<ModuleEntry> result = ImmutableSet.builder();
    for (ModuleReference ref : modules.getReferences().values()) {
      Namespace module = ref.getModule();
      if (module instanceof ModuleInfo) {
        result.add(((ModuleInfo) module).getProjectEntry());
      }
    }
    for (ProjectEntry entry : entriesByPath.values()) {
      if (entry instanceof ModuleEntry) {
        result.add((ModuleEntry) entry);
      }
    }
    return result.build().asList();
  }

  // Module queries.

  /** The modules that can be imported, project and interpreter ones alike. */
  public ImmutableList<MemberResult> getModules(boolean topLevelOnly) {
    return listModules(name -> topLevelOnly && name.indexOf('.') != -1);
  }

  /** The module bound to exactly {@code name}, as a list of zero or one result. */
  public ImmutableList<MemberResult> getModule(String name) {
    return listModules(other -> !other.equals(name));
  }

  private ImmutableList<MemberResult> listModules(Predicate<String> excluded) {
    ImmutableList.Builder<MemberResult> result = ImmutableList.builder();
    for (Map.Entry<String, ModuleReference> entry : modules.getReferences().entrySet()) {
      String name = entry.getKey();
      if (name.trim().isEmpty() || excluded.test(name) || !entry.getValue().isValid()) {
        continue;
      }
      result.add(
          new MemberResult(
              name,
              () -> {
                Namespace module = modules.getModule(name);
                return module == null ? ImmutableList.of() : ImmutableList.of(module);
              }));
    }
    return result.build();
  }

  /**
   * The members of the module {@code names} (a dotted name split at the dots). Without {@code
   * includeMembers} only child packages and members that are modules are returned.
   */
  public ImmutableList<MemberResult> getModuleMembers(
      ModuleContext moduleContext, List<String> names, boolean includeMembers) {
    checkArgument(!names.isEmpty(), "No module name");
    Map<String, List<Namespace>> result = new LinkedHashMap<>();
    if (!includeMembers) {
      ImmutableMap<String, Namespace> children = getChildModules(DOT_JOINER.join(names));
      for (Map.Entry<String, Namespace> child : children.entrySet()) {
        add(result, child.getKey(), child.getValue());
      }
    }
    Module module = null;
    Namespace top = modules.getModule(names.get(0));
    if (top instanceof Module) {
      module = importResolver.importFromModule((Module) top, names, 1);
    }
    if (module != null) {
      if (includeMembers) {
        for (Map.Entry<String, NamespaceSet> member :
            module.getAllMembers(moduleContext).entrySet()) {
          add(result, member.getKey(), member.getValue());
        }
      } else {
        for (Map.Entry<String, Namespace> child :
            module.getChildrenPackages(moduleContext).entrySet()) {
          add(result, child.getKey(), ImmutableList.of(child.getValue()));
        }
        for (Map.Entry<String, NamespaceSet> member :
            module.getAllMembers(moduleContext).entrySet()) {
          if (containsModules(member.getValue())) {
            add(result, member.getKey(), member.getValue());
          }
        }
      }
    }
    ImmutableList.Builder<MemberResult> members = ImmutableList.builder();
    for (Map.Entry<String, List<Namespace>> entry : result.entrySet()) {
      members.add(new MemberResult(entry.getKey(), entry.getValue()));
    }
    return members.build();
  }

  private static void add(
      Map<String, List<Namespace>> result, String name, Iterable<? extends Namespace> values) {
    List<Namespace> list = result.computeIfAbsent(name, n -> new ArrayList<>());
    for (Namespace value : values) {
      if (!list.contains(value)) {
        list.add(value);
      }
    }
  }

  private static void add(Map<String, List<Namespace>> result, String name, Namespace value) {
    add(result, name, ImmutableList.of(value));
  }

  private static boolean containsModules(NamespaceSet values) {
    for (Namespace ns : values) {
      if (ns instanceof Module && !(ns instanceof MultipleMemberInfo)) {
        return true;
      }
      if (ns instanceof MultipleMemberInfo) {
        for (Namespace member : ((MultipleMemberInfo) ns).getMembers()) {
          if (member instanceof Module && !(member instanceof MultipleMemberInfo)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  /**
   * Modules that could provide {@code name} for an auto-import. A {@code true} flag means the
   * module is known to define it; {@code false} that it might.
   */
  public ImmutableList<ExportedMemberInfo> findNameInAllModules(String name) {
    ImmutableList.Builder<ExportedMemberInfo> result = ImmutableList.builder();
    ImmutableMap<String, ModuleReference> refs = modules.getReferences();
    for (Map.Entry<String, ModuleReference> entry : refs.entrySet()) {
      if (entry.getValue().isValid() && packageNameMatches(entry.getKey(), name)) {
        result.add(ExportedMemberInfo.create(entry.getKey(), true));
      }
    }
    for (Map.Entry<String, ModuleReference> entry : refs.entrySet()) {
      ModuleReference ref = entry.getValue();
      if (!ref.isValid()) {
        continue;
      }
      String qualifiedName = entry.getKey() + "." + name;
      Namespace module = ref.getModule();
      boolean defined =
          module instanceof Module && ((Module) module).containsMember(defaultContext, name);
      result.add(ExportedMemberInfo.create(qualifiedName, defined));
    }
    return result.build();
  }

  static boolean packageNameMatches(String moduleName, String name) {
    return moduleName.equals(name) || moduleName.endsWith("." + name);
  }

  // Specializations.

  /**
   * Replaces calls of {@code moduleName.name} with {@code delegate}. The module need not exist
   * yet; the override is installed when it is added. A null result from the delegate means the
   * generic result is used, which is only computed if {@code analyze} is set.
   */
  public void specializeFunction(
      String moduleName, String name, CallDelegate delegate, boolean analyze) {
    checkNotNull(moduleName);
    checkNotNull(name);
    checkNotNull(delegate);
    specializations.register(moduleName, name, delegate, analyze);
  }

  /**
   * Makes {@code moduleName.name} return an instance of {@code returnType}, a name such as {@code
   * thread.LockType}.
   */
  public void specializeFunction(String moduleName, String name, String returnType) {
    int lastDot = returnType.lastIndexOf('.');
    if (lastDot == -1) {
      throw new IllegalArgumentException(
          "Expected module.typename for return type, got '" + returnType + "'");
    }
    String typeModule = returnType.substring(0, lastDot);
    String typeName = returnType.substring(lastDot + 1);
    specializeFunction(
        moduleName,
        name,
        (node, unit, args, argNames) -> {
          Namespace module = modules.getModule(typeModule);
          if (module == null) {
            return null;
          }
          NamespaceSet result = NamespaceSet.EMPTY;
          for (Namespace value : module.getMember(node, unit, typeName)) {
            if (value instanceof ClassInfo) {
              result = result.add(((ClassInfo) value).getInstance());
            } else if (value instanceof BuiltinClassInfo) {
              result = result.add(((BuiltinClassInfo) value).getInstance());
            } else {
              result = result.add(value);
            }
          }
          return result;
        },
        true);
  }

  public void specializeFunction(String moduleName, String name, CallInfoDelegate delegate) {
    checkNotNull(delegate);
    specializeFunction(
        moduleName,
        name,
        (node, unit, args, argNames) -> {
          Iterable<? extends Namespace> result =
              delegate.call(node, CallInfo.create(args, argNames));
          return result == null ? null : NamespaceSet.copyOf(result);
        },
        true);
  }

  /** Calls {@code callback} with each call site of {@code moduleName.name} that is analyzed. */
  public void specializeFunction(String moduleName, String name, Consumer<Node> callback) {
    checkNotNull(callback);
    specializeFunction(
        moduleName,
        name,
        (node, unit, args, argNames) -> {
          callback.accept(node);
          return null;
        },
        true);
  }

  // Analysis directories.

  public ImmutableList<String> getAnalysisDirectories() {
    synchronized (analysisDirectories) {
      return ImmutableList.copyOf(analysisDirectories);
    }
  }

  public void addAnalysisDirectory(String directory) {
    boolean changed;
    synchronized (analysisDirectories) {
      changed = analysisDirectories.add(checkNotNull(directory));
    }
    if (changed) {
      fireAnalysisDirectoriesChanged();
    }
  }

  public void removeAnalysisDirectory(String directory) {
    boolean changed;
    synchronized (analysisDirectories) {
      changed = analysisDirectories.remove(directory);
    }
    if (changed) {
      fireAnalysisDirectoriesChanged();
    }
  }

  public void addAnalysisDirectoriesListener(AnalysisDirectoriesListener listener) {
    directoryListeners.add(checkNotNull(listener));
  }

  public void removeAnalysisDirectoriesListener(AnalysisDirectoriesListener listener) {
    directoryListeners.remove(listener);
  }

  private void fireAnalysisDirectoriesChanged() {
    for (AnalysisDirectoriesListener listener : directoryListeners) {
      listener.analysisDirectoriesChanged(this);
    }
  }

  // Module names.

  /** Converts a file path to a module name, using the files on disk to find packages. */
  public static String pathToModuleName(String path) {
    return pathToModuleName(path, p -> Files.exists(Paths.get(p)));
  }

  /**
   * Converts a file path to a fully qualified module name. Each enclosing directory that contains
   * an {@code __init__.py}, as reported by {@code fileExists}, adds a package to the name.
   */
  public static String pathToModuleName(@Nullable String path, Predicate<String> fileExists) {
    if (path == null) {
      return "";
    }
    Path file = Paths.get(path);
    Path fileName = file.getFileName();
    if (fileName == null) {
      return "";
    }
    String moduleName;
    Path dir;
    if (fileName.toString().equals(PACKAGE_MARKER)) {
      dir = file.getParent();
      if (dir == null || dir.getFileName() == null) {
        return "";
      }
      moduleName = dir.getFileName().toString();
    } else {
      String name = fileName.toString();
      int dot = name.lastIndexOf('.');
      moduleName = dot > 0 ? name.substring(0, dot) : name;
      dir = file;
    }
    while ((dir = dir.getParent()) != null
        && dir.getFileName() != null
        && fileExists.test(dir.resolve(PACKAGE_MARKER).toString())) {
      moduleName = dir.getFileName() + "." + moduleName;
    }
    return moduleName;
  }

  // Analysis.

  /**
   * Calls {@code reportFunction} with the number of queued units every {@code interval} analyzed
   * units, and once when the queue is drained.
   */
  public void setQueueReporting(@Nullable IntConsumer reportFunction, int interval) {
    checkArgument(interval > 0, "interval must be positive: %s", interval);
    this.reportQueueSize = reportFunction;
    this.reportQueueInterval = interval;
  }

  /** Analyzes queued units until the queue is empty or {@code cancel} is requested. */
  @CanIgnoreReturnValue
  public int analyzeQueuedEntries(CancellationToken cancel) {
    return new WorklistAnalyzer(queue, getLimits(), reportQueueSize, reportQueueInterval)
        .analyze(cancel);
  }

  /**
   * Throws away everything learned from the interpreter and from the project, for when the
   * interpreter changed. Project entries stay and are queued for analysis.
   */
  public void reloadModules() {
    logger.info("Reloading modules");
    itemCache.clear();
    synchronized (allMembersCache) {
      allMembersCache.clear();
    }
    modules.reInit();
    loadKnownTypes();
    for (ModuleEntry entry : getModuleEntries()) {
      entry.prepareForAnalysis();
    }
    specializations.replayAll();
  }

  void enqueue(AnalysisUnit unit) {
    if (!unit.isForEval()) {
      queue.addLast(unit);
    }
  }

  void enqueueFirst(AnalysisUnit unit) {
    if (!unit.isForEval()) {
      queue.addFirst(unit);
    }
  }

  int getQueueSize() {
    return queue.size();
  }

  // Interpreter objects.

  /** The namespace for an object of the interpreter. The same object gives the same namespace. */
  public Namespace getNamespaceFromObjects(@Nullable Object attr) {
    Namespace result = lookupNamespace(attr);
    // Still being built further up the stack.
    return result != null ? result : getClassInfo(BuiltinTypeId.OBJECT).getInstance();
  }

  private @Nullable Namespace lookupNamespace(@Nullable Object attr) {
    switch (HostObjectKind.classify(attr)) {
      case TYPE:
        return getBuiltinType((PythonType) attr);
      case FUNCTION:
        return itemCache.getCached(
            attr, () -> new BuiltinFunctionInfo((PythonFunction) attr, this));
      case METHOD_DESCRIPTOR:
        return itemCache.getCached(
            attr, () -> new BuiltinMethodInfo((PythonMethodDescriptor) attr, this));
      case PROPERTY:
        return itemCache.getCached(
            attr, () -> new BuiltinPropertyInfo((BuiltinProperty) attr, this));
      case MODULE:
        return modules.getBuiltinModule((PythonModule) attr);
      case CONSTANT:
      case PRIMITIVE:
        return getConstantNamespace(attr);
      case MEMBER_CONTAINER:
        return itemCache.getCached(
            attr, () -> new ReflectedNamespace((MemberContainer) attr, this));
      case MULTIPLE_MEMBERS:
        return itemCache.getCached(attr, () -> makeMultipleMembers((PythonMultipleMembers) attr));
      case UNKNOWN:
      default:
        return unclassified(checkNotNull(attr));
    }
  }

  private Namespace makeMultipleMembers(PythonMultipleMembers members) {
    List<Namespace> namespaces = new ArrayList<>();
    for (Member member : members.getMembers()) {
      Namespace ns = lookupNamespace(member);
      if (ns != null && !namespaces.contains(ns)) {
        namespaces.add(ns);
      }
    }
    return new MultipleMemberInfo(namespaces);
  }

  private Namespace unclassified(Object obj) {
    logger.severe("Unable to classify interpreter object of " + obj.getClass().getName());
    if (options.isStrictHostContract()) {
      throw new IllegalStateException("Unclassifiable interpreter object: " + obj);
    }
    return getClassInfo(BuiltinTypeId.OBJECT).getInstance();
  }

  /** The value of a literal or an interpreter constant. */
  public NamespaceSet getConstant(@Nullable Object value) {
    return getConstantNamespace(value).getSelfSet();
  }

  private Namespace getConstantNamespace(@Nullable Object value) {
    if (value == null) {
      return noneInstance;
    }
    if (value instanceof PythonConstant) {
      PythonType type = ((PythonConstant) value).getType();
      return checkNotNull(
          itemCache.getCached(value, () -> new ConstantInfo(value, getBuiltinType(type))));
    }
    PythonType type = getTypeFromObject(value);
    if (type == null) {
      return unclassified(value);
    }
    return checkNotNull(
        itemCache.getCached(value, () -> new ConstantInfo(value, getBuiltinType(type))));
  }

  /** The builtin type of a literal value, or null if {@code value} is not one. */
  public @Nullable PythonType getTypeFromObject(@Nullable Object value) {
    boolean is3x = options.getLanguageVersion().is3x();
    if (value == null) {
      return types.get(BuiltinTypeId.NONE_TYPE);
    } else if (value instanceof Boolean) {
      return types.get(BuiltinTypeId.BOOL);
    } else if (value instanceof Integer) {
      return types.get(BuiltinTypeId.INT);
    } else if (value instanceof Long || value instanceof BigInteger) {
      return types.get(is3x ? BuiltinTypeId.INT : BuiltinTypeId.LONG);
    } else if (value instanceof Double) {
      return types.get(BuiltinTypeId.FLOAT);
    } else if (value instanceof String) {
      return types.get(is3x ? BuiltinTypeId.STR : BuiltinTypeId.UNICODE);
    } else if (value instanceof Complex) {
      return types.get(BuiltinTypeId.COMPLEX);
    } else if (value instanceof AsciiString) {
      return types.get(is3x ? BuiltinTypeId.BYTES : BuiltinTypeId.STR);
    } else if (value instanceof Ellipsis) {
      return types.get(BuiltinTypeId.ELLIPSIS);
    }
    return null;
  }

  public BuiltinClassInfo getBuiltinType(PythonType type) {
    Namespace result = itemCache.getCached(type, () -> makeBuiltinType(type));
    checkState(result instanceof BuiltinClassInfo, "Cyclic conversion of %s", type.getName());
    return (BuiltinClassInfo) result;
  }

  private BuiltinClassInfo makeBuiltinType(PythonType type) {
    switch (type.getTypeId()) {
      case LIST:
      case TUPLE:
        return new SequenceBuiltinClassInfo(type, this);
      case OBJECT:
        return new ObjectBuiltinClassInfo(type, this);
      default:
        return new BuiltinClassInfo(type, this);
    }
  }

  public BuiltinInstanceInfo getInstance(PythonType type) {
    return getBuiltinType(type).getInstance();
  }

  /** The instances of {@code returnTypes}, with {@code NoneType} giving the None constant. */
  public NamespaceSet getInstances(Iterable<? extends PythonType> returnTypes) {
    NamespaceSet result = NamespaceSet.EMPTY;
    for (PythonType type : returnTypes) {
      if (type.getTypeId() == BuiltinTypeId.NONE_TYPE) {
        result = result.add(noneInstance);
      } else {
        result = result.add(getInstance(type));
      }
    }
    return result;
  }

  /** Instantiates a generic interpreter type such as {@code List[int]}. */
  public BuiltinClassInfo makeGenericType(AdvancedPythonType generic, PythonType... indexTypes) {
    checkArgument(
        generic.isGenericTypeDefinition(), "%s is not a generic type", generic.getName());
    return getBuiltinType(generic.makeGenericType(indexTypes));
  }

  public BuiltinClassInfo getClassInfo(BuiltinTypeId id) {
    return getBuiltinType(types.get(id));
  }

  public ConstantInfo getNoneInstance() {
    return noneInstance;
  }

  public BuiltinModule getBuiltinModule() {
    return builtinModule;
  }

  /** The members of an interpreter object as namespaces. Computed once per container. */
  public Map<String, NamespaceSet> getAllMembers(
      MemberContainer container, ModuleContext moduleContext) {
    synchronized (allMembersCache) {
      Map<String, NamespaceSet> cached = allMembersCache.get(container);
      if (cached != null) {
        return cached;
      }
    }
    Map<String, NamespaceSet> result = new LinkedHashMap<>();
    for (String name : container.getMemberNames(moduleContext)) {
      Member member = container.getMember(moduleContext, name);
      if (member != null) {
        result.put(name, getNamespaceFromObjects(member).getSelfSet());
      }
    }
    ImmutableMap<String, NamespaceSet> members = ImmutableMap.copyOf(result);
    synchronized (allMembersCache) {
      allMembersCache.putIfAbsent(container, members);
      return allMembersCache.get(container);
    }
  }

  @Nullable Namespace getCached(Object key, Supplier<? extends Namespace> maker) {
    return itemCache.getCached(key, maker);
  }

  /** Applies the overrides of {@code moduleName} to the member {@code qualifiedName}. */
  public NamespaceSet applySpecializations(
      String moduleName, String qualifiedName, NamespaceSet values) {
    ModuleReference ref = modules.getReference(moduleName);
    Namespace module = ref == null ? null : ref.getModule();
    if (module instanceof Module) {
      return ((Module) module).applySpecializations(qualifiedName, values);
    }
    return values;
  }

  // Modules.

  public ModuleTable getModules() {
    return modules;
  }

  /** The module bound to {@code name}, importing it from the interpreter if needed. */
  public @Nullable Namespace tryGetModule(String name) {
    return modules.getModule(name);
  }

  /** Like {@link #tryGetModule}, but only for names the analyzer already knows. */
  public @Nullable Namespace getRegisteredModule(String name) {
    return modules.contains(name) ? modules.getModule(name) : null;
  }

  /** The bound modules named {@code parent.<name>}, keyed by {@code name}. */
  public ImmutableMap<String, Namespace> getChildModules(String parent) {
    String prefix = parent + ".";
    ImmutableMap.Builder<String, Namespace> result = ImmutableMap.builder();
    for (Map.Entry<String, ModuleReference> entry : modules.getReferences().entrySet()) {
      String name = entry.getKey();
      if (!name.startsWith(prefix) || name.indexOf('.', prefix.length()) != -1) {
        continue;
      }
      Namespace module = entry.getValue().getModule();
      if (module != null) {
        result.put(name.substring(prefix.length()), module);
      }
    }
    return result.buildOrThrow();
  }

  @Nullable Namespace resolveModule(String name) {
    return importResolver.resolveModule(name);
  }

  @Nullable Module importBuiltinModule(String name, boolean bottom) {
    return importResolver.importBuiltinModule(name, bottom);
  }

  void addImportReference(String name, AnalysisUnit unit) {
    modules.getOrCreateReference(name).addReference(unit);
  }

  // Settings.

  public AnalysisLimits getLimits() {
    return options.getLimits();
  }

  public LanguageVersion getLanguageVersion() {
    return options.getLanguageVersion();
  }

  public AnalyzerOptions getOptions() {
    return options;
  }

  public PythonInterpreter getInterpreter() {
    return interpreter;
  }

  public ModuleContext getDefaultContext() {
    return defaultContext;
  }

  /** A unit for evaluating expressions outside of any project module. */
  public AnalysisUnit getEvalUnit() {
    return evalUnit;
  }
}
