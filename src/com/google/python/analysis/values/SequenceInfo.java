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
package com.google.python.analysis.values;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.python.analysis.AnalysisUnit;
import com.google.python.analysis.VariableDef;
import com.google.python.interpreter.BuiltinTypeId;
import com.google.python.interpreter.ModuleContext;
import com.google.python.interpreter.PythonMemberType;
import com.google.python.parsing.Node;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A list or tuple allocated at one node. Element types are tracked as one set shared by all
 * positions.
 */
public class SequenceInfo extends Namespace {
  private final BuiltinClassInfo sequenceType;
  private final Node allocation;
  private final VariableDef indexTypes = new VariableDef();
  private @Nullable IteratorInfo iterator;
  private @Nullable SpecialFunction append;

  public SequenceInfo(BuiltinClassInfo sequenceType, Node allocation) {
    this.sequenceType = checkNotNull(sequenceType);
    this.allocation = checkNotNull(allocation);
  }

  public Node getAllocation() {
    return allocation;
  }

  /** Adds element types; returns true if the element set grew. */
  @CanIgnoreReturnValue
  public boolean addTypes(AnalysisUnit unit, NamespaceSet types) {
    return indexTypes.addTypes(unit, types, unit.getProjectState().getLimits().getIndexTypes());
  }

  /** The element types, without recording a dependency. */
  public NamespaceSet getIndexTypes() {
    return indexTypes.getTypes();
  }

  @Override
  public NamespaceSet getIndex(Node node, AnalysisUnit unit, NamespaceSet index) {
    return indexTypes.getTypes(unit);
  }

  @Override
  public NamespaceSet getEnumeratorTypes(Node node, AnalysisUnit unit) {
    return indexTypes.getTypes(unit);
  }

  @Override
  public NamespaceSet getIterator(Node node, AnalysisUnit unit) {
    if (iterator == null) {
      BuiltinTypeId iteratorId =
          sequenceType.getTypeId() == BuiltinTypeId.TUPLE
              ? BuiltinTypeId.TUPLE_ITERATOR
              : BuiltinTypeId.LIST_ITERATOR;
      iterator =
          new IteratorInfo(indexTypes, sequenceType.getProjectState().getClassInfo(iteratorId));
    }
    return iterator.getSelfSet();
  }

  @Override
  public NamespaceSet getMember(Node node, AnalysisUnit unit, String name) {
    if (name.equals("append") && sequenceType.getTypeId() == BuiltinTypeId.LIST) {
      if (append == null) {
        append = new SpecialFunction("append", this::appendCall);
      }
      return append.getSelfSet();
    }
    return sequenceType.getInstance().getMember(node, unit, name);
  }

  private NamespaceSet appendCall(
      Node node, AnalysisUnit unit, NamespaceSet[] args, String[] argNames) {
    if (args.length > 0) {
      addTypes(unit, args[0]);
    }
    return unit.getProjectState().getNoneInstance().getSelfSet();
  }

  @Override
  public Map<String, NamespaceSet> getAllMembers(ModuleContext moduleContext) {
    return sequenceType.getAllMembers(moduleContext);
  }

  @Override
  public PythonMemberType getMemberType() {
    return PythonMemberType.INSTANCE;
  }

  @Override
  public String getName() {
    return sequenceType.getName();
  }

  @Override
  public String getDescription() {
    return getName() + " of " + getIndexTypes();
  }
}
