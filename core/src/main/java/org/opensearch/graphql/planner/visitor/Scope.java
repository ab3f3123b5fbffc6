/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.visitor;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.graphql.planner.schema.TypeDefinition;

/**
 * The type context of a selection: the type its fields are selected on, the object types it can
 * have at runtime given every enclosing type condition, and the enclosing scope.
 */
@Getter
@RequiredArgsConstructor
public class Scope {

  private final TypeDefinition parentType;
  private final ImmutableList<TypeDefinition> possibleTypes;
  private final Scope enclosingScope;

  /** Returns true if a value of the given object type can be selected in this scope. */
  public boolean isPossibleType(TypeDefinition type) {
    return possibleTypes.contains(type);
  }

  @Override
  public String toString() {
    return parentType.getName() + possibleTypes.stream().map(TypeDefinition::getName).toList();
  }
}
