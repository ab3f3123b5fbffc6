/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/** One operation of a query document. The name is null for anonymous operations. */
@Getter
@ToString
public class OperationDefinition {

  private final OperationType type;
  private final String name;
  private final ImmutableList<VariableDefinition> variableDefinitions;
  private final ImmutableList<Selection> selectionSet;

  public OperationDefinition(
      OperationType type,
      String name,
      List<VariableDefinition> variableDefinitions,
      List<Selection> selectionSet) {
    this.type = type;
    this.name = name;
    this.variableDefinitions = ImmutableList.copyOf(variableDefinitions);
    this.selectionSet = ImmutableList.copyOf(selectionSet);
  }

  public Optional<VariableDefinition> getVariableDefinition(String variableName) {
    return variableDefinitions.stream().filter(v -> v.getName().equals(variableName)).findFirst();
  }
}
