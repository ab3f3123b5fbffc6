/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;

/** A parsed executable document: its operations and named fragments. */
@Getter
public class QueryDocument {

  private final ImmutableList<OperationDefinition> operations;
  private final ImmutableMap<String, FragmentDefinition> fragments;

  public QueryDocument(
      List<OperationDefinition> operations, Map<String, FragmentDefinition> fragments) {
    this.operations = ImmutableList.copyOf(operations);
    this.fragments = ImmutableMap.copyOf(fragments);
  }

  /**
   * Selects the operation to plan.
   *
   * @param operationName the operation to plan, or null when the document has a single operation
   * @return the selected operation
   * @throws InvalidQueryException if no operation matches
   */
  public OperationDefinition getOperation(String operationName) {
    if (operationName == null) {
      if (operations.size() != 1) {
        throw new InvalidQueryException(
            "Must provide operation name if query contains multiple operations");
      }
      return operations.get(0);
    }
    return operations.stream()
        .filter(op -> operationName.equals(op.getName()))
        .findFirst()
        .orElseThrow(
            () -> new InvalidQueryException("Unknown operation named \"" + operationName + "\""));
  }

  public Optional<FragmentDefinition> getFragment(String name) {
    return Optional.ofNullable(fragments.get(name));
  }
}
