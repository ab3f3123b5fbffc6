/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.parser;

import graphql.language.Definition;
import graphql.language.Document;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.graphql.planner.exceptions.FailedParsingQueryException;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.query.FragmentDefinition;
import org.opensearch.graphql.planner.query.OperationDefinition;
import org.opensearch.graphql.planner.query.OperationType;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.query.VariableDefinition;

/** Parses executable documents (operations and fragments). */
@Log4j2
public class QueryParser {

  /**
   * Parse a query document.
   *
   * @param query operation text
   * @return the parsed document
   * @throws FailedParsingQueryException if the text is not syntactically valid GraphQL
   * @throws InvalidQueryException if the document is not executable
   */
  public QueryDocument parse(String query) {
    Document document;
    try {
      document = Parser.parse(query);
    } catch (InvalidSyntaxException e) {
      throw new FailedParsingQueryException("Failed parsing query: " + e.getMessage(), e);
    }

    List<OperationDefinition> operations = new ArrayList<>();
    Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
    for (Definition<?> definition : document.getDefinitions()) {
      if (definition instanceof graphql.language.OperationDefinition operation) {
        operations.add(toOperation(operation));
      } else if (definition instanceof graphql.language.FragmentDefinition fragment) {
        if (fragments.containsKey(fragment.getName())) {
          throw new InvalidQueryException(
              "There can be only one fragment named \"" + fragment.getName() + "\"");
        }
        fragments.put(
            fragment.getName(),
            new FragmentDefinition(
                fragment.getName(),
                fragment.getTypeCondition().getName(),
                AstConverter.toSelections(fragment.getSelectionSet())));
      } else {
        throw new InvalidQueryException(
            "Query must only contain operations and fragments, found "
                + definition.getClass().getSimpleName());
      }
    }
    if (operations.isEmpty()) {
      throw new InvalidQueryException("Query contains no operation");
    }
    log.debug(
        "Parsed query with {} operation(s), {} fragment(s)", operations.size(), fragments.size());
    return new QueryDocument(operations, fragments);
  }

  private OperationDefinition toOperation(graphql.language.OperationDefinition operation) {
    List<VariableDefinition> variables =
        operation.getVariableDefinitions().stream()
            .map(
                v ->
                    new VariableDefinition(
                        v.getName(),
                        AstConverter.toTypeReference(v.getType()),
                        v.getDefaultValue()))
            .collect(Collectors.toList());
    return new OperationDefinition(
        toOperationType(operation.getOperation()),
        operation.getName(),
        variables,
        AstConverter.toSelections(operation.getSelectionSet()));
  }

  private OperationType toOperationType(graphql.language.OperationDefinition.Operation operation) {
    switch (operation) {
      case MUTATION:
        return OperationType.MUTATION;
      case SUBSCRIPTION:
        return OperationType.SUBSCRIPTION;
      default:
        return OperationType.QUERY;
    }
  }
}
