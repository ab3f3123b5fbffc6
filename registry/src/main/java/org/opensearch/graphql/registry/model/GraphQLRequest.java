/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.registry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Body of a GraphQL http POST. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class GraphQLRequest {

  private final String query;

  private final Map<String, Object> variables;

  public GraphQLRequest(String query) {
    this(query, Map.of());
  }
}
