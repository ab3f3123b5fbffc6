/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A call to one subgraph. Entity fetches carry the selection of the representations they are sent
 * in {@code requires}; root fetches have none.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"serviceName", "variableUsages", "requires", "operation"})
public class FetchNode implements PlanNode {

  public static final String KIND = "Fetch";

  private final String serviceName;
  private final ImmutableList<String> variableUsages;

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private final ImmutableList<SelectionNode> requires;

  private final String operation;

  @JsonCreator
  public FetchNode(
      @JsonProperty("serviceName") String serviceName,
      @JsonProperty("variableUsages") List<String> variableUsages,
      @JsonProperty("requires") List<SelectionNode> requires,
      @JsonProperty("operation") String operation) {
    this.serviceName = serviceName;
    this.variableUsages =
        variableUsages == null ? ImmutableList.of() : ImmutableList.copyOf(variableUsages);
    this.requires = requires == null ? null : ImmutableList.copyOf(requires);
    this.operation = operation;
  }
}
