/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Runs a node on the entities found at a response path and merges its results back there. A
 * {@code "@"} segment stands for every element of a list.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"path", "node"})
public class FlattenNode implements PlanNode {

  public static final String KIND = "Flatten";

  private final ImmutableList<String> path;
  private final PlanNode node;

  @JsonCreator
  public FlattenNode(@JsonProperty("path") List<String> path, @JsonProperty("node") PlanNode node) {
    this.path = ImmutableList.copyOf(path);
    this.node = node;
  }
}
