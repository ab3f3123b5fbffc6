/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Nodes that may execute concurrently. */
@Getter
@EqualsAndHashCode
@ToString
public class ParallelNode implements PlanNode {

  public static final String KIND = "Parallel";

  private final ImmutableList<PlanNode> nodes;

  @JsonCreator
  public ParallelNode(@JsonProperty("nodes") List<PlanNode> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }
}
