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

/** Nodes executed one after the other. */
@Getter
@EqualsAndHashCode
@ToString
public class SequenceNode implements PlanNode {

  public static final String KIND = "Sequence";

  private final ImmutableList<PlanNode> nodes;

  @JsonCreator
  public SequenceNode(@JsonProperty("nodes") List<PlanNode> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }
}
