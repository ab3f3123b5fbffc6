/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** The plan of one operation. Its JSON form is the JSON of the root node. */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class QueryPlan {

  private final PlanNode node;

  /** Returns true for plans that call no subgraph. */
  public boolean isEmpty() {
    return node instanceof SequenceNode sequence && sequence.getNodes().isEmpty();
  }
}
