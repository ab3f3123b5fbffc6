/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A node of a query plan. Serialized with a {@code kind} discriminator. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = FetchNode.class, name = FetchNode.KIND),
  @JsonSubTypes.Type(value = SequenceNode.class, name = SequenceNode.KIND),
  @JsonSubTypes.Type(value = ParallelNode.class, name = ParallelNode.KIND),
  @JsonSubTypes.Type(value = FlattenNode.class, name = FlattenNode.KIND)
})
public interface PlanNode {}
