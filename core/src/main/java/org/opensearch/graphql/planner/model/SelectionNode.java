/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A selection of an entity representation, as found in {@link FetchNode#getRequires()}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = FieldNode.class, name = FieldNode.KIND),
  @JsonSubTypes.Type(value = InlineFragmentNode.class, name = InlineFragmentNode.KIND)
})
public interface SelectionNode {}
