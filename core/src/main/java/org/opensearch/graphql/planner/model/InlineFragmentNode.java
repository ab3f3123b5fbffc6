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

@Getter
@EqualsAndHashCode
@ToString
@JsonPropertyOrder({"typeCondition", "selections"})
public class InlineFragmentNode implements SelectionNode {

  public static final String KIND = "InlineFragment";

  private final String typeCondition;
  private final ImmutableList<SelectionNode> selections;

  @JsonCreator
  public InlineFragmentNode(
      @JsonProperty("typeCondition") String typeCondition,
      @JsonProperty("selections") List<SelectionNode> selections) {
    this.typeCondition = typeCondition;
    this.selections = ImmutableList.copyOf(selections);
  }
}
