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
 * A field of a representation. When set, the alias is the response key the upstream fetch stores
 * the value under; the representation itself is keyed by the field name.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"alias", "name", "selections"})
public class FieldNode implements SelectionNode {

  public static final String KIND = "Field";

  private final String alias;
  private final String name;
  private final ImmutableList<SelectionNode> selections;

  @JsonCreator
  public FieldNode(
      @JsonProperty("alias") String alias,
      @JsonProperty("name") String name,
      @JsonProperty("selections") List<SelectionNode> selections) {
    this.alias = alias;
    this.name = name;
    this.selections = selections == null ? null : ImmutableList.copyOf(selections);
  }
}
