/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Per-call planning options. */
@Getter
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryPlanningOptions {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /**
   * Factor selection sets that recur within one subgraph operation into named fragments. Off by
   * default.
   */
  private final boolean autoFragmentization;

  public QueryPlanningOptions() {
    this(false);
  }

  @JsonCreator
  public QueryPlanningOptions(@JsonProperty("autoFragmentization") boolean autoFragmentization) {
    this.autoFragmentization = autoFragmentization;
  }

  /**
   * Read options from JSON, e.g. {@code {"autoFragmentization": true}}. Missing properties keep
   * their defaults.
   */
  public static QueryPlanningOptions fromJson(String json) {
    try {
      return OBJECT_MAPPER.readValue(json, QueryPlanningOptions.class);
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed query planning options: " + json, e);
    }
  }
}
