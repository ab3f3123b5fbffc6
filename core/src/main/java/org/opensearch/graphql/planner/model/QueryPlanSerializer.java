/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;

/**
 * Canonical JSON form of query plans. Property order is fixed, so equal plans serialize to equal
 * text.
 */
public final class QueryPlanSerializer {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final ObjectWriter WRITER = OBJECT_MAPPER.writerFor(PlanNode.class);
  private static final ObjectReader READER = OBJECT_MAPPER.readerFor(PlanNode.class);

  private QueryPlanSerializer() {}

  /** Serializes a plan to compact JSON. */
  public static String toJson(QueryPlan plan) {
    try {
      return WRITER.writeValueAsString(plan.getNode());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize query plan", e);
    }
  }

  /** Serializes a plan to indented JSON. */
  public static String toPrettyJson(QueryPlan plan) {
    try {
      return WRITER.withDefaultPrettyPrinter().writeValueAsString(plan.getNode());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize query plan", e);
    }
  }

  /**
   * Reads a plan from JSON.
   *
   * @throws IllegalArgumentException if the text is not a well-formed plan
   */
  public static QueryPlan fromJson(String json) {
    try {
      PlanNode node = READER.readValue(json);
      if (node == null) {
        throw new IllegalArgumentException("Query plan JSON is empty");
      }
      return new QueryPlan(node);
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed query plan JSON: " + e.getMessage(), e);
    }
  }
}
