/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner;

import org.opensearch.graphql.planner.model.QueryPlanSerializer;

/** Single-call entry point: schema text and query text in, plan JSON out. */
public final class QueryPlanning {

  private QueryPlanning() {}

  /**
   * Plan a query against a schema and serialize the plan.
   *
   * @param schemaSdl supergraph SDL
   * @param query executable document with a single operation
   * @param options planning options
   * @return compact plan JSON
   */
  public static String plan(String schemaSdl, String query, QueryPlanningOptions options) {
    return QueryPlanSerializer.toJson(QueryPlanner.create(schemaSdl).plan(query, options));
  }
}
