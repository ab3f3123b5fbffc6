/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.federation;

/** Directive and argument names of the composed supergraph vocabulary. */
public final class FederationDirectives {

  /** Schema-level subgraph declaration: {@code @graph(name:, url:)}. */
  public static final String GRAPH = "graph";

  /** Type-level base subgraph of an entity: {@code @owner(graph:)}. */
  public static final String OWNER = "owner";

  /** Type-level entity key: {@code @key(fields:, graph:)}. */
  public static final String KEY = "key";

  /** Field-level extension owner: {@code @resolve(graph:)}. */
  public static final String RESOLVE = "resolve";

  public static final String REQUIRES = "requires";
  public static final String PROVIDES = "provides";

  public static final String NAME_ARGUMENT = "name";
  public static final String URL_ARGUMENT = "url";
  public static final String GRAPH_ARGUMENT = "graph";
  public static final String FIELDS_ARGUMENT = "fields";

  private FederationDirectives() {}
}
