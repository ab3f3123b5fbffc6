/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.registry;

/** Failure talking to the graph registry: transport, http status, or a GraphQL error reply. */
public class GraphRegistryException extends RuntimeException {

  public GraphRegistryException(String message) {
    super(message);
  }

  public GraphRegistryException(String message, Throwable cause) {
    super(message, cause);
  }
}
