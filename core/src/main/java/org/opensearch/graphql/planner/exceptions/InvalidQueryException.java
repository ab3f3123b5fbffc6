/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.exceptions;

/**
 * The operation parsed but is not valid against the supergraph: an unknown or unserved field, a
 * dangling or circular fragment, a circular {@code @requires} chain, an undeclared variable.
 */
public class InvalidQueryException extends QueryPlanningException {

  public InvalidQueryException(String message) {
    super(ErrorKind.INVALID_QUERY, message);
  }
}
