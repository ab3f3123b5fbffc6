/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.exceptions;

/** The client operation text could not be parsed. */
public class FailedParsingQueryException extends QueryPlanningException {

  public FailedParsingQueryException(String message) {
    super(ErrorKind.FAILED_PARSING_QUERY, message);
  }

  public FailedParsingQueryException(String message, Throwable cause) {
    super(ErrorKind.FAILED_PARSING_QUERY, message, cause);
  }
}
