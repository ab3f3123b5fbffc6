/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.exceptions;

/** The supergraph schema could not be parsed or carries malformed federation metadata. */
public class FailedParsingSchemaException extends QueryPlanningException {

  public FailedParsingSchemaException(String message) {
    super(ErrorKind.FAILED_PARSING_SCHEMA, message);
  }

  public FailedParsingSchemaException(String message, Throwable cause) {
    super(ErrorKind.FAILED_PARSING_SCHEMA, message, cause);
  }
}
