/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.exceptions;

import lombok.Getter;

/**
 * Base class of every failure raised by the query planner. Planning either produces one complete
 * plan or throws one of the subclasses; there is no partial result.
 */
@Getter
public abstract class QueryPlanningException extends RuntimeException {

  private final ErrorKind kind;

  protected QueryPlanningException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected QueryPlanningException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /** Kinds of planning failures. */
  public enum ErrorKind {
    /** The supergraph SDL is malformed. Planner construction aborts. */
    FAILED_PARSING_SCHEMA,

    /** The operation text is malformed. */
    FAILED_PARSING_QUERY,

    /** The operation is well formed but cannot be planned against the schema. */
    INVALID_QUERY
  }
}
