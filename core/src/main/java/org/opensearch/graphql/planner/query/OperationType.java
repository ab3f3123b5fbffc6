/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

/** The operation types of an executable document. */
public enum OperationType {
  QUERY("query"),
  MUTATION("mutation"),
  SUBSCRIPTION("subscription");

  private final String keyword;

  OperationType(String keyword) {
    this.keyword = keyword;
  }

  /** Returns the keyword that starts an operation of this type. */
  public String getKeyword() {
    return keyword;
  }
}
