/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.federation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A field of a named type, printed as {@code Type.field}. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public class FieldCoordinate {

  private final String typeName;
  private final String fieldName;

  @Override
  public String toString() {
    return typeName + "." + fieldName;
  }
}
