/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.schema;

/** The kinds of named types a schema can define. */
public enum TypeKind {
  OBJECT,
  INTERFACE,
  UNION,
  SCALAR,
  ENUM,
  INPUT_OBJECT;

  /** Returns true for types that have selectable fields. */
  public boolean isComposite() {
    return this == OBJECT || this == INTERFACE || this == UNION;
  }

  /** Returns true for types whose runtime type is one of several object types. */
  public boolean isAbstract() {
    return this == INTERFACE || this == UNION;
  }
}
