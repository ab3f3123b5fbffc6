/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.schema;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A reference to a type as written in a field or variable declaration, e.g. {@code [User!]!}. */
@Getter
@EqualsAndHashCode
public class TypeReference {

  private final Kind kind;
  private final String name;
  private final TypeReference ofType;

  private TypeReference(Kind kind, String name, TypeReference ofType) {
    this.kind = kind;
    this.name = name;
    this.ofType = ofType;
  }

  public static TypeReference named(String name) {
    Preconditions.checkNotNull(name, "type name");
    return new TypeReference(Kind.NAMED, name, null);
  }

  public static TypeReference listOf(TypeReference ofType) {
    return new TypeReference(Kind.LIST, null, ofType);
  }

  public static TypeReference nonNull(TypeReference ofType) {
    Preconditions.checkArgument(ofType.kind != Kind.NON_NULL, "Non-null of non-null: %s", ofType);
    return new TypeReference(Kind.NON_NULL, null, ofType);
  }

  /** Returns the name of the innermost named type. */
  public String getNamedType() {
    TypeReference type = this;
    while (type.kind != Kind.NAMED) {
      type = type.ofType;
    }
    return type.name;
  }

  public boolean isList() {
    return kind == Kind.LIST;
  }

  public boolean isNonNull() {
    return kind == Kind.NON_NULL;
  }

  /** Prints the reference in SDL form. */
  @Override
  public String toString() {
    switch (kind) {
      case LIST:
        return "[" + ofType + "]";
      case NON_NULL:
        return ofType + "!";
      default:
        return name;
    }
  }

  public enum Kind {
    NAMED,
    LIST,
    NON_NULL
  }
}
