/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import graphql.language.Value;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.graphql.planner.schema.TypeReference;

/** A variable declared by an operation, e.g. {@code $first: Int = 5}. */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class VariableDefinition {

  @EqualsAndHashCode.Include private final String name;
  @EqualsAndHashCode.Include private final TypeReference type;
  private final Value<?> defaultValue;

  public VariableDefinition(String name, TypeReference type, Value<?> defaultValue) {
    this.name = name;
    this.type = type;
    this.defaultValue = defaultValue;
  }

  /** Prints the definition as it appears in an operation header. */
  @Override
  public String toString() {
    String text = "$" + name + ":" + type;
    return defaultValue == null ? text : text + "=" + ValuePrinter.print(defaultValue);
  }
}
