/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import graphql.language.StringValue;
import graphql.language.Value;
import java.util.Collection;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A named argument of a field or directive. Two arguments are equal when they print the same. */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Argument {

  @EqualsAndHashCode.Include private final String name;

  private final Value<?> value;

  @EqualsAndHashCode.Include private final String valueText;

  public Argument(String name, Value<?> value) {
    this.name = name;
    this.value = value;
    this.valueText = ValuePrinter.print(value);
  }

  /** Returns the value when it is a string literal. */
  public Optional<String> getStringValue() {
    return value instanceof StringValue string
        ? Optional.of(string.getValue())
        : Optional.empty();
  }

  public void collectVariables(Collection<String> variables) {
    ValuePrinter.collectVariables(value, variables);
  }

  @Override
  public String toString() {
    return name + ":" + valueText;
  }
}
