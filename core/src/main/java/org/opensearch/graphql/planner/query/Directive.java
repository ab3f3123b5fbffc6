/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A directive application, on a schema element or on a selection. */
@Getter
@EqualsAndHashCode
public class Directive {

  public static final String SKIP = "skip";
  public static final String INCLUDE = "include";

  private final String name;
  private final ImmutableList<Argument> arguments;

  public Directive(String name, List<Argument> arguments) {
    this.name = name;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public Optional<Argument> getArgument(String argumentName) {
    return arguments.stream().filter(a -> a.getName().equals(argumentName)).findFirst();
  }

  /** Returns true for {@code @skip} and {@code @include}. */
  public boolean isConditional() {
    return SKIP.equals(name) || INCLUDE.equals(name);
  }

  @Override
  public String toString() {
    return SelectionPrinter.printDirective(this);
  }
}
