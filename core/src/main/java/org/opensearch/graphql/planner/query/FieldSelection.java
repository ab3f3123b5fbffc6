/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A field selection. Leaf fields have a null selection set. */
@Getter
@EqualsAndHashCode
public class FieldSelection implements Selection {

  private final String alias;
  private final String name;
  private final ImmutableList<Argument> arguments;
  private final ImmutableList<Directive> directives;
  private final ImmutableList<Selection> selectionSet;

  public FieldSelection(
      String alias,
      String name,
      List<Argument> arguments,
      List<Directive> directives,
      List<Selection> selectionSet) {
    this.alias = alias;
    this.name = name;
    this.arguments = ImmutableList.copyOf(arguments);
    this.directives = ImmutableList.copyOf(directives);
    this.selectionSet = selectionSet == null ? null : ImmutableList.copyOf(selectionSet);
  }

  /** Creates a leaf field without alias, arguments or directives. */
  public static FieldSelection leaf(String name) {
    return new FieldSelection(null, name, List.of(), List.of(), null);
  }

  /** The key of the field in the response: its alias, or its name when it has none. */
  public String getResponseName() {
    return alias != null ? alias : name;
  }

  public boolean hasSelectionSet() {
    return selectionSet != null;
  }

  public FieldSelection withSelectionSet(List<Selection> newSelectionSet) {
    return new FieldSelection(alias, name, arguments, directives, newSelectionSet);
  }

  public FieldSelection withAlias(String newAlias) {
    return new FieldSelection(newAlias, name, arguments, directives, selectionSet);
  }

  @Override
  public String toString() {
    return SelectionPrinter.printSelection(this);
  }
}
