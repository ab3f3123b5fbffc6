/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A named fragment, either declared by the client or produced by autofragmentization. */
@Getter
@EqualsAndHashCode
public class FragmentDefinition {

  private final String name;
  private final String typeCondition;
  private final ImmutableList<Selection> selectionSet;

  public FragmentDefinition(String name, String typeCondition, List<Selection> selectionSet) {
    this.name = name;
    this.typeCondition = typeCondition;
    this.selectionSet = ImmutableList.copyOf(selectionSet);
  }

  public FragmentDefinition withSelectionSet(List<Selection> newSelectionSet) {
    return new FragmentDefinition(name, typeCondition, newSelectionSet);
  }

  @Override
  public String toString() {
    return SelectionPrinter.printFragmentDefinition(this);
  }
}
