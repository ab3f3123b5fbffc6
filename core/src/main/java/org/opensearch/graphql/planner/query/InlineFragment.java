/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** An inline fragment; the type condition is null when the fragment only carries directives. */
@Getter
@EqualsAndHashCode
public class InlineFragment implements Selection {

  private final String typeCondition;
  private final ImmutableList<Directive> directives;
  private final ImmutableList<Selection> selectionSet;

  public InlineFragment(
      String typeCondition, List<Directive> directives, List<Selection> selectionSet) {
    this.typeCondition = typeCondition;
    this.directives = ImmutableList.copyOf(directives);
    this.selectionSet = ImmutableList.copyOf(selectionSet);
  }

  public InlineFragment withSelectionSet(List<Selection> newSelectionSet) {
    return new InlineFragment(typeCondition, directives, newSelectionSet);
  }

  @Override
  public String toString() {
    return SelectionPrinter.printSelection(this);
  }
}
