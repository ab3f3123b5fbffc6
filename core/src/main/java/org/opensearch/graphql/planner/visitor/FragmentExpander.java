/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.visitor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.FragmentDefinition;
import org.opensearch.graphql.planner.query.FragmentSpread;
import org.opensearch.graphql.planner.query.InlineFragment;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.query.Selection;

/**
 * Replaces every fragment spread with an inline fragment on the fragment's type condition that
 * carries the spread's directives.
 */
@RequiredArgsConstructor
public class FragmentExpander {

  private final QueryDocument document;

  /**
   * Expand the spreads of a selection set.
   *
   * @throws InvalidQueryException if a spread names an unknown fragment or a fragment spreads
   *     itself
   */
  public List<Selection> expand(List<Selection> selections) {
    return expand(selections, new LinkedHashSet<>());
  }

  private List<Selection> expand(List<Selection> selections, LinkedHashSet<String> spreadPath) {
    List<Selection> expanded = new ArrayList<>(selections.size());
    for (Selection selection : selections) {
      if (selection instanceof FieldSelection field) {
        expanded.add(
            field.hasSelectionSet()
                ? field.withSelectionSet(expand(field.getSelectionSet(), spreadPath))
                : field);
      } else if (selection instanceof InlineFragment fragment) {
        expanded.add(fragment.withSelectionSet(expand(fragment.getSelectionSet(), spreadPath)));
      } else if (selection instanceof FragmentSpread spread) {
        expanded.add(expandSpread(spread, spreadPath));
      }
    }
    return expanded;
  }

  private InlineFragment expandSpread(FragmentSpread spread, LinkedHashSet<String> spreadPath) {
    String name = spread.getName();
    if (spreadPath.contains(name)) {
      throw new InvalidQueryException(
          "Cannot spread fragment \"" + name + "\" within itself via "
              + String.join(" -> ", spreadPath) + " -> " + name);
    }
    FragmentDefinition definition =
        document
            .getFragment(name)
            .orElseThrow(
                () -> new InvalidQueryException("Fragment \"" + name + "\" not found"));
    spreadPath.add(name);
    try {
      return new InlineFragment(
          definition.getTypeCondition(),
          spread.getDirectives(),
          expand(definition.getSelectionSet(), spreadPath));
    } finally {
      spreadPath.remove(name);
    }
  }
}
