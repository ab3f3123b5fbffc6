/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.assembler;

import java.util.ArrayList;
import java.util.List;
import org.opensearch.graphql.planner.model.FieldNode;
import org.opensearch.graphql.planner.model.InlineFragmentNode;
import org.opensearch.graphql.planner.model.SelectionNode;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.InlineFragment;
import org.opensearch.graphql.planner.query.Selection;

/** Converts representation selections into the selection nodes of a fetch's {@code requires}. */
final class RequiresConverter {

  private RequiresConverter() {}

  static List<SelectionNode> toSelectionNodes(List<Selection> selections) {
    List<SelectionNode> nodes = new ArrayList<>();
    for (Selection selection : selections) {
      if (selection instanceof FieldSelection field) {
        nodes.add(
            new FieldNode(
                field.getAlias(),
                field.getName(),
                field.hasSelectionSet() ? toSelectionNodes(field.getSelectionSet()) : null));
      } else if (selection instanceof InlineFragment fragment) {
        if (fragment.getTypeCondition() == null) {
          nodes.addAll(toSelectionNodes(fragment.getSelectionSet()));
        } else {
          nodes.add(
              new InlineFragmentNode(
                  fragment.getTypeCondition(), toSelectionNodes(fragment.getSelectionSet())));
        }
      } else {
        throw new IllegalStateException("Unexpected selection in representation: " + selection);
      }
    }
    return nodes;
  }
}
