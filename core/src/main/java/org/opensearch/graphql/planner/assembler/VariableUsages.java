/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.assembler;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.opensearch.graphql.planner.query.Argument;
import org.opensearch.graphql.planner.query.Directive;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.FragmentDefinition;
import org.opensearch.graphql.planner.query.InlineFragment;
import org.opensearch.graphql.planner.query.Selection;

/** Finds the variables an operation uses, in the order they first appear in its text. */
final class VariableUsages {

  private VariableUsages() {}

  static List<String> collect(List<Selection> selectionSet, List<FragmentDefinition> fragments) {
    Set<String> variables = new LinkedHashSet<>();
    collect(selectionSet, variables);
    for (FragmentDefinition fragment : fragments) {
      collect(fragment.getSelectionSet(), variables);
    }
    return new ArrayList<>(variables);
  }

  private static void collect(List<Selection> selections, Set<String> variables) {
    for (Selection selection : selections) {
      if (selection instanceof FieldSelection field) {
        field.getArguments().forEach(a -> a.collectVariables(variables));
        collectDirectives(field.getDirectives(), variables);
        if (field.hasSelectionSet()) {
          collect(field.getSelectionSet(), variables);
        }
      } else if (selection instanceof InlineFragment fragment) {
        collectDirectives(fragment.getDirectives(), variables);
        collect(fragment.getSelectionSet(), variables);
      } else {
        collectDirectives(selection.getDirectives(), variables);
      }
    }
  }

  private static void collectDirectives(List<Directive> directives, Set<String> variables) {
    for (Directive directive : directives) {
      for (Argument argument : directive.getArguments()) {
        argument.collectVariables(variables);
      }
    }
  }
}
