/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.parser;

import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.SelectionSet;
import graphql.language.Type;
import graphql.language.TypeName;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.opensearch.graphql.planner.query.Argument;
import org.opensearch.graphql.planner.query.Directive;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.FragmentSpread;
import org.opensearch.graphql.planner.query.InlineFragment;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.schema.TypeReference;

/** Converts graphql-java AST nodes into the planner's immutable model. */
final class AstConverter {

  private AstConverter() {}

  static TypeReference toTypeReference(Type<?> type) {
    if (type instanceof NonNullType nonNull) {
      return TypeReference.nonNull(toTypeReference(nonNull.getType()));
    }
    if (type instanceof ListType list) {
      return TypeReference.listOf(toTypeReference(list.getType()));
    }
    return TypeReference.named(((TypeName) type).getName());
  }

  static List<Directive> toDirectives(List<graphql.language.Directive> directives) {
    return directives.stream()
        .map(d -> new Directive(d.getName(), toArguments(d.getArguments())))
        .collect(Collectors.toList());
  }

  static List<Argument> toArguments(List<graphql.language.Argument> arguments) {
    return arguments.stream()
        .map(a -> new Argument(a.getName(), a.getValue()))
        .collect(Collectors.toList());
  }

  static List<Selection> toSelections(SelectionSet selectionSet) {
    List<Selection> selections = new ArrayList<>();
    for (graphql.language.Selection<?> selection : selectionSet.getSelections()) {
      if (selection instanceof graphql.language.Field field) {
        selections.add(
            new FieldSelection(
                field.getAlias(),
                field.getName(),
                toArguments(field.getArguments()),
                toDirectives(field.getDirectives()),
                field.getSelectionSet() == null ? null : toSelections(field.getSelectionSet())));
      } else if (selection instanceof graphql.language.InlineFragment fragment) {
        selections.add(
            new InlineFragment(
                fragment.getTypeCondition() == null ? null : fragment.getTypeCondition().getName(),
                toDirectives(fragment.getDirectives()),
                toSelections(fragment.getSelectionSet())));
      } else if (selection instanceof graphql.language.FragmentSpread spread) {
        selections.add(new FragmentSpread(spread.getName(), toDirectives(spread.getDirectives())));
      }
    }
    return selections;
  }
}
