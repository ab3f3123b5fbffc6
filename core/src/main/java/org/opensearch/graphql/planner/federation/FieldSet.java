/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.federation;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.graphql.planner.exceptions.FailedParsingQueryException;
import org.opensearch.graphql.planner.exceptions.FailedParsingSchemaException;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.parser.QueryParser;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.InlineFragment;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.query.SelectionPrinter;

/**
 * The selection of a {@code @key}, {@code @requires} or {@code @provides} directive in canonical
 * form: fields sorted by response name at every level, inline fragments after fields. Two field
 * sets are equal when their canonical text is equal.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FieldSet {

  private static final Comparator<Selection> CANONICAL_ORDER =
      Comparator.comparing(FieldSet::sortKey);

  private final ImmutableList<Selection> selections;

  @EqualsAndHashCode.Include private final String text;

  private FieldSet(List<Selection> selections) {
    this.selections = ImmutableList.copyOf(selections);
    this.text = SelectionPrinter.printSelectionSet(selections);
  }

  /**
   * Parse a field set argument, with or without surrounding braces.
   *
   * @throws FailedParsingSchemaException if the text is not a valid selection set
   */
  public static FieldSet parse(String fieldSetText) {
    String trimmed = fieldSetText.trim();
    String query = trimmed.startsWith("{") ? trimmed : "{" + trimmed + "}";
    try {
      List<Selection> selections =
          new QueryParser().parse(query).getOperation(null).getSelectionSet();
      if (selections.isEmpty()) {
        throw new FailedParsingSchemaException("Empty field set: " + fieldSetText);
      }
      return new FieldSet(canonicalize(selections));
    } catch (FailedParsingQueryException | InvalidQueryException e) {
      throw new FailedParsingSchemaException("Malformed field set \"" + fieldSetText + "\"", e);
    }
  }

  public int size() {
    return selections.size();
  }

  private static List<Selection> canonicalize(List<Selection> selections) {
    return selections.stream()
        .map(
            selection -> {
              if (selection instanceof FieldSelection field && field.hasSelectionSet()) {
                return field.withSelectionSet(canonicalize(field.getSelectionSet()));
              } else if (selection instanceof InlineFragment fragment) {
                return fragment.withSelectionSet(canonicalize(fragment.getSelectionSet()));
              }
              return selection;
            })
        .sorted(CANONICAL_ORDER)
        .collect(Collectors.toList());
  }

  private static String sortKey(Selection selection) {
    if (selection instanceof FieldSelection field) {
      return "0" + field.getResponseName();
    }
    return "1" + SelectionPrinter.printSelection(selection);
  }

  @Override
  public String toString() {
    return text;
  }
}
