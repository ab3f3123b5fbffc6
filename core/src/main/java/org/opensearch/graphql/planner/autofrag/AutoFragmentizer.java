/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.autofrag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.FragmentDefinition;
import org.opensearch.graphql.planner.query.FragmentSpread;
import org.opensearch.graphql.planner.query.InlineFragment;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.query.SelectionPrinter;
import org.opensearch.graphql.planner.schema.FieldDefinition;
import org.opensearch.graphql.planner.schema.SchemaDocument;
import org.opensearch.graphql.planner.schema.TypeDefinition;

/**
 * Factors field selection sets that recur within one operation into named fragments. A selection
 * set of at least two selections found below two or more fields of the same type becomes {@code
 * fragment __QueryPlanFragment_N__ on Type}, and every occurrence is replaced by a spread of it.
 * This repeats until nothing recurs. Fragments are numbered from 0 in the pre-order of their first
 * occurrence.
 */
@Log4j2
@RequiredArgsConstructor
public class AutoFragmentizer {

  public static final String FRAGMENT_NAME_PREFIX = "__QueryPlanFragment_";
  public static final String FRAGMENT_NAME_SUFFIX = "__";

  private static final int MIN_SELECTIONS = 2;
  private static final int MIN_OCCURRENCES = 2;

  private final SchemaDocument schema;

  /**
   * Rewrite a selection set.
   *
   * @param selectionSet selections of an operation
   * @param parentType type the selections are made on, or null when every top-level selection is
   *     an inline fragment with a type condition
   * @return the rewritten selection set with the fragments it spreads
   */
  public FragmentizedSelectionSet fragmentize(
      List<Selection> selectionSet, TypeDefinition parentType) {
    List<Selection> current = selectionSet;
    List<FragmentDefinition> fragments = new ArrayList<>();
    while (true) {
      Map<String, Occurrence> occurrences = new LinkedHashMap<>();
      countOccurrences(current, parentType, occurrences);
      for (FragmentDefinition fragment : fragments) {
        countOccurrences(fragment.getSelectionSet(), typeOf(fragment), occurrences);
      }
      Optional<Occurrence> recurring =
          occurrences.values().stream().filter(o -> o.count >= MIN_OCCURRENCES).findFirst();
      if (recurring.isEmpty()) {
        break;
      }

      Occurrence occurrence = recurring.get();
      String name = FRAGMENT_NAME_PREFIX + fragments.size() + FRAGMENT_NAME_SUFFIX;
      FragmentSpread spread = new FragmentSpread(name, List.of());
      current = replace(current, parentType, occurrence.key, spread);
      fragments =
          fragments.stream()
              .map(
                  f ->
                      f.withSelectionSet(
                          replace(f.getSelectionSet(), typeOf(f), occurrence.key, spread)))
              .collect(Collectors.toCollection(ArrayList::new));
      fragments.add(new FragmentDefinition(name, occurrence.typeName, occurrence.selectionSet));
      log.debug("Factored {} occurrences into fragment {}", occurrence.count, name);
    }
    return new FragmentizedSelectionSet(current, fragments);
  }

  private void countOccurrences(
      List<Selection> selections, TypeDefinition type, Map<String, Occurrence> occurrences) {
    for (Selection selection : selections) {
      if (selection instanceof FieldSelection field && field.hasSelectionSet()) {
        TypeDefinition fieldType = fieldTypeOf(type, field);
        List<Selection> subSelections = field.getSelectionSet();
        if (subSelections.size() >= MIN_SELECTIONS) {
          String key = occurrenceKey(fieldType, subSelections);
          occurrences
              .computeIfAbsent(key, k -> new Occurrence(k, fieldType.getName(), subSelections))
              .count++;
        }
        countOccurrences(subSelections, fieldType, occurrences);
      } else if (selection instanceof InlineFragment fragment) {
        countOccurrences(fragment.getSelectionSet(), typeOf(fragment, type), occurrences);
      }
    }
  }

  private List<Selection> replace(
      List<Selection> selections, TypeDefinition type, String key, FragmentSpread spread) {
    List<Selection> replaced = new ArrayList<>(selections.size());
    for (Selection selection : selections) {
      if (selection instanceof FieldSelection field && field.hasSelectionSet()) {
        TypeDefinition fieldType = fieldTypeOf(type, field);
        if (key.equals(occurrenceKey(fieldType, field.getSelectionSet()))) {
          replaced.add(field.withSelectionSet(List.of(spread)));
        } else {
          replaced.add(
              field.withSelectionSet(replace(field.getSelectionSet(), fieldType, key, spread)));
        }
      } else if (selection instanceof InlineFragment fragment) {
        replaced.add(
            fragment.withSelectionSet(
                replace(fragment.getSelectionSet(), typeOf(fragment, type), key, spread)));
      } else {
        replaced.add(selection);
      }
    }
    return replaced;
  }

  private TypeDefinition fieldTypeOf(TypeDefinition parentType, FieldSelection field) {
    if (parentType == null) {
      throw new IllegalStateException("Field " + field.getName() + " selected without a type");
    }
    FieldDefinition fieldDef =
        parentType
            .getField(field.getName())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Unknown field " + parentType.getName() + "." + field.getName()));
    return schema.requireType(fieldDef.getType().getNamedType());
  }

  private TypeDefinition typeOf(InlineFragment fragment, TypeDefinition enclosingType) {
    return fragment.getTypeCondition() == null
        ? enclosingType
        : schema.requireType(fragment.getTypeCondition());
  }

  private TypeDefinition typeOf(FragmentDefinition fragment) {
    return schema.requireType(fragment.getTypeCondition());
  }

  private static String occurrenceKey(TypeDefinition type, List<Selection> selections) {
    return type.getName() + " " + SelectionPrinter.printSelectionSet(selections);
  }

  /** A recurring selection set and the number of fields it was found below. */
  @RequiredArgsConstructor
  private static class Occurrence {
    private final String key;
    private final String typeName;
    private final List<Selection> selectionSet;
    private int count;
  }
}
