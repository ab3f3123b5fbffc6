/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.group;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.opensearch.graphql.planner.query.Directive;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.FragmentSpread;
import org.opensearch.graphql.planner.query.InlineFragment;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.query.SelectionPrinter;
import org.opensearch.graphql.planner.schema.TypeDefinition;
import org.opensearch.graphql.planner.visitor.CollectedField;

/** Turns collected fields back into selection sets. */
public final class SelectionSets {

  private SelectionSets() {}

  /**
   * Builds the selection set of a list of collected fields. Fields whose parent type is not {@code
   * parentType} are wrapped in an inline fragment on their parent type; a null {@code parentType}
   * wraps every field. Fields with the same response key are merged into one. Fields collected
   * through conditional fragments are wrapped in an inline fragment carrying the conditions.
   */
  public static List<Selection> fromFields(List<CollectedField> fields, TypeDefinition parentType) {
    List<Selection> selections = new ArrayList<>();
    for (Map.Entry<TypeDefinition, List<CollectedField>> byType :
        groupBy(fields, CollectedField::getParentType).entrySet()) {
      List<Selection> typeSelections = selectionsOf(byType.getValue());
      if (byType.getKey().equals(parentType)) {
        selections.addAll(typeSelections);
      } else {
        selections.add(new InlineFragment(byType.getKey().getName(), List.of(), typeSelections));
      }
    }
    return selections;
  }

  /**
   * Merges selection sets: fields with the same response name and directives are combined
   * recursively, as are inline fragments with the same type condition and directives.
   */
  public static List<Selection> merge(List<List<Selection>> selectionSets) {
    Map<String, List<Selection>> byKey = new LinkedHashMap<>();
    for (List<Selection> selectionSet : selectionSets) {
      for (Selection selection : selectionSet) {
        byKey.computeIfAbsent(mergeKey(selection), k -> new ArrayList<>()).add(selection);
      }
    }
    List<Selection> merged = new ArrayList<>();
    for (List<Selection> group : byKey.values()) {
      Selection first = group.get(0);
      if (first instanceof FieldSelection field && field.hasSelectionSet()) {
        merged.add(field.withSelectionSet(merge(subSelectionSets(group))));
      } else if (first instanceof InlineFragment fragment) {
        merged.add(fragment.withSelectionSet(merge(subSelectionSets(group))));
      } else {
        merged.add(first);
      }
    }
    return merged;
  }

  private static List<Selection> selectionsOf(List<CollectedField> fields) {
    Map<String, List<Directive>> conditionsByKey = new LinkedHashMap<>();
    Map<String, List<Selection>> selectionsByConditions = new LinkedHashMap<>();
    for (List<CollectedField> sameKey : groupBy(fields, CollectedField::getResponseKey).values()) {
      List<Directive> conditions = sameKey.get(0).getConditions();
      String conditionsKey = SelectionPrinter.printDirectives(conditions);
      conditionsByKey.putIfAbsent(conditionsKey, conditions);
      selectionsByConditions
          .computeIfAbsent(conditionsKey, k -> new ArrayList<>())
          .add(combine(sameKey));
    }
    List<Selection> selections = new ArrayList<>();
    selectionsByConditions.forEach(
        (conditionsKey, conditioned) -> {
          if (conditionsKey.isEmpty()) {
            selections.addAll(conditioned);
          } else {
            selections.add(
                new InlineFragment(null, conditionsByKey.get(conditionsKey), conditioned));
          }
        });
    return selections;
  }

  private static FieldSelection combine(List<CollectedField> fields) {
    FieldSelection first = fields.get(0).getFieldNode();
    if (!first.hasSelectionSet()) {
      return first;
    }
    List<List<Selection>> selectionSets = new ArrayList<>();
    for (CollectedField field : fields) {
      if (field.getFieldNode().hasSelectionSet()) {
        selectionSets.add(field.getFieldNode().getSelectionSet());
      }
    }
    return first.withSelectionSet(merge(selectionSets));
  }

  private static List<List<Selection>> subSelectionSets(List<Selection> selections) {
    List<List<Selection>> selectionSets = new ArrayList<>();
    for (Selection selection : selections) {
      if (selection instanceof FieldSelection field && field.hasSelectionSet()) {
        selectionSets.add(field.getSelectionSet());
      } else if (selection instanceof InlineFragment fragment) {
        selectionSets.add(fragment.getSelectionSet());
      }
    }
    return selectionSets;
  }

  private static String mergeKey(Selection selection) {
    String directives = SelectionPrinter.printDirectives(selection.getDirectives());
    if (selection instanceof FieldSelection field) {
      return "field:" + field.getResponseName() + directives;
    } else if (selection instanceof InlineFragment fragment) {
      return "fragment:" + fragment.getTypeCondition() + directives;
    }
    return "spread:" + ((FragmentSpread) selection).getName() + directives;
  }

  static <K> Map<K, List<CollectedField>> groupBy(
      List<CollectedField> fields, Function<CollectedField, K> keyFunction) {
    Map<K, List<CollectedField>> groups = new LinkedHashMap<>();
    for (CollectedField field : fields) {
      groups.computeIfAbsent(keyFunction.apply(field), k -> new ArrayList<>()).add(field);
    }
    return groups;
  }
}
