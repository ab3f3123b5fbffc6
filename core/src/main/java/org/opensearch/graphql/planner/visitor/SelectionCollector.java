/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.visitor;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.opensearch.graphql.planner.query.Directive;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.FragmentSpread;
import org.opensearch.graphql.planner.query.InlineFragment;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.schema.TypeDefinition;

/**
 * Flattens selection sets into the list of fields they select, resolving every field against the
 * scope it appears in. Inline fragments narrow the scope; fragments that cannot apply are dropped.
 * Fragment spreads must have been expanded by {@link FragmentExpander} first.
 */
@RequiredArgsConstructor
public class SelectionCollector {

  private final QueryPlanningContext context;

  /** Collects the fields of a selection set into {@code fields}. */
  public void collectFields(Scope scope, List<Selection> selections, List<CollectedField> fields) {
    collectFields(scope, selections, ImmutableList.of(), fields);
  }

  /**
   * Collects the fields of a selection set into {@code fields}.
   *
   * @param conditions {@code @skip}/{@code @include} directives of the enclosing inline fragments
   */
  public void collectFields(
      Scope scope,
      List<Selection> selections,
      List<Directive> conditions,
      List<CollectedField> fields) {
    for (Selection selection : selections) {
      if (selection instanceof FieldSelection field) {
        fields.add(
            new CollectedField(
                scope, field, context.getFieldDef(scope.getParentType(), field), conditions));
      } else if (selection instanceof InlineFragment fragment) {
        TypeDefinition typeCondition =
            fragment.getTypeCondition() == null
                ? scope.getParentType()
                : context.getType(fragment.getTypeCondition());
        Scope fragmentScope = context.newScope(typeCondition, scope);
        if (fragmentScope.getPossibleTypes().isEmpty()) {
          continue;
        }
        List<Directive> fragmentConditions = new ArrayList<>(conditions);
        fragment.getDirectives().stream()
            .filter(Directive::isConditional)
            .forEach(fragmentConditions::add);
        collectFields(fragmentScope, fragment.getSelectionSet(), fragmentConditions, fields);
      } else if (selection instanceof FragmentSpread spread) {
        throw new IllegalStateException("Unexpanded fragment spread: " + spread.getName());
      }
    }
  }

  /**
   * Collects the fields selected below a group of fields that share a response name. Each field's
   * sub-selection is walked in a fresh scope of the return type.
   */
  public List<CollectedField> collectSubfields(
      TypeDefinition returnType, List<CollectedField> fields) {
    List<CollectedField> subfields = new ArrayList<>();
    for (CollectedField field : fields) {
      if (field.getFieldNode().hasSelectionSet()) {
        collectFields(
            context.newScope(returnType, null), field.getFieldNode().getSelectionSet(), subfields);
      }
    }
    return subfields;
  }
}
