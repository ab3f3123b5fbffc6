/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.visitor;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.graphql.planner.query.Directive;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.SelectionPrinter;
import org.opensearch.graphql.planner.schema.FieldDefinition;
import org.opensearch.graphql.planner.schema.TypeDefinition;

/**
 * A field reached while walking a selection set, together with its scope and definition. The
 * conditions are the {@code @skip}/{@code @include} directives of the inline fragments the field
 * was collected through; they are re-applied as inline fragment wrappers when the field is printed.
 */
@Getter
public class CollectedField {

  private final Scope scope;
  private final FieldSelection fieldNode;
  private final FieldDefinition fieldDef;
  private final ImmutableList<Directive> conditions;

  public CollectedField(Scope scope, FieldSelection fieldNode, FieldDefinition fieldDef) {
    this(scope, fieldNode, fieldDef, ImmutableList.of());
  }

  public CollectedField(
      Scope scope, FieldSelection fieldNode, FieldDefinition fieldDef, List<Directive> conditions) {
    this.scope = scope;
    this.fieldNode = fieldNode;
    this.fieldDef = fieldDef;
    this.conditions = ImmutableList.copyOf(conditions);
  }

  public TypeDefinition getParentType() {
    return scope.getParentType();
  }

  public String getResponseName() {
    return fieldNode.getResponseName();
  }

  /**
   * Fields with equal response keys are printed as a single field whose sub-selections are merged.
   */
  public String getResponseKey() {
    return getResponseName()
        + SelectionPrinter.printDirectives(fieldNode.getDirectives())
        + "|"
        + SelectionPrinter.printDirectives(conditions);
  }

  public CollectedField withScope(Scope newScope, FieldDefinition newFieldDef) {
    return new CollectedField(newScope, fieldNode, newFieldDef, conditions);
  }

  public CollectedField withFieldNode(FieldSelection newFieldNode) {
    return new CollectedField(scope, newFieldNode, fieldDef, conditions);
  }

  @Override
  public String toString() {
    return scope.getParentType().getName() + "." + SelectionPrinter.printSelection(fieldNode);
  }
}
