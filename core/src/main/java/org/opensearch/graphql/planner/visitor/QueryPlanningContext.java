/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.visitor;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import org.opensearch.graphql.planner.QueryPlanningOptions;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.federation.FederationIndex;
import org.opensearch.graphql.planner.federation.FieldSet;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.OperationDefinition;
import org.opensearch.graphql.planner.query.OperationType;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.query.VariableDefinition;
import org.opensearch.graphql.planner.schema.FieldDefinition;
import org.opensearch.graphql.planner.schema.SchemaDocument;
import org.opensearch.graphql.planner.schema.TypeDefinition;

/**
 * Everything one planning call needs: the shared schema and federation index, the operation being
 * planned with its fragments expanded, and the options of the call. Created per call and never
 * shared between threads.
 */
@Getter
public class QueryPlanningContext {

  private final SchemaDocument schema;
  private final FederationIndex federation;
  private final OperationDefinition operation;
  private final TypeDefinition rootType;
  private final QueryPlanningOptions options;

  /** The root selection set of the operation with every fragment spread expanded. */
  private final ImmutableList<Selection> expandedSelectionSet;

  private final SelectionCollector collector;

  /**
   * Create the context of one planning call.
   *
   * @throws InvalidQueryException if the operation cannot be planned against the schema
   */
  public QueryPlanningContext(
      SchemaDocument schema,
      FederationIndex federation,
      QueryDocument document,
      OperationDefinition operation,
      QueryPlanningOptions options) {
    this.schema = schema;
    this.federation = federation;
    this.operation = operation;
    this.options = options;
    if (operation.getType() == OperationType.SUBSCRIPTION) {
      throw new InvalidQueryException("Subscriptions are not supported by the query planner");
    }
    this.rootType =
        schema
            .getRootType(operation.getType())
            .orElseThrow(
                () ->
                    new InvalidQueryException(
                        "Schema is not configured for " + operation.getType().getKeyword()
                            + " operations"));
    this.expandedSelectionSet =
        ImmutableList.copyOf(new FragmentExpander(document).expand(operation.getSelectionSet()));
    this.collector = new SelectionCollector(this);
  }

  /** Returns the named type, failing with an invalid query error when it is unknown. */
  public TypeDefinition getType(String typeName) {
    return schema
        .getType(typeName)
        .orElseThrow(() -> new InvalidQueryException("Unknown type \"" + typeName + "\""));
  }

  /**
   * Resolve the definition of a selected field.
   *
   * @throws InvalidQueryException if the parent type has no such field
   */
  public FieldDefinition getFieldDef(TypeDefinition parentType, FieldSelection field) {
    if (FieldDefinition.TYPENAME.equals(field.getName())) {
      return FieldDefinition.TYPENAME_FIELD;
    }
    return parentType
        .getField(field.getName())
        .orElseThrow(
            () ->
                new InvalidQueryException(
                    "Cannot query field \"" + field.getName() + "\" on type \""
                        + parentType.getName() + "\""));
  }

  public List<TypeDefinition> getPossibleTypes(TypeDefinition type) {
    return schema.getPossibleTypes(type);
  }

  /**
   * Create the scope of a selection set on the given type. Inside an enclosing scope the possible
   * types are narrowed to those the enclosing scope allows; a narrowing down to the enclosing
   * object type keeps that object type as parent.
   */
  public Scope newScope(TypeDefinition parentType, Scope enclosingScope) {
    List<TypeDefinition> possibleTypes = getPossibleTypes(parentType);
    if (enclosingScope != null) {
      possibleTypes =
          possibleTypes.stream()
              .filter(enclosingScope::isPossibleType)
              .collect(Collectors.toList());
      if (possibleTypes.size() == 1
          && enclosingScope.getParentType().equals(possibleTypes.get(0))) {
        parentType = enclosingScope.getParentType();
      }
    }
    return new Scope(parentType, ImmutableList.copyOf(possibleTypes), enclosingScope);
  }

  public Optional<String> getBaseService(TypeDefinition type) {
    return federation.getBaseService(type.getName());
  }

  /** Returns the subgraph resolving the field: its {@code @resolve} graph, else the base. */
  public Optional<String> getOwningService(TypeDefinition parentType, FieldDefinition fieldDef) {
    Optional<String> owner = federation.getFieldOwner(parentType.getName(), fieldDef.getName());
    return owner.isPresent() ? owner : getBaseService(parentType);
  }

  public boolean isValueType(TypeDefinition type) {
    return federation.isValueType(type.getName());
  }

  public CollectedField typenameField(TypeDefinition parentType) {
    return new CollectedField(
        newScope(parentType, null),
        FieldSelection.leaf(FieldDefinition.TYPENAME),
        FieldDefinition.TYPENAME_FIELD);
  }

  /**
   * Returns {@code __typename} followed by one key of every possible type of {@code parentType}
   * suitable for sending representations from {@code fromService} to {@code toService}. Possible
   * types without a usable key contribute nothing, so a result holding only {@code __typename}
   * means no key exists.
   *
   * <p>Candidate keys are the ones {@code fromService} declares, then the ones {@code toService}
   * declares. A key declared by both wins, then the key with the fewest fields not already in
   * {@code selected}, then the smaller key, then the first declared.
   */
  public List<CollectedField> getKeyFields(
      TypeDefinition parentType,
      String fromService,
      String toService,
      List<CollectedField> selected) {
    List<CollectedField> keyFields = new ArrayList<>();
    keyFields.add(typenameField(parentType));
    for (TypeDefinition possibleType : getPossibleTypes(parentType)) {
      chooseKey(possibleType, fromService, toService, selected)
          .ifPresent(
              key ->
                  collector.collectFields(
                      newScope(possibleType, null), key.getSelections(), keyFields));
    }
    return keyFields;
  }

  /** Returns {@code __typename} followed by every key the subgraph declares for the type. */
  public List<CollectedField> getAllKeyFields(TypeDefinition parentType, String serviceName) {
    List<CollectedField> keyFields = new ArrayList<>();
    keyFields.add(typenameField(parentType));
    for (TypeDefinition possibleType : getPossibleTypes(parentType)) {
      Scope scope = newScope(possibleType, null);
      for (FieldSet key : federation.getKeys(possibleType.getName(), serviceName)) {
        collector.collectFields(scope, key.getSelections(), keyFields);
      }
    }
    return keyFields;
  }

  /**
   * Returns the representation an extension field needs: a key accepted by the owning subgraph
   * plus the field's {@code @requires} selection.
   */
  public List<CollectedField> getRequiredFields(
      TypeDefinition parentType,
      FieldDefinition fieldDef,
      String owningService,
      List<CollectedField> selected) {
    String baseService = getBaseService(parentType).orElse(owningService);
    List<CollectedField> requiredFields =
        getKeyFields(parentType, owningService, baseService, selected);
    federation
        .getRequires(parentType.getName(), fieldDef.getName())
        .ifPresent(
            requires ->
                collector.collectFields(
                    newScope(parentType, null), requires.getSelections(), requiredFields));
    return requiredFields;
  }

  /**
   * Returns the fields a subgraph can serve below a field it resolves without crossing to another
   * subgraph: every key it declares for the return type plus the field's {@code @provides}.
   */
  public List<CollectedField> getProvidedFields(
      TypeDefinition parentType, FieldDefinition fieldDef, String serviceName) {
    TypeDefinition returnType = getType(fieldDef.getType().getNamedType());
    if (!returnType.isComposite()) {
      return List.of();
    }
    List<CollectedField> providedFields = getAllKeyFields(returnType, serviceName);
    federation
        .getProvides(parentType.getName(), fieldDef.getName())
        .ifPresent(
            provides ->
                collector.collectFields(
                    newScope(returnType, null), provides.getSelections(), providedFields));
    return providedFields;
  }

  /**
   * Returns the client's definition of a variable.
   *
   * @throws InvalidQueryException if the operation does not declare it
   */
  public VariableDefinition getVariableDefinition(String variableName) {
    return operation
        .getVariableDefinition(variableName)
        .orElseThrow(
            () ->
                new InvalidQueryException(
                    "Variable \"$" + variableName + "\" is not defined by the operation"));
  }

  private Optional<FieldSet> chooseKey(
      TypeDefinition type, String fromService, String toService, List<CollectedField> selected) {
    List<FieldSet> fromKeys = federation.getKeys(type.getName(), fromService);
    List<FieldSet> toKeys = federation.getKeys(type.getName(), toService);
    Set<FieldSet> candidates = new LinkedHashSet<>(fromKeys);
    candidates.addAll(toKeys);
    List<FieldSet> ordered = new ArrayList<>(candidates);
    return ordered.stream()
        .min(
            Comparator.<FieldSet>comparingInt(
                    key -> fromKeys.contains(key) && toKeys.contains(key) ? 0 : 1)
                .thenComparingInt(key -> missingFieldCount(key, selected))
                .thenComparingInt(FieldSet::size)
                .thenComparingInt(ordered::indexOf));
  }

  private static int missingFieldCount(FieldSet key, List<CollectedField> selected) {
    int missing = 0;
    for (Selection selection : key.getSelections()) {
      if (selection instanceof FieldSelection field
          && selected.stream()
              .noneMatch(
                  f ->
                      f.getConditions().isEmpty()
                          && f.getFieldNode().getName().equals(field.getName())
                          && f.getResponseName().equals(field.getResponseName()))) {
        missing++;
      }
    }
    return missing;
  }
}
