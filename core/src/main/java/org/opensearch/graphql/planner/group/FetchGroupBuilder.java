/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.group;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.federation.FieldCoordinate;
import org.opensearch.graphql.planner.federation.FieldSet;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.OperationType;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.schema.FieldDefinition;
import org.opensearch.graphql.planner.schema.TypeDefinition;
import org.opensearch.graphql.planner.visitor.CollectedField;
import org.opensearch.graphql.planner.visitor.QueryPlanningContext;
import org.opensearch.graphql.planner.visitor.Scope;
import org.opensearch.graphql.planner.visitor.SelectionCollector;

/**
 * Partitions the fields of an operation into fetch groups, one per subgraph call, and links the
 * groups by the dependencies entity representations impose.
 *
 * <p>Group boundaries are inserted at:
 *
 * <ul>
 *   <li>Root fields, one group per subgraph (per consecutive run of a subgraph for mutations)
 *   <li>Entity fields resolved by a subgraph other than the enclosing group's
 *   <li>Extension fields whose {@code @requires} the enclosing group cannot provide
 * </ul>
 *
 * A builder plans a single operation and is not reusable.
 */
@Log4j2
public class FetchGroupBuilder {

  /**
   * Prefix of the alias given to a representation field whose response name the client already
   * uses for a different field.
   */
  private static final String REPRESENTATION_ALIAS_PREFIX = "__rep_";

  private final QueryPlanningContext context;
  private final SelectionCollector collector;
  private final List<FetchGroup> groups = new ArrayList<>();

  /** Extension fields whose {@code @requires} are being planned, outermost first. */
  private final LinkedHashSet<FieldCoordinate> requiresPath = new LinkedHashSet<>();

  private int nextSegment;
  private FetchGroup lastSerialGroup;

  public FetchGroupBuilder(QueryPlanningContext context) {
    this.context = context;
    this.collector = context.getCollector();
  }

  /**
   * Builds the fetch groups of the operation.
   *
   * @return frozen fetch group graph
   * @throws InvalidQueryException if a field cannot be resolved by any subgraph, an entity
   *     boundary has no usable key, or {@code @requires} are circular
   */
  public FetchGroupGraph build() {
    Scope rootScope = context.newScope(context.getRootType(), null);
    List<CollectedField> fields = new ArrayList<>();
    collector.collectFields(rootScope, context.getExpandedSelectionSet(), fields);

    if (context.getOperation().getType() == OperationType.MUTATION) {
      splitFields(ResponsePath.ROOT, fields, null, this::serialRootGroupFor);
    } else {
      Map<String, FetchGroup> rootGroups = new LinkedHashMap<>();
      splitFields(
          ResponsePath.ROOT,
          fields,
          null,
          field ->
              rootGroups.computeIfAbsent(
                  rootServiceFor(field), service -> newFetchGroup(service, ResponsePath.ROOT, 0)));
    }

    List<FetchGroup> merged = new FetchGroupMerger().merge(groups);
    merged.forEach(FetchGroup::freeze);
    FetchGroupGraph graph = new FetchGroupGraph(merged);
    List<String> errors = graph.validate();
    if (!errors.isEmpty()) {
      throw new IllegalStateException("Invalid fetch group graph: " + errors);
    }
    log.debug("Built {} fetch group(s): {}", graph.getGroupCount(), graph.getGroups());
    return graph;
  }

  private FetchGroup serialRootGroupFor(CollectedField field) {
    String service = rootServiceFor(field);
    if (lastSerialGroup == null || !lastSerialGroup.getServiceName().equals(service)) {
      lastSerialGroup = newFetchGroup(service, ResponsePath.ROOT, nextSegment++);
    }
    return lastSerialGroup;
  }

  private String rootServiceFor(CollectedField field) {
    return context
        .getOwningService(field.getParentType(), field.getFieldDef())
        .orElseThrow(() -> notServed(coordinateOf(field)));
  }

  /**
   * Assigns every field to the group returned by {@code groupForField}. Fields selected on an
   * abstract type are assigned once if they all stay in {@code parentGroup}, otherwise once per
   * possible runtime type.
   */
  private void splitFields(
      ResponsePath path,
      List<CollectedField> fields,
      FetchGroup parentGroup,
      Function<CollectedField, FetchGroup> groupForField) {
    for (List<CollectedField> fieldsForResponseKey :
        SelectionSets.groupBy(fields, CollectedField::getResponseKey).values()) {
      for (List<CollectedField> fieldsForParentType :
          SelectionSets.groupBy(fieldsForResponseKey, CollectedField::getParentType).values()) {
        CollectedField field = fieldsForParentType.get(0);
        Scope scope = field.getScope();
        TypeDefinition parentType = field.getParentType();
        FieldDefinition fieldDef = field.getFieldDef();

        if (fieldDef.isIntrospection()
            || (fieldDef.isTypename() && context.getSchema().isRootType(parentType.getName()))) {
          continue;
        }

        if (parentType.isObject() && scope.isPossibleType(parentType)) {
          FetchGroup group = groupForField.apply(field);
          group.addField(completeField(scope, group, path, fieldsForParentType));
          continue;
        }

        Map<FetchGroup, List<TypeDefinition>> runtimeTypesByGroup = new LinkedHashMap<>();
        for (TypeDefinition runtimeType : scope.getPossibleTypes()) {
          CollectedField runtimeField =
              field.withScope(
                  context.newScope(runtimeType, scope),
                  context.getFieldDef(runtimeType, field.getFieldNode()));
          runtimeTypesByGroup
              .computeIfAbsent(groupForField.apply(runtimeField), g -> new ArrayList<>())
              .add(runtimeType);
        }
        if (runtimeTypesByGroup.size() == 1 && runtimeTypesByGroup.containsKey(parentGroup)) {
          parentGroup.addField(completeField(scope, parentGroup, path, fieldsForParentType));
          continue;
        }
        runtimeTypesByGroup.forEach(
            (group, runtimeTypes) -> {
              for (TypeDefinition runtimeType : runtimeTypes) {
                Scope runtimeScope = context.newScope(runtimeType, scope);
                FieldDefinition runtimeFieldDef =
                    context.getFieldDef(runtimeType, field.getFieldNode());
                List<CollectedField> runtimeFields =
                    fieldsForParentType.stream()
                        .map(f -> f.withScope(runtimeScope, runtimeFieldDef))
                        .collect(Collectors.toList());
                group.addField(completeField(runtimeScope, group, path, runtimeFields));
              }
            });
      }
    }
  }

  /**
   * Plans the selection set of a composite field in a nested group of {@code parentGroup} and
   * returns the field with the part of its selection set that stays in {@code parentGroup}.
   */
  private CollectedField completeField(
      Scope scope, FetchGroup parentGroup, ResponsePath path, List<CollectedField> fields) {
    CollectedField field = fields.get(0);
    TypeDefinition returnType = context.getType(field.getFieldDef().getType().getNamedType());
    if (!returnType.isComposite()) {
      return field;
    }

    ResponsePath fieldPath = path.append(field.getResponseName(), field.getFieldDef().getType());
    FetchGroup subGroup = FetchGroup.nested(parentGroup, fieldPath);
    subGroup.addProvidedFields(
        context.getProvidedFields(
            scope.getParentType(), field.getFieldDef(), parentGroup.getServiceName()));
    if (returnType.isAbstract()) {
      subGroup.addField(context.typenameField(returnType));
    }

    List<CollectedField> subfields = collector.collectSubfields(returnType, fields);
    splitFields(
        fieldPath,
        subfields,
        subGroup,
        subfield -> groupForSubfield(subfield, subGroup, fieldPath, subfields));

    List<Selection> selectionSet = SelectionSets.fromFields(subGroup.getFields(), returnType);
    if (selectionSet.isEmpty()) {
      selectionSet = List.of(FieldSelection.leaf(FieldDefinition.TYPENAME));
    }
    return field.withFieldNode(field.getFieldNode().withSelectionSet(selectionSet));
  }

  /**
   * Decides which group fetches a field selected below {@code parentGroup}. {@code siblings} are
   * the client's fields at the same level.
   */
  private FetchGroup groupForSubfield(
      CollectedField field,
      FetchGroup parentGroup,
      ResponsePath path,
      List<CollectedField> siblings) {
    TypeDefinition parentType = field.getParentType();
    FieldDefinition fieldDef = field.getFieldDef();
    if (fieldDef.isTypename() || !parentType.isObject() || context.isValueType(parentType)) {
      return parentGroup;
    }

    FieldCoordinate coordinate = coordinateOf(field);
    String owningService =
        context.getOwningService(parentType, fieldDef).orElseThrow(() -> notServed(coordinate));
    Optional<String> baseService = context.getBaseService(parentType);
    if (baseService.isEmpty()) {
      if (owningService.equals(parentGroup.getServiceName())) {
        return parentGroup;
      }
      throw noKey(coordinate, parentGroup.getServiceName(), owningService);
    }

    if (owningService.equals(baseService.get())) {
      if (owningService.equals(parentGroup.getServiceName()) || parentGroup.provides(field)) {
        return parentGroup;
      }
      List<CollectedField> keyFields =
          keyFields(parentType, parentGroup, owningService, coordinate);
      return dependentGroup(parentGroup, owningService, keyFields, siblings);
    }

    if (!hasKey(parentType, owningService) && !hasKey(parentType, baseService.get())) {
      throw noKey(coordinate, parentGroup.getServiceName(), owningService);
    }
    List<CollectedField> requiredFields =
        context.getRequiredFields(parentType, fieldDef, owningService, parentGroup.getFields());
    if (requiredFields.stream().allMatch(parentGroup::provides)) {
      if (owningService.equals(parentGroup.getServiceName())) {
        return parentGroup;
      }
      return dependentGroup(parentGroup, owningService, requiredFields, siblings);
    }

    FetchGroup provider = parentGroup;
    if (!baseService.get().equals(parentGroup.getServiceName())) {
      List<CollectedField> keyFields =
          keyFields(parentType, parentGroup, baseService.get(), coordinate);
      provider = dependentGroup(parentGroup, baseService.get(), keyFields, siblings);
    }
    return dependentGroupWithRequires(
        provider, owningService, requiredFields, path, coordinate, siblings);
  }

  /**
   * Returns the group of {@code serviceName} depending on {@code parent}, creating it on first use.
   * The required fields become part of the dependent group's representation and are added to the
   * parent's selection, aliased where a sibling already uses their response name.
   */
  private FetchGroup dependentGroup(
      FetchGroup parent,
      String serviceName,
      List<CollectedField> requiredFields,
      List<CollectedField> siblings) {
    List<CollectedField> representation = withoutClashes(requiredFields, siblings);
    FetchGroup group = parent.getDependentGroup(serviceName);
    if (group == null) {
      FetchGroup parentFetch = parent.fetch();
      group = newFetchGroup(serviceName, parent.getMergeAt(), parentFetch.getSegment());
      group.addDependency(parentFetch.getId());
      parent.putDependentGroup(serviceName, group);
    }
    group.addRequiredFields(representation);
    parent.addFields(representation);
    return group;
  }

  /**
   * Like {@link #dependentGroup}, except that required fields {@code provider} cannot fetch are
   * planned in groups of their own, which the dependent group then also depends on.
   */
  private FetchGroup dependentGroupWithRequires(
      FetchGroup provider,
      String serviceName,
      List<CollectedField> requiredFields,
      ResponsePath path,
      FieldCoordinate coordinate,
      List<CollectedField> siblings) {
    List<CollectedField> local = new ArrayList<>();
    List<CollectedField> remote = new ArrayList<>();
    for (CollectedField requiredField : withoutClashes(requiredFields, siblings)) {
      (canFetch(provider, requiredField) ? local : remote).add(requiredField);
    }
    FetchGroup group = dependentGroup(provider, serviceName, local, siblings);
    if (remote.isEmpty()) {
      return group;
    }

    if (!requiresPath.add(coordinate)) {
      throw circularRequires(coordinate);
    }
    try {
      group.addRequiredFields(remote);
      for (CollectedField requiredField : remote) {
        FetchGroup requiredGroup = groupForSubfield(requiredField, provider, path, siblings);
        if (requiredGroup.fetch() == group) {
          throw circularRequires(coordinate);
        }
        requiredGroup.addField(
            completeField(requiredField.getScope(), requiredGroup, path, List.of(requiredField)));
        group.addDependency(requiredGroup.fetch().getId());
      }
    } finally {
      requiresPath.remove(coordinate);
    }
    return group;
  }

  /** Returns true if the subgraph of {@code group} can select the field where the group is. */
  private boolean canFetch(FetchGroup group, CollectedField field) {
    TypeDefinition parentType = field.getParentType();
    if (field.getFieldDef().isTypename()
        || !parentType.isObject()
        || context.isValueType(parentType)
        || group.provides(field)) {
      return true;
    }
    String serviceName = group.getServiceName();
    if (context
        .getOwningService(parentType, field.getFieldDef())
        .map(serviceName::equals)
        .orElse(false)) {
      return true;
    }
    String fieldName = field.getFieldDef().getName();
    for (FieldSet key : context.getFederation().getKeys(parentType.getName(), serviceName)) {
      for (Selection selection : key.getSelections()) {
        if (selection instanceof FieldSelection keyField && keyField.getName().equals(fieldName)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Aliases the representation fields whose response name a sibling uses for another field or
   * other arguments. Merging them with the sibling would build the representation from the
   * client's value.
   */
  private static List<CollectedField> withoutClashes(
      List<CollectedField> representation, List<CollectedField> siblings) {
    List<CollectedField> result = new ArrayList<>(representation.size());
    for (CollectedField field : representation) {
      if (siblings.stream().anyMatch(sibling -> clashes(sibling, field))) {
        FieldSelection node = field.getFieldNode();
        String alias = REPRESENTATION_ALIAS_PREFIX + node.getName();
        result.add(field.withFieldNode(node.withAlias(alias)));
      } else {
        result.add(field);
      }
    }
    return result;
  }

  private static boolean clashes(CollectedField sibling, CollectedField field) {
    FieldSelection siblingNode = sibling.getFieldNode();
    FieldSelection node = field.getFieldNode();
    if (!siblingNode.getResponseName().equals(node.getResponseName())) {
      return false;
    }
    boolean sameField =
        siblingNode.getName().equals(node.getName())
            && siblingNode.getArguments().equals(node.getArguments());
    boolean overlappingTypes =
        sibling.getParentType().equals(field.getParentType())
            || !sibling.getParentType().isObject()
            || !field.getParentType().isObject();
    return !sameField && overlappingTypes;
  }

  private List<CollectedField> keyFields(
      TypeDefinition parentType,
      FetchGroup parentGroup,
      String toService,
      FieldCoordinate coordinate) {
    List<CollectedField> keyFields =
        context.getKeyFields(
            parentType, parentGroup.getServiceName(), toService, parentGroup.getFields());
    if (keyFields.size() == 1) {
      throw noKey(coordinate, parentGroup.getServiceName(), toService);
    }
    return keyFields;
  }

  private boolean hasKey(TypeDefinition type, String serviceName) {
    return !context.getFederation().getKeys(type.getName(), serviceName).isEmpty();
  }

  private FetchGroup newFetchGroup(String serviceName, ResponsePath mergeAt, int segment) {
    FetchGroup group = FetchGroup.fetch(groups.size(), serviceName, mergeAt, segment);
    groups.add(group);
    return group;
  }

  private static FieldCoordinate coordinateOf(CollectedField field) {
    return FieldCoordinate.of(field.getParentType().getName(), field.getFieldDef().getName());
  }

  private static InvalidQueryException notServed(FieldCoordinate coordinate) {
    return new InvalidQueryException(
        "Field \"" + coordinate + "\" is not resolved by any subgraph");
  }

  private static InvalidQueryException noKey(
      FieldCoordinate coordinate, String fromService, String toService) {
    return new InvalidQueryException(
        "Cannot plan field \"" + coordinate + "\": type \"" + coordinate.getTypeName()
            + "\" has no @key usable from subgraph \"" + fromService + "\" to subgraph \""
            + toService + "\"");
  }

  private InvalidQueryException circularRequires(FieldCoordinate coordinate) {
    List<String> cycle = new ArrayList<>();
    requiresPath.forEach(c -> cycle.add(c.toString()));
    cycle.add(coordinate.toString());
    return new InvalidQueryException("circular requires: " + String.join(" -> ", cycle));
  }
}
