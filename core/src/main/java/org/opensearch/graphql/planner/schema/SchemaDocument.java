/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import org.opensearch.graphql.planner.query.Directive;
import org.opensearch.graphql.planner.query.OperationType;

/**
 * The parsed supergraph schema. Immutable once built; one instance is shared by every planning
 * call of a {@code QueryPlanner}.
 */
@Getter
public class SchemaDocument {

  public static final List<String> BUILT_IN_SCALARS =
      ImmutableList.of("Int", "Float", "String", "Boolean", "ID");

  private final ImmutableMap<String, TypeDefinition> types;
  private final ImmutableMap<OperationType, String> rootTypeNames;
  private final ImmutableList<Directive> schemaDirectives;

  /** Abstract type name to the object types that can appear at runtime, in declaration order. */
  private final ImmutableListMultimap<String, TypeDefinition> possibleTypes;

  public SchemaDocument(
      Map<String, TypeDefinition> types,
      Map<OperationType, String> rootTypeNames,
      List<Directive> schemaDirectives) {
    this.types = ImmutableMap.copyOf(types);
    this.rootTypeNames = ImmutableMap.copyOf(rootTypeNames);
    this.schemaDirectives = ImmutableList.copyOf(schemaDirectives);
    this.possibleTypes = computePossibleTypes(this.types);
  }

  public Optional<TypeDefinition> getType(String name) {
    return Optional.ofNullable(types.get(name));
  }

  /** Returns the type with the given name, failing if the schema does not define it. */
  public TypeDefinition requireType(String name) {
    TypeDefinition type = types.get(name);
    if (type == null) {
      throw new IllegalArgumentException("Type not found: " + name);
    }
    return type;
  }

  public Optional<TypeDefinition> getRootType(OperationType operationType) {
    return Optional.ofNullable(rootTypeNames.get(operationType)).flatMap(this::getType);
  }

  public boolean isRootType(String typeName) {
    return rootTypeNames.containsValue(typeName);
  }

  /**
   * Returns the object types a value of the given type can have at runtime: the type itself for
   * object types, the implementations or members for abstract types, nothing for leaf types.
   */
  public List<TypeDefinition> getPossibleTypes(TypeDefinition type) {
    if (type.isObject()) {
      return ImmutableList.of(type);
    }
    return possibleTypes.get(type.getName());
  }

  private static ImmutableListMultimap<String, TypeDefinition> computePossibleTypes(
      Map<String, TypeDefinition> types) {
    ImmutableListMultimap.Builder<String, TypeDefinition> builder = ImmutableListMultimap.builder();
    for (TypeDefinition type : types.values()) {
      if (type.getKind() == TypeKind.UNION) {
        for (String member : type.getUnionMembers()) {
          TypeDefinition memberType = types.get(member);
          if (memberType != null && memberType.isObject()) {
            builder.put(type.getName(), memberType);
          }
        }
      }
    }
    for (TypeDefinition type : types.values()) {
      if (type.isObject()) {
        for (String iface : type.getInterfaces()) {
          builder.put(iface, type);
        }
      }
    }
    return builder.build();
  }
}
