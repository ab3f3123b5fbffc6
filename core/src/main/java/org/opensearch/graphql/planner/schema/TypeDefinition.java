/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.opensearch.graphql.planner.query.Directive;

/**
 * A named type of the schema. Extensions ({@code extend type}) are already merged in: the fields,
 * interfaces, union members and directives of every declaration of the name appear here in the
 * order they were declared.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TypeDefinition {

  @EqualsAndHashCode.Include private final String name;
  private final TypeKind kind;
  private final ImmutableMap<String, FieldDefinition> fields;
  private final ImmutableList<String> interfaces;
  private final ImmutableList<String> unionMembers;
  private final ImmutableList<Directive> directives;

  public TypeDefinition(
      String name,
      TypeKind kind,
      Map<String, FieldDefinition> fields,
      List<String> interfaces,
      List<String> unionMembers,
      List<Directive> directives) {
    this.name = name;
    this.kind = kind;
    this.fields = ImmutableMap.copyOf(fields);
    this.interfaces = ImmutableList.copyOf(interfaces);
    this.unionMembers = ImmutableList.copyOf(unionMembers);
    this.directives = ImmutableList.copyOf(directives);
  }

  /** Creates a scalar type with no directives. */
  public static TypeDefinition scalar(String name) {
    return new TypeDefinition(
        name, TypeKind.SCALAR, ImmutableMap.of(), List.of(), List.of(), List.of());
  }

  public boolean isComposite() {
    return kind.isComposite();
  }

  public boolean isAbstract() {
    return kind.isAbstract();
  }

  public boolean isObject() {
    return kind == TypeKind.OBJECT;
  }

  public Optional<FieldDefinition> getField(String fieldName) {
    return Optional.ofNullable(fields.get(fieldName));
  }

  /** Returns every directive applied to this type with the given name, in declaration order. */
  public List<Directive> getDirectives(String directiveName) {
    return directives.stream()
        .filter(d -> d.getName().equals(directiveName))
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return kind + " " + name;
  }
}
