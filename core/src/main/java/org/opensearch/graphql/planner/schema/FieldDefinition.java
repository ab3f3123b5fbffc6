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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.graphql.planner.query.Directive;

/** A field declared on an object or interface type. */
@Getter
@EqualsAndHashCode
@ToString
public class FieldDefinition {

  public static final String TYPENAME = "__typename";

  /** The {@code __typename} meta field every composite type exposes. */
  public static final FieldDefinition TYPENAME_FIELD =
      new FieldDefinition(
          TYPENAME,
          TypeReference.nonNull(TypeReference.named("String")),
          ImmutableMap.of(),
          ImmutableList.of());

  private final String name;
  private final TypeReference type;

  /** Argument name to declared argument type, in declaration order. */
  private final ImmutableMap<String, TypeReference> arguments;

  private final ImmutableList<Directive> directives;

  public FieldDefinition(
      String name,
      TypeReference type,
      Map<String, TypeReference> arguments,
      List<Directive> directives) {
    this.name = name;
    this.type = type;
    this.arguments = ImmutableMap.copyOf(arguments);
    this.directives = ImmutableList.copyOf(directives);
  }

  public boolean isTypename() {
    return TYPENAME.equals(name);
  }

  /** Returns true for the {@code __schema} and {@code __type} introspection entry points. */
  public boolean isIntrospection() {
    return name.startsWith("__") && !isTypename();
  }

  public Optional<Directive> getDirective(String directiveName) {
    return directives.stream().filter(d -> d.getName().equals(directiveName)).findFirst();
  }
}
