/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.federation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.graphql.planner.TestSchemas;
import org.opensearch.graphql.planner.exceptions.FailedParsingSchemaException;
import org.opensearch.graphql.planner.parser.SchemaParser;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FederationMetadataResolverTest {

  private FederationIndex index;

  @BeforeEach
  void setUp() {
    index = resolve(TestSchemas.load(TestSchemas.SUPERGRAPH));
  }

  @Test
  void graphs_are_read_in_declaration_order() {
    assertEquals(
        List.of("accounts", "products", "reviews", "inventory"),
        List.copyOf(index.getGraphNames()));
    assertEquals("http://reviews:4002/graphql", index.getGraphs().get("reviews"));
  }

  @Test
  void owned_types_have_a_base_service() {
    assertEquals(Optional.of("accounts"), index.getBaseService("User"));
    assertEquals(Optional.of("products"), index.getBaseService("Product"));
    assertEquals(Optional.empty(), index.getBaseService("Address"));
    assertTrue(index.isEntity("Product"));
  }

  @Test
  void keys_are_kept_per_subgraph() {
    assertEquals(List.of(FieldSet.parse("id")), index.getKeys("User", "reviews"));
    assertEquals(List.of(FieldSet.parse("upc")), index.getKeys("Product", "inventory"));
    assertEquals(List.of(), index.getKeys("User", "inventory"));
  }

  @Test
  void field_directives_are_indexed() {
    assertEquals(Optional.of("reviews"), index.getFieldOwner("User", "reviews"));
    assertEquals(Optional.empty(), index.getFieldOwner("User", "name"));
    assertEquals(
        Optional.of(FieldSet.parse("weight price")),
        index.getRequires("Product", "shippingEstimate"));
    assertEquals(Optional.of(FieldSet.parse("username")), index.getProvides("Review", "author"));
  }

  @Test
  void unowned_object_types_are_value_types() {
    assertTrue(index.isValueType("Address"));
    assertFalse(index.isValueType("User"));
    assertFalse(index.isValueType("Query"));
    assertEquals(Set.of("Address"), index.getValueTypes());
  }

  @Test
  void unknown_graph_is_rejected() {
    FailedParsingSchemaException exception =
        assertThrows(
            FailedParsingSchemaException.class,
            () ->
                resolve(
                    "schema @graph(name: \"a\", url: \"http://a\") { query: Query }"
                        + " type Query { t: T @resolve(graph: \"b\") }"
                        + " type T @owner(graph: \"a\") { id: ID }"));
    assertEquals("Unknown graph \"b\" referenced on field Query.t", exception.getMessage());
  }

  @Test
  void graphs_need_not_be_declared() {
    FederationIndex undeclared =
        resolve(
            "type Query { t: T @resolve(graph: \"a\") }"
                + " type T @owner(graph: \"a\") { id: ID }");

    assertEquals(Optional.of("a"), undeclared.getFieldOwner("Query", "t"));
    assertTrue(undeclared.getGraphNames().isEmpty());
  }

  @Test
  void key_without_fields_is_rejected() {
    assertThrows(
        FailedParsingSchemaException.class,
        () ->
            resolve(
                "type Query { a: Int }"
                    + " type T @owner(graph: \"a\") @key(graph: \"a\") { id: ID }"));
  }

  @Test
  void malformed_field_set_is_rejected() {
    assertThrows(
        FailedParsingSchemaException.class,
        () ->
            resolve(
                "type Query { a: Int }"
                    + " type T @owner(graph: \"a\")"
                    + " @key(fields: \"id {\", graph: \"a\") { id: ID }"));
  }

  private static FederationIndex resolve(String sdl) {
    return new FederationMetadataResolver().resolve(new SchemaParser().parse(sdl));
  }
}
