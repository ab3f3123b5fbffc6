/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.visitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.graphql.planner.QueryPlanningOptions;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.federation.FederationIndex;
import org.opensearch.graphql.planner.federation.FederationMetadataResolver;
import org.opensearch.graphql.planner.parser.QueryParser;
import org.opensearch.graphql.planner.parser.SchemaParser;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.schema.SchemaDocument;
import org.opensearch.graphql.planner.schema.TypeDefinition;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryPlanningContextTest {

  private static final String SCHEMA =
      "type Query { t: T @resolve(graph: \"a\") u: U @resolve(graph: \"a\") }"
          + " type T @owner(graph: \"a\")"
          + " @key(fields: \"id\", graph: \"a\")"
          + " @key(fields: \"sku\", graph: \"a\")"
          + " @key(fields: \"sku\", graph: \"b\") {"
          + " id: ID sku: String x: Int @resolve(graph: \"b\") }"
          + " type U @owner(graph: \"a\")"
          + " @key(fields: \"id\", graph: \"a\") @key(fields: \"id kind\", graph: \"a\") {"
          + " id: ID kind: String }"
          + " type V { a: Int }";

  private SchemaDocument schema;
  private FederationIndex federation;

  @BeforeEach
  void setUp() {
    schema = new SchemaParser().parse(SCHEMA);
    federation = new FederationMetadataResolver().resolve(schema);
  }

  @Test
  void key_declared_by_both_subgraphs_wins() {
    QueryPlanningContext context = context("{ t { x } }");
    TypeDefinition t = schema.requireType("T");

    assertEquals(List.of("__typename", "sku"), names(context.getKeyFields(t, "a", "b", List.of())));
  }

  @Test
  void first_declared_key_breaks_ties() {
    QueryPlanningContext context = context("{ t { x } }");
    TypeDefinition t = schema.requireType("T");

    assertEquals(List.of("__typename", "id"), names(context.getKeyFields(t, "a", "c", List.of())));
  }

  @Test
  void key_of_selected_fields_is_preferred() {
    QueryPlanningContext context = context("{ t { x } }");
    TypeDefinition t = schema.requireType("T");
    List<CollectedField> selected = new ArrayList<>();
    context
        .getCollector()
        .collectFields(
            context.newScope(t, null), List.<Selection>of(FieldSelection.leaf("sku")), selected);

    assertEquals(List.of("__typename", "sku"), names(context.getKeyFields(t, "a", "c", selected)));
  }

  @Test
  void smaller_key_is_preferred() {
    QueryPlanningContext context = context("{ u { id } }");
    TypeDefinition u = schema.requireType("U");

    assertEquals(List.of("__typename", "id"), names(context.getKeyFields(u, "a", "c", List.of())));
  }

  @Test
  void no_usable_key_yields_only_typename() {
    QueryPlanningContext context = context("{ t { x } }");

    assertEquals(
        List.of("__typename"),
        names(context.getKeyFields(schema.requireType("U"), "b", "c", List.of())));
  }

  @Test
  void owning_service_falls_back_to_the_base() {
    QueryPlanningContext context = context("{ t { x } }");
    TypeDefinition t = schema.requireType("T");

    assertEquals(Optional.of("b"), context.getOwningService(t, t.getField("x").get()));
    assertEquals(Optional.of("a"), context.getOwningService(t, t.getField("id").get()));
    assertEquals(
        Optional.empty(),
        context.getOwningService(
            schema.requireType("V"), schema.requireType("V").getField("a").get()));
  }

  @Test
  void unknown_field_is_invalid() {
    QueryPlanningContext context = context("{ t { x } }");

    assertThrows(
        InvalidQueryException.class,
        () -> context.getFieldDef(schema.requireType("T"), FieldSelection.leaf("nope")));
  }

  @Test
  void undeclared_variable_is_invalid() {
    QueryPlanningContext context = context("query($a: Int) { t { x } }");

    assertEquals("$a:Int", context.getVariableDefinition("a").toString());
    assertThrows(InvalidQueryException.class, () -> context.getVariableDefinition("b"));
  }

  private QueryPlanningContext context(String query) {
    QueryDocument document = new QueryParser().parse(query);
    return new QueryPlanningContext(
        schema, federation, document, document.getOperation(null), new QueryPlanningOptions());
  }

  private static List<String> names(List<CollectedField> fields) {
    return fields.stream()
        .map(f -> f.getFieldNode().getName())
        .collect(Collectors.toList());
  }
}
