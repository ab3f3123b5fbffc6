/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.group;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.graphql.planner.QueryPlanningOptions;
import org.opensearch.graphql.planner.TestSchemas;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.federation.FederationIndex;
import org.opensearch.graphql.planner.federation.FederationMetadataResolver;
import org.opensearch.graphql.planner.parser.QueryParser;
import org.opensearch.graphql.planner.parser.SchemaParser;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.schema.SchemaDocument;
import org.opensearch.graphql.planner.visitor.QueryPlanningContext;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FetchGroupBuilderTest {

  private SchemaDocument schema;
  private FederationIndex federation;

  @BeforeEach
  void setUp() {
    schema = new SchemaParser().parse(TestSchemas.load(TestSchemas.SUPERGRAPH));
    federation = new FederationMetadataResolver().resolve(schema);
  }

  @Test
  void one_group_per_root_subgraph() {
    FetchGroupGraph graph = build("{ me { name } topProducts { name } topReviews { body } }");

    assertEquals(List.of("accounts", "products", "reviews"), services(graph.getGroups()));
    assertEquals(3, graph.getRootGroups().size());
    assertTrue(graph.getGroups().stream().noneMatch(FetchGroup::isEntityFetch));
  }

  @Test
  void entity_groups_depend_on_the_group_providing_keys() {
    FetchGroupGraph graph = build("{ me { reviews { body } } }");

    FetchGroup reviews = graph.getGroup(1);
    assertEquals("reviews", reviews.getServiceName());
    assertEquals(Set.of(0), reviews.getDependencyIds());
    assertEquals(ResponsePath.of("me"), reviews.getMergeAt());
    assertTrue(reviews.isEntityFetch());
    assertTrue(reviews.isFrozen());
  }

  @Test
  void requires_of_a_third_subgraph_add_a_dependency() {
    FetchGroupGraph graph = build("{ topProducts { deliveryNote } }");

    assertEquals(List.of("products", "reviews", "inventory"), services(graph.getGroups()));
    assertEquals(Set.of(0, 2), graph.getGroup(1).getDependencyIds());
    assertEquals(Set.of(0), graph.getGroup(2).getDependencyIds());
    assertEquals(ResponsePath.of("topProducts", "@"), graph.getGroup(2).getMergeAt());
    assertEquals(List.of(graph.getGroup(0)), graph.getRootGroups());
  }

  @Test
  void entity_fields_of_one_subgraph_share_a_group() {
    FetchGroupGraph graph = build("{ topProducts { inStock shippingEstimate } }");

    assertEquals(List.of("products", "inventory"), services(graph.getGroups()));
    assertEquals(2, graph.getGroup(1).getFields().size());
  }

  @Test
  void mutation_root_fields_get_serial_segments() {
    FetchGroupGraph graph =
        build(
            "mutation { a: login(username: \"a\") { id } b: login(username: \"b\") { id }"
                + " reviewProduct(upc: \"1\", body: \"x\") { upc } }");

    assertEquals(2, graph.getGroupCount());
    assertEquals(2, graph.getSegments().size());
    assertEquals(2, graph.getGroup(0).getFields().size());
  }

  @Test
  void built_graph_is_valid() {
    FetchGroupGraph graph = build("{ me { name reviews { body product { name inStock } } } }");

    assertEquals(List.of(), graph.validate());
    assertFalse(graph.getGroups().isEmpty());
  }

  @Test
  void unresolved_field_is_invalid() {
    SchemaDocument orphan =
        new SchemaParser().parse("type Query { a: Int @resolve(graph: \"x\") b: Int }");
    FederationIndex orphanIndex = new FederationMetadataResolver().resolve(orphan);
    QueryDocument document = new QueryParser().parse("{ b }");

    InvalidQueryException exception =
        assertThrows(
            InvalidQueryException.class,
            () ->
                new FetchGroupBuilder(
                        new QueryPlanningContext(
                            orphan,
                            orphanIndex,
                            document,
                            document.getOperation(null),
                            new QueryPlanningOptions()))
                    .build());
    assertEquals("Field \"Query.b\" is not resolved by any subgraph", exception.getMessage());
  }

  private FetchGroupGraph build(String query) {
    QueryDocument document = new QueryParser().parse(query);
    QueryPlanningContext context =
        new QueryPlanningContext(
            schema, federation, document, document.getOperation(null), new QueryPlanningOptions());
    return new FetchGroupBuilder(context).build();
  }

  private static List<String> services(List<FetchGroup> groups) {
    return groups.stream().map(FetchGroup::getServiceName).collect(Collectors.toList());
  }
}
