/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.assembler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.graphql.planner.QueryPlanningOptions;
import org.opensearch.graphql.planner.TestSchemas;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.federation.FederationMetadataResolver;
import org.opensearch.graphql.planner.group.FetchGroup;
import org.opensearch.graphql.planner.group.FetchGroupGraph;
import org.opensearch.graphql.planner.group.ResponsePath;
import org.opensearch.graphql.planner.model.FetchNode;
import org.opensearch.graphql.planner.model.ParallelNode;
import org.opensearch.graphql.planner.model.PlanNode;
import org.opensearch.graphql.planner.model.SequenceNode;
import org.opensearch.graphql.planner.parser.QueryParser;
import org.opensearch.graphql.planner.parser.SchemaParser;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.query.VariableDefinition;
import org.opensearch.graphql.planner.schema.SchemaDocument;
import org.opensearch.graphql.planner.schema.TypeReference;
import org.opensearch.graphql.planner.visitor.QueryPlanningContext;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanAssemblerTest {

  private final PlanNode a = new FetchNode("a", List.of(), null, "{a}");
  private final PlanNode b = new FetchNode("b", List.of(), null, "{b}");
  private final PlanNode c = new FetchNode("c", List.of(), null, "{c}");

  @Test
  void single_node_is_not_wrapped() {
    assertSame(a, PlanAssembler.sequence(List.of(a)));
    assertSame(a, PlanAssembler.parallel(List.of(a)));
  }

  @Test
  void nested_nodes_of_the_same_kind_are_flattened() {
    assertEquals(
        new SequenceNode(List.of(a, b, c)),
        PlanAssembler.sequence(List.of(new SequenceNode(List.of(a, b)), c)));
    assertEquals(
        new ParallelNode(List.of(a, b, c)),
        PlanAssembler.parallel(List.of(a, new ParallelNode(List.of(b, c)))));
  }

  @Test
  void entities_operation_declares_representations_first() {
    List<Selection> selectionSet = List.of(FieldSelection.leaf("name"));

    assertEquals(
        "query($representations:[_Any!]!,$locale:String!)"
            + "{_entities(representations:$representations){name}}",
        PlanAssembler.entitiesOperation(
            List.of(
                new VariableDefinition(
                    "locale", TypeReference.nonNull(TypeReference.named("String")), null)),
            selectionSet,
            List.of()));
  }

  @Test
  void cyclic_groups_are_rejected() {
    SchemaDocument schema = new SchemaParser().parse(TestSchemas.load(TestSchemas.SUPERGRAPH));
    QueryDocument document = new QueryParser().parse("{ me { id } }");
    QueryPlanningContext context =
        new QueryPlanningContext(
            schema,
            new FederationMetadataResolver().resolve(schema),
            document,
            document.getOperation(null),
            new QueryPlanningOptions());
    FetchGroup first = FetchGroup.fetch(0, "accounts", ResponsePath.ROOT, 0);
    FetchGroup second = FetchGroup.fetch(1, "reviews", ResponsePath.ROOT, 0);
    first.addDependency(1);
    second.addDependency(0);

    InvalidQueryException exception =
        assertThrows(
            InvalidQueryException.class,
            () -> new PlanAssembler(context).assemble(new FetchGroupGraph(List.of(first, second))));
    assertEquals("circular requires between fetch groups [0, 1]", exception.getMessage());
  }
}
