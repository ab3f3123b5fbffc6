/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryPlanSerializerTest {

  private final QueryPlan plan =
      new QueryPlan(
          new SequenceNode(
              List.of(
                  new FetchNode(
                      "accounts", List.of("id"), null, "query($id:ID!){user(id:$id){id}}"),
                  new FlattenNode(
                      List.of("user"),
                      new FetchNode(
                          "reviews",
                          List.of(),
                          List.of(
                              new InlineFragmentNode(
                                  "User",
                                  List.of(
                                      new FieldNode(null, "__typename", null),
                                      new FieldNode(null, "id", null)))),
                          "query($representations:[_Any!]!)"
                              + "{_entities(representations:$representations)"
                              + "{...on User{reviews{body}}}}")))));

  @Test
  void plan_is_written_with_node_kinds() {
    assertEquals(
        "{\"kind\":\"Sequence\",\"nodes\":["
            + "{\"kind\":\"Fetch\",\"serviceName\":\"accounts\",\"variableUsages\":[\"id\"],"
            + "\"operation\":\"query($id:ID!){user(id:$id){id}}\"},"
            + "{\"kind\":\"Flatten\",\"path\":[\"user\"],\"node\":"
            + "{\"kind\":\"Fetch\",\"serviceName\":\"reviews\",\"variableUsages\":[],"
            + "\"requires\":[{\"kind\":\"InlineFragment\",\"typeCondition\":\"User\","
            + "\"selections\":[{\"kind\":\"Field\",\"name\":\"__typename\"},"
            + "{\"kind\":\"Field\",\"name\":\"id\"}]}],"
            + "\"operation\":\"query($representations:[_Any!]!)"
            + "{_entities(representations:$representations){...on User{reviews{body}}}}\"}}]}",
        QueryPlanSerializer.toJson(plan));
  }

  @Test
  void plan_is_read_back() {
    assertEquals(plan, QueryPlanSerializer.fromJson(QueryPlanSerializer.toJson(plan)));
    assertEquals(plan, QueryPlanSerializer.fromJson(QueryPlanSerializer.toPrettyJson(plan)));
  }

  @Test
  void pretty_json_is_indented() {
    assertTrue(QueryPlanSerializer.toPrettyJson(plan).contains("\n  \"nodes\" : ["));
  }

  @Test
  void malformed_plan_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> QueryPlanSerializer.fromJson("{"));
    assertThrows(
        IllegalArgumentException.class,
        () -> QueryPlanSerializer.fromJson("{\"kind\":\"Unknown\"}"));
    assertThrows(IllegalArgumentException.class, () -> QueryPlanSerializer.fromJson("null"));
  }
}
