/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.group;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.graphql.planner.schema.TypeReference;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ResponsePathTest {

  @Test
  void lists_add_element_markers() {
    TypeReference matrix =
        TypeReference.nonNull(
            TypeReference.listOf(TypeReference.listOf(TypeReference.named("Product"))));

    ResponsePath path = ResponsePath.ROOT.append("me", TypeReference.named("User"));

    assertEquals(List.of("me", "grid", "@", "@"), path.append("grid", matrix).getSegments());
  }

  @Test
  void root_is_empty() {
    assertTrue(ResponsePath.ROOT.isEmpty());
    assertEquals("<root>", ResponsePath.ROOT.toString());
    assertEquals("a.@", ResponsePath.of("a", "@").toString());
  }
}
