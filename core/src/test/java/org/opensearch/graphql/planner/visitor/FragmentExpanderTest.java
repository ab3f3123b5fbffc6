/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.visitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.parser.QueryParser;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.query.SelectionPrinter;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FragmentExpanderTest {

  @Test
  void spreads_become_inline_fragments() {
    assertEquals(
        "{me{...on User{id ...on User @include(if:$b){name}}}}",
        expand(
            "query($b: Boolean!) { me { ...A } }"
                + " fragment A on User { id ...B @include(if: $b) }"
                + " fragment B on User { name }"));
  }

  @Test
  void fragment_may_be_spread_twice() {
    assertEquals(
        "{a:me{...on User{id}} b:me{...on User{id}}}",
        expand("{ a: me { ...A } b: me { ...A } } fragment A on User { id }"));
  }

  @Test
  void unknown_fragment_is_invalid() {
    InvalidQueryException exception =
        assertThrows(InvalidQueryException.class, () -> expand("{ me { ...Missing } }"));
    assertEquals("Fragment \"Missing\" not found", exception.getMessage());
  }

  @Test
  void fragment_spreading_itself_is_invalid() {
    InvalidQueryException exception =
        assertThrows(
            InvalidQueryException.class,
            () ->
                expand(
                    "{ me { ...A } } fragment A on User { ...B } fragment B on User { id ...A }"));
    assertEquals(
        "Cannot spread fragment \"A\" within itself via A -> B -> A", exception.getMessage());
  }

  private static String expand(String query) {
    QueryDocument document = new QueryParser().parse(query);
    return SelectionPrinter.printSelectionSet(
        new FragmentExpander(document).expand(document.getOperation(null).getSelectionSet()));
  }
}
