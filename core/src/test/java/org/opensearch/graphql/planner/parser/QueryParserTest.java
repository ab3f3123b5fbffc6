/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.graphql.planner.exceptions.FailedParsingQueryException;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.query.FieldSelection;
import org.opensearch.graphql.planner.query.OperationDefinition;
import org.opensearch.graphql.planner.query.OperationType;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.query.SelectionPrinter;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryParserTest {

  private final QueryParser parser = new QueryParser();

  @Test
  void parses_operation_with_variables_and_fragments() {
    QueryDocument document =
        parser.parse(
            "query Search($text: String = \"a \\\"b\\\"\", $first: [Int!]!) {"
                + " search(text: $text, filter: {kind: BOOK, tags: [\"x\"]}) @skip(if: false) {"
                + " ...Fields } }"
                + " fragment Fields on Book { title }");

    OperationDefinition operation = document.getOperation("Search");
    assertEquals(OperationType.QUERY, operation.getType());
    assertEquals(
        "$text:String=\"a \\\"b\\\"\"", operation.getVariableDefinition("text").get().toString());
    assertEquals("$first:[Int!]!", operation.getVariableDefinition("first").get().toString());
    assertEquals(
        "{search(text:$text,filter:{kind:BOOK,tags:[\"x\"]}) @skip(if:false){...Fields}}",
        SelectionPrinter.printSelectionSet(operation.getSelectionSet()));
    assertTrue(document.getFragment("Fields").isPresent());
  }

  @Test
  void aliases_are_kept() {
    FieldSelection field =
        (FieldSelection)
            parser.parse("{ first: me { id } }").getOperation(null).getSelectionSet().get(0);

    assertEquals("first", field.getResponseName());
    assertEquals("me", field.getName());
  }

  @Test
  void mutation_operation_type() {
    assertEquals(
        OperationType.MUTATION,
        parser.parse("mutation { login { id } }").getOperation(null).getType());
  }

  @Test
  void syntax_error_fails_parsing() {
    assertThrows(FailedParsingQueryException.class, () -> parser.parse("{ me { id }"));
  }

  @Test
  void duplicate_fragment_is_invalid() {
    assertThrows(
        InvalidQueryException.class,
        () -> parser.parse("{ me { ...F } } fragment F on User { id } fragment F on User { id }"));
  }

  @Test
  void document_without_operation_is_invalid() {
    assertThrows(InvalidQueryException.class, () -> parser.parse("fragment F on User { id }"));
  }

  @Test
  void type_system_definitions_are_invalid() {
    assertThrows(InvalidQueryException.class, () -> parser.parse("type Query { a: Int }"));
  }

  @Test
  void unknown_operation_name_is_invalid() {
    QueryDocument document = parser.parse("query A { a } query B { b }");

    assertThrows(InvalidQueryException.class, () -> document.getOperation("C"));
    assertThrows(InvalidQueryException.class, () -> document.getOperation(null));
    assertEquals("B", document.getOperation("B").getName());
  }
}
