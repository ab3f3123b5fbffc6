/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import static org.junit.jupiter.api.Assertions.assertEquals;

import graphql.language.ArrayValue;
import graphql.language.EnumValue;
import graphql.language.IntValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.StringValue;
import graphql.language.VariableReference;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ValuePrinterTest {

  private final ObjectValue filter =
      ObjectValue.newObjectValue()
          .objectField(new ObjectField("kind", new EnumValue("BOOK")))
          .objectField(
              new ObjectField(
                  "tags",
                  ArrayValue.newArrayValue()
                      .value(new StringValue("x"))
                      .value(new VariableReference("tag"))
                      .build()))
          .objectField(new ObjectField("first", new IntValue(BigInteger.TEN)))
          .build();

  @Test
  void nested_values_are_printed_compactly() {
    assertEquals("{kind:BOOK,tags:[\"x\",$tag],first:10}", ValuePrinter.print(filter));
  }

  @Test
  void quotes_in_strings_are_escaped() {
    assertEquals("\"a \\\"b\\\"\"", ValuePrinter.print(new StringValue("a \"b\"")));
  }

  @Test
  void variables_nested_in_values_are_collected() {
    List<String> variables = new ArrayList<>();
    ValuePrinter.collectVariables(filter, variables);

    assertEquals(List.of("tag"), variables);
  }
}
