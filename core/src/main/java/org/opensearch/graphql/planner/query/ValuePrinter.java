/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import graphql.language.ArrayValue;
import graphql.language.AstPrinter;
import graphql.language.ObjectValue;
import graphql.language.Value;
import graphql.language.VariableReference;
import java.util.Collection;

/** Prints graphql-java literal values in compact GraphQL syntax. */
public final class ValuePrinter {

  private ValuePrinter() {}

  public static String print(Value<?> value) {
    return AstPrinter.printAstCompact(value);
  }

  /** Adds the names of the variables referenced by the value to the collection. */
  public static void collectVariables(Value<?> value, Collection<String> variables) {
    if (value instanceof VariableReference ref) {
      variables.add(ref.getName());
    } else if (value instanceof ArrayValue array) {
      array.getValues().forEach(v -> collectVariables(v, variables));
    } else if (value instanceof ObjectValue object) {
      object.getObjectFields().forEach(f -> collectVariables(f.getValue(), variables));
    }
  }
}
