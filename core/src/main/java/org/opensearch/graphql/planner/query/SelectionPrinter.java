/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints selections and operations in the compact form used for subgraph operations: no
 * insignificant whitespace, selections separated by a single space, e.g. {@code
 * {user(id:"1"){name id}}}. The output is deterministic for a given input.
 */
public final class SelectionPrinter {

  private SelectionPrinter() {}

  public static String printSelectionSet(List<Selection> selections) {
    return selections.stream()
        .map(SelectionPrinter::printSelection)
        .collect(Collectors.joining(" ", "{", "}"));
  }

  public static String printSelection(Selection selection) {
    StringBuilder out = new StringBuilder();
    if (selection instanceof FieldSelection field) {
      if (field.getAlias() != null) {
        out.append(field.getAlias()).append(':');
      }
      out.append(field.getName());
      if (!field.getArguments().isEmpty()) {
        out.append(printArguments(field.getArguments()));
      }
      out.append(printDirectives(field.getDirectives()));
      if (field.hasSelectionSet()) {
        out.append(printSelectionSet(field.getSelectionSet()));
      }
    } else if (selection instanceof InlineFragment fragment) {
      out.append("...");
      if (fragment.getTypeCondition() != null) {
        out.append("on ").append(fragment.getTypeCondition());
      }
      out.append(printDirectives(fragment.getDirectives()));
      out.append(printSelectionSet(fragment.getSelectionSet()));
    } else if (selection instanceof FragmentSpread spread) {
      out.append("...").append(spread.getName()).append(printDirectives(spread.getDirectives()));
    } else {
      throw new IllegalArgumentException("Unsupported selection: " + selection);
    }
    return out.toString();
  }

  /** Prints each directive preceded by a space, or nothing for an empty list. */
  public static String printDirectives(List<Directive> directives) {
    return directives.stream().map(d -> " " + printDirective(d)).collect(Collectors.joining());
  }

  public static String printDirective(Directive directive) {
    return directive.getArguments().isEmpty()
        ? "@" + directive.getName()
        : "@" + directive.getName() + printArguments(directive.getArguments());
  }

  public static String printFragmentDefinition(FragmentDefinition fragment) {
    return "fragment "
        + fragment.getName()
        + " on "
        + fragment.getTypeCondition()
        + printSelectionSet(fragment.getSelectionSet());
  }

  /**
   * Prints an operation. Anonymous queries without variables use the shorthand form; fragment
   * definitions follow the operation, separated by a space.
   */
  public static String printOperation(
      OperationType type,
      List<VariableDefinition> variableDefinitions,
      List<Selection> selectionSet,
      List<FragmentDefinition> fragments) {
    StringBuilder out = new StringBuilder();
    if (type != OperationType.QUERY || !variableDefinitions.isEmpty()) {
      out.append(type.getKeyword());
    }
    out.append(printVariableDefinitions(variableDefinitions));
    out.append(printSelectionSet(selectionSet));
    for (FragmentDefinition fragment : fragments) {
      out.append(' ').append(printFragmentDefinition(fragment));
    }
    return out.toString();
  }

  public static String printVariableDefinitions(List<VariableDefinition> variableDefinitions) {
    if (variableDefinitions.isEmpty()) {
      return "";
    }
    return variableDefinitions.stream()
        .map(VariableDefinition::toString)
        .collect(Collectors.joining(",", "(", ")"));
  }

  private static String printArguments(List<Argument> arguments) {
    return arguments.stream().map(Argument::toString).collect(Collectors.joining(",", "(", ")"));
  }
}
