/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.federation;

import static org.opensearch.graphql.planner.federation.FederationDirectives.FIELDS_ARGUMENT;
import static org.opensearch.graphql.planner.federation.FederationDirectives.GRAPH;
import static org.opensearch.graphql.planner.federation.FederationDirectives.GRAPH_ARGUMENT;
import static org.opensearch.graphql.planner.federation.FederationDirectives.KEY;
import static org.opensearch.graphql.planner.federation.FederationDirectives.NAME_ARGUMENT;
import static org.opensearch.graphql.planner.federation.FederationDirectives.OWNER;
import static org.opensearch.graphql.planner.federation.FederationDirectives.PROVIDES;
import static org.opensearch.graphql.planner.federation.FederationDirectives.REQUIRES;
import static org.opensearch.graphql.planner.federation.FederationDirectives.RESOLVE;
import static org.opensearch.graphql.planner.federation.FederationDirectives.URL_ARGUMENT;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.opensearch.graphql.planner.exceptions.FailedParsingSchemaException;
import org.opensearch.graphql.planner.query.Argument;
import org.opensearch.graphql.planner.query.Directive;
import org.opensearch.graphql.planner.schema.FieldDefinition;
import org.opensearch.graphql.planner.schema.SchemaDocument;
import org.opensearch.graphql.planner.schema.TypeDefinition;

/**
 * Builds the {@link FederationIndex} of a supergraph in a single pass over its type definitions.
 * Fields with no owning subgraph are not rejected here; the planner reports them when a query
 * selects them.
 */
@Log4j2
public class FederationMetadataResolver {

  /**
   * Resolve federation metadata.
   *
   * @param schema parsed supergraph schema
   * @return federation index
   * @throws FailedParsingSchemaException on malformed federation directives
   */
  public FederationIndex resolve(SchemaDocument schema) {
    Map<String, String> graphs = new LinkedHashMap<>();
    for (Directive directive : schema.getSchemaDirectives()) {
      if (GRAPH.equals(directive.getName())) {
        String name = requireString(directive, NAME_ARGUMENT, "schema");
        String url =
            directive.getArgument(URL_ARGUMENT).flatMap(Argument::getStringValue).orElse("");
        graphs.put(name, url);
      }
    }

    ImmutableMap.Builder<String, String> baseServices = ImmutableMap.builder();
    Map<String, Map<String, List<FieldSet>>> keys = new LinkedHashMap<>();
    ImmutableMap.Builder<FieldCoordinate, String> fieldOwners = ImmutableMap.builder();
    ImmutableMap.Builder<FieldCoordinate, FieldSet> requires = ImmutableMap.builder();
    ImmutableMap.Builder<FieldCoordinate, FieldSet> provides = ImmutableMap.builder();
    ImmutableSet.Builder<String> valueTypes = ImmutableSet.builder();

    for (TypeDefinition type : schema.getTypes().values()) {
      if (!type.isComposite()) {
        continue;
      }
      String location = "type " + type.getName();
      if (type.isObject()) {
        Optional<Directive> owner = type.getDirectives(OWNER).stream().findFirst();
        if (owner.isPresent()) {
          String graph = requireString(owner.get(), GRAPH_ARGUMENT, location);
          baseServices.put(type.getName(), checkGraph(graphs, graph, location));
        } else if (!schema.isRootType(type.getName())) {
          valueTypes.add(type.getName());
        }
        for (Directive key : type.getDirectives(KEY)) {
          String graph = checkGraph(graphs, requireString(key, GRAPH_ARGUMENT, location), location);
          keys.computeIfAbsent(type.getName(), t -> new LinkedHashMap<>())
              .computeIfAbsent(graph, g -> new ArrayList<>())
              .add(fieldSet(key, location));
        }
      }

      for (FieldDefinition field : type.getFields().values()) {
        FieldCoordinate coordinate = FieldCoordinate.of(type.getName(), field.getName());
        String fieldLocation = "field " + coordinate;
        Optional<Directive> resolve = field.getDirective(RESOLVE);
        if (resolve.isPresent()) {
          String graph = requireString(resolve.get(), GRAPH_ARGUMENT, fieldLocation);
          fieldOwners.put(coordinate, checkGraph(graphs, graph, fieldLocation));
        }
        field
            .getDirective(REQUIRES)
            .ifPresent(d -> requires.put(coordinate, fieldSet(d, fieldLocation)));
        field
            .getDirective(PROVIDES)
            .ifPresent(d -> provides.put(coordinate, fieldSet(d, fieldLocation)));
      }
    }

    ImmutableTable.Builder<String, String, ImmutableList<FieldSet>> keyTable =
        ImmutableTable.builder();
    keys.forEach(
        (typeName, byGraph) ->
            byGraph.forEach(
                (graph, fieldSets) ->
                    keyTable.put(typeName, graph, ImmutableList.copyOf(fieldSets))));

    FederationIndex index =
        new FederationIndex(
            ImmutableMap.copyOf(graphs),
            baseServices.build(),
            keyTable.build(),
            fieldOwners.build(),
            requires.build(),
            provides.build(),
            valueTypes.build());
    log.debug(
        "Resolved federation metadata: {} subgraphs, {} entity types",
        graphs.size(),
        keys.size());
    return index;
  }

  private static FieldSet fieldSet(Directive directive, String location) {
    return FieldSet.parse(requireString(directive, FIELDS_ARGUMENT, location));
  }

  private static String requireString(Directive directive, String argument, String location) {
    return directive
        .getArgument(argument)
        .flatMap(Argument::getStringValue)
        .orElseThrow(
            () ->
                new FailedParsingSchemaException(
                    "@" + directive.getName() + " on " + location + " requires a string argument \""
                        + argument + "\""));
  }

  private static String checkGraph(Map<String, String> graphs, String graph, String location) {
    if (!graphs.isEmpty() && !graphs.containsKey(graph)) {
      throw new FailedParsingSchemaException(
          "Unknown graph \"" + graph + "\" referenced on " + location);
    }
    return graph;
  }
}
