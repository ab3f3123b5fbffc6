/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.assembler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.graphql.planner.autofrag.AutoFragmentizer;
import org.opensearch.graphql.planner.autofrag.FragmentizedSelectionSet;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.group.FetchGroup;
import org.opensearch.graphql.planner.group.FetchGroupGraph;
import org.opensearch.graphql.planner.group.SelectionSets;
import org.opensearch.graphql.planner.model.FetchNode;
import org.opensearch.graphql.planner.model.FlattenNode;
import org.opensearch.graphql.planner.model.ParallelNode;
import org.opensearch.graphql.planner.model.PlanNode;
import org.opensearch.graphql.planner.model.QueryPlan;
import org.opensearch.graphql.planner.model.SelectionNode;
import org.opensearch.graphql.planner.model.SequenceNode;
import org.opensearch.graphql.planner.query.FragmentDefinition;
import org.opensearch.graphql.planner.query.OperationType;
import org.opensearch.graphql.planner.query.Selection;
import org.opensearch.graphql.planner.query.SelectionPrinter;
import org.opensearch.graphql.planner.query.VariableDefinition;
import org.opensearch.graphql.planner.schema.TypeDefinition;
import org.opensearch.graphql.planner.visitor.QueryPlanningContext;

/**
 * Turns a fetch group graph into a plan tree. Each serial segment is layered topologically: a
 * layer holds the groups whose dependencies all lie in earlier layers and becomes a {@code
 * Parallel} node; the layers of a segment, and the segments, become {@code Sequence} nodes.
 */
@Log4j2
public class PlanAssembler {

  static final String REPRESENTATIONS_VARIABLE = "representations";

  private final QueryPlanningContext context;
  private final AutoFragmentizer autoFragmentizer;

  public PlanAssembler(QueryPlanningContext context) {
    this.context = context;
    this.autoFragmentizer =
        context.getOptions().isAutoFragmentization()
            ? new AutoFragmentizer(context.getSchema())
            : null;
  }

  /**
   * Assemble the plan.
   *
   * @param graph frozen fetch groups
   * @return query plan, an empty {@code Sequence} when there is nothing to fetch
   * @throws InvalidQueryException if the groups depend on each other in a cycle, or a fetch uses a
   *     variable the operation does not declare
   */
  public QueryPlan assemble(FetchGroupGraph graph) {
    List<PlanNode> segments = new ArrayList<>();
    for (List<FetchGroup> segment : graph.getSegments()) {
      List<PlanNode> layers = new ArrayList<>();
      for (List<FetchGroup> layer : layers(segment)) {
        layers.add(parallel(layer.stream().map(this::planNodeFor).collect(Collectors.toList())));
      }
      segments.add(sequence(layers));
    }
    PlanNode root = segments.isEmpty() ? new SequenceNode(List.of()) : sequence(segments);
    log.debug("Assembled plan of {} segment(s)", segments.size());
    return new QueryPlan(root);
  }

  private List<List<FetchGroup>> layers(List<FetchGroup> groups) {
    List<List<FetchGroup>> layers = new ArrayList<>();
    List<FetchGroup> remaining = new ArrayList<>(groups);
    Set<Integer> placed = new HashSet<>();
    while (!remaining.isEmpty()) {
      List<FetchGroup> layer =
          remaining.stream()
              .filter(g -> placed.containsAll(g.getDependencyIds()))
              .collect(Collectors.toList());
      if (layer.isEmpty()) {
        throw new InvalidQueryException(
            "circular requires between fetch groups "
                + remaining.stream().map(FetchGroup::getId).collect(Collectors.toList()));
      }
      layer.forEach(g -> placed.add(g.getId()));
      remaining.removeAll(layer);
      layers.add(layer);
    }
    return layers;
  }

  private PlanNode planNodeFor(FetchGroup group) {
    FetchNode fetch = fetchNodeFor(group);
    return group.getMergeAt().isEmpty()
        ? fetch
        : new FlattenNode(group.getMergeAt().getSegments(), fetch);
  }

  private FetchNode fetchNodeFor(FetchGroup group) {
    boolean entityFetch = group.isEntityFetch();
    TypeDefinition parentType = entityFetch ? null : context.getRootType();
    List<Selection> selectionSet = SelectionSets.fromFields(group.getFields(), parentType);
    List<FragmentDefinition> fragments = List.of();
    if (autoFragmentizer != null) {
      FragmentizedSelectionSet fragmentized =
          autoFragmentizer.fragmentize(selectionSet, parentType);
      selectionSet = fragmentized.getSelectionSet();
      fragments = fragmentized.getFragments();
    }

    List<String> variableUsages = VariableUsages.collect(selectionSet, fragments);
    List<VariableDefinition> variableDefinitions =
        variableUsages.stream()
            .map(context::getVariableDefinition)
            .collect(Collectors.toList());

    String operation;
    List<SelectionNode> requires = null;
    if (entityFetch) {
      operation = entitiesOperation(variableDefinitions, selectionSet, fragments);
      requires =
          RequiresConverter.toSelectionNodes(
              SelectionSets.fromFields(group.getRequiredFields(), null));
    } else {
      operation =
          SelectionPrinter.printOperation(
              context.getOperation().getType(), variableDefinitions, selectionSet, fragments);
    }
    return new FetchNode(group.getServiceName(), variableUsages, requires, operation);
  }

  /**
   * Prints {@code query($representations:[_Any!]!,...){_entities(representations:$representations)
   * {...}}}.
   */
  static String entitiesOperation(
      List<VariableDefinition> variableDefinitions,
      List<Selection> selectionSet,
      List<FragmentDefinition> fragments) {
    StringBuilder out = new StringBuilder(OperationType.QUERY.getKeyword());
    out.append("($").append(REPRESENTATIONS_VARIABLE).append(":[_Any!]!");
    for (VariableDefinition definition : variableDefinitions) {
      out.append(',').append(definition);
    }
    out.append("){_entities(representations:$")
        .append(REPRESENTATIONS_VARIABLE)
        .append(')')
        .append(SelectionPrinter.printSelectionSet(selectionSet))
        .append('}');
    for (FragmentDefinition fragment : fragments) {
      out.append(' ').append(SelectionPrinter.printFragmentDefinition(fragment));
    }
    return out.toString();
  }

  /** Wraps nodes in a {@code Sequence}, collapsing a single node and flattening nested ones. */
  static PlanNode sequence(List<PlanNode> nodes) {
    if (nodes.size() == 1) {
      return nodes.get(0);
    }
    List<PlanNode> flattened = new ArrayList<>();
    for (PlanNode node : nodes) {
      if (node instanceof SequenceNode sequence) {
        flattened.addAll(sequence.getNodes());
      } else {
        flattened.add(node);
      }
    }
    return new SequenceNode(flattened);
  }

  /** Wraps nodes in a {@code Parallel}, collapsing a single node and flattening nested ones. */
  static PlanNode parallel(List<PlanNode> nodes) {
    if (nodes.size() == 1) {
      return nodes.get(0);
    }
    List<PlanNode> flattened = new ArrayList<>();
    for (PlanNode node : nodes) {
      if (node instanceof ParallelNode parallel) {
        flattened.addAll(parallel.getNodes());
      } else {
        flattened.add(node);
      }
    }
    return new ParallelNode(flattened);
  }
}
