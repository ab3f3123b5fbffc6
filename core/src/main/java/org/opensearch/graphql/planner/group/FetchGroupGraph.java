/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The frozen fetch groups of one operation, a DAG through their dependency ids. Groups are kept in
 * creation order, which follows the first appearance of their fields in the query.
 */
public class FetchGroupGraph {

  private final List<FetchGroup> groups;

  public FetchGroupGraph(List<FetchGroup> groups) {
    this.groups = Collections.unmodifiableList(groups);
  }

  /** Returns all groups in creation order. */
  public List<FetchGroup> getGroups() {
    return groups;
  }

  /** Returns a group by its id. */
  FetchGroup getGroup(int id) {
    return groups.stream()
        .filter(g -> g.getId() == id)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Fetch group not found: " + id));
  }

  /** Returns the groups with no upstream dependencies. */
  List<FetchGroup> getRootGroups() {
    return groups.stream().filter(FetchGroup::isRoot).collect(Collectors.toList());
  }

  /** Returns the groups of every serial segment, segments in execution order. */
  public List<List<FetchGroup>> getSegments() {
    Map<Integer, List<FetchGroup>> bySegment = new TreeMap<>();
    for (FetchGroup group : groups) {
      bySegment.computeIfAbsent(group.getSegment(), s -> new ArrayList<>()).add(group);
    }
    return new ArrayList<>(bySegment.values());
  }

  public int getGroupCount() {
    return groups.size();
  }

  /**
   * Validates the graph. Returns a list of validation errors, or empty list if valid.
   *
   * @return list of error messages
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();
    Map<Integer, FetchGroup> groupMap =
        groups.stream().collect(Collectors.toMap(FetchGroup::getId, Function.identity()));
    for (FetchGroup group : groups) {
      if (!group.isFrozen()) {
        errors.add("Fetch group " + group.getId() + " is not frozen");
      }
      for (int dependencyId : group.getDependencyIds()) {
        FetchGroup dependency = groupMap.get(dependencyId);
        if (dependency == null) {
          errors.add(
              "Fetch group " + group.getId() + " references unknown group: " + dependencyId);
        } else if (dependency.getSegment() != group.getSegment()) {
          errors.add(
              "Fetch group " + group.getId() + " depends on group " + dependencyId
                  + " of another segment");
        }
      }
    }
    return errors;
  }

  @Override
  public String toString() {
    return "FetchGroupGraph{groups=" + groups + '}';
  }
}
