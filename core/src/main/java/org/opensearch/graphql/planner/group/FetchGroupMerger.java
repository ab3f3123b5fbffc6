/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.group;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.log4j.Log4j2;
import org.opensearch.graphql.planner.query.SelectionPrinter;
import org.opensearch.graphql.planner.schema.TypeDefinition;
import org.opensearch.graphql.planner.visitor.CollectedField;

/**
 * Merges entity fetch groups that can share one fetch: same subgraph, same segment, same merge
 * path, same dependencies, and the same representation for every entity type both send.
 */
@Log4j2
public class FetchGroupMerger {

  /**
   * Merges the groups until no two can be merged.
   *
   * @param groups fetch groups in creation order
   * @return the remaining groups in creation order
   */
  public List<FetchGroup> merge(List<FetchGroup> groups) {
    List<FetchGroup> remaining = new ArrayList<>(groups);
    boolean merged = true;
    while (merged) {
      merged = false;
      search:
      for (int i = 0; i < remaining.size(); i++) {
        for (int j = i + 1; j < remaining.size(); j++) {
          FetchGroup target = remaining.get(i);
          FetchGroup source = remaining.get(j);
          if (canMerge(target, source)) {
            log.debug("Merging fetch group {} into {}", source, target);
            target.absorb(source);
            remaining.remove(j);
            for (FetchGroup group : remaining) {
              group.replaceDependency(source.getId(), target.getId());
            }
            merged = true;
            break search;
          }
        }
      }
    }
    return remaining;
  }

  private boolean canMerge(FetchGroup a, FetchGroup b) {
    return a.isEntityFetch()
        && b.isEntityFetch()
        && a.getServiceName().equals(b.getServiceName())
        && a.getSegment() == b.getSegment()
        && a.getMergeAt().equals(b.getMergeAt())
        && a.getDependencyIds().equals(b.getDependencyIds())
        && compatibleRepresentations(a, b);
  }

  private boolean compatibleRepresentations(FetchGroup a, FetchGroup b) {
    Map<String, String> representationsA = representationsByType(a);
    Map<String, String> representationsB = representationsByType(b);
    for (Map.Entry<String, String> representation : representationsA.entrySet()) {
      String other = representationsB.get(representation.getKey());
      if (other != null && !other.equals(representation.getValue())) {
        return false;
      }
    }
    return true;
  }

  private Map<String, String> representationsByType(FetchGroup group) {
    Map<String, String> representations = new TreeMap<>();
    Map<TypeDefinition, List<CollectedField>> byType =
        SelectionSets.groupBy(group.getRequiredFields(), CollectedField::getParentType);
    byType.forEach(
        (type, fields) ->
            representations.put(
                type.getName(),
                SelectionPrinter.printSelectionSet(SelectionSets.fromFields(fields, type))));
    return representations;
  }
}
