/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.autofrag;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.graphql.planner.query.FragmentDefinition;
import org.opensearch.graphql.planner.query.Selection;

/** A selection set rewritten to spread the fragments it is returned with. */
@Getter
@RequiredArgsConstructor
public class FragmentizedSelectionSet {

  private final List<Selection> selectionSet;
  private final List<FragmentDefinition> fragments;
}
