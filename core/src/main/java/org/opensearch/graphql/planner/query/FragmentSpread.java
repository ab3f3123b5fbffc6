/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A spread of a named fragment. */
@Getter
@EqualsAndHashCode
public class FragmentSpread implements Selection {

  private final String name;
  private final ImmutableList<Directive> directives;

  public FragmentSpread(String name, List<Directive> directives) {
    this.name = name;
    this.directives = ImmutableList.copyOf(directives);
  }

  @Override
  public String toString() {
    return SelectionPrinter.printSelection(this);
  }
}
