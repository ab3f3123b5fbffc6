/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.group;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import org.opensearch.graphql.planner.schema.TypeReference;

/**
 * A path into the response: response names, with {@value #LIST_ELEMENT} standing for every element
 * of a list.
 */
@EqualsAndHashCode
public class ResponsePath {

  public static final String LIST_ELEMENT = "@";

  public static final ResponsePath ROOT = new ResponsePath(ImmutableList.of());

  private final ImmutableList<String> segments;

  private ResponsePath(ImmutableList<String> segments) {
    this.segments = segments;
  }

  public static ResponsePath of(String... segments) {
    return new ResponsePath(ImmutableList.copyOf(segments));
  }

  /**
   * Extends the path by a field, adding one list-element marker for every list wrapping the
   * field's type.
   */
  public ResponsePath append(String responseName, TypeReference type) {
    ImmutableList.Builder<String> builder = ImmutableList.<String>builder().addAll(segments);
    builder.add(responseName);
    for (TypeReference t = type; t.getKind() != TypeReference.Kind.NAMED; t = t.getOfType()) {
      if (t.isList()) {
        builder.add(LIST_ELEMENT);
      }
    }
    return new ResponsePath(builder.build());
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  public List<String> getSegments() {
    return segments;
  }

  @Override
  public String toString() {
    return segments.isEmpty() ? "<root>" : String.join(".", segments);
  }
}
