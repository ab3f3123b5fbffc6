/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.query;

import java.util.List;

/** A field, inline fragment or fragment spread inside a selection set. */
public interface Selection {

  List<Directive> getDirectives();
}
