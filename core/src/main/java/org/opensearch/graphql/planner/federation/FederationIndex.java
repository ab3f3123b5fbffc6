/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.federation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Ownership and entity metadata of a supergraph, derived once from the schema document. Lookups
 * are by type and field name; every collection is immutable so one index can be shared across
 * planning calls.
 */
@RequiredArgsConstructor
public class FederationIndex {

  /** Declared subgraphs, name to routing url, in declaration order. */
  @Getter private final ImmutableMap<String, String> graphs;

  /** Entity type name to its base (owning) subgraph. */
  private final ImmutableMap<String, String> baseServices;

  /** (type name, subgraph) to that subgraph's keys for the type, in declaration order. */
  private final ImmutableTable<String, String, ImmutableList<FieldSet>> keys;

  /** Extension fields to the subgraph that resolves them. */
  private final ImmutableMap<FieldCoordinate, String> fieldOwners;

  private final ImmutableMap<FieldCoordinate, FieldSet> requires;
  private final ImmutableMap<FieldCoordinate, FieldSet> provides;

  /** Object types that are neither root types nor owned by a subgraph. */
  @Getter private final ImmutableSet<String> valueTypes;

  public Optional<String> getBaseService(String typeName) {
    return Optional.ofNullable(baseServices.get(typeName));
  }

  /** Returns the keys the subgraph declares for the type, or an empty list. */
  public List<FieldSet> getKeys(String typeName, String serviceName) {
    List<FieldSet> declared = keys.get(typeName, serviceName);
    return declared == null ? ImmutableList.of() : declared;
  }

  /** Returns true when any subgraph declares a key for the type. */
  boolean isEntity(String typeName) {
    return keys.containsRow(typeName);
  }

  /** Returns the subgraph named by {@code @resolve} on the field, if any. */
  public Optional<String> getFieldOwner(String typeName, String fieldName) {
    return Optional.ofNullable(fieldOwners.get(FieldCoordinate.of(typeName, fieldName)));
  }

  public Optional<FieldSet> getRequires(String typeName, String fieldName) {
    return Optional.ofNullable(requires.get(FieldCoordinate.of(typeName, fieldName)));
  }

  public Optional<FieldSet> getProvides(String typeName, String fieldName) {
    return Optional.ofNullable(provides.get(FieldCoordinate.of(typeName, fieldName)));
  }

  public boolean isValueType(String typeName) {
    return valueTypes.contains(typeName);
  }

  public Set<String> getGraphNames() {
    return graphs.keySet();
  }
}
