/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner.group;

import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.opensearch.graphql.planner.visitor.CollectedField;

/**
 * A set of fields fetched from one subgraph in one operation. Fetch groups become the {@code Fetch}
 * nodes of the plan; the groups they depend on must complete before they run, since they provide
 * the entity representations in {@link #getRequiredFields()}.
 *
 * <p>The selection set below a field that stays in the same subgraph is built with a nested group
 * sharing the enclosing fetch. Nested groups have no id and are never emitted.
 *
 * <p>Groups are mutable while the builder runs and frozen afterwards.
 */
public class FetchGroup {

  private static final int NESTED = -1;

  private final int id;
  private final String serviceName;
  private final ResponsePath mergeAt;
  private final int segment;
  private final FetchGroup enclosingFetch;

  private final List<CollectedField> fields = new ArrayList<>();
  private final List<CollectedField> requiredFields = new ArrayList<>();
  private final List<CollectedField> providedFields = new ArrayList<>();
  private final Map<String, FetchGroup> dependentGroupsByService = new LinkedHashMap<>();
  private final Set<Integer> dependencyIds = new TreeSet<>();
  private boolean frozen;

  private FetchGroup(
      int id, String serviceName, ResponsePath mergeAt, int segment, FetchGroup enclosingFetch) {
    this.id = id;
    this.serviceName = serviceName;
    this.mergeAt = mergeAt;
    this.segment = segment;
    this.enclosingFetch = enclosingFetch;
  }

  /** Creates a group that is emitted as a fetch. */
  public static FetchGroup fetch(int id, String serviceName, ResponsePath mergeAt, int segment) {
    return new FetchGroup(id, serviceName, mergeAt, segment, null);
  }

  /** Creates the group of a selection set nested in {@code enclosing}, rooted at {@code path}. */
  public static FetchGroup nested(FetchGroup enclosing, ResponsePath path) {
    FetchGroup fetch = enclosing.fetch();
    return new FetchGroup(NESTED, fetch.serviceName, path, fetch.segment, fetch);
  }

  public int getId() {
    checkState(isFetch(), "Nested fetch groups have no id");
    return id;
  }

  public String getServiceName() {
    return serviceName;
  }

  /** Returns the response path the results of this group are merged at. */
  public ResponsePath getMergeAt() {
    return mergeAt;
  }

  /** Returns the serial segment of the plan this group runs in. Queries have a single segment. */
  public int getSegment() {
    return segment;
  }

  public boolean isFetch() {
    return enclosingFetch == null;
  }

  /** Returns the group that is emitted for this one: itself, or the enclosing fetch. */
  public FetchGroup fetch() {
    return isFetch() ? this : enclosingFetch;
  }

  /** Returns true for groups that fetch entities from representations. */
  public boolean isEntityFetch() {
    return !requiredFields.isEmpty();
  }

  public List<CollectedField> getFields() {
    return Collections.unmodifiableList(fields);
  }

  public void addField(CollectedField field) {
    checkNotFrozen();
    fields.add(field);
  }

  public void addFields(List<CollectedField> newFields) {
    checkNotFrozen();
    fields.addAll(newFields);
  }

  /** Returns the fields of the entity representations this group is sent. */
  public List<CollectedField> getRequiredFields() {
    return Collections.unmodifiableList(requiredFields);
  }

  public void addRequiredFields(List<CollectedField> newRequiredFields) {
    checkNotFrozen();
    requiredFields.addAll(newRequiredFields);
  }

  public List<CollectedField> getProvidedFields() {
    return Collections.unmodifiableList(providedFields);
  }

  public void addProvidedFields(List<CollectedField> newProvidedFields) {
    checkNotFrozen();
    providedFields.addAll(newProvidedFields);
  }

  /** Returns true if the field is among the fields this group's subgraph provides here. */
  public boolean provides(CollectedField field) {
    String fieldName = field.getFieldDef().getName();
    return providedFields.stream()
        .anyMatch(
            provided ->
                provided.getFieldDef().getName().equals(fieldName)
                    && (provided.getParentType().equals(field.getParentType())
                        || provided.getScope().isPossibleType(field.getParentType())));
  }

  /** Returns the group depending on this one for the given subgraph, or null. */
  public FetchGroup getDependentGroup(String dependentServiceName) {
    return dependentGroupsByService.get(dependentServiceName);
  }

  public void putDependentGroup(String dependentServiceName, FetchGroup group) {
    checkNotFrozen();
    dependentGroupsByService.put(dependentServiceName, group);
  }

  /** Returns the ids of the groups that must complete before this one, in ascending order. */
  public Set<Integer> getDependencyIds() {
    return Collections.unmodifiableSet(dependencyIds);
  }

  public void addDependency(int dependencyId) {
    checkNotFrozen();
    checkState(isFetch(), "Nested fetch groups have no dependencies");
    if (dependencyId != id) {
      dependencyIds.add(dependencyId);
    }
  }

  /** Points a dependency on a group merged away to the group it was merged into. */
  public void replaceDependency(int fromId, int toId) {
    checkNotFrozen();
    if (dependencyIds.remove(fromId)) {
      addDependency(toId);
    }
  }

  /** Takes over the fields and representations of a group with the same dependencies. */
  public void absorb(FetchGroup other) {
    checkNotFrozen();
    fields.addAll(other.fields);
    requiredFields.addAll(other.requiredFields);
  }

  /** Returns true if this group has no upstream dependencies. */
  public boolean isRoot() {
    return dependencyIds.isEmpty();
  }

  public void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkNotFrozen() {
    checkState(!frozen, "Fetch group %s is frozen", this);
  }

  @Override
  public String toString() {
    return "FetchGroup{"
        + "id="
        + (isFetch() ? String.valueOf(id) : "nested")
        + ", service='"
        + serviceName
        + "', mergeAt="
        + mergeAt
        + ", deps="
        + dependencyIds
        + '}';
  }
}
