/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.planner;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.graphql.planner.assembler.PlanAssembler;
import org.opensearch.graphql.planner.exceptions.FailedParsingQueryException;
import org.opensearch.graphql.planner.exceptions.FailedParsingSchemaException;
import org.opensearch.graphql.planner.exceptions.InvalidQueryException;
import org.opensearch.graphql.planner.federation.FederationIndex;
import org.opensearch.graphql.planner.federation.FederationMetadataResolver;
import org.opensearch.graphql.planner.group.FetchGroupBuilder;
import org.opensearch.graphql.planner.group.FetchGroupGraph;
import org.opensearch.graphql.planner.model.QueryPlan;
import org.opensearch.graphql.planner.parser.QueryParser;
import org.opensearch.graphql.planner.parser.SchemaParser;
import org.opensearch.graphql.planner.query.OperationDefinition;
import org.opensearch.graphql.planner.query.QueryDocument;
import org.opensearch.graphql.planner.schema.SchemaDocument;
import org.opensearch.graphql.planner.visitor.QueryPlanningContext;

/**
 * Plans client operations against a federated supergraph. The schema is parsed once at
 * construction; a planner is immutable and can plan concurrently from several threads.
 */
@Log4j2
public class QueryPlanner {

  @Getter private final SchemaDocument schema;
  @Getter private final FederationIndex federation;

  private final QueryParser queryParser = new QueryParser();

  /**
   * Create a planner for a composed schema.
   *
   * @param schemaSdl supergraph SDL annotated with ownership and key metadata
   * @throws FailedParsingSchemaException if the schema or its federation metadata is malformed
   */
  public QueryPlanner(String schemaSdl) {
    this.schema = new SchemaParser().parse(schemaSdl);
    this.federation = new FederationMetadataResolver().resolve(schema);
    log.info(
        "Created query planner for {} types across subgraphs {}",
        schema.getTypes().size(),
        federation.getGraphNames());
  }

  public static QueryPlanner create(String schemaSdl) {
    return new QueryPlanner(schemaSdl);
  }

  /**
   * Plan a document holding a single operation.
   *
   * @throws FailedParsingQueryException if the query is not syntactically valid
   * @throws InvalidQueryException if the query cannot be planned against the schema
   */
  public QueryPlan plan(String query, QueryPlanningOptions options) {
    return plan(query, null, options);
  }

  /**
   * Plan one operation of a document.
   *
   * @param query executable document
   * @param operationName operation to plan, or null if the document holds only one
   * @param options planning options
   * @return the query plan
   * @throws FailedParsingQueryException if the query is not syntactically valid
   * @throws InvalidQueryException if the query cannot be planned against the schema
   */
  public QueryPlan plan(String query, String operationName, QueryPlanningOptions options) {
    QueryDocument document = queryParser.parse(query);
    OperationDefinition operation = document.getOperation(operationName);
    QueryPlanningContext context =
        new QueryPlanningContext(schema, federation, document, operation, options);
    FetchGroupGraph graph = new FetchGroupBuilder(context).build();
    QueryPlan plan = new PlanAssembler(context).assemble(graph);
    log.debug("Planned {} operation into {} fetch(es)", operation.getType(), graph.getGroupCount());
    return plan;
  }
}
