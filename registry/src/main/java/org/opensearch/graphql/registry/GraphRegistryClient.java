/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.opensearch.graphql.registry.model.GraphQLError;
import org.opensearch.graphql.registry.model.GraphQLRequest;
import org.opensearch.graphql.registry.model.GraphQLResponse;

/**
 * Client of the graph registry GraphQL API. Lists the accounts the api key's user belongs to and
 * registers new graphs.
 */
@Log4j2
public class GraphRegistryClient {

  static final String GET_ORG_MEMBERSHIPS_QUERY =
      "query GetOrgMemberships { me { ...on User { memberships { account { id } } } } }";

  static final String CREATE_GRAPH_MUTATION =
      "mutation CreateGraph($accountID: ID!, $graphID: ID!) "
          + "{ newService(accountId: $accountID, id: $graphID) { id apiKeys { token } } }";

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final Call.Factory callFactory;

  private final String endpoint;

  /** Create a client sending requests through an http client built from the configuration. */
  public GraphRegistryClient(GraphRegistryConfig config) {
    this(httpClient(config), config.getEndpoint());
  }

  public GraphRegistryClient(Call.Factory callFactory, String endpoint) {
    this.callFactory = callFactory;
    this.endpoint = endpoint;
  }

  /**
   * Returns the ids of the accounts the authenticated user is a member of.
   *
   * @throws GraphRegistryException if the request fails or the api key is not accepted
   */
  public Set<String> getOrgMemberships() {
    JsonNode data = execute(new GraphQLRequest(GET_ORG_MEMBERSHIPS_QUERY));
    JsonNode me = data.path("me");
    if (me.isMissingNode() || me.isNull()) {
      log.error("Graph registry did not authenticate the api key");
      throw new GraphRegistryException(
          "Could not authenticate. Please check that your auth token is up-to-date");
    }
    Set<String> accountIds = new LinkedHashSet<>();
    for (JsonNode membership : me.path("memberships")) {
      String accountId = membership.path("account").path("id").asText(null);
      if (accountId != null) {
        accountIds.add(accountId);
      }
    }
    return accountIds;
  }

  /**
   * Registers a graph under an account.
   *
   * @param graphId id of the new graph
   * @param accountId account owning the graph
   * @return the api key of the new graph
   * @throws GraphRegistryException if the request fails or the reply carries no api key
   */
  public String createGraph(String graphId, String accountId) {
    Map<String, Object> variables = ImmutableMap.of("graphID", graphId, "accountID", accountId);
    JsonNode data = execute(new GraphQLRequest(CREATE_GRAPH_MUTATION, variables));
    JsonNode token = data.path("newService").path("apiKeys").path(0).path("token");
    if (!token.isTextual()) {
      log.error("Graph registry created graph {} without returning an api key", graphId);
      throw new GraphRegistryException("No api key returned for new graph " + graphId);
    }
    return token.asText();
  }

  private JsonNode execute(GraphQLRequest graphQLRequest) {
    Request request =
        new Request.Builder()
            .url(endpoint)
            .post(RequestBody.create(toJson(graphQLRequest), JSON))
            .build();
    String body;
    try (Response response = callFactory.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      body = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        log.error("Graph registry request failed with status {}: {}", response.code(), body);
        throw new GraphRegistryException(
            "Graph registry request failed with status " + response.code());
      }
    } catch (IOException e) {
      log.error("Graph registry request to {} failed", endpoint, e);
      throw new GraphRegistryException("Graph registry request failed: " + e.getMessage(), e);
    }

    GraphQLResponse graphQLResponse;
    try {
      graphQLResponse = OBJECT_MAPPER.readValue(body, GraphQLResponse.class);
    } catch (JsonProcessingException e) {
      log.error("Invalid response from graph registry: {}", body);
      throw new GraphRegistryException("Invalid response from graph registry", e);
    }
    if (graphQLResponse.hasErrors()) {
      String messages =
          graphQLResponse.getErrors().stream()
              .map(GraphQLError::getMessage)
              .collect(Collectors.joining("; "));
      log.error("Graph registry returned errors: {}", messages);
      throw new GraphRegistryException("Graph registry returned errors: " + messages);
    }
    if (graphQLResponse.getData() == null || graphQLResponse.getData().isNull()) {
      log.error("Graph registry returned no data");
      throw new GraphRegistryException("Graph registry returned no data");
    }
    return graphQLResponse.getData();
  }

  private static String toJson(GraphQLRequest request) {
    try {
      return OBJECT_MAPPER.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode graph registry request", e);
    }
  }

  private static OkHttpClient httpClient(GraphRegistryConfig config) {
    config.validate();
    return new OkHttpClient.Builder()
        .addInterceptor(new ApiKeyInterceptor(config.getApiKey()))
        .connectTimeout(config.getConnectTimeoutMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(config.getReadTimeoutMillis(), TimeUnit.MILLISECONDS)
        .build();
  }
}
