/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Set;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GraphRegistryClientTest {

  private static final String ENDPOINT = "http://localhost:4000/api/graphql";

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private Call.Factory callFactory;

  @Mock private Call call;

  private GraphRegistryClient client;

  @BeforeEach
  void setUp() {
    when(callFactory.newCall(any())).thenReturn(call);
    client = new GraphRegistryClient(callFactory, ENDPOINT);
  }

  @Test
  void get_org_memberships_returns_account_ids() throws IOException {
    respondWith(
        200,
        "{\"data\":{\"me\":{\"memberships\":["
            + "{\"account\":{\"id\":\"acme\"}},{\"account\":{\"id\":\"globex\"}}]}}}");

    Set<String> accounts = client.getOrgMemberships();

    assertEquals(Set.of("acme", "globex"), accounts);
    JsonNode sent = sentBody();
    assertEquals(GraphRegistryClient.GET_ORG_MEMBERSHIPS_QUERY, sent.get("query").asText());
    assertTrue(sent.path("variables").isMissingNode());
  }

  @Test
  void get_org_memberships_fails_when_not_authenticated() throws IOException {
    respondWith(200, "{\"data\":{\"me\":null}}");

    GraphRegistryException exception =
        assertThrows(GraphRegistryException.class, () -> client.getOrgMemberships());
    assertEquals(
        "Could not authenticate. Please check that your auth token is up-to-date",
        exception.getMessage());
  }

  @Test
  void create_graph_sends_variables_and_returns_api_key() throws IOException {
    respondWith(
        200,
        "{\"data\":{\"newService\":{\"id\":\"products\","
            + "\"apiKeys\":[{\"token\":\"service:products:abc\"}]}}}");

    String token = client.createGraph("products", "acme");

    assertEquals("service:products:abc", token);
    JsonNode sent = sentBody();
    assertEquals(GraphRegistryClient.CREATE_GRAPH_MUTATION, sent.get("query").asText());
    assertEquals("products", sent.path("variables").path("graphID").asText());
    assertEquals("acme", sent.path("variables").path("accountID").asText());
  }

  @Test
  void create_graph_fails_without_api_key() throws IOException {
    respondWith(200, "{\"data\":{\"newService\":{\"id\":\"products\",\"apiKeys\":[]}}}");

    assertThrows(GraphRegistryException.class, () -> client.createGraph("products", "acme"));
  }

  @Test
  void graphql_errors_are_reported() throws IOException {
    respondWith(200, "{\"data\":null,\"errors\":[{\"message\":\"graph already exists\"}]}");

    GraphRegistryException exception =
        assertThrows(GraphRegistryException.class, () -> client.createGraph("products", "acme"));
    assertEquals("Graph registry returned errors: graph already exists", exception.getMessage());
  }

  @Test
  void http_error_status_is_reported() throws IOException {
    respondWith(500, "internal error");

    GraphRegistryException exception =
        assertThrows(GraphRegistryException.class, () -> client.getOrgMemberships());
    assertEquals("Graph registry request failed with status 500", exception.getMessage());
  }

  @Test
  void undecodable_body_is_reported() throws IOException {
    respondWith(200, "<html>not json</html>");

    assertThrows(GraphRegistryException.class, () -> client.getOrgMemberships());
  }

  @Test
  void missing_data_is_reported() throws IOException {
    respondWith(200, "{}");

    GraphRegistryException exception =
        assertThrows(GraphRegistryException.class, () -> client.getOrgMemberships());
    assertEquals("Graph registry returned no data", exception.getMessage());
  }

  @Test
  void transport_failure_keeps_cause() throws IOException {
    IOException failure = new IOException("connection refused");
    when(call.execute()).thenThrow(failure);

    GraphRegistryException exception =
        assertThrows(GraphRegistryException.class, () -> client.getOrgMemberships());
    assertSame(failure, exception.getCause());
  }

  private void respondWith(int code, String body) throws IOException {
    Request request = new Request.Builder().url(ENDPOINT).build();
    Response response =
        new Response.Builder()
            .request(request)
            .protocol(Protocol.HTTP_1_1)
            .code(code)
            .message(code == 200 ? "OK" : "Error")
            .body(ResponseBody.create(body, MediaType.get("application/json")))
            .build();
    when(call.execute()).thenReturn(response);
  }

  private JsonNode sentBody() throws IOException {
    ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
    verify(callFactory).newCall(captor.capture());
    Request request = captor.getValue();
    assertEquals("POST", request.method());
    assertEquals(ENDPOINT, request.url().toString());
    Buffer buffer = new Buffer();
    request.body().writeTo(buffer);
    return objectMapper.readTree(buffer.readUtf8());
  }
}
