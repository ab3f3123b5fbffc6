/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Where the graph registry lives and how to authenticate against it. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class GraphRegistryConfig {

  private static final Logger LOG = LogManager.getLogger();

  private static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 10_000L;

  private static final long DEFAULT_READ_TIMEOUT_MILLIS = 30_000L;

  @JsonProperty(required = true)
  private String endpoint;

  @JsonProperty(required = true)
  private String apiKey;

  private long connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;

  private long readTimeoutMillis = DEFAULT_READ_TIMEOUT_MILLIS;

  public GraphRegistryConfig(String endpoint, String apiKey) {
    this.endpoint = endpoint;
    this.apiKey = apiKey;
  }

  /**
   * Reads the registry configuration from a JSON document.
   *
   * @param inputStream configuration json
   * @return registry configuration
   * @throws IllegalArgumentException if the document is malformed or misses a required setting
   */
  public static GraphRegistryConfig fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      GraphRegistryConfig config = objectMapper.readValue(inputStream, GraphRegistryConfig.class);
      config.validate();
      return config;
    } catch (IOException e) {
      LOG.error("Graph registry configuration is malformed.");
      throw new IllegalArgumentException(
          "Malformed graph registry configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Checks the configuration can be used to build a client.
   *
   * @throws IllegalArgumentException if a setting is missing or out of range
   */
  public void validate() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("Graph registry api key is required");
    }
    if (endpoint == null || endpoint.isBlank()) {
      throw new IllegalArgumentException("Graph registry endpoint is required");
    }
    if (connectTimeoutMillis < 0 || readTimeoutMillis < 0) {
      throw new IllegalArgumentException("Graph registry timeouts must not be negative");
    }
  }
}
