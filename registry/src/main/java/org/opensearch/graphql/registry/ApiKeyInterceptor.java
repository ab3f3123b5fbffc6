/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.registry;

import java.io.IOException;
import lombok.NonNull;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

/** Adds the registry api key to every outgoing request. */
public class ApiKeyInterceptor implements Interceptor {

  public static final String API_KEY_HEADER = "X-API-KEY";

  private final String apiKey;

  public ApiKeyInterceptor(@NonNull String apiKey) {
    this.apiKey = apiKey;
  }

  @Override
  public Response intercept(Interceptor.Chain chain) throws IOException {
    Request request = chain.request();
    Request authenticated = request.newBuilder().header(API_KEY_HEADER, apiKey).build();
    return chain.proceed(authenticated);
  }
}
