/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.graphql.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
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
class ApiKeyInterceptorTest {

  @Mock private Interceptor.Chain chain;

  @Test
  void adds_api_key_header() throws IOException {
    Request request =
        new Request.Builder()
            .url("http://localhost:4000/api/graphql")
            .header(ApiKeyInterceptor.API_KEY_HEADER, "stale")
            .build();
    when(chain.request()).thenReturn(request);
    when(chain.proceed(any()))
        .thenReturn(
            new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(200)
                .message("OK")
                .build());

    new ApiKeyInterceptor("user:secret").intercept(chain);

    ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
    verify(chain).proceed(captor.capture());
    assertEquals(
        "user:secret", captor.getValue().header(ApiKeyInterceptor.API_KEY_HEADER));
    assertEquals(1, captor.getValue().headers(ApiKeyInterceptor.API_KEY_HEADER).size());
  }

  @Test
  void rejects_null_api_key() {
    assertThrows(NullPointerException.class, () -> new ApiKeyInterceptor(null));
  }
}
