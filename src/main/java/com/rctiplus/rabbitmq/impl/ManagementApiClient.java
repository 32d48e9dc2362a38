// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rctiplus.rabbitmq.impl;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.rctiplus.rabbitmq.MessagingException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists queues with the broker HTTP management API.
 *
 * <p>Plain HTTP GET on <code>/api/queues/{vhost}</code> with basic authentication. No retry, no
 * pagination.
 */
final class ManagementApiClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManagementApiClient.class);

  private static final Gson GSON = new Gson();
  private static final TypeToken<List<Map<String, Object>>> QUEUES_TYPE = new TypeToken<>() {};

  private final HttpClient client;
  private final Duration requestTimeout;

  ManagementApiClient(Duration requestTimeout) {
    this(requestTimeout, ignored -> {});
  }

  ManagementApiClient(Duration requestTimeout, Consumer<HttpClient.Builder> clientBuilderConsumer) {
    this.requestTimeout = requestTimeout;
    HttpClient.Builder builder = HttpClient.newBuilder().connectTimeout(requestTimeout);
    clientBuilderConsumer.accept(builder);
    this.client = builder.build();
  }

  CompletableFuture<List<String>> queues(
      String username, String password, String host, int port, String virtualHost) {
    URI uri;
    try {
      uri = URI.create(UriUtils.queuesManagementUri(host, port, virtualHost));
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(
          new MessagingException("Invalid management API endpoint %s:%d", host, port));
    }
    HttpRequest request =
        HttpRequest.newBuilder(uri)
            .timeout(this.requestTimeout)
            .header("authorization", authorization(username, password))
            .header("accept", "application/json")
            .GET()
            .build();
    LOGGER.debug("Listing queues with {}", uri);
    return this.client
        .sendAsync(request, HttpResponse.BodyHandlers.ofString(UTF_8))
        .handle(
            (response, throwable) -> {
              if (throwable != null) {
                throw ExceptionUtils.convert(
                    throwable, "Error while listing queues with %s", uri);
              }
              return names(uri, response);
            });
  }

  private static List<String> names(URI uri, HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode < 200 || statusCode >= 300) {
      throw new MessagingException.MessagingManagementApiException(
          statusCode, "Unexpected response code " + statusCode + " from " + uri);
    }
    List<Map<String, Object>> queues;
    try {
      queues = GSON.fromJson(response.body(), QUEUES_TYPE);
    } catch (JsonParseException e) {
      throw new MessagingException("Invalid JSON response from " + uri, e);
    }
    if (queues == null) {
      return List.of();
    }
    List<String> names = new ArrayList<>(queues.size());
    for (Map<String, Object> queue : queues) {
      Object name = queue == null ? null : queue.get("name");
      if (name != null) {
        names.add(name.toString());
      }
    }
    return names;
  }

  private static String authorization(String username, String password) {
    String credentials =
        (username == null ? "" : username) + ":" + (password == null ? "" : password);
    return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(UTF_8));
  }
}
