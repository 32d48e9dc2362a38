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

import static com.rctiplus.rabbitmq.impl.HttpTestUtils.startServer;
import static com.rctiplus.rabbitmq.impl.TestUtils.randomNetworkPort;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rctiplus.rabbitmq.AsyncClient;
import com.rctiplus.rabbitmq.MessagingException;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ManagementApiClientTest {

  static final String QUEUES =
      "[{\"name\":\"a\",\"vhost\":\"/\",\"messages\":0},"
          + "{\"name\":\"b\",\"vhost\":\"/\",\"messages\":3}]";

  HttpServer server;
  int port;
  ManagementApiClient client = new ManagementApiClient(Duration.ofSeconds(10));

  @BeforeEach
  void init() throws IOException {
    this.port = randomNetworkPort();
  }

  @AfterEach
  public void tearDown() {
    if (server != null) {
      server.stop(0);
    }
  }

  @Test
  void queuesShouldReturnNamesInResponseOrder() throws Exception {
    AtomicReference<String> httpMethod = new AtomicReference<>();
    AtomicReference<String> authorization = new AtomicReference<>();
    AtomicReference<String> path = new AtomicReference<>();
    server =
        startServer(
            port,
            "/api/queues",
            exchange -> {
              httpMethod.set(exchange.getRequestMethod());
              authorization.set(exchange.getRequestHeaders().getFirst("authorization"));
              path.set(exchange.getRequestURI().getRawPath());
              respond(200, QUEUES).handle(exchange);
            });

    List<String> queues =
        client.queues("guest", "guest", "localhost", port, "/").get(10, TimeUnit.SECONDS);

    assertThat(queues).containsExactly("a", "b");
    assertThat(httpMethod).hasValue("GET");
    assertThat(authorization).hasValue("Basic Z3Vlc3Q6Z3Vlc3Q=");
    assertThat(path).hasValue("/api/queues/%2F");
  }

  @Test
  void queuesShouldNotBeResorted() throws Exception {
    server =
        startServer(
            port,
            "/api/queues",
            respond(200, "[{\"name\":\"zeta\"},{\"name\":\"alpha\"},{\"name\":\"mu\"}]"));

    List<String> queues =
        client.queues("guest", "guest", "localhost", port, null).get(10, TimeUnit.SECONDS);

    assertThat(queues).containsExactly("zeta", "alpha", "mu");
  }

  @Test
  void emptyVirtualHostShouldListAllQueues() throws Exception {
    AtomicReference<String> path = new AtomicReference<>();
    server =
        startServer(
            port,
            "/api/queues",
            exchange -> {
              path.set(exchange.getRequestURI().getRawPath());
              respond(200, "[]").handle(exchange);
            });

    List<String> queues =
        client.queues("guest", "guest", "localhost", port, "").get(10, TimeUnit.SECONDS);

    assertThat(queues).isEmpty();
    assertThat(path).hasValue("/api/queues/");
  }

  @Test
  void unsuccessfulResponseShouldFailWithStatusCode() {
    server = startServer(port, "/api/queues", respond(401, "{\"error\":\"not_authorized\"}"));

    assertThatThrownBy(
            () ->
                client.queues("guest", "wrong", "localhost", port, null).get(10, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOf(MessagingException.MessagingManagementApiException.class)
        .satisfies(
            e ->
                assertThat(((MessagingException.MessagingManagementApiException) e).statusCode())
                    .isEqualTo(401));
  }

  @Test
  void unreachableEndpointShouldFailWithConnectionException() {
    assertThatThrownBy(
            () ->
                client.queues("guest", "guest", "localhost", port, null).get(10, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(MessagingException.MessagingConnectionException.class);
  }

  @Test
  void asyncClientShouldListQueuesWithoutAmqpConnection() throws Exception {
    server = startServer(port, "/api/queues", respond(200, QUEUES));
    AsyncClient asyncClient = new RabbitMqClientBuilder().buildAsync();
    try {
      List<String> queues =
          asyncClient
              .listQueues("guest", "guest", "localhost", port, null)
              .get(10, TimeUnit.SECONDS);
      assertThat(queues).containsExactly("a", "b");
    } finally {
      asyncClient.close();
    }
  }

  static HttpHandler respond(int statusCode, String body) {
    return exchange -> {
      byte[] data = body.getBytes(UTF_8);
      exchange.getResponseHeaders().set("content-type", "application/json");
      exchange.sendResponseHeaders(statusCode, data.length);
      OutputStream responseBody = exchange.getResponseBody();
      responseBody.write(data);
      responseBody.close();
    };
  }
}
