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
package com.rctiplus.rabbitmq;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Asynchronous client.
 *
 * <p>Network operations run on a single-threaded event loop and complete the returned {@link
 * CompletableFuture}. Code running on the loop (e.g. delivery handlers) must never block on these
 * futures, it must chain on them.
 *
 * <p>The connection recovers automatically from transport failures, the client goes to {@link
 * Resource.State#RECOVERING} and back to {@link Resource.State#CONNECTED}.
 */
public interface AsyncClient extends MessagingClient {

  /**
   * Open the connection and its channel.
   *
   * <p>Username and password are percent-encoded in the connection URI, so they can contain any
   * character.
   *
   * @param host broker host
   * @param port broker port, 0 for the default port
   * @param username username
   * @param password password
   * @return future completed once connected
   */
  CompletableFuture<Void> connect(String host, int port, String username, String password);

  /**
   * Publish a payload to a queue through the default exchange.
   *
   * @param queue queue name
   * @param payload payload
   * @return future completed once the message is handed over to the connection
   */
  CompletableFuture<Void> send(String queue, Payload payload);

  /**
   * Publish a payload to a queue.
   *
   * @param queue queue name, also the routing key
   * @param payload payload
   * @param exchange exchange name, empty string for the default exchange
   * @return future completed once the message is handed over to the connection
   */
  CompletableFuture<Void> send(String queue, Payload payload, String exchange);

  /**
   * Register a handler for the messages of a queue.
   *
   * <p>The future completes as soon as the consumer is registered. The handler is then called on
   * the event loop for each message, one at a time for a given subscription: the next message is
   * dispatched once the stage returned for the previous one completes.
   *
   * @param queue queue name
   * @param handler message handler
   * @return future of the subscription
   */
  CompletableFuture<Subscription> receive(String queue, DeliveryHandler handler);

  /**
   * Delete a queue.
   *
   * @param queue queue name
   * @return future completed once deleted
   */
  CompletableFuture<Void> deleteQueue(String queue);

  /**
   * Delete an exchange.
   *
   * @param exchange exchange name
   * @return future completed once deleted
   */
  CompletableFuture<Void> deleteExchange(String exchange);

  /**
   * Acknowledge a message, to call from the handler when auto-ack is disabled.
   *
   * <p>Handlers should return a stage that depends on the returned future when the outcome matters.
   *
   * @param message the message to acknowledge
   * @return future completed once the acknowledgement is sent
   */
  CompletableFuture<Void> commitAck(IncomingMessage message);

  /**
   * List queue names with the HTTP management API, with default settings (guest/guest on
   * localhost:15672, all virtual hosts).
   *
   * @return future of queue names
   * @see #listQueues(String, String, String, int, String)
   */
  CompletableFuture<List<String>> listQueues();

  /**
   * List queue names with the HTTP management API.
   *
   * <p>This does not use the AMQP connection, it can be called in any state. Names are returned in
   * the order of the API response.
   *
   * @param username management username
   * @param password management password
   * @param host management host
   * @param port management port
   * @param virtualHost virtual host, null for all virtual hosts
   * @return future of queue names
   */
  CompletableFuture<List<String>> listQueues(
      String username, String password, String host, int port, String virtualHost);

  /**
   * Close the connection. Subscriptions stop and the client cannot be used anymore.
   *
   * @return future completed once closed
   */
  CompletableFuture<Void> disconnect();

  /** Contract to process a message asynchronously. */
  @FunctionalInterface
  interface DeliveryHandler {

    /**
     * Process a message.
     *
     * @param message the message
     * @return stage completed when the processing is over
     */
    CompletionStage<Void> handle(IncomingMessage message);
  }

  /** A registered consumer. */
  interface Subscription {

    /**
     * The consumed queue.
     *
     * @return queue name
     */
    String queue();

    /**
     * The broker consumer tag.
     *
     * @return consumer tag
     */
    String consumerTag();

    /**
     * Stop consuming.
     *
     * @return future completed once cancelled
     */
    CompletableFuture<Void> cancel();
  }
}
