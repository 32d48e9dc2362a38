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

/**
 * Blocking client.
 *
 * <p>Every operation runs on the calling thread. {@link #receive(String, DeliveryHandler)} does not
 * return until consumption stops, applications consuming several queues at the same time use one
 * client per thread.
 *
 * <p>Transport failures surface immediately, there is no automatic reconnection.
 */
public interface SyncClient extends MessagingClient {

  /**
   * Open the connection and its channel.
   *
   * @param host broker host
   * @param port broker port, 0 for the default port
   * @param username username
   * @param password password
   */
  void connect(String host, int port, String username, String password);

  /**
   * Publish a payload to a queue through the default exchange.
   *
   * @param queue queue name
   * @param payload payload
   */
  void send(String queue, Payload payload);

  /**
   * Publish a payload to a queue.
   *
   * <p>The queue is declared (or checked) first. Messages are persistent if the client is durable.
   * There is no confirmation from the broker.
   *
   * @param queue queue name, also the routing key
   * @param payload payload
   * @param exchange exchange name, empty string for the default exchange
   */
  void send(String queue, Payload payload, String exchange);

  /**
   * Consume messages from a queue, blocking the calling thread.
   *
   * <p>Messages are dispatched to the handler one at a time on the calling thread, in the order
   * they are delivered. The method returns when the consumer is cancelled (queue deleted, client
   * disconnected from another thread, calling thread interrupted).
   *
   * @param queue queue name
   * @param handler message handler
   */
  void receive(String queue, DeliveryHandler handler);

  /**
   * Delete a queue.
   *
   * @param queue queue name
   */
  void deleteQueue(String queue);

  /**
   * Delete an exchange.
   *
   * @param exchange exchange name
   */
  void deleteExchange(String exchange);

  /**
   * Acknowledge a message, to call from the handler when auto-ack is disabled.
   *
   * <p>Must be called exactly once per delivered message. This is a no-op if auto-ack is enabled.
   *
   * @param context the delivery context of the message
   */
  void commitAck(DeliveryContext context);

  /** Close the connection. The client cannot be used anymore. */
  void disconnect();

  /** Contract to process a message. */
  @FunctionalInterface
  interface DeliveryHandler {

    /**
     * Process a message.
     *
     * @param message the message
     */
    void handle(IncomingMessage message);
  }
}
