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
 * Common contract of the blocking and asynchronous clients.
 *
 * <p>A client owns exactly one connection and one channel. The durability and auto-delete settings
 * apply to every queue the client declares, use several client instances for different policies.
 *
 * <p>Client instances are not thread-safe, concurrent use of the same instance must be serialized
 * by the caller.
 *
 * @see SyncClient
 * @see AsyncClient
 * @see com.rctiplus.rabbitmq.impl.RabbitMqClientBuilder
 */
public interface MessagingClient extends AutoCloseable, Resource {

  /** Default exchange (nameless, routes by queue name). */
  String DEFAULT_EXCHANGE = "";

  /**
   * Whether queues are declared durable and messages published as persistent.
   *
   * @return durable flag
   */
  boolean durable();

  /**
   * Whether the broker considers messages acknowledged as soon as they are delivered.
   *
   * @return auto-ack flag
   */
  boolean autoAck();

  /**
   * Whether queues and exchanges are declared auto-delete.
   *
   * @return auto-delete flag
   */
  boolean autoDelete();

  /**
   * The policy used to make sure queues exist.
   *
   * @return the queue topology policy
   */
  TopologyPolicy queueTopologyPolicy();

  /**
   * The current state of the client.
   *
   * @return state
   */
  State state();

  /** Release the connection, same as {@code disconnect}. */
  @Override
  void close();
}
