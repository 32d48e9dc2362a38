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
 * Broker-assigned information about a delivered message, required to acknowledge it.
 *
 * <p>A context is bound to the channel the message was delivered on. It becomes stale if the client
 * replaces this channel (e.g. after a topology conflict), acknowledging it then fails.
 *
 * @see SyncClient#commitAck(DeliveryContext)
 * @see AsyncClient#commitAck(IncomingMessage)
 */
public interface DeliveryContext {

  /**
   * The delivery tag, unique per channel.
   *
   * @return delivery tag
   */
  long deliveryTag();

  /**
   * The tag of the consumer the message was delivered to.
   *
   * @return consumer tag
   */
  String consumerTag();

  /**
   * The queue the message was consumed from.
   *
   * @return queue name
   */
  String queue();

  /**
   * Whether the message has been delivered before.
   *
   * @return true if redelivered
   */
  boolean redelivered();

  /**
   * Whether the message has been acknowledged with {@code commitAck}.
   *
   * @return true if acknowledged
   */
  boolean acknowledged();
}
