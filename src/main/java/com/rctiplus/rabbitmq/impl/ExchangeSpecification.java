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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;

/**
 * A direct exchange with the auto-delete flag of the client that uses it.
 *
 * <p>Exchanges are never durable, whatever the durability of the client queues.
 */
final class ExchangeSpecification {

  private final String name;
  private final boolean autoDelete;

  ExchangeSpecification(String name, boolean autoDelete) {
    this.name = name;
    this.autoDelete = autoDelete;
  }

  ManagedChannel.ChannelOperation<AMQP.Exchange.DeclareOk> declare() {
    return channel ->
        channel.exchangeDeclare(
            this.name, BuiltinExchangeType.DIRECT, false, this.autoDelete, null);
  }

  /** Bind a queue with its name as the routing key, a no-op if the binding exists. */
  ManagedChannel.ChannelOperation<AMQP.Queue.BindOk> bind(String queue) {
    return channel -> channel.queueBind(queue, this.name, queue);
  }

  @Override
  public String toString() {
    return "exchange '" + this.name + "' (auto-delete=" + this.autoDelete + ")";
  }
}
