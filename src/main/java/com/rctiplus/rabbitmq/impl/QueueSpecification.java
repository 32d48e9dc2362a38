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

/** A queue with the declaration parameters of the client that uses it. */
final class QueueSpecification {

  private final String name;
  private final boolean durable;
  private final boolean autoDelete;

  QueueSpecification(String name, boolean durable, boolean autoDelete) {
    this.name = name;
    this.durable = durable;
    this.autoDelete = autoDelete;
  }

  /** Passive declaration, fails if the queue does not exist. */
  ManagedChannel.ChannelOperation<AMQP.Queue.DeclareOk> ensure() {
    return channel -> channel.queueDeclarePassive(this.name);
  }

  ManagedChannel.ChannelOperation<AMQP.Queue.DeclareOk> declare() {
    return channel -> channel.queueDeclare(this.name, this.durable, false, this.autoDelete, null);
  }

  @Override
  public String toString() {
    return "queue '"
        + this.name
        + "' (durable="
        + this.durable
        + ", auto-delete="
        + this.autoDelete
        + ")";
  }
}
