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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rctiplus.rabbitmq.MessagingException;
import java.io.IOException;
import java.util.function.Function;

/**
 * A consumer of a client, registered again on the new channel when the client channel is reopened.
 */
final class ConsumerRegistration {

  private final String queue;
  private final boolean autoAck;
  private final Function<Channel, Consumer> consumerFactory;
  private final java.util.function.Consumer<MessagingException> restoreFailureCallback;
  private volatile Channel channel;
  private volatile String consumerTag;

  ConsumerRegistration(
      String queue,
      boolean autoAck,
      Function<Channel, Consumer> consumerFactory,
      java.util.function.Consumer<MessagingException> restoreFailureCallback) {
    this.queue = queue;
    this.autoAck = autoAck;
    this.consumerFactory = consumerFactory;
    this.restoreFailureCallback = restoreFailureCallback;
  }

  void consume(Channel channel) throws IOException {
    this.consumerTag =
        channel.basicConsume(this.queue, this.autoAck, this.consumerFactory.apply(channel));
    this.channel = channel;
  }

  void restoreFailed(MessagingException exception) {
    // the consumer is bound to no channel anymore, end signals of the previous one are stale
    this.channel = null;
    this.restoreFailureCallback.accept(exception);
  }

  void cancel() throws IOException {
    Channel ch = this.channel;
    if (ch != null && ch.isOpen()) {
      ch.basicCancel(this.consumerTag);
    }
  }

  /** Whether the registration currently consumes on this channel. */
  boolean current(Channel channel) {
    return this.channel == channel;
  }

  String queue() {
    return this.queue;
  }

  String consumerTag() {
    return this.consumerTag;
  }

  @Override
  public String toString() {
    return "consumer '" + this.consumerTag + "' on queue '" + this.queue + "'";
  }
}
