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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rctiplus.rabbitmq.DeliveryContext;
import com.rctiplus.rabbitmq.IncomingMessage;
import com.rctiplus.rabbitmq.Payload;
import com.rctiplus.rabbitmq.PayloadParser;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.atomic.AtomicBoolean;

final class DefaultIncomingMessage implements IncomingMessage {

  static final int PERSISTENT_DELIVERY_MODE = 2;

  private final byte[] body;
  private final AMQP.BasicProperties properties;
  private final Envelope envelope;
  private final DefaultDeliveryContext context;

  DefaultIncomingMessage(
      Channel channel,
      String queue,
      String consumerTag,
      Envelope envelope,
      AMQP.BasicProperties properties,
      byte[] body) {
    this.body = body == null ? new byte[0] : body;
    this.properties = properties;
    this.envelope = envelope;
    this.context = new DefaultDeliveryContext(channel, queue, consumerTag, envelope);
  }

  @Override
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public byte[] body() {
    return this.body;
  }

  @Override
  public String bodyAsString() {
    return new String(this.body, UTF_8);
  }

  @Override
  public <T extends Payload> T payload(PayloadParser<T> parser) {
    return parser.fromString(this.bodyAsString());
  }

  @Override
  public boolean persistent() {
    return this.properties != null
        && this.properties.getDeliveryMode() != null
        && this.properties.getDeliveryMode() == PERSISTENT_DELIVERY_MODE;
  }

  @Override
  public String exchange() {
    return this.envelope.getExchange();
  }

  @Override
  public String routingKey() {
    return this.envelope.getRoutingKey();
  }

  @Override
  public DefaultDeliveryContext context() {
    return this.context;
  }

  @Override
  public String toString() {
    return "IncomingMessage{"
        + "queue='"
        + this.context.queue
        + "', deliveryTag="
        + this.context.deliveryTag()
        + ", size="
        + this.body.length
        + '}';
  }

  static final class DefaultDeliveryContext implements DeliveryContext {

    private final Channel channel;
    private final String queue;
    private final String consumerTag;
    private final long deliveryTag;
    private final boolean redelivered;
    private final AtomicBoolean acknowledged = new AtomicBoolean(false);

    private DefaultDeliveryContext(
        Channel channel, String queue, String consumerTag, Envelope envelope) {
      this.channel = channel;
      this.queue = queue;
      this.consumerTag = consumerTag;
      this.deliveryTag = envelope.getDeliveryTag();
      this.redelivered = envelope.isRedeliver();
    }

    Channel channel() {
      return this.channel;
    }

    void markAcknowledged() {
      this.acknowledged.set(true);
    }

    @Override
    public long deliveryTag() {
      return this.deliveryTag;
    }

    @Override
    public String consumerTag() {
      return this.consumerTag;
    }

    @Override
    public String queue() {
      return this.queue;
    }

    @Override
    public boolean redelivered() {
      return this.redelivered;
    }

    @Override
    public boolean acknowledged() {
      return this.acknowledged.get();
    }
  }
}
