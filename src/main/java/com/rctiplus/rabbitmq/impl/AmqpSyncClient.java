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
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.rctiplus.rabbitmq.DeliveryContext;
import com.rctiplus.rabbitmq.MessagingException;
import com.rctiplus.rabbitmq.Payload;
import com.rctiplus.rabbitmq.SyncClient;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpSyncClient extends AmqpClientBase implements SyncClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpSyncClient.class);

  AmqpSyncClient(ClientSettings settings) {
    super(settings);
  }

  @Override
  public void connect(String host, int port, String username, String password) {
    this.doConnect(host, port, username, password);
  }

  @Override
  protected void configure(
      ConnectionFactory factory, String host, int port, String username, String password) {
    factory.setHost(host);
    if (port > 0) {
      factory.setPort(port);
    }
    factory.setUsername(username);
    factory.setPassword(password);
    factory.setVirtualHost(this.settings.virtualHost());
    factory.setAutomaticRecoveryEnabled(false);
  }

  @Override
  protected String connectionName() {
    return "rabbitmq-sync-client";
  }

  @Override
  public void send(String queue, Payload payload) {
    this.send(queue, payload, DEFAULT_EXCHANGE);
  }

  @Override
  public void send(String queue, Payload payload, String exchange) {
    this.doSend(queue, payload, exchange);
  }

  @Override
  public void receive(String queue, DeliveryHandler handler) {
    this.checkConnected();
    Utils.checkName(queue, "Queue");
    this.ensureQueue(queue);
    BlockingQueue<Object> deliveries = new LinkedBlockingQueue<>();
    ConsumerRegistration registration =
        new ConsumerRegistration(
            queue,
            this.autoAck(),
            ch -> new QueueingConsumer(ch, queue, deliveries),
            e -> deliveries.add(new End(null, null, e)));
    this.register(registration);
    try {
      while (true) {
        Object item = deliveries.take();
        if (item instanceof End) {
          End end = (End) item;
          if (end.failure != null) {
            throw end.failure;
          } else if (!registration.current(end.channel)) {
            // consumer of a channel replaced since, the registration moved to the new channel
            continue;
          } else if (end.signal == null || end.signal.isInitiatedByApplication()) {
            LOGGER.debug("Consumer on queue '{}' cancelled", queue);
            return;
          } else {
            throw ExceptionUtils.convert(end.signal);
          }
        }
        DefaultIncomingMessage message = (DefaultIncomingMessage) item;
        try {
          handler.handle(message);
        } catch (RuntimeException e) {
          LOGGER.debug("Error in handler of queue '{}', stopping consumption", queue);
          this.cancel(registration);
          throw e;
        }
      }
    } catch (InterruptedException e) {
      LOGGER.debug("Consumption of queue '{}' interrupted", queue);
      Thread.currentThread().interrupt();
      this.cancel(registration);
    } finally {
      this.unregister(registration);
    }
  }

  @Override
  public void deleteQueue(String queue) {
    this.doDeleteQueue(queue);
  }

  @Override
  public void deleteExchange(String exchange) {
    this.doDeleteExchange(exchange);
  }

  @Override
  public void commitAck(DeliveryContext context) {
    this.doCommitAck(context);
  }

  @Override
  public void disconnect() {
    this.doDisconnect();
  }

  @Override
  public void close() {
    this.disconnect();
  }

  private final class QueueingConsumer extends DefaultConsumer {

    private final String queue;
    private final BlockingQueue<Object> deliveries;

    private QueueingConsumer(Channel channel, String queue, BlockingQueue<Object> deliveries) {
      super(channel);
      this.queue = queue;
      this.deliveries = deliveries;
    }

    @Override
    public void handleDelivery(
        String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
      metricsCollector.consume();
      this.deliveries.add(
          new DefaultIncomingMessage(
              this.getChannel(), this.queue, consumerTag, envelope, properties, body));
    }

    @Override
    public void handleCancel(String consumerTag) {
      LOGGER.debug("Consumer '{}' cancelled by broker", consumerTag);
      this.deliveries.add(new End(this.getChannel(), null, null));
    }

    @Override
    public void handleCancelOk(String consumerTag) {
      this.deliveries.add(new End(this.getChannel(), null, null));
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
      this.deliveries.add(new End(this.getChannel(), sig, null));
    }
  }

  /** Marks the end of a consumer on a given channel. */
  private static final class End {

    private final Channel channel;
    private final ShutdownSignalException signal;
    private final MessagingException failure;

    private End(Channel channel, ShutdownSignalException signal, MessagingException failure) {
      this.channel = channel;
      this.signal = signal;
      this.failure = failure;
    }
  }
}
