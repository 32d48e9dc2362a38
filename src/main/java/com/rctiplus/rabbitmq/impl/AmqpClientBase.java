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

import static com.rctiplus.rabbitmq.Resource.State.CONNECTED;
import static com.rctiplus.rabbitmq.Resource.State.CONNECTING;
import static com.rctiplus.rabbitmq.Resource.State.DISCONNECTED;
import static com.rctiplus.rabbitmq.Resource.State.UNCONNECTED;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import com.rctiplus.rabbitmq.DeliveryContext;
import com.rctiplus.rabbitmq.MessagingClient;
import com.rctiplus.rabbitmq.MessagingException;
import com.rctiplus.rabbitmq.Payload;
import com.rctiplus.rabbitmq.TopologyPolicy;
import com.rctiplus.rabbitmq.metrics.MetricsCollector;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection, channel, topology and consumer handling shared by the blocking and asynchronous
 * clients.
 *
 * <p>Operations here run on the calling thread, the asynchronous client calls them from its event
 * loop.
 */
abstract class AmqpClientBase extends ResourceBase implements MessagingClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClientBase.class);

  private static final AMQP.BasicProperties PERSISTENT =
      new AMQP.BasicProperties.Builder()
          .deliveryMode(DefaultIncomingMessage.PERSISTENT_DELIVERY_MODE)
          .build();
  private static final AMQP.BasicProperties TRANSIENT = new AMQP.BasicProperties.Builder().build();

  protected final ClientSettings settings;
  protected final MetricsCollector metricsCollector;
  private final List<ConsumerRegistration> registrations = new CopyOnWriteArrayList<>();
  private final AtomicBoolean connectionOpen = new AtomicBoolean(false);
  private volatile Connection connection;
  private volatile ManagedChannel channel;
  private volatile TopologyResolver topologyResolver;

  AmqpClientBase(ClientSettings settings) {
    super(settings.listeners());
    this.settings = settings;
    this.metricsCollector = settings.metricsCollector();
  }

  /** Set host, credentials and recovery settings on the factory of this client. */
  protected abstract void configure(
      ConnectionFactory factory, String host, int port, String username, String password);

  protected abstract String connectionName();

  /** Called when the connection is closed by the broker or by a network failure. */
  protected void connectionLost(ShutdownSignalException cause) {
    MessagingException exception = ExceptionUtils.convert(cause);
    LOGGER.debug("Connection of {} lost: {}", this.connectionName(), cause.getMessage());
    this.closeChannel();
    if (this.connectionOpen.compareAndSet(true, false)) {
      this.metricsCollector.closeConnection();
    }
    this.state(DISCONNECTED, exception);
  }

  /** Called once the connection and its channel are open, before the client is connected. */
  protected void connectionOpened(Connection connection) {}

  protected void doConnect(String host, int port, String username, String password) {
    if (!this.compareAndSetState(UNCONNECTED, CONNECTING)) {
      throw new MessagingException.MessagingResourceInvalidStateException(
          "Client cannot connect, current state is %s", this.state().name());
    }
    Connection c = null;
    try {
      ConnectionFactory factory = this.settings.connectionFactory();
      this.configure(factory, host, port, username, password);
      c = factory.newConnection(this.connectionName());
      this.channel = new ManagedChannel(c, this.metricsCollector, this::restoreConsumers);
      this.topologyResolver = new TopologyResolver(this.channel);
      this.connection = c;
      this.connectionOpen.set(true);
      this.metricsCollector.openConnection();
      c.addShutdownListener(
          cause -> {
            if (!cause.isInitiatedByApplication()) {
              this.connectionLost(cause);
            }
          });
      this.connectionOpened(c);
      LOGGER.debug("{} connected to {}:{}", this.connectionName(), host, port);
      this.state(CONNECTED);
    } catch (IOException | TimeoutException | RuntimeException e) {
      if (c != null) {
        Utils.maybeClose(
            c, ex -> LOGGER.debug("Error while closing connection: {}", ex.getMessage()));
      }
      MessagingException exception =
          ExceptionUtils.convert(e, "Error while connecting to %s:%d", host, port);
      // the client can connect again after a failed attempt
      this.state(UNCONNECTED, exception);
      throw exception;
    }
  }

  protected void doSend(String queue, Payload payload, String exchange) {
    this.checkConnected();
    Utils.checkName(queue, "Queue");
    Utils.checkName(exchange, "Exchange");
    byte[] body = payload.serialize().getBytes(UTF_8);
    this.ensureQueue(queue);
    if (!DEFAULT_EXCHANGE.equals(exchange)) {
      ExchangeSpecification specification = this.exchange(exchange);
      this.topologyResolver.declareAlways(specification, specification.declare());
      this.channel.execute(specification.bind(queue));
    }
    AMQP.BasicProperties properties = this.settings.durable() ? PERSISTENT : TRANSIENT;
    this.channel.execute(
        ch -> {
          ch.basicPublish(exchange, queue, properties, body);
          return null;
        });
    this.metricsCollector.publish();
  }

  protected void ensureQueue(String queue) {
    QueueSpecification specification = this.queue(queue);
    this.topologyResolver.resolve(
        this.settings.queueTopologyPolicy(),
        specification,
        specification.ensure(),
        specification.declare());
  }

  protected void register(ConsumerRegistration registration) {
    this.channel.execute(
        ch -> {
          registration.consume(ch);
          return null;
        });
    this.registrations.add(registration);
    this.metricsCollector.openConsumer();
    LOGGER.debug("Registered {}", registration);
  }

  protected void unregister(ConsumerRegistration registration) {
    if (this.registrations.remove(registration)) {
      this.metricsCollector.closeConsumer();
      LOGGER.debug("Unregistered {}", registration);
    }
  }

  protected ConsumerRegistration registration(String consumerTag) {
    for (ConsumerRegistration registration : this.registrations) {
      if (registration.consumerTag() != null && registration.consumerTag().equals(consumerTag)) {
        return registration;
      }
    }
    return null;
  }

  protected void cancel(ConsumerRegistration registration) {
    try {
      registration.cancel();
    } catch (IOException | ShutdownSignalException e) {
      LOGGER.debug("Error while cancelling {}: {}", registration, e.getMessage());
    } finally {
      this.unregister(registration);
    }
  }

  protected void doDeleteQueue(String queue) {
    this.checkConnected();
    Utils.checkName(queue, "Queue");
    this.channel.execute(ch -> ch.queueDelete(queue));
    LOGGER.debug("Deleted queue '{}'", queue);
  }

  protected void doDeleteExchange(String exchange) {
    this.checkConnected();
    Utils.checkName(exchange, "Exchange");
    this.channel.execute(ch -> ch.exchangeDelete(exchange));
    LOGGER.debug("Deleted exchange '{}'", exchange);
  }

  protected void doCommitAck(DeliveryContext context) {
    this.checkConnected();
    if (this.settings.autoAck()) {
      LOGGER.debug(
          "Auto-ack enabled, ignoring acknowledgement of delivery {}", context.deliveryTag());
      return;
    }
    if (!(context instanceof DefaultIncomingMessage.DefaultDeliveryContext)) {
      throw new IllegalArgumentException("Unknown delivery context: " + context);
    }
    DefaultIncomingMessage.DefaultDeliveryContext deliveryContext =
        (DefaultIncomingMessage.DefaultDeliveryContext) context;
    if (deliveryContext.channel() != this.channel.channel()
        || this.channel.state() == ManagedChannel.State.CLOSED) {
      throw new MessagingException.MessagingResourceClosedException(
          String.format(
              "Channel of delivery %d has been closed, the message will be redelivered",
              context.deliveryTag()));
    }
    if (deliveryContext.acknowledged()) {
      throw new MessagingException.MessagingResourceInvalidStateException(
          "Delivery %d already acknowledged", context.deliveryTag());
    }
    long deliveryTag = context.deliveryTag();
    this.channel.execute(
        ch -> {
          ch.basicAck(deliveryTag, false);
          return null;
        });
    // marked after a successful basic.ack only, a failed ack stays retryable
    deliveryContext.markAcknowledged();
    this.metricsCollector.acknowledge();
  }

  protected void doDisconnect() {
    State previous = this.state();
    if (previous == DISCONNECTED) {
      return;
    }
    this.registrations.forEach(this::unregister);
    this.closeChannel();
    Connection c = this.connection;
    if (c != null && c.isOpen()) {
      try {
        c.close();
      } catch (IOException | ShutdownSignalException e) {
        LOGGER.debug("Error while closing connection: {}", e.getMessage());
      }
    }
    if (this.connectionOpen.compareAndSet(true, false)) {
      this.metricsCollector.closeConnection();
    }
    this.state(DISCONNECTED);
    LOGGER.debug("{} disconnected", this.connectionName());
  }

  protected ManagedChannel channel() {
    return this.channel;
  }

  @Override
  public boolean durable() {
    return this.settings.durable();
  }

  @Override
  public boolean autoAck() {
    return this.settings.autoAck();
  }

  @Override
  public boolean autoDelete() {
    return this.settings.autoDelete();
  }

  @Override
  public TopologyPolicy queueTopologyPolicy() {
    return this.settings.queueTopologyPolicy();
  }

  private void restoreConsumers(Channel newChannel) {
    for (ConsumerRegistration registration : this.registrations) {
      try {
        registration.consume(newChannel);
        LOGGER.debug("Restored {} on new channel", registration);
      } catch (IOException | ShutdownSignalException e) {
        LOGGER.warn("Could not restore {}", registration, e);
        this.unregister(registration);
        registration.restoreFailed(ExceptionUtils.convert(e));
      }
    }
  }

  private void closeChannel() {
    ManagedChannel ch = this.channel;
    if (ch != null) {
      ch.close();
    }
  }

  private QueueSpecification queue(String name) {
    return new QueueSpecification(name, this.settings.durable(), this.settings.autoDelete());
  }

  private ExchangeSpecification exchange(String name) {
    return new ExchangeSpecification(name, this.settings.autoDelete());
  }
}
