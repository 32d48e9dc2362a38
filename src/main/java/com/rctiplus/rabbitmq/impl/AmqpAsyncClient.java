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
import static com.rctiplus.rabbitmq.Resource.State.DISCONNECTED;
import static com.rctiplus.rabbitmq.Resource.State.RECOVERING;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.ShutdownSignalException;
import com.rctiplus.rabbitmq.AsyncClient;
import com.rctiplus.rabbitmq.IncomingMessage;
import com.rctiplus.rabbitmq.MessagingException;
import com.rctiplus.rabbitmq.Payload;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous client.
 *
 * <p>Channel operations run on a single-threaded executor, the event loop. Deliveries are handed
 * over from the connection threads to the loop by a {@link SerialDispatcher} per subscription.
 */
final class AmqpAsyncClient extends AmqpClientBase implements AsyncClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpAsyncClient.class);

  static final String DEFAULT_MANAGEMENT_USERNAME = "guest";
  static final String DEFAULT_MANAGEMENT_PASSWORD = "guest";
  static final String DEFAULT_MANAGEMENT_HOST = "localhost";
  static final int DEFAULT_MANAGEMENT_PORT = 15672;

  private final ExecutorService loop;
  private final boolean ownsLoop;
  private final ManagementApiClient managementApiClient;

  AmqpAsyncClient(ClientSettings settings, ManagementApiClient managementApiClient) {
    super(settings);
    if (settings.executorService() == null) {
      this.loop = Utils.eventLoop();
      this.ownsLoop = true;
    } else {
      this.loop = settings.executorService();
      this.ownsLoop = false;
    }
    this.managementApiClient = managementApiClient;
  }

  @Override
  public CompletableFuture<Void> connect(
      String host, int port, String username, String password) {
    return this.run(() -> this.doConnect(host, port, username, password));
  }

  @Override
  protected void configure(
      ConnectionFactory factory, String host, int port, String username, String password) {
    try {
      factory.setUri(
          UriUtils.amqpUri(host, port, username, password, this.settings.virtualHost()));
    } catch (URISyntaxException | GeneralSecurityException e) {
      throw new MessagingException("Invalid connection URI for host " + host, e);
    }
    factory.setAutomaticRecoveryEnabled(true);
    factory.setTopologyRecoveryEnabled(true);
  }

  @Override
  protected String connectionName() {
    return "rabbitmq-async-client";
  }

  @Override
  protected void connectionOpened(Connection connection) {
    if (connection instanceof Recoverable) {
      ((Recoverable) connection)
          .addRecoveryListener(
              new RecoveryListener() {
                @Override
                public void handleRecovery(Recoverable recoverable) {
                  LOGGER.info("Connection of {} recovered", connectionName());
                  if (state() == RECOVERING) {
                    state(CONNECTED);
                  }
                }

                @Override
                public void handleRecoveryStarted(Recoverable recoverable) {
                  LOGGER.info("Connection of {} recovery started", connectionName());
                  if (state() != DISCONNECTED) {
                    state(RECOVERING);
                  }
                }
              });
    }
  }

  @Override
  protected void connectionLost(ShutdownSignalException cause) {
    if (this.settings.connectionFactory().isAutomaticRecoveryEnabled()) {
      LOGGER.info("Connection of {} lost, waiting for recovery", this.connectionName());
      if (this.state() != DISCONNECTED) {
        this.state(RECOVERING, ExceptionUtils.convert(cause));
      }
    } else {
      super.connectionLost(cause);
    }
  }

  @Override
  public CompletableFuture<Void> send(String queue, Payload payload) {
    return this.send(queue, payload, DEFAULT_EXCHANGE);
  }

  @Override
  public CompletableFuture<Void> send(String queue, Payload payload, String exchange) {
    return this.run(() -> this.doSend(queue, payload, exchange));
  }

  @Override
  public CompletableFuture<Subscription> receive(String queue, DeliveryHandler handler) {
    return this.supply(
        () -> {
          this.checkConnected();
          Utils.checkName(queue, "Queue");
          this.ensureQueue(queue);
          SerialDispatcher dispatcher = new SerialDispatcher(this.loop, "queue '" + queue + "'");
          ConsumerRegistration registration =
              new ConsumerRegistration(
                  queue,
                  this.autoAck(),
                  ch -> new DispatchingConsumer(ch, queue, handler, dispatcher),
                  e -> LOGGER.warn("Subscription to queue '{}' stopped", queue, e));
          this.register(registration);
          return new DefaultSubscription(registration);
        });
  }

  @Override
  public CompletableFuture<Void> deleteQueue(String queue) {
    return this.run(() -> this.doDeleteQueue(queue));
  }

  @Override
  public CompletableFuture<Void> deleteExchange(String exchange) {
    return this.run(() -> this.doDeleteExchange(exchange));
  }

  @Override
  public CompletableFuture<Void> commitAck(IncomingMessage message) {
    return this.run(() -> this.doCommitAck(message.context()));
  }

  @Override
  public CompletableFuture<List<String>> listQueues() {
    return this.listQueues(
        DEFAULT_MANAGEMENT_USERNAME,
        DEFAULT_MANAGEMENT_PASSWORD,
        DEFAULT_MANAGEMENT_HOST,
        DEFAULT_MANAGEMENT_PORT,
        null);
  }

  @Override
  public CompletableFuture<List<String>> listQueues(
      String username, String password, String host, int port, String virtualHost) {
    return this.managementApiClient.queues(username, password, host, port, virtualHost);
  }

  @Override
  public CompletableFuture<Void> disconnect() {
    CompletableFuture<Void> result = this.run(this::doDisconnect);
    if (this.ownsLoop) {
      return result.whenComplete((ignored, throwable) -> this.loop.shutdown());
    } else {
      return result;
    }
  }

  /**
   * Disconnect and wait for completion.
   *
   * <p>Must not be called from the event loop, e.g. in a delivery handler.
   */
  @Override
  public void close() {
    if (this.state() != DISCONNECTED) {
      this.disconnect().join();
    }
  }

  private CompletableFuture<Void> run(Runnable task) {
    return this.supply(
        () -> {
          task.run();
          return null;
        });
  }

  private <T> CompletableFuture<T> supply(Supplier<T> task) {
    try {
      return CompletableFuture.supplyAsync(task, this.loop);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(
          new MessagingException.MessagingNotConnectedException(
              "Client event loop is not running, current state is %s", this.state().name()));
    }
  }

  private final class DispatchingConsumer extends DefaultConsumer {

    private final String queue;
    private final DeliveryHandler handler;
    private final SerialDispatcher dispatcher;

    private DispatchingConsumer(
        Channel channel, String queue, DeliveryHandler handler, SerialDispatcher dispatcher) {
      super(channel);
      this.queue = queue;
      this.handler = handler;
      this.dispatcher = dispatcher;
    }

    @Override
    public void handleDelivery(
        String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
      metricsCollector.consume();
      DefaultIncomingMessage message =
          new DefaultIncomingMessage(
              this.getChannel(), this.queue, consumerTag, envelope, properties, body);
      this.dispatcher.dispatch(() -> this.handler.handle(message));
    }

    @Override
    public void handleCancel(String consumerTag) {
      LOGGER.debug("Consumer '{}' on queue '{}' cancelled by broker", consumerTag, this.queue);
      this.unregisterOnLoop(consumerTag);
    }

    @Override
    public void handleCancelOk(String consumerTag) {
      this.unregisterOnLoop(consumerTag);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
      if (sig.isInitiatedByApplication() || sig.isHardError()) {
        return;
      }
      Channel closedChannel = this.getChannel();
      // posted to the loop, a reopen in progress there has restored the consumer already
      submit(
          () -> {
            ConsumerRegistration registration = registration(consumerTag);
            if (registration != null && registration.current(closedChannel)) {
              LOGGER.debug(
                  "Channel of consumer on queue '{}' closed: {}", this.queue, sig.getMessage());
              channel().reopenIfClosed(ExceptionUtils.convert(sig));
            }
          });
    }

    private void unregisterOnLoop(String consumerTag) {
      submit(
          () -> {
            ConsumerRegistration registration = registration(consumerTag);
            if (registration != null) {
              unregister(registration);
            }
          });
    }
  }

  private void submit(Runnable task) {
    try {
      this.loop.execute(task);
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Event loop stopped, ignoring task");
    }
  }

  private final class DefaultSubscription implements Subscription {

    private final ConsumerRegistration registration;

    private DefaultSubscription(ConsumerRegistration registration) {
      this.registration = registration;
    }

    @Override
    public String queue() {
      return this.registration.queue();
    }

    @Override
    public String consumerTag() {
      return this.registration.consumerTag();
    }

    @Override
    public CompletableFuture<Void> cancel() {
      return run(() -> AmqpAsyncClient.this.cancel(this.registration));
    }
  }
}
