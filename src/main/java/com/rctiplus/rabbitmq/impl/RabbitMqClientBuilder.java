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

import com.rabbitmq.client.ConnectionFactory;
import com.rctiplus.rabbitmq.AsyncClient;
import com.rctiplus.rabbitmq.Resource;
import com.rctiplus.rabbitmq.SyncClient;
import com.rctiplus.rabbitmq.TopologyPolicy;
import com.rctiplus.rabbitmq.metrics.MetricsCollector;
import com.rctiplus.rabbitmq.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * API to create {@link SyncClient} and {@link AsyncClient} instances.
 *
 * <pre>{@code
 * SyncClient client = new RabbitMqClientBuilder().durable(true).autoAck(false).buildSync();
 * client.connect("localhost", 5672, "guest", "guest");
 * }</pre>
 *
 * <p>Each build call creates an independent client with its own connection. The builder can be
 * reused.
 */
public class RabbitMqClientBuilder {

  static final String DEFAULT_VIRTUAL_HOST = "/";
  static final Duration DEFAULT_MANAGEMENT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private boolean durable = false;
  private boolean autoAck = true;
  private boolean autoDelete = false;
  private TopologyPolicy queueTopologyPolicy;
  private String virtualHost = DEFAULT_VIRTUAL_HOST;
  private ConnectionFactory connectionFactory;
  private ExecutorService executorService;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private Duration managementRequestTimeout = DEFAULT_MANAGEMENT_REQUEST_TIMEOUT;

  public RabbitMqClientBuilder() {}

  /**
   * Declare queues and exchanges durable and publish persistent messages.
   *
   * <p>Default is false.
   *
   * @param durable durable flag
   * @return this builder instance
   */
  public RabbitMqClientBuilder durable(boolean durable) {
    this.durable = durable;
    return this;
  }

  /**
   * Consume in automatic acknowledgement mode.
   *
   * <p>Default is true. With false, handlers must call {@code commitAck} for each message.
   *
   * @param autoAck auto-ack flag
   * @return this builder instance
   */
  public RabbitMqClientBuilder autoAck(boolean autoAck) {
    this.autoAck = autoAck;
    return this;
  }

  /**
   * Declare queues and exchanges auto-delete.
   *
   * <p>Default is false.
   *
   * @param autoDelete auto-delete flag
   * @return this builder instance
   */
  public RabbitMqClientBuilder autoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  /**
   * Policy to make sure queues exist before publishing or consuming.
   *
   * <p>Default is {@link TopologyPolicy#DECLARE_ALWAYS} for blocking clients and {@link
   * TopologyPolicy#ASSERT_FIRST} for asynchronous clients.
   *
   * @param queueTopologyPolicy the policy
   * @return this builder instance
   */
  public RabbitMqClientBuilder queueTopologyPolicy(TopologyPolicy queueTopologyPolicy) {
    this.queueTopologyPolicy = queueTopologyPolicy;
    return this;
  }

  /**
   * Virtual host to connect to.
   *
   * <p>Default is <code>/</code>.
   *
   * @param virtualHost virtual host
   * @return this builder instance
   */
  public RabbitMqClientBuilder virtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
    return this;
  }

  /**
   * Template for low-level connection settings (TLS, heartbeat, timeouts).
   *
   * <p>Each client works on a copy. Host, port, credentials, virtual host and automatic recovery
   * are always set by the client.
   *
   * @param connectionFactory the connection factory
   * @return this builder instance
   */
  public RabbitMqClientBuilder connectionFactory(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
    return this;
  }

  /**
   * Event loop of asynchronous clients.
   *
   * <p>Must execute tasks one at a time in submission order, e.g. {@link
   * java.util.concurrent.Executors#newSingleThreadExecutor()}. Each client creates its own by
   * default. It is the developer's responsibility to shut down a provided executor.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  public RabbitMqClientBuilder executorService(ExecutorService executorService) {
    this.executorService = executorService;
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.rctiplus.rabbitmq.metrics.MicrometerMetricsCollector
   */
  public RabbitMqClientBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  /**
   * Add {@link Resource.StateListener}s to the clients.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  public RabbitMqClientBuilder listeners(Resource.StateListener... listeners) {
    this.listeners.addAll(Arrays.asList(listeners));
    return this;
  }

  /**
   * Timeout of management API requests.
   *
   * <p>Default is 10 seconds.
   *
   * @param managementRequestTimeout timeout
   * @return this builder instance
   */
  public RabbitMqClientBuilder managementRequestTimeout(Duration managementRequestTimeout) {
    if (managementRequestTimeout == null
        || managementRequestTimeout.isNegative()
        || managementRequestTimeout.isZero()) {
      throw new IllegalArgumentException("Management request timeout must be positive");
    }
    this.managementRequestTimeout = managementRequestTimeout;
    return this;
  }

  /**
   * Create a blocking client.
   *
   * @return the client
   */
  public SyncClient buildSync() {
    return new AmqpSyncClient(this.settings(TopologyPolicy.DECLARE_ALWAYS));
  }

  /**
   * Create an asynchronous client.
   *
   * @return the client
   */
  public AsyncClient buildAsync() {
    return new AmqpAsyncClient(
        this.settings(TopologyPolicy.ASSERT_FIRST),
        new ManagementApiClient(this.managementRequestTimeout));
  }

  private ClientSettings settings(TopologyPolicy defaultPolicy) {
    if (this.virtualHost == null) {
      throw new IllegalArgumentException("Virtual host cannot be null");
    }
    ConnectionFactory factory =
        this.connectionFactory == null ? new ConnectionFactory() : this.connectionFactory.clone();
    return new ClientSettings(
        this.durable,
        this.autoAck,
        this.autoDelete,
        this.queueTopologyPolicy == null ? defaultPolicy : this.queueTopologyPolicy,
        this.virtualHost,
        factory,
        this.executorService,
        this.metricsCollector == null ? NoOpMetricsCollector.INSTANCE : this.metricsCollector,
        this.listeners,
        this.managementRequestTimeout);
  }
}
