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
import com.rctiplus.rabbitmq.Resource;
import com.rctiplus.rabbitmq.TopologyPolicy;
import com.rctiplus.rabbitmq.metrics.MetricsCollector;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/** Snapshot of the builder settings for one client instance. */
final class ClientSettings {

  private final boolean durable;
  private final boolean autoAck;
  private final boolean autoDelete;
  private final TopologyPolicy queueTopologyPolicy;
  private final String virtualHost;
  private final ConnectionFactory connectionFactory;
  private final ExecutorService executorService;
  private final MetricsCollector metricsCollector;
  private final List<Resource.StateListener> listeners;
  private final Duration managementRequestTimeout;

  ClientSettings(
      boolean durable,
      boolean autoAck,
      boolean autoDelete,
      TopologyPolicy queueTopologyPolicy,
      String virtualHost,
      ConnectionFactory connectionFactory,
      ExecutorService executorService,
      MetricsCollector metricsCollector,
      List<Resource.StateListener> listeners,
      Duration managementRequestTimeout) {
    this.durable = durable;
    this.autoAck = autoAck;
    this.autoDelete = autoDelete;
    this.queueTopologyPolicy = queueTopologyPolicy;
    this.virtualHost = virtualHost;
    this.connectionFactory = connectionFactory;
    this.executorService = executorService;
    this.metricsCollector = metricsCollector;
    this.listeners = List.copyOf(listeners);
    this.managementRequestTimeout = managementRequestTimeout;
  }

  boolean durable() {
    return this.durable;
  }

  boolean autoAck() {
    return this.autoAck;
  }

  boolean autoDelete() {
    return this.autoDelete;
  }

  TopologyPolicy queueTopologyPolicy() {
    return this.queueTopologyPolicy;
  }

  String virtualHost() {
    return this.virtualHost;
  }

  ConnectionFactory connectionFactory() {
    return this.connectionFactory;
  }

  ExecutorService executorService() {
    return this.executorService;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }

  Duration managementRequestTimeout() {
    return this.managementRequestTimeout;
  }
}
