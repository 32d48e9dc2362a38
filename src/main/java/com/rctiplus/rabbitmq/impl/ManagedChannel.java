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
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import com.rctiplus.rabbitmq.MessagingException;
import com.rctiplus.rabbitmq.metrics.MetricsCollector;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single channel of a client.
 *
 * <p>The broker closes a channel on any channel-level error (failed passive declaration,
 * declaration conflict, unknown delivery tag). The channel then goes from {@link State#OPEN} to
 * {@link State#CLOSED} and every subsequent operation on it fails until {@link #reopen()} replaces
 * it with a new channel on the same connection.
 */
final class ManagedChannel implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManagedChannel.class);

  enum State {
    OPEN,
    CLOSED
  }

  @FunctionalInterface
  interface ChannelOperation<T> {

    T apply(Channel channel) throws IOException;
  }

  private final Connection connection;
  private final MetricsCollector metricsCollector;
  private final Consumer<Channel> reopenCallback;
  private volatile Channel delegate;
  private volatile boolean closed = false;

  ManagedChannel(
      Connection connection, MetricsCollector metricsCollector, Consumer<Channel> reopenCallback)
      throws IOException {
    this.connection = connection;
    this.metricsCollector = metricsCollector;
    this.reopenCallback = reopenCallback;
    this.delegate = this.open();
  }

  Channel channel() {
    return this.delegate;
  }

  State state() {
    Channel channel = this.delegate;
    // the shutdown cause is set before the failing call returns, listeners may run later
    return this.closed || channel == null || !channel.isOpen() ? State.CLOSED : State.OPEN;
  }

  /**
   * Replace the current channel with a new one.
   *
   * @return the new channel
   * @throws IOException if the new channel cannot be created
   */
  Channel reopen() throws IOException {
    if (this.closed) {
      throw new MessagingException.MessagingResourceClosedException("Channel has been closed");
    }
    Channel previous = this.delegate;
    if (previous != null && previous.isOpen()) {
      Utils.maybeClose(
          previous,
          e -> LOGGER.debug("Error while closing channel before reopening: {}", e.getMessage()));
    }
    LOGGER.debug("Reopening channel (previous was {})", previous);
    this.delegate = this.open();
    this.metricsCollector.reopenChannel();
    this.reopenCallback.accept(this.delegate);
    return this.delegate;
  }

  /**
   * Run an operation on the current channel.
   *
   * <p>Failures are converted. If the broker closed the channel because of the failure, the channel
   * is replaced before the exception is thrown so the client stays usable. The operation is not
   * retried.
   */
  <T> T execute(ChannelOperation<T> operation) {
    try {
      return operation.apply(this.delegate);
    } catch (IOException | ShutdownSignalException e) {
      MessagingException exception = ExceptionUtils.convert(e);
      this.reopenIfClosed(exception);
      throw exception;
    }
  }

  void reopenIfClosed(Exception cause) {
    if (this.state() == State.CLOSED && !this.closed && this.connection.isOpen()) {
      try {
        this.reopen();
      } catch (Exception e) {
        LOGGER.debug("Could not reopen channel after failure: {}", e.getMessage());
        cause.addSuppressed(e);
      }
    }
  }

  @Override
  public void close() {
    if (!this.closed) {
      this.closed = true;
      Channel channel = this.delegate;
      if (channel != null && channel.isOpen()) {
        try {
          channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
          LOGGER.debug("Error while closing channel: {}", e.getMessage());
        }
      }
    }
  }

  private Channel open() throws IOException {
    Channel channel = this.connection.createChannel();
    if (channel == null) {
      throw new MessagingException("No channel available on connection %s", this.connection);
    }
    channel.addShutdownListener(
        cause -> {
          if (!cause.isInitiatedByApplication()) {
            LOGGER.debug("Channel {} closed by broker: {}", channel, cause.getMessage());
          }
        });
    return channel;
  }
}
