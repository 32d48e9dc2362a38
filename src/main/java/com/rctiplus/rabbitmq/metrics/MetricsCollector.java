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
package com.rctiplus.rabbitmq.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a client opens its connection. */
  void openConnection();

  /** Called when a client connection is closed. */
  void closeConnection();

  /** Called when a consumer is registered on a queue. */
  void openConsumer();

  /** Called when a consumer is cancelled. */
  void closeConsumer();

  /** Called when a message is published. */
  void publish();

  /** Called when a message is dispatched to a consumer callback. */
  void consume();

  /** Called when a message is acknowledged by the application. */
  void acknowledge();

  /** Called when the client replaces its channel after a channel-level failure. */
  void reopenChannel();
}
