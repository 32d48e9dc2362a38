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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the message handler of one subscription on the event loop, one message at a time.
 *
 * <p>Each task starts when the stage returned by the previous one completes. A failed task is
 * logged and the next one still runs.
 */
final class SerialDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(SerialDispatcher.class);

  private final Executor executor;
  private final String label;
  private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

  SerialDispatcher(Executor executor, String label) {
    this.executor = executor;
    this.label = label;
  }

  synchronized CompletableFuture<Void> dispatch(Supplier<? extends CompletionStage<Void>> task) {
    this.tail =
        this.tail
            .thenComposeAsync(ignored -> invoke(task), this.executor)
            .exceptionally(
                e -> {
                  LOGGER.warn("Error while handling message from {}", this.label, e);
                  return null;
                });
    return this.tail;
  }

  private static CompletionStage<Void> invoke(Supplier<? extends CompletionStage<Void>> task) {
    try {
      CompletionStage<Void> stage = task.get();
      return stage == null ? CompletableFuture.completedFuture(null) : stage;
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}
