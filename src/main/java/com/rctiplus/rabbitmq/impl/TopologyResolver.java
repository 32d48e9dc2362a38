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

import com.rabbitmq.client.ShutdownSignalException;
import com.rctiplus.rabbitmq.MessagingException;
import com.rctiplus.rabbitmq.TopologyPolicy;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes sure a queue or an exchange is usable on the client channel before an operation uses it.
 *
 * <p>The resolver works with a pair of operations: {@code ensure} checks the entity exists without
 * side effects, {@code declare} creates it (or does nothing if an identical entity exists).
 *
 * <p>With {@link TopologyPolicy#ASSERT_FIRST}, the entity is checked first. A failed check closes
 * the channel on the broker side: the resolver sees the {@link ManagedChannel.State#CLOSED} state,
 * reopens the channel and declares the entity. This recovery is invisible to the caller.
 *
 * <p>With {@link TopologyPolicy#DECLARE_ALWAYS}, the entity is declared before every operation. A
 * declaration conflict (the entity exists with different parameters) is thrown as-is and never
 * retried.
 */
final class TopologyResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopologyResolver.class);

  private final ManagedChannel channel;

  TopologyResolver(ManagedChannel channel) {
    this.channel = channel;
  }

  <T> T resolve(
      TopologyPolicy policy,
      Object entity,
      ManagedChannel.ChannelOperation<T> ensure,
      ManagedChannel.ChannelOperation<T> declare) {
    if (policy == TopologyPolicy.ASSERT_FIRST) {
      return this.assertFirst(entity, ensure, declare);
    } else {
      return this.declareAlways(entity, declare);
    }
  }

  <T> T declareAlways(Object entity, ManagedChannel.ChannelOperation<T> declare) {
    LOGGER.debug("Declaring {}", entity);
    return this.channel.execute(declare);
  }

  private <T> T assertFirst(
      Object entity,
      ManagedChannel.ChannelOperation<T> ensure,
      ManagedChannel.ChannelOperation<T> declare) {
    try {
      T result = ensure.apply(this.channel.channel());
      LOGGER.debug("{} exists", entity);
      return result;
    } catch (IOException | ShutdownSignalException e) {
      if (this.channel.state() == ManagedChannel.State.CLOSED) {
        LOGGER.debug(
            "Check of {} failed and closed the channel ({}), reopening it",
            entity,
            e.getMessage());
        try {
          this.channel.reopen();
        } catch (IOException | ShutdownSignalException reopenException) {
          MessagingException exception = ExceptionUtils.convert(reopenException);
          exception.addSuppressed(e);
          throw exception;
        }
      } else if (!ExceptionUtils.notFound(e)) {
        throw ExceptionUtils.convert(e);
      }
      return this.declareAlways(entity, declare);
    }
  }
}
