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
import static com.rctiplus.rabbitmq.Resource.State.UNCONNECTED;

import com.rctiplus.rabbitmq.MessagingException;
import com.rctiplus.rabbitmq.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lifecycle of a client: current state, reason of the disconnection and notification of the state
 * listeners.
 *
 * <p>Listeners are called on the thread that changes the state, in registration order. A failing
 * listener is logged and does not prevent the others from being called.
 */
abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>();
  private final List<StateListener> listeners;
  private volatile Throwable closeReason;

  ResourceBase(List<StateListener> listeners) {
    this.listeners = List.copyOf(listeners);
    this.state(UNCONNECTED);
  }

  protected void checkConnected() {
    State state = this.state.get();
    if (state == CONNECTED) {
      return;
    }
    if (this.closeReason instanceof MessagingException) {
      throw (MessagingException) this.closeReason;
    } else if (state == UNCONNECTED || state == DISCONNECTED) {
      throw new MessagingException.MessagingNotConnectedException(
          "Client is not connected, current state is %s", state.name());
    } else {
      throw new MessagingException.MessagingResourceInvalidStateException(
          "Client is not connected, current state is %s", state.name());
    }
  }

  public State state() {
    return this.state.get();
  }

  protected void state(State state) {
    this.state(state, null);
  }

  protected void state(State state, Throwable failureCause) {
    State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      if (state == DISCONNECTED && this.closeReason == null) {
        this.closeReason = failureCause;
      }
      this.notifyListeners(new StateChange(this, previousState, state, failureCause));
    }
  }

  protected boolean compareAndSetState(State expected, State state) {
    if (this.state.compareAndSet(expected, state)) {
      this.notifyListeners(new StateChange(this, expected, state, null));
      return true;
    } else {
      return false;
    }
  }

  private void notifyListeners(StateChange change) {
    if (change.previousState != null) {
      LOGGER.debug("{}: {} -> {}", this, change.previousState, change.currentState);
    }
    for (StateListener listener : this.listeners) {
      try {
        listener.handle(change);
      } catch (Exception e) {
        LOGGER.warn(
            "State listener failed on transition {} -> {}",
            change.previousState,
            change.currentState,
            e);
      }
    }
  }

  private static final class StateChange implements Context {

    private final Resource resource;
    private final State previousState;
    private final State currentState;
    private final Throwable failureCause;

    private StateChange(
        Resource resource, State previousState, State currentState, Throwable failureCause) {
      this.resource = resource;
      this.previousState = previousState;
      this.currentState = currentState;
      this.failureCause = failureCause;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }
  }
}
