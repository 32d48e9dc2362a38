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

import static com.rctiplus.rabbitmq.impl.ExceptionUtils.convert;
import static com.rctiplus.rabbitmq.impl.TestUtils.channelClose;
import static com.rctiplus.rabbitmq.impl.TestUtils.channelError;
import static org.assertj.core.api.Assertions.assertThat;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import com.rctiplus.rabbitmq.MessagingException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.Test;

public class ExceptionUtilsTest {

  @Test
  void convertTest() {
    assertThat(convert(channelError(AMQP.NOT_FOUND, "NOT_FOUND", null)))
        .isInstanceOf(MessagingException.MessagingEntityNotFoundException.class)
        .hasCauseInstanceOf(IOException.class)
        .hasRootCauseInstanceOf(ShutdownSignalException.class);
    assertThat(convert(channelError(AMQP.PRECONDITION_FAILED, "PRECONDITION_FAILED", null)))
        .isInstanceOf(MessagingException.MessagingDeclarationConflictException.class);
    assertThat(convert(channelError(AMQP.ACCESS_REFUSED, "ACCESS_REFUSED", null)))
        .isInstanceOf(MessagingException.MessagingSecurityException.class);
    assertThat(convert(channelClose(AMQP.RESOURCE_LOCKED, "RESOURCE_LOCKED", null)))
        .isInstanceOf(MessagingException.MessagingResourceClosedException.class);
    assertThat(
            convert(
                new ShutdownSignalException(
                    true,
                    false,
                    new AMQP.Connection.Close.Builder()
                        .replyCode(AMQP.CONNECTION_FORCED)
                        .replyText("CONNECTION_FORCED")
                        .build(),
                    null)))
        .isInstanceOf(MessagingException.MessagingConnectionException.class);
    assertThat(
            convert(
                new AlreadyClosedException(channelClose(AMQP.NOT_FOUND, "NOT_FOUND", null))))
        .isInstanceOf(MessagingException.MessagingResourceClosedException.class);
    assertThat(convert(new ConnectException("Connection refused")))
        .isInstanceOf(MessagingException.MessagingConnectionException.class);
    assertThat(convert(new UnknownHostException("nowhere")))
        .isInstanceOf(MessagingException.MessagingConnectionException.class);
    assertThat(convert(new IOException("Connection reset by peer")))
        .isInstanceOf(MessagingException.MessagingConnectionException.class);
    assertThat(convert(new TimeoutException()))
        .isInstanceOf(MessagingException.MessagingConnectionException.class);
    assertThat(convert(new AuthenticationFailureException("ACCESS_REFUSED")))
        .isInstanceOf(MessagingException.MessagingSecurityException.class);
    assertThat(convert(new PossibleAuthenticationFailureException(new IOException())))
        .isInstanceOf(MessagingException.MessagingSecurityException.class);
    assertThat(convert(new IOException(new SSLHandshakeException("bad certificate"))))
        .isInstanceOf(MessagingException.MessagingSecurityException.class);
    assertThat(convert(new IOException("unexpected")))
        .isExactlyInstanceOf(MessagingException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void convertShouldUnwrapFutureExceptions() {
    MessagingException cause =
        new MessagingException.MessagingNotConnectedException("not connected");
    assertThat(convert(new CompletionException(cause))).isSameAs(cause);
    assertThat(convert(new ExecutionException(new ConnectException("Connection refused"))))
        .isInstanceOf(MessagingException.MessagingConnectionException.class);
  }

  @Test
  void convertShouldUseProvidedMessage() {
    assertThat(convert(new ConnectException("Connection refused"), "Error with %s", "broker"))
        .isInstanceOf(MessagingException.MessagingConnectionException.class)
        .hasMessage("Error with broker");
  }

  @Test
  void notFoundTest() {
    assertThat(ExceptionUtils.notFound(channelError(AMQP.NOT_FOUND, "NOT_FOUND", null))).isTrue();
    assertThat(ExceptionUtils.notFound(channelError(AMQP.ACCESS_REFUSED, "", null))).isFalse();
    assertThat(ExceptionUtils.notFound(new IOException())).isFalse();
  }
}
