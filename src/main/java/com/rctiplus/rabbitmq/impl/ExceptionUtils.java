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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import com.rctiplus.rabbitmq.MessagingException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static MessagingException convert(Throwable e) {
    return convert(e, null);
  }

  static MessagingException convert(Throwable e, String format, Object... args) {
    String message = format != null ? String.format(format, args) : null;
    if (e instanceof CompletionException || e instanceof ExecutionException) {
      return e.getCause() == null ? new MessagingException(message, e) : convert(e.getCause());
    } else if (e instanceof MessagingException) {
      return (MessagingException) e;
    }
    ShutdownSignalException sse = shutdownSignal(e);
    if (sse != null) {
      return convert(sse, e, message);
    } else if (e instanceof PossibleAuthenticationFailureException) {
      return new MessagingException.MessagingSecurityException(messageOrDefault(message, e), e);
    } else if (e instanceof SSLException || e.getCause() instanceof SSLException) {
      return new MessagingException.MessagingSecurityException(messageOrDefault(message, e), e);
    } else if (isNetworkError(e)) {
      return new MessagingException.MessagingConnectionException(messageOrDefault(message, e), e);
    } else if (e instanceof TimeoutException) {
      return new MessagingException.MessagingConnectionException(messageOrDefault(message, e), e);
    } else {
      return new MessagingException(messageOrDefault(message, e), e);
    }
  }

  private static MessagingException convert(
      ShutdownSignalException sse, Throwable original, String message) {
    String msg = messageOrDefault(message, sse);
    if (sse instanceof AlreadyClosedException) {
      // operation on a channel or connection closed earlier, the reason is not about this call
      return new MessagingException.MessagingResourceClosedException(msg, original);
    }
    int replyCode = replyCode(sse);
    if (replyCode == AMQP.NOT_FOUND) {
      return new MessagingException.MessagingEntityNotFoundException(msg, original);
    } else if (replyCode == AMQP.PRECONDITION_FAILED) {
      return new MessagingException.MessagingDeclarationConflictException(msg, original);
    } else if (replyCode == AMQP.ACCESS_REFUSED) {
      return new MessagingException.MessagingSecurityException(msg, original);
    } else if (sse.isHardError()) {
      return new MessagingException.MessagingConnectionException(msg, original);
    } else {
      return new MessagingException.MessagingResourceClosedException(msg, original);
    }
  }

  static ShutdownSignalException shutdownSignal(Throwable e) {
    Throwable current = e;
    while (current != null) {
      if (current instanceof ShutdownSignalException) {
        return (ShutdownSignalException) current;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return null;
  }

  static int replyCode(ShutdownSignalException sse) {
    Method reason = sse.getReason();
    if (reason instanceof AMQP.Channel.Close) {
      return ((AMQP.Channel.Close) reason).getReplyCode();
    } else if (reason instanceof AMQP.Connection.Close) {
      return ((AMQP.Connection.Close) reason).getReplyCode();
    } else {
      return -1;
    }
  }

  static boolean notFound(Throwable e) {
    ShutdownSignalException sse = shutdownSignal(e);
    return sse != null && replyCode(sse) == AMQP.NOT_FOUND;
  }

  private static boolean isNetworkError(Throwable e) {
    if (e instanceof ConnectException
        || e instanceof UnknownHostException
        || e instanceof NoRouteToHostException
        || e instanceof SocketException) {
      return true;
    } else if (e instanceof IOException) {
      String message = e.getMessage();
      if (message != null) {
        message = message.toLowerCase();
        return message.contains("connection reset") || message.contains("connection refused");
      }
    }
    return false;
  }

  private static String messageOrDefault(String message, Throwable e) {
    return message == null ? e.getMessage() : message;
  }
}
