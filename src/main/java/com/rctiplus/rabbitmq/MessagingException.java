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
package com.rctiplus.rabbitmq;

public class MessagingException extends RuntimeException {

  public MessagingException(Throwable cause) {
    super(cause);
  }

  public MessagingException(String format, Object... args) {
    super(String.format(format, args));
  }

  public MessagingException(String message, Throwable cause) {
    super(message, cause);
  }

  public static class MessagingSecurityException extends MessagingException {

    public MessagingSecurityException(String message, Throwable cause) {
      super(message, cause);
    }

    public MessagingSecurityException(Throwable cause) {
      super(cause);
    }
  }

  public static class MessagingConnectionException extends MessagingException {

    public MessagingConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The broker rejected a declaration because the entity exists with different parameters. */
  public static class MessagingDeclarationConflictException extends MessagingException {

    public MessagingDeclarationConflictException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class MessagingEntityNotFoundException extends MessagingException {

    public MessagingEntityNotFoundException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class MessagingResourceInvalidStateException extends MessagingException {

    public MessagingResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public MessagingResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Operation called before connecting or after disconnecting. */
  public static class MessagingNotConnectedException
      extends MessagingResourceInvalidStateException {

    public MessagingNotConnectedException(String format, Object... args) {
      super(format, args);
    }
  }

  public static class MessagingResourceClosedException
      extends MessagingResourceInvalidStateException {

    public MessagingResourceClosedException(String message) {
      super(message);
    }

    public MessagingResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Non-successful response from the broker HTTP management API. */
  public static class MessagingManagementApiException extends MessagingException {

    private final int statusCode;

    public MessagingManagementApiException(int statusCode, String message) {
      super(message, (Throwable) null);
      this.statusCode = statusCode;
    }

    public int statusCode() {
      return this.statusCode;
    }
  }
}
