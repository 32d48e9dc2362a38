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

/** A message delivered to a consumer callback. */
public interface IncomingMessage {

  /**
   * The raw body.
   *
   * @return body
   */
  byte[] body();

  /**
   * The body decoded as UTF-8.
   *
   * @return body as string
   */
  String bodyAsString();

  /**
   * Parse the body with the given parser.
   *
   * @param parser payload parser
   * @return the payload
   * @param <T> type of payload
   */
  <T extends Payload> T payload(PayloadParser<T> parser);

  /**
   * Whether the message was published as persistent (delivery mode 2).
   *
   * @return true for persistent messages
   */
  boolean persistent();

  /**
   * The exchange the message was published to, empty string for the default exchange.
   *
   * @return exchange name
   */
  String exchange();

  /**
   * The routing key the message was published with.
   *
   * @return routing key
   */
  String routingKey();

  /**
   * Delivery information, required for acknowledgement.
   *
   * @return delivery context
   */
  DeliveryContext context();
}
