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

/**
 * Application value published by a {@link MessagingClient}.
 *
 * <p>The client never interprets the content, it only puts the UTF-8 bytes of {@link #serialize()}
 * on the wire. The reverse operation is provided by a {@link PayloadParser} and is used by consumer
 * callbacks only.
 *
 * <p>Implementations must be able to go back and forth with their parser: {@code
 * parser.fromString(p.serialize())} must be equal to {@code p}.
 *
 * @see PayloadParser
 */
public interface Payload {

  /**
   * Convert this value to the string placed on the wire.
   *
   * @return the wire representation
   */
  String serialize();
}
