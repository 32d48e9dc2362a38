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

/** How a client makes sure a queue exists before publishing to it or consuming from it. */
public enum TopologyPolicy {

  /**
   * Check the queue exists with a passive declaration and use it as-is. If the check fails, reopen
   * the channel (the broker closes it on a failed passive declaration) and declare the queue with
   * the client settings.
   *
   * <p>This avoids declaration conflicts with queues created by other applications with different
   * parameters.
   */
  ASSERT_FIRST,

  /**
   * Always declare the queue with the client settings. This is a no-op if an identical queue exists
   * and an error if the queue exists with different parameters.
   */
  DECLARE_ALWAYS
}
