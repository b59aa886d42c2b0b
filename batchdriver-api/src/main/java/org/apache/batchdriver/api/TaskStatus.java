/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.batchdriver.api;

/**
 * Lifecycle status of a {@link BatchTask} as observed by a driver.
 *
 * <p>
 *   A driver moves a task to {@link #SUBMITTED} once the remote service accepted it, and to {@link #KILLED}
 *   either when the task is terminated or when a termination signal prevented its submission. The terminal
 *   {@link #SUCCEEDED} and {@link #FAILED} values are set by the workflow engine from the job outcome.
 * </p>
 */
public enum TaskStatus {
  SUBMITTED,
  RUNNING,
  SUCCEEDED,
  FAILED,
  KILLED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == KILLED;
  }
}
