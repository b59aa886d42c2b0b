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

import java.util.concurrent.atomic.AtomicReference;

import com.google.common.base.Optional;


/**
 * A {@link TerminationSignal} that is raised once, typically from a signal handler or a shutdown hook,
 * and remembers why.
 */
public class SettableTerminationSignal implements TerminationSignal {

  private final AtomicReference<String> reason = new AtomicReference<>();

  /**
   * Raise the signal. Only the first reason is kept.
   *
   * @param reason why termination was requested, e.g. the name of the received OS signal
   * @return {@code true} if this call raised the signal
   */
  public boolean terminate(String reason) {
    return this.reason.compareAndSet(null, reason == null ? "unspecified" : reason);
  }

  @Override
  public boolean isTerminationRequested() {
    return this.reason.get() != null;
  }

  public Optional<String> getReason() {
    return Optional.fromNullable(this.reason.get());
  }

  @Override
  public String toString() {
    return String.format("%s{reason=%s}", SettableTerminationSignal.class.getSimpleName(), this.reason.get());
  }
}
