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
package org.apache.batchdriver.util;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;


/**
 * Helpers for creating and tearing down the worker pools used by bulk driver operations.
 */
public class ExecutorsUtils {

  private ExecutorsUtils() {
  }

  /**
   * Get a new daemon {@link ThreadFactory} whose threads log uncaught exceptions through
   * {@link LoggingUncaughtExceptionHandler}.
   *
   * @param logger the {@link Logger} uncaught exceptions go to, the handler's own logger if absent
   * @param nameFormat a {@link String#format(String, Object...)} pattern taking the thread index, if any
   */
  public static ThreadFactory newDaemonThreadFactory(Optional<Logger> logger, Optional<String> nameFormat) {
    ThreadFactoryBuilder builder = new ThreadFactoryBuilder().setDaemon(true);
    if (nameFormat.isPresent()) {
      builder.setNameFormat(nameFormat.get());
    }
    return builder.setUncaughtExceptionHandler(new LoggingUncaughtExceptionHandler(logger)).build();
  }

  /**
   * Shutdown an {@link ExecutorService} gradually: stop accepting work, wait half of {@code timeout} for running
   * work, then cancel what is left and wait the other half.
   *
   * @param executorService the {@link ExecutorService} to shutdown
   * @param logger where to report work that had to be cancelled
   * @param timeout the maximum time to wait for the {@code ExecutorService} to terminate
   * @param unit the time unit of the timeout argument
   */
  public static void shutdownExecutorService(ExecutorService executorService, Optional<Logger> logger,
      long timeout, TimeUnit unit) {
    Preconditions.checkNotNull(unit);
    executorService.shutdown();
    try {
      long halfTimeoutNanos = TimeUnit.NANOSECONDS.convert(timeout, unit) / 2;
      if (!executorService.awaitTermination(halfTimeoutNanos, TimeUnit.NANOSECONDS)) {
        List<Runnable> pending = executorService.shutdownNow();
        if (logger.isPresent()) {
          logger.get().warn(String.format("Executor service shutdown timed out, %d pending tasks were cancelled",
              pending.size()));
        }
        executorService.awaitTermination(halfTimeoutNanos, TimeUnit.NANOSECONDS);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      executorService.shutdownNow();
    }
  }
}
