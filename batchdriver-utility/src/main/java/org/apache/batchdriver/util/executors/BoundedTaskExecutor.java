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
package org.apache.batchdriver.util.executors;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;

import org.apache.batchdriver.util.ExecutorsUtils;

import lombok.extern.slf4j.Slf4j;


/**
 * Runs a list of {@link Callable}s on at most {@code maxThreads} worker threads and returns their futures in input
 * order. A single callable runs on the caller's thread without creating a pool.
 *
 * <p>
 *  Note: {@link #execute()} only guarantees every callable has finished, not that it finished successfully. Callers
 *  inspect the returned futures, e.g. through {@link #getFirstFailure(List)}.
 * </p>
 *
 * @param <T> result type of the callables
 */
@Slf4j
public class BoundedTaskExecutor<T> {

  private final List<Callable<T>> callables;
  private final int numThreads;
  private final ThreadFactory threadFactory;
  private boolean executed;

  public BoundedTaskExecutor(List<? extends Callable<T>> callables, int maxThreads, ThreadFactory threadFactory) {
    Preconditions.checkArgument(maxThreads > 0, "maxThreads must be positive, got %s", maxThreads);
    this.callables = ImmutableList.copyOf(callables);
    this.numThreads = Math.max(1, Math.min(this.callables.size(), maxThreads));
    this.threadFactory = threadFactory;
    this.executed = false;
  }

  /**
   * @return the number of worker threads {@link #execute()} will use
   */
  public int getNumThreads() {
    return this.numThreads;
  }

  /**
   * Execute every callable. Blocks until all of them are completed.
   *
   * @return completed futures, in the order of the input callables
   * @throws InterruptedException if interrupted while waiting for a worker
   */
  public List<Future<T>> execute() throws InterruptedException {
    if (this.executed) {
      throw new IllegalStateException(String.format("This %s has already been executed.",
          BoundedTaskExecutor.class.getSimpleName()));
    }
    this.executed = true;

    if (this.callables.isEmpty()) {
      return ImmutableList.of();
    }
    if (this.callables.size() == 1) {
      return ImmutableList.of(callInline(this.callables.get(0)));
    }

    ExecutorService executor = Executors.newFixedThreadPool(this.numThreads, this.threadFactory);
    CompletionService<T> completionService = new ExecutorCompletionService<>(executor);
    List<Future<T>> futures = Lists.newArrayListWithCapacity(this.callables.size());
    try {
      int activeTasks = 0;
      for (Callable<T> callable : this.callables) {
        futures.add(completionService.submit(callable));
        activeTasks++;
        if (activeTasks == this.numThreads) {
          completionService.take();
          activeTasks--;
        }
      }
      while (activeTasks > 0) {
        completionService.take();
        activeTasks--;
      }
    } finally {
      ExecutorsUtils.shutdownExecutorService(executor, Optional.of(log), 10, TimeUnit.SECONDS);
    }
    return futures;
  }

  private Future<T> callInline(Callable<T> callable) {
    try {
      return Futures.immediateFuture(callable.call());
    } catch (Exception exception) {
      return Futures.immediateFailedFuture(exception);
    }
  }

  /**
   * Get the cause of the first failed future in {@code futures}, if any. Every future must be done.
   */
  public static <T> Optional<Throwable> getFirstFailure(List<Future<T>> futures) throws InterruptedException {
    for (Future<T> future : futures) {
      Preconditions.checkArgument(future.isDone(), "Future is not done");
      try {
        future.get();
      } catch (ExecutionException ee) {
        return Optional.of(ee.getCause() == null ? ee : ee.getCause());
      }
    }
    return Optional.absent();
  }

  /**
   * Rethrow the cause of the first failed future. Every future must be done.
   *
   * @param operation what the callables did, used in the wrapping exception's message
   */
  public static <T> void rethrowFirstFailure(List<Future<T>> futures, String operation)
      throws IOException, InterruptedException {
    Optional<Throwable> failure = getFirstFailure(futures);
    if (failure.isPresent()) {
      rethrow(failure.get(), operation);
    }
  }

  /**
   * Rethrow {@code failure} unchanged if it is unchecked or an {@link IOException}, wrapped in an
   * {@link IOException} otherwise.
   */
  public static void rethrow(Throwable failure, String operation) throws IOException {
    Throwables.throwIfUnchecked(failure);
    Throwables.throwIfInstanceOf(failure, IOException.class);
    throw new IOException(String.format("Failed to %s task", operation), failure);
  }
}
