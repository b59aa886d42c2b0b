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
package org.apache.batchdriver.util.retry;

import java.util.concurrent.TimeUnit;

import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableMap;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;


/**
 * Factory class that builds a fixed-wait, attempt-bounded {@link Retryer} from a {@link Config}.
 *
 * <p>
 *   Accepted keys are {@link #RETRY_INTERVAL_MS} and {@link #RETRY_ATTEMPTS}. Fewer than one attempt still makes a
 *   single call.
 * </p>
 */
public class RetryerFactory {
  public static final String RETRY_INTERVAL_MS = "interval_ms";
  public static final String RETRY_ATTEMPTS = "attempts";

  private static final Config DEFAULTS = ConfigFactory.parseMap(ImmutableMap.<String, Object>of(
      RETRY_INTERVAL_MS, TimeUnit.SECONDS.toMillis(30L),
      RETRY_ATTEMPTS, 3));

  private RetryerFactory() {
  }

  /**
   * Creates a retryer that retries only on exceptions accepted by {@code retryOn}. Other exceptions abort
   * immediately and surface through {@link java.util.concurrent.ExecutionException}.
   */
  public static <T> Retryer<T> newInstance(Config config, Predicate<Throwable> retryOn) {
    config = config.withFallback(DEFAULTS);
    return RetryerBuilder.<T>newBuilder()
        .retryIfException(retryOn)
        .withStopStrategy(StopStrategies.stopAfterAttempt(Math.max(1, config.getInt(RETRY_ATTEMPTS))))
        .withWaitStrategy(WaitStrategies.fixedWait(config.getLong(RETRY_INTERVAL_MS), TimeUnit.MILLISECONDS))
        .build();
  }
}
