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
package org.apache.batchdriver.aws;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.apache.batchdriver.api.BatchTask;
import org.apache.batchdriver.api.TaskStatus;
import org.apache.batchdriver.api.TerminationSignal;
import org.apache.batchdriver.util.ExecutorsUtils;
import org.apache.batchdriver.util.executors.BoundedTaskExecutor;


/**
 * Forcefully terminates jobs. A killed job's logs are not collected; its staged script is removed.
 */
public class AWSBatchJobTerminator {
  private static final Logger LOGGER = LoggerFactory.getLogger(AWSBatchJobTerminator.class);

  private final AWSBatchSdkClient awsBatchSdkClient;
  private final TaskCleaner taskCleaner;
  private final String terminationReason;
  private final int maxThreads;

  public AWSBatchJobTerminator(AWSBatchSdkClient awsBatchSdkClient, TaskCleaner taskCleaner, String terminationReason,
      int maxThreads) {
    this.awsBatchSdkClient = awsBatchSdkClient;
    this.taskCleaner = taskCleaner;
    this.terminationReason = terminationReason;
    this.maxThreads = maxThreads;
  }

  public void kill(BatchTask task, TerminationSignal signal) throws IOException {
    Preconditions.checkArgument(task.getJobId() != null, "Task %s has no job id", task.getUid());
    LOGGER.info(String.format("Terminating job %s of task %s", task.getJobId(), task.getUid()));
    this.awsBatchSdkClient.terminateJob(task.getJobId(), this.terminationReason);
    this.taskCleaner.cleanup(task, Optional.<String>absent(), 0, 0L, signal);
    task.setStatus(TaskStatus.KILLED);
  }

  /**
   * Kill every task, on up to the configured number of threads. All kills are attempted; the first failure is
   * rethrown afterwards.
   */
  public void killAll(List<? extends BatchTask> tasks, final TerminationSignal signal)
      throws IOException, InterruptedException {
    if (tasks.isEmpty()) {
      return;
    }
    LOGGER.info(String.format("Killing %d tasks", tasks.size()));

    List<Callable<Void>> kills = Lists.newArrayListWithCapacity(tasks.size());
    for (final BatchTask task : tasks) {
      kills.add(new Callable<Void>() {
        @Override
        public Void call() throws IOException {
          kill(task, signal);
          return null;
        }
      });
    }
    List<Future<Void>> results = new BoundedTaskExecutor<>(kills, this.maxThreads,
        ExecutorsUtils.newDaemonThreadFactory(Optional.of(LOGGER), Optional.of("AWSBatchKiller-%d"))).execute();
    BoundedTaskExecutor.rethrowFirstFailure(results, "kill");
  }
}
