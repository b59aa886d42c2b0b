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

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Charsets;
import com.google.common.base.Optional;

import org.apache.batchdriver.api.BatchTask;
import org.apache.batchdriver.api.TerminationSignal;


/**
 * Collects a finished or killed job's output into its task's stdout file and removes the staged command script.
 *
 * <p>
 *   Only the given task's files and its staged script are touched, so tasks can be cleaned up from several threads.
 * </p>
 */
public class TaskCleaner {
  private static final Logger LOGGER = LoggerFactory.getLogger(TaskCleaner.class);

  static final String TRUNCATION_WARNING =
      "\nWARNING: this might be truncated.  check log stream on the aws console for job: %s";

  private final AWSBatchSdkClient awsBatchSdkClient;
  private final CloudWatchLogRetriever logRetriever;

  public TaskCleaner(AWSBatchSdkClient awsBatchSdkClient, CloudWatchLogRetriever logRetriever) {
    this.awsBatchSdkClient = awsBatchSdkClient;
    this.logRetriever = logRetriever;
  }

  /**
   * @param task task to clean up
   * @param logStreamName the job's log stream, looked up from the job id if absent
   * @param logAttempts how many times to look for the log stream, logs are not fetched if not positive
   * @param logSleepMillis pause between two log stream lookups
   * @param signal stops log paging when raised
   * @throws IOException if the stdout file cannot be written
   */
  public void cleanup(BatchTask task, Optional<String> logStreamName, int logAttempts, long logSleepMillis,
      TerminationSignal signal) throws IOException {
    if (logAttempts > 0) {
      String logs = logStreamName.isPresent()
          ? this.logRetriever.fetchLogs(logStreamName.get(), logAttempts, logSleepMillis, signal)
          : this.logRetriever.fetchLogsForJob(task.getJobId(), logAttempts, logSleepMillis, signal);
      FileUtils.writeStringToFile(task.getStdoutFile(), logs + String.format(TRUNCATION_WARNING, task.getJobId()),
          Charsets.UTF_8);
    }

    if (task.isKeepCommandScript()) {
      LOGGER.info(String.format("Keeping command script %s of task %s", task.getCommandScriptUri(), task.getUid()));
    } else if (task.getCommandScriptUri() != null) {
      this.awsBatchSdkClient.deleteObject(S3Location.parse(task.getCommandScriptUri()));
    }
    LOGGER.info(String.format("Cleaned up task %s (job %s)", task.getUid(), task.getJobId()));
  }
}
