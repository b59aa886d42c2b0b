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
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.services.batch.model.JobDetail;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.apache.batchdriver.api.BatchTask;
import org.apache.batchdriver.api.TerminationSignal;


/**
 * Polls AWS Batch for the state of submitted jobs.
 *
 * <p>
 *   Job ids are described in chunks. Unless told otherwise, a chunk whose answer does not cover exactly the
 *   requested ids fails the whole poll with {@link JobStatusMismatchException}.
 * </p>
 */
public class AWSBatchJobStatusPoller {
  private static final Logger LOGGER = LoggerFactory.getLogger(AWSBatchJobStatusPoller.class);

  private final AWSBatchSdkClient awsBatchSdkClient;
  private final TaskCleaner taskCleaner;
  private final int describeBatchSize;
  private final int cleanupLogAttempts;
  private final long cleanupLogSleepMillis;

  public AWSBatchJobStatusPoller(AWSBatchSdkClient awsBatchSdkClient, TaskCleaner taskCleaner, int describeBatchSize,
      int cleanupLogAttempts, long cleanupLogSleepMillis) {
    Preconditions.checkArgument(describeBatchSize > 0 && describeBatchSize <= 100,
        "describe batch size must be within [1, 100], got %s", describeBatchSize);
    this.awsBatchSdkClient = awsBatchSdkClient;
    this.taskCleaner = taskCleaner;
    this.describeBatchSize = describeBatchSize;
    this.cleanupLogAttempts = cleanupLogAttempts;
    this.cleanupLogSleepMillis = cleanupLogSleepMillis;
  }

  /**
   * Get the tasks whose job reached a terminal state, in input order.
   *
   * <p>
   *   The returned iterator is lazy and single-pass: jobs are described on the first call to
   *   {@link Iterator#hasNext()}, and each finished task is cleaned up (logs collected, script removed) right
   *   before it is returned. Tasks whose job is still queued or running are skipped.
   * </p>
   *
   * @throws IllegalArgumentException if a task has no job id or two tasks share one
   */
  public Iterator<CompletedJob> filterCompleted(List<? extends BatchTask> tasks, final TerminationSignal signal) {
    final List<BatchTask> polled = ImmutableList.copyOf(tasks);
    final List<String> jobIds = JobIds.ofTasks(polled);

    return new AbstractIterator<CompletedJob>() {
      private Iterator<BatchTask> taskIterator;
      private Map<String, RemoteJobRecord> records;

      @Override
      protected CompletedJob computeNext() {
        if (this.taskIterator == null) {
          this.records = indexById(describe(jobIds, false));
          this.taskIterator = polled.iterator();
        }
        while (this.taskIterator.hasNext()) {
          BatchTask task = this.taskIterator.next();
          RemoteJobRecord record = this.records.get(task.getJobId());
          if (!record.getStatus().isTerminal()) {
            continue;
          }
          JobOutcome outcome = toOutcome(record);
          try {
            taskCleaner.cleanup(task, record.getLogStreamName(), cleanupLogAttempts, cleanupLogSleepMillis, signal);
          } catch (IOException ioe) {
            throw new UncheckedIOException(String.format("Failed to clean up task %s", task.getUid()), ioe);
          }
          return new CompletedJob(task, outcome);
        }
        return endOfData();
      }
    };
  }

  /**
   * Get the coarse remote status of each task's job. Tasks without a job id are ignored, as are jobs AWS Batch
   * no longer knows about.
   */
  public Map<String, RemoteJobStatus> remoteStatuses(List<? extends BatchTask> tasks) {
    List<String> jobIds = Lists.newArrayList();
    for (BatchTask task : tasks) {
      if (task.getJobId() != null) {
        jobIds.add(task.getJobId());
      }
    }
    ImmutableMap.Builder<String, RemoteJobStatus> statuses = ImmutableMap.builder();
    for (RemoteJobRecord record : describe(ImmutableSet.copyOf(jobIds).asList(), true)) {
      statuses.put(record.getJobId(), record.getStatus());
    }
    return statuses.build();
  }

  /**
   * Describe {@code jobIds} in chunks.
   *
   * @param jobIds unique job ids
   * @param missingOk if false, every chunk must return exactly the requested ids
   * @return records in the order of {@code jobIds}
   */
  public List<RemoteJobRecord> describe(List<String> jobIds, boolean missingOk) {
    Preconditions.checkArgument(ImmutableSet.copyOf(jobIds).size() == jobIds.size(), "Job ids must be unique");
    List<RemoteJobRecord> records = Lists.newArrayListWithCapacity(jobIds.size());
    for (List<String> chunk : Lists.partition(jobIds, this.describeBatchSize)) {
      List<JobDetail> jobs = this.awsBatchSdkClient.describeJobs(chunk);
      Set<String> returned = JobIds.of(jobs);
      if (!missingOk && !returned.equals(ImmutableSet.copyOf(chunk))) {
        throw new JobStatusMismatchException(ImmutableSet.copyOf(chunk), returned);
      }
      Map<String, JobDetail> byId = Maps.newHashMap();
      for (JobDetail job : jobs) {
        byId.put(job.getJobId(), job);
      }
      for (String jobId : chunk) {
        if (byId.containsKey(jobId)) {
          records.add(RemoteJobRecord.fromJobDetail(byId.get(jobId)));
        }
      }
    }
    return records;
  }

  /**
   * Derive the outcome of a job in a terminal state.
   *
   * @throws JobInvariantViolationException if a succeeded job has no attempt or a failed job exited with 0
   */
  static JobOutcome toOutcome(RemoteJobRecord record) {
    int exitStatus;
    String statusReason;
    if (record.isAttempted()) {
      exitStatus = record.getExitCode().or(JobOutcome.MISSING_EXIT_CODE);
      statusReason = record.getAttemptStatusReason().orNull();
      if (statusReason != null && record.getContainerReason().isPresent()) {
        statusReason += " -- container_reason: " + record.getContainerReason().get();
      }
    } else if (record.getStatus() == RemoteJobStatus.FAILED) {
      exitStatus = JobOutcome.NO_ATTEMPT_EXIT_STATUS;
      statusReason = JobOutcome.NO_ATTEMPT_REASON;
    } else {
      throw new JobInvariantViolationException(
          String.format("Job %s is %s but has no attempt", record.getJobId(), record.getRawStatus()));
    }

    if (record.getStatus() == RemoteJobStatus.FAILED && exitStatus == 0) {
      throw new JobInvariantViolationException(
          String.format("Job %s failed, but has an exit status of 0", record.getJobId()));
    }

    long wallTimeSeconds = 0;
    if (record.getStartedAt().isPresent() && record.getStoppedAt().isPresent()) {
      wallTimeSeconds = Math.round((record.getStoppedAt().get() - record.getStartedAt().get()) / 1000.0);
    } else {
      LOGGER.warn("Could not find timing info for job: " + record.getJobId());
    }
    return new JobOutcome(exitStatus, wallTimeSeconds, statusReason);
  }

  private static Map<String, RemoteJobRecord> indexById(List<RemoteJobRecord> records) {
    Map<String, RemoteJobRecord> byId = Maps.newHashMap();
    for (RemoteJobRecord record : records) {
      byId.put(record.getJobId(), record);
    }
    return byId;
  }
}
