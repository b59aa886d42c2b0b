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

import java.util.List;

import com.amazonaws.services.batch.model.AttemptContainerDetail;
import com.amazonaws.services.batch.model.AttemptDetail;
import com.amazonaws.services.batch.model.JobDetail;
import com.google.common.base.Optional;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;


/**
 * The parts of a {@code DescribeJobs} entry the driver acts on. Only the last attempt is kept.
 */
@Getter
@ToString
@AllArgsConstructor
public class RemoteJobRecord {

  private final String jobId;
  private final RemoteJobStatus status;
  private final String rawStatus;
  private final boolean attempted;
  private final Optional<Integer> exitCode;
  private final Optional<String> attemptStatusReason;
  private final Optional<String> containerReason;
  private final Optional<String> logStreamName;
  private final Optional<Long> startedAt;
  private final Optional<Long> stoppedAt;

  public static RemoteJobRecord fromJobDetail(JobDetail jobDetail) {
    List<AttemptDetail> attempts = jobDetail.getAttempts();
    boolean hasAttempt = attempts != null && !attempts.isEmpty();

    Optional<Integer> exitCode = Optional.absent();
    Optional<String> attemptStatusReason = Optional.absent();
    Optional<String> containerReason = Optional.absent();
    if (hasAttempt) {
      AttemptDetail lastAttempt = attempts.get(attempts.size() - 1);
      attemptStatusReason = Optional.fromNullable(lastAttempt.getStatusReason());
      AttemptContainerDetail container = lastAttempt.getContainer();
      if (container != null) {
        exitCode = Optional.fromNullable(container.getExitCode());
        containerReason = Optional.fromNullable(container.getReason());
      }
    }

    Optional<String> logStreamName = jobDetail.getContainer() == null ? Optional.<String>absent()
        : Optional.fromNullable(jobDetail.getContainer().getLogStreamName());

    return new RemoteJobRecord(jobDetail.getJobId(), RemoteJobStatus.fromRawStatus(jobDetail.getStatus()),
        jobDetail.getStatus(), hasAttempt, exitCode, attemptStatusReason, containerReason, logStreamName,
        Optional.fromNullable(jobDetail.getStartedAt()), Optional.fromNullable(jobDetail.getStoppedAt()));
  }
}
