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

/**
 * Coarse state of an AWS Batch job.
 */
public enum RemoteJobStatus {
  /** SUBMITTED, PENDING, RUNNABLE */
  QUEUED,
  /** STARTING, RUNNING */
  RUNNING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }

  /**
   * Map a raw AWS Batch job status.
   *
   * @throws AWSBatchApiException if the status is not one AWS Batch documents
   */
  public static RemoteJobStatus fromRawStatus(String rawStatus) {
    if (rawStatus == null) {
      throw new AWSBatchApiException("Job has no status");
    }
    switch (rawStatus) {
      case "SUBMITTED":
      case "PENDING":
      case "RUNNABLE":
        return QUEUED;
      case "STARTING":
      case "RUNNING":
        return RUNNING;
      case "SUCCEEDED":
        return SUCCEEDED;
      case "FAILED":
        return FAILED;
      default:
        throw new AWSBatchApiException("Unknown job status " + rawStatus);
    }
  }
}
