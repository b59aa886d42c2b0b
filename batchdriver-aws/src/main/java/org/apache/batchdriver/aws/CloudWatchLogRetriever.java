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

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.services.batch.model.JobDetail;
import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.logs.model.OutputLogEvent;
import com.amazonaws.services.logs.model.ResourceNotFoundException;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.Retryer;
import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.base.Predicates;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.typesafe.config.ConfigFactory;

import org.apache.batchdriver.api.TerminationSignal;
import org.apache.batchdriver.util.retry.RetryerFactory;


/**
 * Reads the output of a job from CloudWatch Logs.
 *
 * <p>
 *   A stream is read forward from its head, page by page, until CloudWatch hands back the token it was given.
 *   Log streams appear some time after a job starts, so a missing stream is retried a bounded number of times
 *   before a placeholder message is returned instead of the logs.
 * </p>
 */
public class CloudWatchLogRetriever {
  private static final Logger LOGGER = LoggerFactory.getLogger(CloudWatchLogRetriever.class);

  static final String LOG_STREAM_NOT_FOUND = "log stream not found for log_stream_name: %s\n";
  static final String NO_LOG_STREAM = "no log stream was available for job: %s\n";

  private static final Joiner NEWLINE_JOINER = Joiner.on('\n');

  private final AWSBatchSdkClient awsBatchSdkClient;
  private final String logGroupName;

  public CloudWatchLogRetriever(AWSBatchSdkClient awsBatchSdkClient, String logGroupName) {
    this.awsBatchSdkClient = awsBatchSdkClient;
    this.logGroupName = logGroupName;
  }

  /**
   * Read a whole log stream.
   *
   * @param logStreamName stream to read
   * @param attempts how many times to look for the stream before giving up
   * @param sleepMillis pause between two lookups
   * @param signal stops paging when raised; the lines read so far are returned
   * @return messages joined by newlines, without messages containing a carriage return, or a placeholder if the
   *         stream never appeared
   */
  public String fetchLogs(final String logStreamName, int attempts, long sleepMillis, final TerminationSignal signal) {
    Retryer<String> retryer = RetryerFactory.newInstance(ConfigFactory.parseMap(ImmutableMap.<String, Object>of(
        RetryerFactory.RETRY_INTERVAL_MS, sleepMillis,
        RetryerFactory.RETRY_ATTEMPTS, attempts)), Predicates.instanceOf(ResourceNotFoundException.class));
    try {
      return retryer.call(new Callable<String>() {
        @Override
        public String call() {
          return readLogStream(logStreamName, signal);
        }
      });
    } catch (RetryException re) {
      LOGGER.warn(String.format("Log stream %s not found after %d attempts", logStreamName,
          re.getNumberOfFailedAttempts()));
      return String.format(LOG_STREAM_NOT_FOUND, logStreamName);
    } catch (ExecutionException ee) {
      Throwables.throwIfUnchecked(ee.getCause());
      throw new AWSBatchApiException("Failed to read log stream " + logStreamName, ee.getCause());
    }
  }

  /**
   * Look up the log stream of {@code jobId} and read it with {@link #fetchLogs}.
   */
  public String fetchLogsForJob(String jobId, int attempts, long sleepMillis, TerminationSignal signal) {
    List<JobDetail> jobs = this.awsBatchSdkClient.describeJobs(Collections.singletonList(jobId));
    if (jobs.size() != 1 || !jobId.equals(jobs.get(0).getJobId())) {
      throw new JobStatusMismatchException(Collections.singleton(jobId), JobIds.of(jobs));
    }
    RemoteJobRecord record = RemoteJobRecord.fromJobDetail(jobs.get(0));
    if (!record.getLogStreamName().isPresent()) {
      return String.format(NO_LOG_STREAM, jobId);
    }
    return fetchLogs(record.getLogStreamName().get(), attempts, sleepMillis, signal);
  }

  private String readLogStream(String logStreamName, TerminationSignal signal) {
    List<String> messages = Lists.newArrayList();
    String token = null;
    int pages = 0;
    while (true) {
      GetLogEventsResult result = this.awsBatchSdkClient.getLogEvents(this.logGroupName, logStreamName, token);
      pages++;
      List<OutputLogEvent> events = result.getEvents() == null ? ImmutableList.<OutputLogEvent>of()
          : result.getEvents();
      for (OutputLogEvent event : events) {
        if (event.getMessage() != null && !event.getMessage().contains("\r")) {
          messages.add(event.getMessage());
        }
      }
      LOGGER.debug(String.format("Read page %d of %s with %d events", pages, logStreamName, events.size()));
      String nextToken = result.getNextForwardToken();
      if (nextToken == null || Objects.equal(nextToken, token)) {
        break;
      }
      if (signal.isTerminationRequested()) {
        LOGGER.info(String.format("Termination requested, stopped reading %s after %d pages", logStreamName, pages));
        break;
      }
      token = nextToken;
    }
    return NEWLINE_JOINER.join(messages);
  }
}
