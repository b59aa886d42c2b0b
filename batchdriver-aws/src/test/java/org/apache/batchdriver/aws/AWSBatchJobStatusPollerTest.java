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

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.amazonaws.services.batch.model.AttemptContainerDetail;
import com.amazonaws.services.batch.model.AttemptDetail;
import com.amazonaws.services.batch.model.ContainerDetail;
import com.amazonaws.services.batch.model.JobDetail;
import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.logs.model.OutputLogEvent;
import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.apache.batchdriver.api.TerminationSignal;


/**
 * Unit tests for {@link AWSBatchJobStatusPoller}.
 */
@Test(groups = { "batchdriver.aws" })
public class AWSBatchJobStatusPollerTest {

  private File directory;
  private AWSBatchSdkClient awsBatchSdkClient;
  private AWSBatchJobStatusPoller poller;
  private Map<String, JobDetail> remoteJobs;

  @BeforeMethod
  public void setUp() throws IOException {
    this.directory = Files.createTempDirectory("poller").toFile();
    this.remoteJobs = Maps.newHashMap();
    this.awsBatchSdkClient = Mockito.mock(AWSBatchSdkClient.class);
    Mockito.doAnswer(new Answer<List<JobDetail>>() {
      @Override
      public List<JobDetail> answer(InvocationOnMock invocation) {
        List<String> jobIds = invocation.getArgument(0);
        List<JobDetail> jobs = Lists.newArrayList();
        // the service does not preserve request order
        for (String jobId : Lists.reverse(jobIds)) {
          if (remoteJobs.containsKey(jobId)) {
            jobs.add(remoteJobs.get(jobId));
          }
        }
        return jobs;
      }
    }).when(this.awsBatchSdkClient).describeJobs(ArgumentMatchers.<String>anyList());
    Mockito.doReturn(new GetLogEventsResult()
        .withEvents(new OutputLogEvent().withMessage("hello"))
        .withNextForwardToken("f/1"))
        .when(this.awsBatchSdkClient).getLogEvents(ArgumentMatchers.anyString(), ArgumentMatchers.anyString(),
            ArgumentMatchers.<String>isNull());
    Mockito.doReturn(new GetLogEventsResult().withEvents().withNextForwardToken("f/1"))
        .when(this.awsBatchSdkClient).getLogEvents(ArgumentMatchers.anyString(), ArgumentMatchers.anyString(),
            ArgumentMatchers.eq("f/1"));

    TaskCleaner cleaner = new TaskCleaner(this.awsBatchSdkClient,
        new CloudWatchLogRetriever(this.awsBatchSdkClient, "/aws/batch/job"));
    this.poller = new AWSBatchJobStatusPoller(this.awsBatchSdkClient, cleaner, 50, 3, 0L);
  }

  @AfterMethod
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(this.directory);
  }

  private static JobDetail job(String jobId, String status) {
    return new JobDetail().withJobId(jobId).withStatus(status)
        .withContainer(new ContainerDetail().withLogStreamName("base/default/" + jobId));
  }

  private static JobDetail finishedJob(String jobId, String status, Integer exitCode, String statusReason,
      String containerReason) {
    return job(jobId, status)
        .withAttempts(new AttemptDetail().withStatusReason(statusReason)
            .withContainer(new AttemptContainerDetail().withExitCode(exitCode).withReason(containerReason)))
        .withStartedAt(1000L)
        .withStoppedAt(62600L);
  }

  private void addJob(JobDetail job) {
    this.remoteJobs.put(job.getJobId(), job);
  }

  @Test
  public void testOnlyTerminalTasksAreEmitted() throws Exception {
    addJob(job("j1", "RUNNABLE"));
    addJob(finishedJob("j2", "SUCCEEDED", 0, "Essential container in task exited", null));
    addJob(job("j3", "RUNNING"));
    addJob(finishedJob("j4", "FAILED", 1, "Essential container in task exited", "OutOfMemoryError"));
    addJob(job("j5", "STARTING"));
    List<FakeBatchTask> tasks = Lists.newArrayList();
    for (int i = 1; i <= 5; i++) {
      tasks.add(FakeBatchTask.submitted("t" + i, "j" + i, this.directory));
    }

    List<CompletedJob> completed = Lists.newArrayList(this.poller.filterCompleted(tasks, TerminationSignal.NEVER));

    Assert.assertEquals(completed.size(), 2);
    Assert.assertSame(completed.get(0).getTask(), tasks.get(1));
    Assert.assertEquals(completed.get(0).getOutcome(),
        new JobOutcome(0, 62, "Essential container in task exited"));
    Assert.assertSame(completed.get(1).getTask(), tasks.get(3));
    Assert.assertEquals(completed.get(1).getOutcome(),
        new JobOutcome(1, 62, "Essential container in task exited -- container_reason: OutOfMemoryError"));
  }

  @Test
  public void testCompletedTasksAreCleanedUpBeforeTheyAreReturned() throws Exception {
    addJob(finishedJob("j1", "SUCCEEDED", 0, null, null));
    FakeBatchTask task = FakeBatchTask.submitted("t1", "j1", this.directory);

    Iterator<CompletedJob> completed = this.poller.filterCompleted(ImmutableList.of(task), TerminationSignal.NEVER);
    Mockito.verifyNoInteractions(this.awsBatchSdkClient);

    Assert.assertTrue(completed.hasNext());
    Assert.assertEquals(FileUtils.readFileToString(task.getStdoutFile(), Charsets.UTF_8),
        "hello\nWARNING: this might be truncated.  check log stream on the aws console for job: j1");
    Mockito.verify(this.awsBatchSdkClient).deleteObject(S3Location.parse(task.getCommandScriptUri()));
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(2)).getLogEvents(ArgumentMatchers.eq("/aws/batch/job"),
        ArgumentMatchers.eq("base/default/j1"), ArgumentMatchers.<String>any());
    Assert.assertNull(completed.next().getOutcome().getStatusReason());
    Assert.assertFalse(completed.hasNext());
  }

  @Test
  public void testMissingExitCodeDefaults() {
    addJob(finishedJob("j1", "FAILED", null, "Host EC2 terminated", null));
    JobOutcome outcome = this.poller.filterCompleted(
        ImmutableList.of(FakeBatchTask.submitted("t1", "j1", this.directory)), TerminationSignal.NEVER).next()
        .getOutcome();
    Assert.assertEquals(outcome.getExitStatus(), -2);
    Assert.assertEquals(outcome.getStatusReason(), "Host EC2 terminated");
  }

  @Test
  public void testFailedWithoutAttempt() {
    addJob(job("j1", "FAILED"));
    JobOutcome outcome = this.poller.filterCompleted(
        ImmutableList.of(FakeBatchTask.submitted("t1", "j1", this.directory)), TerminationSignal.NEVER).next()
        .getOutcome();
    Assert.assertEquals(outcome, new JobOutcome(-1, 0, "no_attempt"));
  }

  @Test(expectedExceptions = JobInvariantViolationException.class)
  public void testSucceededWithoutAttemptViolatesInvariant() {
    addJob(job("j1", "SUCCEEDED"));
    this.poller.filterCompleted(ImmutableList.of(FakeBatchTask.submitted("t1", "j1", this.directory)),
        TerminationSignal.NEVER).next();
  }

  @Test
  public void testFailedWithExitCodeZeroViolatesInvariant() {
    addJob(finishedJob("j1", "FAILED", 0, "Essential container in task exited", null));
    FakeBatchTask task = FakeBatchTask.submitted("t1", "j1", this.directory);
    try {
      this.poller.filterCompleted(ImmutableList.of(task), TerminationSignal.NEVER).next();
      Assert.fail("Expected an invariant violation");
    } catch (JobInvariantViolationException jive) {
      Assert.assertTrue(jive.getMessage().contains("j1"));
    }
    Mockito.verify(this.awsBatchSdkClient, Mockito.never()).deleteObject(ArgumentMatchers.any(S3Location.class));
  }

  @Test
  public void testMissingJobIsAMismatch() {
    addJob(finishedJob("j1", "SUCCEEDED", 0, null, null));
    List<FakeBatchTask> tasks = ImmutableList.of(FakeBatchTask.submitted("t1", "j1", this.directory),
        FakeBatchTask.submitted("t2", "j2", this.directory));
    try {
      this.poller.filterCompleted(tasks, TerminationSignal.NEVER).hasNext();
      Assert.fail("Expected a mismatch");
    } catch (JobStatusMismatchException jsme) {
      Assert.assertEquals(jsme.getMissingJobIds(), ImmutableSet.of("j2"));
      Assert.assertTrue(jsme.getUnexpectedJobIds().isEmpty());
    }
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testTaskWithoutJobIdIsRejected() {
    this.poller.filterCompleted(ImmutableList.of(new FakeBatchTask("t1", this.directory)), TerminationSignal.NEVER);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testDuplicateJobIdsAreRejected() {
    this.poller.filterCompleted(ImmutableList.of(FakeBatchTask.submitted("t1", "j1", this.directory),
        FakeBatchTask.submitted("t2", "j1", this.directory)), TerminationSignal.NEVER);
  }

  @Test(expectedExceptions = AWSBatchApiException.class)
  public void testUnknownStatusFailsLoudly() {
    addJob(job("j1", "PAUSED"));
    this.poller.filterCompleted(ImmutableList.of(FakeBatchTask.submitted("t1", "j1", this.directory)),
        TerminationSignal.NEVER).hasNext();
  }

  @Test
  public void testMissingTimingInfo() {
    addJob(finishedJob("j1", "SUCCEEDED", 0, null, null).withStoppedAt(null));
    Assert.assertEquals(this.poller.filterCompleted(
        ImmutableList.of(FakeBatchTask.submitted("t1", "j1", this.directory)), TerminationSignal.NEVER).next()
        .getOutcome().getWallTimeSeconds(), 0L);
  }

  @Test
  public void testDescribeIsChunkedAndOrdered() {
    List<String> jobIds = Lists.newArrayList();
    for (int i = 0; i < 120; i++) {
      addJob(job("j" + i, "RUNNING"));
      jobIds.add("j" + i);
    }

    List<RemoteJobRecord> records = this.poller.describe(jobIds, false);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass((Class) List.class);
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(3)).describeJobs(captor.capture());
    Assert.assertEquals(captor.getAllValues().get(0).size(), 50);
    Assert.assertEquals(captor.getAllValues().get(1).size(), 50);
    Assert.assertEquals(captor.getAllValues().get(2).size(), 20);
    Assert.assertEquals(records.size(), 120);
    for (int i = 0; i < 120; i++) {
      Assert.assertEquals(records.get(i).getJobId(), "j" + i);
    }
  }

  @Test
  public void testRemoteStatuses() {
    addJob(job("j1", "SUBMITTED"));
    addJob(job("j2", "PENDING"));
    addJob(job("j3", "STARTING"));
    addJob(finishedJob("j4", "SUCCEEDED", 0, null, null));
    FakeBatchTask unsubmitted = new FakeBatchTask("t0", this.directory);

    Map<String, RemoteJobStatus> statuses = this.poller.remoteStatuses(ImmutableList.of(unsubmitted,
        FakeBatchTask.submitted("t1", "j1", this.directory), FakeBatchTask.submitted("t2", "j2", this.directory),
        FakeBatchTask.submitted("t3", "j3", this.directory), FakeBatchTask.submitted("t4", "j4", this.directory),
        FakeBatchTask.submitted("t5", "gone", this.directory)));

    Assert.assertEquals(statuses.size(), 4);
    Assert.assertEquals(statuses.get("j1"), RemoteJobStatus.QUEUED);
    Assert.assertEquals(statuses.get("j2"), RemoteJobStatus.QUEUED);
    Assert.assertEquals(statuses.get("j3"), RemoteJobStatus.RUNNING);
    Assert.assertEquals(statuses.get("j4"), RemoteJobStatus.SUCCEEDED);
  }

  @Test
  public void testNoTasks() {
    Assert.assertFalse(this.poller.filterCompleted(ImmutableList.<FakeBatchTask>of(), TerminationSignal.NEVER)
        .hasNext());
    Assert.assertTrue(this.poller.remoteStatuses(ImmutableList.<FakeBatchTask>of()).isEmpty());
    Mockito.verifyNoInteractions(this.awsBatchSdkClient);
  }
}
