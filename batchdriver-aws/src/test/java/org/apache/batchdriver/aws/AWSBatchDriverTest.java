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

import org.apache.commons.io.FileUtils;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import com.amazonaws.services.batch.model.AttemptContainerDetail;
import com.amazonaws.services.batch.model.AttemptDetail;
import com.amazonaws.services.batch.model.ContainerDetail;
import com.amazonaws.services.batch.model.JobDetail;
import com.amazonaws.services.batch.model.RegisterJobDefinitionRequest;
import com.amazonaws.services.batch.model.SubmitJobRequest;
import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.logs.model.OutputLogEvent;
import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.apache.batchdriver.api.SettableTerminationSignal;
import org.apache.batchdriver.api.TaskStatus;


/**
 * Drives a batch of tasks through submission, polling, kill and shutdown against a mocked {@link AWSBatchSdkClient}.
 */
@Test(groups = { "batchdriver.aws" }, singleThreaded = true)
public class AWSBatchDriverTest {

  private static final String ARN = "arn:aws:batch:us-west-2:123456789012:job-definition/pipeline_base_jobdef_t1:1";

  private File directory;
  private AWSBatchSdkClient awsBatchSdkClient;
  private SettableTerminationSignal signal;
  private AWSBatchDriver driver;
  private List<FakeBatchTask> tasks;

  @BeforeClass
  public void setUp() throws IOException {
    this.directory = Files.createTempDirectory("driver").toFile();
    Config config = ConfigFactory.parseResources(AWSBatchDriverTest.class, "/AWSBatchDriverTest.conf");

    this.awsBatchSdkClient = Mockito.mock(AWSBatchSdkClient.class);
    Mockito.doReturn(ARN).when(this.awsBatchSdkClient)
        .registerJobDefinition(ArgumentMatchers.any(RegisterJobDefinitionRequest.class));
    Mockito.doAnswer(new Answer<String>() {
      @Override
      public String answer(InvocationOnMock invocation) {
        SubmitJobRequest request = invocation.getArgument(0);
        return request.getJobName().substring(request.getJobName().lastIndexOf('_') + 1).replace('t', 'j');
      }
    }).when(this.awsBatchSdkClient).submitJob(ArgumentMatchers.any(SubmitJobRequest.class));

    this.signal = new SettableTerminationSignal();
    this.driver = new AWSBatchDriver(config, this.signal, this.awsBatchSdkClient);
    this.tasks = Lists.newArrayList();
    for (int i = 1; i <= 3; i++) {
      this.tasks.add(new FakeBatchTask("t" + i, this.directory));
    }
  }

  @AfterClass
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(this.directory);
  }

  @Test
  public void testSubmit() throws Exception {
    this.driver.submitJobs(this.tasks);

    ArgumentCaptor<RegisterJobDefinitionRequest> registration =
        ArgumentCaptor.forClass(RegisterJobDefinitionRequest.class);
    Mockito.verify(this.awsBatchSdkClient).registerJobDefinition(registration.capture());
    Assert.assertEquals(registration.getValue().getJobDefinitionName(), "pipeline_base_jobdef_t1");
    Assert.assertEquals(registration.getValue().getContainerProperties().getJobRoleArn(),
        "arn:aws:iam::123456789012:role/batch-job");
    Assert.assertEquals(registration.getValue().getContainerProperties().getVolumes().get(0).getHost().getSourcePath(),
        "/mnt/scratch");

    ArgumentCaptor<SubmitJobRequest> submissions = ArgumentCaptor.forClass(SubmitJobRequest.class);
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(3)).submitJob(submissions.capture());
    for (SubmitJobRequest request : submissions.getAllValues()) {
      Assert.assertTrue(request.getJobName().startsWith("pipeline__ci__align__t"));
      Assert.assertEquals(request.getTags().get("username"), "ci");
    }
    for (FakeBatchTask task : this.tasks) {
      Assert.assertEquals(task.getStatus(), TaskStatus.SUBMITTED);
      Assert.assertEquals(task.getJobId(), task.getUid().replace('t', 'j'));
      Assert.assertEquals(task.getJobDefinitionArn(), ARN);
    }
  }

  @Test(dependsOnMethods = "testSubmit")
  public void testPoll() throws Exception {
    Mockito.doAnswer(new Answer<List<JobDetail>>() {
      @Override
      public List<JobDetail> answer(InvocationOnMock invocation) {
        List<String> jobIds = invocation.getArgument(0);
        List<JobDetail> jobs = Lists.newArrayList();
        for (String jobId : jobIds) {
          if (jobId.equals("j2")) {
            jobs.add(new JobDetail().withJobId(jobId).withStatus("SUCCEEDED")
                .withContainer(new ContainerDetail().withLogStreamName("pipeline/default/j2"))
                .withAttempts(new AttemptDetail().withStatusReason("Essential container in task exited")
                    .withContainer(new AttemptContainerDetail().withExitCode(0)))
                .withStartedAt(0L).withStoppedAt(5000L));
          } else {
            jobs.add(new JobDetail().withJobId(jobId).withStatus("RUNNING").withContainer(new ContainerDetail()));
          }
        }
        return jobs;
      }
    }).when(this.awsBatchSdkClient).describeJobs(ArgumentMatchers.<String>anyList());
    Mockito.doReturn(new GetLogEventsResult().withEvents(new OutputLogEvent().withMessage("aligned"))
        .withNextForwardToken("f/1")).when(this.awsBatchSdkClient)
        .getLogEvents("/aws/batch/pipeline", "pipeline/default/j2", null);
    Mockito.doReturn(new GetLogEventsResult().withEvents().withNextForwardToken("f/1")).when(this.awsBatchSdkClient)
        .getLogEvents("/aws/batch/pipeline", "pipeline/default/j2", "f/1");

    Assert.assertEquals(this.driver.remoteStatuses(this.tasks).get("j2"), RemoteJobStatus.SUCCEEDED);

    Iterator<CompletedJob> completed = this.driver.filterCompleted(this.tasks);
    CompletedJob job = completed.next();
    Assert.assertFalse(completed.hasNext());

    Assert.assertSame(job.getTask(), this.tasks.get(1));
    Assert.assertEquals(job.getOutcome(), new JobOutcome(0, 5, "Essential container in task exited"));
    Assert.assertTrue(FileUtils.readFileToString(this.tasks.get(1).getStdoutFile(), Charsets.UTF_8)
        .startsWith("aligned\nWARNING"));
    Mockito.verify(this.awsBatchSdkClient)
        .deleteObject(S3Location.parse(this.tasks.get(1).getCommandScriptUri()));
  }

  @Test(dependsOnMethods = "testPoll")
  public void testKillAndShutdown() throws Exception {
    List<FakeBatchTask> running = ImmutableList.of(this.tasks.get(0), this.tasks.get(2));
    this.signal.terminate("SIGINT");

    this.driver.killAll(running);

    Mockito.verify(this.awsBatchSdkClient).terminateJob("j1", "cancelled by pipeline");
    Mockito.verify(this.awsBatchSdkClient).terminateJob("j3", "cancelled by pipeline");
    Assert.assertEquals(this.tasks.get(0).getStatus(), TaskStatus.KILLED);
    Assert.assertEquals(this.tasks.get(2).getStatus(), TaskStatus.KILLED);

    this.driver.shutdown();
    this.driver.shutdown();
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(1)).deregisterJobDefinition(ARN);
    Assert.assertTrue(this.driver.getJobDefinitionRegistry().getRegisteredDefinitions().isEmpty());
  }
}
