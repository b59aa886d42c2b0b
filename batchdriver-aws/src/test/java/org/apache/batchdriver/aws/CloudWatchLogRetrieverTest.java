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

import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.batch.model.ContainerDetail;
import com.amazonaws.services.batch.model.JobDetail;
import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.logs.model.OutputLogEvent;
import com.amazonaws.services.logs.model.ResourceNotFoundException;
import com.google.common.collect.ImmutableList;

import org.apache.batchdriver.api.SettableTerminationSignal;
import org.apache.batchdriver.api.TerminationSignal;


/**
 * Unit tests for {@link CloudWatchLogRetriever}.
 */
@Test(groups = { "batchdriver.aws" })
public class CloudWatchLogRetrieverTest {

  private static final String LOG_GROUP = "/aws/batch/job";
  private static final String LOG_STREAM = "base/default/0123";

  private AWSBatchSdkClient awsBatchSdkClient;
  private CloudWatchLogRetriever retriever;

  @BeforeMethod
  public void setUp() {
    this.awsBatchSdkClient = Mockito.mock(AWSBatchSdkClient.class);
    this.retriever = new CloudWatchLogRetriever(this.awsBatchSdkClient, LOG_GROUP);
  }

  private static GetLogEventsResult page(String nextToken, String... messages) {
    GetLogEventsResult result = new GetLogEventsResult().withEvents().withNextForwardToken(nextToken);
    for (String message : messages) {
      result.getEvents().add(new OutputLogEvent().withMessage(message).withTimestamp(0L));
    }
    return result;
  }

  @Test
  public void testPagesUntilTokenRepeats() {
    Mockito.doReturn(page("f/1", "line 1", "progress 10%\rprogress 20%", "line 2"))
        .when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, null);
    Mockito.doReturn(page("f/2", "line 3"))
        .when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, "f/1");
    Mockito.doReturn(page("f/2"))
        .when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, "f/2");

    String logs = this.retriever.fetchLogs(LOG_STREAM, 3, 0L, TerminationSignal.NEVER);

    Assert.assertEquals(logs, "line 1\nline 2\nline 3");
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(3)).getLogEvents(ArgumentMatchers.eq(LOG_GROUP),
        ArgumentMatchers.eq(LOG_STREAM), ArgumentMatchers.<String>any());
  }

  @Test
  public void testMissingStreamIsRetried() {
    Mockito.doThrow(new ResourceNotFoundException("The specified log stream does not exist."))
        .doThrow(new ResourceNotFoundException("The specified log stream does not exist."))
        .doReturn(page("f/1", "done"))
        .when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, null);
    Mockito.doReturn(page("f/1")).when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, "f/1");

    Assert.assertEquals(this.retriever.fetchLogs(LOG_STREAM, 3, 0L, TerminationSignal.NEVER), "done");
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(3)).getLogEvents(LOG_GROUP, LOG_STREAM, null);
  }

  @Test
  public void testPlaceholderWhenRetriesAreExhausted() {
    Mockito.doThrow(new ResourceNotFoundException("The specified log stream does not exist."))
        .when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, null);

    Assert.assertEquals(this.retriever.fetchLogs(LOG_STREAM, 2, 0L, TerminationSignal.NEVER),
        "log stream not found for log_stream_name: base/default/0123\n");
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(2)).getLogEvents(LOG_GROUP, LOG_STREAM, null);
  }

  @Test
  public void testOtherErrorsPropagate() {
    Mockito.doThrow(new AmazonServiceException("Access denied"))
        .when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, null);
    try {
      this.retriever.fetchLogs(LOG_STREAM, 5, 0L, TerminationSignal.NEVER);
      Assert.fail("Expected the service error to propagate");
    } catch (AmazonServiceException ase) {
      Assert.assertFalse(ase instanceof ResourceNotFoundException);
    }
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(1)).getLogEvents(LOG_GROUP, LOG_STREAM, null);
  }

  @Test
  public void testTerminationStopsPaging() {
    final SettableTerminationSignal signal = new SettableTerminationSignal();
    Mockito.doAnswer(new Answer<GetLogEventsResult>() {
      @Override
      public GetLogEventsResult answer(InvocationOnMock invocation) {
        signal.terminate("SIGTERM");
        return page("f/1", "first page");
      }
    }).when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, null);

    Assert.assertEquals(this.retriever.fetchLogs(LOG_STREAM, 3, 0L, signal), "first page");
    Mockito.verify(this.awsBatchSdkClient, Mockito.never()).getLogEvents(LOG_GROUP, LOG_STREAM, "f/1");
  }

  @Test
  public void testRaisedSignalStillReadsFirstPage() {
    SettableTerminationSignal signal = new SettableTerminationSignal();
    signal.terminate("SIGINT");
    Mockito.doReturn(page("f/1", "already written"))
        .when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, null);

    Assert.assertEquals(this.retriever.fetchLogs(LOG_STREAM, 3, 0L, signal), "already written");
    Mockito.verify(this.awsBatchSdkClient, Mockito.times(1))
        .getLogEvents(ArgumentMatchers.anyString(), ArgumentMatchers.anyString(), ArgumentMatchers.<String>any());
  }

  @Test
  public void testJobWithoutLogStream() {
    Mockito.doReturn(ImmutableList.of(new JobDetail().withJobId("j1").withStatus("FAILED")
        .withContainer(new ContainerDetail())))
        .when(this.awsBatchSdkClient).describeJobs(Collections.singletonList("j1"));

    Assert.assertEquals(this.retriever.fetchLogsForJob("j1", 3, 0L, TerminationSignal.NEVER),
        "no log stream was available for job: j1\n");
    Mockito.verify(this.awsBatchSdkClient, Mockito.never()).getLogEvents(ArgumentMatchers.anyString(),
        ArgumentMatchers.anyString(), ArgumentMatchers.<String>any());
  }

  @Test
  public void testJobLogStreamIsLookedUp() {
    Mockito.doReturn(ImmutableList.of(new JobDetail().withJobId("j1").withStatus("SUCCEEDED")
        .withContainer(new ContainerDetail().withLogStreamName(LOG_STREAM))))
        .when(this.awsBatchSdkClient).describeJobs(Collections.singletonList("j1"));
    Mockito.doReturn(page("f/1", "out")).when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, null);
    Mockito.doReturn(page("f/1")).when(this.awsBatchSdkClient).getLogEvents(LOG_GROUP, LOG_STREAM, "f/1");

    Assert.assertEquals(this.retriever.fetchLogsForJob("j1", 3, 0L, TerminationSignal.NEVER), "out");
  }

  @Test(expectedExceptions = JobStatusMismatchException.class)
  public void testUnknownJob() {
    Mockito.doReturn(ImmutableList.<JobDetail>of())
        .when(this.awsBatchSdkClient).describeJobs(Collections.singletonList("j1"));
    this.retriever.fetchLogsForJob("j1", 3, 0L, TerminationSignal.NEVER);
  }
}
