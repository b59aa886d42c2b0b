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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonWebServiceResult;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.http.SdkHttpMetadata;
import com.amazonaws.retry.PredefinedRetryPolicies;
import com.amazonaws.services.batch.AWSBatch;
import com.amazonaws.services.batch.AWSBatchClientBuilder;
import com.amazonaws.services.batch.model.DeregisterJobDefinitionRequest;
import com.amazonaws.services.batch.model.DeregisterJobDefinitionResult;
import com.amazonaws.services.batch.model.DescribeJobsRequest;
import com.amazonaws.services.batch.model.DescribeJobsResult;
import com.amazonaws.services.batch.model.JobDetail;
import com.amazonaws.services.batch.model.RegisterJobDefinitionRequest;
import com.amazonaws.services.batch.model.RegisterJobDefinitionResult;
import com.amazonaws.services.batch.model.SubmitJobRequest;
import com.amazonaws.services.batch.model.SubmitJobResult;
import com.amazonaws.services.batch.model.TerminateJobRequest;
import com.amazonaws.services.batch.model.TerminateJobResult;
import com.amazonaws.services.logs.AWSLogs;
import com.amazonaws.services.logs.AWSLogsClientBuilder;
import com.amazonaws.services.logs.model.GetLogEventsRequest;
import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.typesafe.config.Config;

import org.apache.batchdriver.util.ConfigUtils;


/**
 * Class responsible for all AWS API calls made by the driver.
 *
 * <p>
 *   This class lazily creates the AWS Batch, S3 and CloudWatch Logs clients, shares them between driver threads
 *   and checks the HTTP status of every Batch and CloudWatch Logs response. The clients retry throttled and
 *   transient failures themselves, with the SDK's default backoff and a configurable number of retries.
 * </p>
 */
public class AWSBatchSdkClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(AWSBatchSdkClient.class);

  private static final int HTTP_OK = 200;

  private final Supplier<AWSBatch> awsBatchSupplier;
  private final Supplier<AmazonS3> amazonS3Supplier;
  private final Supplier<AWSLogs> awsLogsSupplier;

  /***
   * Initialize the AWS SDK Client
   *
   * @param securityManager The {@link AWSBatchSecurityManager} to fetch AWS credentials
   * @param config driver configuration holding the region and client settings
   */
  public AWSBatchSdkClient(final AWSBatchSecurityManager securityManager, Config config) {
    final String region = ConfigUtils.getString(config, AWSBatchConfigurationKeys.AWS_REGION_KEY,
        AWSBatchConfigurationKeys.DEFAULT_AWS_REGION);
    final ClientConfiguration clientConfiguration = buildClientConfiguration(config);

    this.awsBatchSupplier = Suppliers.memoize(new Supplier<AWSBatch>() {
      @Override
      public AWSBatch get() {
        return AWSBatchClientBuilder.standard()
            .withCredentials(securityManager.getCredentialsProvider())
            .withClientConfiguration(clientConfiguration)
            .withRegion(region)
            .build();
      }
    });
    this.amazonS3Supplier = Suppliers.memoize(new Supplier<AmazonS3>() {
      @Override
      public AmazonS3 get() {
        return AmazonS3ClientBuilder.standard()
            .withCredentials(securityManager.getCredentialsProvider())
            .withClientConfiguration(clientConfiguration)
            .withRegion(region)
            .build();
      }
    });
    this.awsLogsSupplier = Suppliers.memoize(new Supplier<AWSLogs>() {
      @Override
      public AWSLogs get() {
        return AWSLogsClientBuilder.standard()
            .withCredentials(securityManager.getCredentialsProvider())
            .withClientConfiguration(clientConfiguration)
            .withRegion(region)
            .build();
      }
    });
  }

  @VisibleForTesting
  static ClientConfiguration buildClientConfiguration(Config config) {
    int maxRetries = ConfigUtils.getInt(config, AWSBatchConfigurationKeys.CLIENT_MAX_RETRIES_KEY,
        AWSBatchConfigurationKeys.DEFAULT_CLIENT_MAX_RETRIES);
    int maxConnections = ConfigUtils.getInt(config, AWSBatchConfigurationKeys.CLIENT_MAX_CONNECTIONS_KEY,
        AWSBatchConfigurationKeys.DEFAULT_CLIENT_MAX_CONNECTIONS);
    return new ClientConfiguration()
        .withRetryPolicy(PredefinedRetryPolicies.getDefaultRetryPolicyWithCustomMaxRetries(maxRetries))
        .withMaxErrorRetry(maxRetries)
        .withMaxConnections(maxConnections)
        .withThrottledRetries(true);
  }

  /***
   * Upload a local file to S3
   *
   * @param file Local file to upload
   * @param location Destination bucket and key
   */
  public void uploadFile(File file, S3Location location) {
    LOGGER.debug(String.format("Uploading %s to %s", file, location));
    getS3Client().putObject(location.getBucket(), location.getKey(), file);
  }

  public void deleteObject(S3Location location) {
    LOGGER.debug("Deleting " + location);
    getS3Client().deleteObject(location.getBucket(), location.getKey());
  }

  /***
   * Register a job definition
   *
   * @param request Fully populated registration request
   * @return ARN of the registered job definition revision
   */
  public String registerJobDefinition(RegisterJobDefinitionRequest request) {
    RegisterJobDefinitionResult result = getBatchClient().registerJobDefinition(request);
    checkResponse(result, "RegisterJobDefinition " + request.getJobDefinitionName());
    return result.getJobDefinitionArn();
  }

  public void deregisterJobDefinition(String jobDefinitionArn) {
    DeregisterJobDefinitionResult result = getBatchClient()
        .deregisterJobDefinition(new DeregisterJobDefinitionRequest().withJobDefinition(jobDefinitionArn));
    checkResponse(result, "DeregisterJobDefinition " + jobDefinitionArn);
  }

  /***
   * Submit a job
   *
   * @param request Fully populated submission request
   * @return Id of the submitted job
   */
  public String submitJob(SubmitJobRequest request) {
    SubmitJobResult result = getBatchClient().submitJob(request);
    checkResponse(result, "SubmitJob " + request.getJobName());
    return result.getJobId();
  }

  /***
   * Describe jobs. AWS Batch accepts at most 100 ids per call, callers chunk larger lists.
   *
   * @param jobIds Ids of the jobs to describe
   * @return Job details in the order the service returned them, possibly missing unknown ids
   */
  public List<JobDetail> describeJobs(List<String> jobIds) {
    DescribeJobsResult result = getBatchClient().describeJobs(new DescribeJobsRequest().withJobs(jobIds));
    checkResponse(result, "DescribeJobs");
    return result.getJobs();
  }

  public void terminateJob(String jobId, String reason) {
    TerminateJobResult result = getBatchClient()
        .terminateJob(new TerminateJobRequest().withJobId(jobId).withReason(reason));
    checkResponse(result, "TerminateJob " + jobId);
  }

  /***
   * Fetch one page of a log stream, reading forward from the head of the stream
   *
   * @param logGroupName Log group holding the stream
   * @param logStreamName Log stream to read
   * @param nextToken Forward token returned by the previous page, or null for the first page
   */
  public GetLogEventsResult getLogEvents(String logGroupName, String logStreamName, String nextToken) {
    GetLogEventsRequest request = new GetLogEventsRequest()
        .withLogGroupName(logGroupName)
        .withLogStreamName(logStreamName)
        .withStartFromHead(true);
    if (nextToken != null) {
      request.withNextToken(nextToken);
    }
    GetLogEventsResult result = getLogsClient().getLogEvents(request);
    checkResponse(result, "GetLogEvents " + logStreamName);
    return result;
  }

  private static void checkResponse(AmazonWebServiceResult<?> result, String operation) {
    SdkHttpMetadata metadata = result.getSdkHttpMetadata();
    if (metadata == null) {
      return;
    }
    checkHttpStatus(metadata.getHttpStatusCode(), operation);
  }

  @VisibleForTesting
  static void checkHttpStatus(int statusCode, String operation) {
    if (statusCode != HTTP_OK) {
      throw new AWSBatchApiException(String.format("%s received status code %d", operation, statusCode));
    }
  }

  public AWSBatch getBatchClient() {
    return this.awsBatchSupplier.get();
  }

  public AmazonS3 getS3Client() {
    return this.amazonS3Supplier.get();
  }

  public AWSLogs getLogsClient() {
    return this.awsLogsSupplier.get();
  }
}
