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
 * Configuration property keys used by the AWS Batch driver, with their defaults.
 */
public class AWSBatchConfigurationKeys {

  public static final String BATCHDRIVER_AWS_PREFIX = "batchdriver.aws.";

  // AWS client configuration properties.
  public static final String AWS_REGION_KEY = BATCHDRIVER_AWS_PREFIX + "region";
  public static final String DEFAULT_AWS_REGION = "us-east-1";
  public static final String CLIENT_MAX_RETRIES_KEY = BATCHDRIVER_AWS_PREFIX + "client.max.retries";
  public static final int DEFAULT_CLIENT_MAX_RETRIES = 50;
  public static final String CLIENT_MAX_CONNECTIONS_KEY = BATCHDRIVER_AWS_PREFIX + "client.max.connections";
  public static final int DEFAULT_CLIENT_MAX_CONNECTIONS = 25;

  // Submission and kill configuration properties.
  public static final String MAX_THREADS_KEY = BATCHDRIVER_AWS_PREFIX + "max.threads";
  public static final int DEFAULT_MAX_THREADS = 50;
  public static final String JOB_NAME_PREFIX_KEY = BATCHDRIVER_AWS_PREFIX + "job.name.prefix";
  public static final String DEFAULT_JOB_NAME_PREFIX = "batchdriver";
  public static final String JOB_USER_KEY = BATCHDRIVER_AWS_PREFIX + "job.user";
  public static final String TERMINATION_REASON_KEY = BATCHDRIVER_AWS_PREFIX + "termination.reason";
  public static final String DEFAULT_TERMINATION_REASON = "terminated by batchdriver";

  // Job definition configuration properties.
  public static final String JOB_ROLE_ARN_KEY = BATCHDRIVER_AWS_PREFIX + "job.role.arn";
  public static final String SCRATCH_VOLUME_NAME_KEY = BATCHDRIVER_AWS_PREFIX + "scratch.volume.name";
  public static final String DEFAULT_SCRATCH_VOLUME_NAME = "scratch";
  public static final String SCRATCH_CONTAINER_PATH_KEY = BATCHDRIVER_AWS_PREFIX + "scratch.container.path";
  public static final String DEFAULT_SCRATCH_CONTAINER_PATH = "/scratch";
  public static final String SCRATCH_HOST_PATH_KEY = BATCHDRIVER_AWS_PREFIX + "scratch.host.path";
  public static final String DEFAULT_SCRATCH_HOST_PATH = "/scratch";

  // Status polling and log retrieval configuration properties.
  public static final String DESCRIBE_BATCH_SIZE_KEY = BATCHDRIVER_AWS_PREFIX + "describe.batch.size";
  public static final int DEFAULT_DESCRIBE_BATCH_SIZE = 50;
  public static final String LOG_GROUP_NAME_KEY = BATCHDRIVER_AWS_PREFIX + "log.group.name";
  public static final String DEFAULT_LOG_GROUP_NAME = "/aws/batch/job";
  public static final String CLEANUP_LOG_ATTEMPTS_KEY = BATCHDRIVER_AWS_PREFIX + "cleanup.log.attempts";
  public static final int DEFAULT_CLEANUP_LOG_ATTEMPTS = 3;
  public static final String CLEANUP_LOG_SLEEP_MILLIS_KEY = BATCHDRIVER_AWS_PREFIX + "cleanup.log.sleep.millis";
  public static final long DEFAULT_CLEANUP_LOG_SLEEP_MILLIS = 0L;

  // Security related configuration properties.
  public static final String SERVICE_ACCESS_KEY = BATCHDRIVER_AWS_PREFIX + "service.access";
  public static final String SERVICE_SECRET_KEY = BATCHDRIVER_AWS_PREFIX + "service.secret";
  public static final String CLIENT_ASSUME_ROLE_KEY = BATCHDRIVER_AWS_PREFIX + "client.assume.role";
  public static final String CLIENT_ROLE_ARN_KEY = BATCHDRIVER_AWS_PREFIX + "client.role.arn";
  public static final String CLIENT_EXTERNAL_ID_KEY = BATCHDRIVER_AWS_PREFIX + "client.external.id";
  public static final String CLIENT_SESSION_ID_KEY = BATCHDRIVER_AWS_PREFIX + "client.session.id";
  public static final String DEFAULT_CLIENT_SESSION_ID = "batchdriver";

  private AWSBatchConfigurationKeys() {
  }
}
