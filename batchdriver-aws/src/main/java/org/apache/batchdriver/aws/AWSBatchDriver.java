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
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.typesafe.config.Config;

import org.apache.batchdriver.api.BatchTask;
import org.apache.batchdriver.api.TerminationSignal;
import org.apache.batchdriver.api.container.MountPointSpec;
import org.apache.batchdriver.api.container.VolumeSpec;
import org.apache.batchdriver.util.ConfigUtils;


/**
 * Runs workflow tasks as AWS Batch jobs.
 *
 * <p>
 *   This is the entry point a workflow engine talks to. It submits tasks, reports the ones that finished, kills
 *   tasks on request and deregisters the job definitions it registered when shut down. Every long operation
 *   watches the {@link TerminationSignal} given at construction.
 * </p>
 *
 * <p>
 *   All settings are read from a {@link Config} using the keys in {@link AWSBatchConfigurationKeys}.
 * </p>
 */
public class AWSBatchDriver {
  private static final Logger LOGGER = LoggerFactory.getLogger(AWSBatchDriver.class);

  private final TerminationSignal terminationSignal;
  private final JobDefinitionRegistry jobDefinitionRegistry;
  private final AWSBatchJobSubmitter jobSubmitter;
  private final AWSBatchJobStatusPoller statusPoller;
  private final AWSBatchJobTerminator jobTerminator;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  public AWSBatchDriver(Config config, TerminationSignal terminationSignal) {
    this(config, terminationSignal, new AWSBatchSdkClient(new AWSBatchSecurityManager(config), config));
  }

  @VisibleForTesting
  AWSBatchDriver(Config config, TerminationSignal terminationSignal, AWSBatchSdkClient awsBatchSdkClient) {
    this.terminationSignal = terminationSignal;

    String jobNamePrefix = ConfigUtils.getString(config, AWSBatchConfigurationKeys.JOB_NAME_PREFIX_KEY,
        AWSBatchConfigurationKeys.DEFAULT_JOB_NAME_PREFIX);
    String jobUser = ConfigUtils.getString(config, AWSBatchConfigurationKeys.JOB_USER_KEY,
        System.getProperty("user.name"));
    int maxThreads = ConfigUtils.getInt(config, AWSBatchConfigurationKeys.MAX_THREADS_KEY,
        AWSBatchConfigurationKeys.DEFAULT_MAX_THREADS);

    String scratchVolumeName = ConfigUtils.getString(config, AWSBatchConfigurationKeys.SCRATCH_VOLUME_NAME_KEY,
        AWSBatchConfigurationKeys.DEFAULT_SCRATCH_VOLUME_NAME);
    this.jobDefinitionRegistry = new JobDefinitionRegistry(awsBatchSdkClient, jobNamePrefix,
        ConfigUtils.hasNonEmptyPath(config, AWSBatchConfigurationKeys.JOB_ROLE_ARN_KEY)
            ? Optional.of(config.getString(AWSBatchConfigurationKeys.JOB_ROLE_ARN_KEY)) : Optional.<String>absent(),
        new MountPointSpec(ConfigUtils.getString(config, AWSBatchConfigurationKeys.SCRATCH_CONTAINER_PATH_KEY,
            AWSBatchConfigurationKeys.DEFAULT_SCRATCH_CONTAINER_PATH), false, scratchVolumeName),
        new VolumeSpec(scratchVolumeName, ConfigUtils.getString(config,
            AWSBatchConfigurationKeys.SCRATCH_HOST_PATH_KEY, AWSBatchConfigurationKeys.DEFAULT_SCRATCH_HOST_PATH)));

    this.jobSubmitter = new AWSBatchJobSubmitter(awsBatchSdkClient, this.jobDefinitionRegistry,
        new ScriptStager(awsBatchSdkClient), new JobNames(jobNamePrefix, jobUser), maxThreads);

    CloudWatchLogRetriever logRetriever = new CloudWatchLogRetriever(awsBatchSdkClient,
        ConfigUtils.getString(config, AWSBatchConfigurationKeys.LOG_GROUP_NAME_KEY,
            AWSBatchConfigurationKeys.DEFAULT_LOG_GROUP_NAME));
    TaskCleaner taskCleaner = new TaskCleaner(awsBatchSdkClient, logRetriever);

    this.statusPoller = new AWSBatchJobStatusPoller(awsBatchSdkClient, taskCleaner,
        ConfigUtils.getInt(config, AWSBatchConfigurationKeys.DESCRIBE_BATCH_SIZE_KEY,
            AWSBatchConfigurationKeys.DEFAULT_DESCRIBE_BATCH_SIZE),
        ConfigUtils.getInt(config, AWSBatchConfigurationKeys.CLEANUP_LOG_ATTEMPTS_KEY,
            AWSBatchConfigurationKeys.DEFAULT_CLEANUP_LOG_ATTEMPTS),
        ConfigUtils.getLong(config, AWSBatchConfigurationKeys.CLEANUP_LOG_SLEEP_MILLIS_KEY,
            AWSBatchConfigurationKeys.DEFAULT_CLEANUP_LOG_SLEEP_MILLIS));

    this.jobTerminator = new AWSBatchJobTerminator(awsBatchSdkClient, taskCleaner,
        ConfigUtils.getString(config, AWSBatchConfigurationKeys.TERMINATION_REASON_KEY,
            AWSBatchConfigurationKeys.DEFAULT_TERMINATION_REASON), maxThreads);
  }

  public void submitJobs(List<? extends BatchTask> tasks) throws IOException, InterruptedException {
    this.jobSubmitter.submit(tasks, this.terminationSignal);
  }

  public Iterator<CompletedJob> filterCompleted(List<? extends BatchTask> tasks) {
    return this.statusPoller.filterCompleted(tasks, this.terminationSignal);
  }

  /**
   * @return job id to coarse remote status; tasks without a job id and jobs unknown to AWS Batch are left out
   */
  public Map<String, RemoteJobStatus> remoteStatuses(List<? extends BatchTask> tasks) {
    return this.statusPoller.remoteStatuses(tasks);
  }

  public void kill(BatchTask task) throws IOException {
    this.jobTerminator.kill(task, this.terminationSignal);
  }

  public void killAll(List<? extends BatchTask> tasks) throws IOException, InterruptedException {
    this.jobTerminator.killAll(tasks, this.terminationSignal);
  }

  /**
   * Deregister the job definitions registered by this driver. Only the first call has an effect.
   */
  public void shutdown() {
    if (!this.shutdown.compareAndSet(false, true)) {
      return;
    }
    LOGGER.info("Shutting down " + AWSBatchDriver.class.getSimpleName());
    this.jobDefinitionRegistry.deregisterAll();
  }

  @VisibleForTesting
  JobDefinitionRegistry getJobDefinitionRegistry() {
    return this.jobDefinitionRegistry;
  }
}
