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
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.services.batch.model.ContainerOverrides;
import com.amazonaws.services.batch.model.KeyValuePair;
import com.amazonaws.services.batch.model.ResourceRequirement;
import com.amazonaws.services.batch.model.ResourceType;
import com.amazonaws.services.batch.model.SubmitJobRequest;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import org.apache.batchdriver.api.BatchTask;
import org.apache.batchdriver.api.InvalidTaskException;
import org.apache.batchdriver.api.TaskStatus;
import org.apache.batchdriver.api.TerminationSignal;
import org.apache.batchdriver.util.ExecutorsUtils;
import org.apache.batchdriver.util.executors.BoundedTaskExecutor;


/**
 * Submits tasks as AWS Batch jobs.
 *
 * <p>
 *   Each task's command script is staged in S3 and the job runs a fixed bootstrap command that downloads and
 *   executes it, on top of the base job definition registered for the task's image. A batch of tasks is submitted
 *   concurrently; the results are written back to the tasks in input order once every submission has finished.
 * </p>
 */
public class AWSBatchJobSubmitter {
  private static final Logger LOGGER = LoggerFactory.getLogger(AWSBatchJobSubmitter.class);

  static final String BOOTSTRAP_COMMAND =
      "aws s3 cp --quiet %s command_script && chmod +x command_script && ./command_script";
  static final String GPU_DEVICES_ENV = "CUDA_VISIBLE_DEVICES";

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
  private static final Joiner COMMA_JOINER = Joiner.on(',');

  private final AWSBatchSdkClient awsBatchSdkClient;
  private final JobDefinitionRegistry jobDefinitionRegistry;
  private final ScriptStager scriptStager;
  private final JobNames jobNames;
  private final int maxThreads;
  private final String workingDirectory;

  public AWSBatchJobSubmitter(AWSBatchSdkClient awsBatchSdkClient, JobDefinitionRegistry jobDefinitionRegistry,
      ScriptStager scriptStager, JobNames jobNames, int maxThreads) {
    this(awsBatchSdkClient, jobDefinitionRegistry, scriptStager, jobNames, maxThreads,
        System.getProperty("user.dir"));
  }

  @VisibleForTesting
  AWSBatchJobSubmitter(AWSBatchSdkClient awsBatchSdkClient, JobDefinitionRegistry jobDefinitionRegistry,
      ScriptStager scriptStager, JobNames jobNames, int maxThreads, String workingDirectory) {
    this.awsBatchSdkClient = awsBatchSdkClient;
    this.jobDefinitionRegistry = jobDefinitionRegistry;
    this.scriptStager = scriptStager;
    this.jobNames = jobNames;
    this.maxThreads = maxThreads;
    this.workingDirectory = workingDirectory;
  }

  /**
   * Submit {@code tasks}. Tasks skipped because termination was requested are marked {@link TaskStatus#KILLED};
   * submitted tasks get their job id, script URI, job definition ARN and {@link TaskStatus#SUBMITTED}.
   *
   * @throws IOException if a task's local files could not be written, after all results were applied
   * @throws InterruptedException if interrupted while waiting for the submission threads
   */
  public void submit(List<? extends BatchTask> tasks, final TerminationSignal signal)
      throws IOException, InterruptedException {
    if (tasks.isEmpty()) {
      return;
    }

    List<Callable<Submission>> submissions = Lists.newArrayListWithCapacity(tasks.size());
    for (final BatchTask task : tasks) {
      submissions.add(new Callable<Submission>() {
        @Override
        public Submission call() {
          return submitOne(task, signal);
        }
      });
    }
    List<Future<Submission>> results = new BoundedTaskExecutor<>(submissions, this.maxThreads,
        ExecutorsUtils.newDaemonThreadFactory(Optional.of(LOGGER), Optional.of("AWSBatchSubmitter-%d"))).execute();

    int submitted = 0;
    Throwable firstFailure = null;
    for (int i = 0; i < tasks.size(); i++) {
      BatchTask task = tasks.get(i);
      Submission submission;
      try {
        submission = results.get(i).get();
      } catch (ExecutionException ee) {
        LOGGER.error(String.format("Failed to submit task %s", task.getUid()), ee.getCause());
        if (firstFailure == null) {
          firstFailure = ee.getCause() == null ? ee : ee.getCause();
        }
        continue;
      }
      if (submission.isSkipped()) {
        task.setStatus(TaskStatus.KILLED);
        continue;
      }
      task.setJobId(submission.getJobId());
      task.setCommandScriptUri(submission.getCommandScriptUri());
      task.setJobDefinitionArn(submission.getJobDefinitionArn());
      task.setStatus(TaskStatus.SUBMITTED);
      submitted++;
      if (submission.getLocalFailure().isPresent() && firstFailure == null) {
        firstFailure = submission.getLocalFailure().get();
      }
    }
    LOGGER.info(String.format("Submitted %d of %d tasks", submitted, tasks.size()));
    if (firstFailure != null) {
      BoundedTaskExecutor.rethrow(firstFailure, "submit");
    }
  }

  /**
   * Validate and submit one task. Nothing remote is touched for a skipped or invalid task. Once the job is accepted
   * the submission is returned even if the local output files could not be written.
   */
  @VisibleForTesting
  Submission submitOne(BatchTask task, TerminationSignal signal) {
    if (signal.isTerminationRequested()) {
      LOGGER.info(String.format("Termination requested, not submitting task %s", task.getUid()));
      return Submission.SKIPPED;
    }
    if (task.getQueue() == null) {
      throw new InvalidTaskException(task.getUid(), "queue cannot be null");
    }
    if (task.getCpuRequest() == null) {
      throw new InvalidTaskException(task.getUid(), "cpu request cannot be null");
    }
    if (task.getMemoryRequest() == null) {
      throw new InvalidTaskException(task.getUid(), "memory request cannot be null");
    }

    String jobName = this.jobNames.forTask(task);
    String jobDefinitionArn = this.jobDefinitionRegistry.getOrRegister(task.getContainerSpec(), task.getUid());
    S3Location script = this.scriptStager.stage(task.getCommandScriptFile(), task.getCommandScriptPrefix(), jobName);

    SubmitJobRequest request = new SubmitJobRequest()
        .withJobName(jobName)
        .withJobQueue(task.getQueue())
        .withJobDefinition(jobDefinitionArn)
        .withContainerOverrides(buildContainerOverrides(task, script))
        .withPropagateTags(true)
        .withTags(ImmutableMap.of(
            "job_type", this.jobNames.getPrefix(),
            "username", this.jobNames.getUser(),
            "stage_name", JobNames.sanitize(task.getStageName()),
            "cwd", this.workingDirectory));
    String jobId = this.awsBatchSdkClient.submitJob(request);
    LOGGER.info(String.format("Submitted task %s as job %s (%s)", task.getUid(), jobId, jobName));

    try {
      FileUtils.writeStringToFile(task.getStdoutFile(), "", Charsets.UTF_8);
      FileUtils.writeStringToFile(task.getStderrFile(), GSON.toJson(ImmutableMap.of("job_id", jobId)),
          Charsets.UTF_8);
    } catch (IOException ioe) {
      LOGGER.error(String.format("Job %s for task %s was submitted but its output files could not be initialized",
          jobId, task.getUid()), ioe);
      return new Submission(jobId, script.toString(), jobDefinitionArn, Optional.of(ioe));
    }
    return new Submission(jobId, script.toString(), jobDefinitionArn, Optional.<IOException>absent());
  }

  @VisibleForTesting
  static ContainerOverrides buildContainerOverrides(BatchTask task, S3Location script) {
    List<KeyValuePair> environment = Lists.newArrayList();
    for (Map.Entry<String, String> entry : task.getEnvironmentVariables().entrySet()) {
      environment.add(new KeyValuePair().withName(entry.getKey()).withValue(entry.getValue()));
    }
    List<ResourceRequirement> resourceRequirements = Lists.newArrayList();
    Integer gpus = task.getGpuRequest();
    if (gpus != null && gpus > 0) {
      resourceRequirements.add(new ResourceRequirement().withType(ResourceType.GPU).withValue(gpus.toString()));
      List<Integer> devices = Lists.newArrayListWithCapacity(gpus);
      for (int i = 0; i < gpus; i++) {
        devices.add(i);
      }
      environment.add(new KeyValuePair().withName(GPU_DEVICES_ENV).withValue(COMMA_JOINER.join(devices)));
    }

    ContainerOverrides overrides = new ContainerOverrides()
        .withMemory(task.getMemoryRequest())
        .withVcpus(task.getCpuRequest())
        .withEnvironment(environment)
        .withResourceRequirements(resourceRequirements)
        .withCommand("bash", "-c", String.format(BOOTSTRAP_COMMAND, script));
    if (task.getInstanceType().isPresent()) {
      overrides.withInstanceType(task.getInstanceType().get());
    }
    return overrides;
  }

  /**
   * What one task's submission produced. A skipped submission has no job id.
   */
  static class Submission {
    static final Submission SKIPPED = new Submission(null, null, null, Optional.<IOException>absent());

    private final String jobId;
    private final String commandScriptUri;
    private final String jobDefinitionArn;
    private final Optional<IOException> localFailure;

    Submission(String jobId, String commandScriptUri, String jobDefinitionArn, Optional<IOException> localFailure) {
      this.jobId = jobId;
      this.commandScriptUri = commandScriptUri;
      this.jobDefinitionArn = jobDefinitionArn;
      this.localFailure = localFailure;
    }

    boolean isSkipped() {
      return this.jobId == null;
    }

    String getJobId() {
      return this.jobId;
    }

    String getCommandScriptUri() {
      return this.commandScriptUri;
    }

    String getJobDefinitionArn() {
      return this.jobDefinitionArn;
    }

    /**
     * @return the failure to initialize the task's output files after the job was accepted, if any
     */
    Optional<IOException> getLocalFailure() {
      return this.localFailure;
    }
  }
}
