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
package org.apache.batchdriver.api;

import java.io.File;
import java.util.Map;

import com.google.common.base.Optional;

import org.apache.batchdriver.api.container.ContainerSpec;


/**
 * A unit of work owned by the workflow engine that a driver submits and tracks.
 *
 * <p>
 *   The driver only reads the request side of a task (queue, resources, container, paths) and writes back the
 *   lifecycle metadata: remote job id, staged command script URI, job definition ARN and {@link TaskStatus}.
 *   Implementations must tolerate those setters being called from a driver worker thread; a driver never
 *   touches the same task from two threads at once.
 * </p>
 */
public interface BatchTask {

  /**
   * @return an identifier unique within the workflow
   */
  String getUid();

  /**
   * @return the logical stage this task belongs to
   */
  String getStageName();

  /**
   * @return the name of the remote job queue, or {@code null} if unset
   */
  String getQueue();

  /**
   * @return the number of vCPUs requested, or {@code null} if unset
   */
  Integer getCpuRequest();

  /**
   * @return the memory requested in MiB, or {@code null} if unset
   */
  Integer getMemoryRequest();

  /**
   * @return the number of GPUs requested, or {@code null} if none
   */
  Integer getGpuRequest();

  Map<String, String> getEnvironmentVariables();

  ContainerSpec getContainerSpec();

  /**
   * @return where command scripts are staged, an {@code s3://bucket/prefix} URI without a trailing slash
   */
  String getCommandScriptPrefix();

  /**
   * @return an instance type hint for the remote scheduler
   */
  Optional<String> getInstanceType();

  /**
   * @return {@code true} if the staged command script must survive cleanup
   */
  boolean isKeepCommandScript();

  File getCommandScriptFile();

  File getStdoutFile();

  File getStderrFile();

  String getJobId();

  void setJobId(String jobId);

  String getCommandScriptUri();

  void setCommandScriptUri(String commandScriptUri);

  String getJobDefinitionArn();

  void setJobDefinitionArn(String jobDefinitionArn);

  TaskStatus getStatus();

  void setStatus(TaskStatus status);
}
