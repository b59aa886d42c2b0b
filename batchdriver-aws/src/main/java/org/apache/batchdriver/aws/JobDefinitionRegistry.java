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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.batch.model.ContainerProperties;
import com.amazonaws.services.batch.model.Host;
import com.amazonaws.services.batch.model.JobDefinitionType;
import com.amazonaws.services.batch.model.LinuxParameters;
import com.amazonaws.services.batch.model.MountPoint;
import com.amazonaws.services.batch.model.RegisterJobDefinitionRequest;
import com.amazonaws.services.batch.model.Volume;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.Striped;

import org.apache.batchdriver.api.container.ContainerSpec;
import org.apache.batchdriver.api.container.MountPointSpec;
import org.apache.batchdriver.api.container.VolumeSpec;


/**
 * Registers one base job definition per container image and remembers its ARN for the lifetime of the driver.
 *
 * <p>
 *   The base definition carries the image, a scratch volume, the spec's mounts and volumes, a placeholder command
 *   and minimal resources; every submission overrides the command and resources. Registration for a given image
 *   happens at most once even when several submission threads ask for it concurrently. Callers for different
 *   images do not block each other.
 * </p>
 */
public class JobDefinitionRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(JobDefinitionRegistry.class);

  static final String PLACEHOLDER_COMMAND = "user-should-override-this";
  static final int BASE_MEMORY_MIB = 100;
  static final int BASE_VCPUS = 1;
  static final int MAX_NAME_LENGTH = 128;
  private static final int LOCK_STRIPES = 64;

  private final AWSBatchSdkClient awsBatchSdkClient;
  private final String namePrefix;
  private final Optional<String> jobRoleArn;
  private final MountPointSpec scratchMountPoint;
  private final VolumeSpec scratchVolume;

  private final ConcurrentMap<String, String> imageToJobDefinitionArn = Maps.newConcurrentMap();
  private final Striped<Lock> registrationLocks = Striped.lock(LOCK_STRIPES);

  public JobDefinitionRegistry(AWSBatchSdkClient awsBatchSdkClient, String namePrefix, Optional<String> jobRoleArn,
      MountPointSpec scratchMountPoint, VolumeSpec scratchVolume) {
    this.awsBatchSdkClient = awsBatchSdkClient;
    this.namePrefix = namePrefix;
    this.jobRoleArn = jobRoleArn;
    this.scratchMountPoint = scratchMountPoint;
    this.scratchVolume = scratchVolume;
  }

  /**
   * Get the ARN of the job definition for {@code spec}'s image, registering it first if needed.
   *
   * @param spec container the job definition is built from
   * @param templateNameHint used in the job definition name, typically the uid of a task using the image
   * @throws JobDefinitionConflictException if the name is too long and the shared fallback name cannot be registered
   */
  public String getOrRegister(ContainerSpec spec, String templateNameHint) {
    String arn = this.imageToJobDefinitionArn.get(spec.getImage());
    if (arn != null) {
      return arn;
    }

    Lock lock = this.registrationLocks.get(spec.getImage());
    lock.lock();
    try {
      arn = this.imageToJobDefinitionArn.get(spec.getImage());
      if (arn == null) {
        arn = register(spec, templateNameHint);
        this.imageToJobDefinitionArn.put(spec.getImage(), arn);
      }
      return arn;
    } finally {
      lock.unlock();
    }
  }

  private String register(ContainerSpec spec, String templateNameHint) {
    String name = jobDefinitionName(templateNameHint);
    boolean sharedName = !name.startsWith(uniqueNamePrefix());
    LOGGER.info(String.format("Registering base job definition %s for image %s", name, spec.getImage()));

    RegisterJobDefinitionRequest request = new RegisterJobDefinitionRequest()
        .withJobDefinitionName(name)
        .withType(JobDefinitionType.Container)
        .withContainerProperties(buildContainerProperties(spec));
    try {
      String arn = this.awsBatchSdkClient.registerJobDefinition(request);
      LOGGER.info(String.format("Registered job definition %s for image %s", arn, spec.getImage()));
      return arn;
    } catch (AmazonServiceException ase) {
      if (sharedName) {
        throw new JobDefinitionConflictException(name, ase);
      }
      throw ase;
    }
  }

  String jobDefinitionName(String templateNameHint) {
    String name = uniqueNamePrefix() + templateNameHint.replaceAll("[^A-Za-z0-9_-]", "_");
    if (name.length() > MAX_NAME_LENGTH) {
      return this.namePrefix + "_base_job_definition";
    }
    return name;
  }

  private String uniqueNamePrefix() {
    return this.namePrefix + "_base_jobdef_";
  }

  ContainerProperties buildContainerProperties(ContainerSpec spec) {
    List<MountPoint> mountPoints = Lists.newArrayList(toMountPoint(this.scratchMountPoint));
    for (MountPointSpec mountPointSpec : spec.getMountPoints()) {
      mountPoints.add(toMountPoint(mountPointSpec));
    }
    List<Volume> volumes = Lists.newArrayList(toVolume(this.scratchVolume));
    for (VolumeSpec volumeSpec : spec.getVolumes()) {
      volumes.add(toVolume(volumeSpec));
    }

    ContainerProperties containerProperties = new ContainerProperties()
        .withImage(spec.getImage())
        .withMountPoints(mountPoints)
        .withVolumes(volumes)
        .withCommand("bash", "-c", PLACEHOLDER_COMMAND)
        .withMemory(BASE_MEMORY_MIB)
        .withVcpus(BASE_VCPUS)
        .withPrivileged(true);
    if (this.jobRoleArn.isPresent()) {
      containerProperties.withJobRoleArn(this.jobRoleArn.get());
    }
    if (spec.getSharedMemorySize().isPresent()) {
      containerProperties.withLinuxParameters(
          new LinuxParameters().withSharedMemorySize(spec.getSharedMemorySize().get()));
    }
    return containerProperties;
  }

  private static MountPoint toMountPoint(MountPointSpec spec) {
    return new MountPoint()
        .withContainerPath(spec.getContainerPath())
        .withReadOnly(spec.isReadOnly())
        .withSourceVolume(spec.getSourceVolume());
  }

  private static Volume toVolume(VolumeSpec spec) {
    return new Volume().withName(spec.getName()).withHost(new Host().withSourcePath(spec.getHostSourcePath()));
  }

  /**
   * @return a snapshot of image to job definition ARN
   */
  public Map<String, String> getRegisteredDefinitions() {
    return ImmutableMap.copyOf(this.imageToJobDefinitionArn);
  }

  /**
   * Deregister every job definition this registry registered. Every definition is attempted; the first failure is
   * rethrown afterwards and the failed definitions stay cached.
   */
  public void deregisterAll() {
    RuntimeException firstFailure = null;
    for (Map.Entry<String, String> entry : this.imageToJobDefinitionArn.entrySet()) {
      try {
        LOGGER.info(String.format("Deregistering job definition %s for image %s", entry.getValue(), entry.getKey()));
        this.awsBatchSdkClient.deregisterJobDefinition(entry.getValue());
        this.imageToJobDefinitionArn.remove(entry.getKey(), entry.getValue());
      } catch (RuntimeException re) {
        LOGGER.error("Failed to deregister job definition " + entry.getValue(), re);
        if (firstFailure == null) {
          firstFailure = re;
        }
      }
    }
    if (firstFailure != null) {
      throw firstFailure;
    }
  }
}
