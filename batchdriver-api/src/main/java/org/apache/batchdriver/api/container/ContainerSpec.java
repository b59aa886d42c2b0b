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
package org.apache.batchdriver.api.container;

import java.util.List;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Describes the container a task runs in: the image plus the extra mount points and volumes it needs on top
 * of the defaults every job definition carries, and an optional shared memory size.
 *
 * <p>
 *   Two tasks with equal {@link ContainerSpec}s can share a job definition.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class ContainerSpec {

  private final String image;
  private final List<MountPointSpec> mountPoints;
  private final List<VolumeSpec> volumes;
  private final Optional<Integer> sharedMemorySize;

  public ContainerSpec(String image) {
    this(image, ImmutableList.<MountPointSpec>of(), ImmutableList.<VolumeSpec>of(), Optional.<Integer>absent());
  }

  /**
   * @param image the container image, e.g. {@code ubuntu:20.04}
   * @param mountPoints mount points added to the default scratch mount point
   * @param volumes volumes added to the default scratch volume
   * @param sharedMemorySize size of {@code /dev/shm} in MiB, if it should be overridden
   */
  public ContainerSpec(String image, List<MountPointSpec> mountPoints, List<VolumeSpec> volumes,
      Optional<Integer> sharedMemorySize) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(image), "container image must not be empty");
    Preconditions.checkNotNull(mountPoints);
    Preconditions.checkNotNull(volumes);
    Preconditions.checkNotNull(sharedMemorySize);
    if (sharedMemorySize.isPresent()) {
      Preconditions.checkArgument(sharedMemorySize.get() > 0, "sharedMemorySize must be positive, got: %s",
          sharedMemorySize.get());
    }

    Set<String> volumeNames = Sets.newHashSet();
    for (VolumeSpec volume : volumes) {
      Preconditions.checkArgument(volumeNames.add(volume.getName()), "duplicate volume name: %s", volume.getName());
    }

    this.image = image;
    this.mountPoints = ImmutableList.copyOf(mountPoints);
    this.volumes = ImmutableList.copyOf(volumes);
    this.sharedMemorySize = sharedMemorySize;
  }
}
