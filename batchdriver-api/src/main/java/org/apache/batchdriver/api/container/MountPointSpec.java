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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * A volume mounted into the job container.
 */
@Getter
@EqualsAndHashCode
@ToString
public class MountPointSpec {

  private final String containerPath;
  private final boolean readOnly;
  private final String sourceVolume;

  /**
   * @param containerPath absolute path inside the container
   * @param readOnly whether the container may only read the mounted volume
   * @param sourceVolume name of a {@link VolumeSpec} declared on the same container
   */
  public MountPointSpec(String containerPath, boolean readOnly, String sourceVolume) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(containerPath) && containerPath.startsWith("/"),
        "containerPath must be an absolute path, got: %s", containerPath);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(sourceVolume), "sourceVolume must not be empty");
    this.containerPath = containerPath;
    this.readOnly = readOnly;
    this.sourceVolume = sourceVolume;
  }
}
