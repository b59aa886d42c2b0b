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
 * A named host volume made available to the job container.
 */
@Getter
@EqualsAndHashCode
@ToString
public class VolumeSpec {

  private final String name;
  private final String hostSourcePath;

  public VolumeSpec(String name, String hostSourcePath) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "volume name must not be empty");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(hostSourcePath) && hostSourcePath.startsWith("/"),
        "hostSourcePath must be an absolute path, got: %s", hostSourcePath);
    this.name = name;
    this.hostSourcePath = hostSourcePath;
  }
}
