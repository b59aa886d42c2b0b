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

import org.apache.commons.lang.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;


/**
 * Uploads command scripts to S3 so that a job can download and run them.
 *
 * <p>
 *   Every call writes a new object named {@code <prefix key>/<32 random alphanumerics>.<job name>.script}, so a
 *   retried submission never overwrites the script of an earlier attempt.
 * </p>
 */
public class ScriptStager {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScriptStager.class);

  static final int RANDOM_NAME_LENGTH = 32;
  static final String SCRIPT_SUFFIX = ".script";

  private final AWSBatchSdkClient awsBatchSdkClient;

  public ScriptStager(AWSBatchSdkClient awsBatchSdkClient) {
    this.awsBatchSdkClient = awsBatchSdkClient;
  }

  /**
   * Upload {@code script} under {@code prefix}.
   *
   * @param script local command script
   * @param prefix {@code s3://bucket/key} prefix, without a trailing slash
   * @param jobName name of the job the script belongs to
   * @return where the script was uploaded
   */
  public S3Location stage(File script, String prefix, String jobName) {
    S3Location prefixLocation = parsePrefix(prefix);
    S3Location scriptLocation =
        prefixLocation.resolve(RandomStringUtils.randomAlphanumeric(RANDOM_NAME_LENGTH) + "." + jobName + SCRIPT_SUFFIX);
    this.awsBatchSdkClient.uploadFile(script, scriptLocation);
    LOGGER.debug(String.format("Staged command script %s at %s", script, scriptLocation));
    return scriptLocation;
  }

  static S3Location parsePrefix(String prefix) {
    Preconditions.checkArgument(prefix != null && prefix.startsWith(S3Location.S3_SCHEME),
        "Command script prefix must start with %s: %s", S3Location.S3_SCHEME, prefix);
    Preconditions.checkArgument(!prefix.endsWith("/"),
        "Command script prefix must not have a trailing slash: %s", prefix);
    return S3Location.parse(prefix);
  }
}
