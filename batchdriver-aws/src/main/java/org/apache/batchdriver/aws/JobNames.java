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

import java.util.regex.Pattern;

import com.google.common.base.Preconditions;

import org.apache.batchdriver.api.BatchTask;


/**
 * Derives AWS Batch job names from tasks.
 */
public class JobNames {

  public static final int MAX_LENGTH = 128;
  public static final Pattern VALID_JOB_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9-_]*$");

  private static final String SEPARATOR = "__";

  private final String prefix;
  private final String user;

  public JobNames(String prefix, String user) {
    this.prefix = prefix;
    this.user = user;
  }

  public String getPrefix() {
    return this.prefix;
  }

  public String getUser() {
    return this.user;
  }

  /**
   * Build {@code <prefix>__<user>__<stage>__<uid>} for {@code task}, truncated to {@link #MAX_LENGTH}.
   *
   * @throws IllegalArgumentException if the result is not a legal job name
   */
  public String forTask(BatchTask task) {
    String name = this.prefix + SEPARATOR + this.user + SEPARATOR + sanitize(task.getStageName()) + SEPARATOR
        + sanitize(task.getUid());
    if (name.length() > MAX_LENGTH) {
      name = name.substring(0, MAX_LENGTH);
    }
    validate(name);
    return name;
  }

  /**
   * Replace {@code /} with {@code __} and drop {@code :}.
   */
  public static String sanitize(String component) {
    return component.replace("/", SEPARATOR).replace(":", "");
  }

  public static void validate(String jobName) {
    Preconditions.checkArgument(jobName.length() <= MAX_LENGTH && VALID_JOB_NAME.matcher(jobName).matches(),
        "%s is not a valid job name. The first character must be alphanumeric, and up to %s letters "
            + "(uppercase and lowercase), numbers, hyphens, and underscores are allowed.", jobName, MAX_LENGTH);
  }
}
