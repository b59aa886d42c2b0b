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
 * Thrown when the shared fallback job definition name cannot be registered. This is a configuration error: the
 * driver cannot submit anything for the image until it is resolved.
 */
public class JobDefinitionConflictException extends RuntimeException {
  private static final long serialVersionUID = 8817205516419054123L;

  private final String jobDefinitionName;

  public JobDefinitionConflictException(String jobDefinitionName, Throwable cause) {
    super(String.format("Could not register job definition %s", jobDefinitionName), cause);
    this.jobDefinitionName = jobDefinitionName;
  }

  public String getJobDefinitionName() {
    return this.jobDefinitionName;
  }
}
