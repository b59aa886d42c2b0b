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

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;


/**
 * Result of a finished job as reported to the workflow engine.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class JobOutcome {

  public static final int NO_ATTEMPT_EXIT_STATUS = -1;
  public static final int MISSING_EXIT_CODE = -2;
  public static final String NO_ATTEMPT_REASON = "no_attempt";

  private final int exitStatus;
  private final long wallTimeSeconds;
  /** May be null when AWS Batch gave no reason. */
  private final String statusReason;
}
