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

import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;


/**
 * Thrown when {@code DescribeJobs} does not return exactly the job ids that were requested.
 */
public class JobStatusMismatchException extends RuntimeException {
  private static final long serialVersionUID = 6602197830927071531L;

  private final Set<String> missingJobIds;
  private final Set<String> unexpectedJobIds;

  public JobStatusMismatchException(Set<String> requested, Set<String> returned) {
    super(String.format("Described jobs do not match the request, missing: %s, unexpected: %s",
        Sets.difference(requested, returned), Sets.difference(returned, requested)));
    this.missingJobIds = ImmutableSet.copyOf(Sets.difference(requested, returned));
    this.unexpectedJobIds = ImmutableSet.copyOf(Sets.difference(returned, requested));
  }

  public Set<String> getMissingJobIds() {
    return this.missingJobIds;
  }

  public Set<String> getUnexpectedJobIds() {
    return this.unexpectedJobIds;
  }
}
