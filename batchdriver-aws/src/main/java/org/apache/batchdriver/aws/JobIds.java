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

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.amazonaws.services.batch.model.JobDetail;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import org.apache.batchdriver.api.BatchTask;


/**
 * Job id helpers shared by the poller and the log retriever.
 */
final class JobIds {

  private JobIds() {
  }

  static Set<String> of(Collection<JobDetail> jobs) {
    ImmutableSet.Builder<String> ids = ImmutableSet.builder();
    for (JobDetail job : jobs) {
      ids.add(job.getJobId());
    }
    return ids.build();
  }

  /**
   * @throws IllegalArgumentException if a task has no job id or two tasks share one
   */
  static List<String> ofTasks(Collection<? extends BatchTask> tasks) {
    ImmutableList.Builder<String> ids = ImmutableList.builder();
    Set<String> seen = Sets.newHashSet();
    for (BatchTask task : tasks) {
      Preconditions.checkArgument(task.getJobId() != null, "Task %s has no job id", task.getUid());
      Preconditions.checkArgument(seen.add(task.getJobId()), "Job id %s appears more than once", task.getJobId());
      ids.add(task.getJobId());
    }
    return ids.build();
  }
}
