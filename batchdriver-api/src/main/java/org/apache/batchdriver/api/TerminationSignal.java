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
package org.apache.batchdriver.api;

/**
 * A cooperative cancellation token owned by the workflow engine.
 *
 * <p>
 *   Long running driver operations poll this token at well defined points (before each remote submission,
 *   between log pages). Calls already in flight are never interrupted.
 * </p>
 */
public interface TerminationSignal {

  /**
   * A signal that is never raised.
   */
  TerminationSignal NEVER = new TerminationSignal() {
    @Override
    public boolean isTerminationRequested() {
      return false;
    }

    @Override
    public String toString() {
      return "TerminationSignal.NEVER";
    }
  };

  /**
   * @return {@code true} once the owner asked running work to stop.
   */
  boolean isTerminationRequested();
}
