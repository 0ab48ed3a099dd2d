/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tessera.index;

/**
 * A {@link MergeScheduler} which never executes any merges. It is also a
 * stateless one, so configurations build a fresh instance with
 * {@code new NoMergeScheduler()} and any two instances behave the same.
 * Use it if you want to prevent the writer from running merges after flushes.
 * <p>
 * <b>NOTE:</b> the merge source still decides which merges are pending;
 * they simply never run.
 */
public final class NoMergeScheduler extends MergeScheduler {

  /** Creates a scheduler that ignores every merge request. */
  public NoMergeScheduler() {
  }

  @Override
  public void close() {}

  @Override
  public void merge(MergeSource mergeSource, MergeTrigger trigger) {}

  @Override
  public String toString() {
    return "NoMergeScheduler";
  }
}
