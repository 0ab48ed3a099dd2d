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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * OneMerge provides the information necessary to perform
 * an individual primitive merge operation, resulting in
 * a single new segment.  It names the
 * subset of segments to be merged.
 * @tessera.experimental
 */
public class OneMerge {

  /**
   * Segments to be merged.
   */
  public final List<FlushedSegment> segments;

  /**
   * Total number of documents in segments to be merged, not accounting for deletions.
   */
  public final int totalMaxDoc;

  private volatile boolean aborted;
  private volatile Throwable error;
  volatile long mergeStartNS = -1;

  /** Sole constructor.
   * @param segments List of {@link FlushedSegment}s
   *        to be merged. */
  public OneMerge(List<FlushedSegment> segments) {
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("segments must include at least one segment");
    }
    // clone the list, as the in list may be based off original SegmentInfos and may be modified
    this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    int count = 0;
    for (FlushedSegment info : segments) {
      count += info.maxDoc();
    }
    totalMaxDoc = count;
  }

  /** Record that an exception occurred while executing
   *  this merge */
  public void setException(Throwable error) {
    this.error = error;
  }

  /** Retrieve previous exception set by {@link
   *  #setException}. */
  public Throwable getException() {
    return error;
  }

  /** Marks this merge as aborted. The merge source stops it at the next possible moment. */
  public void setAborted() {
    aborted = true;
  }

  /** Returns true if this merge was aborted. */
  public boolean isAborted() {
    return aborted;
  }

  /** Nanosecond timestamp the merge started at, or -1 if it has not started. */
  public long getMergeStartNS() {
    return mergeStartNS;
  }

  /** Returns a readable description of the current merge
   *  state. */
  public String segString() {
    StringBuilder b = new StringBuilder();
    final int numSegments = segments.size();
    for(int i=0;i<numSegments;i++) {
      if (i > 0) {
        b.append(' ');
      }
      b.append(segments.get(i).getSegmentName());
    }
    if (aborted) {
      b.append(" [ABORTED]");
    }
    return b.toString();
  }

  @Override
  public String toString() {
    return "OneMerge(" + segString() + " totalMaxDoc=" + totalMaxDoc + ")";
  }
}
