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

import org.tessera.util.Bits;
import org.tessera.util.FixedBitSet;
import org.tessera.util.InfoStream;

/**
 * A segment that a {@link DocumentsWriterPerThread} has written through its
 * codec. Handed to the {@link DocumentsWriter.FlushListener} once the deletes
 * that were frozen before it have been published.
 * @tessera.experimental
 */
public final class FlushedSegment {

  private final String segmentName;
  private final int maxDoc;
  private final FieldInfos fieldInfos;
  // 只作用于本段的删除/更新, 可能为 null
  final FrozenBufferedUpdates segmentUpdates;
  private final FixedBitSet liveDocs;
  private final int delCount;
  private long delGen = -1;

  FlushedSegment(InfoStream infoStream, String segmentName, int maxDoc, FieldInfos fieldInfos,
                 BufferedUpdates segmentUpdates, FixedBitSet liveDocs, int delCount) {
    this.segmentName = segmentName;
    this.maxDoc = maxDoc;
    this.fieldInfos = fieldInfos;
    this.segmentUpdates = segmentUpdates != null && segmentUpdates.any() ? new FrozenBufferedUpdates(infoStream, segmentUpdates, true) : null;
    this.liveDocs = liveDocs;
    this.delCount = delCount;
  }

  public String getSegmentName() {
    return segmentName;
  }

  /** Number of documents in the segment, deleted ones included. */
  public int maxDoc() {
    return maxDoc;
  }

  public FieldInfos getFieldInfos() {
    return fieldInfos;
  }

  /** Live documents of the segment, or <code>null</code> if none were deleted while flushing. */
  public Bits getLiveDocs() {
    return liveDocs;
  }

  /** Documents deleted while flushing: failed documents and segment-private term deletes. */
  public int getDelCount() {
    return delCount;
  }

  /** Returns true if queries or doc-values updates still have to be resolved against this segment. */
  public boolean hasSegmentUpdates() {
    return segmentUpdates != null;
  }

  /**
   * The buffered-deletes generation of this segment. Every global packet with a
   * larger generation applies to it; see {@link BufferedUpdatesStream#coalesce(long)}.
   */
  public long getDelGen() {
    return delGen;
  }

  void setDelGen(long delGen) {
    assert this.delGen == -1 : "delGen was already assigned";
    this.delGen = delGen;
  }

  @Override
  public String toString() {
    return "FlushedSegment(" + segmentName + " maxDoc=" + maxDoc + " delCount=" + delCount + " delGen=" + delGen + ")";
  }
}
