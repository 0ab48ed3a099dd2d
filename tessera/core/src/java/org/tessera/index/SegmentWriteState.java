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

import org.tessera.util.FixedBitSet;
import org.tessera.util.InfoStream;

/**
 * Holder class for common parameters used during write.
 * @tessera.experimental
 */
public class SegmentWriteState {

  /** {@link InfoStream} used for debugging messages. */
  public final InfoStream infoStream;

  /** Name of the segment being written. */
  public final String segmentName;

  /** Number of documents buffered for the segment, deleted ones included. */
  public final int maxDoc;

  /** {@link FieldInfos} describing all fields in this
   *  segment. */
  public final FieldInfos fieldInfos;

  /** Number of deleted documents set while flushing the
   *  segment. */
  public int delCountOnFlush;

  /**
   * Deletes and updates to apply while we are flushing the segment. A Term is
   * enrolled in here if it was deleted/updated at one point, and it's mapped to
   * the docIDUpto, meaning any docID &lt; docIDUpto containing this term should
   * be deleted/updated.
   */
  public final BufferedUpdates segUpdates;

  /** {@link FixedBitSet} recording live documents; this is
   *  only set if there is one or more deleted documents. */
  public FixedBitSet liveDocs;

  /** Sole constructor. */
  public SegmentWriteState(InfoStream infoStream, String segmentName, int maxDoc,
                           FieldInfos fieldInfos, BufferedUpdates segUpdates) {
    this.infoStream = infoStream;
    this.segmentName = segmentName;
    this.maxDoc = maxDoc;
    this.fieldInfos = fieldInfos;
    this.segUpdates = segUpdates;
    assert assertSegmentName(segmentName);
  }

  // 段名形如 "_0"、"_a", 由写入方生成
  private static boolean assertSegmentName(String segmentName) {
    assert segmentName != null && segmentName.startsWith("_") : "invalid segment name: " + segmentName;
    return true;
  }
}
