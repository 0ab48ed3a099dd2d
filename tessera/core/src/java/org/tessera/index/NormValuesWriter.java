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

import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.tessera.codecs.NormsConsumer;
import org.tessera.util.ArrayUtil;
import org.tessera.util.Counter;
import org.tessera.util.RamUsageEstimator;

/** Buffers up pending long per doc, then flushes when
 *  segment flushes. */
class NormValuesWriter {

  private final static long MISSING = 0L;

  private long[] pending = new long[0];
  private final Counter iwBytesUsed;
  private long bytesUsed;
  private final FieldInfo fieldInfo;
  private int lastDocID = -1;

  NormValuesWriter(FieldInfo fieldInfo, Counter iwBytesUsed) {
    this.fieldInfo = fieldInfo;
    this.iwBytesUsed = iwBytesUsed;
    this.bytesUsed = RamUsageEstimator.sizeOf(pending);
    iwBytesUsed.addAndGet(bytesUsed);
  }

  void addValue(int docID, long value) {
    if (docID <= lastDocID) {
      throw new IllegalArgumentException("Norm for \"" + fieldInfo.name + "\" appears more than once in this document (only one value is allowed per field)");
    }
    if (docID >= pending.length) {
      pending = ArrayUtil.grow(pending, docID + 1);
    }
    // 跳过的文档保持 MISSING(数组新扩出的部分本就是 0)
    pending[docID] = value;
    updateBytesUsed();
    lastDocID = docID;
  }

  private void updateBytesUsed() {
    final long newBytesUsed = RamUsageEstimator.sizeOf(pending);
    iwBytesUsed.addAndGet(newBytesUsed - bytesUsed);
    bytesUsed = newBytesUsed;
  }

  void finish(int maxDoc) {
  }

  void flush(SegmentWriteState state, NormsConsumer normsConsumer) throws IOException {
    final int maxDoc = state.maxDoc;
    final long[] values = pending;
    final int upto = lastDocID + 1;

    normsConsumer.addNormsField(fieldInfo,
                                new Iterable<Number>() {
                                  @Override
                                  public Iterator<Number> iterator() {
                                    return new NumericIterator(maxDoc, upto, values);
                                  }
                                });
  }

  // iterates over the values we have in ram
  private static class NumericIterator implements Iterator<Number> {
    final long[] values;
    final int upto;
    final int maxDoc;
    int docUpto;

    NumericIterator(int maxDoc, int upto, long[] values) {
      this.maxDoc = maxDoc;
      this.upto = upto;
      this.values = values;
    }

    @Override
    public boolean hasNext() {
      return docUpto < maxDoc;
    }

    @Override
    public Number next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Long value;
      if (docUpto < upto) {
        value = values[docUpto];
      } else {
        value = MISSING;
      }
      docUpto++;
      return value;
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }
  }
}
