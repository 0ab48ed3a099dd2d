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

import org.tessera.codecs.DocValuesConsumer;
import org.tessera.util.ArrayUtil;
import org.tessera.util.ByteBlockPool;
import org.tessera.util.BytesRef;
import org.tessera.util.Counter;
import org.tessera.util.FixedBitSet;
import org.tessera.util.RamUsageEstimator;

import static org.tessera.util.ByteBlockPool.BYTE_BLOCK_SIZE;

/** Buffers up pending byte[] per doc, then flushes when
 *  segment flushes. */
class BinaryDocValuesWriter extends DocValuesWriter {

  /** Maximum length for a binary field. */
  static final int MAX_LENGTH = BYTE_BLOCK_SIZE - 2;

  // 值本身顺序写入池中, 第 i 个值的起点 = 前 i-1 个值的长度之和
  private final ByteBlockPool pool;
  private int[] lengths = new int[0];
  private FixedBitSet docsWithField;
  private final Counter iwBytesUsed;
  private long bytesUsed;
  private final FieldInfo fieldInfo;
  private int lastDocID = -1;

  BinaryDocValuesWriter(FieldInfo fieldInfo, Counter iwBytesUsed) {
    this.fieldInfo = fieldInfo;
    this.pool = new ByteBlockPool(new ByteBlockPool.DirectTrackingAllocator(iwBytesUsed));
    this.iwBytesUsed = iwBytesUsed;
    this.docsWithField = new FixedBitSet(64);
    this.bytesUsed = RamUsageEstimator.sizeOf(lengths) + docsWithField.ramBytesUsed();
    iwBytesUsed.addAndGet(bytesUsed);
  }

  void addValue(int docID, BytesRef value) {
    if (docID <= lastDocID) {
      throw new IllegalArgumentException("DocValuesField \"" + fieldInfo.name + "\" appears more than once in this document (only one value is allowed per field)");
    }
    if (value == null) {
      throw new IllegalArgumentException("field=\"" + fieldInfo.name + "\": null value not allowed");
    }
    if (value.length > MAX_LENGTH) {
      throw new IllegalArgumentException("DocValuesField \"" + fieldInfo.name + "\" is too large, must be <= " + MAX_LENGTH);
    }

    if (docID >= lengths.length) {
      lengths = ArrayUtil.grow(lengths, docID + 1);
    }
    lengths[docID] = value.length;
    pool.append(value);
    docsWithField = FixedBitSet.ensureCapacity(docsWithField, docID);
    docsWithField.set(docID);
    updateBytesUsed();

    lastDocID = docID;
  }

  private void updateBytesUsed() {
    // 池的块由 DirectTrackingAllocator 直接计入 iwBytesUsed
    final long newBytesUsed = RamUsageEstimator.sizeOf(lengths) + docsWithField.ramBytesUsed();
    iwBytesUsed.addAndGet(newBytesUsed - bytesUsed);
    bytesUsed = newBytesUsed;
  }

  @Override
  public void finish(int maxDoc) {
  }

  @Override
  public void flush(SegmentWriteState state, DocValuesConsumer dvConsumer) throws IOException {
    final int maxDoc = state.maxDoc;
    dvConsumer.addBinaryField(fieldInfo,
                              new Iterable<BytesRef>() {
                                @Override
                                public Iterator<BytesRef> iterator() {
                                  return new BytesIterator(maxDoc);
                                }
                              });
  }

  // iterates over the values we have in ram
  private class BytesIterator implements Iterator<BytesRef> {
    final BytesRef value = new BytesRef();
    final int upto = lastDocID + 1;
    final int maxDoc;
    int docUpto;
    long byteOffset;

    BytesIterator(int maxDoc) {
      this.maxDoc = maxDoc;
    }

    @Override
    public boolean hasNext() {
      return docUpto < maxDoc;
    }

    @Override
    public BytesRef next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      final BytesRef v;
      if (docUpto < upto && docsWithField.get(docUpto)) {
        int length = lengths[docUpto];
        value.length = length;
        if (length == 0) {
          value.bytes = BytesRef.EMPTY_BYTES;
          value.offset = 0;
        } else {
          pool.setRawBytesRef(value, byteOffset);
          byteOffset += length;
        }
        v = value;
      } else {
        v = null;
      }
      docUpto++;
      return v;
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }
  }
}
