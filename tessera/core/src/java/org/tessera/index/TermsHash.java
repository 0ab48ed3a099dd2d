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
import java.util.Map;

import org.tessera.util.ByteBlockPool;
import org.tessera.util.Counter;
import org.tessera.util.IntBlockPool;

/** This class is passed each token produced by the token stream
 *  on each field during indexing, and it stores these
 *  tokens in a hash table, and allocates separate byte
 *  streams per token.  Subclasses, eg {@link
 *  FreqProxTermsWriter}, write their own byte streams under each term
 *  and turn them into postings at flush. */
abstract class TermsHash {

  // 所有字段共用这两个池: intPool 记录每个 term 各条流的写入位置, bytePool 存放流本身
  final IntBlockPool intPool;
  final ByteBlockPool bytePool;
  // term 文本也写在 bytePool 里
  final ByteBlockPool termBytePool;
  final Counter bytesUsed;

  final DocumentsWriterPerThread docWriter;
  final DocumentsWriterPerThread.DocState docState;

  final boolean trackAllocations;

  TermsHash(final DocumentsWriterPerThread docWriter, boolean trackAllocations) {
    this.docWriter = docWriter;
    this.docState = docWriter.docState;
    this.trackAllocations = trackAllocations;
    this.bytesUsed = trackAllocations ? docWriter.bytesUsed : Counter.newCounter();
    intPool = new IntBlockPool(docWriter.intBlockAllocator);
    bytePool = new ByteBlockPool(docWriter.byteBlockAllocator);
    termBytePool = bytePool;
  }

  public void abort() {
    reset(false, false);
  }

  /**
   * Releases every block of both pools. Zero filling is only needed when the
   * same pools go on to allocate new slices.
   */
  void reset(boolean zeroFillBytes, boolean zeroFillInts) {
    intPool.reset(zeroFillInts, false);
    bytePool.reset(zeroFillBytes, false);
  }

  abstract void flush(Map<String,TermsHashPerField> fieldsToFlush, final SegmentWriteState state) throws IOException;

  abstract TermsHashPerField addField(FieldInvertState fieldInvertState, FieldInfo fieldInfo);

  void finishDocument() throws IOException {
  }

  void startDocument() throws IOException {
  }
}
