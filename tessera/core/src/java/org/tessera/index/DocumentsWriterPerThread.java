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
import java.text.NumberFormat;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

import org.tessera.codecs.Codec;
import org.tessera.index.DocumentsWriterDeleteQueue.DeleteSlice;
import org.tessera.util.ArrayUtil;
import org.tessera.util.ByteBlockPool;
import org.tessera.util.Counter;
import org.tessera.util.FixedBitSet;
import org.tessera.util.InfoStream;
import org.tessera.util.IntBlockPool;

/**
 * The RAM buffer behind one thread state: indexes documents into a private
 * {@link IndexingChain} until it is flushed into a single segment, then it is
 * discarded. Only ever used by one thread at a time.
 */
final class DocumentsWriterPerThread {

  /**
   * Maximum length of a single term in UTF8 bytes; the term must fit in one
   * byte block together with its 2 byte length prefix.
   */
  static final int MAX_TERM_LENGTH_UTF8 = ByteBlockPool.BYTE_BLOCK_SIZE - 2;

  /**
   * Maximum position of a token within a field. The headroom keeps
   * position arithmetic in the chain from overflowing.
   */
  static final int MAX_POSITION = Integer.MAX_VALUE - 128;

  private static final boolean INFO_VERBOSE = false;

  static class DocState {
    final DocumentsWriterPerThread docWriter;
    InfoStream infoStream;
    // 当前文档在本段内的编号, 从 0 开始
    int docID;
    Iterable<? extends IndexableField> doc;

    DocState(DocumentsWriterPerThread docWriter, InfoStream infoStream) {
      this.docWriter = docWriter;
      this.infoStream = infoStream;
    }

    public void clear() {
      // don't hold onto doc, in case it is largish:
      doc = null;
    }
  }

  final Codec codec;
  final DocState docState;
  final Counter bytesUsed;
  final ByteBlockPool.Allocator byteBlockAllocator;
  final IntBlockPool.Allocator intBlockAllocator;
  final InfoStream infoStream;
  final DocumentsWriterDeleteQueue deleteQueue;

  private final IndexingChain consumer;

  // Updates for our still-in-RAM (to be flushed next) segment
  private final BufferedUpdates pendingUpdates;
  private final DeleteSlice deleteSlice;
  private final String segmentName;
  private final FieldInfos.Builder fieldInfos;
  private final AtomicLong pendingNumDocs;
  private final NumberFormat nf = NumberFormat.getInstance(Locale.ROOT);

  private int numDocsInRAM;
  private boolean aborted = false;   // True if we aborted
  private Throwable abortingException;

  // 解析失败(非致命)的文档, flush 时从 liveDocs 中清除
  private int[] deleteDocIDs = new int[0];
  private int numDeletedDocIds = 0;

  DocumentsWriterPerThread(String segmentName, Codec codec, InfoStream infoStream,
                           DocumentsWriterDeleteQueue deleteQueue, FieldInfos.Builder fieldInfos, AtomicLong pendingNumDocs) {
    this.segmentName = segmentName;
    this.infoStream = infoStream;
    this.codec = codec;
    this.docState = new DocState(this, infoStream);
    this.bytesUsed = Counter.newCounter();
    this.byteBlockAllocator = new ByteBlockPool.DirectTrackingAllocator(bytesUsed);
    this.intBlockAllocator = new IntBlockAllocator(bytesUsed);
    this.pendingUpdates = new BufferedUpdates(segmentName);
    this.deleteQueue = deleteQueue;
    this.fieldInfos = fieldInfos;
    this.pendingNumDocs = pendingNumDocs;
    assert numDocsInRAM == 0 : "num docs " + numDocsInRAM;
    deleteSlice = deleteQueue.newSlice();
    if (INFO_VERBOSE && infoStream.isEnabled("DWPT")) {
      infoStream.message("DWPT", Thread.currentThread().getName() + " init seg=" + segmentName + " delQueue=" + deleteQueue);
    }
    // last: the chain reads the allocators and docState from this instance
    consumer = new IndexingChain(this);
  }

  FieldInfos.Builder getFieldInfosBuilder() {
    return fieldInfos;
  }

  String getSegmentName() {
    return segmentName;
  }

  /** Records the first exception that left this writer's buffers in an unknown state. */
  void onAbortingException(Throwable throwable) {
    assert throwable != null : "aborting exception must not be null";
    assert abortingException == null : "aborting exception has already been set";
    abortingException = throwable;
  }

  boolean hasHitAbortingException() {
    return abortingException != null;
  }

  boolean isAborted() {
    return aborted;
  }

  /**
   * Called if we hit an exception at a bad time (when
   * updating the index files) and must discard all
   * currently buffered docs.  This resets our state,
   * discarding any docs added since last flush.
   */
  void abort() throws IOException {
    aborted = true;
    pendingNumDocs.addAndGet(-numDocsInRAM);
    try {
      if (infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", "now abort");
      }
      try {
        consumer.abort();
      } finally {
        pendingUpdates.clear();
      }
    } finally {
      if (infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", "done abort");
      }
    }
  }

  /** Anything that will add N docs to the index should reserve first to
   *  make sure it's allowed. */
  private void reserveOneDoc() {
    if (pendingNumDocs.incrementAndGet() > DocumentsWriter.getActualMaxDocs()) {
      // Reserve failed: put the one doc back and throw exc:
      pendingNumDocs.decrementAndGet();
      throw new IllegalArgumentException("number of documents in the index cannot exceed " + DocumentsWriter.getActualMaxDocs());
    }
  }

  /**
   * Indexes one document. If <code>delTerm</code> is not null, every document
   * buffered before this one that contains the term is deleted once the
   * document made it into the buffer.
   * <p>
   * A non-aborting exception leaves the document in the buffer, marked as
   * deleted; an aborting one aborts this writer before it is rethrown.
   */
  void updateDocument(Iterable<? extends IndexableField> doc, Term delTerm) throws IOException {
    try {
      assert hasHitAbortingException() == false : "DWPT has hit aborting exception but is still indexing";
      assert deleteQueue != null;
      reserveOneDoc();
      docState.doc = doc;
      docState.docID = numDocsInRAM;
      if (INFO_VERBOSE && infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", Thread.currentThread().getName() + " update delTerm=" + delTerm + " docID=" + docState.docID + " seg=" + segmentName);
      }
      // Even on exception, the document is still added (but marked
      // deleted), so we don't need to un-reserve at that point.
      boolean success = false;
      try {
        try {
          consumer.processDocument();
        } finally {
          docState.clear();
        }
        success = true;
      } finally {
        if (!success) {
          // the document is kept (docIDs must stay dense) but never becomes live:
          if (!aborted && !hasHitAbortingException()) {
            deleteLastDocs(1);
          }
          numDocsInRAM++;
        }
      }
      finishDocument(delTerm);
    } finally {
      maybeAbort("updateDocument");
    }
  }

  private void finishDocument(Term delTerm) {
    /*
     * here we actually finish the document in two steps 1. push the delete into
     * the queue and update our slice. 2. increment the DWPT private document
     * id.
     *
     * the updated slice we get from 1. holds all the deletes that have occurred
     * since we updated the slice the last time.
     */
    boolean applySlice = numDocsInRAM != 0;
    if (delTerm != null) {
      deleteQueue.add(delTerm, deleteSlice);
      assert deleteSlice.isTailItem(delTerm) : "expected the delete term as the tail item";
    } else  {
      applySlice &= deleteQueue.updateSlice(deleteSlice);
    }

    if (applySlice) {
      deleteSlice.apply(pendingUpdates, numDocsInRAM);
    } else { // if we don't need to apply we must reset!
      deleteSlice.reset();
    }
    ++numDocsInRAM;
  }

  /**
   * This method marks the last N docs as deleted. This is used
   * in the case of a non-aborting exception. There are several cases where we fail a document ie. due to an exception
   * during analysis that causes the doc to be rejected but won't cause the DWPT to be stale nor the entire IW to abort and
   * shutdown. In such a case we only mark these docs as deleted and turn it into a livedocs during flush
   */
  private void deleteLastDocs(int docCount) {
    int from = numDocsInRAM;
    int to = numDocsInRAM + docCount;
    int size = deleteDocIDs.length;
    deleteDocIDs = ArrayUtil.grow(deleteDocIDs, numDeletedDocIds + (to - from));
    for (int docId = from; docId < to; docId++) {
      deleteDocIDs[numDeletedDocIds++] = docId;
    }
    bytesUsed.addAndGet((deleteDocIDs.length - size) * Integer.BYTES);
  }

  /**
   * Returns the number of RAM resident documents in this {@link DocumentsWriterPerThread}
   */
  public int getNumDocsInRAM() {
    // public for FlushPolicy
    return numDocsInRAM;
  }

  /**
   * Prepares this DWPT for flushing. This method will freeze and return the
   * {@link DocumentsWriterDeleteQueue}s global buffer and apply all pending
   * deletes to this DWPT.
   */
  FrozenBufferedUpdates prepareFlush() {
    assert numDocsInRAM > 0;
    final FrozenBufferedUpdates globalUpdates = deleteQueue.freezeGlobalBuffer(deleteSlice);
    // apply all deletes before we flush and release the delete slice
    deleteSlice.apply(pendingUpdates, numDocsInRAM);
    assert deleteSlice.isEmpty();
    deleteSlice.reset();
    return globalUpdates;
  }

  /** Flush all pending docs to a new segment */
  FlushedSegment flush() throws IOException {
    assert numDocsInRAM > 0;
    assert deleteSlice.isEmpty() : "all deletes must be applied in prepareFlush";
    final SegmentWriteState flushState = new SegmentWriteState(infoStream, segmentName, numDocsInRAM,
        fieldInfos.finish(), pendingUpdates);
    final double startMBUsed = bytesUsed() / 1024. / 1024.;

    // Apply delete-by-docID now (delete-byDocID only
    // happens when an exception is hit processing that
    // doc, eg if analyzer has some problem w/ the text):
    if (numDeletedDocIds > 0) {
      flushState.liveDocs = new FixedBitSet(numDocsInRAM);
      flushState.liveDocs.set(0, numDocsInRAM);
      for (int i = 0; i < numDeletedDocIds; i++) {
        flushState.liveDocs.clear(deleteDocIDs[i]);
      }
      flushState.delCountOnFlush = numDeletedDocIds;
      bytesUsed.addAndGet(-(deleteDocIDs.length * Integer.BYTES));
      deleteDocIDs = null;
    }

    if (aborted) {
      if (infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", "flush: skip because aborting is set");
      }
      return null;
    }

    long t0 = System.nanoTime();

    if (infoStream.isEnabled("DWPT")) {
      infoStream.message("DWPT", "flush postings as segment " + flushState.segmentName + " numDocs=" + numDocsInRAM);
    }
    try {
      consumer.flush(flushState);
      // We clear this here because we already resolved them (private to this segment) when writing postings:
      pendingUpdates.clearDeleteTerms();

      if (infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", "new segment has " + (flushState.liveDocs == null ? 0 : flushState.delCountOnFlush) + " deleted docs");
        infoStream.message("DWPT", "new segment has " +
            (flushState.fieldInfos.hasNorms() ? "norms" : "no norms") + "; " +
            (flushState.fieldInfos.hasDocValues() ? "docValues" : "no docValues") + "; " +
            (flushState.fieldInfos.hasProx() ? "prox" : "no prox") + "; " +
            (flushState.fieldInfos.hasFreq() ? "freqs" : "no freqs"));
        infoStream.message("DWPT", "flushed codec=" + codec);
      }

      final BufferedUpdates segmentDeletes;
      if (pendingUpdates.deleteQueries.isEmpty() && pendingUpdates.numericUpdates.isEmpty() && pendingUpdates.binaryUpdates.isEmpty()) {
        pendingUpdates.clear();
        segmentDeletes = null;
      } else {
        segmentDeletes = pendingUpdates;
      }

      if (infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", "flushed: segment=" + segmentName +
            " ramUsed=" + nf.format(startMBUsed) + " MB" +
            " docs=" + numDocsInRAM + " delCount=" + flushState.delCountOnFlush);
      }

      FlushedSegment fs = new FlushedSegment(infoStream, segmentName, numDocsInRAM, flushState.fieldInfos,
          segmentDeletes, flushState.liveDocs, flushState.delCountOnFlush);
      if (infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", "flush time " + ((System.nanoTime() - t0) / 1000000.0) + " msec");
      }
      return fs;
    } catch (Throwable t) {
      onAbortingException(t);
      throw t;
    } finally {
      maybeAbort("flush");
    }
  }

  private void maybeAbort(String location) throws IOException {
    if (hasHitAbortingException() && aborted == false) {
      // if we are already aborted don't do anything here
      if (infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", "hit aborting exception in " + location + ": " + abortingException);
      }
      abort();
    }
  }

  long bytesUsed() {
    return bytesUsed.get() + pendingUpdates.bytesUsed.get();
  }

  /* Initial chunks size of the shared int[] blocks used to
     store postings data */
  private static class IntBlockAllocator extends IntBlockPool.Allocator {
    private final Counter bytesUsed;

    IntBlockAllocator(Counter bytesUsed) {
      super(IntBlockPool.INT_BLOCK_SIZE);
      this.bytesUsed = bytesUsed;
    }

    /* Allocate another int[] from the shared pool */
    @Override
    public int[] getIntBlock() {
      int[] b = new int[IntBlockPool.INT_BLOCK_SIZE];
      bytesUsed.addAndGet(IntBlockPool.INT_BLOCK_SIZE * Integer.BYTES);
      return b;
    }

    @Override
    public void recycleIntBlocks(int[][] blocks, int start, int end) {
      bytesUsed.addAndGet(-((end - start) * (IntBlockPool.INT_BLOCK_SIZE * Integer.BYTES)));
    }
  }

  @Override
  public String toString() {
    return "DocumentsWriterPerThread [pendingDeletes=" + pendingUpdates
        + ", segment=" + segmentName + ", aborted=" + aborted + ", numDocsInRAM="
        + numDocsInRAM + ", deleteQueue=" + deleteQueue + ", " + numDeletedDocIds + " deleted docIds" + "]";
  }
}
