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

import java.io.Closeable;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.tessera.codecs.Codec;
import org.tessera.index.DocumentsWriterFlushQueue.FlushTicket;
import org.tessera.index.DocumentsWriterPerThreadPool.ThreadState;
import org.tessera.search.Query;
import org.tessera.store.AlreadyClosedException;
import org.tessera.util.Accountable;
import org.tessera.util.BytesRef;
import org.tessera.util.IOUtils;
import org.tessera.util.InfoStream;

/**
 * This class accepts multiple added documents and directly
 * writes segment files.
 *
 * Each added document is passed to the indexing chain,
 * which in turn processes the document into the different
 * codec formats.  Some formats write bytes to files
 * immediately, e.g. stored fields, while others are
 * buffered by the indexing chain and written only on
 * flush.
 *
 * Once we have used our allowed RAM buffer, or the number
 * of added docs is large enough (in the case we are
 * flushing by doc count instead of RAM usage), we create a
 * real segment and flush it to the codec.
 *
 * Threads:
 *
 * Multiple threads are allowed into addDocument at once.
 * There is an initial synchronized call to
 * {@link DocumentsWriterFlushControl#obtainAndLock()} which
 * hands the thread a {@link ThreadState} of its own; from then
 * on the document is indexed without any global lock.
 *
 * When flush is called by a thread the flushing DWPT is
 * taken out of rotation first, so other threads keep adding
 * documents while it is written.
 *
 * Exceptions:
 *
 * Because this class directly updates in-memory posting
 * lists, and flushes stored fields and term vectors
 * directly to the codec, when an exception is hit we may
 * need to abort the thread's buffered segment. Any exception
 * thrown while the inverted state may be corrupt (e.g. an
 * {@link OutOfMemoryError} or a failing stored-fields writer)
 * aborts the whole {@link DocumentsWriterPerThread}: all
 * documents it buffered since the last flush are discarded.
 * Any other exception, for example one thrown by the token
 * stream, only marks the current document as deleted.
 *
 * Flushed segments are handed to the {@link FlushListener}
 * in the order their flushes started, right after the deletes
 * that were frozen before them have been pushed to the
 * {@link BufferedUpdatesStream}.
 *
 * @tessera.experimental
 */
public final class DocumentsWriter implements Closeable, Accountable {

  /** Hard limit on maximum number of documents that may be added to the
   *  writer.  This is a little bit smaller than Integer.MAX_VALUE
   *  so that composite readers over the flushed segments can
   *  still address every document. */
  public static final int MAX_DOCS = Integer.MAX_VALUE - 128;

  // lowered by tests only
  private static int actualMaxDocs = MAX_DOCS;

  /** Used only for testing. */
  static void setMaxDocs(int maxDocs) {
    if (maxDocs > MAX_DOCS) {
      // Cannot go higher than the hard max:
      throw new IllegalArgumentException("maxDocs must be <= DocumentsWriter.MAX_DOCS=" + MAX_DOCS + "; got: " + maxDocs);
    }
    actualMaxDocs = maxDocs;
  }

  static int getActualMaxDocs() {
    return actualMaxDocs;
  }

  /**
   * Receives every segment this writer flushes.
   * @tessera.experimental
   */
  public interface FlushListener {
    /**
     * Called once per flushed segment, in flush order. Never called
     * concurrently by the same writer.
     */
    void onSegmentFlushed(FlushedSegment segment) throws IOException;
  }

  private final LiveIndexWriterConfig config;
  private final InfoStream infoStream;
  private final FlushListener flushListener;
  private final MergeScheduler mergeScheduler;
  private final MergeScheduler.MergeSource mergeSource;
  private final Codec codec;

  private final AtomicInteger numDocsInRAM = new AtomicInteger(0);
  // 已经保留的文档总数, 包括已 flush 的段
  private final AtomicLong pendingNumDocs = new AtomicLong();
  private final AtomicLong segmentCounter = new AtomicLong();
  private final FieldInfos.FieldNumbers globalFieldNumbers = new FieldInfos.FieldNumbers();
  private final BufferedUpdatesStream bufferedUpdatesStream;

  volatile DocumentsWriterDeleteQueue deleteQueue;
  private final DocumentsWriterFlushQueue ticketQueue = new DocumentsWriterFlushQueue();
  /*
   * we preserve changes during a full flush since IW might not checkout before
   * we release all changes. NRT Readers otherwise suddenly return true from
   * isCurrent while there are actually changes currently committed. See also
   * #anyChanges() & #flushAllThreads
   */
  private volatile boolean pendingChangesInCurrentFullFlush;

  final DocumentsWriterPerThreadPool perThreadPool;
  final FlushPolicy flushPolicy;
  final DocumentsWriterFlushControl flushControl;

  private final Object fullFlushLock = new Object();
  private volatile boolean closed;

  /**
   * Creates a writer that hands flushed segments to the given listener and
   * never runs merges.
   */
  public DocumentsWriter(IndexWriterConfig config, FlushListener flushListener) {
    this(config, flushListener, null);
  }

  /**
   * Creates a writer that hands flushed segments to the given listener. After
   * every publish the configured {@link MergeScheduler} runs the merges the
   * given source asks for; a <code>null</code> source disables merging.
   */
  public DocumentsWriter(IndexWriterConfig config, FlushListener flushListener, MergeScheduler.MergeSource mergeSource) {
    if (flushListener == null) {
      throw new IllegalArgumentException("flushListener must not be null");
    }
    this.config = config;
    this.infoStream = config.getInfoStream();
    this.codec = config.getCodec();
    this.flushListener = flushListener;
    this.mergeSource = mergeSource;
    this.mergeScheduler = config.getMergeScheduler();
    this.mergeScheduler.initialize(infoStream);
    this.deleteQueue = new DocumentsWriterDeleteQueue(infoStream);
    this.bufferedUpdatesStream = new BufferedUpdatesStream(infoStream);
    this.perThreadPool = new DocumentsWriterPerThreadPool(config.getMaxThreadStates());
    this.flushPolicy = config.getFlushPolicy();
    flushPolicy.init(config);
    flushControl = new DocumentsWriterFlushControl(this, config, bufferedUpdatesStream);
    if (infoStream.isEnabled("DW")) {
      infoStream.message("DW", "init: create=true\n" + config);
    }
  }

  /** Returns the live configuration of this writer. */
  public LiveIndexWriterConfig getConfig() {
    return config;
  }

  /**
   * Deletes every buffered or already flushed document containing any of
   * the given terms. Returns true if deletes were published as a result.
   */
  public boolean deleteTerms(final Term... terms) throws IOException {
    ensureOpen();
    final DocumentsWriterDeleteQueue deleteQueue;
    synchronized (this) {
      // the queue must not be swapped by a full flush in between
      deleteQueue = this.deleteQueue;
      deleteQueue.addDelete(terms);
    }
    flushControl.doOnDelete();
    return applyAllDeletes(deleteQueue);
  }

  /** Deletes every document matching any of the given queries. */
  public boolean deleteQueries(final Query... queries) throws IOException {
    ensureOpen();
    final DocumentsWriterDeleteQueue deleteQueue;
    synchronized (this) {
      deleteQueue = this.deleteQueue;
      deleteQueue.addDelete(queries);
    }
    flushControl.doOnDelete();
    return applyAllDeletes(deleteQueue);
  }

  /**
   * Updates a document's numeric doc-values field to the given value.
   * Every document containing <code>term</code> is updated.
   *
   * @throws IllegalArgumentException if the field was never indexed as a
   *         numeric doc-values field by this writer
   */
  public boolean updateNumericDocValue(Term term, String field, long value) throws IOException {
    ensureOpen();
    if (!globalFieldNumbers.contains(field, DocValuesType.NUMERIC)) {
      throw new IllegalArgumentException("can only update existing numeric-docvalues fields!");
    }
    return updateDocValues(new DocValuesUpdate.NumericDocValuesUpdate(term, field, value));
  }

  /**
   * Updates a document's binary doc-values field to the given value.
   * Every document containing <code>term</code> is updated.
   *
   * @throws IllegalArgumentException if the field was never indexed as a
   *         binary doc-values field by this writer
   */
  public boolean updateBinaryDocValue(Term term, String field, BytesRef value) throws IOException {
    ensureOpen();
    if (value == null) {
      throw new IllegalArgumentException("cannot update a field to a null value: " + field);
    }
    if (!globalFieldNumbers.contains(field, DocValuesType.BINARY)) {
      throw new IllegalArgumentException("can only update existing binary-docvalues fields!");
    }
    return updateDocValues(new DocValuesUpdate.BinaryDocValuesUpdate(term, field, value));
  }

  boolean updateDocValues(DocValuesUpdate... updates) throws IOException {
    final DocumentsWriterDeleteQueue deleteQueue;
    synchronized (this) {
      deleteQueue = this.deleteQueue;
      deleteQueue.addDocValuesUpdates(updates);
    }
    flushControl.doOnDelete();
    return applyAllDeletes(deleteQueue);
  }

  private boolean applyAllDeletes(DocumentsWriterDeleteQueue deleteQueue) throws IOException {
    if (flushControl.getAndResetApplyAllDeletes()) {
      if (deleteQueue != null && !flushControl.isFullFlush()) {
        ticketQueue.addDeletes(deleteQueue);
      }
      purgeBuffer(true);
      return true;
    }
    return false;
  }

  /** Publishes every finished ticket at the head of the ticket queue. */
  private int purgeBuffer(boolean forced) throws IOException {
    final int before = ticketQueue.getTicketCount();
    if (forced) {
      ticketQueue.forcePurge(this::publishFlushTicket);
    } else {
      ticketQueue.tryPurge(this::publishFlushTicket);
    }
    return before - ticketQueue.getTicketCount();
  }

  /**
   * Returns how many docs are currently buffered in RAM.
   */
  public int getNumDocs() {
    return numDocsInRAM.get();
  }

  /**
   * Returns the number of documents reserved so far, flushed and buffered ones
   * together, minus the ones discarded by aborts.
   */
  public long getPendingNumDocs() {
    return pendingNumDocs.get();
  }

  private void ensureOpen() throws AlreadyClosedException {
    if (closed) {
      throw new AlreadyClosedException("this DocumentsWriter is closed");
    }
  }

  /** Called if we hit an exception at a bad time (when
   *  updating the index files) and must discard all
   *  currently buffered docs.  This resets our state,
   *  discarding any docs added since last flush. Keeps going
   *  when a thread state fails to abort and rethrows the first
   *  failure at the end. */
  public synchronized void abort() throws IOException {
    boolean success = false;
    Throwable th = null;
    try {
      deleteQueue.clear();
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "abort");
      }
      final int limit = perThreadPool.getActiveThreadStateCount();
      for (int i = 0; i < limit; i++) {
        final ThreadState perThread = perThreadPool.getThreadState(i);
        perThread.lock();
        try {
          abortThreadState(perThread);
        } catch (Throwable t) {
          th = IOUtils.useOrSuppress(th, t);
        } finally {
          perThread.unlock();
        }
      }
      try {
        flushControl.abortPendingFlushes();
      } catch (Throwable t) {
        th = IOUtils.useOrSuppress(th, t);
      }
      flushControl.waitForFlush();
      success = th == null;
    } finally {
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "done abort success=" + success);
      }
    }
    if (th != null) {
      throw IOUtils.rethrowAlways(th);
    }
  }

  /** Returns how many documents were aborted. */
  private int abortThreadState(final ThreadState perThread) throws IOException {
    assert perThread.isHeldByCurrentThread();
    if (perThread.isActive()) { // we might be closed
      if (perThread.isInitialized()) {
        int abortedDocCount = perThread.dwpt.getNumDocsInRAM();
        try {
          subtractFlushedNumDocs(abortedDocCount);
          perThread.dwpt.abort();
        } finally {
          flushControl.doOnAbort(perThread);
        }
        return abortedDocCount;
      } else {
        flushControl.doOnAbort(perThread);
        // This DWPT was never initialized so it has no indexed documents:
        return 0;
      }
    } else {
      assert closed;
      return 0;
    }
  }

  /** Returns true if there are buffered documents, deletes or unpublished flushes. */
  public boolean anyChanges() {
    /*
     * changes are either in a DWPT or in the deleteQueue.
     * yet if we currently flush deletes and / or dwpt there
     * could be a window where all changes are in the ticket queue
     * before they are published to the IW. ie we need to check if the
     * ticket queue has any tickets.
     */
    boolean anyChanges = numDocsInRAM.get() != 0 || anyDeletions() || ticketQueue.hasTickets() || pendingChangesInCurrentFullFlush;
    if (infoStream.isEnabled("DW") && anyChanges) {
      infoStream.message("DW", "anyChanges? numDocsInRam=" + numDocsInRAM.get()
                         + " deletes=" + anyDeletions() + " hasTickets:"
                         + ticketQueue.hasTickets() + " pendingChangesInFullFlush: "
                         + pendingChangesInCurrentFullFlush);
    }
    return anyChanges;
  }

  /** Returns the number of buffered delete terms, published packets included. */
  public int getBufferedDeleteTermsSize() {
    return deleteQueue.getBufferedUpdatesTermsSize();
  }

  //for testing
  public int getNumBufferedDeleteTerms() {
    return deleteQueue.numGlobalTermDeletes();
  }

  public boolean anyDeletions() {
    return deleteQueue.anyChanges();
  }

  /**
   * Flushes whatever is still buffered and closes this writer. Merges the
   * merge source still asks for run with {@link MergeTrigger#CLOSING} first.
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    boolean success = false;
    try {
      flushAllThreads();
      maybeMerge(MergeTrigger.CLOSING);
      success = true;
    } finally {
      closed = true;
      flushControl.setClosed();
      perThreadPool.deactivateUnreleasedStates();
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "close success=" + success);
      }
      if (success) {
        IOUtils.close(mergeScheduler);
      } else {
        IOUtils.closeWhileHandlingException(mergeScheduler);
      }
    }
  }

  private boolean preUpdate() throws IOException {
    ensureOpen();
    boolean hasEvents = false;
    if (flushControl.anyStalledThreads() || flushControl.numQueuedFlushes() > 0) {
      // Help out flushing any queued DWPTs so we can un-stall:
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "DocumentsWriter has queued dwpt; will hijack this thread to flush pending segment(s)");
      }
      do {
        // Try pick up pending threads here if possible
        DocumentsWriterPerThread flushingDWPT;
        while ((flushingDWPT = flushControl.nextPendingFlush()) != null) {
          // Don't push the delete here since the update could fail!
          hasEvents |= doFlush(flushingDWPT);
        }

        if (infoStream.isEnabled("DW") && flushControl.anyStalledThreads()) {
          infoStream.message("DW", "WARNING DocumentsWriter has stalled threads; waiting");
        }

        flushControl.waitIfStalled(); // block if stalled
      } while (flushControl.numQueuedFlushes() != 0); // still queued DWPTs try help flushing

      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", "continue indexing after helping out flushing DocumentsWriter is healthy");
      }
    }
    return hasEvents;
  }

  private boolean postUpdate(DocumentsWriterPerThread flushingDWPT, boolean hasEvents) throws IOException {
    hasEvents |= applyAllDeletes(deleteQueue);
    if (flushingDWPT != null) {
      hasEvents |= doFlush(flushingDWPT);
    } else {
      final DocumentsWriterPerThread nextPendingFlush = flushControl.nextPendingFlush();
      if (nextPendingFlush != null) {
        hasEvents |= doFlush(nextPendingFlush);
      }
    }

    return hasEvents;
  }

  private void ensureInitialized(ThreadState state) {
    if (state.dwpt == null) {
      final FieldInfos.Builder infos = new FieldInfos.Builder(globalFieldNumbers);
      state.dwpt = new DocumentsWriterPerThread(newSegmentName(), codec, infoStream,
          deleteQueue, infos, pendingNumDocs);
    }
  }

  private String newSegmentName() {
    return "_" + Long.toString(segmentCounter.getAndIncrement(), Character.MAX_RADIX);
  }

  /**
   * Adds a document. Returns true if segments were flushed or deletes were
   * published while the document was added.
   */
  public boolean addDocument(Iterable<? extends IndexableField> doc) throws IOException {
    return updateDocument(doc, null);
  }

  /**
   * Adds a document after deleting every document, buffered or flushed, that
   * contains <code>delTerm</code>. The delete and the add happen atomically
   * with respect to other updates of the same term. A <code>null</code>
   * delTerm makes this a plain add.
   */
  public boolean updateDocument(Iterable<? extends IndexableField> doc, Term delTerm) throws IOException {
    boolean hasEvents = preUpdate();

    final ThreadState perThread = flushControl.obtainAndLock();

    final DocumentsWriterPerThread flushingDWPT;
    try {
      // This must happen after we've pulled the ThreadState because IW.close
      // waits for all ThreadStates to be released:
      if (!perThread.isActive()) {
        ensureOpen();
        throw new AlreadyClosedException("this DocumentsWriter is closed");
      }
      ensureOpen();
      ensureInitialized(perThread);
      assert perThread.isInitialized();
      final DocumentsWriterPerThread dwpt = perThread.dwpt;
      final int dwptNumDocs = dwpt.getNumDocsInRAM();
      try {
        dwpt.updateDocument(doc, delTerm);
      } finally {
        if (dwpt.isAborted()) {
          // the aborted DWPT took all of its documents with it:
          subtractFlushedNumDocs(dwptNumDocs);
          flushControl.doOnAbort(perThread);
        } else {
          // We don't know whether the document actually
          // counted as being indexed, so we must subtract here to
          // accumulate our separate counter:
          numDocsInRAM.addAndGet(dwpt.getNumDocsInRAM() - dwptNumDocs);
        }
      }
      final boolean isUpdate = delTerm != null;
      flushingDWPT = flushControl.doAfterDocument(perThread, isUpdate);
    } finally {
      perThreadPool.release(perThread);
    }

    return postUpdate(flushingDWPT, hasEvents);
  }

  private boolean doFlush(DocumentsWriterPerThread flushingDWPT) throws IOException {
    boolean hasEvents = false;
    boolean forcePurge = false;
    while (flushingDWPT != null) {
      hasEvents = true;
      boolean success = false;
      FlushTicket ticket = null;
      try {
        /*
         * Since with DWPT the flush process is concurrent and several DWPT
         * could flush at the same time we must maintain the order of the
         * flushes before we can apply the flushed segment and the frozen global
         * deletes it is buffering. The reason for this is that the global
         * deletes mark a certain point in time where we took a DWPT out of
         * rotation and freeze the global deletes.
         *
         * Example: A flush 'A' starts and freezes the global deletes, then
         * flush 'B' starts and freezes all deletes occurred since 'A' has
         * started. if 'B' finishes before 'A' we need to wait until 'A' is done
         * otherwise the deletes frozen by 'B' are not applied to 'A' and we
         * might miss to deletes documents in 'A'.
         */
        try {
          // Each flush is assigned a ticket in the order they acquire the ticketQueue lock
          ticket = ticketQueue.addFlushTicket(flushingDWPT);

          final int flushingDocsInRam = flushingDWPT.getNumDocsInRAM();
          boolean dwptSuccess = false;
          try {
            // flush concurrently without locking
            final FlushedSegment newSegment = flushingDWPT.flush();
            ticketQueue.addSegment(ticket, newSegment);
            dwptSuccess = true;
          } finally {
            subtractFlushedNumDocs(flushingDocsInRam);
            if (!dwptSuccess && infoStream.isEnabled("DW")) {
              infoStream.message("DW", "flush of segment " + flushingDWPT.getSegmentName() + " failed");
            }
          }
          // flush was successful once we reached this point - new seg. has been assigned to the ticket!
          success = true;
        } finally {
          if (!success && ticket != null) {
            // In the case of a failure make sure we are making progress and
            // apply all the deletes since the segment flush failed since the flush
            // ticket could hold global deletes see FlushTicket#canPublish()
            ticketQueue.markTicketFailed(ticket);
          }
        }
        /*
         * Now we are done and try to flush the ticket queue if the head of the
         * queue has already finished the flush.
         */
        if (ticketQueue.getTicketCount() >= perThreadPool.getActiveThreadStateCount()) {
          // This means there is a backlog: the one
          // thread in innerPurge can't keep up with all
          // other threads flushing segments.  In this case
          // we forcefully stall the producers.
          forcePurge = true;
          break;
        }
      } finally {
        flushControl.doAfterFlush(flushingDWPT);
      }

      flushingDWPT = flushControl.nextPendingFlush();
    }
    if (hasEvents) {
      purgeBuffer(forcePurge);
      maybeMerge(MergeTrigger.SEGMENT_FLUSH);
    }

    // If deletes alone are consuming > 1/2 our RAM
    // buffer, force them all to apply now. This is to
    // prevent too-frequent flushing of a long tail of
    // tiny segments:
    final double ramBufferSizeMB = config.getRAMBufferSizeMB();
    if (ramBufferSizeMB != IndexWriterConfig.DISABLE_AUTO_FLUSH &&
        flushControl.getDeleteBytesUsed() > (1024*1024*ramBufferSizeMB/2)) {
      hasEvents = true;
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", String.format(Locale.ROOT, "force apply deletes bytesUsed=%.1f MB vs ramBuffer=%.1f MB",
            flushControl.getDeleteBytesUsed()/(1024.*1024.),
            ramBufferSizeMB));
      }
      flushControl.setApplyAllDeletes();
      applyAllDeletes(deleteQueue);
    }

    return hasEvents;
  }

  void subtractFlushedNumDocs(int numFlushed) {
    int oldValue = numDocsInRAM.get();
    while (!numDocsInRAM.compareAndSet(oldValue, oldValue - numFlushed)) {
      oldValue = numDocsInRAM.get();
    }
    assert numDocsInRAM.get() >= 0;
  }

  /**
   * Pushes the ticket's global deletes, then the segment-private ones, and
   * hands the segment to the listener with the generation it was assigned.
   * Only ever called by the thread holding the ticket queue's purge lock.
   */
  private void publishFlushTicket(FlushTicket ticket) throws IOException {
    ticket.markPublished();
    final FrozenBufferedUpdates globalPacket = ticket.getFrozenUpdates();
    final FlushedSegment newSegment = ticket.getFlushedSegment();
    // Lock order: DW -> BD
    synchronized (bufferedUpdatesStream) {
      if (globalPacket != null && globalPacket.any()) {
        bufferedUpdatesStream.push(globalPacket);
      }
      if (newSegment == null) {
        // failed flush or a deletes-only ticket: nothing to publish
        return;
      }
      final long nextGen;
      if (newSegment.segmentUpdates != null && newSegment.segmentUpdates.any()) {
        nextGen = bufferedUpdatesStream.push(newSegment.segmentUpdates);
      } else {
        // Since we don't have a delete packet to apply we can get a new
        // generation right away
        nextGen = bufferedUpdatesStream.getNextGen();
      }
      newSegment.setDelGen(nextGen);
    }
    if (infoStream.isEnabled("DW")) {
      infoStream.message("DW", "publish flushed segment " + newSegment);
    }
    flushListener.onSegmentFlushed(newSegment);
  }

  private void maybeMerge(MergeTrigger trigger) throws IOException {
    if (mergeSource == null) {
      return;
    }
    if (infoStream.isEnabled("DW")) {
      infoStream.message("DW", "maybeMerge trigger=" + trigger + " pending=" + mergeSource.hasPendingMerges());
    }
    mergeScheduler.merge(mergeSource, trigger);
  }

  /**
   * Flushes every buffered document of every thread state into new segments
   * and publishes all buffered deletes. Documents added concurrently go to the
   * next generation of buffers. Returns true if any segment was flushed.
   */
  public boolean flushAllThreads() throws IOException {
    synchronized (fullFlushLock) {
      boolean success = false;
      try {
        final boolean anythingFlushed = doFlushAllThreads();
        success = true;
        if (anythingFlushed) {
          maybeMerge(MergeTrigger.FULL_FLUSH);
        }
        return anythingFlushed;
      } finally {
        finishFullFlush(success);
      }
    }
  }

  private boolean doFlushAllThreads() throws IOException {
    final DocumentsWriterDeleteQueue flushingDeleteQueue;
    if (infoStream.isEnabled("DW")) {
      infoStream.message("DW", "startFullFlush");
    }

    synchronized (this) {
      pendingChangesInCurrentFullFlush = anyChanges();
      flushingDeleteQueue = deleteQueue;
      /* Cutover to a new delete queue.  This must be synced on the flush control
       * otherwise a new DWPT could sneak into the loop with an already flushing
       * delete queue */
      flushControl.markForFullFlush(); // swaps the delQueue synced on FlushControl
    }
    assert flushingDeleteQueue != deleteQueue;
    boolean anythingFlushed = false;
    DocumentsWriterPerThread flushingDWPT;
    // Help out with flushing:
    while ((flushingDWPT = flushControl.nextPendingFlush()) != null) {
      anythingFlushed |= doFlush(flushingDWPT);
    }
    // If a concurrent flush is still in flight wait for it
    flushControl.waitForFlush();
    if (!anythingFlushed && flushingDeleteQueue.anyChanges()) { // apply deletes if we did not flush any document
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", Thread.currentThread().getName() + ": flush naked frozen global deletes");
      }
      ticketQueue.addDeletes(flushingDeleteQueue);
    }
    purgeBuffer(true);
    assert !flushingDeleteQueue.anyChanges() && !ticketQueue.hasTickets();
    return anythingFlushed;
  }

  private void finishFullFlush(boolean success) throws IOException {
    try {
      if (infoStream.isEnabled("DW")) {
        infoStream.message("DW", Thread.currentThread().getName() + " finishFullFlush success=" + success);
      }
      if (success) {
        // Release the flush lock
        flushControl.finishFullFlush();
      } else {
        flushControl.abortFullFlushes();
      }
    } finally {
      pendingChangesInCurrentFullFlush = false;
    }
  }

  /** Returns the stream every published delete packet goes to. */
  BufferedUpdatesStream getBufferedUpdatesStream() {
    return bufferedUpdatesStream;
  }

  @Override
  public long ramBytesUsed() {
    return flushControl.ramBytesUsed();
  }
}
