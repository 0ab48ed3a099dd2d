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

import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

import org.tessera.index.DocValuesUpdate.BinaryDocValuesUpdate;
import org.tessera.index.DocValuesUpdate.NumericDocValuesUpdate;
import org.tessera.search.Query;
import org.tessera.util.BytesRef;
import org.tessera.util.InfoStream;

/**
 * Append-only, singly linked log of the deletes and doc values updates issued
 * during one indexing session. Only the tail is kept here; every reader of
 * the log holds a {@link DeleteSlice}, a (head, tail] window it replays into
 * its own {@link BufferedUpdates}.
 * <p>
 * Each {@link DocumentsWriterPerThread} opens its slice when it takes its
 * first document, so it only ever sees deletes issued after that point, and
 * replays the slice once per document with its current doc count as the
 * limit. The global slice starts at the sentinel and collects everything
 * with no limit; it is frozen into a packet whenever a flush takes a ticket.
 * Nodes nobody's slice can reach any more are left to the garbage collector.
 * <p>
 * The tail is guarded by this object's monitor, the global buffer by
 * {@link #globalBufferLock}. The monitor is never held while taking the lock.
 */
final class DocumentsWriterDeleteQueue {

  private volatile Node tail;

  private final DeleteSlice globalSlice;
  private final BufferedUpdates globalBufferedUpdates;

  // pkg-private for tests
  final ReentrantLock globalBufferLock = new ReentrantLock();

  /** Incremented on every full flush, which swaps in a new queue. */
  final long generation;

  private final InfoStream infoStream;

  DocumentsWriterDeleteQueue(InfoStream infoStream) {
    this(infoStream, 0);
  }

  DocumentsWriterDeleteQueue(InfoStream infoStream, long generation) {
    this.infoStream = infoStream;
    this.globalBufferedUpdates = new BufferedUpdates("global");
    this.generation = generation;
    // the sentinel is always a slice head, so it is never replayed
    this.tail = new Node(null, (updates, docIDUpto) -> {
      throw new IllegalStateException("sentinel must never be applied");
    });
    this.globalSlice = new DeleteSlice(tail);
  }

  void addDelete(Term... terms) {
    append(new Node(terms, (updates, docIDUpto) -> {
      for (Term term : terms) {
        updates.addTerm(term, docIDUpto);
      }
    }));
    tryApplyGlobalSlice();
  }

  void addDelete(Query... queries) {
    append(new Node(queries, (updates, docIDUpto) -> {
      for (Query query : queries) {
        updates.addQuery(query, docIDUpto);
      }
    }));
    tryApplyGlobalSlice();
  }

  void addDocValuesUpdates(DocValuesUpdate... dvUpdates) {
    append(new Node(dvUpdates, (updates, docIDUpto) -> {
      // every buffer gets its own copy, BufferedUpdates stamps docIDUpto on it
      for (DocValuesUpdate update : dvUpdates) {
        if (update instanceof NumericDocValuesUpdate) {
          updates.addNumericUpdate(new NumericDocValuesUpdate(update.term, update.field, (Long) update.value), docIDUpto);
        } else if (update instanceof BinaryDocValuesUpdate) {
          updates.addBinaryUpdate(new BinaryDocValuesUpdate(update.term, update.field, (BytesRef) update.value), docIDUpto);
        } else {
          throw new IllegalArgumentException(update.type + " doc values updates are not supported");
        }
      }
    }));
    tryApplyGlobalSlice();
  }

  /**
   * Appends the delete term of a document update and makes it the tail of the
   * caller's slice in the same step. Of two threads updating with the same
   * term, whichever appends last wins once both slices are replayed.
   */
  void add(Term term, DeleteSlice slice) {
    final Node node = new Node(term, (updates, docIDUpto) -> updates.addTerm(term, docIDUpto));
    append(node);
    slice.sliceTail = node;
    assert slice.sliceHead != slice.sliceTail : "slice head and tail must differ after add";
    tryApplyGlobalSlice();
  }

  private synchronized void append(Node node) {
    tail.next = node;
    tail = node;
  }

  DeleteSlice newSlice() {
    return new DeleteSlice(tail);
  }

  /** Moves the slice's tail to the queue's tail; returns true if new deletes arrived since the last update. */
  synchronized boolean updateSlice(DeleteSlice slice) {
    if (slice.sliceTail == tail) {
      return false;
    }
    slice.sliceTail = tail;
    return true;
  }

  boolean anyChanges() {
    globalBufferLock.lock();
    try {
      return globalBufferedUpdates.any() || !globalSlice.isEmpty() || globalSlice.sliceTail != tail || tail.next != null;
    } finally {
      globalBufferLock.unlock();
    }
  }

  /** Replays the global slice if nobody else is doing it right now. */
  void tryApplyGlobalSlice() {
    if (globalBufferLock.tryLock()) {
      try {
        if (updateSlice(globalSlice)) {
          globalSlice.apply(globalBufferedUpdates, BufferedUpdates.MAX_INT);
        }
      } finally {
        globalBufferLock.unlock();
      }
    }
  }

  /**
   * Freezes everything the global slice has collected into one packet and
   * moves the caller's slice tail to the current tail. Returns
   * <code>null</code> if there was nothing to freeze.
   */
  FrozenBufferedUpdates freezeGlobalBuffer(DeleteSlice callerSlice) {
    globalBufferLock.lock();
    try {
      // anything appended after this point belongs to the next packet
      final Node frozenTail = tail;
      if (callerSlice != null) {
        callerSlice.sliceTail = frozenTail;
      }
      catchUpGlobalSlice(frozenTail);
      if (globalBufferedUpdates.any() == false) {
        return null;
      }
      final FrozenBufferedUpdates packet = new FrozenBufferedUpdates(infoStream, globalBufferedUpdates, false);
      globalBufferedUpdates.clear();
      return packet;
    } finally {
      globalBufferLock.unlock();
    }
  }

  /** Drops everything buffered globally; used on abort. */
  void clear() {
    globalBufferLock.lock();
    try {
      globalSlice.sliceHead = globalSlice.sliceTail = tail;
      globalBufferedUpdates.clear();
    } finally {
      globalBufferLock.unlock();
    }
  }

  private void catchUpGlobalSlice(Node upTo) {
    assert globalBufferLock.isHeldByCurrentThread();
    if (globalSlice.sliceTail != upTo) {
      globalSlice.sliceTail = upTo;
      globalSlice.apply(globalBufferedUpdates, BufferedUpdates.MAX_INT);
    }
  }

  int numGlobalTermDeletes() {
    return globalBufferedUpdates.numTermDeletes.get();
  }

  /** Applies every queued node to the global buffer and returns its unique delete term count. */
  int getBufferedUpdatesTermsSize() {
    globalBufferLock.lock();
    try {
      catchUpGlobalSlice(tail);
      return globalBufferedUpdates.deleteTerms.size();
    } finally {
      globalBufferLock.unlock();
    }
  }

  /** RAM used by the deletes buffered in the global slice. */
  long bytesUsed() {
    return globalBufferedUpdates.bytesUsed.get();
  }

  @Override
  public String toString() {
    return "DWDQ: [ generation: " + generation + " ]";
  }

  /** A (head, tail] window over the log. Thread confined, hence no volatiles. */
  static class DeleteSlice {
    Node sliceHead; // never replayed
    Node sliceTail;

    DeleteSlice(Node currentTail) {
      assert currentTail != null;
      sliceHead = sliceTail = currentTail;
    }

    /**
     * Replays every node of the slice into the given buffer, limited to the
     * documents below <code>docIDUpto</code>, and empties the slice.
     */
    void apply(BufferedUpdates updates, int docIDUpto) {
      Node current = sliceHead;
      while (current != sliceTail) {
        current = current.next;
        assert current != null : "a non-empty slice must be linked from head to tail";
        current.replay.apply(updates, docIDUpto);
      }
      reset();
    }

    void reset() {
      sliceHead = sliceTail;
    }

    /** Whether {@code item} is the very object held by the tail node. */
    boolean isTailItem(Object item) {
      return sliceTail.item == item;
    }

    boolean isEmpty() {
      return sliceHead == sliceTail;
    }
  }

  @FunctionalInterface
  private interface Replay {
    void apply(BufferedUpdates updates, int docIDUpto);
  }

  static final class Node {
    volatile Node next;
    final Object item;
    private final Replay replay;

    private Node(Object item, Replay replay) {
      this.item = item;
      this.replay = replay;
    }

    @Override
    public String toString() {
      return item instanceof Object[] ? Arrays.toString((Object[]) item) : String.valueOf(item);
    }
  }
}
