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
import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.tessera.util.IOUtils;

/**
 * Orders the results of concurrent flushes. Every flush takes a ticket before
 * it freezes the global deletes; tickets are published strictly in the order
 * they were taken, so a segment never sees deletes frozen after it.
 * @tessera.internal
 */
final class DocumentsWriterFlushQueue {
  private final ArrayDeque<FlushTicket> queue = new ArrayDeque<>();
  // counted before the ticket exists, the queue size lags behind
  private final AtomicInteger ticketCount = new AtomicInteger();
  private final ReentrantLock purgeLock = new ReentrantLock();

  /** Queues a ticket for the global deletes only; returns false if there was nothing to freeze. */
  synchronized boolean addDeletes(DocumentsWriterDeleteQueue deleteQueue) {
    return enqueue(() -> deleteQueue.freezeGlobalBuffer(null), false) != null;
  }

  /** Queues the ticket of a segment flush. Freezes the global deletes under this queue's monitor. */
  synchronized FlushTicket addFlushTicket(DocumentsWriterPerThread dwpt) {
    return enqueue(dwpt::prepareFlush, true);
  }

  private FlushTicket enqueue(Supplier<FrozenBufferedUpdates> freeze, boolean hasSegment) {
    assert Thread.holdsLock(this);
    // count first: while the deletes are being frozen anyChanges() must already see this ticket
    ticketCount.incrementAndGet();
    FlushTicket ticket = null;
    try {
      final FrozenBufferedUpdates frozen = freeze.get();
      if (frozen != null || hasSegment) {
        ticket = new FlushTicket(frozen, hasSegment);
        queue.add(ticket);
      }
      return ticket;
    } finally {
      if (ticket == null) {
        ticketCount.decrementAndGet();
      }
    }
  }

  synchronized void addSegment(FlushTicket ticket, FlushedSegment segment) {
    assert ticket.hasSegment && ticket.failed == false;
    ticket.segment = segment;
  }

  /** A failed ticket still has to leave the queue, its global deletes go out with it. */
  synchronized void markTicketFailed(FlushTicket ticket) {
    assert ticket.hasSegment && ticket.segment == null;
    ticket.failed = true;
  }

  boolean hasTickets() {
    final int count = ticketCount.get();
    assert count >= 0 : "ticketCount should be >= 0 but was: " + count;
    return count != 0;
  }

  int getTicketCount() {
    return ticketCount.get();
  }

  /** Publishes every ready ticket at the head, waiting for a concurrent purge to finish first. */
  void forcePurge(IOUtils.IOConsumer<FlushTicket> consumer) throws IOException {
    assert !Thread.holdsLock(this);
    purgeLock.lock();
    try {
      publishReadyTickets(consumer);
    } finally {
      purgeLock.unlock();
    }
  }

  /** Like {@link #forcePurge} but returns at once when another thread is purging. */
  void tryPurge(IOUtils.IOConsumer<FlushTicket> consumer) throws IOException {
    assert !Thread.holdsLock(this);
    if (purgeLock.tryLock()) {
      try {
        publishReadyTickets(consumer);
      } finally {
        purgeLock.unlock();
      }
    }
  }

  private void publishReadyTickets(IOUtils.IOConsumer<FlushTicket> consumer) throws IOException {
    assert purgeLock.isHeldByCurrentThread();
    FlushTicket head;
    while ((head = readyHead()) != null) {
      try {
        // 不持有 monitor: 发布期间其它 flush 仍可入队
        consumer.accept(head);
      } finally {
        synchronized (this) {
          final FlushTicket polled = queue.poll();
          ticketCount.decrementAndGet();
          assert polled == head : "only the purge lock holder removes tickets";
        }
      }
    }
  }

  private synchronized FlushTicket readyHead() {
    final FlushTicket head = queue.peek();
    return head != null && head.canPublish() ? head : null;
  }

  static final class FlushTicket {
    private final FrozenBufferedUpdates frozenUpdates;
    private final boolean hasSegment;
    // 由 flush 线程回填
    private FlushedSegment segment;
    private boolean failed;
    private boolean published;

    private FlushTicket(FrozenBufferedUpdates frozenUpdates, boolean hasSegment) {
      this.frozenUpdates = frozenUpdates;
      this.hasSegment = hasSegment;
    }

    private boolean canPublish() {
      return hasSegment == false || segment != null || failed;
    }

    synchronized void markPublished() {
      assert published == false : "ticket was already published";
      published = true;
    }

    /** The flushed segment, or <code>null</code> for a deletes-only or failed ticket. */
    FlushedSegment getFlushedSegment() {
      return segment;
    }

    /** The global deletes frozen when the ticket was taken, may be <code>null</code>. */
    FrozenBufferedUpdates getFrozenUpdates() {
      return frozenUpdates;
    }
  }
}
