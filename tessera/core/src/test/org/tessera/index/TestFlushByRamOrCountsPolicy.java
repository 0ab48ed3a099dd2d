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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.codecs.RecordingCodec;
import org.tessera.document.Document;
import org.tessera.document.Field;
import org.tessera.document.StringField;
import org.tessera.document.TextField;
import org.tessera.index.DocumentsWriterPerThreadPool.ThreadState;

import static org.junit.Assert.*;

public class TestFlushByRamOrCountsPolicy extends RandomizedTest {

  @Test
  public void testFlushByDocCount() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    IndexWriterConfig config = new IndexWriterConfig(codec)
        .setMaxBufferedDocs(1000)
        .setRAMBufferSizeMB(IndexWriterConfig.DISABLE_AUTO_FLUSH);
    CheckingFlushPolicy policy = new CheckingFlushPolicy();
    config.setFlushPolicy(policy);
    List<Integer> flushed = new CopyOnWriteArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(config, segment -> flushed.add(segment.maxDoc()));
    try {
      for (int i = 0; i < 2500; i++) {
        writer.addDocument(newDocument(i));
        if (i == 999) {
          assertEquals(Collections.singletonList(1000), flushed);
          assertEquals(0, writer.getNumDocs());
        }
      }
      assertEquals(List.of(1000, 1000), flushed);
      assertEquals(500, writer.getNumDocs());
      assertTrue(policy.hasMarkedPending);
      assertFalse(writer.flushControl.stallControl.wasStalled());

      assertTrue(writer.flushAllThreads());
      assertEquals(List.of(1000, 1000, 500), flushed);
      assertEquals(0, writer.getNumDocs());
      assertEquals(2500, writer.getPendingNumDocs());
    } finally {
      writer.close();
    }
    assertEquals(3, codec.numSegments());
  }

  @Test
  public void testFlushByRam() throws Exception {
    RecordingCodec codec = new RecordingCodec();
    IndexWriterConfig config = new IndexWriterConfig(codec)
        .setRAMBufferSizeMB(0.5);
    CheckingFlushPolicy policy = new CheckingFlushPolicy();
    config.setFlushPolicy(policy);
    List<FlushedSegment> flushed = new CopyOnWriteArrayList<>();
    final DocumentsWriter writer = new DocumentsWriter(config, flushed::add);
    final int numThreads = randomIntBetween(1, 4);
    final int docsPerThread = randomIntBetween(1500, 3000);
    try {
      final AtomicReference<Throwable> failure = new AtomicReference<>();
      Thread[] threads = new Thread[numThreads];
      for (int t = 0; t < numThreads; t++) {
        final int base = t * docsPerThread;
        threads[t] = new Thread(() -> {
          try {
            for (int i = 0; i < docsPerThread; i++) {
              writer.addDocument(newDocument(base + i));
            }
          } catch (Throwable th) {
            failure.compareAndSet(null, th);
          }
        });
        threads[t].start();
      }
      for (Thread thread : threads) {
        thread.join();
      }
      if (failure.get() != null) {
        throw new AssertionError("indexing thread failed", failure.get());
      }
      assertTrue("no writer was ever marked pending", policy.hasMarkedPending);
      assertTrue(flushed.size() > 0);

      writer.flushAllThreads();
      int total = 0;
      for (FlushedSegment segment : flushed) {
        assertTrue(segment.maxDoc() > 0);
        total += segment.maxDoc();
      }
      assertEquals(numThreads * docsPerThread, total);
      assertEquals(0, writer.flushControl.activeBytes());
      assertEquals(0, writer.flushControl.flushBytes());
    } finally {
      writer.close();
    }
  }

  @Test
  public void testLargestWriterTieKeepsCaller() throws Exception {
    IndexWriterConfig config = new IndexWriterConfig(new RecordingCodec())
        .setMaxBufferedDocs(1000)
        .setRAMBufferSizeMB(IndexWriterConfig.DISABLE_AUTO_FLUSH);
    final DocumentsWriter writer = new DocumentsWriter(config, segment -> {});
    try {
      writer.addDocument(newDocument(0));
      // 占住第一个 state, 另一线程只能新建一个
      ThreadState first = writer.perThreadPool.getAndLock();
      final AtomicReference<Throwable> failure = new AtomicReference<>();
      Thread other = new Thread(() -> {
        try {
          writer.addDocument(newDocument(1));
        } catch (Throwable th) {
          failure.set(th);
        }
      });
      other.start();
      other.join();
      if (failure.get() != null) {
        throw new AssertionError("indexing thread failed", failure.get());
      }
      assertEquals(2, writer.perThreadPool.getActiveThreadStateCount());
      ThreadState second = writer.perThreadPool.getThreadState(1);
      assertNotSame(first, second);
      second.lock();
      final long firstBytes = first.bytesUsed;
      final long secondBytes = second.bytesUsed;
      try {
        assertEquals(1, first.dwpt.getNumDocsInRAM());
        assertEquals(1, second.dwpt.getNumDocsInRAM());
        FlushPolicy policy = writer.flushPolicy;
        DocumentsWriterFlushControl control = writer.flushControl;

        first.bytesUsed = 1024;
        second.bytesUsed = 1024;
        assertSame(first, policy.findLargestNonPendingWriter(control, first));
        assertSame(second, policy.findLargestNonPendingWriter(control, second));

        second.bytesUsed = 1025;
        assertSame(second, policy.findLargestNonPendingWriter(control, first));

        second.flushPending = true;
        assertSame(first, policy.findLargestNonPendingWriter(control, first));
      } finally {
        second.flushPending = false;
        first.bytesUsed = firstBytes;
        second.bytesUsed = secondBytes;
        second.unlock();
        writer.perThreadPool.release(first);
      }
      assertTrue(writer.flushAllThreads());
      assertEquals(0, writer.getNumDocs());
    } finally {
      writer.close();
    }
  }

  static Document newDocument(int id) {
    Document doc = new Document();
    doc.add(new StringField("id", Integer.toString(id), Field.Store.YES));
    StringBuilder body = new StringBuilder();
    for (int i = 0; i < 20; i++) {
      // mostly unique terms, so the buffer keeps growing
      body.append('w').append(id).append('_').append(i).append(' ');
      body.append("common").append(i % 5).append(' ');
    }
    doc.add(new TextField("body", body.toString(), Field.Store.NO));
    return doc;
  }

  /**
   * Re-derives the decision of the default policy before running it and checks
   * the outcome: the writer marked is the largest one, and no empty writer is
   * ever marked.
   */
  static class CheckingFlushPolicy extends FlushByRamOrCountsPolicy {
    volatile boolean hasMarkedPending = false;

    @Override
    public void onInsert(DocumentsWriterFlushControl control, ThreadState state) {
      final List<ThreadState> pendingBefore = new ArrayList<>();
      final List<ThreadState> notPending = new ArrayList<>();
      findPending(control, pendingBefore, notPending);
      final ThreadState toFlush;
      if (flushOnDocCount() && state.dwpt.getNumDocsInRAM() >= indexWriterConfig.getMaxBufferedDocs()) {
        toFlush = state;
      } else if (flushOnRAM()
          && control.activeBytes() + control.getDeleteBytesUsed() >= (long) (indexWriterConfig.getRAMBufferSizeMB() * 1024. * 1024.)) {
        toFlush = findLargestNonPendingWriter(control, state);
        for (ThreadState other : notPending) {
          if (other.dwpt != null && other.dwpt.getNumDocsInRAM() > 0) {
            assertTrue(toFlush.bytesUsed >= other.bytesUsed);
          }
        }
      } else {
        toFlush = null;
      }
      super.onInsert(control, state);
      if (toFlush != null) {
        assertTrue(toFlush.flushPending);
        hasMarkedPending = true;
      }
      for (ThreadState next : notPending) {
        if (next.flushPending) {
          assertSame("only the chosen writer may become pending", toFlush, next);
          assertTrue("empty writer marked pending", next.dwpt.getNumDocsInRAM() > 0);
        }
      }
    }
  }

  static void findPending(DocumentsWriterFlushControl flushControl,
      List<ThreadState> pending, List<ThreadState> notPending) {
    Iterator<ThreadState> allActiveThreads = flushControl.allActiveThreadStates();
    while (allActiveThreads.hasNext()) {
      ThreadState next = allActiveThreads.next();
      if (next.flushPending) {
        pending.add(next);
      } else {
        notPending.add(next);
      }
    }
  }
}
