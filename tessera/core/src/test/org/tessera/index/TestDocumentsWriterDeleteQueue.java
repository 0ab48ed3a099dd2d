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

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.index.DocValuesUpdate.NumericDocValuesUpdate;
import org.tessera.index.DocumentsWriterDeleteQueue.DeleteSlice;
import org.tessera.search.TermQuery;
import org.tessera.util.InfoStream;

import static org.junit.Assert.*;

public class TestDocumentsWriterDeleteQueue extends RandomizedTest {

  @Test
  public void testUpdateDeleteSlices() {
    DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    final int size = randomIntBetween(200, 500);
    Integer[] ids = new Integer[size];
    for (int i = 0; i < ids.length; i++) {
      ids[i] = randomInt(1000);
    }
    DeleteSlice slice1 = queue.newSlice();
    DeleteSlice slice2 = queue.newSlice();
    BufferedUpdates bd1 = new BufferedUpdates("bd1");
    BufferedUpdates bd2 = new BufferedUpdates("bd2");
    int last1 = 0;
    int last2 = 0;
    Set<Term> uniqueValues = new HashSet<>();
    for (int j = 0; j < ids.length; j++) {
      Integer i = ids[j];
      // create an array here since we compare identity below against tailItem
      Term[] term = new Term[] {new Term("id", i.toString())};
      uniqueValues.add(term[0]);
      queue.addDelete(term);
      if (randomBoolean() || j == ids.length - 1) {
        queue.updateSlice(slice1);
        assertTrue(slice1.isTailItem(term));
        slice1.apply(bd1, j);
        assertAllBetween(last1, j, bd1, ids);
        last1 = j + 1;
      }
      if (randomBoolean() || j == ids.length - 1) {
        queue.updateSlice(slice2);
        assertTrue(slice2.isTailItem(term));
        slice2.apply(bd2, j);
        assertAllBetween(last2, j, bd2, ids);
        last2 = j + 1;
      }
      assertEquals(j + 1, queue.numGlobalTermDeletes());
    }
    assertEquals(uniqueValues, bd1.deleteTerms.keySet());
    assertEquals(uniqueValues, bd2.deleteTerms.keySet());
    HashSet<Term> frozenSet = new HashSet<>();
    for (Term t : queue.freezeGlobalBuffer(null).termsIterable()) {
      frozenSet.add(t);
    }
    assertEquals(uniqueValues, frozenSet);
    assertEquals("num deletes must be 0 after freeze", 0, queue.numGlobalTermDeletes());
  }

  private void assertAllBetween(int start, int end, BufferedUpdates deletes, Integer[] ids) {
    for (int i = start; i <= end; i++) {
      assertEquals(Integer.valueOf(end), deletes.deleteTerms.get(new Term("id", ids[i].toString())));
    }
  }

  @Test
  public void testClear() {
    DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    assertFalse(queue.anyChanges());
    queue.clear();
    assertFalse(queue.anyChanges());
    final int size = randomIntBetween(20, 200);
    for (int i = 0; i < size; i++) {
      Term term = new Term("id", "" + i);
      if (randomInt(10) == 0) {
        queue.addDelete(new TermQuery(term));
      } else {
        queue.addDelete(term);
      }
      assertTrue(queue.anyChanges());
      if (randomInt(10) == 0) {
        queue.clear();
        queue.tryApplyGlobalSlice();
        assertFalse(queue.anyChanges());
      }
    }
  }

  @Test
  public void testAnyChanges() {
    DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    final int size = randomIntBetween(20, 200);
    int termsSinceFreeze = 0;
    int queriesSinceFreeze = 0;
    for (int i = 0; i < size; i++) {
      Term term = new Term("id", "" + i);
      if (randomInt(10) == 0) {
        queue.addDelete(new TermQuery(term));
        queriesSinceFreeze++;
      } else {
        queue.addDelete(term);
        termsSinceFreeze++;
      }
      assertTrue(queue.anyChanges());
      if (randomInt(5) == 0) {
        FrozenBufferedUpdates freezeGlobalBuffer = queue.freezeGlobalBuffer(null);
        assertEquals(termsSinceFreeze, freezeGlobalBuffer.terms.length);
        assertEquals(queriesSinceFreeze, freezeGlobalBuffer.queries.length);
        queriesSinceFreeze = 0;
        termsSinceFreeze = 0;
        assertFalse(queue.anyChanges());
      }
    }
  }

  @Test
  public void testFreezeEmptyQueueReturnsNull() {
    DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT, 3);
    assertEquals(3, queue.generation);
    assertNull(queue.freezeGlobalBuffer(null));
    assertEquals(0, queue.getBufferedUpdatesTermsSize());
    assertEquals(0, queue.bytesUsed());
  }

  @Test
  public void testFreezeMovesCallerSlice() {
    DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    DeleteSlice slice = queue.newSlice();
    Term[] terms = new Term[] {new Term("id", "a")};
    queue.addDelete(terms);
    assertTrue(slice.isEmpty());
    assertEquals(1, queue.getBufferedUpdatesTermsSize());
    assertTrue(queue.bytesUsed() > 0);

    FrozenBufferedUpdates packet = queue.freezeGlobalBuffer(slice);
    assertNotNull(packet);
    assertEquals(1, packet.terms.length);
    assertTrue(slice.isTailItem(terms));
    assertFalse(slice.isEmpty());
    BufferedUpdates local = new BufferedUpdates("_0");
    slice.apply(local, 4);
    assertEquals(Integer.valueOf(4), local.deleteTerms.get(new Term("id", "a")));
    assertTrue(slice.isEmpty());
    assertEquals(0, queue.bytesUsed());
  }

  @Test
  public void testUpdateTermIsAtomicWithSlice() {
    DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    DeleteSlice slice = queue.newSlice();
    Term delTerm = new Term("id", "7");
    queue.add(delTerm, slice);
    assertTrue(slice.isTailItem(delTerm));
    BufferedUpdates local = new BufferedUpdates("_0");
    slice.apply(local, 2);
    assertEquals(Integer.valueOf(2), local.deleteTerms.get(delTerm));
    // the global buffer sees the same delete without a doc limit
    FrozenBufferedUpdates packet = queue.freezeGlobalBuffer(null);
    assertEquals(delTerm, packet.terms[0]);
  }

  @Test
  public void testDocValuesUpdateCopiedPerBuffer() {
    DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    DeleteSlice slice = queue.newSlice();
    Term term = new Term("id", "1");
    NumericDocValuesUpdate update = new NumericDocValuesUpdate(term, "price", 5L);
    queue.addDocValuesUpdates(update);
    assertTrue(queue.updateSlice(slice));
    assertFalse(queue.updateSlice(slice));

    BufferedUpdates local = new BufferedUpdates("_0");
    slice.apply(local, 3);
    NumericDocValuesUpdate buffered = local.numericUpdates.get("price").get(term);
    assertNotSame(update, buffered);
    assertEquals(3, buffered.docIDUpto);
    assertEquals(Long.valueOf(5), buffered.value);
    // the caller's instance is never stamped
    assertEquals(-1, update.docIDUpto);

    FrozenBufferedUpdates packet = queue.freezeGlobalBuffer(null);
    assertNotNull(packet);
    assertTrue(packet.any());
    assertFalse(queue.anyChanges());
  }

  @Test
  public void testPartiallyAppliedGlobalSlice() throws Exception {
    final DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    queue.globalBufferLock.lock();
    Thread t;
    try {
      t = new Thread() {
        @Override
        public void run() {
          queue.addDelete(new Term("foo", "bar"));
        }
      };
      t.start();
      t.join();
    } finally {
      queue.globalBufferLock.unlock();
    }
    assertTrue("changes in del queue but not in slice yet", queue.anyChanges());
    queue.tryApplyGlobalSlice();
    assertTrue("changes in global buffer", queue.anyChanges());
    FrozenBufferedUpdates freezeGlobalBuffer = queue.freezeGlobalBuffer(null);
    assertTrue(freezeGlobalBuffer.any());
    assertEquals(1, freezeGlobalBuffer.terms.length);
    assertFalse("all changes applied", queue.anyChanges());
  }

  @Test
  public void testStressDeleteQueue() throws InterruptedException {
    DocumentsWriterDeleteQueue queue = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    Set<Term> uniqueValues = new HashSet<>();
    final int size = randomIntBetween(500, 2000);
    Integer[] ids = new Integer[size];
    for (int i = 0; i < ids.length; i++) {
      ids[i] = randomInt(1000);
      uniqueValues.add(new Term("id", ids[i].toString()));
    }
    CountDownLatch latch = new CountDownLatch(1);
    AtomicInteger index = new AtomicInteger(0);
    final int numThreads = randomIntBetween(2, 5);
    UpdateThread[] threads = new UpdateThread[numThreads];
    for (int i = 0; i < threads.length; i++) {
      threads[i] = new UpdateThread(queue, index, ids, latch);
      threads[i].start();
    }
    latch.countDown();
    for (int i = 0; i < threads.length; i++) {
      threads[i].join();
    }

    for (UpdateThread updateThread : threads) {
      DeleteSlice slice = updateThread.slice;
      queue.updateSlice(slice);
      BufferedUpdates deletes = updateThread.deletes;
      slice.apply(deletes, BufferedUpdates.MAX_INT);
      assertEquals(uniqueValues, deletes.deleteTerms.keySet());
    }
    queue.tryApplyGlobalSlice();
    Set<Term> frozenSet = new HashSet<>();
    for (Term t : queue.freezeGlobalBuffer(null).termsIterable()) {
      frozenSet.add(t);
    }
    assertEquals("num deletes must be 0 after freeze", 0, queue.numGlobalTermDeletes());
    assertEquals(uniqueValues.size(), frozenSet.size());
    assertEquals(uniqueValues, frozenSet);
  }

  private static class UpdateThread extends Thread {
    final DocumentsWriterDeleteQueue queue;
    final AtomicInteger index;
    final Integer[] ids;
    final DeleteSlice slice;
    final BufferedUpdates deletes;
    final CountDownLatch latch;

    UpdateThread(DocumentsWriterDeleteQueue queue, AtomicInteger index, Integer[] ids, CountDownLatch latch) {
      this.queue = queue;
      this.index = index;
      this.ids = ids;
      this.slice = queue.newSlice();
      deletes = new BufferedUpdates("deletes");
      this.latch = latch;
    }

    @Override
    public void run() {
      try {
        latch.await();
      } catch (InterruptedException e) {
        throw new RuntimeException(e);
      }
      int i = 0;
      while ((i = index.getAndIncrement()) < ids.length) {
        Term term = new Term("id", ids[i].toString());
        queue.add(term, slice);
        assertTrue(slice.isTailItem(term));
        slice.apply(deletes, BufferedUpdates.MAX_INT);
      }
    }
  }
}
