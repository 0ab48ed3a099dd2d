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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.util.ThreadInterruptedException;

import static org.junit.Assert.*;

public class TestDocumentsWriterStallControl extends RandomizedTest {

  @Test
  public void testSimpleStall() throws InterruptedException {
    DocumentsWriterStallControl ctrl = new DocumentsWriterStallControl();

    ctrl.updateStalled(false);
    Thread[] waitThreads = waitThreads(randomIntBetween(1, 3), ctrl);
    start(waitThreads);
    assertFalse(ctrl.hasBlocked());
    assertFalse(ctrl.anyStalledThreads());
    join(waitThreads);

    // now stall threads and wake them up again
    ctrl.updateStalled(true);
    waitThreads = waitThreads(randomIntBetween(1, 3), ctrl);
    start(waitThreads);
    awaitState(Thread.State.WAITING, waitThreads);
    assertTrue(ctrl.hasBlocked());
    assertTrue(ctrl.anyStalledThreads());
    ctrl.updateStalled(false);
    assertFalse(ctrl.anyStalledThreads());
    join(waitThreads);
    assertFalse(ctrl.hasBlocked());
    // sticky
    assertTrue(ctrl.wasStalled());
  }

  @Test
  public void testTwoThreadsReleasedTogether() throws InterruptedException {
    final DocumentsWriterStallControl ctrl = new DocumentsWriterStallControl();
    ctrl.updateStalled(true);
    assertFalse(ctrl.isHealthy());

    final AtomicInteger released = new AtomicInteger();
    Thread t1 = new Thread(() -> {
      ctrl.waitIfStalled();
      released.incrementAndGet();
    });
    Thread t2 = new Thread(() -> {
      ctrl.waitIfStalled();
      released.incrementAndGet();
    });
    start(new Thread[] {t1, t2});
    awaitState(Thread.State.WAITING, t1, t2);
    assertTrue(ctrl.isThreadQueued(t1));
    assertTrue(ctrl.isThreadQueued(t2));
    assertEquals(0, released.get());

    ctrl.updateStalled(false);
    join(new Thread[] {t1, t2});
    assertEquals(2, released.get());
    assertTrue(ctrl.isHealthy());
    assertFalse(ctrl.isThreadQueued(t1));
    assertTrue(ctrl.wasStalled());
  }

  @Test
  public void testRandomToggle() throws InterruptedException {
    final DocumentsWriterStallControl ctrl = new DocumentsWriterStallControl();
    final int numWaiters = randomIntBetween(1, 4);
    final int iterations = randomIntBetween(200, 400);
    final CountDownLatch start = new CountDownLatch(1);
    final AtomicReference<Throwable> failure = new AtomicReference<>();
    Thread[] threads = new Thread[numWaiters];
    for (int i = 0; i < threads.length; i++) {
      threads[i] = new Thread(() -> {
        try {
          start.await();
          for (int j = 0; j < iterations; j++) {
            ctrl.waitIfStalled();
          }
        } catch (Throwable t) {
          failure.compareAndSet(null, t);
        }
      });
      threads[i].start();
    }
    start.countDown();
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(1);
    while (System.nanoTime() < deadline) {
      ctrl.updateStalled(randomBoolean());
      Thread.yield();
    }
    ctrl.updateStalled(false);
    join(threads);
    assertNull(failure.get());
    assertFalse(ctrl.hasBlocked());
    assertTrue(ctrl.isHealthy());
  }

  @Test
  public void testInterruptWhileStalled() throws InterruptedException {
    final DocumentsWriterStallControl ctrl = new DocumentsWriterStallControl();
    ctrl.updateStalled(true);
    final AtomicReference<Throwable> thrown = new AtomicReference<>();
    Thread waiter = new Thread(() -> {
      try {
        ctrl.waitIfStalled();
      } catch (Throwable th) {
        thrown.set(th);
      }
    });
    waiter.start();
    awaitState(Thread.State.WAITING, waiter);
    assertTrue(ctrl.hasBlocked());
    assertTrue(ctrl.isThreadQueued(waiter));

    waiter.interrupt();
    join(new Thread[] {waiter});
    assertTrue(thrown.get() instanceof ThreadInterruptedException);
    assertTrue(thrown.get().getCause() instanceof InterruptedException);
    // 中断的线程已出队, 但 stall 状态不变
    assertFalse(ctrl.hasBlocked());
    assertFalse(ctrl.isThreadQueued(waiter));
    assertTrue(ctrl.anyStalledThreads());

    ctrl.updateStalled(false);
    assertTrue(ctrl.isHealthy());
  }

  private static Thread[] waitThreads(int num, final DocumentsWriterStallControl ctrl) {
    Thread[] array = new Thread[num];
    for (int i = 0; i < array.length; i++) {
      array[i] = new Thread(ctrl::waitIfStalled);
    }
    return array;
  }

  private static void start(Thread[] tostart) {
    for (Thread thread : tostart) {
      thread.start();
    }
  }

  private static void join(Thread[] toJoin) throws InterruptedException {
    for (Thread thread : toJoin) {
      thread.join(TimeUnit.SECONDS.toMillis(30));
      assertFalse("thread still alive: " + thread.getName(), thread.isAlive());
    }
  }

  /** Waits until every thread has reached the given state. */
  private static void awaitState(Thread.State state, Thread... threads) throws InterruptedException {
    for (Thread thread : threads) {
      final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
      while (thread.getState() != state) {
        assertTrue("thread " + thread.getName() + " never reached " + state, System.nanoTime() < deadline);
        Thread.sleep(1);
      }
    }
  }
}
