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

import java.util.IdentityHashMap;
import java.util.Map;

import org.tessera.util.ThreadInterruptedException;

/**
 * Controls the health status of a {@link DocumentsWriter} sessions. This class
 * used to block incoming indexing threads if flushing significantly slower than
 * indexing to ensure the {@link DocumentsWriter}s healthiness. If flushing is
 * significantly slower than indexing the net memory used within a
 * {@link DocumentsWriter} session can increase very quickly and easily exceed the
 * JVM's available memory.
 * <p>
 * To prevent OOM Errors and ensure the writer's stability this class blocks
 * incoming threads from indexing once the bytes pending flush plus the active
 * bytes exceed twice the RAM buffer. Once flushing catches up threads are
 * released and can continue indexing.
 * 暂停控制器: 刷盘跟不上写入时阻塞写线程
 */
final class DocumentsWriterStallControl {

  private volatile boolean stalled;
  /**
   * 当前有多少线程在等待
   */
  private int numWaiting;

  private boolean wasStalled;
  /**
   * 记录当前正在等待的线程, 只用于测试和诊断
   */
  private final Map<Thread, Boolean> waiting = new IdentityHashMap<>();

  /**
   * Update the stalled flag status. Every change of the flag wakes up all
   * threads waiting in {@link #waitIfStalled()}, so that they re-check the
   * state of the writer rather than wait on a latched condition.
   */
  synchronized void updateStalled(boolean stalled) {
    if (this.stalled != stalled) {
      this.stalled = stalled;
      if (stalled) {
        wasStalled = true;
      }
      notifyAll();
    }
  }

  /**
   * Blocks if documents writing is currently in a stalled state. Waits for a
   * single wake up and returns; the caller re-checks and calls again if the
   * writer is still stalled.
   */
  void waitIfStalled() {
    if (stalled) {
      synchronized (this) {
        if (stalled) { // react on the first wakeup call!
          // don't loop here, higher level logic will re-stall!
          try {
            incWaiters();
            wait();
          } catch (InterruptedException e) {
            throw new ThreadInterruptedException(e);
          } finally {
            decrWaiters();
          }
        }
      }
    }
  }

  boolean anyStalledThreads() {
    return stalled;
  }

  private void incWaiters() {
    numWaiting++;
    Boolean previous = waiting.put(Thread.currentThread(), Boolean.TRUE);
    assert previous == null;
    assert numWaiting > 0;
  }

  private void decrWaiters() {
    numWaiting--;
    Boolean previous = waiting.remove(Thread.currentThread());
    assert previous != null;
    assert numWaiting >= 0;
  }

  synchronized boolean hasBlocked() { // for tests
    return numWaiting > 0;
  }

  boolean isHealthy() { // for tests
    return !stalled; // volatile read!
  }

  synchronized boolean isThreadQueued(Thread t) { // for tests
    return waiting.containsKey(t);
  }

  synchronized boolean wasStalled() { // for tests
    return wasStalled;
  }
}
