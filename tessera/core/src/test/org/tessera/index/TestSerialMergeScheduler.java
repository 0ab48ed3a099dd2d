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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.util.InfoStream;

import static org.junit.Assert.*;

public class TestSerialMergeScheduler extends RandomizedTest {

  private static FlushedSegment segment(String name, int maxDoc) {
    return new FlushedSegment(InfoStream.NO_OUTPUT, name, maxDoc, FieldInfos.EMPTY, null, null, 0);
  }

  /** Hands out queued merges and records what happened to them. */
  private static class QueueMergeSource implements MergeScheduler.MergeSource {
    final Deque<OneMerge> pending = new ArrayDeque<>();
    final List<OneMerge> merged = new ArrayList<>();
    final List<OneMerge> finished = new ArrayList<>();
    String failOn;

    @Override
    public synchronized OneMerge getNextMerge() {
      return pending.poll();
    }

    @Override
    public synchronized void onMergeFinished(OneMerge merge) {
      finished.add(merge);
    }

    @Override
    public synchronized boolean hasPendingMerges() {
      return pending.isEmpty() == false;
    }

    @Override
    public void merge(OneMerge merge) throws IOException {
      if (merge.segString().equals(failOn)) {
        throw new IOException("fake merge failure");
      }
      merged.add(merge);
    }
  }

  @Test
  public void testRunsMergesInOrder() throws IOException {
    QueueMergeSource source = new QueueMergeSource();
    OneMerge first = new OneMerge(List.of(segment("_0", 3), segment("_1", 4)));
    OneMerge second = new OneMerge(List.of(segment("_2", 5)));
    source.pending.add(first);
    source.pending.add(second);
    assertEquals(7, first.totalMaxDoc);
    assertEquals(-1, first.getMergeStartNS());

    SerialMergeScheduler scheduler = new SerialMergeScheduler();
    scheduler.initialize(InfoStream.NO_OUTPUT);
    scheduler.merge(source, MergeTrigger.EXPLICIT);
    scheduler.close();

    assertEquals(List.of(first, second), source.merged);
    assertEquals(List.of(first, second), source.finished);
    assertFalse(source.hasPendingMerges());
    assertNull(first.getException());
    assertTrue(first.getMergeStartNS() != -1);
  }

  @Test
  public void testFailedMergeIsRecordedAndRethrown() {
    QueueMergeSource source = new QueueMergeSource();
    OneMerge bad = new OneMerge(List.of(segment("_0", 1), segment("_1", 1)));
    OneMerge after = new OneMerge(List.of(segment("_2", 1)));
    source.pending.add(bad);
    source.pending.add(after);
    source.failOn = "_0 _1";

    SerialMergeScheduler scheduler = new SerialMergeScheduler();
    scheduler.initialize(InfoStream.NO_OUTPUT);
    IOException expected = assertThrows(IOException.class, () -> scheduler.merge(source, MergeTrigger.SEGMENT_FLUSH));
    assertSame(expected, bad.getException());
    assertEquals(List.of(bad), source.finished);
    assertTrue(source.merged.isEmpty());
    // the remaining merge stays queued
    assertTrue(source.hasPendingMerges());
  }

  @Test
  public void testNoMergeSchedulerIgnoresMerges() throws IOException {
    QueueMergeSource source = new QueueMergeSource();
    source.pending.add(new OneMerge(List.of(segment("_0", 1))));
    NoMergeScheduler scheduler = new NoMergeScheduler();
    scheduler.merge(source, MergeTrigger.FULL_FLUSH);
    scheduler.close();
    assertTrue(source.hasPendingMerges());
    assertTrue(source.merged.isEmpty());
    assertEquals("NoMergeScheduler", scheduler.toString());
  }

  @Test
  public void testOneMerge() {
    assertThrows(IllegalArgumentException.class, () -> new OneMerge(Collections.<FlushedSegment>emptyList()));
    OneMerge merge = new OneMerge(List.of(segment("_a", 2), segment("_b", 3)));
    assertFalse(merge.isAborted());
    merge.setAborted();
    assertTrue(merge.isAborted());
    assertEquals("_a _b [ABORTED]", merge.segString());
    assertEquals("OneMerge(_a _b [ABORTED] totalMaxDoc=5)", merge.toString());
    assertThrows(UnsupportedOperationException.class, () -> merge.segments.clear());
  }
}
