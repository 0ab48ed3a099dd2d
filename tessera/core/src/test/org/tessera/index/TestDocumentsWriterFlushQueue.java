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
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.codecs.RecordingCodec;
import org.tessera.document.Document;
import org.tessera.document.Field;
import org.tessera.document.StringField;
import org.tessera.index.DocumentsWriterFlushQueue.FlushTicket;
import org.tessera.util.InfoStream;

import static org.junit.Assert.*;

public class TestDocumentsWriterFlushQueue extends RandomizedTest {

  @Test
  public void testDeletesOnlyTicket() throws IOException {
    DocumentsWriterFlushQueue tickets = new DocumentsWriterFlushQueue();
    DocumentsWriterDeleteQueue deletes = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    assertFalse("nothing to freeze", tickets.addDeletes(deletes));
    assertFalse(tickets.hasTickets());

    deletes.addDelete(new Term("id", "1"), new Term("id", "2"));
    assertTrue(tickets.addDeletes(deletes));
    assertEquals(1, tickets.getTicketCount());

    List<FlushTicket> published = new ArrayList<>();
    tickets.forcePurge(published::add);
    assertEquals(1, published.size());
    assertNull(published.get(0).getFlushedSegment());
    assertEquals(2, published.get(0).getFrozenUpdates().terms.length);
    assertFalse(tickets.hasTickets());
  }

  @Test
  public void testTicketsPublishInOrderTaken() throws IOException {
    DocumentsWriterFlushQueue tickets = new DocumentsWriterFlushQueue();
    DocumentsWriterDeleteQueue deletes = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    DocumentsWriterPerThread first = newPerThread("_0", deletes);
    DocumentsWriterPerThread second = newPerThread("_1", deletes);
    first.updateDocument(newDocument("a"), null);
    second.updateDocument(newDocument("b"), null);
    deletes.addDelete(new Term("id", "x"));

    FlushTicket firstTicket = tickets.addFlushTicket(first);
    FlushTicket secondTicket = tickets.addFlushTicket(second);
    assertEquals(2, tickets.getTicketCount());
    // the first ticket froze the pending delete, nothing was left for the second
    assertEquals(1, firstTicket.getFrozenUpdates().terms.length);
    assertNull(secondTicket.getFrozenUpdates());

    List<FlushTicket> published = new ArrayList<>();
    tickets.addSegment(secondTicket, second.flush());
    tickets.forcePurge(published::add);
    assertTrue("head is still flushing", published.isEmpty());
    assertEquals(2, tickets.getTicketCount());

    tickets.addSegment(firstTicket, first.flush());
    tickets.tryPurge(published::add);
    assertEquals(Arrays.asList(firstTicket, secondTicket), published);
    assertEquals("_0", published.get(0).getFlushedSegment().getSegmentName());
    assertEquals("_1", published.get(1).getFlushedSegment().getSegmentName());
    assertFalse(tickets.hasTickets());
  }

  @Test
  public void testFailedTicketStillPublishesDeletes() throws IOException {
    DocumentsWriterFlushQueue tickets = new DocumentsWriterFlushQueue();
    DocumentsWriterDeleteQueue deletes = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    DocumentsWriterPerThread perThread = newPerThread("_0", deletes);
    perThread.updateDocument(newDocument("a"), null);
    deletes.addDelete(new Term("id", "y"));

    FlushTicket ticket = tickets.addFlushTicket(perThread);
    List<FlushTicket> published = new ArrayList<>();
    tickets.tryPurge(published::add);
    assertTrue(published.isEmpty());

    tickets.markTicketFailed(ticket);
    tickets.forcePurge(published::add);
    assertEquals(1, published.size());
    assertNull(published.get(0).getFlushedSegment());
    assertTrue(published.get(0).getFrozenUpdates().any());
    assertEquals(0, tickets.getTicketCount());
  }

  @Test
  public void testPublishFailureStillRemovesTicket() {
    DocumentsWriterFlushQueue tickets = new DocumentsWriterFlushQueue();
    DocumentsWriterDeleteQueue deletes = new DocumentsWriterDeleteQueue(InfoStream.NO_OUTPUT);
    deletes.addDelete(new Term("id", "z"));
    assertTrue(tickets.addDeletes(deletes));
    IOException e = assertThrows(IOException.class, () -> tickets.forcePurge(t -> {
      throw new IOException("listener failed");
    }));
    assertEquals("listener failed", e.getMessage());
    assertFalse(tickets.hasTickets());
  }

  private static DocumentsWriterPerThread newPerThread(String name, DocumentsWriterDeleteQueue deletes) {
    return new DocumentsWriterPerThread(name, new RecordingCodec(), InfoStream.NO_OUTPUT, deletes,
        new FieldInfos.Builder(new FieldInfos.FieldNumbers()), new AtomicLong());
  }

  private static Document newDocument(String id) {
    Document doc = new Document();
    doc.add(new StringField("id", id, Field.Store.YES));
    return doc;
  }
}
