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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.analysis.CannedTokenStream;
import org.tessera.analysis.CannedTokenStream.Token;
import org.tessera.codecs.RecordingCodec;
import org.tessera.codecs.RecordingCodec.Posting;
import org.tessera.document.BinaryDocValuesField;
import org.tessera.document.Document;
import org.tessera.document.Field;
import org.tessera.document.NumericDocValuesField;
import org.tessera.document.StoredField;
import org.tessera.document.StringField;
import org.tessera.document.TextField;
import org.tessera.search.TermQuery;
import org.tessera.store.AlreadyClosedException;
import org.tessera.util.BytesRef;

import static org.junit.Assert.*;

public class TestDocumentsWriter extends RandomizedTest {

  private static Document doc(String id, String body) {
    Document doc = new Document();
    doc.add(new StringField("id", id, Field.Store.YES));
    if (body != null) {
      doc.add(new TextField("body", body, Field.Store.NO));
    }
    return doc;
  }

  @Test
  public void testFlushWritesEveryStage() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      Document d0 = doc("0", "quick brown quick");
      d0.add(new NumericDocValuesField("price", 10));
      d0.add(new BinaryDocValuesField("blob", new BytesRef("a")));
      writer.addDocument(d0);

      Document d1 = doc("1", "brown fox");
      d1.add(new BinaryDocValuesField("blob", new BytesRef("b")));
      d1.add(new StoredField("note", 42L));
      writer.addDocument(d1);

      Document d2 = doc("2", "fox");
      d2.add(new NumericDocValuesField("price", 7));
      writer.addDocument(d2);

      assertEquals(3, writer.getNumDocs());
      assertTrue(writer.anyChanges());
      assertTrue(writer.ramBytesUsed() > 0);
      // stored fields go straight to the codec, the rest waits for the flush
      assertEquals(3, codec.segment("_0").storedDocs.size());
      assertEquals(-1, codec.segment("_0").storedNumDocs);
      assertNull(codec.segment("_0").norms.get("body"));

      assertEquals(1, writer.perThreadPool.getActiveThreadStateCount());
      DocumentsWriterPerThreadPool.ThreadState state = writer.perThreadPool.getThreadState(0);
      state.lock();
      try {
        assertFalse(state.isFlushPending());
        assertEquals(3, state.getDocumentsWriterPerThread().getNumDocsInRAM());
        assertTrue(state.getBytesUsedPerThread() > 0);
      } finally {
        state.unlock();
      }

      assertTrue(writer.flushAllThreads());
      assertEquals(0, writer.flushControl.numFlushingDWPT());
      assertEquals(0, writer.flushControl.numBlockedFlushes());
      assertEquals(0, writer.getNumDocs());
      assertEquals(3, writer.getPendingNumDocs());
      assertFalse(writer.anyChanges());
    } finally {
      writer.close();
    }

    assertEquals(1, flushed.size());
    FlushedSegment segment = flushed.get(0);
    assertEquals("_0", segment.getSegmentName());
    assertEquals(3, segment.maxDoc());
    assertNull(segment.getLiveDocs());
    assertEquals(0, segment.getDelCount());
    assertFalse(segment.hasSegmentUpdates());
    assertTrue(segment.getDelGen() > 0);
    assertEquals(DocValuesType.NUMERIC, segment.getFieldInfos().fieldInfo("price").getDocValuesType());
    assertEquals(DocValuesType.BINARY, segment.getFieldInfos().fieldInfo("blob").getDocValuesType());
    assertEquals(IndexOptions.DOCS, segment.getFieldInfos().fieldInfo("id").getIndexOptions());

    RecordingCodec.SegmentRecord record = codec.segment("_0");
    assertTrue(record.fieldsClosed);
    assertEquals(Arrays.asList(0), record.docs("body", "quick"));
    assertEquals(Arrays.asList(0, 1), record.docs("body", "brown"));
    assertEquals(Arrays.asList(1, 2), record.docs("body", "fox"));
    assertEquals(Arrays.asList(1), record.docs("id", "1"));

    Posting quick = record.postings.get("body").get("quick").get(0);
    assertEquals(2, quick.freq);
    assertEquals(Arrays.asList(0, 2), quick.positions);
    Posting brownInOne = record.postings.get("body").get("brown").get(1);
    assertEquals(Arrays.asList(0), brownInOne.positions);
    // docs only: no freqs
    assertEquals(-1, record.postings.get("id").get("0").get(0).freq);
    assertEquals(Integer.valueOf(3), record.docCounts.get("body"));

    assertEquals(Arrays.<Number>asList(10L, null, 7L), record.numericValues.get("price"));
    List<BytesRef> blobs = record.binaryValues.get("blob");
    assertEquals(3, blobs.size());
    assertEquals("a", blobs.get(0).utf8ToString());
    assertEquals("b", blobs.get(1).utf8ToString());
    assertNull(blobs.get(2));

    assertEquals(Arrays.<Number>asList(3L, 2L, 1L), record.norms.get("body"));
    assertFalse("string fields omit norms", record.norms.containsKey("id"));

    assertEquals(3, record.storedNumDocs);
    assertEquals(Arrays.asList(
        Arrays.asList("id=0"), Arrays.asList("id=1", "note=42"), Arrays.asList("id=2")), record.storedDocs);
    assertEquals(IndexOptions.NONE, segment.getFieldInfos().fieldInfo("note").getIndexOptions());
    assertFalse(record.storedAborted);
  }

  @Test
  public void testPayloadsAndOverlappingTokens() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      Document doc = new Document();
      doc.add(new TextField("body", new CannedTokenStream(
          new Token("a", 1, 0, 1, new BytesRef("p1")),
          new Token("b", 0, 0, 1, null),
          new Token("c", 1, 2, 3, null))));
      writer.addDocument(doc);
      writer.flushAllThreads();
    } finally {
      writer.close();
    }
    RecordingCodec.SegmentRecord record = codec.segment("_0");
    Posting a = record.postings.get("body").get("a").get(0);
    assertEquals(Arrays.asList(0), a.positions);
    assertEquals(Arrays.asList("p1"), a.payloads);
    Posting b = record.postings.get("body").get("b").get(0);
    assertEquals(Arrays.asList(0), b.positions);
    assertEquals(Arrays.asList((String) null), b.payloads);
    assertEquals(Arrays.asList(1), record.postings.get("body").get("c").get(0).positions);
    // three tokens, one of them stacked
    assertEquals(Arrays.<Number>asList(2L), record.norms.get("body"));
    assertTrue(flushed.get(0).getFieldInfos().fieldInfo("body").hasPayloads());
  }

  @Test
  public void testUpdateDeletesOlderBufferedDocument() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      writer.addDocument(doc("0", "x"));
      writer.addDocument(doc("1", "y"));
      writer.addDocument(doc("2", "z"));
      writer.updateDocument(doc("1", "y2"), new Term("id", "1"));
      assertEquals(4, writer.getNumDocs());
      writer.flushAllThreads();

      assertEquals(1, flushed.size());
      FlushedSegment segment = flushed.get(0);
      assertEquals(4, segment.maxDoc());
      assertEquals(1, segment.getDelCount());
      assertTrue(segment.getLiveDocs().get(0));
      assertFalse(segment.getLiveDocs().get(1));
      assertTrue(segment.getLiveDocs().get(2));
      assertTrue(segment.getLiveDocs().get(3));
      // the term delete was resolved while flushing
      assertFalse(segment.hasSegmentUpdates());
      // deleted documents are still written
      assertEquals(Arrays.asList(1, 3), codec.segment("_0").docs("id", "1"));

      // the global packet was pushed before the segment and does not apply to it
      BufferedUpdatesStream stream = writer.getBufferedUpdatesStream();
      assertEquals(1, stream.numTerms());
      assertFalse(stream.coalesce(segment.getDelGen()).any());
      assertTrue(stream.coalesce(0).any());
    } finally {
      writer.close();
    }
  }

  @Test
  public void testDeleteAppliesOnlyToEarlierSegments() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      writer.addDocument(doc("0", null));
      writer.addDocument(doc("1", null));
      writer.flushAllThreads();

      assertFalse(writer.deleteTerms(new Term("id", "0")));
      assertTrue(writer.anyChanges());
      assertTrue(writer.anyDeletions());
      assertEquals(1, writer.getNumBufferedDeleteTerms());
      assertEquals(1, writer.getBufferedDeleteTermsSize());

      writer.addDocument(doc("2", null));
      writer.flushAllThreads();
      assertFalse(writer.anyDeletions());

      assertEquals(2, flushed.size());
      FlushedSegment first = flushed.get(0);
      FlushedSegment second = flushed.get(1);
      assertTrue(first.getDelGen() < second.getDelGen());
      // the second segment was buffered after the delete
      assertNull(second.getLiveDocs());

      BufferedUpdatesStream stream = writer.getBufferedUpdatesStream();
      List<Term> forFirst = new ArrayList<>();
      for (Term term : stream.coalesce(first.getDelGen()).termsIterable()) {
        forFirst.add(term);
      }
      assertEquals(Arrays.asList(new Term("id", "0")), forFirst);
      assertFalse(stream.coalesce(second.getDelGen()).any());
    } finally {
      writer.close();
    }
  }

  @Test
  public void testDeletesWithoutDocumentsArePublished() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      writer.deleteQueries(new TermQuery(new Term("id", "7")));
      assertTrue(writer.anyChanges());
      assertFalse(writer.flushAllThreads());
      assertTrue(flushed.isEmpty());
      assertFalse(writer.anyChanges());
      BufferedUpdatesStream stream = writer.getBufferedUpdatesStream();
      assertTrue(stream.any());
      assertEquals(1, stream.coalesce(0).queries.size());
    } finally {
      writer.close();
    }
    assertEquals(0, codec.numSegments());
  }

  @Test
  public void testDeleteQueryStaysWithSegment() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      writer.addDocument(doc("0", null));
      writer.deleteQueries(new TermQuery(new Term("id", "0")));
      writer.addDocument(doc("1", null));
      writer.flushAllThreads();

      FlushedSegment segment = flushed.get(0);
      // queries are resolved against the flushed segment later on
      assertTrue(segment.hasSegmentUpdates());
      assertNull(segment.getLiveDocs());
      FrozenBufferedUpdates updates = segment.segmentUpdates;
      assertTrue(updates.isSegmentPrivate);
      assertEquals(segment.getDelGen(), updates.delGen());
      assertEquals(1, updates.queries.length);
      assertEquals(1, updates.queryLimits[0]);
      assertEquals(new Term("id", "0"), ((TermQuery) updates.queries[0]).getTerm());
      assertEquals("id:0", updates.queries[0].toString());
      // segment private packets are never coalesced for older segments
      assertEquals(1, writer.getBufferedUpdatesStream().coalesce(0).queries.size());
    } finally {
      writer.close();
    }
  }

  @Test
  public void testDocValuesUpdatesNeedAnExistingField() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      IllegalArgumentException expected = assertThrows(IllegalArgumentException.class,
          () -> writer.updateNumericDocValue(new Term("id", "0"), "price", 5));
      assertEquals("can only update existing numeric-docvalues fields!", expected.getMessage());

      Document doc = doc("0", null);
      doc.add(new NumericDocValuesField("price", 1));
      writer.addDocument(doc);

      assertThrows(IllegalArgumentException.class,
          () -> writer.updateBinaryDocValue(new Term("id", "0"), "price", new BytesRef("x")));
      assertThrows(IllegalArgumentException.class,
          () -> writer.updateBinaryDocValue(new Term("id", "0"), "price", null));

      assertFalse(writer.updateNumericDocValue(new Term("id", "0"), "price", 5));
      assertTrue(writer.anyDeletions());
      writer.flushAllThreads();

      FlushedSegment segment = flushed.get(0);
      assertTrue(segment.hasSegmentUpdates());
      assertEquals(1, segment.segmentUpdates.numericDVUpdates.length);
      assertEquals(5L, segment.segmentUpdates.numericDVUpdates[0].value);
    } finally {
      writer.close();
    }
  }

  @Test
  public void testAnalysisFailureOnlyDeletesTheDocument() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      writer.addDocument(doc("0", "a"));

      Document bad = doc("1", null);
      bad.add(new TextField("body", new CannedTokenStream(
          new Token("a", 0, 1), new Token("b", 2, 3)).failAfter(1)));
      IOException expected = assertThrows(IOException.class, () -> writer.addDocument(bad));
      assertTrue(expected.getMessage().contains("fake analysis failure"));

      writer.addDocument(doc("2", "a"));
      // the failed document still holds its doc id
      assertEquals(3, writer.getNumDocs());
      assertEquals(3, writer.getPendingNumDocs());
      writer.flushAllThreads();
    } finally {
      writer.close();
    }

    FlushedSegment segment = flushed.get(0);
    assertEquals(3, segment.maxDoc());
    assertEquals(1, segment.getDelCount());
    assertFalse(segment.getLiveDocs().get(1));
    assertTrue(segment.getLiveDocs().get(2));
    RecordingCodec.SegmentRecord record = codec.segment("_0");
    assertEquals(3, record.storedNumDocs);
    assertEquals(Arrays.asList("id=1"), record.storedDocs.get(1));
    assertFalse(record.storedAborted);
  }

  @Test
  public void testAbortingFailureDiscardsBufferedDocuments() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      writer.addDocument(doc("0", "a"));
      writer.addDocument(doc("1", "b"));
      codec.setFailStoredFields(true);
      IOException expected = assertThrows(IOException.class, () -> writer.addDocument(doc("2", "c")));
      assertEquals("fake stored fields failure", expected.getMessage());
      codec.setFailStoredFields(false);

      assertEquals(0, writer.getNumDocs());
      assertEquals(0, writer.getPendingNumDocs());
      assertTrue(codec.segment("_0").storedAborted);

      // the writer keeps going with a fresh buffer
      writer.addDocument(doc("3", "d"));
      assertTrue(writer.flushAllThreads());
    } finally {
      writer.close();
    }
    assertEquals(1, flushed.size());
    assertEquals("_1", flushed.get(0).getSegmentName());
    assertEquals(1, flushed.get(0).maxDoc());
    assertEquals(Arrays.asList(0), codec.segment("_1").docs("id", "3"));
  }

  @Test
  public void testAbort() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    try {
      for (int i = 0; i < 10; i++) {
        writer.addDocument(doc(Integer.toString(i), "body " + i));
      }
      writer.deleteTerms(new Term("id", "3"));
      assertTrue(writer.anyChanges());

      writer.abort();
      assertEquals(0, writer.getNumDocs());
      assertEquals(0, writer.getPendingNumDocs());
      assertFalse(writer.anyChanges());
      assertEquals(0, writer.flushControl.activeBytes());
      assertTrue(codec.segment("_0").storedAborted);

      assertFalse(writer.flushAllThreads());
      assertTrue(flushed.isEmpty());
      assertFalse(writer.getBufferedUpdatesStream().any());

      writer.addDocument(doc("10", null));
      writer.flushAllThreads();
      assertEquals(1, flushed.size());
      assertEquals(1, flushed.get(0).maxDoc());
      assertEquals(1, writer.getPendingNumDocs());
    } finally {
      writer.close();
    }
  }

  @Test
  public void testMaxDocsLimit() throws IOException {
    DocumentsWriter.setMaxDocs(3);
    try {
      RecordingCodec codec = new RecordingCodec();
      List<FlushedSegment> flushed = new ArrayList<>();
      DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
      try {
        for (int i = 0; i < 3; i++) {
          writer.addDocument(doc(Integer.toString(i), null));
        }
        IllegalArgumentException expected = assertThrows(IllegalArgumentException.class,
            () -> writer.addDocument(doc("3", null)));
        assertEquals("number of documents in the index cannot exceed 3", expected.getMessage());
        assertEquals(3, writer.getNumDocs());
        assertEquals(3, writer.getPendingNumDocs());

        writer.flushAllThreads();
        assertEquals(3, flushed.get(0).maxDoc());
        // flushed documents still count
        assertThrows(IllegalArgumentException.class, () -> writer.addDocument(doc("4", null)));
      } finally {
        writer.close();
      }
    } finally {
      DocumentsWriter.setMaxDocs(DocumentsWriter.MAX_DOCS);
    }
    assertThrows(IllegalArgumentException.class, () -> DocumentsWriter.setMaxDocs(DocumentsWriter.MAX_DOCS + 1));
  }

  @Test
  public void testClose() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    List<FlushedSegment> flushed = new ArrayList<>();
    DocumentsWriter writer = new DocumentsWriter(new IndexWriterConfig(codec), flushed::add);
    writer.addDocument(doc("0", "a"));
    writer.close();
    // close flushes what is still buffered
    assertEquals(1, flushed.size());
    writer.close();
    assertEquals(1, flushed.size());

    assertThrows(AlreadyClosedException.class, () -> writer.addDocument(doc("1", "b")));
    assertThrows(AlreadyClosedException.class, () -> writer.deleteTerms(new Term("id", "0")));
    assertThrows(IllegalArgumentException.class, () -> new DocumentsWriter(new IndexWriterConfig(codec), null));
  }

  @Test
  public void testMergesRunAfterFlushes() throws IOException {
    RecordingCodec codec = new RecordingCodec();
    final List<FlushedSegment> unmerged = new ArrayList<>();
    final List<OneMerge> merged = new ArrayList<>();
    final List<MergeTrigger> triggers = new ArrayList<>();
    MergeScheduler.MergeSource source = new MergeScheduler.MergeSource() {
      @Override
      public synchronized OneMerge getNextMerge() {
        if (unmerged.size() < 2) {
          return null;
        }
        List<FlushedSegment> pair = new ArrayList<>(unmerged.subList(0, 2));
        unmerged.subList(0, 2).clear();
        return new OneMerge(pair);
      }

      @Override
      public void onMergeFinished(OneMerge merge) {
        assertTrue(merge.getMergeStartNS() != -1);
      }

      @Override
      public synchronized boolean hasPendingMerges() {
        return unmerged.size() >= 2;
      }

      @Override
      public void merge(OneMerge merge) {
        merged.add(merge);
      }
    };
    IndexWriterConfig config = new IndexWriterConfig(codec)
        .setMaxBufferedDocs(2)
        .setMergeScheduler(new SerialMergeScheduler() {
          @Override
          public synchronized void merge(MergeSource mergeSource, MergeTrigger trigger) throws IOException {
            triggers.add(trigger);
            super.merge(mergeSource, trigger);
          }
        });
    DocumentsWriter writer = new DocumentsWriter(config, segment -> {
      synchronized (source) {
        unmerged.add(segment);
      }
    }, source);
    for (int i = 0; i < 6; i++) {
      writer.addDocument(doc(Integer.toString(i), null));
    }
    writer.close();

    assertEquals(1, merged.size());
    assertEquals(4, merged.get(0).totalMaxDoc);
    assertEquals("_0 _1", merged.get(0).segString());
    assertEquals(1, unmerged.size());
    assertEquals(Arrays.asList(MergeTrigger.SEGMENT_FLUSH, MergeTrigger.SEGMENT_FLUSH,
        MergeTrigger.SEGMENT_FLUSH, MergeTrigger.CLOSING), triggers);
  }

  @Test
  public void testConcurrentIndexing() throws Exception {
    RecordingCodec codec = new RecordingCodec();
    IndexWriterConfig config = new IndexWriterConfig(codec)
        .setMaxBufferedDocs(randomIntBetween(2, 50));
    if (randomBoolean()) {
      config.setRAMBufferSizeMB(0.1 + randomDouble());
    }
    final List<FlushedSegment> flushed = new CopyOnWriteArrayList<>();
    final AtomicBoolean inListener = new AtomicBoolean();
    final AtomicReference<Throwable> listenerFailure = new AtomicReference<>();
    final DocumentsWriter writer = new DocumentsWriter(config, segment -> {
      if (inListener.getAndSet(true)) {
        listenerFailure.compareAndSet(null, new AssertionError("listener called concurrently"));
      }
      if (flushed.isEmpty() == false && flushed.get(flushed.size() - 1).getDelGen() >= segment.getDelGen()) {
        listenerFailure.compareAndSet(null, new AssertionError("segments published out of order: " + segment));
      }
      flushed.add(segment);
      inListener.set(false);
    });

    final int numThreads = randomIntBetween(2, 6);
    final int docsPerThread = randomIntBetween(100, 500);
    final AtomicInteger added = new AtomicInteger();
    final AtomicReference<Throwable> failure = new AtomicReference<>();
    Thread[] threads = new Thread[numThreads];
    try {
      for (int t = 0; t < numThreads; t++) {
        final int base = t * docsPerThread;
        threads[t] = new Thread(() -> {
          try {
            for (int i = 0; i < docsPerThread; i++) {
              String id = Integer.toString(base + i);
              if (i > 0 && i % 10 == 0) {
                writer.updateDocument(doc(id, "updated " + id), new Term("id", Integer.toString(base + i - 1)));
              } else {
                writer.addDocument(TestFlushByRamOrCountsPolicy.newDocument(base + i));
              }
              added.incrementAndGet();
              if (i % 97 == 0) {
                writer.deleteTerms(new Term("id", "missing" + i));
              }
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
      writer.flushAllThreads();
    } finally {
      writer.close();
    }
    if (listenerFailure.get() != null) {
      throw new AssertionError(listenerFailure.get());
    }

    int total = 0;
    for (FlushedSegment segment : flushed) {
      assertTrue(segment.maxDoc() > 0);
      total += segment.maxDoc();
    }
    assertEquals(numThreads * docsPerThread, added.get());
    assertEquals(added.get(), total);
    assertEquals(total, writer.getPendingNumDocs());
    assertEquals(0, writer.getNumDocs());
  }
}
