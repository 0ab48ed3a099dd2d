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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.document.DocumentStoredFieldVisitor;
import org.tessera.store.AlreadyClosedException;

import static org.junit.Assert.*;

public class TestBaseCompositeReader extends RandomizedTest {

  @Test
  public void testDocIdMappingWithEmptyReader() throws IOException {
    FakeLeafReader r0 = new FakeLeafReader(5);
    FakeLeafReader r1 = new FakeLeafReader(0);
    FakeLeafReader r2 = new FakeLeafReader(3);
    try (MultiReader multi = new MultiReader(r0, r1, r2)) {
      assertEquals(8, multi.maxDoc());
      assertEquals(8, multi.numDocs());

      assertEquals(0, multi.readerIndex(0));
      assertEquals(0, multi.readerIndex(4));
      assertEquals(2, multi.readerIndex(5));
      assertEquals(2, multi.readerIndex(7));
      expectIAE(() -> multi.readerIndex(8));
      expectIAE(() -> multi.readerIndex(-1));

      assertEquals(0, multi.readerBase(0));
      assertEquals(5, multi.readerBase(1));
      assertEquals(5, multi.readerBase(2));
      expectIAE(() -> multi.readerBase(3));

      ReaderSlice empty = multi.readerSlice(1);
      assertEquals(5, empty.start);
      assertEquals(0, empty.length);
      assertEquals(1, empty.readerIndex);

      multi.document(6, new DocumentStoredFieldVisitor());
      multi.getTermVectors(4);
      assertEquals(Arrays.asList(1), r2.visitedDocs);
      assertEquals(Arrays.asList(4), r0.termVectorDocs);
    }
  }

  @Test
  public void testRandomMappingIsBijection() throws IOException {
    final int numReaders = randomIntBetween(1, 10);
    final FakeLeafReader[] subs = new FakeLeafReader[numReaders];
    int total = 0;
    for (int i = 0; i < numReaders; i++) {
      subs[i] = new FakeLeafReader(randomIntBetween(0, 20));
      total += subs[i].maxDoc();
    }
    try (MultiReader multi = new MultiReader(subs)) {
      assertEquals(total, multi.maxDoc());
      int expectedReader = 0;
      int local = 0;
      for (int doc = 0; doc < total; doc++) {
        while (local == subs[expectedReader].maxDoc()) {
          expectedReader++;
          local = 0;
        }
        int idx = multi.readerIndex(doc);
        assertEquals(expectedReader, idx);
        assertEquals(local, doc - multi.readerBase(idx));
        local++;
      }
    }
  }

  @Test
  public void testStatisticsPropagateUnsupported() throws IOException {
    Term term = new Term("body", "quick");
    FakeLeafReader r0 = new FakeLeafReader(4).setDocFreq(term, 2).setSumDocFreq("body", 10);
    FakeLeafReader r1 = new FakeLeafReader(4).setDocFreq(term, 3).setSumDocFreq("body", 7);
    try (MultiReader multi = new MultiReader(r0, r1)) {
      assertEquals(5, multi.docFreq(term));
      assertEquals(5, multi.totalTermFreq(term));
      assertEquals(17, multi.getSumDocFreq("body"));
      assertEquals(8, multi.getDocCount("body"));
      assertEquals(0, multi.getSumDocFreq("missing"));
    }

    FakeLeafReader u0 = new FakeLeafReader(4).setDocFreq(term, 2).setSumDocFreq("body", 10);
    FakeLeafReader u1 = new FakeLeafReader(4).setDocFreq(term, -1).setSumDocFreq("body", -1);
    try (MultiReader multi = new MultiReader(u0, u1)) {
      assertEquals(-1, multi.docFreq(term));
      assertEquals(-1, multi.totalTermFreq(term));
      assertEquals(-1, multi.getSumDocFreq("body"));
      assertEquals(-1, multi.getSumTotalTermFreq("body"));
      assertEquals(-1, multi.getDocCount("body"));
    }
  }

  @Test
  public void testNestedContexts() throws IOException {
    FakeLeafReader a = new FakeLeafReader(2);
    FakeLeafReader b = new FakeLeafReader(3);
    FakeLeafReader c = new FakeLeafReader(4);
    MultiReader inner = new MultiReader(a, b);
    try (MultiReader outer = new MultiReader(inner, c)) {
      List<LeafReaderContext> leaves = outer.leaves();
      assertEquals(3, leaves.size());
      assertSame(a, leaves.get(0).reader());
      assertSame(c, leaves.get(2).reader());
      assertEquals(0, leaves.get(0).docBase);
      assertEquals(2, leaves.get(1).docBase);
      assertEquals(5, leaves.get(2).docBase);
      for (int i = 0; i < leaves.size(); i++) {
        assertEquals(i, leaves.get(i).ord);
      }
      assertSame(outer.getContext(), ReaderUtil.getTopLevelContext(leaves.get(1)));
      assertEquals(1, ReaderUtil.subIndex(4, leaves));

      IndexReaderContext innerContext = outer.getContext().children().get(0);
      assertFalse(innerContext.isTopLevel);
      assertThrows(UnsupportedOperationException.class, innerContext::leaves);
    }
  }

  @Test
  public void testCloseSubReadersFlag() throws IOException {
    FakeLeafReader r0 = new FakeLeafReader(1);
    FakeLeafReader r1 = new FakeLeafReader(1);
    MultiReader shared = new MultiReader(new IndexReader[] {r0, r1}, false);
    assertEquals(2, r0.getRefCount());
    shared.close();
    assertEquals(1, r0.getRefCount());
    assertEquals(1, r1.getRefCount());

    r1.failOnClose = true;
    MultiReader owning = new MultiReader(r0, r1);
    IOException e = assertThrows(IOException.class, owning::close);
    assertTrue(e.getMessage().contains("maxDoc=1"));
    assertEquals(0, r0.getRefCount());
    assertEquals(0, r1.getRefCount());
  }

  @Test
  public void testTooManyDocuments() throws IOException {
    FakeLeafReader full = new FakeLeafReader(DocumentsWriter.MAX_DOCS);
    FakeLeafReader one = new FakeLeafReader(1);
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new MultiReader(full, one));
    assertTrue(e.getMessage(), e.getMessage().contains("total maxDoc=" + ((long) DocumentsWriter.MAX_DOCS + 1)));

    FakeLeafReader half = new FakeLeafReader(DocumentsWriter.MAX_DOCS / 2 + 1);
    e = assertThrows(IllegalArgumentException.class, () -> new MultiReader(new IndexReader[] {half, half}, false));
    assertEquals(1, half.getRefCount());

    // exactly at the limit is accepted
    try (MultiReader atLimit = new MultiReader(new IndexReader[] {full, new FakeLeafReader(0)}, false)) {
      assertEquals(DocumentsWriter.MAX_DOCS, atLimit.maxDoc());
      assertEquals(DocumentsWriter.MAX_DOCS, atLimit.numDocs());
      assertEquals(0, atLimit.readerIndex(DocumentsWriter.MAX_DOCS - 1));
      assertEquals(DocumentsWriter.MAX_DOCS, atLimit.readerBase(1));
    }
    assertEquals(1, full.getRefCount());
    full.close();
    one.close();
    half.close();
  }

  @Test
  public void testClosingChildInvalidatesParent() throws IOException {
    FakeLeafReader r0 = new FakeLeafReader(3);
    FakeLeafReader r1 = new FakeLeafReader(3);
    MultiReader multi = new MultiReader(new IndexReader[] {r0, r1}, false);
    r0.decRef();
    assertEquals(1, r0.getRefCount());
    // the composite's own reference: the child is now closed under it
    r0.decRef();
    assertThrows(AlreadyClosedException.class, () -> multi.docFreq(new Term("f", "x")));
    assertThrows(AlreadyClosedException.class, () -> multi.addReaderClosedListener(reader -> {}));
    // stored fields and term vectors only translate the id and leave checks to the leaf
    multi.document(4, new DocumentStoredFieldVisitor());
    multi.getTermVectors(5);
    assertEquals(Arrays.asList(1), r1.visitedDocs);
    assertEquals(Arrays.asList(2), r1.termVectorDocs);
    r1.close();
  }

  @Test
  public void testClosedListeners() throws IOException {
    FakeLeafReader r0 = new FakeLeafReader(2);
    MultiReader multi = new MultiReader(r0);
    assertFalse(multi.hasDeletions());
    List<IndexReader> closed = new ArrayList<>();
    IndexReader.ClosedListener kept = closed::add;
    IndexReader.ClosedListener removed = reader -> fail("removed listener must not run");
    multi.addReaderClosedListener(kept);
    multi.addReaderClosedListener(removed);
    multi.removeReaderClosedListener(removed);
    r0.addReaderClosedListener(closed::add);

    multi.close();
    // the sub reader closes first, then the composite's own listeners run
    assertEquals(Arrays.asList(r0, multi), closed);
    assertThrows(AlreadyClosedException.class, () -> multi.addReaderClosedListener(kept));
  }

  private static void expectIAE(ThrowingRunnableIO r) {
    assertThrows(IllegalArgumentException.class, r::run);
  }

  @FunctionalInterface
  private interface ThrowingRunnableIO {
    void run() throws Exception;
  }
}
