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

import java.util.ArrayList;
import java.util.List;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.index.BufferedUpdatesStream.QueryAndLimit;
import org.tessera.index.DocValuesUpdate.NumericDocValuesUpdate;
import org.tessera.search.TermQuery;
import org.tessera.util.InfoStream;

import static org.junit.Assert.*;

public class TestCoalescedUpdates extends RandomizedTest {

  private static FrozenBufferedUpdates freeze(BufferedUpdates updates) {
    return new FrozenBufferedUpdates(InfoStream.NO_OUTPUT, updates, false);
  }

  @Test
  public void testTermsMergedInOrderKeepingDuplicates() {
    BufferedUpdates first = new BufferedUpdates("global");
    first.addTerm(new Term("id", "c"), 3);
    first.addTerm(new Term("id", "a"), 1);
    BufferedUpdates second = new BufferedUpdates("global");
    second.addTerm(new Term("id", "b"), 7);
    second.addTerm(new Term("id", "a"), 2);

    CoalescedUpdates coalesced = new CoalescedUpdates();
    assertFalse(coalesced.any());
    coalesced.update(freeze(first));
    coalesced.update(freeze(second));
    assertTrue(coalesced.any());

    List<String> seen = new ArrayList<>();
    for (Term term : coalesced.termsIterable()) {
      seen.add(term.text());
    }
    assertEquals(List.of("a", "a", "b", "c"), seen);

    // iterable may be replayed
    int count = 0;
    for (Term term : coalesced.termsIterable()) {
      assertNotNull(term);
      count++;
    }
    assertEquals(4, count);
  }

  @Test
  public void testQueriesLoseTheirDocLimit() {
    TermQuery query = new TermQuery(new Term("body", "x"));
    BufferedUpdates first = new BufferedUpdates("global");
    first.addQuery(query, 5);
    BufferedUpdates second = new BufferedUpdates("global");
    second.addQuery(new TermQuery(new Term("body", "x")), 9);

    FrozenBufferedUpdates frozen = freeze(first);
    QueryAndLimit original = frozen.queriesIterable().iterator().next();
    assertEquals(5, original.limit);

    CoalescedUpdates coalesced = new CoalescedUpdates();
    coalesced.update(frozen);
    coalesced.update(freeze(second));

    int count = 0;
    for (QueryAndLimit ent : coalesced.queriesIterable()) {
      assertEquals(query, ent.query);
      assertEquals(Integer.MAX_VALUE, ent.limit);
      count++;
    }
    // equal queries collapse
    assertEquals(1, count);
  }

  @Test
  public void testDocValuesUpdatesApplyToAllDocs() {
    BufferedUpdates updates = new BufferedUpdates("global");
    updates.addNumericUpdate(new NumericDocValuesUpdate(new Term("id", "1"), "price", 42L), 3);

    CoalescedUpdates coalesced = new CoalescedUpdates();
    coalesced.update(freeze(updates));
    assertEquals(1, coalesced.numericDVUpdates.size());
    NumericDocValuesUpdate update = coalesced.numericDVUpdates.get(0);
    assertEquals(Integer.MAX_VALUE, update.docIDUpto);
    assertEquals(42L, update.value);
    assertTrue(coalesced.binaryDVUpdates.isEmpty());
  }

  @Test
  public void testStreamCoalescesOnlyNewerGlobalPackets() {
    BufferedUpdatesStream stream = new BufferedUpdatesStream(InfoStream.NO_OUTPUT);
    assertFalse(stream.any());

    BufferedUpdates older = new BufferedUpdates("global");
    older.addTerm(new Term("id", "old"), 1);
    long olderGen = stream.push(freeze(older));

    BufferedUpdates segmentPrivate = new BufferedUpdates("_0");
    segmentPrivate.addQuery(new TermQuery(new Term("id", "private")), 1);
    long privateGen = stream.push(new FrozenBufferedUpdates(InfoStream.NO_OUTPUT, segmentPrivate, true));

    BufferedUpdates newer = new BufferedUpdates("global");
    newer.addTerm(new Term("id", "new"), 1);
    long newerGen = stream.push(freeze(newer));

    assertTrue(olderGen < privateGen);
    assertTrue(privateGen < newerGen);
    assertEquals(2, stream.numTerms());
    assertEquals(3, stream.getPacketCount());

    CoalescedUpdates coalesced = stream.coalesce(olderGen);
    List<String> seen = new ArrayList<>();
    for (Term term : coalesced.termsIterable()) {
      seen.add(term.text());
    }
    assertEquals(List.of("new"), seen);
    assertTrue(coalesced.queries.isEmpty());

    stream.prune(newerGen);
    assertEquals(1, stream.getPacketCount());
    assertEquals(1, stream.numTerms());
    assertTrue(stream.any());
    stream.prune(newerGen + 1);
    assertFalse(stream.any());
    assertEquals(0, stream.numTerms());
  }
}
