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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestFieldInvertState extends RandomizedTest {

  private static FieldInvertState newState() {
    FieldInvertState state = new FieldInvertState("body", IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS);
    state.reset();
    return state;
  }

  @Test
  public void testMultiValuedFieldCarriesPositionsAndOffsets() {
    FieldInvertState state = newState();
    // "a b" then "c"
    state.addToken(1, 0, 1);
    state.addToken(1, 2, 3);
    state.endValue(0, 3);
    assertEquals(1, state.position);
    assertEquals(3, state.offset);

    state.addToken(1, 0, 1);
    assertEquals(2, state.position);
    assertEquals(3, state.lastStartOffset);
    assertEquals(3, state.length);
    assertEquals(3, state.normValue());
  }

  @Test
  public void testStackedTokensDoNotCountTowardsNorm() {
    FieldInvertState state = newState();
    final int stacked = randomIntBetween(1, 5);
    state.addToken(1, 0, 4);
    for (int i = 0; i < stacked; i++) {
      state.addToken(0, 0, 4);
    }
    assertEquals(0, state.position);
    assertEquals(stacked + 1, state.length);
    assertEquals(stacked, state.numOverlap);
    assertEquals(1, state.normValue());
  }

  @Test
  public void testEmptyFieldHasZeroNorm() {
    FieldInvertState state = newState();
    state.endValue(0, 0);
    assertEquals(0, state.normValue());
  }

  @Test
  public void testInvalidTokens() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> newState().addToken(0, 0, 1));
    assertTrue(e.getMessage().contains("first position increment must be > 0"));

    FieldInvertState state = newState();
    state.addToken(3, 0, 1);
    e = assertThrows(IllegalArgumentException.class, () -> state.addToken(-1, 2, 3));
    assertTrue(e.getMessage().contains("position increment must be >= 0"));

    FieldInvertState offsets = newState();
    offsets.addToken(1, 5, 6);
    e = assertThrows(IllegalArgumentException.class, () -> offsets.addToken(1, 4, 6));
    assertTrue(e.getMessage().contains("offsets must not go backwards"));
    e = assertThrows(IllegalArgumentException.class, () -> newState().addToken(1, 3, 2));
    assertTrue(e.getMessage().contains("endOffset must be >= startOffset"));

    FieldInvertState far = newState();
    e = assertThrows(IllegalArgumentException.class, () -> far.addToken(DocumentsWriterPerThread.MAX_POSITION + 2, 0, 1));
    assertTrue(e.getMessage().contains("is too large for field 'body'"));
  }
}
