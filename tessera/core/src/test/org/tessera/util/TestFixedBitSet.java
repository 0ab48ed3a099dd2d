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
package org.tessera.util;

import java.util.BitSet;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestFixedBitSet extends RandomizedTest {

  @Test
  public void testSetRangeAgainstBitSet() {
    final int numBits = randomIntBetween(1, 300);
    FixedBitSet bits = new FixedBitSet(numBits);
    BitSet expected = new BitSet(numBits);
    final int iters = randomIntBetween(20, 40);
    for (int i = 0; i < iters; i++) {
      int from = randomInt(numBits);
      int to = randomIntBetween(from, numBits);
      bits.set(from, to);
      expected.set(from, to);
      if (randomBoolean()) {
        int index = randomInt(numBits - 1);
        bits.clear(index);
        expected.clear(index);
      }
    }
    for (int i = 0; i < numBits; i++) {
      assertEquals("bit " + i, expected.get(i), bits.get(i));
    }
    assertEquals(expected.cardinality(), bits.cardinality());
  }

  @Test
  public void testWordBoundaries() {
    FixedBitSet bits = new FixedBitSet(192);
    bits.set(0, 64);
    assertEquals(64, bits.cardinality());
    assertFalse(bits.get(64));
    bits.set(63, 129);
    assertEquals(129, bits.cardinality());
    assertTrue(bits.get(128));
    assertFalse(bits.get(129));
    bits.set(100, 100);
    assertEquals(129, bits.cardinality());
  }

  @Test
  public void testEnsureCapacityKeepsBits() {
    FixedBitSet bits = new FixedBitSet(64);
    bits.set(3);
    bits.set(63);
    assertSame(bits, FixedBitSet.ensureCapacity(bits, 63));

    FixedBitSet grown = FixedBitSet.ensureCapacity(bits, 64);
    assertNotSame(bits, grown);
    assertTrue(grown.length() > 64);
    assertTrue(grown.get(3));
    assertTrue(grown.get(63));
    assertFalse(grown.get(64));
    grown.set(64);
    assertEquals(3, grown.cardinality());
    assertTrue(grown.ramBytesUsed() > bits.ramBytesUsed());
  }
}
