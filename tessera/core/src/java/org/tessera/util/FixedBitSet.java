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

import java.util.Arrays;

/**
 * Fixed size bit set over a {@code long[]}. Backs the live docs of a flushing
 * segment and the doc values presence bits of the doc values writers.
 *
 * @tessera.internal
 */
public final class FixedBitSet implements Bits, Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(FixedBitSet.class);

  // bits at or past numBits are always clear
  private final long[] words;
  private final int numBits;

  public FixedBitSet(int numBits) {
    this(new long[wordCount(numBits)], numBits);
  }

  private FixedBitSet(long[] words, int numBits) {
    assert wordCount(numBits) <= words.length : numBits + " bits do not fit into " + words.length + " words";
    this.words = words;
    this.numBits = numBits;
  }

  private static int wordCount(int numBits) {
    return (numBits + 63) >>> 6;
  }

  /**
   * Returns {@code bits} when {@code index} is already a valid index into it,
   * otherwise a larger set sharing or copying its words. The returned set may
   * be longer than requested.
   */
  public static FixedBitSet ensureCapacity(FixedBitSet bits, int index) {
    if (index < bits.numBits) {
      return bits;
    }
    final long[] grown = ArrayUtil.grow(bits.words, wordCount(index + 1));
    return new FixedBitSet(grown, grown.length << 6);
  }

  @Override
  public long ramBytesUsed() {
    return BASE_RAM_BYTES_USED + RamUsageEstimator.sizeOf(words);
  }

  @Override
  public int length() {
    return numBits;
  }

  /** Number of set bits. */
  public int cardinality() {
    int count = 0;
    for (long word : words) {
      count += Long.bitCount(word);
    }
    return count;
  }

  @Override
  public boolean get(int index) {
    assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
    // long shifts only use the low 6 bits of the distance
    return (words[index >> 6] & (1L << index)) != 0;
  }

  public void set(int index) {
    assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
    words[index >> 6] |= 1L << index;
  }

  public void clear(int index) {
    assert index >= 0 && index < numBits : "index=" + index + ", numBits=" + numBits;
    words[index >> 6] &= ~(1L << index);
  }

  /** Sets every bit in {@code [from, to)}. */
  public void set(int from, int to) {
    assert 0 <= from && from <= to && to <= numBits : "from=" + from + ", to=" + to + ", numBits=" + numBits;
    if (from == to) {
      return;
    }
    final int first = from >> 6;
    final int last = (to - 1) >> 6;
    final long head = -1L << from;
    final long tail = -1L >>> -to; // to 为 64 的倍数时为全 1
    if (first == last) {
      words[first] |= head & tail;
    } else {
      words[first] |= head;
      Arrays.fill(words, first + 1, last, -1L);
      words[last] |= tail;
    }
  }
}
