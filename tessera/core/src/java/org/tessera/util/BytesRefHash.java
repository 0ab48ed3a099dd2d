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

import static org.tessera.util.ByteBlockPool.BYTE_BLOCK_SIZE;

/**
 * Interns term bytes into a {@link ByteBlockPool} and hands out dense ids.
 * The first distinct term gets id 0, the next id 1 and so on; the address of
 * every interned term lives in an {@code int[]} owned by a
 * {@link BytesStartArray}, so the indexing chain can keep its per-term
 * postings arrays parallel to it.
 * <p>
 * A term is stored as a 1 or 2 byte length prefix followed by its bytes,
 * which caps a single term at {@link ByteBlockPool#BYTE_BLOCK_SIZE}-2 bytes.
 *
 * @tessera.internal
 */
public final class BytesRefHash {

  public static final int DEFAULT_CAPACITY = 16;

  private static final int EMPTY = -1;

  final ByteBlockPool pool;
  int[] bytesStart;

  private final BytesStartArray bytesStartArray;
  private final Counter bytesUsed;
  private final BytesRef scratch = new BytesRef();

  // 开放寻址表: 槽位里存 term id
  private int[] slots;
  private int count;

  public BytesRefHash(ByteBlockPool pool) {
    this(pool, DEFAULT_CAPACITY, new DirectBytesStartArray(DEFAULT_CAPACITY));
  }

  /**
   * @param capacity initial number of hash slots, a power of two
   */
  public BytesRefHash(ByteBlockPool pool, int capacity, BytesStartArray bytesStartArray) {
    assert Integer.bitCount(capacity) == 1 : "capacity must be a power of two: " + capacity;
    this.pool = pool;
    this.bytesStartArray = bytesStartArray;
    this.bytesUsed = bytesStartArray.bytesUsed() == null ? Counter.newCounter() : bytesStartArray.bytesUsed();
    this.slots = newSlots(capacity);
    this.bytesStart = bytesStartArray.init();
  }

  /** Number of distinct terms interned since the last {@link #clear}. */
  public int size() {
    return count;
  }

  /** Points {@code ref} at the bytes of term {@code bytesID} inside the pool. */
  public BytesRef get(int bytesID, BytesRef ref) {
    assert bytesID >= 0 && bytesID < count : "no term with id " + bytesID;
    pool.setBytesRef(ref, bytesStart[bytesID]);
    return ref;
  }

  /**
   * Interns {@code bytes}.
   *
   * @return the new id when the bytes were not seen before, otherwise
   *         {@code -(id + 1)} of the existing entry
   * @throws MaxBytesLengthExceededException if the term does not fit into a
   *         single pool block
   */
  public int add(BytesRef bytes) {
    if (bytesStart == null) {
      bytesStart = bytesStartArray.init();
    }
    final int slot = slotOf(bytes);
    final int existing = slots[slot];
    if (existing != EMPTY) {
      return -(existing + 1);
    }

    final int termStart = append(bytes);
    if (count >= bytesStart.length) {
      bytesStart = bytesStartArray.grow();
      assert count < bytesStart.length;
    }
    final int id = count++;
    bytesStart[id] = termStart;
    slots[slot] = id;

    if (count == slots.length >> 1) {
      rehash(slots.length << 1);
    }
    return id;
  }

  /** Returns the id of {@code bytes}, or {@code -1} when it was never added. */
  public int find(BytesRef bytes) {
    if (count == 0) {
      return EMPTY;
    }
    return slots[slotOf(bytes)];
  }

  /**
   * Returns the term ids ordered by their bytes (unsigned). The ids occupy
   * the first {@link #size()} entries of the returned array. The hash can
   * not be used for lookups afterwards until {@link #clear} is called.
   */
  public int[] sort() {
    final int[] ids = compact();
    new IntroSorter() {
      private final BytesRef pivot = new BytesRef();
      private final BytesRef left = new BytesRef();
      private final BytesRef right = new BytesRef();

      @Override
      protected void swap(int i, int j) {
        final int tmp = ids[i];
        ids[i] = ids[j];
        ids[j] = tmp;
      }

      @Override
      protected int compare(int i, int j) {
        pool.setBytesRef(left, bytesStart[ids[i]]);
        pool.setBytesRef(right, bytesStart[ids[j]]);
        return left.compareTo(right);
      }

      @Override
      protected void setPivot(int i) {
        pool.setBytesRef(pivot, bytesStart[ids[i]]);
      }

      @Override
      protected int comparePivot(int j) {
        pool.setBytesRef(right, bytesStart[ids[j]]);
        return pivot.compareTo(right);
      }
    }.sort(0, count);
    return ids;
  }

  /**
   * Forgets every term. The slot table shrinks when the previous generation
   * used only a small part of it.
   *
   * @param resetPool whether the byte pool is recycled too
   */
  public void clear(boolean resetPool) {
    final int lastCount = count;
    count = 0;
    if (resetPool) {
      pool.reset(false, false);
    }
    bytesStart = bytesStartArray.clear();
    int target = slots.length;
    while (target >= 8 && target / 4 > lastCount) {
      target >>= 1;
    }
    if (target != slots.length) {
      bytesUsed.addAndGet(-(long) Integer.BYTES * slots.length);
      slots = newSlots(target);
    } else {
      Arrays.fill(slots, EMPTY);
    }
  }

  public void clear() {
    clear(true);
  }

  private int[] newSlots(int size) {
    final int[] table = new int[size];
    Arrays.fill(table, EMPTY);
    bytesUsed.addAndGet((long) Integer.BYTES * size);
    return table;
  }

  /** Moves every live id to the front of the slot table. */
  private int[] compact() {
    int upto = 0;
    for (int i = 0; i < slots.length; i++) {
      if (slots[i] != EMPTY) {
        if (upto < i) {
          slots[upto] = slots[i];
          slots[i] = EMPTY;
        }
        upto++;
      }
    }
    assert upto == count;
    return slots;
  }

  /** Writes length prefix and bytes into the pool; returns the term's address. */
  private int append(BytesRef bytes) {
    final int length = bytes.length;
    final int needed = length + (length < 128 ? 1 : 2);
    if (needed + pool.byteUpto > BYTE_BLOCK_SIZE) {
      if (length + 2 > BYTE_BLOCK_SIZE) {
        throw new MaxBytesLengthExceededException("bytes can be at most "
            + (BYTE_BLOCK_SIZE - 2) + " in length; got " + length);
      }
      pool.nextBuffer();
    }
    final byte[] buffer = pool.buffer;
    int upto = pool.byteUpto;
    final int address = upto + pool.byteOffset;
    if (length < 128) {
      buffer[upto++] = (byte) length;
    } else {
      buffer[upto++] = (byte) (0x80 | (length & 0x7f));
      buffer[upto++] = (byte) ((length >> 7) & 0xff);
    }
    System.arraycopy(bytes.bytes, bytes.offset, buffer, upto, length);
    pool.byteUpto = upto + length;
    return address;
  }

  /** Slot holding {@code bytes}, or the empty slot where it would go. */
  private int slotOf(BytesRef bytes) {
    final int mask = slots.length - 1;
    int code = hash(bytes);
    int slot = code & mask;
    while (slots[slot] != EMPTY && !termEquals(slots[slot], bytes)) {
      slot = ++code & mask;
    }
    return slot;
  }

  private boolean termEquals(int id, BytesRef bytes) {
    pool.setBytesRef(scratch, bytesStart[id]);
    return scratch.bytesEquals(bytes);
  }

  private void rehash(int newSize) {
    final int[] old = slots;
    slots = newSlots(newSize);
    final int mask = newSize - 1;
    for (int id : old) {
      if (id == EMPTY) {
        continue;
      }
      pool.setBytesRef(scratch, bytesStart[id]);
      int code = hash(scratch);
      int slot = code & mask;
      while (slots[slot] != EMPTY) {
        slot = ++code & mask;
      }
      slots[slot] = id;
    }
    bytesUsed.addAndGet(-(long) Integer.BYTES * old.length);
  }

  private static int hash(BytesRef bytes) {
    return StringHelper.murmurhash3_x86_32(bytes.bytes, bytes.offset, bytes.length, StringHelper.GOOD_FAST_HASH_SEED);
  }

  /** Thrown when a single term is longer than a pool block can hold. */
  @SuppressWarnings("serial")
  public static class MaxBytesLengthExceededException extends RuntimeException {
    MaxBytesLengthExceededException(String message) {
      super(message);
    }
  }

  /**
   * Owner of the term address array. The indexing chain plugs in an
   * implementation that grows its postings arrays in step.
   */
  public abstract static class BytesStartArray {
    /** Allocates the address array. */
    public abstract int[] init();

    /** Grows the address array by at least one entry, keeping its content. */
    public abstract int[] grow();

    /** Releases the address array; may return {@code null}. */
    public abstract int[] clear();

    /** Counter the hash charges its slot table to, or {@code null} for a private one. */
    public abstract Counter bytesUsed();
  }

  /** Plain {@link BytesStartArray} backed by a private counter. */
  public static class DirectBytesStartArray extends BytesStartArray {
    private final int initSize;
    private final Counter bytesUsed = Counter.newCounter();
    private int[] bytesStart;

    public DirectBytesStartArray(int initSize) {
      this.initSize = initSize;
    }

    @Override
    public int[] init() {
      return bytesStart = new int[ArrayUtil.oversize(initSize, Integer.BYTES)];
    }

    @Override
    public int[] grow() {
      return bytesStart = ArrayUtil.grow(bytesStart, bytesStart.length + 1);
    }

    @Override
    public int[] clear() {
      return bytesStart = null;
    }

    @Override
    public Counter bytesUsed() {
      return bytesUsed;
    }
  }
}
