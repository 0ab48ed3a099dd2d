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
 * Int counterpart of {@link ByteBlockPool}. The terms hash keeps, for every term, the
 * current write address of each of its byte streams in this pool.
 * <p>
 * Slices work like the byte slices but a forwarding pointer takes a single int, so the
 * last int of every region is reserved for it. Levels: 2, 4, 8, ... 1024 ints.
 *
 * @tessera.internal
 */
public final class IntBlockPool {
  public static final int INT_BLOCK_SHIFT = 13;
  public static final int INT_BLOCK_SIZE = 1 << INT_BLOCK_SHIFT;
  public static final int INT_BLOCK_MASK = INT_BLOCK_SIZE - 1;

  /** Abstract class for allocating and freeing int blocks. */
  public abstract static class Allocator {
    protected final int blockSize;

    protected Allocator(int blockSize) {
      this.blockSize = blockSize;
    }

    public abstract void recycleIntBlocks(int[][] blocks, int start, int end);

    public int[] getIntBlock() {
      return new int[blockSize];
    }
  }

  /** A simple {@link Allocator} that never recycles. */
  public static final class DirectAllocator extends Allocator {

    public DirectAllocator() {
      super(INT_BLOCK_SIZE);
    }

    @Override
    public void recycleIntBlocks(int[][] blocks, int start, int end) {
    }
  }

  /** Blocks allocated so far; only {@code [0, bufferUpto]} are live. */
  public int[][] buffers = new int[10][];

  private int bufferUpto = -1;
  /** Write position inside the head block. */
  public int intUpto = INT_BLOCK_SIZE;
  /** The head block. */
  public int[] buffer;
  /** Absolute address of the first int of the head block. */
  public int intOffset = -INT_BLOCK_SIZE;

  private final Allocator allocator;

  public IntBlockPool() {
    this(new DirectAllocator());
  }

  public IntBlockPool(Allocator allocator) {
    this.allocator = allocator;
  }

  /** Resets the pool, zero-filling and keeping the first block. */
  public void reset() {
    this.reset(true, true);
  }

  /**
   * Expert: Resets the pool to its initial state.
   *
   * @param zeroFillBuffers fill the used area with 0 before reuse; required for slice use
   * @param reuseFirst keep the first block as the head block
   */
  public void reset(boolean zeroFillBuffers, boolean reuseFirst) {
    if (bufferUpto == -1) {
      return;
    }
    if (zeroFillBuffers) {
      for (int i = 0; i < bufferUpto; i++) {
        Arrays.fill(buffers[i], 0);
      }
      Arrays.fill(buffers[bufferUpto], 0, intUpto, 0);
    }

    if (bufferUpto > 0 || !reuseFirst) {
      final int firstRecycled = reuseFirst ? 1 : 0;
      allocator.recycleIntBlocks(buffers, firstRecycled, 1 + bufferUpto);
      Arrays.fill(buffers, firstRecycled, bufferUpto + 1, null);
    }
    if (reuseFirst) {
      bufferUpto = 0;
      intUpto = 0;
      intOffset = 0;
      buffer = buffers[0];
    } else {
      bufferUpto = -1;
      intUpto = INT_BLOCK_SIZE;
      intOffset = -INT_BLOCK_SIZE;
      buffer = null;
    }
  }

  /** Advances the pool to a fresh head block. */
  public void nextBuffer() {
    if (1 + bufferUpto == buffers.length) {
      int[][] newBuffers = new int[ArrayUtil.oversize(buffers.length + 1, RamUsageEstimator.NUM_BYTES_OBJECT_REF)][];
      System.arraycopy(buffers, 0, newBuffers, 0, buffers.length);
      buffers = newBuffers;
    }
    buffer = buffers[1 + bufferUpto] = allocator.getIntBlock();
    bufferUpto++;

    intUpto = 0;
    intOffset += INT_BLOCK_SIZE;
  }

  private int newSlice(final int size) {
    if (intUpto > INT_BLOCK_SIZE - size) {
      nextBuffer();
      assert assertSliceBuffer(buffer);
    }

    final int upto = intUpto;
    intUpto += size;
    buffer[intUpto - 1] = 16;
    return upto;
  }

  private static boolean assertSliceBuffer(int[] buffer) {
    int count = 0;
    for (int i = 0; i < buffer.length; i++) {
      count += buffer[i]; // for slices the buffer must only have 0 values
    }
    return count == 0;
  }

  private static final int[] NEXT_LEVEL_ARRAY = {1, 2, 3, 4, 5, 6, 7, 8, 9, 9};

  private static final int[] LEVEL_SIZE_ARRAY = {2, 4, 8, 16, 32, 64, 128, 256, 512, 1024};

  private static final int FIRST_LEVEL_SIZE = LEVEL_SIZE_ARRAY[0];

  // 与字节池相同: 末尾的标记被替换成下一个分片的绝对地址
  private int allocSlice(final int[] slice, final int sliceOffset) {
    final int level = slice[sliceOffset] & 15;
    final int newLevel = NEXT_LEVEL_ARRAY[level];
    final int newSize = LEVEL_SIZE_ARRAY[newLevel];
    if (intUpto > INT_BLOCK_SIZE - newSize) {
      nextBuffer();
      assert assertSliceBuffer(buffer);
    }

    final int newUpto = intUpto;
    final int address = newUpto + intOffset;
    intUpto += newSize;
    slice[sliceOffset] = address;

    buffer[intUpto - 1] = 16 | newLevel;

    return newUpto;
  }

  /**
   * Writes ints into a chain of int slices.
   * <p>
   * Keep the value of {@link #startNewSlice()} as the slice head and
   * {@link #getCurrentOffset()} as its end to read the data back with a {@link SliceReader}.
   */
  public static class SliceWriter {

    private int offset;
    private final IntBlockPool pool;

    public SliceWriter(IntBlockPool pool) {
      this.pool = pool;
    }

    /** Continues writing at the given absolute offset. */
    public void reset(int sliceOffset) {
      this.offset = sliceOffset;
    }

    /** Writes the given value into the slice and resizes the slice if needed */
    public void writeInt(int value) {
      int[] ints = pool.buffers[offset >> INT_BLOCK_SHIFT];
      assert ints != null;
      int relativeOffset = offset & INT_BLOCK_MASK;
      if (ints[relativeOffset] != 0) {
        // End of slice; allocate a new one
        relativeOffset = pool.allocSlice(ints, relativeOffset);
        ints = pool.buffer;
        offset = relativeOffset + pool.intOffset;
      }
      ints[relativeOffset] = value;
      offset++;
    }

    /**
     * starts a new slice and returns the start offset. The returned value
     * should be used as the start offset to initialize a {@link SliceReader}.
     */
    public int startNewSlice() {
      return offset = pool.newSlice(FIRST_LEVEL_SIZE) + pool.intOffset;
    }

    /**
     * Returns the offset of the currently written slice. The returned value
     * should be used as the end offset to initialize a {@link SliceReader} once
     * this slice is fully written.
     */
    public int getCurrentOffset() {
      return offset;
    }
  }

  /**
   * Reads back ints written by a {@link SliceWriter}.
   */
  public static final class SliceReader {

    private final IntBlockPool pool;
    private int upto;
    private int bufferUpto;
    private int bufferOffset;
    private int[] buffer;
    private int limit;
    private int level;
    private int end;

    public SliceReader(IntBlockPool pool) {
      this.pool = pool;
    }

    /** Positions the reader on the slice chain spanning {@code [startOffset, endOffset)}. */
    public void reset(int startOffset, int endOffset) {
      bufferUpto = startOffset / INT_BLOCK_SIZE;
      bufferOffset = bufferUpto * INT_BLOCK_SIZE;
      this.end = endOffset;
      level = 0;

      buffer = pool.buffers[bufferUpto];
      upto = startOffset & INT_BLOCK_MASK;

      final int firstSize = LEVEL_SIZE_ARRAY[0];
      if (startOffset + firstSize >= endOffset) {
        // There is only this one slice to read
        limit = endOffset & INT_BLOCK_MASK;
      } else {
        limit = upto + firstSize - 1;
      }
    }

    /** Returns <code>true</code> iff the current slice is fully read. */
    public boolean endOfSlice() {
      assert upto + bufferOffset <= end;
      return upto + bufferOffset == end;
    }

    /**
     * Reads the next int from the current slice and returns it.
     * @see SliceReader#endOfSlice()
     */
    public int readInt() {
      assert !endOfSlice();
      assert upto <= limit;
      if (upto == limit) {
        nextSlice();
      }
      return buffer[upto++];
    }

    private void nextSlice() {
      // Skip to our next slice
      final int nextIndex = buffer[limit];
      level = NEXT_LEVEL_ARRAY[level];
      final int newSize = LEVEL_SIZE_ARRAY[level];

      bufferUpto = nextIndex / INT_BLOCK_SIZE;
      bufferOffset = bufferUpto * INT_BLOCK_SIZE;

      buffer = pool.buffers[bufferUpto];
      upto = nextIndex & INT_BLOCK_MASK;

      if (nextIndex + newSize >= end) {
        // We are advancing to the final slice
        assert end - nextIndex > 0;
        limit = end - bufferOffset;
      } else {
        // This is not the final slice (subtract 1 for the
        // forwarding address at the end of this new slice)
        limit = upto + newSize - 1;
      }
    }
  }
}
