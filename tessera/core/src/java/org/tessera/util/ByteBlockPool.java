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

import static org.tessera.util.RamUsageEstimator.NUM_BYTES_OBJECT_REF;

/**
 * Arena of fixed-size byte blocks that the terms hash writes posting streams into.
 * <p>
 * A stream lives in a chain of <em>slices</em> of growing size (5 bytes, then 14, then 20,
 * ... capped at 200). Every slice is zero-filled when handed out and its last byte holds a
 * non-zero level marker ({@code 16 | level}). A writer therefore never tracks the slice
 * length: hitting a non-zero byte means "end of slice", at which point
 * {@link #allocSlice(byte[], int)} reserves the next slice and overwrites the last four
 * bytes of the exhausted one with the absolute address of the new one.
 * <p>
 * Addresses handed out by this pool are absolute: {@code blockIndex << BYTE_BLOCK_SHIFT | offsetInBlock}.
 * A slice never crosses a block boundary.
 *
 * @tessera.internal
 */
public final class ByteBlockPool implements Accountable {
  private static final long BASE_RAM_BYTES = RamUsageEstimator.shallowSizeOfInstance(ByteBlockPool.class);

  public static final int BYTE_BLOCK_SHIFT = 15;
  public static final int BYTE_BLOCK_SIZE = 1 << BYTE_BLOCK_SHIFT;
  public static final int BYTE_BLOCK_MASK = BYTE_BLOCK_SIZE - 1;

  /** Abstract class for allocating and freeing byte blocks. */
  public abstract static class Allocator {
    protected final int blockSize;

    protected Allocator(int blockSize) {
      this.blockSize = blockSize;
    }

    /** Gives back blocks {@code [start, end)}; the slots are nulled by the pool afterwards. */
    public abstract void recycleByteBlocks(byte[][] blocks, int start, int end);

    public byte[] getByteBlock() {
      return new byte[blockSize];
    }
  }

  /** A simple {@link Allocator} that never recycles. */
  public static final class DirectAllocator extends Allocator {

    public DirectAllocator() {
      this(BYTE_BLOCK_SIZE);
    }

    public DirectAllocator(int blockSize) {
      super(blockSize);
    }

    @Override
    public void recycleByteBlocks(byte[][] blocks, int start, int end) {
    }
  }

  /** A simple {@link Allocator} that never recycles, but
   *  tracks how much total RAM is in use. */
  public static class DirectTrackingAllocator extends Allocator {
    private final Counter bytesUsed;

    public DirectTrackingAllocator(Counter bytesUsed) {
      this(BYTE_BLOCK_SIZE, bytesUsed);
    }

    public DirectTrackingAllocator(int blockSize, Counter bytesUsed) {
      super(blockSize);
      this.bytesUsed = bytesUsed;
    }

    @Override
    public byte[] getByteBlock() {
      // 先记账再分配, DWPT 的内存统计与 flush 策略依赖这个计数器
      bytesUsed.addAndGet(blockSize);
      return new byte[blockSize];
    }

    @Override
    public void recycleByteBlocks(byte[][] blocks, int start, int end) {
      bytesUsed.addAndGet(-((end - start) * blockSize));
      for (int i = start; i < end; i++) {
        blocks[i] = null;
      }
    }
  }

  /** Blocks allocated so far; only {@code [0, bufferUpto]} are live. */
  public byte[][] buffers = new byte[10][];

  /** Index of the head block in {@link #buffers}, -1 before the first allocation. */
  private int bufferUpto = -1;

  /** Write position inside the head block. */
  public int byteUpto = BYTE_BLOCK_SIZE;

  /** The head block. */
  public byte[] buffer;

  /** Absolute address of the first byte of the head block. */
  public int byteOffset = -BYTE_BLOCK_SIZE;

  private final Allocator allocator;

  public ByteBlockPool(Allocator allocator) {
    this.allocator = allocator;
  }

  /**
   * Resets the pool to its initial state reusing the first buffer and fills all
   * buffers with <code>0</code> bytes before they are reused or passed to
   * {@link Allocator#recycleByteBlocks(byte[][], int, int)}.
   */
  public void reset() {
    reset(true, true);
  }

  /**
   * Expert: Resets the pool to its initial state.
   *
   * @param zeroFillBuffers if <code>true</code> the used area of every buffer is filled with
   *        <code>0</code>. Must be <code>true</code> when the pool is used for slices again.
   * @param reuseFirst if <code>true</code> the first buffer is kept and becomes the head block,
   *        so {@link #nextBuffer()} need not be called after the reset.
   */
  public void reset(boolean zeroFillBuffers, boolean reuseFirst) {
    if (bufferUpto == -1) {
      return;
    }
    if (zeroFillBuffers) {
      for (int i = 0; i < bufferUpto; i++) {
        Arrays.fill(buffers[i], (byte) 0);
      }
      // 最后一块只清理用过的部分
      Arrays.fill(buffers[bufferUpto], 0, byteUpto, (byte) 0);
    }

    if (bufferUpto > 0 || !reuseFirst) {
      final int firstRecycled = reuseFirst ? 1 : 0;
      allocator.recycleByteBlocks(buffers, firstRecycled, 1 + bufferUpto);
      Arrays.fill(buffers, firstRecycled, 1 + bufferUpto, null);
    }

    if (reuseFirst) {
      bufferUpto = 0;
      byteUpto = 0;
      byteOffset = 0;
      buffer = buffers[0];
    } else {
      bufferUpto = -1;
      byteUpto = BYTE_BLOCK_SIZE;
      byteOffset = -BYTE_BLOCK_SIZE;
      buffer = null;
    }
  }

  /**
   * Advances the pool to a fresh head block. Must be called once after construction.
   */
  public void nextBuffer() {
    if (1 + bufferUpto == buffers.length) {
      byte[][] newBuffers = new byte[ArrayUtil.oversize(buffers.length + 1, NUM_BYTES_OBJECT_REF)][];
      System.arraycopy(buffers, 0, newBuffers, 0, buffers.length);
      buffers = newBuffers;
    }
    buffer = buffers[1 + bufferUpto] = allocator.getByteBlock();
    bufferUpto++;

    byteUpto = 0;
    byteOffset += BYTE_BLOCK_SIZE;
  }

  /**
   * Allocates a first-level slice of {@code size} bytes and returns its offset inside the
   * head block. If the head block cannot hold it, the tail of the block is abandoned.
   *
   * @see #FIRST_LEVEL_SIZE
   */
  public int newSlice(final int size) {
    if (byteUpto > BYTE_BLOCK_SIZE - size) {
      nextBuffer();
    }
    final int upto = byteUpto;
    byteUpto += size;
    buffer[byteUpto - 1] = 16;
    return upto;
  }

  // Level tables. The level is stored in the low 4 bits of the end marker, so both
  // arrays must stay at most 16 long. Level 9 repeats itself.

  /** Next level for each level. */
  public static final int[] NEXT_LEVEL_ARRAY = {1, 2, 3, 4, 5, 6, 7, 8, 9, 9};

  /** Size in bytes of a slice at each level. */
  public static final int[] LEVEL_SIZE_ARRAY = {5, 14, 20, 30, 40, 40, 80, 80, 120, 200};

  /** The size of a slice created by {@link #newSlice(int)} for a new stream. */
  public static final int FIRST_LEVEL_SIZE = LEVEL_SIZE_ARRAY[0];

  /**
   * Called by a writer that hit the end marker at {@code slice[upto]}: reserves the slice of
   * the next level, moves the last three data bytes of the full slice to its start, writes the
   * forwarding address into the last four bytes of the full slice and returns the position in
   * the (new) head block where writing continues.
   */
  public int allocSlice(final byte[] slice, final int upto) {

    final int level = slice[upto] & 15;
    final int newLevel = NEXT_LEVEL_ARRAY[level];
    final int newSize = LEVEL_SIZE_ARRAY[newLevel];

    if (byteUpto > BYTE_BLOCK_SIZE - newSize) {
      nextBuffer();
    }

    final int newUpto = byteUpto;
    final int address = newUpto + byteOffset;
    byteUpto += newSize;

    // 旧分片最后 4 个字节要存转发地址, 先把其中 3 个数据字节搬到新分片开头
    buffer[newUpto] = slice[upto - 3];
    buffer[newUpto + 1] = slice[upto - 2];
    buffer[newUpto + 2] = slice[upto - 1];

    // big-endian forwarding address
    slice[upto - 3] = (byte) (address >>> 24);
    slice[upto - 2] = (byte) (address >>> 16);
    slice[upto - 1] = (byte) (address >>> 8);
    slice[upto] = (byte) address;

    buffer[byteUpto - 1] = (byte) (16 | newLevel);

    return newUpto + 3;
  }

  /**
   * Points {@code term} at a length-prefixed term written by {@link BytesRefHash}.
   * The prefix is one byte for lengths below 128, two bytes otherwise.
   */
  public void setBytesRef(BytesRef term, int textStart) {
    final byte[] bytes = term.bytes = buffers[textStart >> BYTE_BLOCK_SHIFT];
    int pos = textStart & BYTE_BLOCK_MASK;
    if ((bytes[pos] & 0x80) == 0) {
      // length is 1 byte
      term.length = bytes[pos];
      term.offset = pos + 1;
    } else {
      // length is 2 bytes
      term.length = (bytes[pos] & 0x7f) + ((bytes[pos + 1] & 0xff) << 7);
      term.offset = pos + 2;
    }
    assert term.length >= 0;
  }

  /**
   * Appends the bytes in the provided {@link BytesRef} at
   * the current position, spilling into new blocks as needed.
   */
  public void append(final BytesRef bytes) {
    int bytesLeft = bytes.length;
    int offset = bytes.offset;
    while (bytesLeft > 0) {
      int bufferLeft = BYTE_BLOCK_SIZE - byteUpto;
      if (bytesLeft < bufferLeft) {
        // fits within current buffer
        System.arraycopy(bytes.bytes, offset, buffer, byteUpto, bytesLeft);
        byteUpto += bytesLeft;
        break;
      } else {
        // fill up this buffer and move to next one
        if (bufferLeft > 0) {
          System.arraycopy(bytes.bytes, offset, buffer, byteUpto, bufferLeft);
        }
        nextBuffer();
        bytesLeft -= bufferLeft;
        offset += bufferLeft;
      }
    }
  }

  /**
   * Reads bytes out of the pool starting at the given offset with the given
   * length into the given byte array at offset <code>off</code>.
   * <p>Note: this method allows to copy across block boundaries.</p>
   */
  public void readBytes(final long offset, final byte[] bytes, int bytesOffset, int bytesLength) {
    int bytesLeft = bytesLength;
    int bufferIndex = (int) (offset >> BYTE_BLOCK_SHIFT);
    int pos = (int) (offset & BYTE_BLOCK_MASK);
    while (bytesLeft > 0) {
      byte[] block = buffers[bufferIndex++];
      int chunk = Math.min(bytesLeft, BYTE_BLOCK_SIZE - pos);
      System.arraycopy(block, pos, bytes, bytesOffset, chunk);
      bytesOffset += chunk;
      bytesLeft -= chunk;
      pos = 0;
    }
  }

  /**
   * Sets {@code ref} to the {@code ref.length} bytes at {@code offset}. The ref points into the
   * pool when the value sits in one block, otherwise it gets a fresh copy.
   */
  public void setRawBytesRef(BytesRef ref, final long offset) {
    int bufferIndex = (int) (offset >> BYTE_BLOCK_SHIFT);
    int pos = (int) (offset & BYTE_BLOCK_MASK);
    if (pos + ref.length <= BYTE_BLOCK_SIZE) {
      ref.bytes = buffers[bufferIndex];
      ref.offset = pos;
    } else {
      ref.bytes = new byte[ref.length];
      ref.offset = 0;
      readBytes(offset, ref.bytes, 0, ref.length);
    }
  }

  /** Read a single byte at the given {@code offset}. */
  public byte readByte(long offset) {
    int bufferIndex = (int) (offset >> BYTE_BLOCK_SHIFT);
    int pos = (int) (offset & BYTE_BLOCK_MASK);
    return buffers[bufferIndex][pos];
  }

  /** Absolute address of the next byte {@link #append} would write. */
  public long getPosition() {
    return (long) byteOffset + byteUpto;
  }

  @Override
  public long ramBytesUsed() {
    long size = BASE_RAM_BYTES;
    size += RamUsageEstimator.shallowSizeOf(buffers);
    for (byte[] buf : buffers) {
      if (buf == buffer) {
        continue;
      }
      if (buf != null) {
        size += RamUsageEstimator.sizeOf(buf);
      }
    }
    if (buffer != null) {
      size += RamUsageEstimator.sizeOf(buffer);
    }
    return size;
  }
}
