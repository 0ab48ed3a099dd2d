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

import org.tessera.store.DataOutput;
import org.tessera.util.ByteBlockPool;

/**
 * Writes one stream into a chain of byte slices of a {@link ByteBlockPool}. The writer
 * never tracks slice lengths: a non-zero byte under the cursor is the end marker of the
 * current slice, and {@link ByteBlockPool#allocSlice(byte[], int)} links in the next one.
 */
final class ByteSliceWriter extends DataOutput {

  private byte[] slice;
  private int upto;
  private final ByteBlockPool pool;

  // 当前分片所在 block 的起始绝对地址
  int offset0;

  public ByteSliceWriter(ByteBlockPool pool) {
    this.pool = pool;
  }

  /**
   * Set up the writer to write at address.
   */
  public void init(int address) {
    slice = pool.buffers[address >> ByteBlockPool.BYTE_BLOCK_SHIFT];
    assert slice != null;
    upto = address & ByteBlockPool.BYTE_BLOCK_MASK;
    offset0 = address;
    assert upto < slice.length;
  }

  /** Write byte into byte slice stream */
  @Override
  public void writeByte(byte b) {
    assert slice != null;
    if (slice[upto] != 0) {
      nextSlice();
    }
    slice[upto++] = b;
    assert upto != slice.length;
  }

  @Override
  public void writeBytes(final byte[] b, int offset, final int len) {
    final int offsetEnd = offset + len;
    while (offset < offsetEnd) {
      if (slice[upto] != 0) {
        nextSlice();
      }
      // 一次拷贝到标记字节之前; 标记所在位置由下一轮处理
      int run = 0;
      while (offset + run < offsetEnd && slice[upto + run] == 0) {
        run++;
      }
      System.arraycopy(b, offset, slice, upto, run);
      upto += run;
      offset += run;
      assert upto != slice.length;
    }
  }

  private void nextSlice() {
    upto = pool.allocSlice(slice, upto);
    slice = pool.buffer;
    offset0 = pool.byteOffset;
    assert slice != null;
  }

  /** Absolute address of the next byte this writer will write. */
  public int getAddress() {
    return upto + (offset0 & ~ByteBlockPool.BYTE_BLOCK_MASK);
  }
}
