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

import org.tessera.store.DataInput;
import org.tessera.store.DataOutput;
import org.tessera.util.ByteBlockPool;

/**
 * Reads back one stream written by {@link ByteSliceWriter} (or by the terms hash) from
 * its first slice up to a known end address, following the 4-byte forwarding addresses
 * stored at the end of every non-final slice.
 *
 * @tessera.internal
 */
public final class ByteSliceReader extends DataInput {
  ByteBlockPool pool;
  int bufferUpto;
  byte[] buffer;
  public int upto;
  // 当前分片最后一个可读数据字节之后的位置(非最后分片时指向转发地址)
  int limit;
  int level;
  public int bufferOffset;

  public int endIndex;

  public ByteSliceReader() {
  }

  /** Positions this reader on the stream spanning {@code [startIndex, endIndex)}. */
  public void init(ByteBlockPool pool, int startIndex, int endIndex) {

    assert endIndex - startIndex >= 0;
    assert startIndex >= 0;
    assert endIndex >= 0;

    this.pool = pool;
    this.endIndex = endIndex;

    level = 0;
    bufferUpto = startIndex / ByteBlockPool.BYTE_BLOCK_SIZE;
    bufferOffset = bufferUpto * ByteBlockPool.BYTE_BLOCK_SIZE;
    buffer = pool.buffers[bufferUpto];
    upto = startIndex & ByteBlockPool.BYTE_BLOCK_MASK;

    final int firstSize = ByteBlockPool.LEVEL_SIZE_ARRAY[0];

    if (startIndex + firstSize >= endIndex) {
      // There is only this one slice to read
      limit = endIndex & ByteBlockPool.BYTE_BLOCK_MASK;
    } else {
      limit = upto + firstSize - 4;
    }
  }

  /** True once every byte up to the end address has been consumed. */
  public boolean eof() {
    assert upto + bufferOffset <= endIndex;
    return upto + bufferOffset == endIndex;
  }

  @Override
  public byte readByte() {
    assert !eof();
    assert upto <= limit;
    if (upto == limit) {
      nextSlice();
    }
    return buffer[upto++];
  }

  /**
   * Copies the rest of the stream to {@code out}, one bulk write per slice.
   *
   * @return the number of bytes written
   */
  public long writeTo(DataOutput out) throws IOException {
    long size = 0;
    while (true) {
      final int chunk = limit - upto;
      out.writeBytes(buffer, upto, chunk);
      size += chunk;
      if (limit + bufferOffset == endIndex) {
        assert endIndex - bufferOffset >= upto;
        upto = limit;
        break;
      }
      nextSlice();
    }
    return size;
  }

  /** Moves to the slice the current one forwards to. */
  public void nextSlice() {

    // Skip to our next slice
    final int nextIndex = ((buffer[limit] & 0xff) << 24) + ((buffer[1 + limit] & 0xff) << 16)
        + ((buffer[2 + limit] & 0xff) << 8) + (buffer[3 + limit] & 0xff);

    level = ByteBlockPool.NEXT_LEVEL_ARRAY[level];
    final int newSize = ByteBlockPool.LEVEL_SIZE_ARRAY[level];

    bufferUpto = nextIndex / ByteBlockPool.BYTE_BLOCK_SIZE;
    bufferOffset = bufferUpto * ByteBlockPool.BYTE_BLOCK_SIZE;

    buffer = pool.buffers[bufferUpto];
    upto = nextIndex & ByteBlockPool.BYTE_BLOCK_MASK;

    if (nextIndex + newSize >= endIndex) {
      // We are advancing to the final slice
      assert endIndex - nextIndex > 0;
      limit = endIndex - bufferOffset;
    } else {
      // This is not the final slice (subtract 4 for the
      // forwarding address at the end of this new slice)
      limit = upto + newSize - 4;
    }
  }

  @Override
  public void readBytes(byte[] b, int offset, int len) {
    while (len > 0) {
      final int numLeft = limit - upto;
      if (numLeft < len) {
        // Read entire slice
        System.arraycopy(buffer, upto, b, offset, numLeft);
        offset += numLeft;
        len -= numLeft;
        nextSlice();
      } else {
        // This slice is the last one
        System.arraycopy(buffer, upto, b, offset, len);
        upto += len;
        break;
      }
    }
  }
}
