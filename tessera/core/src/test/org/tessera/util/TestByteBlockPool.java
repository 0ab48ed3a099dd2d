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

import java.util.ArrayList;
import java.util.List;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestByteBlockPool extends RandomizedTest {

  @Test
  public void testAppendAndRead() {
    Counter bytesUsed = Counter.newCounter();
    ByteBlockPool pool = new ByteBlockPool(new ByteBlockPool.DirectTrackingAllocator(bytesUsed));
    pool.nextBuffer();
    boolean reuseFirst = randomBoolean();
    for (int j = 0; j < 2; j++) {
      List<BytesRef> list = new ArrayList<>();
      int maxLength = randomIntBetween(1, 500);
      final int numValues = randomIntBetween(1, 200);
      for (int i = 0; i < numValues; i++) {
        final String value = randomAsciiLettersOfLengthBetween(1, maxLength);
        BytesRef ref = new BytesRef(value);
        list.add(ref);
        pool.append(ref);
      }
      // verify
      long position = 0;
      for (BytesRef expected : list) {
        byte[] actual = new byte[expected.length];
        pool.readBytes(position, actual, 0, actual.length);
        assertEquals(expected.utf8ToString(), new BytesRef(actual).utf8ToString());
        position += expected.length;
      }
      assertEquals(position, pool.getPosition());
      pool.reset(randomBoolean(), reuseFirst);
      if (reuseFirst) {
        assertEquals(ByteBlockPool.BYTE_BLOCK_SIZE, bytesUsed.get());
      } else {
        assertEquals(0, bytesUsed.get());
        pool.nextBuffer(); // prepare for next iter
      }
    }
  }

  @Test
  public void testLargeValueSpansBlocks() {
    ByteBlockPool pool = new ByteBlockPool(new ByteBlockPool.DirectAllocator());
    pool.nextBuffer();
    byte[] bytes = new byte[ByteBlockPool.BYTE_BLOCK_SIZE * 2 + 17];
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = (byte) (i % 127);
    }
    pool.append(new BytesRef(new byte[] {1, 2, 3}));
    pool.append(new BytesRef(bytes));

    BytesRef ref = new BytesRef();
    ref.length = bytes.length;
    pool.setRawBytesRef(ref, 3);
    assertEquals(bytes.length, ref.length);
    for (int i = 0; i < bytes.length; i++) {
      assertEquals(bytes[i], ref.bytes[ref.offset + i]);
    }
    assertEquals(3, pool.readByte(2));
    assertEquals((byte) (ByteBlockPool.BYTE_BLOCK_SIZE % 127), pool.readByte(3 + ByteBlockPool.BYTE_BLOCK_SIZE));
  }

  @Test
  public void testNewSliceAbandonsTail() {
    ByteBlockPool pool = new ByteBlockPool(new ByteBlockPool.DirectAllocator());
    pool.nextBuffer();
    pool.byteUpto = ByteBlockPool.BYTE_BLOCK_SIZE - 3;
    int upto = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE);
    assertEquals(0, upto);
    assertEquals(ByteBlockPool.BYTE_BLOCK_SIZE, pool.byteOffset);
    assertEquals(16, pool.buffer[ByteBlockPool.FIRST_LEVEL_SIZE - 1]);
  }

  @Test
  public void testZeroFillOnReset() {
    ByteBlockPool pool = new ByteBlockPool(new ByteBlockPool.DirectAllocator());
    pool.nextBuffer();
    pool.append(new BytesRef("abcdef"));
    pool.reset(true, true);
    for (int i = 0; i < 6; i++) {
      assertEquals(0, pool.buffer[i]);
    }
    assertEquals(0, pool.getPosition());
  }
}
