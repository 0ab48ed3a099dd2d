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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;
import org.tessera.store.GrowableByteArrayDataOutput;
import org.tessera.util.ByteBlockPool;
import org.tessera.util.Counter;

import static org.junit.Assert.*;

public class TestByteSliceReaderWriter extends RandomizedTest {

  @Test
  public void testInterleavedStreams() throws IOException {
    ByteBlockPool pool = new ByteBlockPool(new ByteBlockPool.DirectTrackingAllocator(Counter.newCounter()));

    final int NUM_STREAM = randomIntBetween(20, 40);

    ByteSliceWriter writer = new ByteSliceWriter(pool);

    int[] starts = new int[NUM_STREAM];
    int[] uptos = new int[NUM_STREAM];
    int[] counters = new int[NUM_STREAM];

    ByteSliceReader reader = new ByteSliceReader();

    for (int ti = 0; ti < 3; ti++) {
      for (int stream = 0; stream < NUM_STREAM; stream++) {
        starts[stream] = -1;
        counters[stream] = 0;
      }

      int num = randomIntBetween(3000, 6000);
      for (int iter = 0; iter < num; iter++) {
        int stream = randomIntBetween(0, NUM_STREAM - 1);

        if (starts[stream] == -1) {
          final int spot = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE);
          starts[stream] = uptos[stream] = spot + pool.byteOffset;
        }
        writer.init(uptos[stream]);
        int numValue;
        if (randomIntBetween(0, 9) == 3) {
          numValue = randomIntBetween(0, 99);
        } else if (randomIntBetween(0, 4) == 3) {
          numValue = randomIntBetween(0, 2);
        } else {
          numValue = randomIntBetween(0, 19);
        }

        for (int j = 0; j < numValue; j++) {
          writer.writeVInt(counters[stream]++);
        }
        uptos[stream] = writer.getAddress();
      }

      for (int stream = 0; stream < NUM_STREAM; stream++) {
        if (starts[stream] != -1 && starts[stream] != uptos[stream]) {
          reader.init(pool, starts[stream], uptos[stream]);
          for (int j = 0; j < counters[stream]; j++) {
            assertEquals(j, reader.readVInt());
          }
          assertTrue(reader.eof());
        }
      }

      pool.reset(true, false);
    }
  }

  @Test
  public void testWriteToCopiesWholeChain() throws IOException {
    ByteBlockPool pool = new ByteBlockPool(new ByteBlockPool.DirectAllocator());
    ByteSliceWriter writer = new ByteSliceWriter(pool);
    final int start = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE) + pool.byteOffset;
    writer.init(start);

    final byte[] expected = new byte[100_000];
    for (int i = 0; i < expected.length; i++) {
      // never 0 so a lost byte cannot hide in zero-filled space
      expected[i] = (byte) (1 + (i % 250));
    }
    int upto = 0;
    while (upto < expected.length) {
      int chunk = Math.min(expected.length - upto, randomIntBetween(1, 1000));
      writer.writeBytes(expected, upto, chunk);
      upto += chunk;
    }
    final int end = writer.getAddress();
    assertTrue(end - start > expected.length);

    ByteSliceReader reader = new ByteSliceReader();
    reader.init(pool, start, end);
    GrowableByteArrayDataOutput out = new GrowableByteArrayDataOutput(16);
    assertEquals(expected.length, reader.writeTo(out));
    assertEquals(expected.length, out.getPosition());
    final byte[] actual = out.getBytes();
    for (int i = 0; i < expected.length; i++) {
      assertEquals("byte " + i, expected[i], actual[i]);
    }
    assertTrue(reader.eof());

    reader.init(pool, start, end);
    final byte[] viaReadBytes = new byte[expected.length];
    reader.readBytes(viaReadBytes, 0, viaReadBytes.length);
    for (int i = 0; i < expected.length; i++) {
      assertEquals(expected[i], viaReadBytes[i]);
    }
    assertTrue(reader.eof());
  }

  @Test
  public void testSingleRegion() throws IOException {
    ByteBlockPool pool = new ByteBlockPool(new ByteBlockPool.DirectAllocator());
    ByteSliceWriter writer = new ByteSliceWriter(pool);
    final int start = pool.newSlice(ByteBlockPool.FIRST_LEVEL_SIZE) + pool.byteOffset;
    writer.init(start);
    writer.writeByte((byte) 7);
    writer.writeByte((byte) 9);
    writer.writeByte((byte) 11);
    writer.writeByte((byte) 13);
    // four data bytes still fit in front of the level marker
    assertEquals(start + 4, writer.getAddress());

    ByteSliceReader reader = new ByteSliceReader();
    reader.init(pool, start, writer.getAddress());
    assertEquals(7, reader.readByte());
    assertEquals(9, reader.readByte());
    assertEquals(11, reader.readByte());
    assertEquals(13, reader.readByte());
    assertTrue(reader.eof());

    // the fifth byte forces a new level
    writer.writeByte((byte) 15);
    assertTrue(writer.getAddress() > start + ByteBlockPool.FIRST_LEVEL_SIZE);
    reader.init(pool, start, writer.getAddress());
    for (int expected : new int[] {7, 9, 11, 13, 15}) {
      assertEquals(expected, reader.readByte());
    }
    assertTrue(reader.eof());
  }
}
