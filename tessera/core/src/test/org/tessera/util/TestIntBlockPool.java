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

public class TestIntBlockPool extends RandomizedTest {

  @Test
  public void testSingleWriterReader() {
    IntBlockPool pool = new IntBlockPool();
    for (int j = 0; j < 2; j++) {
      IntBlockPool.SliceWriter writer = new IntBlockPool.SliceWriter(pool);
      int start = writer.startNewSlice();
      int num = randomIntBetween(100, 200);
      for (int i = 0; i < num; i++) {
        writer.writeInt(i);
      }

      int upto = writer.getCurrentOffset();
      IntBlockPool.SliceReader reader = new IntBlockPool.SliceReader(pool);
      reader.reset(start, upto);
      for (int i = 0; i < num; i++) {
        assertEquals(i, reader.readInt());
      }
      assertTrue(reader.endOfSlice());
      pool.reset(true, randomBoolean());
    }
  }

  @Test
  public void testMultipleWriterReader() {
    IntBlockPool pool = new IntBlockPool();
    for (int j = 0; j < 2; j++) {
      List<StartEndAndValues> holders = new ArrayList<>();
      int num = randomIntBetween(4, 8);
      for (int i = 0; i < num; i++) {
        holders.add(new StartEndAndValues(randomIntBetween(0, 999)));
      }
      IntBlockPool.SliceWriter writer = new IntBlockPool.SliceWriter(pool);
      IntBlockPool.SliceReader reader = new IntBlockPool.SliceReader(pool);

      int numValuesToWrite = randomIntBetween(10000, 20000);
      for (int i = 0; i < numValuesToWrite; i++) {
        StartEndAndValues values = holders.get(randomIntBetween(0, holders.size() - 1));
        if (values.valueCount == 0) {
          values.start = writer.startNewSlice();
        } else {
          writer.reset(values.end);
        }
        writer.writeInt(values.nextValue());
        values.end = writer.getCurrentOffset();
        if (randomIntBetween(0, 4) == 0) {
          // pick one and reader the ints
          assertReader(reader, holders.get(randomIntBetween(0, holders.size() - 1)));
        }
      }

      while (!holders.isEmpty()) {
        StartEndAndValues values = holders.remove(randomIntBetween(0, holders.size() - 1));
        assertReader(reader, values);
      }
      pool.reset(true, randomBoolean());
    }
  }

  private static void assertReader(IntBlockPool.SliceReader reader, StartEndAndValues values) {
    reader.reset(values.start, values.end);
    for (int i = 0; i < values.valueCount; i++) {
      assertEquals(values.valueOffset + i, reader.readInt());
    }
    assertTrue(reader.endOfSlice());
  }

  private static class StartEndAndValues {
    int valueOffset;
    int valueCount;
    int start;
    int end;

    StartEndAndValues(int valueOffset) {
      this.valueOffset = valueOffset;
    }

    int nextValue() {
      return valueOffset + valueCount++;
    }
  }
}
