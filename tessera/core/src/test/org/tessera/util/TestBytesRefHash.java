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

import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestBytesRefHash extends RandomizedTest {

  private BytesRefHash hash;
  private ByteBlockPool pool;

  @Before
  public void setUpHash() {
    pool = new ByteBlockPool(new ByteBlockPool.DirectAllocator());
    hash = new BytesRefHash(pool);
  }

  @Test
  public void testAddAndGet() {
    Map<String,Integer> strings = new HashMap<>();
    int num = randomIntBetween(200, 400);
    for (int i = 0; i < num; i++) {
      String str = randomAsciiLettersOfLengthBetween(1, 20);
      int key = hash.add(new BytesRef(str));
      Integer previous = strings.get(str);
      if (previous == null) {
        assertTrue(key >= 0);
        strings.put(str, key);
      } else {
        assertEquals(-(previous + 1), key);
      }
    }
    assertEquals(strings.size(), hash.size());
    BytesRef scratch = new BytesRef();
    for (Map.Entry<String,Integer> entry : strings.entrySet()) {
      assertEquals(entry.getKey(), hash.get(entry.getValue(), scratch).utf8ToString());
      assertEquals(entry.getValue().intValue(), hash.find(new BytesRef(entry.getKey())));
    }
    assertEquals(-1, hash.find(new BytesRef("0 never added")));
  }

  @Test
  public void testSort() {
    TreeSet<String> strings = new TreeSet<>();
    int num = randomIntBetween(200, 400);
    for (int i = 0; i < num; i++) {
      String str = randomAsciiLettersOfLengthBetween(1, 20);
      hash.add(new BytesRef(str));
      strings.add(str);
    }
    int[] sorted = hash.sort();
    assertTrue(strings.size() <= sorted.length);
    int i = 0;
    BytesRef scratch = new BytesRef();
    for (String expected : strings) {
      assertEquals(expected, hash.get(sorted[i++], scratch).utf8ToString());
    }
    hash.clear();
    assertEquals(0, hash.size());
  }

  @Test
  public void testClearAndReuse() {
    for (int round = 0; round < 3; round++) {
      int num = randomIntBetween(50, 100);
      TreeSet<String> strings = new TreeSet<>();
      for (int i = 0; i < num; i++) {
        String str = randomAsciiLettersOfLengthBetween(1, 10);
        hash.add(new BytesRef(str));
        strings.add(str);
      }
      assertEquals(strings.size(), hash.size());
      hash.clear();
      assertEquals(0, hash.size());
      assertEquals(-1, hash.find(new BytesRef(strings.first())));
    }
  }

  @Test
  public void testLargeValue() {
    int[] sizes = new int[] {ByteBlockPool.BYTE_BLOCK_SIZE - 33, ByteBlockPool.BYTE_BLOCK_SIZE - 2};
    for (int size : sizes) {
      BytesRef ref = new BytesRef(new byte[size]);
      ref.bytes[0] = (byte) size;
      assertTrue(hash.add(ref) >= 0);
    }
    assertEquals(2, hash.size());

    BytesRef tooBig = new BytesRef(new byte[ByteBlockPool.BYTE_BLOCK_SIZE - 1]);
    assertThrows(BytesRefHash.MaxBytesLengthExceededException.class, () -> hash.add(tooBig));
    assertEquals(2, hash.size());
  }
}
