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
 * Methods for manipulating arrays.
 *
 * @tessera.internal
 */
public final class ArrayUtil {

  /** Maximum length for an array (Integer.MAX_VALUE - RamUsageEstimator.NUM_BYTES_ARRAY_HEADER). */
  public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - RamUsageEstimator.NUM_BYTES_ARRAY_HEADER;

  private ArrayUtil() {} // no instance

  /** Returns an array size &gt;= minTargetSize, generally
   *  over-allocating exponentially to achieve amortized
   *  linear-time cost as the array grows.
   *
   *  @param minTargetSize Minimum required value to be returned.
   *  @param bytesPerElement Bytes used by each element of
   *  the array.  See constants in {@link RamUsageEstimator}.
   */
  public static int oversize(int minTargetSize, int bytesPerElement) {
    if (minTargetSize < 0) {
      // catch usage that accidentally overflows int
      throw new IllegalArgumentException("invalid array size " + minTargetSize);
    }
    if (minTargetSize == 0) {
      return 0;
    }
    if (minTargetSize > MAX_ARRAY_LENGTH) {
      throw new IllegalArgumentException("requested array size " + minTargetSize + " exceeds maximum array in java (" + MAX_ARRAY_LENGTH + ")");
    }

    // 每次多分配约 1/8, 至少 3 个元素
    int extra = minTargetSize >> 3;
    if (extra < 3) {
      extra = 3;
    }
    int newSize = minTargetSize + extra;

    // add 7 to allow for worst case byte alignment addition below:
    if (newSize + 7 < 0 || newSize + 7 > MAX_ARRAY_LENGTH) {
      return MAX_ARRAY_LENGTH;
    }

    // round up to an 8 byte boundary so the array tail is not wasted
    switch (bytesPerElement) {
      case 8:
        return newSize;
      case 4:
        return (newSize + 1) & 0x7ffffffe;
      case 2:
        return (newSize + 3) & 0x7ffffffc;
      case 1:
        return (newSize + 7) & 0x7ffffff8;
      default:
        return newSize;
    }
  }

  /** Returns a larger array, generally over-allocating exponentially */
  public static int[] grow(int[] array, int minSize) {
    assert minSize >= 0 : "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Integer.BYTES));
    }
    return array;
  }

  public static int[] grow(int[] array) {
    return grow(array, 1 + array.length);
  }

  /** Returns a larger array, generally over-allocating exponentially */
  public static long[] grow(long[] array, int minSize) {
    assert minSize >= 0 : "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Long.BYTES));
    }
    return array;
  }

  /** Returns a larger array, generally over-allocating exponentially */
  public static byte[] grow(byte[] array, int minSize) {
    assert minSize >= 0 : "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, Byte.BYTES));
    }
    return array;
  }

  /** Returns a larger array, generally over-allocating exponentially */
  public static <T> T[] grow(T[] array, int minSize) {
    assert minSize >= 0 : "size must be positive (got " + minSize + "): likely integer overflow?";
    if (array.length < minSize) {
      return Arrays.copyOf(array, oversize(minSize, RamUsageEstimator.NUM_BYTES_OBJECT_REF));
    }
    return array;
  }
}
