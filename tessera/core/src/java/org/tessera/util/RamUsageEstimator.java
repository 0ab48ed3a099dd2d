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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Estimates the size (memory representation) of Java objects.
 * <p>
 * The numbers assume a 64 bit JVM with compressed object pointers, which is what the
 * flush accounting is calibrated against. They are estimates, not measurements.
 *
 * @tessera.internal
 */
public final class RamUsageEstimator {

  private RamUsageEstimator() {}

  /** Approximate memory usage that we assign to a Hashtable / HashMap entry. */
  public static final long HASHTABLE_RAM_BYTES_PER_ENTRY =
      2L * 4 // key + value refs
      * 2;   // hash tables need to be oversized to avoid collisions, assume 2x capacity

  public static final int NUM_BYTES_OBJECT_REF = 4;

  public static final int NUM_BYTES_OBJECT_HEADER = 12;

  public static final int NUM_BYTES_ARRAY_HEADER = 16;

  public static final int NUM_BYTES_OBJECT_ALIGNMENT = 8;

  private static final Map<Class<?>, Integer> PRIMITIVE_SIZES = new IdentityHashMap<>();
  static {
    PRIMITIVE_SIZES.put(boolean.class, 1);
    PRIMITIVE_SIZES.put(byte.class, 1);
    PRIMITIVE_SIZES.put(char.class, Character.BYTES);
    PRIMITIVE_SIZES.put(short.class, Short.BYTES);
    PRIMITIVE_SIZES.put(int.class, Integer.BYTES);
    PRIMITIVE_SIZES.put(float.class, Float.BYTES);
    PRIMITIVE_SIZES.put(double.class, Double.BYTES);
    PRIMITIVE_SIZES.put(long.class, Long.BYTES);
  }

  /** Aligns an object size to be the next multiple of {@link #NUM_BYTES_OBJECT_ALIGNMENT}. */
  public static long alignObjectSize(long size) {
    size += NUM_BYTES_OBJECT_ALIGNMENT - 1L;
    return size - (size % NUM_BYTES_OBJECT_ALIGNMENT);
  }

  /** Returns the size in bytes of the byte[] object. */
  public static long sizeOf(byte[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + arr.length);
  }

  /** Returns the size in bytes of the int[] object. */
  public static long sizeOf(int[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) Integer.BYTES * arr.length);
  }

  /** Returns the size in bytes of the long[] object. */
  public static long sizeOf(long[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) Long.BYTES * arr.length);
  }

  /** Returns the shallow size in bytes of the Object[] object. */
  public static long shallowSizeOf(Object[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_OBJECT_REF * arr.length);
  }

  /** Size of a {@link BytesRef} together with the bytes it points at. */
  public static long sizeOf(BytesRef ref) {
    return BytesRef.BASE_RAM_BYTES_USED + sizeOf(ref.bytes);
  }

  /**
   * Returns the shallow instance size in bytes an instance of the given class would occupy.
   * This works with all conventional classes and primitive types, but not with arrays
   * (the size then depends on the number of elements and varies from object to object).
   */
  public static long shallowSizeOfInstance(Class<?> clazz) {
    if (clazz.isArray()) {
      throw new IllegalArgumentException("This method does not work with array classes.");
    }
    if (clazz.isPrimitive()) {
      return PRIMITIVE_SIZES.get(clazz);
    }

    long size = NUM_BYTES_OBJECT_HEADER;

    // 沿着继承链累加所有实例字段
    for (; clazz != null; clazz = clazz.getSuperclass()) {
      for (Field f : clazz.getDeclaredFields()) {
        if (!Modifier.isStatic(f.getModifiers())) {
          final Class<?> type = f.getType();
          size += type.isPrimitive() ? PRIMITIVE_SIZES.get(type) : NUM_BYTES_OBJECT_REF;
        }
      }
    }
    return alignObjectSize(size);
  }
}
