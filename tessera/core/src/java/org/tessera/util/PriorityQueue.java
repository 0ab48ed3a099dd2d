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

/**
 * Bounded binary min-heap ordered by {@link #lessThan}. Unlike
 * {@link java.util.PriorityQueue} it lets the caller change the top element in
 * place and restore the order with {@link #updateTop()}, which is what k-way
 * merges need.
 *
 * @tessera.internal
 */
public abstract class PriorityQueue<T> {
  // 以 1 为下标起点的二叉堆, heap[0] 不使用
  private final T[] heap;
  private int size;

  @SuppressWarnings("unchecked")
  public PriorityQueue(int maxSize) {
    if (maxSize < 0 || maxSize >= ArrayUtil.MAX_ARRAY_LENGTH) {
      throw new IllegalArgumentException("maxSize must be >= 0 and < " + ArrayUtil.MAX_ARRAY_LENGTH + "; got: " + maxSize);
    }
    // one spare slot so top() of an empty queue reads null
    heap = (T[]) new Object[Math.max(2, maxSize + 1)];
  }

  /** Whether {@code a} sorts before {@code b}. */
  protected abstract boolean lessThan(T a, T b);

  /**
   * Adds {@code element}; adding more than {@code maxSize} elements throws
   * {@link ArrayIndexOutOfBoundsException}.
   */
  public final void add(T element) {
    heap[++size] = element;
    siftUp(size);
  }

  /** The least element, or {@code null} when empty. */
  public final T top() {
    return heap[1];
  }

  /** Removes and returns the least element, or {@code null} when empty. */
  public final T pop() {
    if (size == 0) {
      return null;
    }
    final T result = heap[1];
    heap[1] = heap[size];
    heap[size--] = null;
    siftDown(1);
    return result;
  }

  /** Restores the heap order after the top element changed its value. */
  public final T updateTop() {
    siftDown(1);
    return heap[1];
  }

  public final int size() {
    return size;
  }

  private void siftUp(int pos) {
    final T node = heap[pos];
    int parent = pos >>> 1;
    while (parent > 0 && lessThan(node, heap[parent])) {
      heap[pos] = heap[parent];
      pos = parent;
      parent >>>= 1;
    }
    heap[pos] = node;
  }

  private void siftDown(int pos) {
    final T node = heap[pos];
    while (true) {
      int child = pos << 1;
      if (child > size) {
        break;
      }
      if (child < size && lessThan(heap[child + 1], heap[child])) {
        child++;
      }
      if (lessThan(heap[child], node) == false) {
        break;
      }
      heap[pos] = heap[child];
      pos = child;
    }
    heap[pos] = node;
  }
}
