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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Sorted union of several sorted iterators. Duplicates are kept: equal
 * elements come out in the order of the iterators that produced them, which
 * is how coalesced delete packets replay their terms.
 * <p>
 * Inputs must be sorted and free of nulls.
 *
 * @tessera.internal
 */
public final class MergedIterator<T extends Comparable<T>> implements Iterator<T> {
  private final PriorityQueue<Source<T>> queue;
  // 上一次 next() 返回元素的来源, 下次调用时再推进
  private Source<T> pending;

  @SafeVarargs
  public MergedIterator(Iterator<T>... iterators) {
    queue = new PriorityQueue<Source<T>>(iterators.length) {
      @Override
      protected boolean lessThan(Source<T> a, Source<T> b) {
        final int cmp = a.head.compareTo(b.head);
        return cmp != 0 ? cmp < 0 : a.ord < b.ord;
      }
    };
    for (int ord = 0; ord < iterators.length; ord++) {
      if (iterators[ord].hasNext()) {
        queue.add(new Source<>(iterators[ord], ord));
      }
    }
  }

  @Override
  public boolean hasNext() {
    advancePending();
    return queue.size() > 0;
  }

  @Override
  public T next() {
    advancePending();
    if (queue.size() == 0) {
      throw new NoSuchElementException();
    }
    pending = queue.top();
    return pending.head;
  }

  private void advancePending() {
    if (pending == null) {
      return;
    }
    assert queue.top() == pending;
    if (pending.iterator.hasNext()) {
      pending.head = pending.iterator.next();
      queue.updateTop();
    } else {
      queue.pop();
    }
    pending = null;
  }

  private static final class Source<T> {
    final Iterator<T> iterator;
    final int ord;
    T head;

    Source(Iterator<T> iterator, int ord) {
      this.iterator = iterator;
      this.ord = ord;
      this.head = iterator.next();
    }
  }
}
