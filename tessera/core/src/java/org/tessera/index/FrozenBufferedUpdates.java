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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

import org.tessera.index.BufferedUpdatesStream.QueryAndLimit;
import org.tessera.index.DocValuesUpdate.BinaryDocValuesUpdate;
import org.tessera.index.DocValuesUpdate.NumericDocValuesUpdate;
import org.tessera.search.Query;
import org.tessera.util.InfoStream;
import org.tessera.util.RamUsageEstimator;

/**
 * Holds buffered deletes and updates by term or query, once pushed. Pushed
 * deletes/updates are write-once, so we shift to more memory efficient data
 * structure to hold them.  We don't hold docIDs because these are applied on
 * flush.
 * 冻结后的删除/更新信息, 不能再追加
 */
final class FrozenBufferedUpdates {

  /* Query we often undercount (say 24 bytes), plus int. */
  final static int BYTES_PER_DEL_QUERY = RamUsageEstimator.NUM_BYTES_OBJECT_REF + Integer.BYTES + 24;

  // Terms, in sorted order:
  final Term[] terms;

  // Parallel array of deleted query, and the docIDUpto for each
  final Query[] queries;
  final int[] queryLimits;

  // numeric DV update term and their updates
  final NumericDocValuesUpdate[] numericDVUpdates;

  // binary DV update term and their updates
  final BinaryDocValuesUpdate[] binaryDVUpdates;

  final int bytesUsed;
  final int numTermDeletes;
  private long gen = -1; // assigned by BufferedUpdatesStream once pushed
  final boolean isSegmentPrivate;  // set to true iff this frozen packet represents
                                   // a segment private deletes. in that case it should
                                   // only have Queries and doc values updates

  FrozenBufferedUpdates(InfoStream infoStream, BufferedUpdates updates, boolean isSegmentPrivate) {
    this.isSegmentPrivate = isSegmentPrivate;
    assert !isSegmentPrivate || updates.deleteTerms.size() == 0 : "segment private package should only have del queries";
    terms = updates.deleteTerms.keySet().toArray(new Term[updates.deleteTerms.size()]);
    Arrays.sort(terms);

    queries = new Query[updates.deleteQueries.size()];
    queryLimits = new int[updates.deleteQueries.size()];
    int upto = 0;
    for(Map.Entry<Query,Integer> ent : updates.deleteQueries.entrySet()) {
      queries[upto] = ent.getKey();
      queryLimits[upto] = ent.getValue();
      upto++;
    }

    List<NumericDocValuesUpdate> allNumericUpdates = new ArrayList<>();
    int numericUpdatesSize = 0;
    for (Map<Term,NumericDocValuesUpdate> numericUpdates : updates.numericUpdates.values()) {
      for (NumericDocValuesUpdate update : numericUpdates.values()) {
        allNumericUpdates.add(update);
        numericUpdatesSize += update.sizeInBytes();
      }
    }
    numericDVUpdates = allNumericUpdates.toArray(new NumericDocValuesUpdate[allNumericUpdates.size()]);

    List<BinaryDocValuesUpdate> allBinaryUpdates = new ArrayList<>();
    int binaryUpdatesSize = 0;
    for (Map<Term,BinaryDocValuesUpdate> binaryUpdates : updates.binaryUpdates.values()) {
      for (BinaryDocValuesUpdate update : binaryUpdates.values()) {
        allBinaryUpdates.add(update);
        binaryUpdatesSize += update.sizeInBytes();
      }
    }
    binaryDVUpdates = allBinaryUpdates.toArray(new BinaryDocValuesUpdate[allBinaryUpdates.size()]);

    long termBytes = 0;
    for (Term term : terms) {
      termBytes += RamUsageEstimator.NUM_BYTES_OBJECT_REF + term.bytes().length + Character.BYTES * term.field().length();
    }
    bytesUsed = (int) (termBytes + queries.length * BYTES_PER_DEL_QUERY
        + numericUpdatesSize + RamUsageEstimator.shallowSizeOf(numericDVUpdates)
        + binaryUpdatesSize + RamUsageEstimator.shallowSizeOf(binaryDVUpdates));

    numTermDeletes = updates.numTermDeletes.get();
    if (infoStream != null && infoStream.isEnabled("BD")) {
      infoStream.message("BD", String.format(Locale.ROOT,
                                             "froze %d to %d bytes for deletes/updates; segment private %s",
                                             updates.ramBytesUsed(), bytesUsed, isSegmentPrivate));
    }
  }

  /** Assigns the generation of this packet; only the stream does this, exactly once. */
  public void setDelGen(long gen) {
    assert this.gen == -1 : "delGen was already set to " + this.gen;
    this.gen = gen;
  }

  public long delGen() {
    assert gen != -1;
    return gen;
  }

  /** The delete terms of this packet, in sorted order. */
  public Iterable<Term> termsIterable() {
    return Arrays.asList(terms);
  }

  public Iterable<QueryAndLimit> queriesIterable() {
    return new Iterable<QueryAndLimit>() {
      @Override
      public Iterator<QueryAndLimit> iterator() {
        return new Iterator<QueryAndLimit>() {
          private int upto;

          @Override
          public boolean hasNext() {
            return upto < queries.length;
          }

          @Override
          public QueryAndLimit next() {
            if (!hasNext()) {
              throw new NoSuchElementException();
            }
            QueryAndLimit ret = new QueryAndLimit(queries[upto], queryLimits[upto]);
            upto++;
            return ret;
          }

          @Override
          public void remove() {
            throw new UnsupportedOperationException();
          }
        };
      }
    };
  }

  @Override
  public String toString() {
    String s = "";
    if (numTermDeletes != 0) {
      s += " " + numTermDeletes + " deleted terms (unique count=" + terms.length + ")";
    }
    if (queries.length != 0) {
      s += " " + queries.length + " deleted queries";
    }
    if (numericDVUpdates.length > 0) {
      s += " " + numericDVUpdates.length + " numeric updates";
    }
    if (binaryDVUpdates.length > 0) {
      s += " " + binaryDVUpdates.length + " binary updates";
    }
    if (bytesUsed != 0) {
      s += " bytesUsed=" + bytesUsed;
    }

    return s;
  }

  boolean any() {
    return terms.length > 0 || queries.length > 0 || numericDVUpdates.length > 0 || binaryDVUpdates.length > 0;
  }
}
