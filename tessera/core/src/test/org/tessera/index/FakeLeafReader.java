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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.tessera.util.Bits;

/**
 * Leaf reader over a fixed number of documents. Term statistics and per-field
 * statistics are set by the test; -1 stands for "not supported".
 */
class FakeLeafReader extends LeafReader {

  private final int maxDoc;
  private final Map<Term,Integer> docFreqs = new HashMap<>();
  private final Map<String,Long> sumDocFreqs = new HashMap<>();
  final List<Integer> visitedDocs = new ArrayList<>();
  final List<Integer> termVectorDocs = new ArrayList<>();
  boolean failOnClose;

  FakeLeafReader(int maxDoc) {
    this.maxDoc = maxDoc;
  }

  FakeLeafReader setDocFreq(Term term, int docFreq) {
    docFreqs.put(term, docFreq);
    return this;
  }

  FakeLeafReader setSumDocFreq(String field, long sumDocFreq) {
    sumDocFreqs.put(field, sumDocFreq);
    return this;
  }

  @Override
  public Terms terms(String field) {
    final Long sum = sumDocFreqs.get(field);
    if (sum == null) {
      return null;
    }
    return new Terms() {
      @Override
      public long size() {
        return -1;
      }

      @Override
      public long getSumTotalTermFreq() {
        return sum;
      }

      @Override
      public long getSumDocFreq() {
        return sum;
      }

      @Override
      public int getDocCount() {
        return sum == -1 ? -1 : maxDoc;
      }

      @Override
      public boolean hasFreqs() {
        return true;
      }

      @Override
      public boolean hasPositions() {
        return false;
      }

      @Override
      public boolean hasOffsets() {
        return false;
      }
    };
  }

  @Override
  public FieldInfos getFieldInfos() {
    return FieldInfos.EMPTY;
  }

  @Override
  public Bits getLiveDocs() {
    return null;
  }

  @Override
  public Fields getTermVectors(int docID) {
    termVectorDocs.add(docID);
    return null;
  }

  @Override
  public int numDocs() {
    return maxDoc;
  }

  @Override
  public int maxDoc() {
    return maxDoc;
  }

  @Override
  public void document(int docID, StoredFieldVisitor visitor) {
    assert docID >= 0 && docID < maxDoc;
    visitedDocs.add(docID);
  }

  @Override
  public int docFreq(Term term) {
    final Integer df = docFreqs.get(term);
    return df == null ? 0 : df;
  }

  @Override
  public long totalTermFreq(Term term) {
    final Integer df = docFreqs.get(term);
    return df == null ? 0 : df;
  }

  @Override
  protected void doClose() throws IOException {
    if (failOnClose) {
      throw new IOException("fake close failure on reader with maxDoc=" + maxDoc);
    }
  }
}
