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

import org.tessera.codecs.NormsConsumer;
import org.tessera.util.IOUtils;

/**
 * Buffers one normalization value per document for every indexed field
 * that keeps norms: the number of positions that did not overlap the
 * previous token.
 */
final class NormsStage implements IndexingStage {

  private final IndexingChain chain;

  NormsStage(IndexingChain chain) {
    this.chain = chain;
  }

  @Override
  public Kind kind() {
    return Kind.NORMS;
  }

  @Override
  public void startDocument(int docID) {
  }

  @Override
  public void processField(IndexingChain.PerField fp, IndexableField field, boolean first) {
  }

  @Override
  public void finishField(IndexingChain.PerField fp) {
    final FieldInfo fi = fp.fieldInfo;
    if (fi.hasNorms() == false) {
      return;
    }
    if (fp.norms == null) {
      fp.norms = new NormValuesWriter(fi, chain.bytesUsed);
    }
    fp.norms.addValue(chain.docState.docID, fp.invertState.normValue());
  }

  @Override
  public void finishDocument() {
  }

  @Override
  public void flush(SegmentWriteState state) throws IOException {
    boolean success = false;
    NormsConsumer normsConsumer = null;
    try {
      if (state.fieldInfos.hasNorms()) {
        normsConsumer = chain.docWriter.codec.normsConsumer(state);

        for (FieldInfo fi : state.fieldInfos) {
          // we must check the final value of omitNorms for the fieldinfo: it could have
          // changed for this field since the first time we added it.
          if (fi.hasNorms()) {
            IndexingChain.PerField perField = chain.getPerField(fi.name);
            assert perField != null && perField.norms != null : "field=" + fi.name;
            perField.norms.finish(state.maxDoc);
            perField.norms.flush(state, normsConsumer);
          }
        }
      }
      success = true;
    } finally {
      if (success) {
        IOUtils.close(normsConsumer);
      } else {
        IOUtils.closeWhileHandlingException(normsConsumer);
      }
    }
  }

  @Override
  public void abort() {
    // buffered values go away with the chain's field hash
  }
}
