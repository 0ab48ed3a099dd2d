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

import org.tessera.codecs.DocValuesConsumer;
import org.tessera.util.IOUtils;

/**
 * Buffers the numeric and binary doc values of each document, one value per
 * field, and writes them column by column at flush.
 */
final class DocValuesStage implements IndexingStage {

  private final IndexingChain chain;

  DocValuesStage(IndexingChain chain) {
    this.chain = chain;
  }

  @Override
  public Kind kind() {
    return Kind.DOC_VALUES;
  }

  @Override
  public void startDocument(int docID) {
  }

  @Override
  public void processField(IndexingChain.PerField fp, IndexableField field, boolean first) {
    final DocValuesType dvType = field.fieldType().docValuesType();
    if (dvType == DocValuesType.NONE) {
      return;
    }
    // This is the first time we are seeing this field indexed with doc values, so we
    // now record the DV type so that any future attempt to (illegally) change
    // the DV type of this field, will throw an IllegalArgExc:
    chain.fieldInfos.setDocValuesType(fp.fieldInfo, dvType);

    final int docID = chain.docState.docID;
    switch (dvType) {
      case NUMERIC:
        if (fp.docValuesWriter == null) {
          fp.docValuesWriter = new NumericDocValuesWriter(fp.fieldInfo, chain.bytesUsed);
        }
        if (field.numericValue() == null) {
          throw new IllegalArgumentException("field=\"" + fp.fieldInfo.name + "\": null value not allowed");
        }
        ((NumericDocValuesWriter) fp.docValuesWriter).addValue(docID, field.numericValue().longValue());
        break;

      case BINARY:
        if (fp.docValuesWriter == null) {
          fp.docValuesWriter = new BinaryDocValuesWriter(fp.fieldInfo, chain.bytesUsed);
        }
        ((BinaryDocValuesWriter) fp.docValuesWriter).addValue(docID, field.binaryValue());
        break;

      default:
        throw new AssertionError("unrecognized DocValues.Type: " + dvType);
    }
  }

  @Override
  public void finishField(IndexingChain.PerField fp) {
  }

  @Override
  public void finishDocument() {
  }

  @Override
  public void flush(SegmentWriteState state) throws IOException {
    final int maxDoc = state.maxDoc;
    DocValuesConsumer dvConsumer = null;
    boolean success = false;
    try {
      for (IndexingChain.PerField perField : chain.allFields()) {
        if (perField.docValuesWriter != null) {
          if (perField.fieldInfo.getDocValuesType() == DocValuesType.NONE) {
            // BUG
            throw new AssertionError("segment=" + state.segmentName + ": field=\"" + perField.fieldInfo.name + "\" has no docValues but wrote them");
          }
          if (dvConsumer == null) {
            // lazy init
            dvConsumer = chain.docWriter.codec.docValuesConsumer(state);
          }
          perField.docValuesWriter.finish(maxDoc);
          perField.docValuesWriter.flush(state, dvConsumer);
          perField.docValuesWriter = null;
        } else if (perField.fieldInfo.getDocValuesType() != DocValuesType.NONE) {
          // BUG
          throw new AssertionError("segment=" + state.segmentName + ": field=\"" + perField.fieldInfo.name + "\" has docValues but did not write them");
        }
      }
      success = true;
    } finally {
      if (success) {
        IOUtils.close(dvConsumer);
      } else {
        IOUtils.closeWhileHandlingException(dvConsumer);
      }
    }
  }

  @Override
  public void abort() {
  }
}
