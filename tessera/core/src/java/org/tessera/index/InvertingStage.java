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
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.tessera.analysis.TokenStream;
import org.tessera.util.BytesRef;
import org.tessera.util.BytesRefHash.MaxBytesLengthExceededException;

/**
 * Inverts every indexed field instance into the terms hash: pulls the
 * tokens, tracks positions and offsets per field and hands each token to the
 * field's {@link TermsHashPerField}.
 */
final class InvertingStage implements IndexingStage {

  private final IndexingChain chain;
  private final TermsHash termsHash;

  InvertingStage(IndexingChain chain, TermsHash termsHash) {
    this.chain = chain;
    this.termsHash = termsHash;
  }

  @Override
  public Kind kind() {
    return Kind.TERMS_HASH;
  }

  @Override
  public void startDocument(int docID) throws IOException {
    termsHash.startDocument();
  }

  @Override
  public void processField(IndexingChain.PerField fp, IndexableField field, boolean first) throws IOException {
    final IndexableFieldType fieldType = field.fieldType();
    final IndexOptions indexOptions = fieldType.indexOptions();
    if (indexOptions == IndexOptions.NONE) {
      return;
    }
    final FieldInfo fieldInfo = fp.fieldInfo;

    if (fp.invertState == null) {
      // first time this field is inverted in this segment
      fieldInfo.setIndexOptions(indexOptions, fieldType.omitNorms());
      fp.invertState = new FieldInvertState(fieldInfo.name, fieldInfo.getIndexOptions());
      fp.termsHashPerField = termsHash.addField(fp.invertState, fieldInfo);
    } else if (fp.invertState.indexOptions != indexOptions) {
      // the postings of this field are already encoded for the other options
      throw new IllegalArgumentException("cannot change field \"" + fieldInfo.name + "\" from index options="
          + fp.invertState.indexOptions + " to inconsistent index options=" + indexOptions);
    } else {
      fieldInfo.setIndexOptions(indexOptions, fieldType.omitNorms());
    }

    invert(fp, field, first);
  }

  private void invert(IndexingChain.PerField fp, IndexableField field, boolean first) throws IOException {
    final FieldInvertState invertState = fp.invertState;
    if (first) {
      // First time we're seeing this field (indexed) in
      // this document:
      invertState.reset();
    }

    /*
     * To assist people in tracking down problems in analysis components, we wish to write the field name to the infostream
     * when we fail. We expect some caller to eventually deal with the real exception, so we don't want any 'catch' clauses,
     * but rather a finally that takes note of the problem.
     */
    boolean succeededInProcessingField = false;
    try (TokenStream stream = fp.tokenStream = field.tokenStream(fp.tokenStream)) {
      // reset the TokenStream to the first token
      stream.reset();
      invertState.tokenStream = stream;
      fp.termsHashPerField.start(field, first);

      while (stream.incrementToken()) {

        // If we hit an exception in stream.next below
        // (which is fairly common, e.g. if analyzer
        // chokes on a given document), then it's
        // non-aborting and (above) this one document
        // will be marked as deleted, but still
        // consume a docID

        invertState.addToken(stream.getPositionIncrement(), stream.startOffset(), stream.endOffset());

        // If we hit an exception in here, we abort
        // all buffered documents since the last
        // flush, on the likelihood that the
        // internal state of the terms hash is now
        // corrupt and should not be flushed to a
        // new segment:
        try {
          fp.termsHashPerField.add();
        } catch (MaxBytesLengthExceededException e) {
          byte[] prefix = new byte[30];
          BytesRef bigTerm = stream.getTermBytes();
          System.arraycopy(bigTerm.bytes, bigTerm.offset, prefix, 0, 30);
          String msg = "Document contains at least one immense term in field=\"" + fp.fieldInfo.name + "\" (whose UTF8 encoding is longer than the max length " + DocumentsWriterPerThread.MAX_TERM_LENGTH_UTF8 + "), all of which were skipped.  Please correct the analyzer to not produce such terms.  The prefix of the first immense term is: '" + Arrays.toString(prefix) + "...', original message: " + e.getMessage();
          if (chain.infoStream.isEnabled("DWPT")) {
            chain.infoStream.message("DWPT", "ERROR: " + msg);
          }
          // Document will be deleted above:
          throw new IllegalArgumentException(msg, e);
        } catch (Throwable th) {
          chain.docWriter.onAbortingException(th);
          throw th;
        }
      }

      // trigger streams to perform end-of-stream operations
      stream.end();

      invertState.endValue(stream.getPositionIncrement(), stream.endOffset());

      /* if there is an exception coming through, we won't set this to true here:*/
      succeededInProcessingField = true;
    } finally {
      if (!succeededInProcessingField && chain.infoStream.isEnabled("DW")) {
        chain.infoStream.message("DW", "An exception was thrown while processing field " + fp.fieldInfo.name);
      }
    }
  }

  @Override
  public void finishField(IndexingChain.PerField fp) throws IOException {
    if (fp.termsHashPerField != null) {
      fp.termsHashPerField.finish();
    }
  }

  @Override
  public void finishDocument() throws IOException {
    try {
      termsHash.finishDocument();
    } catch (Throwable th) {
      // Must abort, on the possibility that the buffered
      // postings are now corrupt:
      chain.docWriter.onAbortingException(th);
      throw th;
    }
  }

  @Override
  public void flush(SegmentWriteState state) throws IOException {
    Map<String,TermsHashPerField> fieldsToFlush = new HashMap<>();
    for (IndexingChain.PerField perField : chain.allFields()) {
      if (perField.invertState != null) {
        fieldsToFlush.put(perField.fieldInfo.name, perField.termsHashPerField);
      }
    }
    termsHash.flush(fieldsToFlush, state);
  }

  @Override
  public void abort() {
    termsHash.abort();
  }
}
