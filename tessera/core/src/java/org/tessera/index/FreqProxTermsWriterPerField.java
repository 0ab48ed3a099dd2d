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
import java.util.Map;

import org.tessera.analysis.TokenStream;
import org.tessera.codecs.FieldsConsumer;
import org.tessera.codecs.PostingsConsumer;
import org.tessera.codecs.TermStats;
import org.tessera.codecs.TermsConsumer;
import org.tessera.util.BytesRef;
import org.tessera.util.FixedBitSet;

/**
 * Buffers the postings of one field. Stream 0 of every term holds the doc
 * deltas and freqs, stream 1 the positions, payloads and offsets. A common
 * trick here is the {@code << 1} encoding: the low bit tells whether a value
 * follows (freq == 1, payload present) without spending an extra byte.
 */
final class FreqProxTermsWriterPerField extends TermsHashPerField {

  private FreqProxPostingsArray freqProxPostingsArray;

  final boolean hasFreq;
  final boolean hasProx;
  final boolean hasOffsets;
  TokenStream stream;

  /** Set to true if any token had a payload in the current
   *  segment. */
  boolean sawPayloads;

  FreqProxTermsWriterPerField(FieldInvertState invertState, TermsHash termsHash, FieldInfo fieldInfo) {
    super(fieldInfo.getIndexOptions().compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0 ? 2 : 1, invertState, termsHash, fieldInfo);
    IndexOptions indexOptions = fieldInfo.getIndexOptions();
    assert indexOptions != IndexOptions.NONE;
    hasFreq = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS) >= 0;
    hasProx = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
    hasOffsets = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS) >= 0;
  }

  @Override
  void finish() throws IOException {
    if (sawPayloads) {
      fieldInfo.setStorePayloads();
    }
  }

  @Override
  void start(IndexableField f, boolean first) {
    stream = fieldState.tokenStream;
  }

  void writeProx(int termID, int proxCode) {
    final BytesRef payload = stream.getPayload();
    if (payload != null && payload.length > 0) {
      writeVInt(1, (proxCode<<1)|1);
      writeVInt(1, payload.length);
      writeBytes(1, payload.bytes, payload.offset, payload.length);
      sawPayloads = true;
    } else {
      writeVInt(1, proxCode<<1);
    }

    assert postingsArray == freqProxPostingsArray;
    freqProxPostingsArray.lastPositions[termID] = fieldState.position;
  }

  void writeOffsets(int termID, int offsetAccum) {
    final int startOffset = offsetAccum + stream.startOffset();
    final int endOffset = offsetAccum + stream.endOffset();
    assert startOffset - freqProxPostingsArray.lastOffsets[termID] >= 0;
    writeVInt(1, startOffset - freqProxPostingsArray.lastOffsets[termID]);
    writeVInt(1, endOffset - startOffset);
    freqProxPostingsArray.lastOffsets[termID] = startOffset;
  }

  @Override
  void newTerm(final int termID) {
    // First time we're seeing this term since the last
    // flush
    final FreqProxPostingsArray postings = freqProxPostingsArray;

    postings.lastDocIDs[termID] = docState.docID;
    if (!hasFreq) {
      assert postings.termFreqs == null;
      postings.lastDocCodes[termID] = docState.docID;
      fieldState.maxTermFrequency = Math.max(1, fieldState.maxTermFrequency);
    } else {
      postings.lastDocCodes[termID] = docState.docID << 1;
      postings.termFreqs[termID] = 1;
      if (hasProx) {
        writeProx(termID, fieldState.position);
        if (hasOffsets) {
          writeOffsets(termID, fieldState.offset);
        }
      } else {
        assert !hasOffsets;
      }
      fieldState.maxTermFrequency = Math.max(postings.termFreqs[termID], fieldState.maxTermFrequency);
    }
    fieldState.uniqueTermCount++;
  }

  @Override
  void addTerm(final int termID) {
    final FreqProxPostingsArray postings = freqProxPostingsArray;
    assert !hasFreq || postings.termFreqs[termID] > 0;

    if (!hasFreq) {
      assert postings.termFreqs == null;
      if (docState.docID != postings.lastDocIDs[termID]) {
        // New document; now encode docCode for previous doc:
        assert docState.docID > postings.lastDocIDs[termID];
        writeVInt(0, postings.lastDocCodes[termID]);
        postings.lastDocCodes[termID] = docState.docID - postings.lastDocIDs[termID];
        postings.lastDocIDs[termID] = docState.docID;
        fieldState.uniqueTermCount++;
      }
    } else if (docState.docID != postings.lastDocIDs[termID]) {
      assert docState.docID > postings.lastDocIDs[termID]:"id: "+docState.docID + " postings ID: "+ postings.lastDocIDs[termID] + " termID: "+termID;
      // Term not yet seen in the current doc but previously
      // seen in other doc(s) since the last flush

      // Now that we know doc freq for previous doc,
      // write it & lastDocCode
      if (1 == postings.termFreqs[termID]) {
        writeVInt(0, postings.lastDocCodes[termID]|1);
      } else {
        writeVInt(0, postings.lastDocCodes[termID]);
        writeVInt(0, postings.termFreqs[termID]);
      }

      // Init freq for the current document
      postings.termFreqs[termID] = 1;
      fieldState.maxTermFrequency = Math.max(postings.termFreqs[termID], fieldState.maxTermFrequency);
      postings.lastDocCodes[termID] = (docState.docID - postings.lastDocIDs[termID]) << 1;
      postings.lastDocIDs[termID] = docState.docID;
      if (hasProx) {
        writeProx(termID, fieldState.position);
        if (hasOffsets) {
          postings.lastOffsets[termID] = 0;
          writeOffsets(termID, fieldState.offset);
        }
      } else {
        assert !hasOffsets;
      }
      fieldState.uniqueTermCount++;
    } else {
      postings.termFreqs[termID] = Math.addExact(postings.termFreqs[termID], 1);
      fieldState.maxTermFrequency = Math.max(fieldState.maxTermFrequency, postings.termFreqs[termID]);
      if (hasProx) {
        writeProx(termID, fieldState.position-postings.lastPositions[termID]);
        if (hasOffsets) {
          writeOffsets(termID, fieldState.offset);
        }
      }
    }
  }

  @Override
  public void newPostingsArray() {
    freqProxPostingsArray = (FreqProxPostingsArray) postingsArray;
  }

  @Override
  ParallelPostingsArray createPostingsArray(int size) {
    IndexOptions indexOptions = fieldInfo.getIndexOptions();
    assert indexOptions != IndexOptions.NONE;
    boolean hasFreq = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS) >= 0;
    boolean hasProx = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
    boolean hasOffsets = indexOptions.compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS) >= 0;
    return new FreqProxPostingsArray(size, hasFreq, hasProx, hasOffsets);
  }

  /**
   * Clears, in {@code state.liveDocs}, every buffered document below the
   * limit of a segment private delete term of this field. Must run before
   * {@link #sortPostings()} since it looks terms up in the hash.
   */
  void applyDeletes(SegmentWriteState state, Map<Term,Integer> segDeletes) throws IOException {
    final ByteSliceReader freq = new ByteSliceReader();
    for (Map.Entry<Term,Integer> ent : segDeletes.entrySet()) {
      final Term deleteTerm = ent.getKey();
      if (deleteTerm.field().equals(fieldInfo.name) == false) {
        continue;
      }
      final int termID = bytesHash.find(deleteTerm.bytes());
      if (termID < 0) {
        continue;
      }
      final int delDocLimit = ent.getValue();
      final PostingsDecoder docs = new PostingsDecoder(termID, freq, null);
      int doc;
      while ((doc = docs.nextDoc()) != -1 && doc < delDocLimit) {
        if (state.liveDocs == null) {
          state.liveDocs = new FixedBitSet(state.maxDoc);
          state.liveDocs.set(0, state.maxDoc);
        }
        if (state.liveDocs.get(doc)) {
          state.delCountOnFlush++;
          state.liveDocs.clear(doc);
        }
      }
    }
  }

  /**
   * Walks all terms of this field in sorted order, decodes their streams and
   * pushes them into the codec. Deleted documents are still written; the
   * live docs of the segment hide them.
   */
  void flush(FieldsConsumer consumer, SegmentWriteState state) throws IOException {
    assert sortedTermIDs != null : "sortPostings() must be called first";
    final TermsConsumer termsConsumer = consumer.addField(fieldInfo);
    final FixedBitSet visitedDocs = new FixedBitSet(state.maxDoc);
    final ByteSliceReader freq = new ByteSliceReader();
    final ByteSliceReader prox = hasProx ? new ByteSliceReader() : null;
    final BytesRef text = new BytesRef();
    final BytesRef payload = new BytesRef(new byte[10]);

    long sumTotalTermFreq = 0;
    long sumDocFreq = 0;
    final int numTerms = bytesHash.size();
    for (int i = 0; i < numTerms; i++) {
      final int termID = sortedTermIDs[i];
      termBytePool.setBytesRef(text, postingsArray.textStarts[termID]);
      final PostingsConsumer postingsConsumer = termsConsumer.startTerm(text);
      final PostingsDecoder docs = new PostingsDecoder(termID, freq, prox);

      int docFreq = 0;
      long totalTermFreq = 0;
      int doc;
      while ((doc = docs.nextDoc()) != -1) {
        visitedDocs.set(doc);
        docFreq++;
        totalTermFreq += docs.freq;
        postingsConsumer.startDoc(doc, hasFreq ? docs.freq : -1);
        if (hasProx) {
          docs.pushPositions(postingsConsumer, payload);
        }
        postingsConsumer.finishDoc();
      }
      assert docFreq > 0;
      termsConsumer.finishTerm(text, new TermStats(docFreq, hasFreq ? totalTermFreq : -1));
      sumTotalTermFreq += totalTermFreq;
      sumDocFreq += docFreq;
    }
    termsConsumer.finish(hasFreq ? sumTotalTermFreq : -1, sumDocFreq, visitedDocs.cardinality());
  }

  /**
   * Decodes the streams of one term. The doc code of the last document the term
   * occurs in is still held by the postings array, not by stream 0.
   */
  private final class PostingsDecoder {
    private final int termID;
    private final ByteSliceReader freqReader;
    private final ByteSliceReader posReader;
    private boolean ended;
    int docID = 0;
    int freq;

    PostingsDecoder(int termID, ByteSliceReader freqReader, ByteSliceReader posReader) {
      this.termID = termID;
      this.freqReader = freqReader;
      this.posReader = posReader;
      initReader(freqReader, termID, 0);
      if (posReader != null) {
        initReader(posReader, termID, 1);
      }
    }

    /** Returns the next document, or -1 once all are consumed. */
    int nextDoc() throws IOException {
      if (freqReader.eof()) {
        if (ended) {
          return -1;
        }
        ended = true;
        docID = freqProxPostingsArray.lastDocIDs[termID];
        freq = hasFreq ? freqProxPostingsArray.termFreqs[termID] : 1;
      } else {
        final int code = freqReader.readVInt();
        if (!hasFreq) {
          docID += code;
          freq = 1;
        } else {
          docID += code >>> 1;
          if ((code & 1) != 0) {
            freq = 1;
          } else {
            freq = freqReader.readVInt();
          }
        }
        assert docID != freqProxPostingsArray.lastDocIDs[termID];
      }
      return docID;
    }

    /** Reads the positions of the current document from stream 1. */
    void pushPositions(PostingsConsumer consumer, BytesRef payload) throws IOException {
      int position = 0;
      int startOffset = 0;
      for (int i = 0; i < freq; i++) {
        final int code = posReader.readVInt();
        position += code >>> 1;
        BytesRef thisPayload = null;
        if ((code & 1) != 0) {
          final int payloadLength = posReader.readVInt();
          if (payload.bytes.length < payloadLength) {
            payload.bytes = new byte[payloadLength];
          }
          payload.offset = 0;
          payload.length = payloadLength;
          posReader.readBytes(payload.bytes, 0, payloadLength);
          thisPayload = payload;
        }
        int start = -1, end = -1;
        if (hasOffsets) {
          startOffset += posReader.readVInt();
          start = startOffset;
          end = startOffset + posReader.readVInt();
        }
        consumer.addPosition(position, thisPayload, start, end);
      }
    }
  }

  static final class FreqProxPostingsArray extends ParallelPostingsArray {
    FreqProxPostingsArray(int size, boolean writeFreqs, boolean writeProx, boolean writeOffsets) {
      super(size);
      if (writeFreqs) {
        termFreqs = new int[size];
      }
      lastDocIDs = new int[size];
      lastDocCodes = new int[size];
      if (writeProx) {
        lastPositions = new int[size];
        if (writeOffsets) {
          lastOffsets = new int[size];
        }
      } else {
        assert !writeOffsets;
      }
    }

    int termFreqs[];                                   // # times this term occurs in the current doc
    int lastDocIDs[];                                  // Last docID where this term occurred
    int lastDocCodes[];                                // Code for prior doc
    int lastPositions[];                               // Last position where this term occurred
    int lastOffsets[];                                 // Last endOffset where this term occurred

    @Override
    ParallelPostingsArray newInstance(int size) {
      return new FreqProxPostingsArray(size, termFreqs != null, lastPositions != null, lastOffsets != null);
    }

    @Override
    void copyTo(ParallelPostingsArray toArray, int numToCopy) {
      assert toArray instanceof FreqProxPostingsArray;
      FreqProxPostingsArray to = (FreqProxPostingsArray) toArray;

      super.copyTo(toArray, numToCopy);

      System.arraycopy(lastDocIDs, 0, to.lastDocIDs, 0, numToCopy);
      System.arraycopy(lastDocCodes, 0, to.lastDocCodes, 0, numToCopy);
      if (lastPositions != null) {
        assert to.lastPositions != null;
        System.arraycopy(lastPositions, 0, to.lastPositions, 0, numToCopy);
      }
      if (lastOffsets != null) {
        assert to.lastOffsets != null;
        System.arraycopy(lastOffsets, 0, to.lastOffsets, 0, numToCopy);
      }
      if (termFreqs != null) {
        assert to.termFreqs != null;
        System.arraycopy(termFreqs, 0, to.termFreqs, 0, numToCopy);
      }
    }

    @Override
    int bytesPerPosting() {
      int bytes = ParallelPostingsArray.BYTES_PER_POSTING + 2 * Integer.BYTES;
      if (lastPositions != null) {
        bytes += Integer.BYTES;
      }
      if (lastOffsets != null) {
        bytes += Integer.BYTES;
      }
      if (termFreqs != null) {
        bytes += Integer.BYTES;
      }

      return bytes;
    }
  }
}
