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
package org.tessera.codecs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.tessera.index.FieldInfo;
import org.tessera.index.FieldInfos;
import org.tessera.index.IndexableField;
import org.tessera.index.SegmentWriteState;
import org.tessera.util.BytesRef;

/**
 * Codec that keeps everything it is handed in memory, keyed by segment name,
 * so tests can look at what a flush produced. Sinks can be told to fail.
 */
public class RecordingCodec extends Codec {

  /** One posting of one term. */
  public static final class Posting {
    public final int doc;
    public final int freq;
    public final List<Integer> positions = new ArrayList<>();
    public final List<String> payloads = new ArrayList<>();

    Posting(int doc, int freq) {
      this.doc = doc;
      this.freq = freq;
    }

    @Override
    public String toString() {
      return "doc=" + doc + " freq=" + freq + " pos=" + positions;
    }
  }

  /** Everything written for one segment. */
  public static final class SegmentRecord {
    public final String name;
    public final Map<String,Map<String,List<Posting>>> postings = new TreeMap<>();
    public final Map<String,Integer> docCounts = new TreeMap<>();
    public final Map<String,List<Number>> numericValues = new TreeMap<>();
    public final Map<String,List<BytesRef>> binaryValues = new TreeMap<>();
    public final Map<String,List<Number>> norms = new TreeMap<>();
    public final List<List<String>> storedDocs = new ArrayList<>();
    public int storedNumDocs = -1;
    public boolean storedAborted;
    public boolean fieldsClosed;

    SegmentRecord(String name) {
      this.name = name;
    }

    /** Returns the docs the given term was posted for, in posting order. */
    public List<Integer> docs(String field, String term) {
      final Map<String,List<Posting>> terms = postings.get(field);
      if (terms == null || terms.containsKey(term) == false) {
        return Collections.emptyList();
      }
      final List<Integer> docs = new ArrayList<>();
      for (Posting p : terms.get(term)) {
        docs.add(p.doc);
      }
      return docs;
    }
  }

  private final Map<String,SegmentRecord> segments = new ConcurrentHashMap<>();
  private volatile boolean failStoredFields;
  private volatile boolean failPostings;

  public RecordingCodec() {
    super("Recording");
  }

  /** Makes every stored-fields write throw until reset. */
  public void setFailStoredFields(boolean fail) {
    this.failStoredFields = fail;
  }

  /** Makes the postings sink throw when a field is added. */
  public void setFailPostings(boolean fail) {
    this.failPostings = fail;
  }

  public SegmentRecord segment(String name) {
    return segments.get(name);
  }

  public int numSegments() {
    return segments.size();
  }

  private SegmentRecord record(String name) {
    return segments.computeIfAbsent(name, SegmentRecord::new);
  }

  @Override
  public FieldsConsumer fieldsConsumer(SegmentWriteState state) {
    final SegmentRecord record = record(state.segmentName);
    return new FieldsConsumer() {
      @Override
      public TermsConsumer addField(FieldInfo field) throws IOException {
        if (failPostings) {
          throw new IOException("fake postings failure");
        }
        final Map<String,List<Posting>> terms = new TreeMap<>();
        synchronized (record) {
          record.postings.put(field.name, terms);
        }
        return new TermsConsumer() {
          @Override
          public PostingsConsumer startTerm(BytesRef text) {
            final List<Posting> docs = new ArrayList<>();
            terms.put(text.utf8ToString(), docs);
            return new PostingsConsumer() {
              Posting current;

              @Override
              public void startDoc(int docID, int freq) {
                current = new Posting(docID, freq);
                docs.add(current);
              }

              @Override
              public void addPosition(int position, BytesRef payload, int startOffset, int endOffset) {
                current.positions.add(position);
                current.payloads.add(payload == null ? null : payload.utf8ToString());
              }

              @Override
              public void finishDoc() {
                current = null;
              }
            };
          }

          @Override
          public void finishTerm(BytesRef text, TermStats stats) {
            assert stats.docFreq == terms.get(text.utf8ToString()).size();
          }

          @Override
          public void finish(long sumTotalTermFreq, long sumDocFreq, int docCount) {
            synchronized (record) {
              record.docCounts.put(field.name, docCount);
            }
          }
        };
      }

      @Override
      public void close() {
        synchronized (record) {
          record.fieldsClosed = true;
        }
      }
    };
  }

  @Override
  public DocValuesConsumer docValuesConsumer(SegmentWriteState state) {
    final SegmentRecord record = record(state.segmentName);
    return new DocValuesConsumer() {
      @Override
      public void addNumericField(FieldInfo field, Iterable<Number> values) {
        final List<Number> copy = new ArrayList<>();
        for (Number n : values) {
          copy.add(n);
        }
        synchronized (record) {
          record.numericValues.put(field.name, copy);
        }
      }

      @Override
      public void addBinaryField(FieldInfo field, Iterable<BytesRef> values) {
        final List<BytesRef> copy = new ArrayList<>();
        for (BytesRef b : values) {
          copy.add(b == null ? null : BytesRef.deepCopyOf(b));
        }
        synchronized (record) {
          record.binaryValues.put(field.name, copy);
        }
      }

      @Override
      public void close() {
      }
    };
  }

  @Override
  public NormsConsumer normsConsumer(SegmentWriteState state) {
    final SegmentRecord record = record(state.segmentName);
    return new NormsConsumer() {
      @Override
      public void addNormsField(FieldInfo field, Iterable<Number> values) {
        final List<Number> copy = new ArrayList<>();
        for (Number n : values) {
          copy.add(n);
        }
        synchronized (record) {
          record.norms.put(field.name, copy);
        }
      }

      @Override
      public void close() {
      }
    };
  }

  @Override
  public StoredFieldsWriter storedFieldsWriter(String segmentName) {
    final SegmentRecord record = record(segmentName);
    return new StoredFieldsWriter() {
      List<String> current;

      @Override
      public void startDocument() {
        current = new ArrayList<>();
        synchronized (record) {
          record.storedDocs.add(current);
        }
      }

      @Override
      public void writeField(FieldInfo info, IndexableField field) throws IOException {
        if (failStoredFields) {
          throw new IOException("fake stored fields failure");
        }
        final Object value;
        if (field.stringValue() != null) {
          value = field.stringValue();
        } else if (field.numericValue() != null) {
          value = field.numericValue();
        } else {
          value = field.binaryValue().utf8ToString();
        }
        current.add(info.name + "=" + value);
      }

      @Override
      public void abort() {
        synchronized (record) {
          record.storedAborted = true;
        }
      }

      @Override
      public void finish(FieldInfos fis, int numDocs) {
        synchronized (record) {
          record.storedNumDocs = numDocs;
        }
      }

      @Override
      public void close() {
      }
    };
  }
}
