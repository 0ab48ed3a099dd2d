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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.tessera.analysis.TokenStream;
import org.tessera.util.ArrayUtil;
import org.tessera.util.Counter;
import org.tessera.util.IOUtils;
import org.tessera.util.InfoStream;
import org.tessera.util.RamUsageEstimator;

/**
 * Default general purpose indexing chain, which handles
 * indexing all types of fields. Each document is run through an
 * explicit, ordered list of {@link IndexingStage}s.
 */
final class IndexingChain {

  final Counter bytesUsed;
  final DocumentsWriterPerThread.DocState docState;
  final DocumentsWriterPerThread docWriter;
  final FieldInfos.Builder fieldInfos;
  final InfoStream infoStream;

  private final List<IndexingStage> stages;

  // Holds all fields seen in current doc
  PerField[] fields = new PerField[1];
  // How many indexed field names we've seen in the current doc (collapses
  // multiple field instances by the same name):
  private int fieldCount;

  private PerField[] fieldHash = new PerField[2];
  private int hashMask = 1;

  private int totalFieldCount;
  private long nextFieldGen;

  IndexingChain(DocumentsWriterPerThread docWriter) {
    this.docWriter = docWriter;
    this.fieldInfos = docWriter.getFieldInfosBuilder();
    this.docState = docWriter.docState;
    this.bytesUsed = docWriter.bytesUsed;
    this.infoStream = docWriter.infoStream;

    final List<IndexingStage> stages = new ArrayList<>();
    stages.add(new InvertingStage(this, new FreqProxTermsWriter(docWriter)));
    stages.add(new NormsStage(this));
    stages.add(new DocValuesStage(this));
    stages.add(new StoredFieldsConsumer(docWriter));
    this.stages = Collections.unmodifiableList(stages);
  }

  /** The stages in the order they see every document. */
  List<IndexingStage> stages() {
    return stages;
  }

  /** Writes the buffered segment through every stage, in order. */
  void flush(SegmentWriteState state) throws IOException {
    for (IndexingStage stage : stages) {
      long t0 = System.nanoTime();
      stage.flush(state);
      if (infoStream.isEnabled("DWPT")) {
        infoStream.message("DWPT", ((System.nanoTime()-t0)/1000000) + " msec to flush " + stage.kind());
      }
    }
  }

  /**
   * Aborts every stage. A failing stage does not stop the others; the first
   * failure is rethrown with the later ones suppressed.
   */
  void abort() throws IOException {
    Throwable th = null;
    try {
      for (IndexingStage stage : stages) {
        try {
          stage.abort();
        } catch (Throwable t) {
          th = IOUtils.useOrSuppress(th, t);
        }
      }
    } finally {
      Arrays.fill(fieldHash, null);
    }
    if (th != null) {
      throw IOUtils.rethrowAlways(th);
    }
  }

  private void rehash() {
    int newHashSize = (fieldHash.length*2);
    assert newHashSize > fieldHash.length;

    PerField newHashArray[] = new PerField[newHashSize];

    // Rehash
    int newHashMask = newHashSize-1;
    for(int j=0;j<fieldHash.length;j++) {
      PerField fp0 = fieldHash[j];
      while(fp0 != null) {
        final int hashPos2 = fp0.fieldInfo.name.hashCode() & newHashMask;
        PerField nextFP0 = fp0.next;
        fp0.next = newHashArray[hashPos2];
        newHashArray[hashPos2] = fp0;
        fp0 = nextFP0;
      }
    }

    fieldHash = newHashArray;
    hashMask = newHashMask;
  }

  void processDocument() throws IOException {
    fieldCount = 0;

    long fieldGen = nextFieldGen++;

    for (IndexingStage stage : stages) {
      stage.startDocument(docState.docID);
    }
    try {
      for (IndexableField field : docState.doc) {
        processField(field, fieldGen);
      }
    } finally {
      if (docWriter.hasHitAbortingException() == false) {
        // Finish each indexed field name seen in the document:
        for (int i=0;i<fieldCount;i++) {
          for (IndexingStage stage : stages) {
            stage.finishField(fields[i]);
          }
        }
        for (IndexingStage stage : stages) {
          stage.finishDocument();
        }
      }
    }
  }

  private void processField(IndexableField field, long fieldGen) throws IOException {
    String fieldName = field.name();
    IndexableFieldType fieldType = field.fieldType();

    if (fieldType.indexOptions() == null) {
      throw new NullPointerException("IndexOptions must not be null (field: \"" + field.name() + "\")");
    }
    if (fieldType.docValuesType() == null) {
      throw new NullPointerException("docValuesType must not be null (field: \"" + fieldName + "\")");
    }

    final boolean indexed = fieldType.indexOptions() != IndexOptions.NONE;
    if (indexed == false && fieldType.stored() == false && fieldType.docValuesType() == DocValuesType.NONE) {
      // 既不倒排也不存储也无 doc values: 没有阶段需要它
      return;
    }

    PerField fp = getOrAddField(fieldName);
    boolean first = indexed && fp.fieldGen != fieldGen;
    if (first) {
      // finishField runs for this field even if one of its instances fails
      fields[fieldCount++] = fp;
      fp.fieldGen = fieldGen;
    }

    for (IndexingStage stage : stages) {
      stage.processField(fp, field, first);
    }
  }

  /** Returns a previously created {@link PerField}, or null
   *  if this field name wasn't seen yet. */
  PerField getPerField(String name) {
    final int hashPos = name.hashCode() & hashMask;
    PerField fp = fieldHash[hashPos];
    while (fp != null && !fp.fieldInfo.name.equals(name)) {
      fp = fp.next;
    }
    return fp;
  }

  /** Every field seen since the last flush, in no particular order. */
  List<PerField> allFields() {
    final List<PerField> all = new ArrayList<>(totalFieldCount);
    for (int i=0;i<fieldHash.length;i++) {
      PerField perField = fieldHash[i];
      while (perField != null) {
        all.add(perField);
        perField = perField.next;
      }
    }
    return all;
  }

  /** Returns a previously created {@link PerField},
   *  or creates a new {@link PerField} if this field name
   *  wasn't seen yet. */
  private PerField getOrAddField(String name) {

    // Make sure we have a PerField allocated
    final int hashPos = name.hashCode() & hashMask;
    PerField fp = fieldHash[hashPos];
    while (fp != null && !fp.fieldInfo.name.equals(name)) {
      fp = fp.next;
    }

    if (fp == null) {
      // First time we are seeing this field in this segment

      FieldInfo fi = fieldInfos.getOrAdd(name);
      fp = new PerField(fi);
      fp.next = fieldHash[hashPos];
      fieldHash[hashPos] = fp;
      totalFieldCount++;

      // At most 50% load factor:
      if (totalFieldCount >= fieldHash.length/2) {
        rehash();
      }

      if (totalFieldCount > fields.length) {
        PerField[] newFields = new PerField[ArrayUtil.oversize(totalFieldCount, RamUsageEstimator.NUM_BYTES_OBJECT_REF)];
        System.arraycopy(fields, 0, newFields, 0, fields.length);
        fields = newFields;
      }
    }

    return fp;
  }

  /**
   * Per segment state of one field name. Each stage keeps what it buffers
   * for the field here.
   */
  static final class PerField implements Comparable<PerField> {

    final FieldInfo fieldInfo;

    // 以下由倒排阶段在字段第一次被索引时初始化
    FieldInvertState invertState;
    TermsHashPerField termsHashPerField;
    TokenStream tokenStream;

    NormValuesWriter norms;

    DocValuesWriter docValuesWriter;

    // We use this to know when a PerField is seen for the
    // first time in the current document.
    long fieldGen = -1;

    // Used by the hash table
    PerField next;

    PerField(FieldInfo fieldInfo) {
      this.fieldInfo = fieldInfo;
    }

    @Override
    public int compareTo(PerField other) {
      return this.fieldInfo.name.compareTo(other.fieldInfo.name);
    }

    @Override
    public String toString() {
      return "PerField(" + fieldInfo.name + ")";
    }
  }
}
