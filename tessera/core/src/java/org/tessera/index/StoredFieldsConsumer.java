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

import org.tessera.codecs.StoredFieldsWriter;
import org.tessera.util.ArrayUtil;
import org.tessera.util.IOUtils;

/**
 * Writes the stored fields of each document straight through to the
 * codec's {@link StoredFieldsWriter}. Documents without stored fields still
 * get an (empty) entry so that entries line up with doc ids.
 */
final class StoredFieldsConsumer implements IndexingStage {

  // java strings are UTF-16; a stored value may take up to 3 UTF-8 bytes per char
  static final int MAX_STORED_STRING_LENGTH = ArrayUtil.MAX_ARRAY_LENGTH / 3;

  final DocumentsWriterPerThread docWriter;
  StoredFieldsWriter writer;
  int lastDoc;

  StoredFieldsConsumer(DocumentsWriterPerThread docWriter) {
    this.docWriter = docWriter;
    this.lastDoc = -1;
  }

  @Override
  public Kind kind() {
    return Kind.STORED_FIELDS;
  }

  private void initStoredFieldsWriter() throws IOException {
    if (writer == null) {
      this.writer = docWriter.codec.storedFieldsWriter(docWriter.getSegmentName());
    }
  }

  @Override
  public void startDocument(int docID) throws IOException {
    assert lastDoc < docID;
    try {
      initStoredFieldsWriter();
      while (++lastDoc < docID) {
        writer.startDocument();
        writer.finishDocument();
      }
      writer.startDocument();
    } catch (Throwable th) {
      docWriter.onAbortingException(th);
      throw th;
    }
  }

  @Override
  public void processField(IndexingChain.PerField fp, IndexableField field, boolean first) throws IOException {
    final IndexableFieldType fieldType = field.fieldType();
    if (fieldType.stored() == false) {
      return;
    }
    String value = field.stringValue();
    if (value != null && value.length() > MAX_STORED_STRING_LENGTH) {
      throw new IllegalArgumentException("stored field \"" + field.name() + "\" is too large (" + value.length() + " characters) to store");
    }
    try {
      writer.writeField(fp.fieldInfo, field);
    } catch (Throwable th) {
      docWriter.onAbortingException(th);
      throw th;
    }
  }

  @Override
  public void finishField(IndexingChain.PerField fp) {
  }

  @Override
  public void finishDocument() throws IOException {
    try {
      writer.finishDocument();
    } catch (Throwable th) {
      docWriter.onAbortingException(th);
      throw th;
    }
  }

  /** Adds empty entries for the documents at the end of the segment that never reached this stage. */
  void finish(int maxDoc) throws IOException {
    while (lastDoc < maxDoc-1) {
      startDocument(lastDoc+1);
      finishDocument();
    }
  }

  @Override
  public void flush(SegmentWriteState state) throws IOException {
    try {
      initStoredFieldsWriter();
      // every doc id gets an entry, even if the last documents failed before this stage
      finish(state.maxDoc);
      writer.finish(state.fieldInfos, state.maxDoc);
    } finally {
      IOUtils.close(writer);
      writer = null;
    }
  }

  @Override
  public void abort() {
    if (writer != null) {
      try {
        writer.abort();
      } finally {
        IOUtils.closeWhileHandlingException(writer);
        writer = null;
      }
    }
  }
}
