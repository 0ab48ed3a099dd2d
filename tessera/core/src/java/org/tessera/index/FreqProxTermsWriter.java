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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.tessera.codecs.FieldsConsumer;
import org.tessera.util.IOUtils;

/**
 * Turns the buffered terms of every inverted field into postings at flush.
 */
final class FreqProxTermsWriter extends TermsHash {

  FreqProxTermsWriter(DocumentsWriterPerThread docWriter) {
    super(docWriter, true);
  }

  @Override
  void flush(Map<String,TermsHashPerField> fieldsToFlush, final SegmentWriteState state) throws IOException {
    // Gather all fields that saw any postings:
    List<FreqProxTermsWriterPerField> allFields = new ArrayList<>();

    for (TermsHashPerField f : fieldsToFlush.values()) {
      final FreqProxTermsWriterPerField perField = (FreqProxTermsWriterPerField) f;
      if (perField.bytesHash.size() > 0) {
        assert perField.fieldInfo.getIndexOptions() != IndexOptions.NONE;
        allFields.add(perField);
      }
    }

    // Sort by field name
    Collections.sort(allFields);

    // Process any pending Term deletes for this newly
    // flushed segment; the lookups need the hash before it is sorted:
    if (state.segUpdates != null && state.segUpdates.deleteTerms.size() > 0) {
      for (FreqProxTermsWriterPerField perField : allFields) {
        perField.applyDeletes(state, state.segUpdates.deleteTerms);
      }
    }

    for (FreqProxTermsWriterPerField perField : allFields) {
      perField.sortPostings();
    }

    FieldsConsumer consumer = docWriter.codec.fieldsConsumer(state);
    boolean success = false;
    try {
      for (FreqProxTermsWriterPerField perField : allFields) {
        perField.flush(consumer, state);
      }
      success = true;
    } finally {
      if (success) {
        IOUtils.close(consumer);
      } else {
        IOUtils.closeWhileHandlingException(consumer);
      }
    }
  }

  @Override
  TermsHashPerField addField(FieldInvertState invertState, FieldInfo fieldInfo) {
    return new FreqProxTermsWriterPerField(invertState, this, fieldInfo);
  }
}
