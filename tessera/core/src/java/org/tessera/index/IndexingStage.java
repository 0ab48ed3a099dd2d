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

/**
 * One step of the {@link IndexingChain}. The chain calls every stage, in the
 * order it holds them, for each document and each field instance; a stage
 * ignores fields it has nothing to do with.
 */
interface IndexingStage {

  /** What a stage buffers for the segment. */
  enum Kind {
    /** Inverts indexed fields into the terms hash. */
    TERMS_HASH,
    /** One normalization value per indexed field and document. */
    NORMS,
    /** Numeric and binary doc values. */
    DOC_VALUES,
    /** Stored field values, written through as documents arrive. */
    STORED_FIELDS
  }

  Kind kind();

  /** Called before the first field of document {@code docID}. */
  void startDocument(int docID) throws IOException;

  /**
   * Consumes one field instance; {@code first} is true if this is the first
   * time the field name is seen in the current document.
   */
  void processField(IndexingChain.PerField fp, IndexableField field, boolean first) throws IOException;

  /** Called once per field inverted in the current document, after its last instance. */
  void finishField(IndexingChain.PerField fp) throws IOException;

  /** Called after all fields of the current document. */
  void finishDocument() throws IOException;

  /** Writes everything buffered for the segment to the codec. */
  void flush(SegmentWriteState state) throws IOException;

  /** Drops everything buffered; the segment will not be written. */
  void abort() throws IOException;
}
