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
import java.util.Objects;

import org.tessera.index.SegmentWriteState;

/**
 * Encodes/decodes an inverted index segment.
 * <p>
 * The indexing core only writes through a codec: at flush time it asks for one
 * consumer per kind of data and pushes the buffered segment into it. The on-disk
 * representation is entirely up to the implementation.
 * <p>
 * Each consumer is opened for exactly one segment and closed by the caller
 * once all fields were written.
 */
public abstract class Codec {

  private final String name;

  /**
   * Creates a new codec.
   * @param name the codec's name, used in diagnostics only.
   */
  protected Codec(String name) {
    this.name = Objects.requireNonNull(name, "name must not be null");
  }

  /** Returns this codec's name */
  public final String getName() {
    return name;
  }

  /** Returns the consumer receiving the inverted fields (postings) of a flushed segment. */
  public abstract FieldsConsumer fieldsConsumer(SegmentWriteState state) throws IOException;

  /** Returns the consumer receiving per-document values of a flushed segment. */
  public abstract DocValuesConsumer docValuesConsumer(SegmentWriteState state) throws IOException;

  /** Returns the consumer receiving the normalization values of a flushed segment. */
  public abstract NormsConsumer normsConsumer(SegmentWriteState state) throws IOException;

  /**
   * Returns the writer for stored fields. Unlike the other consumers this one is opened
   * lazily on the first document of a segment and is fed document by document.
   */
  public abstract StoredFieldsWriter storedFieldsWriter(String segmentName) throws IOException;

  @Override
  public String toString() {
    return name;
  }
}
