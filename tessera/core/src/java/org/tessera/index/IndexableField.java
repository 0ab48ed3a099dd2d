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

import org.tessera.analysis.TokenStream;
import org.tessera.util.BytesRef;

/** Represents a single field for indexing. The indexing chain consumes
 *  Iterable&lt;IndexableField&gt; as a document.
 */
public interface IndexableField {

  /** Field name */
  String name();

  /** {@link IndexableFieldType} describing the properties
   * of this field. */
  IndexableFieldType fieldType();

  /**
   * Creates the TokenStream used for indexing this field.  If appropriate,
   * implementations should use the given TokenStream when possible.
   *
   * @param reuse TokenStream for a previous instance of this field <b>name</b>. This allows
   *              custom field types to reuse a TokenStream.
   * @return TokenStream value for indexing the document.  Should always return
   *         a non-null value if the field is to be indexed
   */
  TokenStream tokenStream(TokenStream reuse);

  /** Non-null if this field has a binary value */
  BytesRef binaryValue();

  /** Non-null if this field has a string value */
  String stringValue();

  /** Non-null if this field has a numeric value */
  Number numericValue();
}
