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
package org.tessera.document;

import org.tessera.index.DocValuesType;
import org.tessera.util.BytesRef;

/**
 * A per-document binary doc-values field. At most one value per field and document
 * is accepted, and a value may not exceed the byte-block size.
 * <pre class="prettyprint">
 *   doc.add(new BinaryDocValuesField("thumbnail", new BytesRef(bytes)));
 * </pre>
 * The value is not stored; add a {@link StoredField} as well to read it back.
 */
public class BinaryDocValuesField extends Field {

  /** Frozen type: binary doc values, not indexed, not stored. */
  public static final FieldType TYPE = new FieldType();
  static {
    TYPE.setDocValuesType(DocValuesType.BINARY);
    TYPE.freeze();
  }

  public BinaryDocValuesField(String name, BytesRef value) {
    super(name, TYPE);
    fieldsData = value;
  }
}
