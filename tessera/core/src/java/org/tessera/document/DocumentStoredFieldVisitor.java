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

import java.util.Objects;

import org.tessera.index.FieldInfo;
import org.tessera.index.StoredFieldVisitor;

/**
 * Rebuilds a {@link Document} from every stored field a leaf reader reports.
 * <p>String values come back as {@link StoredField}s that carry the index
 * options and norms flag recorded in the field's {@link FieldInfo}; all other
 * values come back as plain stored fields.
 */
public class DocumentStoredFieldVisitor extends StoredFieldVisitor {

  private final Document doc = new Document();

  public DocumentStoredFieldVisitor() {
  }

  @Override
  public Status needsField(FieldInfo fieldInfo) {
    return Status.YES;
  }

  @Override
  public void stringField(FieldInfo fieldInfo, String value) {
    Objects.requireNonNull(value, "stored string value must not be null");
    final FieldType type = new FieldType(TextField.TYPE_STORED);
    type.setIndexOptions(fieldInfo.getIndexOptions());
    type.setOmitNorms(fieldInfo.omitsNorms());
    doc.add(new StoredField(fieldInfo.name, value, type));
  }

  @Override
  public void binaryField(FieldInfo fieldInfo, byte[] value) {
    doc.add(new StoredField(fieldInfo.name, value));
  }

  @Override
  public void intField(FieldInfo fieldInfo, int value) {
    doc.add(new StoredField(fieldInfo.name, value));
  }

  @Override
  public void longField(FieldInfo fieldInfo, long value) {
    doc.add(new StoredField(fieldInfo.name, value));
  }

  @Override
  public void doubleField(FieldInfo fieldInfo, double value) {
    doc.add(new StoredField(fieldInfo.name, value));
  }

  /** The document built so far. Only the stored values of its fields are meaningful. */
  public Document getDocument() {
    return doc;
  }
}
