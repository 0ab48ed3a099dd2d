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

import java.io.IOException;

import org.tessera.analysis.TokenStream;
import org.tessera.analysis.WhitespaceTokenStream;
import org.tessera.index.IndexOptions;
import org.tessera.index.IndexableField;
import org.tessera.index.IndexableFieldType;
import org.tessera.util.BytesRef;

/**
 * Expert: directly create a field for a document.  Most
 * users should use one of the sugar subclasses:
 * {@link TextField}, {@link StringField}, {@link StoredField},
 * {@link NumericDocValuesField} or {@link BinaryDocValuesField}.
 *
 * <p> A field is a section of a Document. Each field has three
 * parts: name, type and value. Values may be text
 * (String or pre-tokenized TokenStream), binary
 * (BytesRef), or numeric (a Number).  Fields are
 * optionally stored in the index, so that they may be returned
 * with hits on the document.
 */
public class Field implements IndexableField {

  /**
   * Field's type
   */
  protected final IndexableFieldType type;

  /**
   * Field's name
   */
  protected final String name;

  /** Field's value */
  protected Object fieldsData;

  /** Pre-analyzed tokenStream for indexed fields; this is
   * separate from fieldsData because you are allowed to
   * have both; eg maybe field has a String value but you
   * customize how it's tokenized */
  protected TokenStream tokenStream;

  /**
   * Expert: creates a field with no initial value.
   * Intended only for custom Field subclasses.
   * @param name field name
   * @param type field type
   * @throws IllegalArgumentException if either the name or type
   *         is null.
   */
  protected Field(String name, IndexableFieldType type) {
    if (name == null) {
      throw new IllegalArgumentException("name must not be null");
    }
    this.name = name;
    if (type == null) {
      throw new IllegalArgumentException("type must not be null");
    }
    this.type = type;
  }

  /**
   * Create field with TokenStream value.
   * @param name field name
   * @param tokenStream TokenStream value
   * @param type field type
   * @throws IllegalArgumentException if either the name or type
   *         is null, or if the field's type is stored(), or
   *         if tokenized() is false, or if indexed() is false.
   * @throws NullPointerException if the tokenStream is null
   */
  public Field(String name, TokenStream tokenStream, IndexableFieldType type) {
    this(name, type);
    if (tokenStream == null) {
      throw new NullPointerException("tokenStream must not be null");
    }
    if (type.indexOptions() == IndexOptions.NONE || !type.tokenized()) {
      throw new IllegalArgumentException("TokenStream fields must be indexed and tokenized");
    }
    if (type.stored()) {
      throw new IllegalArgumentException("TokenStream fields cannot be stored");
    }
    this.tokenStream = tokenStream;
  }

  /**
   * Create field with String value.
   * @param name field name
   * @param value string value
   * @param type field type
   * @throws IllegalArgumentException if either the name or value
   *         is null, or if the field's type is neither indexed() nor stored()
   */
  public Field(String name, String value, IndexableFieldType type) {
    this(name, type);
    if (value == null) {
      throw new IllegalArgumentException("value must not be null");
    }
    if (!type.stored() && type.indexOptions() == IndexOptions.NONE) {
      throw new IllegalArgumentException("it doesn't make sense to have a field that "
          + "is neither indexed nor stored");
    }
    this.fieldsData = value;
  }

  /**
   * Create field with binary value.
   *
   * <p>NOTE: the provided BytesRef is not copied so be sure
   * not to change it until you're done with this field.
   * @param name field name
   * @param bytes BytesRef pointing to binary content (not copied)
   * @param type field type
   * @throws IllegalArgumentException if the field name or value is null,
   *         or the field's type is tokenized and indexed
   */
  public Field(String name, BytesRef bytes, IndexableFieldType type) {
    this(name, type);
    if (bytes == null) {
      throw new IllegalArgumentException("bytes must not be null");
    }
    if (type.indexOptions() != IndexOptions.NONE && type.tokenized()) {
      throw new IllegalArgumentException("Fields with BytesRef values cannot be indexed and tokenized");
    }
    this.fieldsData = bytes;
  }

  /**
   * The value of the field as a String, or null. If null, the binary value
   * or the numeric value is used.
   */
  @Override
  public String stringValue() {
    if (fieldsData instanceof CharSequence || fieldsData instanceof Number) {
      return fieldsData.toString();
    } else {
      return null;
    }
  }

  @Override
  public Number numericValue() {
    if (fieldsData instanceof Number) {
      return (Number) fieldsData;
    } else {
      return null;
    }
  }

  @Override
  public BytesRef binaryValue() {
    if (fieldsData instanceof BytesRef) {
      return (BytesRef) fieldsData;
    } else {
      return null;
    }
  }

  @Override
  public String name() {
    return name;
  }

  /**
   * Returns the {@link FieldType} for this field.
   */
  @Override
  public IndexableFieldType fieldType() {
    return type;
  }

  @Override
  public TokenStream tokenStream(TokenStream reuse) {
    if (fieldType().indexOptions() == IndexOptions.NONE) {
      // Not indexed
      return null;
    }

    if (tokenStream != null) {
      return tokenStream;
    }

    if (!fieldType().tokenized()) {
      // 不分词: 整个值作为一个 token
      final BytesRef value;
      if (fieldsData instanceof BytesRef) {
        value = (BytesRef) fieldsData;
      } else if (stringValue() != null) {
        value = new BytesRef(stringValue());
      } else {
        throw new IllegalArgumentException("Non-Tokenized Fields must have a String value");
      }
      final SingleTokenStream stream = reuse instanceof SingleTokenStream ? (SingleTokenStream) reuse : new SingleTokenStream();
      return stream.setValue(value, stringValue() == null ? value.length : stringValue().length());
    }

    if (stringValue() != null) {
      final WhitespaceTokenStream stream = reuse instanceof WhitespaceTokenStream ? (WhitespaceTokenStream) reuse : new WhitespaceTokenStream();
      return stream.setValue(stringValue());
    }

    throw new IllegalArgumentException("Field must have either TokenStream, String or BytesRef value");
  }

  /** Emits the whole field value as one token. */
  private static final class SingleTokenStream extends TokenStream {
    private BytesRef value;
    private int valueLength;
    private boolean used = true;

    SingleTokenStream setValue(BytesRef value, int valueLength) {
      this.value = value;
      this.valueLength = valueLength;
      return this;
    }

    @Override
    public boolean incrementToken() {
      if (used) {
        return false;
      }
      clearToken();
      term.bytes = value.bytes;
      term.offset = value.offset;
      term.length = value.length;
      startOffset = 0;
      endOffset = valueLength;
      used = true;
      return true;
    }

    @Override
    public void reset() throws IOException {
      super.reset();
      used = false;
    }

    @Override
    public void end() throws IOException {
      super.end();
      startOffset = endOffset = valueLength;
    }
  }

  @Override
  public String toString() {
    StringBuilder result = new StringBuilder();
    result.append(type.toString());
    result.append('<');
    result.append(name);
    result.append(':');

    if (fieldsData != null) {
      result.append(fieldsData);
    }

    result.append('>');
    return result.toString();
  }

  /** Specifies whether and how a field should be stored. */
  public enum Store {

    /** Store the original field value in the index. This is useful for short texts
     * like a document's title which should be displayed with the results. The
     * value is stored in its original form, i.e. no analyzer is used before it is
     * stored.
     */
    YES,

    /** Do not store the field value in the index. */
    NO
  }
}
