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
package org.tessera.analysis;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Splits a string on whitespace. Used by tokenized fields that carry a plain string
 * instead of their own {@link TokenStream}.
 */
public final class WhitespaceTokenStream extends TokenStream {

  private String value = "";
  private int pos;

  /** Sets the text to tokenize; the stream can then be consumed again. */
  public WhitespaceTokenStream setValue(String value) {
    this.value = value;
    return this;
  }

  @Override
  public void reset() throws IOException {
    super.reset();
    pos = 0;
  }

  @Override
  public boolean incrementToken() {
    clearToken();
    final int len = value.length();
    while (pos < len && Character.isWhitespace(value.charAt(pos))) {
      pos++;
    }
    if (pos == len) {
      return false;
    }
    final int start = pos;
    while (pos < len && !Character.isWhitespace(value.charAt(pos))) {
      pos++;
    }
    final byte[] bytes = value.substring(start, pos).getBytes(StandardCharsets.UTF_8);
    term.bytes = bytes;
    term.length = bytes.length;
    startOffset = start;
    endOffset = pos;
    return true;
  }

  @Override
  public void end() throws IOException {
    super.end();
    startOffset = endOffset = value.length();
  }
}
