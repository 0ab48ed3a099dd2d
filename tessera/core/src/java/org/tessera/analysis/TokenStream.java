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

import java.io.Closeable;
import java.io.IOException;

import org.tessera.util.BytesRef;

/**
 * A <code>TokenStream</code> enumerates the sequence of tokens of one field value.
 * <p>
 * The workflow of the indexing chain is:
 * <ol>
 * <li>{@link #reset()} before the first token,
 * <li>{@link #incrementToken()} until it returns false, reading the current token
 * through the accessors after each successful call,
 * <li>{@link #end()} so the stream can publish its final offset and trailing position
 * increment,
 * <li>{@link #close()}.
 * </ol>
 * Implementations fill the protected token fields in {@link #incrementToken()}.
 */
public abstract class TokenStream implements Closeable {

  /** Bytes of the current token. */
  protected final BytesRef term = new BytesRef();
  /** Position increment of the current token (or, after {@link #end()}, of the trailing gap). */
  protected int positionIncrement = 1;
  /** Start offset of the current token (or the final offset after {@link #end()}). */
  protected int startOffset;
  /** End offset of the current token (or the final offset after {@link #end()}). */
  protected int endOffset;
  /** Payload of the current token, null if none. */
  protected BytesRef payload;

  /** Sole constructor. */
  protected TokenStream() {
  }

  /**
   * Consumers call this method to advance the stream to the next token.
   *
   * @return false for end of stream; true otherwise
   */
  public abstract boolean incrementToken() throws IOException;

  /**
   * Called once before the first {@link #incrementToken()}. Resets the token state.
   */
  public void reset() throws IOException {
    clearToken();
  }

  /**
   * Called after the last token; subclasses set {@link #startOffset}/{@link #endOffset} to the
   * final offset of the value and {@link #positionIncrement} to any trailing gap.
   */
  public void end() throws IOException {
    clearToken();
    positionIncrement = 0;
  }

  /** Releases resources associated with this stream. */
  @Override
  public void close() throws IOException {
  }

  /** Resets the per-token fields to their defaults. */
  protected final void clearToken() {
    term.bytes = BytesRef.EMPTY_BYTES;
    term.offset = 0;
    term.length = 0;
    positionIncrement = 1;
    startOffset = 0;
    endOffset = 0;
    payload = null;
  }

  /** Bytes of the current token; only valid until the next call to {@link #incrementToken()}. */
  public final BytesRef getTermBytes() {
    return term;
  }

  public final int getPositionIncrement() {
    return positionIncrement;
  }

  public final int startOffset() {
    return startOffset;
  }

  public final int endOffset() {
    return endOffset;
  }

  /** Payload of the current token, or null. */
  public final BytesRef getPayload() {
    return payload;
  }
}
