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

/**
 * Per-field counters of the document being inverted: position, length,
 * overlap and offset of the tokens seen so far. The counters carry over from
 * one value of a multi-valued field to the next and feed the field's norm.
 */
final class FieldInvertState {
  final String name;
  final IndexOptions indexOptions;
  int position;
  int length;
  int numOverlap;
  int offset;
  int maxTermFrequency;
  int uniqueTermCount;
  int lastStartOffset;
  int lastPosition;
  // 当前正在消费的 token 流, 由倒排阶段在每个字段实例开始时设置
  TokenStream tokenStream;

  FieldInvertState(String name, IndexOptions indexOptions) {
    this.name = name;
    this.indexOptions = indexOptions;
  }

  /** Called before the first value of the field in a new document. */
  void reset() {
    position = -1;
    length = 0;
    numOverlap = 0;
    offset = 0;
    maxTermFrequency = 0;
    uniqueTermCount = 0;
    lastStartOffset = 0;
    lastPosition = 0;
  }

  /**
   * Accounts one token. Offsets are relative to the current value and get
   * shifted by the end offsets of the values before it.
   *
   * @throws IllegalArgumentException if positions or offsets go backwards,
   *         the position exceeds {@link DocumentsWriterPerThread#MAX_POSITION}
   *         or the field has more than {@link Integer#MAX_VALUE} tokens
   */
  void addToken(int posIncr, int startOffset, int endOffset) {
    position += posIncr;
    if (position < lastPosition) {
      if (posIncr == 0) {
        throw new IllegalArgumentException("first position increment must be > 0 (got 0) for field '" + name + "'");
      } else if (posIncr < 0) {
        throw new IllegalArgumentException("position increment must be >= 0 (got " + posIncr + ") for field '" + name + "'");
      }
      throw new IllegalArgumentException("position overflowed Integer.MAX_VALUE (got posIncr=" + posIncr
          + " lastPosition=" + lastPosition + " position=" + position + ") for field '" + name + "'");
    }
    if (position > DocumentsWriterPerThread.MAX_POSITION) {
      throw new IllegalArgumentException("position " + position + " is too large for field '" + name
          + "': max allowed position is " + DocumentsWriterPerThread.MAX_POSITION);
    }
    lastPosition = position;
    if (posIncr == 0) {
      numOverlap++;
    }

    final int start = offset + startOffset;
    final int end = offset + endOffset;
    if (start < lastStartOffset || end < start) {
      throw new IllegalArgumentException("startOffset must be non-negative, and endOffset must be >= startOffset, "
          + "and offsets must not go backwards startOffset=" + start + ",endOffset=" + end
          + ",lastStartOffset=" + lastStartOffset + " for field '" + name + "'");
    }
    lastStartOffset = start;

    if (length == Integer.MAX_VALUE) {
      throw new IllegalArgumentException("too many tokens for field \"" + name + "\"");
    }
    length++;
  }

  /** Applies the trailing position increment and end offset of a finished value. */
  void endValue(int finalPosIncr, int finalOffset) {
    position += finalPosIncr;
    offset += finalOffset;
  }

  /** Norm of the field: its length without the stacked tokens, or 0 when it had no tokens. */
  long normValue() {
    return length == 0 ? 0 : length - numOverlap;
  }
}
