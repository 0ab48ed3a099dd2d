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

import org.tessera.codecs.DocValuesConsumer;

/** Buffers the doc values of one field of an in-RAM segment. */
abstract class DocValuesWriter {
  /** Called once all documents of the segment were added. */
  abstract void finish(int numDoc);

  /** Hands the buffered values to the codec. */
  abstract void flush(SegmentWriteState state, DocValuesConsumer consumer) throws IOException;
}
