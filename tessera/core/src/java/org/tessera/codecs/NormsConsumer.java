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

import java.io.Closeable;
import java.io.IOException;

import org.tessera.index.FieldInfo;

/**
 * Receives the norms of one segment at flush, one call per indexed field that
 * keeps norms. The consumer is closed once every field was added.
 *
 * @tessera.experimental
 */
public abstract class NormsConsumer implements Closeable {

  protected NormsConsumer() {}

  /**
   * Adds the norms of one field.
   * @param field the field
   * @param values a lazy sequence with one value per document of the
   *        segment in doc id order; documents without the field report {@code 0}
   */
  public abstract void addNormsField(FieldInfo field, Iterable<Number> values) throws IOException;
}
