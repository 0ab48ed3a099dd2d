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

/**
 * DocValues types. Note that DocValues is strongly typed, so a
 * field cannot have different types across different documents.
 */
public enum DocValuesType {
  /**
   * No doc values for this field.
   */
  NONE,
  /**
   * A per-document numeric value.
   */
  NUMERIC,
  /**
   * A per-document byte[]. Values longer than 32766 bytes are
   * rejected while buffering.
   */
  BINARY,
}
