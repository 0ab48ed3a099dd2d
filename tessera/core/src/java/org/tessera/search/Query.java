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
package org.tessera.search;

/**
 * The abstract base class for queries.
 * <p>Within the indexing core a query is only an opaque delete key: it is buffered,
 * frozen and coalesced together with the document id limit it applies to, and
 * handed to the segment owner that knows how to run it.
 * <p>Implementations must override {@link #equals(Object)} and {@link #hashCode()}
 * so that buffering the same query twice keeps a single entry.
 */
public abstract class Query {

  /** Sole constructor. (For invocation by subclass
   *  constructors, typically implicit.) */
  protected Query() {
  }

  /** Prints a query to a string, with <code>field</code> assumed to be the
   * default field and omitted.
   */
  public abstract String toString(String field);

  /** Prints a query to a string. */
  @Override
  public final String toString() {
    return toString("");
  }

  /**
   * Override and implement query instance equivalence properly in a subclass.
   * This is required so that buffered deletes can collapse equal queries.
   */
  @Override
  public abstract boolean equals(Object obj);

  /**
   * Override and implement query hash code properly in a subclass.
   * This is required so that buffered deletes can collapse equal queries.
   */
  @Override
  public abstract int hashCode();

  /**
   * Utility method to check whether <code>other</code> is not null and is exactly
   * of the same class as this object's class.
   */
  protected final boolean sameClassAs(Object other) {
    return other != null && getClass() == other.getClass();
  }

  private final int CLASS_NAME_HASH = getClass().getName().hashCode();

  /**
   * Provides a constant integer for a given class, derived from the name of the class.
   */
  protected final int classHash() {
    return CLASS_NAME_HASH;
  }
}
