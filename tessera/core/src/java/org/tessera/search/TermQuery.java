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

import java.util.Objects;

import org.tessera.index.Term;

/**
 * Matches every document that contains one exact {@link Term}.
 * <p>Buffered as a delete key, a {@code TermQuery} differs from a plain term
 * delete in one way: it is resolved by the segment owner after the flush, so it
 * stays in the segment's private updates packet.
 */
public class TermQuery extends Query {

  private final Term term;

  public TermQuery(Term term) {
    this.term = Objects.requireNonNull(term, "term must not be null");
  }

  public Term getTerm() {
    return term;
  }

  @Override
  public String toString(String defaultField) {
    // 默认字段省略前缀
    return term.field().equals(defaultField) ? term.text() : term.field() + ":" + term.text();
  }

  @Override
  public boolean equals(Object other) {
    return sameClassAs(other) && term.equals(((TermQuery) other).term);
  }

  @Override
  public int hashCode() {
    return 31 * classHash() + term.hashCode();
  }
}
