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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Collection of {@link FieldInfo}s (accessible by number or by name).
 */
public class FieldInfos implements Iterable<FieldInfo> {

  /** An instance without any fields. */
  public static final FieldInfos EMPTY = new FieldInfos(new FieldInfo[0]);

  private final boolean hasFreq;
  private final boolean hasProx;
  private final boolean hasPayloads;
  private final boolean hasOffsets;
  private final boolean hasNorms;
  private final boolean hasDocValues;

  private final FieldInfo[] byNumber;

  private final HashMap<String, FieldInfo> byName = new HashMap<>();
  private final List<FieldInfo> values; // for an unmodifiable iterator

  /**
   * Constructs a new FieldInfos from an array of FieldInfo objects
   */
  public FieldInfos(FieldInfo[] infos) {
    boolean hasProx = false;
    boolean hasFreq = false;
    boolean hasPayloads = false;
    boolean hasOffsets = false;
    boolean hasNorms = false;
    boolean hasDocValues = false;

    int maxNumber = -1;
    for (FieldInfo info : infos) {
      maxNumber = Math.max(maxNumber, info.number);
    }
    // 全局编号可能不连续: 这个段只用到了部分字段
    final FieldInfo[] byNumberTemp = new FieldInfo[maxNumber + 1];
    final SortedMap<Integer, FieldInfo> ordered = new TreeMap<>();
    for (FieldInfo info : infos) {
      if (info.number < 0) {
        throw new IllegalArgumentException("illegal field number: " + info.number + " for field " + info.name);
      }
      FieldInfo previous = byNumberTemp[info.number];
      if (previous != null) {
        throw new IllegalArgumentException("duplicate field numbers: " + previous.name + " and " + info.name + " have: " + info.number);
      }
      byNumberTemp[info.number] = info;
      ordered.put(info.number, info);

      previous = byName.put(info.name, info);
      if (previous != null) {
        throw new IllegalArgumentException("duplicate field names: " + previous.number + " and " + info.number + " have: " + info.name);
      }

      hasFreq |= info.getIndexOptions().compareTo(IndexOptions.DOCS_AND_FREQS) >= 0;
      hasProx |= info.getIndexOptions().compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS) >= 0;
      hasOffsets |= info.getIndexOptions().compareTo(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS_AND_OFFSETS) >= 0;
      hasNorms |= info.hasNorms();
      hasDocValues |= info.getDocValuesType() != DocValuesType.NONE;
      hasPayloads |= info.hasPayloads();
    }

    this.hasFreq = hasFreq;
    this.hasProx = hasProx;
    this.hasPayloads = hasPayloads;
    this.hasOffsets = hasOffsets;
    this.hasNorms = hasNorms;
    this.hasDocValues = hasDocValues;
    this.byNumber = byNumberTemp;
    this.values = Collections.unmodifiableList(new ArrayList<>(ordered.values()));
  }

  /** Returns true if any fields have freqs */
  public boolean hasFreq() {
    return hasFreq;
  }

  /** Returns true if any fields have positions */
  public boolean hasProx() {
    return hasProx;
  }

  /** Returns true if any fields have payloads */
  public boolean hasPayloads() {
    return hasPayloads;
  }

  /** Returns true if any fields have offsets */
  public boolean hasOffsets() {
    return hasOffsets;
  }

  /** Returns true if any fields have norms */
  public boolean hasNorms() {
    return hasNorms;
  }

  /** Returns true if any fields have DocValues */
  public boolean hasDocValues() {
    return hasDocValues;
  }

  /** Returns the number of fields */
  public int size() {
    return byName.size();
  }

  /**
   * Returns an iterator over all the fieldinfo objects present,
   * ordered by ascending field number
   */
  @Override
  public Iterator<FieldInfo> iterator() {
    return values.iterator();
  }

  /**
   * Return the fieldinfo object referenced by the field name
   * @return the FieldInfo object or null when the given fieldName
   * doesn't exist.
   */
  public FieldInfo fieldInfo(String fieldName) {
    return byName.get(fieldName);
  }

  /**
   * Return the fieldinfo object referenced by the fieldNumber.
   * @param fieldNumber field's number.
   * @return the FieldInfo object or null when the given fieldNumber
   * doesn't exist.
   * @throws IllegalArgumentException if fieldNumber is negative
   */
  public FieldInfo fieldInfo(int fieldNumber) {
    if (fieldNumber < 0) {
      throw new IllegalArgumentException("Illegal field number: " + fieldNumber);
    }
    if (fieldNumber >= byNumber.length) {
      return null;
    }
    return byNumber[fieldNumber];
  }

  /**
   * Field numbers and doc-values types shared by every per-thread writer of one
   * documents writer, so that a field keeps one number and one doc-values type
   * across all the segments it appears in.
   */
  static final class FieldNumbers {

    private final Map<Integer, String> numberToName;
    private final Map<String, Integer> nameToNumber;
    // We use this to enforce that a given field never
    // changes DV type, even across segments:
    private final Map<String, DocValuesType> docValuesType;

    private int lowestUnassignedFieldNumber = -1;

    FieldNumbers() {
      this.nameToNumber = new HashMap<>();
      this.numberToName = new HashMap<>();
      this.docValuesType = new HashMap<>();
    }

    /**
     * Returns the global field number for the given field name. If the name
     * does not exist yet it tries to add it with the given preferred field
     * number assigned if possible otherwise the first unassigned field number
     * is used as the field number.
     */
    synchronized int addOrGet(String fieldName, DocValuesType dvType) {
      if (dvType != DocValuesType.NONE) {
        DocValuesType currentDVType = docValuesType.get(fieldName);
        if (currentDVType == null) {
          docValuesType.put(fieldName, dvType);
        } else if (currentDVType != DocValuesType.NONE && currentDVType != dvType) {
          throw new IllegalArgumentException("cannot change DocValues type from " + currentDVType + " to " + dvType + " for field \"" + fieldName + "\"");
        }
      }
      Integer fieldNumber = nameToNumber.get(fieldName);
      if (fieldNumber == null) {
        while (numberToName.containsKey(++lowestUnassignedFieldNumber)) {
          // might not be up to date - lets do the work once needed
        }
        fieldNumber = lowestUnassignedFieldNumber;
        numberToName.put(fieldNumber, fieldName);
        nameToNumber.put(fieldName, fieldNumber);
      }
      return fieldNumber.intValue();
    }

    synchronized void setDocValuesType(String name, DocValuesType dvType) {
      assert nameToNumber.containsKey(name) : name;
      DocValuesType currentDVType = docValuesType.get(name);
      if (currentDVType != null && currentDVType != DocValuesType.NONE && currentDVType != dvType) {
        throw new IllegalArgumentException("cannot change DocValues type from " + currentDVType + " to " + dvType + " for field \"" + name + "\"");
      }
      docValuesType.put(name, dvType);
    }

    /** Returns true if the field was seen before with exactly this doc-values type. */
    synchronized boolean contains(String fieldName, DocValuesType dvType) {
      if (!nameToNumber.containsKey(fieldName)) {
        return false;
      } else {
        return dvType == docValuesType.get(fieldName);
      }
    }

    synchronized void clear() {
      numberToName.clear();
      nameToNumber.clear();
      docValuesType.clear();
      lowestUnassignedFieldNumber = -1;
    }
  }

  /** Accumulates the field infos of one segment while it is being buffered. */
  static final class Builder {
    private final HashMap<String, FieldInfo> byName = new HashMap<>();
    final FieldNumbers globalFieldNumbers;
    private boolean finished;

    Builder(FieldNumbers globalFieldNumbers) {
      assert globalFieldNumbers != null;
      this.globalFieldNumbers = globalFieldNumbers;
    }

    /** Create a new field, or return existing one. */
    public FieldInfo getOrAdd(String name) {
      assert assertNotFinished();
      FieldInfo fi = byName.get(name);
      if (fi == null) {
        // This field wasn't yet added to this in-RAM
        // segment's FieldInfo, so now we get a global
        // number for this field.  If the field was seen
        // before then we'll get the same name and number,
        // else we'll allocate a new one:
        final int fieldNumber = globalFieldNumbers.addOrGet(name, DocValuesType.NONE);
        fi = new FieldInfo(name, fieldNumber, IndexOptions.NONE, false, false, DocValuesType.NONE);
        byName.put(fi.name, fi);
      }
      return fi;
    }

    /** Sets the doc-values type of a field, checked against every other segment of the writer. */
    void setDocValuesType(FieldInfo fi, DocValuesType dvType) {
      assert assertNotFinished();
      if (fi.getDocValuesType() == dvType) {
        return;
      }
      if (fi.getDocValuesType() == DocValuesType.NONE) {
        globalFieldNumbers.setDocValuesType(fi.name, dvType);
      }
      fi.setDocValuesType(dvType);
    }

    public FieldInfo fieldInfo(String fieldName) {
      return byName.get(fieldName);
    }

    /** Called only from assert */
    private boolean assertNotFinished() {
      if (finished) {
        throw new IllegalStateException("FieldInfos.Builder was already finished; cannot add new fields");
      }
      return true;
    }

    FieldInfos finish() {
      finished = true;
      return new FieldInfos(byName.values().toArray(new FieldInfo[byName.size()]));
    }
  }
}
