/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.resonantlab.summary.mongodb.schema;

import com.google.common.collect.ImmutableMap;

import org.bson.Document;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Occurrence counts by value type for one normalized top-level key.
 */
public final class SchemaFieldStat {

  private final String key;
  private final ImmutableMap<ValueType, Long> counts;

  public SchemaFieldStat(String key, Map<ValueType, Long> counts) {
    this.key = requireNonNull(key, "key");
    EnumMap<ValueType, Long> sorted = new EnumMap<>(ValueType.class);
    for (Map.Entry<ValueType, Long> entry : counts.entrySet()) {
      if (entry.getValue() < 0) {
        throw new IllegalArgumentException("Negative count for " + key + ": " + entry);
      }
      if (entry.getValue() > 0) {
        sorted.put(entry.getKey(), entry.getValue());
      }
    }
    this.counts = ImmutableMap.copyOf(sorted);
  }

  /** Creates the record emitted for a single occurrence of a key. */
  public static SchemaFieldStat single(String key, ValueType type) {
    return new SchemaFieldStat(key, ImmutableMap.of(type, 1L));
  }

  /**
   * Combines two records for the same key by summing counts per type.
   *
   * @throws IllegalArgumentException if the keys differ
   */
  public static SchemaFieldStat merge(SchemaFieldStat a, SchemaFieldStat b) {
    if (!a.key.equals(b.key)) {
      throw new IllegalArgumentException("Cannot merge " + a.key + " with " + b.key);
    }
    EnumMap<ValueType, Long> sum = new EnumMap<>(ValueType.class);
    sum.putAll(a.counts);
    for (Map.Entry<ValueType, Long> entry : b.counts.entrySet()) {
      sum.merge(entry.getKey(), entry.getValue(), Long::sum);
    }
    return new SchemaFieldStat(a.key, sum);
  }

  public String getKey() {
    return key;
  }

  /** Returns the non-zero counts, in {@link ValueType} order. */
  public Map<ValueType, Long> getCounts() {
    return counts;
  }

  public long getCount(ValueType type) {
    Long count = counts.get(type);
    return count == null ? 0 : count;
  }

  /** Returns the counts keyed by type name ("string", "number", ...). */
  public Map<String, Long> getTypeCounts() {
    Map<String, Long> byName = new LinkedHashMap<>();
    for (Map.Entry<ValueType, Long> entry : counts.entrySet()) {
      byName.put(entry.getKey().getTypeName(), entry.getValue());
    }
    return byName;
  }

  /** Returns the number of documents in which the key occurs. */
  public long getTotal() {
    long total = 0;
    for (long count : counts.values()) {
      total += count;
    }
    return total;
  }

  /** Renders {@code {_id: key, value: {typeName: count, ...}}}. */
  public Document toDocument() {
    Document value = new Document();
    for (Map.Entry<String, Long> entry : getTypeCounts().entrySet()) {
      value.append(entry.getKey(), entry.getValue());
    }
    return new Document("_id", key).append("value", value);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SchemaFieldStat)) {
      return false;
    }
    SchemaFieldStat that = (SchemaFieldStat) o;
    return key.equals(that.key) && counts.equals(that.counts);
  }

  @Override public int hashCode() {
    return Objects.hash(key, counts);
  }

  @Override public String toString() {
    return key + getTypeCounts();
  }
}
