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
package org.resonantlab.summary.mongodb.histogram;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.bson.Document;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Total count plus one result per requested attribute.
 *
 * <p>Attributes that were not requested, or whose spec was rejected, have
 * no entry. When no document matches, only the total (zero) is present.
 *
 * <p>Numeric values that cannot be placed in a bin (NaN, infinities) are
 * left out of the bins and counted in {@link #getNonFiniteCounts()}, so the
 * bins of an attribute plus its non-finite count equal its numeric values.
 */
public final class AggregationResult {

  /** Key of the total in {@link #toDocument()}. */
  public static final String TOTAL_COUNT = "Total Count";

  private final long totalCount;
  private final ImmutableMap<String, ImmutableList<CategoricalCount>> categorical;
  private final ImmutableMap<String, ImmutableList<HistogramBin>> quantitative;
  private final ImmutableMap<String, String> rejected;
  private final ImmutableMap<String, Long> nonFinite;

  private AggregationResult(Builder builder) {
    this.totalCount = builder.totalCount;
    ImmutableMap.Builder<String, ImmutableList<CategoricalCount>> categoricalBuilder =
        ImmutableMap.builder();
    for (Map.Entry<String, List<CategoricalCount>> entry : builder.categorical.entrySet()) {
      categoricalBuilder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.categorical = categoricalBuilder.build();
    ImmutableMap.Builder<String, ImmutableList<HistogramBin>> quantitativeBuilder =
        ImmutableMap.builder();
    for (Map.Entry<String, List<HistogramBin>> entry : builder.quantitative.entrySet()) {
      quantitativeBuilder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.quantitative = quantitativeBuilder.build();
    this.rejected = ImmutableMap.copyOf(builder.rejected);
    this.nonFinite = ImmutableMap.copyOf(builder.nonFinite);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Result for a request that matched no documents. */
  public static AggregationResult empty(Map<String, String> rejected) {
    return builder().rejectedAll(rejected).build();
  }

  public long getTotalCount() {
    return totalCount;
  }

  public boolean isEmpty() {
    return totalCount == 0;
  }

  /** Returns the attributes with a result, categorical ones first. */
  public Set<String> getAttributes() {
    Set<String> attributes = new LinkedHashSet<>(categorical.keySet());
    attributes.addAll(quantitative.keySet());
    return attributes;
  }

  public Map<String, ImmutableList<CategoricalCount>> getCategorical() {
    return categorical;
  }

  public @Nullable List<CategoricalCount> getCategorical(String attribute) {
    return categorical.get(attribute);
  }

  public Map<String, ImmutableList<HistogramBin>> getQuantitative() {
    return quantitative;
  }

  public @Nullable List<HistogramBin> getQuantitative(String attribute) {
    return quantitative.get(attribute);
  }

  /** Returns the attributes whose histogram was rejected, with the reason. */
  public Map<String, String> getRejectedAttributes() {
    return rejected;
  }

  /** Returns, per binned attribute, how many non-finite values were left out. */
  public Map<String, Long> getNonFiniteCounts() {
    return nonFinite;
  }

  public long getNonFiniteCount(String attribute) {
    Long count = nonFinite.get(attribute);
    return count == null ? 0 : count;
  }

  /**
   * Renders the result as
   * {@code {"Total Count": n, attr: [{_id, count}, ...], qattr: [{_id, count,
   * lowBound, highBound}, ...]}}. An attribute requested both ways keeps its
   * quantitative entry.
   */
  public Document toDocument() {
    Document document = new Document(TOTAL_COUNT, totalCount);
    for (Map.Entry<String, ImmutableList<CategoricalCount>> entry : categorical.entrySet()) {
      List<Document> values = new ArrayList<>();
      for (CategoricalCount count : entry.getValue()) {
        values.add(count.toDocument());
      }
      document.append(entry.getKey(), values);
    }
    for (Map.Entry<String, ImmutableList<HistogramBin>> entry : quantitative.entrySet()) {
      List<Document> bins = new ArrayList<>();
      for (HistogramBin bin : entry.getValue()) {
        bins.add(bin.toDocument());
      }
      document.append(entry.getKey(), bins);
    }
    return document;
  }

  @Override public String toString() {
    return "AggregationResult{totalCount=" + totalCount
        + ", categorical=" + categorical
        + ", quantitative=" + quantitative
        + ", rejected=" + rejected.keySet()
        + ", nonFinite=" + nonFinite + "}";
  }

  /**
   * Builder for AggregationResult.
   */
  public static final class Builder {
    private long totalCount;
    private final Map<String, List<CategoricalCount>> categorical = new LinkedHashMap<>();
    private final Map<String, List<HistogramBin>> quantitative = new LinkedHashMap<>();
    private final Map<String, String> rejected = new LinkedHashMap<>();
    private final Map<String, Long> nonFinite = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder totalCount(long totalCount) {
      if (totalCount < 0) {
        throw new IllegalArgumentException("totalCount must not be negative: " + totalCount);
      }
      this.totalCount = totalCount;
      return this;
    }

    public Builder categorical(String attribute, List<CategoricalCount> counts) {
      categorical.put(attribute, counts);
      return this;
    }

    public Builder quantitative(String attribute, List<HistogramBin> bins) {
      quantitative.put(attribute, bins);
      return this;
    }

    /** Records values of a binned attribute that had no finite bin index. */
    public Builder nonFinite(String attribute, long count) {
      if (count < 0) {
        throw new IllegalArgumentException("count must not be negative: " + count);
      }
      if (count > 0) {
        nonFinite.merge(attribute, count, Long::sum);
      }
      return this;
    }

    public Builder rejected(String attribute, String reason) {
      rejected.put(attribute, reason);
      return this;
    }

    public Builder rejectedAll(Map<String, String> reasons) {
      rejected.putAll(reasons);
      return this;
    }

    public AggregationResult build() {
      if (totalCount == 0
          && !(categorical.isEmpty() && quantitative.isEmpty() && nonFinite.isEmpty())) {
        throw new IllegalStateException("A zero total carries no attribute results");
      }
      return new AggregationResult(this);
    }
  }
}
