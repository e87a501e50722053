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

import org.resonantlab.summary.mongodb.DatasetHandle;
import org.resonantlab.summary.mongodb.filter.FilterPredicate;
import org.resonantlab.summary.mongodb.pipeline.Pipeline;
import org.resonantlab.summary.mongodb.pipeline.PipelineStage;

import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes a total count and per-attribute histograms for one collection,
 * all under one optional filter.
 *
 * <p>Each result comes from its own pipeline, built on a shared prefix that
 * holds the filter:
 * <pre>
 * total:        prefix | group(null, totalCount)
 * categorical:  prefix | project(attr) | group(attr, count)
 * quantitative: prefix | match(attr is number) | binIndex(attr) | group(binIndex, count)
 * </pre>
 *
 * <p>When the total is zero no other pipeline runs. A quantitative spec
 * that cannot be binned is reported in
 * {@link AggregationResult#getRejectedAttributes()} and does not stop the
 * other attributes. Numeric values without a finite bin index are counted
 * in {@link AggregationResult#getNonFiniteCounts()}. Store errors propagate
 * unchanged.
 */
public class HistogramAggregationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(HistogramAggregationEngine.class);

  static final String TOTAL_COUNT_FIELD = "totalCount";
  static final String COUNT_FIELD = "count";
  static final String BIN_INDEX_FIELD = "binIndex";

  /**
   * Computes histograms with the default (unclamped) top edge.
   *
   * @param handle Collection to aggregate
   * @param filter Filter predicate, or null for none
   * @param categoricalAttributes Attributes to count by value
   * @param quantitativeSpecs Attributes to bin; the key names the attribute,
   *     whatever attribute the spec itself carries
   */
  public AggregationResult computeHistograms(DatasetHandle handle,
      @Nullable FilterPredicate filter, Collection<String> categoricalAttributes,
      Map<String, QuantitativeSpec> quantitativeSpecs) {
    HistogramRequest.Builder request = HistogramRequest.builder()
        .filter(filter)
        .categorical(categoricalAttributes);
    for (Map.Entry<String, QuantitativeSpec> entry : quantitativeSpecs.entrySet()) {
      request.quantitative(entry.getValue().forAttribute(entry.getKey()));
    }
    return computeHistograms(handle, request.build());
  }

  public AggregationResult computeHistograms(DatasetHandle handle, HistogramRequest request) {
    Map<String, String> rejected = new LinkedHashMap<>(request.getRejectedAttributes());
    Map<String, QuantitativeSpec> specs = new LinkedHashMap<>();
    for (QuantitativeSpec spec : request.getQuantitativeSpecs().values()) {
      try {
        spec.validate();
        specs.put(spec.getAttribute(), spec);
      } catch (InvalidBinSpecException e) {
        LOGGER.warn("Skipping histogram of {}: {}", spec.getAttribute(), e.getMessage());
        rejected.put(spec.getAttribute(), e.getMessage());
      }
    }

    Pipeline prefix = Pipeline.prefix(request.getFilter());

    long total = totalCount(handle, prefix);
    if (total == 0) {
      LOGGER.info("No documents of {} match {}", handle.getMetadata(),
          request.getFilter().toJson());
      return AggregationResult.empty(rejected);
    }

    AggregationResult.Builder result = AggregationResult.builder()
        .totalCount(total)
        .rejectedAll(rejected);

    for (String attribute : request.getCategoricalAttributes()) {
      result.categorical(attribute, categoricalCounts(handle, prefix, attribute));
    }

    TopEdgePolicy policy = request.getTopEdgePolicy();
    if (policy == null) {
      policy = TopEdgePolicy.UNCLAMPED;
    }
    for (QuantitativeSpec spec : specs.values()) {
      histogram(handle, prefix, spec, policy, result);
    }

    LOGGER.info("Computed histograms of {}: total={}, categorical={}, quantitative={}, "
            + "rejected={}", handle.getMetadata(), total,
        request.getCategoricalAttributes().size(), specs.size(), rejected.size());
    return result.build();
  }

  private static long totalCount(DatasetHandle handle, Pipeline prefix) {
    Pipeline pipeline = prefix.append(PipelineStage.count(null, TOTAL_COUNT_FIELD));
    List<BsonDocument> rows = handle.aggregate(pipeline);
    if (rows.isEmpty()) {
      return 0;
    }
    return rows.get(0).getNumber(TOTAL_COUNT_FIELD).longValue();
  }

  private static List<CategoricalCount> categoricalCounts(DatasetHandle handle,
      Pipeline prefix, String attribute) {
    Pipeline pipeline = prefix.append(
        PipelineStage.project(attribute),
        PipelineStage.count(attribute, COUNT_FIELD));
    List<CategoricalCount> counts = new ArrayList<>();
    for (BsonDocument row : handle.aggregate(pipeline)) {
      counts.add(
          new CategoricalCount(row.get("_id"), row.getNumber(COUNT_FIELD).longValue()));
    }
    return counts;
  }

  private static void histogram(DatasetHandle handle, Pipeline prefix,
      QuantitativeSpec spec, TopEdgePolicy policy, AggregationResult.Builder result) {
    Pipeline pipeline = prefix.append(
        PipelineStage.match(FilterPredicate.numeric(spec.getAttribute())),
        PipelineStage.binIndex(spec, BIN_INDEX_FIELD, policy),
        PipelineStage.count(BIN_INDEX_FIELD, COUNT_FIELD));
    List<HistogramBin> bins = new ArrayList<>();
    long nonFinite = 0;
    for (BsonDocument row : handle.aggregate(pipeline)) {
      long count = row.getNumber(COUNT_FIELD).longValue();
      BsonValue id = row.get("_id");
      Long index = binIndex(id);
      if (index == null) {
        // NaN or infinite values cannot be placed in a bin
        LOGGER.warn("Leaving out {} value(s) of {} with bin index {}", count,
            spec.getAttribute(), id);
        nonFinite += count;
        continue;
      }
      bins.add(HistogramBin.of(spec, index, count));
    }
    bins.sort(Comparator.comparingLong(HistogramBin::getIndex));
    result.quantitative(spec.getAttribute(), bins)
        .nonFinite(spec.getAttribute(), nonFinite);
  }

  /** Reads a bin index computed by the store; null if it is not a finite number. */
  static @Nullable Long binIndex(@Nullable BsonValue id) {
    if (id == null) {
      return null;
    }
    if (id.isDouble()) {
      double value = id.asDouble().getValue();
      return Double.isFinite(value) ? (long) value : null;
    }
    if (id.isInt32() || id.isInt64()) {
      return id.asNumber().longValue();
    }
    if (id.isDecimal128()) {
      if (id.asDecimal128().getValue().isNaN() || id.asDecimal128().getValue().isInfinite()) {
        return null;
      }
      return id.asDecimal128().getValue().bigDecimalValue().longValue();
    }
    return null;
  }
}
