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

import org.resonantlab.summary.mongodb.DatasetHandle;
import org.resonantlab.summary.mongodb.pipeline.Pipeline;
import org.resonantlab.summary.mongodb.pipeline.PipelineStage;

import com.google.common.collect.ImmutableList;

import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Infers a best-effort type schema for a collection.
 *
 * <p>Works in two phases. Emit produces one {@code (normalizedKey, {type: 1})}
 * record per top-level key of every document; merge sums the records of each
 * key per type. Merging is associative and commutative, so partial results
 * can be combined in any order, and memory grows with the number of distinct
 * normalized keys rather than with the number of documents.
 *
 * <p>Counts are exact. Keys are reported in order of first appearance.
 */
public class SchemaInferenceEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(SchemaInferenceEngine.class);

  private static final String COUNT_FIELD = "count";

  /**
   * Where the emit phase runs.
   */
  public enum Mode {
    /** Stream every document to the client and emit there. */
    SCAN,
    /**
     * Let the store count raw key/type pairs; normalization and type
     * mapping happen in the merge phase.
     */
    PUSHDOWN
  }

  private final Mode mode;

  public SchemaInferenceEngine() {
    this(Mode.SCAN);
  }

  public SchemaInferenceEngine(Mode mode) {
    this.mode = requireNonNull(mode, "mode");
  }

  public Mode getMode() {
    return mode;
  }

  /**
   * Computes per-key type occurrence counts over the whole collection.
   *
   * @param handle Collection to scan
   * @return One record per normalized key; empty for an empty collection
   */
  public List<SchemaFieldStat> inferSchema(DatasetHandle handle) {
    Accumulator accumulator = new Accumulator();
    long documents = 0;
    if (mode == Mode.SCAN) {
      for (BsonDocument document : handle.scan()) {
        for (SchemaFieldStat record : emit(document)) {
          accumulator.add(record);
        }
        documents++;
      }
    } else {
      Pipeline pipeline = Pipeline.empty().append(PipelineStage.keyTypeCount(COUNT_FIELD));
      for (BsonDocument partial : handle.aggregate(pipeline)) {
        accumulator.add(fromPartial(partial));
      }
    }

    List<SchemaFieldStat> result = accumulator.result();
    if (mode == Mode.SCAN) {
      LOGGER.info("Inferred schema of {}: {} keys in {} documents",
          handle.getMetadata(), result.size(), documents);
    } else {
      LOGGER.info("Inferred schema of {} (pushdown): {} keys",
          handle.getMetadata(), result.size());
    }
    return result;
  }

  /**
   * Emit phase: one single-count record per top-level key of a document.
   */
  public static List<SchemaFieldStat> emit(BsonDocument document) {
    List<SchemaFieldStat> records = new ArrayList<>(document.size());
    for (Map.Entry<String, BsonValue> entry : document.entrySet()) {
      records.add(
          SchemaFieldStat.single(KeyNormalizer.normalize(entry.getKey()),
              ValueType.of(entry.getValue())));
    }
    return records;
  }

  /**
   * Merge phase: sums records of the same key. Input order does not affect
   * the counts.
   */
  public static List<SchemaFieldStat> merge(Iterable<SchemaFieldStat> records) {
    Accumulator accumulator = new Accumulator();
    for (SchemaFieldStat record : records) {
      accumulator.add(record);
    }
    return accumulator.result();
  }

  /**
   * Reads one document produced by the key/type counting stage.
   */
  static SchemaFieldStat fromPartial(BsonDocument partial) {
    BsonDocument id = partial.getDocument("_id");
    String key = id.getString(PipelineStage.KeyTypeCount.KEY_FIELD).getValue();
    String alias = id.getString(PipelineStage.KeyTypeCount.TYPE_FIELD).getValue();
    long count = partial.getNumber(COUNT_FIELD).longValue();
    EnumMap<ValueType, Long> counts = new EnumMap<>(ValueType.class);
    counts.put(ValueType.fromAlias(alias), count);
    return new SchemaFieldStat(KeyNormalizer.normalize(key), counts);
  }

  /** Mutable per-key counters used while folding records. */
  private static final class Accumulator {
    private final Map<String, EnumMap<ValueType, Long>> counts = new LinkedHashMap<>();

    void add(SchemaFieldStat record) {
      EnumMap<ValueType, Long> perType =
          counts.computeIfAbsent(record.getKey(), k -> new EnumMap<>(ValueType.class));
      for (Map.Entry<ValueType, Long> entry : record.getCounts().entrySet()) {
        perType.merge(entry.getKey(), entry.getValue(), Long::sum);
      }
    }

    List<SchemaFieldStat> result() {
      ImmutableList.Builder<SchemaFieldStat> result = ImmutableList.builder();
      for (Map.Entry<String, EnumMap<ValueType, Long>> entry : counts.entrySet()) {
        result.add(new SchemaFieldStat(entry.getKey(), entry.getValue()));
      }
      return result.build();
    }
  }
}
