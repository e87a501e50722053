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
package org.resonantlab.summary.mongodb;

import org.resonantlab.summary.mongodb.histogram.AggregationResult;
import org.resonantlab.summary.mongodb.histogram.HistogramAggregationEngine;
import org.resonantlab.summary.mongodb.histogram.HistogramRequest;
import org.resonantlab.summary.mongodb.schema.SchemaFieldStat;
import org.resonantlab.summary.mongodb.schema.SchemaInferenceEngine;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Entry point used by the request layer: resolves a dataset, runs one
 * engine against it and releases the connection.
 *
 * <p>Stateless apart from its configuration; safe to share between
 * threads. Each call opens its own connection.
 */
public class DataSummaryService {

  private final CollectionAccessor accessor;
  private final SchemaInferenceEngine schemaEngine;
  private final HistogramAggregationEngine histogramEngine;
  private final DataSummaryConfig config;

  public DataSummaryService(DataSummaryConfig config) {
    this(new MongoCollectionAccessor(config), config);
  }

  public DataSummaryService(CollectionAccessor accessor, DataSummaryConfig config) {
    this.accessor = requireNonNull(accessor, "accessor");
    this.config = requireNonNull(config, "config");
    this.schemaEngine = new SchemaInferenceEngine(config.getSchemaMode());
    this.histogramEngine = new HistogramAggregationEngine();
  }

  /**
   * Creates a service from an operand map, see {@link DataSummaryConfig#fromMap}.
   */
  public static DataSummaryService create(Map<String, ?> operand) {
    return new DataSummaryService(DataSummaryConfig.fromMap(operand));
  }

  public DataSummaryConfig getConfig() {
    return config;
  }

  /**
   * Infers the type schema of a dataset.
   *
   * @throws ConnectionException if the store cannot be reached
   */
  public List<SchemaFieldStat> inferSchema(DatasetMetadata metadata) {
    try (DatasetHandle handle = accessor.resolve(metadata)) {
      return schemaEngine.inferSchema(handle);
    }
  }

  /**
   * Computes histograms of a dataset. The configured top edge policy
   * applies unless the request names one itself.
   *
   * @throws ConnectionException if the store cannot be reached
   */
  public AggregationResult computeHistograms(DatasetMetadata metadata,
      HistogramRequest request) {
    HistogramRequest effective = request.getTopEdgePolicy() == null
        ? request.withTopEdgePolicy(config.getTopEdgePolicy())
        : request;
    try (DatasetHandle handle = accessor.resolve(metadata)) {
      return histogramEngine.computeHistograms(handle, effective);
    }
  }

  /**
   * Computes histograms from request parameters ({@code filterQuery},
   * {@code categoricalAttrs}, {@code quantitativeAttrs}). The filter is
   * validated before any connection is made.
   */
  public AggregationResult computeHistograms(DatasetMetadata metadata,
      Map<String, String> parameters) {
    return computeHistograms(metadata, HistogramRequest.fromParameters(parameters));
  }
}
