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
package org.resonantlab.summary.mongodb.pipeline;

import org.resonantlab.summary.mongodb.histogram.QuantitativeSpec;
import org.resonantlab.summary.mongodb.histogram.TopEdgePolicy;

import com.google.common.collect.ImmutableList;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.model.Accumulators;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.Projections;

import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.conversions.Bson;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates pipeline stages into MongoDB aggregation stages.
 */
public final class BsonStageTranslator implements PipelineStage.Visitor<List<Bson>> {

  public static final BsonStageTranslator INSTANCE = new BsonStageTranslator();

  /** Temporary field holding a document's key/value pairs during key counting. */
  private static final String PAIRS_FIELD = "kv";

  private BsonStageTranslator() {
  }

  /** Translates a whole pipeline. One stage may produce several store stages. */
  public List<Bson> translate(Pipeline pipeline) {
    ImmutableList.Builder<Bson> result = ImmutableList.builder();
    for (List<Bson> stages : pipeline.accept(this)) {
      result.addAll(stages);
    }
    return result.build();
  }

  /** Renders a pipeline as the JSON array the store receives. */
  public String toJson(Pipeline pipeline) {
    return translate(pipeline).stream()
        .map(stage -> stage.toBsonDocument(BsonDocument.class,
            MongoClientSettings.getDefaultCodecRegistry()).toJson())
        .collect(Collectors.joining(", ", "[", "]"));
  }

  @Override public List<Bson> visit(PipelineStage.Match match) {
    return ImmutableList.of(Aggregates.match(match.getPredicate().toBsonDocument()));
  }

  @Override public List<Bson> visit(PipelineStage.Project project) {
    return ImmutableList.of(Aggregates.project(Projections.include(project.getFields())));
  }

  @Override public List<Bson> visit(PipelineStage.Group group) {
    String keyPath = group.getKeyPath();
    String id = keyPath == null ? null : "$" + keyPath;
    return ImmutableList.of(Aggregates.group(id, Accumulators.sum(group.getCountField(), 1)));
  }

  @Override public List<Bson> visit(PipelineStage.ComputeBinIndex binIndex) {
    BsonValue expression = binIndexExpression(binIndex.getSpec(), binIndex.getPolicy());
    return ImmutableList.of(
        Aggregates.project(new BsonDocument(binIndex.getOutputField(), expression)));
  }

  @Override public List<Bson> visit(PipelineStage.KeyTypeCount keyTypeCount) {
    BsonDocument pairs = new BsonDocument("_id", new BsonInt32(0))
        .append(PAIRS_FIELD, new BsonDocument("$objectToArray", new BsonString("$$ROOT")));
    BsonDocument groupKey = new BsonDocument()
        .append(PipelineStage.KeyTypeCount.KEY_FIELD, new BsonString("$" + PAIRS_FIELD + ".k"))
        .append(PipelineStage.KeyTypeCount.TYPE_FIELD,
            new BsonDocument("$type", new BsonString("$" + PAIRS_FIELD + ".v")));
    return ImmutableList.of(
        Aggregates.project(pairs),
        Aggregates.unwind("$" + PAIRS_FIELD),
        Aggregates.group(groupKey, Accumulators.sum(keyTypeCount.getCountField(), 1)));
  }

  /**
   * Builds {@code floor(((value - min) * binCount) / (max - min))}; under
   * {@link TopEdgePolicy#INCLUDE_MAX} a value equal to max maps to
   * {@code binCount - 1}.
   */
  static BsonValue binIndexExpression(QuantitativeSpec spec, TopEdgePolicy policy) {
    spec.validate();
    BsonString value = new BsonString("$" + spec.getAttribute());
    BsonDocument offset = operator("$subtract", value, new BsonDouble(spec.getMin()));
    BsonDocument scaled = operator("$multiply", offset, new BsonInt32(spec.getBinCount()));
    BsonDocument ratio = operator("$divide", scaled, new BsonDouble(spec.getRange()));
    BsonDocument floor = new BsonDocument("$floor", ratio);
    if (policy == TopEdgePolicy.UNCLAMPED) {
      return floor;
    }
    BsonDocument atMax = operator("$eq", value, new BsonDouble(spec.getMax()));
    return new BsonDocument("$cond",
        new BsonArray(Arrays.asList(atMax, new BsonInt32(spec.getBinCount() - 1), floor)));
  }

  private static BsonDocument operator(String name, BsonValue left, BsonValue right) {
    return new BsonDocument(name, new BsonArray(Arrays.asList(left, right)));
  }
}
