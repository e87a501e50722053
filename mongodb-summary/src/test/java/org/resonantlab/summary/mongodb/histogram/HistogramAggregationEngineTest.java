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

import org.resonantlab.summary.mongodb.InMemoryDatasetHandle;
import org.resonantlab.summary.mongodb.filter.FilterPredicate;
import org.resonantlab.summary.mongodb.pipeline.Pipeline;
import org.resonantlab.summary.mongodb.pipeline.PipelineStage;

import com.google.common.collect.ImmutableMap;
import com.mongodb.MongoException;

import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasKey;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for HistogramAggregationEngine, run against documents held in memory.
 */
@Tag("unit")
public class HistogramAggregationEngineTest {

  private static final String[] PEOPLE = {
      "{\"_id\": 1, \"sex\": \"f\", \"race\": \"a\", \"age\": 25, \"income\": 10}",
      "{\"_id\": 2, \"sex\": \"m\", \"race\": \"b\", \"age\": 50, \"income\": \"n/a\"}",
      "{\"_id\": 3, \"sex\": \"f\", \"race\": null, \"age\": 100}",
      "{\"_id\": 4, \"sex\": \"m\", \"race\": \"a\", \"age\": \"old\"}",
      "{\"_id\": 5, \"sex\": \"f\", \"age\": 75.5}"
  };

  private static final QuantitativeSpec AGE = new QuantitativeSpec("age", 0, 100, 10);

  private HistogramAggregationEngine engine;
  private InMemoryDatasetHandle handle;

  @BeforeEach void setUp() {
    engine = new HistogramAggregationEngine();
    handle = InMemoryDatasetHandle.of(PEOPLE);
  }

  @Test void testTotalCountWithoutFilter() {
    AggregationResult result = engine.computeHistograms(handle, HistogramRequest.builder().build());
    assertEquals(5, result.getTotalCount());
    assertTrue(result.getAttributes().isEmpty());
  }

  @Test void testAbsentFilterMatchesMatchAllFilter() {
    AggregationResult absent = engine.computeHistograms(handle, null,
        Collections.singletonList("sex"), Collections.emptyMap());
    AggregationResult matchAll = engine.computeHistograms(handle,
        FilterPredicate.parse("{\"sex\": {\"$in\": [\"f\", \"m\"]}}"),
        Collections.singletonList("sex"), Collections.emptyMap());

    assertEquals(absent.getTotalCount(), matchAll.getTotalCount());
    assertEquals(counts(absent.getCategorical("sex")), counts(matchAll.getCategorical("sex")));
  }

  @Test void testCategoricalCountsSumToTotal() {
    AggregationResult result = engine.computeHistograms(handle,
        HistogramRequest.builder().categorical(Arrays.asList("sex", "race")).build());

    assertEquals(ImmutableMap.of(new BsonString("f"), 3L, new BsonString("m"), 2L),
        counts(result.getCategorical("sex")));

    Map<Object, Long> race = counts(result.getCategorical("race"));
    assertEquals(2L, race.get(new BsonString("a")));
    assertEquals(1L, race.get(new BsonString("b")));
    // null and missing share one bucket
    assertEquals(2L, race.get(BsonNull.VALUE));

    for (List<CategoricalCount> values : result.getCategorical().values()) {
      long sum = 0;
      for (CategoricalCount count : values) {
        sum += count.getCount();
      }
      assertEquals(result.getTotalCount(), sum);
    }
  }

  @Test void testQuantitativeHistogram() {
    AggregationResult result = engine.computeHistograms(handle,
        HistogramRequest.builder().quantitative(AGE).build());

    List<HistogramBin> bins = result.getQuantitative("age");
    assertNotNull(bins);
    assertThat(bins, contains(
        new HistogramBin(2, 1, 20, 30),
        new HistogramBin(5, 1, 50, 60),
        new HistogramBin(7, 1, 70, 80),
        new HistogramBin(10, 1, 100, 110)));
  }

  @Test void testBinCountsSumToNumericValues() {
    AggregationResult result = engine.computeHistograms(handle,
        HistogramRequest.builder().quantitative(AGE).quantitative("income", 0, 20, 4).build());

    assertEquals(4, sum(result.getQuantitative("age")));
    assertEquals(1, sum(result.getQuantitative("income")));
    // non-numeric values only drop out of their own histogram
    assertEquals(5, result.getTotalCount());
  }

  @Test void testTopEdgeIsUnclampedByDefault() {
    InMemoryDatasetHandle scores = InMemoryDatasetHandle.of(
        "{\"s\": 0}", "{\"s\": 5}", "{\"s\": 9.999}", "{\"s\": 10}");
    QuantitativeSpec spec = new QuantitativeSpec("s", 0, 10, 1);

    AggregationResult result = engine.computeHistograms(scores,
        HistogramRequest.builder().quantitative(spec).build());
    assertThat(result.getQuantitative("s"), contains(
        new HistogramBin(0, 3, 0, 10),
        new HistogramBin(1, 1, 10, 20)));

    AggregationResult clamped = engine.computeHistograms(scores,
        HistogramRequest.builder().quantitative(spec)
            .topEdgePolicy(TopEdgePolicy.INCLUDE_MAX).build());
    assertThat(clamped.getQuantitative("s"), contains(new HistogramBin(0, 4, 0, 10)));
  }

  @Test void testFilterAppliesToEverySubPipeline() {
    FilterPredicate filter = FilterPredicate.parse("{\"sex\": \"f\"}");
    BsonDocument before = filter.toBsonDocument();
    AggregationResult result = engine.computeHistograms(handle,
        HistogramRequest.builder().filter(filter).categorical("sex").quantitative(AGE).build());

    assertEquals(3, result.getTotalCount());
    assertEquals(ImmutableMap.of(new BsonString("f"), 3L), counts(result.getCategorical("sex")));
    assertEquals(3, sum(result.getQuantitative("age")));

    assertEquals(3, handle.getExecuted().size());
    for (Pipeline pipeline : handle.getExecuted()) {
      assertEquals(PipelineStage.match(filter), pipeline.getStages().get(0));
    }
    assertEquals(before, filter.toBsonDocument());
  }

  @Test void testZeroTotalShortCircuits() {
    AggregationResult result = engine.computeHistograms(handle,
        HistogramRequest.builder()
            .filter(FilterPredicate.parse("{\"sex\": \"x\"}"))
            .categorical("sex")
            .quantitative(AGE)
            .build());

    assertTrue(result.isEmpty());
    assertEquals(new Document(AggregationResult.TOTAL_COUNT, 0L), result.toDocument());
    assertEquals(1, handle.getExecuted().size());
  }

  @Test void testEmptyCollection() {
    InMemoryDatasetHandle empty = new InMemoryDatasetHandle(Collections.emptyList());
    AggregationResult result = engine.computeHistograms(empty,
        HistogramRequest.builder().categorical("sex").build());
    assertEquals(0, result.getTotalCount());
    assertNull(result.getCategorical("sex"));
  }

  @Test void testInvalidSpecIsIsolated() {
    AggregationResult result = engine.computeHistograms(handle,
        HistogramRequest.builder()
            .categorical("sex")
            .quantitative(AGE)
            .quantitative("x", 10, 10, 5)
            .build());

    assertNotNull(result.getCategorical("sex"));
    assertNotNull(result.getQuantitative("age"));
    assertNull(result.getQuantitative("x"));
    assertThat(result.getRejectedAttributes(), hasKey("x"));
    // total, sex and age only
    assertEquals(3, handle.getExecuted().size());
  }

  @Test void testNonFiniteValuesAreCountedApart() {
    InMemoryDatasetHandle values = new InMemoryDatasetHandle(Arrays.asList(
        new BsonDocument("v", new BsonDouble(Double.NaN)),
        new BsonDocument("v", new BsonDouble(Double.POSITIVE_INFINITY)),
        new BsonDocument("v", new BsonInt32(3))));

    AggregationResult result = engine.computeHistograms(values,
        HistogramRequest.builder().quantitative("v", 0, 10, 2).build());
    assertEquals(3, result.getTotalCount());
    assertThat(result.getQuantitative("v"), contains(new HistogramBin(0, 1, 0, 5)));
    assertEquals(2, result.getNonFiniteCount("v"));
    assertEquals(ImmutableMap.of("v", 2L), result.getNonFiniteCounts());
  }

  @Test void testFiniteValuesHaveNoNonFiniteCount() {
    AggregationResult result = engine.computeHistograms(handle,
        HistogramRequest.builder().quantitative(AGE).build());
    assertEquals(0, result.getNonFiniteCount("age"));
    assertTrue(result.getNonFiniteCounts().isEmpty());
  }

  @Test void testSpecMapKeyNamesTheAttribute() {
    AggregationResult result = engine.computeHistograms(handle, null,
        Collections.emptyList(),
        ImmutableMap.of("age", new QuantitativeSpec("other", 0, 100, 10)));

    assertThat(result.getQuantitative().keySet(), contains("age"));
    assertNull(result.getQuantitative("other"));
    assertThat(result.getQuantitative("age"), contains(
        new HistogramBin(2, 1, 20, 30),
        new HistogramBin(5, 1, 50, 60),
        new HistogramBin(7, 1, 70, 80),
        new HistogramBin(10, 1, 100, 110)));
  }

  @Test void testStoreErrorsPropagate() {
    MongoException failure = new MongoException("boom");
    handle.failWith(failure);
    MongoException thrown = assertThrows(MongoException.class,
        () -> engine.computeHistograms(handle, HistogramRequest.builder().build()));
    assertSame(failure, thrown);
  }

  @Test void testToDocument() {
    Document document = engine.computeHistograms(handle,
        HistogramRequest.builder().categorical("sex").quantitative(AGE).build()).toDocument();

    assertEquals(5L, document.get(AggregationResult.TOTAL_COUNT));
    List<?> sex = document.get("sex", List.class);
    assertEquals(2, sex.size());
    Document first = (Document) sex.get(0);
    assertTrue(first.containsKey("_id"));
    assertTrue(first.containsKey("count"));

    List<?> age = document.get("age", List.class);
    Document bin = (Document) age.get(0);
    assertEquals(2L, bin.get("_id"));
    assertEquals(1L, bin.get("count"));
    assertEquals(20.0, bin.get("lowBound"));
    assertEquals(30.0, bin.get("highBound"));
  }

  @Test void testBinIndexOfStoreValues() {
    assertEquals(Long.valueOf(3), HistogramAggregationEngine.binIndex(new BsonDouble(3.0)));
    assertEquals(Long.valueOf(-1), HistogramAggregationEngine.binIndex(new BsonInt32(-1)));
    assertNull(HistogramAggregationEngine.binIndex(new BsonDouble(Double.NaN)));
    assertNull(HistogramAggregationEngine.binIndex(new BsonString("3")));
    assertNull(HistogramAggregationEngine.binIndex(null));
  }

  private static Map<Object, Long> counts(List<CategoricalCount> values) {
    Map<Object, Long> map = new HashMap<>();
    for (CategoricalCount count : values) {
      map.put(count.getValue(), count.getCount());
    }
    return map;
  }

  private static long sum(List<HistogramBin> bins) {
    long sum = 0;
    for (HistogramBin bin : bins) {
      sum += bin.getCount();
    }
    return sum;
  }
}
