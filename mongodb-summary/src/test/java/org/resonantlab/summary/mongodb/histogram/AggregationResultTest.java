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

import com.google.common.collect.ImmutableMap;

import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.Document;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for AggregationResult, CategoricalCount and HistogramBin.
 */
@Tag("unit")
public class AggregationResultTest {

  @Test void testEmptyResult() {
    AggregationResult result = AggregationResult.empty(ImmutableMap.of("x", "bad range"));
    assertTrue(result.isEmpty());
    assertEquals(0, result.getTotalCount());
    assertEquals(new Document("Total Count", 0L), result.toDocument());
    assertEquals("bad range", result.getRejectedAttributes().get("x"));
  }

  @Test void testZeroTotalCannotCarryAttributes() {
    assertThrows(IllegalStateException.class,
        () -> AggregationResult.builder()
            .categorical("sex", Collections.emptyList())
            .build());
  }

  @Test void testNegativeTotalIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> AggregationResult.builder().totalCount(-1));
  }

  @Test void testToDocument() {
    AggregationResult result = AggregationResult.builder()
        .totalCount(4)
        .categorical("sex", Arrays.asList(
            new CategoricalCount(new BsonString("f"), 3),
            new CategoricalCount(null, 1)))
        .quantitative("age", Collections.singletonList(new HistogramBin(5, 4, 50, 60)))
        .build();

    Document document = result.toDocument();
    assertThat(document.keySet(), contains("Total Count", "sex", "age"));
    assertEquals(Arrays.asList(
            new Document("_id", "f").append("count", 3L),
            new Document("_id", null).append("count", 1L)),
        document.get("sex"));
    assertEquals(Collections.singletonList(
            new Document("_id", 5L).append("count", 4L)
                .append("lowBound", 50.0).append("highBound", 60.0)),
        document.get("age"));
    assertThat(result.getAttributes(), contains("sex", "age"));
    assertNull(result.getCategorical("race"));
  }

  @Test void testQuantitativeWinsInDocument() {
    AggregationResult result = AggregationResult.builder()
        .totalCount(1)
        .categorical("age", Collections.singletonList(
            new CategoricalCount(new BsonInt32(30), 1)))
        .quantitative("age", Collections.singletonList(new HistogramBin(3, 1, 30, 40)))
        .build();

    List<?> age = result.toDocument().get("age", List.class);
    assertTrue(((Document) age.get(0)).containsKey("lowBound"));
  }

  @Test void testCategoricalJavaValues() {
    assertEquals("f", new CategoricalCount(new BsonString("f"), 1).getJavaValue());
    assertEquals(30, new CategoricalCount(new BsonInt32(30), 1).getJavaValue());
    assertNull(new CategoricalCount(BsonNull.VALUE, 1).getJavaValue());
    assertTrue(new CategoricalCount(null, 1).isNull());
    assertEquals(new Document("city", "Oslo"),
        new CategoricalCount(BsonDocument.parse("{\"city\": \"Oslo\"}"), 2).getJavaValue());
  }

  @Test void testBinFromSpec() {
    QuantitativeSpec spec = new QuantitativeSpec("t", 1, 2, 4);
    HistogramBin bin = HistogramBin.of(spec, 2, 7);
    assertEquals(2, bin.getIndex());
    assertEquals(7, bin.getCount());
    assertEquals(1.5, bin.getLowBound());
    assertEquals(1.75, bin.getHighBound());
  }
}
