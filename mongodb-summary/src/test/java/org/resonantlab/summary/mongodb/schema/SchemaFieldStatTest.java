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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for SchemaFieldStat.
 */
@Tag("unit")
public class SchemaFieldStatTest {

  @Test void testSingle() {
    SchemaFieldStat stat = SchemaFieldStat.single("name", ValueType.STRING);
    assertEquals("name", stat.getKey());
    assertEquals(1L, stat.getCount(ValueType.STRING));
    assertEquals(0L, stat.getCount(ValueType.NUMBER));
    assertEquals(1L, stat.getTotal());
  }

  @Test void testMergeSumsPerType() {
    SchemaFieldStat a = new SchemaFieldStat("age", ImmutableMap.of(ValueType.NUMBER, 3L));
    SchemaFieldStat b = new SchemaFieldStat("age",
        ImmutableMap.of(ValueType.NUMBER, 2L, ValueType.STRING, 1L));

    SchemaFieldStat merged = SchemaFieldStat.merge(a, b);
    assertEquals(5L, merged.getCount(ValueType.NUMBER));
    assertEquals(1L, merged.getCount(ValueType.STRING));
    assertEquals(6L, merged.getTotal());
    assertEquals(merged, SchemaFieldStat.merge(b, a));
  }

  @Test void testMergeIsAssociative() {
    SchemaFieldStat a = SchemaFieldStat.single("k", ValueType.STRING);
    SchemaFieldStat b = SchemaFieldStat.single("k", ValueType.NULL);
    SchemaFieldStat c = SchemaFieldStat.single("k", ValueType.STRING);
    assertEquals(SchemaFieldStat.merge(SchemaFieldStat.merge(a, b), c),
        SchemaFieldStat.merge(a, SchemaFieldStat.merge(b, c)));
  }

  @Test void testMergeRejectsDifferentKeys() {
    assertThrows(IllegalArgumentException.class,
        () -> SchemaFieldStat.merge(SchemaFieldStat.single("a", ValueType.STRING),
            SchemaFieldStat.single("b", ValueType.STRING)));
  }

  @Test void testZeroCountsAreDropped() {
    SchemaFieldStat stat = new SchemaFieldStat("k",
        ImmutableMap.of(ValueType.STRING, 0L, ValueType.BOOLEAN, 2L));
    assertFalse(stat.getCounts().containsKey(ValueType.STRING));
    assertEquals(ImmutableMap.of("boolean", 2L), stat.getTypeCounts());
  }

  @Test void testNegativeCountsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new SchemaFieldStat("k", ImmutableMap.of(ValueType.STRING, -1L)));
  }

  @Test void testToDocument() {
    SchemaFieldStat stat = new SchemaFieldStat("colXX",
        ImmutableMap.of(ValueType.NUMBER, 4L, ValueType.STRING, 1L));
    Document document = stat.toDocument();

    assertEquals("colXX", document.get("_id"));
    Document value = document.get("value", Document.class);
    assertEquals(4L, value.get("number"));
    assertEquals(1L, value.get("string"));
    List<String> expectedOrder = Arrays.asList("string", "number");
    assertEquals(expectedOrder, new ArrayList<>(value.keySet()));
  }

  @Test void testEmptyCounts() {
    SchemaFieldStat stat = new SchemaFieldStat("k", Collections.emptyMap());
    assertEquals(0L, stat.getTotal());
    assertEquals("k{}", stat.toString());
  }
}
