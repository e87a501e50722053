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

import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDateTime;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.types.Decimal128;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for ValueType.
 */
@Tag("unit")
public class ValueTypeTest {

  @Test void testPrimitiveTypes() {
    assertEquals(ValueType.STRING, ValueType.of(new BsonString("x")));
    assertEquals(ValueType.NUMBER, ValueType.of(new BsonInt32(1)));
    assertEquals(ValueType.NUMBER, ValueType.of(new BsonInt64(1L)));
    assertEquals(ValueType.NUMBER, ValueType.of(new BsonDouble(1.5)));
    assertEquals(ValueType.NUMBER, ValueType.of(new BsonDecimal128(Decimal128.parse("1.5"))));
    assertEquals(ValueType.BOOLEAN, ValueType.of(BsonBoolean.TRUE));
    assertEquals(ValueType.NULL, ValueType.of(BsonNull.VALUE));
    assertEquals(ValueType.ARRAY, ValueType.of(new BsonArray()));
  }

  @Test void testNonPrimitiveTypesAreObjects() {
    assertEquals(ValueType.OBJECT, ValueType.of(new BsonDocument()));
    assertEquals(ValueType.OBJECT, ValueType.of(new BsonObjectId()));
    assertEquals(ValueType.OBJECT, ValueType.of(new BsonDateTime(0)));
  }

  @Test void testFromAlias() {
    assertEquals(ValueType.NUMBER, ValueType.fromAlias("int"));
    assertEquals(ValueType.NUMBER, ValueType.fromAlias("long"));
    assertEquals(ValueType.NUMBER, ValueType.fromAlias("double"));
    assertEquals(ValueType.NUMBER, ValueType.fromAlias("decimal"));
    assertEquals(ValueType.STRING, ValueType.fromAlias("string"));
    assertEquals(ValueType.BOOLEAN, ValueType.fromAlias("bool"));
    assertEquals(ValueType.NULL, ValueType.fromAlias("null"));
    assertEquals(ValueType.ARRAY, ValueType.fromAlias("array"));
    assertEquals(ValueType.OBJECT, ValueType.fromAlias("objectId"));
    assertEquals(ValueType.OBJECT, ValueType.fromAlias("date"));
    assertEquals(ValueType.OBJECT, ValueType.fromAlias("somethingNew"));
  }

  @Test void testTypeNames() {
    assertEquals("string", ValueType.STRING.getTypeName());
    assertEquals(ValueType.ARRAY, ValueType.fromTypeName("array"));
    assertThrows(IllegalArgumentException.class, () -> ValueType.fromTypeName("int"));
  }
}
